/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;


/**
 * Utils for time handling shared by anomaly detection components. All calendar computations are in UTC.
 */
public final class AnomalyWatchUtils {
  public static final int HOURS_PER_DAY = 24;
  public static final int DAYS_PER_WEEK = 7;

  private AnomalyWatchUtils() {

  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The date for the given time in ISO 8601 format with date, hour, minute, and seconds.
   */
  public static String utcDateFor(long timeMs) {
    DateTimeFormatter formatter = new DateTimeFormatterBuilder().appendInstant(0).toFormatter();
    return formatter.format(Instant.ofEpochMilli(timeMs).truncatedTo(ChronoUnit.SECONDS));
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The hour of day of the given time in UTC, from 0 to 23.
   */
  public static int utcHourOfDay(long timeMs) {
    return utc(timeMs).getHour();
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The day of week of the given time in UTC, from 0 (Monday) to 6 (Sunday).
   */
  public static int utcDayOfWeek(long timeMs) {
    return utc(timeMs).getDayOfWeek().getValue() - 1;
  }

  private static ZonedDateTime utc(long timeMs) {
    return Instant.ofEpochMilli(timeMs).atZone(ZoneOffset.UTC);
  }
}
