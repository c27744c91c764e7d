/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.llm.anomalywatch.detector.anomaly.ErrorRateSpike;
import com.linkedin.llm.anomalywatch.exception.MalformedEventException;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.BASE_TIME_MS;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.ENTITY;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.event;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.failedEvent;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;


public class ErrorPatternTrackerTest {
  private static final long MINUTE_MS = TimeUnit.MINUTES.toMillis(1);
  private static final long HOUR_MS = TimeUnit.HOURS.toMillis(1);
  private static final String ERROR = "Rate limit exceeded";
  private ErrorPatternTracker _tracker;

  @Before
  public void setUp() {
    _tracker = new ErrorPatternTracker(5, HOUR_MS, HOUR_MS, 100, new MockTime());
  }

  private ErrorRateSpike recordFailure(EntityKey key, long minute, String error) throws MalformedEventException {
    return _tracker.record(failedEvent(key, BASE_TIME_MS + minute * MINUTE_MS, error));
  }

  @Test
  public void testRecurringError() throws MalformedEventException {
    for (int i = 0; i < 4; i++) {
      assertNull(recordFailure(ENTITY, 10 * i, ERROR));
    }
    ErrorRateSpike spike = recordFailure(ENTITY, 40, ERROR);
    assertNotNull(spike);
    assertEquals(5, spike.count());
    assertEquals(BASE_TIME_MS, spike.firstSeenMs());
    assertEquals(ERROR, spike.errorSignature());
    assertEquals("error_rate_spike|" + ENTITY + "|" + ERROR, spike.signature());

    // Reported at most once per cooldown in event time.
    for (int minute = 50; minute < 100; minute += 10) {
      assertNull(recordFailure(ENTITY, minute, ERROR));
    }
    ErrorRateSpike again = recordFailure(ENTITY, 100, ERROR);
    assertNotNull(again);
    assertEquals(BASE_TIME_MS + 60 * MINUTE_MS, again.firstSeenMs());
  }

  @Test
  public void testSparseErrorsAreNotRecurring() throws MalformedEventException {
    for (int i = 0; i < 20; i++) {
      assertNull(recordFailure(ENTITY, 20 * i, ERROR));
    }
  }

  @Test
  public void testErrorsAreGroupedByEntityAndMessage() throws MalformedEventException {
    EntityKey other = new EntityKey("openai", "test-model", "batch");
    for (int i = 0; i < 4; i++) {
      assertNull(recordFailure(ENTITY, i, ERROR));
      assertNull(recordFailure(other, i, ERROR));
      assertNull(recordFailure(ENTITY, i, "Connection reset"));
    }
    assertEquals(3, _tracker.numTrackedGroups());
    assertNotNull(recordFailure(other, 4, ERROR));
  }

  @Test
  public void testLongErrorsShareTheirPrefix() throws MalformedEventException {
    String prefix = "x".repeat(ErrorPatternTracker.ERROR_SIGNATURE_LENGTH);
    for (int i = 0; i < 4; i++) {
      assertNull(recordFailure(ENTITY, i, prefix + " request " + i));
    }
    ErrorRateSpike spike = recordFailure(ENTITY, 4, prefix + " request 4");
    assertNotNull(spike);
    assertEquals(prefix, spike.errorSignature());
  }

  @Test
  public void testSuccessfulCallsAreIgnored() throws MalformedEventException {
    for (int i = 0; i < 10; i++) {
      assertNull(_tracker.record(event(ENTITY, BASE_TIME_MS + i, 1.0)));
    }
    assertEquals(0, _tracker.numTrackedGroups());
  }
}
