/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.monitor.series;

import java.util.Objects;


/**
 * A single observation of a metric. Immutable once created.
 *
 * @param <M> The type of the metadata attached to the observation.
 */
public final class MetricPoint<M> {
  private final double _value;
  private final long _timestampMs;
  private final M _metadata;

  public MetricPoint(double value, long timestampMs, M metadata) {
    _value = value;
    _timestampMs = timestampMs;
    _metadata = metadata;
  }

  public double value() {
    return _value;
  }

  public long timestampMs() {
    return _timestampMs;
  }

  /**
   * @return The metadata of the originating event, or {@code null} for synthetic points.
   */
  public M metadata() {
    return _metadata;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricPoint<?> that = (MetricPoint<?>) o;
    return Double.compare(that._value, _value) == 0 && _timestampMs == that._timestampMs && Objects.equals(_metadata, that._metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_value, _timestampMs, _metadata);
  }

  @Override
  public String toString() {
    return String.format("{value=%f, timestampMs=%d}", _value, _timestampMs);
  }
}
