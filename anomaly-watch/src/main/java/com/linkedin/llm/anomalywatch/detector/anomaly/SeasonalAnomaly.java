/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.Map;


/**
 * An hourly value that deviates from what its trend and seasonal pattern predict by more than the residual threshold.
 */
public class SeasonalAnomaly extends LlmAnomaly {
  private final MetricType _metricType;
  private final long _bucketStartMs;
  private final double _value;
  private final double _expected;
  private final double _threshold;

  public SeasonalAnomaly(EntityKey entityKey, long detectionTimeMs, LlmCallEvent event, MetricType metricType, long bucketStartMs,
                         double value, double expected, double threshold) {
    super(LlmAnomalyType.TIME_SERIES_ANOMALY, entityKey, detectionTimeMs, event);
    _metricType = metricType;
    _bucketStartMs = bucketStartMs;
    _value = value;
    _expected = expected;
    _threshold = threshold;
  }

  public MetricType metricType() {
    return _metricType;
  }

  /**
   * @return Start time of the hourly bucket the anomalous value was observed in.
   */
  public long bucketStartMs() {
    return _bucketStartMs;
  }

  public double value() {
    return _value;
  }

  public double expected() {
    return _expected;
  }

  public double residual() {
    return _value - _expected;
  }

  public double threshold() {
    return _threshold;
  }

  @Override
  protected String signatureDetail() {
    return _metricType.metricName() + SIGNATURE_SEPARATOR + (residual() > 0 ? "high" : "low");
  }

  @Override
  protected void addDetails(Map<String, Object> structure) {
    structure.put("metric", _metricType.metricName());
    structure.put("bucket_start_ms", _bucketStartMs);
    structure.put("value", _value);
    structure.put("expected", _expected);
    structure.put("residual", residual());
    structure.put("threshold", _threshold);
  }

  @Override
  public String description() {
    return String.format("%s of %.4f deviates by %.4f from the seasonally expected %.4f (threshold %.4f).", _metricType, _value,
                         residual(), _expected, _threshold);
  }
}
