/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

import com.linkedin.anomalywatch.detector.AnomalyType;
import java.util.List;


/**
 * The types of anomalies reported on LLM call telemetry. The smaller the priority, the more urgent the anomaly.
 */
public enum LlmAnomalyType implements AnomalyType {
  ERROR_RATE_SPIKE("error_rate_spike", 0),
  STATISTICAL_SPIKE("statistical_spike", 1),
  TIME_SERIES_ANOMALY("time_series_anomaly", 2),
  CORRELATION_DIVERGENCE("correlation_divergence", 3),
  STATISTICAL_OUTLIER("statistical_outlier", 4),
  INFERENCE_TIME_TREND("inference_time_trend", 5),
  CROSS_APPLICATION_OUTLIER("cross_application_outlier", 6),
  COST_OPTIMIZATION("cost_optimization", 7);

  private static final List<LlmAnomalyType> CACHED_VALUES = List.of(values());
  private final String _typeName;
  private final int _priority;

  LlmAnomalyType(String typeName, int priority) {
    _typeName = typeName;
    _priority = priority;
  }

  @Override
  public int priority() {
    return _priority;
  }

  @Override
  public String typeName() {
    return _typeName;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<LlmAnomalyType> cachedValues() {
    return CACHED_VALUES;
  }

  @Override
  public String toString() {
    return _typeName;
  }
}
