/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.model;

import java.util.List;


/**
 * The metrics tracked per entity.
 * <ul>
 *   <li>{@link #INFERENCE_TIME}: Latency of the call in seconds.</li>
 *   <li>{@link #TOTAL_TOKENS}: Prompt and completion tokens of the call.</li>
 *   <li>{@link #ESTIMATED_COST}: Estimated cost of the call. Deviations are only reported when the recent mean cost
 *   is above a significance floor.</li>
 *   <li>{@link #MEMORY_USED}: Memory used to serve the call.</li>
 *   <li>{@link #PROMPT_TOKENS}: Prompt tokens of the call.</li>
 *   <li>{@link #COMPLETION_TOKENS}: Completion tokens of the call.</li>
 *   <li>{@link #TOKEN_RATIO}: Completion tokens per prompt token. Derived from the token counts of each call and
 *   checked for deviations in both directions.</li>
 * </ul>
 */
public enum MetricType {
  INFERENCE_TIME("inference_time", false, false, 0.0),
  TOTAL_TOKENS("total_tokens", false, false, 0.0),
  ESTIMATED_COST("estimated_cost", false, false, 0.001),
  MEMORY_USED("memory_used", false, false, 0.0),
  PROMPT_TOKENS("prompt_tokens", false, false, 0.0),
  COMPLETION_TOKENS("completion_tokens", false, false, 0.0),
  TOKEN_RATIO("token_ratio", true, true, 0.0);

  private static final List<MetricType> CACHED_VALUES = List.of(values());
  private final String _name;
  private final boolean _derived;
  private final boolean _twoSided;
  private final double _significanceFloor;

  MetricType(String name, boolean derived, boolean twoSided, double significanceFloor) {
    _name = name;
    _derived = derived;
    _twoSided = twoSided;
    _significanceFloor = significanceFloor;
  }

  /**
   * @return The external name of the metric.
   */
  public String metricName() {
    return _name;
  }

  /**
   * @return {@code true} if the metric is computed from other metrics rather than reported directly.
   */
  public boolean isDerived() {
    return _derived;
  }

  /**
   * @return {@code true} if both unusually high and unusually low values are anomalous.
   */
  public boolean isTwoSided() {
    return _twoSided;
  }

  /**
   * @return The recent mean a metric must exceed before its deviations are reported.
   */
  public double significanceFloor() {
    return _significanceFloor;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<MetricType> cachedValues() {
    return CACHED_VALUES;
  }

  /**
   * @param name The external name of a metric.
   * @return The metric type with the given name, or {@code null} if there is no such metric.
   */
  public static MetricType forName(String name) {
    for (MetricType metricType : CACHED_VALUES) {
      if (metricType._name.equals(name)) {
        return metricType;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return _name;
  }
}
