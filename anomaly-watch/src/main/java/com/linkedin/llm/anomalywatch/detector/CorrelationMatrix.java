/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * Pairwise Pearson correlation coefficients between the metrics of one entity. Immutable.
 */
public final class CorrelationMatrix {
  private final Map<MetricType, Map<MetricType, Double>> _coefficients;
  private final long _computedAtMs;

  /**
   * @param metricTypes The metrics, in the order of the rows and columns of the given coefficients.
   * @param coefficients A symmetric matrix of correlation coefficients.
   * @param computedAtMs The time the coefficients were computed.
   */
  public CorrelationMatrix(List<MetricType> metricTypes, double[][] coefficients, long computedAtMs) {
    Map<MetricType, Map<MetricType, Double>> byMetric = new EnumMap<>(MetricType.class);
    for (int i = 0; i < metricTypes.size(); i++) {
      Map<MetricType, Double> row = new EnumMap<>(MetricType.class);
      for (int j = 0; j < metricTypes.size(); j++) {
        row.put(metricTypes.get(j), coefficients[i][j]);
      }
      byMetric.put(metricTypes.get(i), Collections.unmodifiableMap(row));
    }
    _coefficients = Collections.unmodifiableMap(byMetric);
    _computedAtMs = computedAtMs;
  }

  /**
   * @return The correlation coefficient of the given metrics, or {@code null} if either metric did not have enough data
   * when the matrix was computed. The coefficient is {@code NaN} if either metric was constant.
   */
  public Double coefficient(MetricType first, MetricType second) {
    Map<MetricType, Double> row = _coefficients.get(first);
    return row == null ? null : row.get(second);
  }

  /**
   * @return The metrics with coefficients in this matrix.
   */
  public Set<MetricType> metricTypes() {
    return _coefficients.keySet();
  }

  public long computedAtMs() {
    return _computedAtMs;
  }

  @Override
  public String toString() {
    return _coefficients.toString();
  }
}
