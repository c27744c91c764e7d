/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.Map;


/**
 * A metric value whose z-score against the recent window exceeds the alert sensitivity.
 */
public class StatisticalSpike extends LlmAnomaly {
  private final MetricType _metricType;
  private final double _value;
  private final double _mean;
  private final double _median;
  private final double _std;
  private final double _zScore;
  private final double _threshold;

  public StatisticalSpike(EntityKey entityKey, long detectionTimeMs, LlmCallEvent event, MetricType metricType, double value,
                          double mean, double median, double std, double zScore, double threshold) {
    super(LlmAnomalyType.STATISTICAL_SPIKE, entityKey, detectionTimeMs, event);
    _metricType = metricType;
    _value = value;
    _mean = mean;
    _median = median;
    _std = std;
    _zScore = zScore;
    _threshold = threshold;
  }

  public MetricType metricType() {
    return _metricType;
  }

  public double value() {
    return _value;
  }

  public double mean() {
    return _mean;
  }

  public double median() {
    return _median;
  }

  public double std() {
    return _std;
  }

  public double zScore() {
    return _zScore;
  }

  /**
   * @return The value beyond which a value is a spike, on the side of the mean the value deviated to.
   */
  public double threshold() {
    return _threshold;
  }

  /**
   * @return {@code true} if the value is unusually high, {@code false} if it is unusually low.
   */
  public boolean isHigh() {
    return _zScore > 0;
  }

  @Override
  protected String signatureDetail() {
    return _metricType.metricName() + SIGNATURE_SEPARATOR + (isHigh() ? "high" : "low");
  }

  @Override
  protected void addDetails(Map<String, Object> structure) {
    structure.put("metric", _metricType.metricName());
    structure.put("value", _value);
    structure.put("direction", isHigh() ? "high" : "low");
    structure.put("mean", _mean);
    structure.put("median", _median);
    structure.put("std", _std);
    structure.put("z_score", _zScore);
    structure.put("threshold", _threshold);
  }

  @Override
  public String description() {
    return String.format("%s of %.4f is %.2f standard deviations %s the recent mean %.4f.", _metricType, _value,
                         Math.abs(_zScore), isHigh() ? "above" : "below", _mean);
  }
}
