/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.Map;


/**
 * Two historically correlated metrics of an entity whose current values no longer move together.
 */
public class CorrelationDivergence extends LlmAnomaly {
  private final MetricType _firstMetric;
  private final MetricType _secondMetric;
  private final double _firstValue;
  private final double _secondValue;
  private final double _firstZScore;
  private final double _secondZScore;
  private final double _correlation;

  public CorrelationDivergence(EntityKey entityKey, long detectionTimeMs, LlmCallEvent event, MetricType firstMetric,
                               MetricType secondMetric, double firstValue, double secondValue, double firstZScore,
                               double secondZScore, double correlation) {
    super(LlmAnomalyType.CORRELATION_DIVERGENCE, entityKey, detectionTimeMs, event);
    _firstMetric = firstMetric;
    _secondMetric = secondMetric;
    _firstValue = firstValue;
    _secondValue = secondValue;
    _firstZScore = firstZScore;
    _secondZScore = secondZScore;
    _correlation = correlation;
  }

  public MetricType firstMetric() {
    return _firstMetric;
  }

  public MetricType secondMetric() {
    return _secondMetric;
  }

  public double firstValue() {
    return _firstValue;
  }

  public double secondValue() {
    return _secondValue;
  }

  public double firstZScore() {
    return _firstZScore;
  }

  public double secondZScore() {
    return _secondZScore;
  }

  public double correlation() {
    return _correlation;
  }

  /**
   * @return How far apart the two z-scores are once the sign of the correlation is accounted for.
   */
  public double divergence() {
    return Math.abs(_firstZScore - Math.signum(_correlation) * _secondZScore);
  }

  @Override
  protected String signatureDetail() {
    return _firstMetric.metricName() + ":" + _secondMetric.metricName();
  }

  @Override
  protected void addDetails(Map<String, Object> structure) {
    structure.put("metric1", _firstMetric.metricName());
    structure.put("metric2", _secondMetric.metricName());
    structure.put("value1", _firstValue);
    structure.put("value2", _secondValue);
    structure.put("z_score1", _firstZScore);
    structure.put("z_score2", _secondZScore);
    structure.put("correlation", _correlation);
    structure.put("divergence", divergence());
  }

  @Override
  public String description() {
    return String.format("%s and %s (correlation %.2f) diverged: z-scores %.2f and %.2f.", _firstMetric, _secondMetric,
                         _correlation, _firstZScore, _secondZScore);
  }
}
