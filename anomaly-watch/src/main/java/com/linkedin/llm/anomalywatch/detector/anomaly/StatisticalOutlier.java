/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.Map;


/**
 * A metric value above the upper interquartile range fence (Q3 + 1.5 IQR) of the recent window.
 */
public class StatisticalOutlier extends LlmAnomaly {
  public static final double IQR_MULTIPLIER = 1.5;
  private final MetricType _metricType;
  private final double _value;
  private final double _q1;
  private final double _q3;

  public StatisticalOutlier(EntityKey entityKey, long detectionTimeMs, LlmCallEvent event, MetricType metricType, double value,
                            double q1, double q3) {
    super(LlmAnomalyType.STATISTICAL_OUTLIER, entityKey, detectionTimeMs, event);
    _metricType = metricType;
    _value = value;
    _q1 = q1;
    _q3 = q3;
  }

  public MetricType metricType() {
    return _metricType;
  }

  public double value() {
    return _value;
  }

  public double q1() {
    return _q1;
  }

  public double q3() {
    return _q3;
  }

  public double iqr() {
    return _q3 - _q1;
  }

  public double upperBound() {
    return _q3 + IQR_MULTIPLIER * iqr();
  }

  @Override
  protected String signatureDetail() {
    return _metricType.metricName();
  }

  @Override
  protected void addDetails(Map<String, Object> structure) {
    structure.put("metric", _metricType.metricName());
    structure.put("value", _value);
    structure.put("q1", _q1);
    structure.put("q3", _q3);
    structure.put("iqr", iqr());
    structure.put("upper_bound", upperBound());
  }

  @Override
  public String description() {
    return String.format("%s of %.4f is above the interquartile range bound %.4f.", _metricType, _value, upperBound());
  }
}
