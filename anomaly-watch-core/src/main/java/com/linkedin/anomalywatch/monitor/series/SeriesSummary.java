/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.monitor.series;

import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Summary statistics of the retained values of a series.
 */
public final class SeriesSummary {
  private final double _mean;
  private final double _median;
  private final double _min;
  private final double _max;
  private final double _std;
  private final int _count;

  public SeriesSummary(double mean, double median, double min, double max, double std, int count) {
    _mean = mean;
    _median = median;
    _min = min;
    _max = max;
    _std = std;
    _count = count;
  }

  public double mean() {
    return _mean;
  }

  public double median() {
    return _median;
  }

  public double min() {
    return _min;
  }

  public double max() {
    return _max;
  }

  public double std() {
    return _std;
  }

  public int count() {
    return _count;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("mean", _mean);
    summary.put("median", _median);
    summary.put("min", _min);
    summary.put("max", _max);
    summary.put("std", _std);
    summary.put("count", _count);
    return summary;
  }

  @Override
  public String toString() {
    return String.format("{mean=%.4f, median=%.4f, min=%.4f, max=%.4f, std=%.4f, count=%d}", _mean, _median, _min, _max, _std, _count);
  }
}
