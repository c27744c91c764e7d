/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.anomalywatch.monitor.series.MetricPoint;
import com.linkedin.anomalywatch.monitor.series.MetricSeriesStore;
import com.linkedin.anomalywatch.monitor.series.SeriesStatistics;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.detector.anomaly.StatisticalOutlier;
import com.linkedin.llm.anomalywatch.detector.anomaly.StatisticalSpike;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.ArrayList;
import java.util.List;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Compares the current value of each checked metric with the recent window of the same metric of the same entity.
 * <ul>
 *   <li>A value whose z-score exceeds the alert sensitivity is a {@link StatisticalSpike}. Two sided metrics are also
 *   checked for unusually low values.</li>
 *   <li>Otherwise, a value above Q3 + 1.5 IQR of the window is a {@link StatisticalOutlier}.</li>
 * </ul>
 * The window contains the current value. Metrics with fewer than the minimum number of data points, a constant window,
 * or a recent mean not above their significance floor are not checked.
 */
public class StatisticalDetector {
  private static final Logger LOG = LoggerFactory.getLogger(StatisticalDetector.class);
  private final MetricSeriesStore<MetricType, EntityKey, LlmCallEvent> _store;
  private final List<MetricType> _metricTypes;
  private final int _windowSize;
  private final int _minDataPoints;
  private final double _sensitivity;
  private final Time _time;

  public StatisticalDetector(MetricSeriesStore<MetricType, EntityKey, LlmCallEvent> store,
                             List<MetricType> metricTypes,
                             int windowSize,
                             int minDataPoints,
                             double sensitivity,
                             Time time) {
    _store = store;
    _metricTypes = List.copyOf(metricTypes);
    _windowSize = windowSize;
    _minDataPoints = minDataPoints;
    _sensitivity = sensitivity;
    _time = time;
  }

  /**
   * @param event The current event, whose metrics have already been added to the store.
   * @return Spikes and outliers among the checked metrics of the given event.
   */
  public List<LlmAnomaly> detect(LlmCallEvent event) {
    List<LlmAnomaly> anomalies = new ArrayList<>();
    for (MetricType metricType : _metricTypes) {
      Double value = event.metricValue(metricType);
      if (value != null) {
        LlmAnomaly anomaly = detect(metricType, value, event);
        if (anomaly != null) {
          anomalies.add(anomaly);
        }
      }
    }
    return anomalies;
  }

  /**
   * Check a single value. At most one anomaly is reported per value: the interquartile range check only applies to
   * values that are not spikes.
   *
   * @param metricType Metric type.
   * @param value Current value.
   * @param event Current event.
   * @return The anomaly found for the value, or {@code null} if the value is not anomalous.
   */
  LlmAnomaly detect(MetricType metricType, double value, LlmCallEvent event) {
    EntityKey key = event.entityKey();
    List<MetricPoint<LlmCallEvent>> window = _store.window(metricType, key, _windowSize);
    if (window.size() < _minDataPoints) {
      LOG.debug("Skip checking {} of {} with {} data points (required: {}).", metricType, key, window.size(), _minDataPoints);
      return null;
    }
    double[] values = SeriesStatistics.values(window);
    double mean = SeriesStatistics.mean(values);
    double std = SeriesStatistics.populationStd(values);
    if (std == 0.0) {
      return null;
    }
    if (metricType.significanceFloor() > 0.0 && mean <= metricType.significanceFloor()) {
      LOG.trace("Skip checking {} of {}: recent mean {} is not above {}.", metricType, key, mean, metricType.significanceFloor());
      return null;
    }

    double zScore = (value - mean) / std;
    boolean isSpike = metricType.isTwoSided() ? Math.abs(zScore) > _sensitivity : zScore > _sensitivity;
    if (isSpike) {
      double threshold = zScore > 0 ? mean + _sensitivity * std : mean - _sensitivity * std;
      StatisticalSpike spike = new StatisticalSpike(key, _time.milliseconds(), event, metricType, value, mean,
                                                    SeriesStatistics.median(values), std, zScore, threshold);
      LOG.trace("Found {}.", spike);
      return spike;
    }

    double q1 = SeriesStatistics.percentile(values, 25.0);
    double q3 = SeriesStatistics.percentile(values, 75.0);
    if (value > q3 + StatisticalOutlier.IQR_MULTIPLIER * (q3 - q1)) {
      StatisticalOutlier outlier = new StatisticalOutlier(key, _time.milliseconds(), event, metricType, value, q1, q3);
      LOG.trace("Found {}.", outlier);
      return outlier;
    }
    return null;
  }
}
