/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.anomalywatch.monitor.series.MetricPoint;
import com.linkedin.anomalywatch.monitor.series.MetricSeriesStore;
import com.linkedin.anomalywatch.monitor.series.SeriesStatistics;
import com.linkedin.llm.anomalywatch.detector.anomaly.CorrelationDivergence;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Detects metrics of an entity that stop moving together.
 * <p>
 * The correlation matrix of an entity is recomputed after every given number of points added for it, over the metrics
 * with at least the minimum number of data points. Series are aligned on the union of their timestamps; a metric
 * without a value at some timestamp takes its previous value, or its next value before its first observation.
 * <p>
 * For each configured pair that is strongly correlated, the z-scores of the current values against their recent
 * windows are compared. If the pair is positively correlated the z-scores are expected to agree; if negatively
 * correlated, to mirror each other. A difference beyond 1.5 times the alert sensitivity is a
 * {@link CorrelationDivergence}.
 */
public class CorrelationDetector {
  private static final Logger LOG = LoggerFactory.getLogger(CorrelationDetector.class);
  static final double DIVERGENCE_SENSITIVITY_MULTIPLIER = 1.5;
  private final MetricSeriesStore<MetricType, EntityKey, LlmCallEvent> _store;
  private final List<List<MetricType>> _metricPairs;
  private final int _recomputeIntervalPoints;
  private final double _strengthThreshold;
  private final int _windowSize;
  private final int _minDataPoints;
  private final double _sensitivity;
  private final Time _time;
  private final ConcurrentMap<EntityKey, AtomicLong> _numPointsAddedByEntity;
  private final ConcurrentMap<EntityKey, CorrelationMatrix> _matrixByEntity;

  public CorrelationDetector(MetricSeriesStore<MetricType, EntityKey, LlmCallEvent> store,
                             List<List<MetricType>> metricPairs,
                             int recomputeIntervalPoints,
                             double strengthThreshold,
                             int windowSize,
                             int minDataPoints,
                             double sensitivity,
                             Time time) {
    _store = store;
    _metricPairs = List.copyOf(metricPairs);
    _recomputeIntervalPoints = recomputeIntervalPoints;
    _strengthThreshold = strengthThreshold;
    _windowSize = windowSize;
    _minDataPoints = minDataPoints;
    _sensitivity = sensitivity;
    _time = time;
    _numPointsAddedByEntity = new ConcurrentHashMap<>();
    _matrixByEntity = new ConcurrentHashMap<>();
  }

  /**
   * Count a point added for the given entity, and recompute the correlation matrix of the entity if due.
   *
   * @param key Entity key.
   */
  public void onPointAdded(EntityKey key) {
    long numPointsAdded = _numPointsAddedByEntity.computeIfAbsent(key, k -> new AtomicLong(0L)).incrementAndGet();
    if (numPointsAdded % _recomputeIntervalPoints == 0) {
      CorrelationMatrix matrix = computeMatrix(key);
      if (matrix != null) {
        _matrixByEntity.put(key, matrix);
        LOG.debug("Recomputed correlations of {}: {}", key, matrix);
      }
    }
  }

  /**
   * @param key Entity key.
   * @return The latest correlation matrix of the given entity, or {@code null} if none has been computed.
   */
  public CorrelationMatrix correlationMatrix(EntityKey key) {
    return _matrixByEntity.get(key);
  }

  CorrelationMatrix computeMatrix(EntityKey key) {
    List<MetricType> metricTypes = new ArrayList<>();
    Map<MetricType, List<MetricPoint<LlmCallEvent>>> pointsByType = new HashMap<>();
    for (MetricType metricType : MetricType.cachedValues()) {
      List<MetricPoint<LlmCallEvent>> points = _store.snapshot(metricType, key);
      if (points.size() >= _minDataPoints) {
        metricTypes.add(metricType);
        pointsByType.put(metricType, points);
      }
    }
    if (metricTypes.size() < 2) {
      return null;
    }

    TreeSet<Long> timestamps = new TreeSet<>();
    pointsByType.values().forEach(points -> points.forEach(point -> timestamps.add(point.timestampMs())));
    Map<Long, Integer> rowByTimestamp = new HashMap<>();
    for (Long timestamp : timestamps) {
      rowByTimestamp.put(timestamp, rowByTimestamp.size());
    }

    double[][] data = new double[timestamps.size()][metricTypes.size()];
    for (int column = 0; column < metricTypes.size(); column++) {
      boolean[] present = new boolean[timestamps.size()];
      for (MetricPoint<LlmCallEvent> point : pointsByType.get(metricTypes.get(column))) {
        int row = rowByTimestamp.get(point.timestampMs());
        data[row][column] = point.value();
        present[row] = true;
      }
      fill(data, present, column);
    }
    if (data.length < 2) {
      return null;
    }
    double[][] coefficients = new PearsonsCorrelation().computeCorrelationMatrix(data).getData();
    return new CorrelationMatrix(metricTypes, coefficients, _time.milliseconds());
  }

  /**
   * Fill the rows of the given column without a value forward, then fill the leading rows backward.
   */
  private static void fill(double[][] data, boolean[] present, int column) {
    int firstPresent = -1;
    for (int row = 0; row < data.length; row++) {
      if (present[row]) {
        if (firstPresent < 0) {
          firstPresent = row;
        }
      } else if (firstPresent >= 0) {
        data[row][column] = data[row - 1][column];
      }
    }
    for (int row = 0; row < firstPresent; row++) {
      data[row][column] = data[firstPresent][column];
    }
  }

  /**
   * @param event The current event, whose metrics have already been added to the store.
   * @return Divergences of strongly correlated metric pairs carried by the event.
   */
  public List<LlmAnomaly> detect(LlmCallEvent event) {
    List<LlmAnomaly> anomalies = new ArrayList<>();
    EntityKey key = event.entityKey();
    CorrelationMatrix matrix = _matrixByEntity.get(key);
    if (matrix == null) {
      return anomalies;
    }
    for (List<MetricType> pair : _metricPairs) {
      MetricType first = pair.get(0);
      MetricType second = pair.get(1);
      Double coefficient = matrix.coefficient(first, second);
      Double firstValue = event.metricValue(first);
      Double secondValue = event.metricValue(second);
      if (coefficient == null || firstValue == null || secondValue == null || !(Math.abs(coefficient) > _strengthThreshold)) {
        continue;
      }
      Double firstZScore = zScore(first, key, firstValue);
      Double secondZScore = zScore(second, key, secondValue);
      if (firstZScore == null || secondZScore == null) {
        continue;
      }
      double divergence = Math.abs(firstZScore - Math.signum(coefficient) * secondZScore);
      if (divergence > DIVERGENCE_SENSITIVITY_MULTIPLIER * _sensitivity) {
        CorrelationDivergence anomaly = new CorrelationDivergence(key, _time.milliseconds(), event, first, second, firstValue,
                                                                  secondValue, firstZScore, secondZScore, coefficient);
        LOG.trace("Found {}.", anomaly);
        anomalies.add(anomaly);
      }
    }
    return anomalies;
  }

  private Double zScore(MetricType metricType, EntityKey key, double value) {
    List<MetricPoint<LlmCallEvent>> window = _store.window(metricType, key, _windowSize);
    if (window.size() < _minDataPoints) {
      return null;
    }
    double[] values = SeriesStatistics.values(window);
    double std = SeriesStatistics.populationStd(values);
    return std > 0.0 ? (value - SeriesStatistics.mean(values)) / std : null;
  }
}
