/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.anomalywatch.monitor.series.MetricPoint;
import com.linkedin.anomalywatch.monitor.series.MetricSeriesStore;
import com.linkedin.anomalywatch.monitor.series.SeriesStatistics;
import com.linkedin.llm.anomalywatch.detector.anomaly.CrossApplicationOutlier;
import com.linkedin.llm.anomalywatch.detector.anomaly.InferenceTimeTrend;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The analysis over all entities that is too expensive to run for every event:
 * <ol>
 *   <li>Inference time trends: the later half of the retained inference times of an entity against the earlier half.</li>
 *   <li>Cross application outliers: the recent mean inference time of an application against the other applications
 *   using the same provider and model. The std of the peers is floored at 5% of their
 *   mean.</li>
 *   <li>Periodic cost insights, see {@link CostPatternAnalyzer#periodicInsights(BooleanSupplier)}.</li>
 * </ol>
 * An analysis runs at most once per analysis interval. The store is read one series snapshot at a time, and the
 * cancellation signal is checked between entities.
 */
public class PeriodicAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(PeriodicAnalyzer.class);
  static final int MIN_APPLICATIONS_FOR_CROSS_ANALYSIS = 3;
  // Lower bound of the peer std, relative to the peer mean.
  static final double MIN_RELATIVE_PEER_STD = 0.05;
  private final MetricSeriesStore<MetricType, EntityKey, LlmCallEvent> _store;
  private final CostPatternAnalyzer _costPatternAnalyzer;
  private final long _analysisIntervalMs;
  private final int _windowSize;
  private final int _minDataPoints;
  private final double _sensitivity;
  private final Time _time;
  private long _lastAnalysisMs;

  public PeriodicAnalyzer(MetricSeriesStore<MetricType, EntityKey, LlmCallEvent> store,
                          CostPatternAnalyzer costPatternAnalyzer,
                          long analysisIntervalMs,
                          int windowSize,
                          int minDataPoints,
                          double sensitivity,
                          Time time) {
    _store = store;
    _costPatternAnalyzer = costPatternAnalyzer;
    _analysisIntervalMs = analysisIntervalMs;
    _windowSize = windowSize;
    _minDataPoints = minDataPoints;
    _sensitivity = sensitivity;
    _time = time;
    _lastAnalysisMs = time.milliseconds();
  }

  /**
   * Run the analysis if the analysis interval has elapsed since the construction or the last run.
   *
   * @param cancelled Cancellation signal. Once it is raised, the analysis returns what it has found so far.
   * @return The anomalies found, empty if the analysis is not due.
   */
  public synchronized List<LlmAnomaly> analyze(BooleanSupplier cancelled) {
    long nowMs = _time.milliseconds();
    if (nowMs - _lastAnalysisMs < _analysisIntervalMs) {
      LOG.trace("Periodic analysis is not due until {}.", _lastAnalysisMs + _analysisIntervalMs);
      return List.of();
    }
    _lastAnalysisMs = nowMs;

    List<LlmAnomaly> anomalies = new ArrayList<>(inferenceTimeTrends(cancelled));
    anomalies.addAll(_costPatternAnalyzer.periodicInsights(cancelled));
    anomalies.addAll(crossApplicationOutliers(cancelled));
    LOG.debug("Periodic analysis found {} anomalies in {} ms.", anomalies.size(), _time.milliseconds() - nowMs);
    return anomalies;
  }

  List<LlmAnomaly> inferenceTimeTrends(BooleanSupplier cancelled) {
    List<LlmAnomaly> trends = new ArrayList<>();
    for (EntityKey key : _store.keys(MetricType.INFERENCE_TIME)) {
      if (cancelled.getAsBoolean()) {
        LOG.info("Inference time trend analysis is cancelled.");
        break;
      }
      List<MetricPoint<LlmCallEvent>> points = new ArrayList<>(_store.snapshot(MetricType.INFERENCE_TIME, key));
      if (points.size() < 2 * _minDataPoints) {
        continue;
      }
      points.sort(Comparator.comparingLong(MetricPoint::timestampMs));
      double[] values = SeriesStatistics.values(points);
      int split = values.length / 2;
      double[] early = Arrays.copyOfRange(values, 0, split);
      double[] recent = Arrays.copyOfRange(values, split, values.length);
      double earlyMean = SeriesStatistics.mean(early);
      double recentMean = SeriesStatistics.mean(recent);
      double earlyStd = SeriesStatistics.populationStd(early);
      if (earlyStd == 0.0 || recentMean <= earlyMean) {
        continue;
      }
      double zScore = (recentMean - earlyMean) / earlyStd;
      if (zScore > _sensitivity) {
        trends.add(new InferenceTimeTrend(key, _time.milliseconds(), earlyMean, recentMean, earlyStd, zScore));
      }
    }
    return trends;
  }

  List<LlmAnomaly> crossApplicationOutliers(BooleanSupplier cancelled) {
    // Provider and model -> application -> recent mean inference time.
    SortedMap<EntityKey, SortedMap<EntityKey, Double>> recentMeanByGroup = new TreeMap<>();
    for (EntityKey key : _store.keys(MetricType.INFERENCE_TIME)) {
      if (cancelled.getAsBoolean()) {
        LOG.info("Cross application analysis is cancelled.");
        return List.of();
      }
      List<MetricPoint<LlmCallEvent>> window = _store.window(MetricType.INFERENCE_TIME, key, _windowSize);
      if (window.size() < _minDataPoints) {
        continue;
      }
      recentMeanByGroup.computeIfAbsent(key.providerModel(), k -> new TreeMap<>())
                       .put(key, SeriesStatistics.mean(SeriesStatistics.values(window)));
    }

    List<LlmAnomaly> outliers = new ArrayList<>();
    for (SortedMap<EntityKey, Double> recentMeanByApplication : recentMeanByGroup.values()) {
      if (recentMeanByApplication.size() < MIN_APPLICATIONS_FOR_CROSS_ANALYSIS) {
        continue;
      }
      for (Map.Entry<EntityKey, Double> entry : recentMeanByApplication.entrySet()) {
        double[] peerMeans = recentMeanByApplication.entrySet().stream()
                                                    .filter(e -> !e.getKey().equals(entry.getKey()))
                                                    .mapToDouble(Map.Entry::getValue)
                                                    .toArray();
        double peerMean = SeriesStatistics.mean(peerMeans);
        double peerStd = Math.max(SeriesStatistics.populationStd(peerMeans), MIN_RELATIVE_PEER_STD * peerMean);
        if (peerStd == 0.0) {
          continue;
        }
        double zScore = (entry.getValue() - peerMean) / peerStd;
        if (zScore > _sensitivity) {
          outliers.add(new CrossApplicationOutlier(entry.getKey(), _time.milliseconds(), MetricType.INFERENCE_TIME,
                                                   entry.getValue(), peerMean, peerStd, peerMeans.length, zScore));
        }
      }
    }
    return outliers;
  }
}
