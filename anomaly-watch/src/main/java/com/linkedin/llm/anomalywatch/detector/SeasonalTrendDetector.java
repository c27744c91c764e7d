/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.anomalywatch.monitor.series.MetricPoint;
import com.linkedin.anomalywatch.monitor.series.MetricSeriesStore;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.detector.anomaly.SeasonalAnomaly;
import com.linkedin.llm.anomalywatch.exception.DecompositionException;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Detects inference times that deviate from the daily pattern of an entity.
 * <p>
 * The retained history is resampled to hourly means, with empty hours taking the value of the previous hour. The hours
 * before the hour of the current event are decomposed into trend, seasonal and residual components, and the current
 * value is compared with the value the decomposition expects for the current hour. The current hour is left out of
 * the decomposition so that an anomalous value does not shift its own expectation.
 */
public class SeasonalTrendDetector {
  private static final Logger LOG = LoggerFactory.getLogger(SeasonalTrendDetector.class);
  static final long BUCKET_MS = TimeUnit.HOURS.toMillis(1);
  // Residual deviations below this are treated as an exact fit.
  static final double MIN_RESIDUAL_STD = 1e-9;
  // Hours older than this are not decomposed.
  static final int MAX_HISTORY_BUCKETS = 24 * 7 * 8;
  private static final MetricType METRIC_TYPE = MetricType.INFERENCE_TIME;
  private final MetricSeriesStore<MetricType, EntityKey, LlmCallEvent> _store;
  private final int _period;
  private final double _sensitivity;
  private final Time _time;

  public SeasonalTrendDetector(MetricSeriesStore<MetricType, EntityKey, LlmCallEvent> store, int period, double sensitivity,
                               Time time) {
    _store = store;
    _period = period;
    _sensitivity = sensitivity;
    _time = time;
  }

  /**
   * @param event The current event, whose inference time has already been added to the store.
   * @return The seasonal anomaly of the current inference time, or {@code null} if there is none.
   */
  public LlmAnomaly detect(LlmCallEvent event) {
    EntityKey key = event.entityKey();
    long currentBucket = Math.floorDiv(event.timestampMs(), BUCKET_MS);
    double[] history = hourlyHistory(_store.snapshot(METRIC_TYPE, key), currentBucket);
    if (history == null || history.length < 2 * _period) {
      LOG.debug("Skip seasonal check of {}: {} hourly buckets of history (required: {}).", key,
                history == null ? 0 : history.length, 2 * _period);
      return null;
    }

    SeasonalDecomposition decomposition;
    try {
      decomposition = SeasonalDecomposition.decompose(history, _period);
    } catch (DecompositionException e) {
      LOG.warn("Failed to decompose the inference time of {}.", key, e);
      return null;
    }
    double residualStd = decomposition.residualStd();
    if (!(residualStd > MIN_RESIDUAL_STD)) {
      return null;
    }
    double threshold = _sensitivity * residualStd;
    double expected = decomposition.forecastNext();
    double value = event.inferenceTime();
    if (Math.abs(value - expected) > threshold) {
      SeasonalAnomaly anomaly = new SeasonalAnomaly(key, _time.milliseconds(), event, METRIC_TYPE, currentBucket * BUCKET_MS,
                                                    value, expected, threshold);
      LOG.trace("Found {}.", anomaly);
      return anomaly;
    }
    return null;
  }

  /**
   * Resample the points before the current bucket to one mean value per hour. Points at or after the current bucket
   * are ignored.
   *
   * @param points Retained points, in arrival order.
   * @param currentBucket The hourly bucket of the current event.
   * @return The hourly means from the first bucket with data up to the bucket before the current one, or {@code null} if
   * there is no point before the current bucket.
   */
  static double[] hourlyHistory(List<MetricPoint<LlmCallEvent>> points, long currentBucket) {
    long firstBucket = Long.MAX_VALUE;
    for (MetricPoint<LlmCallEvent> point : points) {
      long bucket = Math.floorDiv(point.timestampMs(), BUCKET_MS);
      if (bucket < currentBucket) {
        firstBucket = Math.min(firstBucket, bucket);
      }
    }
    if (firstBucket == Long.MAX_VALUE) {
      return null;
    }
    firstBucket = Math.max(firstBucket, currentBucket - MAX_HISTORY_BUCKETS);
    int numBuckets = (int) (currentBucket - firstBucket);
    double[] sums = new double[numBuckets];
    int[] counts = new int[numBuckets];
    for (MetricPoint<LlmCallEvent> point : points) {
      long bucket = Math.floorDiv(point.timestampMs(), BUCKET_MS);
      if (bucket >= firstBucket && bucket < currentBucket) {
        int index = (int) (bucket - firstBucket);
        sums[index] += point.value();
        counts[index]++;
      }
    }
    double[] means = new double[numBuckets];
    int firstWithData = -1;
    for (int i = 0; i < numBuckets; i++) {
      if (counts[i] > 0) {
        means[i] = sums[i] / counts[i];
        if (firstWithData < 0) {
          firstWithData = i;
        }
      } else if (i > 0) {
        means[i] = means[i - 1];
      }
    }
    if (firstWithData > 0) {
      // Leading hours without data only occur when older hours were cut off; drop them.
      double[] trimmed = new double[numBuckets - firstWithData];
      System.arraycopy(means, firstWithData, trimmed, 0, trimmed.length);
      return trimmed;
    }
    return means;
  }
}
