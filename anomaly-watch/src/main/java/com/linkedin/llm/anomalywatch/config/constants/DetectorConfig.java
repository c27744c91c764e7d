/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.config.constants;

import com.linkedin.anomalywatch.common.config.ConfigDef;
import java.util.concurrent.TimeUnit;

import static com.linkedin.anomalywatch.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.anomalywatch.common.config.ConfigDef.Range.between;


/**
 * A class to keep the configs and defaults of the streaming anomaly detectors.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class DetectorConfig {

  private DetectorConfig() {
  }

  /**
   * <code>window.size</code>
   */
  public static final String WINDOW_SIZE_CONFIG = "window.size";
  public static final int DEFAULT_WINDOW_SIZE = 100;
  public static final String WINDOW_SIZE_DOC = "The number of most recent observations of a metric that the current "
      + "observation is compared against.";

  /**
   * <code>lookback.period</code>
   */
  public static final String LOOKBACK_PERIOD_CONFIG = "lookback.period";
  public static final int DEFAULT_LOOKBACK_PERIOD = 1000;
  public static final String LOOKBACK_PERIOD_DOC = "The maximum number of observations retained per metric and entity. "
      + "Once reached, each new observation evicts the oldest one.";

  /**
   * <code>alert.sensitivity</code>
   */
  public static final String ALERT_SENSITIVITY_CONFIG = "alert.sensitivity";
  public static final double DEFAULT_ALERT_SENSITIVITY = 3.0;
  public static final String ALERT_SENSITIVITY_DOC = "The number of standard deviations an observation must deviate by "
      + "to be reported.";

  /**
   * <code>min.data.points</code>
   */
  public static final String MIN_DATA_POINTS_CONFIG = "min.data.points";
  public static final int DEFAULT_MIN_DATA_POINTS = 30;
  public static final String MIN_DATA_POINTS_DOC = "The minimum number of observations required before an entity is "
      + "checked for anomalies.";

  /**
   * <code>statistical.detector.metrics</code>
   */
  public static final String STATISTICAL_DETECTOR_METRICS_CONFIG = "statistical.detector.metrics";
  public static final String DEFAULT_STATISTICAL_DETECTOR_METRICS = "inference_time,total_tokens,estimated_cost,memory_used,token_ratio";
  public static final String STATISTICAL_DETECTOR_METRICS_DOC = "The metrics checked for z-score spikes and interquartile "
      + "range outliers.";

  /**
   * <code>seasonal.period</code>
   */
  public static final String SEASONAL_PERIOD_CONFIG = "seasonal.period";
  public static final int DEFAULT_SEASONAL_PERIOD = 24;
  public static final String SEASONAL_PERIOD_DOC = "The number of hourly buckets in one seasonal cycle of inference time.";

  /**
   * <code>correlation.recompute.interval.points</code>
   */
  public static final String CORRELATION_RECOMPUTE_INTERVAL_POINTS_CONFIG = "correlation.recompute.interval.points";
  public static final int DEFAULT_CORRELATION_RECOMPUTE_INTERVAL_POINTS = 50;
  public static final String CORRELATION_RECOMPUTE_INTERVAL_POINTS_DOC = "The number of new observations of an entity "
      + "after which the correlations between its metrics are recomputed.";

  /**
   * <code>correlation.strength.threshold</code>
   */
  public static final String CORRELATION_STRENGTH_THRESHOLD_CONFIG = "correlation.strength.threshold";
  public static final double DEFAULT_CORRELATION_STRENGTH_THRESHOLD = 0.7;
  public static final String CORRELATION_STRENGTH_THRESHOLD_DOC = "The absolute correlation coefficient above which two "
      + "metrics are expected to move together.";

  /**
   * <code>correlation.metric.pairs</code>
   */
  public static final String CORRELATION_METRIC_PAIRS_CONFIG = "correlation.metric.pairs";
  public static final String DEFAULT_CORRELATION_METRIC_PAIRS = "inference_time:memory_used";
  public static final String CORRELATION_METRIC_PAIRS_DOC = "A list of metric pairs in the form first:second that are "
      + "checked for diverging from their historical correlation.";

  /**
   * <code>anomaly.dedup.cooldown.ms</code>
   */
  public static final String ANOMALY_DEDUP_COOLDOWN_MS_CONFIG = "anomaly.dedup.cooldown.ms";
  public static final long DEFAULT_ANOMALY_DEDUP_COOLDOWN_MS = TimeUnit.MINUTES.toMillis(5);
  public static final String ANOMALY_DEDUP_COOLDOWN_MS_DOC = "The time during which an anomaly with the same signature "
      + "as an already reported one is suppressed.";

  /**
   * <code>anomaly.dedup.cache.max.size</code>
   */
  public static final String ANOMALY_DEDUP_CACHE_MAX_SIZE_CONFIG = "anomaly.dedup.cache.max.size";
  public static final int DEFAULT_ANOMALY_DEDUP_CACHE_MAX_SIZE = 1000;
  public static final String ANOMALY_DEDUP_CACHE_MAX_SIZE_DOC = "The maximum number of anomaly signatures remembered for "
      + "deduplication. The oldest signature is forgotten first.";

  /**
   * <code>error.rate.alert.cooldown.ms</code>
   */
  public static final String ERROR_RATE_ALERT_COOLDOWN_MS_CONFIG = "error.rate.alert.cooldown.ms";
  public static final long DEFAULT_ERROR_RATE_ALERT_COOLDOWN_MS = TimeUnit.HOURS.toMillis(1);
  public static final String ERROR_RATE_ALERT_COOLDOWN_MS_DOC = "The minimum time between two reports of the same "
      + "recurring error of an entity.";

  /**
   * <code>error.pattern.min.occurrences</code>
   */
  public static final String ERROR_PATTERN_MIN_OCCURRENCES_CONFIG = "error.pattern.min.occurrences";
  public static final int DEFAULT_ERROR_PATTERN_MIN_OCCURRENCES = 5;
  public static final String ERROR_PATTERN_MIN_OCCURRENCES_DOC = "The number of occurrences of the same error within "
      + "the error pattern window that makes it a recurring error.";

  /**
   * <code>error.pattern.window.ms</code>
   */
  public static final String ERROR_PATTERN_WINDOW_MS_CONFIG = "error.pattern.window.ms";
  public static final long DEFAULT_ERROR_PATTERN_WINDOW_MS = TimeUnit.HOURS.toMillis(1);
  public static final String ERROR_PATTERN_WINDOW_MS_DOC = "The time window, in event time, in which occurrences of the "
      + "same error are counted.";

  /**
   * Define configs for the streaming anomaly detectors.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the streaming anomaly detectors.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(WINDOW_SIZE_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_WINDOW_SIZE,
                            atLeast(2),
                            ConfigDef.Importance.HIGH,
                            WINDOW_SIZE_DOC)
                    .define(LOOKBACK_PERIOD_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_LOOKBACK_PERIOD,
                            atLeast(2),
                            ConfigDef.Importance.HIGH,
                            LOOKBACK_PERIOD_DOC)
                    .define(ALERT_SENSITIVITY_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_ALERT_SENSITIVITY,
                            between(0.1, 100.0),
                            ConfigDef.Importance.HIGH,
                            ALERT_SENSITIVITY_DOC)
                    .define(MIN_DATA_POINTS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MIN_DATA_POINTS,
                            atLeast(2),
                            ConfigDef.Importance.HIGH,
                            MIN_DATA_POINTS_DOC)
                    .define(STATISTICAL_DETECTOR_METRICS_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_STATISTICAL_DETECTOR_METRICS,
                            ConfigDef.ValidList.in("inference_time", "total_tokens", "estimated_cost", "memory_used",
                                                   "prompt_tokens", "completion_tokens", "token_ratio"),
                            ConfigDef.Importance.MEDIUM,
                            STATISTICAL_DETECTOR_METRICS_DOC)
                    .define(SEASONAL_PERIOD_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_SEASONAL_PERIOD,
                            between(2, 24 * 7),
                            ConfigDef.Importance.MEDIUM,
                            SEASONAL_PERIOD_DOC)
                    .define(CORRELATION_RECOMPUTE_INTERVAL_POINTS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_CORRELATION_RECOMPUTE_INTERVAL_POINTS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            CORRELATION_RECOMPUTE_INTERVAL_POINTS_DOC)
                    .define(CORRELATION_STRENGTH_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_CORRELATION_STRENGTH_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.LOW,
                            CORRELATION_STRENGTH_THRESHOLD_DOC)
                    .define(CORRELATION_METRIC_PAIRS_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_CORRELATION_METRIC_PAIRS,
                            ConfigDef.Importance.LOW,
                            CORRELATION_METRIC_PAIRS_DOC)
                    .define(ANOMALY_DEDUP_COOLDOWN_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_ANOMALY_DEDUP_COOLDOWN_MS,
                            atLeast(0),
                            ConfigDef.Importance.MEDIUM,
                            ANOMALY_DEDUP_COOLDOWN_MS_DOC)
                    .define(ANOMALY_DEDUP_CACHE_MAX_SIZE_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ANOMALY_DEDUP_CACHE_MAX_SIZE,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            ANOMALY_DEDUP_CACHE_MAX_SIZE_DOC)
                    .define(ERROR_RATE_ALERT_COOLDOWN_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_ERROR_RATE_ALERT_COOLDOWN_MS,
                            atLeast(0),
                            ConfigDef.Importance.MEDIUM,
                            ERROR_RATE_ALERT_COOLDOWN_MS_DOC)
                    .define(ERROR_PATTERN_MIN_OCCURRENCES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ERROR_PATTERN_MIN_OCCURRENCES,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            ERROR_PATTERN_MIN_OCCURRENCES_DOC)
                    .define(ERROR_PATTERN_WINDOW_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_ERROR_PATTERN_WINDOW_MS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            ERROR_PATTERN_WINDOW_MS_DOC);
  }
}
