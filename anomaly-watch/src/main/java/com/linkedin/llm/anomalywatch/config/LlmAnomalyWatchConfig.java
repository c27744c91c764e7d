/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.config;

import com.linkedin.anomalywatch.common.config.AbstractConfig;
import com.linkedin.anomalywatch.common.config.ConfigDef;
import com.linkedin.anomalywatch.common.config.ConfigException;
import com.linkedin.llm.anomalywatch.config.constants.AnalysisConfig;
import com.linkedin.llm.anomalywatch.config.constants.DetectorConfig;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;


/**
 * The configuration of the LLM telemetry anomaly detection engine.
 */
public class LlmAnomalyWatchConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = AnalysisConfig.define(DetectorConfig.define(new ConfigDef()));
  }

  public LlmAnomalyWatchConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public LlmAnomalyWatchConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckWindows();
    sanityCheckCorrelationPairs();
  }

  /**
   * @return The configuration with every value at its default.
   */
  public static LlmAnomalyWatchConfig defaults() {
    return new LlmAnomalyWatchConfig(Collections.emptyMap(), false);
  }

  /**
   * @return The metrics checked by the statistical detector.
   */
  public List<MetricType> statisticalDetectorMetrics() {
    List<MetricType> metricTypes = new ArrayList<>();
    for (String name : getList(DetectorConfig.STATISTICAL_DETECTOR_METRICS_CONFIG)) {
      metricTypes.add(MetricType.forName(name));
    }
    return Collections.unmodifiableList(metricTypes);
  }

  /**
   * @return The metric pairs checked for diverging from their correlation, as two-element lists.
   */
  public List<List<MetricType>> correlationMetricPairs() {
    List<List<MetricType>> pairs = new ArrayList<>();
    for (String pair : getList(DetectorConfig.CORRELATION_METRIC_PAIRS_CONFIG)) {
      String[] names = pair.split(":");
      pairs.add(List.of(MetricType.forName(names[0].trim()), MetricType.forName(names[1].trim())));
    }
    return Collections.unmodifiableList(pairs);
  }

  private void sanityCheckWindows() {
    int windowSize = getInt(DetectorConfig.WINDOW_SIZE_CONFIG);
    int lookbackPeriod = getInt(DetectorConfig.LOOKBACK_PERIOD_CONFIG);
    if (windowSize > lookbackPeriod) {
      throw new ConfigException(String.format("Window size [%d] cannot be greater than the lookback period [%d].",
                                              windowSize, lookbackPeriod));
    }
    int minDataPoints = getInt(DetectorConfig.MIN_DATA_POINTS_CONFIG);
    if (minDataPoints > windowSize) {
      throw new ConfigException(String.format("Minimum data points [%d] cannot be greater than the window size [%d].",
                                              minDataPoints, windowSize));
    }
  }

  private void sanityCheckCorrelationPairs() {
    for (String pair : getList(DetectorConfig.CORRELATION_METRIC_PAIRS_CONFIG)) {
      String[] names = pair.split(":");
      if (names.length != 2) {
        throw new ConfigException(DetectorConfig.CORRELATION_METRIC_PAIRS_CONFIG, pair, "Expected a pair in the form first:second.");
      }
      MetricType first = MetricType.forName(names[0].trim());
      MetricType second = MetricType.forName(names[1].trim());
      if (first == null || second == null || first.isDerived() || second.isDerived()) {
        throw new ConfigException(DetectorConfig.CORRELATION_METRIC_PAIRS_CONFIG, pair, "Both metrics must be reported metrics.");
      }
      if (first == second) {
        throw new ConfigException(DetectorConfig.CORRELATION_METRIC_PAIRS_CONFIG, pair, "A metric cannot be paired with itself.");
      }
    }
  }
}
