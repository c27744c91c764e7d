/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.config;

import com.linkedin.anomalywatch.common.config.ConfigException;
import com.linkedin.llm.anomalywatch.config.constants.AnalysisConfig;
import com.linkedin.llm.anomalywatch.config.constants.DetectorConfig;
import com.linkedin.llm.anomalywatch.detector.notifier.NoopAnomalyNotifier;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.Test;

import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.config;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;


public class LlmAnomalyWatchConfigTest {

  @Test
  public void testDefaults() {
    LlmAnomalyWatchConfig config = LlmAnomalyWatchConfig.defaults();
    assertEquals(100, config.getInt(DetectorConfig.WINDOW_SIZE_CONFIG).intValue());
    assertEquals(1000, config.getInt(DetectorConfig.LOOKBACK_PERIOD_CONFIG).intValue());
    assertEquals(3.0, config.getDouble(DetectorConfig.ALERT_SENSITIVITY_CONFIG), 0.0);
    assertEquals(30, config.getInt(DetectorConfig.MIN_DATA_POINTS_CONFIG).intValue());
    assertEquals(24, config.getInt(DetectorConfig.SEASONAL_PERIOD_CONFIG).intValue());
    assertEquals(1800000L, config.getLong(AnalysisConfig.PERIODIC_ANALYSIS_INTERVAL_MS_CONFIG).longValue());
    assertEquals(300000L, config.getLong(DetectorConfig.ANOMALY_DEDUP_COOLDOWN_MS_CONFIG).longValue());
    assertEquals(3600000L, config.getLong(DetectorConfig.ERROR_RATE_ALERT_COOLDOWN_MS_CONFIG).longValue());
    assertEquals(NoopAnomalyNotifier.class, config.getClass(AnalysisConfig.ANOMALY_NOTIFIER_CLASS_CONFIG));
    assertEquals(List.of(MetricType.INFERENCE_TIME, MetricType.TOTAL_TOKENS, MetricType.ESTIMATED_COST,
                         MetricType.MEMORY_USED, MetricType.TOKEN_RATIO), config.statisticalDetectorMetrics());
    assertEquals(List.of(List.of(MetricType.INFERENCE_TIME, MetricType.MEMORY_USED)), config.correlationMetricPairs());
  }

  @Test
  public void testParseFromProperties() {
    Properties props = new Properties();
    props.setProperty(DetectorConfig.WINDOW_SIZE_CONFIG, "50");
    props.setProperty(DetectorConfig.ALERT_SENSITIVITY_CONFIG, "2.5");
    props.setProperty(DetectorConfig.STATISTICAL_DETECTOR_METRICS_CONFIG, "inference_time, estimated_cost");
    props.setProperty(DetectorConfig.CORRELATION_METRIC_PAIRS_CONFIG, "inference_time:memory_used,total_tokens:estimated_cost");
    LlmAnomalyWatchConfig config = new LlmAnomalyWatchConfig(props, false);
    assertEquals(50, config.getInt(DetectorConfig.WINDOW_SIZE_CONFIG).intValue());
    assertEquals(2.5, config.getDouble(DetectorConfig.ALERT_SENSITIVITY_CONFIG), 0.0);
    assertEquals(List.of(MetricType.INFERENCE_TIME, MetricType.ESTIMATED_COST), config.statisticalDetectorMetrics());
    assertEquals(2, config.correlationMetricPairs().size());
    assertEquals(List.of(MetricType.TOTAL_TOKENS, MetricType.ESTIMATED_COST), config.correlationMetricPairs().get(1));
  }

  @Test
  public void testWindowLargerThanLookbackIsRejected() {
    assertThrows(ConfigException.class, () -> config(Map.of(DetectorConfig.WINDOW_SIZE_CONFIG, 200,
                                                            DetectorConfig.LOOKBACK_PERIOD_CONFIG, 100)));
  }

  @Test
  public void testMinDataPointsLargerThanWindowIsRejected() {
    assertThrows(ConfigException.class, () -> config(Map.of(DetectorConfig.WINDOW_SIZE_CONFIG, 20)));
  }

  @Test
  public void testInvalidValuesAreRejected() {
    assertThrows(ConfigException.class, () -> config(Map.of(DetectorConfig.ALERT_SENSITIVITY_CONFIG, -1.0)));
    assertThrows(ConfigException.class, () -> config(Map.of(DetectorConfig.STATISTICAL_DETECTOR_METRICS_CONFIG, "latency")));
    assertThrows(ConfigException.class, () -> config(Map.of(DetectorConfig.WINDOW_SIZE_CONFIG, "many")));
  }

  @Test
  public void testInvalidCorrelationPairsAreRejected() {
    assertThrows(ConfigException.class, () -> config(Map.of(DetectorConfig.CORRELATION_METRIC_PAIRS_CONFIG, "inference_time")));
    assertThrows(ConfigException.class,
                 () -> config(Map.of(DetectorConfig.CORRELATION_METRIC_PAIRS_CONFIG, "inference_time:token_ratio")));
    assertThrows(ConfigException.class,
                 () -> config(Map.of(DetectorConfig.CORRELATION_METRIC_PAIRS_CONFIG, "memory_used:memory_used")));
    assertThrows(ConfigException.class,
                 () -> config(Map.of(DetectorConfig.CORRELATION_METRIC_PAIRS_CONFIG, "inference_time:latency")));
  }
}
