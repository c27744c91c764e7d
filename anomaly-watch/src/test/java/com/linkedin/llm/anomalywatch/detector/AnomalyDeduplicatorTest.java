/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.llm.anomalywatch.detector.anomaly.ErrorRateSpike;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.detector.anomaly.StatisticalOutlier;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.time.Duration;
import java.util.List;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.ENTITY;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


public class AnomalyDeduplicatorTest {
  private static final Duration COOLDOWN = Duration.ofMinutes(5);
  private static final Duration ERROR_RATE_COOLDOWN = Duration.ofHours(1);
  private MockTime _time;
  private AnomalyDeduplicator _deduplicator;

  @Before
  public void setUp() {
    _time = new MockTime();
    _deduplicator = new AnomalyDeduplicator(COOLDOWN, ERROR_RATE_COOLDOWN, 3, _time);
  }

  private LlmAnomaly outlier(EntityKey key, MetricType metricType) {
    return new StatisticalOutlier(key, _time.milliseconds(), null, metricType, 10.0, 1.0, 2.0);
  }

  private LlmAnomaly errorRateSpike(String error) {
    return new ErrorRateSpike(ENTITY, _time.milliseconds(), null, error, 5, _time.milliseconds());
  }

  @Test
  public void testSuppressWithinCooldown() {
    LlmAnomaly first = outlier(ENTITY, MetricType.INFERENCE_TIME);
    assertEquals(List.of(first), _deduplicator.deduplicate(List.of(first)));

    _time.sleep(COOLDOWN.toMillis() - 1);
    assertTrue(_deduplicator.deduplicate(List.of(outlier(ENTITY, MetricType.INFERENCE_TIME))).isEmpty());

    // A different signature is not affected.
    LlmAnomaly otherMetric = outlier(ENTITY, MetricType.MEMORY_USED);
    assertEquals(List.of(otherMetric), _deduplicator.deduplicate(List.of(otherMetric)));

    _time.sleep(1);
    LlmAnomaly afterCooldown = outlier(ENTITY, MetricType.INFERENCE_TIME);
    assertEquals(List.of(afterCooldown), _deduplicator.deduplicate(List.of(afterCooldown)));
  }

  @Test
  public void testSameSignatureInOneBatch() {
    LlmAnomaly first = outlier(ENTITY, MetricType.INFERENCE_TIME);
    LlmAnomaly second = outlier(ENTITY, MetricType.INFERENCE_TIME);
    assertEquals(List.of(first), _deduplicator.deduplicate(List.of(first, second)));
  }

  @Test
  public void testErrorRateSpikeCooldown() {
    assertEquals(1, _deduplicator.deduplicate(List.of(errorRateSpike("timeout"))).size());
    _time.sleep(COOLDOWN.toMillis());
    assertTrue(_deduplicator.deduplicate(List.of(errorRateSpike("timeout"))).isEmpty());
    _time.sleep(ERROR_RATE_COOLDOWN.toMillis() - COOLDOWN.toMillis());
    assertEquals(1, _deduplicator.deduplicate(List.of(errorRateSpike("timeout"))).size());
  }

  @Test
  public void testEvictLeastRecentlyReportedSignature() {
    LlmAnomaly a = outlier(new EntityKey("p", "m", "a"), MetricType.INFERENCE_TIME);
    LlmAnomaly b = outlier(new EntityKey("p", "m", "b"), MetricType.INFERENCE_TIME);
    LlmAnomaly c = outlier(new EntityKey("p", "m", "c"), MetricType.INFERENCE_TIME);
    LlmAnomaly d = outlier(new EntityKey("p", "m", "d"), MetricType.INFERENCE_TIME);
    _deduplicator.deduplicate(List.of(a, b, c, d));
    assertEquals(3, _deduplicator.reportTimeBySignature().size());
    assertFalse(_deduplicator.reportTimeBySignature().containsKey(a.signature()));
    // The evicted signature is reported again.
    assertEquals(1, _deduplicator.deduplicate(List.of(outlier(new EntityKey("p", "m", "a"), MetricType.INFERENCE_TIME))).size());
    assertFalse(_deduplicator.reportTimeBySignature().containsKey(b.signature()));
  }

  @Test
  public void testRemoveExpiredSignatures() {
    _deduplicator.deduplicate(List.of(outlier(ENTITY, MetricType.INFERENCE_TIME), errorRateSpike("timeout")));
    _time.sleep(COOLDOWN.toMillis());
    _deduplicator.removeExpiredSignatures();
    assertEquals(2, _deduplicator.reportTimeBySignature().size());
    _time.sleep(ERROR_RATE_COOLDOWN.toMillis());
    _deduplicator.removeExpiredSignatures();
    assertTrue(_deduplicator.reportTimeBySignature().isEmpty());
  }
}
