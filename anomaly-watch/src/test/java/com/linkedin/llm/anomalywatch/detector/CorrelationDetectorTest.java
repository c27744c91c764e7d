/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.anomalywatch.monitor.series.MetricSeriesStore;
import com.linkedin.llm.anomalywatch.detector.anomaly.CorrelationDivergence;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.exception.MalformedEventException;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.List;
import java.util.Random;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.BASE_TIME_MS;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.ENTITY;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.eventBuilder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;


public class CorrelationDetectorTest {
  private static final int NUM_EVENTS = 60;
  private MetricSeriesStore<MetricType, EntityKey, LlmCallEvent> _store;
  private CorrelationDetector _detector;
  private MockTime _time;

  @Before
  public void setUp() {
    _store = new MetricSeriesStore<>(1000);
    _time = new MockTime();
    _detector = new CorrelationDetector(_store, List.of(List.of(MetricType.INFERENCE_TIME, MetricType.MEMORY_USED)), 50, 0.7,
                                        100, 30, 3.0, _time);
  }

  private List<LlmAnomaly> addAndDetect(int index, double inferenceTime, double memoryUsed) throws MalformedEventException {
    LlmCallEvent event = eventBuilder(ENTITY, BASE_TIME_MS + index * 1000L, inferenceTime).memoryUsed(memoryUsed).build();
    _store.add(MetricType.INFERENCE_TIME, ENTITY, inferenceTime, event, event.timestampMs());
    _detector.onPointAdded(ENTITY);
    _store.add(MetricType.MEMORY_USED, ENTITY, memoryUsed, event, event.timestampMs());
    _detector.onPointAdded(ENTITY);
    return _detector.detect(event);
  }

  @Test
  public void testDivergenceOfCorrelatedMetrics() throws MalformedEventException {
    Random random = new Random(11);
    for (int i = 0; i < NUM_EVENTS; i++) {
      double inferenceTime = 1.0 + 0.1 * random.nextGaussian();
      double memoryUsed = 2 * inferenceTime + 0.07 * random.nextGaussian();
      assertTrue(addAndDetect(i, inferenceTime, memoryUsed).isEmpty());
      if (i == 24) {
        // Recomputed after 50 points, while each metric has fewer than the minimum data points.
        assertNull(_detector.correlationMatrix(ENTITY));
      }
    }
    CorrelationMatrix matrix = _detector.correlationMatrix(ENTITY);
    assertNotNull(matrix);
    assertEquals(0.950, matrix.coefficient(MetricType.INFERENCE_TIME, MetricType.MEMORY_USED), 0.005);
    assertEquals(matrix.coefficient(MetricType.INFERENCE_TIME, MetricType.MEMORY_USED),
                 matrix.coefficient(MetricType.MEMORY_USED, MetricType.INFERENCE_TIME));
    assertNull(matrix.coefficient(MetricType.INFERENCE_TIME, MetricType.TOTAL_TOKENS));

    // Usual inference time with unusually high memory.
    List<LlmAnomaly> anomalies = addAndDetect(NUM_EVENTS, 1.0, 5.0);
    assertEquals(1, anomalies.size());
    CorrelationDivergence divergence = (CorrelationDivergence) anomalies.get(0);
    assertEquals(MetricType.INFERENCE_TIME, divergence.firstMetric());
    assertEquals(MetricType.MEMORY_USED, divergence.secondMetric());
    assertEquals(0.016, divergence.firstZScore(), 0.01);
    assertEquals(6.886, divergence.secondZScore(), 0.01);
    assertTrue(divergence.divergence() > CorrelationDetector.DIVERGENCE_SENSITIVITY_MULTIPLIER * 3.0);
    assertEquals("correlation_divergence|" + ENTITY + "|inference_time:memory_used", divergence.signature());
  }

  @Test
  public void testUncorrelatedMetricsNeverDiverge() throws MalformedEventException {
    Random random = new Random(12);
    for (int i = 0; i < NUM_EVENTS; i++) {
      addAndDetect(i, 1.0 + 0.1 * random.nextGaussian(), 2.0 + 0.2 * random.nextGaussian());
    }
    CorrelationMatrix matrix = _detector.correlationMatrix(ENTITY);
    assertNotNull(matrix);
    assertTrue(Math.abs(matrix.coefficient(MetricType.INFERENCE_TIME, MetricType.MEMORY_USED)) < 0.7);
    assertTrue(addAndDetect(NUM_EVENTS, 1.0, 5.0).isEmpty());
  }

  @Test
  public void testAlignmentFillsMissingValues() throws MalformedEventException {
    // Memory is only reported by every other event; the gaps are filled with the last reported value.
    for (int i = 0; i < 80; i++) {
      double inferenceTime = 1.0 + (i % 10) * 0.1;
      LlmCallEvent event = eventBuilder(ENTITY, BASE_TIME_MS + i * 1000L, inferenceTime).build();
      _store.add(MetricType.INFERENCE_TIME, ENTITY, inferenceTime, event, event.timestampMs());
      if (i % 2 == 0) {
        _store.add(MetricType.MEMORY_USED, ENTITY, 2 * inferenceTime, event, event.timestampMs());
      }
    }
    CorrelationMatrix matrix = _detector.computeMatrix(ENTITY);
    assertNotNull(matrix);
    assertTrue(matrix.coefficient(MetricType.INFERENCE_TIME, MetricType.MEMORY_USED) > 0.7);
    assertEquals(_time.milliseconds(), matrix.computedAtMs());
  }
}
