/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.model;

import com.linkedin.llm.anomalywatch.exception.MalformedEventException;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.BASE_TIME_MS;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.ENTITY;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.event;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.eventBuilder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;


public class LlmCallEventTest {

  @Test
  public void testMetricValues() throws MalformedEventException {
    LlmCallEvent event = eventBuilder(ENTITY, BASE_TIME_MS, 1.25).memoryUsed(256.0).build();
    assertEquals(1.25, event.metricValue(MetricType.INFERENCE_TIME), 0.0);
    assertEquals(150.0, event.metricValue(MetricType.TOTAL_TOKENS), 0.0);
    assertEquals(100.0, event.metricValue(MetricType.PROMPT_TOKENS), 0.0);
    assertEquals(50.0, event.metricValue(MetricType.COMPLETION_TOKENS), 0.0);
    assertEquals(0.01, event.metricValue(MetricType.ESTIMATED_COST), 0.0);
    assertEquals(256.0, event.metricValue(MetricType.MEMORY_USED), 0.0);
    assertEquals(0.5, event.metricValue(MetricType.TOKEN_RATIO), 0.0);
  }

  @Test
  public void testTokenRatioUndefinedWithoutPromptTokens() throws MalformedEventException {
    LlmCallEvent event = eventBuilder(ENTITY, BASE_TIME_MS, 1.0).succeeded(0, 20, 0.001).build();
    assertNull(event.tokenRatio());
    assertNull(event.memoryUsed());
    assertEquals(5, event.reportedMetrics().size());
  }

  @Test
  public void testJsonStructureUsesEventFieldNames() throws MalformedEventException {
    LlmCallEvent event = event(ENTITY, BASE_TIME_MS + 500, 0.75);
    Map<String, Object> structure = event.getJsonStructure();
    assertEquals(ENTITY.provider(), structure.get(LlmCallEvent.PROVIDER));
    assertEquals(ENTITY.application(), structure.get(LlmCallEvent.APPLICATION));
    assertEquals((BASE_TIME_MS + 500) / 1000.0, (Double) structure.get(LlmCallEvent.TIMESTAMP), 0.0);
    assertEquals(0.75, (Double) structure.get(LlmCallEvent.INFERENCE_TIME), 0.0);
    assertEquals(150, structure.get(LlmCallEvent.TOTAL_TOKENS));
    assertNull(structure.get(LlmCallEvent.MEMORY_USED));
  }

  @Test
  public void testFailedCallRequiresError() {
    assertThrows(MalformedEventException.class, () -> LlmCallEvent.builder()
                                                                   .requestId("r")
                                                                   .timestampMs(BASE_TIME_MS)
                                                                   .entity(ENTITY)
                                                                   .inferenceTime(1.0)
                                                                   .success(false)
                                                                   .promptTokens(10)
                                                                   .build());
  }

  @Test
  public void testEmptyEntityFieldIsRejected() {
    assertThrows(MalformedEventException.class,
                 () -> eventBuilder(new EntityKey("openai", "", "chat"), BASE_TIME_MS, 1.0).build());
  }
}
