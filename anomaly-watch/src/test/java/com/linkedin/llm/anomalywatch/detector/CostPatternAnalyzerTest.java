/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.llm.anomalywatch.detector.anomaly.CostInsightType;
import com.linkedin.llm.anomalywatch.detector.anomaly.CostOptimizationInsight;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.exception.MalformedEventException;
import com.linkedin.llm.anomalywatch.model.CostPattern;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.ModelCatalog;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.BASE_TIME_MS;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.ENTITY;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.event;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.eventBuilder;
import static com.linkedin.llm.anomalywatch.LlmAnomalyWatchUnitTestUtils.failedEvent;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;


public class CostPatternAnalyzerTest {
  private static final int MIN_DATA_POINTS = 5;
  private static final long HOUR_MS = TimeUnit.HOURS.toMillis(1);
  // BASE_TIME_MS is 22:00 UTC on a Tuesday.
  private static final int BASE_HOUR_OF_DAY = 22;
  private static final int BASE_DAY_OF_WEEK = 1;
  private static final EntityKey GPT_4 = new EntityKey("openai", "gpt-4", "summarizer");
  private CostPatternAnalyzer _analyzer;

  @Before
  public void setUp() {
    _analyzer = new CostPatternAnalyzer(ModelCatalog.defaultCatalog(), MIN_DATA_POINTS, new MockTime());
  }

  private LlmCallEvent record(EntityKey key, long timestampMs, int promptTokens, int completionTokens, double cost)
      throws MalformedEventException {
    LlmCallEvent event = eventBuilder(key, timestampMs, 1.0).succeeded(promptTokens, completionTokens, cost).build();
    _analyzer.record(cost, event);
    return event;
  }

  @Test
  public void testCostPattern() throws MalformedEventException {
    record(ENTITY, BASE_TIME_MS, 100, 100, 0.02);
    record(ENTITY, BASE_TIME_MS + HOUR_MS, 300, 100, 0.04);
    CostPattern pattern = _analyzer.costPattern(ENTITY);
    assertEquals(0.06, pattern.totalCost(), 1e-12);
    assertEquals(2, pattern.requestCount());
    assertEquals(300.0, pattern.avgTokensPerRequest(), 1e-12);
    assertEquals((0.5 + 0.75) / 2, pattern.avgPromptRatio(), 1e-12);
    assertEquals(0.02, pattern.hourlyCost()[BASE_HOUR_OF_DAY], 1e-12);
    assertEquals(0.04, pattern.hourlyCost()[BASE_HOUR_OF_DAY + 1], 1e-12);
    assertEquals(0.06, pattern.dailyCost()[BASE_DAY_OF_WEEK], 1e-12);
    assertEquals(BASE_TIME_MS + HOUR_MS, pattern.lastUpdateMs());
    assertNull(_analyzer.costPattern(GPT_4));

    // The returned pattern is a copy.
    record(ENTITY, BASE_TIME_MS, 100, 100, 0.02);
    assertEquals(2, pattern.requestCount());
    assertEquals(3, _analyzer.costPattern(ENTITY).requestCount());
  }

  @Test
  public void testNoInsightBeforeMinDataPoints() throws MalformedEventException {
    for (int i = 0; i < MIN_DATA_POINTS - 1; i++) {
      LlmCallEvent event = record(GPT_4, BASE_TIME_MS + i, 900, 100, 0.05);
      assertTrue(_analyzer.insights(event).isEmpty());
    }
  }

  @Test
  public void testInsightsOfEvent() throws MalformedEventException {
    LlmCallEvent event = null;
    for (int i = 0; i < MIN_DATA_POINTS; i++) {
      event = record(GPT_4, BASE_TIME_MS + i, 900, 100, 0.05);
    }
    List<LlmAnomaly> insights = _analyzer.insights(event);
    assertEquals(3, insights.size());

    CostOptimizationInsight highPromptRatio = (CostOptimizationInsight) insights.get(0);
    assertEquals(CostInsightType.HIGH_PROMPT_RATIO, highPromptRatio.insightType());
    assertEquals(0.9, highPromptRatio.value(), 1e-12);
    assertEquals(0.9, (Double) highPromptRatio.details().get("avg_ratio"), 1e-12);

    CostOptimizationInsight modelAlternative = (CostOptimizationInsight) insights.get(1);
    assertEquals(CostInsightType.MODEL_ALTERNATIVE, modelAlternative.insightType());
    assertEquals(0.05, modelAlternative.value(), 0.0);
    assertEquals(1, ((List<?>) modelAlternative.details().get("alternatives")).size());

    CostOptimizationInsight underutilizedContext = (CostOptimizationInsight) insights.get(2);
    assertEquals(CostInsightType.UNDERUTILIZED_CONTEXT, underutilizedContext.insightType());
    assertEquals(1000.0, underutilizedContext.value(), 0.0);
    assertEquals(8192, underutilizedContext.details().get("context_window"));
    assertEquals("cost_optimization|" + GPT_4 + "|underutilized_context", underutilizedContext.signature());
  }

  @Test
  public void testNoInsightForUnknownModelWithBalancedPrompts() throws MalformedEventException {
    LlmCallEvent event = null;
    for (int i = 0; i < MIN_DATA_POINTS; i++) {
      event = record(ENTITY, BASE_TIME_MS + i, 100, 100, 0.05);
    }
    assertTrue(_analyzer.insights(event).isEmpty());
    assertTrue(_analyzer.insights(failedEvent(ENTITY, BASE_TIME_MS, "timeout")).isEmpty());
  }

  @Test
  public void testPeriodicInsights() throws MalformedEventException {
    // Every request of ENTITY is in the same hour, with a high prompt ratio.
    for (int i = 0; i < MIN_DATA_POINTS; i++) {
      record(ENTITY, BASE_TIME_MS + i, 800, 100, 0.01);
    }
    // The requests of the other entity are spread over the day.
    EntityKey spread = new EntityKey("openai", "test-model", "batch");
    for (int hour = 0; hour < 24; hour++) {
      record(spread, BASE_TIME_MS + hour * HOUR_MS, 100, 100, 0.01);
    }
    List<LlmAnomaly> insights = _analyzer.periodicInsights(() -> false);
    assertEquals(2, insights.size());

    CostOptimizationInsight peakHourUsage = (CostOptimizationInsight) insights.get(0);
    assertEquals(ENTITY, peakHourUsage.entityKey());
    assertEquals(CostInsightType.PEAK_HOUR_USAGE, peakHourUsage.insightType());
    assertEquals(100.0, peakHourUsage.value(), 1e-9);
    assertEquals(List.of(BASE_HOUR_OF_DAY), peakHourUsage.details().get("peak_hours"));
    assertNull(peakHourUsage.event());

    CostOptimizationInsight highPromptRatio = (CostOptimizationInsight) insights.get(1);
    assertEquals(CostInsightType.HIGH_PROMPT_RATIO, highPromptRatio.insightType());
    assertEquals(800.0 / 900.0, highPromptRatio.value(), 1e-12);
    assertEquals(CostPatternAnalyzer.PERIODIC_HIGH_PROMPT_RATIO_RECOMMENDATION, highPromptRatio.recommendation());

    assertTrue(_analyzer.periodicInsights(() -> true).isEmpty());
    assertEquals(2, _analyzer.numPatterns());
  }

  @Test
  public void testZeroCostRequestIsCounted() throws MalformedEventException {
    LlmCallEvent event = event(ENTITY, BASE_TIME_MS, 1.0);
    _analyzer.record(0.0, event);
    assertEquals(0.0, _analyzer.costPattern(ENTITY).totalCost(), 0.0);
    assertEquals(1, _analyzer.costPattern(ENTITY).requestCount());
  }
}
