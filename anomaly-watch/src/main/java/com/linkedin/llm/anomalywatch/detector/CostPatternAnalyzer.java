/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.llm.anomalywatch.detector.anomaly.CostInsightType;
import com.linkedin.llm.anomalywatch.detector.anomaly.CostOptimizationInsight;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.model.CostPattern;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.ModelAlternative;
import com.linkedin.llm.anomalywatch.model.ModelCatalog;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BooleanSupplier;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Maintains the {@link CostPattern} of each entity and derives cost optimization insights from it.
 */
public class CostPatternAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(CostPatternAnalyzer.class);
  static final double HIGH_PROMPT_RATIO_THRESHOLD = 0.8;
  static final double PERIODIC_HIGH_PROMPT_RATIO_THRESHOLD = 0.75;
  static final double UNDERUTILIZED_CONTEXT_RATIO = 0.3;
  static final double PEAK_HOUR_COST_SHARE = 0.15;
  static final double PEAK_HOURS_MIN_TOTAL_SHARE = 0.5;
  static final int MAX_PEAK_HOURS = 6;
  static final String PERIODIC_HIGH_PROMPT_RATIO_RECOMMENDATION = "High prompt-to-completion ratio detected. Consider caching "
                                                                  + "results, optimizing prompts, or using a different model.";
  private final ModelCatalog _modelCatalog;
  private final int _minDataPoints;
  private final Time _time;
  private final ConcurrentMap<EntityKey, CostPattern> _patternByEntity;

  public CostPatternAnalyzer(ModelCatalog modelCatalog, int minDataPoints, Time time) {
    _modelCatalog = modelCatalog;
    _minDataPoints = minDataPoints;
    _time = time;
    _patternByEntity = new ConcurrentHashMap<>();
  }

  /**
   * Record the cost of the given event in the pattern of its entity.
   *
   * @param cost Cost of the event.
   * @param event The event.
   */
  public void record(double cost, LlmCallEvent event) {
    _patternByEntity.computeIfAbsent(event.entityKey(), k -> new CostPattern())
                    .record(cost, event.totalTokens(), event.promptTokens(), event.timestampMs());
  }

  /**
   * @param key Entity key.
   * @return A copy of the cost pattern of the given entity, or {@code null} if no cost was recorded for it.
   */
  public CostPattern costPattern(EntityKey key) {
    CostPattern pattern = _patternByEntity.get(key);
    return pattern == null ? null : pattern.copy();
  }

  /**
   * Insights about the given event, available once its entity has recorded the minimum number of requests.
   *
   * @param event The current event, whose cost has already been recorded.
   * @return Cost optimization insights about the given event.
   */
  public List<LlmAnomaly> insights(LlmCallEvent event) {
    if (event.estimatedCost() == null) {
      return Collections.emptyList();
    }
    EntityKey key = event.entityKey();
    CostPattern pattern = costPattern(key);
    if (pattern == null || pattern.requestCount() < _minDataPoints) {
      return Collections.emptyList();
    }
    List<LlmAnomaly> insights = new ArrayList<>();
    long nowMs = _time.milliseconds();

    Integer totalTokens = event.totalTokens();
    if (pattern.avgPromptRatio() > HIGH_PROMPT_RATIO_THRESHOLD && totalTokens != null && totalTokens > 0) {
      double currentRatio = (double) event.promptTokens() / totalTokens;
      if (currentRatio > HIGH_PROMPT_RATIO_THRESHOLD) {
        insights.add(new CostOptimizationInsight(key, nowMs, event, CostInsightType.HIGH_PROMPT_RATIO, currentRatio,
                                                 CostInsightType.HIGH_PROMPT_RATIO.recommendation(),
                                                 Map.of("avg_ratio", pattern.avgPromptRatio())));
      }
    }

    List<ModelAlternative> alternatives = _modelCatalog.alternativesFor(key.model());
    if (!alternatives.isEmpty()) {
      List<Map<String, Object>> alternativesJson = new ArrayList<>(alternatives.size());
      alternatives.forEach(alternative -> alternativesJson.add(alternative.getJsonStructure()));
      insights.add(new CostOptimizationInsight(key, nowMs, event, CostInsightType.MODEL_ALTERNATIVE, event.estimatedCost(),
                                               CostInsightType.MODEL_ALTERNATIVE.recommendation(),
                                               Map.of("alternatives", alternativesJson)));
    }

    Integer contextWindow = _modelCatalog.contextWindow(key.model());
    if (contextWindow != null && event.completionTokens() != null) {
      int usedTokens = event.promptTokens() + event.completionTokens();
      if (usedTokens < contextWindow * UNDERUTILIZED_CONTEXT_RATIO) {
        insights.add(new CostOptimizationInsight(key, nowMs, event, CostInsightType.UNDERUTILIZED_CONTEXT, usedTokens,
                                                 CostInsightType.UNDERUTILIZED_CONTEXT.recommendation(),
                                                 Map.of("context_window", contextWindow,
                                                        "utilization", (double) usedTokens / contextWindow)));
      }
    }
    return insights;
  }

  /**
   * Insights about the usage patterns of every entity that has recorded the minimum number of requests.
   *
   * @param cancelled Checked before each entity; analysis stops early once it returns {@code true}.
   * @return Peak hour and prompt ratio insights across entities.
   */
  public List<LlmAnomaly> periodicInsights(BooleanSupplier cancelled) {
    List<LlmAnomaly> insights = new ArrayList<>();
    long nowMs = _time.milliseconds();
    for (Map.Entry<EntityKey, CostPattern> entry : new TreeMap<>(_patternByEntity).entrySet()) {
      if (cancelled.getAsBoolean()) {
        LOG.debug("Periodic cost analysis cancelled.");
        break;
      }
      EntityKey key = entry.getKey();
      CostPattern pattern = entry.getValue().copy();
      if (pattern.requestCount() < _minDataPoints) {
        continue;
      }
      LlmAnomaly peakHourUsage = peakHourUsage(key, pattern, nowMs);
      if (peakHourUsage != null) {
        insights.add(peakHourUsage);
      }
      if (pattern.avgPromptRatio() > PERIODIC_HIGH_PROMPT_RATIO_THRESHOLD) {
        insights.add(new CostOptimizationInsight(key, nowMs, null, CostInsightType.HIGH_PROMPT_RATIO, pattern.avgPromptRatio(),
                                                 PERIODIC_HIGH_PROMPT_RATIO_RECOMMENDATION,
                                                 Map.of("prompt_ratio", pattern.avgPromptRatio())));
      }
    }
    return insights;
  }

  private static LlmAnomaly peakHourUsage(EntityKey key, CostPattern pattern, long nowMs) {
    double[] hourlyCost = pattern.hourlyCost();
    double totalCost = 0.0;
    for (double cost : hourlyCost) {
      totalCost += cost;
    }
    if (totalCost <= 0.0) {
      return null;
    }
    List<Integer> peakHours = new ArrayList<>();
    double peakCost = 0.0;
    for (int hour = 0; hour < hourlyCost.length; hour++) {
      if (hourlyCost[hour] > totalCost * PEAK_HOUR_COST_SHARE) {
        peakHours.add(hour);
        peakCost += hourlyCost[hour];
      }
    }
    if (peakCost > totalCost * PEAK_HOURS_MIN_TOTAL_SHARE && peakHours.size() <= MAX_PEAK_HOURS) {
      double peakCostPercentage = peakCost / totalCost * 100.0;
      return new CostOptimizationInsight(key, nowMs, null, CostInsightType.PEAK_HOUR_USAGE, peakCostPercentage,
                                         CostInsightType.PEAK_HOUR_USAGE.recommendation(),
                                         Map.of("peak_hours", peakHours, "peak_cost_percentage", peakCostPercentage));
    }
    return null;
  }

  /**
   * @return The number of entities with a cost pattern.
   */
  public int numPatterns() {
    return _patternByEntity.size();
  }
}
