/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * An opportunity to reduce the cost of an entity. Unlike other anomalies, an insight is advisory.
 */
public class CostOptimizationInsight extends LlmAnomaly {
  private final CostInsightType _insightType;
  private final double _value;
  private final String _recommendation;
  private final Map<String, Object> _details;

  /**
   * @param entityKey Entity key.
   * @param detectionTimeMs Detection time.
   * @param event Triggering event, or {@code null} for insights of the periodic analysis.
   * @param insightType The kind of optimization opportunity.
   * @param value The value that exhibits the opportunity.
   * @param recommendation What to do about it.
   * @param details Insight specific details, keyed by their JSON field names.
   */
  public CostOptimizationInsight(EntityKey entityKey, long detectionTimeMs, LlmCallEvent event, CostInsightType insightType,
                                 double value, String recommendation, Map<String, Object> details) {
    super(LlmAnomalyType.COST_OPTIMIZATION, entityKey, detectionTimeMs, event);
    _insightType = insightType;
    _value = value;
    _recommendation = recommendation;
    _details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public CostInsightType insightType() {
    return _insightType;
  }

  public double value() {
    return _value;
  }

  public String recommendation() {
    return _recommendation;
  }

  public Map<String, Object> details() {
    return _details;
  }

  @Override
  protected String signatureDetail() {
    return _insightType.subtype();
  }

  @Override
  protected void addDetails(Map<String, Object> structure) {
    structure.put("subtype", _insightType.subtype());
    structure.put("value", _value);
    structure.putAll(_details);
    structure.put("recommendation", _recommendation);
  }

  @Override
  public String description() {
    return String.format("Cost optimization opportunity %s (value %.4f). %s", _insightType, _value, _recommendation);
  }
}
