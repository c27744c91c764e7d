/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

/**
 * The kinds of cost optimization opportunities.
 */
public enum CostInsightType {
  HIGH_PROMPT_RATIO("high_prompt_ratio", "Consider optimizing prompts to reduce token usage."),
  MODEL_ALTERNATIVE("model_alternative", "Consider using an alternative model with similar capabilities but lower cost."),
  UNDERUTILIZED_CONTEXT("underutilized_context", "Consider batching requests to more efficiently use the model's context window."),
  PEAK_HOUR_USAGE("peak_hour_usage", "Consider optimizing workloads to avoid peak hours.");

  private final String _subtype;
  private final String _recommendation;

  CostInsightType(String subtype, String recommendation) {
    _subtype = subtype;
    _recommendation = recommendation;
  }

  public String subtype() {
    return _subtype;
  }

  public String recommendation() {
    return _recommendation;
  }

  @Override
  public String toString() {
    return _subtype;
  }
}
