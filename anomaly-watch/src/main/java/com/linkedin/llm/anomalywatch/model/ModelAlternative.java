/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.model;

import java.util.LinkedHashMap;
import java.util.Map;


/**
 * A cheaper model that can stand in for a more expensive one.
 */
public final class ModelAlternative {
  private final String _model;
  private final double _costRatio;
  private final double _capabilityRatio;

  /**
   * @param model Name of the alternative model.
   * @param costRatio Cost of the alternative relative to the original model.
   * @param capabilityRatio Capability of the alternative relative to the original model.
   */
  public ModelAlternative(String model, double costRatio, double capabilityRatio) {
    _model = model;
    _costRatio = costRatio;
    _capabilityRatio = capabilityRatio;
  }

  public String model() {
    return _model;
  }

  public double costRatio() {
    return _costRatio;
  }

  public double capabilityRatio() {
    return _capabilityRatio;
  }

  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("model", _model);
    structure.put("cost_ratio", _costRatio);
    structure.put("capability_ratio", _capabilityRatio);
    return structure;
  }

  @Override
  public String toString() {
    return String.format("%s(cost=%.2f, capability=%.2f)", _model, _costRatio, _capabilityRatio);
  }
}
