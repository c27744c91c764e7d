/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.model;

import com.linkedin.anomalywatch.common.utils.Utils;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;


/**
 * Identifies the entity that telemetry is tracked for: a (provider, model, application) triple.
 */
public final class EntityKey implements Comparable<EntityKey> {
  public static final String ANY_APPLICATION = "*";
  private final String _provider;
  private final String _model;
  private final String _application;

  public EntityKey(String provider, String model, String application) {
    _provider = Utils.validateNotNull(provider, "Provider cannot be null");
    _model = Utils.validateNotNull(model, "Model cannot be null");
    _application = Utils.validateNotNull(application, "Application cannot be null");
  }

  public String provider() {
    return _provider;
  }

  public String model() {
    return _model;
  }

  public String application() {
    return _application;
  }

  /**
   * @return The key shared by all applications that use the same provider and model as this key.
   */
  public EntityKey providerModel() {
    return new EntityKey(_provider, _model, ANY_APPLICATION);
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("provider", _provider);
    structure.put("model", _model);
    structure.put("application", _application);
    return structure;
  }

  @Override
  public int compareTo(EntityKey o) {
    int result = _provider.compareTo(o._provider);
    if (result == 0) {
      result = _model.compareTo(o._model);
    }
    return result == 0 ? _application.compareTo(o._application) : result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    EntityKey that = (EntityKey) o;
    return _provider.equals(that._provider) && _model.equals(that._model) && _application.equals(that._application);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_provider, _model, _application);
  }

  @Override
  public String toString() {
    return String.format("(%s, %s, %s)", _provider, _model, _application);
  }
}
