/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.anomalywatch.AnomalyWatchUtils;
import com.linkedin.anomalywatch.common.utils.Utils;
import com.linkedin.anomalywatch.detector.Anomaly;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;


/**
 * The base class of anomalies found in LLM call telemetry. Anomalies are immutable.
 * <p>
 * Anomalies found while processing an event carry that event; anomalies found by the periodic analysis do not.
 */
public abstract class LlmAnomaly implements Anomaly {
  private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();
  protected static final String SIGNATURE_SEPARATOR = "|";
  private final String _anomalyId;
  private final LlmAnomalyType _anomalyType;
  private final EntityKey _entityKey;
  private final long _detectionTimeMs;
  private final LlmCallEvent _event;

  protected LlmAnomaly(LlmAnomalyType anomalyType, EntityKey entityKey, long detectionTimeMs, LlmCallEvent event) {
    _anomalyId = UUID.randomUUID().toString();
    _anomalyType = Utils.validateNotNull(anomalyType, "Anomaly type cannot be null");
    _entityKey = Utils.validateNotNull(entityKey, "Entity key cannot be null");
    _detectionTimeMs = detectionTimeMs;
    _event = event;
  }

  @Override
  public String anomalyId() {
    return _anomalyId;
  }

  @Override
  public LlmAnomalyType anomalyType() {
    return _anomalyType;
  }

  @Override
  public long detectionTimeMs() {
    return _detectionTimeMs;
  }

  public EntityKey entityKey() {
    return _entityKey;
  }

  /**
   * @return The event that triggered this anomaly, or {@code null} if it was found by the periodic analysis.
   */
  public LlmCallEvent event() {
    return _event;
  }

  /**
   * @return The time of the triggering event, or the detection time if there is no triggering event.
   */
  public long eventTimeMs() {
    return _event == null ? _detectionTimeMs : _event.timestampMs();
  }

  /**
   * @return The part of the signature that distinguishes anomalies of the same type on the same entity.
   */
  protected abstract String signatureDetail();

  /**
   * Add the type specific details of this anomaly to the given JSON structure.
   *
   * @param structure The JSON structure to populate.
   */
  protected abstract void addDetails(Map<String, Object> structure);

  @Override
  public String signature() {
    return _anomalyType.typeName() + SIGNATURE_SEPARATOR + _entityKey + SIGNATURE_SEPARATOR + signatureDetail();
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("anomaly_id", _anomalyId);
    structure.put("type", _anomalyType.typeName());
    structure.putAll(_entityKey.getJsonStructure());
    structure.put("detection_time_ms", _detectionTimeMs);
    structure.put("detection_time", AnomalyWatchUtils.utcDateFor(_detectionTimeMs));
    structure.put("event_time_ms", eventTimeMs());
    addDetails(structure);
    structure.put("description", description());
    if (_event != null) {
      structure.put("metadata", _event.getJsonStructure());
    }
    return structure;
  }

  /**
   * @return The JSON representation of this anomaly.
   */
  public String toJson() {
    return GSON.toJson(getJsonStructure());
  }

  @Override
  public String toString() {
    return String.format("{%s, id=%s, entity=%s, %s}", _anomalyType, _anomalyId, _entityKey, description());
  }
}
