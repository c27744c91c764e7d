/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import java.util.Map;


/**
 * The same error recurring for an entity within a short time.
 */
public class ErrorRateSpike extends LlmAnomaly {
  private final String _errorSignature;
  private final int _count;
  private final long _firstSeenMs;

  /**
   * @param entityKey Entity key.
   * @param detectionTimeMs Detection time.
   * @param event The failed call that completed the pattern.
   * @param errorSignature The truncated error text the occurrences were grouped by.
   * @param count Number of occurrences within the window.
   * @param firstSeenMs Time of the first occurrence within the window.
   */
  public ErrorRateSpike(EntityKey entityKey, long detectionTimeMs, LlmCallEvent event, String errorSignature, int count,
                        long firstSeenMs) {
    super(LlmAnomalyType.ERROR_RATE_SPIKE, entityKey, detectionTimeMs, event);
    _errorSignature = errorSignature;
    _count = count;
    _firstSeenMs = firstSeenMs;
  }

  public String errorSignature() {
    return _errorSignature;
  }

  public int count() {
    return _count;
  }

  public long firstSeenMs() {
    return _firstSeenMs;
  }

  @Override
  protected String signatureDetail() {
    return _errorSignature;
  }

  @Override
  protected void addDetails(Map<String, Object> structure) {
    structure.put("error", event() == null ? _errorSignature : event().error());
    structure.put("count", _count);
    structure.put("first_seen_ms", _firstSeenMs);
  }

  @Override
  public String description() {
    return String.format("Error \"%s\" occurred %d times since %d.", _errorSignature, _count, _firstSeenMs);
  }
}
