/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch;

import com.linkedin.llm.anomalywatch.config.LlmAnomalyWatchConfig;
import com.linkedin.llm.anomalywatch.exception.MalformedEventException;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;


/**
 * A test util class.
 */
public final class LlmAnomalyWatchUnitTestUtils {
  public static final String PROVIDER = "openai";
  // Not in the default model catalog, so no model specific cost insight is reported.
  public static final String MODEL = "test-model";
  public static final EntityKey ENTITY = new EntityKey(PROVIDER, MODEL, "chat");
  // 2023-11-14T22:00:00Z, aligned to the hour.
  public static final long BASE_TIME_MS = 472_222L * TimeUnit.HOURS.toMillis(1);
  private static final AtomicLong REQUEST_ID = new AtomicLong(0L);

  private LlmAnomalyWatchUnitTestUtils() {

  }

  /**
   * @param overrides Configs to set, on top of the defaults.
   * @return The engine configuration.
   */
  public static LlmAnomalyWatchConfig config(Map<String, Object> overrides) {
    return new LlmAnomalyWatchConfig(new HashMap<>(overrides), false);
  }

  /**
   * @return A builder of a successful call with 100 prompt tokens, 50 completion tokens and a cost of 0.01.
   */
  public static LlmCallEvent.Builder eventBuilder(EntityKey entityKey, long timestampMs, double inferenceTime) {
    return LlmCallEvent.builder()
                       .requestId("req-" + REQUEST_ID.incrementAndGet())
                       .timestampMs(timestampMs)
                       .entity(entityKey)
                       .inferenceTime(inferenceTime)
                       .succeeded(100, 50, 0.01);
  }

  public static LlmCallEvent event(EntityKey entityKey, long timestampMs, double inferenceTime) throws MalformedEventException {
    return eventBuilder(entityKey, timestampMs, inferenceTime).build();
  }

  public static LlmCallEvent failedEvent(EntityKey entityKey, long timestampMs, String error) throws MalformedEventException {
    return LlmCallEvent.builder()
                       .requestId("req-" + REQUEST_ID.incrementAndGet())
                       .timestampMs(timestampMs)
                       .entity(entityKey)
                       .inferenceTime(0.5)
                       .failed(100, error)
                       .build();
  }
}
