/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.notifier;

import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import java.util.List;
import java.util.Map;


/**
 * A no-op notifier.
 */
public class NoopAnomalyNotifier implements AnomalyNotifier {

  @Override
  public void onAnomalies(List<LlmAnomaly> anomalies) {

  }

  @Override
  public void configure(Map<String, ?> configs) {

  }
}
