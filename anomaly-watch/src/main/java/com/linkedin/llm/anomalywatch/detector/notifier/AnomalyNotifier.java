/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.notifier;

import com.linkedin.anomalywatch.common.AnomalyWatchConfigurable;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import java.util.List;
import org.apache.kafka.common.annotation.InterfaceStability;


/**
 * An interface to deliver the anomalies found on LLM call telemetry, e.g. to an alerting or storage system.
 * Implementations are instantiated by reflection from <code>anomaly.notifier.class</code> and must have a public
 * no-argument constructor.
 */
@InterfaceStability.Evolving
public interface AnomalyNotifier extends AnomalyWatchConfigurable {

  /**
   * Called with the deduplicated anomalies found on an event or by a periodic analysis. Never called with an empty list.
   * The method may be called from the ingestion thread and from the periodic analysis thread.
   *
   * @param anomalies The anomalies to deliver, most urgent first.
   */
  void onAnomalies(List<LlmAnomaly> anomalies);
}
