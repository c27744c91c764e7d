/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.notifier;

import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A notifier that logs the JSON of each anomaly. The anomalies of the most urgent type are logged at WARN, the others at
 * INFO. Use the logger <code>LlmAnomalyLogger</code> to route them to a dedicated appender.
 */
public class LoggingAnomalyNotifier implements AnomalyNotifier {
  private static final Logger ANOMALY_LOG = LoggerFactory.getLogger("LlmAnomalyLogger");
  static final int WARN_PRIORITY_THRESHOLD = 0;
  private long _numNotified;

  @Override
  public synchronized void onAnomalies(List<LlmAnomaly> anomalies) {
    for (LlmAnomaly anomaly : anomalies) {
      if (anomaly.anomalyType().priority() <= WARN_PRIORITY_THRESHOLD) {
        ANOMALY_LOG.warn("{}", anomaly.toJson());
      } else {
        ANOMALY_LOG.info("{}", anomaly.toJson());
      }
    }
    _numNotified += anomalies.size();
  }

  /**
   * @return The number of anomalies logged so far.
   */
  public synchronized long numNotified() {
    return _numNotified;
  }

  @Override
  public void configure(Map<String, ?> configs) {

  }
}
