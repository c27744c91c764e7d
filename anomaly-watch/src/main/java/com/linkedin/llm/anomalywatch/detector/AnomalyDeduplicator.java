/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomalyType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Suppresses anomalies whose signature was already reported within its cooldown.
 * <p>
 * The cache of reported signatures is bounded: once full, the signature reported the longest time ago is forgotten
 * first, so a forgotten signature may be reported again before its cooldown elapses.
 */
public class AnomalyDeduplicator {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyDeduplicator.class);
  private final Duration _cooldown;
  private final Duration _errorRateCooldown;
  private final Time _time;
  private final Map<String, Long> _reportTimeBySignature;

  /**
   * @param cooldown Cooldown of anomaly signatures.
   * @param errorRateCooldown Cooldown of {@link LlmAnomalyType#ERROR_RATE_SPIKE} signatures.
   * @param maxCacheSize Maximum number of remembered signatures.
   * @param time The clock cooldowns are measured with.
   */
  public AnomalyDeduplicator(Duration cooldown, Duration errorRateCooldown, int maxCacheSize, Time time) {
    _cooldown = cooldown;
    _errorRateCooldown = errorRateCooldown;
    _time = time;
    _reportTimeBySignature = new LinkedHashMap<>() {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Long> eldest) {
        return this.size() > maxCacheSize;
      }
    };
  }

  /**
   * Drop the anomalies whose signature is within its cooldown, and record the signatures of the remaining ones. Of
   * several anomalies with the same signature in one batch, only the first is kept.
   *
   * @param anomalies Anomalies to deduplicate.
   * @return The anomalies to report, in their original order.
   */
  public synchronized List<LlmAnomaly> deduplicate(List<LlmAnomaly> anomalies) {
    List<LlmAnomaly> toReport = new ArrayList<>(anomalies.size());
    long nowMs = _time.milliseconds();
    for (LlmAnomaly anomaly : anomalies) {
      String signature = anomaly.signature();
      Long lastReportMs = _reportTimeBySignature.get(signature);
      if (lastReportMs != null && nowMs - lastReportMs < cooldownFor(anomaly).toMillis()) {
        LOG.debug("Suppressed duplicate anomaly {} reported at {}.", signature, lastReportMs);
        continue;
      }
      // Re-insert so that the eviction order follows the last report time.
      _reportTimeBySignature.remove(signature);
      _reportTimeBySignature.put(signature, nowMs);
      toReport.add(anomaly);
    }
    return toReport;
  }

  private Duration cooldownFor(LlmAnomaly anomaly) {
    return anomaly.anomalyType() == LlmAnomalyType.ERROR_RATE_SPIKE ? _errorRateCooldown : _cooldown;
  }

  /**
   * Forget the signatures whose cooldown has elapsed.
   */
  public synchronized void removeExpiredSignatures() {
    long nowMs = _time.milliseconds();
    long maxCooldownMs = Math.max(_cooldown.toMillis(), _errorRateCooldown.toMillis());
    if (_reportTimeBySignature.entrySet().removeIf(entry -> entry.getValue() + maxCooldownMs <= nowMs)) {
      LOG.debug("Remaining signatures in deduplication cache: {}.", _reportTimeBySignature.size());
    }
  }

  /**
   * Package private for unit test.
   * @return Report time by signature.
   */
  synchronized Map<String, Long> reportTimeBySignature() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(_reportTimeBySignature));
  }
}
