/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.ingestion;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.linkedin.anomalywatch.exception.AnomalyWatchException;
import com.linkedin.llm.anomalywatch.LlmAnomalyEngine;
import com.linkedin.llm.anomalywatch.config.LlmAnomalyWatchConfig;
import com.linkedin.llm.anomalywatch.config.constants.AnalysisConfig;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.detector.notifier.AnomalyNotifier;
import com.linkedin.llm.anomalywatch.exception.MalformedEventException;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.ModelCatalog;
import java.util.Collections;
import java.util.List;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.llm.anomalywatch.LlmAnomalyEngine.ANOMALY_WATCH_SENSOR;


/**
 * Feeds decoded telemetry events to the {@link LlmAnomalyEngine} and delivers what it finds to the
 * {@link AnomalyNotifier}. The transport that consumes the events is responsible for calling
 * {@link #process(String)} from a single thread in arrival order.
 */
public class TelemetryEventProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(TelemetryEventProcessor.class);
  private final LlmAnomalyEngine _engine;
  private final AnomalyNotifier _notifier;
  private final Meter _malformedEventRate;
  private final Meter _notificationFailureRate;

  /**
   * Create the engine and the notifier configured by <code>anomaly.notifier.class</code>.
   *
   * @param config The engine configuration.
   * @param modelCatalog The catalog of model alternatives and context windows.
   * @param dropwizardMetricRegistry The metric registry that holds the sensors.
   * @param time The clock of the engine.
   * @throws AnomalyWatchException If the notifier cannot be instantiated.
   */
  public TelemetryEventProcessor(LlmAnomalyWatchConfig config, ModelCatalog modelCatalog, MetricRegistry dropwizardMetricRegistry,
                                 Time time) throws AnomalyWatchException {
    this(new LlmAnomalyEngine(config, modelCatalog, dropwizardMetricRegistry, time),
         config.getConfiguredInstance(AnalysisConfig.ANOMALY_NOTIFIER_CLASS_CONFIG, AnomalyNotifier.class),
         dropwizardMetricRegistry);
  }

  /**
   * Package private for unit test.
   */
  TelemetryEventProcessor(LlmAnomalyEngine engine, AnomalyNotifier notifier, MetricRegistry dropwizardMetricRegistry) {
    _engine = engine;
    _notifier = notifier;
    _malformedEventRate = dropwizardMetricRegistry.meter(MetricRegistry.name(ANOMALY_WATCH_SENSOR, "malformed-event-rate"));
    _notificationFailureRate = dropwizardMetricRegistry.meter(MetricRegistry.name(ANOMALY_WATCH_SENSOR, "notification-failure-rate"));
  }

  /**
   * Start the periodic analysis, delivering its findings to the notifier of this processor.
   */
  public void start() {
    _engine.startPeriodicAnalysis(_notifier);
  }

  /**
   * Decode and process one JSON encoded event. A malformed event is logged and skipped.
   *
   * @param json JSON encoded event.
   * @return The anomalies found on the event, empty if the event is malformed.
   */
  public List<LlmAnomaly> process(String json) {
    LlmCallEvent event;
    try {
      event = LlmCallEventParser.parse(json);
    } catch (MalformedEventException e) {
      _malformedEventRate.mark();
      LOG.warn("Skip malformed telemetry event: {}", e.getMessage());
      return Collections.emptyList();
    }
    return process(event);
  }

  /**
   * Record the metrics of the given event, check it for anomalies and deliver them to the notifier. A failure of the
   * notifier is logged and does not affect the engine.
   *
   * @param event A valid event.
   * @return The anomalies found on the event.
   */
  public List<LlmAnomaly> process(LlmCallEvent event) {
    _engine.addEvent(event);
    List<LlmAnomaly> anomalies = _engine.detectAnomalies(event);
    if (!anomalies.isEmpty()) {
      try {
        _notifier.onAnomalies(anomalies);
      } catch (RuntimeException e) {
        _notificationFailureRate.mark();
        LOG.error("Failed to deliver {} anomalies found on request {}.", anomalies.size(), event.requestId(), e);
      }
    }
    return anomalies;
  }

  /**
   * Stop the periodic analysis.
   */
  public void shutdown() {
    _engine.shutdown();
  }

  /**
   * @return The engine of this processor.
   */
  public LlmAnomalyEngine engine() {
    return _engine;
  }
}
