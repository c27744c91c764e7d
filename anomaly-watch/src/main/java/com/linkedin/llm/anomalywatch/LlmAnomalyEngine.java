/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.anomalywatch.monitor.series.MetricPoint;
import com.linkedin.anomalywatch.monitor.series.MetricSeriesStore;
import com.linkedin.anomalywatch.monitor.series.SeriesStatistics;
import com.linkedin.anomalywatch.monitor.series.SeriesSummary;
import com.linkedin.llm.anomalywatch.common.LlmAnomalyWatchThreadFactory;
import com.linkedin.llm.anomalywatch.config.LlmAnomalyWatchConfig;
import com.linkedin.llm.anomalywatch.config.constants.AnalysisConfig;
import com.linkedin.llm.anomalywatch.config.constants.DetectorConfig;
import com.linkedin.llm.anomalywatch.detector.AnomalyDeduplicator;
import com.linkedin.llm.anomalywatch.detector.CorrelationDetector;
import com.linkedin.llm.anomalywatch.detector.CorrelationMatrix;
import com.linkedin.llm.anomalywatch.detector.CostPatternAnalyzer;
import com.linkedin.llm.anomalywatch.detector.ErrorPatternTracker;
import com.linkedin.llm.anomalywatch.detector.PeriodicAnalyzer;
import com.linkedin.llm.anomalywatch.detector.SeasonalTrendDetector;
import com.linkedin.llm.anomalywatch.detector.StatisticalDetector;
import com.linkedin.llm.anomalywatch.detector.anomaly.ErrorRateSpike;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomaly;
import com.linkedin.llm.anomalywatch.detector.anomaly.LlmAnomalyType;
import com.linkedin.llm.anomalywatch.detector.notifier.AnomalyNotifier;
import com.linkedin.llm.anomalywatch.model.CostPattern;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import com.linkedin.llm.anomalywatch.model.ModelCatalog;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalywatch.common.utils.Utils.validateNotNull;


/**
 * The anomaly detection engine of LLM call telemetry. It keeps the recent metrics of each (provider, model,
 * application) entity and runs the detectors over them:
 * <ul>
 *   <li>{@link #addMetric(String, double, LlmCallEvent)} records the metrics of an event.</li>
 *   <li>{@link #detectAnomalies(LlmCallEvent)} checks the event against the recorded metrics of its entity.</li>
 *   <li>{@link #performPeriodicAnalysis()} runs the analysis across entities, either when called or on the schedule
 *   started by {@link #startPeriodicAnalysis(AnomalyNotifier)}.</li>
 * </ul>
 * Metrics of an entity must be added and checked by a single thread in arrival order. The periodic analysis may run
 * concurrently with ingestion.
 */
public class LlmAnomalyEngine {
  private static final Logger LOG = LoggerFactory.getLogger(LlmAnomalyEngine.class);
  public static final String ANOMALY_WATCH_SENSOR = "AnomalyWatch";
  static final long MAX_PERIODIC_CHECK_INTERVAL_MS = TimeUnit.MINUTES.toMillis(1);
  private final MetricSeriesStore<MetricType, EntityKey, LlmCallEvent> _store;
  private final StatisticalDetector _statisticalDetector;
  private final SeasonalTrendDetector _seasonalTrendDetector;
  private final CorrelationDetector _correlationDetector;
  private final CostPatternAnalyzer _costPatternAnalyzer;
  private final ErrorPatternTracker _errorPatternTracker;
  private final AnomalyDeduplicator _deduplicator;
  private final PeriodicAnalyzer _periodicAnalyzer;
  private final long _periodicAnalysisIntervalMs;
  private final long _shutdownTimeoutMs;
  private final int _maxTrackedEntitiesWarningThreshold;
  private final Map<LlmAnomalyType, Meter> _anomalyRateByType;
  private final Meter _suppressedDuplicateRate;
  private final Timer _periodicAnalysisTimer;
  private final Object _schedulerLock;
  private ScheduledExecutorService _periodicAnalysisScheduler;
  private volatile boolean _shutdown;
  private volatile boolean _tooManyEntitiesReported;

  /**
   * @param config The engine configuration.
   * @param modelCatalog The catalog of model alternatives and context windows used by cost insights.
   * @param dropwizardMetricRegistry The metric registry that holds the sensors of the engine.
   * @param time The clock of detection times, cooldowns and the periodic analysis cadence.
   */
  public LlmAnomalyEngine(LlmAnomalyWatchConfig config, ModelCatalog modelCatalog, MetricRegistry dropwizardMetricRegistry,
                          Time time) {
    validateNotNull(config, "The engine configuration cannot be null.");
    validateNotNull(modelCatalog, "The model catalog cannot be null.");
    validateNotNull(dropwizardMetricRegistry, "The metric registry cannot be null.");
    validateNotNull(time, "The time cannot be null.");
    int windowSize = config.getInt(DetectorConfig.WINDOW_SIZE_CONFIG);
    int minDataPoints = config.getInt(DetectorConfig.MIN_DATA_POINTS_CONFIG);
    double sensitivity = config.getDouble(DetectorConfig.ALERT_SENSITIVITY_CONFIG);

    _store = new MetricSeriesStore<>(config.getInt(DetectorConfig.LOOKBACK_PERIOD_CONFIG));
    _statisticalDetector = new StatisticalDetector(_store, config.statisticalDetectorMetrics(), windowSize, minDataPoints,
                                                   sensitivity, time);
    _seasonalTrendDetector = new SeasonalTrendDetector(_store, config.getInt(DetectorConfig.SEASONAL_PERIOD_CONFIG),
                                                       sensitivity, time);
    _correlationDetector = new CorrelationDetector(_store,
                                                   config.correlationMetricPairs(),
                                                   config.getInt(DetectorConfig.CORRELATION_RECOMPUTE_INTERVAL_POINTS_CONFIG),
                                                   config.getDouble(DetectorConfig.CORRELATION_STRENGTH_THRESHOLD_CONFIG),
                                                   windowSize,
                                                   minDataPoints,
                                                   sensitivity,
                                                   time);
    _costPatternAnalyzer = new CostPatternAnalyzer(modelCatalog, minDataPoints, time);
    int dedupCacheMaxSize = config.getInt(DetectorConfig.ANOMALY_DEDUP_CACHE_MAX_SIZE_CONFIG);
    long errorRateAlertCooldownMs = config.getLong(DetectorConfig.ERROR_RATE_ALERT_COOLDOWN_MS_CONFIG);
    _errorPatternTracker = new ErrorPatternTracker(config.getInt(DetectorConfig.ERROR_PATTERN_MIN_OCCURRENCES_CONFIG),
                                                   config.getLong(DetectorConfig.ERROR_PATTERN_WINDOW_MS_CONFIG),
                                                   errorRateAlertCooldownMs,
                                                   dedupCacheMaxSize,
                                                   time);
    _deduplicator = new AnomalyDeduplicator(Duration.ofMillis(config.getLong(DetectorConfig.ANOMALY_DEDUP_COOLDOWN_MS_CONFIG)),
                                            Duration.ofMillis(errorRateAlertCooldownMs),
                                            dedupCacheMaxSize,
                                            time);
    _periodicAnalysisIntervalMs = config.getLong(AnalysisConfig.PERIODIC_ANALYSIS_INTERVAL_MS_CONFIG);
    _periodicAnalyzer = new PeriodicAnalyzer(_store, _costPatternAnalyzer, _periodicAnalysisIntervalMs, windowSize,
                                             minDataPoints, sensitivity, time);
    _shutdownTimeoutMs = config.getLong(AnalysisConfig.PERIODIC_ANALYSIS_SHUTDOWN_TIMEOUT_MS_CONFIG);
    _maxTrackedEntitiesWarningThreshold = config.getInt(AnalysisConfig.MAX_TRACKED_ENTITIES_WARNING_THRESHOLD_CONFIG);

    _anomalyRateByType = new EnumMap<>(LlmAnomalyType.class);
    for (LlmAnomalyType anomalyType : LlmAnomalyType.cachedValues()) {
      _anomalyRateByType.put(anomalyType,
                             dropwizardMetricRegistry.meter(MetricRegistry.name(ANOMALY_WATCH_SENSOR, anomalyType.typeName() + "-rate")));
    }
    _suppressedDuplicateRate = dropwizardMetricRegistry.meter(MetricRegistry.name(ANOMALY_WATCH_SENSOR, "suppressed-duplicate-rate"));
    _periodicAnalysisTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(ANOMALY_WATCH_SENSOR, "periodic-analysis-timer"));
    dropwizardMetricRegistry.register(MetricRegistry.name(ANOMALY_WATCH_SENSOR, "tracked-entities"),
                                      (Gauge<Integer>) _store::numEntities);
    _schedulerLock = new Object();
    _periodicAnalysisScheduler = null;
    _shutdown = false;
    _tooManyEntitiesReported = false;
  }

  /**
   * Record one metric of the given event. Recording {@link MetricType#TOTAL_TOKENS} also records the
   * {@link MetricType#TOKEN_RATIO} of the event when it is defined, and recording {@link MetricType#ESTIMATED_COST} also
   * updates the cost pattern of the entity.
   *
   * @param metricName Name of a directly reported metric, e.g. <code>inference_time</code>.
   * @param value Value of the metric.
   * @param event The event carrying the metric.
   * @return {@code true} if the metric was recorded, {@code false} if the metric name is unknown or names a derived
   * metric.
   */
  public boolean addMetric(String metricName, double value, LlmCallEvent event) {
    MetricType metricType = MetricType.forName(metricName);
    if (metricType == null || metricType.isDerived()) {
      LOG.debug("Ignore metric {} of request {}: not a reported metric.", metricName, event.requestId());
      return false;
    }
    addPoint(metricType, value, event);
    if (metricType == MetricType.TOTAL_TOKENS) {
      Double tokenRatio = event.tokenRatio();
      if (tokenRatio != null) {
        addPoint(MetricType.TOKEN_RATIO, tokenRatio, event);
      }
    } else if (metricType == MetricType.ESTIMATED_COST) {
      _costPatternAnalyzer.record(value, event);
    }
    checkNumTrackedEntities();
    return true;
  }

  /**
   * Record every reported metric carried by the given event.
   *
   * @param event The event.
   */
  public void addEvent(LlmCallEvent event) {
    for (Map.Entry<MetricType, Double> entry : event.reportedMetrics().entrySet()) {
      addMetric(entry.getKey().metricName(), entry.getValue(), event);
    }
  }

  private void addPoint(MetricType metricType, double value, LlmCallEvent event) {
    _store.add(metricType, event.entityKey(), value, event, event.timestampMs());
    _correlationDetector.onPointAdded(event.entityKey());
  }

  private void checkNumTrackedEntities() {
    if (_tooManyEntitiesReported) {
      return;
    }
    int numEntities = _store.numEntities();
    if (numEntities > _maxTrackedEntitiesWarningThreshold) {
      _tooManyEntitiesReported = true;
      LOG.warn("Tracking {} entities, which exceeds the warning threshold {}. Retained metrics of entities are never "
               + "evicted.", numEntities, _maxTrackedEntitiesWarningThreshold);
    }
  }

  /**
   * Check the given event against the recorded metrics of its entity. The metrics of the event are expected to have been
   * recorded with {@link #addMetric(String, double, LlmCallEvent)} before. A failing detector is logged and does not
   * prevent the other detectors from running.
   *
   * @param event The current event.
   * @return The anomalies found on the event that were not reported within their cooldown, most urgent first.
   */
  public List<LlmAnomaly> detectAnomalies(LlmCallEvent event) {
    List<LlmAnomaly> anomalies = new ArrayList<>();
    try {
      anomalies.addAll(_statisticalDetector.detect(event));
    } catch (RuntimeException e) {
      LOG.error("Statistical detection failed for request {}.", event.requestId(), e);
    }
    try {
      LlmAnomaly seasonalAnomaly = _seasonalTrendDetector.detect(event);
      if (seasonalAnomaly != null) {
        anomalies.add(seasonalAnomaly);
      }
    } catch (RuntimeException e) {
      LOG.error("Seasonal detection failed for request {}.", event.requestId(), e);
    }
    try {
      anomalies.addAll(_correlationDetector.detect(event));
    } catch (RuntimeException e) {
      LOG.error("Correlation detection failed for request {}.", event.requestId(), e);
    }
    try {
      anomalies.addAll(_costPatternAnalyzer.insights(event));
    } catch (RuntimeException e) {
      LOG.error("Cost pattern analysis failed for request {}.", event.requestId(), e);
    }
    try {
      ErrorRateSpike errorRateSpike = _errorPatternTracker.record(event);
      if (errorRateSpike != null) {
        anomalies.add(errorRateSpike);
      }
    } catch (RuntimeException e) {
      LOG.error("Error pattern tracking failed for request {}.", event.requestId(), e);
    }
    return report(anomalies);
  }

  /**
   * Run the analysis across entities if it is due, see {@link PeriodicAnalyzer}.
   *
   * @return The anomalies found that were not reported within their cooldown, empty if the analysis is not due.
   */
  public List<LlmAnomaly> performPeriodicAnalysis() {
    final Timer.Context ctx = _periodicAnalysisTimer.time();
    try {
      return report(_periodicAnalyzer.analyze(() -> _shutdown));
    } finally {
      ctx.stop();
      _deduplicator.removeExpiredSignatures();
    }
  }

  private List<LlmAnomaly> report(List<LlmAnomaly> anomalies) {
    if (anomalies.isEmpty()) {
      return Collections.emptyList();
    }
    List<LlmAnomaly> toReport = new ArrayList<>(_deduplicator.deduplicate(anomalies));
    _suppressedDuplicateRate.mark(anomalies.size() - toReport.size());
    toReport.sort(Comparator.comparingInt(anomaly -> anomaly.anomalyType().priority()));
    for (LlmAnomaly anomaly : toReport) {
      _anomalyRateByType.get(anomaly.anomalyType()).mark();
      LOG.debug("Detected {}.", anomaly);
    }
    return toReport;
  }

  /**
   * Start running the periodic analysis in the background, delivering its anomalies to the given notifier. The analysis
   * is attempted at least once per minute and runs whenever its interval has elapsed.
   *
   * @param notifier The notifier of the anomalies found by the periodic analysis.
   */
  public void startPeriodicAnalysis(AnomalyNotifier notifier) {
    validateNotNull(notifier, "The anomaly notifier cannot be null.");
    synchronized (_schedulerLock) {
      if (_shutdown) {
        throw new IllegalStateException("The anomaly engine has been shut down.");
      }
      if (_periodicAnalysisScheduler != null) {
        throw new IllegalStateException("The periodic analysis has already been started.");
      }
      long checkIntervalMs = Math.max(1L, Math.min(_periodicAnalysisIntervalMs, MAX_PERIODIC_CHECK_INTERVAL_MS));
      _periodicAnalysisScheduler = Executors.newSingleThreadScheduledExecutor(
          new LlmAnomalyWatchThreadFactory("PeriodicAnomalyAnalyzer", true, LOG));
      _periodicAnalysisScheduler.scheduleWithFixedDelay(() -> runPeriodicAnalysis(notifier), checkIntervalMs,
                                                        checkIntervalMs, TimeUnit.MILLISECONDS);
      LOG.info("Periodic analysis started with interval {} ms.", _periodicAnalysisIntervalMs);
    }
  }

  private void runPeriodicAnalysis(AnomalyNotifier notifier) {
    List<LlmAnomaly> anomalies;
    try {
      anomalies = performPeriodicAnalysis();
    } catch (RuntimeException e) {
      LOG.error("Periodic analysis failed.", e);
      return;
    }
    if (anomalies.isEmpty() || _shutdown) {
      return;
    }
    try {
      notifier.onAnomalies(anomalies);
    } catch (RuntimeException e) {
      LOG.error("Failed to deliver {} anomalies found by the periodic analysis.", anomalies.size(), e);
    }
  }

  /**
   * Stop the periodic analysis. An ongoing analysis is cancelled and waited for at most
   * <code>periodic.analysis.shutdown.timeout.ms</code>.
   */
  public void shutdown() {
    LOG.info("Shutting down anomaly engine.");
    ScheduledExecutorService scheduler;
    synchronized (_schedulerLock) {
      _shutdown = true;
      scheduler = _periodicAnalysisScheduler;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(_shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
          LOG.warn("The periodic analysis failed to shutdown in {} ms.", _shutdownTimeoutMs);
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        LOG.warn("Interrupted while waiting for the periodic analysis to shutdown.");
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    LOG.info("Anomaly engine shutdown completed.");
  }

  /**
   * @return {@code true} if the engine has been shut down.
   */
  public boolean isShutdown() {
    return _shutdown;
  }

  /**
   * @param key Entity key.
   * @param metricType Metric type.
   * @return Summary statistics over the retained values of the given metric of the given entity, or {@code null} if
   * there is no retained value.
   */
  public SeriesSummary metricSummary(EntityKey key, MetricType metricType) {
    List<MetricPoint<LlmCallEvent>> points = _store.snapshot(metricType, key);
    if (points.isEmpty()) {
      return null;
    }
    return SeriesStatistics.summarize(SeriesStatistics.values(points));
  }

  /**
   * @param key Entity key.
   * @return A copy of the cost pattern of the given entity, or {@code null} if no cost was recorded for it.
   */
  public CostPattern costPattern(EntityKey key) {
    return _costPatternAnalyzer.costPattern(key);
  }

  /**
   * @param key Entity key.
   * @return The latest correlation matrix of the given entity, or {@code null} if none has been computed.
   */
  public CorrelationMatrix correlationMatrix(EntityKey key) {
    return _correlationDetector.correlationMatrix(key);
  }

  /**
   * @return The number of entities with retained metrics.
   */
  public int numTrackedEntities() {
    return _store.numEntities();
  }

  /**
   * Package private for unit test.
   */
  boolean tooManyEntitiesReported() {
    return _tooManyEntitiesReported;
  }
}
