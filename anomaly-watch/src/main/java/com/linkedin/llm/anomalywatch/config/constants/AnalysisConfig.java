/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.config.constants;

import com.linkedin.anomalywatch.common.config.ConfigDef;
import com.linkedin.llm.anomalywatch.detector.notifier.NoopAnomalyNotifier;
import java.util.concurrent.TimeUnit;

import static com.linkedin.anomalywatch.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep the configs and defaults of the periodic analysis and of anomaly reporting.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class AnalysisConfig {

  private AnalysisConfig() {
  }

  /**
   * <code>periodic.analysis.interval.ms</code>
   */
  public static final String PERIODIC_ANALYSIS_INTERVAL_MS_CONFIG = "periodic.analysis.interval.ms";
  public static final long DEFAULT_PERIODIC_ANALYSIS_INTERVAL_MS = TimeUnit.MINUTES.toMillis(30);
  public static final String PERIODIC_ANALYSIS_INTERVAL_MS_DOC = "The minimum time between two runs of the periodic "
      + "trend, cross application and cost analysis.";

  /**
   * <code>periodic.analysis.shutdown.timeout.ms</code>
   */
  public static final String PERIODIC_ANALYSIS_SHUTDOWN_TIMEOUT_MS_CONFIG = "periodic.analysis.shutdown.timeout.ms";
  public static final long DEFAULT_PERIODIC_ANALYSIS_SHUTDOWN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(5);
  public static final String PERIODIC_ANALYSIS_SHUTDOWN_TIMEOUT_MS_DOC = "The maximum time to wait for an ongoing "
      + "periodic analysis to stop upon shutdown.";

  /**
   * <code>max.tracked.entities.warning.threshold</code>
   */
  public static final String MAX_TRACKED_ENTITIES_WARNING_THRESHOLD_CONFIG = "max.tracked.entities.warning.threshold";
  public static final int DEFAULT_MAX_TRACKED_ENTITIES_WARNING_THRESHOLD = 10000;
  public static final String MAX_TRACKED_ENTITIES_WARNING_THRESHOLD_DOC = "The number of tracked (provider, model, "
      + "application) entities above which a warning is logged. Entities are never evicted.";

  /**
   * <code>anomaly.notifier.class</code>
   */
  public static final String ANOMALY_NOTIFIER_CLASS_CONFIG = "anomaly.notifier.class";
  public static final String DEFAULT_ANOMALY_NOTIFIER_CLASS = NoopAnomalyNotifier.class.getName();
  public static final String ANOMALY_NOTIFIER_CLASS_DOC = "The name of the class that implements AnomalyNotifier and "
      + "receives the reported anomalies.";

  /**
   * Define configs for the periodic analysis and anomaly reporting.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the periodic analysis and anomaly reporting.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(PERIODIC_ANALYSIS_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_PERIODIC_ANALYSIS_INTERVAL_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            PERIODIC_ANALYSIS_INTERVAL_MS_DOC)
                    .define(PERIODIC_ANALYSIS_SHUTDOWN_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_PERIODIC_ANALYSIS_SHUTDOWN_TIMEOUT_MS,
                            atLeast(0),
                            ConfigDef.Importance.LOW,
                            PERIODIC_ANALYSIS_SHUTDOWN_TIMEOUT_MS_DOC)
                    .define(MAX_TRACKED_ENTITIES_WARNING_THRESHOLD_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MAX_TRACKED_ENTITIES_WARNING_THRESHOLD,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            MAX_TRACKED_ENTITIES_WARNING_THRESHOLD_DOC)
                    .define(ANOMALY_NOTIFIER_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_ANOMALY_NOTIFIER_CLASS,
                            ConfigDef.Importance.MEDIUM,
                            ANOMALY_NOTIFIER_CLASS_DOC);
  }
}
