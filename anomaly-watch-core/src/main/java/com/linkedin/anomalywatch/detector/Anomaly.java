/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.detector;

/**
 * A finding surfaced by one of the detectors. Anomalies are immutable once created.
 */
public interface Anomaly {

  /**
   * @return A unique identifier for the anomaly.
   */
  String anomalyId();

  /**
   * Get the type of anomaly.
   *
   * @return The type of anomaly.
   */
  AnomalyType anomalyType();

  /**
   * Get the detection time of anomaly.
   *
   * @return The detection time of anomaly.
   */
  long detectionTimeMs();

  /**
   * Get the key under which repeated findings of the same kind are considered duplicates of each other.
   *
   * @return The deduplication signature of this anomaly.
   */
  String signature();

  /**
   * @return A human readable description of the anomaly.
   */
  String description();
}
