/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.detector;

public interface AnomalyType {

  /**
   * Get the priority of the anomaly type.
   * The smaller the value is, the higher priority the anomaly has.
   *
   * @return The priority value.
   */
  int priority();

  /**
   * @return The external name of the anomaly type, as it appears in serialized findings.
   */
  String typeName();
}
