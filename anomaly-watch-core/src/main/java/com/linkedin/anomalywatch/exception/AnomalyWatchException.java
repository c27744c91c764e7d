/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.exception;

/**
 * Base class for checked exceptions raised while processing telemetry or running detection.
 */
public class AnomalyWatchException extends Exception {

  public AnomalyWatchException(String message, Throwable cause) {
    super(message, cause);
  }

  public AnomalyWatchException(String message) {
    super(message);
  }

  public AnomalyWatchException(Throwable cause) {
    super(cause);
  }
}
