/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.exception;

import com.linkedin.anomalywatch.exception.AnomalyWatchException;


/**
 * Thrown when a telemetry event does not conform to the event schema.
 */
public class MalformedEventException extends AnomalyWatchException {

  public MalformedEventException(String message, Throwable cause) {
    super(message, cause);
  }

  public MalformedEventException(String message) {
    super(message);
  }
}
