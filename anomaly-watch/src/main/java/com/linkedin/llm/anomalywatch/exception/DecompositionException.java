/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.exception;

import com.linkedin.anomalywatch.exception.AnomalyWatchException;


/**
 * Thrown when a series cannot be decomposed into trend, seasonal and residual components.
 */
public class DecompositionException extends AnomalyWatchException {

  public DecompositionException(String message) {
    super(message);
  }
}
