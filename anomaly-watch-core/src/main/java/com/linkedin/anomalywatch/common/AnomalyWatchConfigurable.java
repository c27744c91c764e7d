/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.anomalywatch.common;

import java.util.Map;


/**
 * A mix-in style interface for pluggable classes that are instantiated by reflection and need configuration.
 */
public interface AnomalyWatchConfigurable {

  /**
   * Configure this class with the given key-value pairs.
   * @param configs Configurations.
   */
  void configure(Map<String, ?> configs);
}
