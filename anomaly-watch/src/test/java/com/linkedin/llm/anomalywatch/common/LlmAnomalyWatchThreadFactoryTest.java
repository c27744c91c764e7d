/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.common;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


public class LlmAnomalyWatchThreadFactoryTest {

  @Test
  public void testThreadNamesAndDaemon() {
    LlmAnomalyWatchThreadFactory factory = new LlmAnomalyWatchThreadFactory("Analyzer");
    Thread first = factory.newThread(() -> { });
    Thread second = factory.newThread(() -> { });
    assertEquals("Analyzer-0", first.getName());
    assertEquals("Analyzer-1", second.getName());
    assertTrue(first.isDaemon());
    assertFalse(new LlmAnomalyWatchThreadFactory("Worker", false, null).newThread(() -> { }).isDaemon());
  }
}
