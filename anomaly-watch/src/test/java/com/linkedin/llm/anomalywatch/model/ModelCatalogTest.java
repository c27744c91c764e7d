/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.model;

import java.util.List;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class ModelCatalogTest {
  private static final ModelCatalog CATALOG = ModelCatalog.defaultCatalog();

  @Test
  public void testAlternatives() {
    List<ModelAlternative> alternatives = CATALOG.alternativesFor("GPT-4-0613");
    assertEquals(1, alternatives.size());
    assertEquals("gpt-3.5-turbo", alternatives.get(0).model());
    assertEquals(0.1, alternatives.get(0).costRatio(), 0.0);
    assertEquals("claude-instant-v1", CATALOG.alternativesFor("claude-2.1").get(0).model());
    assertTrue(CATALOG.alternativesFor("llama-2-70b").isEmpty());
  }

  @Test
  public void testContextWindowFirstMatchWins() {
    assertEquals(Integer.valueOf(32768), CATALOG.contextWindow("gpt-4-32k"));
    assertEquals(Integer.valueOf(8192), CATALOG.contextWindow("gpt-4"));
    assertEquals(Integer.valueOf(16384), CATALOG.contextWindow("gpt-3.5-turbo-16k"));
    assertEquals(Integer.valueOf(4096), CATALOG.contextWindow("gpt-3.5-turbo"));
    assertEquals(Integer.valueOf(100000), CATALOG.contextWindow("claude-instant-1"));
    assertNull(CATALOG.contextWindow("llama-2-70b"));
  }

  @Test
  public void testCustomCatalog() {
    ModelCatalog catalog = ModelCatalog.builder()
                                       .alternatives(List.of("mistral-large"), new ModelAlternative("mistral-small", 0.25, 0.8))
                                       .contextWindow(List.of("mistral"), 32000)
                                       .build();
    assertEquals("mistral-small", catalog.alternativesFor("mistral-large-latest").get(0).model());
    assertEquals(Integer.valueOf(32000), catalog.contextWindow("mistral-small"));
    assertTrue(catalog.alternativesFor("gpt-4").isEmpty());
    assertThrows(IllegalArgumentException.class, () -> ModelCatalog.builder().contextWindow(List.of("x"), 0));
  }
}
