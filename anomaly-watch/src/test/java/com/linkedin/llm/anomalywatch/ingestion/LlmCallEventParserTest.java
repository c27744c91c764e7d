/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.ingestion;

import com.linkedin.llm.anomalywatch.exception.MalformedEventException;
import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import com.linkedin.llm.anomalywatch.model.MetricType;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class LlmCallEventParserTest {
  private static final String SUCCESSFUL_CALL = "{\"request_id\": \"r-1\", \"timestamp\": 1704116730.25, \"provider\": \"openai\","
      + " \"model\": \"gpt-4\", \"application\": \"search\", \"inference_time\": 1.5, \"success\": true,"
      + " \"prompt_tokens\": 300, \"completion_tokens\": 100, \"total_tokens\": 400, \"estimated_cost\": 0.024,"
      + " \"memory_used\": 512.0, \"environment\": \"prod\"}";

  @Test
  public void testParseSuccessfulCall() throws MalformedEventException {
    LlmCallEvent event = LlmCallEventParser.parse(SUCCESSFUL_CALL);
    assertEquals("r-1", event.requestId());
    assertEquals(1704116730250L, event.timestampMs());
    assertEquals(new EntityKey("openai", "gpt-4", "search"), event.entityKey());
    assertTrue(event.success());
    assertEquals(300, event.promptTokens());
    assertEquals(Integer.valueOf(400), event.totalTokens());
    assertEquals(0.024, event.estimatedCost(), 0.0);
    assertEquals(512.0, event.memoryUsed(), 0.0);
    assertEquals("prod", event.environment());
    assertNull(event.error());
    assertEquals(1.0 / 3.0, event.tokenRatio(), 1e-12);
    assertEquals(6, event.reportedMetrics().size());
    assertFalse(event.reportedMetrics().containsKey(MetricType.TOKEN_RATIO));
  }

  @Test
  public void testParseFailedCall() throws MalformedEventException {
    String json = "{\"request_id\": \"r-2\", \"timestamp\": 1704116730, \"provider\": \"anthropic\", \"model\": \"claude-2\","
                  + " \"application\": \"chat\", \"inference_time\": 0.2, \"success\": false, \"prompt_tokens\": 10,"
                  + " \"completion_tokens\": null, \"error\": \"rate limited\"}";
    LlmCallEvent event = LlmCallEventParser.parse(json);
    assertFalse(event.success());
    assertEquals("rate limited", event.error());
    assertNull(event.completionTokens());
    assertNull(event.estimatedCost());
    assertNull(event.tokenRatio());
    assertNull(event.metricValue(MetricType.TOTAL_TOKENS));
  }

  @Test
  public void testRejectInvalidJson() {
    assertThrows(MalformedEventException.class, () -> LlmCallEventParser.parse("{\"request_id\": "));
    assertThrows(MalformedEventException.class, () -> LlmCallEventParser.parse("[1, 2]"));
  }

  @Test
  public void testRejectUnknownField() {
    String json = SUCCESSFUL_CALL.replace("\"environment\"", "\"region\"");
    assertThrows(MalformedEventException.class, () -> LlmCallEventParser.parse(json));
  }

  @Test
  public void testRejectMissingRequiredField() {
    String json = SUCCESSFUL_CALL.replace("\"provider\": \"openai\",", "");
    assertThrows(MalformedEventException.class, () -> LlmCallEventParser.parse(json));
    // A successful call must report its cost.
    String noCost = SUCCESSFUL_CALL.replace("\"estimated_cost\": 0.024,", "");
    assertThrows(MalformedEventException.class, () -> LlmCallEventParser.parse(noCost));
  }

  @Test
  public void testRejectWrongTypes() {
    assertThrows(MalformedEventException.class,
                 () -> LlmCallEventParser.parse(SUCCESSFUL_CALL.replace("\"inference_time\": 1.5", "\"inference_time\": \"slow\"")));
    assertThrows(MalformedEventException.class,
                 () -> LlmCallEventParser.parse(SUCCESSFUL_CALL.replace("\"prompt_tokens\": 300", "\"prompt_tokens\": 300.5")));
    assertThrows(MalformedEventException.class,
                 () -> LlmCallEventParser.parse(SUCCESSFUL_CALL.replace("\"success\": true", "\"success\": \"yes\"")));
    assertThrows(MalformedEventException.class,
                 () -> LlmCallEventParser.parse(SUCCESSFUL_CALL.replace("\"inference_time\": 1.5", "\"inference_time\": -1.5")));
  }
}
