/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.ingestion;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.linkedin.llm.anomalywatch.exception.MalformedEventException;
import com.linkedin.llm.anomalywatch.model.LlmCallEvent;
import java.util.Map;
import java.util.Set;

import static com.linkedin.llm.anomalywatch.model.LlmCallEvent.*;


/**
 * Decodes a JSON encoded telemetry event. Fields outside the event schema are rejected rather than ignored.
 */
public final class LlmCallEventParser {
  private static final Set<String> KNOWN_FIELDS = Set.of(REQUEST_ID, TIMESTAMP, PROVIDER, MODEL, APPLICATION, INFERENCE_TIME,
                                                         SUCCESS, PROMPT_TOKENS, COMPLETION_TOKENS, TOTAL_TOKENS,
                                                         ESTIMATED_COST, MEMORY_USED, ERROR, ENVIRONMENT);

  private LlmCallEventParser() {

  }

  /**
   * @param json A JSON object encoding one telemetry event.
   * @return The decoded event.
   * @throws MalformedEventException if the input is not a JSON object or does not conform to the event schema.
   */
  public static LlmCallEvent parse(String json) throws MalformedEventException {
    JsonElement element;
    try {
      element = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new MalformedEventException("Event is not valid JSON.", e);
    }
    if (element == null || !element.isJsonObject()) {
      throw new MalformedEventException("Event must be a JSON object, got: " + json);
    }
    return parse(element.getAsJsonObject());
  }

  /**
   * @param object A JSON object encoding one telemetry event.
   * @return The decoded event.
   * @throws MalformedEventException if the object does not conform to the event schema.
   */
  public static LlmCallEvent parse(JsonObject object) throws MalformedEventException {
    LlmCallEvent.Builder builder = LlmCallEvent.builder();
    for (Map.Entry<String, JsonElement> field : object.entrySet()) {
      String name = field.getKey();
      JsonElement value = field.getValue();
      if (!KNOWN_FIELDS.contains(name)) {
        throw new MalformedEventException(String.format("Unknown field %s.", name));
      }
      if (value.isJsonNull()) {
        // An explicit null is treated as an absent field.
        continue;
      }
      switch (name) {
        case REQUEST_ID:
          builder.requestId(string(name, value));
          break;
        case TIMESTAMP:
          builder.timestamp(number(name, value));
          break;
        case PROVIDER:
          builder.provider(string(name, value));
          break;
        case MODEL:
          builder.model(string(name, value));
          break;
        case APPLICATION:
          builder.application(string(name, value));
          break;
        case INFERENCE_TIME:
          builder.inferenceTime(number(name, value));
          break;
        case SUCCESS:
          builder.success(bool(name, value));
          break;
        case PROMPT_TOKENS:
          builder.promptTokens(integer(name, value));
          break;
        case COMPLETION_TOKENS:
          builder.completionTokens(integer(name, value));
          break;
        case TOTAL_TOKENS:
          builder.totalTokens(integer(name, value));
          break;
        case ESTIMATED_COST:
          builder.estimatedCost(number(name, value));
          break;
        case MEMORY_USED:
          builder.memoryUsed(number(name, value));
          break;
        case ERROR:
          builder.error(string(name, value));
          break;
        case ENVIRONMENT:
          builder.environment(string(name, value));
          break;
        default:
          throw new IllegalStateException("Unhandled field " + name);
      }
    }
    return builder.build();
  }

  private static JsonPrimitive primitive(String name, JsonElement value) throws MalformedEventException {
    if (!value.isJsonPrimitive()) {
      throw new MalformedEventException(String.format("Field %s must be a scalar, got %s.", name, value));
    }
    return value.getAsJsonPrimitive();
  }

  private static String string(String name, JsonElement value) throws MalformedEventException {
    JsonPrimitive primitive = primitive(name, value);
    if (!primitive.isString()) {
      throw new MalformedEventException(String.format("Field %s must be a string, got %s.", name, value));
    }
    return primitive.getAsString();
  }

  private static double number(String name, JsonElement value) throws MalformedEventException {
    JsonPrimitive primitive = primitive(name, value);
    if (!primitive.isNumber()) {
      throw new MalformedEventException(String.format("Field %s must be a number, got %s.", name, value));
    }
    return primitive.getAsDouble();
  }

  private static int integer(String name, JsonElement value) throws MalformedEventException {
    double number = number(name, value);
    if (number != Math.rint(number) || number > Integer.MAX_VALUE || number < Integer.MIN_VALUE) {
      throw new MalformedEventException(String.format("Field %s must be an integer, got %s.", name, value));
    }
    return (int) number;
  }

  private static boolean bool(String name, JsonElement value) throws MalformedEventException {
    JsonPrimitive primitive = primitive(name, value);
    if (!primitive.isBoolean()) {
      throw new MalformedEventException(String.format("Field %s must be a boolean, got %s.", name, value));
    }
    return primitive.getAsBoolean();
  }
}
