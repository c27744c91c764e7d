/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.model;

import com.linkedin.llm.anomalywatch.exception.MalformedEventException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;


/**
 * Telemetry of a single LLM call. Instances are only created through {@link Builder}, which enforces the event schema:
 * <ul>
 *   <li>{@code request_id}, {@code timestamp}, {@code provider}, {@code model}, {@code application},
 *   {@code inference_time}, {@code success} and {@code prompt_tokens} are always required.</li>
 *   <li>A successful call carries {@code completion_tokens}, {@code total_tokens} and {@code estimated_cost}.</li>
 *   <li>A failed call carries {@code error}.</li>
 *   <li>{@code memory_used} and {@code environment} are optional.</li>
 * </ul>
 */
public final class LlmCallEvent {
  public static final String REQUEST_ID = "request_id";
  public static final String TIMESTAMP = "timestamp";
  public static final String PROVIDER = "provider";
  public static final String MODEL = "model";
  public static final String APPLICATION = "application";
  public static final String INFERENCE_TIME = "inference_time";
  public static final String SUCCESS = "success";
  public static final String PROMPT_TOKENS = "prompt_tokens";
  public static final String COMPLETION_TOKENS = "completion_tokens";
  public static final String TOTAL_TOKENS = "total_tokens";
  public static final String ESTIMATED_COST = "estimated_cost";
  public static final String MEMORY_USED = "memory_used";
  public static final String ERROR = "error";
  public static final String ENVIRONMENT = "environment";

  private final String _requestId;
  private final long _timestampMs;
  private final EntityKey _entityKey;
  private final double _inferenceTime;
  private final boolean _success;
  private final int _promptTokens;
  private final Integer _completionTokens;
  private final Integer _totalTokens;
  private final Double _estimatedCost;
  private final Double _memoryUsed;
  private final String _error;
  private final String _environment;

  private LlmCallEvent(Builder builder) {
    _requestId = builder._requestId;
    _timestampMs = Math.round(builder._timestamp * 1000.0);
    _entityKey = new EntityKey(builder._provider, builder._model, builder._application);
    _inferenceTime = builder._inferenceTime;
    _success = builder._success;
    _promptTokens = builder._promptTokens;
    _completionTokens = builder._completionTokens;
    _totalTokens = builder._totalTokens;
    _estimatedCost = builder._estimatedCost;
    _memoryUsed = builder._memoryUsed;
    _error = builder._error;
    _environment = builder._environment;
  }

  public String requestId() {
    return _requestId;
  }

  public long timestampMs() {
    return _timestampMs;
  }

  public EntityKey entityKey() {
    return _entityKey;
  }

  public double inferenceTime() {
    return _inferenceTime;
  }

  public boolean success() {
    return _success;
  }

  public int promptTokens() {
    return _promptTokens;
  }

  /**
   * @return Completion tokens, or {@code null} for a failed call.
   */
  public Integer completionTokens() {
    return _completionTokens;
  }

  /**
   * @return Total tokens, or {@code null} for a failed call.
   */
  public Integer totalTokens() {
    return _totalTokens;
  }

  /**
   * @return Estimated cost, or {@code null} for a failed call.
   */
  public Double estimatedCost() {
    return _estimatedCost;
  }

  public Double memoryUsed() {
    return _memoryUsed;
  }

  /**
   * @return The error message of a failed call, or {@code null} for a successful call.
   */
  public String error() {
    return _error;
  }

  public String environment() {
    return _environment;
  }

  /**
   * @return Completion tokens per prompt token, or {@code null} if the ratio is undefined for this call.
   */
  public Double tokenRatio() {
    if (_promptTokens <= 0 || _completionTokens == null) {
      return null;
    }
    return (double) _completionTokens / _promptTokens;
  }

  /**
   * @param metricType Metric type.
   * @return The value of the given metric carried by this event, or {@code null} if the event does not carry it.
   */
  public Double metricValue(MetricType metricType) {
    switch (metricType) {
      case INFERENCE_TIME:
        return _inferenceTime;
      case TOTAL_TOKENS:
        return _totalTokens == null ? null : _totalTokens.doubleValue();
      case ESTIMATED_COST:
        return _estimatedCost;
      case MEMORY_USED:
        return _memoryUsed;
      case PROMPT_TOKENS:
        return (double) _promptTokens;
      case COMPLETION_TOKENS:
        return _completionTokens == null ? null : _completionTokens.doubleValue();
      case TOKEN_RATIO:
        return tokenRatio();
      default:
        throw new IllegalArgumentException("Unsupported metric type " + metricType);
    }
  }

  /**
   * @return The directly reported metrics carried by this event, in declaration order of {@link MetricType}.
   */
  public Map<MetricType, Double> reportedMetrics() {
    Map<MetricType, Double> metrics = new EnumMap<>(MetricType.class);
    for (MetricType metricType : MetricType.cachedValues()) {
      if (!metricType.isDerived()) {
        Double value = metricValue(metricType);
        if (value != null) {
          metrics.put(metricType, value);
        }
      }
    }
    return metrics;
  }

  /**
   * @return An object that can be further used to encode into JSON, using the field names of the event schema.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put(REQUEST_ID, _requestId);
    structure.put(TIMESTAMP, _timestampMs / 1000.0);
    structure.put(PROVIDER, _entityKey.provider());
    structure.put(MODEL, _entityKey.model());
    structure.put(APPLICATION, _entityKey.application());
    structure.put(INFERENCE_TIME, _inferenceTime);
    structure.put(SUCCESS, _success);
    structure.put(PROMPT_TOKENS, _promptTokens);
    putIfNotNull(structure, COMPLETION_TOKENS, _completionTokens);
    putIfNotNull(structure, TOTAL_TOKENS, _totalTokens);
    putIfNotNull(structure, ESTIMATED_COST, _estimatedCost);
    putIfNotNull(structure, MEMORY_USED, _memoryUsed);
    putIfNotNull(structure, ERROR, _error);
    putIfNotNull(structure, ENVIRONMENT, _environment);
    return structure;
  }

  private static void putIfNotNull(Map<String, Object> structure, String name, Object value) {
    if (value != null) {
      structure.put(name, value);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    LlmCallEvent that = (LlmCallEvent) o;
    return _timestampMs == that._timestampMs && _requestId.equals(that._requestId) && _entityKey.equals(that._entityKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_requestId, _timestampMs, _entityKey);
  }

  @Override
  public String toString() {
    return String.format("LlmCallEvent{requestId=%s, entity=%s, timestampMs=%d, success=%s}", _requestId, _entityKey, _timestampMs, _success);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String _requestId;
    private Double _timestamp;
    private String _provider;
    private String _model;
    private String _application;
    private Double _inferenceTime;
    private Boolean _success;
    private Integer _promptTokens;
    private Integer _completionTokens;
    private Integer _totalTokens;
    private Double _estimatedCost;
    private Double _memoryUsed;
    private String _error;
    private String _environment;

    private Builder() {

    }

    public Builder requestId(String requestId) {
      _requestId = requestId;
      return this;
    }

    /**
     * @param timestamp Epoch time of the call in seconds, fractional seconds allowed.
     * @return This builder.
     */
    public Builder timestamp(double timestamp) {
      _timestamp = timestamp;
      return this;
    }

    public Builder timestampMs(long timestampMs) {
      _timestamp = timestampMs / 1000.0;
      return this;
    }

    public Builder entity(EntityKey entityKey) {
      _provider = entityKey.provider();
      _model = entityKey.model();
      _application = entityKey.application();
      return this;
    }

    public Builder provider(String provider) {
      _provider = provider;
      return this;
    }

    public Builder model(String model) {
      _model = model;
      return this;
    }

    public Builder application(String application) {
      _application = application;
      return this;
    }

    public Builder inferenceTime(double inferenceTime) {
      _inferenceTime = inferenceTime;
      return this;
    }

    public Builder success(boolean success) {
      _success = success;
      return this;
    }

    public Builder promptTokens(int promptTokens) {
      _promptTokens = promptTokens;
      return this;
    }

    public Builder completionTokens(int completionTokens) {
      _completionTokens = completionTokens;
      return this;
    }

    public Builder totalTokens(int totalTokens) {
      _totalTokens = totalTokens;
      return this;
    }

    public Builder estimatedCost(double estimatedCost) {
      _estimatedCost = estimatedCost;
      return this;
    }

    public Builder memoryUsed(double memoryUsed) {
      _memoryUsed = memoryUsed;
      return this;
    }

    public Builder error(String error) {
      _error = error;
      return this;
    }

    public Builder environment(String environment) {
      _environment = environment;
      return this;
    }

    /**
     * @return A successful call with the given token counts and cost; total tokens are prompt plus completion tokens.
     */
    public Builder succeeded(int promptTokens, int completionTokens, double estimatedCost) {
      return success(true).promptTokens(promptTokens)
                          .completionTokens(completionTokens)
                          .totalTokens(promptTokens + completionTokens)
                          .estimatedCost(estimatedCost);
    }

    /**
     * @return A failed call with the given prompt tokens and error.
     */
    public Builder failed(int promptTokens, String error) {
      return success(false).promptTokens(promptTokens).error(error);
    }

    /**
     * Build the event after validating it against the event schema.
     *
     * @return The event.
     * @throws MalformedEventException if the event does not conform to the schema.
     */
    public LlmCallEvent build() throws MalformedEventException {
      requireText(_requestId, REQUEST_ID);
      require(_timestamp, TIMESTAMP);
      if (!Double.isFinite(_timestamp) || _timestamp < 0) {
        throw new MalformedEventException(String.format("Field %s must be a non-negative epoch time, got %s.", TIMESTAMP, _timestamp));
      }
      requireText(_provider, PROVIDER);
      requireText(_model, MODEL);
      requireText(_application, APPLICATION);
      require(_inferenceTime, INFERENCE_TIME);
      requireNonNegative(_inferenceTime, INFERENCE_TIME);
      require(_success, SUCCESS);
      require(_promptTokens, PROMPT_TOKENS);
      requireNonNegative(_promptTokens, PROMPT_TOKENS);
      if (_success) {
        require(_completionTokens, COMPLETION_TOKENS);
        require(_totalTokens, TOTAL_TOKENS);
        require(_estimatedCost, ESTIMATED_COST);
        requireNonNegative(_completionTokens, COMPLETION_TOKENS);
        requireNonNegative(_totalTokens, TOTAL_TOKENS);
        requireNonNegative(_estimatedCost, ESTIMATED_COST);
      } else {
        requireText(_error, ERROR);
      }
      if (_memoryUsed != null) {
        requireNonNegative(_memoryUsed, MEMORY_USED);
      }
      return new LlmCallEvent(this);
    }

    private static void require(Object value, String field) throws MalformedEventException {
      if (value == null) {
        throw new MalformedEventException(String.format("Missing required field %s.", field));
      }
    }

    private static void requireText(String value, String field) throws MalformedEventException {
      require(value, field);
      if (value.isEmpty()) {
        throw new MalformedEventException(String.format("Field %s must not be empty.", field));
      }
    }

    private static void requireNonNegative(Number value, String field) throws MalformedEventException {
      if (!(value.doubleValue() >= 0.0) || Double.isInfinite(value.doubleValue())) {
        throw new MalformedEventException(String.format("Field %s must be a non-negative number, got %s.", field, value));
      }
    }
  }
}
