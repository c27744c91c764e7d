/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.model;

import com.linkedin.anomalywatch.AnomalyWatchUtils;
import java.util.Arrays;


/**
 * Running cost and token usage aggregates of one entity. Each cost observation is recorded exactly once; averages are
 * maintained incrementally and never recomputed from history.
 * <p>
 * Thread safe: updates and reads are synchronized on the pattern, and {@link #copy()} gives a consistent view for
 * readers that inspect several fields.
 */
public class CostPattern {
  private double _totalCost;
  private long _requestCount;
  // Number of requests that carried token counts, which the token averages are taken over.
  private long _tokenSampleCount;
  private double _avgTokensPerRequest;
  private double _avgPromptRatio;
  private final double[] _hourlyCost;
  private final double[] _dailyCost;
  private long _lastUpdateMs;

  public CostPattern() {
    _hourlyCost = new double[AnomalyWatchUtils.HOURS_PER_DAY];
    _dailyCost = new double[AnomalyWatchUtils.DAYS_PER_WEEK];
    _lastUpdateMs = -1L;
  }

  private CostPattern(CostPattern other) {
    _totalCost = other._totalCost;
    _requestCount = other._requestCount;
    _tokenSampleCount = other._tokenSampleCount;
    _avgTokensPerRequest = other._avgTokensPerRequest;
    _avgPromptRatio = other._avgPromptRatio;
    _hourlyCost = other._hourlyCost.clone();
    _dailyCost = other._dailyCost.clone();
    _lastUpdateMs = other._lastUpdateMs;
  }

  /**
   * Record the cost of a request.
   *
   * @param cost Cost of the request.
   * @param totalTokens Total tokens of the request, or {@code null} if unknown.
   * @param promptTokens Prompt tokens of the request.
   * @param timestampMs Time of the request.
   */
  public synchronized void record(double cost, Integer totalTokens, int promptTokens, long timestampMs) {
    _totalCost += cost;
    _requestCount++;
    if (totalTokens != null && totalTokens > 0) {
      _tokenSampleCount++;
      _avgTokensPerRequest += (totalTokens - _avgTokensPerRequest) / _tokenSampleCount;
      double promptRatio = (double) promptTokens / totalTokens;
      _avgPromptRatio += (promptRatio - _avgPromptRatio) / _tokenSampleCount;
    }
    _hourlyCost[AnomalyWatchUtils.utcHourOfDay(timestampMs)] += cost;
    _dailyCost[AnomalyWatchUtils.utcDayOfWeek(timestampMs)] += cost;
    _lastUpdateMs = timestampMs;
  }

  /**
   * @return A consistent copy of this pattern.
   */
  public synchronized CostPattern copy() {
    return new CostPattern(this);
  }

  public synchronized double totalCost() {
    return _totalCost;
  }

  public synchronized long requestCount() {
    return _requestCount;
  }

  public synchronized long tokenSampleCount() {
    return _tokenSampleCount;
  }

  public synchronized double avgTokensPerRequest() {
    return _avgTokensPerRequest;
  }

  /**
   * @return Average share of prompt tokens in the total tokens of a request.
   */
  public synchronized double avgPromptRatio() {
    return _avgPromptRatio;
  }

  /**
   * @return Cost per UTC hour of day, indexed 0 to 23.
   */
  public synchronized double[] hourlyCost() {
    return _hourlyCost.clone();
  }

  /**
   * @return Cost per UTC day of week, indexed 0 (Monday) to 6 (Sunday).
   */
  public synchronized double[] dailyCost() {
    return _dailyCost.clone();
  }

  /**
   * @return Time of the last recorded request, or -1 if none was recorded.
   */
  public synchronized long lastUpdateMs() {
    return _lastUpdateMs;
  }

  @Override
  public synchronized String toString() {
    return String.format("{totalCost=%f, requestCount=%d, avgTokensPerRequest=%f, avgPromptRatio=%f, hourlyCost=%s}",
                         _totalCost, _requestCount, _avgTokensPerRequest, _avgPromptRatio, Arrays.toString(_hourlyCost));
  }
}
