/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

import com.linkedin.llm.anomalywatch.model.EntityKey;
import java.util.Map;


/**
 * A sustained increase of the inference time of an entity: the recent half of its history is significantly slower
 * than the early half.
 */
public class InferenceTimeTrend extends LlmAnomaly {
  private final double _earlyMean;
  private final double _recentMean;
  private final double _earlyStd;
  private final double _zScore;

  public InferenceTimeTrend(EntityKey entityKey, long detectionTimeMs, double earlyMean, double recentMean, double earlyStd,
                            double zScore) {
    super(LlmAnomalyType.INFERENCE_TIME_TREND, entityKey, detectionTimeMs, null);
    _earlyMean = earlyMean;
    _recentMean = recentMean;
    _earlyStd = earlyStd;
    _zScore = zScore;
  }

  public double earlyMean() {
    return _earlyMean;
  }

  public double recentMean() {
    return _recentMean;
  }

  public double earlyStd() {
    return _earlyStd;
  }

  public double zScore() {
    return _zScore;
  }

  /**
   * @return Increase of the recent mean over the early mean in percent.
   */
  public double percentIncrease() {
    return _earlyMean == 0.0 ? Double.POSITIVE_INFINITY : (_recentMean - _earlyMean) / _earlyMean * 100.0;
  }

  @Override
  protected String signatureDetail() {
    return "increase";
  }

  @Override
  protected void addDetails(Map<String, Object> structure) {
    structure.put("early_mean", _earlyMean);
    structure.put("recent_mean", _recentMean);
    structure.put("early_std", _earlyStd);
    structure.put("percent_increase", percentIncrease());
    structure.put("z_score", _zScore);
  }

  @Override
  public String description() {
    return String.format("Inference time increased by %.1f%% from %.4f to %.4f.", percentIncrease(), _earlyMean, _recentMean);
  }
}
