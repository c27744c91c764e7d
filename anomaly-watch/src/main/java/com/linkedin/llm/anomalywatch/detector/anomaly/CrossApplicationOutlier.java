/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector.anomaly;

import com.linkedin.llm.anomalywatch.model.EntityKey;
import com.linkedin.llm.anomalywatch.model.MetricType;
import java.util.Map;


/**
 * An application whose recent mean of a metric stands out from the other applications using the same provider and
 * model.
 */
public class CrossApplicationOutlier extends LlmAnomaly {
  private final MetricType _metricType;
  private final double _applicationMean;
  private final double _peerMean;
  private final double _peerStd;
  private final int _numPeers;
  private final double _zScore;

  public CrossApplicationOutlier(EntityKey entityKey, long detectionTimeMs, MetricType metricType, double applicationMean,
                                 double peerMean, double peerStd, int numPeers, double zScore) {
    super(LlmAnomalyType.CROSS_APPLICATION_OUTLIER, entityKey, detectionTimeMs, null);
    _metricType = metricType;
    _applicationMean = applicationMean;
    _peerMean = peerMean;
    _peerStd = peerStd;
    _numPeers = numPeers;
    _zScore = zScore;
  }

  public MetricType metricType() {
    return _metricType;
  }

  public double applicationMean() {
    return _applicationMean;
  }

  public double peerMean() {
    return _peerMean;
  }

  public double peerStd() {
    return _peerStd;
  }

  public int numPeers() {
    return _numPeers;
  }

  public double zScore() {
    return _zScore;
  }

  @Override
  protected String signatureDetail() {
    return _metricType.metricName();
  }

  @Override
  protected void addDetails(Map<String, Object> structure) {
    structure.put("metric", _metricType.metricName());
    structure.put("application_mean", _applicationMean);
    structure.put("peer_mean", _peerMean);
    structure.put("peer_std", _peerStd);
    structure.put("num_peers", _numPeers);
    structure.put("z_score", _zScore);
  }

  @Override
  public String description() {
    return String.format("Application %s has mean %s %.4f against %.4f (std %.4f) across %d peer applications.",
                         entityKey().application(), _metricType, _applicationMean, _peerMean, _peerStd, _numPeers);
  }
}
