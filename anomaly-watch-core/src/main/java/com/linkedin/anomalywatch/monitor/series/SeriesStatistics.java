/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalywatch.monitor.series;

import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;


/**
 * Statistics over series values. Standard deviations are population standard deviations and percentiles are
 * computed with linear interpolation between the closest ranks.
 */
public final class SeriesStatistics {

  private SeriesStatistics() {

  }

  /**
   * @param points Points.
   * @return The values of the given points in the same order.
   */
  public static double[] values(List<? extends MetricPoint<?>> points) {
    double[] values = new double[points.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = points.get(i).value();
    }
    return values;
  }

  public static double mean(double[] values) {
    return StatUtils.mean(values);
  }

  /**
   * @param values Values.
   * @return Population standard deviation of the values, {@code NaN} for an empty array.
   */
  public static double populationStd(double[] values) {
    return Math.sqrt(StatUtils.populationVariance(values));
  }

  /**
   * @param values Values.
   * @param p The percentile in (0, 100].
   * @return The percentile using linear interpolation between the closest ranks.
   */
  public static double percentile(double[] values, double p) {
    return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(values, p);
  }

  public static double median(double[] values) {
    return percentile(values, 50.0);
  }

  /**
   * @param values Values, must not be empty.
   * @return Summary statistics of the given values.
   */
  public static SeriesSummary summarize(double[] values) {
    DescriptiveStatistics stats = new DescriptiveStatistics(values);
    return new SeriesSummary(stats.getMean(),
                             percentile(values, 50.0),
                             stats.getMin(),
                             stats.getMax(),
                             populationStd(values),
                             (int) stats.getN());
  }
}
