/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.llm.anomalywatch.detector;

import com.linkedin.llm.anomalywatch.exception.DecompositionException;


/**
 * Classical additive decomposition of an evenly spaced series into trend, seasonal and residual components.
 * <ul>
 *   <li>Trend: centered moving average over one period (a 2 x period moving average for even periods). The first and
 *   last half period, where the moving average is undefined, are filled by a least squares line through the nearest
 *   period of trend values.</li>
 *   <li>Seasonal: the mean detrended value of each phase of the period, shifted so that the indices sum to zero.</li>
 *   <li>Residual: what remains after removing trend and seasonal components.</li>
 * </ul>
 * The decomposition also forecasts the value that follows the series, by extending the trend line fitted to the end
 * of the series and adding the seasonal index of the next phase.
 */
public final class SeasonalDecomposition {
  private final int _period;
  private final double[] _trend;
  private final double[] _seasonalIndices;
  private final double[] _residual;
  private final double _endSlope;
  private final double _endIntercept;

  private SeasonalDecomposition(int period, double[] trend, double[] seasonalIndices, double[] residual, double endSlope,
                                double endIntercept) {
    _period = period;
    _trend = trend;
    _seasonalIndices = seasonalIndices;
    _residual = residual;
    _endSlope = endSlope;
    _endIntercept = endIntercept;
  }

  /**
   * @param values Evenly spaced values, at least two periods long.
   * @param period The number of values in one seasonal cycle.
   * @return The decomposition of the given values.
   * @throws DecompositionException if the values are too short or not all finite.
   */
  public static SeasonalDecomposition decompose(double[] values, int period) throws DecompositionException {
    if (period < 2) {
      throw new DecompositionException("Seasonal period must be at least 2, got " + period);
    }
    int n = values.length;
    if (n < 2 * period) {
      throw new DecompositionException(String.format("Need at least %d values to decompose with period %d, got %d.",
                                                     2 * period, period, n));
    }
    for (double value : values) {
      if (!Double.isFinite(value)) {
        throw new DecompositionException("Cannot decompose a series with non-finite value " + value);
      }
    }

    double[] trend = new double[n];
    int half = period / 2;
    int first = half;
    int last = n - 1 - half;
    for (int i = first; i <= last; i++) {
      double sum = 0.0;
      if (period % 2 == 0) {
        sum += 0.5 * values[i - half] + 0.5 * values[i + half];
        for (int j = i - half + 1; j < i + half; j++) {
          sum += values[j];
        }
      } else {
        for (int j = i - half; j <= i + half; j++) {
          sum += values[j];
        }
      }
      trend[i] = sum / period;
    }

    int numFitted = Math.min(period, last - first + 1);
    double[] startLine = fitLine(trend, first, first + numFitted - 1);
    for (int i = 0; i < first; i++) {
      trend[i] = startLine[0] * i + startLine[1];
    }
    double[] endLine = fitLine(trend, last - numFitted + 1, last);
    for (int i = last + 1; i < n; i++) {
      trend[i] = endLine[0] * i + endLine[1];
    }

    double[] seasonalIndices = new double[period];
    int[] counts = new int[period];
    for (int i = 0; i < n; i++) {
      seasonalIndices[i % period] += values[i] - trend[i];
      counts[i % period]++;
    }
    double meanIndex = 0.0;
    for (int phase = 0; phase < period; phase++) {
      seasonalIndices[phase] /= counts[phase];
      meanIndex += seasonalIndices[phase];
    }
    meanIndex /= period;
    for (int phase = 0; phase < period; phase++) {
      seasonalIndices[phase] -= meanIndex;
    }

    double[] residual = new double[n];
    for (int i = 0; i < n; i++) {
      residual[i] = values[i] - trend[i] - seasonalIndices[i % period];
    }
    return new SeasonalDecomposition(period, trend, seasonalIndices, residual, endLine[0], endLine[1]);
  }

  /**
   * Least squares line through (i, values[i]) for i in [from, to].
   * @return {slope, intercept}.
   */
  private static double[] fitLine(double[] values, int from, int to) {
    int count = to - from + 1;
    if (count == 1) {
      return new double[]{0.0, values[from]};
    }
    double meanX = 0.0;
    double meanY = 0.0;
    for (int i = from; i <= to; i++) {
      meanX += i;
      meanY += values[i];
    }
    meanX /= count;
    meanY /= count;
    double sxx = 0.0;
    double sxy = 0.0;
    for (int i = from; i <= to; i++) {
      sxx += (i - meanX) * (i - meanX);
      sxy += (i - meanX) * (values[i] - meanY);
    }
    double slope = sxy / sxx;
    return new double[]{slope, meanY - slope * meanX};
  }

  public int period() {
    return _period;
  }

  public double[] trend() {
    return _trend.clone();
  }

  /**
   * @return The seasonal index of each phase of the period.
   */
  public double[] seasonalIndices() {
    return _seasonalIndices.clone();
  }

  public double[] residual() {
    return _residual.clone();
  }

  /**
   * @return Sample standard deviation of the residual.
   */
  public double residualStd() {
    double mean = 0.0;
    for (double r : _residual) {
      mean += r;
    }
    mean /= _residual.length;
    double sumOfSquares = 0.0;
    for (double r : _residual) {
      sumOfSquares += (r - mean) * (r - mean);
    }
    return Math.sqrt(sumOfSquares / (_residual.length - 1));
  }

  /**
   * @return The expected value of the element that immediately follows the decomposed series.
   */
  public double forecastNext() {
    int next = _residual.length;
    return _endSlope * next + _endIntercept + _seasonalIndices[next % _period];
  }
}
