// This file is part of Predictive Levels.
// Copyright (C) 2020  The Predictive Levels Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.predictive.prediction;

import java.util.List;

import com.google.common.collect.Lists;

/**
 * Reduces a set of aligned slices into per-offset statistics.
 * @since 1.0
 */
public final class StatisticalSummarizer {

  private StatisticalSummarizer() {
    // static helpers only
  }

  /**
   * Statistically summarizes the up-sampled slices. For every offset the
   * non-NaN values across all slices are reduced to their average, minimum,
   * maximum and standard deviation. Slices of differing lengths are
   * truncated to the shortest one.
   * @param slices The non-null slices.
   * @return One entry per offset.
   */
  public static List<PointStatistics> summarize(final List<double[]> slices) {
    int length = slices.isEmpty() ? 0 : Integer.MAX_VALUE;
    for (final double[] slice : slices) {
      length = Math.min(length, slice.length);
    }

    final List<PointStatistics> descriptors =
        Lists.newArrayListWithCapacity(length);
    final double[] point_line = new double[slices.size()];
    for (int idx = 0; idx < length; idx++) {
      int count = 0;
      for (final double[] slice : slices) {
        if (!Double.isNaN(slice[idx])) {
          point_line[count++] = slice[idx];
        }
      }

      if (count == 0) {
        descriptors.add(PointStatistics.EMPTY);
        continue;
      }

      double sum = 0;
      double min = point_line[0];
      double max = point_line[0];
      for (int i = 0; i < count; i++) {
        sum += point_line[i];
        min = Math.min(min, point_line[i]);
        max = Math.max(max, point_line[i]);
      }
      final double average = sum / count;
      descriptors.add(new PointStatistics(average, min, max,
          stdDev(point_line, count, average)));
    }
    return descriptors;
  }

  /**
   * Sample standard deviation via the sum of squares. A single sample yields
   * the magnitude of the value itself as the dispersion. The formula is kept
   * as is so results match previously persisted predictions.
   * @param points The values, only the first {@code count} are read.
   * @param count How many values to read, at least 1.
   * @param average The mean of those values.
   * @return The standard deviation.
   */
  public static double stdDev(final double[] points,
                              final int count,
                              final double average) {
    if (count == 1) {
      return Math.abs(average);
    }
    double sum_squares = 0;
    for (int i = 0; i < count; i++) {
      sum_squares += points[i] * points[i];
    }
    return Math.sqrt(Math.abs(sum_squares - average * average * count)
        / (count - 1));
  }
}
