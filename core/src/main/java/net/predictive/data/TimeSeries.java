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
package net.predictive.data;

import java.util.Arrays;

/**
 * A time series as returned by the store: a native resolution plus one value
 * per step. Value {@code i} covers the interval that ends at
 * {@code start + (i + 1) * step}. Missing samples are {@link Double#NaN}.
 * @since 1.0
 */
public class TimeSeries {
  private final TimeSeriesWindow window;
  private final double[] values;

  /**
   * Default ctor.
   * @param window The non-null native resolution.
   * @param values The non-null values, NaN for missing samples.
   * @throws IllegalArgumentException if either argument was null.
   */
  public TimeSeries(final TimeSeriesWindow window, final double[] values) {
    if (window == null) {
      throw new IllegalArgumentException("Window cannot be null.");
    }
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    this.window = window;
    this.values = values;
  }

  /** @return The native resolution of the series. */
  public TimeSeriesWindow window() {
    return window;
  }

  /** @return The backing values. Not a copy. */
  public double[] values() {
    return values;
  }

  /** @return The end timestamp of every native interval. */
  public long[] rrdTimestamps() {
    final long[] timestamps = new long[window.size()];
    for (int i = 0; i < timestamps.length; i++) {
      timestamps[i] = window.start() + ((i + 1) * window.step());
    }
    return timestamps;
  }

  /**
   * Up-samples the series onto the target resolution by back filling, i.e.
   * every target slot takes the value of the first native interval whose
   * end, moved forward by {@code shift} seconds, lies after the slot. Slots
   * past the last native interval are NaN.
   * @param target The non-null target resolution.
   * @param shift How many seconds to move this series forward in time so it
   * lines up with the target.
   * @return The values on the target resolution. If the target equals the
   * native resolution a copy of the values is returned as is.
   * @throws IllegalArgumentException if the target was null or had a step of
   * zero.
   */
  public double[] bfillUpsample(final TimeSeriesWindow target, final long shift) {
    if (target == null) {
      throw new IllegalArgumentException("Target window cannot be null.");
    }
    if (target.equals(window)) {
      return Arrays.copyOf(values, values.length);
    }
    if (target.step() <= 0) {
      throw new IllegalArgumentException("Cannot upsample to a step of "
          + target.step());
    }

    final long[] current_times = rrdTimestamps();
    final double[] upsampled = new double[target.size()];
    int i = 0;
    int idx = 0;
    for (long t = target.start(); t < target.end(); t += target.step()) {
      while (i < current_times.length && t >= current_times[i] + shift) {
        i++;
      }
      upsampled[idx++] = i < current_times.length && i < values.length ?
          values[i] : Double.NaN;
    }
    return upsampled;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{window=")
        .append(window)
        .append(", values=")
        .append(values.length)
        .append("}")
        .toString();
  }
}
