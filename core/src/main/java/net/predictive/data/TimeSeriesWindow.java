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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * The resolution of a time series: the first second covered, the first
 * second no longer covered and the distance between two samples, all in Unix
 * epoch seconds. Often called the "twindow".
 * @since 1.0
 */
public final class TimeSeriesWindow {
  private final long start;
  private final long end;
  private final long step;

  /**
   * Default ctor.
   * @param start The start timestamp in Unix epoch seconds, inclusive.
   * @param end The end timestamp in Unix epoch seconds, exclusive.
   * @param step The sample spacing in seconds. Zero means the store had no
   * data for the requested range.
   * @throws IllegalArgumentException if the step is negative or the end is
   * before the start.
   */
  public TimeSeriesWindow(final long start, final long end, final long step) {
    if (step < 0) {
      throw new IllegalArgumentException("Step cannot be negative: " + step);
    }
    if (end < start) {
      throw new IllegalArgumentException("End " + end
          + " cannot be before start " + start);
    }
    this.start = start;
    this.end = end;
    this.step = step;
  }

  public long start() {
    return start;
  }

  public long end() {
    return end;
  }

  public long step() {
    return step;
  }

  /** @return The number of sample slots in the window, 0 if the step is 0. */
  @JsonIgnore
  public int size() {
    if (step == 0) {
      return 0;
    }
    return (int) ((end - start + step - 1) / step);
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof TimeSeriesWindow)) {
      return false;
    }
    final TimeSeriesWindow other = (TimeSeriesWindow) o;
    return start == other.start && end == other.end && step == other.step;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end, step);
  }

  @Override
  public String toString() {
    return "(" + start + ", " + end + ", " + step + ")";
  }
}
