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
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;

import net.predictive.data.TimeSeriesWindow;

/**
 * The persisted statistics of one timegroup:
 * <pre>
 * {"columns": ["average", "min", "max", "stdev"],
 *  "points": [[avg, min, max, stdev], ...],
 *  "num_points": n,
 *  "data_twindow": [start, end],
 *  "step": step}
 * </pre>
 * The shape is validated when deserializing so a broken file fails to load
 * instead of failing later at the point of use.
 * @since 1.0
 */
@JsonPropertyOrder({ "columns", "points", "num_points", "data_twindow", "step" })
public final class PredictionSummary {

  /** The column names, in the order they appear in every point. */
  public static final List<String> COLUMNS =
      ImmutableList.of("average", "min", "max", "stdev");

  private final List<PointStatistics> points;
  private final long start;
  private final long end;
  private final long step;

  /**
   * Ctor used for deserialization, validates all fields.
   * @param columns The column names, must equal {@link #COLUMNS}.
   * @param points The non-null points.
   * @param num_points The number of points, must match the points.
   * @param data_twindow The start and end of the data.
   * @param step The positive resolution in seconds.
   * @throws IllegalArgumentException if any of the fields was invalid.
   */
  @JsonCreator
  public PredictionSummary(@JsonProperty("columns") final List<String> columns,
                           @JsonProperty("points") final List<PointStatistics> points,
                           @JsonProperty("num_points") final Integer num_points,
                           @JsonProperty("data_twindow") final long[] data_twindow,
                           @JsonProperty("step") final Long step) {
    if (!COLUMNS.equals(columns)) {
      throw new IllegalArgumentException("Unexpected columns: " + columns);
    }
    if (points == null) {
      throw new IllegalArgumentException("Points cannot be null.");
    }
    for (final PointStatistics point : points) {
      if (point == null) {
        throw new IllegalArgumentException("Points cannot contain nulls.");
      }
    }
    if (num_points == null || num_points != points.size()) {
      throw new IllegalArgumentException("Number of points " + num_points
          + " does not match " + points.size() + " points.");
    }
    if (data_twindow == null || data_twindow.length != 2) {
      throw new IllegalArgumentException("Data window must have a start and "
          + "an end.");
    }
    if (step == null || step <= 0) {
      throw new IllegalArgumentException("Step must be positive: " + step);
    }
    if (data_twindow[1] < data_twindow[0]
        || (data_twindow[1] - data_twindow[0]) % step != 0) {
      throw new IllegalArgumentException("Data window ["
          + data_twindow[0] + ", " + data_twindow[1]
          + "] is not a multiple of the step " + step);
    }
    this.points = ImmutableList.copyOf(points);
    start = data_twindow[0];
    end = data_twindow[1];
    this.step = step;
  }

  /**
   * Builds a summary from freshly computed statistics.
   * @param window The non-null common resolution of the data.
   * @param points The non-null statistics, one per offset.
   * @return The summary.
   * @throws IllegalArgumentException if the window and the points do not fit.
   */
  public static PredictionSummary fromStatistics(
      final TimeSeriesWindow window,
      final List<PointStatistics> points) {
    return new PredictionSummary(COLUMNS, points, points.size(),
        new long[] { window.start(), window.end() }, window.step());
  }

  @JsonProperty("columns")
  public List<String> getColumns() {
    return COLUMNS;
  }

  @JsonProperty("points")
  public List<PointStatistics> getPoints() {
    return points;
  }

  @JsonProperty("num_points")
  public int getNumPoints() {
    return points.size();
  }

  @JsonProperty("data_twindow")
  public long[] getDataTwindow() {
    return new long[] { start, end };
  }

  @JsonProperty("step")
  public long getStep() {
    return step;
  }

  /**
   * Finds the statistics for an offset within the slice.
   * @param offset Seconds since the start of the slice.
   * @return The statistics at {@code offset / step} or null if the offset
   * falls outside of the points.
   */
  public PointStatistics reference(final long offset) {
    final long index = offset / step;
    if (offset < 0 || index >= points.size()) {
      return null;
    }
    return points.get((int) index);
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof PredictionSummary)) {
      return false;
    }
    final PredictionSummary other = (PredictionSummary) o;
    return start == other.start &&
        end == other.end &&
        step == other.step &&
        points.equals(other.points);
  }

  @Override
  public int hashCode() {
    return Objects.hash(points, start, end, step);
  }
}
