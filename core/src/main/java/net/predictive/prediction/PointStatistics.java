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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Statistics of all historical values at one offset within the slice.
 * Serialized as {@code [average, min, max, stdev]}. All four are null when
 * none of the slices had a value at the offset.
 * @since 1.0
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({ "average", "min", "max", "stdev" })
public final class PointStatistics {

  /** Statistics for an offset without any values. */
  public static final PointStatistics EMPTY =
      new PointStatistics(null, null, null, null);

  private final Double average;
  private final Double min;
  private final Double max;
  private final Double stdev;

  /**
   * Default ctor.
   * @param average The mean, may be null.
   * @param min The minimum, may be null.
   * @param max The maximum, may be null.
   * @param stdev The standard deviation, may be null.
   */
  @JsonCreator
  public PointStatistics(@JsonProperty("average") final Double average,
                         @JsonProperty("min") final Double min,
                         @JsonProperty("max") final Double max,
                         @JsonProperty("stdev") final Double stdev) {
    this.average = average;
    this.min = min;
    this.max = max;
    this.stdev = stdev;
  }

  @JsonProperty("average")
  public Double average() {
    return average;
  }

  @JsonProperty("min")
  public Double min() {
    return min;
  }

  @JsonProperty("max")
  public Double max() {
    return max;
  }

  @JsonProperty("stdev")
  public Double stdev() {
    return stdev;
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof PointStatistics)) {
      return false;
    }
    final PointStatistics other = (PointStatistics) o;
    return Objects.equals(average, other.average) &&
        Objects.equals(min, other.min) &&
        Objects.equals(max, other.max) &&
        Objects.equals(stdev, other.stdev);
  }

  @Override
  public int hashCode() {
    return Objects.hash(average, min, max, stdev);
  }

  @Override
  public String toString() {
    return "[" + average + ", " + min + ", " + max + ", " + stdev + "]";
  }
}
