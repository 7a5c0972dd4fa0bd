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
 * A historical slice as {@code [start, end]} in Unix epoch seconds, start
 * inclusive and end exclusive. Serialized as a two element array.
 * @since 1.0
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({ "start", "end" })
public final class TimeWindow {
  private final long start;
  private final long end;

  /**
   * Default ctor.
   * @param start The first second of the window.
   * @param end The first second after the window.
   * @throws IllegalArgumentException if the end is not after the start.
   */
  @JsonCreator
  public TimeWindow(@JsonProperty("start") final long start,
                    @JsonProperty("end") final long end) {
    if (end <= start) {
      throw new IllegalArgumentException("Window end " + end
          + " must be after the start " + start);
    }
    this.start = start;
    this.end = end;
  }

  @JsonProperty("start")
  public long start() {
    return start;
  }

  @JsonProperty("end")
  public long end() {
    return end;
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof TimeWindow)) {
      return false;
    }
    final TimeWindow other = (TimeWindow) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + "]";
  }
}
