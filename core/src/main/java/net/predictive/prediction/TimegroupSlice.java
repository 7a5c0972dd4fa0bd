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

/**
 * The bucket a timestamp falls into along with the slice containing it.
 * @since 1.0
 */
public final class TimegroupSlice {
  private final String timegroup;
  private final long start;
  private final long end;
  private final long offset;

  /**
   * Default ctor.
   * @param timegroup The non-null bucket name.
   * @param start The first second of the slice.
   * @param end The first second after the slice.
   * @param offset Seconds between the slice start and the resolved timestamp.
   */
  public TimegroupSlice(final String timegroup,
                        final long start,
                        final long end,
                        final long offset) {
    this.timegroup = timegroup;
    this.start = start;
    this.end = end;
    this.offset = offset;
  }

  /** @return The bucket name, e.g. "monday" or "12". */
  public String timegroup() {
    return timegroup;
  }

  /** @return The first second of the slice in Unix epoch seconds. */
  public long start() {
    return start;
  }

  /** @return The first second after the slice in Unix epoch seconds. */
  public long end() {
    return end;
  }

  /** @return Seconds between the slice start and the resolved timestamp. */
  public long offset() {
    return offset;
  }

  /** @return The slice as a time window. */
  public TimeWindow window() {
    return new TimeWindow(start, end);
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof TimegroupSlice)) {
      return false;
    }
    final TimegroupSlice other = (TimegroupSlice) o;
    return Objects.equals(timegroup, other.timegroup) &&
        start == other.start &&
        end == other.end &&
        offset == other.offset;
  }

  @Override
  public int hashCode() {
    return Objects.hash(timegroup, start, end, offset);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{timegroup=")
        .append(timegroup)
        .append(", start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append(", offset=")
        .append(offset)
        .append("}")
        .toString();
  }
}
