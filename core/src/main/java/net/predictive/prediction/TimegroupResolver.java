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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Maps a timestamp to the timegroup and slice it belongs to under a period.
 * <p>
 * Slices start at local midnight (or the local top of the hour) and always
 * last exactly one slice length. The local UTC offset is taken once, at the
 * query timestamp, and applied to every slice resolved for that query, so
 * slices on the far side of a daylight saving switch are shifted by the
 * difference. That keeps the slicing deterministic.
 * @since 1.0
 */
public class TimegroupResolver {

  /** The zone used for local calendar fields. */
  private final ZoneId zone;

  /**
   * Default ctor.
   * @param zone The non-null local zone.
   * @throws IllegalArgumentException if the zone was null.
   */
  public TimegroupResolver(final ZoneId zone) {
    if (zone == null) {
      throw new IllegalArgumentException("Zone cannot be null.");
    }
    this.zone = zone;
  }

  /** @return The local zone. */
  public ZoneId zone() {
    return zone;
  }

  /**
   * @param timestamp A Unix epoch timestamp in seconds.
   * @return The local UTC offset in effect at the timestamp.
   */
  public ZoneOffset offsetAt(final long timestamp) {
    return zone.getRules().getOffset(Instant.ofEpochSecond(timestamp));
  }

  /**
   * Resolves the timestamp using the UTC offset in effect at that timestamp.
   * @param timestamp A Unix epoch timestamp in seconds.
   * @param period The non-null period.
   * @return The resolved slice.
   */
  public TimegroupSlice resolve(final long timestamp,
                                final PredictionPeriod period) {
    return resolve(timestamp, period, offsetAt(timestamp));
  }

  /**
   * Resolves the timestamp using a fixed UTC offset.
   * @param timestamp A Unix epoch timestamp in seconds.
   * @param period The non-null period.
   * @param offset The non-null local UTC offset to apply.
   * @return The resolved slice.
   */
  public static TimegroupSlice resolve(final long timestamp,
                                       final PredictionPeriod period,
                                       final ZoneOffset offset) {
    final long rel_time = windowStart(timestamp, period.sliceLength(), offset);
    final String timegroup = period.timegroup(
        LocalDateTime.ofEpochSecond(timestamp, 0, offset));
    final long from_time = timestamp - rel_time;
    return new TimegroupSlice(timegroup, from_time,
        from_time + period.sliceLength(), rel_time);
  }

  /**
   * If time is partitioned in {@code span} second intervals of local time,
   * how many seconds is the timestamp away from the start of its interval.
   * @param timestamp A Unix epoch timestamp in seconds.
   * @param span The interval length in seconds.
   * @param offset The local UTC offset.
   * @return The offset within the interval, always in {@code [0, span)}.
   */
  static long windowStart(final long timestamp,
                          final long span,
                          final ZoneOffset offset) {
    return Math.floorMod(timestamp + offset.getTotalSeconds(), span);
  }
}
