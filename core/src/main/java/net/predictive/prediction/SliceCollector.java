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

import java.time.ZoneOffset;
import java.util.List;

import com.google.common.collect.Lists;

/**
 * Walks back in time from a timestamp, one slice length at a time, and
 * collects every slice that falls into the requested timegroup.
 * @since 1.0
 */
public class SliceCollector {

  private final TimegroupResolver resolver;

  /**
   * Default ctor.
   * @param resolver The non-null resolver to use.
   * @throws IllegalArgumentException if the resolver was null.
   */
  public SliceCollector(final TimegroupResolver resolver) {
    if (resolver == null) {
      throw new IllegalArgumentException("Resolver cannot be null.");
    }
    this.resolver = resolver;
  }

  /**
   * Collects all slices back into the past until the horizon is reached.
   * The UTC offset at {@code timestamp} is used for every slice.
   * @param timestamp The query timestamp in Unix epoch seconds.
   * @param horizon How far back to look, in seconds.
   * @param period The non-null period.
   * @param timegroup The non-null timegroup to match.
   * @return The matching windows, most recent first. May be empty if the
   * horizon is too short.
   */
  public List<TimeWindow> collect(final long timestamp,
                                  final long horizon,
                                  final PredictionPeriod period,
                                  final String timegroup) {
    final ZoneOffset offset = resolver.offsetAt(timestamp);
    final long abs_begin = timestamp - horizon;
    final List<TimeWindow> slices = Lists.newArrayList();
    for (long begin = timestamp; begin > abs_begin;
         begin -= period.sliceLength()) {
      final TimegroupSlice slice =
          TimegroupResolver.resolve(begin, period, offset);
      if (slice.timegroup().equals(timegroup)) {
        slices.add(slice.window());
      }
    }
    return slices;
  }
}
