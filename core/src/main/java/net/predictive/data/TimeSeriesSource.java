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

/**
 * Read access to the raw history of a metric. Implementations talk to the
 * actual time-series store and must return in bounded time.
 * @since 1.0
 */
public interface TimeSeriesSource {

  /**
   * Fetches the stored series for the range at whatever resolution the store
   * keeps for it.
   * @param id The non-null metric to fetch.
   * @param start The start of the range in Unix epoch seconds, inclusive.
   * @param end The end of the range in Unix epoch seconds, exclusive.
   * @param cf The non-null consolidation function to read.
   * @return The series, or null if the store has nothing for the metric. A
   * series with a step of 0 likewise means no data.
   */
  public TimeSeries fetch(final MetricId id,
                          final long start,
                          final long end,
                          final ConsolidationFunction cf);

}
