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

import net.predictive.data.MetricId;

/**
 * Persists computed predictions and their metadata per metric and timegroup.
 * A summary and its metadata are always written together and replaced as a
 * whole.
 *
 * @since 1.0
 */
public interface PredictionCache {

  /**
   * Whether the cached prediction can be used as is.
   * @param id A non-null metric.
   * @param timegroup A non-null timegroup.
   * @param params The non-null parameters of the current computation.
   * @param now The current time in Unix epoch seconds.
   * @return False if there is no metadata, it is outdated or it was computed
   * with different parameters. True otherwise.
   */
  public boolean isFresh(final MetricId id,
                         final String timegroup,
                         final PredictionParams params,
                         final long now);

  /**
   * Attempts to load the metadata.
   * @param id A non-null metric.
   * @param timegroup A non-null timegroup.
   * @return The metadata or null if missing or unreadable.
   */
  public PredictionInfo loadInfo(final MetricId id, final String timegroup);

  /**
   * Attempts to load the summary.
   * @param id A non-null metric.
   * @param timegroup A non-null timegroup.
   * @return The summary or null if missing or unreadable.
   */
  public PredictionSummary load(final MetricId id, final String timegroup);

  /**
   * Writes the summary and its metadata, replacing any previous pair.
   * @param id A non-null metric.
   * @param timegroup A non-null timegroup.
   * @param info The non-null metadata.
   * @param summary The non-null summary.
   * @throws java.io.UncheckedIOException if writing failed.
   */
  public void store(final MetricId id,
                    final String timegroup,
                    final PredictionInfo info,
                    final PredictionSummary summary);

  /**
   * Removes stale entries for the timegroup.
   * @param id A non-null metric.
   * @param timegroup A non-null timegroup.
   * @param force When true both files are removed, otherwise only empty ones
   * left over by broken writes.
   */
  public void invalidate(final MetricId id,
                         final String timegroup,
                         final boolean force);

}
