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

import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.locks.Lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;

import net.predictive.data.ConsolidationFunction;
import net.predictive.data.MetricId;
import net.predictive.data.TimeSeriesSource;
import net.predictive.exceptions.NoHistoricDataException;
import net.predictive.exceptions.PredictionConfigException;
import net.predictive.utils.Config;

/**
 * Computes adaptive levels for a metric by comparing "now" against the same
 * point in time of past slices of the same timegroup.
 * <p>
 * The statistics of a timegroup are cached and only recomputed once they are
 * outdated or the parameters changed. Regeneration of one cache entry is
 * serialized through striped locks so concurrent checks of the same metric do
 * not compute it twice.
 * <p>
 * Failures are thrown, not logged. Callers decide whether a failure means "no
 * levels for this cycle".
 *
 * @since 1.0
 */
public class PredictiveLevels {
  private static final Logger LOG = LoggerFactory.getLogger(PredictiveLevels.class);

  private final TimeSeriesSource source;
  private final PredictionCache cache;
  private final TimegroupResolver resolver;
  private final SliceCollector collector;
  private final Striped<Lock> locks;

  /**
   * Ctor reading the cache directory, the zone and the lock stripes from the
   * config.
   * @param config The non-null config.
   * @param source The non-null source of historical data.
   * @throws IllegalArgumentException if the config was invalid.
   */
  public PredictiveLevels(final Config config, final TimeSeriesSource source) {
    this(source,
         new FilePredictionCache(config),
         config.getZoneId(Config.TIMEZONE_KEY),
         config.getInt(Config.LOCK_STRIPES_KEY));
  }

  /**
   * Default ctor.
   * @param source The non-null source of historical data.
   * @param cache The non-null prediction cache.
   * @param zone The non-null local zone.
   * @param lock_stripes The number of striped locks, at least 1.
   * @throws IllegalArgumentException if an argument was invalid.
   */
  public PredictiveLevels(final TimeSeriesSource source,
                          final PredictionCache cache,
                          final ZoneId zone,
                          final int lock_stripes) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    if (cache == null) {
      throw new IllegalArgumentException("Cache cannot be null.");
    }
    if (lock_stripes < 1) {
      throw new IllegalArgumentException("Need at least one lock stripe: "
          + lock_stripes);
    }
    this.source = source;
    this.cache = cache;
    resolver = new TimegroupResolver(zone);
    collector = new SliceCollector(resolver);
    locks = Striped.lock(lock_stripes);
  }

  /**
   * Computes the levels as of now with a levels factor of 1.
   * @see #computeLevels(MetricId, PredictionParams, ConsolidationFunction, double, long)
   */
  public PredictionResult computeLevels(final String host,
                                        final String service,
                                        final String metric,
                                        final PredictionParams params,
                                        final ConsolidationFunction cf) {
    return computeLevels(host, service, metric, params, cf, 1.0);
  }

  /**
   * Computes the levels as of now.
   * @see #computeLevels(MetricId, PredictionParams, ConsolidationFunction, double, long)
   */
  public PredictionResult computeLevels(final String host,
                                        final String service,
                                        final String metric,
                                        final PredictionParams params,
                                        final ConsolidationFunction cf,
                                        final double levels_factor) {
    return computeLevels(new MetricId(host, service, metric), params, cf,
        levels_factor, System.currentTimeMillis() / 1000);
  }

  /**
   * Computes the levels of the metric as of the given time.
   * @param id The non-null metric.
   * @param params The non-null parameters.
   * @param cf The non-null consolidation function to read from the store.
   * @param levels_factor Multiplier for absolute levels, e.g. the number of
   * CPU cores for a load metric.
   * @param now The as-of time in Unix epoch seconds.
   * @return The reference value and the levels. Both are empty if history
   * had no value for the current offset.
   * @throws PredictionConfigException if the parameters were missing.
   * @throws NoHistoricDataException if the store had no usable history.
   * @throws java.io.UncheckedIOException if the cache could not be written.
   */
  public PredictionResult computeLevels(final MetricId id,
                                        final PredictionParams params,
                                        final ConsolidationFunction cf,
                                        final double levels_factor,
                                        final long now) {
    if (params == null) {
      throw new PredictionConfigException("Prediction parameters cannot be null.");
    }
    if (id == null) {
      throw new IllegalArgumentException("Metric ID cannot be null.");
    }
    if (cf == null) {
      throw new IllegalArgumentException("Consolidation function cannot be null.");
    }

    final TimegroupSlice current = resolver.resolve(now, params.getPeriod());
    final PredictionSummary summary =
        getPrediction(id, params, cf, current.timegroup(), now);

    final PointStatistics reference = summary.reference(current.offset());
    if (reference == null) {
      LOG.debug("No reference at offset {} of timegroup {} for {}",
          current.offset(), current.timegroup(), id);
      return new PredictionResult(null, EstimatedLevels.NONE);
    }
    return new PredictionResult(reference.average(),
        LevelsEstimator.estimate(
            reference.average(),
            reference.stdev(),
            params.getLevelsLower(),
            params.getLevelsUpper(),
            params.getLevelsUpperMin(),
            levels_factor));
  }

  /**
   * Returns the cached summary of the timegroup if it is still fresh,
   * otherwise recomputes and stores it.
   * @param id The non-null metric.
   * @param params The non-null parameters.
   * @param cf The non-null consolidation function.
   * @param timegroup The non-null timegroup of {@code now}.
   * @param now The as-of time in Unix epoch seconds.
   * @return The summary.
   */
  @VisibleForTesting
  PredictionSummary getPrediction(final MetricId id,
                                  final PredictionParams params,
                                  final ConsolidationFunction cf,
                                  final String timegroup,
                                  final long now) {
    final Lock lock = locks.get(id.toString() + "/" + timegroup);
    lock.lock();
    try {
      cache.invalidate(id, timegroup, false);

      PredictionSummary summary = null;
      if (cache.isFresh(id, timegroup, params, now)) {
        summary = cache.load(id, timegroup);
      }
      if (summary != null) {
        return summary;
      }

      LOG.debug("Calculating prediction data for time group {}", timegroup);
      cache.invalidate(id, timegroup, true);

      final PredictionPeriod period = params.getPeriod();
      final List<TimeWindow> windows = collector.collect(now,
          params.horizonSeconds(), period, timegroup);
      summary = calculate(id, cf, windows);

      final PredictionInfo info = new PredictionInfo(now, windows.get(0), cf,
          id.metric(), period.sliceLength(), params);
      cache.store(id, timegroup, info, summary);
      return summary;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Fetches, aligns and summarizes the windows.
   * @param id The non-null metric.
   * @param cf The non-null consolidation function.
   * @param windows The windows, most recent first.
   * @return The summary.
   * @throws NoHistoricDataException if there were no windows or no data for
   * the most recent one.
   */
  @VisibleForTesting
  PredictionSummary calculate(final MetricId id,
                              final ConsolidationFunction cf,
                              final List<TimeWindow> windows) {
    final ResampledSlices resampled =
        new Resampler(source, id, cf).resample(windows);
    return PredictionSummary.fromStatistics(resampled.window(),
        StatisticalSummarizer.summarize(resampled.slices()));
  }

  /** @return The resolver used for timegroups. */
  public TimegroupResolver resolver() {
    return resolver;
  }
}
