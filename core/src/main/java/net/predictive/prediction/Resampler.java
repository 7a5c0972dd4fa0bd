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

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.predictive.data.ConsolidationFunction;
import net.predictive.data.MetricId;
import net.predictive.data.TimeSeries;
import net.predictive.data.TimeSeriesSource;
import net.predictive.data.TimeSeriesWindow;
import net.predictive.exceptions.NoHistoricDataException;

/**
 * Fetches the raw series for every historical slice and up-samples them onto
 * one common resolution.
 * <p>
 * The stores keep older data at coarser resolutions, so the youngest slice is
 * assumed to have the finest one and its resolution becomes the common one.
 * Every older slice is shifted forward onto the youngest slice's start.
 * @since 1.0
 */
public class Resampler {
  private static final Logger LOG = LoggerFactory.getLogger(Resampler.class);

  private final TimeSeriesSource source;
  private final MetricId id;
  private final ConsolidationFunction cf;

  /**
   * Default ctor.
   * @param source The non-null data source.
   * @param id The non-null metric to read.
   * @param cf The non-null consolidation function to read.
   * @throws IllegalArgumentException if any argument was null.
   */
  public Resampler(final TimeSeriesSource source,
                   final MetricId id,
                   final ConsolidationFunction cf) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    if (id == null) {
      throw new IllegalArgumentException("Metric ID cannot be null.");
    }
    if (cf == null) {
      throw new IllegalArgumentException("Consolidation function cannot be null.");
    }
    this.source = source;
    this.id = id;
    this.cf = cf;
  }

  /**
   * Collects all time slices and up-samples them to the same resolution.
   * @param windows The non-null windows, most recent first.
   * @return The slices on the resolution of the most recent one.
   * @throws NoHistoricDataException if there were no windows or the store
   * has no data for the most recent one.
   */
  public ResampledSlices resample(final List<TimeWindow> windows) {
    if (windows == null || windows.isEmpty()) {
      throw new NoHistoricDataException("No time windows to fetch for " + id);
    }
    final TimeWindow youngest_window = windows.get(0);
    final long from_time = youngest_window.start();

    final TimeSeries youngest = source.fetch(id, youngest_window.start(),
        youngest_window.end(), cf);
    if (youngest == null || youngest.window().step() == 0) {
      throw new NoHistoricDataException("Got no historic metrics for " + id);
    }

    // trim a ragged end so the window spans a whole number of steps.
    final TimeSeriesWindow native_window = youngest.window();
    final TimeSeriesWindow twindow = new TimeSeriesWindow(
        native_window.start(),
        native_window.start() + native_window.size() * native_window.step(),
        native_window.step());

    final List<double[]> slices = Lists.newArrayListWithCapacity(windows.size());
    slices.add(youngest.bfillUpsample(twindow, 0));
    for (int i = 1; i < windows.size(); i++) {
      final TimeWindow window = windows.get(i);
      final TimeSeries series = source.fetch(id, window.start(), window.end(), cf);
      if (series == null || series.window().step() == 0) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("No data for " + id + " in window " + window);
        }
        final double[] empty = new double[twindow.size()];
        Arrays.fill(empty, Double.NaN);
        slices.add(empty);
        continue;
      }
      slices.add(series.bfillUpsample(twindow, from_time - window.start()));
    }
    return new ResampledSlices(twindow, slices);
  }
}
