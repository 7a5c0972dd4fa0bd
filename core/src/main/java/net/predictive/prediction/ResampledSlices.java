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

import java.util.Collections;
import java.util.List;

import net.predictive.data.TimeSeriesWindow;

/**
 * The historical slices of a metric, all on one common resolution.
 * @since 1.0
 */
public final class ResampledSlices {
  private final TimeSeriesWindow window;
  private final List<double[]> slices;

  /**
   * Default ctor.
   * @param window The non-null common resolution.
   * @param slices The non-null slices, each with {@code window.size()} values.
   */
  public ResampledSlices(final TimeSeriesWindow window,
                         final List<double[]> slices) {
    this.window = window;
    this.slices = slices;
  }

  /** @return The common resolution the slices are aligned to. */
  public TimeSeriesWindow window() {
    return window;
  }

  /** @return The slices, most recent first. Missing values are NaN. */
  public List<double[]> slices() {
    return Collections.unmodifiableList(slices);
  }
}
