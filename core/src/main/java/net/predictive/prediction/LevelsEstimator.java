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

/**
 * Turns the reference statistics and the configured levels into concrete
 * bounds. Stateless.
 * @since 1.0
 */
public final class LevelsEstimator {

  private LevelsEstimator() {
    // static helpers only
  }

  /**
   * Computes the upper and lower levels.
   * <ul>
   * <li>{@link Levels.Type#ABSOLUTE}: the configured values multiplied by
   * {@code levels_factor}.</li>
   * <li>{@link Levels.Type#RELATIVE}: the reference moved by the configured
   * percentage of itself.</li>
   * <li>{@link Levels.Type#STDEV}: the reference moved by the configured
   * multiple of the standard deviation.</li>
   * </ul>
   * Upper levels move up, lower levels move down. The upper minimum, if
   * given, raises the upper bounds to at least its values.
   * @param reference The reference average, may be null.
   * @param stdev The reference standard deviation, may be null.
   * @param levels_lower The lower levels, may be null.
   * @param levels_upper The upper levels, may be null.
   * @param levels_upper_min The floor for the upper levels, may be null.
   * @param levels_factor Multiplier for absolute levels.
   * @return The levels, {@link EstimatedLevels#NONE} if there was no
   * reference.
   */
  public static EstimatedLevels estimate(final Double reference,
                                         final Double stdev,
                                         final Levels levels_lower,
                                         final Levels levels_upper,
                                         final Thresholds levels_upper_min,
                                         final double levels_factor) {
    if (reference == null) {
      return EstimatedLevels.NONE;
    }

    Thresholds upper = levels_upper == null ? null :
        levelsFromParams(levels_upper, 1, reference, stdev, levels_factor);
    final Thresholds lower = levels_lower == null ? null :
        levelsFromParams(levels_lower, -1, reference, stdev, levels_factor);

    if (upper != null && levels_upper_min != null) {
      upper = new Thresholds(
          Math.max(levels_upper_min.warn(), upper.warn()),
          Math.max(levels_upper_min.crit(), upper.crit()));
    }
    return new EstimatedLevels(upper, lower);
  }

  /**
   * Computes one side of the levels.
   * @param levels The non-null levels.
   * @param sig 1 for the upper side, -1 for the lower one.
   * @param reference The reference average.
   * @param stdev The reference standard deviation, may be null.
   * @param levels_factor Multiplier for absolute levels.
   * @return The bounds or null if they need a standard deviation and there
   * is none.
   */
  static Thresholds levelsFromParams(final Levels levels,
                                     final int sig,
                                     final double reference,
                                     final Double stdev,
                                     final double levels_factor) {
    final Thresholds thresholds = levels.thresholds();
    final double deviation;
    switch (levels.type()) {
    case ABSOLUTE:
      return new Thresholds(thresholds.warn() * levels_factor,
          thresholds.crit() * levels_factor);
    case RELATIVE:
      deviation = reference / 100.0;
      break;
    case STDEV:
      if (stdev == null) {
        return null;
      }
      deviation = stdev;
      break;
    default:
      throw new IllegalArgumentException("Unsupported levels type: "
          + levels.type());
    }
    return new Thresholds(reference + sig * thresholds.warn() * deviation,
        reference + sig * thresholds.crit() * deviation);
  }
}
