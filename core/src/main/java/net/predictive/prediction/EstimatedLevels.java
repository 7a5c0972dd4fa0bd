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
 * The adaptive levels derived from a prediction. Each side is either fully
 * present (warning and critical) or absent.
 * @since 1.0
 */
public final class EstimatedLevels {

  /** No levels on either side. */
  public static final EstimatedLevels NONE = new EstimatedLevels(null, null);

  private final Thresholds upper;
  private final Thresholds lower;

  /**
   * Default ctor.
   * @param upper The upper levels, may be null.
   * @param lower The lower levels, may be null.
   */
  public EstimatedLevels(final Thresholds upper, final Thresholds lower) {
    this.upper = upper;
    this.lower = lower;
  }

  /** @return The upper warning and critical bounds, null if not set. */
  public Thresholds upper() {
    return upper;
  }

  /** @return The lower warning and critical bounds, null if not set. */
  public Thresholds lower() {
    return lower;
  }

  /** @return The upper warning bound, null if not set. */
  public Double upperWarn() {
    return upper == null ? null : upper.warn();
  }

  /** @return The upper critical bound, null if not set. */
  public Double upperCrit() {
    return upper == null ? null : upper.crit();
  }

  /** @return The lower warning bound, null if not set. */
  public Double lowerWarn() {
    return lower == null ? null : lower.warn();
  }

  /** @return The lower critical bound, null if not set. */
  public Double lowerCrit() {
    return lower == null ? null : lower.crit();
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof EstimatedLevels)) {
      return false;
    }
    final EstimatedLevels other = (EstimatedLevels) o;
    return Objects.equals(upper, other.upper) &&
        Objects.equals(lower, other.lower);
  }

  @Override
  public int hashCode() {
    return Objects.hash(upper, lower);
  }

  @Override
  public String toString() {
    return "{upper=" + upper + ", lower=" + lower + "}";
  }
}
