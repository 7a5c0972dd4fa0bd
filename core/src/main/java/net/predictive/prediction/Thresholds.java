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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A warning and a critical value, serialized as {@code [warn, crit]}.
 * @since 1.0
 */
public final class Thresholds {
  private final double warn;
  private final double crit;

  /**
   * Default ctor.
   * @param warn The warning value.
   * @param crit The critical value.
   */
  public Thresholds(final double warn, final double crit) {
    this.warn = warn;
    this.crit = crit;
  }

  /**
   * Deserializes the two element array form.
   * @param values The values.
   * @return The thresholds.
   * @throws IllegalArgumentException if the array did not have exactly two
   * entries.
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Thresholds fromArray(final double[] values) {
    if (values == null || values.length != 2) {
      throw new IllegalArgumentException("Thresholds need exactly a warning "
          + "and a critical value.");
    }
    return new Thresholds(values[0], values[1]);
  }

  /** @return The two element array form. */
  @JsonValue
  public double[] toArray() {
    return new double[] { warn, crit };
  }

  public double warn() {
    return warn;
  }

  public double crit() {
    return crit;
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Thresholds)) {
      return false;
    }
    final Thresholds other = (Thresholds) o;
    return Double.compare(warn, other.warn) == 0 &&
        Double.compare(crit, other.crit) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(warn, crit);
  }

  @Override
  public String toString() {
    return "(" + warn + ", " + crit + ")";
  }
}
