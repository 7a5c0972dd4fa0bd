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
 * The outcome of a predictive levels computation: the reference value taken
 * from history and the levels derived from it.
 * @since 1.0
 */
public final class PredictionResult {

  private final Double reference;
  private final EstimatedLevels levels;

  /**
   * Default ctor.
   * @param reference The reference average, may be null.
   * @param levels The non-null levels.
   */
  public PredictionResult(final Double reference, final EstimatedLevels levels) {
    this.reference = reference;
    this.levels = levels;
  }

  /** @return The reference average or null if history had no value for
   * the current offset. */
  public Double reference() {
    return reference;
  }

  /** @return The levels. */
  public EstimatedLevels levels() {
    return levels;
  }

  /** @return The lower warning and critical bounds, null if not set. */
  public Thresholds lower() {
    return levels.lower();
  }

  /** @return The upper warning and critical bounds, null if not set. */
  public Thresholds upper() {
    return levels.upper();
  }

  @Override
  public String toString() {
    return "{reference=" + reference + ", levels=" + levels + "}";
  }
}
