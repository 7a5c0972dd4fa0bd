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
 * The aggregation the time-series store applies when it downsamples raw
 * samples into coarser archives.
 * @since 1.0
 */
public enum ConsolidationFunction {
  MAX,
  MIN,
  AVERAGE;

  /**
   * Case insensitive lookup.
   * @param name A non-null name.
   * @return The function.
   * @throws IllegalArgumentException if the name is unknown.
   */
  public static ConsolidationFunction fromString(final String name) {
    if (name == null) {
      throw new IllegalArgumentException("Consolidation function cannot be null.");
    }
    for (final ConsolidationFunction cf : values()) {
      if (cf.name().equalsIgnoreCase(name)) {
        return cf;
      }
    }
    throw new IllegalArgumentException("Unrecognized consolidation function: "
        + name);
  }
}
