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

import java.time.LocalDateTime;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import net.predictive.exceptions.PredictionConfigException;

/**
 * The supported ways of partitioning time into recurring buckets. Each period
 * slices time into units of {@link #sliceLength()} seconds and names the
 * bucket a slice belongs to. A computed prediction stays valid for
 * {@link #validSlices()} slices.
 * @since 1.0
 */
public enum PredictionPeriod {
  /** One bucket per weekday, e.g. "monday". */
  WDAY("wday", 86400, 7) {
    @Override
    public String timegroup(final LocalDateTime local) {
      return local.getDayOfWeek().name().toLowerCase(Locale.ROOT);
    }
  },

  /** One bucket per day of the month, "1" through "31". */
  DAY("day", 86400, 28) {
    @Override
    public String timegroup(final LocalDateTime local) {
      return Integer.toString(local.getDayOfMonth());
    }
  },

  /** Every day shares a single bucket, sliced by the day. */
  HOUR("hour", 86400, 1) {
    @Override
    public String timegroup(final LocalDateTime local) {
      return EVERYDAY;
    }
  },

  /** Every hour shares a single bucket, sliced by the hour. */
  MINUTE("minute", 3600, 24) {
    @Override
    public String timegroup(final LocalDateTime local) {
      return EVERYHOUR;
    }
  };

  /** Timegroup of the {@link #HOUR} period. */
  public static final String EVERYDAY = "everyday";

  /** Timegroup of the {@link #MINUTE} period. */
  public static final String EVERYHOUR = "everyhour";

  /** The name used in the parameters. */
  private final String name;

  /** Length of one slice in seconds. */
  private final long slice_length;

  /** How many slices a computed prediction stays fresh. */
  private final int valid_slices;

  PredictionPeriod(final String name,
                   final long slice_length,
                   final int valid_slices) {
    this.name = name;
    this.slice_length = slice_length;
    this.valid_slices = valid_slices;
  }

  /**
   * Names the bucket the local date and time falls into.
   * @param local The non-null local date time.
   * @return The non-null timegroup.
   */
  public abstract String timegroup(final LocalDateTime local);

  /** @return The name used in the parameters. */
  @JsonValue
  public String getName() {
    return name;
  }

  /** @return Length of one slice in seconds. */
  public long sliceLength() {
    return slice_length;
  }

  /** @return How many slices a computed prediction stays fresh. */
  public int validSlices() {
    return valid_slices;
  }

  /** @return How many seconds a computed prediction stays fresh. */
  public long validity() {
    return valid_slices * slice_length;
  }

  /**
   * Looks up the period by its parameter name.
   * @param name The name to find a period for.
   * @return The period.
   * @throws PredictionConfigException if the name was null or unknown.
   */
  @JsonCreator
  public static PredictionPeriod fromString(final String name) {
    if (name != null) {
      for (final PredictionPeriod period : values()) {
        if (period.name.equals(name)) {
          return period;
        }
      }
    }
    throw new PredictionConfigException("Unknown prediction period: " + name);
  }
}
