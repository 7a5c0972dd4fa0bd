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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Strings;

import net.predictive.exceptions.PredictionConfigException;
import net.predictive.utils.JSON;

/**
 * The user parameters of a predictive levels computation. Persisted along
 * with every prediction so a change of parameters invalidates it.
 * <pre>
 * {"period": "wday", "horizon": 90,
 *  "levels_upper": ["relative", [10.0, 20.0]],
 *  "levels_lower": ["stdev", [2.0, 4.0]],
 *  "levels_upper_min": [10.0, 15.0]}
 * </pre>
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "period", "horizon", "levels_upper", "levels_lower",
    "levels_upper_min" })
@JsonDeserialize(builder = PredictionParams.Builder.class)
public final class PredictionParams {

  /** The partitioning scheme. */
  private final PredictionPeriod period;

  /** How many days of history to consider. */
  private final int horizon;

  /** Optional upper levels. */
  private final Levels levels_upper;

  /** Optional lower levels. */
  private final Levels levels_lower;

  /** Optional floor for the upper levels. */
  private final Thresholds levels_upper_min;

  /**
   * Default ctor.
   * @param builder The non-null builder to pull values from.
   */
  private PredictionParams(final Builder builder) {
    period = builder.period;
    horizon = builder.horizon;
    levels_upper = builder.levels_upper;
    levels_lower = builder.levels_lower;
    levels_upper_min = builder.levels_upper_min;
  }

  /** @return The partitioning scheme. */
  @JsonProperty("period")
  public PredictionPeriod getPeriod() {
    return period;
  }

  /** @return How many days of history to consider. */
  @JsonProperty("horizon")
  public int getHorizon() {
    return horizon;
  }

  /** @return The horizon in seconds. */
  public long horizonSeconds() {
    return horizon * 86400L;
  }

  /** @return The upper levels, may be null. */
  @JsonProperty("levels_upper")
  public Levels getLevelsUpper() {
    return levels_upper;
  }

  /** @return The lower levels, may be null. */
  @JsonProperty("levels_lower")
  public Levels getLevelsLower() {
    return levels_lower;
  }

  /** @return The floor for the upper levels, may be null. */
  @JsonProperty("levels_upper_min")
  public Thresholds getLevelsUpperMin() {
    return levels_upper_min;
  }

  /**
   * Parses parameters from their JSON form.
   * @param json The non-null JSON.
   * @return The validated parameters.
   * @throws PredictionConfigException if the JSON could not be parsed or the
   * parameters were invalid.
   */
  public static PredictionParams parse(final String json) {
    if (Strings.isNullOrEmpty(json)) {
      throw new PredictionConfigException("Prediction parameters cannot be "
          + "null or empty.");
    }
    try {
      return JSON.parseToObject(json, PredictionParams.class);
    } catch (IllegalArgumentException e) {
      Throwable cause = e;
      while (cause != null) {
        if (cause instanceof PredictionConfigException) {
          throw (PredictionConfigException) cause;
        }
        cause = cause.getCause();
      }
      throw new PredictionConfigException("Invalid prediction parameters: "
          + json, e);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof PredictionParams)) {
      return false;
    }
    final PredictionParams other = (PredictionParams) o;
    return period == other.period &&
        horizon == other.horizon &&
        Objects.equals(levels_upper, other.levels_upper) &&
        Objects.equals(levels_lower, other.levels_lower) &&
        Objects.equals(levels_upper_min, other.levels_upper_min);
  }

  @Override
  public int hashCode() {
    return Objects.hash(period, horizon, levels_upper, levels_lower,
        levels_upper_min);
  }

  @Override
  public String toString() {
    return JSON.serializeToString(this);
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private PredictionPeriod period;
    @JsonProperty
    private int horizon;
    @JsonProperty
    private Levels levels_upper;
    @JsonProperty
    private Levels levels_lower;
    @JsonProperty
    private Thresholds levels_upper_min;

    public Builder setPeriod(final PredictionPeriod period) {
      this.period = period;
      return this;
    }

    /**
     * @param period The parameter name of the period.
     * @return The builder.
     * @throws PredictionConfigException if the period is unknown.
     */
    public Builder setPeriodName(final String period) {
      this.period = PredictionPeriod.fromString(period);
      return this;
    }

    public Builder setHorizon(final int horizon) {
      this.horizon = horizon;
      return this;
    }

    public Builder setLevelsUpper(final Levels levels_upper) {
      this.levels_upper = levels_upper;
      return this;
    }

    public Builder setLevelsLower(final Levels levels_lower) {
      this.levels_lower = levels_lower;
      return this;
    }

    public Builder setLevelsUpperMin(final Thresholds levels_upper_min) {
      this.levels_upper_min = levels_upper_min;
      return this;
    }

    /**
     * @return The validated parameters.
     * @throws PredictionConfigException if the period was missing or the
     * horizon was less than one day.
     */
    public PredictionParams build() {
      if (period == null) {
        throw new PredictionConfigException("Missing prediction period.");
      }
      if (horizon < 1) {
        throw new PredictionConfigException("Horizon must be at least one "
            + "day: " + horizon);
      }
      return new PredictionParams(this);
    }
  }
}
