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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import net.predictive.data.ConsolidationFunction;

/**
 * The metadata sidecar persisted next to every {@link PredictionSummary}: when
 * and from what the summary was computed. Files written by older versions use
 * the short names {@code time}, {@code cf}, {@code dsname} and {@code slice};
 * those are accepted on read.
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "computed_at", "range", "consolidation_function",
    "metric_name", "slice_length", "params" })
public final class PredictionInfo {
  private final long computed_at;
  private final TimeWindow range;
  private final ConsolidationFunction consolidation_function;
  private final String metric_name;
  private final long slice_length;
  private final PredictionParams params;

  /**
   * Default ctor.
   * @param computed_at When the summary was computed, Unix epoch seconds.
   * @param range The non-null most recent window the summary was built from.
   * @param consolidation_function The non-null consolidation function read.
   * @param metric_name The non-null metric name.
   * @param slice_length The slice length in seconds.
   * @param params The non-null parameters used.
   * @throws IllegalArgumentException if a required field was missing.
   */
  @JsonCreator
  public PredictionInfo(
      @JsonProperty("computed_at") @JsonAlias("time") final Long computed_at,
      @JsonProperty("range") final TimeWindow range,
      @JsonProperty("consolidation_function") @JsonAlias("cf")
          final ConsolidationFunction consolidation_function,
      @JsonProperty("metric_name") @JsonAlias("dsname") final String metric_name,
      @JsonProperty("slice_length") @JsonAlias("slice") final Long slice_length,
      @JsonProperty("params") final PredictionParams params) {
    if (computed_at == null) {
      throw new IllegalArgumentException("Missing computation time.");
    }
    if (range == null) {
      throw new IllegalArgumentException("Missing range.");
    }
    if (consolidation_function == null) {
      throw new IllegalArgumentException("Missing consolidation function.");
    }
    if (metric_name == null) {
      throw new IllegalArgumentException("Missing metric name.");
    }
    if (slice_length == null || slice_length <= 0) {
      throw new IllegalArgumentException("Invalid slice length: "
          + slice_length);
    }
    if (params == null) {
      throw new IllegalArgumentException("Missing parameters.");
    }
    this.computed_at = computed_at;
    this.range = range;
    this.consolidation_function = consolidation_function;
    this.metric_name = metric_name;
    this.slice_length = slice_length;
    this.params = params;
  }

  @JsonProperty("computed_at")
  public long getComputedAt() {
    return computed_at;
  }

  @JsonProperty("range")
  public TimeWindow getRange() {
    return range;
  }

  @JsonProperty("consolidation_function")
  public ConsolidationFunction getConsolidationFunction() {
    return consolidation_function;
  }

  @JsonProperty("metric_name")
  public String getMetricName() {
    return metric_name;
  }

  @JsonProperty("slice_length")
  public long getSliceLength() {
    return slice_length;
  }

  @JsonProperty("params")
  public PredictionParams getParams() {
    return params;
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof PredictionInfo)) {
      return false;
    }
    final PredictionInfo other = (PredictionInfo) o;
    return computed_at == other.computed_at &&
        slice_length == other.slice_length &&
        range.equals(other.range) &&
        consolidation_function == other.consolidation_function &&
        metric_name.equals(other.metric_name) &&
        params.equals(other.params);
  }

  @Override
  public int hashCode() {
    return Objects.hash(computed_at, range, consolidation_function,
        metric_name, slice_length, params);
  }
}
