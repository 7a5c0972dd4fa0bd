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

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

/**
 * How to derive one side (upper or lower) of the levels from the reference.
 * Serialized as {@code [type, [warn, crit]]}, e.g.
 * {@code ["stdev", [2.0, 4.0]]}.
 * @since 1.0
 */
public final class Levels {

  /** The interpretation of the configured values. */
  public static enum Type {
    /** The values are the bounds themselves, scaled by the levels factor. */
    ABSOLUTE("absolute"),

    /** The values are percentages of the reference value. */
    RELATIVE("relative"),

    /** The values are multiples of the standard deviation. */
    STDEV("stdev");

    private final String name;

    Type(final String name) {
      this.name = name;
    }

    /** @return The name used in the parameters. */
    public String getName() {
      return name;
    }

    /**
     * @param name The name to look up.
     * @return The type.
     * @throws IllegalArgumentException if the name was unknown.
     */
    public static Type fromString(final String name) {
      for (final Type type : values()) {
        if (type.name.equals(name)) {
          return type;
        }
      }
      throw new IllegalArgumentException("Unrecognized levels type: " + name);
    }
  }

  private final Type type;
  private final Thresholds thresholds;

  /**
   * Default ctor.
   * @param type The non-null type.
   * @param thresholds The non-null values.
   * @throws IllegalArgumentException if either argument was null.
   */
  public Levels(final Type type, final Thresholds thresholds) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (thresholds == null) {
      throw new IllegalArgumentException("Thresholds cannot be null.");
    }
    this.type = type;
    this.thresholds = thresholds;
  }

  /**
   * Shorthand for {@code new Levels(type, new Thresholds(warn, crit))}.
   * @param type The non-null type.
   * @param warn The warning value.
   * @param crit The critical value.
   * @return The levels.
   */
  public static Levels of(final Type type, final double warn, final double crit) {
    return new Levels(type, new Thresholds(warn, crit));
  }

  /**
   * Parses the {@code [type, [warn, crit]]} form.
   * @param node The node to parse.
   * @return The levels.
   * @throws IllegalArgumentException if the node had a different shape.
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Levels fromJson(final JsonNode node) {
    if (node == null || !node.isArray() || node.size() != 2) {
      throw new IllegalArgumentException("Levels must be [type, [warn, crit]]: "
          + node);
    }
    final JsonNode values = node.get(1);
    if (!node.get(0).isTextual() || !values.isArray() || values.size() != 2
        || !values.get(0).isNumber() || !values.get(1).isNumber()) {
      throw new IllegalArgumentException("Levels must be [type, [warn, crit]]: "
          + node);
    }
    return of(Type.fromString(node.get(0).asText()),
        values.get(0).asDouble(), values.get(1).asDouble());
  }

  /** @return The {@code [type, [warn, crit]]} form. */
  @JsonValue
  public List<Object> toJson() {
    return ImmutableList.<Object>of(type.getName(), thresholds.toArray());
  }

  public Type type() {
    return type;
  }

  public Thresholds thresholds() {
    return thresholds;
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Levels)) {
      return false;
    }
    final Levels other = (Levels) o;
    return type == other.type && thresholds.equals(other.thresholds);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, thresholds);
  }

  @Override
  public String toString() {
    return "(" + type.getName() + ", " + thresholds + ")";
  }
}
