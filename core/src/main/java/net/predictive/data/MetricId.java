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

import java.util.Objects;

import com.google.common.base.Strings;

/**
 * Identifies one monitored metric: the host, the service on that host and the
 * metric (data source) name within the service.
 * @since 1.0
 */
public final class MetricId {
  private final String host;
  private final String service;
  private final String metric;

  /**
   * Default ctor.
   * @param host A non-null and non-empty host name.
   * @param service A non-null and non-empty service description.
   * @param metric A non-null and non-empty metric name.
   * @throws IllegalArgumentException if any of the names was null or empty.
   */
  public MetricId(final String host, final String service, final String metric) {
    if (Strings.isNullOrEmpty(host)) {
      throw new IllegalArgumentException("Host cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(service)) {
      throw new IllegalArgumentException("Service cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(metric)) {
      throw new IllegalArgumentException("Metric cannot be null or empty.");
    }
    this.host = host;
    this.service = service;
    this.metric = metric;
  }

  public String host() {
    return host;
  }

  public String service() {
    return service;
  }

  public String metric() {
    return metric;
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof MetricId)) {
      return false;
    }
    final MetricId other = (MetricId) o;
    return host.equals(other.host) &&
        service.equals(other.service) &&
        metric.equals(other.metric);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, service, metric);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{host=")
        .append(host)
        .append(", service=")
        .append(service)
        .append(", metric=")
        .append(metric)
        .append("}")
        .toString();
  }
}
