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
package net.predictive.exceptions;

/**
 * Thrown when the data source has nothing usable for the most recent
 * historical window, e.g. a native resolution of zero seconds, or when no
 * window qualifies within the horizon at all.
 * @since 1.0
 */
public final class NoHistoricDataException extends PredictionException {

  /**
   * Constructor.
   * @param msg Message describing the problem.
   */
  public NoHistoricDataException(final String msg) {
    super(msg);
  }

  static final long serialVersionUID = 1602083313;
}
