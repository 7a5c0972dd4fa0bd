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
 * Base class for failures raised while computing predictive levels. Callers
 * usually treat any of these as "no levels available" for the current check
 * cycle.
 * @since 1.0
 */
public class PredictionException extends RuntimeException {

  /**
   * Constructor.
   * @param msg Message describing the problem.
   */
  public PredictionException(final String msg) {
    super(msg);
  }

  /**
   * Constructor.
   * @param msg Message describing the problem.
   * @param cause The source exception.
   */
  public PredictionException(final String msg, final Throwable cause) {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1602083312;
}
