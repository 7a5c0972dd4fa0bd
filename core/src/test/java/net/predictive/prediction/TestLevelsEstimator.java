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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public final class TestLevelsEstimator {

  @Test
  public void noReference() throws Exception {
    assertEquals(EstimatedLevels.NONE, LevelsEstimator.estimate(null, 5.0,
        Levels.of(Levels.Type.ABSOLUTE, 1, 2),
        Levels.of(Levels.Type.ABSOLUTE, 1, 2), null, 1.0));
  }

  @Test
  public void noLevelsConfigured() throws Exception {
    final EstimatedLevels levels =
        LevelsEstimator.estimate(100.0, 5.0, null, null, null, 1.0);
    assertNull(levels.upper());
    assertNull(levels.lower());
    assertNull(levels.upperWarn());
    assertNull(levels.lowerCrit());
  }

  @Test
  public void absolute() throws Exception {
    final EstimatedLevels levels = LevelsEstimator.estimate(100.0, 0.0,
        Levels.of(Levels.Type.ABSOLUTE, 90, 80),
        Levels.of(Levels.Type.ABSOLUTE, 110, 120), null, 1.0);
    assertEquals(new Thresholds(110, 120), levels.upper());
    assertEquals(new Thresholds(90, 80), levels.lower());
  }

  @Test
  public void absoluteScaled() throws Exception {
    final EstimatedLevels levels = LevelsEstimator.estimate(100.0, 0.0,
        null, Levels.of(Levels.Type.ABSOLUTE, 110, 120), null, 2.0);
    assertEquals(220, levels.upperWarn(), 0.0);
    assertEquals(240, levels.upperCrit(), 0.0);
  }

  @Test
  public void relative() throws Exception {
    final EstimatedLevels levels = LevelsEstimator.estimate(200.0, 0.0,
        Levels.of(Levels.Type.RELATIVE, 10, 20),
        Levels.of(Levels.Type.RELATIVE, 10, 20), null, 2.0);
    // the factor only scales absolute levels
    assertEquals(new Thresholds(220, 240), levels.upper());
    assertEquals(new Thresholds(180, 160), levels.lower());
  }

  @Test
  public void stdev() throws Exception {
    final EstimatedLevels levels = LevelsEstimator.estimate(100.0, 5.0,
        Levels.of(Levels.Type.STDEV, 2, 4),
        Levels.of(Levels.Type.STDEV, 2, 4), null, 1.0);
    assertEquals(new Thresholds(110, 120), levels.upper());
    assertEquals(new Thresholds(90, 80), levels.lower());
  }

  @Test
  public void stdevUnknown() throws Exception {
    final EstimatedLevels levels = LevelsEstimator.estimate(100.0, null,
        Levels.of(Levels.Type.RELATIVE, 10, 20),
        Levels.of(Levels.Type.STDEV, 2, 4), null, 1.0);
    assertNull(levels.upper());
    assertEquals(new Thresholds(90, 80), levels.lower());
  }

  @Test
  public void upperMinimum() throws Exception {
    final EstimatedLevels levels = LevelsEstimator.estimate(100.0, 5.0,
        null, Levels.of(Levels.Type.STDEV, 2, 4), new Thresholds(115, 100),
        1.0);
    assertEquals(new Thresholds(115, 120), levels.upper());
  }

  @Test
  public void upperMinimumWithoutUpperLevels() throws Exception {
    assertNull(LevelsEstimator.estimate(100.0, 5.0, null, null,
        new Thresholds(115, 100), 1.0).upper());
  }

  @Test
  public void zeroReferenceIsAReference() throws Exception {
    final EstimatedLevels levels = LevelsEstimator.estimate(0.0, 0.0,
        null, Levels.of(Levels.Type.RELATIVE, 10, 20), null, 1.0);
    assertEquals(new Thresholds(0, 0), levels.upper());
  }
}
