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

import java.time.LocalDateTime;

import net.predictive.exceptions.PredictionConfigException;
import net.predictive.utils.JSON;

import org.junit.Test;

public final class TestPredictionPeriod {

  @Test
  public void fromString() throws Exception {
    assertEquals(PredictionPeriod.WDAY, PredictionPeriod.fromString("wday"));
    assertEquals(PredictionPeriod.DAY, PredictionPeriod.fromString("day"));
    assertEquals(PredictionPeriod.HOUR, PredictionPeriod.fromString("hour"));
    assertEquals(PredictionPeriod.MINUTE,
        PredictionPeriod.fromString("minute"));
  }

  @Test (expected = PredictionConfigException.class)
  public void fromStringUnknown() throws Exception {
    PredictionPeriod.fromString("year");
  }

  @Test (expected = PredictionConfigException.class)
  public void fromStringNull() throws Exception {
    PredictionPeriod.fromString(null);
  }

  @Test
  public void sliceLengths() throws Exception {
    assertEquals(86400, PredictionPeriod.WDAY.sliceLength());
    assertEquals(86400, PredictionPeriod.DAY.sliceLength());
    assertEquals(86400, PredictionPeriod.HOUR.sliceLength());
    assertEquals(3600, PredictionPeriod.MINUTE.sliceLength());
  }

  @Test
  public void validity() throws Exception {
    assertEquals(7 * 86400, PredictionPeriod.WDAY.validity());
    assertEquals(28 * 86400, PredictionPeriod.DAY.validity());
    assertEquals(86400, PredictionPeriod.HOUR.validity());
    assertEquals(24 * 3600, PredictionPeriod.MINUTE.validity());
  }

  @Test
  public void timegroups() throws Exception {
    // a Tuesday
    final LocalDateTime local = LocalDateTime.of(2020, 1, 7, 10, 30);
    assertEquals("tuesday", PredictionPeriod.WDAY.timegroup(local));
    assertEquals("7", PredictionPeriod.DAY.timegroup(local));
    assertEquals("everyday", PredictionPeriod.HOUR.timegroup(local));
    assertEquals("everyhour", PredictionPeriod.MINUTE.timegroup(local));
  }

  @Test
  public void serialize() throws Exception {
    assertEquals("\"wday\"", JSON.serializeToString(PredictionPeriod.WDAY));
    assertEquals(PredictionPeriod.MINUTE,
        JSON.parseToObject("\"minute\"", PredictionPeriod.class));
  }
}
