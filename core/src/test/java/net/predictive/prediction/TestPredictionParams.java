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

import net.predictive.exceptions.PredictionConfigException;
import net.predictive.utils.JSON;

import org.junit.Test;

public final class TestPredictionParams {

  @Test
  public void parse() throws Exception {
    final PredictionParams params = PredictionParams.parse(
        "{\"period\":\"wday\",\"horizon\":90,"
        + "\"levels_upper\":[\"relative\",[10,20]],"
        + "\"levels_lower\":[\"stdev\",[2.0,4.0]],"
        + "\"levels_upper_min\":[5,10]}");
    assertEquals(PredictionPeriod.WDAY, params.getPeriod());
    assertEquals(90, params.getHorizon());
    assertEquals(90 * 86400L, params.horizonSeconds());
    assertEquals(Levels.of(Levels.Type.RELATIVE, 10, 20),
        params.getLevelsUpper());
    assertEquals(Levels.of(Levels.Type.STDEV, 2, 4), params.getLevelsLower());
    assertEquals(new Thresholds(5, 10), params.getLevelsUpperMin());
  }

  @Test
  public void parseMinimal() throws Exception {
    final PredictionParams params =
        PredictionParams.parse("{\"period\":\"minute\",\"horizon\":1}");
    assertEquals(PredictionPeriod.MINUTE, params.getPeriod());
    assertNull(params.getLevelsUpper());
    assertNull(params.getLevelsLower());
    assertNull(params.getLevelsUpperMin());
  }

  @Test
  public void serialize() throws Exception {
    final PredictionParams params = PredictionParams.newBuilder()
        .setPeriod(PredictionPeriod.DAY)
        .setHorizon(8)
        .setLevelsUpper(Levels.of(Levels.Type.ABSOLUTE, 110, 120))
        .build();
    final String json = JSON.serializeToString(params);
    assertEquals("{\"period\":\"day\",\"horizon\":8,"
        + "\"levels_upper\":[\"absolute\",[110.0,120.0]]}", json);
    assertEquals(params, PredictionParams.parse(json));
  }

  @Test (expected = PredictionConfigException.class)
  public void parseUnknownPeriod() throws Exception {
    PredictionParams.parse("{\"period\":\"year\",\"horizon\":8}");
  }

  @Test (expected = PredictionConfigException.class)
  public void parseMissingPeriod() throws Exception {
    PredictionParams.parse("{\"horizon\":8}");
  }

  @Test (expected = PredictionConfigException.class)
  public void parseZeroHorizon() throws Exception {
    PredictionParams.parse("{\"period\":\"day\",\"horizon\":0}");
  }

  @Test (expected = PredictionConfigException.class)
  public void parseUnknownLevelsType() throws Exception {
    PredictionParams.parse("{\"period\":\"day\",\"horizon\":8,"
        + "\"levels_upper\":[\"percentile\",[10,20]]}");
  }

  @Test (expected = PredictionConfigException.class)
  public void parseMalformedLevels() throws Exception {
    PredictionParams.parse("{\"period\":\"day\",\"horizon\":8,"
        + "\"levels_upper\":[\"absolute\",10]}");
  }

  @Test (expected = PredictionConfigException.class)
  public void parseNotJson() throws Exception {
    PredictionParams.parse("period=day");
  }

  @Test (expected = PredictionConfigException.class)
  public void parseEmpty() throws Exception {
    PredictionParams.parse("");
  }

  @Test
  public void builderPeriodName() throws Exception {
    assertEquals(PredictionPeriod.HOUR, PredictionParams.newBuilder()
        .setPeriodName("hour")
        .setHorizon(30)
        .build()
        .getPeriod());
  }

  @Test (expected = PredictionConfigException.class)
  public void builderUnknownPeriodName() throws Exception {
    PredictionParams.newBuilder().setPeriodName("fortnight");
  }
}
