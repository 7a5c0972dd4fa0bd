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

import static net.predictive.prediction.TestTimegroupResolver.TUESDAY;
import static net.predictive.prediction.TestTimegroupResolver.TUESDAY_MIDNIGHT;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.file.Files;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import net.predictive.data.ConsolidationFunction;
import net.predictive.data.MetricId;
import net.predictive.data.TimeSeries;
import net.predictive.data.TimeSeriesSource;
import net.predictive.data.TimeSeriesWindow;
import net.predictive.exceptions.NoHistoricDataException;
import net.predictive.exceptions.PredictionConfigException;
import net.predictive.utils.Config;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

import com.google.common.collect.Lists;

public final class TestPredictiveLevels {
  private static final MetricId ID = new MetricId("web01", "CPU load", "load1");
  private static final long STEP = 300;
  private static final long WEEK = 7 * 86400L;

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private TimeSeriesSource source;
  private FilePredictionCache cache;
  private PredictiveLevels levels;

  @Before
  public void before() throws Exception {
    source = mock(TimeSeriesSource.class);
    cache = new FilePredictionCache(folder.getRoot().toPath());
    levels = new PredictiveLevels(source, cache, ZoneOffset.UTC, 16);
  }

  @Test
  public void constantMetricAbsoluteLevels() throws Exception {
    when(source.fetch(eq(ID), anyLong(), anyLong(),
        any(ConsolidationFunction.class))).thenAnswer(constant(100));
    final PredictionParams params = PredictionParams.parse(
        "{\"period\":\"day\",\"horizon\":8,"
        + "\"levels_upper\":[\"absolute\",[110,120]]}");

    final PredictionResult result = levels.computeLevels(ID, params,
        ConsolidationFunction.MAX, 1.0, TUESDAY);
    assertEquals(100.0, result.reference(), 0.0);
    assertEquals(110.0, result.upper().warn(), 0.0);
    assertEquals(120.0, result.upper().crit(), 0.0);
    assertNull(result.lower());

    // a single slice for the 7th within eight days
    verify(source, times(1)).fetch(ID, TUESDAY_MIDNIGHT,
        TUESDAY_MIDNIGHT + 86400, ConsolidationFunction.MAX);
    final PredictionSummary summary = cache.load(ID, "7");
    assertEquals(288, summary.getNumPoints());
    assertEquals(100.0, summary.getPoints().get(0).stdev(), 0.0);
  }

  @Test
  public void weeklyStatistics() throws Exception {
    // 110 this week, 100 a week ago, 90 two weeks ago
    when(source.fetch(eq(ID), anyLong(), anyLong(),
        any(ConsolidationFunction.class))).thenAnswer(new Answer<TimeSeries>() {
          @Override
          public TimeSeries answer(final InvocationOnMock invocation) {
            final Long start = invocation.getArgument(1);
            final Long end = invocation.getArgument(2);
            final long weeks_ago = (TUESDAY_MIDNIGHT - start) / WEEK;
            return series(start, end, 110 - 10 * weeks_ago);
          }
        });
    final PredictionParams params = PredictionParams.parse(
        "{\"period\":\"wday\",\"horizon\":21,"
        + "\"levels_upper\":[\"stdev\",[1,2]],"
        + "\"levels_lower\":[\"stdev\",[1,2]]}");

    final PredictionResult result = levels.computeLevels(ID, params,
        ConsolidationFunction.AVERAGE, 1.0, TUESDAY);
    assertEquals(100.0, result.reference(), 0.0);
    assertEquals(new Thresholds(110, 120), result.upper());
    assertEquals(new Thresholds(90, 80), result.lower());
    verify(source, times(3)).fetch(eq(ID), anyLong(), anyLong(),
        eq(ConsolidationFunction.AVERAGE));
  }

  @Test
  public void reusesFreshPrediction() throws Exception {
    when(source.fetch(eq(ID), anyLong(), anyLong(),
        any(ConsolidationFunction.class))).thenAnswer(constant(100));
    final PredictionParams params = PredictionParams.parse(
        "{\"period\":\"hour\",\"horizon\":3}");

    levels.computeLevels(ID, params, ConsolidationFunction.MAX, 1.0, TUESDAY);
    levels.computeLevels(ID, params, ConsolidationFunction.MAX, 1.0,
        TUESDAY + 600);
    verify(source, times(3)).fetch(eq(ID), anyLong(), anyLong(),
        eq(ConsolidationFunction.MAX));

    // the hourly prediction is valid for one day
    levels.computeLevels(ID, params, ConsolidationFunction.MAX, 1.0,
        TUESDAY + 86400);
    verify(source, times(6)).fetch(eq(ID), anyLong(), anyLong(),
        eq(ConsolidationFunction.MAX));
  }

  @Test
  public void recomputesWhenParamsChange() throws Exception {
    when(source.fetch(eq(ID), anyLong(), anyLong(),
        any(ConsolidationFunction.class))).thenAnswer(constant(100));
    levels.computeLevels(ID, PredictionParams.parse(
        "{\"period\":\"hour\",\"horizon\":1}"),
        ConsolidationFunction.MAX, 1.0, TUESDAY);
    levels.computeLevels(ID, PredictionParams.parse(
        "{\"period\":\"hour\",\"horizon\":1,"
        + "\"levels_upper\":[\"relative\",[10,20]]}"),
        ConsolidationFunction.MAX, 1.0, TUESDAY);
    verify(source, times(2)).fetch(eq(ID), anyLong(), anyLong(),
        eq(ConsolidationFunction.MAX));
  }

  @Test
  public void recomputesCorruptPrediction() throws Exception {
    when(source.fetch(eq(ID), anyLong(), anyLong(),
        any(ConsolidationFunction.class))).thenAnswer(constant(100));
    final PredictionParams params = PredictionParams.parse(
        "{\"period\":\"hour\",\"horizon\":1}");
    levels.computeLevels(ID, params, ConsolidationFunction.MAX, 1.0, TUESDAY);
    Files.write(cache.dataFile(ID, PredictionPeriod.EVERYDAY),
        "garbage".getBytes("UTF-8"));

    final PredictionResult result = levels.computeLevels(ID, params,
        ConsolidationFunction.MAX, 1.0, TUESDAY);
    assertEquals(100.0, result.reference(), 0.0);
    verify(source, times(2)).fetch(eq(ID), anyLong(), anyLong(),
        eq(ConsolidationFunction.MAX));
  }

  @Test
  public void noHistoricData() throws Exception {
    when(source.fetch(eq(ID), anyLong(), anyLong(),
        any(ConsolidationFunction.class)))
      .thenReturn(new TimeSeries(new TimeSeriesWindow(0, 0, 0), new double[0]));
    try {
      levels.computeLevels(ID, PredictionParams.parse(
          "{\"period\":\"wday\",\"horizon\":28}"),
          ConsolidationFunction.MAX, 1.0, TUESDAY);
      fail("Expected a NoHistoricDataException");
    } catch (NoHistoricDataException e) {
      assertFalse(Files.exists(cache.infoFile(ID, "tuesday")));
    }
  }

  @Test
  public void unknownPeriodFailsBeforeIO() throws Exception {
    try {
      levels.computeLevels(ID, PredictionParams.parse(
          "{\"period\":\"year\",\"horizon\":28}"),
          ConsolidationFunction.MAX, 1.0, TUESDAY);
      fail("Expected a PredictionConfigException");
    } catch (PredictionConfigException e) {
      verifyNoInteractions(source);
    }
  }

  @Test (expected = PredictionConfigException.class)
  public void nullParams() throws Exception {
    levels.computeLevels(ID, null, ConsolidationFunction.MAX, 1.0, TUESDAY);
  }

  @Test
  public void referenceMissingInShortData() throws Exception {
    // the source only has data for the first hour of the day
    when(source.fetch(eq(ID), anyLong(), anyLong(),
        any(ConsolidationFunction.class))).thenAnswer(new Answer<TimeSeries>() {
          @Override
          public TimeSeries answer(final InvocationOnMock invocation) {
            final Long start = invocation.getArgument(1);
            return series(start, start + 3600, 100);
          }
        });
    final PredictionResult result = levels.computeLevels(ID,
        PredictionParams.parse("{\"period\":\"hour\",\"horizon\":1,"
            + "\"levels_upper\":[\"absolute\",[110,120]]}"),
        ConsolidationFunction.MAX, 1.0, TUESDAY);
    assertNull(result.reference());
    assertSame(EstimatedLevels.NONE, result.levels());
  }

  @Test
  public void concurrentMissesComputeOnce() throws Exception {
    when(source.fetch(eq(ID), anyLong(), anyLong(),
        any(ConsolidationFunction.class))).thenAnswer(constant(100));
    final PredictionParams params = PredictionParams.parse(
        "{\"period\":\"hour\",\"horizon\":2}");
    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Callable<PredictionResult>> tasks = Lists.newArrayList();
      for (int i = 0; i < 8; i++) {
        tasks.add(new Callable<PredictionResult>() {
          @Override
          public PredictionResult call() throws Exception {
            return levels.computeLevels(ID, params, ConsolidationFunction.MAX,
                1.0, TUESDAY);
          }
        });
      }
      for (final Future<PredictionResult> future : executor.invokeAll(tasks)) {
        assertEquals(100.0, future.get().reference(), 0.0);
      }
    } finally {
      executor.shutdownNow();
    }
    verify(source, times(2)).fetch(eq(ID), anyLong(), anyLong(),
        eq(ConsolidationFunction.MAX));
  }

  @Test
  public void ctorConfig() throws Exception {
    final Config config = new Config();
    config.overrideConfig(Config.CACHE_DIRECTORY_KEY,
        folder.getRoot().getAbsolutePath());
    config.overrideConfig(Config.TIMEZONE_KEY, "Europe/Berlin");
    final PredictiveLevels from_config = new PredictiveLevels(config, source);
    assertEquals("Europe/Berlin", from_config.resolver().zone().getId());
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorNoStripes() throws Exception {
    new PredictiveLevels(source, cache, ZoneOffset.UTC, 0);
  }

  private static Answer<TimeSeries> constant(final double value) {
    return new Answer<TimeSeries>() {
      @Override
      public TimeSeries answer(final InvocationOnMock invocation) {
        final Long start = invocation.getArgument(1);
        final Long end = invocation.getArgument(2);
        return series(start, end, value);
      }
    };
  }

  private static TimeSeries series(final long start,
                                   final long end,
                                   final double value) {
    final double[] values = new double[(int) ((end - start) / STEP)];
    Arrays.fill(values, value);
    return new TimeSeries(new TimeSeriesWindow(start, end, STEP), values);
  }
}
