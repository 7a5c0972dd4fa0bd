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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;

import net.predictive.data.MetricId;
import net.predictive.utils.Config;
import net.predictive.utils.FileSystem;
import net.predictive.utils.JSON;
import net.predictive.utils.JSONException;

/**
 * Keeps predictions as JSON files below a root directory:
 * {@code <root>/<host>/<service>/<metric>/<timegroup>} for the summary and
 * {@code <timegroup>.info} next to it for the metadata. Both are written via
 * temp file and rename, the summary first.
 * <p>
 * Anything that cannot be read back, be it missing, empty or malformed, is a
 * cache miss.
 *
 * @since 1.0
 */
public class FilePredictionCache implements PredictionCache {
  private static final Logger LOG =
      LoggerFactory.getLogger(FilePredictionCache.class);

  /** Suffix of the metadata sidecar. */
  public static final String INFO_SUFFIX = ".info";

  /** Characters that are replaced in path elements. */
  private static final CharMatcher UNSAFE = CharMatcher.anyOf(" :/\\");

  /** The root directory. */
  private final Path root;

  /**
   * Default ctor.
   * @param root The non-null root directory. Created on the first write.
   * @throws IllegalArgumentException if the root was null.
   */
  public FilePredictionCache(final Path root) {
    if (root == null) {
      throw new IllegalArgumentException("Root directory cannot be null.");
    }
    this.root = root;
  }

  /**
   * Ctor using {@link Config#CACHE_DIRECTORY_KEY} as the root.
   * @param config The non-null config.
   * @throws IllegalArgumentException if the directory was not configured.
   */
  public FilePredictionCache(final Config config) {
    this(rootFrom(config));
  }

  @Override
  public boolean isFresh(final MetricId id,
                         final String timegroup,
                         final PredictionParams params,
                         final long now) {
    final PredictionInfo last_info = loadInfo(id, timegroup);
    if (last_info == null) {
      return false;
    }

    final PredictionPeriod period = params.getPeriod();
    if (now >= last_info.getComputedAt() + period.validity()) {
      LOG.debug("Prediction of {} outdated", timegroup);
      return false;
    }

    if (!JSON.normalize(last_info.getParams()).equals(JSON.normalize(params))) {
      LOG.debug("Prediction parameters have changed.");
      return false;
    }
    return true;
  }

  @Override
  public PredictionInfo loadInfo(final MetricId id, final String timegroup) {
    return read(infoFile(id, timegroup), PredictionInfo.class, timegroup);
  }

  @Override
  public PredictionSummary load(final MetricId id, final String timegroup) {
    return read(dataFile(id, timegroup), PredictionSummary.class, timegroup);
  }

  @Override
  public void store(final MetricId id,
                    final String timegroup,
                    final PredictionInfo info,
                    final PredictionSummary summary) {
    if (info == null) {
      throw new IllegalArgumentException("Info cannot be null.");
    }
    if (summary == null) {
      throw new IllegalArgumentException("Summary cannot be null.");
    }
    FileSystem.checkDirectory(directoryFor(id).toString(), true, true);
    FileSystem.atomicWrite(dataFile(id, timegroup),
        JSON.serializeToBytes(summary));
    FileSystem.atomicWrite(infoFile(id, timegroup),
        JSON.serializeToBytes(info));
  }

  @Override
  public void invalidate(final MetricId id,
                         final String timegroup,
                         final boolean force) {
    for (final Path file : new Path[] { dataFile(id, timegroup),
                                        infoFile(id, timegroup) }) {
      try {
        if (force || Files.size(file) == 0) {
          if (Files.deleteIfExists(file)) {
            LOG.debug("Removed obsolete prediction {}", file.getFileName());
          }
        }
      } catch (NoSuchFileException e) {
        LOG.trace("Nothing to remove at {}", file);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to remove " + file, e);
      }
    }
  }

  /**
   * @param id A non-null metric.
   * @return The directory holding all predictions of the metric.
   */
  public Path directoryFor(final MetricId id) {
    return root.resolve(cleanup(id.host()))
        .resolve(cleanup(id.service()))
        .resolve(cleanup(id.metric()));
  }

  /** @return The root directory. */
  public Path root() {
    return root;
  }

  @VisibleForTesting
  Path dataFile(final MetricId id, final String timegroup) {
    return directoryFor(id).resolve(cleanup(timegroup));
  }

  @VisibleForTesting
  Path infoFile(final MetricId id, final String timegroup) {
    return directoryFor(id).resolve(cleanup(timegroup) + INFO_SUFFIX);
  }

  /**
   * Replaces characters that are unsafe in a path element with underscores.
   * @param name A non-null name.
   * @return The cleaned name.
   */
  static String cleanup(final String name) {
    return UNSAFE.replaceFrom(name, '_');
  }

  private <T> T read(final Path path,
                     final Class<T> type,
                     final String timegroup) {
    final byte[] data;
    try {
      data = FileSystem.readIfExists(path);
    } catch (UncheckedIOException e) {
      LOG.warn("Unable to read prediction file " + path, e);
      return null;
    }
    if (data == null) {
      LOG.debug("No previous prediction for group {} available.", timegroup);
      return null;
    }
    if (data.length == 0) {
      LOG.debug("Empty prediction file {}", path);
      return null;
    }
    try {
      return JSON.parseToObject(data, type);
    } catch (IllegalArgumentException | JSONException e) {
      LOG.warn("Invalid prediction file " + path + ", ignoring it", e);
      return null;
    }
  }

  private static Path rootFrom(final Config config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    final String directory = config.getDirectoryName(Config.CACHE_DIRECTORY_KEY);
    if (Strings.isNullOrEmpty(directory)) {
      throw new IllegalArgumentException("Missing " + Config.CACHE_DIRECTORY_KEY);
    }
    return Paths.get(directory);
  }
}
