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
package net.predictive.utils;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers for the on-disk state: directory checks and whole-file swaps.
 */
public class FileSystem {
  private static final Logger LOG = LoggerFactory.getLogger(FileSystem.class);

  /** Suffix of the temporary file written before the rename. */
  public static final String TEMP_SUFFIX = ".tmp";

  /**
   * Verifies a directory and checks to see if it's writeable or not if
   * configured
   * @param dir The path to check on
   * @param need_write Set to true if the path needs write access
   * @param create Set to true if the directory should be created if it does not
   *          exist
   * @throws IllegalArgumentException if the path is empty, if it's not there
   *           and told not to create it or if it needs write access and can't
   *           be written to
   */
  public static void checkDirectory(final String dir,
      final boolean need_write, final boolean create) {
    if (dir == null || dir.isEmpty()) {
      throw new IllegalArgumentException("Directory path is empty");
    }
    final File f = new File(dir);
    if (!f.exists() && !(create && f.mkdirs())) {
      // another writer may have created it between the two calls.
      if (!f.isDirectory()) {
        throw new IllegalArgumentException("No such directory [" + dir + "]");
      }
    }
    if (!f.isDirectory()) {
      throw new IllegalArgumentException("Not a directory [" + dir + "]");
    } else if (need_write && !f.canWrite()) {
      throw new IllegalArgumentException("Cannot write to directory [" + dir
          + "]");
    }
  }

  /**
   * Writes the data to a temporary file next to the target and renames it
   * over the target so readers see either the old or the new content, never
   * a partial file.
   * @param path The non-null target path. Its parent must exist.
   * @param data The non-null content.
   * @throws UncheckedIOException if the write or the rename failed.
   */
  public static void atomicWrite(final Path path, final byte[] data) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    final Path parent = path.toAbsolutePath().getParent();
    Path temp = null;
    try {
      temp = Files.createTempFile(parent, path.getFileName().toString(),
          TEMP_SUFFIX);
      Files.write(temp, data);
      try {
        Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        LOG.debug("Atomic move not supported for {}, falling back", path);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + path, e);
    } finally {
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException e) {
          LOG.warn("Unable to remove temporary file " + temp, e);
        }
      }
    }
  }

  /**
   * Reads the whole file.
   * @param path The non-null path to read.
   * @return The content or null if the file does not exist.
   * @throws UncheckedIOException if the file exists but could not be read.
   */
  public static byte[] readIfExists(final Path path) {
    try {
      return Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      return null;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + path, e);
    }
  }
}
