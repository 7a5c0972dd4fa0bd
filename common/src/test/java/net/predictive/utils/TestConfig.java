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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.time.ZoneId;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public final class TestConfig {

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void constructorDefaults() throws Exception {
    final Config config = new Config();
    assertNull(config.configLocation());
    assertEquals("/var/lib/predictive/prediction",
        config.getString(Config.CACHE_DIRECTORY_KEY));
    assertEquals(64, config.getInt(Config.LOCK_STRIPES_KEY));
    assertEquals(ZoneId.systemDefault(), config.getZoneId(Config.TIMEZONE_KEY));
  }

  @Test
  public void constructorWithFile() throws Exception {
    final File file = writeConfig("predictive.cache.directory", "/tmp/pred",
        "predictive.timezone", "Europe/Berlin");
    final Config config = new Config(file.getAbsolutePath());
    assertEquals(file.getAbsolutePath(), config.configLocation());
    assertEquals("/tmp/pred", config.getString(Config.CACHE_DIRECTORY_KEY));
    assertEquals(ZoneId.of("Europe/Berlin"),
        config.getZoneId(Config.TIMEZONE_KEY));
    // unset keys fall back to the defaults
    assertEquals(64, config.getInt(Config.LOCK_STRIPES_KEY));
  }

  @Test (expected = FileNotFoundException.class)
  public void constructorFileNotFound() throws Exception {
    new Config(new File(folder.getRoot(), "nope.conf").getAbsolutePath());
  }

  @Test
  public void constructorNoAutoLoad() throws Exception {
    final Config config = new Config(false);
    assertNull(config.configLocation());
    assertTrue(config.hasProperty(Config.CACHE_DIRECTORY_KEY));
  }

  @Test
  public void overrideConfig() throws Exception {
    final Config config = new Config();
    config.overrideConfig(Config.LOCK_STRIPES_KEY, " 8 ");
    assertEquals(8, config.getInt(Config.LOCK_STRIPES_KEY));
    assertEquals(8L, config.getLong(Config.LOCK_STRIPES_KEY));
    assertEquals(8.0, config.getDouble(Config.LOCK_STRIPES_KEY), 0.0);
  }

  @Test (expected = NumberFormatException.class)
  public void getIntBad() throws Exception {
    final Config config = new Config();
    config.overrideConfig(Config.LOCK_STRIPES_KEY, "many");
    config.getInt(Config.LOCK_STRIPES_KEY);
  }

  @Test
  public void getBoolean() throws Exception {
    final Config config = new Config();
    config.overrideConfig("flag", "Yes");
    assertTrue(config.getBoolean("flag"));
    config.overrideConfig("flag", "1");
    assertTrue(config.getBoolean("flag"));
    config.overrideConfig("flag", "nope");
    assertFalse(config.getBoolean("flag"));
  }

  @Test
  public void getDirectoryName() throws Exception {
    final Config config = new Config();
    assertEquals("/var/lib/predictive/prediction/",
        config.getDirectoryName(Config.CACHE_DIRECTORY_KEY));
    config.overrideConfig(Config.CACHE_DIRECTORY_KEY, "/tmp/");
    assertEquals("/tmp/", config.getDirectoryName(Config.CACHE_DIRECTORY_KEY));
    config.overrideConfig(Config.CACHE_DIRECTORY_KEY, "");
    assertNull(config.getDirectoryName(Config.CACHE_DIRECTORY_KEY));
  }

  @Test (expected = IllegalArgumentException.class)
  public void getZoneIdInvalid() throws Exception {
    final Config config = new Config();
    config.overrideConfig(Config.TIMEZONE_KEY, "Mars/Olympus");
    config.getZoneId(Config.TIMEZONE_KEY);
  }

  @Test (expected = IllegalArgumentException.class)
  public void getZoneIdMissing() throws Exception {
    new Config().getZoneId("no.such.key");
  }

  @Test
  public void hasProperty() throws Exception {
    final Config config = new Config();
    assertFalse(config.hasProperty("no.such.key"));
    config.overrideConfig("empty", "");
    assertFalse(config.hasProperty("empty"));
  }

  @Test
  public void dumpConfigurationMasksPasswords() throws Exception {
    final Config config = new Config();
    config.overrideConfig("store.password", "secret");
    final String dump = config.dumpConfiguration();
    assertTrue(dump.contains("********"));
    assertFalse(dump.contains("secret"));
  }

  @Test
  public void getMapIsCopy() throws Exception {
    final Config config = new Config();
    assertNotNull(config.getMap().get(Config.TIMEZONE_KEY));
    config.overrideConfig("later", "value");
    assertFalse(new Config().getMap().containsKey("later"));
  }

  private File writeConfig(final String... kvs) throws Exception {
    final Properties props = new Properties();
    for (int i = 0; i < kvs.length; i += 2) {
      props.setProperty(kvs[i], kvs[i + 1]);
    }
    final File file = folder.newFile("predictive.conf");
    final FileOutputStream out = new FileOutputStream(file);
    try {
      props.store(out, null);
    } finally {
      out.close();
    }
    return file;
  }
}
