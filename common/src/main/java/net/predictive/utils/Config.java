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

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Predictive levels configuration.
 * <p>
 * On initialization default values are configured for all variables. Then
 * callers may use {@link #loadConfig()} to search the default locations for a
 * properties file or pass the file explicitly.
 * <p>
 * The get&lt;type&gt; number helpers will throw NumberFormatExceptions if the
 * requested property is null or unparseable.
 * @since 1.0
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** Root directory of the on-disk prediction cache. */
  public static final String CACHE_DIRECTORY_KEY = "predictive.cache.directory";

  /** Zone used to compute local calendar buckets and UTC offsets. */
  public static final String TIMEZONE_KEY = "predictive.timezone";

  /** How many striped locks guard regeneration of cache entries. */
  public static final String LOCK_STRIPES_KEY = "predictive.cache.lock_stripes";

  /** Locations searched by {@link #loadConfig()}, in order. */
  public static final List<String> DEFAULT_LOCATIONS = ImmutableList.of(
      "predictive.conf",
      "/etc/predictive.conf",
      "/etc/predictive/predictive.conf",
      "/opt/predictive/predictive.conf");

  /** Holds default values for the config */
  protected static final Map<String, String> DEFAULTS = ImmutableMap.of(
      CACHE_DIRECTORY_KEY, "/var/lib/predictive/prediction",
      TIMEZONE_KEY, ZoneId.systemDefault().getId(),
      LOCK_STRIPES_KEY, "64");

  /**
   * The list of properties configured to their defaults or modified by users
   */
  protected final HashMap<String, String> properties =
      new HashMap<String, String>();

  /** Tracks the location of the file that was actually loaded */
  protected String config_location;

  /**
   * Creates a config populated with the defaults only.
   */
  public Config() {
    setDefaults();
  }

  /**
   * Constructor that initializes default configuration values. May attempt to
   * search for a config file if configured.
   * @param auto_load_config When set to true, attempts to search for a config
   *          file in the default locations
   * @throws IOException Thrown if unable to read or parse one of the default
   *           config files
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Constructor that initializes default values and attempts to load the given
   * properties file
   * @param file Path to the file to load
   * @throws IOException Thrown if unable to read or parse the file
   */
  public Config(final String file) throws IOException {
    loadConfig(file);
    setDefaults();
  }

  /** @return The file that generated this config. May be null */
  public String configLocation() {
    return config_location;
  }

  /**
   * Allows for modifying properties after creation or loading.
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * Returns the given property as a String
   * @param property The property to load
   * @return The property value as a string, null if not set.
   */
  public final String getString(final String property) {
    return properties.get(property);
  }

  /**
   * Returns the given property as an integer
   * @param property The property to load
   * @return A parsed integer or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   */
  public final int getInt(final String property) {
    return Integer.parseInt(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a long
   * @param property The property to load
   * @return A parsed long or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   */
  public final long getLong(final String property) {
    return Long.parseLong(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a double
   * @param property The property to load
   * @return A parsed double or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   * @throws NullPointerException if the property did not exist
   */
  public final double getDouble(final String property) {
    return Double.parseDouble(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a boolean
   *
   * Property values are case insensitive and the following values will result
   * in a True return value: - 1 - True - Yes
   *
   * Any other values, including an empty string, will result in a False
   *
   * @param property The property to load
   * @return A parsed boolean
   * @throws NullPointerException if the property was not found
   */
  public final boolean getBoolean(final String property) {
    final String val = properties.get(property).trim().toUpperCase();
    return val.equals("1") || val.equals("TRUE") || val.equals("YES");
  }

  /**
   * Returns the directory name, making sure the end is a slash
   * @param property The property to load
   * @return The property value with a slash appended or null if the property
   * wasn't found or the directory was empty.
   */
  public final String getDirectoryName(final String property) {
    final String directory = properties.get(property);
    if (directory == null || directory.isEmpty()) {
      return null;
    }
    if (directory.charAt(directory.length() - 1) == '/') {
      return directory;
    }
    return directory + "/";
  }

  /**
   * Parses the property as a zone ID.
   * @param property The property to load
   * @return The zone.
   * @throws IllegalArgumentException if the property is missing or not a
   * valid zone ID.
   */
  public final ZoneId getZoneId(final String property) {
    final String zone = sanitize(properties.get(property));
    if (zone == null || zone.isEmpty()) {
      throw new IllegalArgumentException("Missing timezone for " + property);
    }
    try {
      return ZoneId.of(zone);
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("Invalid timezone [" + zone
          + "] for " + property, e);
    }
  }

  /**
   * Determines if the given propery is in the map
   * @param property The property to search for
   * @return True if the property exists and has a value, not an empty string
   */
  public final boolean hasProperty(final String property) {
    final String val = properties.get(property);
    return val != null && !val.isEmpty();
  }

  /**
   * Returns a simple string with the configured properties for debugging
   * @return A string with information about the config
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty()) {
      return "No configuration settings stored";
    }

    final StringBuilder response = new StringBuilder("Configuration:\n");
    response.append("File [" + config_location + "]\n");
    int line = 0;
    for (final Map.Entry<String, String> entry : properties.entrySet()) {
      if (line > 0) {
        response.append("\n");
      }
      response.append("Key [" + entry.getKey() + "]  Value [");
      if (entry.getKey().toUpperCase().contains("PASS")) {
        response.append("********");
      } else {
        response.append(entry.getValue());
      }
      response.append("]");
      line++;
    }
    return response.toString();
  }

  /** @return An immutable copy of the configuration map */
  public final Map<String, String> getMap() {
    return ImmutableMap.copyOf(properties);
  }

  /**
   * Loads default entries that were not provided by a file
   */
  protected void setDefaults() {
    for (final Map.Entry<String, String> entry : DEFAULTS.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /**
   * Searches the {@link #DEFAULT_LOCATIONS} for a config file. The first one
   * found is loaded. If none exist the defaults are used.
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    if (config_location != null && !config_location.isEmpty()) {
      loadConfig(config_location);
      return;
    }

    for (final String file : DEFAULT_LOCATIONS) {
      try {
        final FileInputStream file_stream = new FileInputStream(file);
        try {
          final Properties props = new Properties();
          props.load(file_stream);
          loadHashMap(props);
        } finally {
          file_stream.close();
        }
      } catch (FileNotFoundException e) {
        LOG.debug("No configuration found at: " + file);
        continue;
      }

      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
      return;
    }

    LOG.info("No configuration file found, using defaults");
  }

  /**
   * Attempts to load the configuration from the given location
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   * @throws FileNotFoundException Thrown if the config file was not found
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    final FileInputStream file_stream = new FileInputStream(file);
    try {
      final Properties props = new Properties();
      props.load(file_stream);
      loadHashMap(props);
      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
    } finally {
      file_stream.close();
    }
  }

  /**
   * Called from {@link #loadConfig} to copy the properties into the hash map
   * @param props The loaded Properties object to copy
   */
  private void loadHashMap(final Properties props) {
    properties.clear();

    @SuppressWarnings("rawtypes")
    final Enumeration e = props.propertyNames();
    while (e.hasMoreElements()) {
      final String key = (String) e.nextElement();
      properties.put(key, props.getProperty(key));
    }
  }

  /**
   * Returns the given string trimed or null if is null
   * @param string The string be trimmed of
   * @return The string trimed or null
   */
  private final String sanitize(final String string) {
    if (string == null) {
      return null;
    }
    return string.trim();
  }
}
