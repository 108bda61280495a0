/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.moxie.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

import exm.moxie.common.exceptions.InvalidOptionException;
import exm.moxie.common.exceptions.MoxieRuntimeError;
import exm.moxie.common.lang.Builtins;

/**
 * Transformer settings.  Instances are immutable and validated when
 * created, so the same object can be shared by transformations of
 * different files.
 * */
public class Settings
{
  /** Ceiling on traversals of a fixed point pass */
  public static final String CONCAT_MAX_ITERATIONS =
                                      "moxie.concat.max-iterations";
  public static final String RUNTIME_IMPORT_PATH = "moxie.runtime.import-path";
  public static final String RUNTIME_ALIAS = "moxie.runtime.alias";
  /** Comma separated packages whose call arguments keep Go strings */
  public static final String PASSTHROUGH_PACKAGES =
                                      "moxie.strings.passthrough-packages";
  public static final String WARN_UNRESOLVED_DISPATCH =
                                      "moxie.warn.unresolved-dispatch";

  public static final String LOG_FILE = "moxie.log.file";
  public static final String LOG_TRACE = "moxie.log.trace";

  private static final Properties defaults;

  static {
    defaults = new Properties();
    // Set defaults here
    defaults.setProperty(CONCAT_MAX_ITERATIONS, "64");
    defaults.setProperty(RUNTIME_IMPORT_PATH, "github.com/mleku/moxie/runtime");
    defaults.setProperty(RUNTIME_ALIAS, "moxie");
    defaults.setProperty(PASSTHROUGH_PACKAGES, "fmt");
    defaults.setProperty(WARN_UNRESOLVED_DISPATCH, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
  }

  private static final Settings DEFAULT_SETTINGS = defaultsOrFail();

  private final Properties properties;

  // Parsed values
  private final int concatMaxIterations;
  private final ImmutableSet<String> passthroughPackages;
  private final boolean warnUnresolvedDispatch;

  private Settings(Properties properties) throws InvalidOptionException {
    this.properties = properties;
    this.concatMaxIterations = getInt(CONCAT_MAX_ITERATIONS);
    if (concatMaxIterations < 1) {
      throw new InvalidOptionException("option " + CONCAT_MAX_ITERATIONS +
          " must be at least 1, but was " + concatMaxIterations);
    }
    this.passthroughPackages = ImmutableSet.copyOf(
        Splitter.on(',').trimResults().omitEmptyStrings()
                .split(get(PASSTHROUGH_PACKAGES)));
    this.warnUnresolvedDispatch = getBoolean(WARN_UNRESOLVED_DISPATCH);
    validateProperties();
  }

  private static Settings defaultsOrFail() {
    try {
      return new Settings(new Properties(defaults));
    } catch (InvalidOptionException e) {
      throw new MoxieRuntimeError("Invalid default settings: " +
                                  e.getMessage());
    }
  }

  public static Settings defaultSettings() {
    return DEFAULT_SETTINGS;
  }

  /**
     Overwrite each default property with value from System
   */
  public static Settings fromSystemProperties() throws InvalidOptionException {
    return fromProperties(System.getProperties());
  }

  /**
   * Take values for known keys from overrides, defaults for the rest
   * @param overrides
   */
  public static Settings fromProperties(Properties overrides)
                                  throws InvalidOptionException {
    Properties properties = new Properties(defaults);
    for (String key: defaults.stringPropertyNames()) {
      String val = overrides.getProperty(key);
      if (val != null) {
        properties.setProperty(key, val);
      }
    }
    return new Settings(properties);
  }

  /**
   * @return a copy of these settings with one value changed
   */
  public Settings with(String key, String value)
                                  throws InvalidOptionException {
    if (defaults.getProperty(key) == null) {
      throw new InvalidOptionException("Unknown option " + key);
    }
    Properties copy = new Properties(defaults);
    for (String k: properties.stringPropertyNames()) {
      copy.setProperty(k, properties.getProperty(k));
    }
    copy.setProperty(key, value);
    return new Settings(copy);
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    String alias = get(RUNTIME_ALIAS);
    if (!Builtins.isIdentifier(alias)) {
      throw new InvalidOptionException("option " + RUNTIME_ALIAS +
          " must be an identifier, but was '" + alias + "'");
    }
    if (get(RUNTIME_IMPORT_PATH).trim().isEmpty()) {
      throw new InvalidOptionException("no value set for option " +
                                       RUNTIME_IMPORT_PATH);
    }
  }

  public String get(String key) {
    return properties.getProperty(key);
  }

  public List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  public int concatMaxIterations() {
    return concatMaxIterations;
  }

  public String runtimeImportPath() {
    return get(RUNTIME_IMPORT_PATH).trim();
  }

  public String runtimeAlias() {
    return get(RUNTIME_ALIAS);
  }

  public ImmutableSet<String> passthroughPackages() {
    return passthroughPackages;
  }

  public boolean warnUnresolvedDispatch() {
    return warnUnresolvedDispatch;
  }

  public String logFile() {
    return get(LOG_FILE);
  }

  public boolean logTrace() {
    return Boolean.parseBoolean(get(LOG_TRACE).trim());
  }

  public int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
