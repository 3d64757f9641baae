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

package exm.dcir.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.dcir.common.exceptions.InvalidOptionException;

/**
 * Global compiler settings, backed by Java properties.
 *
 * Library settings are keyed by library name and are not
 * given defaults here:
 * dcir.library.&lt;lib&gt;.default-implementation
 * dcir.library.&lt;lib&gt;.override
 * */
public class Settings
{
  public static final String COMPILER_DEBUG = "dcir.compiler-debug";

  public static final String OPT_EXPAND_LIBRARIES = "dcir.opt.expand-libraries";
  public static final String OPT_TRANSIENT_REUSE = "dcir.opt.transient-reuse";

  public static final String LOG_FILE = "dcir.log.file";
  public static final String LOG_TRACE = "dcir.log.trace";

  private static final String LIBRARY_PREFIX = "dcir.library.";
  private static final String LIBRARY_DEFAULT_IMPL = ".default-implementation";
  private static final String LIBRARY_OVERRIDE = ".override";

  private static final Properties defaults;

  private static Properties properties;

  static {
    defaults = new Properties();
    defaults.setProperty(COMPILER_DEBUG, "true");
    defaults.setProperty(OPT_EXPAND_LIBRARIES, "true");
    defaults.setProperty(OPT_TRANSIENT_REUSE, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Overwrite settings with any dcir.* values from System properties
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: System.getProperties().stringPropertyNames()) {
      if (key.startsWith("dcir.")) {
        properties.setProperty(key, System.getProperty(key));
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop all explicitly set values, leaving only defaults
   */
  public static void reset() {
    properties = new Properties(defaults);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  public static String libraryDefaultImplKey(String library) {
    return LIBRARY_PREFIX + library + LIBRARY_DEFAULT_IMPL;
  }

  public static String libraryOverrideKey(String library) {
    return LIBRARY_PREFIX + library + LIBRARY_OVERRIDE;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(COMPILER_DEBUG);
    getBoolean(OPT_EXPAND_LIBRARIES);
    getBoolean(OPT_TRANSIENT_REUSE);
    getBoolean(LOG_TRACE);

    for (String key: properties.stringPropertyNames()) {
      if (key.startsWith(LIBRARY_PREFIX) && key.endsWith(LIBRARY_OVERRIDE)) {
        getBoolean(key);
      }
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
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
