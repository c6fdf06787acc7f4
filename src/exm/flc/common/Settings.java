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

package exm.flc.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.flc.common.exceptions.InvalidOptionException;

/**
 * General compiler settings.
 *
 * Defaults are set here and may be overridden by Java system properties
 * with the same keys, see {@link #initProperties()}.
 */
public class Settings
{
  /** Emit only the general follower block, no runtime fast-follow probe */
  public static final String NO_FAST_FOLLOWERS = "flc.no-fast-followers";

  /** Check tree invariants after each forall is lowered */
  public static final String VERIFY = "flc.verify";

  /** Number of worker threads in the reference runtime */
  public static final String RUNTIME_NUM_TASKS = "flc.runtime.num-tasks";

  public static final String LOG_FILE = "flc.log.file";
  public static final String LOG_TRACE = "flc.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(NO_FAST_FOLLOWERS, "false");
    defaults.setProperty(VERIFY, "false");
    defaults.setProperty(RUNTIME_NUM_TASKS, "4");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: getKeys()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set since startup, going back to the default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static List<String> getKeys() {
    List<String> keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(NO_FAST_FOLLOWERS);
    getBoolean(VERIFY);
    getBoolean(LOG_TRACE);
    if (getLong(RUNTIME_NUM_TASKS) < 1) {
      throw new InvalidOptionException("option " + RUNTIME_NUM_TASKS +
                        " must be at least 1, but was " + get(RUNTIME_NUM_TASKS));
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
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
