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

package exm.cgen.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.cgen.common.exceptions.CGenRuntimeError;
import exm.cgen.common.exceptions.InvalidOptionException;

/**
 * General code generator settings
 *
 * Defaults are set here and may be overridden with Java system
 * properties of the same name, see {@link #initCGenProperties()}.
 * */
public class Settings
{
  /** Spaces per indentation level in rendered code */
  public static final String INDENT_WIDTH = "cgen.indent-width";

  /** Maximum line length of documentation comment text */
  public static final String DOC_WRAP_WIDTH = "cgen.doc.wrap-width";

  /** Column up to which heading comment rules extend */
  public static final String HEADING_WIDTH = "cgen.comment.heading-width";

  public static final String LOG_FILE = "cgen.log.file";
  public static final String LOG_TRACE = "cgen.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(INDENT_WIDTH, "4");
    defaults.setProperty(DOC_WRAP_WIDTH, "90");
    defaults.setProperty(HEADING_WIDTH, "100");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initCGenProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
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

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    checkPositive(INDENT_WIDTH);
    checkPositive(DOC_WRAP_WIDTH);
    checkPositive(HEADING_WIDTH);
    getBoolean(LOG_TRACE);
  }

  private static void checkPositive(String key) throws InvalidOptionException {
    int val = getInt(key);
    if (val <= 0) {
      throw new InvalidOptionException("Expected property " + key +
                          " to be positive but was " + val);
    }
  }

  /**
   * Lookup of a setting that was validated on startup.  An invalid value
   * at this point is an internal error.
   */
  public static int getValidatedInt(String key) {
    try {
      return getInt(key);
    } catch (InvalidOptionException e) {
      throw new CGenRuntimeError(e.getMessage());
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
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
