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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.cgen.common.exceptions.InvalidOptionException;
import exm.cgen.common.util.Pair;

public class Logging
{
  private static final String CGEN_LOGGER_NAME = "exm.cgen";

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  public static Logger getCGenLogger()
  {
    return Logger.getLogger(CGEN_LOGGER_NAME);
  }

  /**
   * Direct the generator log to a file, if one is given.
   * @param logfile file name, or empty/null to keep the default appenders
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @throws IOException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws IOException
  {
    Logger cgenLogger = getCGenLogger();
    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout("%-5p %m%n");
      FileAppender appender = new FileAppender(layout, logfile, false);
      cgenLogger.addAppender(appender);
      cgenLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    // Even if logging is disabled, this must be valid:
    return cgenLogger;
  }

  /**
   * Set up logging from the {@link Settings#LOG_FILE} and
   * {@link Settings#LOG_TRACE} settings
   * @throws InvalidOptionException if the trace setting is not a boolean
   * @throws IOException if the log file cannot be opened
   */
  public static Logger setupLogging()
      throws InvalidOptionException, IOException
  {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return setupLogging(logfile, trace);
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getCGenLogger().warn(msg);
    else
      getCGenLogger().debug("Duplicate Warning: " + msg);
  }
}
