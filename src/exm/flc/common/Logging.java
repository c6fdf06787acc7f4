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

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

public class Logging
{
  private static final String FLC_LOGGER_NAME = "exm.flc";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  public static Logger getFlcLogger()
  {
    return Logger.getLogger(FLC_LOGGER_NAME);
  }

  /**
   * Attach a file appender to the compiler logger.
   * @param logfile if null or empty, logging stays at WARN
   * @param trace if true, log everything, otherwise log up to DEBUG
   * @return the compiler logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger flcLogger = getFlcLogger();
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      flcLogger.setLevel(Level.WARN);
      return flcLogger;
    }

    Layout layout = new PatternLayout(LOG_PATTERN);
    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      flcLogger.removeAllAppenders();
      flcLogger.addAppender(appender);
      flcLogger.setAdditivity(false);
    } catch (IOException e) {
      System.err.println("Could not open log file: " + logfile + ": " +
                         e.getMessage());
      flcLogger.setLevel(Level.WARN);
      return flcLogger;
    }

    flcLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return flcLogger;
  }
}
