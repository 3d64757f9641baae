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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.dcir.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String DCIR_LOGGER_NAME = "exm.dcir";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted, keyed by level and text
   */
  private static final Set<String> emitted = new HashSet<String>();

  public static Logger getDCIRLogger()
  {
    return Logger.getLogger(DCIR_LOGGER_NAME);
  }

  /**
   * Send compiler log output to a file.  If logfile is empty, logger is
   * left as configured by log4j.
   * @param logfile
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the compiler logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                    throws InvalidOptionException
  {
    Logger dcirLogger = getDCIRLogger();
    if (StringUtils.isNotEmpty(logfile)) {
      try {
        FileAppender appender = new FileAppender(
                          new PatternLayout(LOG_PATTERN), logfile, false);
        dcirLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                         logfile + ": " + e.getMessage());
      }
      dcirLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    // Even if logging is disabled, this must be valid:
    return dcirLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(level.toString() + ":" + msg);
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getDCIRLogger().warn(msg);
    else
      getDCIRLogger().debug("Duplicate Warning: " + msg);
  }
}
