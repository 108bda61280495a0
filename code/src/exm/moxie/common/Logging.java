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

import java.io.IOException;
import java.util.HashSet;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.moxie.common.util.Pair;

public class Logging {
  private static final String MOXIE_LOGGER_NAME = "exm.moxie";

  /** Name of the appender added by setupLogging */
  public static final String LOG_FILE_APPENDER = "moxie-log-file";

  /**
   * Messages already emitted.
   */
  private static final HashSet<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getMoxieLogger() {
    return Logger.getLogger(MOXIE_LOGGER_NAME);
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getMoxieLogger().warn(msg);
    } else {
      Logging.getMoxieLogger().debug("Duplicate Warning: " + msg);
    }
  }

  /**
   * Send transformer log output to a file.  With no file, logging is left
   * as configured by log4j.properties.  Calling this again replaces the
   * file set up by the previous call.
   * @param logfile path of log file, or empty for none
   * @param trace log at TRACE instead of DEBUG
   * @return the transformer logger
   */
  public static synchronized Logger setupLogging(String logfile,
                                                 boolean trace) {
    Logger moxieLogger = getMoxieLogger();
    if (StringUtils.isNotBlank(logfile)) {
      Layout layout = new PatternLayout("%-5p %m%n");
      boolean append = false;
      try {
        FileAppender appender = new FileAppender(layout, logfile, append);
        appender.setName(LOG_FILE_APPENDER);
        Level threshold = trace ? Level.TRACE : Level.DEBUG;
        appender.setThreshold(threshold);
        closeLogFile(moxieLogger);
        moxieLogger.addAppender(appender);
        moxieLogger.setLevel(threshold);
      } catch (IOException e) {
        System.err.println(e.getMessage());
        System.err.println("Could not open log file: " + logfile);
        moxieLogger.warn("Logging to " + logfile + " disabled", e);
      }
    }
    return moxieLogger;
  }

  /**
   * Stop logging to the file set up by {@link #setupLogging}, if any
   */
  public static synchronized void closeLogFile() {
    closeLogFile(getMoxieLogger());
  }

  private static void closeLogFile(Logger moxieLogger) {
    Appender old = moxieLogger.getAppender(LOG_FILE_APPENDER);
    if (old != null) {
      moxieLogger.removeAppender(old);
      old.close();
    }
  }
}
