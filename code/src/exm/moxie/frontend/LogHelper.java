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
package exm.moxie.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.moxie.common.Logging;

/**
 * Logging with the current source location and nesting level
 */
public class LogHelper {

  static final Logger logger = Logging.getMoxieLogger();

  public static void debug(TransformContext context, String msg) {
    log(context.getLevel(), Level.DEBUG, context.getLocation(), msg);
  }

  public static void trace(TransformContext context, String msg) {
    log(context.getLevel(), Level.TRACE, context.getLocation(), msg);
  }

  /**
    WARN-level with indentation for nice output
   */
  public static void warn(TransformContext context, String msg) {
    log(context.getLevel(), Level.WARN, context.getLocation(), msg);
  }

  public static void log(int indent, Level level, String location, String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
