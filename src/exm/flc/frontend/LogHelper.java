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
package exm.flc.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.flc.ast.AstPrinter;
import exm.flc.ast.Expr;
import exm.flc.ast.FilePosition;
import exm.flc.common.Logging;

public class LogHelper {

  static final Logger logger = Logging.getFlcLogger();

  public static void info(Expr where, String msg) {
    log(0, Level.INFO, location(where), msg);
  }

  public static void debug(Expr where, String msg) {
    log(0, Level.DEBUG, location(where), msg);
  }

  public static void trace(Expr where, String msg) {
    log(0, Level.TRACE, location(where), msg);
  }

  /**
     DEBUG-level with indentation for nice output
   */
  public static void debug(int indent, String msg) {
    log(indent, Level.DEBUG, "", msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, "", msg);
  }

  /**
   * Print a lowered tree at TRACE level, one line per node
   */
  public static void traceTree(Expr where, String title, Expr tree) {
    if (logger.isTraceEnabled()) {
      trace(where, title);
      for (String line: AstPrinter.print(tree).split("\n")) {
        trace(2, line);
      }
    }
  }

  public static void log(int indent, Level level, String location,
                         String msg) {
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  private static String location(Expr where) {
    if (where == null) {
      return "";
    }
    FilePosition pos = where.findPosition();
    return pos == null ? "" : pos.toString() + ": ";
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
