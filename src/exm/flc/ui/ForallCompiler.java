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
package exm.flc.ui;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.log4j.Logger;

import exm.flc.ast.FnSymbol;
import exm.flc.common.Logging;
import exm.flc.common.Settings;
import exm.flc.common.exceptions.FlcFatal;
import exm.flc.common.exceptions.InvalidOptionException;
import exm.flc.common.exceptions.UserException;
import exm.flc.frontend.Diagnostics;
import exm.flc.frontend.ForallPass;
import exm.flc.frontend.GlobalContext;
import exm.flc.frontend.LoweringContext;
import exm.flc.jvm.runtime.Frame;
import exm.flc.jvm.runtime.Interpreter;
import exm.flc.jvm.runtime.LogicException;
import exm.flc.jvm.runtime.RuntimeLibrary;

/**
 * This is the main entry point to the forall lowering
 */
public class ForallCompiler {

  private final Logger logger;

  public ForallCompiler(Logger logger) {
    this.logger = logger;
  }

  /**
   * Load settings from system properties and configure logging from them
   * @return the compiler logger
   */
  public static Logger setupLogging() {
    try {
      Settings.initProperties();
      return Logging.setupLogging(Settings.get(Settings.LOG_FILE),
                                  Settings.getBoolean(Settings.LOG_TRACE));
    } catch (InvalidOptionException e) {
      System.err.println("flc error:");
      System.err.println(e.getMessage());
      throw new FlcFatal(ExitCode.ERROR_COMMAND.code());
    }
  }

  /**
   * Resolve every function of the program in globals, lowering its
   * foralls and reduce expressions.
   *
   * @return the messages reported, if compilation succeeded
   * @throws FlcFatal with the exit code if it did not
   */
  public Diagnostics compile(GlobalContext globals) {
    Diagnostics diag = new Diagnostics(logger);
    try {
      logger.info("FLC starting: " + globals.getInputFile());
      LoweringContext ctx = LoweringContext.fromSettings(globals, diag);
      new ForallPass(ctx).resolveProgram();
      if (diag.hasErrors()) {
        throw diag.stop();
      }
      logger.debug("FLC done: " + globals.getInputFile());
      return diag;
    }
    catch (FlcFatal e) {
      // Rethrow
      throw e;
    }
    catch (InvalidOptionException e) {
      System.err.println("flc error:");
      System.err.println(e.getMessage());
      throw new FlcFatal(ExitCode.ERROR_COMMAND.code());
    }
    catch (UserException e) {
      System.err.println("flc error:");
      for (Diagnostics.Message m: diag.getMessages()) {
        System.err.println(m);
      }
      if (diag.getMessages().isEmpty()) {
        System.err.println(e.getMessage());
      }
      if (logger.isDebugEnabled())
        logger.debug(ExceptionUtils.getStackTrace(e));
      throw new FlcFatal(ExitCode.ERROR_USER.code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new FlcFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new FlcFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Run a compiled program on the reference runtime, with the number of
   * tasks from the settings.
   * @return the final values of main's variables
   * @throws FlcFatal if the program fails
   */
  public Frame run(RuntimeLibrary lib, FnSymbol main) {
    Interpreter interp;
    try {
      interp = Interpreter.fromSettings(lib);
    } catch (InvalidOptionException e) {
      System.err.println("flc error:");
      System.err.println(e.getMessage());
      throw new FlcFatal(ExitCode.ERROR_COMMAND.code());
    }
    try {
      logger.debug("running " + main.getName() + " with " +
                   interp.getNumTasks() + " tasks");
      return interp.run(main);
    } catch (LogicException e) {
      System.err.println("flc runtime error: " + e.getMessage());
      throw new FlcFatal(ExitCode.ERROR_USER.code());
    } finally {
      interp.shutdown();
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("FLC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
