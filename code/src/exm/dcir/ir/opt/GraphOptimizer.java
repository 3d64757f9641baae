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

package exm.dcir.ir.opt;

import java.io.PrintStream;

import org.apache.log4j.Logger;

import exm.dcir.common.Settings;
import exm.dcir.common.exceptions.DCIRRuntimeError;
import exm.dcir.common.exceptions.InvalidOptionException;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.ir.tree.Program;

/**
 * Runs the standard sequence of passes over a program
 */
public class GraphOptimizer {

  /**
   * @param irOutput if not null, dump IR after each pass
   */
  public static Program optimize(Logger logger, PrintStream irOutput,
                                 Program program) throws UserException {
    boolean debug;
    try {
      debug = Settings.getBoolean(Settings.COMPILER_DEBUG);
    } catch (InvalidOptionException e) {
      throw new DCIRRuntimeError(e.getMessage());
    }

    OptimizerPipeline pipe = new OptimizerPipeline(irOutput);
    if (debug) {
      pipe.addPass(new Validate());
    }
    pipe.addPass(new ExpandLibraryNodes());
    if (debug) {
      pipe.addPass(new Validate());
    }
    pipe.addPass(new TransientReuse());
    // Renaming must leave a consistent program
    pipe.addPass(new Validate());

    pipe.runPipeline(logger, program);
    return program;
  }
}
