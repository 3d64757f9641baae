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
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dcir.common.Settings;
import exm.dcir.common.exceptions.DCIRRuntimeError;
import exm.dcir.common.exceptions.InvalidOptionException;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.ir.tree.Program;

public class OptimizerPipeline {

  public OptimizerPipeline(PrintStream irOutput) {
    this.irOutput = irOutput;
  }

  private final List<OptimizerPass> passes = new ArrayList<OptimizerPass>();
  private final PrintStream irOutput;

  public void addPass(OptimizerPass pass) {
    passes.add(pass);
  }

  public void runPipeline(Logger logger, Program program) throws UserException {
    for (OptimizerPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Pass: " + pass.getPassName());
        pass.optimize(logger, program);
        if (irOutput != null) {
          irOutput.println("IR after " + pass.getPassName());
          irOutput.println(program);
        }
      } else {
        logger.debug("Skipping disabled pass: " + pass.getPassName());
      }
    }
  }

  public boolean passEnabled(OptimizerPass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new DCIRRuntimeError("Expected config key " + pass.getConfigEnabledKey()
          + " to exist");
    }
  }
}
