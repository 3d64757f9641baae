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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import exm.dcir.common.Settings;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.ir.lib.LibraryConfig;
import exm.dcir.ir.lib.LibraryExpander;
import exm.dcir.ir.tree.GraphContext;
import exm.dcir.ir.tree.LibraryNode;
import exm.dcir.ir.tree.NestedGraphNode;
import exm.dcir.ir.tree.Node;
import exm.dcir.ir.tree.Program;
import exm.dcir.ir.tree.Region;

/**
 * Replace every library node, including those in nested graphs, with
 * its chosen implementation.
 */
public class ExpandLibraryNodes implements OptimizerPass {

  /** Null to read from settings */
  private final LibraryConfig config;

  public ExpandLibraryNodes() {
    this(null);
  }

  public ExpandLibraryNodes(LibraryConfig config) {
    this.config = config;
  }

  @Override
  public String getPassName() {
    return "Expand library nodes";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_EXPAND_LIBRARIES;
  }

  @Override
  public void optimize(Logger logger, Program program) throws UserException {
    LibraryConfig cfg = config;
    if (cfg == null) {
      cfg = LibraryConfig.fromSettings(libraryNames(program));
    }
    expandAll(new LibraryExpander(logger, cfg), program);
  }

  private void expandAll(LibraryExpander expander, Program program)
                                                throws UserException {
    for (Region r: program.getRegions()) {
      // Expansion modifies region
      List<Node> nodes = new ArrayList<Node>(r.nodes());
      for (Node n: nodes) {
        if (n instanceof LibraryNode) {
          expander.expand(new GraphContext(program, r), (LibraryNode)n);
        } else if (n instanceof NestedGraphNode) {
          expandAll(expander, ((NestedGraphNode)n).getProgram());
        }
      }
    }
  }

  private static Set<String> libraryNames(Program program) {
    Set<String> result = new TreeSet<String>();
    for (Region r: program.getRegions()) {
      for (Node n: r.nodes()) {
        if (n instanceof LibraryNode) {
          result.add(((LibraryNode)n).type().getLibraryName());
        } else if (n instanceof NestedGraphNode) {
          result.addAll(libraryNames(((NestedGraphNode)n).getProgram()));
        }
      }
    }
    return result;
  }
}
