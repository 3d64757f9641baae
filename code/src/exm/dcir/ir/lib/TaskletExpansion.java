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

package exm.dcir.ir.lib;

import java.util.Map;

import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.SymExpr;
import exm.dcir.ir.tree.GraphContext;
import exm.dcir.ir.tree.LibraryNode;
import exm.dcir.ir.tree.Tasklet;

/**
 * Expand a library node into a single tasklet with the same connectors
 * and edges.  Subclasses generate the tasklet code.
 */
public abstract class TaskletExpansion implements Expansion {
  private final String name;

  protected TaskletExpansion(String name) {
    this.name = name;
  }

  @Override
  public String getName() {
    return name;
  }

  /**
   * @return code of tasklet replacing node
   */
  protected abstract String generateCode(GraphContext context,
                            LibraryNode node) throws UserException;

  @Override
  public void expand(GraphContext context, LibraryNode node)
                                            throws UserException {
    Tasklet tasklet = new Tasklet(node.getLabel(), node.inConnectors(),
                        node.outConnectors(), generateCode(context, node));
    for (Map.Entry<String, SymExpr> e: node.getLocation().entrySet()) {
      tasklet.setLocation(e.getKey(), e.getValue());
    }
    context.getRegion().replaceNode(node, tasklet);
  }
}
