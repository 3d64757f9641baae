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

import exm.dcir.common.exceptions.UserException;
import exm.dcir.ir.tree.GraphContext;
import exm.dcir.ir.tree.LibraryNode;

/**
 * One way of implementing a library node kind, e.g. a pure tasklet or a
 * call into a vendor library.
 */
public interface Expansion {
  public abstract String getName();

  /**
   * Replace node in its region by the implementation
   * @param context region containing node
   * @param node
   */
  public abstract void expand(GraphContext context, LibraryNode node)
                                                  throws UserException;
}
