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

import org.apache.log4j.Logger;

import exm.dcir.common.Logging;
import exm.dcir.common.exceptions.UndefinedImplementationException;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.ir.tree.GraphContext;
import exm.dcir.ir.tree.LibraryNode;

/**
 * Chooses an implementation for a library node and expands it.
 *
 * Precedence, first match wins:
 * 1. configured default if the library's override flag is set
 * 2. implementation set on the node
 * 3. default of the node kind
 * 4. default of the registered library
 * 5. configured default
 */
public class LibraryExpander {
  private final Logger logger;
  private final LibraryConfig config;

  public LibraryExpander(Logger logger, LibraryConfig config) {
    this.logger = logger;
    this.config = config;
  }

  /**
   * @return name of implementation to use
   * @throws UndefinedImplementationException if none can be determined
   *            or it isn't registered for the node kind
   */
  public String resolve(LibraryNode node)
                        throws UndefinedImplementationException {
    LibraryNodeType type = node.type();
    String libraryName = type.getLibraryName();
    String configImpl = config.getDefaultImplementation(libraryName);

    String impl = node.getImplementation();
    if (configImpl != null && config.isOverride(libraryName)) {
      if (impl != null) {
        Logging.uniqueWarn("Overriding explicitly specified implementation "
            + impl + " for " + node.getLabel() + " with " + configImpl);
      }
      impl = configImpl;
    }

    if (impl == null) {
      impl = type.getDefaultImplementation();
    }
    if (impl == null) {
      Library lib = LibraryRegistry.lookup(libraryName);
      if (lib != null) {
        impl = lib.getDefaultImplementation();
      }
    }
    if (impl == null) {
      impl = configImpl;
    }
    if (impl == null) {
      throw UndefinedImplementationException.noneDetermined(node.getLabel());
    }

    if (!type.getImplementations().containsKey(impl)) {
      throw UndefinedImplementationException.unknown(node.getLabel(), impl);
    }
    return impl;
  }

  /**
   * Resolve implementation and apply it to node in its region
   */
  public void expand(GraphContext context, LibraryNode node)
                                            throws UserException {
    String impl = resolve(node);
    if (logger.isDebugEnabled()) {
      logger.debug("Expanding " + node.getLabel() + " in region " +
                   context.getRegion().getLabel() + " with " + impl);
    }
    node.type().getImplementations().get(impl).expand(context, node);
  }
}
