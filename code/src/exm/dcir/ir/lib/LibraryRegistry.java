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

import java.util.HashMap;
import java.util.Map;

import exm.dcir.ir.tree.NodeTypeRegistry;

/**
 * Process-wide table of registered libraries.  Registering a library
 * also makes its node kinds known to {@link NodeTypeRegistry}.
 */
public class LibraryRegistry {
  private static final Map<String, Library> libraries =
                                    new HashMap<String, Library>();

  public static synchronized void register(Library library) {
    libraries.put(library.getName(), library);
    for (LibraryNodeType t: library.getNodeTypes()) {
      NodeTypeRegistry.registerLibraryNodeType(t);
    }
  }

  /**
   * @return library, or null if none of that name registered
   */
  public static synchronized Library lookup(String name) {
    return libraries.get(name);
  }

  public static synchronized void unregister(String name) {
    libraries.remove(name);
  }
}
