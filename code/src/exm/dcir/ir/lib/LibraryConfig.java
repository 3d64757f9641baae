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
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import exm.dcir.common.Settings;
import exm.dcir.common.exceptions.InvalidOptionException;

/**
 * Per-library configuration consulted when choosing an implementation.
 */
public class LibraryConfig {
  private final Map<String, String> defaultImplementations =
                                          new HashMap<String, String>();
  private final Set<String> overrides = new HashSet<String>();

  public LibraryConfig() {
  }

  /**
   * @param library
   * @param implementation default implementation for library
   * @param override if true, replaces implementations chosen on nodes
   */
  public LibraryConfig set(String library, String implementation,
                           boolean override) {
    defaultImplementations.put(library, implementation);
    if (override) {
      overrides.add(library);
    } else {
      overrides.remove(library);
    }
    return this;
  }

  /**
   * Read configuration of the given libraries from settings
   */
  public static LibraryConfig fromSettings(Iterable<String> libraries)
                                          throws InvalidOptionException {
    LibraryConfig config = new LibraryConfig();
    for (String lib: libraries) {
      String impl = Settings.get(Settings.libraryDefaultImplKey(lib));
      boolean override = false;
      if (Settings.get(Settings.libraryOverrideKey(lib)) != null) {
        override = Settings.getBoolean(Settings.libraryOverrideKey(lib));
      }
      if (impl != null) {
        config.set(lib, impl, override);
      }
    }
    return config;
  }

  /**
   * @return configured default implementation, or null
   */
  public String getDefaultImplementation(String library) {
    return defaultImplementations.get(library);
  }

  public boolean isOverride(String library) {
    return overrides.contains(library);
  }
}
