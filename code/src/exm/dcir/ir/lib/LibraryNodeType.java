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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import exm.dcir.common.exceptions.DCIRRuntimeError;
import exm.dcir.ir.tree.LibraryNode;

/**
 * Describes a library node kind: the library it belongs to, its
 * registered implementations and how to construct one.
 */
public class LibraryNodeType {

  public static interface LibraryNodeFactory {
    public LibraryNode create(String name);
  }

  private final String libraryName;

  /** Fully-qualified name identifying the kind in exchange records */
  private final String classpath;

  /** Default implementation for this kind, may be null */
  private final String defaultImplementation;

  private final LibraryNodeFactory factory;

  private final Map<String, Expansion> implementations =
                                  new LinkedHashMap<String, Expansion>();

  public LibraryNodeType(String libraryName, String classpath,
                         String defaultImplementation,
                         LibraryNodeFactory factory) {
    this.libraryName = libraryName;
    this.classpath = classpath;
    this.defaultImplementation = defaultImplementation;
    this.factory = factory;
  }

  public String getLibraryName() {
    return libraryName;
  }

  public String getClasspath() {
    return classpath;
  }

  public String getDefaultImplementation() {
    return defaultImplementation;
  }

  public void registerImplementation(Expansion expansion) {
    if (implementations.containsKey(expansion.getName())) {
      throw new DCIRRuntimeError("Implementation " + expansion.getName() +
          " already registered for " + classpath);
    }
    implementations.put(expansion.getName(), expansion);
  }

  public Map<String, Expansion> getImplementations() {
    return Collections.unmodifiableMap(implementations);
  }

  public LibraryNode create(String name) {
    return factory.create(name);
  }

  @Override
  public String toString() {
    return libraryName + ":" + classpath;
  }
}
