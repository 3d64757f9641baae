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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named collection of library node kinds
 */
public class Library {
  private final String name;

  /** Used if neither node nor node kind chooses, may be null */
  private final String defaultImplementation;

  private final List<LibraryNodeType> nodeTypes =
                                new ArrayList<LibraryNodeType>();

  public Library(String name, String defaultImplementation) {
    this.name = name;
    this.defaultImplementation = defaultImplementation;
  }

  public String getName() {
    return name;
  }

  public String getDefaultImplementation() {
    return defaultImplementation;
  }

  public void addNodeType(LibraryNodeType type) {
    nodeTypes.add(type);
  }

  public List<LibraryNodeType> getNodeTypes() {
    return Collections.unmodifiableList(nodeTypes);
  }
}
