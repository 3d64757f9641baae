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

package exm.dcir.common.exceptions;

/**
 * Could not select an implementation to expand a library node into
 */
public class UndefinedImplementationException extends UserException {

  /** Attempted implementation name, null if none could be determined */
  private final String implementation;

  private UndefinedImplementationException(String implementation,
                                           String message) {
    super(message);
    this.implementation = implementation;
  }

  public static UndefinedImplementationException noneDetermined(
                                                    String node) {
    return new UndefinedImplementationException(null,
        "No implementation or default implementation specified for " +
        "library node " + node);
  }

  public static UndefinedImplementationException unknown(String node,
                                                String implementation) {
    return new UndefinedImplementationException(implementation,
        "Unknown implementation: " + implementation + " for library node "
        + node);
  }

  public String getImplementation() {
    return implementation;
  }

  private static final long serialVersionUID = 1L;
}
