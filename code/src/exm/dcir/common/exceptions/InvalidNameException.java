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
 * A label or connector is not a valid identifier
 */
public class InvalidNameException extends UserException {

  private final String name;

  public InvalidNameException(String what, String name) {
    super("Invalid " + what + " \"" + name + "\"");
    this.name = name;
  }

  public String getName() {
    return name;
  }

  private static final long serialVersionUID = 1L;
}
