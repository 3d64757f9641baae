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

package exm.dcir.common.lang;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rules for names of nodes, scopes, connectors and buffers
 */
public class Identifiers {

  private static final Pattern IDENTIFIER =
                  Pattern.compile("^[a-zA-Z_][a-zA-Z_0-9]*$");

  private static final Set<String> RESERVED = Collections.unmodifiableSet(
        new HashSet<String>(Arrays.asList("True", "False", "None")));

  public static boolean isValid(String name) {
    if (name == null || name.isEmpty()) {
      return false;
    }
    if (RESERVED.contains(name)) {
      return false;
    }
    return IDENTIFIER.matcher(name).matches();
  }
}
