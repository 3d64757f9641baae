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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Symbols used inside a nested graph are not given a value by the
 * enclosing node.
 */
public class MissingSymbolException extends UserException {

  private final List<String> symbols;

  public MissingSymbolException(String node, Collection<String> symbols) {
    super("Missing symbols on nested graph " + node + ": " + symbols);
    this.symbols = Collections.unmodifiableList(
                          new ArrayList<String>(symbols));
  }

  public List<String> getSymbols() {
    return symbols;
  }

  private static final long serialVersionUID = 1L;
}
