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

package exm.dcir.ir.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import exm.dcir.common.exceptions.InvalidNameException;
import exm.dcir.common.lang.Identifiers;
import exm.dcir.common.lang.SymExpr;

/**
 * A node with runnable code and acyclic external data dependencies:
 * a tasklet, a nested graph or a library node.
 */
public abstract class CodeNode extends Node {
  protected String label;

  /** Storage location identifier, e.g. rank or GPU id */
  protected final Map<String, SymExpr> location;

  protected CodeNode(String label, Map<String, SymExpr> location,
                     Set<String> inputs, Set<String> outputs) {
    super(inputs, outputs);
    this.label = label;
    this.location = new LinkedHashMap<String, SymExpr>();
    if (location != null) {
      this.location.putAll(location);
    }
  }

  @Override
  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }

  public Map<String, SymExpr> getLocation() {
    return Collections.unmodifiableMap(location);
  }

  public void setLocation(String key, SymExpr value) {
    location.put(key, value);
  }

  @Override
  public Set<String> freeSymbols() {
    return SymExpr.freeSymbols(location.values());
  }

  /**
   * Check label and connectors are valid identifiers
   * @param what kind of node, for error messages
   */
  protected void validateNames(String what) throws InvalidNameException {
    if (!Identifiers.isValid(label)) {
      throw new InvalidNameException(what + " name", label);
    }
    for (String in: new TreeSet<String>(inConnectors())) {
      if (!Identifiers.isValid(in)) {
        throw new InvalidNameException("input connector", in);
      }
    }
    for (String out: new TreeSet<String>(outConnectors())) {
      if (!Identifiers.isValid(out)) {
        throw new InvalidNameException("output connector", out);
      }
    }
  }

  @Override
  public Map<String, Object> properties() {
    Map<String, Object> props = super.properties();
    props.put("label", label);
    props.put("location", getLocation());
    return props;
  }
}
