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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import exm.dcir.common.exceptions.ConnectorMismatchException;
import exm.dcir.common.exceptions.DCIRRuntimeError;
import exm.dcir.common.exceptions.MissingSymbolException;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.BufferDesc;
import exm.dcir.common.lang.ScalarType;
import exm.dcir.common.lang.ScheduleType;
import exm.dcir.common.lang.SymExpr;

/**
 * A node containing a program of its own, run with the data given
 * through its connectors.  A connector name refers to the non-transient
 * buffer of the same name inside the nested program.
 */
public class NestedGraphNode extends CodeNode {
  private Program program;

  /** Inner symbol -> value in terms of outer symbols */
  private final Map<String, SymExpr> symbolMapping;

  private ScheduleType schedule;

  private boolean collapsed = false;

  public NestedGraphNode(String label, Program program, Set<String> inputs,
                         Set<String> outputs,
                         Map<String, SymExpr> symbolMapping) {
    super(label, null, inputs, outputs);
    if (program == null) {
      throw new DCIRRuntimeError("Program for NestedGraphNode can not be null");
    }
    this.program = program;
    this.symbolMapping = new LinkedHashMap<String, SymExpr>();
    if (symbolMapping != null) {
      this.symbolMapping.putAll(symbolMapping);
    }
    this.schedule = ScheduleType.DEFAULT;
    program.setParentNode(this);
  }

  public Program getProgram() {
    return program;
  }

  public void setProgram(Program program) {
    if (program == null) {
      throw new DCIRRuntimeError("Program for NestedGraphNode can not be null");
    }
    this.program = program;
    program.setParentNode(this);
  }

  public Map<String, SymExpr> getSymbolMapping() {
    return Collections.unmodifiableMap(symbolMapping);
  }

  public void mapSymbol(String inner, SymExpr outer) {
    symbolMapping.put(inner, outer);
  }

  public ScheduleType getSchedule() {
    return schedule;
  }

  public void setSchedule(ScheduleType schedule) {
    this.schedule = schedule;
  }

  public boolean isCollapsed() {
    return collapsed;
  }

  public void setCollapsed(boolean collapsed) {
    this.collapsed = collapsed;
  }

  @Override
  public Set<String> freeSymbols() {
    Set<String> result = new HashSet<String>(
                      SymExpr.freeSymbols(symbolMapping.values()));
    result.addAll(super.freeSymbols());
    return result;
  }

  /**
   * A nested graph doesn't introduce symbols into the parent
   */
  @Override
  public Map<String, ScalarType> newSymbols(GraphContext context,
                                  Map<String, ScalarType> symbols) {
    return Collections.emptyMap();
  }

  @Override
  public void validate(GraphContext context) throws UserException {
    validateNames("nested graph");

    Set<String> connectors = new HashSet<String>(inConnectors());
    connectors.addAll(outConnectors());

    for (Map.Entry<String, BufferDesc> e: program.getBuffers().entrySet()) {
      String name = e.getKey();
      BufferDesc desc = e.getValue();
      // Scalars can be passed by symbol instead of connector
      if (desc.isScalar()) {
        continue;
      }
      if (!desc.isTransient() && !connectors.contains(name)) {
        throw ConnectorMismatchException.missingConnector(label, name);
      }
      if (desc.isTransient() && connectors.contains(name)) {
        throw ConnectorMismatchException.transientConnector(label, name);
      }
    }

    Set<String> missing = new TreeSet<String>();
    for (String sym: program.freeSymbols()) {
      if (!connectors.contains(sym) && !symbolMapping.containsKey(sym)) {
        missing.add(sym);
      }
    }
    if (!missing.isEmpty()) {
      throw new MissingSymbolException(label, missing);
    }

    program.validate();
  }

  @Override
  public Map<String, Object> properties() {
    Map<String, Object> props = super.properties();
    props.put("program", program.getName());
    props.put("symbol_mapping", getSymbolMapping());
    props.put("schedule", schedule.name());
    props.put("is_collapsed", collapsed);
    return props;
  }

  @Override
  public String toString() {
    if (label == null || label.isEmpty()) {
      return "Program";
    }
    return label;
  }
}
