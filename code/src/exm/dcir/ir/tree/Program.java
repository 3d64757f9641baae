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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import exm.dcir.common.exceptions.DCIRRuntimeError;
import exm.dcir.common.exceptions.UndefinedBufferException;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.BufferDesc;
import exm.dcir.common.lang.Identifiers;
import exm.dcir.common.lang.ScalarType;
import exm.dcir.ir.tree.ScopeNodes.EntryNode;

/**
 * A whole program: an ordered collection of regions plus the
 * program-wide buffer descriptor table and declared symbols.
 */
public class Program {
  private final String name;

  private final List<Region> regions = new ArrayList<Region>();

  /** Buffer descriptors in declaration order */
  private final Map<String, BufferDesc> buffers =
                              new LinkedHashMap<String, BufferDesc>();

  private final Map<String, ScalarType> symbols =
                              new LinkedHashMap<String, ScalarType>();

  /** Node containing this program, null if top level */
  private NestedGraphNode parentNode = null;

  public Program(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public NestedGraphNode getParentNode() {
    return parentNode;
  }

  void setParentNode(NestedGraphNode parentNode) {
    this.parentNode = parentNode;
  }

  public Region addRegion(String label) {
    Region r = new Region(label);
    r.setProgram(this);
    regions.add(r);
    return r;
  }

  public List<Region> getRegions() {
    return Collections.unmodifiableList(regions);
  }

  public Map<String, BufferDesc> getBuffers() {
    return Collections.unmodifiableMap(buffers);
  }

  public boolean hasBuffer(String bufName) {
    return buffers.containsKey(bufName);
  }

  /**
   * @return descriptor, or null if not declared
   */
  public BufferDesc lookupBuffer(String bufName) {
    return buffers.get(bufName);
  }

  public void addBuffer(String bufName, BufferDesc desc) {
    addBuffer(bufName, desc, false);
  }

  /**
   * Add buffer to table
   * @param bufName
   * @param desc
   * @param findNewName if true, pick a fresh name derived from bufName
   *          if it's taken by a buffer or symbol.  Otherwise it's an error
   *          if it's taken.
   * @return the name the buffer was added under
   */
  public String addBuffer(String bufName, BufferDesc desc,
                          boolean findNewName) {
    if (!Identifiers.isValid(bufName)) {
      throw new DCIRRuntimeError("Invalid buffer name: " + bufName);
    }
    String actual;
    if (findNewName) {
      actual = findNewName(bufName);
    } else if (buffers.containsKey(bufName)) {
      throw new DCIRRuntimeError("Buffer " + bufName +
                                 " already exists in " + name);
    } else if (symbols.containsKey(bufName)) {
      throw new DCIRRuntimeError("Buffer " + bufName +
                                 " clashes with symbol in " + name);
    } else {
      actual = bufName;
    }
    buffers.put(actual, desc);
    return actual;
  }

  /**
   * @return base if unused, otherwise base_0, base_1, ... whichever is
   *         first unused
   */
  public String findNewName(String base) {
    if (!buffers.containsKey(base) && !symbols.containsKey(base)) {
      return base;
    }
    int index = 0;
    while (buffers.containsKey(base + "_" + index) ||
           symbols.containsKey(base + "_" + index)) {
      index++;
    }
    return base + "_" + index;
  }

  public BufferDesc removeBuffer(String bufName) {
    return buffers.remove(bufName);
  }

  /**
   * @return names of transient buffers in declaration order
   */
  public Set<String> transientNames() {
    Set<String> result = new LinkedHashSet<String>();
    for (Map.Entry<String, BufferDesc> e: buffers.entrySet()) {
      if (e.getValue().isTransient()) {
        result.add(e.getKey());
      }
    }
    return result;
  }

  public void addSymbol(String symName, ScalarType type) {
    symbols.put(symName, type);
  }

  public Map<String, ScalarType> getSymbols() {
    return Collections.unmodifiableMap(symbols);
  }

  /**
   * Symbols that must be given a value from outside the program:
   * declared symbols and those used by nodes and buffer shapes, except
   * scope parameters defined inside the program.
   */
  public Set<String> freeSymbols() {
    Set<String> used = new TreeSet<String>(symbols.keySet());
    Set<String> defined = new TreeSet<String>();
    for (BufferDesc desc: buffers.values()) {
      used.addAll(desc.freeSymbols());
    }
    for (Region r: regions) {
      for (Node n: r.nodes()) {
        used.addAll(n.freeSymbols());
        if (n instanceof EntryNode) {
          defined.addAll(((EntryNode)n).scopeParams());
        }
      }
    }
    used.removeAll(defined);
    return used;
  }

  /**
   * Check all nodes and edges of the program
   * @throws UserException for first problem found
   */
  public void validate() throws UserException {
    for (Region r: regions) {
      GraphContext context = new GraphContext(this, r);
      for (Node n: r.nodes()) {
        n.validate(context);
      }
      for (Edge e: r.edges()) {
        String data = e.getMemlet().getData();
        if (data != null && !buffers.containsKey(data)) {
          throw new UndefinedBufferException(data, name);
        }
      }
    }
  }

  public void prettyPrint(StringBuilder sb) {
    sb.append("program " + name + "\n");
    for (Map.Entry<String, BufferDesc> e: buffers.entrySet()) {
      sb.append("  " + e.getKey() + ": " + e.getValue() + "\n");
    }
    for (Region r: regions) {
      r.prettyPrint(sb);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }
}
