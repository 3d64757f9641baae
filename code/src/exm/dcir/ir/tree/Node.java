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
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.ScalarType;
import exm.dcir.ir.tree.ScopeNodes.EntryNode;

/**
 * Base class of all nodes in a region graph.
 *
 * Nodes compare by identity.  A node's id is its position in the
 * owning region, see {@link Region#nodeId(Node)}.
 */
public abstract class Node {

  protected final Connectors connectors;

  protected Node() {
    this.connectors = new Connectors();
  }

  protected Node(Set<String> inConnectors, Set<String> outConnectors) {
    this.connectors = new Connectors(inConnectors, outConnectors);
  }

  public String getLabel() {
    return getClass().getSimpleName();
  }

  public Set<String> inConnectors() {
    return connectors.in();
  }

  public Set<String> outConnectors() {
    return connectors.out();
  }

  /**
   * Add an input connector.
   * @return false if a connector (input or output) of that name exists
   */
  public boolean addInConnector(String name) {
    return connectors.addIn(name);
  }

  /**
   * Add an output connector.
   * @return false if a connector (input or output) of that name exists
   */
  public boolean addOutConnector(String name) {
    return connectors.addOut(name);
  }

  public boolean removeInConnector(String name) {
    return connectors.removeIn(name);
  }

  public boolean removeOutConnector(String name) {
    return connectors.removeOut(name);
  }

  /**
   * Next unused connector number, used when routing edges through scopes
   */
  public String nextConnector() {
    return Integer.toString(connectors.nextFreeIndex());
  }

  public String lastConnector() {
    return Integer.toString(connectors.lastUsedIndex());
  }

  public Connectors getConnectors() {
    return connectors;
  }

  /**
   * Check node is well-formed in its region.
   * @throws UserException describing the problem
   */
  public void validate(GraphContext context) throws UserException {
    // Nothing to check by default
  }

  /**
   * @return symbols used in this node's properties
   */
  public Set<String> freeSymbols() {
    return Collections.emptySet();
  }

  /**
   * Symbols defined by this node for the scope it opens.
   * @param context
   * @param symbols types of symbols already known
   * @return map from symbol to inferred type
   */
  public Map<String, ScalarType> newSymbols(GraphContext context,
                                  Map<String, ScalarType> symbols) {
    return Collections.emptyMap();
  }

  /**
   * Tag identifying the node kind in exchange records
   */
  public String typeTag() {
    return getClass().getSimpleName();
  }

  /**
   * Flattened properties for exchange records.  Subclasses add to this.
   */
  public Map<String, Object> properties() {
    Map<String, Object> props = new LinkedHashMap<String, Object>();
    props.put("in_connectors", sorted(inConnectors()));
    props.put("out_connectors", sorted(outConnectors()));
    return props;
  }

  private static List<String> sorted(Set<String> names) {
    List<String> l = new ArrayList<String>(names);
    Collections.sort(l);
    return l;
  }

  /**
   * Build exchange record for node.
   * @param parent region containing this node
   */
  public Map<String, Object> toRecord(Region parent) {
    String scopeEntry = null;
    String scopeExit = null;

    EntryNode entry = parent.entryNode(this);
    if (entry != null) {
      scopeEntry = Integer.toString(parent.nodeId(entry));
      Node exit = parent.exitNode(entry);
      if (exit != null) {
        scopeExit = Integer.toString(parent.nodeId(exit));
      }
    }

    // Entry nodes point at their own exit
    if (this instanceof EntryNode) {
      Node exit = parent.exitNode((EntryNode)this);
      scopeExit = exit == null ? null : Integer.toString(parent.nodeId(exit));
    }

    Map<String, Object> record = new LinkedHashMap<String, Object>();
    record.put("type", typeTag());
    record.put("label", toString());
    record.put("attributes", properties());
    record.put("id", parent.nodeId(this));
    record.put("scope_entry", scopeEntry);
    record.put("scope_exit", scopeExit);
    return record;
  }

  @Override
  public String toString() {
    return getLabel();
  }
}
