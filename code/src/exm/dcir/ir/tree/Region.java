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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.dcir.common.exceptions.DCIRRuntimeError;
import exm.dcir.common.lang.SymExpr;
import exm.dcir.ir.tree.ScopeNodes.ConsumeEntry;
import exm.dcir.ir.tree.ScopeNodes.ConsumeExit;
import exm.dcir.ir.tree.ScopeNodes.EntryNode;
import exm.dcir.ir.tree.ScopeNodes.ExitNode;
import exm.dcir.ir.tree.ScopeNodes.MapEntry;
import exm.dcir.ir.tree.ScopeNodes.MapExit;
import exm.dcir.ir.tree.ScopeNodes.PipelineEntry;
import exm.dcir.ir.tree.ScopeNodes.PipelineExit;
import exm.dcir.ir.tree.Scopes.ConsumeScope;
import exm.dcir.ir.tree.Scopes.MapScope;
import exm.dcir.ir.tree.Scopes.PipelineScope;

/**
 * A state of the program: a multigraph of nodes scheduled as one
 * sequential step.  Node ids are positions in the node list.
 */
public class Region {
  private final String label;

  private Program program = null;

  private final List<Node> nodes = new ArrayList<Node>();

  private final List<Edge> edges = new ArrayList<Edge>();

  private final ListMultimap<Node, Edge> inEdges = ArrayListMultimap.create();

  private final ListMultimap<Node, Edge> outEdges = ArrayListMultimap.create();

  public Region(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public Program getProgram() {
    return program;
  }

  void setProgram(Program program) {
    this.program = program;
  }

  public List<Node> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<Edge> edges() {
    return Collections.unmodifiableList(edges);
  }

  public boolean contains(Node node) {
    return nodes.contains(node);
  }

  public <T extends Node> T addNode(T node) {
    if (contains(node)) {
      throw new DCIRRuntimeError("Node " + node + " already in region " +
                                 label);
    }
    nodes.add(node);
    return node;
  }

  public AccessNode addAccess(String data) {
    return addNode(new AccessNode(data));
  }

  public Tasklet addTasklet(String label, Set<String> inputs,
                            Set<String> outputs, String code) {
    return addNode(new Tasklet(label, inputs, outputs, code));
  }

  public NestedGraphNode addNestedGraph(String label, Program nested,
      Set<String> inputs, Set<String> outputs, Map<String, SymExpr> mapping) {
    return addNode(new NestedGraphNode(label, nested, inputs, outputs,
                                       mapping));
  }

  /**
   * Add entry and exit nodes of a new map scope, sharing the descriptor
   * @return the entry node
   */
  public MapEntry addMap(MapScope map) {
    if (map instanceof PipelineScope) {
      PipelineScope pipeline = (PipelineScope)map;
      PipelineEntry entry = addNode(new PipelineEntry(pipeline));
      addNode(new PipelineExit(pipeline));
      return entry;
    }
    MapEntry entry = addNode(new MapEntry(map));
    addNode(new MapExit(map));
    return entry;
  }

  /**
   * Add entry and exit nodes of a new consume scope
   * @return the entry node
   */
  public ConsumeEntry addConsume(ConsumeScope consume) {
    ConsumeEntry entry = addNode(new ConsumeEntry(consume));
    addNode(new ConsumeExit(consume));
    return entry;
  }

  public void removeNode(Node node) {
    for (Edge e: new ArrayList<Edge>(allEdges(node))) {
      removeEdge(e);
    }
    nodes.remove(node);
  }

  /**
   * Put replacement at the old node's position, moving all edges
   */
  public void replaceNode(Node old, Node replacement) {
    int id = nodeId(old);
    if (contains(replacement)) {
      throw new DCIRRuntimeError("Replacement " + replacement +
                                 " already in region " + label);
    }
    List<Edge> oldIn = new ArrayList<Edge>(inEdges(old));
    List<Edge> oldOut = new ArrayList<Edge>(outEdges(old));
    for (Edge e: oldIn) {
      removeEdge(e);
    }
    for (Edge e: oldOut) {
      removeEdge(e);
    }
    nodes.set(id, replacement);
    for (Edge e: oldIn) {
      Node src = e.getSrc() == old ? replacement : e.getSrc();
      addEdge(src, e.getSrcConn(), replacement, e.getDstConn(), e.getMemlet());
    }
    for (Edge e: oldOut) {
      if (e.getDst() == old) {
        // Self loop, already re-added
        continue;
      }
      addEdge(replacement, e.getSrcConn(), e.getDst(), e.getDstConn(),
              e.getMemlet());
    }
  }

  /**
   * Add edge between two nodes of the region.  Named connectors are
   * added to the nodes if not already present.
   */
  public Edge addEdge(Node src, String srcConn, Node dst, String dstConn,
                      Memlet memlet) {
    checkMember(src);
    checkMember(dst);
    if (srcConn != null && !src.outConnectors().contains(srcConn)) {
      src.addOutConnector(srcConn);
    }
    if (dstConn != null && !dst.inConnectors().contains(dstConn)) {
      dst.addInConnector(dstConn);
    }
    Edge e = new Edge(src, srcConn, dst, dstConn, memlet);
    edges.add(e);
    outEdges.put(src, e);
    inEdges.put(dst, e);
    return e;
  }

  /**
   * Add edges for one memlet along a path of nodes, where all nodes
   * except the ends are scope entries or exits.  Each scope node gets a
   * fresh IN_n/OUT_n connector pair.
   * @param memlet copied for each edge
   * @param srcConn connector on first node of path
   * @param dstConn connector on last node of path
   * @return the edges, from first to last
   */
  public List<Edge> addMemletPath(Memlet memlet, String srcConn,
                                  String dstConn, Node ...path) {
    if (path.length < 2) {
      throw new DCIRRuntimeError("Memlet path needs at least two nodes");
    }
    List<Edge> result = new ArrayList<Edge>();
    String nextSrcConn = srcConn;
    for (int i = 0; i < path.length - 1; i++) {
      Node dst = path[i + 1];
      String edgeDstConn;
      String followingSrcConn = null;
      if (i == path.length - 2) {
        edgeDstConn = dstConn;
      } else {
        if (!(dst instanceof EntryNode || dst instanceof ExitNode)) {
          throw new DCIRRuntimeError("Memlet path passes through " + dst +
                                     " which isn't a scope node");
        }
        String n = dst.nextConnector();
        edgeDstConn = Connectors.IN_PREFIX + n;
        followingSrcConn = Connectors.OUT_PREFIX + n;
        dst.addInConnector(edgeDstConn);
        dst.addOutConnector(followingSrcConn);
      }
      result.add(addEdge(path[i], nextSrcConn, dst, edgeDstConn,
                         memlet.copy()));
      nextSrcConn = followingSrcConn;
    }
    return result;
  }

  public void removeEdge(Edge e) {
    edges.remove(e);
    outEdges.remove(e.getSrc(), e);
    inEdges.remove(e.getDst(), e);
  }

  private void checkMember(Node n) {
    if (!contains(n)) {
      throw new DCIRRuntimeError("Node " + n + " not in region " + label);
    }
  }

  public int nodeId(Node node) {
    int id = nodes.indexOf(node);
    if (id < 0) {
      throw new DCIRRuntimeError("Node " + node + " not in region " + label);
    }
    return id;
  }

  public Node node(int id) {
    return nodes.get(id);
  }

  public boolean hasNodeId(int id) {
    return id >= 0 && id < nodes.size();
  }

  public List<Edge> inEdges(Node node) {
    return Collections.unmodifiableList(inEdges.get(node));
  }

  public List<Edge> outEdges(Node node) {
    return Collections.unmodifiableList(outEdges.get(node));
  }

  public List<Edge> allEdges(Node node) {
    List<Edge> result = new ArrayList<Edge>(inEdges.get(node));
    result.addAll(outEdges.get(node));
    return result;
  }

  public List<Node> predecessors(Node node) {
    Set<Node> result = new LinkedHashSet<Node>();
    for (Edge e: inEdges.get(node)) {
      result.add(e.getSrc());
    }
    return new ArrayList<Node>(result);
  }

  public List<Node> successors(Node node) {
    Set<Node> result = new LinkedHashSet<Node>();
    for (Edge e: outEdges.get(node)) {
      result.add(e.getDst());
    }
    return new ArrayList<Node>(result);
  }

  public List<AccessNode> accessNodes() {
    List<AccessNode> result = new ArrayList<AccessNode>();
    for (Node n: nodes) {
      if (n instanceof AccessNode) {
        result.add((AccessNode)n);
      }
    }
    return result;
  }

  /**
   * @return names of all buffers with access nodes in this region
   */
  public Set<String> accessedData() {
    Set<String> result = new LinkedHashSet<String>();
    for (AccessNode a: accessNodes()) {
      result.add(a.getData());
    }
    return result;
  }

  /**
   * @return matching exit node (same scope descriptor), or null
   */
  public ExitNode exitNode(EntryNode entry) {
    for (Node n: nodes) {
      if (n instanceof ExitNode &&
          ((ExitNode)n).getScope() == entry.getScope()) {
        return (ExitNode)n;
      }
    }
    return null;
  }

  /**
   * @return matching entry node (same scope descriptor), or null
   */
  public EntryNode entryOfExit(ExitNode exit) {
    for (Node n: nodes) {
      if (n instanceof EntryNode &&
          ((EntryNode)n).getScope() == exit.getScope()) {
        return (EntryNode)n;
      }
    }
    return null;
  }

  /**
   * Nodes inside the scope opened by entry, including its exit and
   * any nested scopes, but not the entry itself.
   * Empty if the entry has no matching exit.
   */
  public Set<Node> scopeSubgraph(EntryNode entry) {
    Set<Node> body = new LinkedHashSet<Node>();
    ExitNode exit = exitNode(entry);
    if (exit == null) {
      return body;
    }
    Deque<Node> stack = new ArrayDeque<Node>();
    stack.push(entry);
    while (!stack.isEmpty()) {
      Node curr = stack.pop();
      for (Edge e: outEdges.get(curr)) {
        Node next = e.getDst();
        if (next != entry && body.add(next) && next != exit) {
          stack.push(next);
        }
      }
    }
    return body;
  }

  /**
   * Innermost enclosing scope of each node.  Exit nodes belong to the
   * scope they close.
   * @return map from node to entry node, null values for top level nodes
   */
  public Map<Node, EntryNode> scopeDict() {
    Map<EntryNode, Set<Node>> bodies = new HashMap<EntryNode, Set<Node>>();
    for (Node n: nodes) {
      if (n instanceof EntryNode) {
        bodies.put((EntryNode)n, scopeSubgraph((EntryNode)n));
      }
    }

    Map<Node, EntryNode> result = new LinkedHashMap<Node, EntryNode>();
    for (Node n: nodes) {
      result.put(n, null);
    }
    for (Map.Entry<EntryNode, Set<Node>> scope: bodies.entrySet()) {
      for (Node member: scope.getValue()) {
        EntryNode curr = result.get(member);
        if (curr == null ||
            bodies.get(curr).size() > scope.getValue().size()) {
          result.put(member, scope.getKey());
        }
      }
    }
    return result;
  }

  /**
   * @return innermost enclosing scope entry, or null for top level
   */
  public EntryNode entryNode(Node node) {
    return scopeDict().get(node);
  }

  /**
   * All edges describing the same logical transfer as e across scope
   * boundaries: follow IN_n/OUT_n connector pairs of scope nodes out to
   * the root edge, then collect everything below it.
   */
  public List<Edge> memletTree(Edge e) {
    Set<Edge> visited = new HashSet<Edge>();
    Edge root = e;
    visited.add(root);
    while (true) {
      Edge parent = parentEdge(root);
      if (parent == null || !visited.add(parent)) {
        break;
      }
      root = parent;
    }

    List<Edge> result = new ArrayList<Edge>();
    Set<Edge> seen = new HashSet<Edge>();
    Deque<Edge> stack = new ArrayDeque<Edge>();
    stack.push(root);
    seen.add(root);
    while (!stack.isEmpty()) {
      Edge curr = stack.pop();
      result.add(curr);
      for (Edge child: childEdges(curr)) {
        if (seen.add(child)) {
          stack.push(child);
        }
      }
    }
    return result;
  }

  private Edge parentEdge(Edge e) {
    String srcConn = e.getSrcConn();
    String dstConn = e.getDstConn();
    if (e.getSrc() instanceof EntryNode && srcConn != null &&
        srcConn.startsWith(Connectors.OUT_PREFIX)) {
      String conn = Connectors.IN_PREFIX +
                    srcConn.substring(Connectors.OUT_PREFIX.length());
      for (Edge in: inEdges.get(e.getSrc())) {
        if (conn.equals(in.getDstConn())) {
          return in;
        }
      }
    } else if (e.getDst() instanceof ExitNode && dstConn != null &&
               dstConn.startsWith(Connectors.IN_PREFIX)) {
      String conn = Connectors.OUT_PREFIX +
                    dstConn.substring(Connectors.IN_PREFIX.length());
      for (Edge out: outEdges.get(e.getDst())) {
        if (conn.equals(out.getSrcConn())) {
          return out;
        }
      }
    }
    return null;
  }

  private List<Edge> childEdges(Edge e) {
    List<Edge> result = new ArrayList<Edge>();
    String srcConn = e.getSrcConn();
    String dstConn = e.getDstConn();
    if (e.getDst() instanceof EntryNode && dstConn != null &&
        dstConn.startsWith(Connectors.IN_PREFIX)) {
      String conn = Connectors.OUT_PREFIX +
                    dstConn.substring(Connectors.IN_PREFIX.length());
      for (Edge out: outEdges.get(e.getDst())) {
        if (conn.equals(out.getSrcConn())) {
          result.add(out);
        }
      }
    }
    if (e.getSrc() instanceof ExitNode && srcConn != null &&
        srcConn.startsWith(Connectors.OUT_PREFIX)) {
      String conn = Connectors.IN_PREFIX +
                    srcConn.substring(Connectors.OUT_PREFIX.length());
      for (Edge in: inEdges.get(e.getSrc())) {
        if (conn.equals(in.getDstConn())) {
          result.add(in);
        }
      }
    }
    return result;
  }

  public void prettyPrint(StringBuilder sb) {
    sb.append("region " + label + " {\n");
    for (int i = 0; i < nodes.size(); i++) {
      Node n = nodes.get(i);
      sb.append("  " + i + ": " + n.typeTag() + " " + n + "\n");
    }
    for (Edge e: edges) {
      sb.append("  " + e + "\n");
    }
    sb.append("}\n");
  }

  @Override
  public String toString() {
    return label;
  }
}
