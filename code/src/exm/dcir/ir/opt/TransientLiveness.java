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

package exm.dcir.ir.opt;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.TreeMultimap;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;

import exm.dcir.common.lang.BufferDesc;
import exm.dcir.ir.tree.AccessNode;
import exm.dcir.ir.tree.Edge;
import exm.dcir.ir.tree.Node;
import exm.dcir.ir.tree.Program;
import exm.dcir.ir.tree.Region;
import exm.dcir.ir.tree.ScopeNodes.EntryNode;
import exm.dcir.ir.tree.ScopeNodes.ExitNode;

/**
 * Buffer lifetimes within one region, computed on a condensed graph
 * that only has top-level access nodes as vertices:
 * - each top-level scope is collapsed into its entry node, which takes
 *   over the out edges of the exit node
 * - remaining non-access nodes are removed, connecting their
 *   predecessors directly to their successors
 * - access nodes written through a write-conflict-resolution edge are
 *   removed in the same way, since their writes can't be bounded here
 *
 * A buffer is bounded if all of its access nodes in the region survive
 * condensation.  Only bounded buffers can be merged.
 */
public class TransientLiveness {
  private final Region region;

  private final MutableGraph<Node> graph;

  /** Buffers with some access node removed during condensation */
  private final Set<String> unbounded;

  /** Surviving access nodes by buffer name */
  private final ListMultimap<String, AccessNode> vertices;

  private final Map<Node, Set<Node>> ancestors;

  private final Map<Node, Set<Node>> successors;

  private TransientLiveness(Region region, MutableGraph<Node> graph,
                            Set<String> unbounded) {
    this.region = region;
    this.graph = graph;
    this.unbounded = unbounded;
    this.vertices = ArrayListMultimap.create();
    this.ancestors = new HashMap<Node, Set<Node>>();
    this.successors = new HashMap<Node, Set<Node>>();
  }

  public static TransientLiveness analyze(Region region) {
    Set<String> unbounded = new HashSet<String>();
    MutableGraph<Node> graph = condense(region, unbounded);
    TransientLiveness result = new TransientLiveness(region, graph,
                                                     unbounded);
    result.computeLiveness();
    return result;
  }

  private static MutableGraph<Node> condense(Region region,
                                             Set<String> unbounded) {
    MutableGraph<Node> g = GraphBuilder.directed().allowsSelfLoops(true)
                                       .build();
    for (Node n: region.nodes()) {
      g.addNode(n);
    }
    for (Edge e: region.edges()) {
      g.putEdge(e.getSrc(), e.getDst());
    }

    Map<Node, EntryNode> scopes = region.scopeDict();
    for (Node n: region.nodes()) {
      if (n instanceof EntryNode && scopes.get(n) == null) {
        EntryNode entry = (EntryNode)n;
        ExitNode exit = region.exitNode(entry);
        if (exit == null) {
          continue;
        }
        for (Node succ: new ArrayList<Node>(g.successors(exit))) {
          g.putEdge(entry, succ);
        }
        for (Node inner: region.scopeSubgraph(entry)) {
          if (inner instanceof AccessNode) {
            unbounded.add(((AccessNode)inner).getData());
          }
          g.removeNode(inner);
        }
      }
    }

    for (Node n: region.nodes()) {
      if (!g.nodes().contains(n)) {
        continue;
      }
      if (!(n instanceof AccessNode)) {
        splice(g, n);
      } else if (hasWcrInput(region, n)) {
        unbounded.add(((AccessNode)n).getData());
        splice(g, n);
      }
    }
    return g;
  }

  private static boolean hasWcrInput(Region region, Node n) {
    for (Edge e: region.inEdges(n)) {
      if (e.getMemlet().hasWcr()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Remove n, connecting each predecessor to each successor
   */
  private static void splice(MutableGraph<Node> g, Node n) {
    List<Node> preds = new ArrayList<Node>(g.predecessors(n));
    List<Node> succs = new ArrayList<Node>(g.successors(n));
    for (Node p: preds) {
      for (Node s: succs) {
        if (p != n && s != n) {
          g.putEdge(p, s);
        }
      }
    }
    g.removeNode(n);
  }

  private void computeLiveness() {
    for (Node n: graph.nodes()) {
      AccessNode a = (AccessNode)n;
      vertices.put(a.getData(), a);

      Set<Node> anc = new HashSet<Node>(
                  Graphs.reachableNodes(Graphs.transpose(graph), n));
      anc.remove(n);
      ancestors.put(n, anc);
      // Direct readers end the lifetime of the buffer
      successors.put(n, new HashSet<Node>(graph.successors(n)));
    }
  }

  public Region getRegion() {
    return region;
  }

  /**
   * @return vertices of the condensed graph: surviving access nodes
   */
  public Set<Node> vertices() {
    return Collections.unmodifiableSet(graph.nodes());
  }

  public Set<Node> ancestors(Node n) {
    return Collections.unmodifiableSet(ancestors.get(n));
  }

  public Set<Node> successors(Node n) {
    return Collections.unmodifiableSet(successors.get(n));
  }

  /**
   * @return true if the buffer has access nodes in the region and all
   *              of them are vertices of the condensed graph
   */
  public boolean isBounded(String data) {
    return vertices.containsKey(data) && !unbounded.contains(data);
  }

  /**
   * Whether buffer n can be stored in buffer m: every use of n is
   * finished before m is first written.  Descriptors aren't checked.
   */
  public boolean mayReplace(String n, String m) {
    if (n.equals(m) || !isBounded(n) || !isBounded(m)) {
      return false;
    }
    for (AccessNode vn: vertices.get(n)) {
      for (AccessNode vm: vertices.get(m)) {
        Set<Node> ancM = ancestors.get(vm);
        if (!ancM.contains(vn) || !ancM.containsAll(successors.get(vn))) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Legal merges among candidates: n -> m if n may be replaced by m and
   * both have equivalent descriptors.
   */
  public SetMultimap<String, String> legalMerges(Program program,
                                          Collection<String> candidates) {
    SetMultimap<String, String> result = TreeMultimap.create();
    for (String n: candidates) {
      BufferDesc descN = program.lookupBuffer(n);
      for (String m: candidates) {
        if (n.equals(m)) {
          continue;
        }
        if (descN.isEquivalent(program.lookupBuffer(m)) &&
            mayReplace(n, m)) {
          result.put(n, m);
        }
      }
    }
    return result;
  }
}
