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

/**
 * Directed edge between two connectors of nodes in a region.
 * Edges compare by identity, since a region is a multigraph.
 */
public class Edge {
  private final Node src;
  private final String srcConn;
  private final Node dst;
  private final String dstConn;
  private final Memlet memlet;

  public Edge(Node src, String srcConn, Node dst, String dstConn,
              Memlet memlet) {
    assert(src != null && dst != null && memlet != null);
    this.src = src;
    this.srcConn = srcConn;
    this.dst = dst;
    this.dstConn = dstConn;
    this.memlet = memlet;
  }

  public Node getSrc() {
    return src;
  }

  /** Null if not attached to a connector */
  public String getSrcConn() {
    return srcConn;
  }

  public Node getDst() {
    return dst;
  }

  /** Null if not attached to a connector */
  public String getDstConn() {
    return dstConn;
  }

  public Memlet getMemlet() {
    return memlet;
  }

  @Override
  public String toString() {
    return src + (srcConn == null ? "" : "." + srcConn) + " -> " +
           dst + (dstConn == null ? "" : "." + dstConn) + " : " + memlet;
  }
}
