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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import exm.dcir.common.Logging;
import exm.dcir.common.Settings;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.BufferDesc;
import exm.dcir.common.lang.RangeDim;
import exm.dcir.common.lang.ScalarType;
import exm.dcir.common.lang.SymExpr;
import exm.dcir.ir.opt.TransientReuse.ReuseReport;
import exm.dcir.ir.tree.AccessNode;
import exm.dcir.ir.tree.Edge;
import exm.dcir.ir.tree.Memlet;
import exm.dcir.ir.tree.Program;
import exm.dcir.ir.tree.Region;
import exm.dcir.ir.tree.Scopes.MapScope;
import exm.dcir.ir.tree.ScopeNodes.MapEntry;
import exm.dcir.ir.tree.Tasklet;

public class TransientReuseTest {

  private static final Logger logger = Logging.getDCIRLogger();

  private static final Set<String> NONE = Collections.emptySet();

  /** 80 bytes */
  private static BufferDesc vector(boolean transientBuf) {
    return BufferDesc.array(ScalarType.FLOAT64, transientBuf, 10);
  }

  private static Program program(String ...transients) {
    Program p = new Program("prog");
    for (String name: Arrays.asList("A", "B", "C", "D")) {
      p.addBuffer(name, vector(false));
    }
    for (String name: transients) {
      p.addBuffer(name, vector(true));
    }
    return p;
  }

  /**
   * src -> tasklet -> dst
   */
  private static Tasklet link(Region r, AccessNode src, AccessNode dst,
                              String wcr) {
    Tasklet k = r.addTasklet("k" + r.nodes().size(), NONE, NONE, "o = i");
    r.addEdge(src, null, k, "i", new Memlet(src.getData(), "0:9"));
    r.addEdge(k, "o", dst, null, new Memlet(dst.getData(), "0:9", wcr));
    return k;
  }

  /**
   * Chain of access nodes linked by tasklets
   */
  private static List<AccessNode> chain(Region r, String ...data) {
    return chainFrom(r, null, data);
  }

  /**
   * Continue a chain from an existing access node
   * @return the new access nodes
   */
  private static List<AccessNode> chainFrom(Region r, AccessNode start,
                                            String ...data) {
    AccessNode[] nodes = new AccessNode[data.length];
    AccessNode prev = start;
    for (int i = 0; i < data.length; i++) {
      nodes[i] = r.addAccess(data[i]);
      if (prev != null) {
        link(r, prev, nodes[i], null);
      }
      prev = nodes[i];
    }
    return Arrays.asList(nodes);
  }

  private static Set<String> names(String ...names) {
    return new HashSet<String>(Arrays.asList(names));
  }

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testSequentialTransientsMerged() throws UserException {
    Program p = program("t1", "t2", "t3");
    Region r = p.addRegion("state");
    chain(r, "A", "t1", "B", "t2", "C", "t3", "D");

    ReuseReport report = new TransientReuse().apply(logger, p);

    assertEquals(Collections.singletonList(Arrays.asList("t1", "t2", "t3")),
                 report.getMergedBuckets());
    assertEquals("transient_reuse", report.getRenames().get("t2"));
    assertEquals(SymExpr.intLit(240), report.getMemoryBefore());
    assertEquals(SymExpr.intLit(80), report.getMemoryAfter());

    assertEquals(names("transient_reuse"), p.transientNames());
    for (String old: Arrays.asList("t1", "t2", "t3")) {
      assertFalse(p.hasBuffer(old));
      assertFalse(r.accessedData().contains(old));
    }
    Set<String> oldNames = names("t1", "t2", "t3");
    for (Edge e: r.edges()) {
      assertFalse("Memlet still refers to " + e.getMemlet().getData(),
                  oldNames.contains(e.getMemlet().getData()));
    }
    p.validate();
  }

  @Test
  public void testUnreferencedBuffersRemoved() throws UserException {
    Program p = program("t1");
    p.addBuffer("unused", vector(false));
    p.addBuffer("scratch", vector(true));
    Region r = p.addRegion("state");
    chain(r, "A", "t1", "B");

    new TransientReuse().apply(logger, p);

    assertFalse("Non-transient buffer without access nodes is removed",
                p.hasBuffer("unused"));
    assertFalse(p.hasBuffer("scratch"));
    assertFalse(p.hasBuffer("C"));
    assertTrue(p.hasBuffer("A"));
    assertTrue(p.hasBuffer("B"));
    assertTrue(p.hasBuffer("t1"));
  }

  @Test
  public void testNewNameAvoidsSymbols() throws UserException {
    Program p = program("t1", "t2");
    p.addSymbol("transient_reuse", ScalarType.INT32);
    Region r = p.addRegion("state");
    chain(r, "A", "t1", "B", "t2", "C");

    ReuseReport report = new TransientReuse().apply(logger, p);

    assertEquals("transient_reuse_0", report.getRenames().get("t1"));
    assertEquals(names("transient_reuse_0"), p.transientNames());
    assertEquals(ScalarType.INT32, p.getSymbols().get("transient_reuse"));
    assertFalse(p.hasBuffer("transient_reuse"));
  }

  @Test
  public void testReuseIsFixedPoint() throws UserException {
    Program p = program("t1", "t2", "t3");
    Region r = p.addRegion("state");
    chain(r, "A", "t1", "B", "t2", "C", "t3", "D");

    new TransientReuse().apply(logger, p);
    String before = p.toString();
    ReuseReport second = new TransientReuse().apply(logger, p);
    assertFalse(second.changed());
    assertEquals(second.getMemoryBefore(), second.getMemoryAfter());
    assertEquals(before, p.toString());
  }

  @Test
  public void testAdjacentTransientsNotMerged() throws UserException {
    Program p = program("t1", "t2", "t3");
    Region r = p.addRegion("state");
    chain(r, "A", "t1", "t2", "t3", "D");

    ReuseReport report = new TransientReuse().apply(logger, p);
    assertEquals("Read of t1 overlaps write of t2",
        Collections.singletonList(Arrays.asList("t1", "t3")),
        report.getMergedBuckets());
    assertTrue(p.hasBuffer("t2"));
    assertEquals(SymExpr.intLit(160), report.getMemoryAfter());
    p.validate();
  }

  @Test
  public void testDiamondNotMerged() throws UserException {
    Program p = program("t1", "t2");
    Region r = p.addRegion("state");
    AccessNode a = r.addAccess("A");
    AccessNode t1 = r.addAccess("t1");
    AccessNode t2 = r.addAccess("t2");
    AccessNode d = r.addAccess("D");
    link(r, a, t1, null);
    link(r, a, t2, null);
    Tasklet join = r.addTasklet("join", NONE, NONE, "o = x + y");
    r.addEdge(t1, null, join, "x", new Memlet("t1", "0:9"));
    r.addEdge(t2, null, join, "y", new Memlet("t2", "0:9"));
    r.addEdge(join, "o", d, null, new Memlet("D", "0:9"));

    ReuseReport report = new TransientReuse().apply(logger, p);
    assertFalse(report.changed());
    assertEquals(names("t1", "t2"), p.transientNames());
    assertEquals(SymExpr.intLit(160), report.getMemoryAfter());
  }

  @Test
  public void testWcrTargetExcluded() throws UserException {
    Program p = program("t1", "t2", "t3");
    Region r = p.addRegion("state");
    List<AccessNode> nodes = chain(r, "A", "t1", "B");
    AccessNode t2 = r.addAccess("t2");
    link(r, nodes.get(2), t2, "lambda a, b: a + b");
    chainFrom(r, t2, "C", "t3", "D");

    ReuseReport report = new TransientReuse().apply(logger, p);
    Map<String, String> renames = report.getRenames();
    assertEquals(names("t1", "t3"), renames.keySet());
    assertTrue(p.hasBuffer("t2"));
    assertTrue(r.accessedData().contains("t2"));
    p.validate();
  }

  @Test
  public void testCrossRegionTransientExcluded() throws UserException {
    Program p = program("t1", "t2", "t3");
    Region r1 = p.addRegion("first");
    chain(r1, "A", "t1", "B", "t2", "C", "t3", "D");
    Region r2 = p.addRegion("second");
    chain(r2, "t1", "A");

    ReuseReport report = new TransientReuse().apply(logger, p);
    assertEquals(names("t2", "t3"), report.getRenames().keySet());
    assertTrue(p.hasBuffer("t1"));
    assertTrue(r1.accessedData().contains("t1"));
    p.validate();
  }

  @Test
  public void testAccessInsideScopeExcluded() throws UserException {
    Program p = program("t1", "t2", "t3");
    Region r = p.addRegion("state");
    List<AccessNode> nodes = chain(r, "A", "t1", "B", "t2", "C");
    AccessNode c = nodes.get(4);

    MapEntry entry = r.addMap(new MapScope("m", Arrays.asList("i"),
        Arrays.asList(RangeDim.upTo(SymExpr.intLit(10)))));
    Tasklet in = r.addTasklet("scale", NONE, NONE, "o = 2 * i");
    AccessNode t3 = r.addAccess("t3");
    Tasklet out = r.addTasklet("copy", NONE, NONE, "o = i");
    AccessNode d = r.addAccess("D");
    r.addMemletPath(new Memlet("C", "i"), null, "i", c, entry, in);
    r.addEdge(in, "o", t3, null, new Memlet("t3", "i"));
    r.addEdge(t3, null, out, "i", new Memlet("t3", "i"));
    r.addMemletPath(new Memlet("D", "i"), "o", null, out, r.exitNode(entry),
                    d);

    TransientLiveness live = TransientLiveness.analyze(r);
    assertFalse(live.isBounded("t3"));
    assertTrue(live.isBounded("t1"));

    ReuseReport report = new TransientReuse().apply(logger, p);
    assertEquals(names("t1", "t2"), report.getRenames().keySet());
    assertTrue(p.hasBuffer("t3"));
    p.validate();
  }

  @Test
  public void testDifferentShapesNotMerged() throws UserException {
    Program p = program("t1");
    p.addBuffer("t2", BufferDesc.array(ScalarType.FLOAT64, true, 20));
    Region r = p.addRegion("state");
    chain(r, "A", "t1", "B", "t2", "C");

    assertFalse(new TransientReuse().apply(logger, p).changed());
  }

  @Test
  public void testRenameFollowsMemletTree() throws UserException {
    Program p = program("t1", "t2");
    Region r = p.addRegion("state");
    AccessNode a = r.addAccess("A");
    AccessNode t1 = r.addAccess("t1");
    link(r, a, t1, null);
    AccessNode b = r.addAccess("B");

    MapEntry entry = r.addMap(new MapScope("m", Arrays.asList("i"),
        Arrays.asList(RangeDim.upTo(SymExpr.intLit(10)))));
    Tasklet k = r.addTasklet("body", NONE, NONE, "o = i");
    List<Edge> inPath = r.addMemletPath(new Memlet("t1", "i"), null, "i",
                                        t1, entry, k);
    r.addMemletPath(new Memlet("B", "i"), "o", null, k, r.exitNode(entry),
                    b);
    chainFrom(r, b, "t2", "C");

    ReuseReport report = new TransientReuse().apply(logger, p);
    assertEquals(names("t1", "t2"), report.getRenames().keySet());
    for (Edge e: inPath) {
      assertEquals("transient_reuse", e.getMemlet().getData());
    }
    p.validate();
  }

  @Test
  public void testGraphOptimizerRespectsSettings() throws UserException {
    Program p = program("t1", "t2");
    Region r = p.addRegion("state");
    chain(r, "A", "t1", "B", "t2", "C");

    Settings.set(Settings.OPT_TRANSIENT_REUSE, "false");
    GraphOptimizer.optimize(logger, null, p);
    assertEquals(names("t1", "t2"), p.transientNames());

    Settings.set(Settings.OPT_TRANSIENT_REUSE, "true");
    GraphOptimizer.optimize(logger, null, p);
    assertEquals(names("transient_reuse"), p.transientNames());
  }
}
