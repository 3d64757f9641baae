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

package exm.dcir.ir.lib;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import exm.dcir.common.Logging;
import exm.dcir.common.Settings;
import exm.dcir.common.exceptions.UndefinedImplementationException;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.BufferDesc;
import exm.dcir.common.lang.ScalarType;
import exm.dcir.ir.opt.ExpandLibraryNodes;
import exm.dcir.ir.tree.AccessNode;
import exm.dcir.ir.tree.GraphContext;
import exm.dcir.ir.tree.LibraryNode;
import exm.dcir.ir.tree.Memlet;
import exm.dcir.ir.tree.NestedGraphNode;
import exm.dcir.ir.tree.Node;
import exm.dcir.ir.tree.Program;
import exm.dcir.ir.tree.Region;
import exm.dcir.ir.tree.Tasklet;

public class LibraryExpanderTest {

  private static final String LIB = "testlib";

  private static final Logger logger = Logging.getDCIRLogger();

  private static class GemmNode extends LibraryNode {
    private final LibraryNodeType type;

    GemmNode(String name, LibraryNodeType type) {
      super(name, new HashSet<String>(Arrays.asList("_a", "_b")),
            Collections.singleton("_c"));
      this.type = type;
    }

    @Override
    public LibraryNodeType type() {
      return type;
    }
  }

  private static class CodeExpansion extends TaskletExpansion {
    CodeExpansion(String name) {
      super(name);
    }

    @Override
    protected String generateCode(GraphContext context, LibraryNode node) {
      return getName() + ":" + node.getName();
    }
  }

  /**
   * Node type with implementations "pure" and "fast"
   */
  private static LibraryNodeType gemmType(String nodeDefault) {
    LibraryNodeType type = new LibraryNodeType(LIB,
        "exm.dcir.test.Gemm", nodeDefault,
        new LibraryNodeType.LibraryNodeFactory() {
          @Override
          public LibraryNode create(String name) {
            return null;
          }
        });
    type.registerImplementation(new CodeExpansion("pure"));
    type.registerImplementation(new CodeExpansion("fast"));
    return type;
  }

  @After
  public void cleanup() {
    LibraryRegistry.unregister(LIB);
    Settings.reset();
  }

  private static String resolve(LibraryConfig config, LibraryNode node)
                                throws UndefinedImplementationException {
    return new LibraryExpander(logger, config).resolve(node);
  }

  @Test
  public void testExplicitImplementation() throws UserException {
    GemmNode n = new GemmNode("gemm", gemmType("pure"));
    n.setImplementation("fast");
    assertEquals("fast", resolve(new LibraryConfig(), n));
    assertEquals("Config without override doesn't replace choice", "fast",
        resolve(new LibraryConfig().set(LIB, "pure", false), n));
  }

  @Test
  public void testOverride() throws UserException {
    GemmNode n = new GemmNode("gemm", gemmType(null));
    n.setImplementation("pure");
    assertEquals("fast",
        resolve(new LibraryConfig().set(LIB, "fast", true), n));
  }

  @Test
  public void testNodeTypeDefault() throws UserException {
    LibraryRegistry.register(new Library(LIB, "pure"));
    GemmNode n = new GemmNode("gemm", gemmType("fast"));
    assertEquals("fast", resolve(new LibraryConfig(), n));
  }

  @Test
  public void testLibraryDefault() throws UserException {
    LibraryRegistry.register(new Library(LIB, "pure"));
    GemmNode n = new GemmNode("gemm", gemmType(null));
    assertEquals("pure",
        resolve(new LibraryConfig().set(LIB, "fast", false), n));
  }

  @Test
  public void testConfigDefault() throws UserException {
    GemmNode n = new GemmNode("gemm", gemmType(null));
    assertEquals("fast",
        resolve(new LibraryConfig().set(LIB, "fast", false), n));
  }

  @Test
  public void testNoImplementation() {
    GemmNode n = new GemmNode("gemm", gemmType(null));
    try {
      resolve(new LibraryConfig(), n);
      fail("Expected no implementation");
    } catch (UndefinedImplementationException e) {
      assertNull(e.getImplementation());
    }
  }

  @Test
  public void testUnknownImplementation() {
    GemmNode n = new GemmNode("gemm", gemmType(null));
    n.setImplementation("cuBLAS");
    try {
      resolve(new LibraryConfig(), n);
      fail("Expected unknown implementation");
    } catch (UndefinedImplementationException e) {
      assertEquals("cuBLAS", e.getImplementation());
      assertTrue(e.getMessage().startsWith("Unknown implementation"));
    }
  }

  @Test
  public void testConfigFromSettings() throws UserException {
    Settings.set(Settings.libraryDefaultImplKey(LIB), "pure");
    Settings.set(Settings.libraryOverrideKey(LIB), "true");
    LibraryConfig config = LibraryConfig.fromSettings(
                                          Collections.singleton(LIB));
    assertEquals("pure", config.getDefaultImplementation(LIB));
    assertTrue(config.isOverride(LIB));

    GemmNode n = new GemmNode("gemm", gemmType(null));
    n.setImplementation("fast");
    assertEquals("pure", resolve(config, n));
  }

  @Test
  public void testExpandReplacesNode() throws UserException {
    Program p = new Program("prog");
    p.addBuffer("A", BufferDesc.array(ScalarType.FLOAT64, false, 4, 4));
    p.addBuffer("C", BufferDesc.array(ScalarType.FLOAT64, false, 4, 4));
    Region r = p.addRegion("state");
    AccessNode a = r.addAccess("A");
    GemmNode n = r.addNode(new GemmNode("gemm", gemmType("pure")));
    AccessNode c = r.addAccess("C");
    r.addEdge(a, null, n, "_a", new Memlet("A", "0:3, 0:3"));
    r.addEdge(n, "_c", c, null, new Memlet("C", "0:3, 0:3"));

    new LibraryExpander(logger, new LibraryConfig())
                            .expand(new GraphContext(p, r), n);

    Node replaced = r.node(1);
    assertTrue(replaced instanceof Tasklet);
    Tasklet t = (Tasklet)replaced;
    assertEquals("pure:gemm", t.getCode());
    assertEquals(n.inConnectors(), t.inConnectors());
    assertEquals(1, r.inEdges(t).size());
    assertEquals(1, r.outEdges(t).size());
    p.validate();
  }

  @Test
  public void testPassExpandsNestedGraphs() throws UserException {
    Program inner = new Program("inner");
    Region innerRegion = inner.addRegion("body");
    innerRegion.addNode(new GemmNode("gemm", gemmType(null)));

    Program p = new Program("prog");
    Region r = p.addRegion("state");
    Set<String> none = Collections.emptySet();
    NestedGraphNode nested = r.addNestedGraph("nested", inner, none, none,
                                              null);

    new ExpandLibraryNodes(new LibraryConfig().set(LIB, "fast", false))
                                                  .optimize(logger, p);
    Tasklet t = (Tasklet)nested.getProgram().getRegions().get(0).node(0);
    assertEquals("fast:gemm", t.getCode());
  }
}
