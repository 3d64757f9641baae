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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.dcir.common.exceptions.ConnectorMismatchException;
import exm.dcir.common.exceptions.DCIRRuntimeError;
import exm.dcir.common.exceptions.MissingSymbolException;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.BufferDesc;
import exm.dcir.common.lang.ScalarType;
import exm.dcir.common.lang.SymExpr;

public class NestedGraphNodeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Set<String> names(String ...names) {
    return new HashSet<String>(Arrays.asList(names));
  }

  private static NestedGraphNode nest(Program outer, Program inner,
          Set<String> in, Set<String> out, Map<String, SymExpr> mapping) {
    Region r = outer.addRegion("state");
    return r.addNestedGraph("nested", inner, in, out, mapping);
  }

  private static void validate(Program outer, NestedGraphNode n)
                                                throws UserException {
    Region r = outer.getRegions().get(0);
    n.validate(new GraphContext(outer, r));
  }

  @Test
  public void testValid() throws UserException {
    Program inner = new Program("inner");
    inner.addBuffer("A", BufferDesc.array(ScalarType.FLOAT32, false, 4));
    inner.addBuffer("tmp", BufferDesc.array(ScalarType.FLOAT32, true, 4));
    Program outer = new Program("outer");
    NestedGraphNode n = nest(outer, inner, names("A"), names(), null);
    assertSame(n, inner.getParentNode());
    validate(outer, n);
  }

  @Test
  public void testMissingConnector() throws UserException {
    Program inner = new Program("inner");
    inner.addBuffer("A", BufferDesc.array(ScalarType.FLOAT32, false, 4));
    Program outer = new Program("outer");
    NestedGraphNode n = nest(outer, inner, names(), names("B"), null);
    try {
      validate(outer, n);
      fail("Expected missing connector");
    } catch (ConnectorMismatchException e) {
      assertEquals("A", e.getBufferName());
    }
  }

  @Test
  public void testScalarNeedsNoConnector() throws UserException {
    Program inner = new Program("inner");
    inner.addBuffer("s", BufferDesc.scalar(ScalarType.INT32, false));
    Program outer = new Program("outer");
    validate(outer, nest(outer, inner, names(), names(), null));
  }

  @Test
  public void testTransientConnector() throws UserException {
    Program inner = new Program("inner");
    inner.addBuffer("tmp", BufferDesc.array(ScalarType.FLOAT32, true, 4));
    Program outer = new Program("outer");
    NestedGraphNode n = nest(outer, inner, names(), names("tmp"), null);
    try {
      validate(outer, n);
      fail("Expected transient conflict");
    } catch (ConnectorMismatchException e) {
      assertEquals("tmp", e.getBufferName());
    }
  }

  @Test
  public void testMissingSymbols() throws UserException {
    Program inner = new Program("inner");
    inner.addSymbol("N", ScalarType.INT64);
    inner.addBuffer("A", BufferDesc.array(ScalarType.FLOAT32, false,
                               SymExpr.symbol("N"), SymExpr.symbol("M")));
    Program outer = new Program("outer");
    NestedGraphNode n = nest(outer, inner, names("A"), names(), null);
    try {
      validate(outer, n);
      fail("Expected missing symbols");
    } catch (MissingSymbolException e) {
      assertEquals(Arrays.asList("M", "N"), e.getSymbols());
    }
  }

  @Test
  public void testSymbolsFromMappingAndConnectors() throws UserException {
    Program inner = new Program("inner");
    inner.addSymbol("N", ScalarType.INT64);
    inner.addBuffer("A", BufferDesc.array(ScalarType.FLOAT32, false,
                               SymExpr.symbol("N"), SymExpr.symbol("M")));
    Map<String, SymExpr> mapping = new HashMap<String, SymExpr>();
    mapping.put("N", SymExpr.mul(SymExpr.symbol("K"), SymExpr.intLit(2)));
    Program outer = new Program("outer");
    NestedGraphNode n = nest(outer, inner, names("A", "M"), names(),
                             mapping);
    validate(outer, n);
    assertEquals("Mapped expressions are free in the parent",
                 Collections.singleton("K"), n.freeSymbols());
  }

  @Test
  public void testNullProgramRejected() {
    exception.expect(DCIRRuntimeError.class);
    exception.expectMessage("can not be null");
    new NestedGraphNode("nested", null, names("A"), names(), null);
  }
}
