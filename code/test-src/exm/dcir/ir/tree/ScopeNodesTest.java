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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

import exm.dcir.common.lang.BufferDesc;
import exm.dcir.common.lang.RangeDim;
import exm.dcir.common.lang.ScalarType;
import exm.dcir.common.lang.ScheduleType;
import exm.dcir.common.lang.SymExpr;
import exm.dcir.ir.tree.Scopes.ConsumeScope;
import exm.dcir.ir.tree.Scopes.MapScope;
import exm.dcir.ir.tree.ScopeNodes.ConsumeEntry;
import exm.dcir.ir.tree.ScopeNodes.ExitNode;
import exm.dcir.ir.tree.ScopeNodes.MapEntry;

public class ScopeNodesTest {

  private static MapScope map1D(String label, String param, SymExpr n) {
    return new MapScope(label, Arrays.asList(param),
                        Arrays.asList(RangeDim.upTo(n)));
  }

  @Test
  public void testEntryAndExitShareDescriptor() {
    Region r = new Region("state");
    MapEntry entry = r.addMap(map1D("outer", "i", SymExpr.intLit(10)));
    ExitNode exit = r.exitNode(entry);

    assertSame(entry.getScope(), exit.getScope());
    exit.setSchedule(ScheduleType.CPU_MULTICORE);
    assertEquals("Schedule set through exit visible on entry",
        ScheduleType.CPU_MULTICORE, entry.getSchedule());
    assertEquals("outer", exit.getLabel());
    assertSame(entry, r.entryOfExit(exit));
  }

  @Test
  public void testMapParamsArentFree() {
    Program p = new Program("prog");
    Region r = p.addRegion("state");
    r.addMap(map1D("m", "i", SymExpr.symbol("N")));
    assertEquals(new HashSet<String>(Arrays.asList("N")), p.freeSymbols());
  }

  @Test
  public void testMapNewSymbols() {
    Program p = new Program("prog");
    Region r = p.addRegion("state");
    MapScope map = new MapScope("m", Arrays.asList("i", "j"),
        Arrays.asList(RangeDim.upTo(SymExpr.symbol("N")),
                      new RangeDim(SymExpr.ZERO, SymExpr.intLit(1L << 40))));
    MapEntry entry = r.addMap(map);

    Map<String, ScalarType> symbols = new HashMap<String, ScalarType>();
    symbols.put("N", ScalarType.INT16);
    Map<String, ScalarType> result = entry.newSymbols(
                                        new GraphContext(p, r), symbols);
    assertEquals("Widened from N - 1", ScalarType.INT32, result.get("i"));
    assertEquals(ScalarType.INT64, result.get("j"));
  }

  @Test
  public void testDynamicInputs() {
    Program p = new Program("prog");
    p.addBuffer("bound", BufferDesc.scalar(ScalarType.INT64, false));
    Region r = p.addRegion("state");
    MapEntry entry = r.addMap(map1D("m", "i", SymExpr.symbol("n")));
    AccessNode bound = r.addAccess("bound");
    r.addEdge(bound, null, entry, "n", new Memlet("bound", "0"));
    entry.addInConnector("IN_1");

    assertEquals(Collections.singleton("n"), entry.dynamicInputs());
    assertFalse("Dynamic input shadows free symbol",
                entry.freeSymbols().contains("n"));

    Map<String, ScalarType> result = entry.newSymbols(
        new GraphContext(p, r), new HashMap<String, ScalarType>());
    assertEquals("Bound to element type of buffer", ScalarType.INT64,
                 result.get("n"));
  }

  @Test
  public void testConsumeEntry() {
    Program p = new Program("prog");
    Region r = p.addRegion("state");
    ConsumeScope consume = new ConsumeScope("cons", "pe", SymExpr.symbol("P"),
        SymExpr.binop(SymExpr.Op.EQ, SymExpr.symbol("left"), SymExpr.ZERO),
        ScheduleType.DEFAULT, 1);
    ConsumeEntry entry = r.addConsume(consume);

    assertTrue(entry.inConnectors().contains(ConsumeEntry.STREAM_IN));
    assertTrue(entry.outConnectors().contains(ConsumeEntry.STREAM_OUT));
    assertEquals(Collections.singletonList("pe"), entry.scopeParams());

    Set<String> free = entry.freeSymbols();
    assertEquals(new HashSet<String>(Arrays.asList("P", "left")), free);

    Map<String, ScalarType> symbols = new HashMap<String, ScalarType>();
    symbols.put("P", ScalarType.UINT8);
    assertEquals(ScalarType.UINT8,
        entry.newSymbols(new GraphContext(p, r), symbols).get("pe"));

    MapScope asMap = consume.asMap();
    assertEquals(Collections.singletonList("pe"), asMap.getParams());
    assertEquals(RangeDim.upTo(SymExpr.symbol("P")), asMap.getRanges().get(0));
  }

  @Test
  public void testMapToString() {
    assertEquals("m[i=0:N - 1]", map1D("m", "i", SymExpr.symbol("N"))
                                                               .toString());
  }
}
