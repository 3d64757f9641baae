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

import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.dcir.common.exceptions.DCIRRuntimeError;
import exm.dcir.common.lang.RangeDim;
import exm.dcir.common.lang.ScheduleType;
import exm.dcir.common.lang.SymExpr;
import exm.dcir.ir.tree.Scopes.PipelineScope;
import exm.dcir.ir.tree.ScopeNodes.MapEntry;
import exm.dcir.ir.tree.ScopeNodes.PipelineEntry;
import exm.dcir.ir.tree.ScopeNodes.PipelineExit;

public class PipelineScopeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static PipelineScope pipeline(int init, boolean initOverlap,
                                        int drain, boolean drainOverlap) {
    return new PipelineScope("pipe", Arrays.asList("i", "j"),
        Arrays.asList(new RangeDim(SymExpr.ZERO, SymExpr.intLit(9)),
                      new RangeDim(SymExpr.ZERO, SymExpr.intLit(3))),
        ScheduleType.FPGA_DEVICE, init, initOverlap, drain, drainOverlap);
  }

  @Test
  public void testIteratorNames() {
    PipelineScope p = pipeline(2, false, 3, false);
    assertEquals("__ij", p.iteratorName());
    assertEquals("__ij_init", p.initializationActiveFlagName());
    assertEquals("__ij_drain", p.drainActiveFlagName());
  }

  @Test
  public void testLoopBound() {
    assertEquals(SymExpr.intLit(45), pipeline(2, false, 3, false).loopBound());
    assertEquals("Overlapping phases don't extend the loop",
        SymExpr.intLit(40), pipeline(2, true, 3, true).loopBound());
    assertEquals(SymExpr.intLit(43), pipeline(0, false, 3, false).loopBound());
  }

  @Test
  public void testNoInitPhase() {
    exception.expect(DCIRRuntimeError.class);
    exception.expectMessage("No such phase");
    pipeline(0, false, 3, false).initializationActiveFlagName();
  }

  @Test
  public void testNoDrainPhase() {
    exception.expect(DCIRRuntimeError.class);
    pipeline(1, false, 0, false).drainActiveFlagName();
  }

  @Test
  public void testRegionCreatesPipelineNodes() {
    Region r = new Region("state");
    MapEntry entry = r.addMap(pipeline(1, false, 1, false));
    assertEquals(PipelineEntry.class, entry.getClass());
    assertEquals(PipelineExit.class, r.exitNode(entry).getClass());
  }
}
