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
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashSet;

import org.junit.Test;

public class ConnectorsTest {

  @Test
  public void testAddRejectsDuplicateNames() {
    Connectors c = new Connectors();
    assertTrue(c.addIn("a"));
    assertFalse("Same name as input", c.addIn("a"));
    assertFalse("Name already used as input", c.addOut("a"));
    assertEquals(new HashSet<String>(Arrays.asList("a")), c.in());
    assertTrue(c.out().isEmpty());
  }

  @Test
  public void testRemoveAlwaysSucceeds() {
    Connectors c = new Connectors();
    c.addOut("b");
    assertTrue(c.removeOut("b"));
    assertTrue("Removing missing connector", c.removeOut("b"));
    assertTrue(c.removeIn("nothing"));
    assertFalse(c.contains("b"));
  }

  @Test
  public void testNextFreeIndex() {
    Connectors c = new Connectors();
    assertEquals("No numbered connectors", 1, c.nextFreeIndex());
    assertEquals(0, c.lastUsedIndex());

    c.addIn("IN_1");
    c.addOut("OUT_2");
    c.addIn("IN_5");
    c.addIn("stream");
    c.addOut("OUT_x");
    assertEquals(6, c.nextFreeIndex());
    assertEquals(5, c.lastUsedIndex());
  }

  @Test
  public void testNodeConnectorNames() {
    Tasklet t = new Tasklet("t");
    t.addInConnector("IN_3");
    assertEquals("4", t.nextConnector());
    assertEquals("3", t.lastConnector());
  }
}
