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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named input and output ports of a node.  A name is in at most one
 * of the two sets.
 */
public class Connectors {
  public static final String IN_PREFIX = "IN_";
  public static final String OUT_PREFIX = "OUT_";

  private static final Pattern NUMBERED =
                    Pattern.compile("^(?:IN_|OUT_)([0-9]{1,9})$");

  private final Set<String> in = new LinkedHashSet<String>();
  private final Set<String> out = new LinkedHashSet<String>();

  public Connectors() {
  }

  public Connectors(Set<String> in, Set<String> out) {
    for (String c: in) {
      addIn(c);
    }
    for (String c: out) {
      addOut(c);
    }
  }

  public boolean contains(String name) {
    return in.contains(name) || out.contains(name);
  }

  /**
   * @return false without changes if name is already a connector
   */
  public boolean addIn(String name) {
    if (contains(name)) {
      return false;
    }
    in.add(name);
    return true;
  }

  /**
   * @return false without changes if name is already a connector
   */
  public boolean addOut(String name) {
    if (contains(name)) {
      return false;
    }
    out.add(name);
    return true;
  }

  public boolean removeIn(String name) {
    in.remove(name);
    return true;
  }

  public boolean removeOut(String name) {
    out.remove(name);
    return true;
  }

  public Set<String> in() {
    return Collections.unmodifiableSet(in);
  }

  public Set<String> out() {
    return Collections.unmodifiableSet(out);
  }

  /**
   * Scan IN_n and OUT_n connector names.
   * @return one more than the highest n, or 1 if there are none
   */
  public int nextFreeIndex() {
    int next = 1;
    for (String c: in) {
      next = Math.max(next, indexOf(c) + 1);
    }
    for (String c: out) {
      next = Math.max(next, indexOf(c) + 1);
    }
    return next;
  }

  public int lastUsedIndex() {
    return nextFreeIndex() - 1;
  }

  /**
   * @return n for IN_n/OUT_n, otherwise 0
   */
  private static int indexOf(String connector) {
    Matcher m = NUMBERED.matcher(connector);
    if (!m.matches()) {
      return 0;
    }
    return Integer.parseInt(m.group(1));
  }
}
