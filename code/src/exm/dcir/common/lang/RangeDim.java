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

package exm.dcir.common.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * One dimension of an iteration range.  Both begin and end are
 * inclusive.
 */
public class RangeDim {
  private final SymExpr begin;
  private final SymExpr end;
  private final SymExpr step;

  public RangeDim(SymExpr begin, SymExpr end, SymExpr step) {
    this.begin = begin;
    this.end = end;
    this.step = step;
  }

  public RangeDim(SymExpr begin, SymExpr end) {
    this(begin, end, SymExpr.ONE);
  }

  /**
   * Range 0 .. n - 1 with unit step
   */
  public static RangeDim upTo(SymExpr n) {
    return new RangeDim(SymExpr.ZERO, SymExpr.sub(n, SymExpr.ONE));
  }

  public SymExpr begin() {
    return begin;
  }

  public SymExpr end() {
    return end;
  }

  public SymExpr step() {
    return step;
  }

  /**
   * @return number of iterations: (end - begin + step) // step
   */
  public SymExpr size() {
    return SymExpr.floorDiv(
        SymExpr.add(SymExpr.sub(end, begin), step), step);
  }

  public Set<String> freeSymbols() {
    return SymExpr.freeSymbols(Arrays.asList(begin, end, step));
  }

  public static Set<String> freeSymbols(List<RangeDim> ranges) {
    List<SymExpr> exprs = new ArrayList<SymExpr>();
    for (RangeDim r: ranges) {
      exprs.add(r.begin);
      exprs.add(r.end);
      exprs.add(r.step);
    }
    return SymExpr.freeSymbols(exprs);
  }

  @Override
  public String toString() {
    String s = begin + ":" + end;
    if (!step.equals(SymExpr.ONE)) {
      s += ":" + step;
    }
    return s;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * begin.hashCode() + end.hashCode()) + step.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof RangeDim)) {
      return false;
    }
    RangeDim other = (RangeDim) obj;
    return begin.equals(other.begin) && end.equals(other.end) &&
           step.equals(other.step);
  }
}
