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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;

import exm.dcir.common.exceptions.DCIRRuntimeError;
import exm.dcir.common.exceptions.InvalidNameException;
import exm.dcir.common.lang.Identifiers;
import exm.dcir.common.lang.RangeDim;
import exm.dcir.common.lang.ScheduleType;
import exm.dcir.common.lang.SymExpr;

/**
 * Descriptors of parametric scopes.  A descriptor is owned by the scope
 * itself: the entry and exit nodes of a scope both refer to the same
 * instance, so changes made through one node are seen through the other.
 */
public class Scopes {

  public static abstract class ScopeDescriptor {
    protected String label;
    protected ScheduleType schedule;

    /** Display only */
    protected boolean collapsed = false;

    protected ScopeDescriptor(String label, ScheduleType schedule) {
      this.label = label;
      this.schedule = schedule;
    }

    public String getLabel() {
      return label;
    }

    public void setLabel(String label) {
      this.label = label;
    }

    public ScheduleType getSchedule() {
      return schedule;
    }

    public void setSchedule(ScheduleType schedule) {
      this.schedule = schedule;
    }

    public boolean isCollapsed() {
      return collapsed;
    }

    public void setCollapsed(boolean collapsed) {
      this.collapsed = collapsed;
    }

    /**
     * @return number of scope parameters
     */
    public abstract int paramCount();

    /**
     * @return symbols referenced by the scope bounds
     */
    public abstract Set<String> freeSymbols();

    /**
     * Name of scope kind for error messages
     */
    protected abstract String kindName();

    /**
     * @param context
     * @param node entry or exit node of the scope being validated
     */
    public void validate(GraphContext context, Node node)
                                        throws InvalidNameException {
      if (!Identifiers.isValid(label)) {
        throw new InvalidNameException(kindName() + " name", label);
      }
    }
  }

  /**
   * Bounded range scope: body is replicated for each point of a
   * multidimensional integer range.
   */
  public static class MapScope extends ScopeDescriptor {
    protected final List<String> params;
    protected final List<RangeDim> ranges;
    protected boolean unroll;
    /** How many dimensions to collapse into the parallel range */
    protected int collapse;

    public MapScope(String label, List<String> params, List<RangeDim> ranges,
                    ScheduleType schedule, boolean unroll, int collapse) {
      super(label, schedule);
      if (params.size() != ranges.size()) {
        throw new DCIRRuntimeError("Map " + label + " has " + params.size()
            + " parameters but " + ranges.size() + " ranges");
      }
      this.params = new ArrayList<String>(params);
      this.ranges = new ArrayList<RangeDim>(ranges);
      this.unroll = unroll;
      this.collapse = collapse;
    }

    public MapScope(String label, List<String> params,
                    List<RangeDim> ranges) {
      this(label, params, ranges, ScheduleType.DEFAULT, false, 1);
    }

    public List<String> getParams() {
      return Collections.unmodifiableList(params);
    }

    public List<RangeDim> getRanges() {
      return Collections.unmodifiableList(ranges);
    }

    public void setRange(int dim, RangeDim range) {
      ranges.set(dim, range);
    }

    public boolean isUnroll() {
      return unroll;
    }

    public void setUnroll(boolean unroll) {
      this.unroll = unroll;
    }

    public int getCollapse() {
      return collapse;
    }

    public void setCollapse(int collapse) {
      this.collapse = collapse;
    }

    @Override
    public int paramCount() {
      return params.size();
    }

    @Override
    public Set<String> freeSymbols() {
      return RangeDim.freeSymbols(ranges);
    }

    @Override
    protected String kindName() {
      return "map";
    }

    @Override
    public String toString() {
      List<String> dims = new ArrayList<String>();
      for (int i = 0; i < params.size(); i++) {
        dims.add(params.get(i) + "=" + ranges.get(i));
      }
      return label + "[" + StringUtils.join(dims, ", ") + "]";
    }
  }

  /**
   * Map with constant-sized initialization and drain phases around the
   * main iteration space, e.g. N*M + c iterations, flattened into one
   * loop.
   */
  public static class PipelineScope extends MapScope {
    private int initSize;
    /** If true, regular indices are incremented during initialization */
    private boolean initOverlap;
    private int drainSize;
    /** If true, regular indices are incremented during drain */
    private boolean drainOverlap;

    public PipelineScope(String label, List<String> params,
        List<RangeDim> ranges, ScheduleType schedule, int initSize,
        boolean initOverlap, int drainSize, boolean drainOverlap) {
      super(label, params, ranges, schedule, false, 1);
      this.initSize = initSize;
      this.initOverlap = initOverlap;
      this.drainSize = drainSize;
      this.drainOverlap = drainOverlap;
    }

    public int getInitSize() {
      return initSize;
    }

    public void setInitSize(int initSize) {
      this.initSize = initSize;
    }

    public boolean isInitOverlap() {
      return initOverlap;
    }

    public void setInitOverlap(boolean initOverlap) {
      this.initOverlap = initOverlap;
    }

    public int getDrainSize() {
      return drainSize;
    }

    public void setDrainSize(int drainSize) {
      this.drainSize = drainSize;
    }

    public boolean isDrainOverlap() {
      return drainOverlap;
    }

    public void setDrainOverlap(boolean drainOverlap) {
      this.drainOverlap = drainOverlap;
    }

    /**
     * Name of the flattened iteration variable
     */
    public String iteratorName() {
      return "__" + StringUtils.join(params, "");
    }

    /**
     * Total iterations of flattened loop, including the init and drain
     * phases where they don't overlap the main range.
     */
    public SymExpr loopBound() {
      List<SymExpr> sizes = new ArrayList<SymExpr>();
      for (RangeDim r: ranges) {
        sizes.add(r.size());
      }
      SymExpr bound = SymExpr.product(sizes);
      if (initSize != 0 && !initOverlap) {
        bound = SymExpr.add(bound, SymExpr.intLit(initSize));
      }
      if (drainSize != 0 && !drainOverlap) {
        bound = SymExpr.add(bound, SymExpr.intLit(drainSize));
      }
      return bound;
    }

    /**
     * @return name of flag that is set while in the initialization phase
     */
    public String initializationActiveFlagName() {
      if (initSize <= 0) {
        throw new DCIRRuntimeError("No such phase: no initialization " +
                                   "phase exists for " + label);
      }
      return iteratorName() + "_init";
    }

    /**
     * @return name of flag that is set while in the drain phase
     */
    public String drainActiveFlagName() {
      if (drainSize <= 0) {
        throw new DCIRRuntimeError("No such phase: no drain phase exists " +
                                   "for " + label);
      }
      return iteratorName() + "_drain";
    }

    @Override
    protected String kindName() {
      return "pipeline";
    }
  }

  /**
   * Producer/consumer scope: a number of processing elements pop elements
   * from an input stream until the quiescence condition holds.
   */
  public static class ConsumeScope extends ScopeDescriptor {
    private String peIndex;
    private SymExpr numPes;
    /** Quiescence condition, null if consuming until stream is empty */
    private SymExpr condition;
    /** Max elements to consume at once */
    private int chunksize;

    public ConsumeScope(String label, String peIndex, SymExpr numPes,
                        SymExpr condition, ScheduleType schedule,
                        int chunksize) {
      super(label, schedule);
      this.peIndex = peIndex;
      this.numPes = numPes;
      this.condition = condition;
      this.chunksize = chunksize;
    }

    public ConsumeScope(String label, String peIndex, SymExpr numPes,
                        SymExpr condition) {
      this(label, peIndex, numPes, condition, ScheduleType.DEFAULT, 1);
    }

    public String getPeIndex() {
      return peIndex;
    }

    public void setPeIndex(String peIndex) {
      this.peIndex = peIndex;
    }

    public SymExpr getNumPes() {
      return numPes;
    }

    public void setNumPes(SymExpr numPes) {
      this.numPes = numPes;
    }

    public SymExpr getCondition() {
      return condition;
    }

    public void setCondition(SymExpr condition) {
      this.condition = condition;
    }

    public int getChunksize() {
      return chunksize;
    }

    public void setChunksize(int chunksize) {
      this.chunksize = chunksize;
    }

    /**
     * View this scope as a map over processing elements
     */
    public MapScope asMap() {
      return new MapScope(label, Collections.singletonList(peIndex),
          Collections.singletonList(RangeDim.upTo(numPes)),
          schedule, false, 1);
    }

    @Override
    public int paramCount() {
      return 1;
    }

    @Override
    public Set<String> freeSymbols() {
      Set<String> result = new TreeSet<String>(numPes.freeSymbols());
      if (condition != null) {
        result.addAll(condition.freeSymbols());
      }
      return result;
    }

    @Override
    protected String kindName() {
      return "consume";
    }

    @Override
    public String toString() {
      String s = label + " [" + peIndex + "=0:" + numPes + "]";
      if (condition != null) {
        s += ", Condition: " + condition;
      }
      return s;
    }
  }
}
