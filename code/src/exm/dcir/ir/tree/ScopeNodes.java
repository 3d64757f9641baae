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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import exm.dcir.common.exceptions.DCIRRuntimeError;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.BufferDesc;
import exm.dcir.common.lang.RangeDim;
import exm.dcir.common.lang.ScalarType;
import exm.dcir.common.lang.ScheduleType;
import exm.dcir.ir.tree.Scopes.ConsumeScope;
import exm.dcir.ir.tree.Scopes.MapScope;
import exm.dcir.ir.tree.Scopes.PipelineScope;
import exm.dcir.ir.tree.Scopes.ScopeDescriptor;

/**
 * Nodes that open and close parametric scopes.  An entry and exit are a
 * pair if they refer to the same descriptor instance.
 */
public class ScopeNodes {

  public static abstract class EntryNode extends Node {

    protected EntryNode(Set<String> dynamicInputs) {
      super(dynamicInputs == null ? Collections.<String>emptySet()
                                  : dynamicInputs,
            Collections.<String>emptySet());
    }

    public abstract ScopeDescriptor getScope();

    /**
     * @return index symbols defined inside the scope
     */
    public abstract List<String> scopeParams();

    @Override
    public String getLabel() {
      return getScope().getLabel();
    }

    public ScheduleType getSchedule() {
      return getScope().getSchedule();
    }

    public void setSchedule(ScheduleType schedule) {
      getScope().setSchedule(schedule);
    }

    @Override
    public void validate(GraphContext context) throws UserException {
      getScope().validate(context, this);
    }

    /**
     * Input connectors not following the IN_ convention carry
     * scope bounds that are only known at run time.
     */
    public Set<String> dynamicInputs() {
      Set<String> result = new TreeSet<String>();
      for (String c: inConnectors()) {
        if (!c.startsWith(Connectors.IN_PREFIX)) {
          result.add(c);
        }
      }
      return result;
    }

    /**
     * Dynamic inputs shadow free symbols of the same name
     */
    @Override
    public Set<String> freeSymbols() {
      Set<String> result = new HashSet<String>(getScope().freeSymbols());
      result.removeAll(dynamicInputs());
      return result;
    }

    /**
     * Bind each wired dynamic input to the element type of the buffer
     * flowing into it.
     */
    protected void addDynamicInputSymbols(GraphContext context,
                                          Map<String, ScalarType> result) {
      Set<String> dynInputs = dynamicInputs();
      for (Edge e: context.getRegion().inEdges(this)) {
        String data = e.getMemlet().getData();
        if (dynInputs.contains(e.getDstConn()) && data != null) {
          BufferDesc desc = context.getProgram().lookupBuffer(data);
          if (desc == null) {
            throw new DCIRRuntimeError("Dynamic input " + e.getDstConn() +
                " of " + this + " reads unknown buffer " + data);
          }
          result.put(e.getDstConn(), desc.getDtype());
        }
      }
    }

    @Override
    public Map<String, Object> properties() {
      Map<String, Object> props = super.properties();
      props.put("label", getScope().getLabel());
      props.put("schedule", getScope().getSchedule().name());
      props.put("is_collapsed", getScope().isCollapsed());
      return props;
    }

    @Override
    public String toString() {
      return getScope().toString();
    }
  }

  public static abstract class ExitNode extends Node {

    protected ExitNode() {
      super();
    }

    public abstract ScopeDescriptor getScope();

    @Override
    public String getLabel() {
      return getScope().getLabel();
    }

    public ScheduleType getSchedule() {
      return getScope().getSchedule();
    }

    public void setSchedule(ScheduleType schedule) {
      getScope().setSchedule(schedule);
    }

    @Override
    public void validate(GraphContext context) throws UserException {
      getScope().validate(context, this);
    }

    @Override
    public String toString() {
      return getScope().toString();
    }
  }

  public static class MapEntry extends EntryNode {
    private MapScope map;

    public MapEntry(MapScope map, Set<String> dynamicInputs) {
      super(dynamicInputs);
      if (map == null) {
        throw new DCIRRuntimeError("Map for MapEntry can not be null");
      }
      this.map = map;
    }

    public MapEntry(MapScope map) {
      this(map, null);
    }

    public MapScope getMap() {
      return map;
    }

    public void setMap(MapScope map) {
      this.map = map;
    }

    @Override
    public ScopeDescriptor getScope() {
      return map;
    }

    @Override
    public List<String> scopeParams() {
      return map.getParams();
    }

    @Override
    public Map<String, ScalarType> newSymbols(GraphContext context,
                                    Map<String, ScalarType> symbols) {
      Map<String, ScalarType> result = new LinkedHashMap<String, ScalarType>();
      for (int i = 0; i < map.paramCount(); i++) {
        RangeDim r = map.getRanges().get(i);
        result.put(map.getParams().get(i),
                   ScalarType.widen(r.begin().inferType(symbols),
                                    r.end().inferType(symbols)));
      }
      addDynamicInputSymbols(context, result);
      return result;
    }

    @Override
    public Map<String, Object> properties() {
      Map<String, Object> props = super.properties();
      props.put("params", map.getParams());
      props.put("range", map.getRanges());
      props.put("unroll", map.isUnroll());
      props.put("collapse", map.getCollapse());
      return props;
    }
  }

  public static class MapExit extends ExitNode {
    private MapScope map;

    public MapExit(MapScope map) {
      super();
      if (map == null) {
        throw new DCIRRuntimeError("Map for MapExit can not be null");
      }
      this.map = map;
    }

    public MapScope getMap() {
      return map;
    }

    public void setMap(MapScope map) {
      this.map = map;
    }

    @Override
    public ScopeDescriptor getScope() {
      return map;
    }
  }

  public static class PipelineEntry extends MapEntry {

    public PipelineEntry(PipelineScope pipeline, Set<String> dynamicInputs) {
      super(pipeline, dynamicInputs);
    }

    public PipelineEntry(PipelineScope pipeline) {
      this(pipeline, null);
    }

    public PipelineScope getPipeline() {
      return (PipelineScope)getMap();
    }

    @Override
    public void setMap(MapScope map) {
      if (!(map instanceof PipelineScope)) {
        throw new DCIRRuntimeError("Pipeline entry needs pipeline scope: "
                                   + map);
      }
      super.setMap(map);
    }

    @Override
    public Map<String, Object> properties() {
      Map<String, Object> props = super.properties();
      PipelineScope p = getPipeline();
      props.put("init_size", p.getInitSize());
      props.put("init_overlap", p.isInitOverlap());
      props.put("drain_size", p.getDrainSize());
      props.put("drain_overlap", p.isDrainOverlap());
      return props;
    }
  }

  public static class PipelineExit extends MapExit {

    public PipelineExit(PipelineScope pipeline) {
      super(pipeline);
    }

    public PipelineScope getPipeline() {
      return (PipelineScope)getMap();
    }

    @Override
    public void setMap(MapScope map) {
      if (!(map instanceof PipelineScope)) {
        throw new DCIRRuntimeError("Pipeline exit needs pipeline scope: "
                                   + map);
      }
      super.setMap(map);
    }
  }

  public static class ConsumeEntry extends EntryNode {
    public static final String STREAM_IN = "IN_stream";
    public static final String STREAM_OUT = "OUT_stream";

    private ConsumeScope consume;

    public ConsumeEntry(ConsumeScope consume, Set<String> dynamicInputs) {
      super(dynamicInputs);
      if (consume == null) {
        throw new DCIRRuntimeError("Consume for ConsumeEntry can not be null");
      }
      this.consume = consume;
      addInConnector(STREAM_IN);
      addOutConnector(STREAM_OUT);
    }

    public ConsumeEntry(ConsumeScope consume) {
      this(consume, null);
    }

    public ConsumeScope getConsume() {
      return consume;
    }

    public void setConsume(ConsumeScope consume) {
      this.consume = consume;
    }

    @Override
    public ScopeDescriptor getScope() {
      return consume;
    }

    @Override
    public List<String> scopeParams() {
      return Collections.singletonList(consume.getPeIndex());
    }

    @Override
    public Map<String, ScalarType> newSymbols(GraphContext context,
                                    Map<String, ScalarType> symbols) {
      Map<String, ScalarType> result = new LinkedHashMap<String, ScalarType>();
      result.put(consume.getPeIndex(), consume.getNumPes().inferType(symbols));
      addDynamicInputSymbols(context, result);
      return result;
    }

    @Override
    public Map<String, Object> properties() {
      Map<String, Object> props = super.properties();
      props.put("pe_index", consume.getPeIndex());
      props.put("num_pes", consume.getNumPes());
      props.put("condition", consume.getCondition());
      props.put("chunksize", consume.getChunksize());
      return props;
    }
  }

  public static class ConsumeExit extends ExitNode {
    private ConsumeScope consume;

    public ConsumeExit(ConsumeScope consume) {
      super();
      if (consume == null) {
        throw new DCIRRuntimeError("Consume for ConsumeExit can not be null");
      }
      this.consume = consume;
    }

    public ConsumeScope getConsume() {
      return consume;
    }

    public void setConsume(ConsumeScope consume) {
      this.consume = consume;
    }

    @Override
    public ScopeDescriptor getScope() {
      return consume;
    }
  }
}
