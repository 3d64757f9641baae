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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.dcir.common.exceptions.UndefinedTypeException;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.AccessType;
import exm.dcir.common.lang.RangeDim;
import exm.dcir.common.lang.ScheduleType;
import exm.dcir.common.lang.SymExpr;
import exm.dcir.ir.lib.LibraryNodeType;
import exm.dcir.ir.tree.ScopeNodes.ConsumeEntry;
import exm.dcir.ir.tree.ScopeNodes.ConsumeExit;
import exm.dcir.ir.tree.ScopeNodes.MapEntry;
import exm.dcir.ir.tree.ScopeNodes.MapExit;
import exm.dcir.ir.tree.ScopeNodes.PipelineEntry;
import exm.dcir.ir.tree.ScopeNodes.PipelineExit;
import exm.dcir.ir.tree.Scopes.ConsumeScope;
import exm.dcir.ir.tree.Scopes.MapScope;
import exm.dcir.ir.tree.Scopes.PipelineScope;

/**
 * Closed registry from exchange record type tags to node constructors.
 * Built-in kinds are registered when the class is initialized; library
 * node kinds are registered by classpath when their library is
 * registered.
 *
 * Attributes are expected to hold the values produced by
 * {@link Node#properties()}.  Scope nodes are re-paired through the
 * scope_entry/scope_exit ids of the record: whichever of the pair is
 * rebuilt second adopts the descriptor of the first.
 */
public class NodeTypeRegistry {

  public static interface NodeFactory {
    /**
     * @param record exchange record
     * @param region region being rebuilt, containing nodes with lower ids
     */
    public Node create(Map<String, Object> record, Region region)
                                                  throws UserException;
  }

  private static final Map<String, NodeFactory> factories =
                                    new HashMap<String, NodeFactory>();

  /** Library node kinds, by classpath */
  private static final Map<String, LibraryNodeType> libraryNodeTypes =
                                    new HashMap<String, LibraryNodeType>();

  static {
    register("AccessNode", new NodeFactory() {
      @Override
      public Node create(Map<String, Object> record, Region region) {
        Map<String, Object> attrs = attributes(record);
        AccessNode n = new AccessNode(getString(attrs, "data"),
            AccessType.valueOf(getString(attrs, "access")));
        n.setSetZero(getBool(attrs, "setzero", false));
        restoreConnectors(n, attrs);
        return n;
      }
    });

    register("Tasklet", new NodeFactory() {
      @Override
      public Node create(Map<String, Object> record, Region region) {
        Map<String, Object> attrs = attributes(record);
        Tasklet t = new Tasklet(getString(attrs, "label"));
        t.setCode(getString(attrs, "code"));
        restoreConnectors(t, attrs);
        restoreLocation(t, attrs);
        return t;
      }
    });

    register("NestedGraphNode", new NodeFactory() {
      @Override
      public Node create(Map<String, Object> record, Region region) {
        Map<String, Object> attrs = attributes(record);
        // Nested program content is exchanged separately
        NestedGraphNode n = new NestedGraphNode(getString(attrs, "label"),
            new Program(getString(attrs, "program")),
            Collections.<String>emptySet(), Collections.<String>emptySet(),
            NodeTypeRegistry.<SymExpr>getMap(attrs, "symbol_mapping"));
        n.setSchedule(ScheduleType.valueOf(getString(attrs, "schedule")));
        n.setCollapsed(getBool(attrs, "is_collapsed", false));
        restoreConnectors(n, attrs);
        restoreLocation(n, attrs);
        return n;
      }
    });

    register("MapEntry", new NodeFactory() {
      @Override
      public Node create(Map<String, Object> record, Region region) {
        MapScope map = mapScope(attributes(record));
        MapEntry entry = new MapEntry(map);
        attachExit(record, region, map);
        restoreConnectors(entry, attributes(record));
        return entry;
      }
    });

    register("PipelineEntry", new NodeFactory() {
      @Override
      public Node create(Map<String, Object> record, Region region) {
        Map<String, Object> attrs = attributes(record);
        MapScope base = mapScope(attrs);
        PipelineScope pipeline = new PipelineScope(base.getLabel(),
            base.getParams(), base.getRanges(), base.getSchedule(),
            getInt(attrs, "init_size", 0),
            getBool(attrs, "init_overlap", false),
            getInt(attrs, "drain_size", 0),
            getBool(attrs, "drain_overlap", false));
        pipeline.setCollapsed(base.isCollapsed());
        PipelineEntry entry = new PipelineEntry(pipeline);
        attachExit(record, region, pipeline);
        restoreConnectors(entry, attrs);
        return entry;
      }
    });

    register("MapExit", new NodeFactory() {
      @Override
      public Node create(Map<String, Object> record, Region region) {
        Node entry = pairedNode(record, "scope_entry", region);
        MapExit exit;
        if (entry instanceof MapEntry) {
          exit = new MapExit(((MapEntry)entry).getMap());
        } else {
          // Entry has higher id: it will attach itself
          exit = new MapExit(placeholderMap());
        }
        restoreConnectors(exit, attributes(record));
        return exit;
      }
    });

    register("PipelineExit", new NodeFactory() {
      @Override
      public Node create(Map<String, Object> record, Region region) {
        Node entry = pairedNode(record, "scope_entry", region);
        PipelineExit exit;
        if (entry instanceof PipelineEntry) {
          exit = new PipelineExit(((PipelineEntry)entry).getPipeline());
        } else {
          exit = new PipelineExit(new PipelineScope("_",
              Collections.<String>emptyList(),
              Collections.<RangeDim>emptyList(), ScheduleType.DEFAULT,
              0, false, 0, false));
        }
        restoreConnectors(exit, attributes(record));
        return exit;
      }
    });

    register("ConsumeEntry", new NodeFactory() {
      @Override
      public Node create(Map<String, Object> record, Region region) {
        Map<String, Object> attrs = attributes(record);
        ConsumeScope consume = new ConsumeScope(getString(attrs, "label"),
            getString(attrs, "pe_index"), (SymExpr)attrs.get("num_pes"),
            (SymExpr)attrs.get("condition"),
            ScheduleType.valueOf(getString(attrs, "schedule")),
            getInt(attrs, "chunksize", 1));
        consume.setCollapsed(getBool(attrs, "is_collapsed", false));
        ConsumeEntry entry = new ConsumeEntry(consume);
        Node exit = pairedNode(record, "scope_exit", region);
        if (exit instanceof ConsumeExit) {
          ((ConsumeExit)exit).setConsume(consume);
        }
        restoreConnectors(entry, attrs);
        return entry;
      }
    });

    register("ConsumeExit", new NodeFactory() {
      @Override
      public Node create(Map<String, Object> record, Region region) {
        Node entry = pairedNode(record, "scope_entry", region);
        ConsumeExit exit;
        if (entry instanceof ConsumeEntry) {
          exit = new ConsumeExit(((ConsumeEntry)entry).getConsume());
        } else {
          exit = new ConsumeExit(new ConsumeScope("_", "i", SymExpr.ONE,
                                                  null));
        }
        restoreConnectors(exit, attributes(record));
        return exit;
      }
    });

    register(LibraryNode.TYPE_TAG, new NodeFactory() {
      @Override
      public Node create(Map<String, Object> record, Region region)
                                            throws UserException {
        String classpath = (String)record.get("classpath");
        LibraryNodeType type = lookupLibraryNodeType(classpath);
        Map<String, Object> attrs = attributes(record);
        LibraryNode n = type.create(getString(attrs, "name"));
        n.setLabel(getString(attrs, "label"));
        n.setImplementation(getString(attrs, "implementation"));
        n.setSchedule(ScheduleType.valueOf(getString(attrs, "schedule")));
        restoreConnectors(n, attrs);
        restoreLocation(n, attrs);
        return n;
      }
    });
  }

  public static void register(String tag, NodeFactory factory) {
    factories.put(tag, factory);
  }

  /**
   * @return constructor for node kind
   * @throws UndefinedTypeException if tag unknown
   */
  public static NodeFactory lookup(String tag) throws UndefinedTypeException {
    NodeFactory f = factories.get(tag);
    if (f == null) {
      throw new UndefinedTypeException(tag);
    }
    return f;
  }

  public static void registerLibraryNodeType(LibraryNodeType type) {
    libraryNodeTypes.put(type.getClasspath(), type);
  }

  public static LibraryNodeType lookupLibraryNodeType(String classpath)
                                        throws UndefinedTypeException {
    LibraryNodeType type = classpath == null ? null
                                       : libraryNodeTypes.get(classpath);
    if (type == null) {
      throw new UndefinedTypeException("library node", classpath);
    }
    return type;
  }

  /**
   * Rebuild a node from its exchange record.  The node is not added to
   * the region.
   */
  public static Node fromRecord(Map<String, Object> record, Region region)
                                                    throws UserException {
    return lookup((String)record.get("type")).create(record, region);
  }

  private static MapScope mapScope(Map<String, Object> attrs) {
    MapScope map = new MapScope(getString(attrs, "label"),
        NodeTypeRegistry.<String>getList(attrs, "params"),
        NodeTypeRegistry.<RangeDim>getList(attrs, "range"),
        ScheduleType.valueOf(getString(attrs, "schedule")),
        getBool(attrs, "unroll", false), getInt(attrs, "collapse", 1));
    map.setCollapsed(getBool(attrs, "is_collapsed", false));
    return map;
  }

  private static MapScope placeholderMap() {
    return new MapScope("_", Collections.<String>emptyList(),
                        Collections.<RangeDim>emptyList());
  }

  private static void attachExit(Map<String, Object> record, Region region,
                                 MapScope map) {
    Node exit = pairedNode(record, "scope_exit", region);
    if (exit instanceof MapExit) {
      ((MapExit)exit).setMap(map);
    }
  }

  /**
   * @return node with id under key if already rebuilt, otherwise null
   */
  private static Node pairedNode(Map<String, Object> record, String key,
                                 Region region) {
    Object id = record.get(key);
    if (id == null) {
      return null;
    }
    int nodeId = Integer.parseInt(id.toString());
    if (!region.hasNodeId(nodeId)) {
      return null;
    }
    return region.node(nodeId);
  }

  private static void restoreConnectors(Node n, Map<String, Object> attrs) {
    for (String in: NodeTypeRegistry.<String>getList(attrs,
                                                     "in_connectors")) {
      n.addInConnector(in);
    }
    for (String out: NodeTypeRegistry.<String>getList(attrs,
                                                      "out_connectors")) {
      n.addOutConnector(out);
    }
  }

  private static void restoreLocation(CodeNode n, Map<String, Object> attrs) {
    Map<String, SymExpr> location = getMap(attrs, "location");
    for (Map.Entry<String, SymExpr> e: location.entrySet()) {
      n.setLocation(e.getKey(), e.getValue());
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> attributes(Map<String, Object> record) {
    Object attrs = record.get("attributes");
    if (attrs == null) {
      return Collections.emptyMap();
    }
    return (Map<String, Object>)attrs;
  }

  private static String getString(Map<String, Object> attrs, String key) {
    Object v = attrs.get(key);
    return v == null ? null : v.toString();
  }

  private static boolean getBool(Map<String, Object> attrs, String key,
                                 boolean dflt) {
    Object v = attrs.get(key);
    return v == null ? dflt : Boolean.parseBoolean(v.toString());
  }

  private static int getInt(Map<String, Object> attrs, String key,
                            int dflt) {
    Object v = attrs.get(key);
    return v == null ? dflt : Integer.parseInt(v.toString());
  }

  @SuppressWarnings("unchecked")
  private static <T> List<T> getList(Map<String, Object> attrs, String key) {
    Object v = attrs.get(key);
    return v == null ? Collections.<T>emptyList() : (List<T>)v;
  }

  @SuppressWarnings("unchecked")
  private static <T> Map<String, T> getMap(Map<String, Object> attrs,
                                           String key) {
    Object v = attrs.get(key);
    return v == null ? Collections.<String, T>emptyMap() : (Map<String, T>)v;
  }
}
