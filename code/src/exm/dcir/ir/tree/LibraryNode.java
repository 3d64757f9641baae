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

import java.util.Map;
import java.util.Set;

import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.ScheduleType;
import exm.dcir.ir.lib.LibraryNodeType;

/**
 * A library-defined operation, expanded into a concrete implementation
 * by {@link exm.dcir.ir.lib.LibraryExpander}.
 *
 * All library node kinds share the exchange type tag "LibraryNode";
 * the concrete kind is identified by its classpath.
 */
public abstract class LibraryNode extends CodeNode {
  public static final String TYPE_TAG = "LibraryNode";

  private String name;

  /** Explicitly chosen implementation, null if not chosen */
  private String implementation = null;

  /** Default device mapping when expanded to a nested graph */
  private ScheduleType schedule = ScheduleType.DEFAULT;

  protected LibraryNode(String name, Set<String> inputs,
                        Set<String> outputs) {
    super(name, null, inputs, outputs);
    this.name = name;
  }

  /**
   * @return descriptor of this node's kind, shared by all instances
   */
  public abstract LibraryNodeType type();

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getImplementation() {
    return implementation;
  }

  public void setImplementation(String implementation) {
    this.implementation = implementation;
  }

  public ScheduleType getSchedule() {
    return schedule;
  }

  public void setSchedule(ScheduleType schedule) {
    this.schedule = schedule;
  }

  public String classpath() {
    return type().getClasspath();
  }

  @Override
  public String typeTag() {
    return TYPE_TAG;
  }

  @Override
  public void validate(GraphContext context) throws UserException {
    validateNames("library node");
  }

  @Override
  public Map<String, Object> properties() {
    Map<String, Object> props = super.properties();
    props.put("name", name);
    props.put("implementation", implementation);
    props.put("schedule", schedule.name());
    return props;
  }

  @Override
  public Map<String, Object> toRecord(Region parent) {
    Map<String, Object> record = super.toRecord(parent);
    record.put("classpath", classpath());
    return record;
  }
}
