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

import exm.dcir.common.exceptions.UndefinedBufferException;
import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.AccessType;
import exm.dcir.common.lang.BufferDesc;

/**
 * A node that accesses a buffer of the program
 */
public class AccessNode extends Node {
  private String data;
  private AccessType access;
  private boolean setZero = false;

  public AccessNode(String data) {
    this(data, AccessType.READ_WRITE);
  }

  public AccessNode(String data, AccessType access) {
    super();
    assert(data != null);
    this.data = data;
    this.access = access;
  }

  public String getData() {
    return data;
  }

  public void setData(String data) {
    this.data = data;
  }

  public AccessType getAccess() {
    return access;
  }

  public void setAccess(AccessType access) {
    this.access = access;
  }

  public boolean isSetZero() {
    return setZero;
  }

  public void setSetZero(boolean setZero) {
    this.setZero = setZero;
  }

  @Override
  public String getLabel() {
    return data;
  }

  public BufferDesc desc(Program program) {
    return program.lookupBuffer(data);
  }

  @Override
  public void validate(GraphContext context) throws UserException {
    Program program = context.getProgram();
    if (!program.hasBuffer(data)) {
      throw new UndefinedBufferException(data, program.getName());
    }
  }

  @Override
  public Map<String, Object> properties() {
    Map<String, Object> props = super.properties();
    props.put("data", data);
    props.put("access", access.name());
    props.put("setzero", setZero);
    return props;
  }
}
