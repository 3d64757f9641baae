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
import java.util.Map;
import java.util.Set;

import exm.dcir.common.exceptions.UserException;
import exm.dcir.common.lang.SymExpr;

/**
 * Functional computation that only accesses external data through its
 * connectors.
 */
public class Tasklet extends CodeNode {
  private String code;

  public Tasklet(String label, Set<String> inputs, Set<String> outputs,
                 String code) {
    this(label, inputs, outputs, code, null);
  }

  public Tasklet(String label, Set<String> inputs, Set<String> outputs,
                 String code, Map<String, SymExpr> location) {
    super(label, location, inputs, outputs);
    this.code = code;
  }

  public Tasklet(String label) {
    this(label, Collections.<String>emptySet(),
         Collections.<String>emptySet(), "");
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  @Override
  public void validate(GraphContext context) throws UserException {
    validateNames("tasklet");
  }

  @Override
  public Map<String, Object> properties() {
    Map<String, Object> props = super.properties();
    props.put("code", code);
    return props;
  }

  @Override
  public String toString() {
    if (label == null || label.isEmpty()) {
      return "--Empty--";
    }
    return label;
  }
}
