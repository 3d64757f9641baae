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

package exm.dcir.common.exceptions;

/**
 * The connectors of a nested graph node don't agree with the buffers
 * declared inside the nested graph.
 */
public class ConnectorMismatchException extends UserException {

  private final String bufferName;

  private ConnectorMismatchException(String bufferName, String message) {
    super(message);
    this.bufferName = bufferName;
  }

  public static ConnectorMismatchException missingConnector(String node,
                                                            String buffer) {
    return new ConnectorMismatchException(buffer, "Missing connector: " +
        "buffer \"" + buffer + "\" not found in connectors of nested graph "
        + node);
  }

  public static ConnectorMismatchException transientConnector(String node,
                                                              String buffer) {
    return new ConnectorMismatchException(buffer, "Transient/connector " +
        "conflict: \"" + buffer + "\" is a connector of " + node +
        " but its corresponding buffer is transient");
  }

  public String getBufferName() {
    return bufferName;
  }

  private static final long serialVersionUID = 1L;
}
