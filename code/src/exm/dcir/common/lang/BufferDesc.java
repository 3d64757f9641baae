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
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * Descriptor of a buffer in a program's buffer table: scalar, array or
 * stream.
 */
public class BufferDesc {

  public static enum BufferKind {
    SCALAR,
    ARRAY,
    STREAM;
  }

  private final BufferKind kind;
  private final ScalarType dtype;
  private final List<SymExpr> shape;
  private StorageType storage;
  private boolean transientBuf;

  public BufferDesc(BufferKind kind, ScalarType dtype, List<SymExpr> shape,
                    StorageType storage, boolean transientBuf) {
    this.kind = kind;
    this.dtype = dtype;
    this.shape = Collections.unmodifiableList(new ArrayList<SymExpr>(shape));
    this.storage = storage;
    this.transientBuf = transientBuf;
  }

  public static BufferDesc scalar(ScalarType dtype, boolean transientBuf) {
    return new BufferDesc(BufferKind.SCALAR, dtype,
        Collections.<SymExpr>emptyList(), StorageType.DEFAULT, transientBuf);
  }

  public static BufferDesc array(ScalarType dtype, boolean transientBuf,
                                 SymExpr ...shape) {
    return new BufferDesc(BufferKind.ARRAY, dtype, Arrays.asList(shape),
                          StorageType.DEFAULT, transientBuf);
  }

  public static BufferDesc array(ScalarType dtype, boolean transientBuf,
                                 long ...shape) {
    List<SymExpr> dims = new ArrayList<SymExpr>();
    for (long d: shape) {
      dims.add(SymExpr.intLit(d));
    }
    return new BufferDesc(BufferKind.ARRAY, dtype, dims,
                          StorageType.DEFAULT, transientBuf);
  }

  /**
   * @param bufferSize number of elements the stream can hold
   */
  public static BufferDesc stream(ScalarType dtype, SymExpr bufferSize,
                                  boolean transientBuf) {
    return new BufferDesc(BufferKind.STREAM, dtype,
        Collections.singletonList(bufferSize), StorageType.DEFAULT,
        transientBuf);
  }

  public BufferKind getKind() {
    return kind;
  }

  public ScalarType getDtype() {
    return dtype;
  }

  public List<SymExpr> getShape() {
    return shape;
  }

  public StorageType getStorage() {
    return storage;
  }

  public void setStorage(StorageType storage) {
    this.storage = storage;
  }

  public boolean isTransient() {
    return transientBuf;
  }

  public void setTransient(boolean transientBuf) {
    this.transientBuf = transientBuf;
  }

  public boolean isScalar() {
    return kind == BufferKind.SCALAR;
  }

  /**
   * @return number of elements
   */
  public SymExpr totalSize() {
    return SymExpr.product(shape);
  }

  public SymExpr sizeInBytes() {
    return SymExpr.mul(totalSize(), SymExpr.intLit(dtype.bytes()));
  }

  public Set<String> freeSymbols() {
    return SymExpr.freeSymbols(shape);
  }

  /**
   * Check whether the other buffer could be used in place of this one:
   * same kind, element type, storage, and a dimension-wise identical
   * shape.  Transience isn't considered.
   */
  public boolean isEquivalent(BufferDesc other) {
    if (other == null) {
      return false;
    }
    return kind == other.kind && dtype == other.dtype &&
           storage == other.storage && shape.equals(other.shape);
  }

  public BufferDesc cloneDesc() {
    return new BufferDesc(kind, dtype, shape, storage, transientBuf);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (transientBuf) {
      sb.append("transient ");
    }
    sb.append(kind.toString().toLowerCase());
    sb.append(" ");
    sb.append(dtype.ctype());
    if (!shape.isEmpty()) {
      sb.append("[" + StringUtils.join(shape, ", ") + "]");
    }
    if (storage != StorageType.DEFAULT) {
      sb.append(" @" + storage);
    }
    return sb.toString();
  }
}
