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

/**
 * Data movement carried by an edge: which buffer, which part of it, and
 * how concurrent writes are resolved.
 */
public class Memlet {
  /** Buffer name, null for an empty (dependency only) memlet */
  private String data;
  private String subset;
  /** Write-conflict resolution, e.g. "a + b".  Null if writes overwrite */
  private String wcr;

  public Memlet(String data, String subset, String wcr) {
    this.data = data;
    this.subset = subset;
    this.wcr = wcr;
  }

  public Memlet(String data, String subset) {
    this(data, subset, null);
  }

  public static Memlet empty() {
    return new Memlet(null, null, null);
  }

  public String getData() {
    return data;
  }

  public void setData(String data) {
    this.data = data;
  }

  public String getSubset() {
    return subset;
  }

  public void setSubset(String subset) {
    this.subset = subset;
  }

  public String getWcr() {
    return wcr;
  }

  public void setWcr(String wcr) {
    this.wcr = wcr;
  }

  public boolean isEmpty() {
    return data == null;
  }

  public boolean hasWcr() {
    return wcr != null;
  }

  public Memlet copy() {
    return new Memlet(data, subset, wcr);
  }

  @Override
  public String toString() {
    if (data == null) {
      return "{}";
    }
    String s = data;
    if (subset != null) {
      s += "[" + subset + "]";
    }
    if (wcr != null) {
      s += " (CR: " + wcr + ")";
    }
    return s;
  }
}
