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

/**
 * Element types of buffers and symbols
 */
public enum ScalarType {
  BOOL(1, false, false, "bool"),
  INT8(1, true, false, "char"),
  INT16(2, true, false, "short"),
  INT32(4, true, false, "int"),
  INT64(8, true, false, "long long"),
  UINT8(1, false, false, "unsigned char"),
  UINT16(2, false, false, "unsigned short"),
  UINT32(4, false, false, "unsigned int"),
  UINT64(8, false, false, "unsigned long long"),
  FLOAT32(4, true, true, "float"),
  FLOAT64(8, true, true, "double");

  private final int bytes;
  private final boolean signed;
  private final boolean floating;
  private final String ctype;

  private ScalarType(int bytes, boolean signed, boolean floating,
                     String ctype) {
    this.bytes = bytes;
    this.signed = signed;
    this.floating = floating;
    this.ctype = ctype;
  }

  public int bytes() {
    return bytes;
  }

  public boolean isSigned() {
    return signed;
  }

  public boolean isFloat() {
    return floating;
  }

  public boolean isInteger() {
    return this != BOOL && !floating;
  }

  public String ctype() {
    return ctype;
  }

  /**
   * Common type that both operand types can be widened to
   * without loss, following the usual numeric promotion rules:
   * bool is absorbed by anything, floats absorb integers, and
   * mixing signed with unsigned picks a wider signed type.
   */
  public static ScalarType widen(ScalarType a, ScalarType b) {
    if (a == b) {
      return a;
    } else if (a == BOOL) {
      return b;
    } else if (b == BOOL) {
      return a;
    } else if (a.floating && b.floating) {
      return a.bytes >= b.bytes ? a : b;
    } else if (a.floating || b.floating) {
      ScalarType f = a.floating ? a : b;
      ScalarType i = a.floating ? b : a;
      // float32 can't represent all 32/64 bit integers
      if (f == FLOAT32 && i.bytes >= 4) {
        return FLOAT64;
      }
      return f;
    } else if (a.signed == b.signed) {
      return a.bytes >= b.bytes ? a : b;
    }

    ScalarType s = a.signed ? a : b;
    ScalarType u = a.signed ? b : a;
    if (s.bytes > u.bytes) {
      return s;
    }
    switch (u.bytes) {
      case 1:
        return INT16;
      case 2:
        return INT32;
      case 4:
        return INT64;
      default:
        // No integer type holds both
        return FLOAT64;
    }
  }
}
