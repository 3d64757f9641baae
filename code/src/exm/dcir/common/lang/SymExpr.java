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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import exm.dcir.common.exceptions.DCIRRuntimeError;

/**
 * Minimal immutable symbolic expression used for scope ranges, sizes,
 * conditions and symbol mappings.  Literal operands of arithmetic are
 * folded when the expression is built.
 */
public class SymExpr {

  public static enum ExprKind {
    INTLIT,
    FLOATLIT,
    SYMBOL,
    BINOP;
  }

  public static enum Op {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    FLOORDIV("//"),
    MOD("%"),
    MIN("min"),
    MAX("max"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    EQ("=="),
    NE("!="),
    AND("and"),
    OR("or");

    private final String symbol;

    private Op(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    public boolean isBoolean() {
      return ordinal() >= LT.ordinal();
    }
  }

  public static final SymExpr ZERO = intLit(0);
  public static final SymExpr ONE = intLit(1);

  private final ExprKind kind;
  private final long intlit;
  private final double floatlit;
  private final String name;
  private final Op op;
  private final SymExpr left;
  private final SymExpr right;

  private SymExpr(ExprKind kind, long intlit, double floatlit, String name,
                  Op op, SymExpr left, SymExpr right) {
    this.kind = kind;
    this.intlit = intlit;
    this.floatlit = floatlit;
    this.name = name;
    this.op = op;
    this.left = left;
    this.right = right;
  }

  public static SymExpr intLit(long v) {
    return new SymExpr(ExprKind.INTLIT, v, 0.0, null, null, null, null);
  }

  public static SymExpr floatLit(double v) {
    return new SymExpr(ExprKind.FLOATLIT, 0, v, null, null, null, null);
  }

  public static SymExpr symbol(String name) {
    if (!Identifiers.isValid(name)) {
      throw new DCIRRuntimeError("Invalid symbol name: " + name);
    }
    return new SymExpr(ExprKind.SYMBOL, 0, 0.0, name, null, null, null);
  }

  public static SymExpr binop(Op op, SymExpr left, SymExpr right) {
    if (left.kind == ExprKind.INTLIT && right.kind == ExprKind.INTLIT) {
      Long folded = fold(op, left.intlit, right.intlit);
      if (folded != null) {
        return intLit(folded);
      }
    }
    // Identities that keep sizes readable
    if (op == Op.MUL && (left.isIntLit(1) || right.isIntLit(1))) {
      return left.isIntLit(1) ? right : left;
    } else if ((op == Op.ADD || op == Op.SUB) && right.isIntLit(0)) {
      return left;
    } else if (op == Op.ADD && left.isIntLit(0)) {
      return right;
    } else if (op == Op.FLOORDIV && right.isIntLit(1)) {
      return left;
    }
    return new SymExpr(ExprKind.BINOP, 0, 0.0, null, op, left, right);
  }

  public static SymExpr add(SymExpr a, SymExpr b) {
    return binop(Op.ADD, a, b);
  }

  public static SymExpr sub(SymExpr a, SymExpr b) {
    return binop(Op.SUB, a, b);
  }

  public static SymExpr mul(SymExpr a, SymExpr b) {
    return binop(Op.MUL, a, b);
  }

  public static SymExpr floorDiv(SymExpr a, SymExpr b) {
    return binop(Op.FLOORDIV, a, b);
  }

  public static SymExpr sum(Collection<SymExpr> terms) {
    SymExpr result = ZERO;
    for (SymExpr t: terms) {
      result = add(result, t);
    }
    return result;
  }

  public static SymExpr product(Collection<SymExpr> factors) {
    SymExpr result = ONE;
    for (SymExpr f: factors) {
      result = mul(result, f);
    }
    return result;
  }

  private static Long fold(Op op, long l, long r) {
    switch (op) {
      case ADD:
        return l + r;
      case SUB:
        return l - r;
      case MUL:
        return l * r;
      case FLOORDIV:
        return r == 0 ? null : Math.floorDiv(l, r);
      case MOD:
        return r == 0 ? null : Math.floorMod(l, r);
      case MIN:
        return Math.min(l, r);
      case MAX:
        return Math.max(l, r);
      default:
        // Don't fold comparisons: result isn't an integer
        return null;
    }
  }

  public ExprKind getKind() {
    return kind;
  }

  public boolean isConstant() {
    return kind == ExprKind.INTLIT || kind == ExprKind.FLOATLIT;
  }

  private boolean isIntLit(long v) {
    return kind == ExprKind.INTLIT && intlit == v;
  }

  public long getIntLit() {
    if (kind == ExprKind.INTLIT) {
      return intlit;
    } else {
      throw new DCIRRuntimeError("getIntLit for non-int expression " + this);
    }
  }

  public String getName() {
    if (kind == ExprKind.SYMBOL) {
      return name;
    } else {
      throw new DCIRRuntimeError("getName for non-symbol expression " + this);
    }
  }

  public Set<String> freeSymbols() {
    switch (kind) {
      case SYMBOL:
        return Collections.singleton(name);
      case BINOP:
        Set<String> result = new HashSet<String>(left.freeSymbols());
        result.addAll(right.freeSymbols());
        return result;
      default:
        return Collections.emptySet();
    }
  }

  public static Set<String> freeSymbols(Collection<SymExpr> exprs) {
    Set<String> result = new TreeSet<String>();
    for (SymExpr e: exprs) {
      result.addAll(e.freeSymbols());
    }
    return result;
  }

  /**
   * Infer the type of this expression.
   * @param symbols known symbol types.  Unknown symbols are assumed INT32
   */
  public ScalarType inferType(Map<String, ScalarType> symbols) {
    switch (kind) {
      case INTLIT:
        if (intlit >= Integer.MIN_VALUE && intlit <= Integer.MAX_VALUE) {
          return ScalarType.INT32;
        }
        return ScalarType.INT64;
      case FLOATLIT:
        return ScalarType.FLOAT64;
      case SYMBOL:
        ScalarType t = symbols.get(name);
        return t != null ? t : ScalarType.INT32;
      case BINOP:
        if (op.isBoolean()) {
          return ScalarType.BOOL;
        }
        return ScalarType.widen(left.inferType(symbols),
                                right.inferType(symbols));
      default:
        throw new DCIRRuntimeError("Unknown kind " + kind);
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case INTLIT:
        return Long.toString(intlit);
      case FLOATLIT:
        return Double.toString(floatlit);
      case SYMBOL:
        return name;
      case BINOP:
        if (op == Op.MIN || op == Op.MAX) {
          return op.symbol() + "(" + left + ", " + right + ")";
        }
        return wrap(left) + " " + op.symbol() + " " + wrap(right);
      default:
        throw new DCIRRuntimeError("Unknown kind " + kind);
    }
  }

  private static String wrap(SymExpr e) {
    if (e.kind == ExprKind.BINOP && e.op != Op.MIN && e.op != Op.MAX) {
      return "(" + e + ")";
    }
    return e.toString();
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = kind.hashCode();
    result = prime * result + (int) (intlit ^ (intlit >>> 32));
    long f = Double.doubleToLongBits(floatlit);
    result = prime * result + (int) (f ^ (f >>> 32));
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    result = prime * result + ((op == null) ? 0 : op.hashCode());
    result = prime * result + ((left == null) ? 0 : left.hashCode());
    result = prime * result + ((right == null) ? 0 : right.hashCode());
    return result;
  }

  /**
   * Structural equality
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SymExpr))
      return false;
    SymExpr other = (SymExpr) obj;
    if (kind != other.kind)
      return false;
    switch (kind) {
      case INTLIT:
        return intlit == other.intlit;
      case FLOATLIT:
        return Double.compare(floatlit, other.floatlit) == 0;
      case SYMBOL:
        return name.equals(other.name);
      default:
        return op == other.op && left.equals(other.left) &&
               right.equals(other.right);
    }
  }
}
