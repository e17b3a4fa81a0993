/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.bounds.ir;

import static net.hydromatic.bounds.ir.IrBuilder.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifier of expressions.
 *
 * <p>Sums, differences and products by constants are converted to a linear
 * form, a sum of terms with integer coefficients plus a constant, and
 * rebuilt with the terms in a canonical order. Other operators fold constants
 * and use the linear form to decide comparisons. For example:
 *
 * <ul>
 *   <li>{@code (x + 10) - 1 - (x + 1)} &rarr; {@code 8}
 *   <li>{@code min(x - 1, x + 1)} &rarr; {@code x - 1}
 *   <li>{@code (x * 4 + 3) / 4} &rarr; {@code x}
 *   <li>{@code min(x, y) + 1 <= x + 1} &rarr; {@code 1}
 * </ul>
 *
 * <p>The result depends only on the structure of the input, so equal inputs
 * always produce equal outputs.
 */
public class Simplifier {
  /** Maximum depth of case analysis on {@code min} and {@code max} terms. */
  private static final int MAX_DEPTH = 8;

  private Simplifier() {}

  /** Simplifies an expression. */
  public static Ir.Expr simplify(Ir.Expr expr) {
    switch (expr.op) {
      case INT_LITERAL:
      case VAR:
        return expr;
      case ADD:
      case SUB:
      case MUL:
        return linear(expr).toExpr();
      default:
        return simplifyNonLinear(expr);
    }
  }

  /**
   * Returns whether a condition is provably true; that is, whether it
   * simplifies to a non-zero literal.
   */
  public static boolean canProve(Ir.Expr condition) {
    final Ir.Expr e = simplify(condition);
    return e.isConstant() && e.constantValue() != 0;
  }

  /**
   * Compares two expressions. Returns true if {@code a <= b} for all values of
   * their variables, false if {@code a > b} for all values of their variables,
   * and null if neither can be proven.
   */
  public static @Nullable Boolean compareLe(Ir.Expr a, Ir.Expr b) {
    final Linear diff = linear(a);
    diff.add(linear(b), -1);
    return nonPositive(diff, 0);
  }

  /** Decides whether {@code diff <= 0}. */
  private static @Nullable Boolean nonPositive(Linear diff, int depth) {
    if (diff.isConstant()) {
      return diff.constant <= 0;
    }
    if (depth >= MAX_DEPTH) {
      return null;
    }
    // Find a min, max or select term with coefficient 1 or -1, and
    // distribute the rest of the sum over its arguments:
    //   min(p, q) + r <= 0  iff  p + r <= 0 || q + r <= 0
    //   max(p, q) + r <= 0  iff  p + r <= 0 && q + r <= 0
    // and -min(p, q) = max(-p, -q). The condition of a select is unknown, so
    // both arms must agree.
    for (Map.Entry<String, Ir.Expr> entry : diff.terms.entrySet()) {
      final Ir.Expr term = entry.getValue();
      final long c = diff.coefficients.get(entry.getKey());
      if (c != 1 && c != -1) {
        continue;
      }
      final Ir.Expr a;
      final Ir.Expr b;
      switch (term.op) {
        case MIN:
        case MAX:
          a = ((Ir.Binary) term).a;
          b = ((Ir.Binary) term).b;
          break;
        case SELECT:
          a = ((Ir.Select) term).trueValue;
          b = ((Ir.Select) term).falseValue;
          break;
        default:
          continue;
      }
      final Linear p = diff.copy();
      p.addTerm(term, -c);
      final Linear q = p.copy();
      p.add(linear(a), c);
      q.add(linear(b), c);
      final Boolean pLe = nonPositive(p, depth + 1);
      final Boolean qLe = nonPositive(q, depth + 1);
      if (term.op == Op.SELECT) {
        if (pLe == null || !pLe.equals(qLe)) {
          return null;
        }
        return pLe;
      }
      final boolean isMin = (term.op == Op.MIN) == (c == 1);
      if (isMin) {
        if (Boolean.TRUE.equals(pLe) || Boolean.TRUE.equals(qLe)) {
          return true;
        }
        if (Boolean.FALSE.equals(pLe) && Boolean.FALSE.equals(qLe)) {
          return false;
        }
      } else {
        if (Boolean.TRUE.equals(pLe) && Boolean.TRUE.equals(qLe)) {
          return true;
        }
        if (Boolean.FALSE.equals(pLe) || Boolean.FALSE.equals(qLe)) {
          return false;
        }
      }
      return null;
    }
    return null;
  }

  private static Ir.Expr simplifyNonLinear(Ir.Expr expr) {
    switch (expr.op) {
      case DIV:
        return simplifyDiv((Ir.Binary) expr);
      case MOD:
        return simplifyMod((Ir.Binary) expr);
      case MIN:
      case MAX:
        return simplifyMinMax((Ir.Binary) expr);
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return simplifyComparison((Ir.Binary) expr);
      case AND:
      case OR:
        return simplifyLogical((Ir.Binary) expr);
      case NOT:
        final Ir.Not not = (Ir.Not) expr;
        final Ir.Expr a = simplify(not.a);
        if (a.isConstant()) {
          return ir.intLiteral(a.constantValue() == 0 ? 1 : 0);
        }
        if (a.op == Op.NOT) {
          return ((Ir.Not) a).a;
        }
        return not.copy(a);
      case SELECT:
        final Ir.Select select = (Ir.Select) expr;
        final Ir.Expr condition = simplify(select.condition);
        if (condition.isConstant()) {
          return simplify(
              condition.constantValue() != 0
                  ? select.trueValue
                  : select.falseValue);
        }
        final Ir.Expr trueValue = simplify(select.trueValue);
        final Ir.Expr falseValue = simplify(select.falseValue);
        if (trueValue.equals(falseValue)) {
          return trueValue;
        }
        return select.copy(condition, trueValue, falseValue);
      case CALL:
        final Ir.Call call = (Ir.Call) expr;
        final List<Ir.Expr> args = new ArrayList<>();
        call.args.forEach(arg -> args.add(simplify(arg)));
        return call.copy(args);
      case LET:
        final Ir.Let let = (Ir.Let) expr;
        final Ir.Expr value = simplify(let.value);
        if (value.isConstant() || value.op == Op.VAR) {
          return simplify(Replacer.substitute(let.name, value, let.body));
        }
        final Ir.Expr body = simplify(let.body);
        if (!FreeFinder.freeVars(body).contains(let.name)) {
          return body;
        }
        return let.copy(value, body);
      default:
        return simplify(expr);
    }
  }

  private static Ir.Expr simplifyDiv(Ir.Binary div) {
    final Ir.Expr a = simplify(div.a);
    final Ir.Expr b = simplify(div.b);
    if (a.isConstant() && a.constantValue() == 0) {
      // 0 / d is zero for every d, including zero
      return a;
    }
    if (!b.isConstant()) {
      return div.copy(a, b);
    }
    final long d = b.constantValue();
    if (d == 0) {
      // Division by zero is defined to be zero
      return ir.intLiteral(0);
    }
    if (d == 1) {
      return a;
    }
    if (a.isConstant()) {
      return ir.intLiteral(Math.floorDiv(a.constantValue(), d));
    }
    if (a.op == Op.DIV
        && ((Ir.Binary) a).b.isConstant()
        && ((Ir.Binary) a).b.constantValue() > 0
        && d > 0) {
      // (x / c1) / c2 => x / (c1 * c2)
      final Ir.Binary inner = (Ir.Binary) a;
      return ir.div(inner.a, inner.b.constantValue() * d);
    }
    // (d * k + rest) / d => k + rest / d, because k is an integer
    final Linear linear = linear(a);
    final Linear whole = new Linear();
    final Linear rest = new Linear();
    linear.forEachTerm(
        (term, c) -> {
          if (c % d == 0) {
            whole.addTerm(term, c / d);
          } else {
            rest.addTerm(term, c);
          }
        });
    whole.constant = Math.floorDiv(linear.constant, d);
    rest.constant = Math.floorMod(linear.constant, d);
    if (rest.isConstant()) {
      // 0 <= rest.constant < |d|, so rest / d contributes nothing when d > 0
      if (d > 0 || rest.constant == 0) {
        return whole.toExpr();
      }
    }
    if (whole.isConstant() && whole.constant == 0) {
      return div.copy(a, b);
    }
    return simplify(ir.add(whole.toExpr(), ir.div(rest.toExpr(), d)));
  }

  private static Ir.Expr simplifyMod(Ir.Binary mod) {
    final Ir.Expr a = simplify(mod.a);
    final Ir.Expr b = simplify(mod.b);
    if (!b.isConstant()) {
      return mod.copy(a, b);
    }
    final long d = b.constantValue();
    if (d == 0 || d == 1 || d == -1) {
      return ir.intLiteral(0);
    }
    if (a.isConstant()) {
      return ir.intLiteral(Math.floorMod(a.constantValue(), d));
    }
    // (d * k + rest) % d => rest % d
    final Linear linear = linear(a);
    final Linear rest = new Linear();
    linear.forEachTerm(
        (term, c) -> {
          if (c % d != 0) {
            rest.addTerm(term, c);
          }
        });
    rest.constant = Math.floorMod(linear.constant, d);
    if (rest.isConstant()) {
      return ir.intLiteral(rest.constant);
    }
    final Ir.Expr restExpr = rest.toExpr();
    return restExpr.equals(a) ? mod.copy(a, b) : ir.mod(restExpr, b);
  }

  private static Ir.Expr simplifyMinMax(Ir.Binary binary) {
    final boolean isMin = binary.op == Op.MIN;
    Ir.Expr a = simplify(binary.a);
    Ir.Expr b = simplify(binary.b);
    if (a.isConstant() && b.isConstant()) {
      final long x = a.constantValue();
      final long y = b.constantValue();
      return ir.intLiteral(isMin ? Math.min(x, y) : Math.max(x, y));
    }
    if (a.equals(b)) {
      return a;
    }
    final Boolean le = compareLe(a, b);
    if (le != null) {
      return le == isMin ? a : b;
    }
    // Canonical order: constant last, otherwise sorted by rendering
    if (a.isConstant()
        || !b.isConstant() && a.toString().compareTo(b.toString()) > 0) {
      final Ir.Expr t = a;
      a = b;
      b = t;
    }
    if (b.isConstant()
        && a.op == binary.op
        && ((Ir.Binary) a).b.isConstant()) {
      // min(min(x, c1), c2) => min(x, min(c1, c2))
      final Ir.Binary inner = (Ir.Binary) a;
      final long x = inner.b.constantValue();
      final long y = b.constantValue();
      return ir.binary(
          binary.op,
          inner.a,
          ir.intLiteral(isMin ? Math.min(x, y) : Math.max(x, y)));
    }
    return a == binary.a && b == binary.b ? binary : ir.binary(binary.op, a, b);
  }

  private static Ir.Expr simplifyComparison(Ir.Binary binary) {
    final Ir.Expr a = simplify(binary.a);
    final Ir.Expr b = simplify(binary.b);
    final @Nullable Boolean result;
    switch (binary.op) {
      case LE:
        result = compareLe(a, b);
        break;
      case LT:
        result = compareLe(ir.add(a, 1), b);
        break;
      case GE:
        result = compareLe(b, a);
        break;
      case GT:
        result = compareLe(ir.add(b, 1), a);
        break;
      case EQ:
      case NE:
        final Boolean le = compareLe(a, b);
        final Boolean ge = compareLe(b, a);
        final Boolean eq;
        if (Boolean.TRUE.equals(le) && Boolean.TRUE.equals(ge)) {
          eq = true;
        } else if (Boolean.FALSE.equals(le) || Boolean.FALSE.equals(ge)) {
          eq = false;
        } else {
          eq = null;
        }
        result = eq == null ? null : eq == (binary.op == Op.EQ);
        break;
      default:
        throw new AssertionError(binary.op);
    }
    if (result == null) {
      return binary.copy(a, b);
    }
    return ir.intLiteral(result ? 1 : 0);
  }

  private static Ir.Expr simplifyLogical(Ir.Binary binary) {
    final Ir.Expr a = simplify(binary.a);
    final Ir.Expr b = simplify(binary.b);
    final boolean isAnd = binary.op == Op.AND;
    if (a.isConstant()) {
      final boolean value = a.constantValue() != 0;
      return value == isAnd ? b : ir.intLiteral(value ? 1 : 0);
    }
    if (b.isConstant()) {
      final boolean value = b.constantValue() != 0;
      return value == isAnd ? a : ir.intLiteral(value ? 1 : 0);
    }
    if (a.equals(b)) {
      return a;
    }
    return binary.copy(a, b);
  }

  /** Converts an expression to linear form. */
  private static Linear linear(Ir.Expr expr) {
    final Linear linear = new Linear();
    addLinear(linear, expr, 1);
    return linear;
  }

  private static void addLinear(Linear linear, Ir.Expr expr, long factor) {
    switch (expr.op) {
      case INT_LITERAL:
        linear.constant += expr.constantValue() * factor;
        return;
      case ADD:
        addLinear(linear, ((Ir.Binary) expr).a, factor);
        addLinear(linear, ((Ir.Binary) expr).b, factor);
        return;
      case SUB:
        addLinear(linear, ((Ir.Binary) expr).a, factor);
        addLinear(linear, ((Ir.Binary) expr).b, -factor);
        return;
      case MUL:
        final Linear a = linear(((Ir.Binary) expr).a);
        final Linear b = linear(((Ir.Binary) expr).b);
        if (b.isConstant()) {
          linear.add(a, factor * b.constant);
        } else if (a.isConstant()) {
          linear.add(b, factor * a.constant);
        } else {
          linear.addTerm(ir.mul(a.toExpr(), b.toExpr()), factor);
        }
        return;
      default:
        final Ir.Expr e = simplifyNonLinear(expr);
        switch (e.op) {
          case INT_LITERAL:
          case ADD:
          case SUB:
          case MUL:
            addLinear(linear, e, factor);
            return;
          default:
            linear.addTerm(e, factor);
        }
    }
  }

  /** Callback for a term and its coefficient. */
  private interface TermConsumer {
    void accept(Ir.Expr term, long coefficient);
  }

  /**
   * Sum of terms, each multiplied by a non-zero coefficient, plus a constant.
   * Terms are keyed by their rendering, which gives a deterministic order.
   */
  private static class Linear {
    final SortedMap<String, Ir.Expr> terms = new TreeMap<>();
    final Map<String, Long> coefficients = new HashMap<>();
    long constant;

    Linear copy() {
      final Linear linear = new Linear();
      linear.add(this, 1);
      return linear;
    }

    boolean isConstant() {
      return terms.isEmpty();
    }

    void addTerm(Ir.Expr term, long c) {
      if (c == 0) {
        return;
      }
      final String key = term.toString();
      final long c2 = coefficients.getOrDefault(key, 0L) + c;
      if (c2 == 0) {
        coefficients.remove(key);
        terms.remove(key);
      } else {
        coefficients.put(key, c2);
        terms.put(key, term);
      }
    }

    void add(Linear linear, long factor) {
      linear.forEachTerm((term, c) -> addTerm(term, c * factor));
      constant += linear.constant * factor;
    }

    void forEachTerm(TermConsumer consumer) {
      terms.forEach(
          (key, term) -> consumer.accept(term, coefficients.get(key)));
    }

    Ir.Expr toExpr() {
      Ir.Expr result = null;
      for (Map.Entry<String, Ir.Expr> entry : terms.entrySet()) {
        final long c = coefficients.get(entry.getKey());
        if (c > 0) {
          final Ir.Expr e = times(entry.getValue(), c);
          result = result == null ? e : ir.add(result, e);
        }
      }
      for (Map.Entry<String, Ir.Expr> entry : terms.entrySet()) {
        final long c = coefficients.get(entry.getKey());
        if (c < 0) {
          result =
              result == null
                  ? times(entry.getValue(), c)
                  : ir.sub(result, times(entry.getValue(), -c));
        }
      }
      if (result == null) {
        return ir.intLiteral(constant);
      }
      if (constant > 0) {
        return ir.add(result, constant);
      }
      if (constant < 0) {
        return ir.sub(result, -constant);
      }
      return result;
    }

    private static Ir.Expr times(Ir.Expr term, long c) {
      return c == 1 ? term : ir.mul(term, c);
    }
  }
}

// End Simplifier.java
