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
package net.hydromatic.bounds.interval;

import static net.hydromatic.bounds.ir.IrBuilder.ir;

import java.util.function.BinaryOperator;
import net.hydromatic.bounds.ir.FreeFinder;
import net.hydromatic.bounds.ir.Ir;
import net.hydromatic.bounds.ir.Op;
import net.hydromatic.bounds.ir.Simplifier;
import net.hydromatic.bounds.ir.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes the interval of values that an expression can take.
 *
 * <p>Variables bound in the scope range over their interval; other variables
 * are treated as fixed but unknown, so that the result may refer to them
 * symbolically. Reads of stages, images and external functions may return
 * any value.
 */
public class Bounds {
  private Bounds() {}

  /** Returns the interval of values of an expression. */
  public static Interval of(Ir.Expr expr, Scope scope) {
    if (isFixed(expr, scope)) {
      return Interval.point(expr);
    }
    switch (expr.op) {
      case INT_LITERAL:
        return Interval.point(expr);

      case VAR:
        final Interval interval = scope.getOpt(((Ir.Var) expr).name);
        return interval != null ? interval : Interval.point(expr);

      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case MOD:
      case MIN:
      case MAX:
        final Ir.Binary binary = (Ir.Binary) expr;
        final Interval a = of(binary.a, scope);
        final Interval b = of(binary.b, scope);
        if (a.isEmpty() || b.isEmpty()) {
          return Interval.EMPTY;
        }
        return arithmetic(binary.op, a, b);

      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case AND:
      case OR:
      case NOT:
        return Interval.of(0, 1);

      case SELECT:
        final Ir.Select select = (Ir.Select) expr;
        return of(select.trueValue, scope).union(of(select.falseValue, scope));

      case LET:
        final Ir.Let let = (Ir.Let) expr;
        return of(let.body, scope.bind(let.name, of(let.value, scope)));

      case CALL:
        return Interval.everything();

      default:
        throw new AssertionError("unexpected " + expr.op);
    }
  }

  /**
   * Returns whether an expression has a single value in a scope: it reads no
   * stage, image or function, and uses no variable that the scope binds.
   */
  private static boolean isFixed(Ir.Expr expr, Scope scope) {
    if (expr.op == Op.INT_LITERAL) {
      return true;
    }
    final boolean[] fixed = {true};
    expr.accept(
        new Visitor() {
          @Override
          protected void visit(Ir.Call call) {
            fixed[0] = false;
          }
        });
    if (fixed[0]) {
      for (String name : FreeFinder.freeVars(expr)) {
        if (scope.getOpt(name) != null) {
          return false;
        }
      }
    }
    return fixed[0];
  }

  private static Interval arithmetic(Op op, Interval a, Interval b) {
    switch (op) {
      case ADD:
        return Interval.of(
            both(a.min, b.min, ir::add), both(a.max, b.max, ir::add));

      case SUB:
        return Interval.of(
            both(a.min, b.max, ir::sub), both(a.max, b.min, ir::sub));

      case MUL:
        if (isConstant(b)) {
          return Interval.imageUnderAffine(
              a, constant(b), ir.intLiteral(0));
        }
        if (isConstant(a)) {
          return Interval.imageUnderAffine(
              b, constant(a), ir.intLiteral(0));
        }
        if (a.isBounded() && b.isBounded()) {
          final Ir.Expr p0 = ir.mul(a.min, b.min);
          final Ir.Expr p1 = ir.mul(a.min, b.max);
          final Ir.Expr p2 = ir.mul(a.max, b.min);
          final Ir.Expr p3 = ir.mul(a.max, b.max);
          return Interval.of(
              ir.min(ir.min(p0, p1), ir.min(p2, p3)),
              ir.max(ir.max(p0, p1), ir.max(p2, p3)));
        }
        return Interval.everything();

      case DIV:
        if (isConstant(b)) {
          final long c = constant(b);
          if (c == 0) {
            return Interval.of(0, 0);
          }
          final Ir.Expr lo = a.min == null ? null : ir.div(a.min, c);
          final Ir.Expr hi = a.max == null ? null : ir.div(a.max, c);
          return c > 0 ? Interval.of(lo, hi) : Interval.of(hi, lo);
        }
        // For a fixed divisor, or divisors of one sign, the quotient is
        // monotonic in each argument, so its extremes are at the corners.
        if (a.isBounded()
            && b.isBounded()
            && (b.isPoint() || isPositive(b) || isNegative(b))) {
          final Ir.Expr q0 = ir.div(a.min, b.min);
          final Ir.Expr q1 = ir.div(a.min, b.max);
          final Ir.Expr q2 = ir.div(a.max, b.min);
          final Ir.Expr q3 = ir.div(a.max, b.max);
          return Interval.of(
              ir.min(ir.min(q0, q1), ir.min(q2, q3)),
              ir.max(ir.max(q0, q1), ir.max(q2, q3)));
        }
        return Interval.everything();

      case MOD:
        // The remainder has the sign of the divisor
        if (isConstant(b)) {
          final long c = constant(b);
          if (c == 0) {
            return Interval.of(0, 0);
          }
          return c > 0 ? Interval.of(0, c - 1) : Interval.of(c + 1, 0);
        }
        if (isPositive(b)) {
          return b.max == null
              ? Interval.atLeast(ir.intLiteral(0))
              : Interval.of(ir.intLiteral(0), ir.sub(b.max, 1));
        }
        if (isNegative(b)) {
          return b.min == null
              ? Interval.atMost(ir.intLiteral(0))
              : Interval.of(ir.add(b.min, 1), ir.intLiteral(0));
        }
        if (b.isBounded()) {
          final Ir.Expr m =
              ir.max(b.max, ir.sub(ir.intLiteral(0), b.min));
          return Interval.of(
              ir.sub(ir.intLiteral(1), m), ir.sub(m, 1));
        }
        return Interval.everything();

      case MIN:
        return Interval.of(
            both(a.min, b.min, ir::min), either(a.max, b.max, ir::min));

      case MAX:
        return Interval.of(
            either(a.min, b.min, ir::max), both(a.max, b.max, ir::max));

      default:
        throw new AssertionError("unexpected " + op);
    }
  }

  /** Combines two endpoints if both are present, otherwise returns null. */
  private static Ir.@Nullable Expr both(
      Ir.@Nullable Expr a,
      Ir.@Nullable Expr b,
      BinaryOperator<Ir.Expr> combiner) {
    return a == null || b == null ? null : combiner.apply(a, b);
  }

  /** Combines two endpoints if both are present, otherwise returns either. */
  private static Ir.@Nullable Expr either(
      Ir.@Nullable Expr a,
      Ir.@Nullable Expr b,
      BinaryOperator<Ir.Expr> combiner) {
    return a == null ? b : b == null ? a : combiner.apply(a, b);
  }

  /** Returns whether every value of an interval is provably at least 1. */
  private static boolean isPositive(Interval interval) {
    return interval.min != null
        && Boolean.TRUE.equals(
            Simplifier.compareLe(ir.intLiteral(1), interval.min));
  }

  /** Returns whether every value of an interval is provably at most -1. */
  private static boolean isNegative(Interval interval) {
    return interval.max != null
        && Boolean.TRUE.equals(
            Simplifier.compareLe(interval.max, ir.intLiteral(-1)));
  }

  private static boolean isConstant(Interval interval) {
    return interval.isPoint() && interval.min.isConstant();
  }

  private static long constant(Interval interval) {
    return interval.min.constantValue();
  }
}

// End Bounds.java
