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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.bounds.ir.IrBuilder.ir;

import java.util.Objects;
import net.hydromatic.bounds.ir.Ir;
import net.hydromatic.bounds.ir.Simplifier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Closed interval of integers whose endpoints are symbolic expressions.
 *
 * <p>A null endpoint means that the interval is unbounded on that side. The
 * interval {@link #EMPTY} contains no values; it is the identity of {@link
 * #union}.
 *
 * <p>Endpoints are simplified when an interval is created, so that, for
 * example, the union of {@code [x - 1, x - 1]} and {@code [x + 1, x + 1]} is
 * {@code [x - 1, x + 1]} rather than an expression involving {@code min} and
 * {@code max}.
 */
public class Interval {
  /** Interval that contains no values. */
  public static final Interval EMPTY = new Interval(null, null, true);

  private static final Interval EVERYTHING = new Interval(null, null, false);

  public final Ir.@Nullable Expr min;
  public final Ir.@Nullable Expr max;
  private final boolean empty;

  private Interval(
      Ir.@Nullable Expr min, Ir.@Nullable Expr max, boolean empty) {
    this.min = min;
    this.max = max;
    this.empty = empty;
  }

  /** Returns the interval that contains every integer. */
  public static Interval everything() {
    return EVERYTHING;
  }

  /** Creates an interval; a null endpoint means unbounded. */
  public static Interval of(Ir.@Nullable Expr min, Ir.@Nullable Expr max) {
    if (min == null && max == null) {
      return EVERYTHING;
    }
    return new Interval(
        min == null ? null : Simplifier.simplify(min),
        max == null ? null : Simplifier.simplify(max),
        false);
  }

  /** Creates an interval with integer endpoints. */
  public static Interval of(long min, long max) {
    return of(ir.intLiteral(min), ir.intLiteral(max));
  }

  /** Creates an interval that contains a single value. */
  public static Interval point(Ir.Expr e) {
    final Ir.Expr e2 = Simplifier.simplify(e);
    return new Interval(e2, e2, false);
  }

  /** Creates an interval that has a minimum but no maximum. */
  public static Interval atLeast(Ir.Expr min) {
    return of(requireNonNull(min), null);
  }

  /** Creates an interval that has a maximum but no minimum. */
  public static Interval atMost(Ir.Expr max) {
    return of(null, requireNonNull(max));
  }

  /** Returns whether this is the empty interval. */
  public boolean isEmpty() {
    return empty;
  }

  /** Returns whether both endpoints are present. */
  public boolean isBounded() {
    return !empty && min != null && max != null;
  }

  /** Returns whether this interval is a single point. */
  public boolean isPoint() {
    return isBounded() && requireNonNull(min).equals(max);
  }

  /** Returns the smallest interval that contains both intervals. */
  public Interval union(Interval other) {
    if (other.empty) {
      return this;
    }
    if (this.empty) {
      return other;
    }
    return of(
        min == null || other.min == null ? null : ir.min(min, other.min),
        max == null || other.max == null ? null : ir.max(max, other.max));
  }

  /**
   * Returns the intersection of two intervals. Returns {@link #EMPTY} if the
   * result can be proven to contain no values.
   */
  public Interval intersect(Interval other) {
    if (this.empty || other.empty) {
      return EMPTY;
    }
    final Ir.Expr lo =
        min == null
            ? other.min
            : other.min == null ? min : ir.max(min, other.min);
    final Ir.Expr hi =
        max == null
            ? other.max
            : other.max == null ? max : ir.min(max, other.max);
    if (lo != null
        && hi != null
        && Boolean.FALSE.equals(Simplifier.compareLe(lo, hi))) {
      return EMPTY;
    }
    return of(lo, hi);
  }

  /**
   * Returns the set of values of {@code a * x + b} for {@code x} in an
   * interval. A negative {@code a} swaps the endpoints.
   */
  public static Interval imageUnderAffine(
      Interval interval, long a, Ir.Expr b) {
    if (interval.empty) {
      return EMPTY;
    }
    if (a == 0) {
      return point(b);
    }
    final Ir.Expr lo =
        interval.min == null ? null : ir.add(ir.mul(interval.min, a), b);
    final Ir.Expr hi =
        interval.max == null ? null : ir.add(ir.mul(interval.max, a), b);
    return a > 0 ? of(lo, hi) : of(hi, lo);
  }

  /** Returns the number of values, {@code max - min + 1}. */
  public Ir.Expr extent() {
    checkArgument(isBounded(), "unbounded interval %s", this);
    return Simplifier.simplify(
        ir.add(ir.sub(requireNonNull(max), requireNonNull(min)), 1));
  }

  /**
   * Returns whether this interval contains another: true if provably so,
   * false if provably not, null if it cannot be decided statically.
   */
  public @Nullable Boolean covers(Interval inner) {
    if (inner.empty) {
      return true;
    }
    if (this.empty) {
      return false;
    }
    final Boolean minOk =
        min == null
            ? Boolean.TRUE
            : inner.min == null
                ? Boolean.FALSE
                : Simplifier.compareLe(min, inner.min);
    final Boolean maxOk =
        max == null
            ? Boolean.TRUE
            : inner.max == null
                ? Boolean.FALSE
                : Simplifier.compareLe(inner.max, max);
    if (Boolean.FALSE.equals(minOk) || Boolean.FALSE.equals(maxOk)) {
      return false;
    }
    if (minOk == null || maxOk == null) {
      return null;
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(min, max, empty);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Interval
            && Objects.equals(min, ((Interval) o).min)
            && Objects.equals(max, ((Interval) o).max)
            && empty == ((Interval) o).empty;
  }

  @Override
  public String toString() {
    if (empty) {
      return "[]";
    }
    return "["
        + (min == null ? "-inf" : min.toString())
        + ", "
        + (max == null ? "+inf" : max.toString())
        + "]";
  }
}

// End Interval.java
