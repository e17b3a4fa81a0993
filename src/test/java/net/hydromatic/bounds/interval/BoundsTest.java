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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.bounds.ir.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link Bounds}. */
public class BoundsTest {
  private final Ir.Var x = ir.var("x");
  private final Ir.Var y = ir.var("y");

  /** Scope in which x is in [0, 9]. */
  private final Scope scope = Scope.empty().bind("x", Interval.of(0, 9));

  private void check(Ir.Expr e, String expected) {
    check(e, scope, expected);
  }

  private static void check(Ir.Expr e, Scope scope, String expected) {
    assertThat(Bounds.of(e, scope), hasToString(expected));
  }

  @Test
  void testArithmetic() {
    check(ir.add(ir.mul(x, 2), 1), "[1, 19]");
    check(ir.add(x, y), "[y, y + 9]");
    check(ir.sub(y, x), "[y - 9, y]");
    check(ir.mul(x, -3), "[-27, 0]");
    check(ir.mul(x, x), "[0, 81]");
    check(
        ir.mul(x, ir.var("w")),
        scope.bind("w", Interval.atLeast(ir.intLiteral(0))),
        "[-inf, +inf]");
  }

  @Test
  void testDivMod() {
    check(ir.div(x, 2), "[0, 4]");
    check(ir.div(x, -2), "[-5, 0]");
    check(ir.div(x, 0), "[0, 0]");
    check(ir.mod(x, ir.intLiteral(4)), "[0, 3]");
    check(ir.mod(y, ir.intLiteral(4)), "[y % 4, y % 4]");
    check(
        ir.mod(x, ir.var("z")),
        scope.bind("z", Interval.of(1, 5)),
        "[0, 4]");
  }

  /** Remainder has the sign of the divisor, as in floor division. */
  @Test
  void testModNegativeDivisor() {
    final Ir.Expr e = ir.mod(x, ir.intLiteral(-3));
    check(e, "[-2, 0]");
    // 1 % -3 is -2
    final Interval value =
        Interval.point(ir.mod(ir.intLiteral(1), ir.intLiteral(-3)));
    assertThat(value, hasToString("[-2, -2]"));
    assertThat(Bounds.of(e, scope).covers(value), is(true));
    check(
        ir.mod(x, ir.var("z")),
        scope.bind("z", Interval.of(-4, -1)),
        "[-3, 0]");
    check(
        ir.mod(x, ir.var("z")),
        scope.bind("z", Interval.of(-4, 2)),
        "[-3, 3]");
  }

  /** Division by a divisor that is not a constant. */
  @Test
  void testDivSymbolic() {
    check(ir.div(x, ir.var("k")), "[min(9 / k, 0), max(9 / k, 0)]");
    check(
        ir.div(x, ir.var("z")),
        scope.bind("z", Interval.of(1, 5)),
        "[0, 9]");
    check(
        ir.div(x, ir.var("z")),
        scope.bind("z", Interval.of(-3, -1)),
        "[-9, 0]");
    check(
        ir.div(x, ir.var("z")),
        scope.bind("z", Interval.of(-2, 3)),
        "[-inf, +inf]");
  }

  @Test
  void testMinMax() {
    check(ir.min(x, ir.intLiteral(5)), "[0, 5]");
    check(ir.max(x, y), "[max(y, 0), max(y, 9)]");
    check(
        ir.min(x, ir.var("u")),
        scope.bind("u", Interval.atMost(ir.intLiteral(3))),
        "[-inf, 3]");
  }

  @Test
  void testOther() {
    check(ir.select(ir.var("c"), x, ir.add(x, 20)), "[0, 29]");
    check(ir.stageCall("f", x), "[-inf, +inf]");
    check(ir.lt(x, ir.intLiteral(5)), "[0, 1]");
    check(ir.let("t", ir.add(x, 1), ir.mul(ir.var("t"), 2)), "[2, 20]");
    check(ir.add(ir.var("e"), 1), scope.bind("e", Interval.EMPTY), "[]");
  }

  /** An expression that uses no variable of the scope is a single point. */
  @Test
  void testFixed() {
    check(ir.add(y, ir.mul(ir.var("n"), 2)), "[n * 2 + y, n * 2 + y]");
    check(ir.intLiteral(7), "[7, 7]");
  }

  @Test
  void testScope() {
    final Scope s =
        scope
            .bindAll(ImmutableMap.of("y", Interval.of(1, 2)))
            .bind("x", Interval.of(5, 6));
    assertThat(s.asString(), hasToString("{x=[5, 6], y=[1, 2]}"));
    check(ir.add(x, y), s, "[6, 8]");
    assertThat(Scope.empty().asString(), hasToString("{}"));
  }
}

// End BoundsTest.java
