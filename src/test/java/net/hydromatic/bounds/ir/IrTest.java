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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

/**
 * Tests for the intermediate representation: how it prints, and the
 * visitors that find and replace variables.
 */
public class IrTest {
  private final Ir.Var x = ir.var("x");
  private final Ir.Var y = ir.var("y");

  /** Program with a loop nested in a realization, used by several tests. */
  private Ir.Stmt program() {
    return ir.realize(
        "f",
        ImmutableList.of(ir.range(ir.var("f.x.min"), ir.var("f.x.extent"))),
        ir.block(
            ir.produce(
                "f",
                ir.forLoop(
                    "x",
                    ir.var("f.x.min"),
                    ir.var("f.x.extent"),
                    Ir.ForType.PARALLEL,
                    ir.provide("f", ir.mul(x, y), x))),
            ir.consume(
                "f",
                ir.assertStmt(
                    ir.le(ir.stageCall("f", ir.intLiteral(0)), y),
                    "too big"))));
  }

  @Test
  void testUnparseExpr() {
    assertThat(ir.mul(ir.add(x, 1), y), hasToString("(x + 1) * y"));
    assertThat(ir.add(x, ir.mul(y, 2)), hasToString("x + y * 2"));
    assertThat(ir.sub(x, ir.sub(y, 1)), hasToString("x - (y - 1)"));
    assertThat(ir.sub(ir.sub(x, y), 1), hasToString("x - y - 1"));
    assertThat(
        ir.min(x, ir.max(y, ir.intLiteral(3))),
        hasToString("min(x, max(y, 3))"));
    assertThat(
        ir.and(ir.lt(x, y), ir.or(ir.eq(x, y), ir.ne(x, y))),
        hasToString("x < y && (x == y || x != y)"));
    assertThat(
        ir.select(ir.ge(x, ir.intLiteral(0)), x, ir.intLiteral(-1)),
        hasToString("select(x >= 0, x, -1)"));
    assertThat(
        ir.imageCall("in", x, ir.add(y, 1)), hasToString("in(x, y + 1)"));
  }

  @Test
  void testUnparseStmt() {
    final String expected =
        "realize f([f.x.min, f.x.extent]) {\n"
            + "  produce f {\n"
            + "    parallel (x, f.x.min, f.x.extent) {\n"
            + "      f(x) = x * y\n"
            + "    }\n"
            + "  }\n"
            + "  consume f {\n"
            + "    assert(f(0) <= y, \"too big\")\n"
            + "  }\n"
            + "}";
    assertThat(program(), hasToString(expected));
    assertThat(
        ir.letStmt("n", ir.intLiteral(3), ir.evaluate(ir.var("n"))),
        hasToString("let n = 3\nn"));
  }

  /** Blocks are flattened, and a block of one statement is the statement. */
  @Test
  void testBlock() {
    final Ir.Stmt a = ir.evaluate(x);
    final Ir.Stmt b = ir.evaluate(y);
    assertThat(ir.block(a), sameInstance(a));
    final Ir.Stmt block = ir.block(a, ir.block(b, a));
    assertThat(block.children().size(), is(3));
    assertThat(block, hasToString("x\ny\nx"));
  }

  @Test
  void testFreeVars() {
    assertThat(
        FreeFinder.freeVars(program()),
        hasToString("[f.x.extent, f.x.min, y]"));
    assertThat(
        FreeFinder.freeVars(ir.let("x", y, ir.add(x, ir.var("z")))),
        hasToString("[y, z]"));
    assertThat(
        FreeFinder.references(ir.add(x, 1), ImmutableMap.of("x", 1).keySet()),
        is(true));
  }

  @Test
  void testReplace() {
    final Ir.Expr e = ir.add(x, ir.let("x", ir.intLiteral(1), ir.add(x, y)));
    assertThat(
        Replacer.substitute("x", ir.var("w"), e),
        hasToString("w + (let x = 1 in x + y)"));
    assertThat(
        Replacer.substitute(ImmutableMap.of("y", ir.intLiteral(7)), e),
        hasToString("x + (let x = 1 in x + 7)"));
    // The loop variable is not replaced in the body, but the bounds are.
    final Ir.Stmt s =
        Replacer.substitute(
            ImmutableMap.of("f.x.min", ir.intLiteral(0), "x", y), program());
    assertThat(
        s.toString().contains("parallel (x, 0, f.x.extent) {\n"), is(true));
    assertThat(s.toString().contains("f(x) = x * y"), is(true));
    // Nothing to replace; the same statement is returned.
    final Ir.Stmt p = program();
    assertThat(
        Replacer.substitute(ImmutableMap.of("z", x), p), sameInstance(p));
  }

  @Test
  void testPaths() {
    final Ir.Stmt p = program();
    assertThat(
        Paths.find(p, s -> s instanceof Ir.For), hasToString("[0, 0, 0]"));
    assertThat(
        Paths.find(p, s -> s instanceof Ir.AssertStmt),
        hasToString("[0, 1, 0]"));
    assertThat(Paths.find(p, s -> s instanceof Ir.LetStmt), nullValue());
    assertThat(
        Paths.findAll(p, s -> s instanceof Ir.ProducerConsumer),
        hasToString("[[0, 0], [0, 1]]"));
    assertThat(
        Paths.get(p, ImmutableList.of(0, 0, 0, 0)),
        hasToString("f(x) = x * y"));
    assertThat(Paths.ancestors(p, ImmutableList.of(0, 1, 0)).size(), is(3));
    assertThat(
        Paths.commonPrefix(
            ImmutableList.of(
                ImmutableList.of(0, 1, 2), ImmutableList.of(0, 1))),
        hasToString("[0, 1]"));
    assertThat(
        Paths.startsWith(ImmutableList.of(0, 1), ImmutableList.of(0)),
        is(true));
    assertThat(
        Paths.startsWith(ImmutableList.of(0), ImmutableList.of(0, 1)),
        is(false));
  }
}

// End IrTest.java
