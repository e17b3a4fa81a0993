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

import static com.google.common.collect.Iterables.getOnlyElement;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds program nodes. */
public enum IrBuilder {
  /**
   * The singleton instance of the IR builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ir;

  private final Ir.IntLiteral zero = new Ir.IntLiteral(0);
  private final Ir.IntLiteral one = new Ir.IntLiteral(1);

  /** Creates an integer literal. */
  public Ir.IntLiteral intLiteral(long value) {
    return value == 0 ? zero : value == 1 ? one : new Ir.IntLiteral(value);
  }

  /** Creates a reference to a variable. */
  public Ir.Var var(String name) {
    return new Ir.Var(name);
  }

  /** Creates a call to a binary operator. */
  public Ir.Binary binary(Op op, Ir.Expr a, Ir.Expr b) {
    return new Ir.Binary(op, a, b);
  }

  public Ir.Binary add(Ir.Expr a, Ir.Expr b) {
    return binary(Op.ADD, a, b);
  }

  /** Creates "a + b" where b is an integer. */
  public Ir.Binary add(Ir.Expr a, long b) {
    return add(a, intLiteral(b));
  }

  public Ir.Binary sub(Ir.Expr a, Ir.Expr b) {
    return binary(Op.SUB, a, b);
  }

  /** Creates "a - b" where b is an integer. */
  public Ir.Binary sub(Ir.Expr a, long b) {
    return sub(a, intLiteral(b));
  }

  public Ir.Binary mul(Ir.Expr a, Ir.Expr b) {
    return binary(Op.MUL, a, b);
  }

  /** Creates "a * b" where b is an integer. */
  public Ir.Binary mul(Ir.Expr a, long b) {
    return mul(a, intLiteral(b));
  }

  public Ir.Binary div(Ir.Expr a, Ir.Expr b) {
    return binary(Op.DIV, a, b);
  }

  /** Creates "a / b" where b is an integer. */
  public Ir.Binary div(Ir.Expr a, long b) {
    return div(a, intLiteral(b));
  }

  public Ir.Binary mod(Ir.Expr a, Ir.Expr b) {
    return binary(Op.MOD, a, b);
  }

  public Ir.Binary min(Ir.Expr a, Ir.Expr b) {
    return binary(Op.MIN, a, b);
  }

  public Ir.Binary max(Ir.Expr a, Ir.Expr b) {
    return binary(Op.MAX, a, b);
  }

  public Ir.Binary eq(Ir.Expr a, Ir.Expr b) {
    return binary(Op.EQ, a, b);
  }

  public Ir.Binary ne(Ir.Expr a, Ir.Expr b) {
    return binary(Op.NE, a, b);
  }

  public Ir.Binary lt(Ir.Expr a, Ir.Expr b) {
    return binary(Op.LT, a, b);
  }

  public Ir.Binary le(Ir.Expr a, Ir.Expr b) {
    return binary(Op.LE, a, b);
  }

  public Ir.Binary gt(Ir.Expr a, Ir.Expr b) {
    return binary(Op.GT, a, b);
  }

  public Ir.Binary ge(Ir.Expr a, Ir.Expr b) {
    return binary(Op.GE, a, b);
  }

  public Ir.Binary and(Ir.Expr a, Ir.Expr b) {
    return binary(Op.AND, a, b);
  }

  public Ir.Binary or(Ir.Expr a, Ir.Expr b) {
    return binary(Op.OR, a, b);
  }

  public Ir.Not not(Ir.Expr a) {
    return new Ir.Not(a);
  }

  public Ir.Select select(
      Ir.Expr condition, Ir.Expr trueValue, Ir.Expr falseValue) {
    return new Ir.Select(condition, trueValue, falseValue);
  }

  /** Creates a call. */
  public Ir.Call call(String name, Ir.CallType callType, List<Ir.Expr> args) {
    return new Ir.Call(name, ImmutableList.copyOf(args), callType);
  }

  /** Creates a read of a stage, "f(args)". */
  public Ir.Call stageCall(String name, Ir.Expr... args) {
    return call(name, Ir.CallType.STAGE, ImmutableList.copyOf(args));
  }

  /** Creates a read of an input image. */
  public Ir.Call imageCall(String name, Ir.Expr... args) {
    return call(name, Ir.CallType.IMAGE, ImmutableList.copyOf(args));
  }

  public Ir.Let let(String name, Ir.Expr value, Ir.Expr body) {
    return new Ir.Let(name, value, body);
  }

  // statements

  public Ir.LetStmt letStmt(String name, Ir.Expr value, Ir.Stmt body) {
    return new Ir.LetStmt(name, value, body);
  }

  /** Creates a serial loop. */
  public Ir.For forLoop(
      String name, Ir.Expr min, Ir.Expr extent, Ir.Stmt body) {
    return forLoop(name, min, extent, Ir.ForType.SERIAL, body);
  }

  public Ir.For forLoop(
      String name,
      Ir.Expr min,
      Ir.Expr extent,
      Ir.ForType forType,
      Ir.Stmt body) {
    return new Ir.For(name, min, extent, forType, body);
  }

  public Ir.ProducerConsumer produce(String name, Ir.Stmt body) {
    return new Ir.ProducerConsumer(name, true, body);
  }

  public Ir.ProducerConsumer consume(String name, Ir.Stmt body) {
    return new Ir.ProducerConsumer(name, false, body);
  }

  public Ir.Range range(Ir.Expr min, Ir.Expr extent) {
    return new Ir.Range(min, extent);
  }

  public Ir.Realize realize(
      String name, List<Ir.Range> bounds, Ir.Stmt body) {
    return new Ir.Realize(name, ImmutableList.copyOf(bounds), body);
  }

  public Ir.Provide provide(
      String name, List<Ir.Expr> values, List<Ir.Expr> args) {
    return new Ir.Provide(
        name, ImmutableList.copyOf(values), ImmutableList.copyOf(args));
  }

  /** Creates a store of a single value, "f(args) = value". */
  public Ir.Provide provide(String name, Ir.Expr value, Ir.Expr... args) {
    return provide(name, ImmutableList.of(value), ImmutableList.copyOf(args));
  }

  /**
   * Creates a sequence of statements. Nested blocks are flattened, and a
   * sequence of one statement is that statement.
   */
  public Ir.Stmt block(List<? extends Ir.Stmt> stmts) {
    final ImmutableList.Builder<Ir.Stmt> b = ImmutableList.builder();
    for (Ir.Stmt stmt : stmts) {
      if (stmt instanceof Ir.Block) {
        b.addAll(((Ir.Block) stmt).stmts);
      } else {
        b.add(stmt);
      }
    }
    final ImmutableList<Ir.Stmt> list = b.build();
    return list.size() == 1 ? getOnlyElement(list) : new Ir.Block(list);
  }

  public Ir.Stmt block(Ir.Stmt stmt0, Ir.Stmt... stmts) {
    return block(
        ImmutableList.<Ir.Stmt>builder().add(stmt0).add(stmts).build());
  }

  public Ir.IfThenElse ifThenElse(
      Ir.Expr condition, Ir.Stmt thenCase, Ir.@Nullable Stmt elseCase) {
    return new Ir.IfThenElse(condition, thenCase, elseCase);
  }

  public Ir.Evaluate evaluate(Ir.Expr value) {
    return new Ir.Evaluate(value);
  }

  public Ir.AssertStmt assertStmt(Ir.Expr condition, String message) {
    return new Ir.AssertStmt(condition, message);
  }
}

// End IrBuilder.java
