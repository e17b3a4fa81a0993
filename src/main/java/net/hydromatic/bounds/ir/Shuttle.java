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

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms programs.
 *
 * <p>Each method returns the node it was given if none of the node's
 * descendants changed, so that a transformation that changes nothing returns
 * the original tree, and unchanged subtrees are shared.
 */
public class Shuttle {
  protected List<Ir.Expr> visitList(List<Ir.Expr> exprs) {
    final List<Ir.Expr> list = new ArrayList<>();
    for (Ir.Expr expr : exprs) {
      list.add(expr.accept(this));
    }
    return list;
  }

  protected List<Ir.Stmt> visitStmts(List<Ir.Stmt> stmts) {
    final List<Ir.Stmt> list = new ArrayList<>();
    for (Ir.Stmt stmt : stmts) {
      list.add(stmt.accept(this));
    }
    return list;
  }

  // expressions

  protected Ir.Expr visit(Ir.IntLiteral literal) {
    return literal; // leaf
  }

  protected Ir.Expr visit(Ir.Var var) {
    return var; // leaf
  }

  protected Ir.Expr visit(Ir.Binary binary) {
    return binary.copy(binary.a.accept(this), binary.b.accept(this));
  }

  protected Ir.Expr visit(Ir.Not not) {
    return not.copy(not.a.accept(this));
  }

  protected Ir.Expr visit(Ir.Select select) {
    return select.copy(
        select.condition.accept(this),
        select.trueValue.accept(this),
        select.falseValue.accept(this));
  }

  protected Ir.Expr visit(Ir.Call call) {
    return call.copy(visitList(call.args));
  }

  protected Ir.Expr visit(Ir.Let let) {
    return let.copy(let.value.accept(this), let.body.accept(this));
  }

  // statements

  protected Ir.Stmt visit(Ir.LetStmt letStmt) {
    return letStmt.copy(
        letStmt.value.accept(this), letStmt.body.accept(this));
  }

  protected Ir.Stmt visit(Ir.For forLoop) {
    return forLoop.copy(
        forLoop.min.accept(this),
        forLoop.extent.accept(this),
        forLoop.body.accept(this));
  }

  protected Ir.Stmt visit(Ir.ProducerConsumer producerConsumer) {
    return producerConsumer.copy(producerConsumer.body.accept(this));
  }

  protected Ir.Stmt visit(Ir.Realize realize) {
    final List<Ir.Range> bounds = new ArrayList<>();
    for (Ir.Range range : realize.bounds) {
      bounds.add(range.copy(range.min.accept(this), range.extent.accept(this)));
    }
    return realize.copy(bounds, realize.body.accept(this));
  }

  protected Ir.Stmt visit(Ir.Provide provide) {
    return provide.copy(visitList(provide.values), visitList(provide.args));
  }

  protected Ir.Stmt visit(Ir.Block block) {
    return block.copy(visitStmts(block.stmts));
  }

  protected Ir.Stmt visit(Ir.IfThenElse ifThenElse) {
    return ifThenElse.copy(
        ifThenElse.condition.accept(this),
        ifThenElse.thenCase.accept(this),
        ifThenElse.elseCase == null
            ? null
            : ifThenElse.elseCase.accept(this));
  }

  protected Ir.Stmt visit(Ir.Evaluate evaluate) {
    return evaluate.copy(evaluate.value.accept(this));
  }

  protected Ir.Stmt visit(Ir.AssertStmt assertStmt) {
    return assertStmt.copy(assertStmt.condition.accept(this));
  }
}

// End Shuttle.java
