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

/** Visits programs. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends IrNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ir.IntLiteral literal) {}

  protected void visit(Ir.Var var) {}

  protected void visit(Ir.Binary binary) {
    binary.a.accept(this);
    binary.b.accept(this);
  }

  protected void visit(Ir.Not not) {
    not.a.accept(this);
  }

  protected void visit(Ir.Select select) {
    select.condition.accept(this);
    select.trueValue.accept(this);
    select.falseValue.accept(this);
  }

  protected void visit(Ir.Call call) {
    call.args.forEach(this::accept);
  }

  protected void visit(Ir.Let let) {
    let.value.accept(this);
    let.body.accept(this);
  }

  // statements

  protected void visit(Ir.LetStmt letStmt) {
    letStmt.value.accept(this);
    letStmt.body.accept(this);
  }

  protected void visit(Ir.For forLoop) {
    forLoop.min.accept(this);
    forLoop.extent.accept(this);
    forLoop.body.accept(this);
  }

  protected void visit(Ir.ProducerConsumer producerConsumer) {
    producerConsumer.body.accept(this);
  }

  protected void visit(Ir.Realize realize) {
    realize.bounds.forEach(
        range -> {
          range.min.accept(this);
          range.extent.accept(this);
        });
    realize.body.accept(this);
  }

  protected void visit(Ir.Provide provide) {
    provide.values.forEach(this::accept);
    provide.args.forEach(this::accept);
  }

  protected void visit(Ir.Block block) {
    block.stmts.forEach(this::accept);
  }

  protected void visit(Ir.IfThenElse ifThenElse) {
    ifThenElse.condition.accept(this);
    ifThenElse.thenCase.accept(this);
    if (ifThenElse.elseCase != null) {
      ifThenElse.elseCase.accept(this);
    }
  }

  protected void visit(Ir.Evaluate evaluate) {
    evaluate.value.accept(this);
  }

  protected void visit(Ir.AssertStmt assertStmt) {
    assertStmt.condition.accept(this);
  }
}

// End Visitor.java
