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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Replaces free variables with expressions.
 *
 * <p>A variable that is re-bound by a {@link Ir.Let}, {@link Ir.LetStmt} or
 * {@link Ir.For} is not replaced within the scope of that binding.
 */
public class Replacer extends Shuttle {
  private final Map<String, ? extends Ir.Expr> substitution;

  private Replacer(Map<String, ? extends Ir.Expr> substitution) {
    this.substitution = requireNonNull(substitution);
  }

  /** Substitutes variables in an expression. */
  public static Ir.Expr substitute(
      Map<String, ? extends Ir.Expr> substitution, Ir.Expr expr) {
    if (substitution.isEmpty()) {
      return expr;
    }
    return expr.accept(new Replacer(substitution));
  }

  /** Substitutes one variable in an expression. */
  public static Ir.Expr substitute(String name, Ir.Expr value, Ir.Expr expr) {
    return substitute(ImmutableMap.of(name, value), expr);
  }

  /** Substitutes variables in a statement. */
  public static Ir.Stmt substitute(
      Map<String, ? extends Ir.Expr> substitution, Ir.Stmt stmt) {
    if (substitution.isEmpty()) {
      return stmt;
    }
    return stmt.accept(new Replacer(substitution));
  }

  /** Returns a replacer that does not replace {@code name}. */
  private Replacer push(String name) {
    if (!substitution.containsKey(name)) {
      return this;
    }
    final Map<String, Ir.Expr> map = new HashMap<>(substitution);
    map.remove(name);
    return new Replacer(map);
  }

  @Override
  protected Ir.Expr visit(Ir.Var var) {
    final Ir.Expr expr = substitution.get(var.name);
    return expr != null ? expr : var;
  }

  @Override
  protected Ir.Expr visit(Ir.Let let) {
    return let.copy(let.value.accept(this), let.body.accept(push(let.name)));
  }

  @Override
  protected Ir.Stmt visit(Ir.LetStmt letStmt) {
    return letStmt.copy(
        letStmt.value.accept(this), letStmt.body.accept(push(letStmt.name)));
  }

  @Override
  protected Ir.Stmt visit(Ir.For forLoop) {
    return forLoop.copy(
        forLoop.min.accept(this),
        forLoop.extent.accept(this),
        forLoop.body.accept(push(forLoop.name)));
  }
}

// End Replacer.java
