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

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Consumer;

/** Finds free variables in an expression or statement. */
public class FreeFinder extends Visitor {
  private final ImmutableSet<String> bound;
  private final Consumer<String> consumer;

  private FreeFinder(ImmutableSet<String> bound, Consumer<String> consumer) {
    this.bound = bound;
    this.consumer = consumer;
  }

  /** Returns the free variables of a node, sorted by name. */
  public static SortedSet<String> freeVars(IrNode node) {
    final SortedSet<String> names = new TreeSet<>();
    node.accept(new FreeFinder(ImmutableSet.of(), names::add));
    return names;
  }

  /**
   * Calls a consumer for each free variable of a node that is not in a given
   * set of names.
   */
  public static void forEachFree(
      IrNode node, Set<String> bound, Consumer<String> consumer) {
    node.accept(new FreeFinder(ImmutableSet.copyOf(bound), consumer));
  }

  /** Returns whether an expression references any of the given variables. */
  public static boolean references(Ir.Expr expr, Set<String> names) {
    for (String name : freeVars(expr)) {
      if (names.contains(name)) {
        return true;
      }
    }
    return false;
  }

  private FreeFinder push(String name) {
    return new FreeFinder(
        ImmutableSet.<String>builder().addAll(bound).add(name).build(),
        consumer);
  }

  @Override
  protected void visit(Ir.Var var) {
    if (!bound.contains(var.name)) {
      consumer.accept(var.name);
    }
  }

  @Override
  protected void visit(Ir.Let let) {
    let.value.accept(this);
    let.body.accept(push(let.name));
  }

  @Override
  protected void visit(Ir.LetStmt letStmt) {
    letStmt.value.accept(this);
    letStmt.body.accept(push(letStmt.name));
  }

  @Override
  protected void visit(Ir.For forLoop) {
    forLoop.min.accept(this);
    forLoop.extent.accept(this);
    forLoop.body.accept(push(forLoop.name));
  }
}

// End FreeFinder.java
