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
package net.hydromatic.bounds.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.bounds.ir.IrBuilder.ir;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import net.hydromatic.bounds.interval.Bounds;
import net.hydromatic.bounds.interval.Box;
import net.hydromatic.bounds.interval.Interval;
import net.hydromatic.bounds.interval.Scope;
import net.hydromatic.bounds.ir.Ir;
import net.hydromatic.bounds.ir.Replacer;
import net.hydromatic.bounds.ir.Visitor;

/**
 * Computes the region of a stage that a part of a program reads.
 *
 * <p>Each index expression of each call to the stage is mapped to an
 * interval; loops and let-bound variables that enclose the call within the
 * part of the program being analyzed range over their bounds, and other
 * variables are symbolic. The region of a dimension is the union over all
 * calls. Calls in both branches of a conditional contribute.
 *
 * <p>Placeholders of stages whose bounds are already known are replaced by
 * their values before an expression is analyzed, so that the values can
 * depend on loops inside the part of the program being analyzed.
 *
 * <p>The region is also broken down by consumer. The consumer of a call is
 * the stage of the innermost enclosing store, otherwise the stage of the
 * innermost enclosing "produce" node, otherwise a name supplied by the
 * caller.
 */
public class RegionRequired extends Visitor {
  private final Stage stage;
  private final Mode mode;
  private final Scope scope;
  private final Map<String, Ir.Expr> substitution;
  private final String consumer;
  private final SortedMap<String, Box> byConsumer;

  private RegionRequired(
      Stage stage,
      Mode mode,
      Scope scope,
      Map<String, Ir.Expr> substitution,
      String consumer,
      SortedMap<String, Box> byConsumer) {
    this.stage = requireNonNull(stage);
    this.mode = requireNonNull(mode);
    this.scope = requireNonNull(scope);
    this.substitution = requireNonNull(substitution);
    this.consumer = requireNonNull(consumer);
    this.byConsumer = requireNonNull(byConsumer);
  }

  /**
   * Returns the region of {@code stage} read by calls in {@code subtree}.
   * Calls in the stage's own "produce" node are ignored.
   *
   * @param subtree Part of the program to analyze
   * @param stage Stage whose calls to look for
   * @param scope Intervals of variables defined outside the subtree
   * @param substitution Values of placeholders defined outside the subtree
   * @param context Consumer of calls outside any stage's definition
   */
  public static Result analyze(
      Ir.Stmt subtree,
      Stage stage,
      Scope scope,
      Map<String, Ir.Expr> substitution,
      String context) {
    return run(subtree, stage, Mode.CONSUMERS, scope, substitution, context);
  }

  /** Returns the total region read by calls in {@code subtree}. */
  public static Box requiredRegion(Ir.Stmt subtree, Stage stage, Scope scope) {
    return analyze(subtree, stage, scope, ImmutableMap.of(), "").total;
  }

  /**
   * Returns the region of {@code stage} that {@code subtree} writes or reads.
   * This is the region that the definitions of a stage touch, and for update
   * definitions may be larger than the region that consumers read.
   */
  public static Box provided(
      Ir.Stmt subtree,
      Stage stage,
      Scope scope,
      Map<String, Ir.Expr> substitution) {
    return run(subtree, stage, Mode.PROVIDED, scope, substitution, stage.name)
        .total;
  }

  private static Result run(
      Ir.Stmt subtree,
      Stage stage,
      Mode mode,
      Scope scope,
      Map<String, Ir.Expr> substitution,
      String context) {
    final SortedMap<String, Box> byConsumer = new TreeMap<>();
    subtree.accept(
        new RegionRequired(
            stage, mode, scope, substitution, context, byConsumer));
    Box total = Box.empty(stage.dimensionCount());
    for (Box box : byConsumer.values()) {
      total = total.union(box);
    }
    return new Result(ImmutableSortedMap.copyOfSorted(byConsumer), total);
  }

  /** Returns the interval of an expression at the current point. */
  private Interval bounds(Ir.Expr expr) {
    return Bounds.of(Replacer.substitute(substitution, expr), scope);
  }

  /**
   * Returns the interval of a loop variable, {@code [min, min + extent - 1]},
   * or empty if the loop's bounds are empty.
   */
  private Interval loopInterval(Ir.For forLoop) {
    final Interval min = bounds(forLoop.min);
    final Interval max =
        bounds(ir.sub(ir.add(forLoop.min, forLoop.extent), 1));
    if (min.isEmpty() || max.isEmpty()) {
      return Interval.EMPTY;
    }
    return Interval.of(min.min, max.max);
  }

  private RegionRequired bind(String name, Interval interval) {
    Map<String, Ir.Expr> substitution = this.substitution;
    if (substitution.containsKey(name)) {
      substitution = new HashMap<>(substitution);
      substitution.remove(name);
    }
    return new RegionRequired(
        stage,
        mode,
        scope.bind(name, interval),
        substitution,
        consumer,
        byConsumer);
  }

  private RegionRequired withConsumer(String consumer) {
    if (consumer.equals(this.consumer)) {
      return this;
    }
    return new RegionRequired(
        stage, mode, scope, substitution, consumer, byConsumer);
  }

  private void record(List<Ir.Expr> args) {
    if (args.size() != stage.dimensionCount()) {
      throw BoundsException.wrongArgumentCount(
          stage.name, stage.dimensionCount(), args.size());
    }
    final List<Interval> intervals = new ArrayList<>();
    for (Ir.Expr arg : args) {
      intervals.add(bounds(arg));
    }
    final Box box = Box.of(stage.dimensionCount(), intervals);
    byConsumer.merge(consumer, box, Box::union);
  }

  @Override
  protected void visit(Ir.Call call) {
    if (call.isCallTo(stage.name)) {
      record(call.args);
    }
    super.visit(call);
  }

  @Override
  protected void visit(Ir.Let let) {
    let.value.accept(this);
    let.body.accept(bind(let.name, bounds(let.value)));
  }

  @Override
  protected void visit(Ir.LetStmt letStmt) {
    letStmt.value.accept(this);
    letStmt.body.accept(bind(letStmt.name, bounds(letStmt.value)));
  }

  @Override
  protected void visit(Ir.For forLoop) {
    forLoop.min.accept(this);
    forLoop.extent.accept(this);
    forLoop.body.accept(bind(forLoop.name, loopInterval(forLoop)));
  }

  @Override
  protected void visit(Ir.ProducerConsumer producerConsumer) {
    if (!producerConsumer.isProducer) {
      super.visit(producerConsumer);
      return;
    }
    if (mode == Mode.CONSUMERS && producerConsumer.name.equals(stage.name)) {
      return;
    }
    producerConsumer.body.accept(withConsumer(producerConsumer.name));
  }

  @Override
  protected void visit(Ir.Provide provide) {
    final RegionRequired visitor = withConsumer(provide.name);
    provide.values.forEach(visitor::accept);
    provide.args.forEach(visitor::accept);
    if (mode == Mode.PROVIDED && provide.name.equals(stage.name)) {
      visitor.record(provide.args);
    }
  }

  /** What the analysis collects. */
  private enum Mode {
    /** Calls to the stage, except from its own definition. */
    CONSUMERS,
    /** Stores to the stage and calls to it. */
    PROVIDED
  }

  /** Region required from a stage, per consumer and in total. */
  public static class Result {
    public final ImmutableSortedMap<String, Box> byConsumer;
    public final Box total;

    Result(ImmutableSortedMap<String, Box> byConsumer, Box total) {
      this.byConsumer = requireNonNull(byConsumer);
      this.total = requireNonNull(total);
    }

    @Override
    public String toString() {
      return total + " " + byConsumer;
    }
  }
}

// End RegionRequired.java
