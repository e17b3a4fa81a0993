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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.bounds.ir.FreeFinder;
import net.hydromatic.bounds.ir.Ir;
import net.hydromatic.bounds.ir.Paths;

/**
 * Injects definitions of placeholders into a program.
 *
 * <p>The definitions of a stage's placeholders are placed around the
 * innermost statement that encloses every use, but outside the stage's own
 * "realize" and "produce" nodes. The rest of the program is unchanged, and
 * subtrees that contain no insertion point are shared with the input; if
 * there are no placeholders, the result is the input program.
 *
 * <p>A stage with a sliding window also gets definitions at the start of the
 * body of the loop that it slides along; these hide the definitions outside
 * the loop from the stage's producer.
 */
public class BoundsInjector {
  private final Ir.Stmt root;
  private final Environment env;
  private final BoundsInference.Analysis analysis;
  private final Tracer tracer;

  /** Uses of placeholders: stage, placeholder name, path of the statement. */
  private final List<Use> uses = new ArrayList<>();
  /** Variables defined by some loop or "let" statement in the program. */
  private final Set<String> definedNames = new HashSet<>();
  /** Definitions and assertions to insert, keyed by path. */
  private final Map<List<Integer>, Insertion> insertions =
      new LinkedHashMap<>();

  private BoundsInjector(
      Ir.Stmt root,
      Environment env,
      BoundsInference.Analysis analysis,
      Tracer tracer) {
    this.root = requireNonNull(root);
    this.env = requireNonNull(env);
    this.analysis = requireNonNull(analysis);
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Returns a program with definitions of placeholders injected.
   *
   * @throws IllegalStateException if a placeholder refers to a stage that
   *     has no box, or if a definition would refer to a variable that is not
   *     defined where the definition is placed
   */
  public static Ir.Stmt inject(
      Ir.Stmt stmt,
      Environment env,
      BoundsInference.Analysis analysis,
      Tracer tracer) {
    return new BoundsInjector(stmt, env, analysis, tracer).inject();
  }

  private Ir.Stmt inject() {
    collect(root, new ArrayList<>(), ImmutableSet.of());
    if (uses.isEmpty()) {
      return root;
    }
    for (Use use : uses) {
      if (!analysis.boxes.containsKey(use.stage)) {
        throw new IllegalStateException(
            "placeholder '"
                + use.name
                + "' refers to stage '"
                + use.stage
                + "', which has no bounds; is it missing from the "
                + "realization order?");
      }
    }
    for (String stage : analysis.order) {
      placeStage(stage);
    }
    for (String stage : analysis.order) {
      placeSlidingWindow(stage);
    }
    insertions.forEach(this::checkDefined);
    return rebuild(root, new ArrayList<>());
  }

  /** Finds uses of placeholders and names of defined variables. */
  private void collect(
      Ir.Stmt stmt, List<Integer> path, ImmutableSet<String> bound) {
    for (Ir.Expr expr : stmt.exprs()) {
      FreeFinder.forEachFree(
          expr,
          bound,
          name -> {
            final Placeholder placeholder = Placeholder.parse(name, env);
            if (placeholder != null) {
              uses.add(
                  new Use(placeholder.stage, name, ImmutableList.copyOf(path)));
            }
          });
    }
    final String boundName = stmt.boundName();
    final ImmutableSet<String> bound2;
    if (boundName == null) {
      bound2 = bound;
    } else {
      definedNames.add(boundName);
      bound2 =
          ImmutableSet.<String>builder().addAll(bound).add(boundName).build();
    }
    final List<Ir.Stmt> children = stmt.children();
    for (int i = 0; i < children.size(); i++) {
      path.add(i);
      collect(children.get(i), path, bound2);
      path.remove(path.size() - 1);
    }
  }

  /**
   * Places the definitions of a stage at the innermost statement that
   * encloses all uses, moved outside the stage's outermost "realize" or
   * "produce" node on that path.
   */
  private void placeStage(String stage) {
    final List<List<Integer>> paths = new ArrayList<>();
    final Set<String> names = new HashSet<>();
    for (Use use : uses) {
      if (use.stage.equals(stage)) {
        paths.add(use.path);
        names.add(use.name);
      }
    }
    if (paths.isEmpty()) {
      return;
    }
    final ImmutableList<Integer> common = Paths.commonPrefix(paths);
    List<Integer> path = common;
    for (int k = 0; k <= common.size(); k++) {
      final Ir.Stmt s = Paths.get(root, common.subList(0, k));
      if (BoundsInference.isRealize(s, stage)
          || s instanceof Ir.ProducerConsumer
              && ((Ir.ProducerConsumer) s).name.equals(stage)) {
        path = common.subList(0, k);
        break;
      }
    }
    final ImmutableMap<String, Ir.Expr> definitions =
        filter(requireNonNull(analysis.definitions.get(stage)), names);
    tracer.onInject(stage, definitions);
    final Insertion insertion = insertionAt(path);
    insertion.definitions.putAll(definitions);
    insertion.asserts.addAll(analysis.asserts.get(stage));
  }

  /** Places the incremental definitions of a sliding window. */
  private void placeSlidingWindow(String stage) {
    final BoundsInference.SlidingWindow slidingWindow =
        analysis.slidingWindows.get(stage);
    if (slidingWindow == null) {
      return;
    }
    final Set<String> names = new HashSet<>();
    for (Use use : uses) {
      if (use.stage.equals(stage)
          && Paths.startsWith(use.path, slidingWindow.bodyPath)) {
        names.add(use.name);
      }
    }
    final ImmutableMap<String, Ir.Expr> definitions =
        filter(slidingWindow.definitions, names);
    if (definitions.isEmpty()) {
      return;
    }
    tracer.onInject(stage, definitions);
    insertionAt(slidingWindow.bodyPath).definitions.putAll(definitions);
  }

  private Insertion insertionAt(List<Integer> path) {
    return insertions.computeIfAbsent(
        ImmutableList.copyOf(path), p -> new Insertion());
  }

  /** Returns the definitions whose names are in a set, in their order. */
  private static ImmutableMap<String, Ir.Expr> filter(
      ImmutableMap<String, Ir.Expr> definitions, Set<String> names) {
    final ImmutableMap.Builder<String, Ir.Expr> b = ImmutableMap.builder();
    definitions.forEach(
        (name, value) -> {
          if (names.contains(name)) {
            b.put(name, value);
          }
        });
    return b.build();
  }

  /**
   * Checks that every variable that a definition uses, if the program
   * defines it, is defined where the definition is placed.
   */
  private void checkDefined(List<Integer> path, Insertion insertion) {
    final Set<String> visible = new HashSet<>();
    for (Ir.Stmt ancestor : Paths.ancestors(root, path)) {
      final String name = ancestor.boundName();
      if (name != null) {
        visible.add(name);
      }
    }
    final List<Ir.Expr> exprs = new ArrayList<>(insertion.definitions.values());
    insertion.asserts.forEach(a -> exprs.add(a.condition));
    for (Ir.Expr expr : exprs) {
      final Set<String> undefined = new TreeSet<>();
      for (String name : FreeFinder.freeVars(expr)) {
        if (definedNames.contains(name) && !visible.contains(name)) {
          undefined.add(name);
        }
      }
      if (!undefined.isEmpty()) {
        throw new IllegalStateException(
            "definition "
                + expr
                + " uses "
                + undefined
                + ", which are not defined at "
                + path);
      }
    }
  }

  private Ir.Stmt rebuild(Ir.Stmt stmt, List<Integer> path) {
    if (!hasInsertionWithin(path)) {
      return stmt;
    }
    final List<Ir.Stmt> children = stmt.children();
    final List<Ir.Stmt> newChildren = new ArrayList<>();
    for (int i = 0; i < children.size(); i++) {
      path.add(i);
      newChildren.add(rebuild(children.get(i), path));
      path.remove(path.size() - 1);
    }
    Ir.Stmt result = stmt.withChildren(newChildren);
    final Insertion insertion = insertions.get(path);
    if (insertion == null) {
      return result;
    }
    if (!insertion.asserts.isEmpty()) {
      result =
          ir.block(
              ImmutableList.<Ir.Stmt>builder()
                  .addAll(insertion.asserts)
                  .add(result)
                  .build());
    }
    final List<Map.Entry<String, Ir.Expr>> definitions =
        new ArrayList<>(insertion.definitions.entrySet());
    for (int i = definitions.size() - 1; i >= 0; i--) {
      final Map.Entry<String, Ir.Expr> entry = definitions.get(i);
      result = ir.letStmt(entry.getKey(), entry.getValue(), result);
    }
    return result;
  }

  private boolean hasInsertionWithin(List<Integer> path) {
    for (List<Integer> insertionPath : insertions.keySet()) {
      if (Paths.startsWith(insertionPath, path)) {
        return true;
      }
    }
    return false;
  }

  /** Use of a placeholder. */
  private static class Use {
    final String stage;
    final String name;
    final ImmutableList<Integer> path;

    Use(String stage, String name, ImmutableList<Integer> path) {
      this.stage = stage;
      this.name = name;
      this.path = path;
    }
  }

  /** Definitions and assertions to be placed around a statement. */
  private static class Insertion {
    final Map<String, Ir.Expr> definitions = new LinkedHashMap<>();
    final List<Ir.AssertStmt> asserts = new ArrayList<>();
  }
}

// End BoundsInjector.java
