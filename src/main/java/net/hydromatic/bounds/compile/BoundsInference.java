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

import static com.google.common.collect.Lists.reverse;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.bounds.ir.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.bounds.interval.Bounds;
import net.hydromatic.bounds.interval.Box;
import net.hydromatic.bounds.interval.Interval;
import net.hydromatic.bounds.interval.Scope;
import net.hydromatic.bounds.ir.Ir;
import net.hydromatic.bounds.ir.Paths;
import net.hydromatic.bounds.ir.Replacer;
import net.hydromatic.bounds.ir.Simplifier;
import net.hydromatic.bounds.ir.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Bounds inference.
 *
 * <p>Takes a partially lowered program in which the bounds of each stage are
 * placeholders such as "f.x.min", computes the region that each stage must
 * compute, and returns a program in which each placeholder is defined.
 *
 * <p>Stages are processed in reverse realization order, so that when a stage
 * is processed, the bounds of all of its consumers are known. The region of a
 * stage is the union of the regions that its consumers read, computed by
 * {@link RegionRequired}. Declared bounds (known bounds and hints) replace
 * the inferred region, but must contain it.
 *
 * <p>Members of a {@link FusedGroup} are reconciled by {@link FusedGroups}
 * once all of them are processed, and the definitions are injected into the
 * program by {@link BoundsInjector}.
 */
public class BoundsInference {
  /** Name of the consumer of calls outside any stage's definition. */
  static final String ROOT_CONSUMER = "<root>";

  private final Ir.Stmt stmt;
  private final ImmutableList<String> outputs;
  private final ImmutableList<String> order;
  private final ImmutableList<FusedGroup> fusedGroups;
  private final Environment env;
  private final KnownBounds knownBounds;
  private final Target target;
  private final Map<Prop, Object> props;
  private final Tracer tracer;

  /** Finalized boxes; provisional for members of incomplete groups. */
  private final Map<String, Box> boxes = new HashMap<>();
  /** Values of the placeholders of each stage in {@link #boxes}. */
  private final Map<String, ImmutableMap<String, Ir.Expr>> definitions =
      new HashMap<>();
  /** Region that consumers read, before declared bounds are applied. */
  private final Map<String, Box> required = new HashMap<>();
  private final ImmutableListMultimap.Builder<String, Ir.AssertStmt> asserts =
      ImmutableListMultimap.builder();
  private final Map<String, SlidingWindow> slidingWindows =
      new LinkedHashMap<>();

  private BoundsInference(
      Ir.Stmt stmt,
      List<String> outputs,
      List<String> order,
      List<FusedGroup> fusedGroups,
      Environment env,
      KnownBounds knownBounds,
      Target target,
      Map<Prop, Object> props,
      Tracer tracer) {
    this.stmt = requireNonNull(stmt);
    this.outputs = ImmutableList.copyOf(outputs);
    this.order = ImmutableList.copyOf(order);
    this.fusedGroups = ImmutableList.copyOf(fusedGroups);
    this.env = requireNonNull(env);
    this.knownBounds = requireNonNull(knownBounds);
    this.target = requireNonNull(target);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Runs bounds inference with default properties.
   *
   * @param stmt Program with placeholders
   * @param outputs Names of the output stages of the pipeline
   * @param order Realization order; producers before consumers
   * @param fusedGroups Groups of stages that share a loop nest
   * @param env Stage definitions
   * @param knownBounds Bounds of outputs, and bounds that the user declared
   * @param target Target machine
   * @return Program with every placeholder defined
   * @throws BoundsException if bounds cannot be inferred
   */
  public static Ir.Stmt run(
      Ir.Stmt stmt,
      List<String> outputs,
      List<String> order,
      List<FusedGroup> fusedGroups,
      Environment env,
      KnownBounds knownBounds,
      Target target) {
    return run(
        stmt,
        outputs,
        order,
        fusedGroups,
        env,
        knownBounds,
        target,
        ImmutableMap.of(),
        Tracers.empty());
  }

  /** Runs bounds inference with given properties and tracer. */
  public static Ir.Stmt run(
      Ir.Stmt stmt,
      List<String> outputs,
      List<String> order,
      List<FusedGroup> fusedGroups,
      Environment env,
      KnownBounds knownBounds,
      Target target,
      Map<Prop, Object> props,
      Tracer tracer) {
    try {
      final Analysis analysis =
          new BoundsInference(
                  stmt,
                  outputs,
                  order,
                  fusedGroups,
                  env,
                  knownBounds,
                  target,
                  props,
                  tracer)
              .analyze();
      return BoundsInjector.inject(stmt, env, analysis, tracer);
    } catch (BoundsException e) {
      tracer.onException(e);
      throw e;
    }
  }

  /**
   * Computes the box of every stage but does not modify the program.
   *
   * @throws BoundsException if bounds cannot be inferred
   */
  public static Analysis analyze(
      Ir.Stmt stmt,
      List<String> outputs,
      List<String> order,
      List<FusedGroup> fusedGroups,
      Environment env,
      KnownBounds knownBounds,
      Target target,
      Map<Prop, Object> props,
      Tracer tracer) {
    return new BoundsInference(
            stmt,
            outputs,
            order,
            fusedGroups,
            env,
            knownBounds,
            target,
            props,
            tracer)
        .analyze();
  }

  private Analysis analyze() {
    checkCalls();
    RealizationOrder.validate(order, outputs, env);
    FusedGroups.validate(fusedGroups, order, env);

    for (String name : reverse(order)) {
      final Stage stage = env.get(name);
      final Box need = required(stage);
      required.put(name, need);
      final Box box = finalizeBox(stage, need);
      final FusedGroup group = groupOf(name);
      if (group == null) {
        complete(stage, box);
        continue;
      }
      setBox(stage, box);
      if (group.stages.stream().allMatch(required::containsKey)) {
        final ImmutableMap<String, Box> reconciled =
            FusedGroups.reconcile(
                group, env, boxes, required, this::declared, this::checkCovers);
        for (String member : group.stages) {
          complete(env.get(member), reconciled.get(member));
        }
      }
    }

    final ImmutableMap.Builder<String, Box> boxMap = ImmutableMap.builder();
    final ImmutableMap.Builder<String, ImmutableMap<String, Ir.Expr>>
        definitionMap = ImmutableMap.builder();
    for (String name : order) {
      boxMap.put(name, boxes.get(name));
      definitionMap.put(name, definitions.get(name));
    }
    return new Analysis(
        order,
        ImmutableSet.copyOf(outputs),
        boxMap.build(),
        definitionMap.build(),
        asserts.build(),
        ImmutableMap.copyOf(slidingWindows));
  }

  /** Checks that every call to a stage refers to a stage in the environment. */
  private void checkCalls() {
    stmt.accept(
        new Visitor() {
          @Override
          protected void visit(Ir.Call call) {
            if (call.callType == Ir.CallType.STAGE) {
              env.get(call.name);
            }
            super.visit(call);
          }
        });
  }

  private @Nullable FusedGroup groupOf(String name) {
    for (FusedGroup group : fusedGroups) {
      if (group.stages.contains(name)) {
        return group;
      }
    }
    return null;
  }

  /**
   * Returns the declared bound of a dimension of a stage: its known bound,
   * otherwise its hint, otherwise null.
   */
  private @Nullable Interval declared(String name, int i) {
    final Interval interval = knownBounds.get(name, i);
    if (interval != null) {
      return interval;
    }
    return env.get(name).hint(i);
  }

  /** Returns the region of a stage that its consumers read. */
  private Box required(Stage stage) {
    final ImmutableList<Integer> realizePath =
        Paths.find(stmt, s -> isRealize(s, stage.name));
    final List<Integer> path;
    final Ir.Stmt subtree;
    if (realizePath == null) {
      path = ImmutableList.of();
      subtree = stmt;
    } else {
      path = realizePath;
      subtree = ((Ir.Realize) Paths.get(stmt, realizePath)).body;
    }
    final Map<String, Ir.Expr> substitution = substitutionAt(path);
    final Scope scope = scopeAt(path, ImmutableMap.of(), substitution);
    Box need =
        RegionRequired.analyze(
                subtree, stage, scope, substitution, ROOT_CONSUMER)
            .total;

    if (stage.hasUpdates()) {
      need = need.union(updated(stage, need));
    }

    for (String name : order) {
      final Stage consumer = env.get(name);
      if (consumer.isExternal
          && consumer.externalInputs.contains(stage.name)
          && boxes.containsKey(name)) {
        need = need.union(externalRead(stage, consumer));
      }
    }
    return need;
  }

  /**
   * Returns the region that the update definitions of a stage write or read,
   * given that the stage's placeholders have their declared or required
   * values.
   */
  private Box updated(Stage stage, Box need) {
    final ImmutableList<Integer> producePath =
        Paths.find(stmt, s -> isProduce(s, stage.name));
    if (producePath == null) {
      return Box.empty(stage.dimensionCount());
    }
    final Map<String, Interval> bindings = new LinkedHashMap<>();
    for (int i = 0; i < stage.dimensionCount(); i++) {
      final Interval declared = declared(stage.name, i);
      final Interval interval = declared != null ? declared : need.get(i);
      final String dimension = stage.dimensions.get(i);
      for (Placeholder.Kind kind : Placeholder.Kind.values()) {
        final Interval value;
        if (interval.isBounded()) {
          value = Interval.point(endpoint(interval, kind));
        } else if (interval.isEmpty()) {
          value = Interval.EMPTY;
        } else {
          value = Interval.everything();
        }
        bindings.put(Placeholder.name(stage.name, dimension, kind), value);
      }
    }
    final Ir.ProducerConsumer produce =
        (Ir.ProducerConsumer) Paths.get(stmt, producePath);
    final Map<String, Ir.Expr> substitution = substitutionAt(producePath);
    return RegionRequired.provided(
        produce.body,
        stage,
        scopeAt(producePath, bindings, substitution),
        substitution);
  }

  private static Ir.Expr endpoint(Interval interval, Placeholder.Kind kind) {
    switch (kind) {
      case MIN:
        return requireNonNull(interval.min);
      case MAX:
        return requireNonNull(interval.max);
      case EXTENT:
        return interval.extent();
      default:
        throw new AssertionError(kind);
    }
  }

  /**
   * Returns the region of a stage that an external stage reads. An external
   * stage with the same number of dimensions is assumed to read the region
   * it computes; otherwise the region is the declared bounds of the stage.
   */
  private Box externalRead(Stage stage, Stage consumer) {
    if (consumer.dimensionCount() == stage.dimensionCount()) {
      return boxes.get(consumer.name);
    }
    final List<Interval> intervals = new ArrayList<>();
    for (int i = 0; i < stage.dimensionCount(); i++) {
      final Interval declared = declared(stage.name, i);
      if (declared == null) {
        throw BoundsException.unsatisfiable(
            stage.name,
            stage.dimensions.get(i),
            "it is read by external stage '"
                + consumer.name
                + "' and has no declared bounds");
      }
      intervals.add(declared);
    }
    return Box.of(stage.dimensionCount(), intervals);
  }

  /**
   * Returns the values of the placeholders of processed stages, except those
   * that a statement enclosing the given path re-binds.
   */
  private Map<String, Ir.Expr> substitutionAt(List<Integer> path) {
    final Map<String, Ir.Expr> map = new HashMap<>();
    definitions.values().forEach(map::putAll);
    for (Ir.Stmt ancestor : Paths.ancestors(stmt, path)) {
      final String name = ancestor.boundName();
      if (name != null) {
        map.remove(name);
      }
    }
    return map;
  }

  /**
   * Returns a scope for analyzing the statement at a path: the given
   * bindings, plus the variables defined by enclosing "let" statements.
   * Enclosing loops are not bound, so results may depend on their variables.
   */
  private Scope scopeAt(
      List<Integer> path,
      Map<String, Interval> bindings,
      Map<String, Ir.Expr> substitution) {
    Scope scope = Scope.empty().bindAll(bindings);
    for (Ir.Stmt ancestor : Paths.ancestors(stmt, path)) {
      if (ancestor instanceof Ir.LetStmt) {
        final Ir.LetStmt letStmt = (Ir.LetStmt) ancestor;
        final Ir.Expr value =
            Replacer.substitute(substitution, letStmt.value);
        scope = scope.bind(letStmt.name, Bounds.of(value, scope));
      }
    }
    return scope;
  }

  /** Applies declared bounds and checks to a required region. */
  private Box finalizeBox(Stage stage, Box need) {
    final List<Interval> intervals = new ArrayList<>();
    for (int i = 0; i < stage.dimensionCount(); i++) {
      final String dimension = stage.dimensions.get(i);
      final Interval interval = need.get(i);
      final Interval declared = declared(stage.name, i);
      Interval result = interval;
      if (stage.isExternal) {
        if (interval.isEmpty() || !interval.isBounded()) {
          if (declared == null) {
            throw BoundsException.unsatisfiable(
                stage.name,
                dimension,
                "external stage has no declared bounds");
          }
          result = declared;
        }
      } else if (declared != null) {
        checkCovers(stage.name, dimension, declared, interval);
        result = declared;
      }
      if (result.isEmpty()) {
        if (outputs.contains(stage.name)) {
          throw BoundsException.unsatisfiable(
              stage.name, dimension, "output has no bounds");
        }
        result = Interval.of(0, -1);
      }
      if (!result.isBounded()) {
        throw BoundsException.unsatisfiable(
            stage.name,
            dimension,
            "required region " + result + " is unbounded");
      }
      intervals.add(result);
    }
    return Box.of(stage.dimensionCount(), intervals);
  }

  /**
   * Checks that a declared bound contains the required region. Throws if it
   * provably does not; adds a run-time assertion if it cannot be decided.
   *
   * <p>A region that is unbounded, because an index depends on data, cannot
   * be checked; the declared bound is trusted.
   */
  private void checkCovers(
      String stage, String dimension, Interval declared, Interval need) {
    if (!need.isEmpty() && !need.isBounded()) {
      tracer.onWarning(
          "region of dimension '"
              + dimension
              + "' of stage '"
              + stage
              + "' depends on data; trusting declared bounds "
              + declared);
      return;
    }
    final Boolean covers = declared.covers(need);
    if (Boolean.TRUE.equals(covers)) {
      return;
    }
    if (Boolean.FALSE.equals(covers)) {
      throw BoundsException.boundsViolation(stage, dimension, declared, need);
    }
    if (!Prop.RUNTIME_ASSERTS.booleanValue(props)
        || target.has(Target.Feature.NO_ASSERTS)) {
      return;
    }
    final Ir.Expr condition =
        Simplifier.simplify(
            ir.and(
                ir.le(requireNonNull(declared.min), requireNonNull(need.min)),
                ir.le(requireNonNull(need.max), requireNonNull(declared.max))));
    asserts.put(
        stage,
        ir.assertStmt(
            condition,
            "bounds "
                + declared
                + " given for dimension '"
                + dimension
                + "' of stage '"
                + stage
                + "' do not contain required region "
                + need));
  }

  private void setBox(Stage stage, Box box) {
    boxes.put(stage.name, box);
    definitions.put(stage.name, definitions(stage, box));
  }

  /** Records the final box of a stage. */
  private void complete(Stage stage, Box box) {
    setBox(stage, box);
    tracer.onBox(stage.name, box);
    final Stage.SlidingWindow slidingWindow = stage.schedule.slidingWindow;
    if (slidingWindow != null) {
      slide(stage, slidingWindow);
    }
  }

  /**
   * Computes the values of the placeholders of a stage. The extent of the
   * innermost dimension of an intermediate stage is padded if the target
   * requires it.
   */
  private ImmutableMap<String, Ir.Expr> definitions(Stage stage, Box box) {
    final ImmutableMap.Builder<String, Ir.Expr> b = ImmutableMap.builder();
    final int vectorSize = vectorSize();
    for (int i = 0; i < stage.dimensionCount(); i++) {
      final Interval interval = box.get(i);
      final Ir.Expr min = requireNonNull(interval.min);
      Ir.Expr max = requireNonNull(interval.max);
      Ir.Expr extent = interval.extent();
      if (i == 0
          && vectorSize > 1
          && target.has(Target.Feature.PAD_EXTENTS)
          && !stage.isExternal
          && !outputs.contains(stage.name)) {
        final Ir.Expr vectors =
            ir.div(ir.add(extent, vectorSize - 1), vectorSize);
        extent = Simplifier.simplify(ir.mul(vectors, vectorSize));
        max = Simplifier.simplify(ir.sub(ir.add(min, extent), 1));
      }
      final String dimension = stage.dimensions.get(i);
      b.put(Placeholder.name(stage.name, dimension, Placeholder.Kind.MIN), min);
      b.put(Placeholder.name(stage.name, dimension, Placeholder.Kind.MAX), max);
      b.put(
          Placeholder.name(stage.name, dimension, Placeholder.Kind.EXTENT),
          clamp(extent));
    }
    return b.build();
  }

  private int vectorSize() {
    final Integer vectorSize = Prop.VECTOR_SIZE.intValueOpt(props);
    return vectorSize != null ? vectorSize : target.naturalVectorSize();
  }

  /** Wraps an extent in "max(extent, 0)" if it might be negative. */
  private Ir.Expr clamp(Ir.Expr extent) {
    if (!Prop.CLAMP_EXTENTS.booleanValue(props)
        || Simplifier.canProve(ir.ge(extent, ir.intLiteral(0)))) {
      return extent;
    }
    return Simplifier.simplify(ir.max(extent, ir.intLiteral(0)));
  }

  /**
   * Computes the incremental bounds of a stage that has a sliding-window
   * directive. Falls back to computing the full region on each iteration,
   * with a warning, if the directive cannot be applied.
   */
  private void slide(Stage stage, Stage.SlidingWindow slidingWindow) {
    final String warning = slideOrWarn(stage, slidingWindow);
    if (warning != null) {
      tracer.onWarning(
          "cannot apply "
              + slidingWindow
              + " to stage '"
              + stage.name
              + "': "
              + warning
              + "; computing full region on each iteration");
    }
  }

  /** Computes a sliding window, or returns the reason why it cannot. */
  private @Nullable String slideOrWarn(
      Stage stage, Stage.SlidingWindow slidingWindow) {
    if (!Prop.SLIDING_WINDOW.booleanValue(props)) {
      return "sliding windows are disabled";
    }
    final ImmutableList<Integer> realizePath =
        Paths.find(stmt, s -> isRealize(s, stage.name));
    final ImmutableList<Integer> producePath =
        Paths.find(stmt, s -> isProduce(s, stage.name));
    if (realizePath == null
        || producePath == null
        || !Paths.startsWith(producePath, realizePath)) {
      return "stage is not realized outside its producer";
    }
    List<Integer> forPath = null;
    for (int k = realizePath.size() + 1; k < producePath.size(); k++) {
      final Ir.Stmt s = Paths.get(stmt, producePath.subList(0, k));
      if (s instanceof Ir.For
          && ((Ir.For) s).name.equals(slidingWindow.loopVariable)) {
        forPath = producePath.subList(0, k);
        break;
      }
    }
    if (forPath == null) {
      return "loop '"
          + slidingWindow.loopVariable
          + "' does not enclose the producer inside the realization";
    }
    final Ir.For forLoop = (Ir.For) Paths.get(stmt, forPath);
    final ImmutableList<Integer> bodyPath =
        ImmutableList.<Integer>builder().addAll(forPath).add(0).build();
    final Map<String, Ir.Expr> substitution = substitutionAt(bodyPath);
    final Scope scope = scopeAt(bodyPath, ImmutableMap.of(), substitution);
    final int i = stage.dimensionIndex(slidingWindow.dimension);
    final Interval need =
        RegionRequired.analyze(
                forLoop.body, stage, scope, substitution, ROOT_CONSUMER)
            .total
            .get(i);
    if (!need.isBounded()) {
      return "region per iteration " + need + " is not bounded";
    }
    final Interval loopMin =
        Bounds.of(Replacer.substitute(substitution, forLoop.min), scope);
    if (!loopMin.isPoint()) {
      return "loop minimum " + forLoop.min + " is not fixed";
    }
    final Ir.Var loop = ir.var(forLoop.name);
    final Ir.Expr min = requireNonNull(need.min);
    final Ir.Expr max = requireNonNull(need.max);
    final Ir.Expr previousMin =
        Simplifier.simplify(
            Replacer.substitute(forLoop.name, ir.sub(loop, 1), min));
    final Ir.Expr previousMax =
        Simplifier.simplify(
            Replacer.substitute(forLoop.name, ir.sub(loop, 1), max));
    if (!Boolean.TRUE.equals(Simplifier.compareLe(previousMin, min))
        || !Boolean.TRUE.equals(Simplifier.compareLe(previousMax, max))) {
      return "region " + need + " is not monotonic in " + forLoop.name;
    }
    final Ir.Expr slidingMin =
        Simplifier.simplify(
            ir.select(
                ir.gt(loop, requireNonNull(loopMin.min)),
                ir.add(previousMax, 1),
                min));
    final String dimension = slidingWindow.dimension;
    final Ir.Expr extent =
        clamp(Simplifier.simplify(ir.add(ir.sub(max, slidingMin), 1)));
    slidingWindows.put(
        stage.name,
        new SlidingWindow(
            stage.name,
            bodyPath,
            ImmutableMap.of(
                Placeholder.name(stage.name, dimension, Placeholder.Kind.MIN),
                slidingMin,
                Placeholder.name(stage.name, dimension, Placeholder.Kind.MAX),
                max,
                Placeholder.name(
                    stage.name, dimension, Placeholder.Kind.EXTENT),
                extent)));
    return null;
  }

  static boolean isRealize(Ir.Stmt stmt, String name) {
    return stmt instanceof Ir.Realize && ((Ir.Realize) stmt).name.equals(name);
  }

  static boolean isProduce(Ir.Stmt stmt, String name) {
    return stmt instanceof Ir.ProducerConsumer
        && ((Ir.ProducerConsumer) stmt).isProducer
        && ((Ir.ProducerConsumer) stmt).name.equals(name);
  }

  /** Incremental definitions of the placeholders of a sliding window. */
  static class SlidingWindow {
    final String stage;
    /** Path of the body of the loop that the window slides along. */
    final ImmutableList<Integer> bodyPath;
    final ImmutableMap<String, Ir.Expr> definitions;

    SlidingWindow(
        String stage,
        ImmutableList<Integer> bodyPath,
        ImmutableMap<String, Ir.Expr> definitions) {
      this.stage = stage;
      this.bodyPath = bodyPath;
      this.definitions = definitions;
    }
  }

  /** Result of analysis: the box of every stage. */
  public static class Analysis {
    public final ImmutableList<String> order;
    public final ImmutableSet<String> outputs;
    /** Box of each stage, in realization order. */
    public final ImmutableMap<String, Box> boxes;
    /** Values of the placeholders of each stage. */
    public final ImmutableMap<String, ImmutableMap<String, Ir.Expr>>
        definitions;
    /** Run-time checks of declared bounds, by stage. */
    public final ImmutableListMultimap<String, Ir.AssertStmt> asserts;
    final ImmutableMap<String, SlidingWindow> slidingWindows;

    Analysis(
        ImmutableList<String> order,
        ImmutableSet<String> outputs,
        ImmutableMap<String, Box> boxes,
        ImmutableMap<String, ImmutableMap<String, Ir.Expr>> definitions,
        ImmutableListMultimap<String, Ir.AssertStmt> asserts,
        ImmutableMap<String, SlidingWindow> slidingWindows) {
      this.order = order;
      this.outputs = outputs;
      this.boxes = boxes;
      this.definitions = definitions;
      this.asserts = asserts;
      this.slidingWindows = slidingWindows;
    }

    /** Returns the box of a stage. */
    public Box box(String stage) {
      return requireNonNull(boxes.get(stage), stage);
    }

    /**
     * Returns the incremental definitions of the placeholders of a stage
     * with a sliding window, or an empty map.
     */
    public ImmutableMap<String, Ir.Expr> slidingDefinitions(String stage) {
      final SlidingWindow slidingWindow = slidingWindows.get(stage);
      return slidingWindow == null
          ? ImmutableMap.of()
          : slidingWindow.definitions;
    }
  }
}

// End BoundsInference.java
