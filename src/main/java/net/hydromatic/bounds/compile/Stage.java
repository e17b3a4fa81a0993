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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.bounds.interval.Interval;
import net.hydromatic.bounds.ir.Ir;
import net.hydromatic.bounds.ir.IrBuilder;
import net.hydromatic.bounds.ir.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Named computation of a pipeline.
 *
 * <p>A stage has a fixed list of dimensions, a pure definition, and zero or
 * more update definitions. An external stage has no definition that the pass
 * can see; it lists the stages it reads.
 *
 * <p>The pass uses definitions only to find which stages each stage reads;
 * the regions it reads are computed from the lowered program.
 */
public class Stage {
  public final String name;
  public final ImmutableList<String> dimensions;
  public final @Nullable Definition pure;
  public final ImmutableList<Definition> updates;
  /** Bound hints, keyed by dimension index. */
  public final ImmutableSortedMap<Integer, Ir.Range> hints;
  public final boolean isExternal;
  public final ImmutableList<String> externalInputs;
  public final Schedule schedule;

  private Stage(
      String name,
      ImmutableList<String> dimensions,
      @Nullable Definition pure,
      ImmutableList<Definition> updates,
      ImmutableSortedMap<Integer, Ir.Range> hints,
      boolean isExternal,
      ImmutableList<String> externalInputs,
      Schedule schedule) {
    this.name = requireNonNull(name);
    this.dimensions = requireNonNull(dimensions);
    this.pure = pure;
    this.updates = requireNonNull(updates);
    this.hints = requireNonNull(hints);
    this.isExternal = isExternal;
    this.externalInputs = requireNonNull(externalInputs);
    this.schedule = requireNonNull(schedule);
    checkArgument(!name.isEmpty(), "empty name");
    checkArgument(
        ImmutableSortedSet.copyOf(dimensions).size() == dimensions.size(),
        "duplicate dimension in %s",
        dimensions);
    checkArgument(
        isExternal == (pure == null),
        "stage %s must have a definition if and only if it is not external",
        name);
    checkArgument(
        updates.isEmpty() || pure != null,
        "stage %s has updates but no pure definition",
        name);
  }

  /** Creates a builder for a stage. */
  public static Builder builder(String name, String... dimensions) {
    return new Builder(name, ImmutableList.copyOf(dimensions));
  }

  @Override
  public String toString() {
    return name + dimensions;
  }

  /** Returns the number of dimensions. */
  public int dimensionCount() {
    return dimensions.size();
  }

  /** Returns the index of a dimension, or -1 if not found. */
  public int dimensionIndex(String dimension) {
    return dimensions.indexOf(dimension);
  }

  /** Returns whether this stage has update definitions. */
  public boolean hasUpdates() {
    return !updates.isEmpty();
  }

  /**
   * Returns the declared bound of a dimension, as an interval, or null if
   * there is no hint.
   */
  public @Nullable Interval hint(int i) {
    final Ir.Range range = hints.get(i);
    if (range == null) {
      return null;
    }
    return Interval.of(range.min, range.max());
  }

  /**
   * Returns the names of the stages that this stage reads, sorted. Includes
   * this stage if an update definition reads it. For an external stage,
   * returns its declared inputs.
   */
  public SortedSet<String> calledStages() {
    final SortedSet<String> names = new TreeSet<>();
    if (isExternal) {
      names.addAll(externalInputs);
      return names;
    }
    final Visitor visitor =
        new Visitor() {
          @Override
          protected void visit(Ir.Call call) {
            if (call.callType == Ir.CallType.STAGE) {
              names.add(call.name);
            }
            super.visit(call);
          }
        };
    requireNonNull(pure).visitAll(visitor);
    updates.forEach(update -> update.visitAll(visitor));
    return names;
  }

  /**
   * Definition of a stage, "f(args) = values".
   *
   * <p>In a pure definition, the arguments are the stage's dimension
   * variables. In an update definition, the arguments are arbitrary index
   * expressions, and may use the variables of a reduction domain.
   */
  public static class Definition {
    public final ImmutableList<Ir.Expr> args;
    public final ImmutableList<Ir.Expr> values;
    public final ImmutableList<ReductionVariable> reductionDomain;

    Definition(
        ImmutableList<Ir.Expr> args,
        ImmutableList<Ir.Expr> values,
        ImmutableList<ReductionVariable> reductionDomain) {
      this.args = requireNonNull(args);
      this.values = requireNonNull(values);
      this.reductionDomain = requireNonNull(reductionDomain);
      checkArgument(!values.isEmpty(), "no values");
    }

    void visitAll(Visitor visitor) {
      args.forEach(arg -> arg.accept(visitor));
      values.forEach(value -> value.accept(visitor));
      for (ReductionVariable v : reductionDomain) {
        v.min.accept(visitor);
        v.extent.accept(visitor);
      }
    }
  }

  /**
   * Variable of a reduction domain, ranging over
   * {@code [min, min + extent)}.
   */
  public static class ReductionVariable {
    public final String name;
    public final Ir.Expr min;
    public final Ir.Expr extent;

    public ReductionVariable(String name, Ir.Expr min, Ir.Expr extent) {
      this.name = requireNonNull(name);
      this.min = requireNonNull(min);
      this.extent = requireNonNull(extent);
    }

    @Override
    public String toString() {
      return name + " in [" + min + ", " + extent + "]";
    }
  }

  /** Scheduling directives that affect bounds. */
  public static class Schedule {
    static final Schedule DEFAULT = new Schedule(null);

    public final @Nullable SlidingWindow slidingWindow;

    private Schedule(@Nullable SlidingWindow slidingWindow) {
      this.slidingWindow = slidingWindow;
    }
  }

  /**
   * Directive that a stage, whose storage is hoisted outside a loop, computes
   * on each iteration of that loop only the part of a dimension that the
   * previous iterations have not computed.
   */
  public static class SlidingWindow {
    public final String dimension;
    public final String loopVariable;

    SlidingWindow(String dimension, String loopVariable) {
      this.dimension = requireNonNull(dimension);
      this.loopVariable = requireNonNull(loopVariable);
    }

    @Override
    public String toString() {
      return "slidingWindow(" + dimension + ", " + loopVariable + ")";
    }
  }

  /** Builder for {@link Stage}. */
  public static class Builder {
    private final String name;
    private final ImmutableList<String> dimensions;
    private @Nullable Definition pure;
    private final List<Definition> updates = new ArrayList<>();
    private final Map<Integer, Ir.Range> hints = new HashMap<>();
    private boolean isExternal;
    private final List<String> externalInputs = new ArrayList<>();
    private Schedule schedule = Schedule.DEFAULT;

    Builder(String name, ImmutableList<String> dimensions) {
      this.name = name;
      this.dimensions = dimensions;
    }

    /**
     * Sets the pure definition; its arguments are the dimension variables.
     */
    public Builder pure(Ir.Expr... values) {
      final ImmutableList.Builder<Ir.Expr> args = ImmutableList.builder();
      dimensions.forEach(d -> args.add(IrBuilder.ir.var(d)));
      pure =
          new Definition(
              args.build(), ImmutableList.copyOf(values), ImmutableList.of());
      return this;
    }

    /** Adds an update definition. */
    public Builder update(
        List<Ir.Expr> args,
        List<Ir.Expr> values,
        List<ReductionVariable> reductionDomain) {
      checkArgument(
          args.size() == dimensions.size(),
          "update of %s has %s arguments",
          name,
          args.size());
      updates.add(
          new Definition(
              ImmutableList.copyOf(args),
              ImmutableList.copyOf(values),
              ImmutableList.copyOf(reductionDomain)));
      return this;
    }

    /** Declares the bounds of a dimension. */
    public Builder hint(String dimension, Ir.Expr min, Ir.Expr extent) {
      final int i = dimensions.indexOf(dimension);
      checkArgument(i >= 0, "unknown dimension %s", dimension);
      hints.put(i, IrBuilder.ir.range(min, extent));
      return this;
    }

    /** Declares the stage to be external, reading the given stages. */
    public Builder external(String... inputs) {
      isExternal = true;
      externalInputs.addAll(ImmutableList.copyOf(inputs));
      return this;
    }

    /** Sets the sliding-window directive. */
    public Builder slidingWindow(String dimension, String loopVariable) {
      checkArgument(
          dimensions.contains(dimension), "unknown dimension %s", dimension);
      schedule = new Schedule(new SlidingWindow(dimension, loopVariable));
      return this;
    }

    public Stage build() {
      return new Stage(
          name,
          dimensions,
          pure,
          ImmutableList.copyOf(updates),
          ImmutableSortedMap.copyOf(hints),
          isExternal,
          ImmutableList.copyOf(externalInputs),
          schedule);
    }
  }
}

// End Stage.java
