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
package net.hydromatic.bounds.interval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Binding of variable names to intervals, used when computing the bounds of
 * an expression.
 *
 * <p>Every scope is immutable; when you call {@link #bind}, a new scope is
 * created that inherits from the previous scope. The new scope may obscure
 * bindings in the old scope, but neither the new nor the old will ever
 * change.
 *
 * <p>To create an empty scope, call {@link #empty()}.
 */
public abstract class Scope {
  /** Returns the empty scope. */
  public static Scope empty() {
    return EmptyScope.INSTANCE;
  }

  /** Returns the interval of {@code name} if bound, null if not. */
  public abstract @Nullable Interval getOpt(String name);

  /** Visits bindings, most recent first, including obscured bindings. */
  abstract void visit(BiConsumer<String, Interval> consumer);

  /**
   * Creates a scope that is the same as this scope, plus one more variable.
   */
  public Scope bind(String name, Interval interval) {
    return new SubScope(this, name, interval);
  }

  /** Creates a scope that is the same as this scope, plus some variables. */
  public Scope bindAll(Map<String, Interval> bindings) {
    if (bindings.isEmpty()) {
      return this;
    }
    return new MapScope(this, ImmutableSortedMap.copyOf(bindings));
  }

  /** Returns the visible bindings, sorted by name. */
  public SortedMap<String, Interval> asMap() {
    final SortedMap<String, Interval> map = new TreeMap<>();
    visit(map::putIfAbsent);
    return map;
  }

  /**
   * Converts this scope to a string.
   *
   * <p>This method does not override {@link #toString()}, because debuggers
   * would call it automatically.
   */
  public String asString() {
    return asMap().toString();
  }

  /** Scope that binds nothing. */
  private static class EmptyScope extends Scope {
    static final EmptyScope INSTANCE = new EmptyScope();

    @Override
    public @Nullable Interval getOpt(String name) {
      return null;
    }

    @Override
    void visit(BiConsumer<String, Interval> consumer) {}
  }

  /** Scope that binds one variable and inherits from a parent scope. */
  private static class SubScope extends Scope {
    private final Scope parent;
    private final String name;
    private final Interval interval;

    SubScope(Scope parent, String name, Interval interval) {
      this.parent = requireNonNull(parent);
      this.name = requireNonNull(name);
      this.interval = requireNonNull(interval);
    }

    @Override
    public @Nullable Interval getOpt(String name) {
      return name.equals(this.name) ? interval : parent.getOpt(name);
    }

    @Override
    void visit(BiConsumer<String, Interval> consumer) {
      consumer.accept(name, interval);
      parent.visit(consumer);
    }
  }

  /** Scope that binds several variables and inherits from a parent scope. */
  private static class MapScope extends Scope {
    private final Scope parent;
    private final ImmutableSortedMap<String, Interval> map;

    MapScope(Scope parent, ImmutableSortedMap<String, Interval> map) {
      this.parent = requireNonNull(parent);
      this.map = requireNonNull(map);
    }

    @Override
    public @Nullable Interval getOpt(String name) {
      final Interval interval = map.get(name);
      return interval != null ? interval : parent.getOpt(name);
    }

    @Override
    void visit(BiConsumer<String, Interval> consumer) {
      map.forEach(consumer);
      parent.visit(consumer);
    }
  }
}

// End Scope.java
