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

import com.google.common.collect.ImmutableTable;
import net.hydromatic.bounds.interval.Interval;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Bounds that are fixed before the pass runs, keyed by stage name and
 * dimension index.
 *
 * <p>Used for the outputs of a pipeline, whose bounds come from the caller,
 * and for bounds that the user declares. A known bound replaces the bound the
 * pass would infer, and must contain it.
 */
public class KnownBounds {
  private static final KnownBounds EMPTY = new KnownBounds(ImmutableTable.of());

  private final ImmutableTable<String, Integer, Interval> table;

  private KnownBounds(ImmutableTable<String, Integer, Interval> table) {
    this.table = requireNonNull(table);
  }

  /** Returns an empty set of known bounds. */
  public static KnownBounds empty() {
    return EMPTY;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return table.toString();
  }

  /** Returns the known bound of a dimension of a stage, or null. */
  public @Nullable Interval get(String stage, int dimension) {
    return table.get(stage, dimension);
  }

  /** Returns whether any dimension of a stage has a known bound. */
  public boolean containsStage(String stage) {
    return table.containsRow(stage);
  }

  /** Builder for {@link KnownBounds}. */
  public static class Builder {
    private final ImmutableTable.Builder<String, Integer, Interval> b =
        ImmutableTable.builder();

    /** Adds a bound. */
    public Builder put(String stage, int dimension, Interval interval) {
      b.put(stage, dimension, interval);
      return this;
    }

    /** Adds a bound with integer endpoints. */
    public Builder put(String stage, int dimension, long min, long max) {
      return put(stage, dimension, Interval.of(min, max));
    }

    public KnownBounds build() {
      return new KnownBounds(b.build());
    }
  }
}

// End KnownBounds.java
