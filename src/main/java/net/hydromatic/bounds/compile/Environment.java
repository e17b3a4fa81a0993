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

import com.google.common.collect.ImmutableSortedMap;
import java.util.Arrays;
import java.util.Collection;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Read-only mapping from stage name to {@link Stage}.
 *
 * <p>Built by an earlier phase; the pass never modifies it.
 */
public class Environment {
  private final ImmutableSortedMap<String, Stage> stages;

  private Environment(ImmutableSortedMap<String, Stage> stages) {
    this.stages = requireNonNull(stages);
  }

  /** Creates an environment containing the given stages. */
  public static Environment of(Stage... stages) {
    return of(Arrays.asList(stages));
  }

  /** Creates an environment containing the given stages. */
  public static Environment of(Iterable<Stage> stages) {
    final ImmutableSortedMap.Builder<String, Stage> b =
        ImmutableSortedMap.naturalOrder();
    for (Stage stage : stages) {
      b.put(stage.name, stage);
    }
    return new Environment(b.build());
  }

  @Override
  public String toString() {
    return stages.keySet().toString();
  }

  /** Returns the stage with a given name, or null if there is none. */
  public @Nullable Stage getOpt(String name) {
    return stages.get(name);
  }

  /**
   * Returns the stage with a given name. Throws {@link BoundsException} of
   * kind {@link BoundsException.Kind#UNRESOLVED_REFERENCE} if there is none.
   */
  public Stage get(String name) {
    final Stage stage = stages.get(name);
    if (stage == null) {
      throw BoundsException.unresolvedReference(name);
    }
    return stage;
  }

  public boolean contains(String name) {
    return stages.containsKey(name);
  }

  /** Returns the stages, sorted by name. */
  public Collection<Stage> stages() {
    return stages.values();
  }
}

// End Environment.java
