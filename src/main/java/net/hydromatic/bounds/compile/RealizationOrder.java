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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Validates a realization order. */
public class RealizationOrder {
  private RealizationOrder() {}

  /**
   * Checks that a realization order is a valid topological order of the
   * stages that the outputs use.
   *
   * <p>Every name must be in the environment and appear once; every stage
   * that the outputs read, directly or indirectly, must appear, and no other;
   * and every stage must appear after the stages it reads. A stage may read
   * itself.
   *
   * @throws BoundsException of kind {@code INVALID_REALIZATION_ORDER} if the
   *     order is not valid, or {@code UNRESOLVED_REFERENCE} if it or a
   *     definition names a stage that is not in the environment
   */
  public static void validate(
      List<String> order, List<String> outputs, Environment env) {
    final Map<String, Integer> positions = new HashMap<>();
    for (String name : order) {
      env.get(name);
      if (positions.put(name, positions.size()) != null) {
        throw BoundsException.invalidOrder(
            "stage '" + name + "' occurs more than once in realization order",
            name);
      }
    }

    // Find the stages reachable from the outputs.
    final Set<String> reachable = new LinkedHashSet<>();
    final Deque<String> queue = new ArrayDeque<>();
    for (String output : outputs) {
      env.get(output);
      if (reachable.add(output)) {
        queue.add(output);
      }
    }
    while (!queue.isEmpty()) {
      final Stage stage = env.get(queue.remove());
      for (String name : stage.calledStages()) {
        env.get(name);
        if (reachable.add(name)) {
          queue.add(name);
        }
      }
    }

    for (String name : reachable) {
      if (!positions.containsKey(name)) {
        throw BoundsException.invalidOrder(
            "stage '" + name + "' is used but not in realization order", name);
      }
    }
    for (String name : order) {
      if (!reachable.contains(name)) {
        throw BoundsException.invalidOrder(
            "stage '" + name + "' is in realization order but is not used",
            name);
      }
    }

    for (String name : order) {
      final int position = positions.get(name);
      for (String producer : env.get(name).calledStages()) {
        if (!producer.equals(name) && positions.get(producer) > position) {
          throw BoundsException.invalidOrder(
              "stage '"
                  + name
                  + "' is realized before stage '"
                  + producer
                  + "', which it reads",
              name);
        }
      }
    }
  }
}

// End RealizationOrder.java
