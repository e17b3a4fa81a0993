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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.bounds.interval.Box;
import net.hydromatic.bounds.interval.Interval;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Validates and reconciles fused groups. */
public class FusedGroups {
  private FusedGroups() {}

  /**
   * Checks that fused groups are well-formed: members are in the environment
   * and the realization order, occupy a contiguous run of it, declare every
   * shared dimension, and do not read each other; and no stage is in more
   * than one group.
   */
  public static void validate(
      List<FusedGroup> groups, List<String> order, Environment env) {
    final Map<String, FusedGroup> groupOf = new HashMap<>();
    for (FusedGroup group : groups) {
      int first = -1;
      for (String name : group.stages) {
        if (!env.contains(name)) {
          throw BoundsException.inconsistentGroup(
              "member '" + name + "' is not in the environment",
              group,
              name,
              null);
        }
        final int position = order.indexOf(name);
        if (position < 0) {
          throw BoundsException.inconsistentGroup(
              "member '" + name + "' is not in the realization order",
              group,
              name,
              null);
        }
        if (first < 0 || position < first) {
          first = position;
        }
        final FusedGroup previous = groupOf.put(name, group);
        if (previous != null) {
          throw BoundsException.inconsistentGroup(
              "member '" + name + "' is also in group " + previous.name(),
              group,
              name,
              null);
        }
        final Stage stage = env.get(name);
        for (String dimension : group.sharedDimensions) {
          if (!stage.dimensions.contains(dimension)) {
            throw BoundsException.inconsistentGroup(
                "member '"
                    + name
                    + "' does not have shared dimension '"
                    + dimension
                    + "'",
                group,
                name,
                dimension);
          }
        }
        for (String called : stage.calledStages()) {
          if (!called.equals(name) && group.stages.contains(called)) {
            throw BoundsException.inconsistentGroup(
                "member '" + name + "' reads member '" + called + "'",
                group,
                name,
                null);
          }
        }
      }
      for (int i = first; i < first + group.stages.size(); i++) {
        if (i >= order.size() || !group.stages.contains(order.get(i))) {
          throw BoundsException.inconsistentGroup(
              "members are not contiguous in the realization order",
              group,
              null,
              null);
        }
      }
    }
  }

  /**
   * Makes the members of a group agree on each shared dimension.
   *
   * <p>The bound of a shared dimension is the union of the members'
   * requirements, unless a member has a declared bound for it. Declared
   * bounds of different members must be equal, and must contain the union.
   *
   * @param group Group
   * @param env Environment
   * @param boxes Box of each member, computed individually
   * @param required Region of each member that its consumers read
   * @param declared Declared bounds
   * @param checker Checks that a declared bound contains a requirement
   * @return Reconciled box of each member
   */
  static ImmutableMap<String, Box> reconcile(
      FusedGroup group,
      Environment env,
      Map<String, Box> boxes,
      Map<String, Box> required,
      DeclaredBounds declared,
      CoverageChecker checker) {
    final Map<String, Box> result = new LinkedHashMap<>();
    for (String name : group.stages) {
      result.put(name, boxes.get(name));
    }
    for (String dimension : group.sharedDimensions) {
      Interval union = Interval.EMPTY;
      String declaringStage = null;
      Interval override = null;
      for (String name : group.stages) {
        final int i = env.get(name).dimensionIndex(dimension);
        union = union.union(required.get(name).get(i));
        final Interval d = declared.get(name, i);
        if (d == null) {
          continue;
        }
        if (override == null) {
          override = d;
          declaringStage = name;
        } else if (!Boolean.TRUE.equals(override.covers(d))
            || !Boolean.TRUE.equals(d.covers(override))) {
          throw BoundsException.inconsistentGroup(
              "declared bounds "
                  + d
                  + " of member '"
                  + name
                  + "' differ from declared bounds "
                  + override
                  + " of member '"
                  + declaringStage
                  + "'",
              group,
              name,
              dimension);
        }
      }
      final Interval interval;
      if (override != null) {
        checker.check(declaringStage, dimension, override, union);
        interval = override;
      } else if (union.isEmpty()) {
        interval = Interval.of(0, -1);
      } else {
        interval = union;
      }
      for (String name : group.stages) {
        final int i = env.get(name).dimensionIndex(dimension);
        result.put(name, result.get(name).with(i, interval));
      }
    }
    return ImmutableMap.copyOf(result);
  }

  /** Source of declared bounds. */
  interface DeclaredBounds {
    @Nullable Interval get(String stage, int dimension);
  }

  /** Checks that a declared bound contains a required region. */
  interface CoverageChecker {
    void check(
        String stage, String dimension, Interval declared, Interval required);
  }
}

// End FusedGroups.java
