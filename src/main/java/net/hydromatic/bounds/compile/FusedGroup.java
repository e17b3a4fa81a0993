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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Stages that are computed in a single loop nest.
 *
 * <p>The members must occupy a contiguous run of the realization order, and
 * for each shared dimension their bounds must be identical.
 */
public class FusedGroup {
  public final ImmutableList<String> stages;
  public final ImmutableList<String> sharedDimensions;

  private FusedGroup(
      ImmutableList<String> stages, ImmutableList<String> sharedDimensions) {
    this.stages = stages;
    this.sharedDimensions = sharedDimensions;
    checkArgument(!stages.isEmpty(), "empty group");
  }

  /** Creates a fused group. */
  public static FusedGroup of(List<String> stages, List<String> dimensions) {
    return new FusedGroup(
        ImmutableList.copyOf(stages), ImmutableList.copyOf(dimensions));
  }

  /** Returns the name of this group, used in messages. */
  public String name() {
    return String.join("+", stages);
  }

  @Override
  public String toString() {
    return "fuse(" + stages + ", " + sharedDimensions + ")";
  }
}

// End FusedGroup.java
