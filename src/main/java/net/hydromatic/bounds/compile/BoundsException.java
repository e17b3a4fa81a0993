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

import net.hydromatic.bounds.interval.Interval;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An error that aborts bounds inference.
 *
 * <p>The pass never returns a partial program; every error is fatal for the
 * pipeline being compiled.
 */
public class BoundsException extends RuntimeException {
  private final Kind kind;
  private final @Nullable String stage;
  private final @Nullable String dimension;
  private final @Nullable String group;

  public BoundsException(
      Kind kind,
      String message,
      @Nullable String stage,
      @Nullable String dimension,
      @Nullable String group) {
    super(message);
    this.kind = requireNonNull(kind);
    this.stage = stage;
    this.dimension = dimension;
    this.group = group;
  }

  /** Creates an exception for a reference to a stage that is not defined. */
  static BoundsException unresolvedReference(String stage) {
    return new BoundsException(
        Kind.UNRESOLVED_REFERENCE,
        "stage '" + stage + "' is not in the environment",
        stage,
        null,
        null);
  }

  /** Creates an exception for a call with the wrong number of arguments. */
  static BoundsException wrongArgumentCount(
      String stage, int expected, int actual) {
    return new BoundsException(
        Kind.UNRESOLVED_REFERENCE,
        "call to stage '"
            + stage
            + "' has "
            + actual
            + " arguments; expected "
            + expected,
        stage,
        null,
        null);
  }

  /** Creates an exception for an invalid realization order. */
  static BoundsException invalidOrder(String message, @Nullable String stage) {
    return new BoundsException(
        Kind.INVALID_REALIZATION_ORDER, message, stage, null, null);
  }

  /** Creates an exception for a fused group that cannot be reconciled. */
  static BoundsException inconsistentGroup(
      String message,
      FusedGroup group,
      @Nullable String stage,
      @Nullable String dimension) {
    return new BoundsException(
        Kind.INCONSISTENT_FUSED_GROUP, message, stage, dimension, group.name());
  }

  /**
   * Creates an exception for a declared bound that does not contain the
   * region that consumers read.
   */
  static BoundsException boundsViolation(
      String stage, String dimension, Interval declared, Interval required) {
    return new BoundsException(
        Kind.BOUNDS_VIOLATION,
        "bounds "
            + declared
            + " given for dimension '"
            + dimension
            + "' of stage '"
            + stage
            + "' do not contain required region "
            + required,
        stage,
        dimension,
        null);
  }

  /** Creates an exception for a dimension that cannot be bounded. */
  static BoundsException unsatisfiable(
      String stage, String dimension, String reason) {
    return new BoundsException(
        Kind.UNSATISFIABLE_BOUND,
        "cannot bound dimension '"
            + dimension
            + "' of stage '"
            + stage
            + "': "
            + reason,
        stage,
        dimension,
        null);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the offending stage, or null. */
  public @Nullable String stage() {
    return stage;
  }

  /** Returns the offending dimension, or null. */
  public @Nullable String dimension() {
    return dimension;
  }

  /** Returns the name of the offending fused group, or null. */
  public @Nullable String group() {
    return group;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(kind).append(" Error: ").append(getMessage());
    if (stage != null || dimension != null || group != null) {
      String sep = " [";
      if (stage != null) {
        buf.append(sep).append("stage ").append(stage);
        sep = ", ";
      }
      if (dimension != null) {
        buf.append(sep).append("dimension ").append(dimension);
        sep = ", ";
      }
      if (group != null) {
        buf.append(sep).append("group ").append(group);
      }
      buf.append("]");
    }
    return buf;
  }

  /** Kind of error. */
  public enum Kind {
    /** A call refers to a stage that is not in the environment. */
    UNRESOLVED_REFERENCE,
    /** The realization order is not a valid topological order. */
    INVALID_REALIZATION_ORDER,
    /** The members of a fused group cannot be reconciled. */
    INCONSISTENT_FUSED_GROUP,
    /** A declared bound is smaller than the region consumers read. */
    BOUNDS_VIOLATION,
    /** A dimension has no finite bound and no declared bound. */
    UNSATISFIABLE_BOUND
  }
}

// End BoundsException.java
