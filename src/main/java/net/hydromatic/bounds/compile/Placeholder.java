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

import java.util.Locale;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reference to a bound of a dimension of a stage, such as "f.x.min".
 *
 * <p>Earlier passes write placeholders as free variables; this pass binds
 * them. A variable is a placeholder only if its stage is in the environment
 * and has the dimension.
 */
public class Placeholder {
  public final String stage;
  public final String dimension;
  public final Kind kind;

  private Placeholder(String stage, String dimension, Kind kind) {
    this.stage = requireNonNull(stage);
    this.dimension = requireNonNull(dimension);
    this.kind = requireNonNull(kind);
  }

  /** Creates a placeholder. */
  public static Placeholder of(String stage, String dimension, Kind kind) {
    return new Placeholder(stage, dimension, kind);
  }

  /** Returns the name of a placeholder, for example "f.x.min". */
  public static String name(String stage, String dimension, Kind kind) {
    return stage + "." + dimension + "." + kind.suffix;
  }

  /**
   * Parses a variable name as a placeholder. Returns null if the name does
   * not have the form "stage.dimension.kind", or if the stage is not in the
   * environment or does not have the dimension.
   */
  public static @Nullable Placeholder parse(String name, Environment env) {
    final int kindDot = name.lastIndexOf('.');
    if (kindDot <= 0) {
      return null;
    }
    final Kind kind = Kind.of(name.substring(kindDot + 1));
    if (kind == null) {
      return null;
    }
    final int dimDot = name.lastIndexOf('.', kindDot - 1);
    if (dimDot <= 0) {
      return null;
    }
    final String stageName = name.substring(0, dimDot);
    final String dimension = name.substring(dimDot + 1, kindDot);
    final Stage stage = env.getOpt(stageName);
    if (stage == null || !stage.dimensions.contains(dimension)) {
      return null;
    }
    return new Placeholder(stageName, dimension, kind);
  }

  /** Returns the name of this placeholder. */
  public String name() {
    return name(stage, dimension, kind);
  }

  @Override
  public int hashCode() {
    return Objects.hash(stage, dimension, kind);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Placeholder
            && stage.equals(((Placeholder) o).stage)
            && dimension.equals(((Placeholder) o).dimension)
            && kind == ((Placeholder) o).kind;
  }

  @Override
  public String toString() {
    return name();
  }

  /** Which bound a placeholder refers to. */
  public enum Kind {
    MIN,
    MAX,
    EXTENT;

    /** Suffix of the placeholder name, for example "min". */
    public final String suffix = name().toLowerCase(Locale.ROOT);

    static @Nullable Kind of(String suffix) {
      for (Kind kind : values()) {
        if (kind.suffix.equals(suffix)) {
          return kind;
        }
      }
      return null;
    }
  }
}

// End Placeholder.java
