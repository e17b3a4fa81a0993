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

import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Description of the machine that the pipeline will run on.
 *
 * <p>The pass uses the target only to decide how to round extents. A target
 * is written "arch-bits-os" followed by zero or more features, for example
 * "x86-64-linux-avx2", "arm-64-android" or "hexagon-32-noos-hvx_128".
 */
public class Target {
  /** The default target, "x86-64-linux". */
  public static final Target DEFAULT = parse("x86-64-linux");

  public final Arch arch;
  public final int bits;
  public final OperatingSystem os;
  private final Set<Feature> features;

  private Target(
      Arch arch, int bits, OperatingSystem os, Set<Feature> features) {
    this.arch = requireNonNull(arch);
    this.bits = bits;
    this.os = requireNonNull(os);
    this.features = Sets.immutableEnumSet(features);
  }

  /**
   * Parses a target string. Throws {@link IllegalArgumentException} if the
   * string is not valid.
   */
  public static Target parse(String s) {
    final List<String> parts = ImmutableList.copyOf(s.split("-"));
    if (parts.size() < 3) {
      throw new IllegalArgumentException(
          "invalid target '" + s + "'; expected arch-bits-os[-feature]*");
    }
    final Arch arch = parseEnum(Arch.class, parts.get(0), s);
    final int bits;
    switch (parts.get(1)) {
      case "32":
        bits = 32;
        break;
      case "64":
        bits = 64;
        break;
      default:
        throw new IllegalArgumentException(
            "invalid bits '" + parts.get(1) + "' in target '" + s + "'");
    }
    final OperatingSystem os =
        parseEnum(OperatingSystem.class, parts.get(2), s);
    final Set<Feature> features = EnumSet.noneOf(Feature.class);
    for (String part : parts.subList(3, parts.size())) {
      features.add(parseEnum(Feature.class, part, s));
    }
    return new Target(arch, bits, os, features);
  }

  private static <E extends Enum<E>> E parseEnum(
      Class<E> enumClass, String name, String target) {
    final Optional<E> optional =
        Enums.getIfPresent(enumClass, name.toUpperCase(Locale.ROOT));
    if (!optional.isPresent()) {
      throw new IllegalArgumentException(
          "unknown "
              + enumClass.getSimpleName()
              + " '"
              + name
              + "' in target '"
              + target
              + "'");
    }
    return optional.get();
  }

  /** Returns whether this target has a feature. */
  public boolean has(Feature feature) {
    return features.contains(feature);
  }

  /**
   * Returns the number of 32-bit values that fit in a vector register of
   * this target; 1 if it has no vector unit that the pass knows of.
   */
  public int naturalVectorSize() {
    if (has(Feature.HVX_128)) {
      return 32;
    }
    if (has(Feature.HVX_64) || has(Feature.AVX512)) {
      return 16;
    }
    if (has(Feature.AVX2)) {
      return 8;
    }
    if (has(Feature.AVX) || has(Feature.SSE41)) {
      return 4;
    }
    if (arch == Arch.ARM) {
      return 4;
    }
    return 1;
  }

  @Override
  public int hashCode() {
    return Objects.hash(arch, bits, os, features);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Target
            && arch == ((Target) o).arch
            && bits == ((Target) o).bits
            && os == ((Target) o).os
            && features.equals(((Target) o).features);
  }

  @Override
  public String toString() {
    final StringBuilder b =
        new StringBuilder()
            .append(arch.name().toLowerCase(Locale.ROOT))
            .append('-')
            .append(bits)
            .append('-')
            .append(os.name().toLowerCase(Locale.ROOT));
    for (Feature feature : features) {
      b.append('-').append(feature.name().toLowerCase(Locale.ROOT));
    }
    return b.toString();
  }

  /** Processor architecture. */
  public enum Arch {
    X86,
    ARM,
    HEXAGON,
    POWERPC,
    RISCV,
    WASM
  }

  /** Operating system. */
  public enum OperatingSystem {
    LINUX,
    OSX,
    WINDOWS,
    ANDROID,
    IOS,
    NOOS
  }

  /** Optional feature of a target. */
  public enum Feature {
    SSE41,
    AVX,
    AVX2,
    AVX512,
    HVX_64,
    HVX_128,
    /** Round extents up to a multiple of the natural vector size. */
    PAD_EXTENTS,
    /** Do not check bounds at run time. */
    NO_ASSERTS
  }
}

// End Target.java
