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

import static net.hydromatic.bounds.compile.Pipeline.source;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import org.junit.jupiter.api.Test;

/** Tests for {@link Placeholder}. */
public class PlaceholderTest {
  private static final Environment ENV =
      Environment.of(source("f", "x", "y"), source("g.h", "x"));

  @Test
  void testParse() {
    final Placeholder p = Placeholder.parse("f.y.extent", ENV);
    assertThat(p, is(Placeholder.of("f", "y", Placeholder.Kind.EXTENT)));
    assertThat(p, hasToString("f.y.extent"));

    // The stage name may contain dots.
    final Placeholder p2 = Placeholder.parse("g.h.x.min", ENV);
    assertThat(p2, is(Placeholder.of("g.h", "x", Placeholder.Kind.MIN)));
  }

  @Test
  void testNotPlaceholder() {
    assertThat(Placeholder.parse("x", ENV), nullValue());
    assertThat(Placeholder.parse("f.x", ENV), nullValue());
    assertThat(Placeholder.parse(".x.min", ENV), nullValue());
    // Unknown suffix, dimension, stage
    assertThat(Placeholder.parse("f.x.stride", ENV), nullValue());
    assertThat(Placeholder.parse("f.z.min", ENV), nullValue());
    assertThat(Placeholder.parse("k.x.max", ENV), nullValue());
    assertThat(Placeholder.parse("h.x.max", ENV), nullValue());
  }

  @Test
  void testName() {
    assertThat(
        Placeholder.name("f", "x", Placeholder.Kind.MAX), is("f.x.max"));
    assertThat(Placeholder.Kind.EXTENT.suffix, is("extent"));
  }
}

// End PlaceholderTest.java
