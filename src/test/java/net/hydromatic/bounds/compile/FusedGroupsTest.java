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
import static net.hydromatic.bounds.ir.IrBuilder.ir;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link FusedGroups#validate}. */
public class FusedGroupsTest {
  /**
   * Environment: sources A, B and T (which has dimensions x and y); D
   * reads A; C reads all of them.
   */
  private static final Environment ENV =
      Environment.of(
          source("A", "x"),
          source("B", "x"),
          source("T", "x", "y"),
          Stage.builder("D", "x").pure(ir.stageCall("A", ir.var("x"))).build(),
          Stage.builder("C", "x")
              .pure(
                  ir.add(
                      ir.add(
                          ir.stageCall("A", ir.var("x")),
                          ir.stageCall("B", ir.var("x"))),
                      ir.add(
                          ir.stageCall("D", ir.var("x")),
                          ir.stageCall("T", ir.var("x"), ir.intLiteral(0)))))
              .build());

  private static final ImmutableList<String> ORDER =
      ImmutableList.of("A", "B", "D", "T", "C");

  private static FusedGroup group(String... stages) {
    return FusedGroup.of(ImmutableList.copyOf(stages), ImmutableList.of("x"));
  }

  private static BoundsException assertInvalid(
      List<FusedGroup> groups, String message) {
    final BoundsException e =
        assertThrows(
            BoundsException.class,
            () -> FusedGroups.validate(groups, ORDER, ENV));
    assertThat(e.kind(), is(BoundsException.Kind.INCONSISTENT_FUSED_GROUP));
    assertThat(e.getMessage(), is(message));
    return e;
  }

  @Test
  void testValid() {
    FusedGroups.validate(
        ImmutableList.of(group("A", "B"), group("D", "T")), ORDER, ENV);
    FusedGroups.validate(ImmutableList.of(group("B", "A")), ORDER, ENV);
  }

  @Test
  void testNotContiguous() {
    final BoundsException e =
        assertInvalid(
            ImmutableList.of(group("A", "T")),
            "members are not contiguous in the realization order");
    assertThat(e.group(), is("A+T"));
    assertThat(e.stage(), nullValue());
  }

  @Test
  void testMemberReadsMember() {
    final BoundsException e =
        assertInvalid(
            ImmutableList.of(group("B", "D", "A")),
            "member 'D' reads member 'A'");
    assertThat(e.stage(), is("D"));
  }

  @Test
  void testMissingSharedDimension() {
    final FusedGroup group =
        FusedGroup.of(ImmutableList.of("D", "T"), ImmutableList.of("y"));
    final BoundsException e =
        assertInvalid(
            ImmutableList.of(group),
            "member 'D' does not have shared dimension 'y'");
    assertThat(e.dimension(), is("y"));
  }

  @Test
  void testTwoGroups() {
    assertInvalid(
        ImmutableList.of(group("A", "B"), group("B")),
        "member 'B' is also in group A+B");
  }

  @Test
  void testNotInEnvironment() {
    assertInvalid(
        ImmutableList.of(group("A", "Z")),
        "member 'Z' is not in the environment");
  }

  @Test
  void testNotInOrder() {
    final Environment env =
        Environment.of(
            ImmutableList.<Stage>builder()
                .addAll(ENV.stages())
                .add(source("E", "x"))
                .build());
    final BoundsException e =
        assertThrows(
            BoundsException.class,
            () ->
                FusedGroups.validate(
                    ImmutableList.of(group("C", "E")), ORDER, env));
    assertThat(
        e.getMessage(), is("member 'E' is not in the realization order"));
  }

  @Test
  void testName() {
    assertThat(group("A", "B").name(), is("A+B"));
    assertThat(group("A", "B"), hasToString("fuse([A, B], [x])"));
  }
}

// End FusedGroupsTest.java
