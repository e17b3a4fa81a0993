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

import static net.hydromatic.bounds.compile.Pipeline.loop;
import static net.hydromatic.bounds.compile.Pipeline.pipeline;
import static net.hydromatic.bounds.compile.Pipeline.produceSource;
import static net.hydromatic.bounds.compile.Pipeline.realize;
import static net.hydromatic.bounds.compile.Pipeline.source;
import static net.hydromatic.bounds.compile.Pipeline.stencil;
import static net.hydromatic.bounds.compile.Pipeline.stencilPipeline;
import static net.hydromatic.bounds.ir.IrBuilder.ir;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.bounds.interval.Interval;
import net.hydromatic.bounds.ir.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link BoundsInference}. */
public class BoundsInferenceTest {
  private static final String STENCIL_PROGRAM =
      "let P.x.min = -1\n"
          + "let P.x.extent = 102\n"
          + "realize P([P.x.min, P.x.extent]) {\n"
          + "  produce P {\n"
          + "    for (P.x, P.x.min, P.x.extent) {\n"
          + "      P(P.x) = in(P.x)\n"
          + "    }\n"
          + "  }\n"
          + "  consume P {\n"
          + "    let C.x.min = 0\n"
          + "    let C.x.extent = 100\n"
          + "    produce C {\n"
          + "      for (C.x, C.x.min, C.x.extent) {\n"
          + "        C(C.x) = P(C.x - 1) + P(C.x + 1)\n"
          + "      }\n"
          + "    }\n"
          + "  }\n"
          + "}";

  /** A single output stage gets exactly the bounds that were given. */
  @Test
  void testSingleStage() {
    final String expected =
        "let C.x.min = 5\n"
            + "let C.x.extent = 16\n"
            + "produce C {\n"
            + "  for (C.x, C.x.min, C.x.extent) {\n"
            + "    C(C.x) = in(C.x)\n"
            + "  }\n"
            + "}";
    pipeline(produceSource("C", "x"), source("C", "x"))
        .withBounds("C", 5, 20)
        .assertBox("C", "{[5, 20]}")
        .assertProgram(expected);
  }

  /** "C(x) = P(x - 1) + P(x + 1)" over [0, 99] needs P over [-1, 100]. */
  @Test
  void testStencil() {
    stencilPipeline()
        .assertBox("C", "{[0, 99]}")
        .assertBox("P", "{[-1, 100]}")
        .assertProgram(STENCIL_PROGRAM);
  }

  /** Widening the bounds of the output does not narrow its producer. */
  @Test
  void testMonotonic() {
    stencilPipeline().withBounds("C", 0, 199).assertBox("P", "{[-1, 200]}");
    stencilPipeline().withBounds("C", -50, 99).assertBox("P", "{[-51, 100]}");
  }

  /**
   * "C(x) = P(x / k)", where k is a parameter of the pipeline. The sign of k
   * is unknown, so P's region covers both a positive and a negative divisor.
   */
  @Test
  void testDivideByParameter() {
    final Ir.Var k = ir.var("k");
    final Ir.Var x = ir.var("C.x");
    final Ir.Stmt program =
        realize(
            "P",
            "x",
            ir.block(
                produceSource("P", "x"),
                ir.consume(
                    "P",
                    ir.produce(
                        "C",
                        loop(
                            "C",
                            "x",
                            ir.provide(
                                "C", ir.stageCall("P", ir.div(x, k)), x))))));
    final Stage c =
        Stage.builder("C", "x")
            .pure(ir.stageCall("P", ir.div(ir.var("x"), k)))
            .build();
    pipeline(program, source("P", "x"), c)
        .withBounds("C", 0, 99)
        .assertBox("C", "{[0, 99]}")
        .assertBox("P", "{[min(99 / k, 0), max(99 / k, 0)]}");
  }

  /** Running the pass on its own output returns the same object. */
  @Test
  void testIdempotent() {
    final Pipeline pipeline = stencilPipeline();
    final Ir.Stmt program = pipeline.run();
    assertThat(program, hasToString(STENCIL_PROGRAM));
    final Ir.Stmt program2 = pipeline.withProgram(program).run();
    assertThat(program2, sameInstance(program));
  }

  /** A program without placeholders is returned unchanged. */
  @Test
  void testNoPlaceholders() {
    final Ir.Stmt program =
        ir.produce(
            "C",
            ir.forLoop(
                "x",
                ir.intLiteral(0),
                ir.intLiteral(10),
                ir.provide("C", ir.imageCall("in", ir.var("x")), ir.var("x"))));
    final Ir.Stmt program2 =
        pipeline(program, source("C", "x")).withBounds("C", 0, 9).run();
    assertThat(program2, sameInstance(program));
  }

  /** Three stages in a chain; each box depends on the one after it. */
  @Test
  void testChain() {
    final Ir.Var bx = ir.var("B.x");
    final Ir.Var cx = ir.var("C.x");
    final Ir.Stmt program =
        realize(
            "A",
            "x",
            ir.block(
                produceSource("A", "x"),
                ir.consume(
                    "A",
                    realize(
                        "B",
                        "x",
                        ir.block(
                            ir.produce(
                                "B",
                                loop(
                                    "B",
                                    "x",
                                    ir.provide(
                                        "B",
                                        ir.stageCall("A", ir.mul(bx, 2)),
                                        bx))),
                            ir.consume(
                                "B",
                                ir.produce(
                                    "C",
                                    loop(
                                        "C",
                                        "x",
                                        ir.provide(
                                            "C",
                                            ir.add(
                                                ir.stageCall("B", cx),
                                                ir.stageCall(
                                                    "B", ir.add(cx, 3))),
                                            cx)))))))));
    final Ir.Var x = ir.var("x");
    final Stage a = source("A", "x");
    final Stage b =
        Stage.builder("B", "x").pure(ir.stageCall("A", ir.mul(x, 2))).build();
    final Stage c =
        Stage.builder("C", "x")
            .pure(
                ir.add(ir.stageCall("B", x), ir.stageCall("B", ir.add(x, 3))))
            .build();
    pipeline(program, a, b, c)
        .withBounds("C", 0, 9)
        .assertBox("C", "{[0, 9]}")
        .assertBox("B", "{[0, 12]}")
        .assertBox("A", "{[0, 24]}");
  }

  /** Bounds given for a producer replace the region that it must compute. */
  @Test
  void testKnownBoundsOverride() {
    stencilPipeline()
        .withKnownBounds(
            KnownBounds.builder()
                .put("C", 0, 0, 99)
                .put("P", 0, -10, 200)
                .build())
        .assertBox("P", "{[-10, 200]}");
  }

  /** A hint is used if there are no known bounds, and must be big enough. */
  @Test
  void testHint() {
    final Ir.Var x = ir.var("x");
    final Stage p =
        Stage.builder("P", "x")
            .pure(ir.imageCall("in", x))
            .hint("x", ir.intLiteral(-5), ir.intLiteral(200))
            .build();
    final Stage c =
        Stage.builder("C", "x")
            .pure(
                ir.add(
                    ir.stageCall("P", ir.sub(x, 1)),
                    ir.stageCall("P", ir.add(x, 1))))
            .build();
    final Pipeline pipeline =
        pipeline(stencil(), p, c).withBounds("C", 0, 99);
    pipeline.assertBox("P", "{[-5, 194]}");

    // Known bounds take precedence over the hint.
    pipeline
        .withKnownBounds(
            KnownBounds.builder()
                .put("C", 0, 0, 99)
                .put("P", 0, -10, 110)
                .build())
        .assertBox("P", "{[-10, 110]}");
  }

  /** Bounds that do not contain the required region are an error. */
  @Test
  void testBoundsViolation() {
    final Pipeline pipeline =
        stencilPipeline()
            .withKnownBounds(
                KnownBounds.builder()
                    .put("C", 0, 0, 99)
                    .put("P", 0, 0, 50)
                    .build());
    pipeline.assertError(
        BoundsException.Kind.BOUNDS_VIOLATION,
        "bounds [0, 50] given for dimension 'x' of stage 'P' "
            + "do not contain required region [-1, 100]");
    final BoundsException e =
        assertThrows(BoundsException.class, pipeline::run);
    assertThat(e.stage(), is("P"));
    assertThat(e.dimension(), is("x"));
    assertThat(
        e,
        hasToString(
            "BOUNDS_VIOLATION Error: bounds [0, 50] given for dimension 'x' "
                + "of stage 'P' do not contain required region [-1, 100] "
                + "[stage P, dimension x]"));
  }

  /**
   * If it cannot be decided whether bounds contain the required region, the
   * program checks at run time.
   */
  @Test
  void testRuntimeAssert() {
    final KnownBounds knownBounds =
        KnownBounds.builder()
            .put(
                "C",
                0,
                Interval.of(ir.intLiteral(0), ir.sub(ir.var("n"), 1)))
            .put("P", 0, -1, 100)
            .build();
    final Pipeline pipeline =
        stencilPipeline().withKnownBounds(knownBounds);
    final String assertion =
        "assert(max(n, 0) <= 100, \"bounds [-1, 100] given for dimension 'x' "
            + "of stage 'P' do not contain required region [-1, max(n, 0)]\")";
    final BoundsInference.Analysis analysis = pipeline.analyze();
    assertThat(analysis.asserts.get("P"), hasToString("[" + assertion + "]"));
    assertThat(analysis.asserts.get("C"), empty());
    assertThat(
        analysis.definitions.get("C"),
        hasToString("{C.x.min=0, C.x.max=n - 1, C.x.extent=max(n, 0)}"));
    assertThat(
        pipeline.run(),
        hasToString(
            containsString(
                "let P.x.extent = 102\n"
                    + assertion
                    + "\n"
                    + "realize P([P.x.min, P.x.extent]) {\n")));

    // No assertions if they are disabled, or the target does not want them
    assertThat(
        pipeline.withProp(Prop.RUNTIME_ASSERTS, false).analyze().asserts.size(),
        is(0));
    assertThat(
        pipeline.withTarget("x86-64-linux-no_asserts").analyze().asserts.size(),
        is(0));
  }

  /** Extents that cannot be proven non-negative are clamped, if enabled. */
  @Test
  void testClampExtents() {
    final KnownBounds knownBounds =
        KnownBounds.builder()
            .put("C", 0, Interval.of(ir.var("a"), ir.var("b")))
            .put(
                "P",
                0,
                Interval.of(ir.sub(ir.var("a"), 1), ir.add(ir.var("b"), 1)))
            .build();
    final Pipeline pipeline =
        stencilPipeline().withKnownBounds(knownBounds);
    assertThat(
        pipeline.analyze().definitions.get("C"),
        hasToString("{C.x.min=a, C.x.max=b, C.x.extent=max(b - a + 1, 0)}"));
    assertThat(
        pipeline
            .withProp(Prop.CLAMP_EXTENTS, false)
            .analyze()
            .definitions
            .get("C"),
        hasToString("{C.x.min=a, C.x.max=b, C.x.extent=b - a + 1}"));
  }

  /** Extents of intermediate stages are rounded up to the vector size. */
  @Test
  void testPadExtents() {
    final Pipeline pipeline =
        stencilPipeline().withTarget("x86-64-linux-avx2-pad_extents");
    final BoundsInference.Analysis analysis = pipeline.analyze();
    assertThat(
        analysis.definitions.get("P"),
        hasToString("{P.x.min=-1, P.x.max=102, P.x.extent=104}"));
    // Outputs are not padded
    assertThat(
        analysis.definitions.get("C"),
        hasToString("{C.x.min=0, C.x.max=99, C.x.extent=100}"));
    // The box is not affected by padding
    assertThat(analysis.box("P"), hasToString("{[-1, 100]}"));

    assertThat(
        pipeline
            .withProp(Prop.VECTOR_SIZE, 16)
            .analyze()
            .definitions
            .get("P"),
        hasToString("{P.x.min=-1, P.x.max=110, P.x.extent=112}"));

    // Without the "pad_extents" feature, the vector size has no effect
    assertThat(
        stencilPipeline()
            .withTarget("x86-64-linux-avx2")
            .analyze()
            .definitions
            .get("P"),
        hasToString("{P.x.min=-1, P.x.max=100, P.x.extent=102}"));
  }

  /** A stage that no consumer reads gets an empty region. */
  @Test
  void testUnusedStage() {
    final Ir.Var cx = ir.var("C.x");
    final Ir.Stmt program =
        realize(
            "P",
            "x",
            ir.block(
                produceSource("P", "x"),
                ir.consume(
                    "P",
                    ir.produce(
                        "C",
                        loop(
                            "C",
                            "x",
                            ir.provide("C", ir.intLiteral(0), cx))))));
    final Stage c =
        Stage.builder("C", "x").pure(ir.stageCall("P", ir.var("x"))).build();
    final BoundsInference.Analysis analysis =
        pipeline(program, source("P", "x"), c)
            .withBounds("C", 0, 9)
            .analyze();
    assertThat(analysis.box("P"), hasToString("{[0, -1]}"));
    assertThat(
        analysis.definitions.get("P"),
        hasToString("{P.x.min=0, P.x.max=-1, P.x.extent=0}"));
  }

  /** The region of a stage with updates includes what the updates touch. */
  @Test
  void testUpdate() {
    final Ir.Var hx = ir.var("H.x");
    final Ir.Var hr = ir.var("H.r");
    final Ir.Var cx = ir.var("C.x");
    final Ir.Stmt program =
        realize(
            "H",
            "x",
            ir.block(
                ir.produce(
                    "H",
                    ir.block(
                        loop("H", "x", ir.provide("H", ir.intLiteral(0), hx)),
                        ir.forLoop(
                            "H.r",
                            ir.intLiteral(0),
                            ir.intLiteral(10),
                            ir.provide(
                                "H", ir.add(ir.stageCall("H", hr), 1), hr)))),
                ir.consume(
                    "H",
                    ir.produce(
                        "C",
                        loop(
                            "C",
                            "x",
                            ir.provide("C", ir.stageCall("H", cx), cx))))));
    final Ir.Var r = ir.var("r");
    final Stage h =
        Stage.builder("H", "x")
            .pure(ir.intLiteral(0))
            .update(
                ImmutableList.of(r),
                ImmutableList.of(ir.add(ir.stageCall("H", r), 1)),
                ImmutableList.of(
                    new Stage.ReductionVariable(
                        "r", ir.intLiteral(0), ir.intLiteral(10))))
            .build();
    final Stage c =
        Stage.builder("C", "x").pure(ir.stageCall("H", ir.var("x"))).build();
    pipeline(program, h, c)
        .withBounds("C", 0, 4)
        .assertBox("C", "{[0, 4]}")
        .assertBox("H", "{[0, 9]}");
  }

  /** Members of a fused group get the same bounds in shared dimensions. */
  @Test
  void testFusedGroup() {
    final Ir.Var ax = ir.var("A.x");
    final Ir.Var bx = ir.var("B.x");
    final Ir.Var cx = ir.var("C.x");
    final Ir.Stmt program =
        realize(
            "A",
            "x",
            realize(
                "B",
                "x",
                ir.block(
                    produceSource("A", "x"),
                    ir.produce(
                        "B",
                        loop(
                            "B",
                            "x",
                            ir.provide(
                                "B", ir.mul(ir.imageCall("in", bx), 2), bx))),
                    ir.produce(
                        "C",
                        loop(
                            "C",
                            "x",
                            ir.provide(
                                "C",
                                ir.add(
                                    ir.stageCall("A", cx),
                                    ir.stageCall("B", ir.add(cx, 2))),
                                cx))))));
    final Ir.Var x = ir.var("x");
    final Stage c =
        Stage.builder("C", "x")
            .pure(
                ir.add(ir.stageCall("A", x), ir.stageCall("B", ir.add(x, 2))))
            .build();
    final Pipeline pipeline =
        pipeline(program, source("A", "x"), source("B", "x"), c)
            .withBounds("C", 0, 9)
            .withGroup(ImmutableList.of("A", "B"), ImmutableList.of("x"));
    pipeline.assertBox("A", "{[0, 11]}").assertBox("B", "{[0, 11]}");

    // Without the group, each stage has its own bounds
    pipeline(program, source("A", "x"), source("B", "x"), c)
        .withBounds("C", 0, 9)
        .assertBox("A", "{[0, 9]}")
        .assertBox("B", "{[2, 11]}");

    // Bounds declared for one member apply to the whole group
    pipeline
        .withKnownBounds(
            KnownBounds.builder()
                .put("C", 0, 0, 9)
                .put("A", 0, 0, 20)
                .build())
        .assertBox("A", "{[0, 20]}")
        .assertBox("B", "{[0, 20]}");

    // Members with different bounds cannot be reconciled
    final Pipeline pipeline2 =
        pipeline.withKnownBounds(
            KnownBounds.builder()
                .put("C", 0, 0, 9)
                .put("A", 0, 0, 20)
                .put("B", 0, 0, 30)
                .build());
    pipeline2.assertError(
        BoundsException.Kind.INCONSISTENT_FUSED_GROUP,
        "declared bounds [0, 30] of member 'B' differ from "
            + "declared bounds [0, 20] of member 'A'");
    final BoundsException e =
        assertThrows(BoundsException.class, pipeline2::run);
    assertThat(e.group(), is("A+B"));
    assertThat(e.dimension(), is("x"));
  }

  /** An external stage reads the region of its input that it computes. */
  @Test
  void testExternal() {
    final Ir.Var cx = ir.var("C.x");
    final Ir.Stmt program =
        realize(
            "P",
            "x",
            ir.block(
                produceSource("P", "x"),
                ir.consume(
                    "P",
                    realize(
                        "E",
                        "x",
                        ir.block(
                            ir.produce(
                                "E",
                                ir.evaluate(
                                    ir.call(
                                        "e_impl",
                                        Ir.CallType.EXTERN,
                                        ImmutableList.of(
                                            ir.var("E.x.min"),
                                            ir.var("E.x.extent"))))),
                            ir.consume(
                                "E",
                                ir.produce(
                                    "C",
                                    loop(
                                        "C",
                                        "x",
                                        ir.provide(
                                            "C",
                                            ir.add(ir.stageCall("E", cx), 1),
                                            cx)))))))));
    final Stage e = Stage.builder("E", "x").external("P").build();
    final Stage c =
        Stage.builder("C", "x")
            .pure(ir.add(ir.stageCall("E", ir.var("x")), 1))
            .build();
    pipeline(program, source("P", "x"), e, c)
        .withBounds("C", 0, 9)
        .assertBox("E", "{[0, 9]}")
        .assertBox("P", "{[0, 9]}");
  }

  /**
   * An external stage whose input has a different number of dimensions
   * needs declared bounds for that input.
   */
  @Test
  void testExternalDimensionMismatch() {
    final Ir.Var cx = ir.var("C.x");
    final Ir.Stmt program =
        realize(
            "P",
            "x",
            ir.block(
                produceSource("P", "x"),
                ir.consume(
                    "P",
                    ir.realize(
                        "E",
                        ImmutableList.of(
                            ir.range(ir.var("E.x.min"), ir.var("E.x.extent")),
                            ir.range(ir.var("E.y.min"), ir.var("E.y.extent"))),
                        ir.block(
                            ir.produce(
                                "E",
                                ir.evaluate(
                                    ir.call(
                                        "e_impl",
                                        Ir.CallType.EXTERN,
                                        ImmutableList.of(
                                            ir.var("E.x.min"),
                                            ir.var("E.y.min"))))),
                            ir.consume(
                                "E",
                                ir.produce(
                                    "C",
                                    loop(
                                        "C",
                                        "x",
                                        ir.provide(
                                            "C",
                                            ir.stageCall(
                                                "E", cx, ir.intLiteral(0)),
                                            cx)))))))));
    final Stage e = Stage.builder("E", "x", "y").external("P").build();
    final Stage c =
        Stage.builder("C", "x")
            .pure(ir.stageCall("E", ir.var("x"), ir.intLiteral(0)))
            .build();
    final Pipeline pipeline =
        pipeline(program, source("P", "x"), e, c).withBounds("C", 0, 9);
    pipeline.assertError(
        BoundsException.Kind.UNSATISFIABLE_BOUND,
        "cannot bound dimension 'x' of stage 'P': "
            + "it is read by external stage 'E' and has no declared bounds");
    pipeline
        .withKnownBounds(
            KnownBounds.builder().put("C", 0, 0, 9).put("P", 0, 0, 63).build())
        .assertBox("E", "{[0, 9], [0, 0]}")
        .assertBox("P", "{[0, 63]}");
  }

  /** A call with the wrong number of arguments is an error. */
  @Test
  void testWrongArgumentCount() {
    final Ir.Stmt program = ir.evaluate(ir.stageCall("E", ir.intLiteral(0)));
    final Stage e = Stage.builder("E", "x", "y").external("P").build();
    final Stage c =
        Stage.builder("C", "x")
            .pure(ir.stageCall("E", ir.var("x"), ir.intLiteral(0)))
            .build();
    pipeline(program, source("P", "x"), e, c)
        .withBounds("C", 0, 9)
        .assertError(
            BoundsException.Kind.UNRESOLVED_REFERENCE,
            "call to stage 'E' has 1 arguments; expected 2");
  }

  /** An output must have bounds. */
  @Test
  void testOutputWithoutBounds() {
    stencilPipeline()
        .withKnownBounds(KnownBounds.empty())
        .assertError(
            BoundsException.Kind.UNSATISFIABLE_BOUND,
            "cannot bound dimension 'x' of stage 'C': output has no bounds");
  }

  /**
   * A region that depends on data is unbounded; it is an error unless there
   * are declared bounds, which are trusted.
   */
  @Test
  void testDataDependent() {
    final Ir.Var cx = ir.var("C.x");
    final Ir.Stmt program =
        realize(
            "P",
            "x",
            ir.block(
                produceSource("P", "x"),
                ir.consume(
                    "P",
                    ir.produce(
                        "C",
                        loop(
                            "C",
                            "x",
                            ir.provide(
                                "C",
                                ir.stageCall("P", ir.imageCall("lut", cx)),
                                cx))))));
    final Stage c =
        Stage.builder("C", "x")
            .pure(ir.stageCall("P", ir.imageCall("lut", ir.var("x"))))
            .build();
    final Pipeline pipeline =
        pipeline(program, source("P", "x"), c).withBounds("C", 0, 9);
    pipeline.assertError(
        BoundsException.Kind.UNSATISFIABLE_BOUND,
        "cannot bound dimension 'x' of stage 'P': "
            + "required region [-inf, +inf] is unbounded");

    final List<String> warnings = new ArrayList<>();
    pipeline
        .withKnownBounds(
            KnownBounds.builder().put("C", 0, 0, 9).put("P", 0, 0, 255).build())
        .withTracer(Tracers.withOnWarning(Tracers.empty(), warnings::add))
        .assertBox("P", "{[0, 255]}");
    assertThat(warnings, hasSize(1));
    assertThat(
        warnings.get(0),
        is(
            "region of dimension 'x' of stage 'P' depends on data; "
                + "trusting declared bounds [0, 255]"));
  }

  /** A realization order that is not topological is an error. */
  @Test
  void testInvalidOrder() {
    stencilPipeline()
        .withOrder("C", "P")
        .assertError(
            BoundsException.Kind.INVALID_REALIZATION_ORDER,
            "stage 'C' is realized before stage 'P', which it reads");
  }

  /** A call to a stage that is not in the environment is an error. */
  @Test
  void testUnresolvedReference() {
    final Ir.Stmt program =
        ir.block(stencil(), ir.evaluate(ir.stageCall("Q", ir.intLiteral(0))));
    stencilPipeline()
        .withProgram(program)
        .assertError(
            BoundsException.Kind.UNRESOLVED_REFERENCE,
            "stage 'Q' is not in the environment");
  }

  /** The tracer sees each box as it is finalized, and each error. */
  @Test
  void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer =
        Tracers.withOnBox(
            tracer, (stage, box) -> events.add(stage + " " + box));
    tracer =
        Tracers.withOnInject(
            tracer,
            (stage, definitions) -> events.add(stage + " " + definitions));
    tracer =
        Tracers.withOnException(tracer, e -> events.add(e.kind().toString()));
    stencilPipeline().withTracer(tracer).run();
    assertThat(
        events,
        hasToString(
            "[C {[0, 99]}, P {[-1, 100]}, "
                + "P {P.x.min=-1, P.x.extent=102}, "
                + "C {C.x.min=0, C.x.extent=100}]"));

    events.clear();
    final Tracer tracer2 = tracer;
    assertThrows(
        BoundsException.class,
        () -> stencilPipeline().withOrder("C", "P").withTracer(tracer2).run());
    assertThat(events, hasToString("[INVALID_REALIZATION_ORDER]"));
  }
}

// End BoundsInferenceTest.java
