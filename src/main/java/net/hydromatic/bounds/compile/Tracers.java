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
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.bounds.interval.Box;
import net.hydromatic.bounds.ir.Ir;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a finalized box, then
   * calls the underlying tracer.
   */
  public static Tracer withOnBox(
      Tracer tracer, BiConsumer<String, Box> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBox(String stage, Box box) {
        consumer.accept(stage, box);
        super.onBox(stage, box);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on injected definitions,
   * then calls the underlying tracer.
   */
  public static Tracer withOnInject(
      Tracer tracer,
      BiConsumer<String, ImmutableMap<String, Ir.Expr>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInject(
          String stage, ImmutableMap<String, Ir.Expr> definitions) {
        consumer.accept(stage, definitions);
        super.onInject(stage, definitions);
      }
    };
  }

  public static Tracer withOnWarning(Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onWarning(String message) {
        consumer.accept(message);
        super.onWarning(message);
      }
    };
  }

  public static Tracer withOnException(
      Tracer tracer, Consumer<BoundsException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onException(BoundsException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onBox(String stage, Box box) {}

    @Override
    public void onInject(
        String stage, ImmutableMap<String, Ir.Expr> definitions) {}

    @Override
    public void onWarning(String message) {}

    @Override
    public void onException(BoundsException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onBox(String stage, Box box) {
      tracer.onBox(stage, box);
    }

    @Override
    public void onInject(
        String stage, ImmutableMap<String, Ir.Expr> definitions) {
      tracer.onInject(stage, definitions);
    }

    @Override
    public void onWarning(String message) {
      tracer.onWarning(message);
    }

    @Override
    public void onException(BoundsException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
