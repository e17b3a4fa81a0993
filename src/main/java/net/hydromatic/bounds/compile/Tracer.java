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
import net.hydromatic.bounds.interval.Box;
import net.hydromatic.bounds.ir.Ir;

/** Called on various events during bounds inference. */
public interface Tracer {
  /** Called when the box of a stage is finalized. */
  void onBox(String stage, Box box);

  /**
   * Called when definitions of placeholders of a stage are injected into the
   * program.
   */
  void onInject(String stage, ImmutableMap<String, Ir.Expr> definitions);

  /**
   * Called when the pass falls back to a less efficient strategy, for
   * example when a sliding window cannot be applied.
   */
  void onWarning(String message);

  /** Called with an exception before the pass throws it. */
  void onException(BoundsException e);
}

// End Tracer.java
