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
package net.hydromatic.bounds.ir;

import com.google.common.collect.Sets;
import java.util.Set;

/** Sub-types of {@link IrNode}. */
public enum Op {
  // leaves
  INT_LITERAL,
  VAR,

  // arithmetic
  ADD(" + ", 6),
  SUB(" - ", 6),
  MUL(" * ", 7),
  /** Division, rounding towards negative infinity. */
  DIV(" / ", 7),
  /** Remainder of {@link #DIV}; never negative for a positive divisor. */
  MOD(" % ", 7),
  MIN("min"),
  MAX("max"),

  // comparisons
  EQ(" == ", 4),
  NE(" != ", 4),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),

  // logical
  AND(" && ", 2),
  OR(" || ", 1),
  NOT("!", 9),

  SELECT("select"),
  CALL,
  LET,

  // statements
  LET_STMT,
  FOR,
  PRODUCER_CONSUMER,
  REALIZE,
  PROVIDE,
  BLOCK,
  IF_THEN_ELSE,
  EVALUATE,
  ASSERT;

  /** Operators that combine two expressions; see {@link Ir.Binary}. */
  public static final Set<Op> BINARY =
      Sets.immutableEnumSet(
          ADD, SUB, MUL, DIV, MOD, MIN, MAX, EQ, NE, LT, LE, GT, GE, AND, OR);

  /** Padded name, e.g. " + ". Null for nodes that are not operators. */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  /** Creates a left-associative operator. */
  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }
}

// End Op.java
