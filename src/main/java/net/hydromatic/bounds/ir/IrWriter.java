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

import java.util.List;

/** Context for writing a program out as a string. */
public class IrWriter {
  private final StringBuilder b = new StringBuilder();
  private int indent;

  /** Appends a string to the output. */
  public IrWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node. */
  public IrWriter append(IrNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a comma-separated list of expressions. */
  public IrWriter appendAll(List<? extends IrNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      append(nodes.get(i), 0, 0);
    }
    return this;
  }

  /** Appends a call to an infix operator. */
  public IrWriter infix(int left, IrNode a0, Op op, IrNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call written in function style, e.g. "min(a, b)". */
  public IrWriter function(String name, List<? extends IrNode> args) {
    return append(name).append("(").appendAll(args).append(")");
  }

  /** Starts a new line at the current indentation. */
  public IrWriter newline() {
    b.append('\n');
    for (int i = 0; i < indent; i++) {
      b.append("  ");
    }
    return this;
  }

  /**
   * Appends "{", a nested statement on indented lines, and "}" on a line of
   * its own.
   */
  public IrWriter block(Ir.Stmt body) {
    append(" {");
    ++indent;
    newline();
    append(body, 0, 0);
    --indent;
    return newline().append("}");
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End IrWriter.java
