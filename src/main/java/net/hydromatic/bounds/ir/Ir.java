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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Nodes of a partially lowered loop-nest program.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Expressions extend {@link Expr}, statements extend {@link Stmt}. All
 * nodes are immutable; expressions compare by value.
 *
 * <p>Create nodes using {@link IrBuilder#ir}.
 */
public class Ir {
  private Ir() {}

  /** Base class of expressions. */
  public abstract static class Expr extends IrNode {
    Expr(Op op) {
      super(op);
    }

    @Override
    public abstract Expr accept(Shuttle shuttle);

    /** Returns whether this expression is an integer literal. */
    public boolean isConstant() {
      return op == Op.INT_LITERAL;
    }

    /**
     * Returns the value of this expression, which must be an integer literal.
     */
    public long constantValue() {
      return ((IntLiteral) this).value;
    }
  }

  /** Integer literal. */
  public static class IntLiteral extends Expr {
    public final long value;

    IntLiteral(long value) {
      super(Op.INT_LITERAL);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IntLiteral && ((IntLiteral) o).value == value;
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(Long.toString(value));
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Reference to a variable.
   *
   * <p>A variable is a loop variable, a let-bound variable, a parameter of the
   * pipeline, or a placeholder for a bound such as "f.x.min".
   */
  public static class Var extends Expr {
    public final String name;

    Var(String name) {
      super(Op.VAR);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && ((Var) o).name.equals(name);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a binary operator, such as "a + b" or "min(a, b)". */
  public static class Binary extends Expr {
    public final Expr a;
    public final Expr b;

    Binary(Op op, Expr a, Expr b) {
      super(op);
      this.a = requireNonNull(a);
      this.b = requireNonNull(b);
      checkArgument(Op.BINARY.contains(op), "not binary: %s", op);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a, b);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
              && ((Binary) o).op == op
              && ((Binary) o).a.equals(a)
              && ((Binary) o).b.equals(b);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      if (op == Op.MIN || op == Op.MAX) {
        return w.function(op.padded, ImmutableList.of(a, b));
      }
      return w.infix(left, a, op, b, right);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Binary} with given arguments, or {@code
     * this} if the arguments are the same.
     */
    public Binary copy(Expr a, Expr b) {
      return a == this.a && b == this.b ? this : new Binary(op, a, b);
    }
  }

  /** Logical negation. */
  public static class Not extends Expr {
    public final Expr a;

    Not(Expr a) {
      super(Op.NOT);
      this.a = requireNonNull(a);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a);
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Not && ((Not) o).a.equals(a);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(op.padded).append(a, op.right, right);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Not copy(Expr a) {
      return a == this.a ? this : new Not(a);
    }
  }

  /** Conditional expression, "select(condition, trueValue, falseValue)". */
  public static class Select extends Expr {
    public final Expr condition;
    public final Expr trueValue;
    public final Expr falseValue;

    Select(Expr condition, Expr trueValue, Expr falseValue) {
      super(Op.SELECT);
      this.condition = requireNonNull(condition);
      this.trueValue = requireNonNull(trueValue);
      this.falseValue = requireNonNull(falseValue);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, trueValue, falseValue);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Select
              && ((Select) o).condition.equals(condition)
              && ((Select) o).trueValue.equals(trueValue)
              && ((Select) o).falseValue.equals(falseValue);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.function(
          op.padded, ImmutableList.of(condition, trueValue, falseValue));
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Select copy(Expr condition, Expr trueValue, Expr falseValue) {
      return condition == this.condition
              && trueValue == this.trueValue
              && falseValue == this.falseValue
          ? this
          : new Select(condition, trueValue, falseValue);
    }
  }

  /** What a {@link Call} refers to. */
  public enum CallType {
    /** Read of a stage of the pipeline. */
    STAGE,
    /** Read of an input image. */
    IMAGE,
    /** Pure external function, such as "sqrt". */
    EXTERN
  }

  /** Call to a stage, image or external function. */
  public static class Call extends Expr {
    public final String name;
    public final ImmutableList<Expr> args;
    public final CallType callType;

    Call(String name, ImmutableList<Expr> args, CallType callType) {
      super(Op.CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
      this.callType = requireNonNull(callType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args, callType);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Call
              && ((Call) o).name.equals(name)
              && ((Call) o).args.equals(args)
              && ((Call) o).callType == callType;
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.function(name, args);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Returns whether this is a read of stage {@code stageName}. */
    public boolean isCallTo(String stageName) {
      return callType == CallType.STAGE && name.equals(stageName);
    }

    public Call copy(List<Expr> args) {
      return args.equals(this.args)
          ? this
          : new Call(name, ImmutableList.copyOf(args), callType);
    }
  }

  /** Expression with a local binding, "let name = value in body". */
  public static class Let extends Expr {
    public final String name;
    public final Expr value;
    public final Expr body;

    Let(String name, Expr value, Expr body) {
      super(Op.LET);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Let
              && ((Let) o).name.equals(name)
              && ((Let) o).value.equals(value)
              && ((Let) o).body.equals(body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("(let ")
          .append(name)
          .append(" = ")
          .append(value, 0, 0)
          .append(" in ")
          .append(body, 0, 0)
          .append(")");
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Let copy(Expr value, Expr body) {
      return value == this.value && body == this.body
          ? this
          : new Let(name, value, body);
    }
  }

  /**
   * Base class of statements.
   *
   * <p>Every statement exposes its direct sub-statements via {@link
   * #children()} and the expressions it holds directly via {@link #exprs()}.
   * Passes that need to know where they are in the program address a
   * statement by the list of child indexes that leads to it from the root.
   */
  public abstract static class Stmt extends IrNode {
    Stmt(Op op) {
      super(op);
    }

    @Override
    public abstract Stmt accept(Shuttle shuttle);

    /** Returns the direct sub-statements of this statement. */
    public abstract List<Stmt> children();

    /**
     * Returns a copy of this statement with the given sub-statements, or
     * {@code this} if they are the same objects as the current ones.
     */
    public abstract Stmt withChildren(List<Stmt> children);

    /** Returns the expressions held directly by this statement. */
    public abstract List<Expr> exprs();

    /**
     * Returns the name of the variable this statement binds for its body, or
     * null.
     */
    public @Nullable String boundName() {
      return null;
    }

    static boolean same(List<Stmt> list0, List<Stmt> list1) {
      if (list0.size() != list1.size()) {
        return false;
      }
      for (int i = 0; i < list0.size(); i++) {
        if (list0.get(i) != list1.get(i)) {
          return false;
        }
      }
      return true;
    }
  }

  /** Statement with a local binding, "let name = value" then a body. */
  public static class LetStmt extends Stmt {
    public final String name;
    public final Expr value;
    public final Stmt body;

    LetStmt(String name, Expr value, Stmt body) {
      super(Op.LET_STMT);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
      this.body = requireNonNull(body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("let ")
          .append(name)
          .append(" = ")
          .append(value, 0, 0)
          .newline()
          .append(body, 0, 0);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Stmt> children() {
      return ImmutableList.of(body);
    }

    @Override
    public Stmt withChildren(List<Stmt> children) {
      checkArgument(children.size() == 1);
      return copy(value, children.get(0));
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value);
    }

    @Override
    public String boundName() {
      return name;
    }

    public LetStmt copy(Expr value, Stmt body) {
      return value == this.value && body == this.body
          ? this
          : new LetStmt(name, value, body);
    }
  }

  /** How the iterations of a {@link For} loop are executed. */
  public enum ForType {
    SERIAL,
    PARALLEL,
    VECTORIZED,
    UNROLLED;

    /** Returns the keyword that starts a loop of this type. */
    String keyword() {
      return this == SERIAL ? "for" : name().toLowerCase(Locale.ROOT);
    }
  }

  /**
   * Loop, "for (name, min, extent) { body }".
   *
   * <p>The loop variable takes the values {@code min} to {@code min + extent -
   * 1} inclusive.
   */
  public static class For extends Stmt {
    public final String name;
    public final Expr min;
    public final Expr extent;
    public final ForType forType;
    public final Stmt body;

    For(String name, Expr min, Expr extent, ForType forType, Stmt body) {
      super(Op.FOR);
      this.name = requireNonNull(name);
      this.min = requireNonNull(min);
      this.extent = requireNonNull(extent);
      this.forType = requireNonNull(forType);
      this.body = requireNonNull(body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(forType.keyword())
          .append(" (")
          .append(name)
          .append(", ")
          .append(min, 0, 0)
          .append(", ")
          .append(extent, 0, 0)
          .append(")")
          .block(body);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Stmt> children() {
      return ImmutableList.of(body);
    }

    @Override
    public Stmt withChildren(List<Stmt> children) {
      checkArgument(children.size() == 1);
      return copy(min, extent, children.get(0));
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(min, extent);
    }

    @Override
    public String boundName() {
      return name;
    }

    public For copy(Expr min, Expr extent, Stmt body) {
      return min == this.min && extent == this.extent && body == this.body
          ? this
          : new For(name, min, extent, forType, body);
    }
  }

  /**
   * Marker for the region of a program that computes a stage ("produce f") or
   * that uses its values ("consume f").
   */
  public static class ProducerConsumer extends Stmt {
    public final String name;
    public final boolean isProducer;
    public final Stmt body;

    ProducerConsumer(String name, boolean isProducer, Stmt body) {
      super(Op.PRODUCER_CONSUMER);
      this.name = requireNonNull(name);
      this.isProducer = isProducer;
      this.body = requireNonNull(body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(isProducer ? "produce " : "consume ")
          .append(name)
          .block(body);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Stmt> children() {
      return ImmutableList.of(body);
    }

    @Override
    public Stmt withChildren(List<Stmt> children) {
      checkArgument(children.size() == 1);
      return copy(children.get(0));
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of();
    }

    public ProducerConsumer copy(Stmt body) {
      return body == this.body
          ? this
          : new ProducerConsumer(name, isProducer, body);
    }
  }

  /** Half-open range of a dimension, given by its minimum and extent. */
  public static class Range {
    public final Expr min;
    public final Expr extent;

    Range(Expr min, Expr extent) {
      this.min = requireNonNull(min);
      this.extent = requireNonNull(extent);
    }

    @Override
    public int hashCode() {
      return Objects.hash(min, extent);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Range
              && ((Range) o).min.equals(min)
              && ((Range) o).extent.equals(extent);
    }

    @Override
    public String toString() {
      return "[" + min + ", " + extent + "]";
    }

    /** Returns the largest value in this range, {@code min + extent - 1}. */
    public Expr max() {
      return IrBuilder.ir.sub(
          IrBuilder.ir.add(min, extent), IrBuilder.ir.intLiteral(1));
    }

    public Range copy(Expr min, Expr extent) {
      return min == this.min && extent == this.extent
          ? this
          : new Range(min, extent);
    }
  }

  /** Allocation of storage for a stage over a region. */
  public static class Realize extends Stmt {
    public final String name;
    public final ImmutableList<Range> bounds;
    public final Stmt body;

    Realize(String name, ImmutableList<Range> bounds, Stmt body) {
      super(Op.REALIZE);
      this.name = requireNonNull(name);
      this.bounds = requireNonNull(bounds);
      this.body = requireNonNull(body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.append("realize ").append(name).append("(");
      for (int i = 0; i < bounds.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.append(bounds.get(i).toString());
      }
      return w.append(")").block(body);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Stmt> children() {
      return ImmutableList.of(body);
    }

    @Override
    public Stmt withChildren(List<Stmt> children) {
      checkArgument(children.size() == 1);
      return copy(bounds, children.get(0));
    }

    @Override
    public List<Expr> exprs() {
      final ImmutableList.Builder<Expr> b = ImmutableList.builder();
      for (Range range : bounds) {
        b.add(range.min, range.extent);
      }
      return b.build();
    }

    public Realize copy(List<Range> bounds, Stmt body) {
      return bounds.equals(this.bounds) && body == this.body
          ? this
          : new Realize(name, ImmutableList.copyOf(bounds), body);
    }
  }

  /** Store of values into a stage at a site, "f(args) = value". */
  public static class Provide extends Stmt {
    public final String name;
    public final ImmutableList<Expr> values;
    public final ImmutableList<Expr> args;

    Provide(String name, ImmutableList<Expr> values, ImmutableList<Expr> args) {
      super(Op.PROVIDE);
      this.name = requireNonNull(name);
      this.values = requireNonNull(values);
      this.args = requireNonNull(args);
      checkArgument(!values.isEmpty(), "no values");
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.function(name, args).append(" = ");
      if (values.size() == 1) {
        return w.append(values.get(0), 0, 0);
      }
      return w.append("{").appendAll(values).append("}");
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Stmt> children() {
      return ImmutableList.of();
    }

    @Override
    public Stmt withChildren(List<Stmt> children) {
      checkArgument(children.isEmpty());
      return this;
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.<Expr>builder().addAll(values).addAll(args).build();
    }

    public Provide copy(List<Expr> values, List<Expr> args) {
      return values.equals(this.values) && args.equals(this.args)
          ? this
          : new Provide(
              name, ImmutableList.copyOf(values), ImmutableList.copyOf(args));
    }
  }

  /** Sequence of statements. */
  public static class Block extends Stmt {
    public final ImmutableList<Stmt> stmts;

    Block(ImmutableList<Stmt> stmts) {
      super(Op.BLOCK);
      this.stmts = requireNonNull(stmts);
      checkArgument(stmts.size() >= 2, "block needs two or more statements");
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      for (int i = 0; i < stmts.size(); i++) {
        if (i > 0) {
          w.newline();
        }
        w.append(stmts.get(i), 0, 0);
      }
      return w;
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Stmt> children() {
      return stmts;
    }

    @Override
    public Stmt withChildren(List<Stmt> children) {
      return copy(children);
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of();
    }

    public Block copy(List<Stmt> stmts) {
      return same(stmts, this.stmts)
          ? this
          : new Block(ImmutableList.copyOf(stmts));
    }
  }

  /** Conditional statement; the else case is optional. */
  public static class IfThenElse extends Stmt {
    public final Expr condition;
    public final Stmt thenCase;
    public final @Nullable Stmt elseCase;

    IfThenElse(Expr condition, Stmt thenCase, @Nullable Stmt elseCase) {
      super(Op.IF_THEN_ELSE);
      this.condition = requireNonNull(condition);
      this.thenCase = requireNonNull(thenCase);
      this.elseCase = elseCase;
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.append("if (").append(condition, 0, 0).append(")").block(thenCase);
      if (elseCase != null) {
        w.append(" else").block(elseCase);
      }
      return w;
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Stmt> children() {
      return elseCase == null
          ? ImmutableList.of(thenCase)
          : ImmutableList.of(thenCase, elseCase);
    }

    @Override
    public Stmt withChildren(List<Stmt> children) {
      checkArgument(children.size() == (elseCase == null ? 1 : 2));
      return copy(
          condition,
          children.get(0),
          children.size() == 1 ? null : children.get(1));
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(condition);
    }

    public IfThenElse copy(
        Expr condition, Stmt thenCase, @Nullable Stmt elseCase) {
      return condition == this.condition
              && thenCase == this.thenCase
              && elseCase == this.elseCase
          ? this
          : new IfThenElse(condition, thenCase, elseCase);
    }
  }

  /** Statement that evaluates an expression for its side effects. */
  public static class Evaluate extends Stmt {
    public final Expr value;

    Evaluate(Expr value) {
      super(Op.EVALUATE);
      this.value = requireNonNull(value);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(value, 0, 0);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Stmt> children() {
      return ImmutableList.of();
    }

    @Override
    public Stmt withChildren(List<Stmt> children) {
      checkArgument(children.isEmpty());
      return this;
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(value);
    }

    public Evaluate copy(Expr value) {
      return value == this.value ? this : new Evaluate(value);
    }
  }

  /** Run-time check; the pipeline fails with {@code message} if false. */
  public static class AssertStmt extends Stmt {
    public final Expr condition;
    public final String message;

    AssertStmt(Expr condition, String message) {
      super(Op.ASSERT);
      this.condition = requireNonNull(condition);
      this.message = requireNonNull(message);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("assert(")
          .append(condition, 0, 0)
          .append(", \"")
          .append(message)
          .append("\")");
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Stmt> children() {
      return ImmutableList.of();
    }

    @Override
    public Stmt withChildren(List<Stmt> children) {
      checkArgument(children.isEmpty());
      return this;
    }

    @Override
    public List<Expr> exprs() {
      return ImmutableList.of(condition);
    }

    public AssertStmt copy(Expr condition) {
      return condition == this.condition
          ? this
          : new AssertStmt(condition, message);
    }
  }
}

// End Ir.java
