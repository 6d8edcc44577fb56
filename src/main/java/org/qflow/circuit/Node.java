/*
 * Copyright 2025 The Qflow Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.qflow.circuit;

import com.google.common.base.Preconditions;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.qflow.cond.Cond;
import org.qflow.cond.Expr;

/**
 * A Node is one element of a {@link Circuit}. Nodes are immutable; the bodies of control-flow nodes
 * are frozen Circuits owned by the node.
 */
public abstract class Node {

  /** The variants of Node. */
  public enum Kind {
    BLOCK,
    IF,
    WHILE,
    DO_WHILE,
    LET,
    EMIT
  }

  // Only the nested subclasses.
  private Node() {}

  public abstract Kind kind();

  /** Appends a readable description of this node, each line prefixed by {@code indent}. */
  abstract void appendTo(StringBuilder sb, String indent);

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, "");
    return sb.toString().trim();
  }

  /**
   * A list of primitive instructions executed as one unit. If {@link #captureAsLast} is true, the
   * measurements made by this block replace the last-block window read by {@link Cond.LastMeas}.
   */
  public static final class Block extends Node {
    public final InstructionList instructions;
    public final boolean captureAsLast;

    public Block(InstructionList instructions, boolean captureAsLast) {
      this.instructions = Objects.requireNonNull(instructions);
      this.captureAsLast = captureAsLast;
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    @Override
    void appendTo(StringBuilder sb, String indent) {
      sb.append(indent).append(captureAsLast ? "Block:\n" : "Block (uncaptured):\n");
      for (InstructionList.Entry entry : instructions) {
        entry.appendTo(sb, indent + "  ");
      }
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Block b
          && b.captureAsLast == captureAsLast
          && b.instructions.equals(instructions);
    }

    @Override
    public int hashCode() {
      return instructions.hashCode() * 2 + (captureAsLast ? 1 : 0);
    }
  }

  /** Executes {@link #body} iff {@link #cond} is true; there is no else. */
  public static final class If extends Node {
    public final Cond cond;
    public final Circuit body;

    public If(Cond cond, Circuit body) {
      this.cond = Objects.requireNonNull(cond);
      this.body = body.frozenCopy();
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    void appendTo(StringBuilder sb, String indent) {
      sb.append(indent).append("If ").append(cond).append(":\n");
      body.appendTo(sb, indent + "  ");
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof If n && n.cond.equals(cond) && n.body.equals(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(cond, body);
    }
  }

  /** The common structure of {@link While} and {@link DoWhile}. */
  public abstract static class Loop extends Node {
    public final Cond cond;
    public final Circuit body;

    /** The body may be executed at most this many times per execution of the loop. */
    public final int maxIterations;

    private Loop(Cond cond, Circuit body, int maxIterations) {
      Preconditions.checkArgument(
          maxIterations > 0, "maxIterations must be positive, got %s", maxIterations);
      this.cond = Objects.requireNonNull(cond);
      this.body = body.frozenCopy();
      this.maxIterations = maxIterations;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Loop n
          && n.kind() == kind()
          && n.cond.equals(cond)
          && n.body.equals(body)
          && n.maxIterations == maxIterations;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), cond, body, maxIterations);
    }
  }

  /** Repeats {@link #body} while {@link #cond} is true, checking before each iteration. */
  public static final class While extends Loop {
    public While(Cond cond, Circuit body, int maxIterations) {
      super(cond, body, maxIterations);
    }

    @Override
    public Kind kind() {
      return Kind.WHILE;
    }

    @Override
    void appendTo(StringBuilder sb, String indent) {
      sb.append(indent).append("While ").append(cond).append(":\n");
      body.appendTo(sb, indent + "  ");
    }
  }

  /** Executes {@link #body}, then repeats it while {@link #cond} is true. */
  public static final class DoWhile extends Loop {
    public DoWhile(Cond cond, Circuit body, int maxIterations) {
      super(cond, body, maxIterations);
    }

    @Override
    public Kind kind() {
      return Kind.DO_WHILE;
    }

    @Override
    void appendTo(StringBuilder sb, String indent) {
      sb.append(indent).append("Do:\n");
      body.appendTo(sb, indent + "  ");
      sb.append(indent).append("While ").append(cond).append('\n');
    }
  }

  /** Binds a classical variable to the value of an expression. */
  public static final class Let extends Node {
    public final String name;
    public final Expr expr;

    public Let(String name, Expr expr) {
      Preconditions.checkArgument(!name.isEmpty(), "Variable name must not be empty");
      this.name = name;
      this.expr = Objects.requireNonNull(expr);
    }

    @Override
    public Kind kind() {
      return Kind.LET;
    }

    @Override
    void appendTo(StringBuilder sb, String indent) {
      sb.append(indent).append("Let ").append(name).append(" = ").append(expr).append('\n');
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Let n && n.name.equals(name) && n.expr.equals(expr);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, expr);
    }
  }

  /** Appends the (boolean) value of an expression to the shot's outputs, optionally labeled. */
  public static final class Emit extends Node {
    public final Expr expr;
    public final @Nullable String name;

    public Emit(Expr expr, @Nullable String name) {
      this.expr = Objects.requireNonNull(expr);
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.EMIT;
    }

    @Override
    void appendTo(StringBuilder sb, String indent) {
      sb.append(indent).append("Emit ").append(expr);
      if (name != null) {
        sb.append(" as ").append(name);
      }
      sb.append('\n');
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Emit n && n.expr.equals(expr) && Objects.equals(n.name, name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(expr, name);
    }
  }
}
