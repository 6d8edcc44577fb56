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

package org.qflow.cond;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.function.ToLongFunction;
import org.jspecify.annotations.Nullable;

/**
 * An Expr is a lazily-evaluated classical expression over a shot's {@link RuntimeState}, used by
 * {@code Let} and {@code Emit} nodes (and, wrapped in a {@link Cond}, as a branch condition).
 *
 * <p>Every value is a {@code long}; booleans are represented as 0 and 1. The logical operators
 * ({@link Op#XOR}, {@link Op#AND}, {@link Op#OR}, {@link Op#NOT}) treat any non-zero operand as
 * true and always produce 0 or 1, while {@link Op#ADD} and {@link Op#MOD} are arithmetic.
 *
 * <p>Evaluation is a pure function of the state at the time {@link #eval} is called; in particular
 * negative measurement indices are resolved against the record's length at evaluation time, so the
 * same Expr can be evaluated repeatedly as the record grows.
 */
public final class Expr {

  /** The variants of Expr. */
  public enum Op {
    LITERAL,
    VAR,
    MEAS,
    XOR,
    AND,
    OR,
    NOT,
    ADD,
    MOD,
    /** An opaque function of the state; not inspectable, so rejected by lowering. */
    COMPUTED
  }

  public final Op op;

  /** The value of a LITERAL, or the record index of a MEAS; otherwise zero. */
  private final long value;

  /** The variable name of a VAR; otherwise null. */
  private final @Nullable String name;

  /** The operands of XOR, AND, OR, NOT, ADD, and MOD; otherwise empty. */
  public final ImmutableList<Expr> operands;

  /** The function of a COMPUTED; otherwise null. */
  private final @Nullable ToLongFunction<? super RuntimeState> fn;

  private Expr(
      Op op,
      long value,
      @Nullable String name,
      ImmutableList<Expr> operands,
      @Nullable ToLongFunction<? super RuntimeState> fn) {
    this.op = op;
    this.value = value;
    this.name = name;
    this.operands = operands;
    this.fn = fn;
  }

  public static final Expr TRUE = literal(1);
  public static final Expr FALSE = literal(0);

  public static Expr literal(long value) {
    return new Expr(Op.LITERAL, value, null, ImmutableList.of(), null);
  }

  public static Expr literal(boolean value) {
    return value ? TRUE : FALSE;
  }

  /** Returns an Expr that reads the classical variable with the given name. */
  public static Expr var(String name) {
    Preconditions.checkArgument(!name.isEmpty(), "Variable name must not be empty");
    return new Expr(Op.VAR, 0, name, ImmutableList.of(), null);
  }

  /**
   * Returns an Expr that reads bit {@code index} of the global measurement record; negative indices
   * count back from the end.
   */
  public static Expr rec(int index) {
    return new Expr(Op.MEAS, index, null, ImmutableList.of(), null);
  }

  /** Returns an Expr that calls {@code fn}; such Exprs are evaluable but not inspectable. */
  public static Expr computed(ToLongFunction<? super RuntimeState> fn) {
    return new Expr(Op.COMPUTED, 0, null, ImmutableList.of(), Objects.requireNonNull(fn));
  }

  private static Expr combine(Op op, Expr... operands) {
    return new Expr(op, 0, null, ImmutableList.copyOf(operands), null);
  }

  public static Expr xor(Expr left, Expr right) {
    return combine(Op.XOR, left, right);
  }

  public static Expr and(Expr left, Expr right) {
    return combine(Op.AND, left, right);
  }

  public static Expr or(Expr left, Expr right) {
    return combine(Op.OR, left, right);
  }

  public static Expr not(Expr operand) {
    return combine(Op.NOT, operand);
  }

  public static Expr add(Expr left, Expr right) {
    return combine(Op.ADD, left, right);
  }

  /** Returns an Expr for {@code floorMod(left, right)}. */
  public static Expr mod(Expr left, Expr right) {
    return combine(Op.MOD, left, right);
  }

  public Expr xor(Expr other) {
    return xor(this, other);
  }

  public Expr and(Expr other) {
    return and(this, other);
  }

  public Expr or(Expr other) {
    return or(this, other);
  }

  public Expr not() {
    return not(this);
  }

  public Expr plus(Expr other) {
    return add(this, other);
  }

  public Expr mod(Expr other) {
    return mod(this, other);
  }

  /** The literal value (for a LITERAL) or record index (for a MEAS). */
  public long value() {
    Preconditions.checkState(op == Op.LITERAL || op == Op.MEAS);
    return value;
  }

  /** The variable name of a VAR. */
  public String name() {
    Preconditions.checkState(op == Op.VAR);
    return Objects.requireNonNull(name);
  }

  /** Evaluates this expression against the given state. */
  public long eval(RuntimeState state) {
    switch (op) {
      case LITERAL:
        return value;
      case VAR:
        return state.var(name());
      case MEAS:
        return state.rec((int) value) ? 1 : 0;
      case XOR:
        return (isTrue(operands.get(0), state) ^ isTrue(operands.get(1), state)) ? 1 : 0;
      case AND:
        return (isTrue(operands.get(0), state) && isTrue(operands.get(1), state)) ? 1 : 0;
      case OR:
        return (isTrue(operands.get(0), state) || isTrue(operands.get(1), state)) ? 1 : 0;
      case NOT:
        return isTrue(operands.get(0), state) ? 0 : 1;
      case ADD:
        return operands.get(0).eval(state) + operands.get(1).eval(state);
      case MOD:
        return Math.floorMod(operands.get(0).eval(state), operands.get(1).eval(state));
      case COMPUTED:
        return Objects.requireNonNull(fn).applyAsLong(state);
    }
    throw new AssertionError(op);
  }

  /** Evaluates this expression and coerces the result to a boolean. */
  public boolean test(RuntimeState state) {
    return eval(state) != 0;
  }

  private static boolean isTrue(Expr expr, RuntimeState state) {
    return expr.eval(state) != 0;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Expr e) || e.op != op) {
      return false;
    } else if (op == Op.COMPUTED) {
      return e.fn == fn;
    }
    return e.value == value && Objects.equals(e.name, name) && e.operands.equals(operands);
  }

  @Override
  public int hashCode() {
    return (op == Op.COMPUTED)
        ? System.identityHashCode(fn)
        : Objects.hash(op, value, name, operands);
  }

  @Override
  public String toString() {
    switch (op) {
      case LITERAL:
        return String.valueOf(value);
      case VAR:
        return "vars[\"" + name + "\"]";
      case MEAS:
        return "rec(" + value + ")";
      case XOR:
        return binary(" ^ ");
      case AND:
        return binary(" & ");
      case OR:
        return binary(" | ");
      case NOT:
        return "~(" + operands.get(0) + ")";
      case ADD:
        return binary(" + ");
      case MOD:
        return binary(" % ");
      case COMPUTED:
        return "<computed>";
    }
    throw new AssertionError(op);
  }

  private String binary(String separator) {
    return "(" + operands.get(0) + separator + operands.get(1) + ")";
  }
}
