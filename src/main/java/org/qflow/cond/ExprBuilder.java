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

/**
 * A convenience for building expressions and conditions that read a shot's state, e.g.
 *
 * <pre>{@code
 * ExprBuilder ctx = new ExprBuilder();
 * circuit.block("H 0\nM 0")
 *     .let("m", ctx.rec(-1))
 *     .emit(ctx.var("m").xor(ctx.literal(true)), "flipped");
 * }</pre>
 *
 * <p>An ExprBuilder holds no state; each caller constructs its own.
 */
public final class ExprBuilder {

  public ExprBuilder() {}

  /** Bit {@code index} of the measurement record; negative indices count from the end. */
  public Expr rec(int index) {
    return Expr.rec(index);
  }

  /** The classical variable with the given name. */
  public Expr var(String name) {
    return Expr.var(name);
  }

  public Expr literal(long value) {
    return Expr.literal(value);
  }

  public Expr literal(boolean value) {
    return Expr.literal(value);
  }

  /** Bit {@code index} of the last-block window, as a condition. */
  public Cond lastMeas(int index) {
    return Cond.lastMeas(index);
  }

  /** The parity of the given record bits, as a condition. */
  public Cond parity(int... indices) {
    return Cond.parity(indices);
  }

  /** Wraps an expression as a condition. */
  public Cond test(Expr expr) {
    return Cond.of(expr);
  }
}
