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

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.Objects;
import java.util.function.Predicate;
import org.qflow.CircuitException;

/**
 * A Cond decides whether an {@code If} body runs or a loop continues.
 *
 * <p>There are exactly four kinds of Cond (see {@link Kind}). Only {@link LastMeas} and {@link
 * MeasParity} are <i>structured</i>: their meaning can be inspected, so they can be lowered to
 * dataflow and serialized. The other two can only be evaluated.
 */
public abstract class Cond {

  /** The variants of Cond. */
  public enum Kind {
    LAST_MEAS,
    MEAS_PARITY,
    EXPR,
    UNSTRUCTURED
  }

  // Only the nested subclasses.
  private Cond() {}

  public abstract Kind kind();

  /** Evaluates this condition against the given state, which is not modified. */
  public abstract boolean eval(RuntimeState state);

  /** True for the kinds that lowering and serialization can represent. */
  public final boolean isStructured() {
    return kind() == Kind.LAST_MEAS || kind() == Kind.MEAS_PARITY;
  }

  /**
   * Returns a condition that is true iff bit {@code index} of the last-block window is 1; negative
   * indices count back from the end of the window.
   */
  public static LastMeas lastMeas(int index) {
    return new LastMeas(index);
  }

  /**
   * Returns a condition that is true iff an odd number of the given bits of the global record are
   * 1; negative indices count back from the end of the record.
   */
  public static MeasParity parity(int... indices) {
    return new MeasParity(ImmutableList.copyOf(Ints.asList(indices)));
  }

  /** Returns a condition that is true iff {@code expr} evaluates to a non-zero value. */
  public static OfExpr of(Expr expr) {
    return new OfExpr(expr);
  }

  /** Returns a condition that calls an arbitrary predicate. */
  public static Unstructured predicate(Predicate<? super RuntimeState> predicate) {
    return new Unstructured(predicate);
  }

  /** True iff the bit at {@code index} within the current last-block window is 1. */
  public static final class LastMeas extends Cond {
    public final int index;

    private LastMeas(int index) {
      this.index = index;
    }

    @Override
    public Kind kind() {
      return Kind.LAST_MEAS;
    }

    @Override
    public boolean eval(RuntimeState state) {
      int size = state.lastBlockSize();
      int resolved = (index < 0) ? size + index : index;
      if (resolved < 0 || resolved >= size) {
        throw CircuitException.indexRange(
            "LastMeas index %s out of range for last block of size %s", index, size);
      }
      return state.lastBlock(resolved);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof LastMeas lm && lm.index == index;
    }

    @Override
    public int hashCode() {
      return index;
    }

    @Override
    public String toString() {
      return "LastMeas(" + index + ")";
    }
  }

  /** True iff an odd number of the selected bits of the global measurement record are 1. */
  public static final class MeasParity extends Cond {
    public final ImmutableList<Integer> indices;

    private MeasParity(ImmutableList<Integer> indices) {
      this.indices = indices;
    }

    @Override
    public Kind kind() {
      return Kind.MEAS_PARITY;
    }

    @Override
    public boolean eval(RuntimeState state) {
      int size = state.recordSize();
      boolean parity = false;
      for (int i : indices) {
        int resolved = (i < 0) ? size + i : i;
        if (resolved < 0 || resolved >= size) {
          throw CircuitException.indexRange(
              "MeasParity index %s out of range for record of size %s", i, size);
        }
        parity ^= state.rec(resolved);
      }
      return parity;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof MeasParity mp && mp.indices.equals(indices);
    }

    @Override
    public int hashCode() {
      return indices.hashCode();
    }

    @Override
    public String toString() {
      return "MeasParity(" + indices + ")";
    }
  }

  /** True iff the wrapped expression evaluates to a non-zero value. */
  public static final class OfExpr extends Cond {
    public final Expr expr;

    private OfExpr(Expr expr) {
      this.expr = Objects.requireNonNull(expr);
    }

    @Override
    public Kind kind() {
      return Kind.EXPR;
    }

    @Override
    public boolean eval(RuntimeState state) {
      return expr.test(state);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof OfExpr oe && oe.expr.equals(expr);
    }

    @Override
    public int hashCode() {
      return expr.hashCode();
    }

    @Override
    public String toString() {
      return expr.toString();
    }
  }

  /** Wraps an arbitrary predicate; equal only to itself. */
  public static final class Unstructured extends Cond {
    private final Predicate<? super RuntimeState> predicate;

    private Unstructured(Predicate<? super RuntimeState> predicate) {
      this.predicate = Objects.requireNonNull(predicate);
    }

    @Override
    public Kind kind() {
      return Kind.UNSTRUCTURED;
    }

    @Override
    public boolean eval(RuntimeState state) {
      return predicate.test(state);
    }

    @Override
    public String toString() {
      return "<predicate>";
    }
  }
}
