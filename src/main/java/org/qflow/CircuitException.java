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

package org.qflow;

import com.google.errorprone.annotations.FormatMethod;

/**
 * All errors detected while building, executing, lowering, or serializing a circuit throw a
 * CircuitException. The {@link Kind} identifies which rule was violated; callers that want to skip
 * a failing shot (rather than abort a sampling run) should switch on it.
 */
public class CircuitException extends RuntimeException {

  /** The categories of failure. */
  public enum Kind {
    /**
     * A {@code LastMeas}, {@code MeasParity}, or measurement reference resolved outside the current
     * window or record.
     */
    INDEX_RANGE,

    /** A variable was read before any {@code Let} bound it. */
    MISSING_BINDING,

    /** A {@code While} or {@code DoWhile} ran its body more times than its budget allows. */
    ITERATION_BUDGET_EXCEEDED,

    /** An opaque predicate was found where a structured condition is required. */
    STRUCTURAL_VALIDATION,

    /** An instruction, node, or condition kind has no defined mapping. */
    UNSUPPORTED,

    /** An operation that requires a circuit with no control flow was given one that has some. */
    STATIC_CIRCUIT_REQUIRED
  }

  public final Kind kind;

  public CircuitException(Kind kind, String msg) {
    super(msg);
    this.kind = kind;
  }

  @FormatMethod
  public static CircuitException indexRange(String fmt, Object... args) {
    return new CircuitException(Kind.INDEX_RANGE, String.format(fmt, args));
  }

  @FormatMethod
  public static CircuitException missingBinding(String fmt, Object... args) {
    return new CircuitException(Kind.MISSING_BINDING, String.format(fmt, args));
  }

  @FormatMethod
  public static CircuitException iterationBudgetExceeded(String fmt, Object... args) {
    return new CircuitException(Kind.ITERATION_BUDGET_EXCEEDED, String.format(fmt, args));
  }

  @FormatMethod
  public static CircuitException structuralValidation(String fmt, Object... args) {
    return new CircuitException(Kind.STRUCTURAL_VALIDATION, String.format(fmt, args));
  }

  @FormatMethod
  public static CircuitException unsupported(String fmt, Object... args) {
    return new CircuitException(Kind.UNSUPPORTED, String.format(fmt, args));
  }

  @FormatMethod
  public static CircuitException staticCircuitRequired(String fmt, Object... args) {
    return new CircuitException(Kind.STATIC_CIRCUIT_REQUIRED, String.format(fmt, args));
  }
}
