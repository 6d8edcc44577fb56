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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * Each Gate is one instruction name that may appear in an {@link InstructionList}. Alternative
 * spellings (e.g. {@code CNOT} for {@link #CX}) are accepted by {@link #lookup} and canonicalized.
 */
public enum Gate {
  I(Kind.UNITARY_1),
  X(Kind.UNITARY_1),
  Y(Kind.UNITARY_1),
  Z(Kind.UNITARY_1),
  H(Kind.UNITARY_1),
  S(Kind.UNITARY_1, "SQRT_Z"),
  S_DAG(Kind.UNITARY_1, "SQRT_Z_DAG"),
  T(Kind.UNITARY_1),
  T_DAG(Kind.UNITARY_1),

  CX(Kind.UNITARY_2, "CNOT", "ZCX"),
  CY(Kind.UNITARY_2, "ZCY"),
  CZ(Kind.UNITARY_2, "ZCZ"),
  XCX(Kind.UNITARY_2),
  XCY(Kind.UNITARY_2),
  XCZ(Kind.UNITARY_2),
  YCX(Kind.UNITARY_2),
  YCY(Kind.UNITARY_2),
  YCZ(Kind.UNITARY_2),
  SWAP(Kind.UNITARY_2),
  ISWAP(Kind.UNITARY_2),

  M(Kind.MEASURE, "MZ"),
  MX(Kind.MEASURE),
  MY(Kind.MEASURE),

  R(Kind.RESET, "RZ"),
  RX(Kind.RESET),
  RY(Kind.RESET),

  MR(Kind.MEASURE_RESET, "MRZ"),
  MRX(Kind.MEASURE_RESET),
  MRY(Kind.MEASURE_RESET),

  X_ERROR(Kind.NOISE),
  Y_ERROR(Kind.NOISE),
  Z_ERROR(Kind.NOISE),
  DEPOLARIZE1(Kind.NOISE),

  TICK(Kind.ANNOTATION),
  QUBIT_COORDS(Kind.ANNOTATION),
  DETECTOR(Kind.ANNOTATION),
  OBSERVABLE_INCLUDE(Kind.ANNOTATION),
  SHIFT_COORDS(Kind.ANNOTATION);

  /** The broad categories of instruction, which determine what arguments and targets are legal. */
  public enum Kind {
    /** Applies a unitary to each qubit target. */
    UNITARY_1,
    /** Applies a unitary to each consecutive pair of qubit targets. */
    UNITARY_2,
    /** Measures each qubit target, appending one bit per target to the record. */
    MEASURE,
    /** Resets each qubit target; produces no measurement. */
    RESET,
    /** Measures and then resets each qubit target. */
    MEASURE_RESET,
    /** A single-qubit Pauli channel with one probability argument. */
    NOISE,
    /** No effect on the state. */
    ANNOTATION
  }

  public final Kind kind;
  private final String[] aliases;

  private static final ImmutableMap<String, Gate> BY_NAME;

  static {
    ImmutableMap.Builder<String, Gate> builder = ImmutableMap.builder();
    for (Gate gate : values()) {
      builder.put(gate.name(), gate);
      for (String alias : gate.aliases) {
        builder.put(alias, gate);
      }
    }
    BY_NAME = builder.buildOrThrow();
  }

  Gate(Kind kind, String... aliases) {
    this.kind = kind;
    this.aliases = aliases;
  }

  /** Returns the Gate with the given name or alias (case-insensitive), or null if there is none. */
  public static @Nullable Gate lookup(String name) {
    return BY_NAME.get(Ascii.toUpperCase(name));
  }

  /** True if this instruction appends bits to the measurement record. */
  public boolean producesMeasurements() {
    return kind == Kind.MEASURE || kind == Kind.MEASURE_RESET;
  }

  /** The number of qubit targets consumed by one application of this gate. */
  public int targetsPerApplication() {
    return kind == Kind.UNITARY_2 ? 2 : 1;
  }

  /** True if targets must be {@code rec[-k]} lookbacks rather than qubits. */
  public boolean takesRecordTargets() {
    return this == DETECTOR || this == OBSERVABLE_INCLUDE;
  }

  /** True if this instruction accepts no targets at all. */
  public boolean takesNoTargets() {
    return this == TICK || this == SHIFT_COORDS;
  }

  /**
   * Returns the number of numeric arguments this instruction requires, or -1 if any number is
   * allowed.
   */
  public int requiredArgs() {
    switch (this) {
      case X_ERROR:
      case Y_ERROR:
      case Z_ERROR:
      case DEPOLARIZE1:
      case OBSERVABLE_INCLUDE:
        return 1;
      case DETECTOR:
      case QUBIT_COORDS:
      case SHIFT_COORDS:
        return -1;
      default:
        return 0;
    }
  }
}
