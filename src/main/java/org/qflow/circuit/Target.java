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
import com.google.errorprone.annotations.Immutable;

/**
 * A Target is one operand of an {@link Instruction}: either a qubit index (possibly marked as
 * inverted, which flips the recorded result of a measurement) or a lookback into the measurement
 * record ({@code rec[-k]}).
 */
@Immutable
public final class Target {
  private final int value;
  private final boolean isRecord;
  private final boolean inverted;

  private Target(int value, boolean isRecord, boolean inverted) {
    this.value = value;
    this.isRecord = isRecord;
    this.inverted = inverted;
  }

  /** Returns a Target for the given (non-negative) qubit index. */
  public static Target qubit(int index) {
    Preconditions.checkArgument(index >= 0, "Negative qubit index %s", index);
    return new Target(index, false, false);
  }

  /** Returns a Target for the given qubit whose measurement result will be inverted. */
  public static Target invertedQubit(int index) {
    Preconditions.checkArgument(index >= 0, "Negative qubit index %s", index);
    return new Target(index, false, true);
  }

  /** Returns a Target for {@code rec[-lookback]}; {@code lookback} must be positive. */
  public static Target record(int lookback) {
    Preconditions.checkArgument(lookback > 0, "Record lookback must be positive, got %s", lookback);
    return new Target(lookback, true, false);
  }

  public boolean isQubit() {
    return !isRecord;
  }

  public boolean isRecord() {
    return isRecord;
  }

  public boolean isInverted() {
    return inverted;
  }

  /** The qubit index; only valid if {@link #isQubit} is true. */
  public int qubit() {
    Preconditions.checkState(!isRecord);
    return value;
  }

  /** The (positive) distance back from the end of the record; only valid for record targets. */
  public int lookback() {
    Preconditions.checkState(isRecord);
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Target t
        && t.value == value
        && t.isRecord == isRecord
        && t.inverted == inverted;
  }

  @Override
  public int hashCode() {
    return value * 4 + (isRecord ? 2 : 0) + (inverted ? 1 : 0);
  }

  @Override
  public String toString() {
    if (isRecord) {
      return "rec[-" + value + "]";
    }
    return inverted ? "!" + value : String.valueOf(value);
  }
}
