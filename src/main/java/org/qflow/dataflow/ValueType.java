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


package org.qflow.dataflow;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;

/** The type of a dataflow {@link Value}: either a qubit or a fixed-width integer. */
@Immutable
public final class ValueType {
  public static final ValueType QUBIT = new ValueType(0);

  /** The type of a single measurement result or condition. */
  public static final ValueType BIT = new ValueType(1);

  /** Zero for qubits, otherwise the integer width in bits. */
  private final int width;

  private ValueType(int width) {
    this.width = width;
  }

  public static ValueType intType(int width) {
    Preconditions.checkArgument(width > 0, "Integer width must be positive, got %s", width);
    return (width == 1) ? BIT : new ValueType(width);
  }

  public boolean isQubit() {
    return width == 0;
  }

  public int width() {
    Preconditions.checkState(!isQubit());
    return width;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ValueType t && t.width == width;
  }

  @Override
  public int hashCode() {
    return width;
  }

  @Override
  public String toString() {
    return isQubit() ? "qubit" : "int(" + width + ")";
  }
}
