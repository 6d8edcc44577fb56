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
 * The read-only view of one shot's classical state that conditions and expressions are evaluated
 * against. None of these methods may change the state.
 */
public interface RuntimeState {

  /** The number of bits in the shot's global measurement record. */
  int recordSize();

  /**
   * Returns the bit at {@code index} in the global measurement record; negative indices count back
   * from the end ({@code -1} is the most recent measurement).
   *
   * @throws org.qflow.CircuitException of kind INDEX_RANGE if the index does not resolve to a bit
   *     in the record
   */
  boolean rec(int index);

  /** The number of bits in the current last-block window. */
  int lastBlockSize();

  /**
   * Returns bit {@code index} of the current last-block window.
   *
   * @throws org.qflow.CircuitException of kind INDEX_RANGE if {@code index} is not in {@code
   *     0..lastBlockSize()-1}
   */
  boolean lastBlock(int index);

  /**
   * Returns the value most recently bound to {@code name} by a {@code Let}.
   *
   * @throws org.qflow.CircuitException of kind MISSING_BINDING if no value has been bound
   */
  long var(String name);

  /** Returns true if {@code name} has been bound by a {@code Let}. */
  boolean hasVar(String name);
}
