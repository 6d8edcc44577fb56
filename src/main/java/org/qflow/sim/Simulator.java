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

package org.qflow.sim;

import org.qflow.circuit.InstructionList;

/**
 * A Simulator holds the quantum state of a single shot. Each shot of a dynamic circuit gets its own
 * Simulator, which is discarded when the shot completes.
 */
public interface Simulator {

  /**
   * Applies the given instructions to the state, in order, and returns the measurement results they
   * produced (exactly {@code instructions.measurementCount()} bits).
   */
  boolean[] apply(InstructionList instructions);

  /** Returns every measurement result produced so far by this Simulator, oldest first. */
  boolean[] measurementRecord();
}
