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

import org.jspecify.annotations.Nullable;

/** Creates a fresh {@link Simulator} for each shot. */
@FunctionalInterface
public interface SimulatorFactory {

  /**
   * Returns a new Simulator in the all-zeros state. If {@code seed} is non-null, the Simulator's
   * random outcomes must be a deterministic function of it.
   */
  Simulator create(@Nullable Long seed);

  /** The default factory, which creates a {@link TableauSimulator}. */
  SimulatorFactory TABLEAU = TableauSimulator::new;
}
