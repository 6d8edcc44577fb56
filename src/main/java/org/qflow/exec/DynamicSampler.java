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

package org.qflow.exec;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;
import org.qflow.circuit.Circuit;
import org.qflow.sim.SimulatorFactory;

/**
 * Samples a dynamic {@link Circuit} by interpreting it once per shot.
 *
 * <p>Each shot gets a fresh simulator and context. If a seed was given, shot {@code s} is seeded
 * with {@code seed + s}, so results are reproducible and do not depend on whether shots are run in
 * parallel. Different shots may produce records of different lengths.
 */
public final class DynamicSampler {
  private static final Logger LOG = Logger.getLogger(DynamicSampler.class.getName());

  private final Circuit circuit;
  private final @Nullable Long seed;
  private final SimulatorFactory factory;
  private final boolean parallel;

  public DynamicSampler(Circuit circuit, @Nullable Long seed) {
    this(circuit, seed, SimulatorFactory.TABLEAU, false);
  }

  public DynamicSampler(Circuit circuit, @Nullable Long seed, SimulatorFactory factory) {
    this(circuit, seed, factory, false);
  }

  private DynamicSampler(
      Circuit circuit, @Nullable Long seed, SimulatorFactory factory, boolean parallel) {
    this.circuit = circuit;
    this.seed = seed;
    this.factory = factory;
    this.parallel = parallel;
  }

  /** Returns a sampler like this one that runs shots concurrently if {@code parallel} is true. */
  public DynamicSampler parallel(boolean parallel) {
    return new DynamicSampler(circuit, seed, factory, parallel);
  }

  /** Returns the measurement record of each shot. */
  public ImmutableList<ImmutableList<Boolean>> sample(int shots) {
    return shots(shots).mapToObj(s -> runShot(s).measurements()).collect(toImmutableList());
  }

  /** Returns the measurements, outputs, and final variables of each shot. */
  public ImmutableList<ShotResult> sampleWithClassical(int shots) {
    return shots(shots).mapToObj(s -> runShot(s).toResult()).collect(toImmutableList());
  }

  private IntStream shots(int shots) {
    Preconditions.checkArgument(shots >= 0, "shots must be non-negative, got %s", shots);
    LOG.fine(
        () -> String.format("Sampling %s shots (seed=%s, parallel=%s)", shots, seed, parallel));
    IntStream result = IntStream.range(0, shots);
    return parallel ? result.parallel() : result;
  }

  /** Runs a single shot with its own simulator and context. */
  ExecContext runShot(int shot) {
    Long shotSeed = (seed == null) ? null : seed + shot;
    ExecContext ctx = new ExecContext(factory.create(shotSeed));
    Interpreter.execute(circuit, ctx);
    return ctx;
  }
}
