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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.qflow.CircuitException;
import org.qflow.circuit.Gate;
import org.qflow.circuit.InstructionList;
import org.qflow.circuit.Target;

/**
 * Samples the detection events and logical observables of a static circuit.
 *
 * <p>Each {@code DETECTOR} is the parity of the measurements it names, compared against the same
 * parity in the noiseless reference sample: a detector "fires" only when noise (or a random outcome
 * that differs from the reference) changes that parity. Each {@code OBSERVABLE_INCLUDE(k)} adds its
 * measurements to observable {@code k}, which is reported the same way.
 *
 * <p>Successive calls to {@link #sample} continue the same sequence of shots, so a sampler created
 * with a given seed always produces the same results for the same sequence of calls.
 */
public final class StaticDetectorSampler {
  private static final Logger LOG = Logger.getLogger(StaticDetectorSampler.class.getName());

  private final InstructionList instructions;
  private final @Nullable Long seed;

  /** For each detector, the absolute record indices whose parity it reports. */
  private final ImmutableList<int[]> detectors;

  /** For each observable, the absolute record indices whose parity it reports. */
  private final ImmutableList<int[]> observables;

  private final boolean[] referenceDetectors;
  private final boolean[] referenceObservables;

  /** The number of shots taken so far, which offsets the per-shot seed. */
  private long shotsTaken;

  public StaticDetectorSampler(InstructionList instructions, @Nullable Long seed) {
    this.instructions = instructions;
    this.seed = seed;
    List<int[]> detectorList = new ArrayList<>();
    List<List<Integer>> observableList = new ArrayList<>();
    int[] measured = {0};
    instructions.forEachUnrolled(
        inst -> {
          if (inst.gate == Gate.DETECTOR) {
            detectorList.add(resolve(inst.targets, measured[0]));
          } else if (inst.gate == Gate.OBSERVABLE_INCLUDE) {
            int k = inst.args.get(0).intValue();
            while (observableList.size() <= k) {
              observableList.add(new ArrayList<>());
            }
            observableList.get(k).addAll(Ints.asList(resolve(inst.targets, measured[0])));
          }
          measured[0] += inst.measurementCount();
        });
    this.detectors = ImmutableList.copyOf(detectorList);
    this.observables =
        observableList.stream().map(Ints::toArray).collect(ImmutableList.toImmutableList());
    TableauSimulator reference = TableauSimulator.reference();
    boolean[] record = reference.apply(instructions);
    this.referenceDetectors = parities(detectors, record);
    this.referenceObservables = parities(observables, record);
    LOG.fine(
        () ->
            String.format(
                "Compiled detector sampler: %s measurements, %s detectors, %s observables",
                record.length, detectors.size(), observables.size()));
  }

  private static int[] resolve(List<Target> targets, int measured) {
    int[] result = new int[targets.size()];
    for (int i = 0; i < result.length; i++) {
      int index = measured - targets.get(i).lookback();
      if (index < 0) {
        throw CircuitException.indexRange(
            "%s refers to a measurement before the start of the circuit", targets.get(i));
      }
      result[i] = index;
    }
    return result;
  }

  private static boolean[] parities(List<int[]> groups, boolean[] record) {
    boolean[] result = new boolean[groups.size()];
    for (int i = 0; i < result.length; i++) {
      for (int index : groups.get(i)) {
        result[i] ^= record[index];
      }
    }
    return result;
  }

  public int numDetectors() {
    return detectors.size();
  }

  public int numObservables() {
    return observables.size();
  }

  /** Samples detection events with the observables appended to each shot. */
  public boolean[][] sample(int shots) {
    return sample(shots, false, true);
  }

  /**
   * Returns one row per shot. Each row holds the detection events, preceded by the observable flips
   * if {@code prependObservables} and followed by them if {@code appendObservables}.
   */
  public boolean[][] sample(int shots, boolean prependObservables, boolean appendObservables) {
    Preconditions.checkArgument(shots >= 0, "shots must be non-negative, got %s", shots);
    boolean[][] result = new boolean[shots][];
    for (int s = 0; s < shots; s++) {
      result[s] = sampleOne(prependObservables, appendObservables);
    }
    return result;
  }

  /**
   * Like {@link #sample(int, boolean, boolean)}, but packs each row eight bits per byte. Bit {@code
   * i} of a row is bit {@code i % 8} (least significant first) of byte {@code i / 8}.
   */
  public byte[][] samplePacked(int shots, boolean prependObservables, boolean appendObservables) {
    boolean[][] bits = sample(shots, prependObservables, appendObservables);
    byte[][] result = new byte[shots][];
    for (int s = 0; s < shots; s++) {
      result[s] = pack(bits[s]);
    }
    return result;
  }

  static byte[] pack(boolean[] bits) {
    byte[] result = new byte[(bits.length + 7) / 8];
    for (int i = 0; i < bits.length; i++) {
      if (bits[i]) {
        result[i >> 3] |= (byte) (1 << (i & 7));
      }
    }
    return result;
  }

  private boolean[] sampleOne(boolean prependObservables, boolean appendObservables) {
    Long shotSeed = (seed == null) ? null : seed + shotsTaken;
    shotsTaken++;
    boolean[] record = new TableauSimulator(shotSeed).apply(instructions);
    boolean[] dets = xor(parities(detectors, record), referenceDetectors);
    boolean[] obs = xor(parities(observables, record), referenceObservables);
    int numObs = obs.length;
    boolean[] row =
        new boolean
            [dets.length + (prependObservables ? numObs : 0) + (appendObservables ? numObs : 0)];
    int pos = 0;
    if (prependObservables) {
      System.arraycopy(obs, 0, row, pos, numObs);
      pos += numObs;
    }
    System.arraycopy(dets, 0, row, pos, dets.length);
    pos += dets.length;
    if (appendObservables) {
      System.arraycopy(obs, 0, row, pos, numObs);
    }
    return row;
  }

  private static boolean[] xor(boolean[] a, boolean[] b) {
    for (int i = 0; i < a.length; i++) {
      a[i] ^= b[i];
    }
    return a;
  }
}
