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

import com.google.common.annotations.VisibleForTesting;
import java.util.Arrays;
import java.util.SplittableRandom;
import org.jspecify.annotations.Nullable;
import org.qflow.CircuitException;
import org.qflow.circuit.Instruction;
import org.qflow.circuit.InstructionList;
import org.qflow.circuit.Target;
import org.qflow.util.BitList;

/**
 * A stabilizer simulator using the CHP tableau representation (Aaronson and Gottesman, "Improved
 * simulation of stabilizer circuits", 2004).
 *
 * <p>For {@code n} qubits the tableau has {@code 2n + 1} rows: rows {@code 0..n-1} are the
 * destabilizers, rows {@code n..2n-1} the stabilizers, and row {@code 2n} is scratch space used by
 * deterministic measurements. Each row is a Pauli product given by its {@code x} and {@code z} bits
 * plus a sign bit {@code r}.
 *
 * <p>The tableau grows as higher-numbered qubits are touched; new qubits start in {@code |0>}.
 *
 * <p>In <i>reference</i> mode every random measurement outcome is false and noise channels are
 * ignored, which gives the noiseless reference sample used to compute detection events.
 */
public final class TableauSimulator implements Simulator {
  private final SplittableRandom random;
  private final boolean reference;

  private int n;
  private boolean[][] x;
  private boolean[][] z;
  private boolean[] r;

  private final BitList measurements = new BitList();

  public TableauSimulator(@Nullable Long seed) {
    this(seed, false);
  }

  private TableauSimulator(@Nullable Long seed, boolean reference) {
    this.random = (seed == null) ? new SplittableRandom() : new SplittableRandom(seed);
    this.reference = reference;
    this.n = 0;
    this.x = new boolean[1][0];
    this.z = new boolean[1][0];
    this.r = new boolean[1];
  }

  /** Returns a simulator in reference mode. */
  public static TableauSimulator reference() {
    return new TableauSimulator(0L, true);
  }

  @VisibleForTesting
  int numQubits() {
    return n;
  }

  @Override
  public boolean[] apply(InstructionList instructions) {
    int start = measurements.size();
    instructions.forEachUnrolled(this::apply);
    return measurements.tail(start);
  }

  @Override
  public boolean[] measurementRecord() {
    return measurements.toArray();
  }

  private void apply(Instruction inst) {
    for (Target t : inst.targets) {
      if (t.isQubit()) {
        ensureQubit(t.qubit());
      }
    }
    switch (inst.gate.kind) {
      case UNITARY_1:
        for (Target t : inst.targets) {
          applyUnitary1(inst, t.qubit());
        }
        break;
      case UNITARY_2:
        for (int i = 0; i < inst.targets.size(); i += 2) {
          applyUnitary2(inst, inst.targets.get(i).qubit(), inst.targets.get(i + 1).qubit());
        }
        break;
      case MEASURE:
      case MEASURE_RESET:
      case RESET:
        for (Target t : inst.targets) {
          applyMeasureOrReset(inst, t);
        }
        break;
      case NOISE:
        if (!reference) {
          double p = inst.args.get(0);
          for (Target t : inst.targets) {
            applyNoise(inst, t.qubit(), p);
          }
        }
        break;
      case ANNOTATION:
        break;
    }
  }

  private void applyUnitary1(Instruction inst, int q) {
    switch (inst.gate) {
      case I:
        break;
      case X:
        pauliX(q);
        break;
      case Y:
        pauliX(q);
        pauliZ(q);
        break;
      case Z:
        pauliZ(q);
        break;
      case H:
        hadamard(q);
        break;
      case S:
        phase(q);
        break;
      case S_DAG:
        phaseDag(q);
        break;
      default:
        throw CircuitException.unsupported("%s is not a Clifford gate", inst.gate);
    }
  }

  private void applyUnitary2(Instruction inst, int a, int b) {
    switch (inst.gate) {
      case CX:
        cnot(a, b);
        break;
      case CY:
        cy(a, b);
        break;
      case CZ:
        cz(a, b);
        break;
      case XCX:
        hadamard(a);
        cnot(a, b);
        hadamard(a);
        break;
      case XCY:
        hadamard(a);
        cy(a, b);
        hadamard(a);
        break;
      case XCZ:
        cnot(b, a);
        break;
      case YCX:
        yBasisToZ(a);
        cnot(a, b);
        zBasisToY(a);
        break;
      case YCY:
        yBasisToZ(a);
        cy(a, b);
        zBasisToY(a);
        break;
      case YCZ:
        cy(b, a);
        break;
      case SWAP:
        swap(a, b);
        break;
      case ISWAP:
        swap(a, b);
        cz(a, b);
        phase(a);
        phase(b);
        break;
      default:
        throw new AssertionError(inst.gate);
    }
  }

  private void applyMeasureOrReset(Instruction inst, Target t) {
    int q = t.qubit();
    switch (inst.gate) {
      case M:
        recordResult(measure(q), t);
        break;
      case MX:
        hadamard(q);
        recordResult(measure(q), t);
        hadamard(q);
        break;
      case MY:
        yBasisToZ(q);
        recordResult(measure(q), t);
        zBasisToY(q);
        break;
      case R:
        reset(q);
        break;
      case RX:
        reset(q);
        hadamard(q);
        break;
      case RY:
        reset(q);
        zBasisToY(q);
        break;
      case MR:
        recordResult(measure(q), t);
        reset(q);
        break;
      case MRX:
        hadamard(q);
        recordResult(measure(q), t);
        reset(q);
        hadamard(q);
        break;
      case MRY:
        yBasisToZ(q);
        recordResult(measure(q), t);
        reset(q);
        zBasisToY(q);
        break;
      default:
        throw new AssertionError(inst.gate);
    }
  }

  private void recordResult(boolean result, Target t) {
    measurements.add(result ^ t.isInverted());
  }

  private void applyNoise(Instruction inst, int q, double p) {
    if (random.nextDouble() >= p) {
      return;
    }
    switch (inst.gate) {
      case X_ERROR:
        pauliX(q);
        break;
      case Y_ERROR:
        pauliX(q);
        pauliZ(q);
        break;
      case Z_ERROR:
        pauliZ(q);
        break;
      case DEPOLARIZE1:
        int which = random.nextInt(3);
        if (which != 2) {
          pauliX(q);
        }
        if (which != 0) {
          pauliZ(q);
        }
        break;
      default:
        throw new AssertionError(inst.gate);
    }
  }

  /** Grows the tableau so that qubit {@code q} exists. */
  private void ensureQubit(int q) {
    if (q < n) {
      return;
    }
    int newN = Math.max(q + 1, 2 * n);
    boolean[][] newX = new boolean[2 * newN + 1][newN];
    boolean[][] newZ = new boolean[2 * newN + 1][newN];
    boolean[] newR = new boolean[2 * newN + 1];
    for (int i = 0; i < n; i++) {
      System.arraycopy(x[i], 0, newX[i], 0, n);
      System.arraycopy(z[i], 0, newZ[i], 0, n);
      newR[i] = r[i];
      System.arraycopy(x[n + i], 0, newX[newN + i], 0, n);
      System.arraycopy(z[n + i], 0, newZ[newN + i], 0, n);
      newR[newN + i] = r[n + i];
    }
    for (int j = n; j < newN; j++) {
      newX[j][j] = true;
      newZ[newN + j][j] = true;
    }
    n = newN;
    x = newX;
    z = newZ;
    r = newR;
  }

  private void pauliX(int q) {
    for (int i = 0; i < 2 * n; i++) {
      r[i] ^= z[i][q];
    }
  }

  private void pauliZ(int q) {
    for (int i = 0; i < 2 * n; i++) {
      r[i] ^= x[i][q];
    }
  }

  private void hadamard(int q) {
    for (int i = 0; i < 2 * n; i++) {
      r[i] ^= x[i][q] & z[i][q];
      boolean t = x[i][q];
      x[i][q] = z[i][q];
      z[i][q] = t;
    }
  }

  private void phase(int q) {
    for (int i = 0; i < 2 * n; i++) {
      r[i] ^= x[i][q] & z[i][q];
      z[i][q] ^= x[i][q];
    }
  }

  private void phaseDag(int q) {
    // S_DAG == S Z
    pauliZ(q);
    phase(q);
  }

  private void cnot(int a, int b) {
    for (int i = 0; i < 2 * n; i++) {
      r[i] ^= x[i][a] & z[i][b] & !(x[i][b] ^ z[i][a]);
      x[i][b] ^= x[i][a];
      z[i][a] ^= z[i][b];
    }
  }

  private void cy(int a, int b) {
    phaseDag(b);
    cnot(a, b);
    phase(b);
  }

  private void cz(int a, int b) {
    hadamard(b);
    cnot(a, b);
    hadamard(b);
  }

  /** Maps the Y eigenbasis onto the Z eigenbasis (|+i> to |0>). */
  private void yBasisToZ(int q) {
    phaseDag(q);
    hadamard(q);
  }

  /** The inverse of {@link #yBasisToZ}. */
  private void zBasisToY(int q) {
    hadamard(q);
    phase(q);
  }

  private void swap(int a, int b) {
    cnot(a, b);
    cnot(b, a);
    cnot(a, b);
  }

  private void reset(int q) {
    if (measure(q)) {
      pauliX(q);
    }
  }

  /** Measures qubit {@code q} in the Z basis, collapsing the state; does not record the result. */
  private boolean measure(int q) {
    int p = -1;
    for (int i = n; i < 2 * n; i++) {
      if (x[i][q]) {
        p = i;
        break;
      }
    }
    if (p >= 0) {
      // Random outcome.
      for (int i = 0; i < 2 * n; i++) {
        if (i != p && x[i][q]) {
          rowsum(i, p);
        }
      }
      copyRow(p - n, p);
      Arrays.fill(x[p], false);
      Arrays.fill(z[p], false);
      z[p][q] = true;
      boolean outcome = !reference && random.nextBoolean();
      r[p] = outcome;
      return outcome;
    }
    // Deterministic outcome; accumulate into the scratch row.
    int scratch = 2 * n;
    Arrays.fill(x[scratch], false);
    Arrays.fill(z[scratch], false);
    r[scratch] = false;
    for (int i = 0; i < n; i++) {
      if (x[i][q]) {
        rowsum(scratch, i + n);
      }
    }
    return r[scratch];
  }

  private void copyRow(int dst, int src) {
    System.arraycopy(x[src], 0, x[dst], 0, n);
    System.arraycopy(z[src], 0, z[dst], 0, n);
    r[dst] = r[src];
  }

  /** Left-multiplies row {@code h} by row {@code i}, tracking the sign. */
  private void rowsum(int h, int i) {
    int sum = (r[h] ? 2 : 0) + (r[i] ? 2 : 0);
    for (int j = 0; j < n; j++) {
      sum += g(x[i][j], z[i][j], x[h][j], z[h][j]);
      x[h][j] ^= x[i][j];
      z[h][j] ^= z[i][j];
    }
    r[h] = Math.floorMod(sum, 4) != 0;
  }

  /**
   * The exponent to which i is raised when the single-qubit Paulis (x1, z1) and (x2, z2) are
   * multiplied.
   */
  private static int g(boolean x1, boolean z1, boolean x2, boolean z2) {
    if (!x1 && !z1) {
      return 0;
    } else if (x1 && z1) {
      return (z2 ? 1 : 0) - (x2 ? 1 : 0);
    } else if (x1) {
      return z2 ? (x2 ? 1 : -1) : 0;
    } else {
      return x2 ? (z2 ? -1 : 1) : 0;
    }
  }
}
