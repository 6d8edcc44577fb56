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


package org.qflow.lower;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.qflow.CircuitException;
import org.qflow.circuit.Circuit;
import org.qflow.circuit.Gate;
import org.qflow.circuit.Instruction;
import org.qflow.circuit.Node;
import org.qflow.circuit.Target;
import org.qflow.cond.Cond;
import org.qflow.dataflow.DataflowModule;
import org.qflow.dataflow.FunctionDef;
import org.qflow.dataflow.Operation;
import org.qflow.dataflow.Region;
import org.qflow.dataflow.Value;
import org.qflow.dataflow.ValueArena;
import org.qflow.dataflow.ValueType;

/**
 * Lowers a {@link Circuit} to a {@link DataflowModule} in SSA form.
 *
 * <p>Every qubit touched anywhere in the circuit is allocated at the start of the function (in
 * index order) and freed at the end. Each gate consumes the current values of the qubits it acts on
 * and produces new ones; each measurement also produces a new {@code int(1)} value, which is
 * appended to the list of measurement slots.
 *
 * <p>Control flow becomes {@code scf.switch} (for If), {@code scf.while} and {@code scf.doWhile},
 * whose state is all the qubit values, then the measurement slots, then the last-block window.
 * Since a region's sources and targets must match, a body that makes {@code k} measurements
 * enters with {@code k} zero slots in front of the current ones and drops the {@code k} oldest
 * slots when it finishes. The slots thus act as a shift register, so index {@code -j} names the
 * {@code j}-th most recent result whether or not the body has run. The window is carried with the
 * size it has after the body, truncated or zero-extended on entry.
 *
 * <p>{@code Let} and {@code Emit} nodes have no dataflow equivalent and are skipped.
 */
public final class DataflowExporter {
  private static final Logger LOG = Logger.getLogger(DataflowExporter.class.getName());

  private final Circuit circuit;
  private final ValueArena arena = new ValueArena();

  private DataflowExporter(Circuit circuit) {
    this.circuit = circuit;
  }

  /**
   * Lowers {@code circuit} to a module containing a single function named {@code name}.
   *
   * @throws CircuitException of kind STRUCTURAL_VALIDATION if any condition is an unstructured
   *     predicate, or UNSUPPORTED if any condition is an expression or any instruction cannot be
   *     lowered; condition errors are detected before anything is emitted
   */
  public static DataflowModule export(Circuit circuit, String name) {
    validate(circuit);
    return new DataflowExporter(circuit).run(name);
  }

  private static void validate(Circuit circuit) {
    for (Node node : circuit.nodes()) {
      Cond cond;
      Circuit body;
      if (node instanceof Node.If ifNode) {
        cond = ifNode.cond;
        body = ifNode.body;
      } else if (node instanceof Node.Loop loop) {
        cond = loop.cond;
        body = loop.body;
      } else {
        continue;
      }
      if (!cond.isStructured()) {
        if (cond.kind() == Cond.Kind.UNSTRUCTURED) {
          throw CircuitException.structuralValidation(
              "Cannot lower a %s node with an unstructured %s condition; use LastMeas or"
                  + " MeasParity",
              node.kind(),
              cond.getClass().getSimpleName());
        }
        throw CircuitException.unsupported(
            "Cannot lower a %s node with an expression condition (%s)", node.kind(), cond);
      }
      validate(body);
    }
  }

  private DataflowModule run(String name) {
    SortedSet<Integer> indices = new TreeSet<>();
    collectQubits(circuit, indices);
    ImmutableMap.Builder<Integer, Integer> positions = ImmutableMap.builder();
    List<Value> qubits = new ArrayList<>();
    List<Operation> allocs = new ArrayList<>();
    for (int q : indices) {
      positions.put(q, qubits.size());
      Value v = arena.fresh(ValueType.QUBIT);
      allocs.add(Operation.of("qubit", "alloc", ImmutableList.of(), ImmutableList.of(v)));
      qubits.add(v);
    }
    ExportState state = ExportState.function(arena, positions.buildOrThrow(), qubits);
    state.ops.addAll(allocs);
    lower(circuit, state);
    for (Value v : state.qubits) {
      state.ops.add(Operation.of("qubit", "free", ImmutableList.of(v), ImmutableList.of()));
    }
    Region body = new Region(ImmutableList.of(), ImmutableList.of(), state.ops);
    LOG.fine(
        () ->
            String.format(
                "Lowered %s: %s qubits, %s measurement slots, %s values",
                name, indices.size(), state.meas.size(), arena.size()));
    return new DataflowModule(ImmutableList.of(new FunctionDef(name, body)), 0);
  }

  private static void collectQubits(Circuit circuit, SortedSet<Integer> qubits) {
    for (Node node : circuit.nodes()) {
      if (node instanceof Node.Block block) {
        block.instructions.collectQubits(qubits);
      } else if (node instanceof Node.If ifNode) {
        collectQubits(ifNode.body, qubits);
      } else if (node instanceof Node.Loop loop) {
        collectQubits(loop.body, qubits);
      }
    }
  }

  /** The number of measurement slots that lowering {@code circuit} appends. */
  private static int slotCount(Circuit circuit) {
    int count = 0;
    for (Node node : circuit.nodes()) {
      if (node instanceof Node.Block block) {
        count += block.instructions.measurementCount();
      } else if (node instanceof Node.If ifNode) {
        count += slotCount(ifNode.body);
      } else if (node instanceof Node.Loop loop) {
        count += slotCount(loop.body);
      }
    }
    return count;
  }

  /** The size of the window after lowering {@code circuit}, given its size before. */
  private static int windowSize(Circuit circuit, int before) {
    int size = before;
    for (Node node : circuit.nodes()) {
      if (node instanceof Node.Block block) {
        if (block.captureAsLast) {
          size = block.instructions.measurementCount();
        }
      } else if (node instanceof Node.If ifNode) {
        size = windowSize(ifNode.body, size);
      } else if (node instanceof Node.Loop loop) {
        size = windowSize(loop.body, size);
      }
    }
    return size;
  }

  private void lower(Circuit circuit, ExportState state) {
    for (Node node : circuit.nodes()) {
      switch (node.kind()) {
        case BLOCK:
          lowerBlock((Node.Block) node, state);
          break;
        case IF:
          lowerIf((Node.If) node, state);
          break;
        case WHILE:
        case DO_WHILE:
          lowerLoop((Node.Loop) node, state);
          break;
        case LET:
        case EMIT:
          LOG.fine(() -> "Skipping classical node: " + node);
          break;
      }
    }
  }

  private void lowerBlock(Node.Block block, ExportState state) {
    int start = state.meas.size();
    block.instructions.forEachUnrolled(inst -> lowerInstruction(inst, state));
    if (block.captureAsLast) {
      List<Value> results = new ArrayList<>(state.meas.subList(start, state.meas.size()));
      state.window.clear();
      state.window.addAll(results);
    }
  }

  private void lowerIf(Node.If node, ExportState state) {
    // The condition reads the state before the body runs.
    Value cond = condition(node.cond, state);
    int k = slotCount(node.body);
    ImmutableList<Value> inputs = carry(state, k, windowSize(node.body, state.window.size()));
    int measCount = state.meas.size() + k;

    ImmutableList<Value> passthrough = state.freshLike(inputs);
    Region falseRegion = new Region(passthrough, passthrough, ImmutableList.of());
    int bodyPadding =
        (state.padding == ExportState.UNKNOWN) ? ExportState.UNKNOWN : state.padding + k;
    Region trueRegion =
        lowerBody(node.body, state.region(state.freshLike(inputs), measCount, bodyPadding), k);

    ImmutableList<Value> outputs = state.freshLike(inputs);
    state.ops.add(
        new Operation(
            "scf",
            "switch",
            ImmutableList.<Value>builder().add(cond).addAll(inputs).build(),
            outputs,
            ImmutableMap.of(),
            ImmutableList.of(falseRegion, trueRegion)));
    finish(state, outputs, measCount, k);
  }

  private void lowerLoop(Node.Loop node, ExportState state) {
    int k = slotCount(node.body);
    ImmutableList<Value> inputs = carry(state, k, windowSize(node.body, state.window.size()));
    int measCount = state.meas.size() + k;
    // Each iteration shifts the slots by k, so only a loop that never measures keeps alignment.
    int padding = (k == 0) ? state.padding : ExportState.UNKNOWN;

    Region bodyRegion =
        lowerBody(node.body, state.region(state.freshLike(inputs), measCount, padding), k);
    // The condition sees the carried state, either on entry or after an iteration.
    ExportState condState = state.region(state.freshLike(inputs), measCount, padding);
    Value cond = condition(node.cond, condState);
    Region condRegion = new Region(condState.sources, ImmutableList.of(cond), condState.ops);

    ImmutableList<Value> outputs = state.freshLike(inputs);
    boolean isWhile = node.kind() == Node.Kind.WHILE;
    state.ops.add(
        new Operation(
            "scf",
            isWhile ? "while" : "doWhile",
            inputs,
            outputs,
            ImmutableMap.of(),
            isWhile
                ? ImmutableList.of(condRegion, bodyRegion)
                : ImmutableList.of(bodyRegion, condRegion)));
    finish(state, outputs, measCount, k);
  }

  /**
   * Returns the values carried into a construct whose body makes {@code k} measurements and leaves
   * a window of {@code windowSize} bits: the qubits, {@code k} zeros followed by the measurement
   * slots, and the window truncated or zero-extended to {@code windowSize}.
   */
  private static ImmutableList<Value> carry(ExportState state, int k, int windowSize) {
    int current = state.window.size();
    @Nullable Value zero = (k > 0 || windowSize > current) ? state.constant(0) : null;
    ImmutableList.Builder<Value> builder = ImmutableList.builder();
    builder.addAll(state.qubits);
    for (int i = 0; i < k; i++) {
      builder.add(zero);
    }
    builder.addAll(state.meas);
    for (int i = 0; i < windowSize; i++) {
      builder.add(i < current ? state.window.get(i) : zero);
    }
    return builder.build();
  }

  /**
   * Lowers {@code bodyCircuit} in {@code body}, whose sources are the carried values, and returns
   * the resulting region. The region drops the {@code k} oldest slots, so that it yields the same
   * number of slots it received.
   */
  private Region lowerBody(Circuit bodyCircuit, ExportState body, int k) {
    int slots = body.meas.size();
    int windowSize = body.window.size();
    lower(bodyCircuit, body);
    if (body.meas.size() != slots + k || body.window.size() != windowSize) {
      throw new AssertionError(
          String.format(
              "Expected %s slots and a window of %s, got %s and %s",
              slots + k, windowSize, body.meas.size(), body.window.size()));
    }
    ImmutableList<Value> targets =
        ImmutableList.<Value>builder()
            .addAll(body.qubits)
            .addAll(body.meas.subList(k, slots + k))
            .addAll(body.window)
            .build();
    return new Region(body.sources, targets, body.ops);
  }

  /** Updates {@code state} with the outputs of a construct whose body makes k measurements. */
  private static void finish(ExportState state, List<Value> outputs, int measCount, int k) {
    if (k > 0) {
      state.loseAlignment();
    }
    state.update(outputs, measCount);
  }

  /** Returns the value of {@code cond} in {@code state}, emitting any ops needed to compute it. */
  private static Value condition(Cond cond, ExportState state) {
    if (cond instanceof Cond.LastMeas lastMeas) {
      return state.lastBlock(lastMeas.index);
    } else if (cond instanceof Cond.MeasParity parity) {
      Value result = null;
      for (int i : parity.indices) {
        Value v = state.measurement(i);
        result = (result == null) ? v : state.xor(result, v);
      }
      return (result == null) ? state.constant(0) : result;
    }
    throw new AssertionError(cond);
  }

  private void lowerInstruction(Instruction inst, ExportState state) {
    switch (inst.gate.kind) {
      case UNITARY_1:
        for (Target t : inst.targets) {
          lowerUnitary1(inst.gate, t.qubit(), state);
        }
        break;
      case UNITARY_2:
        for (int i = 0; i < inst.targets.size(); i += 2) {
          lowerUnitary2(
              inst.gate, inst.targets.get(i).qubit(), inst.targets.get(i + 1).qubit(), state);
        }
        break;
      case MEASURE:
      case RESET:
      case MEASURE_RESET:
        for (Target t : inst.targets) {
          lowerMeasureOrReset(inst.gate, t, state);
        }
        break;
      case NOISE:
        throw CircuitException.unsupported("%s has no dataflow equivalent", inst.gate);
      case ANNOTATION:
        break;
    }
  }

  private void lowerUnitary1(Gate gate, int q, ExportState state) {
    switch (gate) {
      case S_DAG:
        gate("s", true, q, state);
        break;
      case T_DAG:
        gate("t", true, q, state);
        break;
      default:
        gate(Ascii.toLowerCase(gate.name()), false, q, state);
    }
  }

  private void lowerUnitary2(Gate gate, int a, int b, ExportState state) {
    switch (gate) {
      case CX:
        controlled("x", a, b, state);
        break;
      case CY:
        controlled("y", a, b, state);
        break;
      case CZ:
        controlled("z", a, b, state);
        break;
      case XCX:
        gate("h", false, a, state);
        controlled("x", a, b, state);
        gate("h", false, a, state);
        break;
      case XCY:
        gate("h", false, a, state);
        controlled("y", a, b, state);
        gate("h", false, a, state);
        break;
      case XCZ:
        controlled("x", b, a, state);
        break;
      case YCX:
        yBasisToZ(a, state);
        controlled("x", a, b, state);
        zBasisToY(a, state);
        break;
      case YCY:
        yBasisToZ(a, state);
        controlled("y", a, b, state);
        zBasisToY(a, state);
        break;
      case YCZ:
        controlled("y", b, a, state);
        break;
      case SWAP:
        swap(a, b, state);
        break;
      case ISWAP:
        swap(a, b, state);
        controlled("z", a, b, state);
        gate("s", false, a, state);
        gate("s", false, b, state);
        break;
      default:
        throw new AssertionError(gate);
    }
  }

  private void lowerMeasureOrReset(Gate gate, Target t, ExportState state) {
    int q = t.qubit();
    switch (gate) {
      case M:
        measure(t, state);
        break;
      case MX:
        gate("h", false, q, state);
        measure(t, state);
        gate("h", false, q, state);
        break;
      case MY:
        yBasisToZ(q, state);
        measure(t, state);
        zBasisToY(q, state);
        break;
      case R:
        reset(q, state);
        break;
      case RX:
        reset(q, state);
        gate("h", false, q, state);
        break;
      case RY:
        reset(q, state);
        zBasisToY(q, state);
        break;
      case MR:
        measure(t, state);
        reset(q, state);
        break;
      case MRX:
        gate("h", false, q, state);
        measure(t, state);
        reset(q, state);
        gate("h", false, q, state);
        break;
      case MRY:
        yBasisToZ(q, state);
        measure(t, state);
        reset(q, state);
        zBasisToY(q, state);
        break;
      default:
        throw new AssertionError(gate);
    }
  }

  private void gate(String name, boolean adjoint, int q, ExportState state) {
    Value out = arena.fresh(ValueType.QUBIT);
    state.ops.add(
        new Operation(
            "gate",
            name,
            ImmutableList.of(state.qubit(q)),
            ImmutableList.of(out),
            ImmutableMap.of("controls", 0, "adjoint", adjoint),
            ImmutableList.of()));
    state.setQubit(q, out);
  }

  /** Emits a singly-controlled gate; its inputs and outputs are ordered target, then control. */
  private void controlled(String name, int control, int target, ExportState state) {
    Value targetOut = arena.fresh(ValueType.QUBIT);
    Value controlOut = arena.fresh(ValueType.QUBIT);
    state.ops.add(
        new Operation(
            "gate",
            name,
            ImmutableList.of(state.qubit(target), state.qubit(control)),
            ImmutableList.of(targetOut, controlOut),
            ImmutableMap.of("controls", 1, "adjoint", false),
            ImmutableList.of()));
    state.setQubit(target, targetOut);
    state.setQubit(control, controlOut);
  }

  private void swap(int a, int b, ExportState state) {
    Value aOut = arena.fresh(ValueType.QUBIT);
    Value bOut = arena.fresh(ValueType.QUBIT);
    state.ops.add(
        new Operation(
            "gate",
            "swap",
            ImmutableList.of(state.qubit(a), state.qubit(b)),
            ImmutableList.of(aOut, bOut),
            ImmutableMap.of("controls", 0, "adjoint", false),
            ImmutableList.of()));
    state.setQubit(a, aOut);
    state.setQubit(b, bOut);
  }

  private void yBasisToZ(int q, ExportState state) {
    gate("s", true, q, state);
    gate("h", false, q, state);
  }

  private void zBasisToY(int q, ExportState state) {
    gate("h", false, q, state);
    gate("s", false, q, state);
  }

  private void measure(Target t, ExportState state) {
    Value qubitOut = arena.fresh(ValueType.QUBIT);
    Value result = arena.fresh(ValueType.BIT);
    state.ops.add(
        Operation.of(
            "qubit",
            "measureNd",
            ImmutableList.of(state.qubit(t.qubit())),
            ImmutableList.of(qubitOut, result)));
    state.setQubit(t.qubit(), qubitOut);
    state.meas.add(t.isInverted() ? state.not(result) : result);
  }

  private void reset(int q, ExportState state) {
    Value out = arena.fresh(ValueType.QUBIT);
    state.ops.add(
        Operation.of("qubit", "reset", ImmutableList.of(state.qubit(q)), ImmutableList.of(out)));
    state.setQubit(q, out);
  }
}
