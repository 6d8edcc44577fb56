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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.qflow.CircuitException;
import org.qflow.dataflow.Operation;
import org.qflow.dataflow.Value;
import org.qflow.dataflow.ValueArena;
import org.qflow.dataflow.ValueType;

/**
 * The lowering state of one region: the current value of each qubit, the measurement slots, the
 * last-block window, and the operations emitted so far.
 *
 * <p>The measurement slots hold the most recent measurement results, oldest first, possibly
 * preceded by some zero-valued padding. Measurement index {@code -j} is always the slot {@code j}
 * from the end. Absolute indices can only be resolved while the amount of padding is known, which
 * stops being true after a construct whose body measures (see {@link #loseAlignment}).
 *
 * <p>All the ExportStates of a lowering share one {@link ValueArena}, so value ids are unique
 * across the function.
 */
final class ExportState {
  static final int UNKNOWN = -1;

  final ValueArena arena;

  /** Maps each qubit index to its position in {@link #qubits}. */
  private final ImmutableMap<Integer, Integer> qubitPositions;

  final List<Value> qubits;
  final List<Value> meas;
  final List<Value> window;

  /** The number of padding slots at the start of {@link #meas}, or {@link #UNKNOWN}. */
  int padding;

  /** True for the state of the function body, whose values stay in scope to the end. */
  private final boolean topLevel;

  /**
   * Results with a known record index that were measured before the top-level state lost
   * alignment; element {@code i} is result {@code i}.
   */
  private ImmutableList<Value> settled = ImmutableList.of();

  /** The sources of the region this state lowers; empty for the function body. */
  ImmutableList<Value> sources = ImmutableList.of();

  final List<Operation> ops = new ArrayList<>();

  private ExportState(
      ValueArena arena,
      ImmutableMap<Integer, Integer> qubitPositions,
      List<Value> qubits,
      List<Value> meas,
      List<Value> window,
      int padding,
      boolean topLevel) {
    this.arena = arena;
    this.qubitPositions = qubitPositions;
    this.qubits = new ArrayList<>(qubits);
    this.meas = new ArrayList<>(meas);
    this.window = new ArrayList<>(window);
    this.padding = padding;
    this.topLevel = topLevel;
  }

  /** Returns the state of a function body that starts with the given qubit values. */
  static ExportState function(
      ValueArena arena, ImmutableMap<Integer, Integer> qubitPositions, List<Value> qubits) {
    return new ExportState(
        arena, qubitPositions, qubits, ImmutableList.of(), ImmutableList.of(), 0, true);
  }

  /**
   * Returns a state for a nested region whose sources are {@code sources}: the qubits, then
   * {@code measCount} measurement slots, then the window.
   */
  ExportState region(List<Value> sources, int measCount, int padding) {
    int q = qubits.size();
    Preconditions.checkArgument(sources.size() >= q + measCount);
    ExportState result =
        new ExportState(
            arena,
            qubitPositions,
            sources.subList(0, q),
            sources.subList(q, q + measCount),
            sources.subList(q + measCount, sources.size()),
            padding,
            false);
    result.sources = ImmutableList.copyOf(sources);
    return result;
  }

  Value qubit(int index) {
    Integer position = qubitPositions.get(index);
    if (position == null) {
      throw CircuitException.indexRange("Qubit %s was not allocated", index);
    }
    return qubits.get(position);
  }

  void setQubit(int index, Value value) {
    qubits.set(qubitPositions.get(index), value);
  }

  /** Returns the value of measurement result {@code index}; negative indices count from the end. */
  Value measurement(int index) {
    int size = meas.size();
    if (index < 0) {
      int position = size + index;
      if (position < Math.max(padding, 0)) {
        throw CircuitException.indexRange(
            "MeasParity index %s out of range for %s measurement slots", index, size);
      }
      return meas.get(position);
    }
    if (padding != UNKNOWN) {
      if (padding + index >= size) {
        throw CircuitException.indexRange(
            "MeasParity index %s out of range for record of size %s", index, size - padding);
      }
      return meas.get(padding + index);
    }
    if (index < settled.size()) {
      return settled.get(index);
    }
    throw CircuitException.unsupported(
        "Cannot lower MeasParity index %s after a data-dependent number of measurements;"
            + " use a negative index",
        index);
  }

  /** Returns the value of bit {@code index} of the window; negative indices count from the end. */
  Value lastBlock(int index) {
    int resolved = (index < 0) ? window.size() + index : index;
    if (resolved < 0 || resolved >= window.size()) {
      throw CircuitException.indexRange(
          "LastMeas index %s out of range for last block of size %s", index, window.size());
    }
    return window.get(resolved);
  }

  /**
   * Records that the number of padding slots is no longer known, because a construct that may or
   * may not measure is about to update this state.
   */
  void loseAlignment() {
    if (padding != UNKNOWN && topLevel) {
      settled = ImmutableList.copyOf(meas.subList(padding, meas.size()));
    }
    padding = UNKNOWN;
  }

  /** The qubit values, then the measurement slots, then the window. */
  ImmutableList<Value> values() {
    return ImmutableList.<Value>builder().addAll(qubits).addAll(meas).addAll(window).build();
  }

  /** Returns a fresh value of the same type as each of the given values. */
  ImmutableList<Value> freshLike(List<Value> values) {
    return values.stream().map(v -> arena.fresh(v.type)).collect(ImmutableList.toImmutableList());
  }

  /**
   * Replaces the values of this state with {@code outputs}, which are laid out like the result of
   * {@link #values}, with {@code measCount} measurement slots.
   */
  void update(List<Value> outputs, int measCount) {
    int q = qubits.size();
    Preconditions.checkArgument(outputs.size() >= q + measCount);
    for (int i = 0; i < q; i++) {
      qubits.set(i, outputs.get(i));
    }
    meas.clear();
    meas.addAll(outputs.subList(q, q + measCount));
    window.clear();
    window.addAll(outputs.subList(q + measCount, outputs.size()));
  }

  Value constant(long value) {
    Value result = arena.fresh(ValueType.BIT);
    ops.add(
        new Operation(
            "int",
            "const",
            ImmutableList.of(),
            ImmutableList.of(result),
            ImmutableMap.of("value", value),
            ImmutableList.of()));
    return result;
  }

  Value xor(Value a, Value b) {
    Value result = arena.fresh(ValueType.BIT);
    ops.add(Operation.of("int", "xor", ImmutableList.of(a, b), ImmutableList.of(result)));
    return result;
  }

  Value not(Value a) {
    Value result = arena.fresh(ValueType.BIT);
    ops.add(Operation.of("int", "not", ImmutableList.of(a), ImmutableList.of(result)));
    return result;
  }
}
