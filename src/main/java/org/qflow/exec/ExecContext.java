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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.qflow.CircuitException;
import org.qflow.circuit.InstructionList;
import org.qflow.cond.RuntimeState;
import org.qflow.sim.Simulator;
import org.qflow.util.BitList;

/**
 * The mutable state of a single shot: the simulator, the global measurement record, the last-block
 * window, the classical variables, and the emitted outputs.
 *
 * <p>An ExecContext is owned by one shot and must not be shared between threads.
 */
public final class ExecContext implements RuntimeState {
  private final Simulator simulator;
  private final BitList record = new BitList();
  private boolean[] window = new boolean[0];
  private final Map<String, Long> vars = new LinkedHashMap<>();
  private final List<Boolean> outputs = new ArrayList<>();
  private final List<String> outputNames = new ArrayList<>();

  public ExecContext(Simulator simulator) {
    this.simulator = simulator;
  }

  /**
   * Runs {@code instructions} on the simulator and appends the results to the record; if {@code
   * captureAsLast}, the results also become the last-block window.
   */
  void runBlock(InstructionList instructions, boolean captureAsLast) {
    boolean[] produced = simulator.apply(instructions);
    record.addAll(produced);
    if (captureAsLast) {
      window = produced;
    }
  }

  void setVar(String name, long value) {
    vars.put(name, value);
  }

  void emit(boolean value, @Nullable String name) {
    outputs.add(value);
    if (name != null) {
      outputNames.add(name);
    }
  }

  @Override
  public int recordSize() {
    return record.size();
  }

  @Override
  public boolean rec(int index) {
    int resolved = (index < 0) ? record.size() + index : index;
    if (resolved < 0 || resolved >= record.size()) {
      throw CircuitException.indexRange(
          "Measurement index %s out of bounds for record of size %s", index, record.size());
    }
    return record.get(resolved);
  }

  @Override
  public int lastBlockSize() {
    return window.length;
  }

  @Override
  public boolean lastBlock(int index) {
    if (index < 0 || index >= window.length) {
      throw CircuitException.indexRange(
          "Last-block index %s out of bounds for window of size %s", index, window.length);
    }
    return window[index];
  }

  @Override
  public long var(String name) {
    Long value = vars.get(name);
    if (value == null) {
      throw CircuitException.missingBinding("Variable '%s' is not bound", name);
    }
    return value;
  }

  @Override
  public boolean hasVar(String name) {
    return vars.containsKey(name);
  }

  public ImmutableList<Boolean> measurements() {
    return record.toList();
  }

  public ImmutableList<Boolean> lastBlock() {
    ImmutableList.Builder<Boolean> builder = ImmutableList.builder();
    for (boolean b : window) {
      builder.add(b);
    }
    return builder.build();
  }

  public ImmutableMap<String, Long> vars() {
    return ImmutableMap.copyOf(vars);
  }

  public ImmutableList<Boolean> outputs() {
    return ImmutableList.copyOf(outputs);
  }

  public ImmutableList<String> outputNames() {
    return ImmutableList.copyOf(outputNames);
  }

  /** Returns an immutable snapshot of this shot's results. */
  public ShotResult toResult() {
    return new ShotResult(measurements(), outputs(), outputNames(), vars());
  }
}
