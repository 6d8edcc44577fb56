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

package org.qflow.circuit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.List;

/**
 * A single primitive instruction: a {@link Gate}, its numeric arguments (e.g. a noise probability
 * or a coordinate), and its targets.
 *
 * <p>The constructor checks that the arguments and targets are legal for the gate, so any
 * Instruction that exists can be executed by a simulator that supports its gate.
 */
@Immutable
public final class Instruction implements InstructionList.Entry {
  public final Gate gate;
  public final ImmutableList<Double> args;
  public final ImmutableList<Target> targets;

  public Instruction(Gate gate, List<Double> args, List<Target> targets) {
    this.gate = gate;
    this.args = ImmutableList.copyOf(args);
    this.targets = ImmutableList.copyOf(targets);
    String problem = check();
    Preconditions.checkArgument(problem == null, "%s: %s", gate, problem);
  }

  /** Returns an Instruction with no arguments applied to the given qubits. */
  public static Instruction of(Gate gate, int... qubits) {
    ImmutableList.Builder<Target> targets = ImmutableList.builder();
    for (int q : qubits) {
      targets.add(Target.qubit(q));
    }
    return new Instruction(gate, ImmutableList.of(), targets.build());
  }

  /** Returns null if this instruction is well-formed, or a description of the problem. */
  private String check() {
    int required = gate.requiredArgs();
    if (required >= 0 && args.size() != required) {
      return String.format("expected %s argument(s), got %s", required, args.size());
    }
    if (gate.kind == Gate.Kind.NOISE) {
      double p = args.get(0);
      if (!(p >= 0 && p <= 1)) {
        return "probability must be in [0, 1], got " + p;
      }
    }
    if (gate == Gate.OBSERVABLE_INCLUDE) {
      double index = args.get(0);
      if (index < 0 || index != Math.rint(index)) {
        return "observable index must be a non-negative integer, got " + index;
      }
    }
    if (gate.takesNoTargets()) {
      return targets.isEmpty() ? null : "takes no targets";
    }
    for (Target t : targets) {
      if (gate.takesRecordTargets()) {
        if (!t.isRecord()) {
          return "expected rec[-k] targets, got " + t;
        }
      } else if (t.isRecord()) {
        return "expected qubit targets, got " + t;
      } else if (t.isInverted() && !gate.producesMeasurements()) {
        return "only measurements may invert a target";
      }
    }
    if (targets.size() % gate.targetsPerApplication() != 0) {
      return "expected an even number of targets";
    }
    if (gate.kind == Gate.Kind.UNITARY_2) {
      for (int i = 0; i < targets.size(); i += 2) {
        if (targets.get(i).qubit() == targets.get(i + 1).qubit()) {
          return "a two-qubit gate may not target the same qubit twice";
        }
      }
    }
    return null;
  }

  @Override
  public int measurementCount() {
    return gate.producesMeasurements() ? targets.size() : 0;
  }

  @Override
  public void appendTo(StringBuilder sb, String indent) {
    sb.append(indent).append(gate.name());
    if (!args.isEmpty()) {
      sb.append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i != 0) {
          sb.append(", ");
        }
        sb.append(formatArg(args.get(i)));
      }
      sb.append(')');
    }
    for (Target t : targets) {
      sb.append(' ').append(t);
    }
    sb.append('\n');
  }

  private static String formatArg(double d) {
    if (d == Math.rint(d) && Math.abs(d) < 1e15) {
      return String.valueOf((long) d);
    }
    return String.valueOf(d);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Instruction inst
        && inst.gate == gate
        && inst.args.equals(args)
        && inst.targets.equals(targets);
  }

  @Override
  public int hashCode() {
    return (gate.hashCode() * 31 + args.hashCode()) * 31 + targets.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, "");
    sb.setLength(sb.length() - 1);
    return sb.toString();
  }
}
