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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.qflow.CircuitException;
import org.qflow.circuit.Circuit;
import org.qflow.cond.Cond;
import org.qflow.cond.Expr;
import org.qflow.dataflow.DataflowModule;
import org.qflow.dataflow.Operation;
import org.qflow.dataflow.Region;
import org.qflow.dataflow.Value;

@RunWith(JUnitParamsRunner.class)
public class DataflowExporterTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  /** Lowers {@code circuit}, checks that the result is well-formed, and returns it. */
  private static DataflowModule lower(Circuit circuit) {
    DataflowModule module = circuit.toDataflow();
    module.verify();
    return module;
  }

  private static ImmutableList<Operation> ops(DataflowModule module) {
    return module.entrypointFunction().body.operations;
  }

  /** The first operation of the entrypoint with the given full name. */
  private static Operation find(DataflowModule module, String fullName) {
    return ops(module).stream()
        .filter(op -> op.fullName().equals(fullName))
        .findFirst()
        .orElseThrow(() -> new AssertionError("No " + fullName + " in\n" + module));
  }

  private static ImmutableList<String> names(Region region) {
    return region.operations.stream().map(Operation::fullName).collect(toImmutableList());
  }

  /** The measurement results produced directly in {@code region}, in order. */
  private static ImmutableList<Value> results(Region region) {
    return region.operations.stream()
        .filter(op -> op.fullName().equals("qubit.measureNd"))
        .map(op -> op.outputs.get(1))
        .collect(toImmutableList());
  }

  /** The input of {@code op} that {@code region} receives as {@code source}. */
  private static Value carriedIn(Operation op, Region region, Value source) {
    int position = region.sources.indexOf(source);
    assertThat(position).isAtLeast(0);
    // A switch's first input is its selector.
    int offset = op.fullName().equals("scf.switch") ? 1 : 0;
    return op.inputs.get(offset + position);
  }

  private static CircuitException lowerFails(Circuit circuit, CircuitException.Kind kind) {
    CircuitException e = assertThrows(CircuitException.class, circuit::toDataflow);
    assertThat(e.kind).isEqualTo(kind);
    return e;
  }

  @Test
  public void emptyCircuit() {
    DataflowModule module = lower(new Circuit());
    assertThat(module.functions).hasSize(1);
    assertThat(module.entrypoint).isEqualTo(0);
    assertThat(module.toString()).isEqualTo("func @main {\n}\n");
  }

  @Test
  public void straightLine() {
    DataflowModule module = lower(new Circuit("H 0\nCX 0 1\nM !1"));
    assertThat(module.toString())
        .isEqualTo(
            "func @main {\n"
                + "  %0:qubit = qubit.alloc()\n"
                + "  %1:qubit = qubit.alloc()\n"
                + "  %2:qubit = gate.h(%0) {controls=0, adjoint=false}\n"
                + "  %3:qubit, %4:qubit = gate.x(%1, %2) {controls=1, adjoint=false}\n"
                + "  %5:qubit, %6:int(1) = qubit.measureNd(%3)\n"
                + "  %7:int(1) = int.not(%6)\n"
                + "  qubit.free(%4)\n"
                + "  qubit.free(%5)\n"
                + "}\n");
  }

  @Test
  public void qubitsAreAllocatedInIndexOrder() {
    DataflowModule module =
        lower(
            new Circuit()
                .block("X 5")
                .conditional("X 2", Cond.parity())
                .block("REPEAT 2 {\nH 9\n}"));
    long allocs = ops(module).stream().filter(op -> op.fullName().equals("qubit.alloc")).count();
    assertThat(allocs).isEqualTo(3);
    // X 5 acts on the second allocated qubit.
    assertThat(find(module, "gate.x").inputs.get(0).id).isEqualTo(1);
  }

  @SuppressWarnings("unused") // referenced by @Parameters
  private static Object[] gateLowerings() {
    return new Object[] {
      new Object[] {"S_DAG 0", "gate.s"},
      new Object[] {"T 0", "gate.t"},
      new Object[] {"I 0", "gate.i"},
      new Object[] {"SWAP 0 1", "gate.swap"},
      new Object[] {"CY 0 1", "gate.y"},
      new Object[] {"XCZ 0 1", "gate.x"},
      new Object[] {"YCZ 0 1", "gate.y"},
      new Object[] {"XCX 0 1", "gate.h gate.x gate.h"},
      new Object[] {"YCY 0 1", "gate.s gate.h gate.y gate.h gate.s"},
      new Object[] {"ISWAP 0 1", "gate.swap gate.z gate.s gate.s"},
      new Object[] {"R 0", "qubit.reset"},
      new Object[] {"RX 0", "qubit.reset gate.h"},
      new Object[] {"MX 0", "gate.h qubit.measureNd gate.h"},
      new Object[] {"MY 0", "gate.s gate.h qubit.measureNd gate.h gate.s"},
      new Object[] {"MR 0", "qubit.measureNd qubit.reset"},
      new Object[] {"MRY !0", "gate.s gate.h qubit.measureNd int.not qubit.reset gate.h gate.s"},
      new Object[] {"TICK\nQUBIT_COORDS(1, 2) 0\nM 0\nDETECTOR rec[-1]", "qubit.measureNd"},
    };
  }

  @Test
  @Parameters(method = "gateLowerings")
  public void gateLowering(String text, String expected) {
    DataflowModule module = lower(new Circuit(text));
    ImmutableList<String> names =
        ops(module).stream()
            .map(Operation::fullName)
            .filter(name -> !name.equals("qubit.alloc") && !name.equals("qubit.free"))
            .collect(toImmutableList());
    assertThat(Joiner.on(' ').join(names)).isEqualTo(expected);
  }

  @Test
  public void adjointAttribute() {
    DataflowModule module = lower(new Circuit("S_DAG 0\nT_DAG 0"));
    assertThat(find(module, "gate.s").attributes).containsEntry("adjoint", true);
    assertThat(find(module, "gate.t").attributes).containsEntry("adjoint", true);
    assertThat(find(module, "gate.t").attributes).containsEntry("controls", 0);
  }

  @Test
  public void conditional() {
    Circuit circuit = new Circuit().block("H 0\nM 0").conditional("X 1", Cond.lastMeas(0));
    assertThat(lower(circuit).toString())
        .isEqualTo(
            "func @main {\n"
                + "  %0:qubit = qubit.alloc()\n"
                + "  %1:qubit = qubit.alloc()\n"
                + "  %2:qubit = gate.h(%0) {controls=0, adjoint=false}\n"
                + "  %3:qubit, %4:int(1) = qubit.measureNd(%2)\n"
                + "  %12:qubit, %13:qubit, %14:int(1) = scf.switch(%4, %3, %1, %4) [\n"
                + "    region (%5:qubit, %6:qubit, %7:int(1)) {\n"
                + "      yield %5, %6, %7\n"
                + "    }\n"
                + "    region (%8:qubit, %9:qubit, %10:int(1)) {\n"
                + "      %11:qubit = gate.x(%9) {controls=0, adjoint=false}\n"
                + "      yield %8, %11, %10\n"
                + "    }\n"
                + "  ]\n"
                + "  qubit.free(%12)\n"
                + "  qubit.free(%13)\n"
                + "}\n");
  }

  @Test
  public void measurementsInsideBranchGetSlots() {
    Circuit circuit =
        new Circuit()
            .block("X 0\nM 0")
            .conditional("M 1", Cond.lastMeas(0))
            .conditional("X 0", Cond.lastMeas(0));
    DataflowModule module = lower(circuit);
    ImmutableList<Operation> switches =
        ops(module).stream()
            .filter(op -> op.fullName().equals("scf.switch"))
            .collect(toImmutableList());
    assertThat(switches).hasSize(2);
    Operation first = switches.get(0);
    // Two qubits, a zero slot for the body's measurement, the entry measurement, and the window.
    assertThat(first.inputs).hasSize(1 + 5);
    assertThat(first.outputs).hasSize(5);
    assertThat(first.inputs.get(3).type.width()).isEqualTo(1);
    // The window enters holding the entry window's bit, which is also the selector.
    assertThat(first.inputs.get(5)).isEqualTo(first.inputs.get(0));
    Region body = first.regions.get(1);
    assertThat(body.targets.get(4)).isEqualTo(results(body).get(0));
    // The second condition reads the window written by the first branch.
    assertThat(switches.get(1).inputs.get(0)).isEqualTo(first.outputs.get(4));
  }

  @Test
  public void emptyStateIsZeroFilled() {
    DataflowModule module = lower(new Circuit().conditional("M 0", Cond.parity()));
    Operation constant = find(module, "int.const");
    assertThat(constant.attributes).containsEntry("value", 0L);
    Operation branch = find(module, "scf.switch");
    // The selector is the empty parity; the measurement slot and the window share a second zero.
    assertThat(branch.inputs).hasSize(4);
    assertThat(branch.inputs.get(2)).isEqualTo(branch.inputs.get(3));
    assertThat(branch.inputs.get(2)).isNotEqualTo(branch.inputs.get(0));
  }

  @Test
  public void repeatUntilSuccess() {
    Circuit circuit = new Circuit().doWhile("R 0\nH 0\nM 0", Cond.lastMeas(0));
    assertThat(lower(circuit).toString())
        .isEqualTo(
            "func @main {\n"
                + "  %0:qubit = qubit.alloc()\n"
                + "  %1:int(1) = int.const() {value=0}\n"
                + "  %12:qubit, %13:int(1), %14:int(1) = scf.doWhile(%0, %1, %1) [\n"
                + "    region (%2:qubit, %3:int(1), %4:int(1)) {\n"
                + "      %5:qubit = qubit.reset(%2)\n"
                + "      %6:qubit = gate.h(%5) {controls=0, adjoint=false}\n"
                + "      %7:qubit, %8:int(1) = qubit.measureNd(%6)\n"
                + "      yield %7, %8, %8\n"
                + "    }\n"
                + "    region (%9:qubit, %10:int(1), %11:int(1)) {\n"
                + "      yield %11\n"
                + "    }\n"
                + "  ]\n"
                + "  qubit.free(%12)\n"
                + "}\n");
  }

  @Test
  public void whileLoopRegions() {
    Circuit circuit = new Circuit().block("M 0 1").whileLoop("X 0\nM 0", Cond.parity(-1, -2));
    Operation loop = find(lower(circuit), "scf.while");
    assertThat(loop.regions).hasSize(2);
    Region cond = loop.regions.get(0);
    Region body = loop.regions.get(1);
    assertThat(cond.targets).hasSize(1);
    assertThat(names(cond)).containsExactly("int.xor");
    assertThat(body.sources).hasSize(loop.inputs.size());
    assertThat(body.targets).hasSize(loop.outputs.size());
  }

  @Test
  public void whileConditionReadsEntryRecordFirst() {
    Circuit circuit = new Circuit().block("X 0\nM 0 1").whileLoop("M 1", Cond.parity(-2), 5);
    // rec[-2] is M 0 on entry, so the body runs once; then it is the entry M 1.
    assertThat(circuit.compileSampler(0L).sample(1))
        .containsExactly(ImmutableList.of(true, false, false));

    DataflowModule module = lower(circuit);
    ImmutableList<Value> entry = results(module.entrypointFunction().body);
    Operation loop = find(module, "scf.while");
    Region cond = loop.regions.get(0);
    Region body = loop.regions.get(1);
    Value read = cond.targets.get(0);
    assertThat(carriedIn(loop, cond, read)).isEqualTo(entry.get(0));
    // After an iteration the same source holds what the body yields in that position.
    int position = cond.sources.indexOf(read);
    assertThat(carriedIn(loop, body, body.targets.get(position))).isEqualTo(entry.get(1));
  }

  @Test
  public void doWhileConditionReadsBodyResults() {
    Circuit circuit =
        new Circuit().block("X 0\nM 0 1").doWhile("M 1", Cond.parity(-1, -3), 5);
    // After one iteration rec[-3] is M 0 and rec[-1] is the body's M 1, so there is a second.
    assertThat(circuit.compileSampler(0L).sample(1))
        .containsExactly(ImmutableList.of(true, false, false, false));

    DataflowModule module = lower(circuit);
    ImmutableList<Value> entry = results(module.entrypointFunction().body);
    Operation loop = find(module, "scf.doWhile");
    Region body = loop.regions.get(0);
    Region cond = loop.regions.get(1);
    Operation xor = cond.operations.get(0);
    assertThat(xor.fullName()).isEqualTo("int.xor");
    Value last = body.targets.get(cond.sources.indexOf(xor.inputs.get(0)));
    Value third = body.targets.get(cond.sources.indexOf(xor.inputs.get(1)));
    assertThat(last).isEqualTo(results(body).get(0));
    assertThat(carriedIn(loop, body, third)).isEqualTo(entry.get(0));
  }

  @Test
  public void conditionAfterBranchReadsEitherOutcome() {
    Circuit circuit =
        new Circuit()
            .block("X 0\nM 0 1")
            .conditional("M 1", Cond.lastMeas(-2))
            .conditional("X 1", Cond.parity(-2));
    DataflowModule module = lower(circuit);
    ImmutableList<Value> entry = results(module.entrypointFunction().body);
    ImmutableList<Operation> switches =
        ops(module).stream()
            .filter(op -> op.fullName().equals("scf.switch"))
            .collect(toImmutableList());
    Operation first = switches.get(0);
    assertThat(first.inputs.get(0)).isEqualTo(entry.get(0));

    int position = first.outputs.indexOf(switches.get(1).inputs.get(0));
    // Skipped: the record is M 0, M 1 and rec[-2] is M 0.
    Region skipped = first.regions.get(0);
    assertThat(carriedIn(first, skipped, skipped.targets.get(position))).isEqualTo(entry.get(0));
    // Taken: the body's M 1 follows, so rec[-2] is the entry M 1.
    Region taken = first.regions.get(1);
    assertThat(carriedIn(first, taken, taken.targets.get(position))).isEqualTo(entry.get(1));
  }

  @Test
  public void absoluteIndices() {
    // Results measured before the first measuring construct stay addressable at top level.
    DataflowModule module =
        lower(
            new Circuit()
                .block("X 0\nM 0")
                .doWhile("R 1\nH 1\nM 1", Cond.lastMeas(0))
                .conditional("X 2", Cond.parity(0)));
    assertThat(find(module, "scf.switch").inputs.get(0))
        .isEqualTo(results(module.entrypointFunction().body).get(0));
    // A loop that never measures keeps the record aligned.
    lower(new Circuit().block("M 0").whileLoop("X 1", Cond.parity(0), 3));

    CircuitException e =
        lowerFails(
            new Circuit().block("M 0").whileLoop("M 1", Cond.parity(0), 3),
            CircuitException.Kind.UNSUPPORTED);
    assertThat(e).hasMessageThat().contains("negative index");
    lowerFails(
        new Circuit()
            .block("M 0")
            .conditional("M 1", Cond.parity(-1))
            .block("M 1")
            .conditional("X 0", Cond.parity(1)),
        CircuitException.Kind.UNSUPPORTED);
  }

  @Test
  public void nestedControlFlow() {
    Circuit inner = new Circuit().block("H 1\nM 1").conditional("X 2\nM 2", Cond.lastMeas(0));
    Circuit circuit =
        new Circuit()
            .block("R 0 1 2\nM 0")
            .whileLoop(inner, Cond.parity(-1))
            .doWhile(
                new Circuit().block("MR 0").whileLoop("M 1", Cond.lastMeas(0)), Cond.parity(-1))
            .block("M 0 1 2");
    DataflowModule module = lower(circuit);
    Operation loop = find(module, "scf.while");
    Region body = loop.regions.get(1);
    assertThat(names(body)).contains("scf.switch");
    // Three qubits, zero slots for the body's two measurements, the entry measurement, and a
    // one-bit window.
    assertThat(loop.inputs).hasSize(3 + 3 + 1);
  }

  @Test
  public void classicalNodesAreSkipped() {
    Circuit plain = new Circuit().block("H 0\nM 0");
    Circuit classical =
        new Circuit()
            .block("H 0\nM 0")
            .let("x", Expr.rec(-1))
            .emit(Expr.var("x"), "x");
    assertThat(lower(classical).toString()).isEqualTo(lower(plain).toString());
  }

  @Test
  public void unstructuredConditionsAreRejected() {
    lowerFails(
        new Circuit().conditional("X 0", Cond.predicate(s -> true)),
        CircuitException.Kind.STRUCTURAL_VALIDATION);
    Circuit nested =
        new Circuit()
            .block("M 0")
            .whileLoop(
                new Circuit().block("M 0").doWhile("M 0", Cond.predicate(s -> false)),
                Cond.lastMeas(0));
    lowerFails(nested, CircuitException.Kind.STRUCTURAL_VALIDATION);
  }

  @Test
  public void expressionConditionsAreUnsupported() {
    lowerFails(
        new Circuit().block("M 0").conditional("X 0", Cond.of(Expr.rec(-1))),
        CircuitException.Kind.UNSUPPORTED);
  }

  @Test
  public void noiseIsUnsupported() {
    CircuitException e =
        lowerFails(new Circuit("X_ERROR(0.1) 0\nM 0"), CircuitException.Kind.UNSUPPORTED);
    assertThat(e).hasMessageThat().contains("X_ERROR");
  }

  @Test
  public void lastMeasOutOfRange() {
    lowerFails(
        new Circuit().conditional("X 0", Cond.lastMeas(0)), CircuitException.Kind.INDEX_RANGE);
    lowerFails(
        new Circuit().block("M 0").conditional("X 0", Cond.lastMeas(1)),
        CircuitException.Kind.INDEX_RANGE);
    lowerFails(
        new Circuit().block("M 0").conditional("X 0", Cond.parity(-2)),
        CircuitException.Kind.INDEX_RANGE);
    lowerFails(
        new Circuit().block("M 0").conditional("X 0", Cond.lastMeas(-2)),
        CircuitException.Kind.INDEX_RANGE);
  }

  @Test
  public void negativeLastMeasCountsFromEndOfWindow() {
    DataflowModule module =
        lower(new Circuit().block("M 0 1").conditional("X 0", Cond.lastMeas(-1)));
    assertThat(find(module, "scf.switch").inputs.get(0))
        .isEqualTo(results(module.entrypointFunction().body).get(1));
  }

  @Test
  public void writeDataflow() throws IOException {
    Circuit circuit = new Circuit().block("H 0\nM 0").conditional("X 0", Cond.lastMeas(0));
    Path path = tmp.getRoot().toPath().resolve("kernel.json");
    circuit.writeDataflow(path, "kernel");
    String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    assertThat(json).isEqualTo(circuit.toDataflow("kernel").toJson());
    assertThat(json).contains("\"name\": \"kernel\"");
    assertThat(json).contains("\"name\": \"switch\"");
  }
}
