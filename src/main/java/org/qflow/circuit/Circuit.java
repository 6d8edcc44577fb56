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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.qflow.CircuitException;
import org.qflow.cond.Cond;
import org.qflow.cond.Expr;
import org.qflow.dataflow.DataflowModule;
import org.qflow.exec.DynamicSampler;
import org.qflow.lower.DataflowExporter;
import org.qflow.sim.StaticDetectorSampler;

/**
 * A Circuit is an ordered sequence of {@link Node}s, built by calling the append methods ({@link
 * #block}, {@link #conditional}, {@link #whileLoop}, {@link #doWhile}, {@link #let}, {@link #emit},
 * {@link #append}). Each returns the Circuit itself, so calls can be chained:
 *
 * <pre>{@code
 * Circuit c = new Circuit()
 *     .block("H 0\nM 0")
 *     .conditional("X 1", Cond.lastMeas(0))
 *     .block("M 1");
 * }</pre>
 *
 * <p>Nodes are only ever appended; once appended a node is never changed or removed. Bodies passed
 * to the control-flow methods are copied, so later changes to the caller's Circuit do not affect
 * nodes that were built from it.
 */
public final class Circuit {

  /**
   * The iteration budget used by {@link #whileLoop} and {@link #doWhile} when none is given;
   * overridden by the {@code qflow.maxIterations} system property.
   */
  public static final int DEFAULT_MAX_ITERATIONS =
      Integer.getInteger("qflow.maxIterations", 10_000);

  private final List<Node> nodes;

  /** True for the bodies owned by control-flow nodes, which may not be appended to. */
  private final boolean frozen;

  public Circuit() {
    this.nodes = new ArrayList<>();
    this.frozen = false;
  }

  /** Creates a Circuit containing a single captured block parsed from the given text. */
  public Circuit(String instructions) {
    this();
    block(instructions);
  }

  private Circuit(List<Node> nodes, boolean frozen) {
    this.nodes = nodes;
    this.frozen = frozen;
  }

  /** Returns a Circuit containing a single captured block parsed from the given text. */
  public static Circuit parse(String instructions) {
    return new Circuit(instructions);
  }

  /**
   * Returns a Circuit containing a single captured block; the inverse of {@link
   * #toFlatInstructions}.
   */
  public static Circuit fromInstructions(InstructionList instructions) {
    return new Circuit().block(instructions);
  }

  /** Returns a new Circuit containing the nodes of each argument, in order. */
  public static Circuit concat(Circuit... circuits) {
    Circuit result = new Circuit();
    for (Circuit c : circuits) {
      result.append(c);
    }
    return result;
  }

  /** Returns an immutable copy of this Circuit (or this Circuit, if it is already frozen). */
  Circuit frozenCopy() {
    return frozen ? this : new Circuit(ImmutableList.copyOf(nodes), true);
  }

  public ImmutableList<Node> nodes() {
    return ImmutableList.copyOf(nodes);
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  @CanIgnoreReturnValue
  private Circuit add(Node node) {
    Preconditions.checkState(!frozen, "Cannot append to the body of a control-flow node");
    nodes.add(node);
    return this;
  }

  /** Appends a block of instructions, parsed from text, whose measurements are captured. */
  @CanIgnoreReturnValue
  public Circuit block(String instructions) {
    return block(InstructionList.parse(instructions), true);
  }

  /**
   * Appends a block of instructions parsed from text.
   *
   * @param captureAsLast if true, the measurements made by this block become the window read by
   *     {@link Cond.LastMeas}
   */
  @CanIgnoreReturnValue
  public Circuit block(String instructions, boolean captureAsLast) {
    return block(InstructionList.parse(instructions), captureAsLast);
  }

  @CanIgnoreReturnValue
  public Circuit block(InstructionList instructions) {
    return block(instructions, true);
  }

  @CanIgnoreReturnValue
  public Circuit block(InstructionList instructions, boolean captureAsLast) {
    return add(new Node.Block(instructions, captureAsLast));
  }

  /** Inlines all the nodes of {@code sub}; equivalent to {@link #append}. */
  @CanIgnoreReturnValue
  public Circuit block(Circuit sub) {
    return append(sub);
  }

  /** Appends an existing node. */
  @CanIgnoreReturnValue
  public Circuit block(Node node) {
    return add(node);
  }

  /** Appends all the nodes of {@code other}; concatenation of circuits. */
  @CanIgnoreReturnValue
  public Circuit append(Circuit other) {
    // Copy first, in case other == this.
    for (Node node : other.nodes()) {
      add(node);
    }
    return this;
  }

  /** Appends an If node whose body is a single block parsed from {@code body}. */
  @CanIgnoreReturnValue
  public Circuit conditional(String body, Cond cond) {
    return conditional(parse(body), cond);
  }

  @CanIgnoreReturnValue
  public Circuit conditional(InstructionList body, Cond cond) {
    return conditional(fromInstructions(body), cond);
  }

  @CanIgnoreReturnValue
  public Circuit conditional(Circuit body, Cond cond) {
    return add(new Node.If(cond, body));
  }

  @CanIgnoreReturnValue
  public Circuit whileLoop(String body, Cond cond) {
    return whileLoop(parse(body), cond, DEFAULT_MAX_ITERATIONS);
  }

  @CanIgnoreReturnValue
  public Circuit whileLoop(InstructionList body, Cond cond) {
    return whileLoop(fromInstructions(body), cond, DEFAULT_MAX_ITERATIONS);
  }

  @CanIgnoreReturnValue
  public Circuit whileLoop(Circuit body, Cond cond) {
    return whileLoop(body, cond, DEFAULT_MAX_ITERATIONS);
  }

  @CanIgnoreReturnValue
  public Circuit whileLoop(String body, Cond cond, int maxIterations) {
    return whileLoop(parse(body), cond, maxIterations);
  }

  @CanIgnoreReturnValue
  public Circuit whileLoop(InstructionList body, Cond cond, int maxIterations) {
    return whileLoop(fromInstructions(body), cond, maxIterations);
  }

  /**
   * Appends a While node: {@code body} is executed repeatedly as long as {@code cond} is true,
   * checked before each iteration. Executing the body more than {@code maxIterations} times is an
   * error.
   */
  @CanIgnoreReturnValue
  public Circuit whileLoop(Circuit body, Cond cond, int maxIterations) {
    return add(new Node.While(cond, body, maxIterations));
  }

  @CanIgnoreReturnValue
  public Circuit doWhile(String body, Cond cond) {
    return doWhile(parse(body), cond, DEFAULT_MAX_ITERATIONS);
  }

  @CanIgnoreReturnValue
  public Circuit doWhile(InstructionList body, Cond cond) {
    return doWhile(fromInstructions(body), cond, DEFAULT_MAX_ITERATIONS);
  }

  @CanIgnoreReturnValue
  public Circuit doWhile(Circuit body, Cond cond) {
    return doWhile(body, cond, DEFAULT_MAX_ITERATIONS);
  }

  @CanIgnoreReturnValue
  public Circuit doWhile(String body, Cond cond, int maxIterations) {
    return doWhile(parse(body), cond, maxIterations);
  }

  @CanIgnoreReturnValue
  public Circuit doWhile(InstructionList body, Cond cond, int maxIterations) {
    return doWhile(fromInstructions(body), cond, maxIterations);
  }

  /**
   * Appends a DoWhile node: {@code body} is executed once, then repeated as long as {@code cond} is
   * true. Useful for repeat-until-success patterns (run, measure, check).
   */
  @CanIgnoreReturnValue
  public Circuit doWhile(Circuit body, Cond cond, int maxIterations) {
    return add(new Node.DoWhile(cond, body, maxIterations));
  }

  /** Appends a Let node, binding {@code name} to the value of {@code expr}. */
  @CanIgnoreReturnValue
  public Circuit let(String name, Expr expr) {
    return add(new Node.Let(name, expr));
  }

  /** Appends an unnamed Emit node. */
  @CanIgnoreReturnValue
  public Circuit emit(Expr expr) {
    return add(new Node.Emit(expr, null));
  }

  /** Appends an Emit node labeled with {@code name}. */
  @CanIgnoreReturnValue
  public Circuit emit(Expr expr, @Nullable String name) {
    return add(new Node.Emit(expr, name));
  }

  /** True if every node is a Block, i.e. the circuit has no control flow or classical state. */
  public boolean isStatic() {
    return nodes.stream().allMatch(n -> n.kind() == Node.Kind.BLOCK);
  }

  /**
   * Returns the concatenation of all blocks' instructions.
   *
   * @throws CircuitException of kind STATIC_CIRCUIT_REQUIRED if the circuit is not static
   */
  public InstructionList toFlatInstructions() {
    InstructionList result = InstructionList.EMPTY;
    for (Node node : nodes) {
      if (!(node instanceof Node.Block block)) {
        throw CircuitException.staticCircuitRequired(
            "Cannot flatten a circuit containing a %s node", node.kind());
      }
      result = result.concat(block.instructions);
    }
    return result;
  }

  /** Returns a sampler that interprets this circuit shot by shot. */
  public DynamicSampler compileSampler(@Nullable Long seed) {
    return new DynamicSampler(this, seed);
  }

  /** Returns a sampler with non-deterministic seeding. */
  public DynamicSampler compileSampler() {
    return compileSampler(null);
  }

  /**
   * Returns a detection-event sampler for this circuit, which must be static.
   *
   * @throws CircuitException of kind STATIC_CIRCUIT_REQUIRED if the circuit is not static
   */
  public StaticDetectorSampler compileDetectorSampler(@Nullable Long seed) {
    return new StaticDetectorSampler(toFlatInstructions(), seed);
  }

  /**
   * Lowers this circuit to a dataflow module with a single function of the given name.
   *
   * @throws CircuitException if the circuit uses a condition or instruction that cannot be lowered
   */
  public DataflowModule toDataflow(String name) {
    return DataflowExporter.export(this, name);
  }

  public DataflowModule toDataflow() {
    return toDataflow("main");
  }

  /** Lowers this circuit and writes the resulting module to {@code path} as JSON. */
  public void writeDataflow(Path path, String name) throws IOException {
    toDataflow(name).writeTo(path);
  }

  void appendTo(StringBuilder sb, String indent) {
    for (Node node : nodes) {
      node.appendTo(sb, indent);
    }
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Circuit c && c.nodes.equals(nodes);
  }

  @Override
  public int hashCode() {
    return nodes.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, "");
    if (sb.length() > 0) {
      sb.setLength(sb.length() - 1);
    }
    return sb.toString();
  }
}
