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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qflow.CircuitException;
import org.qflow.circuit.Circuit;
import org.qflow.cond.Cond;
import org.qflow.cond.Expr;
import org.qflow.sim.TableauSimulator;

@RunWith(JUnit4.class)
public class DynamicSamplerTest {

  private static final ImmutableList<Boolean> TRUE = ImmutableList.of(true);

  @Test
  public void deterministicMeasurement() {
    Circuit circuit = new Circuit().block("X 0\nM 0");
    assertThat(circuit.compileSampler(1L).sample(10))
        .containsExactlyElementsIn(Collections.nCopies(10, TRUE));
    assertThat(circuit.compileSampler().sample(3)).containsExactly(TRUE, TRUE, TRUE);
  }

  @Test
  public void noShots() {
    assertThat(new Circuit().block("H 0\nM 0").compileSampler(0L).sample(0)).isEmpty();
    assertThrows(
        IllegalArgumentException.class,
        () -> new Circuit().block("M 0").compileSampler(0L).sample(-1));
  }

  @Test
  public void conditionalCopiesMeasurement() {
    Circuit circuit =
        new Circuit().block("H 0\nM 0").conditional("X 1", Cond.lastMeas(0)).block("M 1");
    int ones = 0;
    for (ImmutableList<Boolean> shot : circuit.compileSampler(7L).sample(100)) {
      assertThat(shot).hasSize(2);
      assertThat(shot.get(1)).isEqualTo(shot.get(0));
      if (shot.get(0)) {
        ones++;
      }
    }
    // Both branches are taken.
    assertThat(ones).isGreaterThan(0);
    assertThat(ones).isLessThan(100);
  }

  @Test
  public void repeatUntilSuccess() {
    Circuit circuit = new Circuit().doWhile("R 0\nH 0\nM 0", Cond.lastMeas(0));
    boolean sawRetry = false;
    for (ImmutableList<Boolean> shot : circuit.compileSampler(3L).sample(50)) {
      assertThat(shot).isNotEmpty();
      assertThat(shot.get(shot.size() - 1)).isFalse();
      assertThat(shot.subList(0, shot.size() - 1)).doesNotContain(false);
      sawRetry |= shot.size() > 1;
    }
    assertThat(sawRetry).isTrue();
  }

  @Test
  public void whileMayRunZeroTimes() {
    Circuit circuit = new Circuit().block("M 0").whileLoop("X 0\nM 0", Cond.lastMeas(0));
    assertThat(circuit.compileSampler(0L).sample(1)).containsExactly(ImmutableList.of(false));
  }

  @Test
  public void doWhileRunsAtLeastOnce() {
    Circuit circuit = new Circuit().block("M 0").doWhile("X 1\nM 1", Cond.lastMeas(0));
    // The body measures 1, then 0.
    assertThat(circuit.compileSampler(0L).sample(1))
        .containsExactly(ImmutableList.of(false, true, false));
  }

  @Test
  public void negativeLastMeasCountsFromEndOfWindow() {
    Circuit circuit =
        new Circuit()
            .block("X 0\nM 0 1")
            .conditional(new Circuit().block("X 2", false), Cond.lastMeas(-2))
            .conditional(new Circuit().block("X 3", false), Cond.lastMeas(-1))
            .block("M 2 3", false);
    assertThat(circuit.compileSampler(0L).sample(1))
        .containsExactly(ImmutableList.of(true, false, true, false));
  }

  @Test
  public void iterationBudget() {
    Circuit circuit = new Circuit().block("X 0\nM 0").whileLoop("M 0", Cond.lastMeas(0), 5);
    DynamicSampler sampler = circuit.compileSampler(0L);
    CircuitException e = assertThrows(CircuitException.class, () -> sampler.sample(1));
    assertThat(e.kind).isEqualTo(CircuitException.Kind.ITERATION_BUDGET_EXCEEDED);
    assertThat(e).hasMessageThat().contains("maxIterations=5");

    Circuit doWhile = new Circuit().doWhile("X 0\nM 0\nX 0", Cond.lastMeas(0), 2);
    CircuitException e2 =
        assertThrows(CircuitException.class, () -> doWhile.compileSampler(0L).sample(1));
    assertThat(e2.kind).isEqualTo(CircuitException.Kind.ITERATION_BUDGET_EXCEEDED);
  }

  @Test
  public void budgetIsNotExceededAtTheLimit() {
    // Runs the body exactly three times, counting with a variable.
    Circuit circuit =
        new Circuit()
            .let("n", Expr.literal(0))
            .whileLoop(
                new Circuit().let("n", Expr.var("n").plus(Expr.literal(1))),
                Cond.of(Expr.var("n").plus(Expr.literal(1)).mod(Expr.literal(4))),
                3);
    ShotResult result = circuit.compileSampler(0L).sampleWithClassical(1).get(0);
    assertThat(result.vars).containsExactly("n", 3L);
  }

  @Test
  public void parityCondition() {
    Circuit circuit =
        new Circuit()
            .block("X 0\nM 0 1")
            .conditional("X 2", Cond.parity(-1, -2))
            .conditional("X 3", Cond.parity(1))
            .block("M 2 3");
    assertThat(circuit.compileSampler(0L).sample(1))
        .containsExactly(ImmutableList.of(true, false, true, false));
  }

  @Test
  public void uncapturedBlockLeavesWindowAlone() {
    Circuit circuit =
        new Circuit()
            .block("X 0\nM 0")
            .block("M 1", false)
            .conditional("X 2", Cond.lastMeas(0))
            .block("M 2");
    assertThat(circuit.compileSampler(0L).sample(1))
        .containsExactly(ImmutableList.of(true, false, true));
  }

  @Test
  public void lastMeasBeforeAnyBlockIsOutOfRange() {
    Circuit circuit = new Circuit().conditional("X 0", Cond.lastMeas(0));
    CircuitException e =
        assertThrows(CircuitException.class, () -> circuit.compileSampler(0L).sample(1));
    assertThat(e.kind).isEqualTo(CircuitException.Kind.INDEX_RANGE);
  }

  @Test
  public void recordOutOfBounds() {
    Circuit circuit = new Circuit().block("M 0").conditional("X 0", Cond.of(Expr.rec(-5)));
    CircuitException e =
        assertThrows(CircuitException.class, () -> circuit.compileSampler(0L).sample(1));
    assertThat(e.kind).isEqualTo(CircuitException.Kind.INDEX_RANGE);
    assertThat(e).hasMessageThat().contains("out of bounds");
  }

  @Test
  public void classicalState() {
    Circuit circuit =
        new Circuit()
            .block("X 0\nM 0 1")
            .let("a", Expr.rec(-2).xor(Expr.rec(-1)))
            .let("b", Expr.literal(40).plus(Expr.literal(2)))
            .emit(Expr.var("a"), "a")
            .emit(Expr.rec(-1))
            .emit(Expr.var("b").mod(Expr.literal(2)), "even");
    ImmutableList<ShotResult> results = circuit.compileSampler(0L).sampleWithClassical(2);
    ShotResult expected =
        new ShotResult(
            ImmutableList.of(true, false),
            ImmutableList.of(true, false, false),
            ImmutableList.of("a", "even"),
            ImmutableMap.of("a", 1L, "b", 42L));
    assertThat(results).containsExactly(expected, expected);
  }

  @Test
  public void unboundVariable() {
    Circuit circuit = new Circuit().emit(Expr.var("missing"));
    CircuitException e =
        assertThrows(CircuitException.class, () -> circuit.compileSampler(0L).sample(1));
    assertThat(e.kind).isEqualTo(CircuitException.Kind.MISSING_BINDING);
  }

  @Test
  public void loopOverVariable() {
    Circuit circuit =
        new Circuit()
            .let("n", Expr.literal(1))
            .whileLoop(
                new Circuit().let("n", Expr.var("n").plus(Expr.literal(1))).block("X 0", false),
                Cond.of(Expr.var("n").mod(Expr.literal(3))))
            .block("M 0");
    ShotResult result = circuit.compileSampler(0L).sampleWithClassical(1).get(0);
    assertThat(result.vars).containsExactly("n", 3L);
    assertThat(result.measurements).containsExactly(false);
  }

  @Test
  public void predicateCondition() {
    Circuit circuit =
        new Circuit().whileLoop("M 0", Cond.predicate(state -> state.recordSize() < 3));
    assertThat(circuit.compileSampler(0L).sample(1))
        .containsExactly(ImmutableList.of(false, false, false));
  }

  @Test
  public void sameSeedSameSamples() {
    Circuit circuit = new Circuit().doWhile("R 0 1\nH 0 1\nM 0 1", Cond.parity(-1, -2));
    assertThat(circuit.compileSampler(123L).sample(40))
        .isEqualTo(circuit.compileSampler(123L).sample(40));
    assertThat(circuit.compileSampler(123L).sampleWithClassical(40))
        .isEqualTo(circuit.compileSampler(123L).sampleWithClassical(40));
  }

  @Test
  public void parallelMatchesSequential() {
    Circuit circuit =
        new Circuit()
            .block("H 0 1 2\nM 0 1 2")
            .conditional("X 3", Cond.parity(0, 1, 2))
            .doWhile("R 4\nH 4\nM 4", Cond.lastMeas(0))
            .block("M 3");
    DynamicSampler sampler = circuit.compileSampler(99L);
    assertThat(sampler.parallel(true).sample(200)).isEqualTo(sampler.sample(200));
  }

  @Test
  public void shotSeedsAreConsecutive() {
    List<Long> seeds = Collections.synchronizedList(new ArrayList<>());
    DynamicSampler sampler =
        new DynamicSampler(
            new Circuit().block("M 0"),
            10L,
            seed -> {
              seeds.add(seed);
              return new TableauSimulator(seed);
            });
    sampler.sample(3);
    assertThat(seeds).containsExactly(10L, 11L, 12L).inOrder();
  }

  @Test
  public void runShotExposesContext() {
    Circuit circuit = new Circuit().block("X 0\nM 0 1").block("M 0", false);
    ExecContext ctx = new DynamicSampler(circuit, 0L).runShot(0);
    assertThat(ctx.measurements()).containsExactly(true, false, true).inOrder();
    assertThat(ctx.lastBlock()).containsExactly(true, false).inOrder();
    assertThat(ctx.recordSize()).isEqualTo(3);
    assertThat(ctx.rec(-1)).isTrue();
    assertThat(ctx.hasVar("x")).isFalse();
  }
}
