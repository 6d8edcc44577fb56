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

import org.qflow.CircuitException;
import org.qflow.circuit.Circuit;
import org.qflow.circuit.Node;

/** Executes a {@link Circuit} against the state of a single shot by walking its nodes. */
public final class Interpreter {

  private Interpreter() {}

  /**
   * Executes each node of {@code circuit} in order, updating {@code ctx}. Stops at the first error,
   * leaving {@code ctx} in whatever state the shot had reached.
   */
  public static void execute(Circuit circuit, ExecContext ctx) {
    for (Node node : circuit.nodes()) {
      execute(node, ctx);
    }
  }

  private static void execute(Node node, ExecContext ctx) {
    switch (node.kind()) {
      case BLOCK:
        Node.Block block = (Node.Block) node;
        ctx.runBlock(block.instructions, block.captureAsLast);
        break;
      case IF:
        Node.If ifNode = (Node.If) node;
        if (ifNode.cond.eval(ctx)) {
          execute(ifNode.body, ctx);
        }
        break;
      case WHILE:
        Node.While whileNode = (Node.While) node;
        int iterations = 0;
        while (whileNode.cond.eval(ctx)) {
          if (++iterations > whileNode.maxIterations) {
            throw CircuitException.iterationBudgetExceeded(
                "While loop exceeded maxIterations=%s", whileNode.maxIterations);
          }
          execute(whileNode.body, ctx);
        }
        break;
      case DO_WHILE:
        Node.DoWhile doWhile = (Node.DoWhile) node;
        int count = 0;
        do {
          if (++count > doWhile.maxIterations) {
            throw CircuitException.iterationBudgetExceeded(
                "Do-while loop exceeded maxIterations=%s", doWhile.maxIterations);
          }
          execute(doWhile.body, ctx);
        } while (doWhile.cond.eval(ctx));
        break;
      case LET:
        Node.Let let = (Node.Let) node;
        ctx.setVar(let.name, let.expr.eval(ctx));
        break;
      case EMIT:
        Node.Emit emit = (Node.Emit) node;
        ctx.emit(emit.expr.test(ctx), emit.name);
        break;
    }
  }
}
