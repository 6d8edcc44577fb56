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

import com.google.common.collect.ImmutableList;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.qflow.circuit.InstructionTextParser.ArgContext;
import org.qflow.circuit.InstructionTextParser.InstructionContext;
import org.qflow.circuit.InstructionTextParser.QubitTargetContext;
import org.qflow.circuit.InstructionTextParser.RecTargetContext;
import org.qflow.circuit.InstructionTextParser.RepeatBlockContext;
import org.qflow.circuit.InstructionTextParser.StatementContext;
import org.qflow.circuit.InstructionTextParser.StatementsContext;
import org.qflow.circuit.InstructionTextParser.TargetContext;

/** Parses the text form of an {@link InstructionList}. */
final class InstructionParser {

  // Static methods only
  private InstructionParser() {}

  /** Parses an instruction list; throws a ParseError if the text is not valid. */
  static InstructionList parse(String text) {
    // Throw ParseErrors in response to lexing and parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new ParseError(msg, lineNum, charPositionInLine);
          }
        };
    InstructionTextLexer lexer = new InstructionTextLexer(CharStreams.fromString(text));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    InstructionTextParser parser = new InstructionTextParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return toList(parser.program().statements());
  }

  private static InstructionList toList(StatementsContext statements) {
    if (statements == null) {
      return InstructionList.EMPTY;
    }
    ImmutableList.Builder<InstructionList.Entry> entries = ImmutableList.builder();
    for (StatementContext statement : statements.statement()) {
      if (statement.instruction() != null) {
        entries.add(toInstruction(statement.instruction()));
      } else {
        entries.add(toRepeatBlock(statement.repeatBlock()));
      }
    }
    return InstructionList.of(entries.build());
  }

  private static RepeatBlock toRepeatBlock(RepeatBlockContext ctx) {
    int count = parseInt(ctx.NUMBER());
    if (count <= 0) {
      throw error(ctx.NUMBER().getSymbol(), "REPEAT count must be positive");
    }
    return new RepeatBlock(count, toList(ctx.statements()));
  }

  private static Instruction toInstruction(InstructionContext ctx) {
    Token nameToken = ctx.NAME().getSymbol();
    Gate gate = Gate.lookup(nameToken.getText());
    if (gate == null) {
      throw error(nameToken, "Unknown instruction '" + nameToken.getText() + "'");
    }
    ImmutableList.Builder<Double> args = ImmutableList.builder();
    if (ctx.argList() != null) {
      for (ArgContext arg : ctx.argList().arg()) {
        double value = parseDouble(arg.NUMBER());
        args.add(arg.MINUS() == null ? value : -value);
      }
    }
    ImmutableList.Builder<Target> targets = ImmutableList.builder();
    for (TargetContext target : ctx.target()) {
      targets.add(toTarget(target));
    }
    try {
      return new Instruction(gate, args.build(), targets.build());
    } catch (IllegalArgumentException e) {
      throw error(nameToken, e.getMessage());
    }
  }

  private static Target toTarget(TargetContext ctx) {
    if (ctx instanceof QubitTargetContext qubit) {
      int index = parseInt(qubit.NUMBER());
      return (qubit.BANG() == null) ? Target.qubit(index) : Target.invertedQubit(index);
    }
    RecTargetContext rec = (RecTargetContext) ctx;
    int lookback = parseInt(rec.NUMBER());
    if (lookback == 0) {
      throw error(rec.NUMBER().getSymbol(), "rec[-0] is not a valid lookback");
    }
    return Target.record(lookback);
  }

  private static int parseInt(TerminalNode node) {
    try {
      return Integer.parseInt(node.getText());
    } catch (NumberFormatException e) {
      throw error(
          node.getSymbol(), "Expected a non-negative integer, got '" + node.getText() + "'");
    }
  }

  private static double parseDouble(TerminalNode node) {
    // The lexer only accepts well-formed decimal numbers.
    return Double.parseDouble(node.getText());
  }

  /** Returns a new ParseError referring to the given token. */
  private static ParseError error(Token token, String msg) {
    return new ParseError(msg, token.getLine(), token.getCharPositionInLine());
  }
}
