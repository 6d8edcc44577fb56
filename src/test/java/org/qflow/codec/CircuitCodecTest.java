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


package org.qflow.codec;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.nio.charset.StandardCharsets;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.qflow.CircuitException;
import org.qflow.circuit.Circuit;
import org.qflow.cond.Cond;
import org.qflow.cond.Expr;

@RunWith(JUnitParamsRunner.class)
public class CircuitCodecTest {

  private static Circuit roundTrip(Circuit circuit) {
    return CircuitCodec.decode(CircuitCodec.encode(circuit));
  }

  private static Circuit decode(String json) {
    return CircuitCodec.decode(json.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void emptyCircuit() {
    assertThat(new String(CircuitCodec.encode(new Circuit()), StandardCharsets.UTF_8))
        .isEqualTo("{\"nodes\":[]}");
    assertThat(roundTrip(new Circuit())).isEqualTo(new Circuit());
  }

  @Test
  public void allNodeKinds() {
    Circuit circuit =
        new Circuit()
            .block("R 0 1\nH 0\nREPEAT 2 {\n  CX 0 1\n}\nM 0 !1")
            .block("X_ERROR(0.25) 1\nM 1", false)
            .conditional("X 1", Cond.lastMeas(1))
            .whileLoop(
                new Circuit().block("MR 2").conditional("H 2", Cond.parity()),
                Cond.parity(-1, 0),
                17)
            .doWhile("R 3\nH 3\nM 3", Cond.lastMeas(-1));
    Circuit decoded = roundTrip(circuit);
    assertThat(decoded).isEqualTo(circuit);
    assertThat(decoded.toString()).isEqualTo(circuit.toString());
  }

  @Test
  public void messageLayout() {
    Circuit circuit =
        new Circuit()
            .block("H 0\nM 0")
            .doWhile(new Circuit().block("M 1", false), Cond.parity(-1, -2), 5);
    JsonObject json =
        JsonParser.parseString(new String(CircuitCodec.encode(circuit), StandardCharsets.UTF_8))
            .getAsJsonObject();
    JsonArray nodes = json.getAsJsonArray("nodes");
    assertThat(nodes).hasSize(2);

    JsonObject block = nodes.get(0).getAsJsonObject();
    assertThat(block.get("type").getAsString()).isEqualTo("block");
    assertThat(block.get("instructions").getAsString()).isEqualTo("H 0\nM 0");
    assertThat(block.get("captureAsLast").getAsBoolean()).isTrue();

    JsonObject loop = nodes.get(1).getAsJsonObject();
    assertThat(loop.get("type").getAsString()).isEqualTo("doWhile");
    assertThat(loop.get("maxIterations").getAsInt()).isEqualTo(5);
    JsonObject cond = loop.getAsJsonObject("cond");
    assertThat(cond.get("type").getAsString()).isEqualTo("measParity");
    assertThat(cond.getAsJsonArray("indices").toString()).isEqualTo("[-1,-2]");
    JsonObject inner =
        loop.getAsJsonObject("body").getAsJsonArray("nodes").get(0).getAsJsonObject();
    assertThat(inner.get("captureAsLast").getAsBoolean()).isFalse();
  }

  @Test
  public void decodesHandWrittenMessage() {
    Circuit decoded =
        decode(
            "{\"nodes\": ["
                + "{\"type\": \"block\", \"instructions\": \"H 0\\nM 0\", \"captureAsLast\": true},"
                + "{\"type\": \"if\", \"cond\": {\"type\": \"lastMeas\", \"index\": 0},"
                + " \"body\": {\"nodes\": []}},"
                + "{\"type\": \"while\", \"cond\": {\"type\": \"measParity\", \"indices\": []},"
                + " \"body\": {\"nodes\": []}, \"maxIterations\": 3.0}"
                + "]}");
    Circuit expected =
        new Circuit()
            .block("H 0\nM 0")
            .conditional(new Circuit(), Cond.lastMeas(0))
            .whileLoop(new Circuit(), Cond.parity(), 3);
    assertThat(decoded).isEqualTo(expected);
  }

  @Test
  public void classicalNodesCannotBeEncoded() {
    CircuitException e =
        assertThrows(
            CircuitException.class,
            () -> CircuitCodec.encode(new Circuit().let("x", Expr.literal(1))));
    assertThat(e.kind).isEqualTo(CircuitException.Kind.UNSUPPORTED);
    e =
        assertThrows(
            CircuitException.class,
            () -> CircuitCodec.encode(new Circuit().emit(Expr.TRUE, "out")));
    assertThat(e.kind).isEqualTo(CircuitException.Kind.UNSUPPORTED);
  }

  @Test
  public void expressionConditionsCannotBeEncoded() {
    Circuit circuit = new Circuit().conditional("X 0", Cond.of(Expr.var("flag")));
    CircuitException e = assertThrows(CircuitException.class, () -> CircuitCodec.encode(circuit));
    assertThat(e.kind).isEqualTo(CircuitException.Kind.UNSUPPORTED);
  }

  @Test
  public void unstructuredConditionsCannotBeEncoded() {
    Circuit body = new Circuit().doWhile("M 0", Cond.predicate(s -> s.recordSize() < 2));
    Circuit circuit = new Circuit().whileLoop(body, Cond.parity());
    CircuitException e = assertThrows(CircuitException.class, () -> CircuitCodec.encode(circuit));
    assertThat(e.kind).isEqualTo(CircuitException.Kind.STRUCTURAL_VALIDATION);
  }

  @SuppressWarnings("unused") // referenced by @Parameters
  private static Object[] malformedMessages() {
    return new Object[] {
      new Object[] {""},
      new Object[] {"{"},
      new Object[] {"[]"},
      new Object[] {"{}"},
      new Object[] {"{\"nodes\": 3}"},
      new Object[] {"{\"nodes\": [3]}"},
      new Object[] {"{\"nodes\": [{}]}"},
      new Object[] {"{\"nodes\": [{\"type\": \"loop\"}]}"},
      new Object[] {"{\"nodes\": [{\"type\": \"block\", \"instructions\": \"H 0\"}]}"},
      new Object[] {
        "{\"nodes\": [{\"type\": \"block\", \"instructions\": \"FOO 0\", \"captureAsLast\": true}]}"
      },
      new Object[] {
        "{\"nodes\": [{\"type\": \"block\", \"instructions\": 7, \"captureAsLast\": true}]}"
      },
      new Object[] {
        "{\"nodes\": [{\"type\": \"block\", \"instructions\": \"H 0\","
            + " \"captureAsLast\": \"yes\"}]}"
      },
      new Object[] {"{\"nodes\": [{\"type\": \"if\", \"body\": {\"nodes\": []}}]}"},
      new Object[] {
        "{\"nodes\": [{\"type\": \"if\", \"cond\": {\"type\": \"expr\"},"
            + " \"body\": {\"nodes\": []}}]}"
      },
      new Object[] {
        "{\"nodes\": [{\"type\": \"if\", \"cond\": {\"type\": \"lastMeas\", \"index\": 0.5},"
            + " \"body\": {\"nodes\": []}}]}"
      },
      new Object[] {
        "{\"nodes\": [{\"type\": \"while\", \"cond\": {\"type\": \"lastMeas\", \"index\": 0},"
            + " \"body\": {\"nodes\": []}, \"maxIterations\": 1e12}]}"
      },
      new Object[] {
        "{\"nodes\": [{\"type\": \"doWhile\", \"cond\": {\"type\": \"lastMeas\", \"index\": 0},"
            + " \"body\": {\"nodes\": []}}]}"
      },
      new Object[] {
        "{\"nodes\": [{\"type\": \"if\", \"cond\": {\"type\": \"measParity\", \"indices\": 1},"
            + " \"body\": {\"nodes\": []}}]}"
      },
    };
  }

  @Test
  @Parameters(method = "malformedMessages")
  public void malformedMessagesAreRejected(String json) {
    assertThrows(IllegalArgumentException.class, () -> decode(json));
  }

  @Test
  public void nonPositiveBudgetIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            decode(
                "{\"nodes\": [{\"type\": \"while\", \"cond\": {\"type\": \"lastMeas\", \"index\":"
                    + " 0}, \"body\": {\"nodes\": []}, \"maxIterations\": 0}]}"));
  }

  @Test
  public void decodedSamplerMatches() {
    Circuit circuit =
        new Circuit().block("H 0\nM 0").conditional("X 1", Cond.lastMeas(0)).block("M 1");
    assertThat(roundTrip(circuit).compileSampler(4L).sample(20))
        .isEqualTo(circuit.compileSampler(4L).sample(20));
  }
}
