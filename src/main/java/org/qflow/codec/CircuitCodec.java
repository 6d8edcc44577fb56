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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.nio.charset.StandardCharsets;
import org.qflow.CircuitException;
import org.qflow.circuit.Circuit;
import org.qflow.circuit.InstructionList;
import org.qflow.circuit.Node;
import org.qflow.circuit.ParseError;
import org.qflow.cond.Cond;

/**
 * Converts circuits to and from a JSON message format.
 *
 * <p>A circuit is {@code {"nodes": [...]}}, and each node is an object tagged by its {@code
 * "type"}:
 *
 * <pre>
 * {"type": "block", "instructions": "H 0\nM 0", "captureAsLast": true}
 * {"type": "if", "cond": COND, "body": CIRCUIT}
 * {"type": "while", "cond": COND, "body": CIRCUIT, "maxIterations": 100}
 * {"type": "doWhile", "cond": COND, "body": CIRCUIT, "maxIterations": 100}
 * </pre>
 *
 * where a COND is {@code {"type": "lastMeas", "index": 0}} or {@code {"type": "measParity",
 * "indices": [-1, -2]}}.
 *
 * <p>Only structured conditions can be encoded, and {@code Let} and {@code Emit} nodes have no
 * message form; {@link #decode} of an encoded circuit returns an equal circuit.
 */
public final class CircuitCodec {
  private static final Gson GSON = new Gson();

  private CircuitCodec() {}

  /**
   * Returns the UTF-8 encoded JSON message for {@code circuit}.
   *
   * @throws CircuitException of kind UNSUPPORTED if the circuit contains a {@code Let} or {@code
   *     Emit} node or an expression condition, or STRUCTURAL_VALIDATION if it contains an
   *     unstructured condition
   */
  public static byte[] encode(Circuit circuit) {
    return GSON.toJson(encodeCircuit(circuit)).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Returns the circuit represented by the given message.
   *
   * @throws IllegalArgumentException if {@code bytes} is not a well-formed circuit message
   */
  public static Circuit decode(byte[] bytes) {
    try {
      JsonElement root = JsonParser.parseString(new String(bytes, StandardCharsets.UTF_8));
      return decodeCircuit(asObject(root, "circuit"));
    } catch (JsonParseException
        | IllegalStateException
        | UnsupportedOperationException
        | NumberFormatException
        | ArithmeticException
        | ParseError e) {
      throw new IllegalArgumentException("Malformed circuit message: " + e.getMessage(), e);
    }
  }

  static JsonObject encodeCircuit(Circuit circuit) {
    JsonArray nodes = new JsonArray();
    for (Node node : circuit.nodes()) {
      nodes.add(encodeNode(node));
    }
    JsonObject json = new JsonObject();
    json.add("nodes", nodes);
    return json;
  }

  private static JsonObject encodeNode(Node node) {
    JsonObject json = new JsonObject();
    switch (node.kind()) {
      case BLOCK:
        Node.Block block = (Node.Block) node;
        json.addProperty("type", "block");
        json.addProperty("instructions", block.instructions.toString());
        json.addProperty("captureAsLast", block.captureAsLast);
        break;
      case IF:
        Node.If ifNode = (Node.If) node;
        json.addProperty("type", "if");
        json.add("cond", encodeCond(ifNode.cond, node));
        json.add("body", encodeCircuit(ifNode.body));
        break;
      case WHILE:
      case DO_WHILE:
        Node.Loop loop = (Node.Loop) node;
        json.addProperty("type", node.kind() == Node.Kind.WHILE ? "while" : "doWhile");
        json.add("cond", encodeCond(loop.cond, node));
        json.add("body", encodeCircuit(loop.body));
        json.addProperty("maxIterations", loop.maxIterations);
        break;
      case LET:
      case EMIT:
        throw CircuitException.unsupported("%s nodes cannot be serialized", node.kind());
    }
    return json;
  }

  private static JsonObject encodeCond(Cond cond, Node node) {
    if (!cond.isStructured()) {
      if (cond.kind() == Cond.Kind.UNSTRUCTURED) {
        throw CircuitException.structuralValidation(
            "Cannot serialize the unstructured %s condition of a %s node",
            cond.getClass().getSimpleName(), node.kind());
      }
      throw CircuitException.unsupported(
          "Cannot serialize the expression condition of a %s node: %s", node.kind(), cond);
    }
    JsonObject json = new JsonObject();
    if (cond instanceof Cond.LastMeas lastMeas) {
      json.addProperty("type", "lastMeas");
      json.addProperty("index", lastMeas.index);
    } else {
      json.addProperty("type", "measParity");
      JsonArray indices = new JsonArray();
      ((Cond.MeasParity) cond).indices.forEach(indices::add);
      json.add("indices", indices);
    }
    return json;
  }

  private static Circuit decodeCircuit(JsonObject json) {
    Circuit circuit = new Circuit();
    for (JsonElement element : field(json, "nodes").getAsJsonArray()) {
      decodeNode(asObject(element, "node"), circuit);
    }
    return circuit;
  }

  private static void decodeNode(JsonObject json, Circuit circuit) {
    String type = string(json, "type");
    switch (type) {
      case "block":
        circuit.block(
            InstructionList.parse(string(json, "instructions")), bool(json, "captureAsLast"));
        break;
      case "if":
        circuit.conditional(body(json), decodeCond(json));
        break;
      case "while":
        circuit.whileLoop(body(json), decodeCond(json), integer(field(json, "maxIterations")));
        break;
      case "doWhile":
        circuit.doWhile(body(json), decodeCond(json), integer(field(json, "maxIterations")));
        break;
      default:
        throw new IllegalArgumentException("Unknown node type: " + type);
    }
  }

  private static Circuit body(JsonObject json) {
    return decodeCircuit(asObject(field(json, "body"), "body"));
  }

  private static Cond decodeCond(JsonObject node) {
    JsonObject json = asObject(field(node, "cond"), "cond");
    String type = string(json, "type");
    switch (type) {
      case "lastMeas":
        return Cond.lastMeas(integer(field(json, "index")));
      case "measParity":
        JsonArray array = field(json, "indices").getAsJsonArray();
        int[] indices = new int[array.size()];
        for (int i = 0; i < indices.length; i++) {
          indices[i] = integer(array.get(i));
        }
        return Cond.parity(indices);
      default:
        throw new IllegalArgumentException("Unknown condition type: " + type);
    }
  }

  private static JsonElement field(JsonObject json, String name) {
    JsonElement result = json.get(name);
    if (result == null || result.isJsonNull()) {
      throw new IllegalArgumentException("Missing field \"" + name + "\"");
    }
    return result;
  }

  private static JsonObject asObject(JsonElement element, String what) {
    if (!element.isJsonObject()) {
      throw new IllegalArgumentException("Expected " + what + " to be an object, got " + element);
    }
    return element.getAsJsonObject();
  }

  private static JsonPrimitive primitive(JsonElement element) {
    if (!element.isJsonPrimitive()) {
      throw new IllegalArgumentException("Expected a primitive, got " + element);
    }
    return element.getAsJsonPrimitive();
  }

  private static String string(JsonObject json, String name) {
    JsonPrimitive p = primitive(field(json, name));
    if (!p.isString()) {
      throw new IllegalArgumentException("Expected \"" + name + "\" to be a string, got " + p);
    }
    return p.getAsString();
  }

  private static boolean bool(JsonObject json, String name) {
    JsonPrimitive p = primitive(field(json, name));
    if (!p.isBoolean()) {
      throw new IllegalArgumentException("Expected \"" + name + "\" to be a boolean, got " + p);
    }
    return p.getAsBoolean();
  }

  /** Returns an integral JSON number as an int; fractions and out-of-range values are rejected. */
  private static int integer(JsonElement element) {
    JsonPrimitive p = primitive(element);
    if (!p.isNumber()) {
      throw new IllegalArgumentException("Expected an integer, got " + p);
    }
    return p.getAsBigDecimal().intValueExact();
  }
}
