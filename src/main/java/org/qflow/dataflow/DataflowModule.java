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


package org.qflow.dataflow;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.qflow.CircuitException;

/** A collection of functions, one of which is the entrypoint. */
public final class DataflowModule {
  public final ImmutableList<FunctionDef> functions;
  public final int entrypoint;

  public DataflowModule(List<FunctionDef> functions, int entrypoint) {
    Preconditions.checkElementIndex(entrypoint, functions.size(), "entrypoint");
    this.functions = ImmutableList.copyOf(functions);
    this.entrypoint = entrypoint;
  }

  public FunctionDef entrypointFunction() {
    return functions.get(entrypoint);
  }

  /**
   * Checks that the module is well-formed:
   *
   * <ul>
   *   <li>every value is defined exactly once, and used only within the region that defines it,
   *       after its definition;
   *   <li>no qubit value is used more than once;
   *   <li>the operations the lowering emits have the expected numbers and types of inputs and
   *       outputs; and
   *   <li>each region of a structured control-flow operation has one source per state input, and
   *       one target per state output (or a single integer target, for condition regions).
   * </ul>
   *
   * @throws CircuitException of kind STRUCTURAL_VALIDATION describing the first problem found
   */
  public void verify() {
    Set<Value> defined = new HashSet<>();
    for (FunctionDef function : functions) {
      new RegionChecker(function.name, defined).check(function.body);
    }
  }

  /** Checks a single region; a new RegionChecker is used for each nested region. */
  private static class RegionChecker {
    final String where;
    final Set<Value> definedAnywhere;
    final Set<Value> inScope = new HashSet<>();
    final Set<Value> consumedQubits = new HashSet<>();

    RegionChecker(String where, Set<Value> definedAnywhere) {
      this.where = where;
      this.definedAnywhere = definedAnywhere;
    }

    void check(Region region) {
      region.sources.forEach(this::define);
      for (Operation op : region.operations) {
        op.inputs.forEach(this::use);
        checkSignature(op);
        for (Region nested : op.regions) {
          new RegionChecker(where + "/" + op.fullName(), definedAnywhere).check(nested);
        }
        op.outputs.forEach(this::define);
      }
      region.targets.forEach(this::use);
    }

    void define(Value v) {
      if (!definedAnywhere.add(v)) {
        throw CircuitException.structuralValidation("%s: %s is defined more than once", where, v);
      }
      inScope.add(v);
    }

    void use(Value v) {
      if (!inScope.contains(v)) {
        throw CircuitException.structuralValidation(
            "%s: %s is not defined in this region", where, v);
      }
      if (v.type.isQubit() && !consumedQubits.add(v)) {
        throw CircuitException.structuralValidation(
            "%s: qubit %s is used more than once", where, v);
      }
    }

    void checkSignature(Operation op) {
      switch (op.fullName()) {
        case "qubit.alloc":
          expect(op, op.inputs.isEmpty() && types(op.outputs, ValueType.QUBIT));
          break;
        case "qubit.free":
          expect(op, types(op.inputs, ValueType.QUBIT) && op.outputs.isEmpty());
          break;
        case "qubit.reset":
          expect(op, types(op.inputs, ValueType.QUBIT) && types(op.outputs, ValueType.QUBIT));
          break;
        case "qubit.measureNd":
          expect(
              op,
              types(op.inputs, ValueType.QUBIT)
                  && types(op.outputs, ValueType.QUBIT, ValueType.BIT));
          break;
        case "scf.switch":
          expect(op, !op.inputs.isEmpty() && !op.inputs.get(0).type.isQubit());
          List<Value> state = op.inputs.subList(1, op.inputs.size());
          for (Region region : op.regions) {
            checkRegion(op, region, state, op.outputs);
          }
          break;
        case "scf.while":
          expect(op, op.regions.size() == 2);
          checkConditionRegion(op, op.regions.get(0));
          checkRegion(op, op.regions.get(1), op.inputs, op.outputs);
          break;
        case "scf.doWhile":
          expect(op, op.regions.size() == 2);
          checkRegion(op, op.regions.get(0), op.inputs, op.outputs);
          checkConditionRegion(op, op.regions.get(1));
          break;
        default:
          if (op.dialect.equals("gate")) {
            expect(
                op,
                !op.inputs.isEmpty()
                    && op.inputs.size() == op.outputs.size()
                    && op.inputs.stream().allMatch(v -> v.type.isQubit())
                    && op.outputs.stream().allMatch(v -> v.type.isQubit()));
          }
      }
      if (op.dialect.equals("scf")) {
        expect(op, op.inputs.size() - (op.name.equals("switch") ? 1 : 0) == op.outputs.size());
      }
    }

    /** Checks a region that maps the op's state inputs to its outputs. */
    void checkRegion(Operation op, Region region, List<Value> inputs, List<Value> outputs) {
      if (!sameTypes(region.sources, inputs) || !sameTypes(region.targets, outputs)) {
        throw CircuitException.structuralValidation(
            "%s: %s region has %s sources and %s targets, but the op has %s inputs and %s outputs",
            where,
            op.fullName(),
            region.sources.size(),
            region.targets.size(),
            inputs.size(),
            outputs.size());
      }
    }

    void checkConditionRegion(Operation op, Region region) {
      if (!sameTypes(region.sources, op.inputs)
          || region.targets.size() != 1
          || region.targets.get(0).type.isQubit()) {
        throw CircuitException.structuralValidation(
            "%s: %s condition region must take %s sources and yield one integer",
            where, op.fullName(), op.inputs.size());
      }
    }

    void expect(Operation op, boolean ok) {
      if (!ok) {
        throw CircuitException.structuralValidation("%s: malformed %s", where, op);
      }
    }

    static boolean types(List<Value> values, ValueType... expected) {
      if (values.size() != expected.length) {
        return false;
      }
      for (int i = 0; i < expected.length; i++) {
        if (!values.get(i).type.equals(expected[i])) {
          return false;
        }
      }
      return true;
    }

    static boolean sameTypes(List<Value> a, List<Value> b) {
      if (a.size() != b.size()) {
        return false;
      }
      for (int i = 0; i < a.size(); i++) {
        if (!a.get(i).type.equals(b.get(i).type)) {
          return false;
        }
      }
      return true;
    }
  }

  /** Returns this module as a JSON document. */
  public String toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("entrypoint", entrypoint);
    JsonArray functionsJson = new JsonArray();
    for (FunctionDef function : functions) {
      JsonObject f = new JsonObject();
      f.addProperty("name", function.name);
      f.add("body", toJson(function.body));
      functionsJson.add(f);
    }
    json.add("functions", functionsJson);
    return new GsonBuilder().setPrettyPrinting().create().toJson(json);
  }

  private static JsonObject toJson(Region region) {
    JsonObject json = new JsonObject();
    json.add("sources", definitions(region.sources));
    json.add("targets", references(region.targets));
    JsonArray ops = new JsonArray();
    for (Operation op : region.operations) {
      JsonObject o = new JsonObject();
      o.addProperty("dialect", op.dialect);
      o.addProperty("name", op.name);
      o.add("inputs", references(op.inputs));
      o.add("outputs", definitions(op.outputs));
      if (!op.attributes.isEmpty()) {
        JsonObject attrs = new JsonObject();
        for (Map.Entry<String, Object> entry : op.attributes.entrySet()) {
          Object value = entry.getValue();
          if (value instanceof Boolean b) {
            attrs.addProperty(entry.getKey(), b);
          } else if (value instanceof Number n) {
            attrs.addProperty(entry.getKey(), n);
          } else {
            attrs.addProperty(entry.getKey(), String.valueOf(value));
          }
        }
        o.add("attributes", attrs);
      }
      if (!op.regions.isEmpty()) {
        JsonArray regions = new JsonArray();
        op.regions.forEach(r -> regions.add(toJson(r)));
        o.add("regions", regions);
      }
      ops.add(o);
    }
    json.add("operations", ops);
    return json;
  }

  private static JsonArray definitions(List<Value> values) {
    JsonArray result = new JsonArray();
    for (Value v : values) {
      JsonObject def = new JsonObject();
      def.addProperty("id", v.id);
      def.addProperty("type", v.type.toString());
      result.add(def);
    }
    return result;
  }

  private static JsonArray references(List<Value> values) {
    JsonArray result = new JsonArray();
    values.forEach(v -> result.add(v.id));
    return result;
  }

  /** Writes {@link #toJson} to the given file, replacing any previous contents. */
  public void writeTo(Path path) throws IOException {
    Files.writeString(path, toJson(), StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (FunctionDef function : functions) {
      function.appendTo(sb);
    }
    return sb.toString();
  }
}
