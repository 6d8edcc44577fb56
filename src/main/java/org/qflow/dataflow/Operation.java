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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * One operation of a dataflow {@link Region}, named by a dialect and an operation name (e.g. {@code
 * qubit.measureNd} or {@code scf.switch}). Structured control-flow operations also own nested
 * regions.
 */
public final class Operation {
  public final String dialect;
  public final String name;
  public final ImmutableList<Value> inputs;
  public final ImmutableList<Value> outputs;

  /** Attribute values are Integers, Longs, Booleans, or Strings. */
  public final ImmutableMap<String, Object> attributes;

  public final ImmutableList<Region> regions;

  public Operation(
      String dialect,
      String name,
      List<Value> inputs,
      List<Value> outputs,
      Map<String, Object> attributes,
      List<Region> regions) {
    this.dialect = dialect;
    this.name = name;
    this.inputs = ImmutableList.copyOf(inputs);
    this.outputs = ImmutableList.copyOf(outputs);
    this.attributes = ImmutableMap.copyOf(attributes);
    this.regions = ImmutableList.copyOf(regions);
  }

  /** Returns an operation with no attributes or regions. */
  public static Operation of(String dialect, String name, List<Value> inputs, List<Value> outputs) {
    return new Operation(dialect, name, inputs, outputs, ImmutableMap.of(), ImmutableList.of());
  }

  /** The full name, e.g. {@code "qubit.alloc"}. */
  public String fullName() {
    return dialect + "." + name;
  }

  void appendTo(StringBuilder sb, String indent) {
    sb.append(indent);
    if (!outputs.isEmpty()) {
      appendTyped(sb, outputs);
      sb.append(" = ");
    }
    sb.append(fullName()).append('(');
    appendJoined(sb, inputs);
    sb.append(')');
    if (!attributes.isEmpty()) {
      sb.append(" {");
      String sep = "";
      for (Map.Entry<String, Object> entry : attributes.entrySet()) {
        sb.append(sep).append(entry.getKey()).append('=').append(entry.getValue());
        sep = ", ";
      }
      sb.append('}');
    }
    if (regions.isEmpty()) {
      sb.append('\n');
    } else {
      sb.append(" [\n");
      for (Region region : regions) {
        region.appendTo(sb, indent + "  ");
      }
      sb.append(indent).append("]\n");
    }
  }

  static void appendJoined(StringBuilder sb, List<Value> values) {
    for (int i = 0; i < values.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(values.get(i));
    }
  }

  static void appendTyped(StringBuilder sb, List<Value> values) {
    for (int i = 0; i < values.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(values.get(i)).append(':').append(values.get(i).type);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, "");
    return sb.toString();
  }
}
