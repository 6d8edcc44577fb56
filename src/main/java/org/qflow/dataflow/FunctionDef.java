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

/** A named function whose body is a single region. */
public final class FunctionDef {
  public final String name;
  public final Region body;

  public FunctionDef(String name, Region body) {
    this.name = name;
    this.body = body;
  }

  void appendTo(StringBuilder sb) {
    sb.append("func @").append(name).append(" {\n");
    for (Operation op : body.operations) {
      op.appendTo(sb, "  ");
    }
    sb.append("}\n");
  }
}
