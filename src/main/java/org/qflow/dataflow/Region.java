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
import java.util.List;

/**
 * A Region is a straight-line sequence of operations with explicit inputs ({@link #sources}) and
 * results ({@link #targets}). Regions are isolated: an operation in a region may only use the
 * region's sources and the outputs of earlier operations in the same region.
 */
public final class Region {
  public final ImmutableList<Value> sources;
  public final ImmutableList<Value> targets;
  public final ImmutableList<Operation> operations;

  public Region(List<Value> sources, List<Value> targets, List<Operation> operations) {
    this.sources = ImmutableList.copyOf(sources);
    this.targets = ImmutableList.copyOf(targets);
    this.operations = ImmutableList.copyOf(operations);
  }

  void appendTo(StringBuilder sb, String indent) {
    sb.append(indent).append("region (");
    Operation.appendTyped(sb, sources);
    sb.append(") {\n");
    for (Operation op : operations) {
      op.appendTo(sb, indent + "  ");
    }
    sb.append(indent).append("  yield ");
    Operation.appendJoined(sb, targets);
    sb.append('\n').append(indent).append("}\n");
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, "");
    return sb.toString();
  }
}
