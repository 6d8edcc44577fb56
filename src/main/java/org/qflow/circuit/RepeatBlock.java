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
import com.google.errorprone.annotations.Immutable;

/** A {@code REPEAT n { ... }} entry: the body is executed {@code count} times in sequence. */
@Immutable
public final class RepeatBlock implements InstructionList.Entry {
  public final int count;
  public final InstructionList body;

  public RepeatBlock(int count, InstructionList body) {
    Preconditions.checkArgument(count > 0, "REPEAT count must be positive, got %s", count);
    this.count = count;
    this.body = body;
  }

  @Override
  public int measurementCount() {
    return Math.multiplyExact(count, body.measurementCount());
  }

  @Override
  public void appendTo(StringBuilder sb, String indent) {
    sb.append(indent).append("REPEAT ").append(count).append(" {\n");
    for (InstructionList.Entry entry : body) {
      entry.appendTo(sb, indent + "    ");
    }
    sb.append(indent).append("}\n");
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof RepeatBlock r && r.count == count && r.body.equals(body);
  }

  @Override
  public int hashCode() {
    return count * 31 + body.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, "");
    return sb.toString().trim();
  }
}
