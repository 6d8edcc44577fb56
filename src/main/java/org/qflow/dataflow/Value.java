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

import com.google.errorprone.annotations.Immutable;

/**
 * A Value is defined exactly once, either as a source of a {@link Region} or as an output of an
 * {@link Operation}. Values are identified by their id, which is unique within a {@link
 * FunctionDef}.
 */
@Immutable
public final class Value {
  public final int id;
  public final ValueType type;

  Value(int id, ValueType type) {
    this.id = id;
    this.type = type;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Value v && v.id == id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return "%" + id;
  }
}
