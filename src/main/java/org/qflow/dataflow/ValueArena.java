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

/** Allocates the {@link Value}s of one function, numbering them consecutively from zero. */
public final class ValueArena {
  private int nextId;

  public Value fresh(ValueType type) {
    return new Value(nextId++, type);
  }

  /** The number of values allocated so far. */
  public int size() {
    return nextId;
  }
}
