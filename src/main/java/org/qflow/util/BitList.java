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

package org.qflow.util;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;

/**
 * An append-only sequence of booleans, stored one bit per entry.
 *
 * <p>Measurement records only ever grow, so the only mutators are {@link #add} and {@link #addAll};
 * snapshots are taken with {@link #toList} or {@link #toArray}.
 */
public final class BitList {
  private long[] words;
  private int size;

  public BitList() {
    words = new long[1];
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /** Returns the bit at {@code i}, which must be in {@code 0..size()-1}. */
  public boolean get(int i) {
    Preconditions.checkElementIndex(i, size);
    return (words[i >> 6] & (1L << i)) != 0;
  }

  public void add(boolean bit) {
    if ((size >> 6) == words.length) {
      words = Arrays.copyOf(words, words.length * 2);
    }
    if (bit) {
      words[size >> 6] |= 1L << size;
    }
    size++;
  }

  public void addAll(boolean[] bits) {
    for (boolean bit : bits) {
      add(bit);
    }
  }

  /** Returns the bits from {@code start} (inclusive) to {@code size()} (exclusive). */
  public boolean[] tail(int start) {
    Preconditions.checkPositionIndex(start, size);
    boolean[] result = new boolean[size - start];
    for (int i = start; i < size; i++) {
      result[i - start] = get(i);
    }
    return result;
  }

  public boolean[] toArray() {
    return tail(0);
  }

  public ImmutableList<Boolean> toList() {
    ImmutableList.Builder<Boolean> builder = ImmutableList.builderWithExpectedSize(size);
    for (int i = 0; i < size; i++) {
      builder.add(get(i));
    }
    return builder.build();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(size);
    for (int i = 0; i < size; i++) {
      sb.append(get(i) ? '1' : '0');
    }
    return sb.toString();
  }
}
