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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.Iterator;
import java.util.List;
import java.util.SortedSet;
import java.util.function.Consumer;

/**
 * An immutable sequence of primitive instructions (and {@code REPEAT} blocks of them), which is
 * what a {@link Node.Block} executes as a single unit.
 *
 * <p>The text form is one instruction per line, e.g. {@code "H 0\nCX 0 1\nM 0 1"}; {@link
 * #toString} produces text that {@link #parse} will accept.
 */
@Immutable
public final class InstructionList implements Iterable<InstructionList.Entry> {

  /** An element of an InstructionList: either an {@link Instruction} or a {@link RepeatBlock}. */
  public interface Entry {
    /** The number of bits this entry appends to the measurement record each time it runs. */
    int measurementCount();

    /** Appends the text form of this entry (one or more lines, each prefixed by indent). */
    void appendTo(StringBuilder sb, String indent);
  }

  public static final InstructionList EMPTY = new InstructionList(ImmutableList.of());

  private final ImmutableList<Entry> entries;

  private InstructionList(ImmutableList<Entry> entries) {
    this.entries = entries;
  }

  public static InstructionList of(List<? extends Entry> entries) {
    return entries.isEmpty() ? EMPTY : new InstructionList(ImmutableList.copyOf(entries));
  }

  public static InstructionList of(Entry... entries) {
    return of(ImmutableList.copyOf(entries));
  }

  /**
   * Parses the text form of an instruction list.
   *
   * @throws ParseError if the text is malformed or names an unknown instruction
   */
  public static InstructionList parse(String text) {
    return InstructionParser.parse(text);
  }

  public ImmutableList<Entry> entries() {
    return entries;
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public Iterator<Entry> iterator() {
    return entries.iterator();
  }

  /** Returns a new InstructionList containing the entries of this followed by those of other. */
  public InstructionList concat(InstructionList other) {
    if (other.isEmpty()) {
      return this;
    } else if (isEmpty()) {
      return other;
    }
    return new InstructionList(
        ImmutableList.<Entry>builder().addAll(entries).addAll(other.entries).build());
  }

  /** The number of bits executing this list appends to the measurement record. */
  public int measurementCount() {
    int count = 0;
    for (Entry entry : entries) {
      count = Math.addExact(count, entry.measurementCount());
    }
    return count;
  }

  /**
   * Calls {@code action} with each Instruction in execution order, expanding {@code REPEAT}
   * blocks.
   */
  public void forEachUnrolled(Consumer<Instruction> action) {
    for (Entry entry : entries) {
      if (entry instanceof RepeatBlock repeat) {
        for (int i = 0; i < repeat.count; i++) {
          repeat.body.forEachUnrolled(action);
        }
      } else {
        action.accept((Instruction) entry);
      }
    }
  }

  /** Adds the index of every qubit targeted by an instruction in this list to {@code qubits}. */
  public void collectQubits(SortedSet<Integer> qubits) {
    for (Entry entry : entries) {
      if (entry instanceof RepeatBlock repeat) {
        repeat.body.collectQubits(qubits);
      } else {
        for (Target t : ((Instruction) entry).targets) {
          if (t.isQubit()) {
            qubits.add(t.qubit());
          }
        }
      }
    }
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof InstructionList list && list.entries.equals(entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Entry entry : entries) {
      entry.appendTo(sb, "");
    }
    if (sb.length() > 0) {
      sb.setLength(sb.length() - 1);
    }
    return sb.toString();
  }
}
