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

package org.qflow.exec;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/**
 * Everything a single shot produced. {@link #outputNames} holds one entry per <i>named</i> emit, so
 * it may be shorter than {@link #outputs}.
 */
@Immutable
public final class ShotResult {
  public final ImmutableList<Boolean> measurements;
  public final ImmutableList<Boolean> outputs;
  public final ImmutableList<String> outputNames;
  public final ImmutableMap<String, Long> vars;

  public ShotResult(
      ImmutableList<Boolean> measurements,
      ImmutableList<Boolean> outputs,
      ImmutableList<String> outputNames,
      ImmutableMap<String, Long> vars) {
    this.measurements = measurements;
    this.outputs = outputs;
    this.outputNames = outputNames;
    this.vars = vars;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ShotResult r
        && r.measurements.equals(measurements)
        && r.outputs.equals(outputs)
        && r.outputNames.equals(outputNames)
        && r.vars.equals(vars);
  }

  @Override
  public int hashCode() {
    return Objects.hash(measurements, outputs, outputNames, vars);
  }

  @Override
  public String toString() {
    return String.format(
        "{measurements=%s, outputs=%s, outputNames=%s, vars=%s}",
        measurements, outputs, outputNames, vars);
  }
}
