/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.fuzzsat.core;

import static java.util.Objects.requireNonNull;

import java.io.File;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of a solving attempt. Immutable. */
public class SolverResponse {
  public final Satisfiability sat;

  /** Human-readable explanation, e.g. why the answer is unknown. */
  public final String reason;

  /** Crash input that witnesses satisfiability, if it was kept. */
  public final @Nullable File artifact;

  private SolverResponse(
      Satisfiability sat, String reason, @Nullable File artifact) {
    this.sat = requireNonNull(sat, "sat");
    this.reason = requireNonNull(reason, "reason");
    this.artifact = artifact;
  }

  public static SolverResponse sat(@Nullable File artifact) {
    return new SolverResponse(Satisfiability.SAT, "target found", artifact);
  }

  public static SolverResponse unknown(String reason) {
    return new SolverResponse(Satisfiability.UNKNOWN, reason, null);
  }

  /**
   * Would return a satisfying assignment; fuzzing solvers cannot produce
   * one.
   *
   * @throws UnsupportedOperationException always
   */
  public Object getModel() {
    throw new UnsupportedOperationException(
        "model generation is not supported");
  }

  @Override
  public String toString() {
    return sat.name().toLowerCase(Locale.ROOT) + " (" + reason + ")";
  }

  /** Answer to the question "is the query satisfiable?". */
  public enum Satisfiability {
    /** A satisfying assignment exists, and was witnessed. */
    SAT,
    /** No answer: unsupported input, failure, timeout or cancellation. */
    UNKNOWN
  }
}

// End SolverResponse.java
