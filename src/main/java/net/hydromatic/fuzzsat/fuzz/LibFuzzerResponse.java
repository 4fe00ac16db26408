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
package net.hydromatic.fuzzsat.fuzz;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.File;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of a libFuzzer run. Immutable. */
public class LibFuzzerResponse {
  public final Outcome outcome;

  /** Input that reached the target; set only if the target was found. */
  public final @Nullable File artifact;

  private LibFuzzerResponse(Outcome outcome, @Nullable File artifact) {
    this.outcome = requireNonNull(outcome, "outcome");
    this.artifact = artifact;
    checkArgument(artifact == null || outcome == Outcome.TARGET_FOUND,
        "artifact without target");
  }

  public static LibFuzzerResponse targetFound(@Nullable File artifact) {
    return new LibFuzzerResponse(Outcome.TARGET_FOUND, artifact);
  }

  public static LibFuzzerResponse unknown() {
    return new LibFuzzerResponse(Outcome.UNKNOWN, null);
  }

  public static LibFuzzerResponse cancelled() {
    return new LibFuzzerResponse(Outcome.CANCELLED, null);
  }

  @Override
  public String toString() {
    return artifact == null ? outcome.name() : outcome + " " + artifact;
  }

  /** What the fuzzer achieved. */
  public enum Outcome {
    /** An input made the target trap. */
    TARGET_FOUND,
    /** No input made the target trap before the run ended. */
    UNKNOWN,
    /** The run was cancelled. */
    CANCELLED
  }
}

// End LibFuzzerResponse.java
