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

import java.io.File;
import net.hydromatic.fuzzsat.core.Cancellable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Runs libFuzzer against a compiled target. */
public interface LibFuzzerInvocationManager extends Cancellable {
  /**
   * Runs the fuzzer, blocking until it finishes or is cancelled.
   *
   * <p>If {@code stdoutFile} and {@code stderrFile} are not null, the
   * fuzzer's output streams are written to them.
   */
  LibFuzzerResponse fuzz(LibFuzzerOptions options,
      @Nullable File stdoutFile, @Nullable File stderrFile);
}

// End LibFuzzerInvocationManager.java
