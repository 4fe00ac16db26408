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
package net.hydromatic.fuzzsat.cxx;

import java.io.File;
import net.hydromatic.fuzzsat.core.Cancellable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Compiles a generated program into a fuzzer binary. */
public interface ClangInvocationManager extends Cancellable {
  /**
   * Writes {@code program} to {@code sourceFile} and compiles it to {@code
   * outputFile}, blocking until the compiler finishes or is cancelled.
   *
   * <p>If {@code stdoutFile} and {@code stderrFile} are not null, the
   * compiler's output streams are written to them.
   *
   * @return whether compilation succeeded
   */
  boolean compile(CxxProgram program, File sourceFile, File outputFile,
      ClangOptions options, @Nullable File stdoutFile,
      @Nullable File stderrFile);
}

// End ClangInvocationManager.java
