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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import net.hydromatic.fuzzsat.core.Context;
import net.hydromatic.fuzzsat.util.ProcessRunner;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Compiles a generated program by running Clang as a child process. */
public class ProcessClangInvocationManager implements ClangInvocationManager {
  private final Context context;
  private final ProcessRunner runner = new ProcessRunner();

  public ProcessClangInvocationManager(Context context) {
    this.context = requireNonNull(context, "context");
  }

  @Override
  public boolean compile(CxxProgram program, File sourceFile,
      File outputFile, ClangOptions options, @Nullable File stdoutFile,
      @Nullable File stderrFile) {
    try (Writer w =
        Files.asCharSink(sourceFile, StandardCharsets.UTF_8)
            .openBufferedStream()) {
      program.print(w);
    } catch (IOException e) {
      context.error("(error failed to write \"" + sourceFile + "\": "
          + e.getMessage() + ")");
      return false;
    }

    final ImmutableList<String> command =
        options.toCommand(sourceFile, outputFile);
    context.debug("(clang " + String.join(" ", command) + ")");
    final int exitCode;
    try {
      exitCode = runner.run(command, sourceFile.getParentFile(), stdoutFile,
          stderrFile);
    } catch (IOException e) {
      context.error("(error failed to run Clang: " + e.getMessage() + ")");
      return false;
    }
    if (exitCode == ProcessRunner.CANCELLED) {
      return false;
    }
    if (exitCode != 0) {
      context.warn("(Clang exited with " + exitCode + ")");
      return false;
    }
    return outputFile.isFile();
  }

  @Override
  public void cancel() {
    runner.cancel();
  }
}

// End ProcessClangInvocationManager.java
