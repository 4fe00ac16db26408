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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Comparator;
import net.hydromatic.fuzzsat.core.Context;
import net.hydromatic.fuzzsat.util.ProcessRunner;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Runs libFuzzer as a child process.
 *
 * <p>The target traps when it finds a satisfying input, and libFuzzer then
 * writes the input to a file named {@code crash-<hash>} in the artifact
 * directory. The presence of such a file is the sign of success; the exit
 * code is not used.
 */
public class ProcessLibFuzzerInvocationManager
    implements LibFuzzerInvocationManager {
  private final Context context;
  private final ProcessRunner runner = new ProcessRunner();

  public ProcessLibFuzzerInvocationManager(Context context) {
    this.context = requireNonNull(context, "context");
  }

  @Override
  public LibFuzzerResponse fuzz(LibFuzzerOptions options,
      @Nullable File stdoutFile, @Nullable File stderrFile) {
    final ImmutableList<String> command = options.toCommand();
    context.debug("(libFuzzer " + String.join(" ", command) + ")");
    final int exitCode;
    try {
      exitCode = runner.run(command, null, stdoutFile, stderrFile);
    } catch (IOException e) {
      context.error("(error failed to run libFuzzer: " + e.getMessage()
          + ")");
      return LibFuzzerResponse.unknown();
    }
    if (exitCode == ProcessRunner.CANCELLED || runner.isCancelled()) {
      return LibFuzzerResponse.cancelled();
    }
    context.debug("(libFuzzer exited with " + exitCode + ")");
    final File crash =
        findCrash(requireNonNull(options.artifactDir, "artifactDir"));
    if (crash != null) {
      return LibFuzzerResponse.targetFound(crash);
    }
    return LibFuzzerResponse.unknown();
  }

  /** Returns the first crash file in a directory, by name, or null. */
  static @Nullable File findCrash(File artifactDir) {
    final File[] files =
        artifactDir.listFiles((dir, name) -> name.startsWith("crash-"));
    if (files == null || files.length == 0) {
      return null;
    }
    Arrays.sort(files, Comparator.comparing(File::getName));
    return files[0];
  }

  @Override
  public void cancel() {
    runner.cancel();
  }
}

// End ProcessLibFuzzerInvocationManager.java
