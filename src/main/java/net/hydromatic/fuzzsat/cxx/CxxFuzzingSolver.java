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

import java.io.File;
import java.io.UncheckedIOException;
import net.hydromatic.fuzzsat.core.Context;
import net.hydromatic.fuzzsat.core.Query;
import net.hydromatic.fuzzsat.core.SolverResponse;
import net.hydromatic.fuzzsat.fuzz.FuzzingAnalysisInfo;
import net.hydromatic.fuzzsat.fuzz.FuzzingSolver;
import net.hydromatic.fuzzsat.fuzz.LibFuzzerInvocationManager;
import net.hydromatic.fuzzsat.fuzz.LibFuzzerOptions;
import net.hydromatic.fuzzsat.fuzz.LibFuzzerResponse;
import net.hydromatic.fuzzsat.fuzz.ProcessLibFuzzerInvocationManager;
import net.hydromatic.fuzzsat.fuzz.WorkingDirectoryManager;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Fuzzing solver that generates a C++ program, compiles it with Clang, and
 * runs it under libFuzzer.
 *
 * <p>Each attempt works in a fresh scratch directory, which holds {@code
 * program.cpp}, the {@code fuzzer} binary, {@code corpus/} and {@code
 * artifacts/} directories, and, when verbosity is 0, the output of Clang
 * and libFuzzer.
 */
public class CxxFuzzingSolver extends FuzzingSolver {
  private final CxxFuzzingSolverOptions options;
  private final ClangInvocationManager clang;
  private final LibFuzzerInvocationManager libFuzzer;

  /**
   * Creates a solver.
   *
   * <p>Raises a fatal error if the compiler or libFuzzer library in {@code
   * options} does not exist.
   */
  public CxxFuzzingSolver(Context context, CxxFuzzingSolverOptions options,
      ClangInvocationManager clang, LibFuzzerInvocationManager libFuzzer) {
    super(context);
    this.options = requireNonNull(options, "options");
    this.clang = requireNonNull(clang, "clang");
    this.libFuzzer = requireNonNull(libFuzzer, "libFuzzer");
    options.clangOptions.checkPaths(context);
  }

  /** Creates a solver that runs Clang and libFuzzer as child processes,
   * configured by the context's properties. */
  public static CxxFuzzingSolver create(Context context) {
    return new CxxFuzzingSolver(context,
        CxxFuzzingSolverOptions.of(context.props),
        new ProcessClangInvocationManager(context),
        new ProcessLibFuzzerInvocationManager(context));
  }

  @Override
  public String getName() {
    return "CxxFuzzingSolver";
  }

  @Override
  protected SolverResponse fuzz(Query query, FuzzingAnalysisInfo info) {
    if (isCancelled()) {
      return cancelledResponse();
    }
    final WorkingDirectoryManager wdm;
    try {
      wdm = createWorkingDirectory();
    } catch (UncheckedIOException e) {
      context.error("(error working directory: " + e.getMessage() + ")");
      return SolverResponse.unknown("working directory failure");
    }
    context.debug("(CxxFuzzingSolver working directory " + wdm + ")");
    try {
      return fuzz(query, info, wdm);
    } catch (UncheckedIOException e) {
      context.error("(error working directory: " + e.getMessage() + ")");
      return SolverResponse.unknown("working directory failure");
    } finally {
      deleteWorkingDirectory(wdm);
    }
  }

  /** Creates the scratch directory for one attempt. */
  protected WorkingDirectoryManager createWorkingDirectory() {
    return WorkingDirectoryManager.create(options.workingDirectory,
        "fuzzsat-", options.keepWorkingDirectory);
  }

  /** Deletes the scratch directory; a failure is a warning, and leaves the
   * attempt's response unchanged. */
  private void deleteWorkingDirectory(WorkingDirectoryManager wdm) {
    try {
      wdm.close();
    } catch (UncheckedIOException e) {
      context.warn("(could not delete working directory " + wdm + ": "
          + e.getMessage() + ")");
    }
  }

  private SolverResponse fuzz(Query query, FuzzingAnalysisInfo info,
      WorkingDirectoryManager wdm) {
    setState(State.LOWERING);
    final CxxProgramBuilderPass builder = new CxxProgramBuilderPass(info);
    try (Registration ignored = register(builder)) {
      builder.run(query);
    }
    if (isCancelled()) {
      return cancelledResponse();
    }
    final CxxProgram program = builder.getProgram();

    setState(State.COMPILING);
    final boolean redirect = context.getVerbosity() == 0;
    final File source = wdm.getPathToFileInDirectory("program.cpp");
    final File binary = wdm.getPathToFileInDirectory("fuzzer");
    final boolean compiled;
    try (Registration ignored = register(clang)) {
      compiled = clang.compile(program, source, binary,
          options.clangOptions,
          redirect ? wdm.getPathToFileInDirectory("clang.stdout.txt") : null,
          redirect ? wdm.getPathToFileInDirectory("clang.stderr.txt") : null);
    }
    if (isCancelled()) {
      return cancelledResponse();
    }
    if (!compiled) {
      context.warn("(error compilation failed)");
      return SolverResponse.unknown("compilation failed");
    }

    setState(State.FUZZ_RUNNING);
    final LibFuzzerOptions libFuzzerOptions =
        options.libFuzzerOptions.withTargetBinary(binary)
            .withCorpusDir(wdm.makeNewDirectoryInDirectory("corpus"))
            .withArtifactDir(wdm.makeNewDirectoryInDirectory("artifacts"))
            .withMaxLength(info.maxLength())
            .withUseCmp(options.clangOptions.usesTraceCmp());
    final LibFuzzerResponse response;
    try (Registration ignored = register(libFuzzer)) {
      response = libFuzzer.fuzz(libFuzzerOptions,
          redirect ? wdm.getPathToFileInDirectory("libfuzzer.stdout.txt")
              : null,
          redirect ? wdm.getPathToFileInDirectory("libfuzzer.stderr.txt")
              : null);
    }
    switch (response.outcome) {
      case TARGET_FOUND:
        // The artifact is deleted with the directory unless it is kept.
        final @Nullable File artifact =
            options.keepWorkingDirectory ? response.artifact : null;
        return SolverResponse.sat(artifact);
      case CANCELLED:
        return cancelledResponse();
      default:
        if (isCancelled()) {
          return cancelledResponse();
        }
        context.warn("(fuzzing found no satisfying input)");
        return SolverResponse.unknown("fuzzing found no satisfying input");
    }
  }
}

// End CxxFuzzingSolver.java
