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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.File;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.fuzzsat.core.Context;
import net.hydromatic.fuzzsat.core.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Options for compiling a generated program with Clang. Immutable. */
public class ClangOptions {
  /** Path of the compiler; a bare name is looked up on {@code PATH}. */
  public final String clangPath;

  /** libFuzzer archive to link, or null to use Clang's own. */
  public final @Nullable String libFuzzerLib;

  public final int optimizationLevel;
  public final boolean debugSymbols;
  public final boolean useAsan;
  public final boolean useUbsan;
  public final ImmutableSet<SanitizerCoverage> coverage;

  ClangOptions(String clangPath, @Nullable String libFuzzerLib,
      int optimizationLevel, boolean debugSymbols, boolean useAsan,
      boolean useUbsan, Iterable<SanitizerCoverage> coverage) {
    this.clangPath = requireNonNull(clangPath, "clangPath");
    this.libFuzzerLib = libFuzzerLib;
    this.optimizationLevel = optimizationLevel;
    this.debugSymbols = debugSymbols;
    this.useAsan = useAsan;
    this.useUbsan = useUbsan;
    this.coverage = ImmutableSet.copyOf(coverage);
    checkArgument(optimizationLevel >= 0 && optimizationLevel <= 3,
        "optimization level must be between 0 and 3: %s", optimizationLevel);
  }

  /** Creates options from properties. */
  public static ClangOptions of(Map<Prop, Object> map) {
    final ImmutableSet.Builder<SanitizerCoverage> coverage =
        ImmutableSet.builder();
    coverage.add(SanitizerCoverage.INLINE_8BIT_COUNTERS,
        SanitizerCoverage.PC_TABLE);
    if (Prop.TRACE_CMP.booleanValue(map)) {
      coverage.add(SanitizerCoverage.TRACE_CMP);
    }
    return new ClangOptions(Prop.CLANG_PATH.stringValue(map),
        Prop.LIB_FUZZER_LIB.optionalStringValue(map),
        Prop.OPTIMIZATION_LEVEL.intValue(map),
        Prop.DEBUG_SYMBOLS.booleanValue(map),
        Prop.USE_ASAN.booleanValue(map),
        Prop.USE_UBSAN.booleanValue(map),
        coverage.build());
  }

  /** Whether the program is instrumented to trace comparisons. */
  public boolean usesTraceCmp() {
    return coverage.contains(SanitizerCoverage.TRACE_CMP);
  }

  /**
   * Checks that the compiler and, if set, the libFuzzer archive exist.
   * Raises a fatal error if not.
   */
  public void checkPaths(Context context) {
    boolean ok = true;
    if (resolve(clangPath) == null) {
      context.error("(error Clang not found: \"" + clangPath + "\")");
      ok = false;
    }
    if (libFuzzerLib != null && !new File(libFuzzerLib).isFile()) {
      context.error("(error libFuzzer library not found: \""
          + libFuzzerLib + "\")");
      ok = false;
    }
    if (!ok) {
      throw context.raiseFatalError("One or more Clang paths do not exist");
    }
  }

  /**
   * Returns the file that a program path refers to, or null.
   *
   * <p>A path that contains a separator must name an existing file; a bare
   * name is searched for in the directories of {@code PATH}.
   */
  static @Nullable File resolve(String path) {
    if (path.isEmpty()) {
      return null;
    }
    if (path.contains(File.separator)) {
      final File file = new File(path);
      return file.isFile() ? file : null;
    }
    final String pathVariable = System.getenv("PATH");
    if (pathVariable == null) {
      return null;
    }
    for (String dir : Splitter.on(File.pathSeparatorChar).omitEmptyStrings()
        .split(pathVariable)) {
      final File file = new File(dir, path);
      if (file.isFile() && file.canExecute()) {
        return file;
      }
    }
    return null;
  }

  /** Returns the command line that compiles {@code source} to
   * {@code output}. */
  public ImmutableList<String> toCommand(File source, File output) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    b.add(clangPath);
    b.add("-std=c++11");
    b.add("-O" + optimizationLevel);
    if (debugSymbols) {
      b.add("-g");
    }
    final StringBuilder sanitize = new StringBuilder("-fsanitize=");
    sanitize.append(libFuzzerLib == null ? "fuzzer" : "fuzzer-no-link");
    if (useAsan) {
      sanitize.append(",address");
    }
    if (useUbsan) {
      sanitize.append(",undefined");
    }
    b.add(sanitize.toString());
    if (libFuzzerLib != null && !coverage.isEmpty()) {
      b.add(coverage.stream()
          .map(c -> c.flag)
          .collect(Collectors.joining(",", "-fsanitize-coverage=", "")));
    }
    b.add(source.getAbsolutePath());
    if (libFuzzerLib != null) {
      b.add(libFuzzerLib);
    }
    b.add("-o");
    b.add(output.getAbsolutePath());
    return b.build();
  }

  /** Kind of coverage instrumentation, as in
   * {@code -fsanitize-coverage=...}. */
  public enum SanitizerCoverage {
    INLINE_8BIT_COUNTERS("inline-8bit-counters"),
    PC_TABLE("pc-table"),
    TRACE_PC_GUARD("trace-pc-guard"),
    TRACE_CMP("trace-cmp");

    public final String flag;

    SanitizerCoverage(String flag) {
      this.flag = flag;
    }
  }
}

// End ClangOptions.java
