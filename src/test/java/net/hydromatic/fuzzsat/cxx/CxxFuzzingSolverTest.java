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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.hamcrest.core.IsNull.nullValue;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.hamcrest.core.StringContains.containsString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.fuzzsat.ast.Sort;
import net.hydromatic.fuzzsat.ast.Term;
import net.hydromatic.fuzzsat.ast.TermBuilder;
import net.hydromatic.fuzzsat.core.Context;
import net.hydromatic.fuzzsat.core.FatalErrorException;
import net.hydromatic.fuzzsat.core.Prop;
import net.hydromatic.fuzzsat.core.Query;
import net.hydromatic.fuzzsat.core.SolverResponse;
import net.hydromatic.fuzzsat.core.Tracer;
import net.hydromatic.fuzzsat.core.Tracers;
import net.hydromatic.fuzzsat.fuzz.FuzzingSolver.State;
import net.hydromatic.fuzzsat.fuzz.LibFuzzerInvocationManager;
import net.hydromatic.fuzzsat.fuzz.LibFuzzerOptions;
import net.hydromatic.fuzzsat.fuzz.LibFuzzerResponse;
import net.hydromatic.fuzzsat.fuzz.WorkingDirectoryManager;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link CxxFuzzingSolver}, with fake compiler and fuzzer. */
public class CxxFuzzingSolverTest {
  @TempDir Path tempDir;

  private final Map<Prop, Object> props = new HashMap<>();
  private final StringWriter warnings = new StringWriter();
  private final StringWriter errors = new StringWriter();
  private final List<State> states = new ArrayList<>();
  private final List<CxxProgram> programs = new ArrayList<>();
  private final FakeClang clang = new FakeClang();
  private final FakeLibFuzzer libFuzzer = new FakeLibFuzzer();
  private File workingDirectory;

  @BeforeEach
  void setUp() throws IOException {
    final File fakeClang = new File(tempDir.toFile(), "clang++");
    Files.touch(fakeClang);
    workingDirectory = new File(tempDir.toFile(), "work");
    props.put(Prop.CLANG_PATH, fakeClang.getPath());
    props.put(Prop.WORKING_DIRECTORY, workingDirectory);
  }

  private Context context() {
    final Tracer tracer =
        Tracers.withOnProgram(
            Tracers.withOnState(Tracers.empty(), states::add),
            programs::add);
    return Context.of(props)
        .withStreams(new PrintWriter(warnings),
            new PrintWriter(new StringWriter()), new PrintWriter(errors))
        .withTracer(tracer);
  }

  private CxxFuzzingSolver solver(Context context) {
    return new CxxFuzzingSolver(context,
        CxxFuzzingSolverOptions.of(context.props), clang, libFuzzer);
  }

  /** Returns a query whose only variable is an 8-bit vector. */
  private static Query bitVectorQuery(Context context) {
    final TermBuilder b = context.terms;
    final Term x = b.variable("x", Sort.bitVector(8));
    return new Query(context, ImmutableList.of(b.bvUlt(x, b.bv(10, 8))));
  }

  /** Returns the scratch directories left in the working directory. */
  private int scratchDirectoryCount() {
    final String[] names = workingDirectory.list();
    return names == null ? 0 : names.length;
  }

  @Test
  void testSat() {
    final Context context = context();
    final CxxFuzzingSolver solver = solver(context);
    assertThat(solver.getName(), is("CxxFuzzingSolver"));
    final SolverResponse response =
        solver.solve(bitVectorQuery(context), false);
    assertThat(response.sat, is(SolverResponse.Satisfiability.SAT));
    assertThat(response.reason, is("target found"));
    assertThat(response.artifact, nullValue());
    assertThat(states,
        is(
            ImmutableList.of(State.INIT, State.GATE_CHECKING,
                State.PREPROCESSING, State.ANALYZING, State.LOWERING,
                State.COMPILING, State.FUZZ_RUNNING, State.SAT)));

    assertThat(clang.invocations, is(1));
    assertThat(programs.size(), is(1));
    assertThat(clang.program, sameInstance(programs.get(0)));
    assertThat(clang.program.toString(),
        containsString("if ((size < 1)) {\n"));
    assertThat(clang.program.toString(), containsString("__builtin_trap();"));
    assertThat(clang.sourceName, is("program.cpp"));
    assertThat(clang.stdoutName, is("clang.stdout.txt"));

    assertThat(libFuzzer.invocations, is(1));
    final LibFuzzerOptions options = libFuzzer.options;
    assertThat(options.maxLength, is(1));
    assertThat(options.useCmp, is(true));
    assertThat(libFuzzer.corpusExisted, is(true));
    assertThat(libFuzzer.stdoutName, is("libfuzzer.stdout.txt"));

    assertThat(scratchDirectoryCount(), is(0));
  }

  @Test
  void testKeepWorkingDirectory() {
    props.put(Prop.KEEP_WORKING_DIRECTORY, true);
    props.put(Prop.VERBOSITY, 1);
    final Context context = context();
    final SolverResponse response =
        solver(context).solve(bitVectorQuery(context), false);
    assertThat(response.sat, is(SolverResponse.Satisfiability.SAT));
    final File artifact = response.artifact;
    assertThat(artifact == null, is(false));
    assertThat(artifact.isFile(), is(true));
    assertThat(artifact.getName(), is("crash-0123"));
    assertThat(artifact.getParentFile().getName(), is("artifacts"));
    assertThat(scratchDirectoryCount(), is(1));

    // At verbosity 1, tool output is not redirected.
    assertThat(clang.stdoutName, nullValue());
    assertThat(libFuzzer.stdoutName, nullValue());
  }

  @Test
  void testUnsupportedSort() {
    props.put(Prop.VERBOSITY, 1);
    final Context context = context();
    final TermBuilder b = context.terms;
    final Term f = b.variable("f", Sort.float32());
    final Term g = b.variable("g", Sort.float32());
    final Query query = new Query(context, ImmutableList.of(b.fpLt(f, g)));
    final SolverResponse response = solver(context).solve(query, false);
    assertThat(response.sat, is(SolverResponse.Satisfiability.UNKNOWN));
    assertThat(response.reason, is("unsupported sort (_ FloatingPoint 8 24)"));
    assertThat(warnings.toString(),
        is("(Sort \"(_ FloatingPoint 8 24)\" not supported)\n"));
    assertThat(states,
        is(ImmutableList.of(State.INIT, State.GATE_CHECKING, State.UNKNOWN)));
    assertThat(clang.invocations, is(0));
    assertThat(libFuzzer.invocations, is(0));
  }

  @Test
  void testProduceModel() {
    final Context context = context();
    final SolverResponse response =
        solver(context).solve(bitVectorQuery(context), true);
    assertThat(response.sat, is(SolverResponse.Satisfiability.UNKNOWN));
    assertThat(response.reason, is("model generation not supported"));
    assertThat(errors.toString(),
        is("(error model generation not supported)\n"));
    assertThat(states, is(ImmutableList.of(State.INIT, State.UNKNOWN)));
    assertThat(clang.invocations, is(0));
  }

  @Test
  void testCompilationFailed() {
    clang.succeed = false;
    final Context context = context();
    final SolverResponse response =
        solver(context).solve(bitVectorQuery(context), false);
    assertThat(response.reason, is("compilation failed"));
    assertThat(states.subList(states.size() - 2, states.size()),
        is(ImmutableList.of(State.COMPILING, State.UNKNOWN)));
    assertThat(libFuzzer.invocations, is(0));
    assertThat(scratchDirectoryCount(), is(0));
  }

  @Test
  void testNothingFound() {
    libFuzzer.mode = Mode.NOTHING;
    final Context context = context();
    final SolverResponse response =
        solver(context).solve(bitVectorQuery(context), false);
    assertThat(response.sat, is(SolverResponse.Satisfiability.UNKNOWN));
    assertThat(response.reason, is("fuzzing found no satisfying input"));
    assertThat(states.subList(states.size() - 2, states.size()),
        is(ImmutableList.of(State.FUZZ_RUNNING, State.UNKNOWN)));
  }

  /** The solver works on a copy of the query. */
  @Test
  void testQueryNotModified() {
    final Context context = context();
    final TermBuilder b = context.terms;
    final Term x = b.variable("x", Sort.bitVector(8));
    final Term y = b.variable("y", Sort.bitVector(8));
    final Query query =
        new Query(context,
            ImmutableList.of(b.and(b.eq(x, b.bv(5, 8)), b.bvUlt(x, y)),
                b.trueLiteral()));
    final ImmutableList<Term> before = query.constraints();
    solver(context).solve(query, false);
    assertThat(query.constraints(), is(before));
    assertThat(clang.program.toString(),
        containsString("const uint64_t var_x = UINT64_C(0x5);\n"));
  }

  @Test
  void testCancelBeforeSolve() {
    final Context context = context();
    final CxxFuzzingSolver solver = solver(context);
    solver.cancel();
    solver.cancel();
    for (int i = 0; i < 2; i++) {
      final SolverResponse response =
          solver.solve(bitVectorQuery(context), false);
      assertThat(response.sat, is(SolverResponse.Satisfiability.UNKNOWN));
      assertThat(response.reason, is("cancelled"));
    }
    assertThat(states,
        is(
            ImmutableList.of(State.INIT, State.CANCELLED, State.INIT,
                State.CANCELLED)));
    assertThat(solver.getState(), is(State.CANCELLED));
    assertThat(clang.invocations, is(0));
  }

  /** Cancelling after a result does not change it, but later attempts are
   * cancelled. */
  @Test
  void testCancelAfterSat() {
    final Context context = context();
    final CxxFuzzingSolver solver = solver(context);
    final SolverResponse response =
        solver.solve(bitVectorQuery(context), false);
    solver.cancel();
    assertThat(response.sat, is(SolverResponse.Satisfiability.SAT));
    assertThat(solver.getState(), is(State.SAT));
    assertThat(solver.isCancelled(), is(true));
    assertThat(solver.solve(bitVectorQuery(context), false).reason,
        is("cancelled"));
    assertThat(clang.invocations, is(1));
  }

  /** Cancelling from another thread while the fuzzer runs stops it. */
  @Test
  void testConcurrentCancel() throws Exception {
    libFuzzer.mode = Mode.BLOCK;
    final Context context = context();
    final CxxFuzzingSolver solver = solver(context);
    final Query query = bitVectorQuery(context);
    final CompletableFuture<SolverResponse> future =
        CompletableFuture.supplyAsync(() -> solver.solve(query, false));
    assertThat(libFuzzer.entered.await(30, TimeUnit.SECONDS), is(true));
    assertThat(solver.getState(), is(State.FUZZ_RUNNING));
    solver.cancel();
    final SolverResponse response = future.get(30, TimeUnit.SECONDS);
    assertThat(response.sat, is(SolverResponse.Satisfiability.UNKNOWN));
    assertThat(response.reason, is("cancelled"));
    assertThat(solver.getState(), is(State.CANCELLED));
    assertThat(libFuzzer.cancels.get(), is(1));
    assertThat(states.get(states.size() - 1), is(State.CANCELLED));
    assertThat(scratchDirectoryCount(), is(0));
  }

  /** A query whose only constraint is {@code x = x} is satisfied by every
   * input. Preprocessing removes the constraint, so the program traps
   * without reading the input. */
  @Test
  void testTrivialEquality() {
    final Context context = context();
    final TermBuilder b = context.terms;
    final Term x = b.variable("x", Sort.bool());
    final Query query = new Query(context, ImmutableList.of(b.eq(x, x)));
    final SolverResponse response = solver(context).solve(query, false);
    assertThat(response.sat, is(SolverResponse.Satisfiability.SAT));
    final String program = clang.program.toString();
    assertThat(program, containsString("  if (true) {\n"));
    assertThat(program, not(containsString("size <")));
    assertThat(program, not(containsString("var_x")));
    assertThat(libFuzzer.options.maxLength, is(0));
  }

  /** Without preprocessing, {@code x = x} is extracted as an equality, so x
   * still takes a byte of input that nothing reads. */
  @Test
  void testTrivialEqualityNoPreprocessing() {
    props.put(Prop.PREPROCESS, false);
    final Context context = context();
    final TermBuilder b = context.terms;
    final Term x = b.variable("x", Sort.bool());
    final Query query = new Query(context, ImmutableList.of(b.eq(x, x)));
    final SolverResponse response = solver(context).solve(query, false);
    assertThat(response.sat, is(SolverResponse.Satisfiability.SAT));
    assertThat(states,
        is(
            ImmutableList.of(State.INIT, State.GATE_CHECKING,
                State.ANALYZING, State.LOWERING, State.COMPILING,
                State.FUZZ_RUNNING, State.SAT)));
    final String program = clang.program.toString();
    assertThat(program, containsString("  if ((size < 1)) {\n"));
    assertThat(program,
        containsString(
            "  const bool var_x = (fz_read_bits(data, 0, 1) != 0);\n"));
    assertThat(program, containsString("  if (true) {\n"));
    assertThat(libFuzzer.options.maxLength, is(1));
  }

  /** If the scratch directory cannot be deleted, the solver warns but still
   * returns the result it found. */
  @Test
  void testDeleteWorkingDirectoryFails() {
    props.put(Prop.VERBOSITY, 1);
    final Context context = context();
    final File scratch = new File(workingDirectory, "scratch");
    final CxxFuzzingSolver solver =
        new CxxFuzzingSolver(context,
            CxxFuzzingSolverOptions.of(context.props), clang, libFuzzer) {
          @Override
          protected WorkingDirectoryManager createWorkingDirectory() {
            assertThat(scratch.mkdirs(), is(true));
            return new WorkingDirectoryManager(scratch, false) {
              @Override
              public void close() {
                throw new UncheckedIOException(
                    new IOException("directory not empty"));
              }
            };
          }
        };
    final SolverResponse response =
        solver.solve(bitVectorQuery(context), false);
    assertThat(response.sat, is(SolverResponse.Satisfiability.SAT));
    assertThat(response.reason, is("target found"));
    assertThat(solver.getState(), is(State.SAT));
    assertThat(warnings.toString(),
        containsString("(could not delete working directory " + scratch
            + ": "));
    assertThat(errors.toString(), is(""));
    assertThat(new File(scratch, "artifacts/crash-0123").isFile(), is(true));
  }

  @Test
  void testMissingClang() {
    props.put(Prop.CLANG_PATH,
        new File(tempDir.toFile(), "no-such-clang").getPath());
    final Context context = context();
    final FatalErrorException e =
        assertThrows(FatalErrorException.class, () -> solver(context));
    assertThat(e.getMessage(), is("One or more Clang paths do not exist"));
    assertThrows(FatalErrorException.class,
        () -> CxxFuzzingSolver.create(context));
    assertThat(errors.toString(),
        containsString("(error Clang not found: \""));
  }

  /** What {@link FakeLibFuzzer} does when run. */
  enum Mode {
    /** Writes a crash file and reports it. */
    FIND,
    /** Reports that nothing was found. */
    NOTHING,
    /** Waits until cancelled. */
    BLOCK
  }

  /** Compiler that records its arguments and creates an empty binary. */
  private static class FakeClang implements ClangInvocationManager {
    boolean succeed = true;
    int invocations;
    CxxProgram program;
    String sourceName;
    @Nullable String stdoutName;

    @Override
    public boolean compile(CxxProgram program, File sourceFile,
        File outputFile, ClangOptions options, @Nullable File stdoutFile,
        @Nullable File stderrFile) {
      ++invocations;
      this.program = program;
      this.sourceName = sourceFile.getName();
      this.stdoutName = stdoutFile == null ? null : stdoutFile.getName();
      if (!succeed) {
        return false;
      }
      try {
        Files.touch(outputFile);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return true;
    }

    @Override
    public void cancel() {
    }
  }

  /** Fuzzer that records its options and behaves according to a
   * {@link Mode}. */
  private static class FakeLibFuzzer implements LibFuzzerInvocationManager {
    Mode mode = Mode.FIND;
    int invocations;
    LibFuzzerOptions options;
    boolean corpusExisted;
    @Nullable String stdoutName;
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch cancelled = new CountDownLatch(1);
    final AtomicInteger cancels = new AtomicInteger();

    @Override
    public LibFuzzerResponse fuzz(LibFuzzerOptions options,
        @Nullable File stdoutFile, @Nullable File stderrFile) {
      ++invocations;
      this.options = options;
      this.corpusExisted =
          options.corpusDir != null && options.corpusDir.isDirectory();
      this.stdoutName = stdoutFile == null ? null : stdoutFile.getName();
      switch (mode) {
        case FIND:
          final File crash = new File(options.artifactDir, "crash-0123");
          try {
            Files.write(new byte[] {5}, crash);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
          return LibFuzzerResponse.targetFound(crash);
        case NOTHING:
          return LibFuzzerResponse.unknown();
        default:
          entered.countDown();
          try {
            if (!cancelled.await(30, TimeUnit.SECONDS)) {
              return LibFuzzerResponse.unknown();
            }
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return LibFuzzerResponse.cancelled();
      }
    }

    @Override
    public void cancel() {
      cancels.incrementAndGet();
      cancelled.countDown();
    }
  }
}

// End CxxFuzzingSolverTest.java
