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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fuzzsat.ast.Sort;
import net.hydromatic.fuzzsat.ast.Term;
import net.hydromatic.fuzzsat.ast.TermBuilder;
import net.hydromatic.fuzzsat.core.Context;
import net.hydromatic.fuzzsat.core.Prop;
import net.hydromatic.fuzzsat.core.Query;
import net.hydromatic.fuzzsat.core.SolverResponse;
import net.hydromatic.fuzzsat.core.Tracer;
import net.hydromatic.fuzzsat.core.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link FuzzingSolver}, using a subclass that does not run
 * a fuzzer. */
public class FuzzingSolverTest {
  private final Map<Prop, Object> props = new HashMap<>();
  private final StringWriter warnings = new StringWriter();
  private final List<FuzzingSolver.State> states = new ArrayList<>();
  private final List<SolverResponse> responses = new ArrayList<>();

  private Context context() {
    final Tracer tracer =
        Tracers.withOnResponse(
            Tracers.withOnState(Tracers.empty(), states::add),
            responses::add);
    return Context.of(props)
        .withStreams(new PrintWriter(warnings),
            new PrintWriter(new StringWriter()),
            new PrintWriter(new StringWriter()))
        .withTracer(tracer);
  }

  /** Solver that records what it is asked to fuzz, and reports SAT. */
  private static class StubSolver extends FuzzingSolver {
    Query query;
    FuzzingAnalysisInfo info;
    int registeredDuringFuzz = -1;

    StubSolver(Context context) {
      super(context);
    }

    @Override
    public String getName() {
      return "StubSolver";
    }

    @Override
    protected SolverResponse fuzz(Query query, FuzzingAnalysisInfo info) {
      this.query = query;
      this.info = info;
      this.registeredDuringFuzz = registeredCount();
      return SolverResponse.sat(null);
    }
  }

  @Test
  void testPipeline() {
    final Context context = context();
    final TermBuilder b = context.terms;
    final Term x = b.variable("x", Sort.bitVector(8));
    final Term y = b.variable("y", Sort.bitVector(8));
    final Query query =
        new Query(context,
            ImmutableList.of(b.and(b.eq(x, b.bv(5, 8)), b.bvUlt(x, y))));
    final ImmutableList<Term> before = query.constraints();
    final StubSolver solver = new StubSolver(context);
    final SolverResponse response = solver.solve(query, false);

    assertThat(response.sat, is(SolverResponse.Satisfiability.SAT));
    assertThat(solver.getState(), is(FuzzingSolver.State.SAT));
    assertThat(states,
        is(
            ImmutableList.of(FuzzingSolver.State.INIT,
                FuzzingSolver.State.GATE_CHECKING,
                FuzzingSolver.State.PREPROCESSING,
                FuzzingSolver.State.ANALYZING,
                FuzzingSolver.State.SAT)));
    assertThat(responses, is(ImmutableList.of(response)));

    // The solver works on a copy; the caller's query is unchanged.
    assertThat(query.constraints(), is(before));
    assertThat(solver.query, not(sameInstance(query)));

    // Preprocessing split the conjunction, so the equality was extracted
    // and x takes no space.
    assertThat(solver.query.constraints(),
        is(ImmutableList.of(b.bvUlt(x, y))));
    assertThat(solver.info.equalities.size(), is(1));
    assertThat(solver.info.maxLength(), is(1));
    assertThat(solver.registeredDuringFuzz, is(0));
    assertThat(solver.registeredCount(), is(0));
  }

  @Test
  void testNoPreprocessing() {
    props.put(Prop.PREPROCESS, false);
    final Context context = context();
    final TermBuilder b = context.terms;
    final Term x = b.variable("x", Sort.bitVector(8));
    final Term y = b.variable("y", Sort.bitVector(8));
    final Query query =
        new Query(context,
            ImmutableList.of(b.and(b.eq(x, b.bv(5, 8)), b.bvUlt(x, y))));
    final StubSolver solver = new StubSolver(context);
    solver.solve(query, false);
    assertThat(states,
        is(
            ImmutableList.of(FuzzingSolver.State.INIT,
                FuzzingSolver.State.GATE_CHECKING,
                FuzzingSolver.State.ANALYZING,
                FuzzingSolver.State.SAT)));
    // The equality is inside a conjunction, so it is not extracted.
    assertThat(solver.info.equalities.isEmpty(), is(true));
    assertThat(solver.info.maxLength(), is(2));
  }

  /** Without equality extraction every variable takes buffer space; by
   * default each starts on a byte boundary. */
  @Test
  void testNoEqualityExtraction() {
    props.put(Prop.EXTRACT_EQUALITIES, false);
    final Context context = context();
    final TermBuilder b = context.terms;
    final Term x = b.variable("x", Sort.bitVector(8));
    final Term p = b.variable("p", Sort.bool());
    final Query query =
        new Query(context, ImmutableList.of(b.eq(x, b.bv(5, 8)), p));
    final StubSolver solver = new StubSolver(context);
    solver.solve(query, false);
    assertThat(solver.query.size(), is(2));
    assertThat(solver.info.computeWidth(), is(16));
    assertThat(solver.info.maxLength(), is(2));
  }

  @Test
  void testPackedBuffer() {
    props.put(Prop.EXTRACT_EQUALITIES, false);
    props.put(Prop.BUFFER_ALIGNMENT, 1);
    final Context context = context();
    final TermBuilder b = context.terms;
    final Term x = b.variable("x", Sort.bitVector(8));
    final Term p = b.variable("p", Sort.bool());
    final Query query =
        new Query(context, ImmutableList.of(b.eq(x, b.bv(5, 8)), p));
    final StubSolver solver = new StubSolver(context);
    solver.solve(query, false);
    assertThat(solver.info.computeWidth(), is(9));
    assertThat(solver.info.maxLength(), is(2));
  }

  @Test
  void testWideBitVectorRejected() {
    props.put(Prop.VERBOSITY, 1);
    final Context context = context();
    final TermBuilder b = context.terms;
    final Term z = b.variable("z", Sort.bitVector(65));
    final Query query = new Query(context, ImmutableList.of(b.bvUlt(z, z)));
    final StubSolver solver = new StubSolver(context);
    final SolverResponse response = solver.solve(query, false);
    assertThat(response.sat, is(SolverResponse.Satisfiability.UNKNOWN));
    assertThat(response.reason, is("unsupported sort (_ BitVec 65)"));
    assertThat(warnings.toString(), is("(BitVector width 65 not supported)\n"));
    assertThat(solver.query == null, is(true));
    assertThat(solver.getState(), is(FuzzingSolver.State.UNKNOWN));
  }

  /** Work registered after the solver is cancelled is cancelled at
   * once. */
  @Test
  void testRegisterAfterCancel() {
    final Context context = context();
    final List<String> log = new ArrayList<>();
    final FuzzingSolver solver = new StubSolver(context) {
      @Override
      protected SolverResponse fuzz(Query query, FuzzingAnalysisInfo info) {
        cancel();
        try (Registration ignored = register(() -> log.add("cancelled"))) {
          log.add("registered " + registeredCount());
        }
        return isCancelled() ? cancelledResponse() : SolverResponse.sat(null);
      }
    };
    final SolverResponse response =
        solver.solve(new Query(context), false);
    assertThat(log, is(ImmutableList.of("cancelled", "registered 1")));
    assertThat(response.reason, is("cancelled"));
    assertThat(solver.getState(), is(FuzzingSolver.State.CANCELLED));
    assertThat(solver.registeredCount(), is(0));

    // Cancellation is sticky.
    states.clear();
    assertThat(solver.solve(new Query(context), false).reason,
        is("cancelled"));
    assertThat(states,
        is(
            ImmutableList.of(FuzzingSolver.State.INIT,
                FuzzingSolver.State.CANCELLED)));
  }
}

// End FuzzingSolverTest.java
