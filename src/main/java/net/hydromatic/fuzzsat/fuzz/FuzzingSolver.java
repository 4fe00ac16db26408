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
import com.google.common.collect.Sets;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import net.hydromatic.fuzzsat.ast.Sort;
import net.hydromatic.fuzzsat.ast.Term;
import net.hydromatic.fuzzsat.core.Cancellable;
import net.hydromatic.fuzzsat.core.Context;
import net.hydromatic.fuzzsat.core.Prop;
import net.hydromatic.fuzzsat.core.Query;
import net.hydromatic.fuzzsat.core.Solver;
import net.hydromatic.fuzzsat.core.SolverResponse;
import net.hydromatic.fuzzsat.transform.QueryPassManager;
import net.hydromatic.fuzzsat.transform.StandardPasses;

/**
 * Solver that searches for a satisfying assignment by fuzzing.
 *
 * <p>{@link #solve} works on a copy of the query. It checks that every sort
 * is supported, simplifies, extracts equalities and lays out the input
 * buffer; then it calls {@link #fuzz}, which subclasses implement.
 *
 * <p>{@link #cancel()} may be called from any thread. It is sticky: once a
 * solver is cancelled, every later call to {@link #solve} returns
 * {@code unknown}.
 */
public abstract class FuzzingSolver implements Solver {
  /** Largest bit-vector width that the generated code can hold. */
  public static final int MAX_BIT_VECTOR_WIDTH = 64;

  protected final Context context;

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Object lock = new Object();
  private final Set<Cancellable> registered = Sets.newIdentityHashSet();
  private volatile State state = State.INIT;

  protected FuzzingSolver(Context context) {
    this.context = requireNonNull(context, "context");
  }

  @Override
  public SolverResponse solve(Query query, boolean produceModel) {
    final SolverResponse response = solve2(query, produceModel);
    if (state != State.CANCELLED) {
      setState(response.sat == SolverResponse.Satisfiability.SAT
          ? State.SAT
          : State.UNKNOWN);
    }
    context.tracer.onResponse(response);
    return response;
  }

  private SolverResponse solve2(Query query, boolean produceModel) {
    setState(State.INIT);
    if (produceModel) {
      context.error("(error model generation not supported)");
      return SolverResponse.unknown("model generation not supported");
    }

    if (isCancelled()) {
      return cancelledResponse();
    }
    setState(State.GATE_CHECKING);
    final Query q = query.copy();
    final SortConformanceCheckPass gate =
        new SortConformanceCheckPass(this::isSortSupported);
    try (Registration ignored = register(gate)) {
      gate.run(q);
    }
    if (isCancelled()) {
      return cancelledResponse();
    }
    if (!gate.predicateAlwaysHeld()) {
      final Term violation = requireNonNull(gate.firstViolation());
      return SolverResponse.unknown("unsupported sort " + violation.sort);
    }

    if (Prop.PREPROCESS.booleanValue(context.props)) {
      setState(State.PREPROCESSING);
      final QueryPassManager pm =
          StandardPasses.addSimplifications(new QueryPassManager());
      try (Registration ignored = register(pm)) {
        pm.run(q);
      }
      if (isCancelled()) {
        return cancelledResponse();
      }
    }

    setState(State.ANALYZING);
    ImmutableList<EqualitySet> equalities = ImmutableList.of();
    if (Prop.EXTRACT_EQUALITIES.booleanValue(context.props)) {
      final EqualityExtractionPass extraction = new EqualityExtractionPass();
      try (Registration ignored = register(extraction)) {
        extraction.run(q);
      }
      if (isCancelled()) {
        return cancelledResponse();
      }
      equalities = extraction.equalities();
    }
    final FreeVariableToBufferAssignmentPass assignment =
        new FreeVariableToBufferAssignmentPass(equalities,
            Prop.BUFFER_ALIGNMENT.intValue(context.props));
    try (Registration ignored = register(assignment)) {
      assignment.run(q);
    }
    if (isCancelled()) {
      return cancelledResponse();
    }
    final FuzzingAnalysisInfo info =
        new FuzzingAnalysisInfo(assignment.getAssignment(), equalities);
    context.debug("(FuzzingSolver input buffer of " + info.maxLength()
        + " byte(s))");

    return fuzz(q, info);
  }

  /**
   * Generates, builds and runs a fuzz target for an analyzed query.
   *
   * <p>Implementations move through {@link State#LOWERING}, {@link
   * State#COMPILING} and {@link State#FUZZ_RUNNING}, register each piece of
   * cancellable work, and return {@link #cancelledResponse()} if {@link
   * #isCancelled()} is set between states.
   */
  protected abstract SolverResponse fuzz(Query query,
      FuzzingAnalysisInfo info);

  /**
   * Returns whether generated code can represent values of a sort. Writes
   * a warning if not.
   */
  protected boolean isSortSupported(Sort sort) {
    switch (sort.kind) {
      case BOOL:
        return true;
      case BIT_VECTOR:
        if (sort.getBitVectorWidth() <= MAX_BIT_VECTOR_WIDTH) {
          return true;
        }
        context.warn("(BitVector width " + sort.getBitVectorWidth()
            + " not supported)");
        return false;
      default:
        context.warn("(Sort \"" + sort + "\" not supported)");
        return false;
    }
  }

  @Override
  public void cancel() {
    synchronized (lock) {
      cancelled.set(true);
      for (Cancellable cancellable : registered) {
        cancellable.cancel();
      }
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public State getState() {
    return state;
  }

  protected final void setState(State state) {
    this.state = state;
    context.tracer.onState(state);
  }

  /** Moves to {@link State#CANCELLED} and returns the response for it. */
  protected final SolverResponse cancelledResponse() {
    context.debug("(FuzzingSolver cancelled in state " + state + ")");
    setState(State.CANCELLED);
    return SolverResponse.unknown("cancelled");
  }

  /**
   * Registers work to be cancelled if this solver is cancelled. If the
   * solver has already been cancelled, cancels it at once.
   *
   * <p>Use in a try-with-resources block, so the registration is removed
   * however the block exits.
   */
  protected final Registration register(Cancellable cancellable) {
    synchronized (lock) {
      registered.add(cancellable);
      if (cancelled.get()) {
        cancellable.cancel();
      }
    }
    return new Registration(cancellable);
  }

  /** Returns the number of pieces of work currently registered. */
  int registeredCount() {
    synchronized (lock) {
      return registered.size();
    }
  }

  /** Stage of a solving attempt. */
  public enum State {
    INIT,
    GATE_CHECKING,
    PREPROCESSING,
    ANALYZING,
    LOWERING,
    COMPILING,
    FUZZ_RUNNING,
    SAT,
    UNKNOWN,
    CANCELLED
  }

  /** Handle that removes a piece of work from the registry when closed. */
  protected final class Registration implements AutoCloseable {
    private final Cancellable cancellable;

    private Registration(Cancellable cancellable) {
      this.cancellable = cancellable;
    }

    @Override
    public void close() {
      synchronized (lock) {
        registered.remove(cancellable);
      }
    }
  }
}

// End FuzzingSolver.java
