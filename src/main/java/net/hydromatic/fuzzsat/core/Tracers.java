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
package net.hydromatic.fuzzsat.core;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.fuzzsat.cxx.CxxProgram;
import net.hydromatic.fuzzsat.fuzz.FuzzingSolver;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action after each pass, then
   * calls the underlying tracer.
   */
  public static Tracer withOnPass(
      Tracer tracer, BiConsumer<String, Boolean> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onPass(String passName, boolean proceed) {
        consumer.accept(passName, proceed);
        super.onPass(passName, proceed);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each state change,
   * then calls the underlying tracer.
   */
  public static Tracer withOnState(
      Tracer tracer, Consumer<FuzzingSolver.State> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onState(FuzzingSolver.State state) {
        consumer.accept(state);
        super.onState(state);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a generated program,
   * then calls the underlying tracer.
   */
  public static Tracer withOnProgram(
      Tracer tracer, Consumer<CxxProgram> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onProgram(CxxProgram program) {
        consumer.accept(program);
        super.onProgram(program);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a response, then
   * calls the underlying tracer.
   */
  public static Tracer withOnResponse(
      Tracer tracer, Consumer<SolverResponse> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResponse(SolverResponse response) {
        consumer.accept(response);
        super.onResponse(response);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onPass(String passName, boolean proceed) {}

    @Override
    public void onState(FuzzingSolver.State state) {}

    @Override
    public void onProgram(CxxProgram program) {}

    @Override
    public void onResponse(SolverResponse response) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onPass(String passName, boolean proceed) {
      tracer.onPass(passName, proceed);
    }

    @Override
    public void onState(FuzzingSolver.State state) {
      tracer.onState(state);
    }

    @Override
    public void onProgram(CxxProgram program) {
      tracer.onProgram(program);
    }

    @Override
    public void onResponse(SolverResponse response) {
      tracer.onResponse(response);
    }
  }
}

// End Tracers.java
