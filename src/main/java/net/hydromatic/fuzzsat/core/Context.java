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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import net.hydromatic.fuzzsat.ast.TermBuilder;

/**
 * Shared state of a solving session: properties, the term builder, and
 * diagnostic streams.
 *
 * <p>Warnings and debug messages are written only if {@link #getVerbosity()}
 * is positive; errors are always written.
 */
public class Context {
  public final ImmutableMap<Prop, Object> props;
  public final TermBuilder terms;
  public final Tracer tracer;
  private final PrintWriter warnings;
  private final PrintWriter debug;
  private final PrintWriter errors;
  private final int verbosity;

  private Context(
      Map<Prop, Object> props,
      TermBuilder terms,
      Tracer tracer,
      PrintWriter warnings,
      PrintWriter debug,
      PrintWriter errors) {
    this.props = ImmutableMap.copyOf(props);
    this.terms = requireNonNull(terms, "terms");
    this.tracer = requireNonNull(tracer, "tracer");
    this.warnings = requireNonNull(warnings, "warnings");
    this.debug = requireNonNull(debug, "debug");
    this.errors = requireNonNull(errors, "errors");
    this.verbosity = Prop.VERBOSITY.intValue(this.props);
  }

  /** Creates a context that writes diagnostics to standard error. */
  public static Context of(Map<Prop, Object> props) {
    final PrintWriter stderr =
        new PrintWriter(
            new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true);
    return new Context(
        props, new TermBuilder(), Tracers.empty(), stderr, stderr, stderr);
  }

  /** Returns a copy of this context with the given diagnostic streams. */
  public Context withStreams(
      PrintWriter warnings, PrintWriter debug, PrintWriter errors) {
    return new Context(props, terms, tracer, warnings, debug, errors);
  }

  /** Returns a copy of this context with the given tracer. */
  public Context withTracer(Tracer tracer) {
    return new Context(props, terms, tracer, warnings, debug, errors);
  }

  public int getVerbosity() {
    return verbosity;
  }

  /** Writes a line to the warning stream, if verbose. */
  public void warn(String line) {
    if (verbosity > 0) {
      warnings.println(line);
      warnings.flush();
    }
  }

  /** Writes a line to the debug stream, if verbose. */
  public void debug(String line) {
    if (verbosity > 0) {
      debug.println(line);
      debug.flush();
    }
  }

  /** Writes a line to the error stream. */
  public void error(String line) {
    errors.println(line);
    errors.flush();
  }

  /**
   * Reports an unrecoverable error and throws.
   *
   * <p>Declared to return the exception so that callers can write
   * {@code throw context.raiseFatalError(...)}; it never returns normally.
   */
  public FatalErrorException raiseFatalError(String message) {
    error("(fatal error: " + message + ")");
    throw new FatalErrorException(message);
  }
}

// End Context.java
