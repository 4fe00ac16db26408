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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.fuzzsat.ast.Term;

/**
 * Ordered list of boolean constraints, all of which must hold.
 *
 * <p>Order does not affect satisfiability but is preserved, so that printing
 * and code generation are deterministic. Passes modify a query by replacing
 * its constraint list; the terms themselves are immutable.
 */
public class Query {
  private final Context context;
  private final List<Term> constraints = new ArrayList<>();

  public Query(Context context, Iterable<? extends Term> constraints) {
    this.context = requireNonNull(context, "context");
    constraints.forEach(this::add);
  }

  public Query(Context context) {
    this(context, ImmutableList.of());
  }

  public Context getContext() {
    return context;
  }

  /** Returns an immutable snapshot of the constraints. */
  public ImmutableList<Term> constraints() {
    return ImmutableList.copyOf(constraints);
  }

  public int size() {
    return constraints.size();
  }

  /** Appends a constraint. */
  public Query add(Term constraint) {
    constraints.add(checkBool(constraint));
    return this;
  }

  /** Replaces all constraints. */
  public void setConstraints(Iterable<? extends Term> newConstraints) {
    final List<Term> list = new ArrayList<>();
    newConstraints.forEach(c -> list.add(checkBool(c)));
    constraints.clear();
    constraints.addAll(list);
  }

  /** Returns a query with the same context and constraints that can be
   * modified independently of this one. */
  public Query copy() {
    return new Query(context, constraints);
  }

  private static Term checkBool(Term constraint) {
    requireNonNull(constraint, "constraint");
    checkArgument(
        constraint.sort.isBool(),
        "constraint must be Bool, got %s: %s",
        constraint.sort,
        constraint);
    return constraint;
  }

  /** Prints the query as SMT-LIB assertions, one per line. */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (Term constraint : constraints) {
      buf.append("(assert ").append(constraint).append(")\n");
    }
    return buf.toString();
  }
}

// End Query.java
