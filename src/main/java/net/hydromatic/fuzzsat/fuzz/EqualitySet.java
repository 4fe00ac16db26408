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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.fuzzsat.ast.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Set of atoms (variables and at most one literal) that top-level
 * constraints require to be equal. Immutable.
 */
public class EqualitySet {
  /** Members, in the order they were first seen. */
  public final ImmutableList<Term> members;

  /** The literal that every member equals, or null. */
  public final Term.@Nullable Literal literal;

  EqualitySet(List<Term> members, Term.@Nullable Literal literal) {
    this.members = ImmutableList.copyOf(members);
    this.literal = literal;
    checkArgument(!this.members.isEmpty(), "empty equality set");
  }

  /** Returns the variables among the members, in order. */
  public ImmutableList<Term.Variable> variables() {
    final ImmutableList.Builder<Term.Variable> b = ImmutableList.builder();
    for (Term member : members) {
      if (member instanceof Term.Variable) {
        b.add((Term.Variable) member);
      }
    }
    return b.build();
  }

  public boolean contains(Term term) {
    for (Term member : members) {
      if (member == term) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return members.stream()
        .map(Term::toString)
        .collect(Collectors.joining(" ", "(= ", ")"));
  }
}

// End EqualitySet.java
