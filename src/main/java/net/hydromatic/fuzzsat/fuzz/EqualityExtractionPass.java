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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fuzzsat.ast.Op;
import net.hydromatic.fuzzsat.ast.Term;
import net.hydromatic.fuzzsat.core.Query;
import net.hydromatic.fuzzsat.transform.QueryPass;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Removes top-level equalities between atoms from a query, and records
 * them as {@link EqualitySet}s.
 *
 * <p>A constraint {@code (= a b)} where {@code a} and {@code b} are each a
 * variable or a literal is removed, and the sets containing {@code a} and
 * {@code b} are merged. If both sets already contain a literal, and the
 * literals differ, the constraint stays in the query and the sets are not
 * merged; the generated program will then evaluate it, and fail.
 */
public class EqualityExtractionPass extends QueryPass {
  private final List<Group> groups = new ArrayList<>();
  private final Map<Term, Group> groupMap = new IdentityHashMap<>();
  private int removedCount;

  @Override
  public String getName() {
    return "EqualityExtractionPass";
  }

  @Override
  public boolean run(Query query) {
    final List<Term> remaining = new ArrayList<>();
    for (Term constraint : query.constraints()) {
      if (isCancelled()) {
        return false;
      }
      if (isAtomEquality(constraint)
          && merge(constraint.getKid(0), constraint.getKid(1))) {
        ++removedCount;
      } else {
        remaining.add(constraint);
      }
    }
    query.setConstraints(remaining);
    query.getContext().debug("(EqualityExtractionPass removed "
        + removedCount + " constraint(s), " + groups.size() + " set(s))");
    return true;
  }

  /** Returns the equality sets found, in order of creation. */
  public ImmutableList<EqualitySet> equalities() {
    final ImmutableList.Builder<EqualitySet> b = ImmutableList.builder();
    for (Group group : groups) {
      b.add(new EqualitySet(group.members, group.literal));
    }
    return b.build();
  }

  /** Returns the number of constraints removed from the query. */
  public int getRemovedCount() {
    return removedCount;
  }

  private static boolean isAtomEquality(Term term) {
    return term.op == Op.EQ
        && term.getNumKids() == 2
        && !term.getKid(0).isApp()
        && !term.getKid(1).isApp();
  }

  /** Merges the sets of two atoms; returns false if they have different
   * literals. */
  private boolean merge(Term a, Term b) {
    final Group groupA = groupOf(a);
    final Group groupB = groupOf(b);
    if (groupA == groupB) {
      return true;
    }
    if (groupA.literal != null
        && groupB.literal != null
        && groupA.literal != groupB.literal) {
      return false;
    }
    for (Term member : groupB.members) {
      groupA.members.add(member);
      groupMap.put(member, groupA);
    }
    if (groupA.literal == null) {
      groupA.literal = groupB.literal;
    }
    groups.remove(groupB);
    return true;
  }

  private Group groupOf(Term atom) {
    return groupMap.computeIfAbsent(atom, a -> {
      final Group group = new Group();
      group.members.add(a);
      if (a instanceof Term.Literal) {
        group.literal = (Term.Literal) a;
      }
      groups.add(group);
      return group;
    });
  }

  /** Mutable equality set, used while the pass runs. */
  private static class Group {
    final List<Term> members = new ArrayList<>();
    Term.@Nullable Literal literal;
  }
}

// End EqualityExtractionPass.java
