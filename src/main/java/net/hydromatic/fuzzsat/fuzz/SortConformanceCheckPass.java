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

import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.function.Predicate;
import net.hydromatic.fuzzsat.ast.Sort;
import net.hydromatic.fuzzsat.ast.Term;
import net.hydromatic.fuzzsat.core.Query;
import net.hydromatic.fuzzsat.transform.QueryPass;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks that the sort of every node in a query satisfies a predicate.
 *
 * <p>Stops at the first node whose sort fails the predicate, so at most one
 * violation is ever reported. Each distinct node is tested once. All
 * constraints are pushed before any is examined, so the last constraint is
 * examined first; children are pushed in ascending index order, the same
 * order as {@link net.hydromatic.fuzzsat.ast.TermVisitor}.
 *
 * <p>The pass never modifies the query.
 */
public class SortConformanceCheckPass extends QueryPass {
  private final Predicate<Sort> predicate;
  private boolean predicateAlwaysHeld = true;
  private @Nullable Term firstViolation;

  public SortConformanceCheckPass(Predicate<Sort> predicate) {
    this.predicate = requireNonNull(predicate, "predicate");
  }

  @Override
  public String getName() {
    return "SortConformanceCheckPass";
  }

  @Override
  public boolean run(Query query) {
    final Set<Term> visited = Sets.newIdentityHashSet();
    final Deque<Term> stack = new ArrayDeque<>();
    for (Term constraint : query.constraints()) {
      stack.push(constraint);
    }
    while (!stack.isEmpty()) {
      if (isCancelled()) {
        return predicateAlwaysHeld;
      }
      final Term node = stack.pop();
      if (!visited.add(node)) {
        continue;
      }
      if (!predicate.test(node.sort)) {
        predicateAlwaysHeld = false;
        firstViolation = node;
        return false;
      }
      for (int i = 0; i < node.getNumKids(); i++) {
        stack.push(node.getKid(i));
      }
    }
    return predicateAlwaysHeld;
  }

  /** Returns whether no node failed the predicate. Also true if the run
   * was cancelled before finding a failure. */
  public boolean predicateAlwaysHeld() {
    return predicateAlwaysHeld;
  }

  /** Returns the node that failed the predicate, or null. */
  public @Nullable Term firstViolation() {
    return firstViolation;
  }
}

// End SortConformanceCheckPass.java
