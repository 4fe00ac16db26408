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
package net.hydromatic.fuzzsat.ast;

import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Visits term graphs, read-only.
 *
 * <p>Traversal is depth-first and uses an explicit stack, so deep graphs do
 * not overflow the call stack. Each distinct node is visited once, even if it
 * is shared by several parents or by several roots; the set of visited nodes
 * lives as long as the visitor. Children are pushed in ascending index order.
 *
 * <p>To rewrite terms, use {@link TermShuttle}.
 */
public class TermVisitor {
  private final Set<Term> visited = Sets.newIdentityHashSet();

  /**
   * Visits every node reachable from {@code root} that this visitor has not
   * already visited.
   *
   * @return whether the traversal completed; false if {@link #isCancelled()}
   *     stopped it
   */
  public final boolean visit(Term root) {
    final Deque<Term> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      if (isCancelled()) {
        return false;
      }
      final Term node = stack.pop();
      if (!visited.add(node)) {
        continue;
      }
      node.accept(this);
      for (int i = 0; i < node.getNumKids(); i++) {
        stack.push(node.getKid(i));
      }
    }
    return true;
  }

  /** Visits each root in turn, stopping early if cancelled. */
  public final boolean visitAll(Iterable<? extends Term> roots) {
    for (Term root : roots) {
      if (!visit(root)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether a node has already been visited. */
  public boolean isVisited(Term term) {
    return visited.contains(term);
  }

  /**
   * Called once per node; if it returns true, traversal stops.
   *
   * <p>Passes override this to poll their cancellation flag.
   */
  protected boolean isCancelled() {
    return false;
  }

  // atoms

  protected void visit(Term.Literal literal) {
    switch (literal.op) {
      case TRUE:
      case FALSE:
        visitBoolLiteral(literal);
        break;
      case BV_LITERAL:
        visitBitVectorLiteral(literal);
        break;
      case FP_LITERAL:
        visitFloatingPointLiteral(literal);
        break;
      default:
        visitRoundingModeLiteral(literal);
        break;
    }
  }

  protected void visitBoolLiteral(Term.Literal literal) {}

  protected void visitBitVectorLiteral(Term.Literal literal) {}

  protected void visitFloatingPointLiteral(Term.Literal literal) {}

  protected void visitRoundingModeLiteral(Term.Literal literal) {}

  protected void visit(Term.Variable variable) {}

  // applications

  protected void visit(Term.Apply apply) {}
}

// End TermVisitor.java
