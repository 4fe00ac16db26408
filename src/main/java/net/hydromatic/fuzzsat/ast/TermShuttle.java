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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites term graphs.
 *
 * <p>Terms are immutable, so a shuttle never modifies a graph; it builds a
 * new one bottom-up. Each distinct node is rewritten once, and the result is
 * memoized, so sub-terms shared in the input remain shared in the output. A
 * node whose arguments did not change keeps its identity.
 */
public class TermShuttle {
  protected final TermBuilder builder;
  private final Map<Term, Term> memo = new IdentityHashMap<>();

  public TermShuttle(TermBuilder builder) {
    this.builder = requireNonNull(builder, "builder");
  }

  /**
   * Rewrites a term.
   *
   * <p>If {@link #isCancelled()} becomes true, returns {@code root}
   * unchanged.
   */
  public final Term apply(Term root) {
    final Deque<Term> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      if (isCancelled()) {
        return root;
      }
      final Term node = stack.peek();
      if (memo.containsKey(node)) {
        stack.pop();
        continue;
      }
      boolean ready = true;
      for (int i = node.getNumKids() - 1; i >= 0; i--) {
        final Term kid = node.getKid(i);
        if (!memo.containsKey(kid)) {
          stack.push(kid);
          ready = false;
        }
      }
      if (ready) {
        stack.pop();
        memo.put(node, rewriteNode(node));
      }
    }
    return requireNonNull(memo.get(root));
  }

  private Term rewriteNode(Term node) {
    if (!node.isApp()) {
      return rewriteAtom(node);
    }
    final Term.Apply apply = node.asApp();
    final ImmutableList.Builder<Term> args = ImmutableList.builder();
    for (Term arg : apply.args) {
      args.add(requireNonNull(memo.get(arg)));
    }
    return rewrite(apply, args.build());
  }

  /** Polled once per step; if true, the rewrite is abandoned. */
  protected boolean isCancelled() {
    return false;
  }

  /** Rewrites a literal or variable. By default, returns it unchanged. */
  protected Term rewriteAtom(Term atom) {
    return atom;
  }

  /**
   * Rewrites an application, given its already-rewritten arguments.
   *
   * <p>By default, rebuilds the application if any argument changed.
   */
  protected Term rewrite(Term.Apply apply, List<Term> args) {
    return rebuild(apply, args);
  }

  /** Returns {@code apply} if its arguments are {@code args}, otherwise a
   * new application of the same operator. */
  protected final Term rebuild(Term.Apply apply, List<Term> args) {
    if (args.equals(apply.args)) {
      return apply;
    }
    return builder.apply(apply.op, args, apply.params);
  }
}

// End TermShuttle.java
