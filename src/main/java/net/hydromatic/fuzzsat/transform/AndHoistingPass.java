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
package net.hydromatic.fuzzsat.transform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.hydromatic.fuzzsat.ast.Op;
import net.hydromatic.fuzzsat.ast.Term;
import net.hydromatic.fuzzsat.core.Query;

/**
 * Replaces each top-level conjunction by its conjuncts, recursively.
 *
 * <p>For example, {@code (and a (and b c))} becomes three constraints
 * {@code a}, {@code b}, {@code c}, in that order.
 */
public class AndHoistingPass extends QueryPass {
  @Override
  public String getName() {
    return "AndHoistingPass";
  }

  @Override
  public boolean run(Query query) {
    final List<Term> constraints = new ArrayList<>();
    final Deque<Term> stack = new ArrayDeque<>();
    for (Term constraint : query.constraints()) {
      stack.push(constraint);
      while (!stack.isEmpty()) {
        if (isCancelled()) {
          return false;
        }
        final Term term = stack.pop();
        if (term.op == Op.AND) {
          // Push in reverse so that conjuncts come out in order.
          for (int i = term.getNumKids() - 1; i >= 0; i--) {
            stack.push(term.getKid(i));
          }
        } else {
          constraints.add(term);
        }
      }
    }
    query.setConstraints(constraints);
    return true;
  }
}

// End AndHoistingPass.java
