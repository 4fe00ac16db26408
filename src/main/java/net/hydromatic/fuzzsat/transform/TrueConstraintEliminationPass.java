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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.fuzzsat.ast.Op;
import net.hydromatic.fuzzsat.ast.Term;
import net.hydromatic.fuzzsat.core.Query;

/** Removes constraints that are the literal {@code true}. */
public class TrueConstraintEliminationPass extends QueryPass {
  @Override
  public String getName() {
    return "TrueConstraintEliminationPass";
  }

  @Override
  public boolean run(Query query) {
    final List<Term> constraints = new ArrayList<>();
    for (Term constraint : query.constraints()) {
      if (isCancelled()) {
        return false;
      }
      if (constraint.op != Op.TRUE) {
        constraints.add(constraint);
      }
    }
    query.setConstraints(constraints);
    return true;
  }
}

// End TrueConstraintEliminationPass.java
