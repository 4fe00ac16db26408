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
import net.hydromatic.fuzzsat.ast.TermBuilder;
import net.hydromatic.fuzzsat.ast.TermShuttle;
import net.hydromatic.fuzzsat.core.Query;

/**
 * Simplifies boolean structure bottom-up.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>{@code (not (not a))} becomes {@code a};
 *   <li>{@code (not true)} becomes {@code false}, and vice versa;
 *   <li>{@code (and ...)} drops {@code true} arguments, and becomes {@code
 *       false} if any argument is {@code false};
 *   <li>{@code (or ...)} drops {@code false} arguments, and becomes {@code
 *       true} if any argument is {@code true};
 *   <li>{@code (ite true a b)} becomes {@code a}, {@code (ite false a b)}
 *       becomes {@code b}, and {@code (ite c a a)} becomes {@code a};
 *   <li>{@code (= a a)} becomes {@code true}.
 * </ul>
 */
public class BooleanSimplificationPass extends QueryPass {
  @Override
  public String getName() {
    return "BooleanSimplificationPass";
  }

  @Override
  public boolean run(Query query) {
    final TermBuilder terms = query.getContext().terms;
    final Simplifier simplifier = new Simplifier(terms);
    final List<Term> constraints = new ArrayList<>();
    for (Term constraint : query.constraints()) {
      if (isCancelled()) {
        return false;
      }
      constraints.add(simplifier.apply(constraint));
    }
    if (isCancelled()) {
      return false;
    }
    query.setConstraints(constraints);
    return true;
  }

  /** Shuttle that applies the rules. */
  private class Simplifier extends TermShuttle {
    Simplifier(TermBuilder builder) {
      super(builder);
    }

    @Override
    protected boolean isCancelled() {
      return BooleanSimplificationPass.this.isCancelled();
    }

    @Override
    protected Term rewrite(Term.Apply apply, List<Term> args) {
      switch (apply.op) {
        case NOT:
          final Term a = args.get(0);
          switch (a.op) {
            case TRUE:
              return builder.falseLiteral();
            case FALSE:
              return builder.trueLiteral();
            case NOT:
              return a.getKid(0);
            default:
              return rebuild(apply, args);
          }

        case AND:
        case OR:
          final Op absorbing = apply.op == Op.AND ? Op.FALSE : Op.TRUE;
          final Op identity = apply.op == Op.AND ? Op.TRUE : Op.FALSE;
          final List<Term> kept = new ArrayList<>();
          for (Term arg : args) {
            if (arg.op == absorbing) {
              return arg;
            }
            if (arg.op != identity) {
              kept.add(arg);
            }
          }
          if (kept.size() == args.size()) {
            return rebuild(apply, args);
          }
          return apply.op == Op.AND ? builder.and(kept) : builder.or(kept);

        case ITE:
          switch (args.get(0).op) {
            case TRUE:
              return args.get(1);
            case FALSE:
              return args.get(2);
            default:
              if (args.get(1) == args.get(2)) {
                return args.get(1);
              }
              return rebuild(apply, args);
          }

        case EQ:
          if (args.size() == 2 && args.get(0) == args.get(1)) {
            return builder.trueLiteral();
          }
          return rebuild(apply, args);

        default:
          return rebuild(apply, args);
      }
    }
  }
}

// End BooleanSimplificationPass.java
