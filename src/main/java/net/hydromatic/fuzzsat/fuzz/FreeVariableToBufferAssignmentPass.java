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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fuzzsat.ast.Term;
import net.hydromatic.fuzzsat.ast.TermVisitor;
import net.hydromatic.fuzzsat.core.Query;
import net.hydromatic.fuzzsat.transform.QueryPass;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Assigns each free variable of a query a region of the fuzzer's input
 * buffer.
 *
 * <p>Variables are taken first from the equality sets, then in the order
 * that {@link TermVisitor} reaches them in the remaining constraints. Each
 * element starts where the previous one ended; its stored width is the
 * width of the variable's sort rounded up to a multiple of the alignment.
 */
public class FreeVariableToBufferAssignmentPass extends QueryPass {
  private final ImmutableList<EqualitySet> equalities;
  private final int alignmentBits;
  private @Nullable BufferAssignment assignment;

  public FreeVariableToBufferAssignmentPass(
      List<EqualitySet> equalities, int alignmentBits) {
    this.equalities = ImmutableList.copyOf(equalities);
    this.alignmentBits = alignmentBits;
    checkArgument(alignmentBits >= 1,
        "alignment must be positive: %s", alignmentBits);
  }

  @Override
  public String getName() {
    return "FreeVariableToBufferAssignmentPass";
  }

  @Override
  public boolean run(Query query) {
    final Map<Term.Variable, BufferAssignment.BufferElement> elementMap =
        new IdentityHashMap<>();
    final List<BufferAssignment.BufferElement> elements = new ArrayList<>();
    final Map<Term.Variable, BufferAssignment.BufferElement> aliases =
        new LinkedHashMap<>();
    final Map<Term.Variable, Term.Literal> fixedValues =
        new LinkedHashMap<>();
    final List<Term.Variable> variables = new ArrayList<>();
    final int[] offset = {0};

    for (EqualitySet equality : equalities) {
      if (isCancelled()) {
        return false;
      }
      final List<Term.Variable> members = equality.variables();
      if (equality.literal != null) {
        for (Term.Variable member : members) {
          fixedValues.put(member, equality.literal);
          variables.add(member);
        }
        continue;
      }
      BufferAssignment.@Nullable BufferElement representative = null;
      for (Term.Variable member : members) {
        variables.add(member);
        if (representative == null) {
          representative = allocate(member, offset);
          elements.add(representative);
          elementMap.put(member, representative);
        } else {
          aliases.put(member, representative);
        }
      }
    }

    final TermVisitor visitor = new TermVisitor() {
      @Override
      protected boolean isCancelled() {
        return FreeVariableToBufferAssignmentPass.this.isCancelled();
      }

      @Override
      protected void visit(Term.Variable variable) {
        if (elementMap.containsKey(variable)
            || aliases.containsKey(variable)
            || fixedValues.containsKey(variable)) {
          return;
        }
        final BufferAssignment.BufferElement element =
            allocate(variable, offset);
        elements.add(element);
        elementMap.put(variable, element);
        variables.add(variable);
      }
    };
    if (!visitor.visitAll(query.constraints())) {
      return false;
    }

    assignment =
        new BufferAssignment(elements, aliases, fixedValues, variables);
    query.getContext().debug("(FreeVariableToBufferAssignmentPass "
        + elements.size() + " element(s), "
        + assignment.computeWidth() + " bit(s))");
    return true;
  }

  private BufferAssignment.BufferElement allocate(Term.Variable variable,
      int[] offset) {
    final int storedWidth = align(variable.sort.bitWidth());
    final BufferAssignment.BufferElement element =
        new BufferAssignment.BufferElement(variable, offset[0], storedWidth);
    offset[0] += storedWidth;
    return element;
  }

  private int align(int width) {
    final int remainder = width % alignmentBits;
    return remainder == 0 ? width : width + alignmentBits - remainder;
  }

  /** Returns the assignment; only valid after a successful run. */
  public BufferAssignment getAssignment() {
    checkState(assignment != null, "pass has not run");
    return requireNonNull(assignment);
  }
}

// End FreeVariableToBufferAssignmentPass.java
