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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.fuzzsat.ast.Sort;
import net.hydromatic.fuzzsat.ast.Term;
import net.hydromatic.fuzzsat.ast.TermBuilder;
import net.hydromatic.fuzzsat.core.Context;
import net.hydromatic.fuzzsat.core.Prop;
import net.hydromatic.fuzzsat.core.Query;
import org.junit.jupiter.api.Test;

/** Tests for {@link EqualityExtractionPass} and
 * {@link FreeVariableToBufferAssignmentPass}. */
public class BufferAssignmentTest {
  private final Context context = Context.of(ImmutableMap.of());
  private final TermBuilder b = context.terms;
  private final Term.Variable x = b.variable("x", Sort.bitVector(8));
  private final Term.Variable y = b.variable("y", Sort.bitVector(8));
  private final Term.Variable z = b.variable("z", Sort.bitVector(8));

  private Query query(Term... constraints) {
    return new Query(context, ImmutableList.copyOf(constraints));
  }

  private static BufferAssignment assign(Query query,
      List<EqualitySet> equalities, int alignment) {
    final FreeVariableToBufferAssignmentPass pass =
        new FreeVariableToBufferAssignmentPass(equalities, alignment);
    assertThat(pass.run(query), is(true));
    return pass.getAssignment();
  }

  /** By default, each variable starts on a byte boundary, in the order the
   * variables are first reached. */
  @Test
  void testByteAligned() {
    final Term.Variable p = b.variable("p", Sort.bool());
    final Term.Variable w = b.variable("w", Sort.bitVector(32));
    final Query query =
        query(b.bvUlt(x, b.bv(3, 8)), p, b.bvUlt(w, b.bv(5, 32)));
    final int alignment =
        Prop.BUFFER_ALIGNMENT.intValue(ImmutableMap.<Prop, Object>of());
    assertThat(alignment, is(8));
    final BufferAssignment assignment =
        assign(query, ImmutableList.of(), alignment);
    assertThat(assignment.elements,
        hasToString("[x@0:8, p@8:1, w@16:32]"));
    assertThat(assignment.elements.get(1).storedWidth, is(8));
    assertThat(assignment.elements.get(1).getBitWidth(), is(1));
    assertThat(assignment.computeWidth(), is(48));
    assertThat(assignment.variables, is(ImmutableList.of(x, p, w)));
    final FuzzingAnalysisInfo info =
        new FuzzingAnalysisInfo(assignment, ImmutableList.of());
    assertThat(info.computeWidth(), is(48));
    assertThat(info.maxLength(), is(6));
  }

  /** With alignment 1, variables are packed with no gaps. */
  @Test
  void testPacked() {
    final Term.Variable p = b.variable("p", Sort.bool());
    final Term.Variable w = b.variable("w", Sort.bitVector(32));
    final Query query =
        query(b.bvUlt(x, b.bv(3, 8)), p, b.bvUlt(w, b.bv(5, 32)));
    final BufferAssignment assignment = assign(query, ImmutableList.of(), 1);
    assertThat(assignment.elements,
        hasToString("[x@0:8, p@8:1, w@9:32]"));
    assertThat(assignment.computeWidth(), is(41));
    final FuzzingAnalysisInfo info =
        new FuzzingAnalysisInfo(assignment, ImmutableList.of());
    assertThat(info.maxLength(), is(6));

    // p takes one bit rather than eight, so three variables of width 1
    // fit in one byte.
    final Term.Variable q = b.variable("q", Sort.bool());
    final Term.Variable r = b.variable("r", Sort.bool());
    final BufferAssignment bits =
        assign(query(p, q, r), ImmutableList.of(), 1);
    assertThat(bits.computeWidth(), is(3));
    assertThat(
        new FuzzingAnalysisInfo(bits, ImmutableList.of()).maxLength(),
        is(1));
    assertThat(
        assign(query(p, q, r), ImmutableList.of(), 8).computeWidth(),
        is(24));
  }

  /** Within a term, later arguments are reached first. */
  @Test
  void testVisitOrder() {
    final Query query = query(b.bvUlt(x, y));
    final BufferAssignment assignment = assign(query, ImmutableList.of(), 1);
    assertThat(assignment.elements, hasToString("[y@0:8, x@8:8]"));
  }

  @Test
  void testBadAlignment() {
    assertThrows(IllegalArgumentException.class,
        () -> new FreeVariableToBufferAssignmentPass(ImmutableList.of(), 0));
    assertThrows(IllegalStateException.class,
        () -> new FreeVariableToBufferAssignmentPass(ImmutableList.of(), 1)
            .getAssignment());
  }

  /** Variables that must be equal share one element. */
  @Test
  void testAlias() {
    final Query query = query(b.eq(x, y), b.bvUlt(x, z));
    final EqualityExtractionPass extraction = new EqualityExtractionPass();
    assertThat(extraction.run(query), is(true));
    assertThat(extraction.getRemovedCount(), is(1));
    assertThat(extraction.equalities(), hasToString("[(= x y)]"));
    assertThat(query.constraints(), is(ImmutableList.of(b.bvUlt(x, z))));

    final BufferAssignment assignment =
        assign(query, extraction.equalities(), 1);
    assertThat(assignment.elements, hasToString("[x@0:8, z@8:8]"));
    assertThat(assignment.elementFor(y),
        sameInstance(assignment.elementFor(x)));
    assertThat(assignment.fixedValue(y), nullValue());
    assertThat(assignment.computeWidth(), is(16));
  }

  /** Variables that equal a literal take no space. */
  @Test
  void testFixed() {
    final Term five = b.bv(5, 8);
    final Query query =
        query(b.eq(x, five), b.eq(five, y), b.bvUlt(x, z));
    final EqualityExtractionPass extraction = new EqualityExtractionPass();
    assertThat(extraction.run(query), is(true));
    assertThat(extraction.getRemovedCount(), is(2));
    final List<EqualitySet> equalities = extraction.equalities();
    assertThat(equalities.size(), is(1));
    final EqualitySet equality = equalities.get(0);
    assertThat(equality, hasToString("(= x #b00000101 y)"));
    assertThat(equality.literal, sameInstance(five));
    assertThat(equality.variables(), is(ImmutableList.of(x, y)));
    assertThat(equality.contains(y), is(true));
    assertThat(equality.contains(z), is(false));

    final BufferAssignment assignment = assign(query, equalities, 1);
    assertThat(assignment.elements, hasToString("[z@0:8]"));
    assertThat(assignment.fixedValue(x), sameInstance(five));
    assertThat(assignment.fixedValue(y), sameInstance(five));
    assertThat(assignment.elementFor(x), nullValue());
    assertThat(assignment.variables, is(ImmutableList.of(x, y, z)));
    assertThat(
        new FuzzingAnalysisInfo(assignment, equalities).maxLength(), is(1));
  }

  /** An equality between two different literals stays in the query. */
  @Test
  void testConflict() {
    final Term c1 = b.eq(x, b.bv(5, 8));
    final Term c2 = b.eq(b.bv(6, 8), x);
    final Query query = query(c1, c2);
    final EqualityExtractionPass extraction = new EqualityExtractionPass();
    assertThat(extraction.run(query), is(true));
    assertThat(extraction.getRemovedCount(), is(1));
    assertThat(query.constraints(), is(ImmutableList.of(c2)));
  }

  /** Only equalities between atoms are extracted. */
  @Test
  void testNonAtomEquality() {
    final Term c = b.eq(b.bvAdd(x, y), z);
    final Term d = b.not(b.eq(x, y));
    final Query query = query(c, d);
    final EqualityExtractionPass extraction = new EqualityExtractionPass();
    assertThat(extraction.run(query), is(true));
    assertThat(extraction.getRemovedCount(), is(0));
    assertThat(extraction.equalities().isEmpty(), is(true));
    assertThat(query.constraints(), is(ImmutableList.of(c, d)));
  }

  /** Chains of equalities merge into one set. */
  @Test
  void testTransitive() {
    final Term.Variable v = b.variable("v", Sort.bitVector(8));
    final Query query =
        query(b.eq(x, y), b.eq(z, v), b.eq(y, v), b.bvUlt(x, b.bv(1, 8)));
    final EqualityExtractionPass extraction = new EqualityExtractionPass();
    assertThat(extraction.run(query), is(true));
    assertThat(extraction.getRemovedCount(), is(3));
    assertThat(extraction.equalities(), hasToString("[(= x y z v)]"));
    final BufferAssignment assignment =
        assign(query, extraction.equalities(), 1);
    assertThat(assignment.elements, hasToString("[x@0:8]"));
    assertThat(assignment.aliases.keySet(), is(ImmutableSet.of(y, z, v)));
  }
}

// End BufferAssignmentTest.java
