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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

/** Tests for {@link TermBuilder}, {@link Term} and {@link Sort}. */
public class TermBuilderTest {
  private final TermBuilder b = new TermBuilder();

  @Test
  void testHashConsing() {
    final Term x = b.variable("x", Sort.bitVector(8));
    final Term y = b.variable("y", Sort.bitVector(8));
    assertThat(b.bvAdd(x, y), sameInstance(b.bvAdd(x, y)));
    assertThat(b.bvAdd(x, y), not(sameInstance(b.bvAdd(y, x))));
    assertThat(b.bv(5, 8), sameInstance(b.bv(5, 8)));
    assertThat(b.bv(5, 8), not(sameInstance(b.bv(5, 16))));
    assertThat(b.variable("x", Sort.bitVector(8)), sameInstance(x));
    assertThat(b.trueLiteral(), sameInstance(b.bool(true)));
  }

  @Test
  void testVariableRedeclaredWithDifferentSort() {
    b.variable("x", Sort.bitVector(8));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> b.variable("x", Sort.bool()));
    assertThat(e.getMessage(),
        is("variable x already declared with sort (_ BitVec 8)"));
  }

  @Test
  void testIllSorted() {
    final Term x = b.variable("x", Sort.bitVector(8));
    final Term y = b.variable("y", Sort.bitVector(16));
    final Term p = b.variable("p", Sort.bool());
    assertThrows(IllegalArgumentException.class, () -> b.bvAdd(x, y));
    assertThrows(IllegalArgumentException.class, () -> b.not(x));
    assertThrows(IllegalArgumentException.class, () -> b.eq(x, p));
    assertThrows(IllegalArgumentException.class, () -> b.extract(8, 0, x));
    assertThrows(IllegalArgumentException.class,
        () -> b.fpAdd(p, b.fp32(1f), b.fp32(2f)));
  }

  @Test
  void testSorts() {
    final Term x = b.variable("x", Sort.bitVector(8));
    final Term y = b.variable("y", Sort.bitVector(4));
    assertThat(b.concat(x, y).sort, is(Sort.bitVector(12)));
    assertThat(b.extract(7, 4, x).sort, is(Sort.bitVector(4)));
    assertThat(b.zeroExtend(8, x).sort, is(Sort.bitVector(16)));
    assertThat(b.signExtend(56, x).sort, is(Sort.bitVector(64)));
    assertThat(b.bvUlt(x, x).sort, is(Sort.bool()));
    assertThat(b.toFp(b.roundingMode(RoundingMode.RNE), x, Sort.float64())
            .sort,
        is(Sort.float64()));
    assertThat(Sort.float32().bitWidth(), is(32));
    assertThat(Sort.bool().bitWidth(), is(1));
    assertThrows(IllegalArgumentException.class,
        () -> Sort.integer().bitWidth());
  }

  @Test
  void testAndOr() {
    final Term p = b.variable("p", Sort.bool());
    final Term q = b.variable("q", Sort.bool());
    assertThat(b.and(), sameInstance(b.trueLiteral()));
    assertThat(b.or(), sameInstance(b.falseLiteral()));
    assertThat(b.and(p), sameInstance(p));
    assertThat(b.and(p, q).op, is(Op.AND));
    assertThat(b.and(p, q).getNumKids(), is(2));
  }

  @Test
  void testLiterals() {
    final Term.Literal minusOne = (Term.Literal) b.bv(-1, 8);
    assertThat(minusOne.bitsValue(), is(BigInteger.valueOf(255)));
    assertThat(minusOne, hasToString("#b11111111"));
    assertThat(b.bv(5, 4), hasToString("#b0101"));
    assertThat(((Term.Literal) b.fp32(1f)).bitsValue(),
        is(BigInteger.valueOf(0x3f800000L)));
    assertThat(((Term.Literal) b.fp64(-0d)).bitsValue(),
        is(BigInteger.ONE.shiftLeft(63)));
    assertThat(b.roundingMode(RoundingMode.RTZ), hasToString("RTZ"));
  }

  @Test
  void testToString() {
    final Term x = b.variable("x", Sort.bitVector(8));
    final Term y = b.variable("y", Sort.bitVector(8));
    assertThat(b.bvUlt(b.bvAdd(x, y), b.bv(3, 8)),
        hasToString("(bvult (bvadd x y) #b00000011)"));
    assertThat(b.extract(7, 4, x), hasToString("((_ extract 7 4) x)"));
    assertThat(Sort.bitVector(8), hasToString("(_ BitVec 8)"));
    assertThat(Sort.float32(), hasToString("(_ FloatingPoint 8 24)"));
    assertThat(Sort.bool(), hasToString("Bool"));
  }

  @Test
  void testIntrospection() {
    final Term x = b.variable("x", Sort.bitVector(8));
    final Term e = b.extract(3, 1, x);
    assertThat(e.isApp(), is(true));
    assertThat(e.getNumKids(), is(1));
    assertThat(e.getKid(0), sameInstance(x));
    assertThat(e.asApp().param(0), is(3));
    assertThat(e.asApp().param(1), is(1));
    assertThat(x.isApp(), is(false));
    assertThat(x.getNumKids(), is(0));
    assertThrows(ClassCastException.class, x::asApp);
  }
}

// End TermBuilderTest.java
