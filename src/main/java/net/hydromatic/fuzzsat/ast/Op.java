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

/** Operator of a {@link Term}, with its SMT-LIB name. */
public enum Op {
  // atoms

  TRUE("true", Category.LITERAL),
  FALSE("false", Category.LITERAL),
  BV_LITERAL("#b", Category.LITERAL),
  FP_LITERAL("fp", Category.LITERAL),
  RM_LITERAL("rm", Category.LITERAL),
  VARIABLE("var", Category.VARIABLE),

  // core theory

  NOT("not", Category.BOOLEAN),
  AND("and", Category.BOOLEAN),
  OR("or", Category.BOOLEAN),
  XOR("xor", Category.BOOLEAN),
  IMPLIES("=>", Category.BOOLEAN),
  ITE("ite", Category.BOOLEAN),
  EQ("=", Category.BOOLEAN),
  DISTINCT("distinct", Category.BOOLEAN),

  // bit-vectors

  BV_NOT("bvnot", Category.BIT_VECTOR),
  BV_NEG("bvneg", Category.BIT_VECTOR),
  BV_AND("bvand", Category.BIT_VECTOR),
  BV_OR("bvor", Category.BIT_VECTOR),
  BV_XOR("bvxor", Category.BIT_VECTOR),
  BV_ADD("bvadd", Category.BIT_VECTOR),
  BV_SUB("bvsub", Category.BIT_VECTOR),
  BV_MUL("bvmul", Category.BIT_VECTOR),
  BV_UDIV("bvudiv", Category.BIT_VECTOR),
  BV_UREM("bvurem", Category.BIT_VECTOR),
  BV_SDIV("bvsdiv", Category.BIT_VECTOR),
  BV_SREM("bvsrem", Category.BIT_VECTOR),
  BV_SHL("bvshl", Category.BIT_VECTOR),
  BV_LSHR("bvlshr", Category.BIT_VECTOR),
  BV_ASHR("bvashr", Category.BIT_VECTOR),
  BV_ULT("bvult", Category.BIT_VECTOR),
  BV_ULE("bvule", Category.BIT_VECTOR),
  BV_UGT("bvugt", Category.BIT_VECTOR),
  BV_UGE("bvuge", Category.BIT_VECTOR),
  BV_SLT("bvslt", Category.BIT_VECTOR),
  BV_SLE("bvsle", Category.BIT_VECTOR),
  BV_SGT("bvsgt", Category.BIT_VECTOR),
  BV_SGE("bvsge", Category.BIT_VECTOR),
  CONCAT("concat", Category.BIT_VECTOR),
  EXTRACT("extract", Category.BIT_VECTOR),
  ZERO_EXTEND("zero_extend", Category.BIT_VECTOR),
  SIGN_EXTEND("sign_extend", Category.BIT_VECTOR),

  // floating point; the rounded ones take a rounding mode as first argument

  FP_ADD("fp.add", Category.FLOATING_POINT, true),
  FP_SUB("fp.sub", Category.FLOATING_POINT, true),
  FP_MUL("fp.mul", Category.FLOATING_POINT, true),
  FP_DIV("fp.div", Category.FLOATING_POINT, true),
  FP_NEG("fp.neg", Category.FLOATING_POINT),
  FP_ABS("fp.abs", Category.FLOATING_POINT),
  FP_EQ("fp.eq", Category.FLOATING_POINT),
  FP_LT("fp.lt", Category.FLOATING_POINT),
  FP_LEQ("fp.leq", Category.FLOATING_POINT),
  FP_IS_NAN("fp.isNaN", Category.FLOATING_POINT),
  TO_FP("to_fp", Category.FLOATING_POINT, true);

  public final String smtName;
  public final Category category;

  /** Whether the first argument is a rounding mode. */
  public final boolean rounded;

  Op(String smtName, Category category) {
    this(smtName, category, false);
  }

  Op(String smtName, Category category, boolean rounded) {
    this.smtName = smtName;
    this.category = category;
    this.rounded = rounded;
  }

  /** Whether this operator is indexed, e.g. {@code (_ extract 7 4)}. */
  public boolean isIndexed() {
    return this == EXTRACT || this == ZERO_EXTEND || this == SIGN_EXTEND
        || this == TO_FP;
  }

  /** Category of operator. */
  public enum Category {
    LITERAL,
    VARIABLE,
    BOOLEAN,
    BIT_VECTOR,
    FLOATING_POINT
  }
}

// End Op.java
