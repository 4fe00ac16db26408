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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates {@link Term}s.
 *
 * <p>Hash-conses every term it creates, so that two structurally identical
 * terms built by the same builder are the same object. Checks sorts as it
 * goes, and throws {@link IllegalArgumentException} if an application is
 * ill-sorted.
 *
 * <p>Not thread-safe.
 */
public class TermBuilder {
  private final Map<List<Object>, Term> terms = new HashMap<>();
  private final Map<String, Term.Variable> variables = new HashMap<>();
  private int nextId = 0;

  // literals

  public Term trueLiteral() {
    return intern(Op.TRUE, Sort.bool(), Boolean.TRUE);
  }

  public Term falseLiteral() {
    return intern(Op.FALSE, Sort.bool(), Boolean.FALSE);
  }

  public Term bool(boolean b) {
    return b ? trueLiteral() : falseLiteral();
  }

  /** Creates a bit-vector literal. Negative values are taken as two's
   * complement. */
  public Term bv(long value, int width) {
    return bv(BigInteger.valueOf(value), width);
  }

  public Term bv(BigInteger value, int width) {
    final Sort sort = Sort.bitVector(width);
    return intern(Op.BV_LITERAL, sort, truncate(value, width));
  }

  public Term fp32(float f) {
    final long bits = Float.floatToRawIntBits(f) & 0xFFFF_FFFFL;
    return fpBits(Sort.float32(), BigInteger.valueOf(bits));
  }

  public Term fp64(double d) {
    final long bits = Double.doubleToRawLongBits(d);
    return fpBits(Sort.float64(), truncate(BigInteger.valueOf(bits), 64));
  }

  /** Creates a floating-point literal from its IEEE-754 bit pattern. */
  public Term fpBits(Sort sort, BigInteger bits) {
    checkArgument(sort.isFloatingPoint(), "not a float sort: %s", sort);
    checkArgument(
        bits.signum() >= 0 && bits.bitLength() <= sort.bitWidth(),
        "bits %s do not fit %s",
        bits,
        sort);
    return intern(Op.FP_LITERAL, sort, bits);
  }

  public Term roundingMode(RoundingMode roundingMode) {
    return intern(Op.RM_LITERAL, Sort.roundingMode(), roundingMode);
  }

  // variables

  /**
   * Declares a free variable, or returns the existing variable with this
   * name.
   *
   * @throws IllegalArgumentException if a variable of the same name but a
   *     different sort exists
   */
  public Term.Variable variable(String name, Sort sort) {
    final Term.Variable existing = variables.get(name);
    if (existing != null) {
      checkArgument(
          existing.sort.equals(sort),
          "variable %s already declared with sort %s",
          name,
          existing.sort);
      return existing;
    }
    final Term.Variable variable = new Term.Variable(sort, nextId++, name);
    variables.put(name, variable);
    return variable;
  }

  // core theory

  public Term not(Term a) {
    return apply(Op.NOT, a);
  }

  /** Creates a conjunction. With no arguments, returns true; with one,
   * returns that argument. */
  public Term and(Term... args) {
    return and(Arrays.asList(args));
  }

  public Term and(List<? extends Term> args) {
    switch (args.size()) {
      case 0:
        return trueLiteral();
      case 1:
        return checkBool(args.get(0));
      default:
        return apply(Op.AND, args, ImmutableList.of());
    }
  }

  /** Creates a disjunction. With no arguments, returns false; with one,
   * returns that argument. */
  public Term or(Term... args) {
    return or(Arrays.asList(args));
  }

  public Term or(List<? extends Term> args) {
    switch (args.size()) {
      case 0:
        return falseLiteral();
      case 1:
        return checkBool(args.get(0));
      default:
        return apply(Op.OR, args, ImmutableList.of());
    }
  }

  public Term xor(Term a, Term b) {
    return apply(Op.XOR, a, b);
  }

  public Term implies(Term a, Term b) {
    return apply(Op.IMPLIES, a, b);
  }

  public Term ite(Term condition, Term ifTrue, Term ifFalse) {
    return apply(Op.ITE, condition, ifTrue, ifFalse);
  }

  public Term eq(Term a, Term b) {
    return apply(Op.EQ, a, b);
  }

  public Term distinct(Term... args) {
    return apply(Op.DISTINCT, Arrays.asList(args), ImmutableList.of());
  }

  // bit-vectors

  public Term bvNot(Term a) {
    return apply(Op.BV_NOT, a);
  }

  public Term bvNeg(Term a) {
    return apply(Op.BV_NEG, a);
  }

  public Term bvAnd(Term a, Term b) {
    return apply(Op.BV_AND, a, b);
  }

  public Term bvOr(Term a, Term b) {
    return apply(Op.BV_OR, a, b);
  }

  public Term bvXor(Term a, Term b) {
    return apply(Op.BV_XOR, a, b);
  }

  public Term bvAdd(Term a, Term b) {
    return apply(Op.BV_ADD, a, b);
  }

  public Term bvSub(Term a, Term b) {
    return apply(Op.BV_SUB, a, b);
  }

  public Term bvMul(Term a, Term b) {
    return apply(Op.BV_MUL, a, b);
  }

  public Term bvUdiv(Term a, Term b) {
    return apply(Op.BV_UDIV, a, b);
  }

  public Term bvUrem(Term a, Term b) {
    return apply(Op.BV_UREM, a, b);
  }

  public Term bvSdiv(Term a, Term b) {
    return apply(Op.BV_SDIV, a, b);
  }

  public Term bvSrem(Term a, Term b) {
    return apply(Op.BV_SREM, a, b);
  }

  public Term bvShl(Term a, Term b) {
    return apply(Op.BV_SHL, a, b);
  }

  public Term bvLshr(Term a, Term b) {
    return apply(Op.BV_LSHR, a, b);
  }

  public Term bvAshr(Term a, Term b) {
    return apply(Op.BV_ASHR, a, b);
  }

  public Term bvUlt(Term a, Term b) {
    return apply(Op.BV_ULT, a, b);
  }

  public Term bvUle(Term a, Term b) {
    return apply(Op.BV_ULE, a, b);
  }

  public Term bvUgt(Term a, Term b) {
    return apply(Op.BV_UGT, a, b);
  }

  public Term bvUge(Term a, Term b) {
    return apply(Op.BV_UGE, a, b);
  }

  public Term bvSlt(Term a, Term b) {
    return apply(Op.BV_SLT, a, b);
  }

  public Term bvSle(Term a, Term b) {
    return apply(Op.BV_SLE, a, b);
  }

  public Term bvSgt(Term a, Term b) {
    return apply(Op.BV_SGT, a, b);
  }

  public Term bvSge(Term a, Term b) {
    return apply(Op.BV_SGE, a, b);
  }

  /** Concatenates; {@code a} supplies the high bits. */
  public Term concat(Term a, Term b) {
    return apply(Op.CONCAT, a, b);
  }

  public Term extract(int high, int low, Term a) {
    return apply(Op.EXTRACT, ImmutableList.of(a), ImmutableList.of(high, low));
  }

  public Term zeroExtend(int extra, Term a) {
    return apply(Op.ZERO_EXTEND, ImmutableList.of(a), ImmutableList.of(extra));
  }

  public Term signExtend(int extra, Term a) {
    return apply(Op.SIGN_EXTEND, ImmutableList.of(a), ImmutableList.of(extra));
  }

  // floating point

  public Term fpAdd(Term rm, Term a, Term b) {
    return apply(Op.FP_ADD, rm, a, b);
  }

  public Term fpSub(Term rm, Term a, Term b) {
    return apply(Op.FP_SUB, rm, a, b);
  }

  public Term fpMul(Term rm, Term a, Term b) {
    return apply(Op.FP_MUL, rm, a, b);
  }

  public Term fpDiv(Term rm, Term a, Term b) {
    return apply(Op.FP_DIV, rm, a, b);
  }

  public Term fpNeg(Term a) {
    return apply(Op.FP_NEG, a);
  }

  public Term fpAbs(Term a) {
    return apply(Op.FP_ABS, a);
  }

  public Term fpEq(Term a, Term b) {
    return apply(Op.FP_EQ, a, b);
  }

  public Term fpLt(Term a, Term b) {
    return apply(Op.FP_LT, a, b);
  }

  public Term fpLeq(Term a, Term b) {
    return apply(Op.FP_LEQ, a, b);
  }

  public Term fpIsNaN(Term a) {
    return apply(Op.FP_IS_NAN, a);
  }

  /**
   * Converts a floating-point value, or a bit-vector taken as a signed
   * integer, to a floating-point sort.
   */
  public Term toFp(Term rm, Term a, Sort target) {
    checkArgument(target.isFloatingPoint(), "not a float sort: %s", target);
    return apply(
        Op.TO_FP,
        ImmutableList.of(rm, a),
        ImmutableList.of(
            target.getExponentWidth(), target.getSignificandWidth()));
  }

  // generic

  private Term apply(Op op, Term... args) {
    return apply(op, Arrays.asList(args), ImmutableList.of());
  }

  /**
   * Creates (or finds) an application, deducing and checking its sort.
   *
   * <p>Used by {@link TermShuttle} to rebuild a node whose arguments have
   * changed.
   */
  public Term apply(
      Op op, List<? extends Term> args, List<Integer> params) {
    final ImmutableList<Term> argList = ImmutableList.copyOf(args);
    final ImmutableList<Integer> paramList = ImmutableList.copyOf(params);
    final Sort sort = deduceSort(op, argList, paramList);
    final List<Object> key = ImmutableList.of(op, sort, argList, paramList);
    final Term term = terms.get(key);
    if (term != null) {
      return term;
    }
    final Term.Apply apply =
        new Term.Apply(op, sort, nextId++, argList, paramList);
    terms.put(key, apply);
    return apply;
  }

  private Term intern(Op op, Sort sort, Object value) {
    final List<Object> key = ImmutableList.of(op, sort, value);
    final Term term = terms.get(key);
    if (term != null) {
      return term;
    }
    final Term literal = new Term.Literal(op, sort, nextId++, value);
    terms.put(key, literal);
    return literal;
  }

  private static BigInteger truncate(BigInteger value, int width) {
    return value.and(BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE));
  }

  private static Term checkBool(Term term) {
    checkArgument(term.sort.isBool(), "expected Bool, got %s", term.sort);
    return term;
  }

  private static Sort deduceSort(
      Op op, List<Term> args, List<Integer> params) {
    switch (op) {
      case NOT:
        checkArity(op, args, 1);
        return checkBool(args.get(0)).sort;

      case AND:
      case OR:
      case XOR:
      case IMPLIES:
        checkArgument(args.size() >= 2, "%s needs two or more arguments", op);
        args.forEach(TermBuilder::checkBool);
        return Sort.bool();

      case ITE:
        checkArity(op, args, 3);
        checkBool(args.get(0));
        return checkSame(op, args.subList(1, 3));

      case EQ:
      case DISTINCT:
        checkArgument(args.size() >= 2, "%s needs two or more arguments", op);
        checkSame(op, args);
        return Sort.bool();

      case BV_NOT:
      case BV_NEG:
        checkArity(op, args, 1);
        return checkBitVector(op, args.get(0));

      case BV_AND:
      case BV_OR:
      case BV_XOR:
      case BV_ADD:
      case BV_SUB:
      case BV_MUL:
      case BV_UDIV:
      case BV_UREM:
      case BV_SDIV:
      case BV_SREM:
      case BV_SHL:
      case BV_LSHR:
      case BV_ASHR:
        checkArity(op, args, 2);
        checkBitVector(op, args.get(0));
        return checkSame(op, args);

      case BV_ULT:
      case BV_ULE:
      case BV_UGT:
      case BV_UGE:
      case BV_SLT:
      case BV_SLE:
      case BV_SGT:
      case BV_SGE:
        checkArity(op, args, 2);
        checkBitVector(op, args.get(0));
        checkSame(op, args);
        return Sort.bool();

      case CONCAT:
        checkArity(op, args, 2);
        return Sort.bitVector(
            checkBitVector(op, args.get(0)).getBitVectorWidth()
                + checkBitVector(op, args.get(1)).getBitVectorWidth());

      case EXTRACT:
        {
          checkArity(op, args, 1);
          checkArgument(params.size() == 2, "extract needs two indices");
          final int width =
              checkBitVector(op, args.get(0)).getBitVectorWidth();
          final int high = params.get(0);
          final int low = params.get(1);
          checkArgument(
              0 <= low && low <= high && high < width,
              "invalid extract [%s:%s] of width %s",
              high,
              low,
              width);
          return Sort.bitVector(high - low + 1);
        }

      case ZERO_EXTEND:
      case SIGN_EXTEND:
        {
          checkArity(op, args, 1);
          checkArgument(params.size() == 1, "%s needs one index", op);
          final int extra = params.get(0);
          checkArgument(extra >= 0, "negative extension %s", extra);
          return Sort.bitVector(
              checkBitVector(op, args.get(0)).getBitVectorWidth() + extra);
        }

      case FP_ADD:
      case FP_SUB:
      case FP_MUL:
      case FP_DIV:
        checkArity(op, args, 3);
        checkRoundingMode(op, args.get(0));
        checkFloatingPoint(op, args.get(1));
        return checkSame(op, args.subList(1, 3));

      case FP_NEG:
      case FP_ABS:
        checkArity(op, args, 1);
        return checkFloatingPoint(op, args.get(0));

      case FP_EQ:
      case FP_LT:
      case FP_LEQ:
        checkArity(op, args, 2);
        checkFloatingPoint(op, args.get(0));
        checkSame(op, args);
        return Sort.bool();

      case FP_IS_NAN:
        checkArity(op, args, 1);
        checkFloatingPoint(op, args.get(0));
        return Sort.bool();

      case TO_FP:
        {
          checkArity(op, args, 2);
          checkArgument(params.size() == 2, "to_fp needs two indices");
          checkRoundingMode(op, args.get(0));
          final Sort source = args.get(1).sort;
          checkArgument(
              source.isFloatingPoint() || source.isBitVector(),
              "to_fp cannot convert from %s",
              source);
          return Sort.floatingPoint(params.get(0), params.get(1));
        }

      default:
        throw new IllegalArgumentException("not an operator: " + op);
    }
  }

  private static void checkArity(Op op, List<Term> args, int arity) {
    checkArgument(
        args.size() == arity,
        "%s expects %s arguments, got %s",
        op.smtName,
        arity,
        args.size());
  }

  private static Sort checkSame(Op op, List<Term> args) {
    final Sort sort = requireNonNull(args.get(0).sort);
    for (Term arg : args) {
      checkArgument(
          arg.sort.equals(sort),
          "%s arguments have different sorts: %s, %s",
          op.smtName,
          sort,
          arg.sort);
    }
    return sort;
  }

  private static Sort checkBitVector(Op op, Term arg) {
    checkArgument(
        arg.sort.isBitVector(),
        "%s expects a bit-vector, got %s",
        op.smtName,
        arg.sort);
    return arg.sort;
  }

  private static Sort checkFloatingPoint(Op op, Term arg) {
    checkArgument(
        arg.sort.isFloatingPoint(),
        "%s expects a float, got %s",
        op.smtName,
        arg.sort);
    return arg.sort;
  }

  private static void checkRoundingMode(Op op, Term arg) {
    checkArgument(
        arg.sort.kind == Sort.Kind.ROUNDING_MODE,
        "%s expects a rounding mode, got %s",
        op.smtName,
        arg.sort);
  }
}

// End TermBuilder.java
