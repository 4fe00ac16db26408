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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;

/**
 * Node in a directed acyclic graph of constraint expressions.
 *
 * <p>Terms are created by a {@link TermBuilder}, which hash-conses them:
 * building the same structure twice returns the same object. Therefore
 * equality and hashing are by identity, and are final.
 *
 * <p>This class also functions as a namespace for its sub-classes {@link
 * Literal}, {@link Variable} and {@link Apply}, so that we can keep the class
 * names short.
 */
public abstract class Term {
  public final Op op;
  public final Sort sort;

  /** Creation ordinal within the owning builder; used only for printing. */
  public final int id;

  Term(Op op, Sort sort, int id) {
    this.op = requireNonNull(op, "op");
    this.sort = requireNonNull(sort, "sort");
    this.id = id;
  }

  public Sort getSort() {
    return sort;
  }

  /** Returns whether this is an application of an operator to arguments. */
  public boolean isApp() {
    return false;
  }

  public int getNumKids() {
    return 0;
  }

  public Term getKid(int i) {
    throw new IndexOutOfBoundsException("term " + this + " has no children");
  }

  /** Returns the arguments; empty unless this is an {@link Apply}. */
  public ImmutableList<Term> args() {
    return ImmutableList.of();
  }

  /** Returns this term as an application. */
  public Apply asApp() {
    throw new ClassCastException("not an application: " + this);
  }

  @Override
  public final boolean equals(Object obj) {
    return this == obj;
  }

  @Override
  public final int hashCode() {
    return System.identityHashCode(this);
  }

  /** Prints the term in SMT-LIB syntax. For debugging only. */
  @Override
  public final String toString() {
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder buf);

  /** Calls the {@link TermVisitor#visit} method for this kind of node. */
  abstract void accept(TermVisitor visitor);

  /** Constant: boolean, bit-vector, floating-point or rounding mode. */
  public static class Literal extends Term {
    /**
     * Value. A {@link Boolean}, a non-negative {@link BigInteger} (for
     * bit-vectors, and the raw bits of floating-point values), or a {@link
     * RoundingMode}.
     */
    public final Object value;

    Literal(Op op, Sort sort, int id, Object value) {
      super(op, sort, id);
      this.value = requireNonNull(value, "value");
      checkArgument(op.category == Op.Category.LITERAL);
    }

    public boolean booleanValue() {
      return (Boolean) value;
    }

    /** Returns the unsigned value of a bit-vector, or the raw bits of a
     * floating-point value. */
    public BigInteger bitsValue() {
      return (BigInteger) value;
    }

    public RoundingMode roundingModeValue() {
      return (RoundingMode) value;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      switch (op) {
        case TRUE:
        case FALSE:
          return buf.append(op.smtName);
        case BV_LITERAL:
          return buf.append("#b").append(binary(bitsValue(), sort.bitWidth()));
        case FP_LITERAL:
          return buf.append("((_ to_fp ")
              .append(sort.getExponentWidth())
              .append(' ')
              .append(sort.getSignificandWidth())
              .append(") #b")
              .append(binary(bitsValue(), sort.bitWidth()))
              .append(')');
        default:
          return buf.append(roundingModeValue().smtName);
      }
    }

    private static String binary(BigInteger value, int width) {
      return Strings.padStart(value.toString(2), width, '0');
    }

    @Override
    void accept(TermVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** Free variable; an uninterpreted constant of arity zero. */
  public static class Variable extends Term {
    public final String name;

    Variable(Sort sort, int id, String name) {
      super(Op.VARIABLE, sort, id);
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    void accept(TermVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** Application of an operator to an ordered list of arguments. */
  public static class Apply extends Term {
    public final ImmutableList<Term> args;

    /** Indices of an indexed operator, e.g. {@code [7, 4]} for
     * {@code (_ extract 7 4)}; otherwise empty. */
    public final ImmutableList<Integer> params;

    Apply(
        Op op,
        Sort sort,
        int id,
        ImmutableList<Term> args,
        ImmutableList<Integer> params) {
      super(op, sort, id);
      this.args = requireNonNull(args, "args");
      this.params = requireNonNull(params, "params");
      checkArgument(!args.isEmpty(), "application with no arguments");
    }

    @Override
    public boolean isApp() {
      return true;
    }

    @Override
    public int getNumKids() {
      return args.size();
    }

    @Override
    public Term getKid(int i) {
      return args.get(i);
    }

    @Override
    public ImmutableList<Term> args() {
      return args;
    }

    @Override
    public Apply asApp() {
      return this;
    }

    /** Returns the {@code i}th index of an indexed operator. */
    public int param(int i) {
      return params.get(i);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append('(');
      if (params.isEmpty()) {
        buf.append(op.smtName);
      } else {
        buf.append("(_ ").append(op.smtName);
        params.forEach(p -> buf.append(' ').append(p));
        buf.append(')');
      }
      for (Term arg : args) {
        arg.unparse(buf.append(' '));
      }
      return buf.append(')');
    }

    @Override
    void accept(TermVisitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Term.java
