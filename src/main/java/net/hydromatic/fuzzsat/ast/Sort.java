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

import java.util.Objects;

/**
 * Sort (type) of a {@link Term}.
 *
 * <p>Sorts are values: two sorts with the same kind and widths are equal.
 */
public final class Sort {
  private static final Sort BOOL = new Sort(Kind.BOOL, 0, 0);
  private static final Sort ROUNDING_MODE = new Sort(Kind.ROUNDING_MODE, 0, 0);
  private static final Sort INT = new Sort(Kind.INT, 0, 0);
  private static final Sort REAL = new Sort(Kind.REAL, 0, 0);

  public final Kind kind;

  /**
   * Width of a bit-vector sort, or exponent width of a floating-point sort;
   * otherwise 0.
   */
  private final int w0;

  /** Significand width (including hidden bit) of a floating-point sort. */
  private final int w1;

  private Sort(Kind kind, int w0, int w1) {
    this.kind = requireNonNull(kind);
    this.w0 = w0;
    this.w1 = w1;
  }

  public static Sort bool() {
    return BOOL;
  }

  public static Sort bitVector(int width) {
    checkArgument(width > 0, "bit-vector width must be positive: %s", width);
    return new Sort(Kind.BIT_VECTOR, width, 0);
  }

  public static Sort floatingPoint(int exponentWidth, int significandWidth) {
    checkArgument(
        exponentWidth > 1 && significandWidth > 1,
        "invalid floating-point sort (%s, %s)",
        exponentWidth,
        significandWidth);
    return new Sort(Kind.FLOATING_POINT, exponentWidth, significandWidth);
  }

  /** IEEE-754 binary32. */
  public static Sort float32() {
    return floatingPoint(8, 24);
  }

  /** IEEE-754 binary64. */
  public static Sort float64() {
    return floatingPoint(11, 53);
  }

  public static Sort roundingMode() {
    return ROUNDING_MODE;
  }

  public static Sort integer() {
    return INT;
  }

  public static Sort real() {
    return REAL;
  }

  public boolean isBool() {
    return kind == Kind.BOOL;
  }

  public boolean isBitVector() {
    return kind == Kind.BIT_VECTOR;
  }

  public boolean isFloatingPoint() {
    return kind == Kind.FLOATING_POINT;
  }

  /** Returns the width of a bit-vector sort. */
  public int getBitVectorWidth() {
    checkArgument(kind == Kind.BIT_VECTOR, "not a bit-vector sort: %s", this);
    return w0;
  }

  public int getExponentWidth() {
    checkArgument(kind == Kind.FLOATING_POINT, "not a float sort: %s", this);
    return w0;
  }

  public int getSignificandWidth() {
    checkArgument(kind == Kind.FLOATING_POINT, "not a float sort: %s", this);
    return w1;
  }

  /**
   * Returns the number of bits needed to hold a value of this sort.
   *
   * @throws IllegalArgumentException if this sort has no finite bit
   *     representation
   */
  public int bitWidth() {
    switch (kind) {
      case BOOL:
        return 1;
      case BIT_VECTOR:
        return w0;
      case FLOATING_POINT:
        return w0 + w1;
      default:
        throw new IllegalArgumentException("sort " + this + " has no width");
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, w0, w1);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Sort
            && ((Sort) o).kind == kind
            && ((Sort) o).w0 == w0
            && ((Sort) o).w1 == w1;
  }

  /** Prints the sort in SMT-LIB syntax. */
  @Override
  public String toString() {
    switch (kind) {
      case BIT_VECTOR:
        return "(_ BitVec " + w0 + ")";
      case FLOATING_POINT:
        return "(_ FloatingPoint " + w0 + " " + w1 + ")";
      default:
        return kind.smtName;
    }
  }

  /** Kind of sort. */
  public enum Kind {
    BOOL("Bool"),
    BIT_VECTOR("BitVec"),
    FLOATING_POINT("FloatingPoint"),
    ROUNDING_MODE("RoundingMode"),
    INT("Int"),
    REAL("Real");

    public final String smtName;

    Kind(String smtName) {
      this.smtName = smtName;
    }
  }
}

// End Sort.java
