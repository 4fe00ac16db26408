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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fuzzsat.ast.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Layout of free variables in the fuzzer's input buffer. Immutable.
 *
 * <p>Each variable is in exactly one of three states: it owns a {@link
 * BufferElement}; it aliases the element of another variable that it must
 * equal; or it is fixed to a literal and takes no space.
 */
public class BufferAssignment {
  /** Elements, in increasing order of offset. */
  public final ImmutableList<BufferElement> elements;

  /** Variables that share another variable's element. */
  public final ImmutableMap<Term.Variable, BufferElement> aliases;

  /** Variables whose value is a known literal. */
  public final ImmutableMap<Term.Variable, Term.Literal> fixedValues;

  /** All variables, in order of first appearance. */
  public final ImmutableList<Term.Variable> variables;

  BufferAssignment(List<BufferElement> elements,
      Map<Term.Variable, BufferElement> aliases,
      Map<Term.Variable, Term.Literal> fixedValues,
      List<Term.Variable> variables) {
    this.elements = ImmutableList.copyOf(elements);
    this.aliases = ImmutableMap.copyOf(aliases);
    this.fixedValues = ImmutableMap.copyOf(fixedValues);
    this.variables = ImmutableList.copyOf(variables);
  }

  /** Returns the total number of bits in the buffer. */
  public int computeWidth() {
    int width = 0;
    for (BufferElement element : elements) {
      width += element.storedWidth;
    }
    return width;
  }

  /** Returns the element from which a variable is decoded, or null if the
   * variable is fixed. */
  public @Nullable BufferElement elementFor(Term.Variable variable) {
    for (BufferElement element : elements) {
      if (element.variable == variable) {
        return element;
      }
    }
    return aliases.get(variable);
  }

  /** Returns the literal that a variable is fixed to, or null. */
  public Term.@Nullable Literal fixedValue(Term.Variable variable) {
    return fixedValues.get(variable);
  }

  @Override
  public String toString() {
    return "BufferAssignment{elements=" + elements
        + ", aliases=" + aliases.keySet()
        + ", fixed=" + fixedValues.keySet() + "}";
  }

  /** Region of the buffer that holds the value of one variable. */
  public static class BufferElement {
    public final Term.Variable variable;

    /** Offset, in bits, from the start of the buffer. */
    public final int bitOffset;

    /** Number of bits reserved, at least the width of the sort. */
    public final int storedWidth;

    BufferElement(Term.Variable variable, int bitOffset, int storedWidth) {
      this.variable = requireNonNull(variable, "variable");
      this.bitOffset = bitOffset;
      this.storedWidth = storedWidth;
      checkArgument(bitOffset >= 0, "negative offset %s", bitOffset);
      checkArgument(storedWidth >= getBitWidth(),
          "stored width %s is less than %s", storedWidth, getBitWidth());
    }

    /** Number of bits that the value occupies. */
    public int getBitWidth() {
      return variable.sort.bitWidth();
    }

    @Override
    public String toString() {
      return variable.name + "@" + bitOffset + ":" + getBitWidth();
    }
  }
}

// End BufferAssignment.java
