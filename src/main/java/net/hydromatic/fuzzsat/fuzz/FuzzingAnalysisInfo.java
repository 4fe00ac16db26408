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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Results of analysis that code generation needs. Immutable. */
public class FuzzingAnalysisInfo {
  public final BufferAssignment bufferAssignment;
  public final ImmutableList<EqualitySet> equalities;

  public FuzzingAnalysisInfo(BufferAssignment bufferAssignment,
      List<EqualitySet> equalities) {
    this.bufferAssignment =
        requireNonNull(bufferAssignment, "bufferAssignment");
    this.equalities = ImmutableList.copyOf(equalities);
  }

  /** Returns the number of bits in the input buffer. */
  public int computeWidth() {
    return bufferAssignment.computeWidth();
  }

  /** Returns the smallest input, in bytes, that holds every variable. */
  public int maxLength() {
    return (computeWidth() + 7) / 8;
  }
}

// End FuzzingAnalysisInfo.java
