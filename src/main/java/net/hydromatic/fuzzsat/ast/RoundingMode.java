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

import org.checkerframework.checker.nullness.qual.Nullable;

/** IEEE-754 rounding mode, as named in SMT-LIB. */
public enum RoundingMode {
  RNE("RNE", "FE_TONEAREST"),
  /** Round to nearest, ties away from zero. C has no equivalent. */
  RNA("RNA", null),
  RTP("RTP", "FE_UPWARD"),
  RTN("RTN", "FE_DOWNWARD"),
  RTZ("RTZ", "FE_TOWARDZERO");

  public final String smtName;

  /** Name of the {@code <cfenv>} macro, or null if there is none. */
  public final @Nullable String fenvName;

  RoundingMode(String smtName, @Nullable String fenvName) {
    this.smtName = smtName;
    this.fenvName = fenvName;
  }
}

// End RoundingMode.java
