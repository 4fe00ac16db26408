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
package net.hydromatic.fuzzsat.cxx;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/** Helper functions that every generated program includes. */
public abstract class CxxRuntime {
  private CxxRuntime() {}

  /** Headers that the prelude and generated code need. */
  public static final ImmutableList<String> INCLUDES =
      ImmutableList.of("cfenv", "cmath", "cstddef", "cstdint", "cstring");

  private static final Supplier<String> PRELUDE =
      Suppliers.memoize(CxxRuntime::load);

  /** Returns the source text of the helper functions. */
  public static String prelude() {
    return PRELUDE.get();
  }

  private static String load() {
    try {
      return Resources.toString(
          Resources.getResource(CxxRuntime.class, "runtime.inc"),
          StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}

// End CxxRuntime.java
