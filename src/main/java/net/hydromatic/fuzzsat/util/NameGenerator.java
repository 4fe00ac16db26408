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
package net.hydromatic.fuzzsat.util;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates unique identifiers for generated code.
 *
 * <p>Temporaries are named {@code <prefix>0}, {@code <prefix>1}, and so on.
 * Names derived from user input are sanitized to C identifiers, and given a
 * numeric suffix if the same sanitized name has been used before.
 */
public class NameGenerator {
  private final String tempPrefix;
  private int id = 0;
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();
  private final Set<String> used = new HashSet<>();

  public NameGenerator(String tempPrefix) {
    this.tempPrefix = tempPrefix;
  }

  /** Generates a temporary name that is unique in this program. */
  public String get() {
    return tempPrefix + id++;
  }

  /** Returns a unique identifier derived from {@code prefix} and
   * {@code name}. */
  public String unique(String prefix, String name) {
    final String base = prefix + sanitize(name);
    String candidate = base;
    while (!used.add(candidate)) {
      candidate = base + "_" + (inc(base) + 1);
    }
    return candidate;
  }

  /** Returns the number of times that "name" has been used. */
  public int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(0))
        .getAndIncrement();
  }

  /** Replaces each character that cannot occur in a C identifier with
   * '_'. */
  static String sanitize(String name) {
    final StringBuilder b = new StringBuilder(name.length());
    for (int i = 0; i < name.length(); i++) {
      final char c = name.charAt(i);
      if (c >= 'a' && c <= 'z'
          || c >= 'A' && c <= 'Z'
          || c >= '0' && c <= '9'
          || c == '_') {
        b.append(c);
      } else {
        b.append('_');
      }
    }
    return b.toString();
  }
}

// End NameGenerator.java
