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
package net.hydromatic.fuzzsat.core;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * @see Context#props
 */
public enum Prop {
  /**
   * Integer property "bufferAlignment" is the alignment, in bits, of each
   * free variable's region in the fuzzer's input buffer. Default is 8, so
   * each region starts on a byte boundary; 1 packs variables with no gaps.
   */
  BUFFER_ALIGNMENT("bufferAlignment", Integer.class, true, 8),

  /** String property "clangPath" is the path of the Clang C++ compiler. */
  CLANG_PATH("clangPath", String.class, true, "clang++"),

  /** Boolean property "debugSymbols" is whether to compile with "-g". */
  DEBUG_SYMBOLS("debugSymbols", Boolean.class, true, false),

  /**
   * Boolean property "extractEqualities" controls whether top-level
   * equalities between variables and constants are removed from the query
   * and satisfied by construction. Default is true.
   */
  EXTRACT_EQUALITIES("extractEqualities", Boolean.class, true, true),

  /**
   * Boolean property "keepWorkingDirectory" controls whether each attempt's
   * scratch directory (generated program, binary, corpus, crash artifacts and
   * tool output) survives the attempt. Default is false.
   */
  KEEP_WORKING_DIRECTORY("keepWorkingDirectory", Boolean.class, true, false),

  /**
   * String property "libFuzzerLib" is the path of a libFuzzer archive to link
   * against. If not set, Clang's "-fsanitize=fuzzer" supplies libFuzzer.
   */
  LIB_FUZZER_LIB("libFuzzerLib", String.class, false, null),

  /**
   * Integer property "maxTotalTime" is the fuzzing time limit in seconds; 0,
   * the default, means no limit.
   */
  MAX_TOTAL_TIME("maxTotalTime", Integer.class, true, 0),

  /** Integer property "optimizationLevel" is the "-O" level. Default 0. */
  OPTIMIZATION_LEVEL("optimizationLevel", Integer.class, true, 0),

  /**
   * Boolean property "preprocess" controls whether simplification passes run
   * before analysis. Default is true.
   */
  PREPROCESS("preprocess", Boolean.class, true, true),

  /**
   * Integer property "runs" is the maximum number of fuzzer runs; -1, the
   * default, means no limit.
   */
  RUNS("runs", Integer.class, true, -1),

  /** Integer property "seed" is libFuzzer's random seed. Default 1. */
  SEED("seed", Integer.class, true, 1),

  /**
   * Boolean property "traceCmp" controls whether the program is instrumented
   * to trace comparisons, and whether libFuzzer uses that instrumentation.
   * Default is true.
   */
  TRACE_CMP("traceCmp", Boolean.class, true, true),

  /** Boolean property "useAsan" is whether to use AddressSanitizer. */
  USE_ASAN("useAsan", Boolean.class, true, false),

  /** Boolean property "useUbsan" is whether to use UBSanitizer. */
  USE_UBSAN("useUbsan", Boolean.class, true, false),

  /**
   * Integer property "verbosity" controls diagnostics. At 0, the default,
   * warnings and debug messages are suppressed and external tools' output is
   * redirected to files.
   */
  VERBOSITY("verbosity", Integer.class, true, 0),

  /**
   * File property "workingDirectory" is the directory in which each attempt
   * creates its scratch directory. Default is "java.io.tmpdir".
   */
  WORKING_DIRECTORY(
      "workingDirectory",
      File.class,
      true,
      new File(System.getProperty("java.io.tmpdir")));

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(
      String camelName,
      Class<?> type,
      boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or its default. */
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return this.typeValue(map.get(this));
  }

  /** Returns the value of an optional string property, or null. */
  public @Nullable String optionalStringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /** Returns the value of a file property. */
  public File fileValue(Map<Prop, Object> map) {
    checkType(File.class);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property from a string, converting it to the
   * property's type. Used to read properties from a command line or a
   * properties file.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable String value) {
    if (value == null || type == String.class) {
      set(map, value);
    } else if (type == Boolean.class) {
      set(map, Boolean.valueOf(value));
    } else if (type == Integer.class) {
      try {
        set(map, Integer.valueOf(value.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must be an integer", e);
      }
    } else {
      set(map, new File(value));
    }
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property must have type " + type);
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous value
   * or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
