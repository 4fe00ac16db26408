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

import static java.util.Objects.requireNonNull;

import java.io.File;
import java.util.Map;
import net.hydromatic.fuzzsat.core.Prop;
import net.hydromatic.fuzzsat.fuzz.LibFuzzerOptions;

/** Options for {@link CxxFuzzingSolver}. Immutable. */
public class CxxFuzzingSolverOptions {
  public final ClangOptions clangOptions;
  public final LibFuzzerOptions libFuzzerOptions;

  /** Directory in which each attempt creates its scratch directory. */
  public final File workingDirectory;

  public final boolean keepWorkingDirectory;

  public CxxFuzzingSolverOptions(ClangOptions clangOptions,
      LibFuzzerOptions libFuzzerOptions, File workingDirectory,
      boolean keepWorkingDirectory) {
    this.clangOptions = requireNonNull(clangOptions, "clangOptions");
    this.libFuzzerOptions =
        requireNonNull(libFuzzerOptions, "libFuzzerOptions");
    this.workingDirectory =
        requireNonNull(workingDirectory, "workingDirectory");
    this.keepWorkingDirectory = keepWorkingDirectory;
  }

  /** Creates options from properties. */
  public static CxxFuzzingSolverOptions of(Map<Prop, Object> map) {
    return new CxxFuzzingSolverOptions(ClangOptions.of(map),
        LibFuzzerOptions.of(map), Prop.WORKING_DIRECTORY.fileValue(map),
        Prop.KEEP_WORKING_DIRECTORY.booleanValue(map));
  }
}

// End CxxFuzzingSolverOptions.java
