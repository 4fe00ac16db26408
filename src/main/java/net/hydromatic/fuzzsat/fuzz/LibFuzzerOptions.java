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

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.util.Map;
import net.hydromatic.fuzzsat.core.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Options for a libFuzzer run. Immutable.
 *
 * <p>The paths are set per attempt; the search parameters come from
 * properties.
 */
public class LibFuzzerOptions {
  public final @Nullable File targetBinary;
  public final @Nullable File corpusDir;
  public final @Nullable File artifactDir;

  /** Maximum input length in bytes; 0 lets libFuzzer choose. */
  public final int maxLength;

  public final int seed;

  /** Number of runs; -1 means unlimited. */
  public final int runs;

  /** Time limit in seconds; 0 means unlimited. */
  public final int maxTotalTime;

  /** Whether to use comparison tracing. */
  public final boolean useCmp;

  private LibFuzzerOptions(@Nullable File targetBinary,
      @Nullable File corpusDir, @Nullable File artifactDir, int maxLength,
      int seed, int runs, int maxTotalTime, boolean useCmp) {
    this.targetBinary = targetBinary;
    this.corpusDir = corpusDir;
    this.artifactDir = artifactDir;
    this.maxLength = maxLength;
    this.seed = seed;
    this.runs = runs;
    this.maxTotalTime = maxTotalTime;
    this.useCmp = useCmp;
    checkArgument(maxLength >= 0, "negative maxLength %s", maxLength);
    checkArgument(maxTotalTime >= 0, "negative maxTotalTime %s",
        maxTotalTime);
  }

  /** Creates options from properties. */
  public static LibFuzzerOptions of(Map<Prop, Object> map) {
    return new LibFuzzerOptions(null, null, null, 0,
        Prop.SEED.intValue(map), Prop.RUNS.intValue(map),
        Prop.MAX_TOTAL_TIME.intValue(map), Prop.TRACE_CMP.booleanValue(map));
  }

  public LibFuzzerOptions withTargetBinary(File targetBinary) {
    return new LibFuzzerOptions(targetBinary, corpusDir, artifactDir,
        maxLength, seed, runs, maxTotalTime, useCmp);
  }

  public LibFuzzerOptions withCorpusDir(File corpusDir) {
    return new LibFuzzerOptions(targetBinary, corpusDir, artifactDir,
        maxLength, seed, runs, maxTotalTime, useCmp);
  }

  public LibFuzzerOptions withArtifactDir(File artifactDir) {
    return new LibFuzzerOptions(targetBinary, corpusDir, artifactDir,
        maxLength, seed, runs, maxTotalTime, useCmp);
  }

  public LibFuzzerOptions withMaxLength(int maxLength) {
    return new LibFuzzerOptions(targetBinary, corpusDir, artifactDir,
        maxLength, seed, runs, maxTotalTime, useCmp);
  }

  public LibFuzzerOptions withUseCmp(boolean useCmp) {
    return new LibFuzzerOptions(targetBinary, corpusDir, artifactDir,
        maxLength, seed, runs, maxTotalTime, useCmp);
  }

  /**
   * Returns the libFuzzer command line.
   *
   * @throws IllegalStateException if the target or a directory is not set
   */
  public ImmutableList<String> toCommand() {
    if (targetBinary == null || corpusDir == null || artifactDir == null) {
      throw new IllegalStateException(
          "target binary, corpus and artifact directories must be set");
    }
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    b.add(targetBinary.getAbsolutePath());
    b.add("-seed=" + seed);
    b.add("-runs=" + runs);
    if (maxLength > 0) {
      b.add("-max_len=" + maxLength);
    }
    b.add("-max_total_time=" + maxTotalTime);
    b.add("-use_cmp=" + (useCmp ? 1 : 0));
    b.add("-artifact_prefix=" + artifactDir.getAbsolutePath()
        + File.separator);
    b.add("-print_final_stats=1");
    b.add(corpusDir.getAbsolutePath());
    return b.build();
  }
}

// End LibFuzzerOptions.java
