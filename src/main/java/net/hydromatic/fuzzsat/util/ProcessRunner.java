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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import net.hydromatic.fuzzsat.core.Cancellable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Runs an external command and waits for it, and can be cancelled from
 * another thread.
 *
 * <p>Cancellation is sticky: once {@link #cancel()} has been called, the
 * running process (and its descendants) is killed, and later calls to
 * {@link #run} return {@link #CANCELLED} without starting a process.
 */
public class ProcessRunner implements Cancellable {
  /** Exit code returned by {@link #run} if the process was cancelled. */
  public static final int CANCELLED = Integer.MIN_VALUE;

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Object lock = new Object();
  private @Nullable Process process;

  /**
   * Runs a command and returns its exit code.
   *
   * <p>If {@code stdoutFile} or {@code stderrFile} is null, the stream is
   * inherited from this process.
   *
   * @throws IOException if the process cannot be started
   */
  public int run(List<String> command, @Nullable File directory,
      @Nullable File stdoutFile, @Nullable File stderrFile)
      throws IOException {
    checkArgument(!command.isEmpty(), "empty command");
    final ProcessBuilder builder =
        new ProcessBuilder(ImmutableList.copyOf(command));
    if (directory != null) {
      builder.directory(directory);
    }
    builder.redirectOutput(stdoutFile == null
        ? ProcessBuilder.Redirect.INHERIT
        : ProcessBuilder.Redirect.to(stdoutFile));
    builder.redirectError(stderrFile == null
        ? ProcessBuilder.Redirect.INHERIT
        : ProcessBuilder.Redirect.to(stderrFile));

    final Process p;
    synchronized (lock) {
      if (cancelled.get()) {
        return CANCELLED;
      }
      p = builder.start();
      process = p;
    }
    try {
      final int exitCode = p.waitFor();
      return cancelled.get() ? CANCELLED : exitCode;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      kill(p);
      return CANCELLED;
    } finally {
      synchronized (lock) {
        process = null;
      }
    }
  }

  @Override
  public void cancel() {
    final Process p;
    synchronized (lock) {
      cancelled.set(true);
      p = process;
    }
    if (p != null) {
      kill(p);
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  private static void kill(Process p) {
    p.descendants().forEach(ProcessHandle::destroyForcibly);
    p.destroyForcibly();
  }
}

// End ProcessRunner.java
