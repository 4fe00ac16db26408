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

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;

/**
 * Scratch directory for one solving attempt.
 *
 * <p>Closing the manager deletes the directory and everything in it,
 * unless it was created with {@code keep}.
 */
public class WorkingDirectoryManager implements AutoCloseable {
  private final File directory;
  private final boolean keep;

  protected WorkingDirectoryManager(File directory, boolean keep) {
    this.directory = requireNonNull(directory, "directory");
    this.keep = keep;
  }

  /**
   * Creates a new, empty directory under {@code parent}, whose name starts
   * with {@code prefix}.
   */
  public static WorkingDirectoryManager create(File parent, String prefix,
      boolean keep) {
    try {
      Files.createDirectories(parent.toPath());
      final File directory =
          Files.createTempDirectory(parent.toPath(), prefix).toFile();
      return new WorkingDirectoryManager(directory, keep);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public File getPath() {
    return directory;
  }

  /** Returns the path of a file in the directory; does not create it. */
  public File getPathToFileInDirectory(String name) {
    checkArgument(!name.isEmpty() && !name.contains(File.separator),
        "invalid file name: %s", name);
    return new File(directory, name);
  }

  /** Creates a subdirectory. */
  public File makeNewDirectoryInDirectory(String name) {
    final File subDirectory = getPathToFileInDirectory(name);
    checkArgument(!subDirectory.exists(), "already exists: %s", subDirectory);
    try {
      Files.createDirectory(subDirectory.toPath());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return subDirectory;
  }

  @Override
  public void close() {
    if (keep || !directory.exists()) {
      return;
    }
    try {
      MoreFiles.deleteRecursively(directory.toPath(),
          RecursiveDeleteOption.ALLOW_INSECURE);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public String toString() {
    return directory.toString();
  }
}

// End WorkingDirectoryManager.java
