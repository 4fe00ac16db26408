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
package net.hydromatic.fuzzsat.transform;

import java.util.concurrent.atomic.AtomicBoolean;
import net.hydromatic.fuzzsat.core.Cancellable;
import net.hydromatic.fuzzsat.core.Query;

/**
 * Step that analyzes or transforms a {@link Query}.
 *
 * <p>A pass is constructed for one pipeline run and then discarded. It may
 * keep results for its caller to collect after the run, but must not carry
 * state from one query to another.
 *
 * <p>A pass that walks a term graph must poll {@link #isCancelled()} at
 * least once per node.
 */
public abstract class QueryPass implements Cancellable {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** Returns the name of this pass, for diagnostics. */
  public abstract String getName();

  /**
   * Runs this pass.
   *
   * @return whether later passes should run
   */
  public abstract boolean run(Query query);

  @Override
  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  @Override
  public String toString() {
    return getName();
  }
}

// End QueryPass.java
