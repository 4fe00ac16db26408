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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import net.hydromatic.fuzzsat.core.Cancellable;
import net.hydromatic.fuzzsat.core.Context;
import net.hydromatic.fuzzsat.core.Query;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Runs a sequence of {@link QueryPass}es over a {@link Query}.
 *
 * <p>Passes run in the order they were added. The run stops early if a pass
 * returns false, or if the manager is cancelled; cancellation is checked
 * between passes, and forwarded to the pass that is running.
 */
public class QueryPassManager implements Cancellable {
  private final List<QueryPass> passes = new ArrayList<>();
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Object lock = new Object();
  private @Nullable QueryPass current;

  /** Appends a pass. */
  public QueryPassManager add(QueryPass pass) {
    passes.add(requireNonNull(pass, "pass"));
    return this;
  }

  public ImmutableList<QueryPass> passes() {
    return ImmutableList.copyOf(passes);
  }

  /**
   * Runs the passes.
   *
   * @return whether every pass ran and allowed later passes to run
   */
  public boolean run(Query query) {
    final Context context = query.getContext();
    for (QueryPass pass : passes) {
      synchronized (lock) {
        if (cancelled.get()) {
          context.debug("(QueryPassManager cancelled before " + pass + ")");
          return false;
        }
        current = pass;
      }
      final boolean proceed;
      try {
        context.debug("(QueryPassManager running " + pass + ")");
        proceed = pass.run(query);
      } finally {
        synchronized (lock) {
          current = null;
        }
      }
      context.tracer.onPass(pass.getName(), proceed);
      if (!proceed) {
        context.debug("(QueryPassManager stopped after " + pass + ")");
        return false;
      }
    }
    return !cancelled.get();
  }

  @Override
  public void cancel() {
    final QueryPass pass;
    synchronized (lock) {
      cancelled.set(true);
      pass = current;
    }
    if (pass != null) {
      pass.cancel();
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}

// End QueryPassManager.java
