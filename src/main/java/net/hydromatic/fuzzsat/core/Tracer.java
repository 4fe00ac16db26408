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

import net.hydromatic.fuzzsat.cxx.CxxProgram;
import net.hydromatic.fuzzsat.fuzz.FuzzingSolver;

/** Called on various events during solving. */
public interface Tracer {
  /** Called when a pass has run, with whether later passes may run. */
  void onPass(String passName, boolean proceed);

  /** Called when a solver enters a state. */
  void onState(FuzzingSolver.State state);

  /** Called when a program has been generated. */
  void onProgram(CxxProgram program);

  /** Called with the response of a solving attempt. */
  void onResponse(SolverResponse response);
}

// End Tracer.java
