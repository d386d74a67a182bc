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
package net.hydromatic.dependentc.compile;

import java.util.List;
import net.hydromatic.dependentc.ast.Ast;

/**
 * Receives events from {@link Compiles#check}.
 *
 * <p>Tests use a tracer to observe the checking order and to collect errors;
 * see {@link Tracers} for implementations.
 */
public interface Tracer {
  /** Receives the declarations in the order they will be checked. */
  void onOrder(List<Ast.TopLevel> order);

  /** Receives a declaration whose signature and body both checked. */
  void onChecked(Ast.TopLevel topLevel);

  /** Receives the error that failed a declaration, and returns true if the
   * error is handled. An unhandled error stops the run unless the
   * {@link Prop#CONTINUE_ON_ERROR} option is set. */
  boolean handleCompileException(CompileException e);
}

// End Tracer.java
