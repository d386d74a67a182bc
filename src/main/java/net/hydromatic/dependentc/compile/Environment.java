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

import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Typing context. Maps each name in scope to its type and, if it was declared
 * with an initializer, to its value.
 *
 * <p>Immutable. {@link #bind} returns a child environment that sees the new
 * binding ahead of its parent's, and the parent is untouched; a checker
 * leaves a scope by dropping the child.
 *
 * <p>The types and values in an environment may refer to the names bound
 * before them. {@link TypeChecker} never binds a name that is already bound,
 * so those references cannot be captured by a later binding.
 *
 * <p>The root of every chain is {@link Environments#empty()}.
 */
public abstract class Environment {
  /** Returns the binding of {@code name}, or null. */
  public abstract @Nullable Binding getOpt(Symbol name);

  /** Returns a child environment in which {@code name} has type
   * {@code type} and no known value. */
  public Environment bind(Symbol name, Ast.Exp type) {
    return bind(Binding.of(name, type));
  }

  /** Returns a child environment in which {@code name} has type
   * {@code type} and value {@code value}. The value is remembered together
   * with this environment, in which it was checked. */
  public Environment bind(Symbol name, Ast.Exp type, Ast.Exp value) {
    return bind(Binding.of(name, type, value, this));
  }

  protected Environment bind(Binding binding) {
    return new Environments.SubEnvironment(this, binding);
  }
}

// End Environment.java
