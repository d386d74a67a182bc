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

import static java.util.Objects.requireNonNull;

import net.hydromatic.dependentc.ast.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Returns the environment in which no name is bound. */
  public static Environment empty() {
    return Root.INSTANCE;
  }

  /** Link in a chain of environments; holds one binding and defers every
   * other name to its parent. */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Binding binding;

    SubEnvironment(Environment parent, Binding binding) {
      this.parent = requireNonNull(parent);
      this.binding = requireNonNull(binding);
    }

    @Override public String toString() {
      return "{" + binding.name + " ...}";
    }

    @Override public @Nullable Binding getOpt(Symbol name) {
      return binding.name.equals(name) ? binding : parent.getOpt(name);
    }
  }

  /** End of every chain. */
  private static class Root extends Environment {
    static final Root INSTANCE = new Root();

    @Override public String toString() {
      return "{}";
    }

    @Override public @Nullable Binding getOpt(Symbol name) {
      return null;
    }
  }
}

// End Environments.java
