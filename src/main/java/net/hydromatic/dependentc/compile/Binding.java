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

import java.util.Objects;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry in an {@link Environment}: a name, its type, and perhaps its value.
 *
 * <p>A value comes with the environment it was checked in. The evaluator
 * unfolds a name to its value only where the value's free names resolve to
 * the same bindings as they did there.
 */
public class Binding {
  public final Symbol name;
  public final Ast.Exp type;
  public final Ast.@Nullable Exp value;
  /** Environment the value was checked in; null if and only if
   * {@link #value} is null. */
  public final @Nullable Environment valueEnv;

  private Binding(Symbol name, Ast.Exp type, Ast.@Nullable Exp value,
      @Nullable Environment valueEnv) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
    this.value = value;
    this.valueEnv = valueEnv;
  }

  /** Binds a name of known type and unknown value, such as a parameter. */
  public static Binding of(Symbol name, Ast.Exp type) {
    return new Binding(name, type, null, null);
  }

  /** Binds a name of known type and value, such as an initialized
   * declaration. */
  public static Binding of(Symbol name, Ast.Exp type, Ast.Exp value,
      Environment valueEnv) {
    return new Binding(name, type, requireNonNull(value),
        requireNonNull(valueEnv));
  }

  @Override public int hashCode() {
    return Objects.hash(name, type, value);
  }

  /** {@inheritDoc}
   *
   * <p>Compares name, type and value, but not the value's environment. */
  @Override public boolean equals(Object o) {
    if (!(o instanceof Binding)) {
      return false;
    }
    final Binding that = (Binding) o;
    return name.equals(that.name)
        && type.equals(that.type)
        && Objects.equals(value, that.value);
  }

  /** Returns "name : type" or "name = value : type". */
  @Override public String toString() {
    final StringBuilder buf = new StringBuilder().append(name);
    if (value != null) {
      buf.append(" = ").append(value);
    }
    return buf.append(" : ").append(type).toString();
  }
}

// End Binding.java
