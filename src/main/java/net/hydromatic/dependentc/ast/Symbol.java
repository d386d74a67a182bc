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
package net.hydromatic.dependentc.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/**
 * Interned name of a variable, parameter, field or declaration.
 *
 * <p>A symbol is a name plus an ordinal. Names that occur in source code have
 * ordinal 0; symbols minted by {@link
 * net.hydromatic.dependentc.compile.NameGenerator} to avoid variable capture
 * have ordinal 1 or greater, and are therefore distinct from every source
 * name.
 */
public final class Symbol {
  private static final Interner<Symbol> INTERNER =
      Interners.newStrongInterner();

  public final String name;
  public final int i;

  private Symbol(String name, int i) {
    this.name = requireNonNull(name, "name");
    this.i = i;
    checkArgument(!name.isEmpty(), "empty name");
    checkArgument(i >= 0, "negative ordinal");
  }

  /** Returns the canonical symbol for a name that occurs in source code. */
  public static Symbol of(String name) {
    return of(name, 0);
  }

  /** Returns the canonical symbol for a name and ordinal. */
  public static Symbol of(String name, int i) {
    return INTERNER.intern(new Symbol(name, i));
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + i;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Symbol
            && ((Symbol) o).name.equals(name)
            && ((Symbol) o).i == i;
  }

  @Override
  public String toString() {
    return i == 0 ? name : name + "_" + i;
  }
}

// End Symbol.java
