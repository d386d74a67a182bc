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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import net.hydromatic.dependentc.ast.Symbol;

/**
 * Source of fresh symbols for one compilation run.
 *
 * <p>A fresh symbol keeps the name of the symbol it replaces and takes the
 * next ordinal for that name, starting at 1. Symbols written in the source
 * have ordinal 0, so they never collide with fresh ones.
 */
public class NameGenerator {
  private final Multiset<String> issued = HashMultiset.create();

  /** Returns a symbol named like {@code base} that differs from every source
   * symbol and from every symbol this generator has returned before. */
  public Symbol fresh(Symbol base) {
    issued.add(base.name);
    return Symbol.of(base.name, issued.count(base.name));
  }
}

// End NameGenerator.java
