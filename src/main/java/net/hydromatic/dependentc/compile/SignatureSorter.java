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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.Symbol;

/**
 * Orders top-level declarations so that each declaration comes after the
 * declarations that its signature references.
 *
 * <p>Only signatures create dependencies. A body may reference any
 * declaration, including its own, because bodies are checked after all
 * signatures.
 *
 * <p>The order is deterministic: declarations are visited depth-first in the
 * order they were written, each one's dependencies are visited in the order
 * they were written, and a declaration is emitted after its dependencies.
 */
public class SignatureSorter {
  private final Map<Symbol, Ast.TopLevel> topLevels = new LinkedHashMap<>();
  private final Set<Symbol> visited = new HashSet<>();
  /** Declarations currently being visited, outermost first. */
  private final List<Symbol> path = new ArrayList<>();
  private final ImmutableList.Builder<Ast.TopLevel> order =
      ImmutableList.builder();

  private SignatureSorter(List<? extends Ast.TopLevel> topLevels) {
    for (Ast.TopLevel topLevel : topLevels) {
      if (this.topLevels.putIfAbsent(topLevel.name, topLevel) != null) {
        throw TypeException.duplicateDeclaration(topLevel);
      }
    }
  }

  /** Sorts the declarations of a translation unit. */
  public static ImmutableList<Ast.TopLevel> sort(Ast.TranslationUnit unit) {
    return sort(unit.topLevels);
  }

  /** Sorts a list of declarations.
   *
   * @throws TypeException if two declarations have the same name, or if
   * signatures reference each other in a cycle */
  public static ImmutableList<Ast.TopLevel> sort(
      List<? extends Ast.TopLevel> topLevels) {
    final SignatureSorter sorter = new SignatureSorter(topLevels);
    sorter.topLevels.values().forEach(sorter::visit);
    return sorter.order.build();
  }

  /** Returns the declarations that a declaration's signature references, in
   * declaration order. */
  private List<Ast.TopLevel> dependencies(Ast.TopLevel topLevel) {
    final Set<Symbol> freeVars = FreeFinder.freeVars(topLevel.signature());
    final List<Ast.TopLevel> list = new ArrayList<>();
    topLevels.forEach((name, t) -> {
      if (freeVars.contains(name)) {
        list.add(t);
      }
    });
    return list;
  }

  private void visit(Ast.TopLevel topLevel) {
    if (visited.contains(topLevel.name)) {
      return;
    }
    final int i = path.indexOf(topLevel.name);
    if (i >= 0) {
      throw TypeException.cyclicSignatureDependency(topLevel.pos,
          path.subList(i, path.size()));
    }
    path.add(topLevel.name);
    dependencies(topLevel).forEach(this::visit);
    path.remove(path.size() - 1);
    visited.add(topLevel.name);
    order.add(topLevel);
  }
}

// End SignatureSorter.java
