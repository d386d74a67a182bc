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

import static java.util.Objects.requireNonNull;

/**
 * Node of an abstract syntax tree.
 *
 * <p>Immutable. Equality is structural and strict: it ignores {@link #pos},
 * compares identifiers by {@link Symbol}, and requires bound names to be
 * identical. For equality up to renaming of bound names, see
 * {@code AlphaEquivalence}.
 */
public abstract class AstNode {
  /** Where the node came from. */
  public final Pos pos;
  /** Kind of node; also gives its precedence when written as text. */
  public final Op op;

  protected AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /** Returns the source text of this node, for diagnostics and tests.
   * Subclasses implement {@link #unparse(AstWriter, int, int)} instead. */
  @Override public final String toString() {
    return unparse(new AstWriter(), 0, 0).toString();
  }

  /** Writes this node to {@code w}. The node is parenthesized if its
   * operator binds less tightly than the neighboring operators, whose
   * precedences are {@code left} and {@code right}. */
  abstract AstWriter unparse(AstWriter w, int left, int right);

  /** Calls the method of {@code shuttle} for this node's class, and returns
   * the node it builds. */
  public abstract AstNode accept(Shuttle shuttle);

  /** Calls the method of {@code visitor} for this node's class. */
  public abstract void accept(Visitor visitor);
}

// End AstNode.java
