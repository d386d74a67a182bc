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

import java.util.function.BiConsumer;

/**
 * Accumulates the source text of a tree.
 *
 * <p>Each node writes itself knowing the precedences of the operators on
 * either side of it, and adds parentheses only where a neighbor binds more
 * tightly than its own operator.
 */
public class AstWriter {
  private final StringBuilder buf = new StringBuilder();

  public AstWriter append(String s) {
    buf.append(s);
    return this;
  }

  public AstWriter id(Symbol symbol) {
    return append(symbol.toString());
  }

  /** Writes a node between operators of precedence {@code left} and
   * {@code right}. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Writes a binary operator and its two operands. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    final boolean parens = left > op.left || right > op.right;
    if (parens) {
      append("(");
      left = 0;
      right = 0;
    }
    append(a0, left, op.left).append(op.padded).append(a1, op.right, right);
    return parens ? append(")") : this;
  }

  /** Writes the operand of a prefix or postfix operator; the operand is
   * parenthesized if it binds less tightly than {@code op}. */
  public AstWriter operand(AstNode node, Op op) {
    return node.op.left < op.left
        ? append("(").append(node, 0, 0).append(")")
        : append(node, op.left, op.right);
  }

  /** Writes each element with {@code consumer}, with {@code separator}
   * between consecutive elements. */
  public <E> AstWriter list(Iterable<E> elements, String separator,
      BiConsumer<AstWriter, E> consumer) {
    String sep = "";
    for (E element : elements) {
      append(sep);
      consumer.accept(this, element);
      sep = separator;
    }
    return this;
  }

  @Override public String toString() {
    return buf.toString();
  }
}

// End AstWriter.java
