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

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/** Kinds of {@link AstNode}, with the precedences used to write them. */
public enum Op {
  // atoms
  LITERAL(true),
  ID(true),

  // binary operators
  EQ(" == ", 3),
  NE(" != ", 3),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  /** Sequencing, "a >> b"; evaluates "a", discards it, then evaluates "b". */
  AND_THEN(" >> ", 1),

  IF(0),

  // function type, constructor and destructor
  FUNC_TYPE(9),
  LAMBDA(0),
  CALL(9),

  // product and sum types, constructor and destructor
  STRUCT(true),
  UNION(true),
  PACK(9),
  MEMBER(9),

  // pointer type, constructor and destructor
  POINTER(9),
  REFERENCE(8),
  DEREFERENCE(8),

  // statements
  EMPTY_STATEMENT,
  EXP_STATEMENT,
  RETURN,
  BLOCK_STATEMENT,
  DECL,
  IF_STATEMENT,
  BLOCK,

  // top-level
  FUNC_DECL,
  TRANSLATION_UNIT;

  /** Operators that compare two values and produce a {@code bool}. */
  public static final Set<Op> COMPARISONS =
      ImmutableSet.of(EQ, NE, LT, LE, GT, GE);

  /** Operators that compare two values by their order. */
  public static final Set<Op> ORDERINGS = ImmutableSet.of(LT, LE, GT, GE);

  /** Operators that perform arithmetic on integral values. */
  public static final Set<Op> ARITHMETIC = ImmutableSet.of(PLUS, MINUS);

  /** Infix text with surrounding spaces, e.g. " == "; empty if none. */
  public final String padded;
  /** How tightly the operator holds the operand on its left. */
  public final int left;
  /** How tightly the operator holds the operand on its right. */
  public final int right;

  Op() {
    this("", 0, 0);
  }

  /** Creates an atom, which never needs parentheses. */
  Op(boolean atom) {
    this("", atom ? 99 : 0, atom ? 99 : 0);
  }

  Op(int precedence) {
    this("", precedence * 2, precedence * 2);
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(String padded, int leftPrecedence, int rightPrecedence) {
    this.padded = padded;
    this.left = leftPrecedence;
    this.right = rightPrecedence;
  }

  /** Returns whether this is a binary operator. */
  public boolean isBinary() {
    return COMPARISONS.contains(this)
        || ARITHMETIC.contains(this)
        || this == AND_THEN;
  }
}

// End Op.java
