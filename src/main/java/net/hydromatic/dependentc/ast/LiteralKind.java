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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Kinds of {@link Ast.Literal}.
 *
 * <p>All kinds except {@link #INTEGRAL} and {@link #BOOLEAN} are types; those
 * two are values.
 */
public enum LiteralKind {
  /** The type of types. */
  TYPE("type", 0, false),
  VOID("void", 0, false),
  U8("u8", 8, false),
  S8("s8", 8, true),
  U16("u16", 16, false),
  S16("s16", 16, true),
  U32("u32", 32, false),
  S32("s32", 32, true),
  U64("u64", 64, false),
  S64("s64", 64, true),
  BOOL("bool", 0, false),

  /** Integer value, e.g. "42". */
  INTEGRAL(null, 0, false),
  /** Boolean value, "true" or "false". */
  BOOLEAN(null, 0, false);

  /** Keyword for a type literal, e.g. "u32"; null for value literals. */
  public final @Nullable String keyword;
  /** Number of bits of an integral type; 0 for other kinds. */
  public final int bits;
  public final boolean signed;

  LiteralKind(@Nullable String keyword, int bits, boolean signed) {
    this.keyword = keyword;
    this.bits = bits;
    this.signed = signed;
  }

  /** Returns whether this kind denotes a type (as opposed to a value). */
  public boolean isType() {
    return keyword != null;
  }

  /** Returns whether this kind is a sized integral type, e.g. "s16". */
  public boolean isIntegralType() {
    return bits > 0;
  }

  /**
   * Returns whether an unsigned 64-bit value fits in this integral type.
   *
   * <p>Literals are never negative, so for a signed type the largest value is
   * {@code 2^(bits - 1) - 1}.
   */
  public boolean fits(long value) {
    final int valueBits = signed ? bits - 1 : bits;
    if (valueBits >= 64) {
      return true;
    }
    return Long.compareUnsigned(value, (1L << valueBits) - 1) <= 0;
  }
}

// End LiteralKind.java
