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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.AstNode;
import net.hydromatic.dependentc.ast.Pos;
import net.hydromatic.dependentc.ast.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Error while ordering, checking or evaluating a program.
 *
 * <p>Each exception has a {@link Kind}, and, depending on the kind, the node
 * where the error was detected, the expected and actual types, and the names
 * involved.
 */
public class TypeException extends CompileException {
  public final Kind kind;
  public final @Nullable AstNode node;
  public final Ast.@Nullable Exp expected;
  public final Ast.@Nullable Exp actual;
  public final ImmutableList<Symbol> names;

  private TypeException(Kind kind, String message, Pos pos,
      @Nullable AstNode node, Ast.@Nullable Exp expected,
      Ast.@Nullable Exp actual, List<Symbol> names) {
    super(message, pos);
    this.kind = requireNonNull(kind);
    this.node = node;
    this.expected = expected;
    this.actual = actual;
    this.names = ImmutableList.copyOf(names);
  }

  private static TypeException of(Kind kind, AstNode node, String message) {
    return new TypeException(kind, message, node.pos, node, null, null,
        ImmutableList.of());
  }

  static TypeException unboundName(Ast.Id id) {
    return new TypeException(Kind.UNBOUND_NAME,
        "unbound name '" + id.name + "'", id.pos, id, null, null,
        ImmutableList.of(id.name));
  }

  static TypeException arityMismatch(AstNode node, int expected,
      int actual) {
    return of(Kind.ARITY_MISMATCH, node,
        "expected " + expected + " arguments but got " + actual);
  }

  static TypeException typeMismatch(AstNode node, Ast.Exp expected,
      Ast.Exp actual) {
    return new TypeException(Kind.TYPE_MISMATCH,
        "type mismatch: expected '" + expected + "' but got '" + actual
            + "' in '" + node + "'",
        node.pos, node, expected, actual, ImmutableList.of());
  }

  static TypeException notAFunctionType(AstNode node, Ast.Exp actual) {
    return new TypeException(Kind.NOT_A_FUNCTION_TYPE,
        "'" + node + "' has type '" + actual + "', which is not a function"
            + " type",
        node.pos, node, null, actual, ImmutableList.of());
  }

  static TypeException notARecordType(AstNode node, Ast.Exp actual) {
    return new TypeException(Kind.NOT_A_RECORD_TYPE,
        "'" + actual + "' is not a struct or union type", node.pos, node,
        null, actual, ImmutableList.of());
  }

  static TypeException notAPointerType(AstNode node, Ast.Exp actual) {
    return new TypeException(Kind.NOT_A_POINTER_TYPE,
        "'" + node + "' has type '" + actual + "', which is not a pointer"
            + " type",
        node.pos, node, null, actual, ImmutableList.of());
  }

  static TypeException unknownField(AstNode node, Symbol field,
      Ast.Exp type) {
    return new TypeException(Kind.UNKNOWN_FIELD,
        "no field '" + field + "' in '" + type + "'", node.pos, node, null,
        type, ImmutableList.of(field));
  }

  static TypeException duplicateField(AstNode node, Symbol field) {
    return new TypeException(Kind.DUPLICATE_FIELD,
        "duplicate field '" + field + "' in '" + node + "'", node.pos, node,
        null, null, ImmutableList.of(field));
  }

  static TypeException incompletePack(Ast.Pack pack, String reason) {
    return of(Kind.INCOMPLETE_OR_EXTRA_PACK_ASSIGNMENT, pack,
        reason + " in '" + pack + "'");
  }

  static TypeException inactiveUnionMember(Ast.Member member,
      Symbol active) {
    return new TypeException(Kind.INACTIVE_UNION_MEMBER,
        "field '" + member.field + "' is not the active member of the union;"
            + " active member is '" + active + "'",
        member.pos, member, null, null,
        ImmutableList.of(member.field, active));
  }

  static TypeException cyclicSignatureDependency(Pos pos,
      List<Symbol> names) {
    return new TypeException(Kind.CYCLIC_SIGNATURE_DEPENDENCY,
        "cyclic dependency between signatures of " + names, pos, null, null,
        null, names);
  }

  static TypeException duplicateDeclaration(Ast.TopLevel topLevel) {
    return new TypeException(Kind.DUPLICATE_DECLARATION,
        "duplicate declaration '" + topLevel.name + "'", topLevel.pos,
        topLevel, null, null, ImmutableList.of(topLevel.name));
  }

  static TypeException unavoidableCapture(AstNode node, Symbol field) {
    return new TypeException(Kind.UNAVOIDABLE_CAPTURE,
        "cannot substitute into '" + node + "' without capturing field '"
            + field + "'",
        node.pos, node, null, null, ImmutableList.of(field));
  }

  static TypeException evaluationLimit(AstNode node, int limit) {
    return of(Kind.EVALUATION_LIMIT, node,
        "evaluation of '" + node + "' exceeded " + limit + " steps");
  }

  /** Kind of error. */
  public enum Kind {
    /** Identifier is not bound in the environment. */
    UNBOUND_NAME,
    /** Call has a different number of arguments than the function. */
    ARITY_MISMATCH,
    /** Expression's type is not equal to the type required by context. */
    TYPE_MISMATCH,
    /** Called expression does not have a function type. */
    NOT_A_FUNCTION_TYPE,
    /** Pack or member expression does not target a struct or union. */
    NOT_A_RECORD_TYPE,
    /** Dereferenced expression does not have a pointer type. */
    NOT_A_POINTER_TYPE,
    UNKNOWN_FIELD,
    /** Two fields, parameters or assignments have the same name. */
    DUPLICATE_FIELD,
    /** Pack does not assign the fields its type requires, in order. */
    INCOMPLETE_OR_EXTRA_PACK_ASSIGNMENT,
    /** Member expression reads an alternative that its union value does not
     * hold. */
    INACTIVE_UNION_MEMBER,
    CYCLIC_SIGNATURE_DEPENDENCY,
    DUPLICATE_DECLARATION,
    /** Substitution into a struct type would capture a free variable of the
     * replacement by a field name. */
    UNAVOIDABLE_CAPTURE,
    EVALUATION_LIMIT
  }
}

// End TypeException.java
