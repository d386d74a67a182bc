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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a type literal, e.g. {@code u32} or {@code type}. */
  public Ast.Literal literal(Pos pos, LiteralKind kind) {
    checkArgument(kind.isType(), "not a type: %s", kind);
    return new Ast.Literal(pos, kind, null);
  }

  /** Creates an integral literal. The value is treated as unsigned. */
  public Ast.Literal integral(Pos pos, long value) {
    return new Ast.Literal(pos, LiteralKind.INTEGRAL, value);
  }

  /** Creates a {@code bool} literal. */
  public Ast.Literal bool(Pos pos, boolean value) {
    return new Ast.Literal(pos, LiteralKind.BOOLEAN, value);
  }

  public Ast.Id id(Pos pos, Symbol name) {
    return new Ast.Id(pos, name);
  }

  public Ast.BinOp binOp(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.BinOp(pos, op, a0, a1);
  }

  public Ast.If ifThenElse(Pos pos, Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  /** Creates a parameter or field. */
  public Ast.Param param(Ast.Exp type, @Nullable Symbol name) {
    return new Ast.Param(type, name);
  }

  public Ast.FuncType funcType(Pos pos, Ast.Exp returnType,
      List<Ast.Param> params) {
    return new Ast.FuncType(pos, returnType, ImmutableList.copyOf(params));
  }

  public Ast.Lambda lambda(Pos pos, List<Ast.Param> params, Ast.Exp body) {
    return new Ast.Lambda(pos, ImmutableList.copyOf(params), body);
  }

  public Ast.Call call(Pos pos, Ast.Exp fn, List<? extends Ast.Exp> args) {
    return new Ast.Call(pos, fn, ImmutableList.copyOf(args));
  }

  public Ast.Struct struct(Pos pos, List<Ast.Param> fields) {
    return new Ast.Struct(pos, ImmutableList.copyOf(fields));
  }

  public Ast.Union union(Pos pos, List<Ast.Param> fields) {
    return new Ast.Union(pos, ImmutableList.copyOf(fields));
  }

  /** Creates an assignment to a field within a pack. */
  public Ast.Assign assign(Symbol field, Ast.Exp value) {
    return new Ast.Assign(field, value);
  }

  public Ast.Pack pack(Pos pos, Ast.Exp type, List<Ast.Assign> assigns) {
    return new Ast.Pack(pos, type, ImmutableList.copyOf(assigns));
  }

  public Ast.Member member(Pos pos, Ast.Exp record, Symbol field) {
    return new Ast.Member(pos, record, field);
  }

  /** Creates a pointer type, "T*". */
  public Ast.PointerExp pointer(Pos pos, Ast.Exp type) {
    return new Ast.PointerExp(pos, Op.POINTER, type);
  }

  /** Creates a reference, "&amp;e". */
  public Ast.PointerExp reference(Pos pos, Ast.Exp exp) {
    return new Ast.PointerExp(pos, Op.REFERENCE, exp);
  }

  /** Creates a dereference, "*e". */
  public Ast.PointerExp dereference(Pos pos, Ast.Exp exp) {
    return new Ast.PointerExp(pos, Op.DEREFERENCE, exp);
  }

  public Ast.PointerExp pointerExp(Pos pos, Op op, Ast.Exp exp) {
    return new Ast.PointerExp(pos, op, exp);
  }

  // statements

  public Ast.EmptyStatement emptyStatement(Pos pos) {
    return new Ast.EmptyStatement(pos);
  }

  public Ast.ExpStatement expStatement(Pos pos, Ast.Exp exp) {
    return new Ast.ExpStatement(pos, Op.EXP_STATEMENT, exp);
  }

  public Ast.ExpStatement returnStatement(Pos pos, Ast.Exp exp) {
    return new Ast.ExpStatement(pos, Op.RETURN, exp);
  }

  public Ast.ExpStatement expStatement(Pos pos, Op op, Ast.Exp exp) {
    return new Ast.ExpStatement(pos, op, exp);
  }

  public Ast.BlockStatement blockStatement(Pos pos, Ast.Block block) {
    return new Ast.BlockStatement(pos, block);
  }

  public Ast.Decl decl(Pos pos, Ast.Exp type, Symbol name,
      Ast.@Nullable Exp initializer) {
    return new Ast.Decl(pos, type, name, initializer);
  }

  public Ast.IfStatement ifStatement(Pos pos, List<Ast.Exp> conditions,
      List<Ast.Block> thens, Ast.Block orElse) {
    return new Ast.IfStatement(pos, ImmutableList.copyOf(conditions),
        ImmutableList.copyOf(thens), orElse);
  }

  public Ast.Block block(Pos pos, List<? extends Ast.Statement> statements) {
    return new Ast.Block(pos, ImmutableList.copyOf(statements));
  }

  // top-level

  public Ast.FuncDecl funcDecl(Pos pos, Symbol name, Ast.Exp returnType,
      List<Ast.Param> params, Ast.Block body) {
    return new Ast.FuncDecl(pos, name, returnType,
        ImmutableList.copyOf(params), body);
  }

  public Ast.TranslationUnit translationUnit(Pos pos,
      List<? extends Ast.TopLevel> topLevels) {
    return new Ast.TranslationUnit(pos, ImmutableList.copyOf(topLevels));
  }
}

// End AstBuilder.java
