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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  /** Visits the types of a list of parameters or fields. */
  protected void visitParams(Iterable<Ast.Param> params) {
    params.forEach(p -> p.type.accept(this));
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.BinOp binOp) {
    binOp.a0.accept(this);
    binOp.a1.accept(this);
  }

  protected void visit(Ast.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Ast.FuncType funcType) {
    visitParams(funcType.params);
    funcType.returnType.accept(this);
  }

  protected void visit(Ast.Lambda lambda) {
    visitParams(lambda.params);
    lambda.body.accept(this);
  }

  protected void visit(Ast.Call call) {
    call.fn.accept(this);
    call.args.forEach(this::accept);
  }

  protected void visit(Ast.Struct struct) {
    visitParams(struct.fields);
  }

  protected void visit(Ast.Union union) {
    visitParams(union.fields);
  }

  protected void visit(Ast.Pack pack) {
    pack.type.accept(this);
    pack.assigns.forEach(a -> a.value.accept(this));
  }

  protected void visit(Ast.Member member) {
    member.record.accept(this);
  }

  protected void visit(Ast.PointerExp pointerExp) {
    pointerExp.exp.accept(this);
  }

  // statements

  protected void visit(Ast.EmptyStatement emptyStatement) {}

  protected void visit(Ast.ExpStatement expStatement) {
    expStatement.exp.accept(this);
  }

  protected void visit(Ast.BlockStatement blockStatement) {
    blockStatement.block.accept(this);
  }

  protected void visit(Ast.Decl decl) {
    decl.type.accept(this);
    if (decl.initializer != null) {
      decl.initializer.accept(this);
    }
  }

  protected void visit(Ast.IfStatement ifStatement) {
    ifStatement.conditions.forEach(this::accept);
    ifStatement.thens.forEach(this::accept);
    ifStatement.orElse.accept(this);
  }

  protected void visit(Ast.Block block) {
    block.statements.forEach(this::accept);
  }

  // top-level

  protected void visit(Ast.FuncDecl funcDecl) {
    visitParams(funcDecl.params);
    funcDecl.returnType.accept(this);
    funcDecl.body.accept(this);
  }

  protected void visit(Ast.TranslationUnit unit) {
    unit.topLevels.forEach(this::accept);
  }
}

// End Visitor.java
