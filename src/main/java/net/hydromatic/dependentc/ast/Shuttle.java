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

import static net.hydromatic.dependentc.ast.AstBuilder.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms syntax trees.
 *
 * <p>The default implementation of each {@code visit} method transforms the
 * children of a node and calls the node's {@code copy} method; if no child
 * changed, the original node is returned. Sub-classes override the methods
 * for the nodes they wish to rewrite.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  /** Returns a deep copy of an expression. Every node in the result is a new
   * object, but the result is {@link Object#equals equal} to the original. */
  public static Ast.Exp copy(Ast.Exp exp) {
    return exp.accept(new Copier());
  }

  /** Returns a deep copy of a statement. */
  public static Ast.Statement copy(Ast.Statement statement) {
    return statement.accept(new Copier());
  }

  /** Returns a deep copy of a block. */
  public static Ast.Block copy(Ast.Block block) {
    return block.accept(new Copier());
  }

  /** Returns a deep copy of a top-level declaration. */
  public static Ast.TopLevel copy(Ast.TopLevel topLevel) {
    return topLevel.accept(new Copier());
  }

  /** Returns a deep copy of a translation unit. */
  public static Ast.TranslationUnit copy(Ast.TranslationUnit unit) {
    return unit.accept(new Copier());
  }

  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  /** Transforms the types of a list of parameters or fields. */
  protected List<Ast.Param> visitParams(List<Ast.Param> params) {
    final List<Ast.Param> list = new ArrayList<>();
    for (Ast.Param param : params) {
      list.add(param.copy(param.type.accept(this)));
    }
    return list;
  }

  /** Transforms the values of a list of assignments. */
  protected List<Ast.Assign> visitAssigns(List<Ast.Assign> assigns) {
    final List<Ast.Assign> list = new ArrayList<>();
    for (Ast.Assign assign : assigns) {
      list.add(assign.copy(assign.value.accept(this)));
    }
    return list;
  }

  // expressions

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Exp visit(Ast.Id id) {
    return id; // leaf
  }

  protected Ast.Exp visit(Ast.BinOp binOp) {
    return binOp.copy(binOp.a0.accept(this), binOp.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.If ifThenElse) {
    return ifThenElse.copy(ifThenElse.condition.accept(this),
        ifThenElse.ifTrue.accept(this),
        ifThenElse.ifFalse.accept(this));
  }

  protected Ast.Exp visit(Ast.FuncType funcType) {
    return funcType.copy(funcType.returnType.accept(this),
        visitParams(funcType.params));
  }

  protected Ast.Exp visit(Ast.Lambda lambda) {
    return lambda.copy(visitParams(lambda.params), lambda.body.accept(this));
  }

  protected Ast.Exp visit(Ast.Call call) {
    return call.copy(call.fn.accept(this), visitList(call.args));
  }

  protected Ast.Exp visit(Ast.Struct struct) {
    return struct.copy(visitParams(struct.fields));
  }

  protected Ast.Exp visit(Ast.Union union) {
    return union.copy(visitParams(union.fields));
  }

  protected Ast.Exp visit(Ast.Pack pack) {
    return pack.copy(pack.type.accept(this), visitAssigns(pack.assigns));
  }

  protected Ast.Exp visit(Ast.Member member) {
    return member.copy(member.record.accept(this));
  }

  protected Ast.Exp visit(Ast.PointerExp pointerExp) {
    return pointerExp.copy(pointerExp.exp.accept(this));
  }

  // statements

  protected Ast.Statement visit(Ast.EmptyStatement emptyStatement) {
    return emptyStatement; // leaf
  }

  protected Ast.Statement visit(Ast.ExpStatement expStatement) {
    return expStatement.copy(expStatement.exp.accept(this));
  }

  protected Ast.Statement visit(Ast.BlockStatement blockStatement) {
    return blockStatement.copy(blockStatement.block.accept(this));
  }

  protected Ast.Statement visit(Ast.Decl decl) {
    return decl.copy(decl.type.accept(this), decl.name,
        decl.initializer == null ? null : decl.initializer.accept(this));
  }

  protected Ast.Statement visit(Ast.IfStatement ifStatement) {
    return ifStatement.copy(visitList(ifStatement.conditions),
        visitList(ifStatement.thens),
        ifStatement.orElse.accept(this));
  }

  protected Ast.Block visit(Ast.Block block) {
    return block.copy(visitList(block.statements));
  }

  // top-level

  protected Ast.TopLevel visit(Ast.FuncDecl funcDecl) {
    return funcDecl.copy(funcDecl.returnType.accept(this),
        visitParams(funcDecl.params),
        funcDecl.body.accept(this));
  }

  protected Ast.TranslationUnit visit(Ast.TranslationUnit unit) {
    return unit.copy(visitList(unit.topLevels));
  }

  /** Shuttle that creates a new object for every node.
   *
   * <p>Only the leaves and the nodes whose children may all be empty lists
   * need overriding; {@code copy} rebuilds any node that has a new child. */
  private static class Copier extends Shuttle {
    @Override protected Ast.Exp visit(Ast.Literal literal) {
      return literal.kind == LiteralKind.INTEGRAL
          ? ast.integral(literal.pos, literal.longValue())
          : literal.kind == LiteralKind.BOOLEAN
          ? ast.bool(literal.pos, literal.booleanValue())
          : ast.literal(literal.pos, literal.kind);
    }

    @Override protected Ast.Exp visit(Ast.Id id) {
      return ast.id(id.pos, id.name);
    }

    @Override protected Ast.Exp visit(Ast.Struct struct) {
      return ast.struct(struct.pos, visitParams(struct.fields));
    }

    @Override protected Ast.Exp visit(Ast.Union union) {
      return ast.union(union.pos, visitParams(union.fields));
    }

    @Override protected Ast.Statement visit(
        Ast.EmptyStatement emptyStatement) {
      return ast.emptyStatement(emptyStatement.pos);
    }

    @Override protected Ast.Block visit(Ast.Block block) {
      return ast.block(block.pos, visitList(block.statements));
    }

    @Override protected Ast.TranslationUnit visit(Ast.TranslationUnit unit) {
      return ast.translationUnit(unit.pos, visitList(unit.topLevels));
    }
  }
}

// End Shuttle.java
