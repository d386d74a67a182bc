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

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.AstNode;
import net.hydromatic.dependentc.ast.Symbol;
import net.hydromatic.dependentc.ast.Visitor;

/**
 * Finds free variables in an expression, statement, block or declaration.
 *
 * <p>Scoping rules:
 *
 * <ul>
 *   <li>The parameters of a function type, lambda and function declaration
 *       form a telescope: the type of each parameter sees the names of the
 *       parameters before it, and the return type and body see all of them.
 *   <li>The fields of a struct form a telescope; the fields of a union do
 *       not.
 *   <li>The field names of a pack are selectors, and bind nothing.
 *   <li>A declaration in a block binds its name in the following statements
 *       of the block, but not in its own type or initializer.
 * </ul>
 */
public class FreeFinder extends Visitor {
  private final ImmutableSet<Symbol> bound;
  private final Consumer<Symbol> consumer;

  private FreeFinder(ImmutableSet<Symbol> bound, Consumer<Symbol> consumer) {
    this.bound = bound;
    this.consumer = consumer;
  }

  /** Returns the free variables of a node, in order of first occurrence. */
  public static Set<Symbol> freeVars(AstNode node) {
    final ImmutableSet.Builder<Symbol> set = ImmutableSet.builder();
    node.accept(new FreeFinder(ImmutableSet.of(), set::add));
    return set.build();
  }

  /** Returns the free variables of a telescope of parameters and the nodes
   * that are in the scope of all of its names. */
  public static Set<Symbol> freeVars(List<Ast.Param> params,
      List<? extends AstNode> scope) {
    final ImmutableSet.Builder<Symbol> set = ImmutableSet.builder();
    final FreeFinder v =
        new FreeFinder(ImmutableSet.of(), set::add).visitTelescope(params);
    scope.forEach(node -> node.accept(v));
    return set.build();
  }

  /** Returns whether a name occurs free in a node. */
  public static boolean isFree(Symbol name, AstNode node) {
    return freeVars(node).contains(name);
  }

  /** Creates a finder the same as this but with one more bound name. */
  private FreeFinder push(Symbol name) {
    if (bound.contains(name)) {
      return this;
    }
    return new FreeFinder(
        ImmutableSet.<Symbol>builder().addAll(bound).add(name).build(),
        consumer);
  }

  /** Visits the types of a telescope, and returns a finder in which all of
   * its names are bound. */
  private FreeFinder visitTelescope(List<Ast.Param> params) {
    FreeFinder v = this;
    for (Ast.Param param : params) {
      param.type.accept(v);
      if (param.name != null) {
        v = v.push(param.name);
      }
    }
    return v;
  }

  @Override protected void visit(Ast.Id id) {
    if (!bound.contains(id.name)) {
      consumer.accept(id.name);
    }
  }

  @Override protected void visit(Ast.FuncType funcType) {
    funcType.returnType.accept(visitTelescope(funcType.params));
  }

  @Override protected void visit(Ast.Lambda lambda) {
    lambda.body.accept(visitTelescope(lambda.params));
  }

  @Override protected void visit(Ast.Struct struct) {
    visitTelescope(struct.fields);
  }

  @Override protected void visit(Ast.Block block) {
    FreeFinder v = this;
    for (Ast.Statement statement : block.statements) {
      statement.accept(v);
      if (statement instanceof Ast.Decl) {
        v = v.push(((Ast.Decl) statement).name);
      }
    }
  }

  @Override protected void visit(Ast.FuncDecl funcDecl) {
    final FreeFinder v = visitTelescope(funcDecl.params);
    funcDecl.returnType.accept(v);
    funcDecl.body.accept(v);
  }
}

// End FreeFinder.java
