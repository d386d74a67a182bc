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
import static net.hydromatic.dependentc.ast.AstBuilder.ast;
import static net.hydromatic.dependentc.util.Static.skip;
import static net.hydromatic.dependentc.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.AstNode;
import net.hydromatic.dependentc.ast.Pos;
import net.hydromatic.dependentc.ast.Shuttle;
import net.hydromatic.dependentc.ast.Symbol;

/**
 * Replaces the free occurrences of a name with an expression, without
 * capturing the free variables of that expression.
 *
 * <p>When the substitution passes a binder, there are three cases. If the
 * binder binds the name being replaced, the name is shadowed, and nothing in
 * the binder's scope is affected. If the binder binds a name that is free in
 * the replacement, and the replacement would be placed in its scope, the
 * binder is first renamed to a fresh name. Otherwise the substitution
 * continues into the scope.
 *
 * <p>Struct fields are binders but also labels, so they cannot be renamed; if
 * a struct field would capture, {@link TypeException.Kind#UNAVOIDABLE_CAPTURE}
 * is thrown. Union fields and pack selectors are not binders.
 *
 * <p>Nodes that contain no free occurrence of the name are returned
 * unchanged, not copied.
 */
public class Substituter extends Shuttle {
  private final NameGenerator nameGenerator;
  private final Symbol name;
  private final Ast.Exp replacement;
  private final Set<Symbol> replacementFreeVars;

  private Substituter(NameGenerator nameGenerator, Symbol name,
      Ast.Exp replacement) {
    this.nameGenerator = requireNonNull(nameGenerator);
    this.name = requireNonNull(name);
    this.replacement = requireNonNull(replacement);
    this.replacementFreeVars = FreeFinder.freeVars(replacement);
  }

  /** Substitutes {@code replacement} for {@code name} in an expression. */
  public static Ast.Exp substitute(NameGenerator nameGenerator, Ast.Exp exp,
      Symbol name, Ast.Exp replacement) {
    if (!FreeFinder.isFree(name, exp)) {
      return exp;
    }
    return exp.accept(new Substituter(nameGenerator, name, replacement));
  }

  /** Substitutes {@code replacement} for {@code name} in a statement. */
  public static Ast.Statement substitute(NameGenerator nameGenerator,
      Ast.Statement statement, Symbol name, Ast.Exp replacement) {
    if (!FreeFinder.isFree(name, statement)) {
      return statement;
    }
    return statement.accept(
        new Substituter(nameGenerator, name, replacement));
  }

  /** Substitutes {@code replacement} for {@code name} in a block. */
  public static Ast.Block substitute(NameGenerator nameGenerator,
      Ast.Block block, Symbol name, Ast.Exp replacement) {
    if (!FreeFinder.isFree(name, block)) {
      return block;
    }
    return block.accept(new Substituter(nameGenerator, name, replacement));
  }

  /** Renames the free occurrences of {@code from} in an expression to
   * {@code to}. */
  public static Ast.Exp rename(NameGenerator nameGenerator, Ast.Exp exp,
      Symbol from, Symbol to) {
    return substitute(nameGenerator, exp, from, ast.id(exp.pos, to));
  }

  /** Renames the free occurrences of {@code from} to {@code to} in a
   * telescope and in the nodes that are in the scope of all of its names.
   * {@code to} must be fresh. */
  static Telescope rename(NameGenerator nameGenerator,
      List<Ast.Param> params, List<AstNode> scope, Symbol from, Symbol to) {
    return new Substituter(nameGenerator, from, ast.id(Pos.ZERO, to))
        .visitTelescope(params, scope);
  }

  @Override protected Ast.Exp visit(Ast.Id id) {
    return id.name.equals(name) ? replacement : id;
  }

  @Override protected Ast.Exp visit(Ast.FuncType funcType) {
    final Telescope t =
        visitTelescope(funcType.params,
            ImmutableList.<AstNode>of(funcType.returnType));
    return funcType.copy((Ast.Exp) t.scope.get(0), t.params);
  }

  @Override protected Ast.Exp visit(Ast.Lambda lambda) {
    final Telescope t =
        visitTelescope(lambda.params, ImmutableList.<AstNode>of(lambda.body));
    return lambda.copy(t.params, (Ast.Exp) t.scope.get(0));
  }

  @Override protected Ast.Exp visit(Ast.Struct struct) {
    final List<Ast.Param> fields = new ArrayList<>();
    for (int i = 0; i < struct.fields.size(); i++) {
      final Ast.Param field = struct.fields.get(i);
      final List<Ast.Param> rest = skip(struct.fields, i + 1);
      fields.add(field.copy(field.type.accept(this)));
      if (field.name().equals(name)) {
        fields.addAll(rest);
        break;
      }
      if (replacementFreeVars.contains(field.name())
          && FreeFinder.freeVars(rest, ImmutableList.of()).contains(name)) {
        throw TypeException.unavoidableCapture(struct, field.name());
      }
    }
    return struct.copy(fields);
  }

  @Override protected Ast.Block visit(Ast.Block block) {
    List<Ast.Statement> statements = block.statements;
    final List<Ast.Statement> newStatements = new ArrayList<>();
    for (int i = 0; i < statements.size(); i++) {
      final Ast.Statement statement = statements.get(i);
      newStatements.add(statement.accept(this));
      if (!(statement instanceof Ast.Decl)) {
        continue;
      }
      final Symbol declName = ((Ast.Decl) statement).name;
      final Ast.Block rest = ast.block(block.pos, skip(statements, i + 1));
      if (declName.equals(name)) {
        // Shadowed for the rest of the block.
        newStatements.addAll(rest.statements);
        break;
      }
      if (replacementFreeVars.contains(declName)
          && FreeFinder.isFree(name, rest)) {
        final Symbol fresh = nameGenerator.fresh(declName);
        final Ast.Block renamed =
            rest.accept(
                new Substituter(nameGenerator, declName,
                    ast.id(statement.pos, fresh)));
        final Ast.Decl decl = (Ast.Decl) newStatements.get(i);
        newStatements.set(i, decl.copy(decl.type, fresh, decl.initializer));
        statements =
            ImmutableList.<Ast.Statement>builder()
                .addAll(statements.subList(0, i + 1))
                .addAll(renamed.statements)
                .build();
      }
    }
    return block.copy(newStatements);
  }

  @Override protected Ast.TopLevel visit(Ast.FuncDecl funcDecl) {
    final Telescope t =
        visitTelescope(funcDecl.params,
            ImmutableList.<AstNode>of(funcDecl.returnType, funcDecl.body));
    return funcDecl.copy((Ast.Exp) t.scope.get(0), t.params,
        (Ast.Block) t.scope.get(1));
  }

  /** Substitutes into a telescope of parameters and the nodes in the scope
   * of all of its names, renaming parameters that would capture. */
  private Telescope visitTelescope(List<Ast.Param> params,
      List<AstNode> scope) {
    final List<Ast.Param> newParams = new ArrayList<>();
    for (int i = 0; i < params.size(); i++) {
      final Ast.Param param = params.get(i);
      newParams.add(param.copy(param.type.accept(this)));
      if (param.name == null) {
        continue;
      }
      final List<Ast.Param> rest = skip(params, i + 1);
      if (param.name.equals(name)) {
        // Shadowed for the rest of the telescope and its scope.
        newParams.addAll(rest);
        return new Telescope(newParams, scope);
      }
      if (replacementFreeVars.contains(param.name)
          && FreeFinder.freeVars(rest, scope).contains(name)) {
        final Symbol fresh = nameGenerator.fresh(param.name);
        final Substituter renamer =
            new Substituter(nameGenerator, param.name,
                ast.id(Pos.ZERO, fresh));
        final Telescope renamed = renamer.visitTelescope(rest, scope);
        newParams.set(i, newParams.get(i).rename(fresh));
        params =
            ImmutableList.<Ast.Param>builder()
                .addAll(params.subList(0, i + 1))
                .addAll(renamed.params)
                .build();
        scope = renamed.scope;
      }
    }
    return new Telescope(newParams,
        transformEager(scope, node -> node.accept(this)));
  }

  /** Parameters of a binder, and the nodes in their scope. */
  static class Telescope {
    final List<Ast.Param> params;
    final List<AstNode> scope;

    Telescope(List<Ast.Param> params, List<AstNode> scope) {
      this.params = params;
      this.scope = scope;
    }
  }
}

// End Substituter.java
