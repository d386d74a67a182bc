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

import static com.google.common.base.MoreObjects.firstNonNull;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.dependentc.ast.AstBuilder.ast;
import static net.hydromatic.dependentc.util.Static.skip;

import java.util.List;
import java.util.Objects;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether two expressions are equal up to a consistent renaming of
 * the parameters of function types and lambdas.
 *
 * <p>For example, "T[type T, T x]" and "U[type U, U y]" are alpha-equivalent.
 *
 * <p>When comparing two binders, both names are replaced by the same fresh
 * name before their scopes are compared. Struct and union field names, and
 * pack selectors, are labels as well as binders, and must be identical.
 *
 * <p>This is not the same as {@link Object#equals}, which is strict
 * structural equality.
 */
public class AlphaEquivalence {
  private final NameGenerator nameGenerator;

  private AlphaEquivalence(NameGenerator nameGenerator) {
    this.nameGenerator = requireNonNull(nameGenerator);
  }

  /** Returns whether two expressions are alpha-equivalent. Does not
   * evaluate them. */
  public static boolean equal(NameGenerator nameGenerator, Ast.Exp e0,
      Ast.Exp e1) {
    return new AlphaEquivalence(nameGenerator).equal(e0, e1);
  }

  private boolean equal(Ast.Exp e0, Ast.Exp e1) {
    if (e0 == e1) {
      return true;
    }
    if (e0.op != e1.op) {
      return false;
    }
    switch (e0.op) {
    case LITERAL:
    case ID:
      return e0.equals(e1);

    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
    case PLUS:
    case MINUS:
    case AND_THEN:
      final Ast.BinOp binOp0 = (Ast.BinOp) e0;
      final Ast.BinOp binOp1 = (Ast.BinOp) e1;
      return equal(binOp0.a0, binOp1.a0)
          && equal(binOp0.a1, binOp1.a1);

    case IF:
      final Ast.If if0 = (Ast.If) e0;
      final Ast.If if1 = (Ast.If) e1;
      return equal(if0.condition, if1.condition)
          && equal(if0.ifTrue, if1.ifTrue)
          && equal(if0.ifFalse, if1.ifFalse);

    case FUNC_TYPE:
      final Ast.FuncType funcType0 = (Ast.FuncType) e0;
      final Ast.FuncType funcType1 = (Ast.FuncType) e1;
      return equalTelescopes(funcType0.params, funcType0.returnType,
          funcType1.params, funcType1.returnType);

    case LAMBDA:
      final Ast.Lambda lambda0 = (Ast.Lambda) e0;
      final Ast.Lambda lambda1 = (Ast.Lambda) e1;
      return equalTelescopes(lambda0.params, lambda0.body,
          lambda1.params, lambda1.body);

    case CALL:
      final Ast.Call call0 = (Ast.Call) e0;
      final Ast.Call call1 = (Ast.Call) e1;
      return equal(call0.fn, call1.fn)
          && equalLists(call0.args, call1.args);

    case STRUCT:
    case UNION:
      final Ast.RecordType record0 = (Ast.RecordType) e0;
      final Ast.RecordType record1 = (Ast.RecordType) e1;
      if (record0.fields.size() != record1.fields.size()) {
        return false;
      }
      for (int i = 0; i < record0.fields.size(); i++) {
        final Ast.Param field0 = record0.fields.get(i);
        final Ast.Param field1 = record1.fields.get(i);
        if (!field0.name().equals(field1.name())
            || !equal(field0.type, field1.type)) {
          return false;
        }
      }
      return true;

    case PACK:
      final Ast.Pack pack0 = (Ast.Pack) e0;
      final Ast.Pack pack1 = (Ast.Pack) e1;
      if (!equal(pack0.type, pack1.type)
          || pack0.assigns.size() != pack1.assigns.size()) {
        return false;
      }
      for (int i = 0; i < pack0.assigns.size(); i++) {
        final Ast.Assign assign0 = pack0.assigns.get(i);
        final Ast.Assign assign1 = pack1.assigns.get(i);
        if (!assign0.field.equals(assign1.field)
            || !equal(assign0.value, assign1.value)) {
          return false;
        }
      }
      return true;

    case MEMBER:
      final Ast.Member member0 = (Ast.Member) e0;
      final Ast.Member member1 = (Ast.Member) e1;
      return member0.field.equals(member1.field)
          && equal(member0.record, member1.record);

    case POINTER:
    case REFERENCE:
    case DEREFERENCE:
      return equal(((Ast.PointerExp) e0).exp, ((Ast.PointerExp) e1).exp);

    default:
      throw new AssertionError("unexpected " + e0.op);
    }
  }

  private boolean equalLists(List<Ast.Exp> list0, List<Ast.Exp> list1) {
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (!equal(list0.get(i), list1.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Compares two telescopes, each followed by an expression in the scope
   * of all of its names. */
  private boolean equalTelescopes(List<Ast.Param> params0, Ast.Exp scope0,
      List<Ast.Param> params1, Ast.Exp scope1) {
    if (params0.size() != params1.size()) {
      return false;
    }
    if (params0.isEmpty()) {
      return equal(scope0, scope1);
    }
    final Ast.Param param0 = params0.get(0);
    final Ast.Param param1 = params1.get(0);
    if (!equal(param0.type, param1.type)) {
      return false;
    }

    // Wrap the rest of each telescope in a function type, so that a
    // substitution renames the rest of the parameters and the scope together.
    Ast.FuncType rest0 =
        ast.funcType(scope0.pos, scope0, skip(params0, 1));
    Ast.FuncType rest1 =
        ast.funcType(scope1.pos, scope1, skip(params1, 1));
    if (!Objects.equals(param0.name, param1.name)) {
      final Symbol fresh =
          nameGenerator.fresh(firstNonNull(param0.name, param1.name));
      rest0 = rename(rest0, param0.name, fresh);
      rest1 = rename(rest1, param1.name, fresh);
    }
    return equalTelescopes(rest0.params, rest0.returnType,
        rest1.params, rest1.returnType);
  }

  private Ast.FuncType rename(Ast.FuncType funcType, @Nullable Symbol from,
      Symbol to) {
    if (from == null) {
      return funcType;
    }
    return (Ast.FuncType)
        Substituter.rename(nameGenerator, funcType, from, to);
  }
}

// End AlphaEquivalence.java
