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

import static net.hydromatic.dependentc.Matchers.assertFails;
import static net.hydromatic.dependentc.Matchers.isAst;
import static net.hydromatic.dependentc.Trees.BOOL;
import static net.hydromatic.dependentc.Trees.S8;
import static net.hydromatic.dependentc.Trees.TYPE;
import static net.hydromatic.dependentc.Trees.U32;
import static net.hydromatic.dependentc.Trees.U64;
import static net.hydromatic.dependentc.Trees.U8;
import static net.hydromatic.dependentc.Trees.VOID;
import static net.hydromatic.dependentc.Trees.assign;
import static net.hydromatic.dependentc.Trees.binOp;
import static net.hydromatic.dependentc.Trees.block;
import static net.hydromatic.dependentc.Trees.blockStatement;
import static net.hydromatic.dependentc.Trees.bool;
import static net.hydromatic.dependentc.Trees.call;
import static net.hydromatic.dependentc.Trees.decl;
import static net.hydromatic.dependentc.Trees.dereference;
import static net.hydromatic.dependentc.Trees.expStatement;
import static net.hydromatic.dependentc.Trees.funcDecl;
import static net.hydromatic.dependentc.Trees.funcType;
import static net.hydromatic.dependentc.Trees.id;
import static net.hydromatic.dependentc.Trees.ifStatement;
import static net.hydromatic.dependentc.Trees.ifThenElse;
import static net.hydromatic.dependentc.Trees.integral;
import static net.hydromatic.dependentc.Trees.lambda;
import static net.hydromatic.dependentc.Trees.member;
import static net.hydromatic.dependentc.Trees.pack;
import static net.hydromatic.dependentc.Trees.param;
import static net.hydromatic.dependentc.Trees.params;
import static net.hydromatic.dependentc.Trees.pointer;
import static net.hydromatic.dependentc.Trees.reference;
import static net.hydromatic.dependentc.Trees.ret;
import static net.hydromatic.dependentc.Trees.struct;
import static net.hydromatic.dependentc.Trees.sym;
import static net.hydromatic.dependentc.Trees.union;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeChecker}. */
public class TypeCheckerTest {
  private final TypeChecker checker =
      new TypeChecker(new NameGenerator(), ImmutableMap.of());

  private static final Environment EMPTY = Environments.empty();

  /** "struct { type T; T v; }". */
  private static final Ast.Struct DEPENDENT_PAIR =
      struct(param(TYPE, "T"), param(id("T"), "v"));

  /** "struct { u32 a; u32 b; }". */
  private static final Ast.Struct PAIR =
      struct(param(U32, "a"), param(U32, "b"));

  /** "union { u32 a; bool b; }". */
  private static final Ast.Union EITHER =
      union(param(U32, "a"), param(BOOL, "b"));

  /** "T[type T, T x]", the type of the polymorphic identity function. */
  private static final Ast.FuncType ID_TYPE =
      funcType(id("T"), param(TYPE, "T"), param(id("T"), "x"));

  private Ast.Exp infer(Environment env, Ast.Exp exp) {
    return checker.typeInfer(env, exp);
  }

  private Ast.Exp infer(Ast.Exp exp) {
    return infer(EMPTY, exp);
  }

  @Test void testLiterals() {
    assertThat(infer(U32), is(TYPE));
    assertThat(infer(TYPE), is(TYPE));
    assertThat(infer(integral(5)), is(U64));
    assertThat(infer(bool(true)), is(BOOL));
  }

  @Test void testUnboundName() {
    final TypeException e =
        assertFails(TypeException.Kind.UNBOUND_NAME, () -> infer(id("x")));
    assertThat(e.names, contains(sym("x")));
    assertThat(e.node, is(id("x")));
  }

  @Test void testIntegralRange() {
    checker.typeCheck(EMPTY, integral(255), U8);
    checker.typeCheck(EMPTY, integral(127), S8);
    checker.typeCheck(EMPTY, integral(-1L), U64);
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheck(EMPTY, integral(256), U8));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheck(EMPTY, integral(128), S8));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheck(EMPTY, integral(1), BOOL));
  }

  /** The type of a field may depend on the value of an earlier field. */
  @Test void testDependentProjectionOfPack() {
    final Ast.Pack p =
        pack(DEPENDENT_PAIR, assign("T", U32), assign("v", integral(5)));
    assertThat(infer(p), is(DEPENDENT_PAIR));
    assertThat(infer(member(p, "T")), is(TYPE));
    assertThat(infer(member(p, "v")), is(U32));

    final Ast.Pack bad =
        pack(DEPENDENT_PAIR, assign("T", BOOL), assign("v", integral(5)));
    assertFails(TypeException.Kind.TYPE_MISMATCH, () -> infer(bad));
  }

  @Test void testDependentProjectionOfVariable() {
    final Environment env = EMPTY.bind(sym("r"), DEPENDENT_PAIR);
    assertThat(infer(env, member(id("r"), "v")), isAst("r.T"));
    assertThat(infer(env, member(id("r"), "T")), is(TYPE));

    // The record's name is the same as a field name
    final Environment env2 = EMPTY.bind(sym("T"), DEPENDENT_PAIR);
    assertThat(infer(env2, member(id("T"), "v")), isAst("T.T"));
  }

  @Test void testStructPack() {
    assertThat(infer(pack(PAIR, assign("a", integral(1)),
            assign("b", integral(2)))),
        is(PAIR));
    assertFails(TypeException.Kind.INCOMPLETE_OR_EXTRA_PACK_ASSIGNMENT,
        () -> infer(pack(PAIR, assign("a", integral(1)))));
    assertFails(TypeException.Kind.INCOMPLETE_OR_EXTRA_PACK_ASSIGNMENT,
        () -> infer(
            pack(PAIR, assign("b", integral(2)), assign("a", integral(1)))));
    assertFails(TypeException.Kind.UNKNOWN_FIELD,
        () -> infer(
            pack(PAIR, assign("a", integral(1)), assign("c", integral(2)))));
    assertFails(TypeException.Kind.DUPLICATE_FIELD,
        () -> infer(
            pack(PAIR, assign("a", integral(1)), assign("a", integral(2)))));
    assertFails(TypeException.Kind.NOT_A_RECORD_TYPE,
        () -> infer(pack(U32, assign("a", integral(1)))));
  }

  @Test void testUnionPack() {
    assertThat(infer(pack(EITHER, assign("b", bool(true)))), is(EITHER));
    assertFails(TypeException.Kind.INCOMPLETE_OR_EXTRA_PACK_ASSIGNMENT,
        () -> infer(
            pack(EITHER, assign("a", integral(1)), assign("b", bool(true)))));
    assertFails(TypeException.Kind.INCOMPLETE_OR_EXTRA_PACK_ASSIGNMENT,
        () -> infer(pack(EITHER)));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> infer(pack(EITHER, assign("b", integral(1)))));
  }

  @Test void testCheckPack() {
    final Ast.Pack p =
        pack(PAIR, assign("a", integral(1)), assign("b", integral(2)));
    checker.typeCheck(EMPTY, p, PAIR);
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheck(EMPTY, p, struct(param(U32, "a"))));
  }

  @Test void testUnionMember() {
    final Ast.Pack p = pack(EITHER, assign("a", integral(1)));
    assertThat(infer(member(p, "a")), is(U32));
    final TypeException e =
        assertFails(TypeException.Kind.INACTIVE_UNION_MEMBER,
            () -> infer(member(p, "b")));
    assertThat(e.names, contains(sym("b"), sym("a")));

    // If the active member is not known, any member may be read
    final Environment env = EMPTY.bind(sym("u"), EITHER);
    assertThat(infer(env, member(id("u"), "b")), is(BOOL));
  }

  @Test void testMemberErrors() {
    final Environment env =
        EMPTY.bind(sym("x"), U32).bind(sym("r"), PAIR);
    assertFails(TypeException.Kind.NOT_A_RECORD_TYPE,
        () -> infer(env, member(id("x"), "a")));
    assertFails(TypeException.Kind.UNKNOWN_FIELD,
        () -> infer(env, member(id("r"), "z")));
    assertThat(infer(env, member(id("r"), "b")), is(U32));
  }

  @Test void testCall() {
    final Environment env =
        EMPTY.bind(sym("id"), ID_TYPE).bind(sym("x"), U32);
    assertThat(infer(env, call(id("id"), U32, integral(5))), is(U32));
    assertThat(infer(env, call(id("id"), BOOL, bool(false))), is(BOOL));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> infer(env, call(id("id"), U32, bool(true))));
    assertFails(TypeException.Kind.ARITY_MISMATCH,
        () -> infer(env, call(id("id"), U32)));
    assertFails(TypeException.Kind.NOT_A_FUNCTION_TYPE,
        () -> infer(env, call(id("x"), integral(1))));
  }

  @Test void testCallLambda() {
    final Ast.Exp fn =
        lambda(params(param(TYPE, "T"), param(id("T"), "x")), id("T"));
    assertThat(infer(call(fn, U32, integral(5))), is(TYPE));

    final Ast.Exp identity =
        lambda(params(param(TYPE, "T"), param(id("T"), "x")), id("x"));
    assertThat(infer(identity), isAst("T[type T, T x]"));
    assertThat(infer(call(identity, U8, integral(5))), is(U8));
  }

  /** A lambda is checked against a function type whose parameters may have
   * different names. */
  @Test void testCheckLambda() {
    checker.typeCheck(EMPTY,
        lambda(params(param(TYPE, "U"), param(id("U"), "y")), id("y")),
        ID_TYPE);
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheck(EMPTY,
            lambda(params(param(TYPE, "U"), param(id("U"), "y")), id("U")),
            ID_TYPE));
    assertFails(TypeException.Kind.ARITY_MISMATCH,
        () -> checker.typeCheck(EMPTY,
            lambda(params(param(TYPE, "U")), id("U")), ID_TYPE));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheck(EMPTY,
            lambda(params(param(U32, "a")), id("a")), U32));
  }

  /** The expected function type refers to an outer "y", and the lambda has
   * a parameter called "y"; the parameter must not capture the outer name. */
  @Test void testCheckLambdaCapture() {
    final Environment env =
        EMPTY.bind(sym("y"), TYPE).bind(sym("w"), id("y"));
    final Ast.Exp type = funcType(id("y"), param(U32, "a"));
    checker.typeCheck(env, lambda(params(param(U32, "y")), id("w")), type);
    // The parameter "y" has type u32, not the outer type "y"
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheck(env,
            lambda(params(param(U32, "y")), id("y")), type));
  }

  /** A lambda parameter that re-uses the name of an outer variable does not
   * capture the references to that variable in the types of other names. */
  @Test void testLambdaParameterHidesOuterName() {
    final Environment env =
        EMPTY.bind(sym("T"), TYPE).bind(sym("a"), id("T"));
    // "\(T x, type T) -> x" returns the outer "T"
    final Ast.Exp fn =
        lambda(params(param(id("T"), "x"), param(TYPE, "T")), id("x"));
    assertThat(infer(env, fn), isAst("T[T x, type T_1]"));
    final Ast.Exp type = infer(env, call(fn, id("a"), U32));
    assertThat(type, is(id("T")));
    assertThat(checker.typeEqual(env, type, id("T")), is(true));
    assertThat(checker.typeEqual(env, type, U32), is(false));

    // In "\(type T, T y) -> a == y", "a" and "y" have different types
    final Ast.Exp compare =
        lambda(params(param(TYPE, "T"), param(id("T"), "y")),
            binOp(Op.EQ, id("a"), id("y")));
    assertFails(TypeException.Kind.TYPE_MISMATCH, () -> infer(env, compare));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheck(env, compare,
            funcType(BOOL, param(TYPE, "T"), param(id("T"), "y"))));
  }

  @Test void testBinOp() {
    final Environment env =
        EMPTY.bind(sym("x"), U32).bind(sym("b"), BOOL).bind(sym("y"), U8);
    assertThat(infer(env, binOp(Op.PLUS, id("x"), integral(1))), is(U32));
    assertThat(infer(env, binOp(Op.MINUS, integral(1), id("x"))), is(U32));
    assertThat(infer(env, binOp(Op.PLUS, integral(1), integral(2))),
        is(U64));
    assertThat(infer(env, binOp(Op.LT, id("x"), integral(1))), is(BOOL));
    assertThat(infer(env, binOp(Op.EQ, id("x"), integral(1))), is(BOOL));
    assertThat(infer(env, binOp(Op.EQ, id("b"), id("b"))), is(BOOL));
    assertThat(infer(env, binOp(Op.AND_THEN, id("x"), id("b"))), is(BOOL));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> infer(env, binOp(Op.PLUS, id("b"), id("b"))));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> infer(env, binOp(Op.PLUS, id("b"), integral(1))));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> infer(env, binOp(Op.PLUS, id("x"), id("b"))));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> infer(env, binOp(Op.PLUS, id("y"), integral(256))));
  }

  @Test void testIf() {
    final Environment env = EMPTY.bind(sym("x"), U32).bind(sym("b"), BOOL);
    assertThat(infer(env, ifThenElse(id("b"), id("x"), integral(1))),
        is(U32));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> infer(env, ifThenElse(id("x"), integral(1), integral(2))));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> infer(env, ifThenElse(id("b"), id("x"), id("b"))));
  }

  @Test void testPointer() {
    final Environment env =
        EMPTY.bind(sym("x"), U32).bind(sym("p"), pointer(U32));
    assertThat(infer(env, pointer(U32)), is(TYPE));
    assertThat(infer(env, reference(id("x"))), is(pointer(U32)));
    assertThat(infer(env, dereference(reference(id("x")))), is(U32));
    assertThat(infer(env, dereference(id("p"))), is(U32));
    assertFails(TypeException.Kind.NOT_A_POINTER_TYPE,
        () -> infer(env, dereference(id("x"))));
  }

  @Test void testTypes() {
    assertThat(infer(DEPENDENT_PAIR), is(TYPE));
    assertThat(infer(EITHER), is(TYPE));
    assertThat(infer(ID_TYPE), is(TYPE));
    assertFails(TypeException.Kind.DUPLICATE_FIELD,
        () -> infer(struct(param(U32, "a"), param(U32, "a"))));
    assertFails(TypeException.Kind.DUPLICATE_FIELD,
        () -> infer(union(param(U32, "a"), param(BOOL, "a"))));
    // "a" is a value, not a type
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> infer(struct(param(U32, "a"), param(id("a"), "b"))));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> infer(funcType(U32, param(integral(5)))));
  }

  @Test void testTypeEqual() {
    assertThat(
        checker.typeEqual(EMPTY, ID_TYPE,
            funcType(id("U"), param(TYPE, "U"), param(id("U"), "y"))),
        is(true));
    final Environment env = EMPTY.bind(sym("T"), TYPE, U32);
    assertThat(checker.typeEqual(env, id("T"), U32), is(true));
    assertThat(checker.typeEqual(env, id("T"), U64), is(false));
    assertThat(checker.typeEval(env, pointer(id("T"))), is(pointer(U32)));
  }

  @Test void testBlock() {
    checker.checkBlock(EMPTY,
        block(decl(TYPE, "T", U32), decl(id("T"), "x", integral(5)),
            ret(id("x"))),
        U32);
    checker.checkBlock(EMPTY, block(decl(U32, "z"), ret(id("z"))), U32);

    // A declaration is not visible after its block
    assertFails(TypeException.Kind.UNBOUND_NAME,
        () -> checker.checkBlock(EMPTY,
            block(blockStatement(decl(U32, "y", integral(1))), ret(id("y"))),
            U32));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.checkBlock(EMPTY, block(ret(bool(true))), U32));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.checkBlock(EMPTY,
            block(decl(U8, "z", integral(256))), U32));
    assertFails(TypeException.Kind.UNBOUND_NAME,
        () -> checker.checkBlock(EMPTY,
            block(expStatement(call(id("f")))), U32));

    final Environment env = EMPTY.bind(sym("x"), U32);
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.checkBlock(env,
            block(ifStatement(id("x"), block(), block())), U32));
  }

  /** A local declaration that re-uses a parameter's name does not change
   * the type of the parameter. */
  @Test void testLocalHidesParameter() {
    // "void f(type T, T x) { { type T = u64; u64 y = x; } }"
    final Ast.FuncDecl f =
        funcDecl("f", VOID, params(param(TYPE, "T"), param(id("T"), "x")),
            block(
                blockStatement(decl(TYPE, "T", U64),
                    decl(U64, "y", id("x")))));
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheckTopLevel(EMPTY, f));

    // The local "T" is visible in the rest of its block
    checker.typeCheckTopLevel(EMPTY,
        funcDecl("g", VOID, params(param(TYPE, "T")),
            block(decl(TYPE, "T", U64), decl(id("T"), "y", integral(5)))));

    // Re-declaring a local hides it, but not from earlier declarations
    checker.checkBlock(EMPTY,
        block(decl(TYPE, "T", U8), decl(id("T"), "x", integral(255)),
            decl(TYPE, "T", BOOL), decl(U8, "y", id("x")),
            decl(id("T"), "b", bool(true))),
        VOID);
  }

  /** The return type refers to the parameter, even after a local
   * declaration re-uses its name. */
  @Test void testReturnAfterLocalHidesParameter() {
    // "T f(type T, T x) { type T = u64; return x; }"
    checker.typeCheckTopLevel(EMPTY,
        funcDecl("f", id("T"),
            params(param(TYPE, "T"), param(id("T"), "x")),
            block(decl(TYPE, "T", U64), ret(id("x")))));
    // "T f(type T, T x) { type T = u64; return 5; }"
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheckTopLevel(EMPTY,
            funcDecl("f", id("T"),
                params(param(TYPE, "T"), param(id("T"), "x")),
                block(decl(TYPE, "T", U64), ret(integral(5))))));
  }

  @Test void testStatementBindsDeclaration() {
    final Environment env =
        checker.checkStatement(EMPTY, decl(U32, "z", integral(1)), U32);
    final Binding binding = env.getOpt(sym("z"));
    assertThat(binding, notNullValue());
    assertThat(binding.type, is(U32));
    assertThat(binding.value, is(integral(1)));
  }

  @Test void testTopLevel() {
    final Ast.FuncDecl identity =
        funcDecl("id", id("T"), params(param(TYPE, "T"), param(id("T"), "x")),
            block(ret(id("x"))));
    final Environment env = checker.typeCheckTopLevel(EMPTY, identity);
    final Binding binding = env.getOpt(sym("id"));
    assertThat(binding, notNullValue());
    assertThat(binding.type, isAst("T[type T, T x]"));

    // A body may call its own declaration
    checker.typeCheckTopLevel(EMPTY,
        funcDecl("f", U32, params(param(U32, "n")),
            block(ret(call(id("f"), id("n"))))));

    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> checker.typeCheckTopLevel(EMPTY,
            funcDecl("g", U32, params(), block(ret(bool(true))))));
    assertFails(TypeException.Kind.UNBOUND_NAME,
        () -> checker.typeCheckTopLevel(EMPTY,
            funcDecl("h", id("T"), params(), block())));
  }
}

// End TypeCheckerTest.java
