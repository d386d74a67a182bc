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

import static net.hydromatic.dependentc.Trees.TYPE;
import static net.hydromatic.dependentc.Trees.U32;
import static net.hydromatic.dependentc.Trees.assign;
import static net.hydromatic.dependentc.Trees.call;
import static net.hydromatic.dependentc.Trees.funcType;
import static net.hydromatic.dependentc.Trees.id;
import static net.hydromatic.dependentc.Trees.integral;
import static net.hydromatic.dependentc.Trees.lambda;
import static net.hydromatic.dependentc.Trees.pack;
import static net.hydromatic.dependentc.Trees.param;
import static net.hydromatic.dependentc.Trees.params;
import static net.hydromatic.dependentc.Trees.pointer;
import static net.hydromatic.dependentc.Trees.struct;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import net.hydromatic.dependentc.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link AlphaEquivalence}. */
public class AlphaEquivalenceTest {
  private final NameGenerator nameGenerator = new NameGenerator();

  private boolean equal(Ast.Exp e0, Ast.Exp e1) {
    return AlphaEquivalence.equal(nameGenerator, e0, e1);
  }

  @Test void testFuncType() {
    final Ast.Exp f0 =
        funcType(id("T"), param(TYPE, "T"), param(id("T"), "x"));
    final Ast.Exp f1 =
        funcType(id("U"), param(TYPE, "U"), param(id("U"), "y"));
    assertThat(equal(f0, f1), is(true));
    assertThat(equal(f1, f0), is(true));

    // "T" in the return type is free on one side only
    final Ast.Exp f2 =
        funcType(id("T"), param(TYPE, "U"), param(id("U"), "x"));
    assertThat(equal(f0, f2), is(false));

    // A parameter name that is not used does not matter
    assertThat(equal(funcType(U32, param(U32)), funcType(U32, param(U32, "n"))),
        is(true));
    assertThat(equal(funcType(U32, param(U32)), funcType(U32, param(TYPE))),
        is(false));
    assertThat(equal(funcType(U32, param(U32)), funcType(U32)), is(false));
  }

  @Test void testLambda() {
    final Ast.Exp e0 = lambda(params(param(TYPE, "T")), id("T"));
    assertThat(equal(e0, lambda(params(param(TYPE, "U")), id("U"))),
        is(true));
    assertThat(equal(e0, lambda(params(param(TYPE, "U")), id("T"))),
        is(false));
    assertThat(
        equal(call(e0, U32),
            call(lambda(params(param(TYPE, "V")), id("V")), U32)),
        is(true));
  }

  /** Free variables must be identical. */
  @Test void testFreeVariables() {
    assertThat(equal(id("x"), id("x")), is(true));
    assertThat(equal(id("x"), id("y")), is(false));
    assertThat(equal(pointer(id("x")), pointer(id("x"))), is(true));
  }

  /** Field names are labels, and are not renamed. */
  @Test void testRecords() {
    final Ast.Exp s0 = struct(param(TYPE, "T"), param(id("T"), "v"));
    final Ast.Exp s1 = struct(param(TYPE, "U"), param(id("U"), "v"));
    assertThat(equal(s0, s1), is(false));
    assertThat(equal(s0, struct(param(TYPE, "T"), param(id("T"), "v"))),
        is(true));
    assertThat(
        equal(pack(s0, assign("T", U32), assign("v", integral(1))),
            pack(s0, assign("T", U32), assign("v", integral(1)))),
        is(true));
    assertThat(
        equal(pack(s0, assign("T", U32), assign("v", integral(1))),
            pack(s0, assign("T", U32), assign("v", integral(2)))),
        is(false));
  }
}

// End AlphaEquivalenceTest.java
