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
import static net.hydromatic.dependentc.Trees.TYPE;
import static net.hydromatic.dependentc.Trees.U32;
import static net.hydromatic.dependentc.Trees.block;
import static net.hydromatic.dependentc.Trees.call;
import static net.hydromatic.dependentc.Trees.funcDecl;
import static net.hydromatic.dependentc.Trees.id;
import static net.hydromatic.dependentc.Trees.param;
import static net.hydromatic.dependentc.Trees.params;
import static net.hydromatic.dependentc.Trees.ret;
import static net.hydromatic.dependentc.Trees.sym;
import static net.hydromatic.dependentc.Trees.unit;
import static net.hydromatic.dependentc.util.Static.transformEager;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.core.Is.is;

import java.util.List;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.Symbol;
import org.junit.jupiter.api.Test;

/** Tests for {@link SignatureSorter}. */
public class SignatureSorterTest {
  /** Creates "returnType name(params) { }". */
  private static Ast.FuncDecl decl(String name, Ast.Exp returnType,
      Ast.Param... params) {
    return funcDecl(name, returnType, params(params), block());
  }

  private static List<String> names(List<Ast.TopLevel> topLevels) {
    return transformEager(topLevels, t -> t.name.name);
  }

  /** "C A()", "u32 B()", "u32 C(B x)"; A depends on C, which depends on
   * B. */
  @Test void testSort() {
    final Ast.TranslationUnit unit =
        unit(decl("A", id("C")),
            decl("B", U32),
            decl("C", U32, param(id("B"), "x")));
    assertThat(names(SignatureSorter.sort(unit)), contains("B", "C", "A"));
  }

  /** Declarations that do not depend on each other stay in the order they
   * were written. */
  @Test void testSortIsStable() {
    final Ast.TranslationUnit unit =
        unit(decl("Z", U32), decl("Y", U32), decl("X", id("Z")),
            decl("W", U32));
    assertThat(names(SignatureSorter.sort(unit)),
        contains("Z", "Y", "X", "W"));
  }

  /** References from bodies, and references to names bound in the signature
   * itself, are not dependencies. */
  @Test void testBodiesAndParameters() {
    final Ast.TranslationUnit unit =
        unit(
            funcDecl("A", U32, params(), block(ret(call(id("B"))))),
            funcDecl("B", U32, params(), block(ret(call(id("A"))))),
            decl("C", id("D"), param(TYPE, "D"), param(id("D"), "x")),
            decl("D", U32));
    assertThat(names(SignatureSorter.sort(unit)),
        contains("A", "B", "C", "D"));
  }

  @Test void testCycle() {
    final TypeException e =
        assertFails(TypeException.Kind.CYCLIC_SIGNATURE_DEPENDENCY,
            () -> SignatureSorter.sort(
                unit(decl("A", id("B")), decl("B", id("A")))));
    assertThat(e.names, contains(sym("A"), sym("B")));

    // Only the declarations on the cycle are reported
    final TypeException e2 =
        assertFails(TypeException.Kind.CYCLIC_SIGNATURE_DEPENDENCY,
            () -> SignatureSorter.sort(
                unit(decl("D", U32),
                    decl("E", id("A")),
                    decl("A", id("B"), param(id("D"), "d")),
                    decl("B", id("C")),
                    decl("C", id("A")))));
    assertThat(e2.names, contains(sym("A"), sym("B"), sym("C")));
  }

  @Test void testSelfCycle() {
    final TypeException e =
        assertFails(TypeException.Kind.CYCLIC_SIGNATURE_DEPENDENCY,
            () -> SignatureSorter.sort(unit(decl("A", id("A")))));
    assertThat(e.names, contains(sym("A")));
  }

  @Test void testDuplicate() {
    final TypeException e =
        assertFails(TypeException.Kind.DUPLICATE_DECLARATION,
            () -> SignatureSorter.sort(
                unit(decl("A", U32), decl("B", U32), decl("A", U32))));
    assertThat(e.names, contains(sym("A")));
  }

  @Test void testEmpty() {
    assertThat(SignatureSorter.sort(unit()).isEmpty(), is(true));
    final List<Symbol> names =
        transformEager(SignatureSorter.sort(unit(decl("A", U32))),
            t -> t.name);
    assertThat(names, contains(sym("A")));
  }
}

// End SignatureSorterTest.java
