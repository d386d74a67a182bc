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
import static net.hydromatic.dependentc.Matchers.hasKind;
import static net.hydromatic.dependentc.Trees.TYPE;
import static net.hydromatic.dependentc.Trees.U32;
import static net.hydromatic.dependentc.Trees.block;
import static net.hydromatic.dependentc.Trees.bool;
import static net.hydromatic.dependentc.Trees.call;
import static net.hydromatic.dependentc.Trees.funcDecl;
import static net.hydromatic.dependentc.Trees.id;
import static net.hydromatic.dependentc.Trees.integral;
import static net.hydromatic.dependentc.Trees.param;
import static net.hydromatic.dependentc.Trees.params;
import static net.hydromatic.dependentc.Trees.ret;
import static net.hydromatic.dependentc.Trees.sym;
import static net.hydromatic.dependentc.Trees.unit;
import static net.hydromatic.dependentc.util.Static.transformEager;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsInstanceOf.instanceOf;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.dependentc.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link Compiles}. */
public class CompilesTest {
  private static final Map<Prop, Object> STOP_ON_ERROR =
      ImmutableMap.of(Prop.CONTINUE_ON_ERROR, false);

  /** "type Elem() { return u32; }". */
  private static final Ast.FuncDecl ELEM =
      funcDecl("Elem", TYPE, params(), block(ret(U32)));

  /** "Elem() first(Elem() x) { return x; }". */
  private static final Ast.FuncDecl FIRST =
      funcDecl("first", call(id("Elem")),
          params(param(call(id("Elem")), "x")), block(ret(id("x"))));

  /** "u32 bad() { return true; }". */
  private static final Ast.FuncDecl BAD =
      funcDecl("bad", U32, params(), block(ret(bool(true))));

  /** "u32 good() { return 1; }". */
  private static final Ast.FuncDecl GOOD =
      funcDecl("good", U32, params(), block(ret(integral(1))));

  private static List<String> names(List<? extends Ast.TopLevel> topLevels) {
    return transformEager(topLevels, t -> t.name.toString());
  }

  /** A declaration whose signature calls another declaration is checked
   * after it. */
  @Test void testCheck() {
    final List<String> events = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnChecked(
            Tracers.withOnOrder(Tracers.empty(),
                order -> events.add("order " + names(order))),
            t -> events.add("checked " + t.name));
    final Compiles.Checked checked =
        Compiles.check(unit(FIRST, ELEM), ImmutableMap.of(), tracer);
    assertThat(checked.isSuccess(), is(true));
    assertThat(names(checked.order), contains("Elem", "first"));
    assertThat(names(checked.checked), contains("Elem", "first"));
    assertThat(events,
        contains("order [Elem, first]", "checked Elem", "checked first"));
  }

  /** By default, a failure does not prevent other declarations from being
   * checked. */
  @Test void testContinueOnError() {
    final List<CompileException> exceptions = new ArrayList<>();
    final Compiles.Checked checked =
        Compiles.check(unit(BAD, GOOD), ImmutableMap.of(),
            Tracers.withOnCompileException(Tracers.empty(), exceptions::add));
    assertThat(checked.isSuccess(), is(false));
    assertThat(names(checked.checked), contains("good"));
    assertThat(checked.failures.keySet(), contains(sym("bad")));
    final CompileException e = checked.failures.get(sym("bad"));
    assertThat(e, instanceOf(TypeException.class));
    assertThat((TypeException) e, hasKind(TypeException.Kind.TYPE_MISMATCH));
    assertThat(exceptions, hasSize(1));
    assertThat(e.toString(), startsWith("0:0: error: type mismatch"));

    // Without a handler, the failure is recorded but not thrown
    final Compiles.Checked checked2 =
        Compiles.check(unit(BAD, GOOD), ImmutableMap.of(), Tracers.empty());
    assertThat(checked2.failures.keySet(), contains(sym("bad")));
  }

  /** A declaration whose signature references a declaration whose signature
   * failed also fails. */
  @Test void testDependentFailure() {
    final Ast.TranslationUnit unit =
        unit(funcDecl("h", call(id("g")), params(), block()),
            funcDecl("g", id("T"), params(), block()),
            GOOD);
    final Compiles.Checked checked =
        Compiles.check(unit, ImmutableMap.of(), Tracers.empty());
    assertThat(names(checked.order), contains("g", "h", "good"));
    assertThat(checked.failures.keySet(), contains(sym("g"), sym("h")));
    assertThat(names(checked.checked), contains("good"));
  }

  @Test void testStopOnError() {
    assertFails(TypeException.Kind.TYPE_MISMATCH,
        () -> Compiles.check(unit(BAD, GOOD), STOP_ON_ERROR,
            Tracers.empty()));

    // If the tracer handles the failure, checking stops but does not throw
    final List<CompileException> exceptions = new ArrayList<>();
    final Compiles.Checked checked =
        Compiles.check(unit(BAD, GOOD), STOP_ON_ERROR,
            Tracers.withOnCompileException(Tracers.empty(), exceptions::add));
    assertThat(checked.checked, empty());
    assertThat(checked.failures.keySet(), contains(sym("bad")));
    assertThat(exceptions, hasSize(1));
  }

  @Test void testCycle() {
    final Compiles.Checked checked =
        Compiles.check(
            unit(funcDecl("A", call(id("B")), params(), block()),
                funcDecl("B", call(id("A")), params(), block())),
            ImmutableMap.of(), Tracers.empty());
    assertThat(checked.isSuccess(), is(false));
    assertThat(checked.order, empty());
    assertThat(checked.failures.keySet(), contains(sym("A"), sym("B")));

    assertFails(TypeException.Kind.DUPLICATE_DECLARATION,
        () -> Compiles.check(unit(GOOD, GOOD), STOP_ON_ERROR,
            Tracers.empty()));
  }
}

// End CompilesTest.java
