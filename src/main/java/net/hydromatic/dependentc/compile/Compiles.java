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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.Symbol;

/** Helpers for checking whole programs with {@link TypeChecker}. */
public abstract class Compiles {
  private Compiles() {}

  /**
   * Checks a translation unit.
   *
   * <p>Orders the declarations with {@link SignatureSorter}, checks their
   * signatures in that order, each in an environment that contains the
   * signatures checked before it, then checks their bodies in an environment
   * that contains all valid signatures.
   *
   * <p>A declaration that fails is reported to {@code tracer} and recorded in
   * the result. If {@link Prop#CONTINUE_ON_ERROR} is false, checking stops
   * at the first failure, and if the tracer does not handle that failure, it
   * is thrown.
   */
  public static Checked check(Ast.TranslationUnit unit,
      Map<Prop, Object> propMap, Tracer tracer) {
    final boolean continueOnError =
        Prop.CONTINUE_ON_ERROR.booleanValue(propMap);
    final TypeChecker checker =
        new TypeChecker(new NameGenerator(), propMap);
    final Map<Symbol, CompileException> failures = new LinkedHashMap<>();

    final List<Ast.TopLevel> order;
    try {
      order = SignatureSorter.sort(unit);
    } catch (TypeException e) {
      e.names.forEach(name -> failures.put(name, e));
      if (!tracer.handleCompileException(e) && !continueOnError) {
        throw e;
      }
      return new Checked(ImmutableList.of(), ImmutableList.of(), failures);
    }
    tracer.onOrder(order);

    Environment env = Environments.empty();
    final List<Ast.TopLevel> valid = new ArrayList<>();
    for (Ast.TopLevel topLevel : order) {
      try {
        env = checker.checkSignature(env, topLevel);
        valid.add(topLevel);
      } catch (CompileException e) {
        failures.put(topLevel.name, e);
        if (!tracer.handleCompileException(e) && !continueOnError) {
          throw e;
        }
        if (!continueOnError) {
          return new Checked(order, ImmutableList.of(), failures);
        }
      }
    }

    final List<Ast.TopLevel> checked = new ArrayList<>();
    for (Ast.TopLevel topLevel : valid) {
      try {
        checker.checkBody(env, topLevel);
        checked.add(topLevel);
        tracer.onChecked(topLevel);
      } catch (CompileException e) {
        failures.put(topLevel.name, e);
        if (!tracer.handleCompileException(e) && !continueOnError) {
          throw e;
        }
        if (!continueOnError) {
          break;
        }
      }
    }
    return new Checked(order, checked, failures);
  }

  /** Result of checking a translation unit. */
  public static class Checked {
    /** Declarations in the order they were checked; empty if they could
     * not be ordered. */
    public final ImmutableList<Ast.TopLevel> order;
    /** Declarations whose signature and body are valid. */
    public final ImmutableList<Ast.TopLevel> checked;
    /** Failures, keyed by the name of the declaration. */
    public final ImmutableMap<Symbol, CompileException> failures;

    Checked(List<Ast.TopLevel> order, List<Ast.TopLevel> checked,
        Map<Symbol, CompileException> failures) {
      this.order = ImmutableList.copyOf(order);
      this.checked = ImmutableList.copyOf(checked);
      this.failures = ImmutableMap.copyOf(requireNonNull(failures));
    }

    /** Returns whether every declaration is valid. */
    public boolean isSuccess() {
      return failures.isEmpty();
    }
  }
}

// End Compiles.java
