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

import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.dependentc.ast.Ast;

/** Factories for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that ignores every event and handles no error. */
  public static Tracer empty() {
    return Silent.INSTANCE;
  }

  /** Returns a tracer that gives the checking order to {@code action}, and
   * forwards every event to {@code next}. */
  public static Tracer withOnOrder(Tracer next,
      Consumer<List<Ast.TopLevel>> action) {
    return new Forwarding(next) {
      @Override public void onOrder(List<Ast.TopLevel> order) {
        action.accept(order);
        next.onOrder(order);
      }
    };
  }

  /** Returns a tracer that gives each checked declaration to
   * {@code action}, and forwards every event to {@code next}. */
  public static Tracer withOnChecked(Tracer next,
      Consumer<Ast.TopLevel> action) {
    return new Forwarding(next) {
      @Override public void onChecked(Ast.TopLevel topLevel) {
        action.accept(topLevel);
        next.onChecked(topLevel);
      }
    };
  }

  /** Returns a tracer that gives each error to {@code action} and then to
   * {@code next}, and reports the error handled whatever {@code next}
   * returns. */
  public static Tracer withOnCompileException(Tracer next,
      Consumer<CompileException> action) {
    return new Forwarding(next) {
      @Override public boolean handleCompileException(CompileException e) {
        action.accept(e);
        next.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that ignores everything. */
  private enum Silent implements Tracer {
    INSTANCE;

    @Override public void onOrder(List<Ast.TopLevel> order) {
    }

    @Override public void onChecked(Ast.TopLevel topLevel) {
    }

    @Override public boolean handleCompileException(CompileException e) {
      return false;
    }
  }

  /** Tracer that passes each event to another. */
  private abstract static class Forwarding implements Tracer {
    protected final Tracer next;

    Forwarding(Tracer next) {
      this.next = next;
    }

    @Override public void onOrder(List<Ast.TopLevel> order) {
      next.onOrder(order);
    }

    @Override public void onChecked(Ast.TopLevel topLevel) {
      next.onChecked(topLevel);
    }

    @Override public boolean handleCompileException(CompileException e) {
      return next.handleCompileException(e);
    }
  }
}

// End Tracers.java
