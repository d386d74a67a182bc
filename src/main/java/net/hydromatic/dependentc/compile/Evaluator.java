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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.LiteralKind;
import net.hydromatic.dependentc.ast.Op;
import net.hydromatic.dependentc.ast.Shuttle;
import net.hydromatic.dependentc.ast.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reduces an expression to normal form.
 *
 * <p>The reduction rules are:
 *
 * <ul>
 *   <li>A call to a lambda substitutes each argument for its parameter, left
 *       to right, and evaluates the body;
 *   <li>A member of a pack yields the value assigned to that field;
 *   <li>A conditional whose condition is a boolean literal yields one of its
 *       branches;
 *   <li>A binary operator whose operands are both literals is folded;
 *   <li>"*&amp;e" yields "e";
 *   <li>An identifier that was declared with a value is replaced by that value,
 *       if {@link Prop#UNFOLD_DEFINITIONS} is set and the names in the value
 *       still mean what they meant where the value was declared.
 * </ul>
 *
 * <p>Every other expression is normalized by normalizing its children. An
 * expression that cannot be reduced (say, a call to an unknown function) is
 * left in place.
 */
public class Evaluator extends Shuttle {
  private final NameGenerator nameGenerator;
  private final Environment env;
  /** Names bound by binders that enclose the current expression; they hide
   * bindings of the same name in {@link #env}. */
  private final ImmutableSet<Symbol> shadowed;
  private final Steps steps;

  private Evaluator(NameGenerator nameGenerator, Environment env,
      ImmutableSet<Symbol> shadowed, Steps steps) {
    this.nameGenerator = requireNonNull(nameGenerator);
    this.env = requireNonNull(env);
    this.shadowed = requireNonNull(shadowed);
    this.steps = requireNonNull(steps);
  }

  /** Evaluates an expression in an environment. */
  public static Ast.Exp eval(NameGenerator nameGenerator, Environment env,
      Map<Prop, Object> propMap, Ast.Exp exp) {
    final Steps steps =
        new Steps(Prop.UNFOLD_DEFINITIONS.booleanValue(propMap),
            Prop.EVAL_STEP_LIMIT.intValue(propMap));
    return exp.accept(
        new Evaluator(nameGenerator, env, ImmutableSet.of(), steps));
  }

  /** Creates an evaluator the same as this but in which a name is hidden
   * by a binder. */
  private Evaluator push(Symbol name) {
    if (shadowed.contains(name)) {
      return this;
    }
    return new Evaluator(nameGenerator, env,
        ImmutableSet.<Symbol>builder().addAll(shadowed).add(name).build(),
        steps);
  }

  /** Normalizes the types of a telescope, and returns an evaluator in which
   * its names are hidden. */
  private Evaluator visitTelescope(List<Ast.Param> params,
      List<Ast.Param> newParams) {
    Evaluator evaluator = this;
    for (Ast.Param param : params) {
      newParams.add(param.copy(param.type.accept(evaluator)));
      if (param.name != null) {
        evaluator = evaluator.push(param.name);
      }
    }
    return evaluator;
  }

  @Override protected Ast.Exp visit(Ast.Id id) {
    if (!steps.unfold || shadowed.contains(id.name)) {
      return id;
    }
    final Binding binding = env.getOpt(id.name);
    if (binding == null || binding.value == null) {
      return id;
    }
    final Environment valueEnv = requireNonNull(binding.valueEnv);
    for (Symbol name : FreeFinder.freeVars(binding.value)) {
      if (shadowed.contains(name)
          || env.getOpt(name) != valueEnv.getOpt(name)) {
        // The value would mean something different here.
        return id;
      }
    }
    return binding.value.accept(this);
  }

  @Override protected Ast.Exp visit(Ast.BinOp binOp) {
    final Ast.Exp a0 = binOp.a0.accept(this);
    final Ast.Exp a1 = binOp.a1.accept(this);
    if (a0 instanceof Ast.Literal && a1 instanceof Ast.Literal) {
      final Ast.Exp folded =
          fold(binOp, (Ast.Literal) a0, (Ast.Literal) a1);
      if (folded != null) {
        return folded;
      }
    }
    return binOp.copy(a0, a1);
  }

  /** Folds a binary operator whose operands are literals, or returns null if
   * the operands are not of a kind the operator accepts. */
  private static Ast.@Nullable Exp fold(Ast.BinOp binOp, Ast.Literal a0,
      Ast.Literal a1) {
    switch (binOp.op) {
    case AND_THEN:
      return a1;
    case EQ:
    case NE:
      if (a0.kind != a1.kind && !(a0.kind.isType() && a1.kind.isType())) {
        return null;
      }
      return ast.bool(binOp.pos, a0.equals(a1) == (binOp.op == Op.EQ));
    default:
      break;
    }
    if (a0.kind != LiteralKind.INTEGRAL || a1.kind != LiteralKind.INTEGRAL) {
      return null;
    }
    final long v0 = a0.longValue();
    final long v1 = a1.longValue();
    final int c = Long.compareUnsigned(v0, v1);
    switch (binOp.op) {
    case LT:
      return ast.bool(binOp.pos, c < 0);
    case LE:
      return ast.bool(binOp.pos, c <= 0);
    case GT:
      return ast.bool(binOp.pos, c > 0);
    case GE:
      return ast.bool(binOp.pos, c >= 0);
    case PLUS:
      return ast.integral(binOp.pos, v0 + v1);
    case MINUS:
      return ast.integral(binOp.pos, v0 - v1);
    default:
      throw new AssertionError("unexpected operator " + binOp.op);
    }
  }

  @Override protected Ast.Exp visit(Ast.If ifThenElse) {
    final Ast.Exp condition = ifThenElse.condition.accept(this);
    if (condition instanceof Ast.Literal
        && ((Ast.Literal) condition).kind == LiteralKind.BOOLEAN) {
      return ((Ast.Literal) condition).booleanValue()
          ? ifThenElse.ifTrue.accept(this)
          : ifThenElse.ifFalse.accept(this);
    }
    return ifThenElse.copy(condition, ifThenElse.ifTrue.accept(this),
        ifThenElse.ifFalse.accept(this));
  }

  @Override protected Ast.Exp visit(Ast.FuncType funcType) {
    final List<Ast.Param> params = new ArrayList<>();
    final Evaluator evaluator = visitTelescope(funcType.params, params);
    return funcType.copy(funcType.returnType.accept(evaluator), params);
  }

  @Override protected Ast.Exp visit(Ast.Lambda lambda) {
    final List<Ast.Param> params = new ArrayList<>();
    final Evaluator evaluator = visitTelescope(lambda.params, params);
    return lambda.copy(params, lambda.body.accept(evaluator));
  }

  @Override protected Ast.Exp visit(Ast.Struct struct) {
    final List<Ast.Param> fields = new ArrayList<>();
    visitTelescope(struct.fields, fields);
    return struct.copy(fields);
  }

  @Override protected Ast.Exp visit(Ast.Call call) {
    final Ast.Exp fn = call.fn.accept(this);
    final List<Ast.Exp> args = visitList(call.args);
    if (!(fn instanceof Ast.Lambda)
        || ((Ast.Lambda) fn).params.size() != args.size()) {
      return call.copy(fn, args);
    }
    steps.step(call);

    // Peel off one parameter at a time, so that the substitution of each
    // argument reaches the types of the later parameters.
    Ast.Lambda lambda = (Ast.Lambda) fn;
    for (Ast.Exp arg : args) {
      final Ast.Param param = lambda.params.get(0);
      final Ast.Lambda rest =
          ast.lambda(lambda.pos, skip(lambda.params, 1), lambda.body);
      lambda =
          (Ast.Lambda) Substituter.substitute(nameGenerator, rest,
              param.name(), arg);
    }
    return lambda.body.accept(this);
  }

  @Override protected Ast.Exp visit(Ast.Member member) {
    final Ast.Exp record = member.record.accept(this);
    if (record instanceof Ast.Pack) {
      final Ast.Assign assign = ((Ast.Pack) record).assign(member.field);
      if (assign != null) {
        return assign.value;
      }
    }
    return member.copy(record);
  }

  @Override protected Ast.Exp visit(Ast.PointerExp pointerExp) {
    final Ast.Exp exp = pointerExp.exp.accept(this);
    if (pointerExp.op == Op.DEREFERENCE && exp.op == Op.REFERENCE) {
      return ((Ast.PointerExp) exp).exp;
    }
    return pointerExp.copy(exp);
  }

  /** Counts reductions; shared by an evaluator and the evaluators it
   * creates for nested scopes. */
  private static class Steps {
    final boolean unfold;
    final int limit;
    int count;

    Steps(boolean unfold, int limit) {
      this.unfold = unfold;
      this.limit = limit;
    }

    void step(Ast.Call call) {
      if (++count > limit && limit > 0) {
        throw TypeException.evaluationLimit(call, limit);
      }
    }
  }
}

// End Evaluator.java
