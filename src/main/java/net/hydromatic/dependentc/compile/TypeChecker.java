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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;
import net.hydromatic.dependentc.ast.Ast;
import net.hydromatic.dependentc.ast.AstNode;
import net.hydromatic.dependentc.ast.LiteralKind;
import net.hydromatic.dependentc.ast.Op;
import net.hydromatic.dependentc.ast.Pos;
import net.hydromatic.dependentc.ast.Symbol;

/**
 * Checks and infers the types of expressions, statements and declarations.
 *
 * <p>Checking is bidirectional. {@link #typeInfer} computes the type of an
 * expression from the expression alone; {@link #typeCheck} checks an
 * expression against a type that is known in advance, which allows lambdas,
 * packs and integral literals to be checked when their type could not be
 * inferred.
 *
 * <p>Types are expressions, and may contain values: the type of field "v" of
 * a record "r" of type "struct { type T; T v; }" is "r.T". Two types are
 * equal if they evaluate to alpha-equivalent expressions; see
 * {@link #typeEqual}.
 *
 * <p>A binder whose name is already bound in the environment is renamed to a
 * fresh name, together with its scope, before it is bound. Every name in an
 * environment is therefore bound once, and the types and values stored for
 * earlier names keep their meaning however the program re-uses names.
 *
 * <p>Every method throws {@link TypeException} if the program is invalid.
 */
public class TypeChecker {
  static final Ast.Literal TYPE = ast.literal(Pos.ZERO, LiteralKind.TYPE);
  static final Ast.Literal BOOL = ast.literal(Pos.ZERO, LiteralKind.BOOL);
  static final Ast.Literal U64 = ast.literal(Pos.ZERO, LiteralKind.U64);

  private final NameGenerator nameGenerator;
  private final Map<Prop, Object> propMap;

  public TypeChecker(NameGenerator nameGenerator, Map<Prop, Object> propMap) {
    this.nameGenerator = requireNonNull(nameGenerator);
    this.propMap = ImmutableMap.copyOf(propMap);
  }

  /** Reduces an expression to normal form. */
  public Ast.Exp typeEval(Environment env, Ast.Exp exp) {
    return Evaluator.eval(nameGenerator, env, propMap, exp);
  }

  /** Returns whether two types are equal: whether their normal forms are
   * equal up to renaming of bound names. */
  public boolean typeEqual(Environment env, Ast.Exp type0, Ast.Exp type1) {
    if (type0.equals(type1)) {
      return true;
    }
    return AlphaEquivalence.equal(nameGenerator, typeEval(env, type0),
        typeEval(env, type1));
  }

  /** Checks that an expression has a given type. */
  public void typeCheck(Environment env, Ast.Exp exp, Ast.Exp type) {
    switch (exp.op) {
    case LITERAL:
      if (((Ast.Literal) exp).kind == LiteralKind.INTEGRAL) {
        checkIntegral(env, (Ast.Literal) exp, type);
        return;
      }
      break;
    case IF:
      final Ast.If ifThenElse = (Ast.If) exp;
      typeCheck(env, ifThenElse.condition, BOOL);
      typeCheck(env, ifThenElse.ifTrue, type);
      typeCheck(env, ifThenElse.ifFalse, type);
      return;
    case LAMBDA:
      checkLambda(env, (Ast.Lambda) exp, type);
      return;
    case PACK:
      checkPack(env, (Ast.Pack) exp, type);
      return;
    default:
      break;
    }
    final Ast.Exp actual = typeInfer(env, exp);
    if (!typeEqual(env, actual, type)) {
      throw TypeException.typeMismatch(exp, type, actual);
    }
  }

  /** Infers the type of an expression. */
  public Ast.Exp typeInfer(Environment env, Ast.Exp exp) {
    switch (exp.op) {
    case LITERAL:
      return inferLiteral((Ast.Literal) exp);
    case ID:
      return lookup(env, (Ast.Id) exp).type;
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
    case PLUS:
    case MINUS:
    case AND_THEN:
      return inferBinOp(env, (Ast.BinOp) exp);
    case IF:
      final Ast.If ifThenElse = (Ast.If) exp;
      typeCheck(env, ifThenElse.condition, BOOL);
      return inferCommon(env, ifThenElse, ifThenElse.ifTrue,
          ifThenElse.ifFalse);
    case FUNC_TYPE:
      final Ast.FuncType funcType = (Ast.FuncType) exp;
      final Scope funcTypeScope =
          enterTelescope(env, funcType, funcType.params,
              funcType.returnType);
      typeCheck(funcTypeScope.env, funcTypeScope.exp(0), TYPE);
      return TYPE;
    case LAMBDA:
      final Ast.Lambda lambda = (Ast.Lambda) exp;
      final Scope lambdaScope =
          enterTelescope(env, lambda, lambda.params, lambda.body);
      final Ast.Exp bodyType =
          typeInfer(lambdaScope.env, lambdaScope.exp(0));
      return ast.funcType(lambda.pos, bodyType, lambdaScope.params);
    case CALL:
      return inferCall(env, (Ast.Call) exp);
    case STRUCT:
      enterTelescope(env, exp, ((Ast.Struct) exp).fields);
      return TYPE;
    case UNION:
      checkDistinct(exp, ((Ast.Union) exp).fields);
      for (Ast.Param field : ((Ast.Union) exp).fields) {
        typeCheck(env, field.type, TYPE);
      }
      return TYPE;
    case PACK:
      final Ast.Pack pack = (Ast.Pack) exp;
      typeCheck(env, pack.type, TYPE);
      final Ast.Exp packType = typeEval(env, pack.type);
      checkAssigns(env, pack, packType);
      return packType;
    case MEMBER:
      return inferMember(env, (Ast.Member) exp);
    case POINTER:
      typeCheck(env, ((Ast.PointerExp) exp).exp, TYPE);
      return TYPE;
    case REFERENCE:
      final Ast.PointerExp reference = (Ast.PointerExp) exp;
      return ast.pointer(reference.pos, typeInfer(env, reference.exp));
    case DEREFERENCE:
      final Ast.PointerExp dereference = (Ast.PointerExp) exp;
      final Ast.Exp pointerType =
          typeEval(env, typeInfer(env, dereference.exp));
      if (pointerType.op != Op.POINTER) {
        throw TypeException.notAPointerType(dereference.exp, pointerType);
      }
      return ((Ast.PointerExp) pointerType).exp;
    default:
      throw new AssertionError("unknown expression " + exp.op);
    }
  }

  private static Ast.Exp inferLiteral(Ast.Literal literal) {
    switch (literal.kind) {
    case INTEGRAL:
      return U64;
    case BOOLEAN:
      return BOOL;
    default:
      return TYPE;
    }
  }

  private static Binding lookup(Environment env, Ast.Id id) {
    final Binding binding = env.getOpt(id.name);
    if (binding == null) {
      throw TypeException.unboundName(id);
    }
    return binding;
  }

  /** Checks that an integral literal is in the range of an integral type. */
  private void checkIntegral(Environment env, Ast.Literal literal,
      Ast.Exp type) {
    final Ast.Exp type2 = typeEval(env, type);
    if (!(type2 instanceof Ast.Literal)
        || !((Ast.Literal) type2).kind.isIntegralType()
        || !((Ast.Literal) type2).kind.fits(literal.longValue())) {
      throw TypeException.typeMismatch(literal, type, U64);
    }
  }

  private Ast.Exp inferBinOp(Environment env, Ast.BinOp binOp) {
    if (binOp.op == Op.AND_THEN) {
      typeInfer(env, binOp.a0);
      return typeInfer(env, binOp.a1);
    }
    final Ast.Exp type = inferCommon(env, binOp, binOp.a0, binOp.a1);
    if (Op.COMPARISONS.contains(binOp.op)
        && !Op.ORDERINGS.contains(binOp.op)) {
      return BOOL;
    }
    final Ast.Exp type2 = typeEval(env, type);
    if (!(type2 instanceof Ast.Literal)
        || !((Ast.Literal) type2).kind.isIntegralType()) {
      throw TypeException.typeMismatch(binOp, U64, type);
    }
    return Op.ORDERINGS.contains(binOp.op) ? BOOL : type;
  }

  /** Infers the type that two expressions have in common. If one of them is
   * an integral literal, it takes the type of the other. */
  private Ast.Exp inferCommon(Environment env, AstNode node, Ast.Exp a0,
      Ast.Exp a1) {
    if (isIntegralLiteral(a0) && !isIntegralLiteral(a1)) {
      final Ast.Exp type = typeInfer(env, a1);
      typeCheck(env, a0, type);
      return type;
    }
    final Ast.Exp type = typeInfer(env, a0);
    if (isIntegralLiteral(a1) && !isIntegralLiteral(a0)) {
      typeCheck(env, a1, type);
      return type;
    }
    final Ast.Exp type1 = typeInfer(env, a1);
    if (!typeEqual(env, type, type1)) {
      throw TypeException.typeMismatch(node, type, type1);
    }
    return type;
  }

  private static boolean isIntegralLiteral(Ast.Exp exp) {
    return exp instanceof Ast.Literal
        && ((Ast.Literal) exp).kind == LiteralKind.INTEGRAL;
  }

  /** Checks that names in a list of parameters or fields are distinct. */
  private static void checkDistinct(AstNode node, List<Ast.Param> params) {
    final Set<Symbol> names = new HashSet<>();
    for (Ast.Param param : params) {
      if (param.name != null && !names.add(param.name)) {
        throw TypeException.duplicateField(node, param.name);
      }
    }
  }

  /** Returns a name for a binder: its own name, or a fresh one if the name is
   * already bound. */
  private Symbol binderName(Environment env, Symbol name) {
    return env.getOpt(name) == null ? name : nameGenerator.fresh(name);
  }

  /**
   * Checks that each type in a telescope is a type, in an environment that
   * contains the earlier names, and binds the names.
   *
   * <p>The nodes in {@code scope} see all of the names. A parameter that
   * would hide a name of {@code env} is renamed, in the rest of the
   * telescope and in the scope, and the result holds the renamed
   * parameters and scope.
   */
  private Scope enterTelescope(Environment env, AstNode node,
      List<Ast.Param> params, AstNode... scope) {
    checkDistinct(node, params);
    final List<Ast.Param> newParams = new ArrayList<>();
    List<Ast.Param> rest = params;
    List<AstNode> nodes = ImmutableList.copyOf(scope);
    while (!rest.isEmpty()) {
      Ast.Param param = rest.get(0);
      rest = skip(rest, 1);
      typeCheck(env, param.type, TYPE);
      if (param.name != null) {
        final Symbol name = binderName(env, param.name);
        if (!name.equals(param.name)) {
          final Substituter.Telescope renamed =
              Substituter.rename(nameGenerator, rest, nodes, param.name,
                  name);
          param = param.rename(name);
          rest = renamed.params;
          nodes = renamed.scope;
        }
        env = env.bind(name, param.type);
      }
      newParams.add(param);
    }
    return new Scope(env, newParams, nodes);
  }

  private Ast.Exp inferCall(Environment env, Ast.Call call) {
    final Ast.Exp fnType = typeEval(env, typeInfer(env, call.fn));
    if (!(fnType instanceof Ast.FuncType)) {
      throw TypeException.notAFunctionType(call.fn, fnType);
    }
    Ast.FuncType rest = (Ast.FuncType) fnType;
    if (rest.params.size() != call.args.size()) {
      throw TypeException.arityMismatch(call, rest.params.size(),
          call.args.size());
    }

    // Dependent application: the type of each parameter, and the return
    // type, may reference earlier parameters, so substitute each argument
    // into the remainder of the function type once it has been checked.
    for (Ast.Exp arg : call.args) {
      final Ast.Param param = rest.params.get(0);
      typeCheck(env, arg, param.type);
      final Ast.FuncType tail =
          ast.funcType(rest.pos, rest.returnType, skip(rest.params, 1));
      rest = param.name == null
          ? tail
          : (Ast.FuncType) Substituter.substitute(nameGenerator, tail,
              param.name, arg);
    }
    return rest.returnType;
  }

  /** Checks a lambda against a function type. Unlike inference, this allows
   * the return type to depend on the parameters. */
  private void checkLambda(Environment env, Ast.Lambda lambda,
      Ast.Exp type) {
    final Ast.Exp type2 = typeEval(env, type);
    if (!(type2 instanceof Ast.FuncType)) {
      throw TypeException.typeMismatch(lambda, type,
          typeInfer(env, lambda));
    }
    Ast.FuncType rest = (Ast.FuncType) type2;
    if (rest.params.size() != lambda.params.size()) {
      throw TypeException.arityMismatch(lambda, rest.params.size(),
          lambda.params.size());
    }
    checkDistinct(lambda, lambda.params);
    List<Ast.Param> params = lambda.params;
    Ast.Exp body = lambda.body;
    while (!params.isEmpty()) {
      final Ast.Param expected = rest.params.get(0);
      Ast.Param param = params.get(0);
      typeCheck(env, param.type, TYPE);
      if (!typeEqual(env, param.type, expected.type)) {
        throw TypeException.typeMismatch(lambda, expected.type, param.type);
      }
      Ast.FuncType tail =
          ast.funcType(rest.pos, rest.returnType, skip(rest.params, 1));
      if (env.getOpt(param.name()) != null
          || !param.name().equals(expected.name)
              && FreeFinder.isFree(param.name(), tail)) {
        // The parameter would hide an outer variable, either one in the
        // environment or one that the function type refers to. Rename the
        // parameter.
        final Symbol fresh = nameGenerator.fresh(param.name());
        final Ast.Lambda renamed =
            (Ast.Lambda) Substituter.rename(nameGenerator,
                ast.lambda(lambda.pos, skip(params, 1), body),
                param.name(), fresh);
        param = param.rename(fresh);
        params = renamed.params;
        body = renamed.body;
      } else {
        params = skip(params, 1);
      }
      if (expected.name != null) {
        tail = (Ast.FuncType) Substituter.rename(nameGenerator, tail,
            expected.name, param.name());
      }
      env = env.bind(param.name(), param.type);
      rest = tail;
    }
    typeCheck(env, body, rest.returnType);
  }

  /** Checks a pack against an expected type. The type written in the pack
   * must equal the expected type. */
  private void checkPack(Environment env, Ast.Pack pack, Ast.Exp type) {
    typeCheck(env, pack.type, TYPE);
    if (!typeEqual(env, pack.type, type)) {
      throw TypeException.typeMismatch(pack, type, pack.type);
    }
    checkAssigns(env, pack, typeEval(env, type));
  }

  /** Checks the assignments of a pack against the fields of its type. */
  private void checkAssigns(Environment env, Ast.Pack pack, Ast.Exp type) {
    if (!(type instanceof Ast.RecordType)) {
      throw TypeException.notARecordType(pack, type);
    }
    final Ast.RecordType recordType = (Ast.RecordType) type;
    final Set<Symbol> names = new HashSet<>();
    for (Ast.Assign assign : pack.assigns) {
      if (recordType.indexOf(assign.field) < 0) {
        throw TypeException.unknownField(pack, assign.field, type);
      }
      if (!names.add(assign.field)) {
        throw TypeException.duplicateField(pack, assign.field);
      }
    }
    if (recordType.op == Op.UNION) {
      if (pack.assigns.size() != 1) {
        throw TypeException.incompletePack(pack,
            "a union pack must assign exactly one field, but assigns "
                + pack.assigns.size());
      }
      final Ast.Assign assign = pack.assigns.get(0);
      typeCheck(env, assign.value,
          recordType.fields.get(recordType.indexOf(assign.field)).type);
      return;
    }
    if (pack.assigns.size() != recordType.fields.size()) {
      throw TypeException.incompletePack(pack,
          "expected " + recordType.fields.size() + " assignments but got "
              + pack.assigns.size());
    }
    for (int i = 0; i < pack.assigns.size(); i++) {
      final Symbol field = recordType.fields.get(i).name();
      if (!pack.assigns.get(i).field.equals(field)) {
        throw TypeException.incompletePack(pack,
            "field '" + field + "' must be assigned at position " + i);
      }
    }
    for (int i = 0; i < pack.assigns.size(); i++) {
      final Ast.Exp fieldType =
          instantiate(recordType, i, j -> pack.assigns.get(j).value);
      typeCheck(env, pack.assigns.get(i).value, fieldType);
    }
  }

  private Ast.Exp inferMember(Environment env, Ast.Member member) {
    final Ast.Exp type = typeEval(env, typeInfer(env, member.record));
    if (!(type instanceof Ast.RecordType)) {
      throw TypeException.notARecordType(member, type);
    }
    final Ast.RecordType recordType = (Ast.RecordType) type;
    final int k = recordType.indexOf(member.field);
    if (k < 0) {
      throw TypeException.unknownField(member, member.field, type);
    }
    if (recordType.op == Op.UNION) {
      final Ast.Exp record = typeEval(env, member.record);
      if (record instanceof Ast.Pack) {
        final Ast.Pack pack = (Ast.Pack) record;
        if (pack.assigns.size() == 1
            && !pack.assigns.get(0).field.equals(member.field)) {
          throw TypeException.inactiveUnionMember(member,
              pack.assigns.get(0).field);
        }
      }
      return recordType.fields.get(k).type;
    }

    // Dependent projection: the type of field k may reference earlier
    // fields; each becomes a projection of the same record.
    final Ast.Exp fieldType =
        instantiate(recordType, k,
            j -> ast.member(member.pos, member.record,
                recordType.fields.get(j).name()));
    return typeEval(env, fieldType);
  }

  /**
   * Returns the type of field {@code i} of a struct with the earlier field
   * names replaced by values.
   *
   * <p>The earlier names are first renamed to fresh names, so that a value
   * that references a name that happens to be a field name is not affected by
   * the substitution of a later field.
   */
  private Ast.Exp instantiate(Ast.RecordType recordType, int i,
      IntFunction<Ast.Exp> values) {
    Ast.Exp type = recordType.fields.get(i).type;
    final List<Symbol> freshNames = new ArrayList<>();
    for (int j = 0; j < i; j++) {
      final Symbol name = recordType.fields.get(j).name();
      final Symbol fresh = nameGenerator.fresh(name);
      type = Substituter.rename(nameGenerator, type, name, fresh);
      freshNames.add(fresh);
    }
    for (int j = 0; j < i; j++) {
      type = Substituter.substitute(nameGenerator, type, freshNames.get(j),
          values.apply(j));
    }
    return type;
  }

  // statements

  /** Checks a statement, and returns the environment for the statements that
   * follow it in its block. A declaration is bound under its own name;
   * {@link #checkBlock} renames declarations that would hide a name. */
  public Environment checkStatement(Environment env,
      Ast.Statement statement, Ast.Exp returnType) {
    switch (statement.op) {
    case EMPTY_STATEMENT:
      return env;
    case EXP_STATEMENT:
      typeInfer(env, ((Ast.ExpStatement) statement).exp);
      return env;
    case RETURN:
      typeCheck(env, ((Ast.ExpStatement) statement).exp, returnType);
      return env;
    case BLOCK_STATEMENT:
      checkBlock(env, ((Ast.BlockStatement) statement).block, returnType);
      return env;
    case DECL:
      final Ast.Decl decl = (Ast.Decl) statement;
      typeCheck(env, decl.type, TYPE);
      if (decl.initializer == null) {
        return env.bind(decl.name, decl.type);
      }
      typeCheck(env, decl.initializer, decl.type);
      return env.bind(decl.name, decl.type, decl.initializer);
    case IF_STATEMENT:
      final Ast.IfStatement ifStatement = (Ast.IfStatement) statement;
      for (int i = 0; i < ifStatement.conditions.size(); i++) {
        typeCheck(env, ifStatement.conditions.get(i), BOOL);
        checkBlock(env, ifStatement.thens.get(i), returnType);
      }
      checkBlock(env, ifStatement.orElse, returnType);
      return env;
    default:
      throw new AssertionError("unknown statement " + statement.op);
    }
  }

  /** Checks a block. Declarations in the block are not visible after it.
   *
   * <p>A declaration that would hide a name of the environment is renamed,
   * in the rest of the block. The return type is outside the declaration's
   * scope, and keeps referring to the outer name. */
  public void checkBlock(Environment env, Ast.Block block,
      Ast.Exp returnType) {
    List<Ast.Statement> statements = block.statements;
    while (!statements.isEmpty()) {
      Ast.Statement statement = statements.get(0);
      statements = skip(statements, 1);
      if (statement.op == Op.DECL) {
        final Ast.Decl decl = (Ast.Decl) statement;
        final Symbol name = binderName(env, decl.name);
        if (!name.equals(decl.name)) {
          statement = decl.copy(decl.type, name, decl.initializer);
          statements =
              Substituter.substitute(nameGenerator,
                  ast.block(block.pos, statements), decl.name,
                  ast.id(decl.pos, name)).statements;
        }
      }
      env = checkStatement(env, statement, returnType);
    }
  }

  // top-level

  /** Checks the signature of a declaration, and returns an environment in
   * which the declaration is bound to its signature. */
  public Environment checkSignature(Environment env, Ast.TopLevel topLevel) {
    final Ast.Exp signature = topLevel.signature();
    typeCheck(env, signature, TYPE);
    return env.bind(topLevel.name, signature);
  }

  /** Checks the body of a declaration, in an environment that contains the
   * signatures of all declarations that it may reference. */
  public void checkBody(Environment env, Ast.TopLevel topLevel) {
    final Ast.FuncDecl funcDecl = (Ast.FuncDecl) topLevel;
    final Scope scope =
        enterTelescope(env, funcDecl, funcDecl.params, funcDecl.returnType,
            funcDecl.body);
    checkBlock(scope.env, (Ast.Block) scope.nodes.get(1), scope.exp(0));
  }

  /** Checks the signature and body of a declaration, and returns an
   * environment in which the declaration is bound. The body may call the
   * declaration recursively. */
  public Environment typeCheckTopLevel(Environment env,
      Ast.TopLevel topLevel) {
    final Environment env2 = checkSignature(env, topLevel);
    checkBody(env2, topLevel);
    return env2;
  }

  /** Environment in which the names of a telescope are bound, with the
   * parameters and the nodes in their scope after renaming. */
  private static class Scope {
    final Environment env;
    final List<Ast.Param> params;
    final List<AstNode> nodes;

    Scope(Environment env, List<Ast.Param> params, List<AstNode> nodes) {
      this.env = env;
      this.params = ImmutableList.copyOf(params);
      this.nodes = nodes;
    }

    Ast.Exp exp(int i) {
      return (Ast.Exp) nodes.get(i);
    }
  }
}

// End TypeChecker.java
