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
package net.hydromatic.dependentc.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.dependentc.ast.AstBuilder.ast;
import static net.hydromatic.dependentc.util.Static.allSame;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class for an expression.
   *
   * <p>Types are expressions too; "u32", "struct { type T; T v; }" and
   * "T*" are all expressions that evaluate to types. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Exp accept(Shuttle shuttle);
  }

  /** Literal: a primitive type such as "u32" or "type", an integral
   * value such as "42", or a boolean value. */
  public static class Literal extends Exp {
    public final LiteralKind kind;
    /** Value; a {@link Long} for {@link LiteralKind#INTEGRAL} (interpreted
     * as unsigned), a {@link Boolean} for {@link LiteralKind#BOOLEAN}, null
     * for type literals. */
    public final @Nullable Object value;

    Literal(Pos pos, LiteralKind kind, @Nullable Object value) {
      super(pos, Op.LITERAL);
      this.kind = requireNonNull(kind);
      this.value = value;
      checkArgument(kind == LiteralKind.INTEGRAL ? value instanceof Long
          : kind == LiteralKind.BOOLEAN ? value instanceof Boolean
          : value == null, "value %s does not match kind %s", value, kind);
    }

    /** Returns the value of an integral literal. */
    public long longValue() {
      checkArgument(kind == LiteralKind.INTEGRAL);
      return (Long) requireNonNull(value);
    }

    /** Returns the value of a boolean literal. */
    public boolean booleanValue() {
      checkArgument(kind == LiteralKind.BOOLEAN);
      return (Boolean) requireNonNull(value);
    }

    @Override public int hashCode() {
      return Objects.hash(kind, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && kind == ((Literal) o).kind
          && Objects.equals(value, ((Literal) o).value);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      switch (kind) {
      case INTEGRAL:
        return w.append(Long.toUnsignedString(longValue()));
      case BOOLEAN:
        return w.append(booleanValue() ? "true" : "false");
      default:
        return w.append(requireNonNull(kind.keyword));
      }
    }
  }

  /** Identifier. */
  public static class Id extends Exp {
    public final Symbol name;

    Id(Pos pos, Symbol name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Id
          && this.name.equals(((Id) o).name);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Call to a binary operator, e.g. "a + b", "a == b", "a >> b". */
  public static class BinOp extends Exp {
    public final Exp a0;
    public final Exp a1;

    BinOp(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isBinary(), "not a binary operator: %s", op);
    }

    @Override public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof BinOp
          && op == ((BinOp) o).op
          && a0.equals(((BinOp) o).a0)
          && a1.equals(((BinOp) o).a1);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /** Creates a copy of this {@code BinOp} with given contents,
     * or {@code this} if the contents are the same. */
    public BinOp copy(Exp a0, Exp a1) {
      return this.a0 == a0 && this.a1 == a1
          ? this
          : ast.binOp(pos, op, a0, a1);
    }
  }

  /** Conditional expression, "if c then a else b". */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof If
          && condition.equals(((If) o).condition)
          && ifTrue.equals(((If) o).ifTrue)
          && ifFalse.equals(((If) o).ifFalse);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || right > op.right) {
        w.append("(");
        unparse(w, 0, 0);
        return w.append(")");
      }
      return w.append("if ").append(condition, 0, 0)
          .append(" then ").append(ifTrue, 0, 0)
          .append(" else ").append(ifFalse, 0, 0);
    }

    /** Creates a copy of this {@code If} with given contents,
     * or {@code this} if the contents are the same. */
    public If copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return this.condition == condition
          && this.ifTrue == ifTrue
          && this.ifFalse == ifFalse
          ? this
          : ast.ifThenElse(pos, condition, ifTrue, ifFalse);
    }
  }

  /** A type with an optional name.
   *
   * <p>Used for the parameters of {@link FuncType}, {@link Lambda} and
   * {@link FuncDecl}, and for the fields of {@link Struct} and {@link Union}.
   * The name is required everywhere except in function types and function
   * declarations. */
  public static class Param {
    public final Exp type;
    public final @Nullable Symbol name;

    Param(Exp type, @Nullable Symbol name) {
      this.type = requireNonNull(type);
      this.name = name;
    }

    @Override public int hashCode() {
      return Objects.hash(type, name);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Param
          && type.equals(((Param) o).type)
          && Objects.equals(name, ((Param) o).name);
    }

    @Override public String toString() {
      return unparse(new AstWriter()).toString();
    }

    AstWriter unparse(AstWriter w) {
      w.append(type, 0, 0);
      return name == null ? w : w.append(" ").id(name);
    }

    /** Returns the name; throws if the parameter is unnamed. */
    public Symbol name() {
      return requireNonNull(name, "name");
    }

    /** Creates a copy of this {@code Param} with a given type,
     * or {@code this} if the type is the same. */
    public Param copy(Exp type) {
      return this.type == type ? this : new Param(type, name);
    }

    /** Creates a copy of this {@code Param} with a given name,
     * or {@code this} if the name is the same. */
    public Param rename(@Nullable Symbol name) {
      return Objects.equals(this.name, name) ? this : new Param(type, name);
    }
  }

  /** Dependent function type, e.g. "T[type T, T x]", the type of a function
   * that takes a type "T" and a value "x" of type "T" and returns a "T".
   *
   * <p>Later parameter types and the return type may reference earlier
   * parameter names. */
  public static class FuncType extends Exp {
    public final Exp returnType;
    public final List<Param> params;

    FuncType(Pos pos, Exp returnType, ImmutableList<Param> params) {
      super(pos, Op.FUNC_TYPE);
      this.returnType = requireNonNull(returnType);
      this.params = requireNonNull(params);
    }

    @Override public int hashCode() {
      return Objects.hash(returnType, params);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FuncType
          && returnType.equals(((FuncType) o).returnType)
          && params.equals(((FuncType) o).params);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.operand(returnType, op)
          .append("[")
          .list(params, ", ", (w2, p) -> p.unparse(w2))
          .append("]");
    }

    /** Creates a copy of this {@code FuncType} with given contents,
     * or {@code this} if the contents are the same. */
    public FuncType copy(Exp returnType, List<Param> params) {
      return this.returnType == returnType && allSame(this.params, params)
          ? this
          : ast.funcType(pos, returnType, params);
    }
  }

  /** Function value, e.g. "\(type T, T x) -> x". All parameters are
   * named. */
  public static class Lambda extends Exp {
    public final List<Param> params;
    public final Exp body;

    Lambda(Pos pos, ImmutableList<Param> params, Exp body) {
      super(pos, Op.LAMBDA);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
      params.forEach(p ->
          checkArgument(p.name != null, "lambda parameter must be named"));
    }

    @Override public int hashCode() {
      return Objects.hash(params, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Lambda
          && params.equals(((Lambda) o).params)
          && body.equals(((Lambda) o).body);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || right > op.right) {
        w.append("(");
        unparse(w, 0, 0);
        return w.append(")");
      }
      return w.append("\\(")
          .list(params, ", ", (w2, p) -> p.unparse(w2))
          .append(") -> ")
          .append(body, 0, 0);
    }

    /** Creates a copy of this {@code Lambda} with given contents,
     * or {@code this} if the contents are the same. */
    public Lambda copy(List<Param> params, Exp body) {
      return allSame(this.params, params) && this.body == body
          ? this
          : ast.lambda(pos, params, body);
    }
  }

  /** Function call, e.g. "f(u32, 5)". */
  public static class Call extends Exp {
    public final Exp fn;
    public final List<Exp> args;

    Call(Pos pos, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.CALL);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return Objects.hash(fn, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Call
          && fn.equals(((Call) o).fn)
          && args.equals(((Call) o).args);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.operand(fn, op)
          .append("(")
          .list(args, ", ", (w2, arg) -> w2.append(arg, 0, 0))
          .append(")");
    }

    /** Creates a copy of this {@code Call} with given contents,
     * or {@code this} if the contents are the same. */
    public Call copy(Exp fn, List<Exp> args) {
      return this.fn == fn && allSame(this.args, args)
          ? this
          : ast.call(pos, fn, args);
    }
  }

  /** Base class for {@link Struct} and {@link Union}. */
  public abstract static class RecordType extends Exp {
    public final List<Param> fields;

    RecordType(Pos pos, Op op, ImmutableList<Param> fields) {
      super(pos, op);
      this.fields = requireNonNull(fields);
      fields.forEach(p ->
          checkArgument(p.name != null, "field must be named"));
    }

    /** Returns the ordinal of the field with a given name, or -1. */
    public int indexOf(Symbol name) {
      for (int i = 0; i < fields.size(); i++) {
        if (name.equals(fields.get(i).name)) {
          return i;
        }
      }
      return -1;
    }

    @Override public int hashCode() {
      return Objects.hash(op, fields);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof RecordType
          && op == ((RecordType) o).op
          && fields.equals(((RecordType) o).fields);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(op == Op.STRUCT ? "struct { " : "union { ");
      fields.forEach(p -> p.unparse(w).append("; "));
      return w.append("}");
    }

    /** Creates a copy of this record type with given fields,
     * or {@code this} if the fields are the same. */
    public abstract RecordType copy(List<Param> fields);
  }

  /** Product type, e.g. "struct { type T; T v; }".
   *
   * <p>The fields form a telescope: the type of each field may reference the
   * names of earlier fields. */
  public static class Struct extends RecordType {
    Struct(Pos pos, ImmutableList<Param> fields) {
      super(pos, Op.STRUCT, fields);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Struct copy(List<Param> fields) {
      return allSame(this.fields, fields) ? this : ast.struct(pos, fields);
    }
  }

  /** Sum type, e.g. "union { u32 a; bool b; }".
   *
   * <p>Unlike {@link Struct}, the type of an alternative may not reference
   * the names of other alternatives. */
  public static class Union extends RecordType {
    Union(Pos pos, ImmutableList<Param> fields) {
      super(pos, Op.UNION, fields);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Union copy(List<Param> fields) {
      return allSame(this.fields, fields) ? this : ast.union(pos, fields);
    }
  }

  /** Assignment of a value to a field within a {@link Pack}, e.g.
   * ".v = 5". */
  public static class Assign {
    public final Symbol field;
    public final Exp value;

    Assign(Symbol field, Exp value) {
      this.field = requireNonNull(field);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return Objects.hash(field, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assign
          && field.equals(((Assign) o).field)
          && value.equals(((Assign) o).value);
    }

    @Override public String toString() {
      return unparse(new AstWriter()).toString();
    }

    AstWriter unparse(AstWriter w) {
      return w.append(".").id(field).append(" = ").append(value, 0, 0);
    }

    /** Creates a copy of this {@code Assign} with a given value,
     * or {@code this} if the value is the same. */
    public Assign copy(Exp value) {
      return this.value == value ? this : new Assign(field, value);
    }
  }

  /** Constructs a value of a struct or union type, e.g.
   * "[struct { type T; T v; }]{.T = u32, .v = 5}". */
  public static class Pack extends Exp {
    public final Exp type;
    public final List<Assign> assigns;

    Pack(Pos pos, Exp type, ImmutableList<Assign> assigns) {
      super(pos, Op.PACK);
      this.type = requireNonNull(type);
      this.assigns = requireNonNull(assigns);
    }

    /** Returns the assignment to a given field, or null. */
    public @Nullable Assign assign(Symbol field) {
      for (Assign assign : assigns) {
        if (assign.field.equals(field)) {
          return assign;
        }
      }
      return null;
    }

    @Override public int hashCode() {
      return Objects.hash(type, assigns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Pack
          && type.equals(((Pack) o).type)
          && assigns.equals(((Pack) o).assigns);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").append(type, 0, 0).append("]{")
          .list(assigns, ", ", (w2, a) -> a.unparse(w2))
          .append("}");
    }

    /** Creates a copy of this {@code Pack} with given contents,
     * or {@code this} if the contents are the same. */
    public Pack copy(Exp type, List<Assign> assigns) {
      return this.type == type && allSame(this.assigns, assigns)
          ? this
          : ast.pack(pos, type, assigns);
    }
  }

  /** Projection of a field from a record, e.g. "r.v". */
  public static class Member extends Exp {
    public final Exp record;
    public final Symbol field;

    Member(Pos pos, Exp record, Symbol field) {
      super(pos, Op.MEMBER);
      this.record = requireNonNull(record);
      this.field = requireNonNull(field);
    }

    @Override public int hashCode() {
      return Objects.hash(record, field);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Member
          && record.equals(((Member) o).record)
          && field.equals(((Member) o).field);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.operand(record, op).append(".").id(field);
    }

    /** Creates a copy of this {@code Member} with a given record,
     * or {@code this} if the record is the same. */
    public Member copy(Exp record) {
      return this.record == record ? this : ast.member(pos, record, field);
    }
  }

  /** Pointer type "T*", reference "&amp;e" or dereference "*e".
   * The {@link #op} distinguishes them. */
  public static class PointerExp extends Exp {
    public final Exp exp;

    PointerExp(Pos pos, Op op, Exp exp) {
      super(pos, op);
      this.exp = requireNonNull(exp);
      checkArgument(op == Op.POINTER
          || op == Op.REFERENCE
          || op == Op.DEREFERENCE);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PointerExp
          && op == ((PointerExp) o).op
          && exp.equals(((PointerExp) o).exp);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
      case POINTER:
        return w.operand(exp, op).append("*");
      case REFERENCE:
        return w.append("&").operand(exp, op);
      default:
        return w.append("*").operand(exp, op);
      }
    }

    /** Creates a copy of this {@code PointerExp} with a given operand,
     * or {@code this} if the operand is the same. */
    public PointerExp copy(Exp exp) {
      return this.exp == exp ? this : ast.pointerExp(pos, op, exp);
    }
  }

  /** Base class for a statement. */
  public abstract static class Statement extends AstNode {
    Statement(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Statement accept(Shuttle shuttle);
  }

  /** Empty statement, ";". */
  public static class EmptyStatement extends Statement {
    EmptyStatement(Pos pos) {
      super(pos, Op.EMPTY_STATEMENT);
    }

    @Override public int hashCode() {
      return op.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this || o instanceof EmptyStatement;
    }

    @Override public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(";");
    }
  }

  /** Statement that evaluates an expression, "e;", or returns its value,
   * "return e;". The {@link #op} distinguishes them. */
  public static class ExpStatement extends Statement {
    public final Exp exp;

    ExpStatement(Pos pos, Op op, Exp exp) {
      super(pos, op);
      this.exp = requireNonNull(exp);
      checkArgument(op == Op.EXP_STATEMENT || op == Op.RETURN);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ExpStatement
          && op == ((ExpStatement) o).op
          && exp.equals(((ExpStatement) o).exp);
    }

    @Override public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (op == Op.RETURN) {
        w.append("return ");
      }
      return w.append(exp, 0, 0).append(";");
    }

    /** Creates a copy of this {@code ExpStatement} with a given expression,
     * or {@code this} if the expression is the same. */
    public ExpStatement copy(Exp exp) {
      return this.exp == exp ? this : ast.expStatement(pos, op, exp);
    }
  }

  /** Nested block used as a statement, "{ ... }". */
  public static class BlockStatement extends Statement {
    public final Block block;

    BlockStatement(Pos pos, Block block) {
      super(pos, Op.BLOCK_STATEMENT);
      this.block = requireNonNull(block);
    }

    @Override public int hashCode() {
      return block.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof BlockStatement
          && block.equals(((BlockStatement) o).block);
    }

    @Override public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(block, 0, 0);
    }

    /** Creates a copy of this {@code BlockStatement} with a given block,
     * or {@code this} if the block is the same. */
    public BlockStatement copy(Block block) {
      return this.block == block ? this : ast.blockStatement(pos, block);
    }
  }

  /** Declaration, e.g. "u32 x = 5;" or "type T;". The declared name is
   * visible to the following statements of the enclosing block. */
  public static class Decl extends Statement {
    public final Exp type;
    public final Symbol name;
    public final @Nullable Exp initializer;

    Decl(Pos pos, Exp type, Symbol name, @Nullable Exp initializer) {
      super(pos, Op.DECL);
      this.type = requireNonNull(type);
      this.name = requireNonNull(name);
      this.initializer = initializer;
    }

    @Override public int hashCode() {
      return Objects.hash(type, name, initializer);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Decl
          && type.equals(((Decl) o).type)
          && name.equals(((Decl) o).name)
          && Objects.equals(initializer, ((Decl) o).initializer);
    }

    @Override public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(type, 0, 0).append(" ").id(name);
      if (initializer != null) {
        w.append(" = ").append(initializer, 0, 0);
      }
      return w.append(";");
    }

    /** Creates a copy of this {@code Decl} with given contents,
     * or {@code this} if the contents are the same. */
    public Decl copy(Exp type, Symbol name, @Nullable Exp initializer) {
      return this.type == type
          && this.name.equals(name)
          && this.initializer == initializer
          ? this
          : ast.decl(pos, type, name, initializer);
    }
  }

  /** Chained conditional statement,
   * "if (c0) { ... } else if (c1) { ... } else { ... }".
   *
   * <p>There is one condition per "then" block, and always an "else"
   * block (which may be empty). */
  public static class IfStatement extends Statement {
    public final List<Exp> conditions;
    public final List<Block> thens;
    public final Block orElse;

    IfStatement(Pos pos, ImmutableList<Exp> conditions,
        ImmutableList<Block> thens, Block orElse) {
      super(pos, Op.IF_STATEMENT);
      this.conditions = requireNonNull(conditions);
      this.thens = requireNonNull(thens);
      this.orElse = requireNonNull(orElse);
      checkArgument(!conditions.isEmpty(), "no conditions");
      checkArgument(conditions.size() == thens.size(),
          "conditions and blocks must have the same size");
    }

    @Override public int hashCode() {
      return Objects.hash(conditions, thens, orElse);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IfStatement
          && conditions.equals(((IfStatement) o).conditions)
          && thens.equals(((IfStatement) o).thens)
          && orElse.equals(((IfStatement) o).orElse);
    }

    @Override public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      for (int i = 0; i < conditions.size(); i++) {
        w.append(i == 0 ? "if (" : " else if (")
            .append(conditions.get(i), 0, 0)
            .append(") ")
            .append(thens.get(i), 0, 0);
      }
      return w.append(" else ").append(orElse, 0, 0);
    }

    /** Creates a copy of this {@code IfStatement} with given contents,
     * or {@code this} if the contents are the same. */
    public IfStatement copy(List<Exp> conditions, List<Block> thens,
        Block orElse) {
      return allSame(this.conditions, conditions)
          && allSame(this.thens, thens)
          && this.orElse == orElse
          ? this
          : ast.ifStatement(pos, conditions, thens, orElse);
    }
  }

  /** Sequence of statements forming a lexical scope. */
  public static class Block extends AstNode {
    public final List<Statement> statements;

    Block(Pos pos, ImmutableList<Statement> statements) {
      super(pos, Op.BLOCK);
      this.statements = requireNonNull(statements);
    }

    @Override public int hashCode() {
      return statements.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Block
          && statements.equals(((Block) o).statements);
    }

    @Override public Block accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      statements.forEach(s -> w.append(" ").append(s, 0, 0));
      return w.append(" }");
    }

    /** Creates a copy of this {@code Block} with given statements,
     * or {@code this} if the statements are the same. */
    public Block copy(List<Statement> statements) {
      return allSame(this.statements, statements)
          ? this
          : ast.block(pos, statements);
    }
  }

  /** Base class for a top-level declaration. */
  public abstract static class TopLevel extends AstNode {
    public final Symbol name;

    TopLevel(Pos pos, Op op, Symbol name) {
      super(pos, op);
      this.name = requireNonNull(name);
    }

    /** Returns the signature, the part of the declaration that other
     * declarations may depend upon. */
    public abstract Exp signature();

    @Override public abstract TopLevel accept(Shuttle shuttle);
  }

  /** Function declaration, e.g. "T id(type T, T x) { return x; }". */
  public static class FuncDecl extends TopLevel {
    public final Exp returnType;
    public final List<Param> params;
    public final Block body;

    FuncDecl(Pos pos, Symbol name, Exp returnType, ImmutableList<Param> params,
        Block body) {
      super(pos, Op.FUNC_DECL, name);
      this.returnType = requireNonNull(returnType);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    /** {@inheritDoc}
     *
     * <p>The signature of a function is its function type; it does not
     * include the body. */
    @Override public FuncType signature() {
      return ast.funcType(pos, returnType, params);
    }

    @Override public int hashCode() {
      return Objects.hash(name, returnType, params, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FuncDecl
          && name.equals(((FuncDecl) o).name)
          && returnType.equals(((FuncDecl) o).returnType)
          && params.equals(((FuncDecl) o).params)
          && body.equals(((FuncDecl) o).body);
    }

    @Override public TopLevel accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(returnType, 0, 0).append(" ").id(name).append("(")
          .list(params, ", ", (w2, p) -> p.unparse(w2))
          .append(") ")
          .append(body, 0, 0);
    }

    /** Creates a copy of this {@code FuncDecl} with given contents,
     * or {@code this} if the contents are the same. */
    public FuncDecl copy(Exp returnType, List<Param> params, Block body) {
      return this.returnType == returnType
          && allSame(this.params, params)
          && this.body == body
          ? this
          : ast.funcDecl(pos, name, returnType, params, body);
    }
  }

  /** Sequence of top-level declarations, in the order they were written. */
  public static class TranslationUnit extends AstNode {
    public final List<TopLevel> topLevels;

    TranslationUnit(Pos pos, ImmutableList<TopLevel> topLevels) {
      super(pos, Op.TRANSLATION_UNIT);
      this.topLevels = requireNonNull(topLevels);
    }

    @Override public int hashCode() {
      return topLevels.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TranslationUnit
          && topLevels.equals(((TranslationUnit) o).topLevels);
    }

    @Override public TranslationUnit accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.list(topLevels, "\n", (w2, t) -> w2.append(t, 0, 0));
    }

    /** Creates a copy of this {@code TranslationUnit} with given
     * declarations, or {@code this} if they are the same. */
    public TranslationUnit copy(List<TopLevel> topLevels) {
      return allSame(this.topLevels, topLevels)
          ? this
          : ast.translationUnit(pos, topLevels);
    }
  }
}

// End Ast.java
