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
package net.hydromatic.specfstar.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.specfstar.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.specfstar.type.PrimitiveType;
import net.hydromatic.specfstar.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds syntax tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // identifiers

  /** Creates a reference to a variable with a source name. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, Ident.of(name));
  }

  /** Creates a reference to a variable. */
  public Ast.Id id(Pos pos, Ident name) {
    return new Ast.Id(pos, name);
  }

  // literals

  /** Creates the unit literal, "()". */
  public Ast.Literal unitLiteral(Pos pos) {
    return new Ast.Literal(pos, Op.UNIT_LITERAL, PrimitiveType.UNIT, null);
  }

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean b) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, PrimitiveType.BOOL, b);
  }

  /**
   * Creates an integer literal of a given type.
   *
   * <p>If the type is {@code usize} or {@code isize} the literal is a
   * machine-size literal, otherwise a fixed-width literal.
   */
  public Ast.Literal intLiteral(Pos pos, PrimitiveType type,
      BigInteger value) {
    checkArgument(type.isInteger(), "not an integer type: %s", type);
    return new Ast.Literal(pos,
        type.isMachineSize() ? Op.SIZE_LITERAL : Op.INT_LITERAL, type, value);
  }

  /** Creates an integer literal of a given type. */
  public Ast.Literal intLiteral(Pos pos, PrimitiveType type, long value) {
    return intLiteral(pos, type, BigInteger.valueOf(value));
  }

  /** Creates a {@code usize} literal. */
  public Ast.Literal usizeLiteral(Pos pos, long value) {
    return intLiteral(pos, PrimitiveType.USIZE, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, PrimitiveType.STR, value);
  }

  // patterns

  public Ast.IdPat idPat(Pos pos, String name) {
    return new Ast.IdPat(pos, Ident.of(name));
  }

  public Ast.IdPat idPat(Pos pos, Ident name) {
    return new Ast.IdPat(pos, name);
  }

  public Ast.WildcardPat wildcardPat(Pos pos) {
    return new Ast.WildcardPat(pos);
  }

  public Ast.TuplePat tuplePat(Pos pos, Iterable<? extends Ast.Pat> args) {
    return new Ast.TuplePat(pos, ImmutableList.copyOf(args));
  }

  public Ast.TuplePat tuplePat(Pos pos, Ast.Pat... args) {
    return new Ast.TuplePat(pos, ImmutableList.copyOf(args));
  }

  // expressions

  public Ast.Tuple tuple(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  public Ast.Tuple tuple(Pos pos, Ast.Exp... args) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  /**
   * Creates a call to a binary operator.
   *
   * @param type Type of the operands
   */
  public Ast.InfixCall binary(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1,
      Type type) {
    return new Ast.InfixCall(pos, op, a0, a1, type);
  }

  /**
   * Creates a call to a unary operator.
   *
   * @param type Type of the operand
   */
  public Ast.PrefixCall unary(Pos pos, Op op, Ast.Exp a, Type type) {
    return new Ast.PrefixCall(pos, op, a, type);
  }

  /** Creates a call to a function that is not qualified by a type. */
  public Ast.Call call(Pos pos, String name, Ast.Exp... args) {
    return new Ast.Call(pos, null, Ident.of(name), ImmutableList.copyOf(args));
  }

  /** Creates a call to a function, optionally qualified by a type. */
  public Ast.Call call(Pos pos, @Nullable Type prefix, Ident name,
      Iterable<? extends Ast.Exp> args) {
    return new Ast.Call(pos, prefix, name, ImmutableList.copyOf(args));
  }

  /** Creates a call to a function qualified by a type. */
  public Ast.Call call(Pos pos, Type prefix, String name, Ast.Exp... args) {
    return new Ast.Call(pos, prefix, Ident.of(name),
        ImmutableList.copyOf(args));
  }

  /** Creates a call to a method. */
  public Ast.MethodCall methodCall(Pos pos, Ast.Exp receiver,
      @Nullable Type receiverType, Ident name,
      Iterable<? extends Ast.Exp> args) {
    return new Ast.MethodCall(pos, receiver, receiverType, name,
        ImmutableList.copyOf(args));
  }

  /** Creates a call to a method. */
  public Ast.MethodCall methodCall(Pos pos, Ast.Exp receiver,
      @Nullable Type receiverType, String name, Ast.Exp... args) {
    return methodCall(pos, receiver, receiverType, Ident.of(name),
        ImmutableList.copyOf(args));
  }

  public Ast.ArrayIndex arrayIndex(Pos pos, Ident array, Ast.Exp index) {
    return new Ast.ArrayIndex(pos, array, index);
  }

  public Ast.NewArray newArray(Pos pos, Ident.@Nullable Original typeName,
      @Nullable Type elementType, Iterable<? extends Ast.Exp> args) {
    return new Ast.NewArray(pos, typeName, elementType,
        ImmutableList.copyOf(args));
  }

  public Ast.Cast cast(Pos pos, Ast.Exp exp, PrimitiveType type) {
    return new Ast.Cast(pos, exp, type);
  }

  // statements

  public Ast.Let let(Pos pos, Ast.Pat pat, @Nullable Type type, Ast.Exp exp) {
    return new Ast.Let(pos, pat, type, exp);
  }

  public Ast.Reassign reassign(Pos pos, Ident name, Ast.Exp exp) {
    return new Ast.Reassign(pos, name, exp);
  }

  public Ast.ArrayUpdate arrayUpdate(Pos pos, Ident array, Ast.Exp index,
      Ast.Exp value) {
    return new Ast.ArrayUpdate(pos, array, index, value);
  }

  public Ast.Return ret(Pos pos, Ast.Exp exp) {
    return new Ast.Return(pos, exp);
  }

  public Ast.If ifThen(Pos pos, Ast.Exp condition, Ast.Block ifTrue,
      Ast.@Nullable Block ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  public Ast.For forLoop(Pos pos, Ident var, Ast.Exp lower, Ast.Exp upper,
      Ast.Block body) {
    return new Ast.For(pos, var, lower, upper, body);
  }

  public Ast.Block block(Pos pos, Type returnType,
      Iterable<? extends Ast.Stmt> stmts) {
    return new Ast.Block(pos, ImmutableList.copyOf(stmts), returnType);
  }

  public Ast.Block block(Pos pos, Type returnType, Ast.Stmt... stmts) {
    return new Ast.Block(pos, ImmutableList.copyOf(stmts), returnType);
  }

  /**
   * Creates the annotation of a block that assigns the given variables; its
   * statement yields the tuple of the variables.
   */
  public Mutations.Mutated mutated(Pos pos, Ident... vars) {
    final ImmutableList<Ident> varList = ImmutableList.copyOf(vars);
    final List<Ast.Id> ids = transformEager(varList, v -> id(pos, v));
    return new Mutations.Mutated(varList, ret(pos, tuple(pos, ids)));
  }

  // declarations

  public Ast.Param param(Pos pos, Ident name, Type type) {
    return new Ast.Param(pos, name, type);
  }

  public Ast.FnDecl fnDecl(Pos pos, Ident name, Iterable<Ast.Param> params,
      Type returnType, Ast.Block body) {
    return new Ast.FnDecl(pos, name, ImmutableList.copyOf(params), returnType,
        body);
  }

  public Ast.ArrayDecl arrayDecl(Pos pos, Ident name, Ast.Exp size,
      Type cellType) {
    return new Ast.ArrayDecl(pos, name, size, cellType);
  }

  public Ast.ConstDecl constDecl(Pos pos, Ident name, Type type,
      Ast.Exp exp) {
    return new Ast.ConstDecl(pos, name, type, exp);
  }

  public Ast.NatDecl natDecl(Pos pos, Ident name, Ident canvasName,
      boolean secret, Ast.Exp canvasSize, String modulus) {
    return new Ast.NatDecl(pos, name, canvasName, secret, canvasSize,
        modulus);
  }

  public Ast.Program program(Pos pos, Iterable<? extends Ast.Decl> decls,
      Mutations mutations) {
    return new Ast.Program(pos, ImmutableList.copyOf(decls), mutations);
  }
}

// End AstBuilder.java
