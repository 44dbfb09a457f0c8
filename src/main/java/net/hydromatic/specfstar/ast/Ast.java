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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.specfstar.type.PrimitiveType;
import net.hydromatic.specfstar.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /**
   * Base class for a pattern.
   *
   * <p>For example, "x" in "let x = 5" is an {@link IdPat}; the "(x, y)" in
   * "let (x, y) = make_pair(1, 2)" is a {@link TuplePat}.
   */
  public abstract static class Pat extends AstNode {
    Pat(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Named pattern, the pattern analog of the {@link Id} expression. */
  public static class IdPat extends Pat {
    public final Ident name;

    IdPat(Pos pos, Ident name) {
      super(pos, Op.ID_PAT);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name.name());
    }
  }

  /** Wildcard pattern, "{@code _}". */
  public static class WildcardPat extends Pat {
    WildcardPat(Pos pos) {
      super(pos, Op.WILDCARD_PAT);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }
  }

  /** Tuple pattern, the pattern analog of the {@link Tuple} expression. */
  public static class TuplePat extends Pat {
    public final List<Pat> args;

    TuplePat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.TUPLE_PAT);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll("(", args, ", ", ")");
    }
  }

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Parse tree node of an identifier. */
  public static class Id extends Exp {
    public final Ident name;

    Id(Pos pos, Ident name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name.name());
    }
  }

  /**
   * Parse tree node of a literal (constant).
   *
   * <p>The value is null for the unit literal, a {@link Boolean} for a boolean
   * literal, a {@link BigInteger} for an integer literal, and a {@link String}
   * for a string literal.
   */
  public static class Literal extends Exp {
    public final PrimitiveType type;
    public final @Nullable Object value;

    Literal(Pos pos, Op op, PrimitiveType type, @Nullable Object value) {
      super(pos, op);
      this.type = requireNonNull(type);
      this.value = value;
      switch (op) {
        case UNIT_LITERAL:
          checkArgument(type == PrimitiveType.UNIT && value == null);
          break;
        case BOOL_LITERAL:
          checkArgument(type == PrimitiveType.BOOL && value instanceof Boolean);
          break;
        case INT_LITERAL:
          checkArgument(type.isSized() && value instanceof BigInteger);
          break;
        case SIZE_LITERAL:
          checkArgument(type.isMachineSize() && value instanceof BigInteger);
          break;
        case STRING_LITERAL:
          checkArgument(type == PrimitiveType.STR && value instanceof String);
          break;
        default:
          throw new AssertionError("not a literal: " + op);
      }
    }

    /** Returns the value of an integer literal. */
    public BigInteger intValue() {
      return (BigInteger) requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case UNIT_LITERAL:
          return w.append("()");
        case STRING_LITERAL:
          return w.append("\"").append((String) value).append("\"");
        case INT_LITERAL:
        case SIZE_LITERAL:
          return w.append(String.valueOf(value)).append(type.moniker);
        default:
          return w.append(String.valueOf(value));
      }
    }
  }

  /** Tuple expression, e.g. "(a, b)". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.TUPLE);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll("(", args, ", ", ")");
    }
  }

  /**
   * Call to an infix operator, e.g. "a + b".
   *
   * <p>{@link #type} is the type of the operands, as resolved by the type
   * checker; it determines which operator the translation uses.
   */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;
    public final Type type;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1, Type type) {
      super(pos, op);
      checkArgument(op.isBinary(), "not a binary operator: %s", op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      this.type = requireNonNull(type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Call to a prefix operator, e.g. "-a" or "!b". */
  public static class PrefixCall extends Exp {
    public final Exp a;
    public final Type type;

    PrefixCall(Pos pos, Op op, Exp a, Type type) {
      super(pos, op);
      checkArgument(op.isUnary(), "not a unary operator: %s", op);
      this.a = requireNonNull(a);
      this.type = requireNonNull(type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /**
   * Call to a function, optionally qualified by a type, e.g. "f(x)" or
   * "Seq::&lt;u8&gt;::new(n)".
   */
  public static class Call extends Exp {
    public final @Nullable Type prefix;
    public final Ident name;
    public final List<Exp> args;

    Call(Pos pos, @Nullable Type prefix, Ident name, ImmutableList<Exp> args) {
      super(pos, Op.CALL);
      this.prefix = prefix;
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (prefix != null) {
        w.append(prefix.moniker()).append("::");
      }
      return w.append(name.name()).appendAll("(", args, ", ", ")");
    }
  }

  /**
   * Call to a method, e.g. "s.len()".
   *
   * <p>{@link #receiverType} is the type of the receiver as resolved by the
   * type checker, or null if it is unknown.
   */
  public static class MethodCall extends Exp {
    public final Exp receiver;
    public final @Nullable Type receiverType;
    public final Ident name;
    public final List<Exp> args;

    MethodCall(Pos pos, Exp receiver, @Nullable Type receiverType, Ident name,
        ImmutableList<Exp> args) {
      super(pos, Op.METHOD_CALL);
      this.receiver = requireNonNull(receiver);
      this.receiverType = receiverType;
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(receiver, Op.METHOD_CALL.right, 0)
          .append(".")
          .append(name.name())
          .appendAll("(", args, ", ", ")");
    }
  }

  /** Element of an array, e.g. "a[i]". */
  public static class ArrayIndex extends Exp {
    public final Ident array;
    public final Exp index;

    ArrayIndex(Pos pos, Ident array, Exp index) {
      super(pos, Op.ARRAY_INDEX);
      this.array = requireNonNull(array);
      this.index = requireNonNull(index);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(array.name())
          .append("[")
          .append(index, 0, 0)
          .append("]");
    }
  }

  /**
   * Array or sequence built from a list of elements, e.g.
   * "Block([1u8, 2u8])".
   */
  public static class NewArray extends Exp {
    public final Ident.@Nullable Original typeName;
    public final @Nullable Type elementType;
    public final List<Exp> args;

    NewArray(Pos pos, Ident.@Nullable Original typeName,
        @Nullable Type elementType, ImmutableList<Exp> args) {
      super(pos, Op.NEW_ARRAY);
      this.typeName = typeName;
      this.elementType = elementType;
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(typeName == null ? "array!" : typeName.name);
      return w.appendAll("([", args, ", ", "])");
    }
  }

  /** Conversion of an integer to another integer type, e.g. "x as u32". */
  public static class Cast extends Exp {
    public final Exp exp;
    public final PrimitiveType type;

    Cast(Pos pos, Exp exp, PrimitiveType type) {
      super(pos, Op.CAST);
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(exp, left, op.left).append(op.padded)
          .append(type.moniker);
    }
  }

  /** Base class of statements. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Statement that binds a pattern, e.g. "let x: u32 = e;". */
  public static class Let extends Stmt {
    public final Pat pat;
    public final @Nullable Type type;
    public final Exp exp;

    Let(Pos pos, Pat pat, @Nullable Type type, Exp exp) {
      super(pos, Op.LET);
      this.pat = requireNonNull(pat);
      this.type = type;
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("let ").append(pat, 0, 0);
      if (type != null) {
        w.append(": ").append(type.moniker());
      }
      return w.append(" = ").append(exp, 0, 0).append(";");
    }
  }

  /** Statement that assigns a new value to a variable, e.g. "x = e;". */
  public static class Reassign extends Stmt {
    public final Ident name;
    public final Exp exp;

    Reassign(Pos pos, Ident name, Exp exp) {
      super(pos, Op.REASSIGN);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name.name()).append(op.padded).append(exp, 0, 0)
          .append(";");
    }
  }

  /** Statement that assigns an element of an array, e.g. "a[i] = e;". */
  public static class ArrayUpdate extends Stmt {
    public final Ident array;
    public final Exp index;
    public final Exp value;

    ArrayUpdate(Pos pos, Ident array, Exp index, Exp value) {
      super(pos, Op.ARRAY_UPDATE);
      this.array = requireNonNull(array);
      this.index = requireNonNull(index);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(array.name()).append("[").append(index, 0, 0)
          .append("] = ").append(value, 0, 0).append(";");
    }
  }

  /** Expression in tail position of a block; the value of the block. */
  public static class Return extends Stmt {
    public final Exp exp;

    Return(Pos pos, Exp exp) {
      super(pos, Op.RETURN);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 0, 0);
    }
  }

  /**
   * Conditional statement, "if c { ... } else { ... }".
   *
   * <p>The variables that the branches assign are recorded in the program's
   * {@link Mutations}, keyed by {@link #ifTrue}.
   */
  public static class If extends Stmt {
    public final Exp condition;
    public final Block ifTrue;
    public final @Nullable Block ifFalse;

    If(Pos pos, Exp condition, Block ifTrue, @Nullable Block ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("if ").append(condition, 0, 0).append(" ")
          .append(ifTrue, 0, 0);
      if (ifFalse != null) {
        w.append(" else ").append(ifFalse, 0, 0);
      }
      return w;
    }
  }

  /**
   * Loop over a range of integers, "for i in lo..hi { ... }".
   *
   * <p>The variables that the body assigns are recorded in the program's
   * {@link Mutations}, keyed by {@link #body}.
   */
  public static class For extends Stmt {
    public final Ident var;
    public final Exp lower;
    public final Exp upper;
    public final Block body;

    For(Pos pos, Ident var, Exp lower, Exp upper, Block body) {
      super(pos, Op.FOR);
      this.var = requireNonNull(var);
      this.lower = requireNonNull(lower);
      this.upper = requireNonNull(upper);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("for ").append(var.name()).append(" in ")
          .append(lower, 0, 0).append("..").append(upper, 0, 0)
          .append(" ").append(body, 0, 0);
    }
  }

  /**
   * Sequence of statements.
   *
   * <p>Blocks are compared by identity; {@link Mutations} uses a block as the
   * key of its annotation.
   */
  public static class Block extends AstNode {
    public final List<Stmt> stmts;
    public final Type returnType;

    Block(Pos pos, ImmutableList<Stmt> stmts, Type returnType) {
      super(pos, Op.BLOCK);
      this.stmts = requireNonNull(stmts);
      this.returnType = requireNonNull(returnType);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll("{", stmts, " ", "}");
    }
  }

  /** Base class of top-level declarations. */
  public abstract static class Decl extends AstNode {
    Decl(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Parameter of a function declaration. */
  public static class Param extends AstNode {
    public final Ident name;
    public final Type type;

    Param(Pos pos, Ident name, Type type) {
      super(pos, Op.ID_PAT);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name.name()).append(": ").append(type.moniker());
    }
  }

  /** Function declaration, "fn f(x: T) -&gt; R { ... }". */
  public static class FnDecl extends Decl {
    public final Ident name;
    public final List<Param> params;
    public final Type returnType;
    public final Block body;

    FnDecl(Pos pos, Ident name, ImmutableList<Param> params, Type returnType,
        Block body) {
      super(pos, Op.FN_DECL);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.returnType = requireNonNull(returnType);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("fn ").append(name.name())
          .appendAll("(", params, ", ", ")")
          .append(" -> ").append(returnType.moniker()).append(" ")
          .append(body, 0, 0);
    }
  }

  /** Declaration of a fixed-length array type, "array!(T, size, U)". */
  public static class ArrayDecl extends Decl {
    public final Ident name;
    public final Exp size;
    public final Type cellType;

    ArrayDecl(Pos pos, Ident name, Exp size, Type cellType) {
      super(pos, Op.ARRAY_DECL);
      this.name = requireNonNull(name);
      this.size = requireNonNull(size);
      this.cellType = requireNonNull(cellType);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("array!(").append(name.name()).append(", ")
          .append(size, 0, 0).append(", ").append(cellType.moniker())
          .append(");");
    }
  }

  /** Declaration of a constant, "const C: T = e;". */
  public static class ConstDecl extends Decl {
    public final Ident name;
    public final Type type;
    public final Exp exp;

    ConstDecl(Pos pos, Ident name, Type type, Exp exp) {
      super(pos, Op.CONST_DECL);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("const ").append(name.name()).append(": ")
          .append(type.moniker()).append(" = ").append(exp, 0, 0)
          .append(";");
    }
  }

  /**
   * Declaration of a natural integer type modulo a constant.
   *
   * <p>Declares two types: the modular integer type itself, and the byte
   * array ("canvas") that holds its representation.
   */
  public static class NatDecl extends Decl {
    public final Ident name;
    public final Ident canvasName;
    public final boolean secret;
    public final Exp canvasSize;
    public final String modulus;

    NatDecl(Pos pos, Ident name, Ident canvasName, boolean secret,
        Exp canvasSize, String modulus) {
      super(pos, Op.NAT_DECL);
      this.name = requireNonNull(name);
      this.canvasName = requireNonNull(canvasName);
      this.secret = secret;
      this.canvasSize = requireNonNull(canvasSize);
      this.modulus = requireNonNull(modulus);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(secret ? "nat_mod!(" : "public_nat_mod!(")
          .append(name.name()).append(", ")
          .append(canvasName.name()).append(", ")
          .append(canvasSize, 0, 0).append(", \"")
          .append(modulus).append("\");");
    }
  }

  /**
   * Checked program: its declarations, in order, and the mutated-variable
   * annotations of its conditionals and loops.
   */
  public static class Program extends AstNode {
    public final List<Decl> decls;
    public final Mutations mutations;

    Program(Pos pos, ImmutableList<Decl> decls, Mutations mutations) {
      super(pos, Op.PROGRAM);
      this.decls = requireNonNull(decls);
      this.mutations = requireNonNull(mutations);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll("", decls, "\n", "");
    }
  }
}

// End Ast.java
