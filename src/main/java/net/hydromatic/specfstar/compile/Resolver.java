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
package net.hydromatic.specfstar.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.specfstar.doc.Doc.space;
import static net.hydromatic.specfstar.doc.Doc.text;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.specfstar.ast.Ident;
import net.hydromatic.specfstar.ast.Op;
import net.hydromatic.specfstar.ast.Pos;
import net.hydromatic.specfstar.doc.Doc;
import net.hydromatic.specfstar.type.ArrayType;
import net.hydromatic.specfstar.type.NamedType;
import net.hydromatic.specfstar.type.NatModType;
import net.hydromatic.specfstar.type.PrimitiveType;
import net.hydromatic.specfstar.type.SeqType;
import net.hydromatic.specfstar.type.Type;
import net.hydromatic.specfstar.type.TypeDict;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves operators and function names, which in F* depend on the type of
 * the operands.
 *
 * <p>A named type is resolved through the {@link TypeDict}; aliases, array
 * types and natural integer types are followed to the type they stand for.
 */
public class Resolver {
  /** Operators whose translation does not depend on the operand type. */
  private static final ImmutableMap<Op, String> FIXED =
      ImmutableMap.<Op, String>builder()
          .put(Op.SHL, "`shift_left`")
          .put(Op.SHR, "`shift_right`")
          .put(Op.LT, "<.")
          .put(Op.LE, "<=.")
          .put(Op.GE, ">=.")
          .put(Op.GT, ">.")
          .put(Op.NE, "!=")
          .put(Op.EQ, "==")
          .put(Op.ANDALSO, "&&")
          .put(Op.ORELSE, "||")
          .build();

  /** Operators on natural integers. */
  private static final ImmutableMap<Op, String> NATURAL =
      ImmutableMap.<Op, String>builder()
          .put(Op.PLUS, "+")
          .put(Op.MINUS, "-")
          .put(Op.TIMES, "*")
          .put(Op.DIVIDE, "/")
          .put(Op.REM, "%")
          .build();

  /** Operators on {@code usize} and {@code isize}. */
  private static final ImmutableMap<Op, String> MACHINE =
      ImmutableMap.<Op, String>builder()
          .put(Op.PLUS, "+")
          .put(Op.MINUS, "-")
          .put(Op.TIMES, "*")
          .put(Op.DIVIDE, "/")
          .build();

  /** Element-wise operators on sequences and arrays. */
  private static final ImmutableMap<Op, String> SEQ =
      ImmutableMap.<Op, String>builder()
          .put(Op.PLUS, "`seq_add`")
          .put(Op.MINUS, "`seq_minus`")
          .put(Op.TIMES, "`seq_mul`")
          .put(Op.DIVIDE, "`seq_div`")
          .put(Op.BIT_XOR, "`seq_xor`")
          .put(Op.BIT_AND, "`seq_and`")
          .put(Op.BIT_OR, "`seq_or`")
          .build();

  /** Operators on machine integers. */
  private static final ImmutableMap<Op, String> DOTTED =
      ImmutableMap.<Op, String>builder()
          .put(Op.PLUS, "+.")
          .put(Op.MINUS, "-.")
          .put(Op.TIMES, "*.")
          .put(Op.DIVIDE, "/.")
          .put(Op.REM, "%.")
          .put(Op.BIT_XOR, "^.")
          .put(Op.BIT_AND, "&.")
          .put(Op.BIT_OR, "|.")
          .build();

  /**
   * Names of the constructors of secret integers, as translated. Called
   * without a type prefix, they classify a public integer.
   */
  private static final ImmutableSet<String> SECRET_CONSTRUCTORS =
      ImmutableSet.of("uint128", "uint64", "uint32", "uint16", "uint8",
          "int128", "int64", "int32", "int16", "int8");

  /** Functions of the sequence module that take the length of an array. */
  private static final ImmutableSet<String> SIZED_SEQ_FUNCTIONS =
      ImmutableSet.of("new_", "from_slice", "from_slice_range");

  private static final String SEQ_MODULE = "seq";

  private final TypeDict typeDict;
  private final TypeTranslator typeTranslator;

  public Resolver(TypeDict typeDict, TypeTranslator typeTranslator) {
    this.typeDict = requireNonNull(typeDict);
    this.typeTranslator = requireNonNull(typeTranslator);
  }

  /**
   * Translates a binary operator applied to operands of a given type.
   *
   * @throws CompileException if the operator cannot be applied to natural
   *   integers, or if the type's aliases form a cycle
   */
  public String binaryOp(Op op, Type type, Pos pos) {
    return binaryOp(op, type, pos, new HashSet<>());
  }

  private String binaryOp(Op op, Type type, Pos pos, Set<String> visited) {
    if (type instanceof NamedType) {
      final Ident.Original name = ((NamedType) type).name;
      final TypeDict.Entry entry = typeDict.get(name);
      if (entry != null) {
        checkCycle(name, visited, pos);
        switch (entry.kind) {
          case NATURAL_INTEGER:
            return naturalOp(op, pos);
          case ARRAY:
          case ALIAS:
            return binaryOp(op, entry.type, pos, visited);
          default:
            throw new AssertionError(entry.kind);
        }
      }
    }
    if (type instanceof NatModType) {
      return naturalOp(op, pos);
    }
    final String s = FIXED.get(op);
    if (s != null) {
      return s;
    }
    if (type instanceof PrimitiveType
        && ((PrimitiveType) type).isMachineSize()
        && MACHINE.containsKey(op)) {
      return requireNonNull(MACHINE.get(op));
    }
    if ((type instanceof SeqType || type instanceof ArrayType)
        && SEQ.containsKey(op)) {
      return requireNonNull(SEQ.get(op));
    }
    final String dotted = DOTTED.get(op);
    if (dotted == null) {
      throw new AssertionError("not a binary operator: " + op);
    }
    return dotted;
  }

  private static String naturalOp(Op op, Pos pos) {
    final String s = NATURAL.get(op);
    if (s != null) {
      return s;
    }
    if (Op.BITWISE.contains(op)) {
      throw CompileException.unsupported("operator '" + op.padded.trim()
          + "' is not supported on natural integers", pos);
    }
    return requireNonNull(FIXED.get(op), op::name);
  }

  /** Translates a unary operator. */
  public String unaryOp(Op op) {
    switch (op) {
      case NOT:
        return "~";
      case NEGATE:
        return "-";
      default:
        throw new AssertionError("not a unary operator: " + op);
    }
  }

  /**
   * Translates the name of a function, optionally qualified by the type that
   * defines it.
   *
   * <p>For example, {@code Seq::<u8>::new} becomes {@code seq_new_ #pub_uint8}
   * and {@code U32} becomes {@code secret}.
   *
   * @throws CompileException if the type cannot qualify a function
   */
  public Doc callName(@Nullable Type prefix, Ident name, Pos pos) {
    final String func = Names.identStr(name.name());
    if (prefix == null) {
      return text(SECRET_CONSTRUCTORS.contains(func) ? "secret" : func);
    }
    final Namespace namespace = namespace(prefix, pos, new HashSet<>());
    Doc d = text(namespace.name + "_" + func);
    if (namespace.name.equals(SEQ_MODULE)
        && SIZED_SEQ_FUNCTIONS.contains(func)
        && namespace.size != null) {
      d = d.append(space()).append(TypeTranslator.size(namespace.size));
    }
    final @Nullable Type elementType =
        prefix instanceof SeqType ? ((SeqType) prefix).elementType
            : prefix instanceof ArrayType ? ((ArrayType) prefix).elementType
            : null;
    if (elementType != null) {
      d = d.append(space()).append("#")
          .append(typeTranslator.translate(elementType));
    }
    return d;
  }

  /** Returns the module in which the functions of a type are defined. */
  private Namespace namespace(Type type, Pos pos, Set<String> visited) {
    if (type instanceof PrimitiveType) {
      final PrimitiveType primitiveType = (PrimitiveType) type;
      if (primitiveType.isInteger()) {
        return new Namespace("int", null);
      }
      if (primitiveType == PrimitiveType.STR) {
        return new Namespace("string", null);
      }
    } else if (type instanceof SeqType) {
      return new Namespace(SEQ_MODULE, null);
    } else if (type instanceof ArrayType) {
      return new Namespace(SEQ_MODULE, ((ArrayType) type).size);
    } else if (type instanceof NatModType) {
      return new Namespace("nat", null);
    } else if (type instanceof NamedType) {
      final Ident.Original name = ((NamedType) type).name;
      final TypeDict.Entry entry = typeDict.get(name);
      if (entry == null) {
        return new Namespace(Names.identStr(name.name), null);
      }
      checkCycle(name, visited, pos);
      return namespace(entry.type, pos, visited);
    }
    throw CompileException.internal("type '" + type.moniker()
        + "' cannot qualify a function", pos);
  }

  private static void checkCycle(Ident.Original name, Set<String> visited,
      Pos pos) {
    if (!visited.add(name.name)) {
      throw CompileException.internal("type '" + name.name
          + "' is defined in terms of itself", pos);
    }
  }

  /** Module that defines the functions of a type. */
  private static class Namespace {
    final String name;
    /** Length of the array type, or null if the type is not an array. */
    final ArrayType.@Nullable ArraySize size;

    Namespace(String name, ArrayType.@Nullable ArraySize size) {
      this.name = name;
      this.size = size;
    }
  }
}

// End Resolver.java
