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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.specfstar.ast.Ident;
import net.hydromatic.specfstar.ast.Op;
import net.hydromatic.specfstar.ast.Pos;
import net.hydromatic.specfstar.type.PrimitiveType;
import net.hydromatic.specfstar.type.Type;
import net.hydromatic.specfstar.type.TypeDict;
import net.hydromatic.specfstar.type.Types;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link Resolver}. */
public class ResolverTest {
  private static final TypeDict DICT =
      TypeDict.builder()
          .array("Block", Types.array("BLOCK_SIZE", PrimitiveType.U8))
          .array("State", Types.array(16, PrimitiveType.U32))
          .alias("Key", Types.named("Block"))
          .alias("Length", PrimitiveType.USIZE)
          .natural("FieldElement", Types.natMod(true, "ffffffff"))
          .alias("Element", Types.named("FieldElement"))
          .alias("Loop1", Types.named("Loop2"))
          .alias("Loop2", Types.named("Loop1"))
          .build();

  private final Resolver resolver =
      new Resolver(DICT, TypeTranslator.create(2));

  private String binaryOp(Op op, Type type) {
    return resolver.binaryOp(op, type, Pos.ZERO);
  }

  private String callName(@Nullable Type prefix, String name) {
    return resolver.callName(prefix, Ident.of(name), Pos.ZERO).render(80);
  }

  @Test
  void testMachineSizeOps() {
    assertThat(binaryOp(Op.PLUS, PrimitiveType.USIZE), is("+"));
    assertThat(binaryOp(Op.MINUS, PrimitiveType.ISIZE), is("-"));
    assertThat(binaryOp(Op.TIMES, PrimitiveType.USIZE), is("*"));
    assertThat(binaryOp(Op.DIVIDE, PrimitiveType.USIZE), is("/"));
    assertThat(binaryOp(Op.REM, PrimitiveType.USIZE), is("%."));
    assertThat(binaryOp(Op.LT, PrimitiveType.USIZE), is("<."));
  }

  @Test
  void testSeqOps() {
    final Type seq = Types.seq(PrimitiveType.U8);
    final Type array = Types.array(4, PrimitiveType.U8);
    assertThat(binaryOp(Op.PLUS, seq), is("`seq_add`"));
    assertThat(binaryOp(Op.MINUS, array), is("`seq_minus`"));
    assertThat(binaryOp(Op.TIMES, seq), is("`seq_mul`"));
    assertThat(binaryOp(Op.DIVIDE, seq), is("`seq_div`"));
    assertThat(binaryOp(Op.BIT_XOR, array), is("`seq_xor`"));
    assertThat(binaryOp(Op.BIT_AND, seq), is("`seq_and`"));
    assertThat(binaryOp(Op.BIT_OR, seq), is("`seq_or`"));
    assertThat(binaryOp(Op.EQ, seq), is("=="));
  }

  @Test
  void testMachineIntegerOps() {
    final Type t = PrimitiveType.U32;
    assertThat(binaryOp(Op.PLUS, t), is("+."));
    assertThat(binaryOp(Op.MINUS, t), is("-."));
    assertThat(binaryOp(Op.TIMES, t), is("*."));
    assertThat(binaryOp(Op.DIVIDE, t), is("/."));
    assertThat(binaryOp(Op.REM, t), is("%."));
    assertThat(binaryOp(Op.BIT_XOR, t), is("^."));
    assertThat(binaryOp(Op.BIT_AND, t), is("&."));
    assertThat(binaryOp(Op.BIT_OR, t), is("|."));
    assertThat(binaryOp(Op.SHL, t), is("`shift_left`"));
    assertThat(binaryOp(Op.SHR, t), is("`shift_right`"));
    assertThat(binaryOp(Op.LE, t), is("<=."));
    assertThat(binaryOp(Op.GE, t), is(">=."));
    assertThat(binaryOp(Op.GT, t), is(">."));
    assertThat(binaryOp(Op.NE, t), is("!="));
    assertThat(binaryOp(Op.ANDALSO, PrimitiveType.BOOL), is("&&"));
    assertThat(binaryOp(Op.ORELSE, PrimitiveType.BOOL), is("||"));
  }

  /** An alias or a named array type resolves operators as the type it
   * stands for. */
  @Test
  void testAliasTransparency() {
    assertThat(binaryOp(Op.PLUS, Types.named("Length")),
        is(binaryOp(Op.PLUS, PrimitiveType.USIZE)));
    assertThat(binaryOp(Op.BIT_XOR, Types.named("Block")), is("`seq_xor`"));
    assertThat(binaryOp(Op.BIT_XOR, Types.named("Key")), is("`seq_xor`"));
    assertThat(callName(Types.named("Key"), "new"),
        is(callName(Types.named("Block"), "new")));
  }

  /** A name that is not in the dictionary resolves structurally. */
  @Test
  void testUnknownNamedType() {
    assertThat(binaryOp(Op.PLUS, Types.named("Unknown")), is("+."));
    assertThat(callName(Types.named("MyType"), "from_bytes"),
        is("my_type_from_bytes"));
  }

  @Test
  void testNaturalIntegerOps() {
    final Type t = Types.named("FieldElement");
    assertThat(binaryOp(Op.PLUS, t), is("+"));
    assertThat(binaryOp(Op.MINUS, t), is("-"));
    assertThat(binaryOp(Op.TIMES, t), is("*"));
    assertThat(binaryOp(Op.DIVIDE, t), is("/"));
    assertThat(binaryOp(Op.REM, t), is("%"));
    assertThat(binaryOp(Op.EQ, t), is("=="));
    assertThat(binaryOp(Op.PLUS, Types.named("Element")), is("+"));
    assertThat(binaryOp(Op.TIMES, Types.natMod(false, "7")), is("*"));

    final CompileException e =
        assertThrows(CompileException.class,
            () -> binaryOp(Op.BIT_XOR, t));
    assertThat(e.kind, is(CompileException.Kind.UNSUPPORTED));
    assertThat(e.getMessage(), containsString("'^'"));
  }

  @Test
  void testCyclicAlias() {
    final CompileException e =
        assertThrows(CompileException.class,
            () -> binaryOp(Op.PLUS, Types.named("Loop1")));
    assertThat(e.kind, is(CompileException.Kind.INTERNAL));
    assertThat(e.getMessage(),
        is("type 'Loop1' is defined in terms of itself"));

    final CompileException e2 =
        assertThrows(CompileException.class,
            () -> callName(Types.named("Loop2"), "new"));
    assertThat(e2.kind, is(CompileException.Kind.INTERNAL));
  }

  @Test
  void testUnaryOp() {
    assertThat(resolver.unaryOp(Op.NOT), is("~"));
    assertThat(resolver.unaryOp(Op.NEGATE), is("-"));
  }

  @Test
  void testCallNameWithoutPrefix() {
    assertThat(callName(null, "hashBlock"), is("hash_block"));
    assertThat(callName(null, "U32"), is("secret"));
    assertThat(callName(null, "I8"), is("secret"));
    assertThat(callName(null, "U128"), is("secret"));
    assertThat(callName(null, "uint32_from_le_bytes"),
        is("uint32_from_le_bytes"));
  }

  @Test
  void testCallNameWithPrefix() {
    assertThat(callName(PrimitiveType.U32, "from_le_bytes"),
        is("int_from_le_bytes"));
    assertThat(callName(PrimitiveType.USIZE, "max"), is("int_max"));
    assertThat(callName(PrimitiveType.STR, "len"), is("string_len"));
    assertThat(callName(Types.seq(PrimitiveType.U8), "new"),
        is("seq_new_ #pub_uint8"));
    assertThat(callName(Types.seq(PrimitiveType.U8), "len"),
        is("seq_len #pub_uint8"));
    assertThat(callName(Types.array(16, PrimitiveType.U32), "new"),
        is("seq_new_ 16 #pub_uint32"));
    assertThat(callName(Types.named("Block"), "new"),
        is("seq_new_ block_size"));
    assertThat(callName(Types.named("Block"), "from_slice_range"),
        is("seq_from_slice_range block_size"));
    assertThat(callName(Types.named("State"), "len"), is("seq_len"));
    assertThat(callName(Types.named("FieldElement"), "from_literal"),
        is("nat_from_literal"));
    assertThat(callName(Types.natMod(true, "7"), "one"), is("nat_one"));
  }

  /** Types that have no functions cannot qualify a call. */
  @Test
  void testIllegalPrefix() {
    for (Type type
        : new Type[] {PrimitiveType.UNIT, PrimitiveType.BOOL,
            Types.tuple(PrimitiveType.U8, PrimitiveType.U8), Types.var(1)}) {
      final CompileException e =
          assertThrows(CompileException.class, () -> callName(type, "f"));
      assertThat(e.kind, is(CompileException.Kind.INTERNAL));
      assertThat(e.getMessage(), containsString("cannot qualify"));
    }
  }
}

// End ResolverTest.java
