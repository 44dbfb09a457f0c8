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
package net.hydromatic.specfstar.type;

import static java.util.Objects.requireNonNull;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.specfstar.ast.Ident;
import org.junit.jupiter.api.Test;

/** Tests for types and the type dictionary. */
public class TypeTest {
  @Test
  void testMoniker() {
    assertThat(PrimitiveType.UNIT.moniker(), is("()"));
    assertThat(Types.seq(PrimitiveType.U8).moniker(), is("Seq<u8>"));
    assertThat(Types.array(16, PrimitiveType.U32).moniker(),
        is("[u32; 16]"));
    assertThat(Types.array("BLOCK_SIZE", PrimitiveType.U8).moniker(),
        is("[u8; BLOCK_SIZE]"));
    assertThat(Types.tuple(PrimitiveType.USIZE, PrimitiveType.BOOL).moniker(),
        is("(usize, bool)"));
    assertThat(Types.named("Block").moniker(), is("Block"));
    assertThat(Types.named("Pair", PrimitiveType.U8, Types.var(1)).moniker(),
        is("Pair<u8, T1>"));
    assertThat(Types.natMod(false, "ff").moniker(),
        is("public_nat_mod(0xff)"));
  }

  @Test
  void testEquals() {
    assertThat(Types.seq(PrimitiveType.U8), is(Types.seq(PrimitiveType.U8)));
    assertThat(Types.seq(PrimitiveType.U8),
        not(is(Types.seq(PrimitiveType.I8))));
    assertThat(Types.named("Block"), is(Types.named("Block")));
    assertThat(PrimitiveType.UNIT.isUnit(), is(true));
    assertThat(Types.tuple().isUnit(), is(false));
  }

  @Test
  void testPrimitive() {
    assertThat(PrimitiveType.U8.isSized(), is(true));
    assertThat(PrimitiveType.USIZE.isSized(), is(false));
    assertThat(PrimitiveType.ISIZE.isMachineSize(), is(true));
    assertThat(PrimitiveType.ISIZE.isInteger(), is(true));
    assertThat(PrimitiveType.STR.isInteger(), is(false));
    assertThat(PrimitiveType.I128.width, is(128));
    assertThat(PrimitiveType.I128.signed, is(true));
  }

  @Test
  void testInvalid() {
    assertThrows(IllegalArgumentException.class,
        () -> Types.natMod(true, "0xff"));
    assertThrows(IllegalArgumentException.class,
        () -> Types.array(-1, PrimitiveType.U8));
    assertThrows(IllegalArgumentException.class, () -> Types.var(-1));
  }

  @Test
  void testTypeDict() {
    final TypeDict dict =
        TypeDict.builder()
            .array("Block", Types.array(64, PrimitiveType.U8))
            .natural("Felem", Types.natMod(true, "7"))
            .alias("Key", Types.named("Block"))
            .build();
    assertThat(ImmutableList.copyOf(dict.names()),
        is(ImmutableList.of("Block", "Felem", "Key")));
    assertThat(requireNonNull(dict.get(Ident.of("Key"))).kind,
        is(DictEntry.ALIAS));
    assertThat(requireNonNull(dict.get("Felem")).type,
        is(Types.natMod(true, "7")));
    assertThat(dict.get("Missing"), nullValue());
    assertThat(TypeDict.EMPTY.names().isEmpty(), is(true));
  }

  /** Tests that the default traversal of {@link TypeVisitor} visits element
   * types. */
  @Test
  void testVisitor() {
    final StringBuilder b = new StringBuilder();
    final TypeVisitor<Void> visitor = new TypeVisitor<Void>() {
      @Override public Void visit(PrimitiveType primitiveType) {
        b.append(primitiveType.moniker).append(' ');
        return null;
      }
    };
    Types.tuple(Types.seq(PrimitiveType.U8),
            Types.array(3, PrimitiveType.BOOL),
            Types.named("Pair", PrimitiveType.U16, Types.var(0)))
        .accept(visitor);
    assertThat(b.toString(), is("u8 bool u16 "));
  }
}

// End TypeTest.java
