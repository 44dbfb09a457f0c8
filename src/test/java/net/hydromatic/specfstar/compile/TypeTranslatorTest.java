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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.specfstar.type.PrimitiveType;
import net.hydromatic.specfstar.type.Type;
import net.hydromatic.specfstar.type.Types;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeTranslator}. */
public class TypeTranslatorTest {
  private final TypeTranslator typeTranslator = TypeTranslator.create(2);

  private String translate(Type type) {
    return typeTranslator.translate(type).render(80);
  }

  @Test
  void testPrimitive() {
    assertThat(translate(PrimitiveType.UNIT), is("unit"));
    assertThat(translate(PrimitiveType.BOOL), is("bool"));
    assertThat(translate(PrimitiveType.U8), is("pub_uint8"));
    assertThat(translate(PrimitiveType.I8), is("pub_int8"));
    assertThat(translate(PrimitiveType.U16), is("pub_uint16"));
    assertThat(translate(PrimitiveType.I16), is("pub_int16"));
    assertThat(translate(PrimitiveType.U32), is("pub_uint32"));
    assertThat(translate(PrimitiveType.I64), is("pub_int64"));
    assertThat(translate(PrimitiveType.U128), is("pub_uint128"));
    assertThat(translate(PrimitiveType.I128), is("pub_int128"));
    assertThat(translate(PrimitiveType.USIZE), is("uint_size"));
    assertThat(translate(PrimitiveType.ISIZE), is("int_size"));
    assertThat(translate(PrimitiveType.STR), is("string"));
  }

  @Test
  void testSeqAndArray() {
    assertThat(translate(Types.seq(PrimitiveType.U8)), is("seq pub_uint8"));
    assertThat(translate(Types.seq(Types.seq(PrimitiveType.BOOL))),
        is("seq seq bool"));
    assertThat(translate(Types.array(16, PrimitiveType.U32)),
        is("lseq pub_uint32 16"));
    assertThat(translate(Types.array("BLOCK_SIZE", PrimitiveType.U8)),
        is("lseq pub_uint8 block_size"));
  }

  @Test
  void testTuple() {
    assertThat(
        translate(Types.tuple(PrimitiveType.USIZE, PrimitiveType.BOOL)),
        is("(uint_size & bool)"));
    assertThat(
        translate(
            Types.tuple(PrimitiveType.U8,
                Types.tuple(PrimitiveType.U16, PrimitiveType.U32))),
        is("(pub_uint8 & (pub_uint16 & pub_uint32))"));
  }

  /** A long tuple type breaks after each "&". */
  @Test
  void testLongTuple() {
    final Type t =
        Types.tuple(Types.named("VeryLongTypeNameNumberOne"),
            Types.named("VeryLongTypeNameNumberTwo"),
            Types.named("VeryLongTypeNameNumberThree"));
    assertThat(translate(t),
        is("(\n"
            + "  very_long_type_name_number_one &\n"
            + "  very_long_type_name_number_two &\n"
            + "  very_long_type_name_number_three\n"
            + ")"));
  }

  @Test
  void testNamed() {
    assertThat(translate(Types.named("Block")), is("block"));
    assertThat(translate(Types.named("KeyPair", PrimitiveType.U8,
            Types.var(3))),
        is("key_pair pub_uint8 't3"));
  }

  @Test
  void testOther() {
    assertThat(translate(Types.var(0)), is("'t0"));
    assertThat(translate(Types.natMod(true, "ffffffff")),
        is("nat_mod 0xffffffff"));
  }
}

// End TypeTranslatorTest.java
