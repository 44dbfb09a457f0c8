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

import static net.hydromatic.specfstar.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.math.BigInteger;
import net.hydromatic.specfstar.ast.Ident;
import net.hydromatic.specfstar.ast.Pos;
import net.hydromatic.specfstar.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Names}. */
public class NamesTest {
  @Test
  void testSnakeCase() {
    assertThat(Names.snakeCase("foo"), is("foo"));
    assertThat(Names.snakeCase("fooBar"), is("foo_bar"));
    assertThat(Names.snakeCase("FooBar"), is("foo_bar"));
    assertThat(Names.snakeCase("HTTPServer"), is("http_server"));
    assertThat(Names.snakeCase("ABC"), is("abc"));
    assertThat(Names.snakeCase("new_Seq"), is("new_seq"));
    assertThat(Names.snakeCase("x_3"), is("x_3"));
    assertThat(Names.snakeCase("__a__b__"), is("a_b"));
    assertThat(Names.snakeCase("u8Foo"), is("u8_foo"));
    assertThat(Names.snakeCase("Sha256Digest"), is("sha256_digest"));
    assertThat(Names.snakeCase(""), is(""));
  }

  /** Names of secret integer types become the names of their F*
   * counterparts. */
  @Test
  void testSecretIntegerNames() {
    assertThat(Names.identStr("U8"), is("uint8"));
    assertThat(Names.identStr("U32"), is("uint32"));
    assertThat(Names.identStr("U128"), is("uint128"));
    assertThat(Names.identStr("I8"), is("int8"));
    assertThat(Names.identStr("I64"), is("int64"));
    assertThat(Names.identStr("FooI32"), is("foo_int32"));
    assertThat(Names.identStr("U32Word"), is("uint32_word"));
  }

  @Test
  void testKeyword() {
    assertThat(Names.identStr("new"), is("new_"));
    assertThat(Names.identStr("New"), is("new_"));
    assertThat(Names.identStr("renew"), is("renew"));
    assertThat(Names.identStr("new_state"), is("new_state"));
  }

  /** Translating a name twice gives the same result as translating it
   * once. */
  @Test
  void testIdempotent() {
    for (String name
        : new String[] {"fooBar", "U32", "I8", "HTTPServer", "x_3", "a1B2"}) {
      final String once = Names.identStr(name);
      assertThat(Names.identStr(once), is(once));
    }
  }

  @Test
  void testHygienicIdent() {
    assertThat(Names.ident(Ident.hygienic(3, "x")).toString(), is("x_3"));
    assertThat(Names.ident(Ident.hygienic(12, "blockLen")).toString(),
        is("block_len_12"));
    assertThat(Names.ident(Ident.of("outLen")).toString(), is("out_len"));
  }

  @Test
  void testLiterals() {
    final Pos pos = Pos.ZERO;
    assertThat(Names.literalStr(ast.unitLiteral(pos)), is("()"));
    assertThat(Names.literalStr(ast.boolLiteral(pos, true)), is("true"));
    assertThat(Names.literalStr(ast.boolLiteral(pos, false)), is("false"));
    assertThat(Names.literalStr(ast.intLiteral(pos, PrimitiveType.U32, 42)),
        is("pub_u32 0x2a"));
    assertThat(Names.literalStr(ast.intLiteral(pos, PrimitiveType.U8, 0)),
        is("pub_u8 0x0"));
    assertThat(Names.literalStr(ast.intLiteral(pos, PrimitiveType.I8, -1)),
        is("pub_i8 0xff"));
    assertThat(Names.literalStr(ast.intLiteral(pos, PrimitiveType.I32, -2)),
        is("pub_i32 0xfffffffe"));
    assertThat(
        Names.literalStr(
            ast.intLiteral(pos, PrimitiveType.U128,
                BigInteger.ONE.shiftLeft(127))),
        is("pub_u128 0x80000000000000000000000000000000"));
    assertThat(Names.literalStr(ast.usizeLiteral(pos, 3)), is("usize 3"));
    assertThat(Names.literalStr(ast.intLiteral(pos, PrimitiveType.ISIZE, -4)),
        is("isize -4"));
    assertThat(Names.literalStr(ast.stringLiteral(pos, "hello")),
        is("\"hello\""));
  }
}

// End NamesTest.java
