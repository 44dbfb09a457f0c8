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

import com.google.common.collect.Sets;
import java.util.Set;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  UNIT_LITERAL(true),
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  SIZE_LITERAL(true),
  STRING_LITERAL(true),

  // patterns
  ID_PAT(true),
  WILDCARD_PAT(true),
  TUPLE_PAT(true),

  // expressions
  TUPLE(true),
  CALL(true),
  METHOD_CALL(true),
  ARRAY_INDEX(true),
  NEW_ARRAY(true),
  CAST(" as ", 11),

  // binary operators
  TIMES(" * ", 10),
  DIVIDE(" / ", 10),
  REM(" % ", 10),
  PLUS(" + ", 9),
  MINUS(" - ", 9),
  SHL(" << ", 8),
  SHR(" >> ", 8),
  BIT_AND(" & ", 7),
  BIT_XOR(" ^ ", 6),
  BIT_OR(" | ", 5),
  EQ(" == ", 4),
  NE(" != ", 4),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  ANDALSO(" && ", 3),
  ORELSE(" || ", 2),

  // unary operators
  NOT("!"),
  NEGATE("-"),

  // statements
  LET,
  REASSIGN(" = "),
  ARRAY_UPDATE,
  RETURN,
  IF,
  FOR,
  BLOCK,

  // items
  FN_DECL,
  ARRAY_DECL,
  CONST_DECL,
  NAT_DECL,
  PROGRAM;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  /** Bitwise operators. */
  public static final Set<Op> BITWISE =
      Sets.immutableEnumSet(BIT_XOR, BIT_AND, BIT_OR);

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is a binary operator. */
  public boolean isBinary() {
    return compareTo(TIMES) >= 0 && compareTo(ORELSE) <= 0;
  }

  /** Returns whether this is a unary operator. */
  public boolean isUnary() {
    return this == NOT || this == NEGATE;
  }
}

// End Op.java
