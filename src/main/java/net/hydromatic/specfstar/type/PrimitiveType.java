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

/** Primitive type. */
public enum PrimitiveType implements Type {
  UNIT("()", 0, false),
  BOOL("bool", 0, false),
  U8("u8", 8, false),
  I8("i8", 8, true),
  U16("u16", 16, false),
  I16("i16", 16, true),
  U32("u32", 32, false),
  I32("i32", 32, true),
  U64("u64", 64, false),
  I64("i64", 64, true),
  U128("u128", 128, false),
  I128("i128", 128, true),
  USIZE("usize", 0, false),
  ISIZE("isize", 0, true),
  STR("String", 0, false);

  /** The name in the source language, e.g. {@code u32}. */
  public final String moniker;
  /** Number of bits, or 0 if this is not a fixed-width integer type. */
  public final int width;
  /** Whether values of this type are signed integers. */
  public final boolean signed;

  PrimitiveType(String moniker, int width, boolean signed) {
    this.moniker = moniker;
    this.width = width;
    this.signed = signed;
  }

  @Override
  public String moniker() {
    return moniker;
  }

  @Override
  public String toString() {
    return moniker;
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  /** Returns whether this is a fixed-width integer type, such as {@code u8}. */
  public boolean isSized() {
    return width > 0;
  }

  /** Returns whether this is {@code usize} or {@code isize}. */
  public boolean isMachineSize() {
    return this == USIZE || this == ISIZE;
  }

  /** Returns whether this is an integer type of any width. */
  public boolean isInteger() {
    return isSized() || isMachineSize();
  }
}

// End PrimitiveType.java
