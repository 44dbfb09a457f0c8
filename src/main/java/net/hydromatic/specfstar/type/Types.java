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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.specfstar.ast.Ident;

/** Factory methods for {@link Type} objects. */
public abstract class Types {
  private Types() {}

  /** Creates a sequence type, e.g. {@code Seq<u8>}. */
  public static SeqType seq(Type elementType) {
    return new SeqType(elementType);
  }

  /** Creates an array type whose length is an integer literal. */
  public static ArrayType array(int size, Type elementType) {
    return new ArrayType(ArrayType.ArraySize.of(size), elementType);
  }

  /** Creates an array type whose length is a named constant. */
  public static ArrayType array(String sizeConstant, Type elementType) {
    return new ArrayType(
        ArrayType.ArraySize.of(Ident.of(sizeConstant)), elementType);
  }

  /** Creates a tuple type. */
  public static TupleType tuple(Type... argTypes) {
    return new TupleType(ImmutableList.copyOf(argTypes));
  }

  /** Creates a tuple type. */
  public static TupleType tuple(List<? extends Type> argTypes) {
    return new TupleType(argTypes);
  }

  /** Creates a reference to a non-generic named type. */
  public static NamedType named(String name) {
    return new NamedType(Ident.of(name), null);
  }

  /** Creates a reference to a generic named type applied to arguments. */
  public static NamedType named(String name, Type... args) {
    return new NamedType(Ident.of(name), ImmutableList.copyOf(args));
  }

  /** Creates a type variable. */
  public static TypeVar var(int id) {
    return new TypeVar(id);
  }

  /** Creates a natural-integer-modulo type. */
  public static NatModType natMod(boolean secret, String modulus) {
    return new NatModType(secret, modulus);
  }
}

// End Types.java
