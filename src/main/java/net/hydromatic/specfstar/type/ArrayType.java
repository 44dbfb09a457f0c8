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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.specfstar.ast.Ident;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Type of an array whose length is fixed. */
public class ArrayType extends BaseType {
  public final ArraySize size;
  public final Type elementType;

  ArrayType(ArraySize size, Type elementType) {
    this.size = requireNonNull(size);
    this.elementType = requireNonNull(elementType);
  }

  @Override
  public String moniker() {
    return "[" + elementType.moniker() + "; " + size + "]";
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  /**
   * Length of an array type; either the name of a constant or an integer
   * literal.
   */
  public static class ArraySize {
    /** Name of the constant, or null if the size is a literal. */
    public final Ident.@Nullable Original constant;
    /** Literal size; only valid if {@link #constant} is null. */
    public final int value;

    private ArraySize(Ident.@Nullable Original constant, int value) {
      this.constant = constant;
      this.value = value;
    }

    /** Creates a size that is the value of a named constant. */
    public static ArraySize of(Ident.Original constant) {
      return new ArraySize(requireNonNull(constant), 0);
    }

    /** Creates a literal size. */
    public static ArraySize of(int value) {
      checkArgument(value >= 0, "negative array size %s", value);
      return new ArraySize(null, value);
    }

    @Override
    public String toString() {
      return constant != null ? constant.name : Integer.toString(value);
    }

    @Override
    public int hashCode() {
      return toString().hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ArraySize && toString().equals(o.toString());
    }
  }
}

// End ArrayType.java
