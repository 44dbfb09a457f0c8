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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.specfstar.ast.Ident;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Table that resolves the name of a declared type to the structural type it
 * stands for.
 *
 * <p>The type checker populates the dictionary; it is immutable while a
 * program is translated.
 */
public class TypeDict {
  public static final TypeDict EMPTY = new TypeDict(ImmutableMap.of());

  private final ImmutableMap<String, Entry> map;

  private TypeDict(ImmutableMap<String, Entry> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the entry for a name, or null if the name is not declared. */
  public @Nullable Entry get(Ident.Original name) {
    return map.get(name.name);
  }

  /** Returns the entry for a name, or null if the name is not declared. */
  public @Nullable Entry get(String name) {
    return map.get(name);
  }

  /** Returns the declared names, in declaration order. */
  public Set<String> names() {
    return map.keySet();
  }

  @Override
  public String toString() {
    return map.toString();
  }

  /** Underlying type of a name, and how the name was declared. */
  public static class Entry {
    public final Type type;
    public final DictEntry kind;

    Entry(Type type, DictEntry kind) {
      this.type = requireNonNull(type);
      this.kind = requireNonNull(kind);
    }

    @Override
    public String toString() {
      return kind + " " + type;
    }
  }

  /** Builder for {@link TypeDict}. */
  public static class Builder {
    private final Map<String, Entry> map = new LinkedHashMap<>();

    private Builder() {}

    /** Declares a name. Later declarations replace earlier ones. */
    @CanIgnoreReturnValue
    public Builder put(String name, Type type, DictEntry kind) {
      map.put(requireNonNull(name), new Entry(type, kind));
      return this;
    }

    /** Declares an alias. */
    @CanIgnoreReturnValue
    public Builder alias(String name, Type type) {
      return put(name, type, DictEntry.ALIAS);
    }

    /** Declares a fixed-length array type. */
    @CanIgnoreReturnValue
    public Builder array(String name, ArrayType type) {
      return put(name, type, DictEntry.ARRAY);
    }

    /** Declares a natural integer type. */
    @CanIgnoreReturnValue
    public Builder natural(String name, NatModType type) {
      return put(name, type, DictEntry.NATURAL_INTEGER);
    }

    public TypeDict build() {
      return new TypeDict(ImmutableMap.copyOf(map));
    }
  }
}

// End TypeDict.java
