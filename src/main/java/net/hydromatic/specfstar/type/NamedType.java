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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.specfstar.ast.Ident;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type referenced by name, optionally applied to type arguments.
 *
 * <p>The name may be a key in the {@link TypeDict}, in which case the
 * dictionary says what structural type it stands for.
 */
public class NamedType extends BaseType {
  public final Ident.Original name;
  /** Type arguments, or null if the type is not generic. */
  public final @Nullable List<Type> args;

  NamedType(Ident.Original name, @Nullable List<? extends Type> args) {
    this.name = requireNonNull(name);
    this.args = args == null ? null : ImmutableList.copyOf(args);
  }

  @Override
  public String moniker() {
    if (args == null) {
      return name.name;
    }
    return args.stream()
        .map(Type::moniker)
        .collect(Collectors.joining(", ", name.name + "<", ">"));
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End NamedType.java
