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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.specfstar.compile.CompileException;

/**
 * Side table of mutated-variable annotations, keyed by block.
 *
 * <p>The type checker computes, for the then-block of each conditional and
 * for the body of each loop, the ordered list of outer variables that the
 * block assigns. The translator turns those assignments into a rebinding of
 * the tuple of those variables.
 *
 * <p>Blocks are keyed by identity; two blocks with the same statements are
 * different keys.
 */
public class Mutations {
  public static final Mutations EMPTY = new Mutations(ImmutableMap.of());

  private final Map<Ast.Block, Mutated> map;

  private Mutations(Map<Ast.Block, Mutated> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the annotation of a block.
   *
   * @throws CompileException if the type checker did not annotate the block
   */
  public Mutated get(Ast.Block block) {
    final Mutated mutated = map.get(block);
    if (mutated == null) {
      throw CompileException.internal(
          "block has no mutated-variable annotation", block.pos);
    }
    return mutated;
  }

  /** Returns the number of annotated blocks. */
  public int size() {
    return map.size();
  }

  /**
   * Annotation of a block: the variables it assigns, and the statement that
   * yields the tuple of their values.
   */
  public static class Mutated {
    public final List<Ident> vars;
    public final Ast.Stmt stmt;

    Mutated(ImmutableList<Ident> vars, Ast.Stmt stmt) {
      this.vars = requireNonNull(vars);
      this.stmt = requireNonNull(stmt);
      final Set<Ident> set = new HashSet<>(vars);
      checkArgument(set.size() == vars.size(), "duplicate variable in %s",
          vars);
    }

    @Override
    public String toString() {
      return vars.toString();
    }
  }

  /** Builder for {@link Mutations}. */
  public static class Builder {
    private final Map<Ast.Block, Mutated> map = new IdentityHashMap<>();

    private Builder() {}

    /** Annotates a block with the variables it assigns. */
    @CanIgnoreReturnValue
    public Builder put(Ast.Block block, Mutated mutated) {
      map.put(requireNonNull(block), requireNonNull(mutated));
      return this;
    }

    /**
     * Annotates a block with the variables it assigns, synthesizing the
     * statement that yields their tuple.
     */
    @CanIgnoreReturnValue
    public Builder put(Ast.Block block, Ident... vars) {
      return put(block, AstBuilder.ast.mutated(block.pos, vars));
    }

    public Mutations build() {
      return new Mutations(
          Collections.unmodifiableMap(new IdentityHashMap<>(map)));
    }
  }
}

// End Mutations.java
