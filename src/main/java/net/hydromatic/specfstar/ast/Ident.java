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

/**
 * Identifier in a checked program.
 *
 * <p>An identifier is either a name that occurred in the source program
 * ({@link Original}) or a name synthesized by the type checker to avoid
 * capture ({@link Hygienic}).
 *
 * <p>Places in the syntax tree that may only hold source names, such as the
 * name in a {@link net.hydromatic.specfstar.type.NamedType}, are declared with
 * type {@link Original}.
 */
public abstract class Ident {
  private Ident() {}

  /** Returns the name as it appears before translation. */
  public abstract String name();

  @Override
  public String toString() {
    return name();
  }

  /** Creates an identifier for a source name. */
  public static Original of(String name) {
    return new Original(name);
  }

  /** Creates a hygienic identifier. */
  public static Hygienic hygienic(int id, String base) {
    return new Hygienic(id, base);
  }

  /** Identifier that occurred in the source program. */
  public static final class Original extends Ident {
    public final String name;

    Original(String name) {
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty identifier");
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Original && name.equals(((Original) o).name);
    }
  }

  /**
   * Identifier synthesized by the type checker.
   *
   * <p>Its name is the base name followed by an underscore and the id, for
   * example {@code x_3}.
   */
  public static final class Hygienic extends Ident {
    public final int id;
    public final String base;

    Hygienic(int id, String base) {
      checkArgument(id >= 0, "negative id");
      this.id = id;
      this.base = requireNonNull(base);
    }

    @Override
    public String name() {
      return base + "_" + id;
    }

    @Override
    public int hashCode() {
      return base.hashCode() * 31 + id;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Hygienic
              && id == ((Hygienic) o).id
              && base.equals(((Hygienic) o).base);
    }
  }
}

// End Ident.java
