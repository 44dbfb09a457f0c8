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

import static java.util.Objects.requireNonNull;

import net.hydromatic.specfstar.ast.Pos;
import net.hydromatic.specfstar.util.FstarException;

/** An error occurred during translation. */
public class CompileException extends RuntimeException
    implements FstarException {
  private final Pos pos;
  public final Kind kind;

  public CompileException(Kind kind, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  /**
   * Creates an exception for a program that the type checker should not
   * have let through.
   */
  public static CompileException internal(String message, Pos pos) {
    return new CompileException(Kind.INTERNAL, message, pos);
  }

  /** Creates an exception for a construct that cannot be translated. */
  public static CompileException unsupported(String message, Pos pos) {
    return new CompileException(Kind.UNSUPPORTED, message, pos);
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Error: ")
        .append(getMessage());
  }

  /** Why a program could not be translated. */
  public enum Kind {
    /** The checked program breaks a contract of the type checker. */
    INTERNAL,
    /** The program uses a construct that has no translation. */
    UNSUPPORTED
  }
}

// End CompileException.java
