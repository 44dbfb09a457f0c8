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

/** Type of a value in a checked program. */
public interface Type {
  /**
   * Returns the type as it would be written in the source program, e.g.
   * "{@code u32}", "{@code Seq<u8>}", "{@code (bool, usize)}".
   */
  String moniker();

  <R> R accept(TypeVisitor<R> typeVisitor);

  /** Returns whether this is the unit type. */
  default boolean isUnit() {
    return this == PrimitiveType.UNIT;
  }
}

// End Type.java
