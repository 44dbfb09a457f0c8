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

import java.util.regex.Pattern;

/**
 * Type of natural integers modulo a fixed modulus.
 *
 * <p>The modulus is held as a string of hexadecimal digits without a
 * {@code 0x} prefix, exactly as it occurs in the declaration.
 */
public class NatModType extends BaseType {
  private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");

  public final boolean secret;
  public final String modulus;

  NatModType(boolean secret, String modulus) {
    this.secret = secret;
    this.modulus = requireNonNull(modulus);
    checkArgument(HEX.matcher(modulus).matches(), "invalid modulus %s",
        modulus);
  }

  @Override
  public String moniker() {
    return (secret ? "secret_nat_mod(0x" : "public_nat_mod(0x") + modulus + ")";
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End NatModType.java
