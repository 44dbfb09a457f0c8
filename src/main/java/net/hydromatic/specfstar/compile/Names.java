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

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;
import net.hydromatic.specfstar.ast.Ast;
import net.hydromatic.specfstar.ast.Ident;
import net.hydromatic.specfstar.doc.Doc;
import net.hydromatic.specfstar.type.PrimitiveType;

/** Translates identifiers and literals to F*. */
public class Names {
  /** Matches the name of a secret integer type, e.g. "U32" or "I128". */
  private static final Pattern SECRET_INT =
      Pattern.compile("(?<prefix>[UI])(?<digits>\\d{1,3})");

  /** Matches the "Iint" that {@link #SECRET_INT} makes of "I8". */
  private static final Pattern SIGNED_INT_FIX =
      Pattern.compile("(?<i>[iI])int");

  /** Matches the characters that separate words. */
  private static final Pattern NON_ALPHANUMERIC =
      Pattern.compile("[^\\p{IsAlphabetic}\\p{IsDigit}]");

  private Names() {}

  /** Translates an identifier. */
  public static Doc ident(Ident ident) {
    return Doc.text(identStr(ident.name()));
  }

  /**
   * Translates a name to an F* identifier.
   *
   * <p>Rewrites the names of secret integer types ("U32" becomes "uint32",
   * "I8" becomes "int8"), converts to snake case, and escapes "new", which is
   * a keyword in F*.
   */
  public static String identStr(String name) {
    String s = SECRET_INT.matcher(name).replaceAll("${prefix}int${digits}");
    s = SIGNED_INT_FIX.matcher(s).replaceAll("${i}nt");
    s = snakeCase(s);
    return s.equals("new") ? "new_" : s;
  }

  /**
   * Converts a name to snake case.
   *
   * <p>Words are separated by characters that are not letters or digits, by
   * a lower-case letter followed by an upper-case letter, and before the last
   * letter of a run of capitals that is followed by a lower-case letter. A
   * digit continues the word it follows. Words are converted to lower case
   * and joined by underscores.
   *
   * <p>For example, "fooBar" and "FooBar" become "foo_bar", "HTTPServer"
   * becomes "http_server", "new_Seq" becomes "new_seq", and "x_3" is
   * unchanged.
   */
  public static String snakeCase(String name) {
    final StringBuilder buf = new StringBuilder();
    for (String word : NON_ALPHANUMERIC.split(name)) {
      int start = 0;
      Mode mode = Mode.BOUNDARY;
      for (int i = 0; i < word.length(); i++) {
        final char c = word.charAt(i);
        if (i + 1 == word.length()) {
          addWord(buf, word.substring(start));
          break;
        }
        final char next = word.charAt(i + 1);
        final Mode nextMode = Character.isLowerCase(c) ? Mode.LOWER
            : Character.isUpperCase(c) ? Mode.UPPER
            : mode;
        if (nextMode == Mode.LOWER && Character.isUpperCase(next)) {
          addWord(buf, word.substring(start, i + 1));
          start = i + 1;
          mode = Mode.BOUNDARY;
        } else if (mode == Mode.UPPER
            && Character.isUpperCase(c)
            && Character.isLowerCase(next)) {
          addWord(buf, word.substring(start, i));
          start = i;
          mode = Mode.BOUNDARY;
        } else {
          mode = nextMode;
        }
      }
    }
    return buf.toString();
  }

  private static void addWord(StringBuilder buf, String word) {
    if (word.isEmpty()) {
      return;
    }
    if (buf.length() > 0) {
      buf.append('_');
    }
    buf.append(word.toLowerCase(Locale.ROOT));
  }

  /** Translates a literal. */
  public static Doc literal(Ast.Literal literal) {
    return Doc.text(literalStr(literal));
  }

  /**
   * Translates a literal to a string.
   *
   * <p>Fixed-width integers are written in hexadecimal, preceded by the
   * function that makes a public integer of their type, e.g.
   * "{@code pub_u32 0x2a}"; negative values are written in two's complement.
   * Machine-size integers are written in decimal, e.g. "{@code usize 3}".
   */
  public static String literalStr(Ast.Literal literal) {
    switch (literal.op) {
      case UNIT_LITERAL:
        return "()";
      case BOOL_LITERAL:
        return String.valueOf(literal.value);
      case STRING_LITERAL:
        return "\"" + literal.value + "\"";
      case SIZE_LITERAL:
        return literal.type.moniker + " " + literal.intValue();
      case INT_LITERAL:
        return "pub_" + literal.type.moniker + " "
            + hex(literal.intValue(), literal.type);
      default:
        throw new AssertionError("not a literal: " + literal.op);
    }
  }

  /** Formats an integer in hexadecimal, e.g. "0x2a". */
  static String hex(BigInteger value, PrimitiveType type) {
    final BigInteger v = value.signum() < 0
        ? value.add(BigInteger.ONE.shiftLeft(type.width))
        : value;
    return "0x" + v.toString(16);
  }

  /** Case of the characters of the current word. */
  private enum Mode {
    BOUNDARY,
    LOWER,
    UPPER
  }
}

// End Names.java
