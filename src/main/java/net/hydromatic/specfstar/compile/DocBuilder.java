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

import static net.hydromatic.specfstar.doc.Doc.line;
import static net.hydromatic.specfstar.doc.Doc.lineOrEmpty;
import static net.hydromatic.specfstar.doc.Doc.text;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.specfstar.doc.Doc;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds the documents of the F* constructs that the translator emits in
 * several places: bindings, tuples, lists and parenthesized terms.
 *
 * <p>Each breakable construct indents its content by {@link #indent}.
 */
class DocBuilder {
  final int indent;

  DocBuilder(int indent) {
    this.indent = indent;
  }

  /**
   * Creates a binding, "{@code let pat : type = exp in}".
   *
   * <p>If {@code topLevel}, there is no "{@code in}"; otherwise the "in" is
   * on its own line if the binding does not fit on one line.
   */
  Doc letBinding(Doc pat, @Nullable Doc type, Doc exp, boolean topLevel) {
    final Doc patType =
        type == null ? pat : pat.append(" : ").append(type);
    final Doc d = text("let ").append(patType.group()).append(" =").group()
        .append(line().append(exp.group()))
        .nest(indent);
    return topLevel ? d : d.append(line()).append("in");
  }

  /**
   * Creates a tuple, "{@code (a, b)}".
   *
   * <p>A tuple of one element is the element itself, and a tuple of no
   * elements is unit.
   */
  Doc tuple(List<Doc> args) {
    switch (args.size()) {
      case 0:
        return text("()");
      case 1:
        return args.get(0);
      default:
        return bracket("(", args, text(",").append(line()), ")");
    }
  }

  /** Creates a tuple, "{@code (a, b)}". */
  Doc tuple(Doc... args) {
    return tuple(ImmutableList.copyOf(args));
  }

  /** Creates a list, "{@code [a; b]}". */
  Doc list(List<Doc> args) {
    return bracket("[", args, text(";").append(line()), "]");
  }

  /** Creates a tuple type, "{@code (a & b)}". */
  Doc typeTuple(List<Doc> args) {
    return bracket("(", args, text(" &").append(line()), ")");
  }

  private Doc bracket(String open, List<Doc> args, Doc separator,
      String close) {
    return text(open)
        .append(lineOrEmpty().append(Doc.intersperse(args, separator))
            .group()
            .nest(indent))
        .append(lineOrEmpty())
        .append(close)
        .group();
  }

  /** Wraps a term in parentheses, "{@code (e)}". */
  Doc paren(Doc e) {
    return text("(")
        .append(lineOrEmpty().append(e).group().nest(indent))
        .append(")")
        .group();
  }

  /** Wraps a term in "{@code begin e end}". */
  Doc beginEnd(Doc e) {
    return text("begin")
        .append(line().append(e).group().nest(indent))
        .append(line())
        .append("end");
  }
}

// End DocBuilder.java
