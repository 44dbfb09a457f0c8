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
package net.hydromatic.specfstar.doc;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;

/**
 * Document that can be laid out within a given page width.
 *
 * <p>A document is built bottom-up from text fragments and line breaks.
 * {@link #group()} marks a region that is printed on a single line if it
 * fits, otherwise with each of its soft line breaks turned into a newline;
 * {@link #nest(int)} indents the lines that start inside a region.
 *
 * <p>Documents are immutable. Call {@link #render(int)} to lay one out.
 */
public abstract class Doc {
  /** Default page width, used by {@link #toString()}. */
  public static final int DEFAULT_WIDTH = 80;

  private static final Doc NIL = new Concat(ImmutableList.of());
  private static final Doc SPACE = new Text(" ");
  private static final Doc LINE = new Line(" ", false);
  private static final Doc LINE_OR_EMPTY = new Line("", false);
  private static final Doc HARD_LINE = new Line("", true);

  private Doc() {}

  /** Returns the empty document. */
  public static Doc nil() {
    return NIL;
  }

  /**
   * Returns a fragment of text.
   *
   * <p>The text must not contain a newline; use {@link #hardLine()}.
   */
  public static Doc text(String s) {
    checkArgument(s.indexOf('\n') < 0, "text contains newline");
    return s.isEmpty() ? NIL : s.equals(" ") ? SPACE : new Text(s);
  }

  /** Returns a single space. */
  public static Doc space() {
    return SPACE;
  }

  /** Returns a line break that is a space if its group is flat. */
  public static Doc line() {
    return LINE;
  }

  /** Returns a line break that is empty if its group is flat. */
  public static Doc lineOrEmpty() {
    return LINE_OR_EMPTY;
  }

  /** Returns a line break that is always a newline. */
  public static Doc hardLine() {
    return HARD_LINE;
  }

  /** Concatenates documents. */
  public static Doc concat(Iterable<? extends Doc> docs) {
    final ImmutableList<Doc> list = ImmutableList.copyOf(docs);
    switch (list.size()) {
      case 0:
        return NIL;
      case 1:
        return list.get(0);
      default:
        return new Concat(list);
    }
  }

  /** Concatenates documents. */
  public static Doc concat(Doc... docs) {
    return concat(ImmutableList.copyOf(docs));
  }

  /** Concatenates documents, with a separator between each pair. */
  public static Doc intersperse(Iterable<? extends Doc> docs, Doc separator) {
    final ImmutableList.Builder<Doc> b = ImmutableList.builder();
    final Iterator<? extends Doc> iterator = docs.iterator();
    while (iterator.hasNext()) {
      b.add(iterator.next());
      if (iterator.hasNext()) {
        b.add(separator);
      }
    }
    return concat(b.build());
  }

  /** Returns this document followed by another. */
  public Doc append(Doc doc) {
    if (doc == NIL) {
      return this;
    }
    if (this == NIL) {
      return doc;
    }
    return new Concat(ImmutableList.of(this, doc));
  }

  /** Returns this document followed by a fragment of text. */
  public Doc append(String s) {
    return append(text(s));
  }

  /**
   * Returns a document that indents by {@code indent} the lines that begin
   * inside this document.
   */
  public Doc nest(int indent) {
    return indent == 0 || this == NIL ? this : new Nest(indent, this);
  }

  /**
   * Returns a document that is printed flat if it fits in the remaining
   * width of the current line, otherwise broken.
   */
  public Doc group() {
    return this instanceof Group || this == NIL ? this : new Group(this);
  }

  /** Lays out this document within a given page width. */
  public String render(int width) {
    return new Layout(width).render(this);
  }

  /** Lays out this document within the default page width. */
  @Override
  public String toString() {
    return render(DEFAULT_WIDTH);
  }

  /** Fragment of text. */
  static final class Text extends Doc {
    final String s;

    Text(String s) {
      this.s = requireNonNull(s);
    }
  }

  /**
   * Line break.
   *
   * <p>If {@link #hard}, always a newline; otherwise {@link #flat} when
   * printed in a flat group and a newline when printed in a broken one.
   */
  static final class Line extends Doc {
    final String flat;
    final boolean hard;

    Line(String flat, boolean hard) {
      this.flat = requireNonNull(flat);
      this.hard = hard;
    }
  }

  /** Sequence of documents. */
  static final class Concat extends Doc {
    final ImmutableList<Doc> docs;

    Concat(ImmutableList<Doc> docs) {
      this.docs = requireNonNull(docs);
    }
  }

  /** Document whose lines are indented. */
  static final class Nest extends Doc {
    final int indent;
    final Doc doc;

    Nest(int indent, Doc doc) {
      this.indent = indent;
      this.doc = requireNonNull(doc);
    }
  }

  /** Document that is printed flat if it fits. */
  static final class Group extends Doc {
    final Doc doc;

    Group(Doc doc) {
      this.doc = requireNonNull(doc);
    }
  }
}

// End Doc.java
