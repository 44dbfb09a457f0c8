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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Lays out a {@link Doc} within a page width.
 *
 * <p>Works in a single pass over a stack of pending documents. Each group is
 * printed flat if its flat text, and the text that follows it up to the next
 * line break, fits in what remains of the current line; otherwise broken.
 *
 * <p>Indentation is written lazily, when the first character of a line is
 * written, so a broken document has no trailing spaces.
 */
class Layout {
  private final int width;
  private final StringBuilder buf = new StringBuilder();
  /** Column at which the next character will be written. */
  private int column;
  /** Indentation owed by the current line, or -1 if it has been written. */
  private int pendingIndent = -1;

  Layout(int width) {
    checkArgument(width > 0, "width must be positive");
    this.width = width;
  }

  String render(Doc doc) {
    final Deque<Cmd> stack = new ArrayDeque<>();
    stack.push(new Cmd(0, Mode.BREAK, doc));
    while (!stack.isEmpty()) {
      final Cmd cmd = stack.pop();
      final Doc d = cmd.doc;
      if (d instanceof Doc.Text) {
        write(((Doc.Text) d).s);
      } else if (d instanceof Doc.Line) {
        final Doc.Line line = (Doc.Line) d;
        if (line.hard || cmd.mode == Mode.BREAK) {
          newline(cmd.indent);
        } else {
          write(line.flat);
        }
      } else if (d instanceof Doc.Concat) {
        final Doc.Concat concat = (Doc.Concat) d;
        for (int i = concat.docs.size() - 1; i >= 0; i--) {
          stack.push(new Cmd(cmd.indent, cmd.mode, concat.docs.get(i)));
        }
      } else if (d instanceof Doc.Nest) {
        final Doc.Nest nest = (Doc.Nest) d;
        stack.push(new Cmd(cmd.indent + nest.indent, cmd.mode, nest.doc));
      } else if (d instanceof Doc.Group) {
        final Doc.Group group = (Doc.Group) d;
        final Mode mode =
            cmd.mode == Mode.FLAT
                || fits(width - column, group.doc, stack.iterator())
                ? Mode.FLAT
                : Mode.BREAK;
        stack.push(new Cmd(cmd.indent, mode, group.doc));
      } else {
        throw new AssertionError("unknown document " + d.getClass());
      }
    }
    return buf.toString();
  }

  private void write(String s) {
    if (s.isEmpty()) {
      return;
    }
    if (pendingIndent >= 0) {
      for (int i = 0; i < pendingIndent; i++) {
        buf.append(' ');
      }
      pendingIndent = -1;
    }
    buf.append(s);
    column += s.length();
  }

  private void newline(int indent) {
    buf.append('\n');
    pendingIndent = indent;
    column = indent;
  }

  /**
   * Returns whether a document, printed flat and followed by the documents
   * in {@code rest}, fits in {@code remaining} columns before the next line
   * break.
   *
   * <p>The documents in {@code rest} are printed in their own mode, so the
   * line ends at the first line break in a broken document, or at a hard
   * line break.
   */
  private static boolean fits(int remaining, Doc doc, Iterator<Cmd> rest) {
    final Deque<Cmd> stack = new ArrayDeque<>();
    stack.push(new Cmd(0, Mode.FLAT, doc));
    boolean inRest = false;
    while (remaining >= 0) {
      if (stack.isEmpty()) {
        if (!rest.hasNext()) {
          return true;
        }
        inRest = true;
        stack.push(rest.next());
      }
      final Cmd cmd = stack.pop();
      final Doc d = cmd.doc;
      if (d instanceof Doc.Text) {
        remaining -= ((Doc.Text) d).s.length();
      } else if (d instanceof Doc.Line) {
        final Doc.Line line = (Doc.Line) d;
        if (line.hard || cmd.mode == Mode.BREAK) {
          // The line ends here. A hard break inside the group itself means
          // the group cannot be flat.
          return inRest;
        }
        remaining -= line.flat.length();
      } else if (d instanceof Doc.Concat) {
        final Doc.Concat concat = (Doc.Concat) d;
        for (int i = concat.docs.size() - 1; i >= 0; i--) {
          stack.push(new Cmd(0, cmd.mode, concat.docs.get(i)));
        }
      } else if (d instanceof Doc.Nest) {
        stack.push(new Cmd(0, cmd.mode, ((Doc.Nest) d).doc));
      } else if (d instanceof Doc.Group) {
        stack.push(new Cmd(0, cmd.mode, ((Doc.Group) d).doc));
      }
    }
    return false;
  }

  /** Whether line breaks in a document are printed as newlines. */
  private enum Mode {
    FLAT,
    BREAK
  }

  /** Document waiting to be printed, with its indentation and mode. */
  private static class Cmd {
    final int indent;
    final Mode mode;
    final Doc doc;

    Cmd(int indent, Mode mode, Doc doc) {
      this.indent = indent;
      this.mode = mode;
      this.doc = doc;
    }
  }
}

// End Layout.java
