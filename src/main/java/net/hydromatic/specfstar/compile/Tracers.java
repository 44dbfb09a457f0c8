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

import java.io.IOException;
import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.specfstar.ast.Ast;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that prints I/O and compile errors to a writer. */
  public static Tracer printing(PrintWriter out) {
    return new PrintingTracer(out);
  }

  /** Returns a tracer that performs the given action on each translated
   * declaration, then calls the underlying tracer. */
  public static Tracer withOnItem(Tracer tracer,
      BiConsumer<Ast.Decl, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onItem(Ast.Decl decl, String text) {
        consumer.accept(decl, text);
        super.onItem(decl, text);
      }
    };
  }

  /** Returns a tracer that performs the given action on the text written
   * to a file, then calls the underlying tracer. */
  public static Tracer withOnWrite(Tracer tracer,
      BiConsumer<String, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onWrite(String path, String text) {
        consumer.accept(path, text);
        super.onWrite(path, text);
      }
    };
  }

  public static Tracer withOnIoException(Tracer tracer,
      Consumer<IOException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean handleIoException(String path,
          IOException e) {
        consumer.accept(e);
        super.handleIoException(path, e);
        return true;
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean handleCompileException(CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onItem(Ast.Decl decl, String text) {
    }

    @Override public void onWrite(String path, String text) {
    }

    @Override public boolean handleIoException(String path, IOException e) {
      return false;
    }

    @Override public boolean handleCompileException(CompileException e) {
      return false;
    }
  }

  /** Tracer that prints errors. */
  private static class PrintingTracer extends EmptyTracer {
    private final PrintWriter out;

    PrintingTracer(PrintWriter out) {
      this.out = requireNonNull(out);
    }

    @Override public boolean handleIoException(String path, IOException e) {
      out.println("Unable to write to output file " + path + ": \""
          + e.getMessage() + "\"");
      out.flush();
      return true;
    }

    @Override public boolean handleCompileException(CompileException e) {
      out.println(e.describeTo(new StringBuilder()));
      out.flush();
      return true;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onItem(Ast.Decl decl, String text) {
      tracer.onItem(decl, text);
    }

    @Override public void onWrite(String path, String text) {
      tracer.onWrite(path, text);
    }

    @Override public boolean handleIoException(String path, IOException e) {
      return tracer.handleIoException(path, e);
    }

    @Override public boolean handleCompileException(CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
