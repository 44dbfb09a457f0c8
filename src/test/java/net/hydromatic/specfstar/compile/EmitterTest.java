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
import static net.hydromatic.specfstar.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.specfstar.ast.Ast;
import net.hydromatic.specfstar.ast.Ident;
import net.hydromatic.specfstar.ast.Mutations;
import net.hydromatic.specfstar.ast.Pos;
import net.hydromatic.specfstar.type.PrimitiveType;
import net.hydromatic.specfstar.type.TypeDict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link Emitter}. */
public class EmitterTest {
  private static final Pos POS = Pos.ZERO;

  private static final String HEADER = "module Chacha20\n"
      + "\n"
      + "#set-options \"--fuel 0 --ifuel 1 --z3rlimit 15\"\n"
      + "\n"
      + "open Hacspec.Lib\n"
      + "open FStar.Mul\n"
      + "\n";

  private static Ast.Program program() {
    return ast.program(POS,
        ImmutableList.of(
            ast.constDecl(POS, Ident.of("BLOCK_SIZE"), PrimitiveType.USIZE,
                ast.usizeLiteral(POS, 64)),
            ast.arrayDecl(POS, Ident.of("Block"),
                ast.id(POS, "BLOCK_SIZE"), PrimitiveType.U8)),
        Mutations.EMPTY);
  }

  private static final String BODY = "let block_size : uint_size =\n"
      + "  usize 64\n"
      + "\n"
      + "type block = lseq (pub_uint8) (block_size)\n"
      + "\n";

  /** Program whose translation fails. */
  private static Ast.Program badProgram() {
    return ast.program(POS,
        ImmutableList.of(
            ast.constDecl(POS, Ident.of("X"), PrimitiveType.U32,
                ast.cast(POS, ast.id(POS, "y"), PrimitiveType.U32))),
        Mutations.EMPTY);
  }

  private static Emitter emitter(Tracer tracer) {
    return new Emitter(TypeDict.EMPTY, ImmutableMap.of(), tracer);
  }

  @Test
  void testModuleName() {
    assertThat(Emitter.moduleName(Paths.get("out/Chacha20.fst")),
        is("Chacha20"));
    assertThat(Emitter.moduleName(Paths.get("Hacspec.Sha256.fst")),
        is("Hacspec.Sha256"));
    assertThat(Emitter.moduleName(Paths.get("noext")), is("noext"));
    assertThat(Emitter.moduleName(Paths.get(".hidden")), is(".hidden"));
  }

  @Test
  void testHeader() {
    assertThat(emitter(Tracers.empty()).header("Chacha20"), is(HEADER));

    final Map<Prop, Object> map =
        ImmutableMap.of(Prop.FSTAR_OPTIONS, "--fuel 1",
            Prop.OPENS, "Hacspec.Lib, Spec.Sha2 ,");
    assertThat(
        new Emitter(TypeDict.EMPTY, map, Tracers.empty()).header("M"),
        is("module M\n"
            + "\n"
            + "#set-options \"--fuel 1\"\n"
            + "\n"
            + "open Hacspec.Lib\n"
            + "open Spec.Sha2\n"
            + "\n"));
  }

  @Test
  void testTranslate() {
    final List<String> items = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnItem(Tracers.empty(), (decl, text) -> items.add(text));
    final String text = emitter(tracer).translate(program(), "Chacha20");
    assertThat(text, is(HEADER + BODY));
    assertThat(items,
        is(
            ImmutableList.of("let block_size : uint_size =\n  usize 64",
                "type block = lseq (pub_uint8) (block_size)")));

    // Translation is deterministic
    assertThat(emitter(Tracers.empty()).translate(program(), "Chacha20"),
        is(text));
  }

  @Test
  void testWrite(@TempDir Path dir) throws IOException {
    final Path file = dir.resolve("Chacha20.fst");
    final List<String> written = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnWrite(Tracers.empty(),
            (path, text) -> written.add(path));
    final boolean b =
        emitter(tracer).write(program(), " " + file + "\n");
    assertThat(b, is(true));
    assertThat(new String(Files.readAllBytes(file), StandardCharsets.UTF_8),
        is(HEADER + BODY));
    assertThat(written, is(ImmutableList.of(file.toString())));
  }

  /** Writing replaces an existing file, and leaves no temporary file
   * behind. */
  @Test
  void testWriteReplaces(@TempDir Path dir) throws IOException {
    final Path file = dir.resolve("Chacha20.fst");
    Files.write(file, "old contents".getBytes(StandardCharsets.UTF_8));
    assertThat(emitter(Tracers.empty()).write(program(), file.toString()),
        is(true));
    assertThat(new String(Files.readAllBytes(file), StandardCharsets.UTF_8),
        is(HEADER + BODY));
    assertThat(requireNonNull(dir.toFile().list()).length, is(1));
  }

  /** A file name that is not a valid path is reported as an I/O error. */
  @Test
  void testWriteInvalidPath() {
    final StringWriter sw = new StringWriter();
    final List<IOException> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnIoException(Tracers.printing(new PrintWriter(sw)),
            exceptions::add);
    final boolean b = emitter(tracer).write(program(), "Bad\0Name.fst");
    assertThat(b, is(false));
    assertThat(exceptions.size(), is(1));
    assertThat(sw.toString(),
        startsWith("Unable to write to output file Bad\0Name.fst: \""));
  }

  /** If the output file cannot be written, the emitter reports the error
   * and returns normally. */
  @Test
  void testWriteFails(@TempDir Path dir) {
    final Path file = dir.resolve("no/such/dir/Chacha20.fst");
    final StringWriter sw = new StringWriter();
    final List<IOException> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnIoException(Tracers.printing(new PrintWriter(sw)),
            exceptions::add);
    final boolean b = emitter(tracer).write(program(), file.toString());
    assertThat(b, is(false));
    assertThat(exceptions.size(), is(1));
    assertThat(sw.toString(),
        startsWith("Unable to write to output file " + file + ": \""));
    assertThat(Files.exists(file), is(false));
  }

  /** If translation fails, the output file is not created. */
  @Test
  void testTranslationFails(@TempDir Path dir) {
    final Path file = dir.resolve("Bad.fst");
    final CompileException e =
        assertThrows(CompileException.class,
            () -> emitter(Tracers.empty()).write(badProgram(),
                file.toString()));
    assertThat(e.kind, is(CompileException.Kind.UNSUPPORTED));
    assertThat(Files.exists(file), is(false));

    final StringWriter sw = new StringWriter();
    final boolean b =
        emitter(Tracers.printing(new PrintWriter(sw)))
            .write(badProgram(), file.toString());
    assertThat(b, is(false));
    assertThat(sw.toString(),
        containsString("0.0-0.0 Error: integer cast is not supported"));
    assertThat(Files.exists(file), is(false));

    final List<CompileException> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCompileException(Tracers.empty(), exceptions::add);
    assertThat(emitter(tracer).write(badProgram(), file.toString()),
        is(false));
    assertThat(exceptions.size(), is(1));
    assertThat(exceptions.get(0).getMessage(),
        is("integer cast is not supported"));
  }

  /** The tracer hears of no declaration if a later one cannot be
   * translated. */
  @Test
  void testNoItemsIfTranslationFails() {
    final Ast.Program program =
        ast.program(POS,
            ImmutableList.of(
                ast.constDecl(POS, Ident.of("BLOCK_SIZE"),
                    PrimitiveType.USIZE, ast.usizeLiteral(POS, 64)),
                ast.constDecl(POS, Ident.of("X"), PrimitiveType.U32,
                    ast.cast(POS, ast.id(POS, "y"), PrimitiveType.U32))),
            Mutations.EMPTY);
    final List<String> items = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnItem(Tracers.empty(), (decl, text) -> items.add(text));
    assertThrows(CompileException.class,
        () -> emitter(tracer).translate(program, "M"));
    assertThat(items.isEmpty(), is(true));
  }
}

// End EmitterTest.java
