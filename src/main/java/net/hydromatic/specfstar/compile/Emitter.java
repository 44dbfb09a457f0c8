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

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.specfstar.ast.Ast;
import net.hydromatic.specfstar.type.TypeDict;

/**
 * Writes a checked program as an F* module.
 *
 * <p>The module starts with a header that names the module, sets the
 * verifier's options and opens the library modules; then each declaration
 * follows, separated by blank lines.
 */
public class Emitter {
  private final TypeDict typeDict;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;

  public Emitter(TypeDict typeDict, Map<Prop, Object> propMap,
      Tracer tracer) {
    this.typeDict = requireNonNull(typeDict);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Returns the name of the module that is written to a file. */
  public static String moduleName(Path path) {
    final Path fileName = path.getFileName();
    final String name = fileName == null ? "" : fileName.toString();
    final int i = name.lastIndexOf('.');
    return i > 0 ? name.substring(0, i) : name;
  }

  /** Returns the header of a module. */
  public String header(String moduleName) {
    final StringBuilder b = new StringBuilder();
    b.append("module ").append(moduleName).append("\n\n")
        .append("#set-options \"")
        .append(Prop.FSTAR_OPTIONS.stringValue(propMap))
        .append("\"\n\n");
    for (String open : Prop.OPENS.listValue(propMap)) {
      b.append("open ").append(open).append('\n');
    }
    return b.append('\n').toString();
  }

  /**
   * Translates a program to the text of an F* module.
   *
   * <p>The tracer is told about each declaration only once the whole program
   * has been translated.
   *
   * @throws CompileException if the program cannot be translated
   */
  public String translate(Ast.Program program, String moduleName) {
    final Translator translator =
        Translator.create(typeDict, program.mutations, propMap);
    final int lineWidth = Prop.LINE_WIDTH.intValue(propMap);
    final List<String> items = new ArrayList<>();
    for (Ast.Decl decl : program.decls) {
      // Each declaration starts in column 0, so it can be laid out on its
      // own.
      items.add(translator.translate(decl).render(lineWidth));
    }
    final StringBuilder b = new StringBuilder(header(moduleName));
    for (int i = 0; i < items.size(); i++) {
      tracer.onItem(program.decls.get(i), items.get(i));
      b.append(items.get(i)).append("\n\n");
    }
    return b.toString();
  }

  /**
   * Translates a program and writes it to a file.
   *
   * <p>The program is translated before the file is opened, so if
   * translation fails the file is not created. The text is written to a
   * temporary file in the same directory, then moved into place, so the
   * file is either written completely or left as it was. If the file cannot
   * be written, reports the error to the tracer.
   *
   * @return whether the file was written
   */
  public boolean write(Ast.Program program, String file) {
    final String fileName = file.trim();
    final Path path;
    try {
      path = Paths.get(fileName).toAbsolutePath();
    } catch (InvalidPathException e) {
      tracer.handleIoException(fileName, new IOException(e.getMessage(), e));
      return false;
    }
    final String moduleName = moduleName(path);
    final String text;
    try {
      text = translate(program, moduleName);
    } catch (CompileException e) {
      if (!tracer.handleCompileException(e)) {
        throw e;
      }
      return false;
    }
    Path tempPath = null;
    try {
      tempPath = Files.createTempFile(path.getParent(), moduleName, ".tmp");
      try (Writer w =
               Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
        w.write(text);
      }
      Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      if (tempPath != null) {
        try {
          Files.deleteIfExists(tempPath);
        } catch (IOException e2) {
          e.addSuppressed(e2);
        }
      }
      tracer.handleIoException(fileName, e);
      return false;
    }
    tracer.onWrite(fileName, text);
    return true;
  }
}

// End Emitter.java
