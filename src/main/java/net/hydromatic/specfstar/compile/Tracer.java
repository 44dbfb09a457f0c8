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

import java.io.IOException;
import net.hydromatic.specfstar.ast.Ast;

/** Called on various events during translation. */
public interface Tracer {
  /** Called when a declaration has been translated. */
  void onItem(Ast.Decl decl, String text);

  /** Called when the translated program has been written to a file. */
  void onWrite(String path, String text);

  /**
   * Called with the exception thrown while writing the output file. Returns
   * whether a handler was found.
   */
  boolean handleIoException(String path, IOException e);

  /**
   * Called with the exception thrown during translation. Returns whether a
   * handler was found.
   */
  boolean handleCompileException(CompileException e);
}

// End Tracer.java
