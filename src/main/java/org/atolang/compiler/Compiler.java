/*
 * Copyright 2025 The Atolang Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.atolang.compiler;

import org.atolang.Graph;
import org.atolang.ast.Ast;

/** Compiles a parsed ato file into declarations on a TypeGraph. */
public final class Compiler {

  // Static methods only
  private Compiler() {}

  /** Compiles {@code file} with default options. */
  public static BuildState compile(Ast.File file, Graph.TypeGraph typeGraph) {
    return compile(file, typeGraph, CompileOptions.defaults());
  }

  /**
   * Compiles a parsed ato file.
   *
   * <p>Each block the file defines becomes a type in {@code typeGraph}; the types it imports from
   * other files are left unresolved and listed in the result for the linker.
   *
   * @param file the root of the AST
   * @param typeGraph the TypeGraph that will hold the new types; it must not be used by anything
   *     else until this call returns
   * @param options the file and import paths, and where to report warnings
   * @return the types defined by the file and the type references still to be linked
   * @throws DslException if the file contains an error; nothing further is compiled, but
   *     declarations already made in {@code typeGraph} are not undone
   */
  public static BuildState compile(
      Ast.File file, Graph.TypeGraph typeGraph, CompileOptions options) {
    return new AstVisitor(file, typeGraph, options).build();
  }
}
