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

/**
 * State shared by everything that runs during one compilation: the warnings sink and the counter
 * used to name anonymous children (literals, expressions, traits). Identifiers start with an
 * underscore so they cannot collide with names written in ato.
 */
final class LoweringContext {
  final CompileWarnings warnings;
  private int nextId;

  LoweringContext(CompileWarnings warnings) {
    this.warnings = warnings;
  }

  /** Returns a fresh identifier such as {@code _lit_3}. */
  String newIdentifier(String hint) {
    return "_" + hint + "_" + nextId++;
  }
}
