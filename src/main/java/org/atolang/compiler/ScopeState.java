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

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The bookkeeping for one lexical scope (a file, a block body, or one iteration of a for loop):
 * the symbols it defines, the fields it declares (keyed by their {@link FieldPath} string), and its
 * aliases.
 */
final class ScopeState {
  /** Maps each symbol defined in this scope to the corresponding Symbol. */
  final Map<String, Symbol> symbols = new LinkedHashMap<>();

  /** The string form of each FieldPath declared in this scope. */
  final Set<String> fields = new LinkedHashSet<>();

  /** Maps alias names (loop variables, pin labels) to the paths they stand for. */
  final Map<String, FieldPath> aliases = new HashMap<>();
}
