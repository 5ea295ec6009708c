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

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A stack of {@link ScopeState}s, innermost first. Lookups search the current scope and then each
 * enclosing scope in turn; declarations only ever go into the current scope.
 *
 * <p>Scopes are pushed with {@link #enter} and aliases installed with {@link #temporaryAlias}; both
 * return a {@link Guard} that must be closed (with try-with-resources) to undo the change.
 */
final class ScopeStack {
  private static final Logger logger = LoggerFactory.getLogger(ScopeStack.class);

  /** Undoes a scoped change when closed. */
  interface Guard extends AutoCloseable {
    @Override
    void close();
  }

  private final Deque<ScopeState> stack = new ArrayDeque<>();

  /** Pushes a fresh scope, which is popped when the returned Guard is closed. */
  Guard enter() {
    ScopeState state = new ScopeState();
    stack.push(state);
    return () -> {
      ScopeState popped = stack.pop();
      assert popped == state;
    };
  }

  /** The number of active scopes; 1 while visiting the statements of a file. */
  int depth() {
    return stack.size();
  }

  private ScopeState current() {
    Preconditions.checkState(!stack.isEmpty(), "No active scope");
    return stack.peek();
  }

  /** Adds a symbol to the current scope; fails if the current scope already defines the name. */
  void addSymbol(Symbol symbol) {
    ScopeState state = current();
    if (state.symbols.containsKey(symbol.name)) {
      throw DslException.of("Symbol `%s` already defined in scope", symbol.name);
    }
    state.symbols.put(symbol.name, symbol);
    logger.debug("Added symbol {} to scope", symbol);
  }

  /** Declares a field in the current scope; fails if the current scope already declares it. */
  void addField(FieldPath path) {
    addField(path, null);
  }

  /**
   * Declares a field in the current scope; fails if the current scope already declares it. If
   * {@code label} is non-null it is used in place of the path in the error message.
   */
  void addField(FieldPath path, @Nullable String label) {
    ScopeState state = current();
    String key = path.toString();
    if (!state.fields.add(key)) {
      throw DslException.of(
          "Field `%s` already defined in scope", (label != null) ? label : key);
    }
    logger.debug("Added field {} to scope", key);
  }

  /** Returns true if {@code path} has been declared in the current or an enclosing scope. */
  boolean hasField(FieldPath path) {
    String key = path.toString();
    for (ScopeState state : stack) {
      if (state.fields.contains(key)) {
        return true;
      }
    }
    return false;
  }

  /** Throws a DslException unless {@code path} has been declared. */
  void ensureDefined(FieldPath path) {
    if (!hasField(path)) {
      throw DslException.of("Field `%s` is not defined in scope", path);
    }
  }

  /** Returns the innermost symbol with the given name, or null if there is none. */
  @Nullable Symbol tryResolveSymbol(String name) {
    for (ScopeState state : stack) {
      Symbol symbol = state.symbols.get(name);
      if (symbol != null) {
        return symbol;
      }
    }
    return null;
  }

  /** Returns the innermost symbol with the given name, or throws a DslException. */
  Symbol resolveSymbol(String name) {
    Symbol symbol = tryResolveSymbol(name);
    if (symbol == null) {
      throw DslException.of("Symbol `%s` is not available in this scope", name);
    }
    return symbol;
  }

  boolean isSymbolDefined(String name) {
    return tryResolveSymbol(name) != null;
  }

  /** Installs a permanent alias in the current scope. */
  void addAlias(String name, FieldPath path) {
    current().aliases.put(name, path);
  }

  /** Returns the innermost alias with the given name, or null if there is none. */
  @Nullable FieldPath resolveAlias(String name) {
    for (ScopeState state : stack) {
      FieldPath path = state.aliases.get(name);
      if (path != null) {
        return path;
      }
    }
    return null;
  }

  /**
   * Makes {@code name} an alias for {@code path} in the current scope until the returned Guard is
   * closed, at which point any alias it replaced is restored. An alias may not shadow a symbol.
   */
  Guard temporaryAlias(String name, FieldPath path) {
    Preconditions.checkState(!stack.isEmpty(), "Alias cannot be installed without an active scope");
    if (isSymbolDefined(name)) {
      throw DslException.of("Alias `%s` would shadow an existing symbol in scope", name);
    }
    ScopeState state = current();
    FieldPath previous = state.aliases.put(name, path);
    return () -> {
      if (previous != null) {
        state.aliases.put(name, previous);
      } else {
        state.aliases.remove(name);
      }
    };
  }
}
