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
import org.atolang.Graph;
import org.jspecify.annotations.Nullable;

/**
 * A named type visible in a scope. Symbols are created by import statements (with an {@link
 * #importRef}) and by block definitions (with a {@link #typeNode}), and are never changed.
 */
public final class Symbol {
  public final String name;
  public final @Nullable ImportRef importRef;
  public final Graph.@Nullable Node typeNode;

  private Symbol(String name, @Nullable ImportRef importRef, Graph.@Nullable Node typeNode) {
    this.name = Preconditions.checkNotNull(name);
    this.importRef = importRef;
    this.typeNode = typeNode;
  }

  static Symbol imported(ImportRef importRef) {
    return new Symbol(importRef.name(), importRef, null);
  }

  static Symbol defined(String name, Graph.Node typeNode) {
    return new Symbol(name, null, Preconditions.checkNotNull(typeNode));
  }

  /** True if this symbol was imported from the standard library. */
  boolean isStdlib() {
    return importRef != null && importRef.isStdlib();
  }

  @Override
  public String toString() {
    return (importRef != null) ? "Symbol(" + importRef + ")" : "Symbol(" + name + ")";
  }
}
