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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.atolang.Graph;
import org.jspecify.annotations.Nullable;

/**
 * The result of compiling one file: the types it defined and the type references the linker still
 * has to resolve. The visitor fills it in; callers see read-only views.
 */
public final class BuildState {

  /** A type reference whose target is an imported type. */
  public record ExternalTypeRef(Graph.Node typeReference, @Nullable ImportRef importRef) {
    public ExternalTypeRef {
      Preconditions.checkNotNull(typeReference);
    }
  }

  /** Block name to type node, in definition order. */
  private final Map<String, Graph.Node> typeRoots = new LinkedHashMap<>();

  private final List<ExternalTypeRef> externalTypeRefs = new ArrayList<>();

  public final @Nullable String filePath;
  public final @Nullable String importPath;

  BuildState(@Nullable String filePath, @Nullable String importPath) {
    this.filePath = filePath;
    this.importPath = importPath;
  }

  public Map<String, Graph.Node> typeRoots() {
    return Collections.unmodifiableMap(typeRoots);
  }

  public List<ExternalTypeRef> externalTypeRefs() {
    return Collections.unmodifiableList(externalTypeRefs);
  }

  void addTypeRoot(String name, Graph.Node typeNode) {
    Graph.Node prev = typeRoots.putIfAbsent(name, typeNode);
    Preconditions.checkState(prev == null, "Duplicate type root %s", name);
  }

  void addExternalTypeRef(Graph.Node typeReference, @Nullable ImportRef importRef) {
    externalTypeRefs.add(new ExternalTypeRef(typeReference, importRef));
  }
}
