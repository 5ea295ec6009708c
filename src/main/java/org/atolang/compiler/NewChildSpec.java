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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.atolang.Graph;
import org.jspecify.annotations.Nullable;

/**
 * The right-hand side of {@code x = new Type}, {@code x = new Type[count]}, or {@code x = new
 * Type<args>}, with the type name already resolved to a symbol.
 */
final class NewChildSpec {
  final Symbol symbol;
  final ImmutableMap<String, Object> templateArgs;

  /** Null for a single child; otherwise the number of elements in the pointer sequence. */
  final @Nullable Integer count;

  NewChildSpec(Symbol symbol, ImmutableMap<String, Object> templateArgs, @Nullable Integer count) {
    this.symbol = Preconditions.checkNotNull(symbol);
    this.templateArgs = templateArgs;
    if (count != null && count < 0) {
      throw DslException.of("Array size must not be negative: %s", count);
    }
    this.count = count;
  }

  /**
   * Returns the field for one instance: templated if the type is a standard-library type whose
   * templated constructor accepts the arguments, otherwise generic. Arguments that cannot be used
   * are reported and dropped.
   */
  ChildField childField(CompileWarnings warnings) {
    ChildField.Builder builder = ChildField.forSymbol(symbol);
    if (templateArgs.isEmpty()) {
      return builder.build();
    }
    StdlibTypes.LibraryType libraryType =
        symbol.isStdlib() ? StdlibTypes.lookup(symbol.name) : null;
    if (libraryType != null && libraryType.acceptsTemplateArgs(templateArgs)) {
      return builder.attributes(templateArgs).build();
    }
    warnings.warn(
        "Template arguments %s for `%s` are ignored: it has no matching templated constructor",
        templateArgs.keySet(),
        symbol.name);
    return builder.build();
  }

  /**
   * Returns the actions declaring the new child (or pointer sequence and its elements) at {@code
   * target}, mounted at {@code parentReference} if non-null.
   */
  ImmutableList<Action> actions(
      FieldPath target, Graph.@Nullable Node parentReference, CompileWarnings warnings) {
    ChildField field = childField(warnings);
    if (count == null) {
      return ImmutableList.of(new Action.AddMakeChild(target, parentReference, null, field));
    }
    ImmutableList.Builder<Action> actions = ImmutableList.builder();
    actions.add(
        new Action.AddMakeChild(
            target,
            parentReference,
            null,
            ChildField.library(StdlibTypes.POINTER_SEQUENCE).build()));
    for (FieldPath element : elements(target)) {
      actions.add(new Action.AddMakeChild(element, null, target, field));
    }
    return actions.build();
  }

  /** Returns the paths of the elements {@code target[0]} ... {@code target[count - 1]}. */
  ImmutableList<FieldPath> elements(FieldPath target) {
    if (count == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<FieldPath> elements = ImmutableList.builderWithExpectedSize(count);
    for (int i = 0; i < count; i++) {
      elements.add(target.child(FieldPath.Segment.index(String.valueOf(i))));
    }
    return elements.build();
  }
}
