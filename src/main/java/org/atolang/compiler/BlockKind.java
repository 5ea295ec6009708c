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

import com.google.common.collect.ImmutableList;
import org.atolang.ast.Ast;
import org.jspecify.annotations.Nullable;

/**
 * The three kinds of block. Every block type is created with the same provenance trait ({@code
 * is_ato_block}, recording the directory of the source file) plus the marker trait of its kind.
 */
enum BlockKind {
  MODULE(StdlibTypes.IS_ATO_MODULE),
  COMPONENT(StdlibTypes.IS_ATO_COMPONENT),
  INTERFACE(StdlibTypes.IS_ATO_INTERFACE);

  final String markerTrait;

  BlockKind(String markerTrait) {
    this.markerTrait = markerTrait;
  }

  static BlockKind of(Ast.BlockDefinition.BlockType blockType) {
    return switch (blockType) {
      case MODULE -> MODULE;
      case COMPONENT -> COMPONENT;
      case INTERFACE -> INTERFACE;
    };
  }

  /** Returns the actions that turn an empty type into a block of this kind. */
  ImmutableList<Action> shell(@Nullable String sourceDir, LoweringContext context) {
    ChildField.Builder provenance = ChildField.library(StdlibTypes.IS_ATO_BLOCK);
    if (sourceDir != null) {
      provenance.attribute("source_dir", sourceDir);
    }
    return ImmutableList.<Action>builder()
        .addAll(
            Action.attachTrait(
                null, context.newIdentifier(StdlibTypes.IS_ATO_BLOCK), provenance.build()))
        .addAll(
            Action.attachTrait(
                null,
                context.newIdentifier(markerTrait),
                ChildField.library(markerTrait).build()))
        .build();
  }
}
