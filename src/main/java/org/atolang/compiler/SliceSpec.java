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
import java.util.List;
import org.atolang.ast.Ast;
import org.jspecify.annotations.Nullable;

/**
 * A {@code [start:stop:step]} selection from a sequence, with Python's rules: missing bounds
 * default to the ends of the sequence (which ends depends on the sign of the step), negative bounds
 * count from the end, and out-of-range bounds are clamped.
 */
record SliceSpec(@Nullable Integer start, @Nullable Integer stop, @Nullable Integer step) {

  /** Selects every element. */
  static final SliceSpec ALL = new SliceSpec(null, null, null);

  SliceSpec {
    if (step != null && step == 0) {
      throw new DslException("Slice step cannot be zero");
    }
  }

  static SliceSpec of(Ast.@Nullable Slice slice) {
    return (slice == null) ? ALL : new SliceSpec(slice.start, slice.stop, slice.step);
  }

  boolean isIdentity() {
    return start == null && stop == null && (step == null || step == 1);
  }

  <T> ImmutableList<T> apply(List<T> items) {
    if (isIdentity()) {
      return ImmutableList.copyOf(items);
    }
    int size = items.size();
    int by = (step == null) ? 1 : step;
    ImmutableList.Builder<T> result = ImmutableList.builder();
    if (by > 0) {
      int from = bound(start, size, 0, 0, size);
      int to = bound(stop, size, size, 0, size);
      for (int i = from; i < to; i += by) {
        result.add(items.get(i));
      }
    } else {
      int from = bound(start, size, size - 1, -1, size - 1);
      int to = bound(stop, size, -1, -1, size - 1);
      for (int i = from; i > to; i += by) {
        result.add(items.get(i));
      }
    }
    return result.build();
  }

  private static int bound(@Nullable Integer value, int size, int dflt, int lo, int hi) {
    if (value == null) {
      return dflt;
    }
    int v = (value < 0) ? value + size : value;
    return Math.max(lo, Math.min(hi, v));
  }
}
