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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.atolang.Graph.Step;

/**
 * Rewrites legacy names in the paths of a connection. Only field steps are rewritten; trait and
 * pointer steps pass through unchanged.
 *
 * <ul>
 *   <li>{@code vcc} and {@code gnd} become {@code hv} and {@code lv}.
 *   <li>{@code has_single_electric_reference} becomes a traversal of that trait.
 *   <li>{@code reference_shim} becomes the {@code reference} child of the {@code
 *       has_single_electric_reference} trait.
 * </ul>
 *
 * Each legacy name is reported as deprecated at most once per compilation.
 */
final class ConnectOverrides {

  private static final ImmutableMap<String, String> RENAMED_SEGMENTS =
      ImmutableMap.of("vcc", "hv", "gnd", "lv");

  private static final String REFERENCE_SHIM = "reference_shim";
  private static final String REFERENCE = "reference";

  private final CompileWarnings warnings;

  ConnectOverrides(CompileWarnings warnings) {
    this.warnings = warnings;
  }

  /** Returns {@code path} with every legacy segment rewritten. */
  LinkPath translate(LinkPath path) {
    ImmutableList<Step> steps = path.steps();
    ImmutableList.Builder<Step> result = ImmutableList.builderWithExpectedSize(steps.size() + 1);
    for (int i = 0; i < steps.size(); i++) {
      Step step = steps.get(i);
      if (!step.isField()) {
        result.add(step);
        continue;
      }
      String renamed = RENAMED_SEGMENTS.get(step.name());
      if (renamed != null) {
        warnings.deprecated(step.name(), renamed);
        result.add(Step.field(renamed));
      } else if (step.name().equals(StdlibTypes.HAS_SINGLE_ELECTRIC_REFERENCE)) {
        result.add(Step.trait(StdlibTypes.HAS_SINGLE_ELECTRIC_REFERENCE));
      } else if (step.name().equals(REFERENCE_SHIM)) {
        warnReferenceShim(steps, i);
        result.add(Step.trait(StdlibTypes.HAS_SINGLE_ELECTRIC_REFERENCE));
        result.add(Step.field(REFERENCE));
      } else {
        result.add(step);
      }
    }
    return LinkPath.of(result.build());
  }

  private void warnReferenceShim(ImmutableList<Step> steps, int index) {
    ImmutableList<Step> prefix = steps.subList(0, index);
    ImmutableList<Step> suffix = steps.subList(index + 1, steps.size());
    String replacement =
        Joiner.on('.')
            .join(
                ImmutableList.<Object>builder()
                    .addAll(prefix)
                    .add(StdlibTypes.HAS_SINGLE_ELECTRIC_REFERENCE, REFERENCE)
                    .addAll(suffix)
                    .build());
    warnings.warnOnce(
        "deprecated:" + REFERENCE_SHIM,
        "Field `%s` is deprecated. Replace `%s` with `%s`.",
        REFERENCE_SHIM,
        Step.render(steps),
        replacement);
  }
}
