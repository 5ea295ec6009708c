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
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/** Translates legacy trait names used in {@code trait} statements to the current traits. */
final class TraitOverrides {

  /** How to build the replacement trait from the statement's template arguments. */
  private record Replacement(
      String traitType,
      boolean deprecated,
      Function<ImmutableMap<String, Object>, ChildField> maker) {}

  private static final ImmutableMap<String, Replacement> OVERRIDES =
      ImmutableMap.of(
          "can_bridge_by_name",
          new Replacement(
              StdlibTypes.CAN_BRIDGE,
              true,
              args ->
                  ChildField.library(StdlibTypes.CAN_BRIDGE)
                      .attribute("in_", ImmutableList.of(args.getOrDefault("input_name", "input")))
                      .attribute(
                          "out_", ImmutableList.of(args.getOrDefault("output_name", "output")))
                      .build()),
          "has_datasheet_defined",
          new Replacement(
              StdlibTypes.HAS_DATASHEET,
              true,
              args ->
                  ChildField.library(StdlibTypes.HAS_DATASHEET)
                      .attribute("datasheet", required(args, "has_datasheet_defined", "datasheet"))
                      .build()),
          "has_single_electric_reference_shared",
          new Replacement(
              StdlibTypes.HAS_SINGLE_ELECTRIC_REFERENCE,
              true,
              args ->
                  ChildField.library(StdlibTypes.HAS_SINGLE_ELECTRIC_REFERENCE)
                      .attribute("ground_only", args.getOrDefault("gnd_only", false))
                      .build()),
          StdlibTypes.HAS_PART_PICKED,
          new Replacement(
              StdlibTypes.HAS_PART_PICKED,
              false,
              args -> ChildField.library(StdlibTypes.HAS_PART_PICKED).attributes(args).build()));

  private final CompileWarnings warnings;

  TraitOverrides(CompileWarnings warnings) {
    this.warnings = warnings;
  }

  /** True if {@code name} is handled here rather than looked up as a library trait. */
  static boolean matches(String name) {
    return OVERRIDES.containsKey(name);
  }

  /** True if {@code name} is a deprecated trait name. */
  static boolean isLegacyName(String name) {
    Replacement override = OVERRIDES.get(name);
    return override != null && override.deprecated;
  }

  /** Returns the trait that replaces the deprecated trait {@code name}, or null. */
  static @Nullable String replacementFor(String name) {
    return isLegacyName(name) ? OVERRIDES.get(name).traitType : null;
  }

  /** Returns the trait to attach for {@code trait name<args>}; {@code name} must match. */
  ChildField handle(String name, Map<String, Object> args) {
    Replacement override = OVERRIDES.get(name);
    if (override == null) {
      throw CompilerException.of("No trait override for %s", name);
    }
    if (override.deprecated) {
      warnings.deprecated(name, override.traitType);
    }
    return override.maker.apply(ImmutableMap.copyOf(args));
  }

  private static Object required(Map<String, Object> args, String trait, String key) {
    Object value = args.get(key);
    if (value == null) {
      throw DslException.of("Missing value for `%s`: '%s'", trait, key);
    }
    return value;
  }
}
