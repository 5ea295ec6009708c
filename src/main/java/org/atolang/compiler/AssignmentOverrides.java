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
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.atolang.ast.Ast;
import org.jspecify.annotations.Nullable;

/**
 * Handles assignments to "sugar" fields, which are not fields at all but shorthands for attaching
 * a trait or constraining a parameter:
 *
 * <ul>
 *   <li>{@code x.package = "0402"} and similar attach a trait to {@code x} (the target's parent).
 *   <li>{@code cap.temperature_coefficient = "X7R"} constrains an enum parameter.
 *   <li>{@code param.default = 1A} attaches {@code has_default_constraint} to {@code param}.
 * </ul>
 *
 * None of these apply when the right-hand side is a {@code new} expression.
 */
final class AssignmentOverrides {

  /** The literal kind a sugar field accepts. */
  enum ValueKind {
    STRING("string"),
    BOOLEAN("boolean");

    final String displayName;

    ValueKind(String displayName) {
      this.displayName = displayName;
    }
  }

  /**
   * A sugar field: the literal kind it accepts and how to build its trait from the value. A null
   * trait means the assignment has no effect.
   */
  private record Sugar(ValueKind kind, Function<Object, @Nullable ChildField> maker) {}

  private static final ImmutableMap<String, Sugar> SUGAR =
      ImmutableMap.<String, Sugar>builder()
          .put(
              "required",
              new Sugar(
                  ValueKind.BOOLEAN,
                  v ->
                      ((Boolean) v)
                          ? ChildField.library(StdlibTypes.REQUIRES_EXTERNAL_USAGE).build()
                          : null))
          .put(
              "package",
              new Sugar(
                  ValueKind.STRING,
                  v ->
                      ChildField.library(StdlibTypes.HAS_PACKAGE_REQUIREMENTS)
                          .attribute("size", SmdSize.parse((String) v))
                          .build()))
          .put(
              "lcsc_id",
              new Sugar(
                  ValueKind.STRING,
                  v ->
                      ChildField.library(StdlibTypes.IS_PICKABLE_BY_SUPPLIER_ID)
                          .attribute("supplier_part_id", v)
                          .attribute("supplier", "lcsc")
                          .build()))
          .put("mpn", simple(StdlibTypes.HAS_MPN_ASSIGNED, "mpn"))
          .put("manufacturer", simple(StdlibTypes.HAS_MFR_ASSIGNED, "mfr"))
          .put("datasheet_url", simple(StdlibTypes.HAS_DATASHEET, "datasheet"))
          .put("designator_prefix", simple(StdlibTypes.HAS_DESIGNATOR_PREFIX, "prefix"))
          .put("override_net_name", netName("EXPECTED"))
          .put("suggest_net_name", netName("SUGGESTED"))
          .buildOrThrow();

  /** An enum parameter that accepts the name of one of its members. */
  private record EnumParameter(String enumType, ImmutableList<String> members) {}

  private static final ImmutableMap<String, EnumParameter> ENUM_PARAMETERS =
      ImmutableMap.<String, EnumParameter>builder()
          .put(
              "temperature_coefficient",
              new EnumParameter(
                  "Capacitor.TemperatureCoefficient",
                  ImmutableList.of("Y5V", "Z5U", "X7S", "X5R", "X6R", "X7R", "X8R", "C0G")))
          .put(
              "channel_type",
              new EnumParameter(
                  "MOSFET.ChannelType", ImmutableList.of("N_CHANNEL", "P_CHANNEL")))
          .put(
              "saturation_type",
              new EnumParameter(
                  "MOSFET.SaturationType", ImmutableList.of("ENHANCEMENT", "DEPLETION")))
          .put("doping_type", new EnumParameter("BJT.DopingType", ImmutableList.of("NPN", "PNP")))
          .put(
              "operation_region",
              new EnumParameter(
                  "BJT.OperationRegion",
                  ImmutableList.of("ACTIVE", "INVERTED", "SATURATION", "CUT_OFF")))
          .put(
              "fuse_type",
              new EnumParameter("Fuse.FuseType", ImmutableList.of("NON_RESETTABLE", "RESETTABLE")))
          .put(
              "response_type",
              new EnumParameter("Fuse.ResponseType", ImmutableList.of("SLOW", "FAST")))
          .buildOrThrow();

  static final String DEFAULT = "default";

  private static Sugar simple(String traitType, String attribute) {
    return new Sugar(
        ValueKind.STRING, v -> ChildField.library(traitType).attribute(attribute, v).build());
  }

  private static Sugar netName(String level) {
    return new Sugar(
        ValueKind.STRING,
        v ->
            ChildField.library(StdlibTypes.HAS_NET_NAME_SUGGESTION)
                .attribute("name", v)
                .attribute("level", level)
                .build());
  }

  private final LoweringContext context;

  AssignmentOverrides(LoweringContext context) {
    this.context = context;
  }

  private static boolean isNew(Ast.Assignable assignable) {
    return assignable.value.kind() == Ast.Kind.NEW_EXPRESSION;
  }

  /** True if assigning {@code assignable} to a field named {@code leaf} is trait sugar. */
  static boolean matchesTrait(String leaf, Ast.Assignable assignable) {
    return !isNew(assignable) && SUGAR.containsKey(leaf);
  }

  /** True if assigning {@code assignable} to a field named {@code leaf} sets an enum parameter. */
  static boolean matchesEnumParameter(String leaf, Ast.Assignable assignable) {
    return !isNew(assignable) && ENUM_PARAMETERS.containsKey(leaf);
  }

  /** True if this is a {@code .default} assignment of a quantity or expression. */
  static boolean matchesDefault(String leaf, Ast.Assignable assignable) {
    return switch (assignable.value.kind()) {
      case NEW_EXPRESSION, STRING, BOOLEAN -> false;
      default -> leaf.equals(DEFAULT);
    };
  }

  /**
   * Returns the actions for trait sugar: the trait attached to the target's parent, or to the
   * enclosing block if the target has no parent. Returns a no-op for sugar that disables its trait
   * ({@code required = False}).
   */
  ImmutableList<Action> handleTrait(FieldPath target, Ast.Assignable assignable) {
    String leaf = target.leaf().identifier();
    Sugar sugar = SUGAR.get(leaf);
    Object value = literalValue(leaf, sugar.kind, assignable.value);
    ChildField trait = sugar.maker.apply(value);
    if (trait == null) {
      return Action.noop();
    }
    FieldPath owner = target.hasParent() ? target.parent() : null;
    return Action.attachTrait(owner, context.newIdentifier(trait.typeName), trait);
  }

  /** Returns the enum literal to constrain the target parameter to. */
  ChildField enumLiteral(FieldPath target, Ast.Assignable assignable) {
    String leaf = target.leaf().identifier();
    EnumParameter parameter = ENUM_PARAMETERS.get(leaf);
    String member = (String) literalValue(leaf, ValueKind.STRING, assignable.value);
    if (!parameter.members.contains(member)) {
      throw DslException.of(
          "Invalid value: '%s'. Valid values: %s", member, Joiner.on(", ").join(parameter.members));
    }
    return ChildField.library(StdlibTypes.ENUMS)
        .attribute("enum", parameter.enumType)
        .attribute("values", ImmutableList.of(member))
        .build();
  }

  /**
   * Returns the actions for {@code param.default = value}: a {@code has_default_constraint} trait
   * on {@code param}, preceded by the children of the default value.
   */
  ImmutableList<Action> handleDefault(
      FieldPath target, Ast.Assignable assignable, Expressions expressions) {
    if (!target.hasParent()) {
      throw DslException.of(
          "`.default` must be used on a parameter field, e.g., `param.default = 1A`");
    }
    FieldPath parameter = target.parent();
    List<ChildField.Dependant> dependants = new ArrayList<>();
    LinkPath value = expressions.operand(assignable.value, LinkPath.of(parameter), dependants);
    ChildField.Builder trait = ChildField.library(StdlibTypes.HAS_DEFAULT_CONSTRAINT);
    for (ChildField.Dependant dependant : dependants) {
      trait.before(dependant.identifier(), dependant.field());
    }
    trait.operand(value);
    return Action.attachTrait(
        parameter, context.newIdentifier(StdlibTypes.HAS_DEFAULT_CONSTRAINT), trait.build());
  }

  private static Object literalValue(String field, ValueKind kind, Ast.Node node) {
    if (kind == ValueKind.STRING && node instanceof Ast.StringLiteral string) {
      return string.text;
    } else if (kind == ValueKind.BOOLEAN && node instanceof Ast.BooleanLiteral bool) {
      return bool.value;
    }
    throw DslException.of(
        "Invalid value for `%s`: expected %s, got %s", field, kind.displayName, node.kind());
  }
}
