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
import java.util.List;
import java.util.function.Function;
import org.atolang.ast.Ast;

/**
 * Lowers arithmetic and literal operands to expression trees. Every literal or sub-expression in a
 * tree becomes an anonymous child; the caller declares them (in order) as "before" dependants of
 * the node that consumes the tree, so each operand exists before anything links to it.
 */
final class Expressions {

  /** Comparison operator to predicate type. */
  private static final ImmutableMap<String, String> PREDICATES =
      ImmutableMap.<String, String>builder()
          .put(">", "GreaterThan")
          .put(">=", "GreaterOrEqual")
          .put("<", "LessThan")
          .put("<=", "LessOrEqual")
          .put("within", "IsSubset")
          .put("is", "Is")
          .buildOrThrow();

  /** Arithmetic operator to expression type. */
  private static final ImmutableMap<String, String> ARITHMETIC =
      ImmutableMap.<String, String>builder()
          .put("+", "Add")
          .put("-", "Subtract")
          .put("*", "Multiply")
          .put("/", "Divide")
          .put("^", "Power")
          .buildOrThrow();

  static final String IS_SUBSET = "IsSubset";

  private final LoweringContext context;
  private final Function<Ast.FieldRef, FieldPath> fields;

  /**
   * @param fields resolves a field reference appearing in an expression to a path (applying any
   *     active aliases)
   */
  Expressions(LoweringContext context, Function<Ast.FieldRef, FieldPath> fields) {
    this.context = context;
    this.fields = fields;
  }

  /** Returns the predicate type for a comparison operator. */
  static String predicateType(String operator) {
    String type = PREDICATES.get(operator);
    if (type == null) {
      throw DslException.of("Unsupported comparison operator: `%s`", operator);
    }
    return type;
  }

  static String arithmeticType(String operator) {
    String type = ARITHMETIC.get(operator);
    if (type == null) {
      throw DslException.of("Unsupported arithmetic operator: `%s`", operator);
    }
    return type;
  }

  /** True if {@code node} can be lowered by {@link #operand}. */
  static boolean isOperand(Ast.Node node) {
    return switch (node.kind()) {
      case FIELD_REF,
          STRING,
          BOOLEAN,
          QUANTITY,
          BOUNDED_QUANTITY,
          BILATERAL_QUANTITY,
          BINARY_EXPRESSION,
          GROUP_EXPRESSION -> true;
      default -> false;
    };
  }

  /**
   * Lowers {@code node} and returns the path of its value. Field references lower to their own
   * path; anything else lowers to an anonymous child mounted at {@code mount}, which is appended
   * (with any children it depends on) to {@code dependants}.
   */
  LinkPath operand(Ast.Node node, LinkPath mount, List<ChildField.Dependant> dependants) {
    switch (node.kind()) {
      case FIELD_REF:
        return LinkPath.of(fields.apply((Ast.FieldRef) node));
      case GROUP_EXPRESSION:
        return operand(((Ast.GroupExpression) node).expression, mount, dependants);
      case BINARY_EXPRESSION:
        {
          Ast.BinaryExpression binary = (Ast.BinaryExpression) node;
          String type = arithmeticType(binary.operator);
          LinkPath left = operand(binary.left, mount, dependants);
          LinkPath right = operand(binary.right, mount, dependants);
          ChildField expression =
              ChildField.library(type).operand(left).operand(right).build();
          return declare("expr", expression, mount, dependants);
        }
      default:
        return declare("lit", literal(node), mount, dependants);
    }
  }

  private LinkPath declare(
      String hint, ChildField field, LinkPath mount, List<ChildField.Dependant> dependants) {
    String identifier = context.newIdentifier(hint);
    dependants.add(new ChildField.Dependant(identifier, field, true));
    return mount.child(identifier);
  }

  /** Returns the literal child for a string, boolean, or quantity node. */
  static ChildField literal(Ast.Node node) {
    return switch (node.kind()) {
      case STRING -> strings(((Ast.StringLiteral) node).text);
      case BOOLEAN ->
          ChildField.library(StdlibTypes.BOOLEANS)
              .attribute("values", ImmutableList.of(((Ast.BooleanLiteral) node).value))
              .build();
      case QUANTITY -> Quantities.single((Ast.Quantity) node);
      case BOUNDED_QUANTITY -> Quantities.bounded((Ast.BoundedQuantity) node);
      case BILATERAL_QUANTITY -> Quantities.bilateral((Ast.BilateralQuantity) node);
      default -> throw CompilerException.of("Not a literal: %s", node);
    };
  }

  static ChildField strings(String value) {
    return ChildField.library(StdlibTypes.STRINGS)
        .attribute("values", ImmutableList.of(value))
        .build();
  }

  /**
   * Returns a constraint that the value at {@code target} is a subset of the value at {@code
   * operand}, preceded by the given dependants.
   */
  static ChildField subsetConstraint(
      LinkPath target, LinkPath operand, List<ChildField.Dependant> dependants) {
    ChildField.Builder builder = ChildField.library(IS_SUBSET).attribute("constrained", true);
    for (ChildField.Dependant dependant : dependants) {
      builder.before(dependant.identifier(), dependant.field());
    }
    return builder.operand(target).operand(operand).build();
  }
}
