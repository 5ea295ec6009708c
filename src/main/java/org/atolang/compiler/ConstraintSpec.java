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
import java.util.ArrayList;
import java.util.List;
import org.atolang.Graph;
import org.atolang.ast.Ast;
import org.jspecify.annotations.Nullable;

/**
 * The right-hand side of an assignment that constrains the target's value: a string, boolean, or
 * arithmetic expression, or an enum member chosen by {@link AssignmentOverrides}.
 */
final class ConstraintSpec {
  private final Ast.@Nullable Node value;
  private final @Nullable ChildField literal;

  private ConstraintSpec(Ast.@Nullable Node value, @Nullable ChildField literal) {
    this.value = value;
    this.literal = literal;
  }

  static ConstraintSpec of(Ast.Node value) {
    return new ConstraintSpec(value, null);
  }

  static ConstraintSpec ofLiteral(ChildField literal) {
    return new ConstraintSpec(null, literal);
  }

  /**
   * Returns the action declaring, below {@code target}, a subset constraint between the target and
   * the assigned value. The value's own children are declared first.
   */
  ImmutableList<Action> actions(
      FieldPath target,
      Graph.Node targetReference,
      Expressions expressions,
      LoweringContext context) {
    LinkPath targetLink = LinkPath.of(target);
    List<ChildField.Dependant> dependants = new ArrayList<>();
    LinkPath operand;
    if (literal != null) {
      String identifier = context.newIdentifier("lit");
      dependants.add(new ChildField.Dependant(identifier, literal, true));
      operand = targetLink.child(identifier);
    } else {
      operand = expressions.operand(value, targetLink, dependants);
    }
    String identifier = context.newIdentifier("constraint");
    return ImmutableList.of(
        new Action.AddMakeChild(
            target.child(FieldPath.Segment.of(identifier)),
            targetReference,
            null,
            Expressions.subsetConstraint(targetLink, operand, dependants)));
  }
}
