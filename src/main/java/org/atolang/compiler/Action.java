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
import org.atolang.Graph;
import org.jspecify.annotations.Nullable;

/**
 * An Action is one step of type construction emitted by the {@link AstVisitor}. Actions are pure
 * data; {@link TypeContextStack#apply} is responsible for carrying them out against the TypeGraph.
 *
 * <p>There are exactly three kinds of Action: {@link AddMakeChild}, {@link AddMakeLink}, and
 * {@link #NOOP}. Lowering a statement produces a list of Actions, applied in order.
 */
public abstract class Action {

  // Only the nested subclasses.
  private Action() {}

  /** An action that does nothing, e.g. for {@code x.required = False}. */
  public static final Action NOOP =
      new Action() {
        @Override
        public String toString() {
          return "NoOp";
        }
      };

  /** Returns a list containing just the NOOP action. */
  static ImmutableList<Action> noop() {
    return ImmutableList.of(NOOP);
  }

  /**
   * Declares a child of the current type. If {@link #parentPath} or {@link #parentReference} is set
   * the child is mounted below that field rather than at the top level of the type; an action with
   * a parent path requires that path to have been declared already.
   */
  public static final class AddMakeChild extends Action {
    public final FieldPath targetPath;
    public final Graph.@Nullable Node parentReference;
    public final @Nullable FieldPath parentPath;
    public final ChildField child;

    AddMakeChild(
        FieldPath targetPath,
        Graph.@Nullable Node parentReference,
        @Nullable FieldPath parentPath,
        ChildField child) {
      this.targetPath = Preconditions.checkNotNull(targetPath);
      this.parentReference = parentReference;
      this.parentPath = parentPath;
      this.child = Preconditions.checkNotNull(child);
    }

    /** Declares {@code child} at {@code targetPath}, mounted below the target's parent (if any). */
    static AddMakeChild at(FieldPath targetPath, ChildField child) {
      return new AddMakeChild(
          targetPath, null, targetPath.hasParent() ? targetPath.parent() : null, child);
    }

    /** The child's identifier within its mount point. */
    public String identifier() {
      return targetPath.leaf().identifier();
    }

    /** The import this child's type comes from, if it is an imported type. */
    public @Nullable ImportRef importRef() {
      return child.importRef;
    }

    @Override
    public String toString() {
      return String.format("AddMakeChild(%s: %s)", targetPath, child);
    }
  }

  /**
   * Returns the pair of actions that attach {@code trait} to the field at {@code target}, or to the
   * type itself if {@code target} is null: the trait child (declared below the target) and a trait
   * edge from the target to it.
   */
  static ImmutableList<Action> attachTrait(
      @Nullable FieldPath target, String identifier, ChildField trait) {
    if (target == null) {
      return ImmutableList.of(
          new AddMakeChild(FieldPath.of(identifier), null, null, trait),
          new AddMakeLink(
              LinkPath.SELF, LinkPath.ofFields(ImmutableList.of(identifier)), Graph.Edge.trait()));
    }
    FieldPath traitPath = target.child(FieldPath.Segment.of(identifier));
    return ImmutableList.of(
        new AddMakeChild(traitPath, null, target, trait),
        new AddMakeLink(LinkPath.of(target), LinkPath.of(traitPath), Graph.Edge.trait()));
  }

  /** Declares a link between two paths in the current type. */
  public static final class AddMakeLink extends Action {
    public final LinkPath lhs;
    public final LinkPath rhs;
    public final Graph.Edge edge;

    AddMakeLink(LinkPath lhs, LinkPath rhs, Graph.Edge edge) {
      this.lhs = Preconditions.checkNotNull(lhs);
      this.rhs = Preconditions.checkNotNull(rhs);
      this.edge = Preconditions.checkNotNull(edge);
    }

    /** Returns an interface connection between the two paths. */
    static AddMakeLink connect(LinkPath lhs, LinkPath rhs) {
      return new AddMakeLink(lhs, rhs, Graph.Edge.interfaceConnection());
    }

    @Override
    public String toString() {
      return String.format("AddMakeLink(%s -> %s, %s)", lhs, rhs, edge);
    }
  }
}
