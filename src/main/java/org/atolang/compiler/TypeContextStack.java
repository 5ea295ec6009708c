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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.atolang.Graph;
import org.atolang.Graph.PathError;
import org.atolang.Graph.TypeGraph;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks which type is currently being populated and carries out {@link Action}s against it.
 *
 * <p>All structural lookups are delegated to the TypeGraph. Any {@link PathError} it reports is
 * translated here into a {@link DslException} naming the part of the path that failed; PathErrors
 * never escape this class.
 */
final class TypeContextStack {
  private static final Logger logger = LoggerFactory.getLogger(TypeContextStack.class);

  /** A type being populated, and the TypeGraph it belongs to. */
  private record Frame(Graph.Node typeNode, TypeGraph typeGraph) {}

  private final Deque<Frame> stack = new ArrayDeque<>();
  private final TypeGraph typeGraph;
  private final BuildState state;

  TypeContextStack(TypeGraph typeGraph, BuildState state) {
    this.typeGraph = typeGraph;
    this.state = state;
  }

  /** Makes {@code typeNode} the current type until the returned Guard is closed. */
  ScopeStack.Guard enter(Graph.Node typeNode) {
    Frame frame = new Frame(typeNode, typeGraph);
    stack.push(frame);
    return () -> {
      Frame popped = stack.pop();
      assert popped == frame;
    };
  }

  private Frame currentFrame() {
    if (stack.isEmpty()) {
      throw new DslException("Type context is not available");
    }
    return stack.peek();
  }

  /** Returns the type currently being populated. */
  Graph.Node current() {
    return currentFrame().typeNode;
  }

  /** Applies each of the given actions, in order. */
  void apply(List<Action> actions) {
    for (Action action : actions) {
      apply(action);
    }
  }

  void apply(Action action) {
    if (action == Action.NOOP) {
      return;
    }
    Frame frame = currentFrame();
    logger.debug("Applying {}", action);
    if (action instanceof Action.AddMakeChild addChild) {
      addChild(frame, addChild);
    } else if (action instanceof Action.AddMakeLink addLink) {
      addLink(frame, addLink);
    } else {
      throw CompilerException.of("Unhandled action: %s", action);
    }
  }

  /**
   * Returns a reference to the field at {@code path} in the current type.
   *
   * @param validate if true, every segment of the path must already have been declared
   */
  Graph.Node resolveReference(FieldPath path, boolean validate) {
    Frame frame = currentFrame();
    return ensureFieldPath(frame, path, validate);
  }

  /** Returns the pointer-sequence members of the container at {@code containerPath}. */
  ImmutableList<Graph.PointerMember> pointerMembers(FieldPath containerPath) {
    Frame frame = currentFrame();
    try {
      return frame.typeGraph.collectPointerMembers(frame.typeNode, containerPath.identifiers());
    } catch (PathError e) {
      throw new DslException(formatPathError(containerPath, e), null, e);
    }
  }

  private static Graph.Node ensureFieldPath(Frame frame, FieldPath path, boolean validate) {
    try {
      return frame.typeGraph.ensureChildReference(frame.typeNode, path.identifiers(), validate);
    } catch (PathError e) {
      throw new DslException(formatPathError(path, e), null, e);
    }
  }

  /** Returns a message describing {@code error}, which occurred while resolving {@code path}. */
  static String formatPathError(FieldPath path, PathError error) {
    String fullPath = error.path.isEmpty() ? path.toString() : joinDotted(error.path);
    switch (error.kind) {
      case MISSING_PARENT:
        {
          List<String> prefix = error.path.subList(0, clampedIndex(error));
          String joined = prefix.isEmpty() ? fullPath : joinDotted(prefix);
          return String.format("Field `%s` is not defined in scope", joined);
        }
      case INVALID_INDEX:
        {
          String container = joinDotted(error.path.subList(0, clampedIndex(error)));
          String index = (error.indexValue != null) ? error.indexValue : error.failingSegment;
          if (container.isEmpty()) {
            return String.format("Field `[ %s ]` is not defined in scope", index);
          }
          return String.format("Field `%s[%s]` is not defined in scope", container, index);
        }
      default:
        return String.format("Field `%s` is not defined in scope", fullPath);
    }
  }

  private static int clampedIndex(PathError error) {
    return Math.max(0, Math.min(error.failingSegmentIndex, error.path.size()));
  }

  private static String joinDotted(List<String> segments) {
    return Joiner.on('.').join(segments);
  }

  private void addChild(Frame frame, Action.AddMakeChild action) {
    Graph.Node mount = action.parentReference;
    if (mount == null && action.parentPath != null) {
      mount = ensureFieldPath(frame, action.parentPath, true);
    }
    declareChild(frame, action.identifier(), action.child, mount, action.targetPath);
  }

  /**
   * Declares {@code field} (and its dependants) with the given identifier below {@code mount}, and
   * links its operands.
   */
  private void declareChild(
      Frame frame,
      String identifier,
      ChildField field,
      Graph.@Nullable Node mount,
      @Nullable FieldPath targetPath) {
    for (ChildField.Dependant dependant : field.dependants) {
      if (dependant.before()) {
        declareChild(frame, dependant.identifier(), dependant.field(), mount, null);
      }
    }
    TypeGraph graph = frame.typeGraph;
    Graph.Node makeChild =
        graph.addMakeChild(frame.typeNode, field.typeName, identifier, field.attributes, mount);
    Graph.Node typeReference = graph.getMakeChildTypeReference(makeChild);
    switch (field.typeSource) {
      case EXTERNAL:
        state.addExternalTypeRef(typeReference, field.importRef);
        break;
      case LOCAL:
        graph.linkTypeReference(typeReference, field.typeNode);
        break;
      case LIBRARY:
        graph.linkTypeReference(typeReference, libraryType(graph, field.typeName));
        break;
    }
    for (int i = 0; i < field.operands.size(); i++) {
      Graph.Node operand = graph.addReference(frame.typeNode, field.operands.get(i).steps());
      graph.addMakeLink(frame.typeNode, makeChild, operand, Graph.Edge.operand(i));
    }
    for (ChildField.Dependant dependant : field.dependants) {
      if (!dependant.before()) {
        declareChild(frame, dependant.identifier(), dependant.field(), mount, null);
      }
    }
    if (targetPath != null) {
      logger.debug("Declared {} as {}", targetPath, field.typeName);
    }
  }

  /** Returns the library type with the given name, creating it on first use. */
  private static Graph.Node libraryType(TypeGraph graph, String name) {
    Graph.Node type = graph.getTypeByName(name);
    return (type != null) ? type : graph.addType(name);
  }

  private static void addLink(Frame frame, Action.AddMakeLink action) {
    TypeGraph graph = frame.typeGraph;
    Graph.Node lhs = graph.addReference(frame.typeNode, action.lhs.steps());
    Graph.Node rhs = graph.addReference(frame.typeNode, action.rhs.steps());
    graph.addMakeLink(frame.typeNode, lhs, rhs, action.edge);
  }
}
