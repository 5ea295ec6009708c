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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.SetMultimap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.atolang.Graph;
import org.atolang.Graph.Edge;
import org.atolang.Graph.PathError;
import org.atolang.Graph.PointerMember;
import org.atolang.Graph.Step;
import org.jspecify.annotations.Nullable;

/**
 * MockTypeGraph implements the TypeGraph interface in memory, and records a readable line for each
 * declaration the compiler makes, e.g.
 *
 * <pre>
 *   Top: child r: Resistor
 *   Top: child _lit_0: Numbers{min=1000, max=1000, unit=Ohm}
 *   Top: link a.hv -> b.lv (interface)
 *   Top: link a.&lt;can_bridge&gt;.*out_ -> b.&lt;can_bridge&gt;.*in_ (interface)
 * </pre>
 *
 * Trait steps are rendered in angle brackets and pointer steps with a leading {@code *}.
 *
 * <p>Children are tracked by path so that validating lookups fail the way the real graph does, and
 * pointer-sequence members are returned in declaration order.
 */
class MockTypeGraph implements Graph.TypeGraph {

  /** A type. */
  static final class TypeNode implements Graph.Node {
    final String name;

    /** Joined child path to child, in declaration order. */
    final Map<String, ChildNode> children = new LinkedHashMap<>();

    TypeNode(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A declared child of a type. */
  static final class ChildNode implements Graph.Node {
    final TypeNode owner;
    final ImmutableList<String> path;
    final String typeName;
    final ImmutableMap<String, Object> attributes;
    final TypeReference typeReference = new TypeReference(this);

    ChildNode(
        TypeNode owner,
        ImmutableList<String> path,
        String typeName,
        ImmutableMap<String, Object> attributes) {
      this.owner = owner;
      this.path = path;
      this.typeName = typeName;
      this.attributes = attributes;
    }

    @Override
    public String toString() {
      return join(path);
    }
  }

  /** The type reference of a child; {@link #target} is set when it is linked. */
  static final class TypeReference implements Graph.Node {
    final ChildNode child;
    @Nullable TypeNode target;

    TypeReference(ChildNode child) {
      this.child = child;
    }

    @Override
    public String toString() {
      return "typeref(" + child + ")";
    }
  }

  /** A reference to a path within a type. */
  static final class Reference implements Graph.Node {
    final ImmutableList<Step> steps;

    Reference(List<Step> steps) {
      this.steps = ImmutableList.copyOf(steps);
    }

    @Override
    public String toString() {
      return render(steps);
    }
  }

  private final Map<String, TypeNode> types = new LinkedHashMap<>();

  /** Children that library types are assumed to have, e.g. Resistor's "resistance". */
  private final SetMultimap<String, String> libraryChildren = HashMultimap.create();
  private final Map<TypeNode, Object> sourcePointers = new HashMap<>();
  private final List<String> lines = new ArrayList<>();

  /** Returns one line per child or link declared so far, in order. */
  ImmutableList<String> lines() {
    return ImmutableList.copyOf(lines);
  }

  /** Returns the lines for declarations in the given type. */
  ImmutableList<String> lines(String typeName) {
    String prefix = typeName + ": ";
    return lines.stream()
        .filter(l -> l.startsWith(prefix))
        .collect(ImmutableList.toImmutableList());
  }

  TypeNode type(String name) {
    TypeNode type = types.get(name);
    Preconditions.checkArgument(type != null, "No type %s", name);
    return type;
  }

  /** Returns the child of the named type at the given dotted path, or null. */
  @Nullable ChildNode child(String typeName, String path) {
    return type(typeName).children.get(path);
  }

  /** Returns the name of the type the child's type reference was linked to, or null if none. */
  @Nullable String linkedType(String typeName, String path) {
    ChildNode child = child(typeName, path);
    Preconditions.checkArgument(child != null, "No child %s in %s", path, typeName);
    TypeNode target = child.typeReference.target;
    return (target == null) ? null : target.name;
  }

  /**
   * Declares that children of the given library type have children with the given names, so that
   * validating lookups of e.g. {@code r.resistance} succeed.
   */
  void libraryChildren(String typeName, String... names) {
    for (String name : names) {
      libraryChildren.put(typeName, name);
    }
  }

  @Nullable Object sourceOf(String typeName) {
    return sourcePointers.get(type(typeName));
  }

  boolean hasType(String name) {
    return types.containsKey(name);
  }

  @Override
  public Graph.Node addType(String identifier) {
    Preconditions.checkState(!types.containsKey(identifier), "Duplicate type %s", identifier);
    TypeNode type = new TypeNode(identifier);
    types.put(identifier, type);
    return type;
  }

  @Override
  public Graph.@Nullable Node getTypeByName(String identifier) {
    return types.get(identifier);
  }

  @Override
  public Graph.Node addMakeChild(
      Graph.Node typeNode,
      String childTypeIdentifier,
      String identifier,
      ImmutableMap<String, Object> attributes,
      Graph.@Nullable Node mountReference) {
    TypeNode type = (TypeNode) typeNode;
    ImmutableList.Builder<String> path = ImmutableList.builder();
    if (mountReference != null) {
      path.addAll(fieldNames(mountReference));
    }
    path.add(identifier);
    ChildNode child = new ChildNode(type, path.build(), childTypeIdentifier, attributes);
    type.children.put(join(child.path), child);
    lines.add(
        String.format(
            "%s: child %s: %s%s",
            type.name, child, childTypeIdentifier, attributes.isEmpty() ? "" : attributes));
    return child;
  }

  private static ImmutableList<String> fieldNames(Graph.Node reference) {
    if (reference instanceof ChildNode child) {
      return child.path;
    }
    Reference ref = (Reference) reference;
    for (Step step : ref.steps) {
      Preconditions.checkArgument(step.isField(), "Cannot mount below %s", ref);
    }
    return ref.steps.stream().map(Step::name).collect(ImmutableList.toImmutableList());
  }

  @Override
  public Graph.Node getMakeChildTypeReference(Graph.Node makeChild) {
    return ((ChildNode) makeChild).typeReference;
  }

  @Override
  public Graph.@Nullable Node getMakeChildTypeReferenceByIdentifier(
      Graph.Node typeNode, String identifier) {
    ChildNode child = ((TypeNode) typeNode).children.get(identifier);
    return (child == null) ? null : child.typeReference;
  }

  @Override
  public void linkTypeReference(Graph.Node typeReference, Graph.Node targetType) {
    TypeReference ref = (TypeReference) typeReference;
    Preconditions.checkState(ref.target == null, "%s already linked", ref);
    ref.target = (TypeNode) targetType;
  }

  @Override
  public Graph.Node addMakeLink(
      Graph.Node typeNode, Graph.Node lhsReference, Graph.Node rhsReference, Edge edge) {
    TypeNode type = (TypeNode) typeNode;
    lines.add(String.format("%s: link %s -> %s (%s)", type.name, lhsReference, rhsReference, edge));
    return new Reference(ImmutableList.of());
  }

  @Override
  public Graph.Node addReference(Graph.Node typeNode, List<Step> path) {
    return new Reference(path);
  }

  @Override
  public Graph.Node ensureChildReference(Graph.Node typeNode, List<String> path, boolean validate)
      throws PathError {
    TypeNode type = (TypeNode) typeNode;
    if (validate) {
      for (int i = 0; i < path.size(); i++) {
        if (type.children.containsKey(join(path.subList(0, i + 1)))
            || isLibraryChild(type, path.subList(0, i), path.get(i))) {
          continue;
        }
        String segment = path.get(i);
        if (i > 0 && isIndex(segment)) {
          throw new PathError(PathError.Kind.INVALID_INDEX, path, i, segment, segment);
        } else if (i < path.size() - 1) {
          throw new PathError(PathError.Kind.MISSING_PARENT, path, i + 1, segment, null);
        }
        throw new PathError(PathError.Kind.MISSING_CHILD, path, i, segment, null);
      }
    }
    return new Reference(path.stream().map(Step::field).collect(ImmutableList.toImmutableList()));
  }

  @Override
  public ImmutableList<PointerMember> collectPointerMembers(
      Graph.Node typeNode, List<String> containerPath) throws PathError {
    TypeNode type = (TypeNode) typeNode;
    String container = join(containerPath);
    if (!type.children.containsKey(container)) {
      int last = containerPath.size() - 1;
      throw new PathError(
          PathError.Kind.MISSING_CHILD, containerPath, last, containerPath.get(last), null);
    }
    ImmutableList.Builder<PointerMember> members = ImmutableList.builder();
    for (ChildNode child : type.children.values()) {
      if (child.path.size() == containerPath.size() + 1
          && child.path.subList(0, containerPath.size()).equals(containerPath)) {
        members.add(new PointerMember(child.path.get(containerPath.size()), child));
      }
    }
    return members.build();
  }

  @Override
  public void addSourcePointer(Graph.Node typeNode, Object astNode) {
    sourcePointers.put((TypeNode) typeNode, astNode);
  }

  private boolean isLibraryChild(TypeNode type, List<String> parentPath, String name) {
    if (parentPath.isEmpty()) {
      return false;
    }
    ChildNode parent = type.children.get(join(parentPath));
    return parent != null && libraryChildren.containsEntry(parent.typeName, name);
  }

  private static boolean isIndex(String segment) {
    return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
  }

  private static String join(List<String> path) {
    return Joiner.on('.').join(path);
  }

  /** Renders a path with trait steps as {@code <name>} and pointer steps as {@code *name}. */
  static String render(List<Step> steps) {
    if (steps.isEmpty()) {
      return "self";
    }
    List<String> parts = new ArrayList<>();
    for (Step step : steps) {
      parts.add(
          switch (step.kind()) {
            case FIELD -> step.name();
            case TRAIT -> "<" + step.name() + ">";
            case POINTER -> "*" + step.name();
          });
    }
    return Joiner.on('.').join(parts);
  }
}
