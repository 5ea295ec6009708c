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

package org.atolang;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The Graph class is just a namespace for the interfaces through which the compiler talks to the
 * TypeGraph engine. The compiler never touches graph storage directly; everything it needs is
 * expressed by {@link TypeGraph}.
 */
public class Graph {

  // Just a namespace for the contained interfaces.
  private Graph() {}

  /**
   * An opaque handle to a node owned by the TypeGraph: a type, a make-child declaration, a type
   * reference, or a path reference. The compiler only passes these back to the TypeGraph.
   */
  public interface Node {}

  /**
   * A TypeGraph stores compiled types as nodes and edges. Types are populated with declarations
   * ("make child", "make link") that are instantiated later, so most operations take the type node
   * being populated as their first argument.
   */
  public interface TypeGraph {

    /** Creates a new, empty type with the given identifier. */
    Node addType(String identifier);

    /** Returns the type with the given identifier, or null if no such type has been created. */
    @Nullable Node getTypeByName(String identifier);

    /**
     * Declares a child of {@code typeNode}.
     *
     * @param childTypeIdentifier the name of the child's type; it need not be resolvable yet (see
     *     {@link #getMakeChildTypeReference} and {@link #linkTypeReference})
     * @param identifier the child's name, unique among the children of its mount point
     * @param attributes literal attributes stored on the child (e.g. the value of a literal)
     * @param mountReference if non-null, the child is mounted below this reference rather than
     *     directly below {@code typeNode}
     * @return the make-child node
     */
    Node addMakeChild(
        Node typeNode,
        String childTypeIdentifier,
        String identifier,
        ImmutableMap<String, Object> attributes,
        @Nullable Node mountReference);

    /** Returns the (possibly unresolved) type reference node of a make-child node. */
    Node getMakeChildTypeReference(Node makeChild);

    /**
     * Returns the type reference of the child of {@code typeNode} with the given identifier, or
     * null if there is no such child.
     */
    @Nullable Node getMakeChildTypeReferenceByIdentifier(Node typeNode, String identifier);

    /** Resolves a type reference to a concrete type node. */
    void linkTypeReference(Node typeReference, Node targetType);

    /** Declares a link between two references within {@code typeNode}. */
    @CanIgnoreReturnValue
    Node addMakeLink(Node typeNode, Node lhsReference, Node rhsReference, Edge edge);

    /** Returns a reference node for a path that may include trait and pointer traversals. */
    Node addReference(Node typeNode, List<Step> path);

    /**
     * Returns a reference to the child of {@code typeNode} at the given path of identifiers.
     *
     * @param validate if true, every segment must name a declared child
     * @throws PathError if the path cannot be resolved
     */
    Node ensureChildReference(Node typeNode, List<String> path, boolean validate)
        throws PathError;

    /**
     * Returns the members of the pointer sequence at {@code containerPath}, in declaration order.
     *
     * @throws PathError if {@code containerPath} cannot be resolved
     */
    ImmutableList<PointerMember> collectPointerMembers(Node typeNode, List<String> containerPath)
        throws PathError;

    /** Records a pointer from a type back to the AST node it was compiled from. */
    void addSourcePointer(Node typeNode, Object astNode);
  }

  /** An element of a pointer sequence, as returned by {@link TypeGraph#collectPointerMembers}. */
  public record PointerMember(@Nullable String identifier, Node node) {}

  /** One step of a reference path. */
  public record Step(Step.Kind kind, String name) {

    /** How a step moves from one node to the next. */
    public enum Kind {
      /** To the composition child with the given identifier. */
      FIELD,
      /** To the trait instance of the given trait type. */
      TRAIT,
      /** Through the pointer child with the given identifier. */
      POINTER
    }

    public Step {
      Preconditions.checkNotNull(kind);
      Preconditions.checkNotNull(name);
    }

    public static Step field(String name) {
      return new Step(Kind.FIELD, name);
    }

    public static Step trait(String traitType) {
      return new Step(Kind.TRAIT, traitType);
    }

    public static Step pointer(String name) {
      return new Step(Kind.POINTER, name);
    }

    public boolean isField() {
      return kind == Kind.FIELD;
    }

    @Override
    public String toString() {
      return name;
    }

    /** Renders a path as a dotted string; the empty path renders as {@code <self>}. */
    public static String render(List<Step> path) {
      return path.isEmpty() ? "<self>" : Joiner.on('.').join(path);
    }
  }

  /** The attributes of an edge created by {@link TypeGraph#addMakeLink}. */
  public static final class Edge {

    /** What the edge represents. */
    public enum Kind {
      INTERFACE_CONNECTION,
      TRAIT,
      OPERAND
    }

    public final Kind kind;

    /** Only meaningful for INTERFACE_CONNECTION edges. */
    public final boolean shallow;

    /** Only meaningful for OPERAND edges; -1 otherwise. */
    public final int operandIndex;

    private static final Edge INTERFACE = new Edge(Kind.INTERFACE_CONNECTION, false, -1);
    private static final Edge SHALLOW_INTERFACE = new Edge(Kind.INTERFACE_CONNECTION, true, -1);
    private static final Edge TRAIT = new Edge(Kind.TRAIT, false, -1);

    private Edge(Kind kind, boolean shallow, int operandIndex) {
      this.kind = kind;
      this.shallow = shallow;
      this.operandIndex = operandIndex;
    }

    /** The default edge for links, connecting two interfaces. */
    public static Edge interfaceConnection() {
      return INTERFACE;
    }

    public static Edge interfaceConnection(boolean shallow) {
      return shallow ? SHALLOW_INTERFACE : INTERFACE;
    }

    /** Links an object to one of its traits. */
    public static Edge trait() {
      return TRAIT;
    }

    /** Links an expression to its {@code index}th operand. */
    public static Edge operand(int index) {
      Preconditions.checkArgument(index >= 0);
      return new Edge(Kind.OPERAND, false, index);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Edge other
          && kind == other.kind
          && shallow == other.shallow
          && operandIndex == other.operandIndex;
    }

    @Override
    public int hashCode() {
      return (kind.hashCode() * 31 + (shallow ? 1 : 0)) * 31 + operandIndex;
    }

    @Override
    public String toString() {
      return switch (kind) {
        case INTERFACE_CONNECTION -> shallow ? "shallow interface" : "interface";
        case TRAIT -> "trait";
        case OPERAND -> "operand[" + operandIndex + "]";
      };
    }
  }

  /**
   * Thrown by the TypeGraph when a path cannot be resolved. Carries enough structure for the
   * compiler to point at the failing part of the path.
   */
  public static final class PathError extends Exception {

    /** Why resolution failed. */
    public enum Kind {
      /** A segment before the last one does not exist. */
      MISSING_PARENT,
      /** The last segment does not exist. */
      MISSING_CHILD,
      /** A segment indexes a pointer sequence that has no such element. */
      INVALID_INDEX,
      OTHER
    }

    public final Kind kind;
    public final ImmutableList<String> path;

    /** The index in {@link #path} of the segment at which resolution failed. */
    public final int failingSegmentIndex;

    public final String failingSegment;

    /** For INVALID_INDEX errors, the offending index if known. */
    public final @Nullable String indexValue;

    public PathError(
        Kind kind,
        List<String> path,
        int failingSegmentIndex,
        String failingSegment,
        @Nullable String indexValue) {
      super(String.format("%s at segment %s of %s", kind, failingSegmentIndex, path));
      this.kind = kind;
      this.path = ImmutableList.copyOf(path);
      this.failingSegmentIndex = failingSegmentIndex;
      this.failingSegment = failingSegment;
      this.indexValue = indexValue;
    }
  }
}
