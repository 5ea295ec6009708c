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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;
import org.atolang.Graph;
import org.jspecify.annotations.Nullable;

/**
 * A ChildField describes one child to be declared in a type: what type it has, the literal
 * attributes stored on it, other children that must be declared with it ("dependants"), and, for
 * expressions, the paths of its operands.
 *
 * <p>The child's own identifier is not part of the ChildField; it comes from the {@link
 * Action.AddMakeChild} that declares it, or from the {@link Dependant} that wraps it.
 */
public final class ChildField {

  /** Where the child's type comes from. */
  public enum TypeSource {
    /** A library type created on demand in the TypeGraph (traits, literals, expressions, ...). */
    LIBRARY,
    /** A block defined earlier in the same file. */
    LOCAL,
    /** An imported type, resolved later by the linker. */
    EXTERNAL
  }

  /** A child declared alongside another, before or after it. */
  public record Dependant(String identifier, ChildField field, boolean before) {
    public Dependant {
      Preconditions.checkNotNull(identifier);
      Preconditions.checkNotNull(field);
    }
  }

  public final String typeName;
  public final TypeSource typeSource;

  /** Non-null iff {@link #typeSource} is LOCAL. */
  public final Graph.@Nullable Node typeNode;

  /** Non-null iff {@link #typeSource} is EXTERNAL. */
  public final @Nullable ImportRef importRef;

  public final ImmutableMap<String, Object> attributes;
  public final ImmutableList<Dependant> dependants;

  /**
   * If non-empty, this child is an expression and each element is linked to it with an operand edge
   * after the child has been declared.
   */
  public final ImmutableList<LinkPath> operands;

  private ChildField(Builder builder) {
    this.typeName = builder.typeName;
    this.typeSource = builder.typeSource;
    this.typeNode = builder.typeNode;
    this.importRef = builder.importRef;
    this.attributes = builder.attributes.buildOrThrow();
    this.dependants = builder.dependants.build();
    this.operands = builder.operands.build();
  }

  /** Returns a builder for a child of the named library type. */
  public static Builder library(String typeName) {
    return new Builder(typeName, TypeSource.LIBRARY, null, null);
  }

  /** Returns a builder for a child whose type is the block {@code typeNode}. */
  public static Builder local(String typeName, Graph.Node typeNode) {
    return new Builder(typeName, TypeSource.LOCAL, Preconditions.checkNotNull(typeNode), null);
  }

  /** Returns a builder for a child of an imported type. */
  public static Builder external(ImportRef importRef) {
    return new Builder(importRef.name(), TypeSource.EXTERNAL, null, importRef);
  }

  /**
   * Returns a builder for a child of the type named by {@code symbol}. Every imported type,
   * standard-library or not, is left for the linker.
   */
  static Builder forSymbol(Symbol symbol) {
    if (symbol.importRef != null) {
      return external(symbol.importRef);
    } else if (symbol.typeNode != null) {
      return local(symbol.name, symbol.typeNode);
    }
    throw DslException.of("Type `%s` is not defined in scope", symbol.name);
  }

  /** Returns a builder initialized with this field's contents. */
  public Builder toBuilder() {
    Builder builder = new Builder(typeName, typeSource, typeNode, importRef);
    builder.attributes.putAll(attributes);
    builder.dependants.addAll(dependants);
    builder.operands.addAll(operands);
    return builder;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(typeName);
    if (!attributes.isEmpty()) {
      sb.append(attributes);
    }
    if (!operands.isEmpty()) {
      sb.append(operands);
    }
    return sb.toString();
  }

  /** Builds a ChildField. */
  public static final class Builder {
    private final String typeName;
    private final TypeSource typeSource;
    private final Graph.@Nullable Node typeNode;
    private final @Nullable ImportRef importRef;
    private final ImmutableMap.Builder<String, Object> attributes = ImmutableMap.builder();
    private final ImmutableList.Builder<Dependant> dependants = ImmutableList.builder();
    private final ImmutableList.Builder<LinkPath> operands = ImmutableList.builder();

    private Builder(
        String typeName,
        TypeSource typeSource,
        Graph.@Nullable Node typeNode,
        @Nullable ImportRef importRef) {
      this.typeName = Preconditions.checkNotNull(typeName);
      this.typeSource = typeSource;
      this.typeNode = typeNode;
      this.importRef = importRef;
    }

    @CanIgnoreReturnValue
    public Builder attribute(String key, Object value) {
      attributes.put(key, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder attributes(Map<String, ?> values) {
      attributes.putAll(values);
      return this;
    }

    /** Adds a child that must be declared before this one. */
    @CanIgnoreReturnValue
    public Builder before(String identifier, ChildField field) {
      dependants.add(new Dependant(identifier, field, true));
      return this;
    }

    /** Adds a child that must be declared after this one. */
    @CanIgnoreReturnValue
    public Builder after(String identifier, ChildField field) {
      dependants.add(new Dependant(identifier, field, false));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder operand(LinkPath path) {
      operands.add(path);
      return this;
    }

    public ChildField build() {
      return new ChildField(this);
    }
  }
}
