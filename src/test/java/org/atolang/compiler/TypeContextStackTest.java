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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.atolang.Graph;
import org.atolang.Graph.PathError;
import org.atolang.compiler.FieldPath.Segment;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TypeContextStackTest {

  private final MockTypeGraph graph = new MockTypeGraph();
  private final BuildState state = new BuildState("/a/b.ato", null);
  private final TypeContextStack types = new TypeContextStack(graph, state);

  private static ChildField electrical() {
    return ChildField.library("Electrical").build();
  }

  @Test
  public void noTypeContext() {
    DslException e = assertThrows(DslException.class, types::current);
    assertThat(e).hasMessageThat().isEqualTo("Type context is not available");
    e =
        assertThrows(
            DslException.class,
            () -> types.apply(Action.AddMakeChild.at(FieldPath.of("r"), electrical())));
    assertThat(e).hasMessageThat().isEqualTo("Type context is not available");
  }

  @Test
  public void noopNeedsNoContext() {
    types.apply(Action.noop());
    assertThat(graph.lines()).isEmpty();
  }

  @Test
  public void nestedContexts() {
    Graph.Node outer = graph.addType("Outer");
    Graph.Node inner = graph.addType("Inner");
    try (ScopeStack.Guard o = types.enter(outer)) {
      try (ScopeStack.Guard i = types.enter(inner)) {
        assertThat(types.current()).isSameInstanceAs(inner);
        types.apply(Action.AddMakeChild.at(FieldPath.of("x"), electrical()));
      }
      assertThat(types.current()).isSameInstanceAs(outer);
    }
    assertThat(graph.lines()).containsExactly("Inner: child x: Electrical");
  }

  @Test
  public void missingParent() {
    try (ScopeStack.Guard t = types.enter(graph.addType("T"))) {
      DslException e =
          assertThrows(
              DslException.class, () -> types.resolveReference(FieldPath.of("a", "b", "c"), true));
      assertThat(e).hasMessageThat().isEqualTo("Field `a` is not defined in scope");
      assertThat(e).hasCauseThat().isInstanceOf(PathError.class);
    }
  }

  @Test
  public void missingChild() {
    try (ScopeStack.Guard t = types.enter(graph.addType("T"))) {
      types.apply(Action.AddMakeChild.at(FieldPath.of("a"), electrical()));
      DslException e =
          assertThrows(
              DslException.class, () -> types.resolveReference(FieldPath.of("a", "b"), true));
      assertThat(e).hasMessageThat().isEqualTo("Field `a.b` is not defined in scope");
    }
  }

  @Test
  public void invalidIndex() {
    try (ScopeStack.Guard t = types.enter(graph.addType("T"))) {
      types.apply(
          Action.AddMakeChild.at(
              FieldPath.of("rs"), ChildField.library(StdlibTypes.POINTER_SEQUENCE).build()));
      types.apply(
          Action.AddMakeChild.at(FieldPath.of("rs").child(Segment.index("0")), electrical()));
      types.resolveReference(FieldPath.of("rs").child(Segment.index("0")), true);
      DslException e =
          assertThrows(
              DslException.class,
              () -> types.resolveReference(FieldPath.of("rs").child(Segment.index("5")), true));
      assertThat(e).hasMessageThat().isEqualTo("Field `rs[5]` is not defined in scope");
    }
  }

  @Test
  public void unvalidatedReferences() {
    try (ScopeStack.Guard t = types.enter(graph.addType("T"))) {
      assertThat(types.resolveReference(FieldPath.of("any", "thing"), false).toString())
          .isEqualTo("any.thing");
    }
  }

  @Test
  public void formatPathErrors() {
    FieldPath path = FieldPath.of("a", "b", "c");
    List<String> ids = path.identifiers();
    assertThat(
            TypeContextStack.formatPathError(
                path, new PathError(PathError.Kind.MISSING_PARENT, ids, 2, "b", null)))
        .isEqualTo("Field `a.b` is not defined in scope");
    assertThat(
            TypeContextStack.formatPathError(
                path, new PathError(PathError.Kind.MISSING_CHILD, ids, 2, "c", null)))
        .isEqualTo("Field `a.b.c` is not defined in scope");
    assertThat(
            TypeContextStack.formatPathError(
                path, new PathError(PathError.Kind.OTHER, ImmutableList.of(), 0, "a", null)))
        .isEqualTo("Field `a.b.c` is not defined in scope");
    assertThat(
            TypeContextStack.formatPathError(
                path, new PathError(PathError.Kind.INVALID_INDEX, ids, 1, "b", "7")))
        .isEqualTo("Field `a[7]` is not defined in scope");
    assertThat(
            TypeContextStack.formatPathError(
                path,
                new PathError(PathError.Kind.INVALID_INDEX, ImmutableList.of("3"), 0, "3", null)))
        .isEqualTo("Field `[ 3 ]` is not defined in scope");
  }

  @Test
  public void externalTypesAreRecorded() {
    try (ScopeStack.Guard t = types.enter(graph.addType("T"))) {
      ImportRef ref = new ImportRef("Foo", "foo.ato");
      types.apply(
          Action.AddMakeChild.at(
              FieldPath.of("f"), ChildField.forSymbol(Symbol.imported(ref)).build()));
      assertThat(state.externalTypeRefs()).hasSize(1);
      assertThat(state.externalTypeRefs().get(0).importRef()).isEqualTo(ref);
      assertThat(graph.linkedType("T", "f")).isNull();
    }
  }

  @Test
  public void stdlibImportsAreRecordedLikeOtherImports() {
    try (ScopeStack.Guard t = types.enter(graph.addType("T"))) {
      ImportRef ref = new ImportRef("Resistor", null);
      types.apply(
          Action.AddMakeChild.at(
              FieldPath.of("r"), ChildField.forSymbol(Symbol.imported(ref)).build()));
      assertThat(state.externalTypeRefs()).hasSize(1);
      assertThat(state.externalTypeRefs().get(0).importRef()).isEqualTo(ref);
      assertThat(graph.linkedType("T", "r")).isNull();
      assertThat(graph.hasType("Resistor")).isFalse();
    }
  }

  @Test
  public void libraryTypesAreCreatedOnce() {
    try (ScopeStack.Guard t = types.enter(graph.addType("T"))) {
      types.apply(Action.AddMakeChild.at(FieldPath.of("a"), electrical()));
      types.apply(Action.AddMakeChild.at(FieldPath.of("b"), electrical()));
      assertThat(graph.linkedType("T", "a")).isEqualTo("Electrical");
      assertThat(graph.child("T", "a").typeReference.target)
          .isSameInstanceAs(graph.child("T", "b").typeReference.target);
    }
  }

  @Test
  public void pointerMembers() {
    try (ScopeStack.Guard t = types.enter(graph.addType("T"))) {
      NewChildSpec spec =
          new NewChildSpec(
              Symbol.imported(new ImportRef("Resistor", null)), ImmutableMap.of(), 3);
      types.apply(spec.actions(FieldPath.of("rs"), null, new CompileWarnings()));
      assertThat(
              types.pointerMembers(FieldPath.of("rs")).stream()
                  .map(Graph.PointerMember::identifier)
                  .collect(ImmutableList.toImmutableList()))
          .containsExactly("0", "1", "2")
          .inOrder();
      DslException e =
          assertThrows(DslException.class, () -> types.pointerMembers(FieldPath.of("xs")));
      assertThat(e).hasMessageThat().isEqualTo("Field `xs` is not defined in scope");
    }
  }
}
