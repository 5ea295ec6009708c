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
import java.util.List;
import org.atolang.Graph;
import org.atolang.Graph.Step;

/**
 * The path of one end of a link, relative to the type being built. Unlike a {@link FieldPath} it
 * may traverse traits and pointers (e.g. {@code a.can_bridge.out_}, where {@code can_bridge} is a
 * trait step and {@code out_} a pointer step). The empty path refers to the type itself.
 */
public final class LinkPath {

  public static final LinkPath SELF = new LinkPath(ImmutableList.of());

  private final ImmutableList<Step> steps;

  private LinkPath(ImmutableList<Step> steps) {
    this.steps = steps;
  }

  public static LinkPath of(List<Step> steps) {
    return steps.isEmpty() ? SELF : new LinkPath(ImmutableList.copyOf(steps));
  }

  /** Returns a LinkPath of field steps, one per segment of {@code path}. */
  public static LinkPath of(FieldPath path) {
    return new LinkPath(
        path.identifiers().stream().map(Step::field).collect(ImmutableList.toImmutableList()));
  }

  /** Returns a LinkPath of field steps with the given identifiers. */
  public static LinkPath ofFields(List<String> identifiers) {
    return of(identifiers.stream().map(Step::field).collect(ImmutableList.toImmutableList()));
  }

  public ImmutableList<Step> steps() {
    return steps;
  }

  public boolean isSelf() {
    return steps.isEmpty();
  }

  /** Returns a new LinkPath with the given steps appended. */
  public LinkPath append(Step... more) {
    return new LinkPath(ImmutableList.<Step>builder().addAll(steps).add(more).build());
  }

  /** Returns a new LinkPath with a field step for {@code identifier} appended. */
  public LinkPath child(String identifier) {
    return append(Step.field(identifier));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof LinkPath other && steps.equals(other.steps);
  }

  @Override
  public int hashCode() {
    return steps.hashCode();
  }

  @Override
  public String toString() {
    return Graph.Step.render(steps);
  }
}
