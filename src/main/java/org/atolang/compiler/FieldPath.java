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
import java.util.List;

/**
 * A FieldPath names a field within a block as a sequence of segments, e.g. {@code a.b[0].c}. Index
 * segments ({@code [0]}) select elements of a pointer sequence.
 *
 * <p>FieldPaths are immutable. Their string form is used as the key for field declarations in a
 * {@link ScopeState}, so two paths are equal exactly when they render identically.
 */
public final class FieldPath {

  /** One segment of a path. */
  public record Segment(String identifier, boolean isIndex) {
    public Segment {
      Preconditions.checkNotNull(identifier);
    }

    public static Segment of(String identifier) {
      return new Segment(identifier, false);
    }

    public static Segment index(String identifier) {
      return new Segment(identifier, true);
    }
  }

  private final ImmutableList<Segment> segments;

  private FieldPath(ImmutableList<Segment> segments) {
    Preconditions.checkArgument(!segments.isEmpty(), "Empty field path");
    this.segments = segments;
  }

  public static FieldPath of(List<Segment> segments) {
    return new FieldPath(ImmutableList.copyOf(segments));
  }

  /** Returns a path of plain (non-index) segments. */
  public static FieldPath of(String first, String... rest) {
    ImmutableList.Builder<Segment> builder = ImmutableList.builder();
    builder.add(Segment.of(first));
    for (String s : rest) {
      builder.add(Segment.of(s));
    }
    return new FieldPath(builder.build());
  }

  public ImmutableList<Segment> segments() {
    return segments;
  }

  public Segment root() {
    return segments.get(0);
  }

  public Segment leaf() {
    return segments.get(segments.size() - 1);
  }

  /** Returns all but the last segment (possibly empty). */
  public ImmutableList<Segment> parentSegments() {
    return segments.subList(0, segments.size() - 1);
  }

  public boolean hasParent() {
    return segments.size() > 1;
  }

  /** Returns the path without its last segment; must only be called if {@link #hasParent}. */
  public FieldPath parent() {
    Preconditions.checkState(hasParent(), "%s has no parent", this);
    return new FieldPath(parentSegments());
  }

  /** Returns a path containing only the first segment of this one. */
  public FieldPath rootPath() {
    return segments.size() == 1 ? this : new FieldPath(segments.subList(0, 1));
  }

  /** Returns a new path with {@code segment} appended. */
  public FieldPath child(Segment segment) {
    return new FieldPath(
        ImmutableList.<Segment>builderWithExpectedSize(segments.size() + 1)
            .addAll(segments)
            .add(segment)
            .build());
  }

  /**
   * Returns a new path in which the first segment has been replaced by all the segments of {@code
   * root}.
   */
  public FieldPath withRoot(FieldPath root) {
    return new FieldPath(
        ImmutableList.<Segment>builder()
            .addAll(root.segments)
            .addAll(segments.subList(1, segments.size()))
            .build());
  }

  /** Returns the segments' identifiers, ignoring whether they are indices. */
  public ImmutableList<String> identifiers() {
    return segments.stream().map(Segment::identifier).collect(ImmutableList.toImmutableList());
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof FieldPath other && segments.equals(other.segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  /** Renders the path as it would be written in ato, e.g. {@code a.b[0].c}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Segment segment : segments) {
      if (segment.isIndex()) {
        sb.append('[').append(segment.identifier()).append(']');
      } else {
        if (sb.length() > 0) {
          sb.append('.');
        }
        sb.append(segment.identifier());
      }
    }
    return sb.toString();
  }
}
