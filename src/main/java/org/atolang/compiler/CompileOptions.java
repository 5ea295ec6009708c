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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/** Options for one call to {@link Compiler#compile}. */
public final class CompileOptions {

  /** The path of the file being compiled; its directory is recorded on every block. */
  public final @Nullable String filePath;

  /**
   * Set when compiling a file on behalf of an import; block identifiers are then namespaced as
   * {@code importPath::name}.
   */
  public final @Nullable String importPath;

  public final CompileWarnings warnings;

  private CompileOptions(Builder builder) {
    this.filePath = builder.filePath;
    this.importPath = builder.importPath;
    this.warnings = (builder.warnings != null) ? builder.warnings : new CompileWarnings();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns options with no file path, no import path, and a fresh warnings sink. */
  public static CompileOptions defaults() {
    return builder().build();
  }

  /** Builds CompileOptions. */
  public static final class Builder {
    private @Nullable String filePath;
    private @Nullable String importPath;
    private @Nullable CompileWarnings warnings;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder filePath(@Nullable String filePath) {
      this.filePath = filePath;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder importPath(@Nullable String importPath) {
      this.importPath = importPath;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder warnings(CompileWarnings warnings) {
      this.warnings = warnings;
      return this;
    }

    public CompileOptions build() {
      return new CompileOptions(this);
    }
  }
}
