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
import org.jspecify.annotations.Nullable;

/**
 * Identifies a type imported by an {@code import} statement. A null {@link #path} means the type
 * comes from the standard library.
 */
public record ImportRef(String name, @Nullable String path) {
  public ImportRef {
    Preconditions.checkNotNull(name);
  }

  public boolean isStdlib() {
    return path == null;
  }

  @Override
  public String toString() {
    return (path == null) ? name : path + "::" + name;
  }
}
