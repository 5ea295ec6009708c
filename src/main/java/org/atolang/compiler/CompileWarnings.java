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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the warnings emitted during one compilation (deprecated syntax, ignored template
 * arguments, ...) and forwards each to the log.
 *
 * <p>"Once" warnings are de-duplicated by key for the lifetime of this object only, so separate
 * compilations each report their own deprecations. Not thread-safe.
 */
public final class CompileWarnings {
  private static final Logger logger = LoggerFactory.getLogger(CompileWarnings.class);

  private final Set<String> warnedKeys = new HashSet<>();
  private final List<String> messages = new ArrayList<>();

  /** Emits a warning. */
  @FormatMethod
  public void warn(String fmt, Object... fmtArgs) {
    String msg = String.format(fmt, fmtArgs);
    messages.add(msg);
    logger.warn(msg);
  }

  /**
   * Emits a warning unless one with the same key has already been emitted. Returns true if the
   * warning was emitted.
   */
  @CanIgnoreReturnValue
  @FormatMethod
  public boolean warnOnce(String key, @FormatString String fmt, Object... fmtArgs) {
    if (!warnedKeys.add(key)) {
      return false;
    }
    warn(fmt, fmtArgs);
    return true;
  }

  /** Emits the standard deprecation warning for {@code name}, at most once. */
  @CanIgnoreReturnValue
  public boolean deprecated(String name, String replacement) {
    return warnOnce(
        "deprecated:" + name, "'%s' is deprecated. Use '%s' instead.", name, replacement);
  }

  /** Returns every warning emitted so far, in order. */
  public ImmutableList<String> messages() {
    return ImmutableList.copyOf(messages);
  }
}
