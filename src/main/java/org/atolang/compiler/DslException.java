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

import com.google.errorprone.annotations.FormatMethod;
import org.atolang.ast.Ast;
import org.jspecify.annotations.Nullable;

/**
 * All errors in the user's ato code detected while lowering throw a DslException: malformed
 * pragmas, undefined or duplicate names, statements that are not allowed where they appear, paths
 * that do not resolve, wrong literal kinds, and syntax used without its experiment enabled.
 */
public class DslException extends RuntimeException {
  public final String msg;

  /** Where the offending node started, if known. */
  public final Ast.@Nullable SourceLocation location;

  public DslException(String msg) {
    this(msg, null, null);
  }

  public DslException(String msg, Ast.@Nullable SourceLocation location) {
    this(msg, location, null);
  }

  public DslException(
      String msg, Ast.@Nullable SourceLocation location, @Nullable Throwable cause) {
    super(msg, cause);
    this.msg = msg;
    this.location = location;
  }

  /** Returns a new DslException with a formatted message. */
  @FormatMethod
  static DslException of(String fmt, Object... fmtArgs) {
    return new DslException(String.format(fmt, fmtArgs));
  }

  /**
   * Returns a copy of this exception pointing at {@code node}, unless a location has already been
   * attached.
   */
  DslException locatedAt(Ast.@Nullable Node node) {
    if (location != null || node == null || node.location() == null) {
      return this;
    }
    DslException result = new DslException(msg, node.location(), getCause());
    result.setStackTrace(getStackTrace());
    return result;
  }

  @Override
  public String getMessage() {
    return (location == null) ? msg : String.format("%s (%s)", msg, location);
  }
}
