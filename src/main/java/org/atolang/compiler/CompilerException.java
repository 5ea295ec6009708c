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

/**
 * Thrown when the compiler reaches a state that valid or invalid user code should never produce,
 * e.g. a node kind with no lowering rule. A CompilerException is a bug in the compiler, not in the
 * code being compiled.
 */
public class CompilerException extends RuntimeException {

  public CompilerException(String msg) {
    super(msg);
  }

  @FormatMethod
  static CompilerException of(String fmt, Object... fmtArgs) {
    return new CompilerException(String.format(fmt, fmtArgs));
  }
}
