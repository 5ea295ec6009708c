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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the text of a {@code #pragma} line. The grammar is
 *
 * <pre>
 *   pragma_stmt:   '#pragma' function_call
 *   function_call: NAME '(' [argument (',' argument)*] ')'
 *   argument:      STRING | INT | BOOLEAN
 * </pre>
 */
final class Pragmas {

  // Static methods only
  private Pragmas() {}

  /** The name of the only pragma function currently recognized. */
  static final String EXPERIMENT = "experiment";

  /** A parsed pragma: the function name and its arguments (Strings, Integers, and Booleans). */
  record Pragma(String name, ImmutableList<Object> args) {}

  private static final Pattern PRAGMA =
      Pattern.compile("^#pragma\\s+(?<name>\\w+)\\(\\s*(?<args>.*?)\\s*\\)$");

  /** One argument followed by a comma or the end of the argument list. */
  private static final Pattern ARGUMENT =
      Pattern.compile(
          "\\s*(?:\"(?<string>[^\"]*)\"|(?<int>-?\\d{1,9})|(?<bool>True|False|true|false))"
              + "\\s*(?:,|$)");

  static Pragma parse(String text) {
    Matcher matcher = PRAGMA.matcher(text.strip());
    if (!matcher.matches()) {
      throw DslException.of("Malformed pragma: '%s'", text);
    }
    String argsText = matcher.group("args");
    ImmutableList.Builder<Object> args = ImmutableList.builder();
    if (!argsText.isEmpty()) {
      Matcher arg = ARGUMENT.matcher(argsText);
      int pos = 0;
      while (pos < argsText.length()) {
        if (!arg.find(pos) || arg.start() != pos || arg.end() == pos) {
          throw DslException.of("Malformed pragma argument in '%s'", text);
        }
        if (arg.group("string") != null) {
          args.add(arg.group("string"));
        } else if (arg.group("int") != null) {
          args.add(Integer.parseInt(arg.group("int")));
        } else {
          args.add(Boolean.parseBoolean(arg.group("bool")));
        }
        pos = arg.end();
      }
      // A trailing comma leaves nothing after it to match, so check for it explicitly.
      if (argsText.strip().endsWith(",")) {
        throw DslException.of("Malformed pragma argument in '%s'", text);
      }
    }
    return new Pragma(matcher.group("name"), args.build());
  }
}
