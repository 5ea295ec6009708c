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

import com.google.common.base.Joiner;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Surface-mount package sizes that a {@code package} assignment may request. Names starting with
 * {@code I} are imperial codes, those starting with {@code M} metric ones.
 */
public enum SmdSize {
  I01005,
  I0201,
  I0402,
  I0603,
  I0805,
  I1206,
  I1210,
  I1812,
  I2010,
  I2512,
  M0402,
  M0603,
  M1005,
  M1608,
  M2012,
  M3216,
  M3225,
  M4532,
  M5025,
  M6332;

  private static final Pattern COMPONENT_PREFIX = Pattern.compile("^[RCL]");
  private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");

  /**
   * Parses a package name as written in ato: a component-prefixed imperial size ({@code R0402}), a
   * bare imperial size ({@code 0402}), or an enum name ({@code I0402}).
   */
  static SmdSize parse(String value) {
    String name = COMPONENT_PREFIX.matcher(value).replaceFirst("I");
    if (DIGITS.matcher(name).matches()) {
      name = "I" + name;
    }
    for (SmdSize size : values()) {
      if (size.name().equals(name)) {
        return size;
      }
    }
    throw DslException.of(
        "Invalid package: `%s`. Valid packages are: %s",
        name, Joiner.on(", ").join(Arrays.asList(values())));
  }
}
