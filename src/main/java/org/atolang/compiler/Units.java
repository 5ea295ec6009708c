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

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Resolves the unit symbols that may follow a number in ato ({@code 10kohm}, {@code 3.3V}, {@code
 * 5%}) to a base unit and a scale factor.
 */
final class Units {

  // Static methods only
  private Units() {}

  /** The unit of a quantity written without one. */
  static final String DIMENSIONLESS = "Dimensionless";

  /** A resolved unit symbol: the value written must be multiplied by {@link #scale}. */
  record Unit(String symbol, String base, BigDecimal scale) {
    boolean isDimensionless() {
      return base.equals(DIMENSIONLESS);
    }

    /** True for units whose tolerance is relative to the nominal value. */
    boolean isRelative() {
      return base.equals("Percent") || base.equals("ppm");
    }

    BigDecimal toBase(BigDecimal value) {
      return value.multiply(scale);
    }
  }

  static final Unit NONE = new Unit("", DIMENSIONLESS, BigDecimal.ONE);

  /** Base symbol to the name recorded on the literal. */
  private static final ImmutableMap<String, String> BASE_UNITS =
      ImmutableMap.<String, String>builder()
          .put("V", "Volt")
          .put("A", "Ampere")
          .put("ohm", "Ohm")
          .put("Ω", "Ohm")
          .put("F", "Farad")
          .put("H", "Henry")
          .put("Hz", "Hertz")
          .put("W", "Watt")
          .put("s", "Second")
          .put("K", "Kelvin")
          .put("degC", "DegreeCelsius")
          .put("%", "Percent")
          .put("ppm", "ppm")
          .put("dB", "Decibel")
          .put("m", "Meter")
          .buildOrThrow();

  private static final ImmutableMap<String, BigDecimal> PREFIXES =
      ImmutableMap.<String, BigDecimal>builder()
          .put("f", new BigDecimal("1e-15"))
          .put("p", new BigDecimal("1e-12"))
          .put("n", new BigDecimal("1e-9"))
          .put("u", new BigDecimal("1e-6"))
          .put("µ", new BigDecimal("1e-6"))
          .put("m", new BigDecimal("1e-3"))
          .put("k", new BigDecimal("1e3"))
          .put("M", new BigDecimal("1e6"))
          .put("G", new BigDecimal("1e9"))
          .put("T", new BigDecimal("1e12"))
          .buildOrThrow();

  /**
   * Returns the unit named by {@code symbol}; null or empty means dimensionless.
   *
   * @throws DslException if the symbol is not a known unit, with or without an SI prefix
   */
  static Unit resolve(@Nullable String symbol) {
    if (symbol == null || symbol.isEmpty()) {
      return NONE;
    }
    // "m" is both a prefix and the meter; unprefixed matches win.
    String base = BASE_UNITS.get(symbol);
    if (base != null) {
      return new Unit(symbol, base, BigDecimal.ONE);
    }
    for (Map.Entry<String, BigDecimal> prefix : PREFIXES.entrySet()) {
      String p = prefix.getKey();
      if (symbol.length() > p.length() && symbol.startsWith(p)) {
        String rest = symbol.substring(p.length());
        base = BASE_UNITS.get(rest);
        if (base != null && !rest.equals("%") && !rest.equals("ppm")) {
          return new Unit(symbol, base, prefix.getValue());
        }
      }
    }
    throw DslException.of("Unknown unit: `%s`", symbol);
  }
}
