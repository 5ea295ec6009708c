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

import java.math.BigDecimal;
import java.math.MathContext;
import org.atolang.ast.Ast;

/**
 * Lowers the three quantity forms to a numeric literal: {@code 10kohm}, {@code 1V to 2V}, and
 * {@code 10kohm +/- 5%}. Each literal is a {@link StdlibTypes#NUMBERS} child with {@code min},
 * {@code max} (scaled to the base unit) and {@code unit} attributes.
 */
final class Quantities {

  // Static methods only
  private Quantities() {}

  private static final BigDecimal PERCENT = new BigDecimal(100);
  private static final BigDecimal PPM = new BigDecimal(1_000_000);

  /** Returns the literal for a single value, e.g. {@code 3.3V}. */
  static ChildField single(Ast.Quantity quantity) {
    Units.Unit unit = Units.resolve(quantity.unit);
    BigDecimal value = unit.toBase(quantity.value);
    return literal(value, value, unit);
  }

  /**
   * Returns the literal for {@code start to end}. If only one bound has a unit the other is taken
   * to have the same one; if both do they must share a base unit.
   */
  static ChildField bounded(Ast.BoundedQuantity quantity) {
    Units.Unit startUnit = Units.resolve(quantity.start.unit);
    Units.Unit endUnit = Units.resolve(quantity.end.unit);
    if (startUnit.isDimensionless() && endUnit.isDimensionless()) {
      throw DslException.of(
          "Bounded quantity `%s to %s` requires a unit", quantity.start.value, quantity.end.value);
    } else if (startUnit.isDimensionless()) {
      startUnit = endUnit;
    } else if (endUnit.isDimensionless()) {
      endUnit = startUnit;
    } else if (!startUnit.base().equals(endUnit.base())) {
      throw DslException.of(
          "Bounded quantity units do not match: `%s` and `%s`",
          startUnit.symbol(),
          endUnit.symbol());
    }
    BigDecimal start = startUnit.toBase(quantity.start.value);
    BigDecimal end = endUnit.toBase(quantity.end.value);
    return literal(start.min(end), start.max(end), startUnit);
  }

  /**
   * Returns the literal for {@code nominal +/- tolerance}. A {@code %} or {@code ppm} tolerance is
   * relative to the nominal value; any other tolerance is absolute and must have the nominal's
   * base unit.
   */
  static ChildField bilateral(Ast.BilateralQuantity quantity) {
    Units.Unit nominalUnit = Units.resolve(quantity.nominal.unit);
    Units.Unit toleranceUnit = Units.resolve(quantity.tolerance.unit);
    BigDecimal nominal = nominalUnit.toBase(quantity.nominal.value);

    if (toleranceUnit.isRelative()) {
      if (nominalUnit.isDimensionless()) {
        throw DslException.of(
            "Bilateral quantity `%s +/- %s%s` requires a unit",
            quantity.nominal.value,
            quantity.tolerance.value,
            toleranceUnit.symbol());
      }
      if (nominal.signum() == 0) {
        throw DslException.of(
            "Relative tolerance `%s%s` cannot be applied to a nominal value of zero",
            quantity.tolerance.value,
            toleranceUnit.symbol());
      }
      BigDecimal divider = toleranceUnit.base().equals("ppm") ? PPM : PERCENT;
      BigDecimal fraction = quantity.tolerance.value.divide(divider, MathContext.DECIMAL64);
      BigDecimal lo = nominal.multiply(BigDecimal.ONE.subtract(fraction));
      BigDecimal hi = nominal.multiply(BigDecimal.ONE.add(fraction));
      return literal(lo.min(hi), lo.max(hi), nominalUnit);
    }

    Units.Unit unit;
    if (toleranceUnit.isDimensionless() && nominalUnit.isDimensionless()) {
      throw DslException.of(
          "Bilateral quantity `%s +/- %s` requires a unit",
          quantity.nominal.value,
          quantity.tolerance.value);
    } else if (toleranceUnit.isDimensionless()) {
      unit = nominalUnit;
      toleranceUnit = nominalUnit;
    } else if (nominalUnit.isDimensionless()) {
      unit = toleranceUnit;
      nominal = toleranceUnit.toBase(quantity.nominal.value);
    } else if (!nominalUnit.base().equals(toleranceUnit.base())) {
      throw DslException.of(
          "Tolerance unit `%s` does not match nominal unit `%s`",
          toleranceUnit.symbol(),
          nominalUnit.symbol());
    } else {
      unit = nominalUnit;
    }
    BigDecimal tolerance = toleranceUnit.toBase(quantity.tolerance.value).abs();
    return literal(nominal.subtract(tolerance), nominal.add(tolerance), unit);
  }

  private static ChildField literal(BigDecimal min, BigDecimal max, Units.Unit unit) {
    return ChildField.library(StdlibTypes.NUMBERS)
        .attribute("min", normalize(min))
        .attribute("max", normalize(max))
        .attribute("unit", unit.base())
        .build();
  }

  /** Strips trailing zeros without switching to exponent notation for whole numbers. */
  static BigDecimal normalize(BigDecimal value) {
    BigDecimal stripped = value.stripTrailingZeros();
    return (stripped.scale() < 0) ? stripped.setScale(0) : stripped;
  }
}
