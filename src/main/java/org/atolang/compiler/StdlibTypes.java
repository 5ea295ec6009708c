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
 * The standard-library types that ato code may import without a path, plus the names of the
 * library types the compiler itself instantiates (literals, expressions, marker traits, ...).
 */
final class StdlibTypes {

  // Static methods only
  private StdlibTypes() {}

  static final String ELECTRICAL = "Electrical";
  static final String POINTER_SEQUENCE = "PointerSequence";

  static final String STRINGS = "Strings";
  static final String BOOLEANS = "Booleans";
  static final String NUMBERS = "Numbers";
  static final String ENUMS = "AbstractEnums";

  static final String IS_ATO_BLOCK = "is_ato_block";
  static final String IS_ATO_MODULE = "is_ato_module";
  static final String IS_ATO_COMPONENT = "is_ato_component";
  static final String IS_ATO_INTERFACE = "is_ato_interface";

  static final String IS_LEAD = "is_lead";
  static final String CAN_ATTACH_TO_PAD_BY_NAME = "can_attach_to_pad_by_name";
  static final String CAN_BRIDGE = "can_bridge";
  static final String HAS_DATASHEET = "has_datasheet";
  static final String HAS_DESIGNATOR_PREFIX = "has_designator_prefix";
  static final String HAS_NET_NAME_SUGGESTION = "has_net_name_suggestion";
  static final String HAS_PACKAGE_REQUIREMENTS = "has_package_requirements";
  static final String REQUIRES_EXTERNAL_USAGE = "requires_external_usage";
  static final String HAS_SINGLE_ELECTRIC_REFERENCE = "has_single_electric_reference";
  static final String IS_PICKABLE_BY_SUPPLIER_ID = "is_pickable_by_supplier_id";
  static final String HAS_MPN_ASSIGNED = "has_mpn_assigned";
  static final String HAS_MFR_ASSIGNED = "has_mfr_assigned";
  static final String HAS_PART_PICKED = "has_part_picked";
  static final String HAS_DEFAULT_CONSTRAINT = "has_default_constraint";

  /**
   * A standard-library type. If {@link #templateParams} is non-empty the type has a templated
   * entry point accepting those (named, typed) arguments.
   */
  static final class LibraryType {
    final String name;
    final boolean isTrait;
    final ImmutableMap<String, Class<?>> templateParams;

    private LibraryType(String name, boolean isTrait, ImmutableMap<String, Class<?>> params) {
      this.name = name;
      this.isTrait = isTrait;
      this.templateParams = params;
    }

    boolean isTemplated() {
      return !templateParams.isEmpty();
    }

    /**
     * Returns true if {@code args} can be passed to this type's templated entry point: every
     * argument must name a parameter and have that parameter's type.
     */
    boolean acceptsTemplateArgs(Map<String, Object> args) {
      if (!isTemplated()) {
        return false;
      }
      for (Map.Entry<String, Object> arg : args.entrySet()) {
        Class<?> expected = templateParams.get(arg.getKey());
        if (expected == null || !expected.isInstance(arg.getValue())) {
          return false;
        }
      }
      return true;
    }
  }

  private static final ImmutableMap<String, LibraryType> TYPES;

  static {
    ImmutableMap.Builder<String, LibraryType> builder = ImmutableMap.builder();
    String[] modules =
        new String[] {
          "BJT",
          "Capacitor",
          "Crystal",
          "Crystal_Oscillator",
          "Diode",
          "ElectricLogic",
          "ElectricPower",
          "ElectricSignal",
          ELECTRICAL,
          "Fuse",
          "I2C",
          "Inductor",
          "JTAG",
          "LED",
          "MOSFET",
          "Resistor",
          "ResistorVoltageDivider",
          "SPI",
          "SWD",
          "UART",
          "USB2_0",
        };
    for (String name : modules) {
      builder.put(name, new LibraryType(name, false, ImmutableMap.of()));
    }
    addType(builder, "Addressor", false, ImmutableMap.of("address_bits", BigDecimal.class));
    addType(builder, "CAN_TTL", false, ImmutableMap.of("termination", Boolean.class));

    String[] traits =
        new String[] {
          CAN_BRIDGE, REQUIRES_EXTERNAL_USAGE, IS_LEAD, HAS_DEFAULT_CONSTRAINT,
        };
    for (String name : traits) {
      builder.put(name, new LibraryType(name, true, ImmutableMap.of()));
    }
    addType(builder, HAS_DATASHEET, true, ImmutableMap.of("datasheet", String.class));
    addType(builder, HAS_DESIGNATOR_PREFIX, true, ImmutableMap.of("prefix", String.class));
    addType(
        builder,
        HAS_NET_NAME_SUGGESTION,
        true,
        ImmutableMap.of("name", String.class, "level", String.class));
    addType(builder, HAS_PACKAGE_REQUIREMENTS, true, ImmutableMap.of("size", String.class));
    addType(
        builder,
        HAS_SINGLE_ELECTRIC_REFERENCE,
        true,
        ImmutableMap.of("ground_only", Boolean.class));
    addType(
        builder,
        IS_PICKABLE_BY_SUPPLIER_ID,
        true,
        ImmutableMap.of("supplier_part_id", String.class, "supplier", String.class));
    addType(builder, HAS_MPN_ASSIGNED, true, ImmutableMap.of("mpn", String.class));
    addType(builder, HAS_MFR_ASSIGNED, true, ImmutableMap.of("mfr", String.class));
    addType(
        builder,
        HAS_PART_PICKED,
        true,
        ImmutableMap.of("supplier_id", String.class, "supplier_partno", String.class));
    addType(builder, CAN_ATTACH_TO_PAD_BY_NAME, true, ImmutableMap.of("regex", String.class));
    TYPES = builder.buildOrThrow();
  }

  private static void addType(
      ImmutableMap.Builder<String, LibraryType> builder,
      String name,
      boolean isTrait,
      ImmutableMap<String, Class<?>> params) {
    builder.put(name, new LibraryType(name, isTrait, params));
  }

  /** Returns the standard-library type with the given name, or null. */
  static @Nullable LibraryType lookup(String name) {
    return TYPES.get(name);
  }

  /**
   * Returns true if {@code name} may be imported without a path. Legacy trait names are allowed
   * (they are translated by {@link TraitOverrides}).
   */
  static boolean isAllowed(String name) {
    return TYPES.containsKey(name) || TraitOverrides.isLegacyName(name);
  }
}
