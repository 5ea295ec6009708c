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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.atolang.Graph.Step;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConnectOverridesTest {

  private final CompileWarnings warnings = new CompileWarnings();
  private final ConnectOverrides overrides = new ConnectOverrides(warnings);

  @Test
  public void unchangedPath() {
    LinkPath path = LinkPath.ofFields(ImmutableList.of("i2c", "scl"));
    assertThat(overrides.translate(path)).isEqualTo(path);
    assertThat(warnings.messages()).isEmpty();
  }

  @Test
  public void onlyFieldStepsAreRenamed() {
    LinkPath path =
        LinkPath.of(ImmutableList.of(Step.field("p"), Step.trait("vcc"), Step.pointer("gnd")));
    assertThat(overrides.translate(path)).isEqualTo(path);
  }

  @Test
  public void renamedSegmentsAnywhereInThePath() {
    LinkPath path = LinkPath.ofFields(ImmutableList.of("vcc", "x", "gnd"));
    assertThat(overrides.translate(path).toString()).isEqualTo("hv.x.lv");
  }

  @Test
  public void referenceShimKeepsTheSuffix() {
    LinkPath path = LinkPath.ofFields(ImmutableList.of("spi", "reference_shim", "lv"));
    LinkPath translated = overrides.translate(path);
    assertThat(translated.steps())
        .containsExactly(
            Step.field("spi"),
            Step.trait(StdlibTypes.HAS_SINGLE_ELECTRIC_REFERENCE),
            Step.field("reference"),
            Step.field("lv"))
        .inOrder();
    assertThat(warnings.messages())
        .containsExactly(
            "Field `reference_shim` is deprecated. Replace `spi.reference_shim.lv` with"
                + " `spi.has_single_electric_reference.reference.lv`.");
  }

  @Test
  public void selfIsUnchanged() {
    assertThat(overrides.translate(LinkPath.SELF)).isEqualTo(LinkPath.SELF);
  }
}
