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
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class SmdSizeTest {

  @Test
  public void imperialSizes(
      @TestParameter({"0402", "R0402", "C0402", "L0402", "I0402"}) String value) {
    assertThat(SmdSize.parse(value)).isEqualTo(SmdSize.I0402);
  }

  @Test
  public void metricSizes() {
    assertThat(SmdSize.parse("M1608")).isEqualTo(SmdSize.M1608);
  }

  @Test
  public void everySizeParsesAsItself(@TestParameter SmdSize size) {
    assertThat(SmdSize.parse(size.name())).isEqualTo(size);
  }

  @Test
  public void invalid(@TestParameter({"9999", "X0402", "0402 ", ""}) String value) {
    DslException e = assertThrows(DslException.class, () -> SmdSize.parse(value));
    assertThat(e).hasMessageThat().startsWith("Invalid package: `");
    assertThat(e).hasMessageThat().endsWith("M5025, M6332");
  }
}
