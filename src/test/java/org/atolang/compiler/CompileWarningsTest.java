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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CompileWarningsTest {

  private final CompileWarnings warnings = new CompileWarnings();

  @Test
  public void warn() {
    warnings.warn("first %s", 1);
    warnings.warn("first %s", 1);
    assertThat(warnings.messages()).containsExactly("first 1", "first 1");
  }

  @Test
  public void warnOnce() {
    assertThat(warnings.warnOnce("k", "only %s", "once")).isTrue();
    assertThat(warnings.warnOnce("k", "only %s", "again")).isFalse();
    assertThat(warnings.warnOnce("other", "different key")).isTrue();
    assertThat(warnings.messages()).containsExactly("only once", "different key").inOrder();
  }

  @Test
  public void deprecated() {
    warnings.deprecated("vcc", "hv");
    warnings.deprecated("vcc", "hv");
    warnings.deprecated("gnd", "lv");
    assertThat(warnings.messages())
        .containsExactly(
            "'vcc' is deprecated. Use 'hv' instead.", "'gnd' is deprecated. Use 'lv' instead.")
        .inOrder();
  }

  @Test
  public void instancesAreIndependent() {
    new CompileWarnings().deprecated("vcc", "hv");
    assertThat(warnings.deprecated("vcc", "hv")).isTrue();
  }
}
