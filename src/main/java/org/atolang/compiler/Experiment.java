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

import org.jspecify.annotations.Nullable;

/** Language features that must be enabled with {@code #pragma experiment("NAME")} before use. */
public enum Experiment {
  BRIDGE_CONNECT,
  FOR_LOOP,
  TRAITS,
  MODULE_TEMPLATING,
  INSTANCE_TRAITS;

  /** Returns the experiment with the given name, or null if there is none. */
  static @Nullable Experiment forName(String name) {
    for (Experiment experiment : values()) {
      if (experiment.name().equals(name)) {
        return experiment;
      }
    }
    return null;
  }
}
