/*
 * Copyright 2025 The Closure Compiler Authors.
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

package com.esupgrade.safety;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SafetyOptionsTest {

  @Test
  public void testDefaults() {
    SafetyOptions options = new SafetyOptions();
    assertThat(options.getWrapperCalleeNames()).containsExactly("$", "jQuery");
    assertThat(options.getOpaqueTopLevelPrefix()).isEqualTo("$");
  }

  @Test
  public void testSetWrapperCalleeNames() {
    SafetyOptions options = new SafetyOptions();
    options.setWrapperCalleeNames(ImmutableList.of("wrap", "wrap", "cash"));
    assertThat(options.getWrapperCalleeNames()).containsExactly("wrap", "cash").inOrder();

    options.setWrapperCalleeNames(ImmutableList.of());
    assertThat(options.getWrapperCalleeNames()).isEmpty();
  }

  @Test
  public void testWrapperCalleeNamesMustBeSimpleNames() {
    SafetyOptions options = new SafetyOptions();
    assertThrows(
        IllegalArgumentException.class,
        () -> options.setWrapperCalleeNames(ImmutableList.of("lib.wrap")));
    assertThrows(
        IllegalArgumentException.class, () -> options.setWrapperCalleeNames(ImmutableList.of("")));
    assertThat(options.getWrapperCalleeNames())
        .isEqualTo(SafetyOptions.DEFAULT_WRAPPER_CALLEE_NAMES);
  }

  @Test
  public void testOpaqueTopLevelPrefix() {
    SafetyOptions options = new SafetyOptions();
    options.setOpaqueTopLevelPrefix("_");
    assertThat(options.getOpaqueTopLevelPrefix()).isEqualTo("_");

    options.setOpaqueTopLevelPrefix(null);
    assertThat(options.getOpaqueTopLevelPrefix()).isNull();

    assertThrows(IllegalArgumentException.class, () -> options.setOpaqueTopLevelPrefix(""));
  }

  @Test
  public void testToString() {
    SafetyOptions options = new SafetyOptions();
    assertThat(options.toString()).contains("wrapperCalleeNames=[$, jQuery]");
    assertThat(options.toString()).contains("opaqueTopLevelPrefix=$");

    options.setOpaqueTopLevelPrefix(null);
    assertThat(options.toString()).doesNotContain("opaqueTopLevelPrefix");
  }
}
