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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/** Options for the safety analysis of one unit. */
public class SafetyOptions implements Serializable {

  private static final long serialVersionUID = 1L;

  public static final ImmutableSet<String> DEFAULT_WRAPPER_CALLEE_NAMES =
      ImmutableSet.of("$", "jQuery");

  public static final String DEFAULT_OPAQUE_TOP_LEVEL_PREFIX = "$";

  /**
   * Names of the functions whose single-argument calls wrap their argument, e.g. {@code $(el)}.
   * A variable initialized from such a call can be resolved to the wrapped argument.
   */
  private ImmutableSet<String> wrapperCalleeNames = DEFAULT_WRAPPER_CALLEE_NAMES;

  /**
   * Top-level variables whose name starts with this prefix are never resolved as aliases. Null
   * disables the rule.
   */
  private @Nullable String opaqueTopLevelPrefix = DEFAULT_OPAQUE_TOP_LEVEL_PREFIX;

  public SafetyOptions() {}

  public void setWrapperCalleeNames(Iterable<String> names) {
    ImmutableSet<String> copy = ImmutableSet.copyOf(names);
    for (String name : copy) {
      checkArgument(!name.isEmpty(), "Wrapper callee names must not be empty");
      checkArgument(name.indexOf('.') == -1, "Wrapper callee must be a simple name: %s", name);
    }
    wrapperCalleeNames = copy;
  }

  public ImmutableSet<String> getWrapperCalleeNames() {
    return wrapperCalleeNames;
  }

  /**
   * @param prefix a non-empty prefix, or null to resolve top-level names regardless of spelling
   */
  public void setOpaqueTopLevelPrefix(@Nullable String prefix) {
    checkArgument(prefix == null || !prefix.isEmpty(), "An empty prefix would match every name");
    opaqueTopLevelPrefix = prefix;
  }

  public @Nullable String getOpaqueTopLevelPrefix() {
    return opaqueTopLevelPrefix;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("wrapperCalleeNames", wrapperCalleeNames)
        .add("opaqueTopLevelPrefix", opaqueTopLevelPrefix)
        .toString();
  }
}
