/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.markup.syntax;

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.OptionalInt;

/** Options for {@link Traversal#walk(Visit, Tree, TraversalOptions)}. */
@AutoValue
public abstract class TraversalOptions {

  private static final TraversalOptions DEFAULTS = builder().build();

  /**
   * The deepest nesting of nodes and expressions a tree may have. Trees from untrusted input should
   * be bounded, since the walk recurses once per level.
   */
  public abstract OptionalInt getMaxDepth();

  public static TraversalOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new AutoValue_TraversalOptions.Builder();
  }

  public abstract Builder toBuilder();

  /** Builder for {@link TraversalOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    @CanIgnoreReturnValue
    public abstract Builder setMaxDepth(int maxDepth);

    abstract TraversalOptions autoBuild();

    public final TraversalOptions build() {
      TraversalOptions options = autoBuild();
      OptionalInt maxDepth = options.getMaxDepth();
      checkState(
          !maxDepth.isPresent() || maxDepth.getAsInt() >= 1,
          "Maximum depth must be positive: %s",
          maxDepth);
      return options;
    }
  }
}
