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

/** Thrown when a tree nests deeper than {@link TraversalOptions#getMaxDepth()} allows. */
public final class AstTooDeepException extends RuntimeException {
  private final int maxDepth;

  AstTooDeepException(int maxDepth) {
    super(String.format("Syntax tree is nested deeper than %d levels", maxDepth));
    this.maxDepth = maxDepth;
  }

  public int getMaxDepth() {
    return maxDepth;
  }
}
