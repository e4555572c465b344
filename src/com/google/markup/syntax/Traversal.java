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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Entry points for walking a syntax tree with a {@link Visit}. */
public final class Traversal {

  private static final Logger logger = Logger.getLogger(Traversal.class.getName());

  private Traversal() {}

  /** Walks {@code tree} in canonical order, calling back into {@code visitor}. */
  public static void walk(Visit visitor, Tree tree) {
    walk(visitor, tree, TraversalOptions.defaults());
  }

  /**
   * Walks {@code tree} in canonical order after checking it against {@code options}.
   *
   * @throws AstTooDeepException if the tree is nested deeper than the configured maximum. The
   *     visitor is not called in that case.
   */
  public static void walk(Visit visitor, Tree tree, TraversalOptions options) {
    checkNotNull(visitor);
    checkNotNull(tree);
    OptionalInt maxDepth = options.getMaxDepth();
    if (maxDepth.isPresent()) {
      checkDepth(tree, maxDepth.getAsInt());
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Walking tree of " + tree.size() + " nodes with " + visitor.getClass().getName());
    }
    visitor.visitTree(tree);
  }

  /**
   * Returns the nesting depth of {@code tree}: the length of the longest chain of nodes and
   * expressions. An empty tree has depth 0.
   */
  public static int depth(Tree tree) {
    DepthCounter counter = new DepthCounter(Integer.MAX_VALUE);
    counter.visitTree(tree);
    return counter.maxSeen;
  }

  private static void checkDepth(Tree tree, int maxDepth) {
    try {
      new DepthCounter(maxDepth).visitTree(tree);
    } catch (AstTooDeepException e) {
      logger.warning("Rejecting syntax tree: " + e.getMessage());
      throw e;
    }
  }

  /** Measures nesting depth, giving up as soon as the limit is passed. */
  private static final class DepthCounter implements Visit {
    private final int limit;
    private int depth;
    private int maxSeen;

    DepthCounter(int limit) {
      this.limit = limit;
    }

    @Override
    public void visitNode(Node node) {
      descend();
      Walk.walkNode(this, node);
      depth--;
    }

    @Override
    public void visitExpr(Expr expr) {
      descend();
      Walk.walkExpr(this, expr);
      depth--;
    }

    private void descend() {
      depth++;
      if (depth > limit) {
        throw new AstTooDeepException(limit);
      }
      maxSeen = Math.max(maxSeen, depth);
    }
  }
}
