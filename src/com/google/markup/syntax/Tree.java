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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.Iterator;

/**
 * An ordered sequence of markup nodes: a whole document, the contents of a heading, or the body of
 * a template expression.
 */
@Immutable
public record Tree(ImmutableList<Node> nodes) implements Iterable<Node> {

  private static final Tree EMPTY = new Tree(ImmutableList.of());

  public Tree {
    checkNotNull(nodes);
  }

  public static Tree empty() {
    return EMPTY;
  }

  public static Tree of(Node... nodes) {
    return new Tree(ImmutableList.copyOf(nodes));
  }

  public static Tree copyOf(Iterable<? extends Node> nodes) {
    return new Tree(ImmutableList.copyOf(nodes));
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public int size() {
    return nodes.size();
  }

  @Override
  public Iterator<Node> iterator() {
    return nodes.iterator();
  }
}
