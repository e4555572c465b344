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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * A visitor that keeps track of the lexical scopes it is in and of the names bound in each of them.
 *
 * <p>The root scope is always open. Subclasses observe scope changes through {@link #enterScope}
 * and {@link #exitScope} and bindings through {@link #declare}; the scope stack is already updated
 * when {@code enterScope} and {@code declare} run, and still holds the exiting scope when {@code
 * exitScope} runs.
 */
public abstract class ScopedVisit implements Visit {

  private final ArrayDeque<List<Ident>> scopes = new ArrayDeque<>();

  protected ScopedVisit() {
    scopes.push(new ArrayList<>());
  }

  @Override
  public final void visitEnter() {
    scopes.push(new ArrayList<>());
    enterScope();
  }

  @Override
  public final void visitExit() {
    checkState(scopes.size() > 1, "Exited a scope that was never entered");
    exitScope();
    scopes.pop();
  }

  @Override
  public final void visitBinding(Ident ident) {
    scopes.peek().add(ident);
    declare(ident);
  }

  /** Called immediately after entering a new scope. */
  protected void enterScope() {}

  /** Called immediately before exiting a scope. */
  protected void exitScope() {}

  /** Called after {@code ident} was added to the current scope. */
  protected void declare(Ident ident) {}

  /** Returns the number of open scopes besides the root scope. */
  public int getScopeDepth() {
    return scopes.size() - 1;
  }

  /** Returns the bindings of the innermost scope, in declaration order. */
  public ImmutableList<Ident> getCurrentScopeBindings() {
    return ImmutableList.copyOf(scopes.peek());
  }

  /** Whether {@code name} is bound in any open scope. */
  public boolean isBound(String name) {
    // Iterates from the innermost scope outwards.
    for (List<Ident> scope : scopes) {
      for (Ident ident : scope) {
        if (ident.name().equals(name)) {
          return true;
        }
      }
    }
    return false;
  }
}
