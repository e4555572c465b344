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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An identifier. As an {@link Expr} it is a use of a name; as a closure parameter, a let target or
 * a for-loop pattern member it is a definition and is reported through {@link
 * Visit#visitBinding(Ident)} instead.
 */
public record Ident(String name) implements Expr {
  public Ident {
    checkArgument(!name.isEmpty(), "Identifiers cannot be empty");
  }

  @Override
  public Kind getKind() {
    return Kind.IDENT;
  }
}
