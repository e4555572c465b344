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

import com.google.errorprone.annotations.Immutable;

/** An argument to a function call: positional {@code (12)} or named {@code (key: value)}. */
@Immutable
public sealed interface Arg permits Arg.Pos, Named {

  enum Kind {
    POS,
    NAMED
  }

  Kind getKind();

  /** A positional argument. */
  record Pos(Expr expr) implements Arg {
    public Pos {
      checkNotNull(expr);
    }

    @Override
    public Kind getKind() {
      return Kind.POS;
    }
  }
}
