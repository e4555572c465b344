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

/** The left-hand side of a {@link Expr.For} loop. */
@Immutable
public sealed interface ForPattern permits ForPattern.Value, ForPattern.KeyValue {

  enum Kind {
    VALUE,
    KEY_VALUE
  }

  Kind getKind();

  /** {@code for x in ...}: binds each value. */
  record Value(Ident value) implements ForPattern {
    public Value {
      checkNotNull(value);
    }

    @Override
    public Kind getKind() {
      return Kind.VALUE;
    }
  }

  /** {@code for k, v in ...}: binds each key and value. */
  record KeyValue(Ident key, Ident value) implements ForPattern {
    public KeyValue {
      checkNotNull(key);
      checkNotNull(value);
    }

    @Override
    public Kind getKind() {
      return Kind.KEY_VALUE;
    }
  }
}
