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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/** A markup node, the element of a {@link Tree}. */
@Immutable
public sealed interface Node
    permits Node.Marker, Node.Text, Node.Raw, Node.Heading, Node.ExprNode {

  /** The closed set of node shapes. */
  enum Kind {
    STRONG,
    EMPH,
    SPACE,
    LINEBREAK,
    PARBREAK,
    TEXT,
    RAW,
    HEADING,
    EXPR
  }

  Kind getKind();

  /** Markup markers, which carry no payload. */
  enum Marker implements Node {
    STRONG(Kind.STRONG),
    EMPH(Kind.EMPH),
    SPACE(Kind.SPACE),
    LINEBREAK(Kind.LINEBREAK),
    PARBREAK(Kind.PARBREAK);

    private final Kind kind;

    Marker(Kind kind) {
      this.kind = kind;
    }

    @Override
    public Kind getKind() {
      return kind;
    }
  }

  /** Plain text. */
  record Text(String text) implements Node {
    public Text {
      checkNotNull(text);
    }

    @Override
    public Kind getKind() {
      return Kind.TEXT;
    }
  }

  /**
   * Raw text, shown verbatim. {@code lang} is the language tag used for highlighting, if any, and
   * {@code block} distinguishes a display block from inline raw text.
   */
  record Raw(@Nullable String lang, String text, boolean block) implements Node {
    public Raw {
      checkNotNull(text);
    }

    @Override
    public Kind getKind() {
      return Kind.RAW;
    }
  }

  /** A section heading. Levels start at 1. */
  record Heading(int level, Tree contents) implements Node {
    public Heading {
      checkArgument(level >= 1, "Heading level must be positive: %s", level);
      checkNotNull(contents);
    }

    @Override
    public Kind getKind() {
      return Kind.HEADING;
    }
  }

  /** An embedded expression of the scripting language. */
  record ExprNode(Expr expr) implements Node {
    public ExprNode {
      checkNotNull(expr);
    }

    @Override
    public Kind getKind() {
      return Kind.EXPR;
    }
  }
}
