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
import org.jspecify.annotations.Nullable;

/**
 * An expression of the embedded scripting language.
 *
 * <p>{@link Lit} and {@link Ident} are terminals. Every other variant owns its children in the
 * order in which {@link Walk} visits them.
 */
@Immutable
public sealed interface Expr
    permits Ident,
        Expr.Lit,
        Expr.Array,
        Expr.Dict,
        Expr.Template,
        Expr.Group,
        Expr.Block,
        Expr.Unary,
        Expr.Binary,
        Expr.Call,
        Expr.Closure,
        Expr.Let,
        Expr.If,
        Expr.While,
        Expr.For {

  /** The closed set of expression shapes. */
  enum Kind {
    LIT,
    IDENT,
    ARRAY,
    DICT,
    TEMPLATE,
    GROUP,
    BLOCK,
    UNARY,
    BINARY,
    CALL,
    CLOSURE,
    LET,
    IF,
    WHILE,
    FOR
  }

  Kind getKind();

  /** A literal, kept as its source text. */
  record Lit(String text) implements Expr {
    public Lit {
      checkNotNull(text);
    }

    @Override
    public Kind getKind() {
      return Kind.LIT;
    }
  }

  /** An array literal: {@code (1, 2, 3)}. */
  record Array(ImmutableList<Expr> items) implements Expr {
    public Array {
      checkNotNull(items);
    }

    @Override
    public Kind getKind() {
      return Kind.ARRAY;
    }
  }

  /** A dictionary literal: {@code (a: 1, b: 2)}. Entries keep their source order. */
  record Dict(ImmutableList<Named> items) implements Expr {
    public Dict {
      checkNotNull(items);
    }

    @Override
    public Kind getKind() {
      return Kind.DICT;
    }
  }

  /** A template: {@code [*Hi* there!]}. */
  record Template(Tree tree) implements Expr {
    public Template {
      checkNotNull(tree);
    }

    @Override
    public Kind getKind() {
      return Kind.TEMPLATE;
    }
  }

  /** A parenthesized expression: {@code (1)}. */
  record Group(Expr expr) implements Expr {
    public Group {
      checkNotNull(expr);
    }

    @Override
    public Kind getKind() {
      return Kind.GROUP;
    }
  }

  /**
   * A sequence of expressions: {@code { let x = 1; x + 2 }}. Only a scoping block opens a new
   * lexical scope.
   */
  record Block(boolean scoping, ImmutableList<Expr> exprs) implements Expr {
    public Block {
      checkNotNull(exprs);
    }

    @Override
    public Kind getKind() {
      return Kind.BLOCK;
    }
  }

  /** A unary operation: {@code -x}. */
  record Unary(UnaryOp op, Expr expr) implements Expr {
    public Unary {
      checkNotNull(op);
      checkNotNull(expr);
    }

    @Override
    public Kind getKind() {
      return Kind.UNARY;
    }
  }

  /** A binary operation: {@code a + b}. */
  record Binary(Expr lhs, BinaryOp op, Expr rhs) implements Expr {
    public Binary {
      checkNotNull(lhs);
      checkNotNull(op);
      checkNotNull(rhs);
    }

    @Override
    public Kind getKind() {
      return Kind.BINARY;
    }
  }

  /** An invocation of a function: {@code f(x, y: 1)}. */
  record Call(Expr callee, Args args) implements Expr {
    public Call {
      checkNotNull(callee);
      checkNotNull(args);
    }

    @Override
    public Kind getKind() {
      return Kind.CALL;
    }
  }

  /** A closure: {@code (x, y) => z}. The parameters are bindings. */
  record Closure(ImmutableList<Ident> params, Expr body) implements Expr {
    public Closure {
      checkNotNull(params);
      checkNotNull(body);
    }

    @Override
    public Kind getKind() {
      return Kind.CLOSURE;
    }
  }

  /** A let expression: {@code let x = 1}. */
  record Let(Ident binding, @Nullable Expr init) implements Expr {
    public Let {
      checkNotNull(binding);
    }

    @Override
    public Kind getKind() {
      return Kind.LET;
    }
  }

  /** An if-else expression: {@code if x { y } else { z }}. */
  record If(Expr condition, Expr ifBody, @Nullable Expr elseBody) implements Expr {
    public If {
      checkNotNull(condition);
      checkNotNull(ifBody);
    }

    @Override
    public Kind getKind() {
      return Kind.IF;
    }
  }

  /** A while loop: {@code while x { y }}. */
  record While(Expr condition, Expr body) implements Expr {
    public While {
      checkNotNull(condition);
      checkNotNull(body);
    }

    @Override
    public Kind getKind() {
      return Kind.WHILE;
    }
  }

  /** A for loop: {@code for k, v in dict { body }}. */
  record For(ForPattern pattern, Expr iter, Expr body) implements Expr {
    public For {
      checkNotNull(pattern);
      checkNotNull(iter);
      checkNotNull(body);
    }

    @Override
    public Kind getKind() {
      return Kind.FOR;
    }
  }
}
