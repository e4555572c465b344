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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A syntax tree construction helper class. */
public final class Ast {

  private Ast() {}

  public static Tree tree(Node... nodes) {
    return Tree.of(nodes);
  }

  public static Tree tree(List<? extends Node> nodes) {
    return Tree.copyOf(nodes);
  }

  // Markup

  public static Node strong() {
    return Node.Marker.STRONG;
  }

  public static Node emph() {
    return Node.Marker.EMPH;
  }

  public static Node space() {
    return Node.Marker.SPACE;
  }

  public static Node linebreak() {
    return Node.Marker.LINEBREAK;
  }

  public static Node parbreak() {
    return Node.Marker.PARBREAK;
  }

  public static Node.Text text(String text) {
    return new Node.Text(text);
  }

  public static Node.Raw raw(String text) {
    return new Node.Raw(null, text, false);
  }

  public static Node.Raw rawBlock(String lang, String text) {
    checkArgument(!lang.isEmpty(), "Use raw(text) for raw text without a language tag");
    return new Node.Raw(lang, text, true);
  }

  public static Node.Heading heading(int level, Node... contents) {
    return new Node.Heading(level, Tree.of(contents));
  }

  public static Node.ExprNode expr(Expr expr) {
    return new Node.ExprNode(expr);
  }

  // Expressions

  public static Expr.Lit lit(String text) {
    return new Expr.Lit(text);
  }

  public static Ident ident(String name) {
    return new Ident(name);
  }

  public static Expr.Array array(Expr... items) {
    return new Expr.Array(ImmutableList.copyOf(items));
  }

  public static Expr.Dict dict(Named... items) {
    return new Expr.Dict(ImmutableList.copyOf(items));
  }

  public static Named named(String name, Expr expr) {
    return new Named(ident(name), expr);
  }

  public static Expr.Template template(Node... nodes) {
    return new Expr.Template(Tree.of(nodes));
  }

  public static Expr.Group group(Expr expr) {
    return new Expr.Group(expr);
  }

  /** A block that opens its own scope, such as a function or loop body. */
  public static Expr.Block block(Expr... exprs) {
    return new Expr.Block(true, ImmutableList.copyOf(exprs));
  }

  /** A block that only groups expressions and shares the enclosing scope. */
  public static Expr.Block transparentBlock(Expr... exprs) {
    return new Expr.Block(false, ImmutableList.copyOf(exprs));
  }

  public static Expr.Unary unary(UnaryOp op, Expr expr) {
    return new Expr.Unary(op, expr);
  }

  public static Expr.Binary binary(Expr lhs, BinaryOp op, Expr rhs) {
    return new Expr.Binary(lhs, op, rhs);
  }

  public static Expr.Call call(Expr callee, Arg... args) {
    return new Expr.Call(callee, new Args(ImmutableList.copyOf(args)));
  }

  public static Arg.Pos pos(Expr expr) {
    return new Arg.Pos(expr);
  }

  public static Expr.Closure closure(List<String> params, Expr body) {
    ImmutableList.Builder<Ident> idents = ImmutableList.builder();
    for (String param : params) {
      idents.add(ident(param));
    }
    return new Expr.Closure(idents.build(), body);
  }

  public static Expr.Let let(String name) {
    return new Expr.Let(ident(name), null);
  }

  public static Expr.Let let(String name, Expr init) {
    return new Expr.Let(ident(name), init);
  }

  public static Expr.If ifExpr(Expr condition, Expr ifBody) {
    return new Expr.If(condition, ifBody, null);
  }

  public static Expr.If ifExpr(Expr condition, Expr ifBody, Expr elseBody) {
    return new Expr.If(condition, ifBody, elseBody);
  }

  public static Expr.While whileExpr(Expr condition, Expr body) {
    return new Expr.While(condition, body);
  }

  public static Expr.For forExpr(String value, Expr iter, Expr body) {
    return new Expr.For(new ForPattern.Value(ident(value)), iter, body);
  }

  public static Expr.For forExpr(String key, String value, Expr iter, Expr body) {
    return new Expr.For(new ForPattern.KeyValue(ident(key), ident(value)), iter, body);
  }
}
