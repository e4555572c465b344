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

/**
 * The default walkers behind {@link Visit}. Each walker visits the children of one kind of node in
 * source order, always through the visitor's operations so that overrides for the children take
 * effect.
 *
 * <p>The visiting order is part of the contract: passes that keep scope stacks or report
 * diagnostics in source order depend on it.
 */
public final class Walk {

  private Walk() {}

  /** Walks a {@link Tree}. */
  public static void walkTree(Visit v, Tree tree) {
    for (Node node : tree) {
      v.visitNode(node);
    }
  }

  /** Walks a {@link Node}. */
  public static void walkNode(Visit v, Node node) {
    switch (node.getKind()) {
      case STRONG, EMPH, SPACE, LINEBREAK, PARBREAK, TEXT, RAW -> {}
      case HEADING -> v.visitTree(((Node.Heading) node).contents());
      case EXPR -> v.visitExpr(((Node.ExprNode) node).expr());
      default -> throw new IllegalStateException("Unhandled node kind: " + node.getKind());
    }
  }

  /** Walks an {@link Expr} by dispatching to the operation for its kind. */
  public static void walkExpr(Visit v, Expr expr) {
    switch (expr.getKind()) {
      case LIT, IDENT -> {}
      case ARRAY -> v.visitArray((Expr.Array) expr);
      case DICT -> v.visitDict((Expr.Dict) expr);
      case TEMPLATE -> v.visitTemplate((Expr.Template) expr);
      case GROUP -> v.visitGroup((Expr.Group) expr);
      case BLOCK -> v.visitBlock((Expr.Block) expr);
      case UNARY -> v.visitUnary((Expr.Unary) expr);
      case BINARY -> v.visitBinary((Expr.Binary) expr);
      case CALL -> v.visitCall((Expr.Call) expr);
      case CLOSURE -> v.visitClosure((Expr.Closure) expr);
      case LET -> v.visitLet((Expr.Let) expr);
      case IF -> v.visitIf((Expr.If) expr);
      case WHILE -> v.visitWhile((Expr.While) expr);
      case FOR -> v.visitFor((Expr.For) expr);
      default -> throw new IllegalStateException("Unhandled expression kind: " + expr.getKind());
    }
  }

  /** Walks an {@link Expr.Array}. */
  public static void walkArray(Visit v, Expr.Array array) {
    for (Expr item : array.items()) {
      v.visitExpr(item);
    }
  }

  /** Walks an {@link Expr.Dict}. Keys are not visited. */
  public static void walkDict(Visit v, Expr.Dict dict) {
    for (Named named : dict.items()) {
      v.visitExpr(named.expr());
    }
  }

  /** Walks an {@link Expr.Template}, which always opens a scope. */
  public static void walkTemplate(Visit v, Expr.Template template) {
    v.visitEnter();
    v.visitTree(template.tree());
    v.visitExit();
  }

  /** Walks an {@link Expr.Group}. */
  public static void walkGroup(Visit v, Expr.Group group) {
    v.visitExpr(group.expr());
  }

  /** Walks an {@link Expr.Block}, which opens a scope only if it is scoping. */
  public static void walkBlock(Visit v, Expr.Block block) {
    if (block.scoping()) {
      v.visitEnter();
    }
    for (Expr expr : block.exprs()) {
      v.visitExpr(expr);
    }
    if (block.scoping()) {
      v.visitExit();
    }
  }

  /** Walks an {@link Expr.Binary}. */
  public static void walkBinary(Visit v, Expr.Binary binary) {
    v.visitExpr(binary.lhs());
    v.visitExpr(binary.rhs());
  }

  /** Walks an {@link Expr.Unary}. */
  public static void walkUnary(Visit v, Expr.Unary unary) {
    v.visitExpr(unary.expr());
  }

  /** Walks an {@link Expr.Call}. */
  public static void walkCall(Visit v, Expr.Call call) {
    v.visitExpr(call.callee());
    v.visitArgs(call.args());
  }

  /** Walks an {@link Expr.Closure}: the parameters are bound before the body is visited. */
  public static void walkClosure(Visit v, Expr.Closure closure) {
    for (Ident param : closure.params()) {
      v.visitBinding(param);
    }
    v.visitExpr(closure.body());
  }

  /** Walks an {@link Args} list. */
  public static void walkArgs(Visit v, Args args) {
    for (Arg arg : args.items()) {
      v.visitArg(arg);
    }
  }

  /** Walks an {@link Arg}. The name of a named argument is not visited. */
  public static void walkArg(Visit v, Arg arg) {
    switch (arg.getKind()) {
      case POS -> v.visitExpr(((Arg.Pos) arg).expr());
      case NAMED -> v.visitExpr(((Named) arg).expr());
      default -> throw new IllegalStateException("Unhandled argument kind: " + arg.getKind());
    }
  }

  /** Walks an {@link Expr.Let}: the binding is reported before the initializer is visited. */
  public static void walkLet(Visit v, Expr.Let let) {
    v.visitBinding(let.binding());
    Expr init = let.init();
    if (init != null) {
      v.visitExpr(init);
    }
  }

  /** Walks an {@link Expr.If}. */
  public static void walkIf(Visit v, Expr.If ifExpr) {
    v.visitExpr(ifExpr.condition());
    v.visitExpr(ifExpr.ifBody());
    Expr elseBody = ifExpr.elseBody();
    if (elseBody != null) {
      v.visitExpr(elseBody);
    }
  }

  /** Walks an {@link Expr.While}. */
  public static void walkWhile(Visit v, Expr.While whileExpr) {
    v.visitExpr(whileExpr.condition());
    v.visitExpr(whileExpr.body());
  }

  /**
   * Walks an {@link Expr.For}: the pattern is bound first, key before value, then the iterable and
   * the body are visited.
   */
  public static void walkFor(Visit v, Expr.For forExpr) {
    ForPattern pattern = forExpr.pattern();
    switch (pattern.getKind()) {
      case VALUE -> v.visitBinding(((ForPattern.Value) pattern).value());
      case KEY_VALUE -> {
        ForPattern.KeyValue keyValue = (ForPattern.KeyValue) pattern;
        v.visitBinding(keyValue.key());
        v.visitBinding(keyValue.value());
      }
      default -> throw new IllegalStateException("Unhandled pattern kind: " + pattern.getKind());
    }
    v.visitExpr(forExpr.iter());
    v.visitExpr(forExpr.body());
  }
}
