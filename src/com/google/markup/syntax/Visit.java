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
 * Traverses the syntax tree.
 *
 * <p>Each operation defaults to the matching walker in {@link Walk}, which visits the children of
 * the node in source order by calling back into this visitor. An override that still wants the
 * children visited calls the walker itself:
 *
 * <pre>{@code
 * @Override
 * public void visitClosure(Expr.Closure closure) {
 *   closures++;
 *   Walk.walkClosure(this, closure);
 * }
 * }</pre>
 *
 * <p>An override that does not call the walker skips the subtree.
 *
 * <p>Besides the structural operations there are three hooks. {@link #visitBinding} is called for
 * every definition of a name, and {@link #visitEnter} and {@link #visitExit} bracket every lexical
 * scope. A visitor instance is meant for one walk at a time; trees are immutable and may be walked
 * concurrently by separate instances.
 */
public interface Visit {

  default void visitTree(Tree tree) {
    Walk.walkTree(this, tree);
  }

  default void visitNode(Node node) {
    Walk.walkNode(this, node);
  }

  default void visitExpr(Expr expr) {
    Walk.walkExpr(this, expr);
  }

  default void visitArray(Expr.Array array) {
    Walk.walkArray(this, array);
  }

  default void visitDict(Expr.Dict dict) {
    Walk.walkDict(this, dict);
  }

  default void visitTemplate(Expr.Template template) {
    Walk.walkTemplate(this, template);
  }

  default void visitGroup(Expr.Group group) {
    Walk.walkGroup(this, group);
  }

  default void visitBlock(Expr.Block block) {
    Walk.walkBlock(this, block);
  }

  default void visitBinary(Expr.Binary binary) {
    Walk.walkBinary(this, binary);
  }

  default void visitUnary(Expr.Unary unary) {
    Walk.walkUnary(this, unary);
  }

  default void visitCall(Expr.Call call) {
    Walk.walkCall(this, call);
  }

  default void visitClosure(Expr.Closure closure) {
    Walk.walkClosure(this, closure);
  }

  default void visitArgs(Args args) {
    Walk.walkArgs(this, args);
  }

  default void visitArg(Arg arg) {
    Walk.walkArg(this, arg);
  }

  default void visitLet(Expr.Let let) {
    Walk.walkLet(this, let);
  }

  default void visitIf(Expr.If ifExpr) {
    Walk.walkIf(this, ifExpr);
  }

  default void visitWhile(Expr.While whileExpr) {
    Walk.walkWhile(this, whileExpr);
  }

  default void visitFor(Expr.For forExpr) {
    Walk.walkFor(this, forExpr);
  }

  /**
   * Visits a definition of a binding.
   *
   * <p>Bindings are the parameters of closures, the targets of let expressions, and the key/value
   * patterns of for loops. For closures and loops the bindings are reported before the body is
   * walked. For a let expression the binding is reported before the initializer, even though the
   * initializer is evaluated in the enclosing scope; use {@link #visitEnter} and {@link
   * #visitExit} to track scope membership.
   */
  default void visitBinding(Ident ident) {}

  /** Visits the entry into a scope. */
  default void visitEnter() {}

  /** Visits the exit from a scope. */
  default void visitExit() {}
}
