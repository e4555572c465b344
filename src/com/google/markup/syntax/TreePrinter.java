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

import com.google.common.base.Ascii;
import com.google.common.base.Strings;

/**
 * Renders a syntax tree as indented text, one line per visited element, in the order the default
 * walkers visit them. Scope changes and bindings are rendered as their own lines. Meant for
 * debugging and tests.
 */
public final class TreePrinter implements Visit {

  private static final String INDENT = "    ";

  private final StringBuilder sb = new StringBuilder();
  private int level;

  private TreePrinter() {}

  public static String toStringTree(Tree tree) {
    TreePrinter printer = new TreePrinter();
    printer.visitTree(tree);
    return printer.sb.toString();
  }

  public static String toStringTree(Expr expr) {
    TreePrinter printer = new TreePrinter();
    printer.visitExpr(expr);
    return printer.sb.toString();
  }

  @Override
  public void visitTree(Tree tree) {
    line("Tree");
    level++;
    Walk.walkTree(this, tree);
    level--;
  }

  @Override
  public void visitNode(Node node) {
    line(describe(node));
    level++;
    Walk.walkNode(this, node);
    level--;
  }

  @Override
  public void visitExpr(Expr expr) {
    line(describe(expr));
    level++;
    Walk.walkExpr(this, expr);
    level--;
  }

  @Override
  public void visitArg(Arg arg) {
    line(arg instanceof Named named ? "Arg " + named.name().name() : "Arg");
    level++;
    Walk.walkArg(this, arg);
    level--;
  }

  @Override
  public void visitBinding(Ident ident) {
    line("binding " + ident.name());
  }

  @Override
  public void visitEnter() {
    line("[enter]");
  }

  @Override
  public void visitExit() {
    line("[exit]");
  }

  private void line(String text) {
    sb.append(Strings.repeat(INDENT, level)).append(text).append('\n');
  }

  private static String describe(Node node) {
    String name = capitalize(node.getKind().name());
    if (node instanceof Node.Text text) {
      return name + " \"" + text.text() + "\"";
    } else if (node instanceof Node.Raw raw) {
      return name
          + (raw.lang() != null ? " " + raw.lang() : "")
          + (raw.block() ? " block" : "")
          + " \""
          + raw.text()
          + "\"";
    } else if (node instanceof Node.Heading heading) {
      return name + " " + heading.level();
    }
    return name;
  }

  private static String describe(Expr expr) {
    String name = capitalize(expr.getKind().name());
    if (expr instanceof Expr.Lit lit) {
      return name + " " + lit.text();
    } else if (expr instanceof Ident ident) {
      return name + " " + ident.name();
    } else if (expr instanceof Expr.Unary unary) {
      return name + " " + unary.op().getSymbol();
    } else if (expr instanceof Expr.Binary binary) {
      return name + " " + binary.op().getSymbol();
    } else if (expr instanceof Expr.Block block && block.scoping()) {
      return name + " scoping";
    }
    return name;
  }

  private static String capitalize(String kind) {
    return kind.charAt(0) + Ascii.toLowerCase(kind.substring(1));
  }
}
