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

import static com.google.common.truth.Truth.assertThat;
import static com.google.markup.syntax.Ast.array;
import static com.google.markup.syntax.Ast.binary;
import static com.google.markup.syntax.Ast.block;
import static com.google.markup.syntax.Ast.call;
import static com.google.markup.syntax.Ast.closure;
import static com.google.markup.syntax.Ast.dict;
import static com.google.markup.syntax.Ast.emph;
import static com.google.markup.syntax.Ast.expr;
import static com.google.markup.syntax.Ast.forExpr;
import static com.google.markup.syntax.Ast.group;
import static com.google.markup.syntax.Ast.heading;
import static com.google.markup.syntax.Ast.ident;
import static com.google.markup.syntax.Ast.ifExpr;
import static com.google.markup.syntax.Ast.let;
import static com.google.markup.syntax.Ast.linebreak;
import static com.google.markup.syntax.Ast.lit;
import static com.google.markup.syntax.Ast.named;
import static com.google.markup.syntax.Ast.parbreak;
import static com.google.markup.syntax.Ast.pos;
import static com.google.markup.syntax.Ast.raw;
import static com.google.markup.syntax.Ast.space;
import static com.google.markup.syntax.Ast.strong;
import static com.google.markup.syntax.Ast.template;
import static com.google.markup.syntax.Ast.text;
import static com.google.markup.syntax.Ast.transparentBlock;
import static com.google.markup.syntax.Ast.tree;
import static com.google.markup.syntax.Ast.unary;
import static com.google.markup.syntax.Ast.whileExpr;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Walk} and the default operations of {@link Visit}. */
@RunWith(JUnit4.class)
public final class WalkTest {

  /** A document that contains every kind of node, expression, argument and for pattern. */
  private static Tree allKinds() {
    return tree(
        strong(),
        emph(),
        space(),
        linebreak(),
        parbreak(),
        text("hi"),
        raw("code"),
        heading(1, text("title")),
        expr(
            transparentBlock(
                let(
                    "f",
                    closure(
                        ImmutableList.of("x"), binary(ident("x"), BinaryOp.ADD, lit("1")))),
                call(
                    ident("f"),
                    pos(lit("2")),
                    named("key", array(lit("3"), group(unary(UnaryOp.NEG, ident("y")))))),
                dict(named("a", template(text("t"), expr(ident("z"))))),
                ifExpr(ident("c"), block(let("y")), block()),
                whileExpr(ident("c"), block()),
                forExpr("k", "v", ident("d"), block(ident("v"))),
                forExpr("e", array(), transparentBlock()))));
  }

  private static ImmutableList<String> eventsOf(Tree tree) {
    EventRecorder recorder = new EventRecorder();
    Traversal.walk(recorder, tree);
    return recorder.events();
  }

  private static ImmutableList<String> eventsOf(Expr expr) {
    EventRecorder recorder = new EventRecorder();
    recorder.visitExpr(expr);
    return recorder.events();
  }

  @Test
  public void testHeadingVisitsContents() {
    assertThat(eventsOf(tree(heading(1, text("hi")))))
        .containsExactly("tree", "node HEADING", "tree", "node TEXT")
        .inOrder();
  }

  @Test
  public void testScopingBlockWithLet() {
    ImmutableList<String> events = eventsOf(tree(expr(block(let("x", lit("1"))))));

    assertThat(events)
        .containsExactly(
            "tree",
            "node EXPR",
            "expr BLOCK",
            "block",
            "enter",
            "expr LET",
            "let",
            "binding x",
            "expr LIT",
            "exit")
        .inOrder();
  }

  @Test
  public void testForKeyValueBindsKeyThenValueBeforeIterable() {
    assertThat(eventsOf(forExpr("k", "v", ident("xs"), transparentBlock())))
        .containsExactly(
            "expr FOR", "for", "binding k", "binding v", "expr IDENT xs", "expr BLOCK", "block")
        .inOrder();
  }

  @Test
  public void testForValuePattern() {
    assertThat(eventsOf(forExpr("x", ident("xs"), ident("x"))))
        .containsExactly("expr FOR", "for", "binding x", "expr IDENT xs", "expr IDENT x")
        .inOrder();
  }

  @Test
  public void testClosureBindsParamsBeforeBody() {
    ImmutableList<String> events =
        eventsOf(
            closure(
                ImmutableList.of("p", "q"), group(binary(ident("p"), BinaryOp.MUL, ident("q")))));

    assertThat(events)
        .containsExactly(
            "expr CLOSURE",
            "closure",
            "binding p",
            "binding q",
            "expr GROUP",
            "group",
            "expr BINARY",
            "binary",
            "expr IDENT p",
            "expr IDENT q")
        .inOrder();
    assertThat(events.indexOf("binding p")).isLessThan(events.indexOf("expr IDENT p"));
  }

  @Test
  public void testLetBindsBeforeInitializer() {
    assertThat(eventsOf(let("x", ident("x"))))
        .containsExactly("expr LET", "let", "binding x", "expr IDENT x")
        .inOrder();
  }

  @Test
  public void testAbsentOptionalChildrenAreSkipped() {
    assertThat(eventsOf(let("x"))).containsExactly("expr LET", "let", "binding x").inOrder();
    assertThat(eventsOf(ifExpr(ident("c"), lit("1"))))
        .containsExactly("expr IF", "if", "expr IDENT c", "expr LIT")
        .inOrder();
  }

  @Test
  public void testIfVisitsElseBodyLast() {
    assertThat(eventsOf(ifExpr(ident("c"), ident("a"), ident("b"))))
        .containsExactly("expr IF", "if", "expr IDENT c", "expr IDENT a", "expr IDENT b")
        .inOrder();
  }

  @Test
  public void testWhile() {
    assertThat(eventsOf(whileExpr(ident("c"), ident("body"))))
        .containsExactly("expr WHILE", "while", "expr IDENT c", "expr IDENT body")
        .inOrder();
  }

  @Test
  public void testCallVisitsCalleeThenArgumentsInOrder() {
    assertThat(eventsOf(call(ident("f"), pos(ident("a")), named("k", ident("b")), pos(ident("c")))))
        .containsExactly(
            "expr CALL",
            "call",
            "expr IDENT f",
            "args",
            "arg POS",
            "expr IDENT a",
            "arg NAMED",
            "expr IDENT b",
            "arg POS",
            "expr IDENT c")
        .inOrder();
  }

  @Test
  public void testDictVisitsValuesInInsertionOrder() {
    assertThat(eventsOf(dict(named("b", ident("two")), named("a", ident("one")))))
        .containsExactly("expr DICT", "dict", "expr IDENT two", "expr IDENT one")
        .inOrder();
  }

  @Test
  public void testEmptySequencesProduceNoChildVisits() {
    assertThat(eventsOf(array())).containsExactly("expr ARRAY", "array").inOrder();
    assertThat(eventsOf(dict())).containsExactly("expr DICT", "dict").inOrder();
    assertThat(eventsOf(transparentBlock())).containsExactly("expr BLOCK", "block").inOrder();
    assertThat(eventsOf(block())).containsExactly("expr BLOCK", "block", "enter", "exit").inOrder();
    assertThat(eventsOf(call(ident("f"))))
        .containsExactly("expr CALL", "call", "expr IDENT f", "args")
        .inOrder();
    assertThat(eventsOf(Tree.empty())).containsExactly("tree");
  }

  @Test
  public void testTemplateAlwaysOpensScope() {
    assertThat(eventsOf(template(text("a"))))
        .containsExactly("expr TEMPLATE", "template", "enter", "tree", "node TEXT", "exit")
        .inOrder();
  }

  @Test
  public void testUnaryAndBinary() {
    assertThat(eventsOf(unary(UnaryOp.NOT, binary(lit("1"), BinaryOp.LT, ident("n")))))
        .containsExactly("expr UNARY", "unary", "expr BINARY", "binary", "expr LIT", "expr IDENT n")
        .inOrder();
  }

  @Test
  public void testEveryKindIsWalked() {
    Set<Node.Kind> nodeKinds = EnumSet.noneOf(Node.Kind.class);
    Set<Expr.Kind> exprKinds = EnumSet.noneOf(Expr.Kind.class);
    Set<Arg.Kind> argKinds = EnumSet.noneOf(Arg.Kind.class);
    Set<ForPattern.Kind> patternKinds = EnumSet.noneOf(ForPattern.Kind.class);
    Traversal.walk(
        new Visit() {
          @Override
          public void visitNode(Node node) {
            nodeKinds.add(node.getKind());
            Walk.walkNode(this, node);
          }

          @Override
          public void visitExpr(Expr expr) {
            exprKinds.add(expr.getKind());
            Walk.walkExpr(this, expr);
          }

          @Override
          public void visitArg(Arg arg) {
            argKinds.add(arg.getKind());
            Walk.walkArg(this, arg);
          }

          @Override
          public void visitFor(Expr.For forExpr) {
            patternKinds.add(forExpr.pattern().getKind());
            Walk.walkFor(this, forExpr);
          }
        },
        allKinds());

    assertThat(nodeKinds).containsExactlyElementsIn(EnumSet.allOf(Node.Kind.class));
    assertThat(exprKinds).containsExactlyElementsIn(EnumSet.allOf(Expr.Kind.class));
    assertThat(argKinds).containsExactlyElementsIn(EnumSet.allOf(Arg.Kind.class));
    assertThat(patternKinds).containsExactlyElementsIn(EnumSet.allOf(ForPattern.Kind.class));
  }

  @Test
  public void testEveryElementIsVisitedExactlyOnce() {
    Tree tree = allKinds();
    EventRecorder recorder = new EventRecorder();
    Traversal.walk(recorder, tree);

    List<Object> nodes = new ArrayList<>();
    List<Object> exprs = new ArrayList<>();
    for (Object element : recorder.visited) {
      if (element instanceof Node) {
        nodes.add(element);
      }
    }
    for (int i = 0; i < recorder.events.size(); i++) {
      if (recorder.events.get(i).startsWith("expr ")) {
        exprs.add(recorder.visited.get(countRecordedBefore(recorder.events, i)));
      }
    }

    List<Object> expectedNodes = new ArrayList<>();
    List<Object> expectedExprs = new ArrayList<>();
    collect(tree, expectedNodes, expectedExprs);

    assertThat(nodes).hasSize(expectedNodes.size());
    assertThat(exprs).hasSize(expectedExprs.size());
    assertThat(identitySet(nodes)).hasSize(nodes.size());
    assertThat(identitySet(exprs)).hasSize(exprs.size());
    assertThat(identitySet(nodes)).containsExactlyElementsIn(identitySet(expectedNodes));
    assertThat(identitySet(exprs)).containsExactlyElementsIn(identitySet(expectedExprs));
  }

  @Test
  public void testWalksAreDeterministic() {
    Tree tree = allKinds();
    EventRecorder first = new EventRecorder();
    EventRecorder second = new EventRecorder();
    Traversal.walk(first, tree);
    Traversal.walk(second, tree);

    assertThat(second.events).containsExactlyElementsIn(first.events).inOrder();
    assertThat(second.visited).hasSize(first.visited.size());
    for (int i = 0; i < first.visited.size(); i++) {
      assertThat(second.visited.get(i)).isSameInstanceAs(first.visited.get(i));
    }
  }

  @Test
  public void testScopesAreBalanced() {
    ImmutableList<String> events = eventsOf(allKinds());

    int open = 0;
    int enters = 0;
    for (String event : events) {
      if (event.equals("enter")) {
        open++;
        enters++;
      } else if (event.equals("exit")) {
        open--;
      }
      assertThat(open).isAtLeast(0);
    }
    assertThat(open).isEqualTo(0);
    // One template and four scoping blocks.
    assertThat(enters).isEqualTo(5);
    assertThat(Collections.frequency(events, "exit")).isEqualTo(5);
  }

  @Test
  public void testSkippingTemplateSuppressesItsContents() {
    Tree tree = tree(expr(template(text("inner"), expr(block(let("hidden"))))), text("after"));
    EventRecorder shallow =
        new EventRecorder() {
          @Override
          public void visitTemplate(Expr.Template template) {
            events.add("template");
          }
        };
    Traversal.walk(shallow, tree);

    assertThat(shallow.events())
        .containsExactly("tree", "node EXPR", "expr TEMPLATE", "template", "node TEXT")
        .inOrder();
  }

  @Test
  public void testChildOverrideInterceptsThroughDefaultParent() {
    int[] groups = {0};
    Visit counter =
        new Visit() {
          @Override
          public void visitGroup(Expr.Group group) {
            groups[0]++;
            Walk.walkGroup(this, group);
          }
        };
    Traversal.walk(counter, tree(expr(array(group(lit("1")), group(group(lit("2")))))));

    assertThat(groups[0]).isEqualTo(3);
  }

  @Test
  public void testDefaultVisitWalksWithoutSideEffects() {
    // The plain interface is a complete, silent walker.
    Traversal.walk(new Visit() {}, allKinds());
  }

  /** Returns the index into {@code visited} of the element recorded by event {@code i}. */
  private static int countRecordedBefore(List<String> events, int i) {
    int count = 0;
    for (int j = 0; j < i; j++) {
      String event = events.get(j);
      if (!event.equals("enter") && !event.equals("exit")) {
        count++;
      }
    }
    return count;
  }

  private static Set<Object> identitySet(List<Object> elements) {
    Set<Object> set = Collections.newSetFromMap(new IdentityHashMap<>());
    set.addAll(elements);
    return set;
  }

  // Counts the tree by hand, independently of Walk.

  private static void collect(Tree tree, List<Object> nodes, List<Object> exprs) {
    for (Node node : tree) {
      nodes.add(node);
      if (node instanceof Node.Heading heading) {
        collect(heading.contents(), nodes, exprs);
      } else if (node instanceof Node.ExprNode exprNode) {
        collect(exprNode.expr(), nodes, exprs);
      }
    }
  }

  private static void collect(Expr expr, List<Object> nodes, List<Object> exprs) {
    exprs.add(expr);
    List<Expr> children = new ArrayList<>();
    if (expr instanceof Expr.Array array) {
      children.addAll(array.items());
    } else if (expr instanceof Expr.Dict dict) {
      for (Named named : dict.items()) {
        children.add(named.expr());
      }
    } else if (expr instanceof Expr.Template template) {
      collect(template.tree(), nodes, exprs);
    } else if (expr instanceof Expr.Group group) {
      children.add(group.expr());
    } else if (expr instanceof Expr.Block block) {
      children.addAll(block.exprs());
    } else if (expr instanceof Expr.Unary unary) {
      children.add(unary.expr());
    } else if (expr instanceof Expr.Binary binary) {
      children.add(binary.lhs());
      children.add(binary.rhs());
    } else if (expr instanceof Expr.Call call) {
      children.add(call.callee());
      for (Arg arg : call.args().items()) {
        children.add(arg instanceof Named named ? named.expr() : ((Arg.Pos) arg).expr());
      }
    } else if (expr instanceof Expr.Closure closure) {
      children.add(closure.body());
    } else if (expr instanceof Expr.Let let && let.init() != null) {
      children.add(let.init());
    } else if (expr instanceof Expr.If ifExpr) {
      children.add(ifExpr.condition());
      children.add(ifExpr.ifBody());
      if (ifExpr.elseBody() != null) {
        children.add(ifExpr.elseBody());
      }
    } else if (expr instanceof Expr.While whileExpr) {
      children.add(whileExpr.condition());
      children.add(whileExpr.body());
    } else if (expr instanceof Expr.For forExpr) {
      children.add(forExpr.iter());
      children.add(forExpr.body());
    }
    for (Expr child : children) {
      collect(child, nodes, exprs);
    }
  }
}
