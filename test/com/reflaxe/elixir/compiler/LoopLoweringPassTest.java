/*
 * Copyright 2026 The Reflaxe Elixir Authors.
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
package com.reflaxe.elixir.compiler;

import static com.reflaxe.elixir.ast.IR.binaryOp;
import static com.reflaxe.elixir.ast.IR.block;
import static com.reflaxe.elixir.ast.IR.call;
import static com.reflaxe.elixir.ast.IR.lambda;
import static com.reflaxe.elixir.ast.IR.list;
import static com.reflaxe.elixir.ast.IR.match;
import static com.reflaxe.elixir.ast.IR.name;
import static com.reflaxe.elixir.ast.IR.number;
import static com.reflaxe.elixir.ast.IR.range;
import static com.reflaxe.elixir.ast.IR.remoteCall;
import static com.reflaxe.elixir.typed.TypedIR.forIn;
import static com.reflaxe.elixir.typed.TypedIR.intLiteral;
import static com.reflaxe.elixir.typed.TypedIR.local;

import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.ast.IR;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.ast.Pattern;
import com.reflaxe.elixir.compiler.loops.FakeExpressionBuilder;
import com.reflaxe.elixir.typed.TypedIR;
import com.reflaxe.elixir.typed.TypedNode;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LoopLoweringPass}. */
@RunWith(JUnit4.class)
public final class LoopLoweringPassTest extends RewritePassTestCase {

  @Override
  protected ContextualRewritePass getProcessor() {
    return new LoopLoweringPass();
  }

  @Before
  public void setUp() {
    context =
        RewriteContext.builder()
            .setModuleName("Main")
            .setExpressionBuilder(new FakeExpressionBuilder())
            .build();
  }

  private static Node fnOf(String param, Node body) {
    return lambda(ImmutableList.of(Pattern.bind(param)), body);
  }

  private static TypedNode trace(String name) {
    return TypedIR.call(local("trace"), local(name));
  }

  @Test
  public void testLoopsKeptWithoutExpressionBuilder() {
    context = RewriteContext.empty();
    testSame(block(IR.loop(forIn("x", local("items"), trace("x"))), call("done")));
  }

  @Test
  public void testMapDropsOverwrittenInitializer() {
    TypedNode loop =
        forIn(
            "x",
            TypedIR.range(intLiteral(0), intLiteral(5)),
            TypedIR.methodCall(
                local("result"), "push", TypedIR.binop("*", local("x"), intLiteral(2))));
    test(
        block(match("result", list()), IR.loop(loop), call("use", name("result"))),
        block(
            match(
                "result",
                remoteCall(
                    "Enum",
                    "map",
                    range(number(0), number(4)),
                    fnOf("x", binaryOp("*", name("x"), number(2))))),
            call("use", name("result"))));
  }

  @Test
  public void testDesugaredCounterDropsDeadInitializer() {
    TypedNode loop =
        TypedIR.whileLoop(
            TypedIR.binop("<", local("_g"), intLiteral(3)),
            TypedIR.block(TypedIR.var("i", TypedIR.postIncrement("_g")), trace("i")));
    test(
        block(match("_g", number(0)), IR.loop(loop), call("done")),
        block(
            remoteCall(
                "Enum",
                "each",
                range(number(0), number(2)),
                fnOf("i", call("trace", name("i")))),
            call("done")));
  }

  @Test
  public void testCounterReboundByDestructuringStartsFromVariable() {
    TypedNode loop =
        TypedIR.whileLoop(
            TypedIR.binop("<", local("_g"), intLiteral(10)),
            TypedIR.block(TypedIR.var("i", TypedIR.postIncrement("_g")), trace("i")));
    Node rebind =
        match(Pattern.tuple(Pattern.bind("_g"), Pattern.bind("y")), call("compute"));
    test(
        block(match("_g", number(0)), rebind, IR.loop(loop), call("done")),
        block(
            match("_g", number(0)),
            rebind,
            remoteCall(
                "Enum",
                "each",
                range(name("_g"), number(9), number(1)),
                fnOf("i", call("trace", name("i")))),
            call("done")));
  }

  @Test
  public void testCounterDoesNotTakeValueOfVariantName() {
    TypedNode loop =
        TypedIR.whileLoop(
            TypedIR.binop("<", local("_g1"), intLiteral(3)),
            TypedIR.block(
                TypedIR.var("i", TypedIR.postIncrement("_g1")),
                TypedIR.call(local("trace"), TypedIR.binop("+", local("i"), local("g1")))));
    test(
        block(match("g1", number(5)), match("_g1", number(0)), IR.loop(loop), call("done")),
        block(
            match("g1", number(5)),
            remoteCall(
                "Enum",
                "each",
                range(number(0), number(2)),
                fnOf("i", call("trace", binaryOp("+", name("i"), name("g1"))))),
            call("done")));
  }

  @Test
  public void testInitializerReadAfterLoopIsKept() {
    TypedNode loop =
        forIn(
            "x",
            local("items"),
            TypedIR.assignOp("+", local("total"), local("x")));
    test(
        block(match("total", number(0)), IR.loop(loop), call("use", name("total"))),
        block(
            match("total", number(0)),
            match(
                "total",
                remoteCall(
                    "Enum",
                    "reduce",
                    name("items"),
                    name("total"),
                    lambda(
                        ImmutableList.of(Pattern.bind("x"), Pattern.bind("total")),
                        binaryOp("+", name("total"), name("x"))))),
            call("use", name("total"))));
  }

  @Test
  public void testUnrecognizedLoopStays() {
    TypedNode loop =
        forIn(
            "x",
            local("items"),
            TypedIR.ifNode(local("x"), TypedIR.returnNode(local("x"))));
    testSame(block(IR.loop(loop), call("done")));
  }

  @Test
  public void testNestedLoopsAreLowered() {
    TypedNode inner = forIn("y", local("others"), trace("y"));
    TypedNode outer = forIn("x", local("items"), TypedIR.block(inner));
    test(
        block(IR.loop(outer), call("done")),
        block(
            remoteCall(
                "Enum",
                "each",
                name("items"),
                fnOf(
                    "x",
                    remoteCall(
                        "Enum", "each", name("others"), fnOf("y", call("trace", name("y")))))),
            call("done")));
  }

  @Test
  public void testLoopOutsideBlock() {
    Node function =
        IR.def(
            "run",
            IR.clause(
                ImmutableList.of(Pattern.bind("items")),
                IR.loop(forIn("x", local("items"), trace("x")))));
    test(
        function,
        IR.def(
            "run",
            IR.clause(
                ImmutableList.of(Pattern.bind("items")),
                remoteCall("Enum", "each", name("items"), fnOf("x", call("trace", name("x")))))));
  }
}
