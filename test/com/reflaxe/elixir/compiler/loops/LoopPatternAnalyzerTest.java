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
package com.reflaxe.elixir.compiler.loops;

import static com.google.common.truth.Truth.assertThat;
import static com.reflaxe.elixir.typed.TypedIR.assign;
import static com.reflaxe.elixir.typed.TypedIR.assignOp;
import static com.reflaxe.elixir.typed.TypedIR.binop;
import static com.reflaxe.elixir.typed.TypedIR.block;
import static com.reflaxe.elixir.typed.TypedIR.call;
import static com.reflaxe.elixir.typed.TypedIR.forIn;
import static com.reflaxe.elixir.typed.TypedIR.ifNode;
import static com.reflaxe.elixir.typed.TypedIR.intLiteral;
import static com.reflaxe.elixir.typed.TypedIR.local;
import static com.reflaxe.elixir.typed.TypedIR.methodCall;
import static com.reflaxe.elixir.typed.TypedIR.postIncrement;
import static com.reflaxe.elixir.typed.TypedIR.range;
import static com.reflaxe.elixir.typed.TypedIR.returnNode;
import static com.reflaxe.elixir.typed.TypedIR.var;
import static com.reflaxe.elixir.typed.TypedIR.whileLoop;

import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.typed.TypedIR;
import com.reflaxe.elixir.typed.TypedNode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LoopPatternAnalyzer} and the standard analyzers. */
@RunWith(JUnit4.class)
public final class LoopPatternAnalyzerTest {

  private final LoopPatternAnalyzer analyzer = LoopPatternAnalyzer.createDefault();

  private LoopAnalysis analyze(TypedNode loop) {
    return analyze(loop, LoopContext.EMPTY);
  }

  private LoopAnalysis analyze(TypedNode loop, LoopContext context) {
    LoopAnalysis analysis = analyzer.analyze(loop, context);
    assertThat(analysis).isNotNull();
    return analysis;
  }

  @Test
  public void testCountedWhileWithTrailingIncrement() {
    // while (i < 10) { trace(i); i = i + 1; }
    TypedNode loop =
        whileLoop(
            binop("<", local("i"), intLiteral(10)),
            block(
                call(local("trace"), local("i")),
                assign(local("i"), binop("+", local("i"), intLiteral(1)))));

    LoopAnalysis analysis = analyze(loop);

    assertThat(analysis.intent().kind()).isEqualTo(LoopIntent.Kind.RANGE);
    assertThat(analysis.confidence()).isEqualTo(LoopAnalysis.RANGE_CONFIDENCE);
    RangeIntent intent = (RangeIntent) analysis.intent();
    assertThat(intent.variable()).isEqualTo("i");
    assertThat(intent.source().start()).isEqualTo(intLiteral(0));
    assertThat(intent.source().end()).isEqualTo(intLiteral(10));
    assertThat(intent.source().step()).isEqualTo(1L);
    assertThat(intent.source().inclusive()).isFalse();
    assertThat(intent.body()).containsExactly(call(local("trace"), local("i")));
  }

  @Test
  public void testCountedWhileInclusiveWithPostIncrement() {
    // while (i <= n) { trace(i); i++; }
    TypedNode loop =
        whileLoop(
            binop("<=", local("i"), local("n")),
            block(call(local("trace"), local("i")), postIncrement("i")));

    RangeIntent intent = (RangeIntent) analyze(loop).intent();

    assertThat(intent.source().end()).isEqualTo(local("n"));
    assertThat(intent.source().inclusive()).isTrue();
    assertThat(intent.source().step()).isEqualTo(1L);
    assertThat(intent.source().counter()).isEqualTo("i");
  }

  @Test
  public void testCountedWhileStartsFromKnownInitialValue() {
    TypedNode loop =
        whileLoop(
            binop("<", local("i"), intLiteral(10)),
            block(call(local("trace"), local("i")), assignOp("+", local("i"), intLiteral(2))));
    LoopContext context = LoopContext.builder().setInitialValue("i", intLiteral(3)).build();

    RangeIntent intent = (RangeIntent) analyze(loop, context).intent();

    assertThat(intent.source().start()).isEqualTo(intLiteral(3));
    assertThat(intent.source().step()).isEqualTo(2L);
  }

  @Test
  public void testDesugaredForLoopUsesTheDeclaredVariable() {
    // var _g = 0; while (_g < 5) { var x = _g++; trace(x); }
    TypedNode loop =
        whileLoop(
            binop("<", local("_g"), intLiteral(5)),
            block(var("x", postIncrement("_g")), call(local("trace"), local("x"))));

    RangeIntent intent = (RangeIntent) analyze(loop).intent();

    assertThat(intent.variable()).isEqualTo("x");
    assertThat(intent.source().counter()).isEqualTo("_g");
    assertThat(intent.body()).containsExactly(call(local("trace"), local("x")));
  }

  @Test
  public void testCounterReadAfterLoopFallsBackToWhile() {
    TypedNode loop =
        whileLoop(
            binop("<", local("i"), intLiteral(10)),
            block(call(local("trace"), local("i")), postIncrement("i")));
    LoopContext context = LoopContext.builder().addLiveAfterLoop("i").build();

    LoopAnalysis analysis = analyze(loop, context);

    assertThat(analysis.intent().kind()).isEqualTo(LoopIntent.Kind.WHILE);
    assertThat(((WhileIntent) analysis.intent()).state()).containsExactly("i");
  }

  @Test
  public void testBoundWrittenByBodyIsNotARange() {
    TypedNode loop =
        whileLoop(
            binop("<", local("i"), local("n")),
            block(assign(local("n"), binop("-", local("n"), intLiteral(1))), postIncrement("i")));

    assertThat(analyze(loop).intent().kind()).isEqualTo(LoopIntent.Kind.WHILE);
  }

  @Test
  public void testPushIsAMap() {
    TypedNode loop =
        forIn(
            "x",
            local("items"),
            methodCall(local("result"), "push", binop("*", local("x"), intLiteral(2))));

    LoopAnalysis analysis = analyze(loop);

    assertThat(analysis.confidence()).isEqualTo(LoopAnalysis.ACCUMULATION_CONFIDENCE);
    MapIntent intent = (MapIntent) analysis.intent();
    assertThat(intent.result()).isEqualTo("result");
    assertThat(intent.transform()).isEqualTo(binop("*", local("x"), intLiteral(2)));
  }

  @Test
  public void testGuardedPushOfTheVariableIsAFilter() {
    TypedNode loop =
        forIn(
            "x",
            local("items"),
            ifNode(
                binop(">", local("x"), intLiteral(0)),
                methodCall(local("out"), "push", local("x"))));

    FilterIntent intent = (FilterIntent) analyze(loop).intent();

    assertThat(intent.predicate()).isEqualTo(binop(">", local("x"), intLiteral(0)));
  }

  @Test
  public void testGuardedPushOfAnExpressionIsAComprehension() {
    TypedNode loop =
        forIn(
            "x",
            range(intLiteral(0), intLiteral(5)),
            ifNode(
                binop("==", binop("%", local("x"), intLiteral(2)), intLiteral(0)),
                methodCall(local("out"), "push", binop("*", local("x"), intLiteral(2)))));

    assertThat(analyze(loop).intent().kind()).isEqualTo(LoopIntent.Kind.COMPREHENSION);
  }

  @Test
  public void testCompoundAssignmentIsAReduce() {
    TypedNode loop = forIn("x", local("items"), assignOp("+", local("sum"), local("x")));

    ReduceIntent intent = (ReduceIntent) analyze(loop).intent();

    assertThat(intent.accumulator()).isEqualTo("sum");
    assertThat(intent.combine()).isEqualTo(binop("+", local("sum"), local("x")));
  }

  @Test
  public void testAccumulatorReadByTransformIsNotAMap() {
    TypedNode loop =
        forIn(
            "x",
            local("items"),
            methodCall(local("out"), "push", TypedIR.field(local("out"), "length")));

    assertThat(analyze(loop).intent().kind()).isEqualTo(LoopIntent.Kind.COLLECTION_EACH);
  }

  @Test
  public void testLoopWithReturnHasNoIntent() {
    TypedNode loop =
        forIn("x", local("items"), ifNode(local("x"), block(returnNode(local("x")))));

    assertThat(analyzer.analyze(loop, LoopContext.EMPTY)).isNull();
  }

  @Test
  public void testNonLoopHasNoIntent() {
    assertThat(analyzer.analyze(local("x"), LoopContext.EMPTY)).isNull();
  }

  @Test
  public void testTieGoesToTheFirstRegisteredAnalyzer() {
    TypedNode loop = forIn("x", local("items"), call(local("trace"), local("x")));
    LoopIntent first = eachOver("a");
    LoopIntent second = eachOver("b");
    LoopPatternAnalyzer tied =
        new LoopPatternAnalyzer(
            ImmutableList.of(
                (l, c) -> new LoopAnalysis(first, 0.7), (l, c) -> new LoopAnalysis(second, 0.7)));

    assertThat(tied.analyze(loop, LoopContext.EMPTY).intent()).isSameInstanceAs(first);
  }

  @Test
  public void testHigherConfidenceWinsRegardlessOfOrder() {
    TypedNode loop = forIn("x", local("items"), call(local("trace"), local("x")));
    LoopIntent weak = eachOver("a");
    LoopIntent strong = eachOver("b");
    LoopPatternAnalyzer analyzers =
        new LoopPatternAnalyzer(
            ImmutableList.of(
                (l, c) -> new LoopAnalysis(weak, 0.6), (l, c) -> new LoopAnalysis(strong, 0.8)));

    assertThat(analyzers.analyze(loop, LoopContext.EMPTY).intent()).isSameInstanceAs(strong);
  }

  private static LoopIntent eachOver(String collection) {
    return new CollectionEachIntent(
        "x", IterationSource.collection(local(collection)), ImmutableList.of());
  }
}
