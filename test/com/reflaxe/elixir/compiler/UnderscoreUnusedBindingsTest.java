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

import static com.reflaxe.elixir.ast.IR.atom;
import static com.reflaxe.elixir.ast.IR.block;
import static com.reflaxe.elixir.ast.IR.call;
import static com.reflaxe.elixir.ast.IR.caseNode;
import static com.reflaxe.elixir.ast.IR.clause;
import static com.reflaxe.elixir.ast.IR.def;
import static com.reflaxe.elixir.ast.IR.ifNode;
import static com.reflaxe.elixir.ast.IR.lambda;
import static com.reflaxe.elixir.ast.IR.match;
import static com.reflaxe.elixir.ast.IR.name;
import static com.reflaxe.elixir.ast.IR.number;

import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.ast.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link UnderscoreUnusedBindings}. */
@RunWith(JUnit4.class)
public final class UnderscoreUnusedBindingsTest extends RewritePassTestCase {

  @Override
  protected ContextualRewritePass getProcessor() {
    return ignoringContext(new UnderscoreUnusedBindings());
  }

  private static Node function(Node body) {
    return def("f", clause(ImmutableList.of(), body));
  }

  @Test
  public void testUnusedMatchInFunctionBody() {
    test(
        function(block(match("x", call("compute")), match("y", call("other")), name("y"))),
        function(block(match("_x", call("compute")), match("y", call("other")), name("y"))));
  }

  @Test
  public void testUnusedCaseClauseBinder() {
    Pattern ok = Pattern.literal(atom("ok"));
    test(
        caseNode(name("v"), clause(Pattern.tuple(ok, Pattern.bind("value")), call("done"))),
        caseNode(name("v"), clause(Pattern.tuple(ok, Pattern.bind("_value")), call("done"))));
  }

  @Test
  public void testUsedCaseClauseBinder() {
    testSame(
        caseNode(
            name("v"),
            clause(
                Pattern.tuple(Pattern.literal(atom("ok")), Pattern.bind("value")),
                call("use", name("value")))));
  }

  @Test
  public void testVariantSpellingCountsAsUse() {
    testSame(function(block(match("user_id", call("fetch")), call("g", name("userId")))));
  }

  @Test
  public void testKeepsBinderBoundTwice() {
    testSame(
        caseNode(
            name("pair"),
            clause(Pattern.tuple(Pattern.bind("x"), Pattern.bind("x")), call("done"))));
  }

  @Test
  public void testMatchAsIfBranch() {
    test(
        ifNode(name("c"), match("x", number(1))),
        ifNode(name("c"), match("_x", number(1))));
  }

  @Test
  public void testMatchInConditionIsKept() {
    testSame(ifNode(match("x", call("fetch")), name("x")));
  }

  @Test
  public void testAlreadyUnderscored() {
    testSame(function(block(match("_x", call("compute")), call("done"))));
  }

  @Test
  public void testFunctionParametersAreLeftAlone() {
    testSame(lambda(ImmutableList.of(Pattern.bind("x")), call("done")));
  }
}
