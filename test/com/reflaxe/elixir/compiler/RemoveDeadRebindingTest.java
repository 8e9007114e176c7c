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
import static com.reflaxe.elixir.ast.IR.list;
import static com.reflaxe.elixir.ast.IR.match;
import static com.reflaxe.elixir.ast.IR.name;
import static com.reflaxe.elixir.ast.IR.number;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link RemoveDeadRebinding}. */
@RunWith(JUnit4.class)
public final class RemoveDeadRebindingTest extends RewritePassTestCase {

  @Override
  protected ContextualRewritePass getProcessor() {
    return ignoringContext(new RemoveDeadRebinding());
  }

  @Test
  public void testDropsOverwrittenLiteral() {
    test(
        block(match("x", number(0)), match("x", call("compute")), call("use", name("x"))),
        block(match("x", call("compute")), call("use", name("x"))));
  }

  @Test
  public void testDropsOverwrittenEmptyList() {
    test(
        block(
            match("result", list()),
            match("result", call("build", name("items"))),
            name("result")),
        block(match("result", call("build", name("items"))), name("result")));
  }

  @Test
  public void testKeepsLiteralReadByRebinding() {
    testSame(
        block(
            match("x", number(0)),
            match("x", binaryOp("+", name("x"), number(1))),
            call("use", name("x"))));
  }

  @Test
  public void testKeepsNonLiteralBinding() {
    testSame(
        block(match("x", call("compute")), match("x", call("other")), call("use", name("x"))));
  }
}
