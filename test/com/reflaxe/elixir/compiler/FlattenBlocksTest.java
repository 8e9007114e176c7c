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

import static com.reflaxe.elixir.ast.IR.block;
import static com.reflaxe.elixir.ast.IR.call;
import static com.reflaxe.elixir.ast.IR.clause;
import static com.reflaxe.elixir.ast.IR.def;
import static com.reflaxe.elixir.ast.IR.match;
import static com.reflaxe.elixir.ast.IR.name;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FlattenBlocks}. */
@RunWith(JUnit4.class)
public final class FlattenBlocksTest extends RewritePassTestCase {

  @Override
  protected ContextualRewritePass getProcessor() {
    return ignoringContext(new FlattenBlocks());
  }

  @Test
  public void testSplicesNestedBlock() {
    test(block(call("a"), block(call("b"), call("c"))), block(call("a"), call("b"), call("c")));
  }

  @Test
  public void testSplicesDeeplyNestedBlocks() {
    test(
        block(block(call("a"), block(call("b"), call("c")))),
        block(call("a"), call("b"), call("c")));
  }

  @Test
  public void testUnwrapsSingleStatementBody() {
    test(
        def("f", clause(ImmutableList.of(), block(call("a")))),
        def("f", clause(ImmutableList.of(), call("a"))));
  }

  @Test
  public void testKeepsMultiStatementExpressionBlock() {
    testSame(block(match("x", block(call("a"), call("b"))), name("x")));
  }

  @Test
  public void testFlatBlockUnchanged() {
    testSame(block(call("a"), call("b")));
  }
}
