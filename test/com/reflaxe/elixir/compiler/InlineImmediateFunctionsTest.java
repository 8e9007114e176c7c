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

import static com.reflaxe.elixir.ast.IR.apply;
import static com.reflaxe.elixir.ast.IR.call;
import static com.reflaxe.elixir.ast.IR.lambda;
import static com.reflaxe.elixir.ast.IR.match;
import static com.reflaxe.elixir.ast.IR.name;
import static com.reflaxe.elixir.ast.IR.number;

import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.ast.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link InlineImmediateFunctions}. */
@RunWith(JUnit4.class)
public final class InlineImmediateFunctionsTest extends RewritePassTestCase {

  @Override
  protected ContextualRewritePass getProcessor() {
    return ignoringContext(new InlineImmediateFunctions());
  }

  @Test
  public void testInlinesZeroArityCall() {
    test(apply(lambda(ImmutableList.of(), call("compute", name("x")))), call("compute", name("x")));
  }

  @Test
  public void testKeepsBodyThatBinds() {
    testSame(apply(lambda(ImmutableList.of(), match("x", number(1)))));
  }

  @Test
  public void testKeepsFunctionWithArguments() {
    testSame(apply(lambda(ImmutableList.of(Pattern.bind("x")), name("x")), number(1)));
  }

  @Test
  public void testKeepsCallOfNamedFunctionValue() {
    testSame(apply(name("callback")));
  }
}
