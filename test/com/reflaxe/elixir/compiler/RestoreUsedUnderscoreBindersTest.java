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
import com.reflaxe.elixir.ast.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link RestoreUsedUnderscoreBinders}. */
@RunWith(JUnit4.class)
public final class RestoreUsedUnderscoreBindersTest extends RewritePassTestCase {

  @Override
  protected ContextualRewritePass getProcessor() {
    return ignoringContext(new RestoreUsedUnderscoreBinders());
  }

  @Test
  public void testRestoresMatchBinder() {
    test(
        block(match("_x", call("compute")), call("use", name("_x"))),
        block(match("x", call("compute")), call("use", name("x"))));
  }

  @Test
  public void testRestoresParameter() {
    test(
        def("f", clause(ImmutableList.of(Pattern.bind("_opts")), call("g", name("_opts")))),
        def("f", clause(ImmutableList.of(Pattern.bind("opts")), call("g", name("opts")))));
  }

  @Test
  public void testKeepsWhenPlainNameIsRead() {
    testSame(block(match("_x", call("compute")), call("use", name("_x"), name("x"))));
  }

  @Test
  public void testKeepsUnreadBinder() {
    testSame(block(match("_x", call("compute")), call("done")));
  }

  @Test
  public void testKeepsDoubleUnderscore() {
    testSame(block(match("__x", call("compute")), call("use", name("__x"))));
  }
}
