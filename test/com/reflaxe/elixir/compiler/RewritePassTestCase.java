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

import static com.google.common.truth.Truth.assertWithMessage;

import com.reflaxe.elixir.ast.Node;

/**
 * Base class for testing rewrite passes. Subclasses supply the pass; {@link #test} runs it and
 * compares the result with the expected tree structurally.
 */
public abstract class RewritePassTestCase {

  /** The context passed to contextual passes. Tests may replace it before calling {@link #test}. */
  protected RewriteContext context = RewriteContext.empty();

  /** Gets the pass to run. */
  protected abstract ContextualRewritePass getProcessor();

  /** Adapts a pass that ignores the context. */
  protected static ContextualRewritePass ignoringContext(RewritePass pass) {
    return (root, context) -> pass.process(root);
  }

  /** Runs the pass on {@code input} and asserts that the result is {@code expected}. */
  protected void test(Node input, Node expected) {
    Node actual = getProcessor().process(input, context);
    assertWithMessage("Input:\n%s", input.toStringTree())
        .that(actual.toStringTree())
        .isEqualTo(expected.toStringTree());
  }

  /** Asserts that the pass leaves {@code input} unchanged. */
  protected void testSame(Node input) {
    test(input, input);
  }
}
