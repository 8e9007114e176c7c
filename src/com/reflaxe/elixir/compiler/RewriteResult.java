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

import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.ast.Node;

/**
 * The outcome of one run of the pipeline.
 *
 * @param root the rewritten tree
 * @param diagnostics the findings reported while scheduling and running the passes
 * @param executedPasses the names of the passes that ran to completion, in order
 */
public record RewriteResult(
    Node root, ImmutableList<RewriteError> diagnostics, ImmutableList<String> executedPasses) {

  public boolean hasDiagnostics() {
    return !diagnostics.isEmpty();
  }
}
