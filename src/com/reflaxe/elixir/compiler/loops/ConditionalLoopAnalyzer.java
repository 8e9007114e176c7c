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

import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.typed.TypedNode;
import com.reflaxe.elixir.typed.TypedToken;
import org.jspecify.annotations.Nullable;

/**
 * The fallback for while and do-while loops of any shape. The variables the body writes become
 * the state threaded through the recursion.
 */
public final class ConditionalLoopAnalyzer implements LoopAnalyzer {

  @Override
  public @Nullable LoopAnalysis analyze(TypedNode loop, LoopContext context) {
    if (loop.getToken() != TypedToken.WHILE && loop.getToken() != TypedToken.DO_WHILE) {
      return null;
    }
    ImmutableList<TypedNode> body = loop.getChildAt(1).statements();
    return new LoopAnalysis(
        new WhileIntent(
            loop.getFirstChild(),
            body,
            TypedNodes.outerState(body),
            loop.getToken() == TypedToken.DO_WHILE),
        LoopAnalysis.FALLBACK_CONFIDENCE);
  }
}
