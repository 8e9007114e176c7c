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

import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.typed.TypedNode;
import org.jspecify.annotations.Nullable;

/** Recognizes the intent of an imperative loop and lowers it. */
public final class LoopTranslator {

  private final LoopPatternAnalyzer analyzer;
  private final LoopIntentLowering lowering;

  public LoopTranslator(LoopPatternAnalyzer analyzer, LoopIntentLowering lowering) {
    this.analyzer = analyzer;
    this.lowering = lowering;
  }

  public LoopTranslator(ExpressionBuilder builder) {
    this(LoopPatternAnalyzer.createDefault(), new LoopIntentLowering(builder));
  }

  /** Returns the lowered loop, or null if its intent is not recognized. */
  public @Nullable Node translate(TypedNode loop, LoopContext context) {
    LoopAnalysis analysis = analyzer.analyze(loop, context);
    if (analysis == null) {
      return null;
    }
    return lowering.lower(analysis.intent(), context);
  }
}
