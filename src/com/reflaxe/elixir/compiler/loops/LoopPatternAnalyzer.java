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
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Runs competing {@link LoopAnalyzer}s over a loop and keeps the most confident result. When two
 * analyzers are equally confident, the one registered first wins.
 *
 * <p>A loop whose body contains {@code return} has no intent: none of the lowered shapes can leave
 * the enclosing function early.
 */
public final class LoopPatternAnalyzer {

  private static final Logger logger = Logger.getLogger(LoopPatternAnalyzer.class.getName());

  private final ImmutableList<LoopAnalyzer> analyzers;

  public LoopPatternAnalyzer(List<LoopAnalyzer> analyzers) {
    this.analyzers = ImmutableList.copyOf(analyzers);
  }

  /** Creates an analyzer with the standard analyzers, most specific first. */
  public static LoopPatternAnalyzer createDefault() {
    return new LoopPatternAnalyzer(
        ImmutableList.of(
            new AccumulationLoopAnalyzer(),
            new RangeLoopAnalyzer(),
            new CollectionLoopAnalyzer(),
            new ConditionalLoopAnalyzer()));
  }

  /** Returns the most confident analysis of {@code loop}, or null if no analyzer matches. */
  public @Nullable LoopAnalysis analyze(TypedNode loop, LoopContext context) {
    if (!loop.isLoop() || TypedNodes.containsReturn(loop.getChildren())) {
      return null;
    }
    LoopAnalysis best = null;
    for (LoopAnalyzer analyzer : analyzers) {
      LoopAnalysis analysis = analyzer.analyze(loop, context);
      if (analysis != null && (best == null || analysis.confidence() > best.confidence())) {
        best = analysis;
      }
    }
    if (best != null) {
      logger.finest("Loop recognized as " + best.intent().kind());
    }
    return best;
  }
}
