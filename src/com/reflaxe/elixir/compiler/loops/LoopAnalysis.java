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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A recognized intent and how sure the analyzer is of it. Confidence is a coarse score in {@code
 * (0, 1]}; higher wins.
 */
public record LoopAnalysis(LoopIntent intent, double confidence) {

  public static final double ACCUMULATION_CONFIDENCE = 0.95;
  public static final double RANGE_CONFIDENCE = 0.9;
  public static final double COLLECTION_CONFIDENCE = 0.8;
  public static final double FALLBACK_CONFIDENCE = 0.5;

  public LoopAnalysis {
    checkArgument(confidence > 0 && confidence <= 1, "confidence out of range: %s", confidence);
  }
}
