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

/**
 * What a loop computes, recognized from its shape. Intents are created by a {@link LoopAnalyzer}
 * and consumed once by {@link LoopIntentLowering}.
 */
public interface LoopIntent {

  /** The kinds of intent. */
  enum Kind {
    RANGE,
    COLLECTION_EACH,
    MAP,
    FILTER,
    REDUCE,
    WHILE,
    DO_WHILE,
    COMPREHENSION
  }

  Kind kind();
}
