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

/**
 * A general while or do-while loop.
 *
 * @param condition The loop condition.
 * @param body The body statements.
 * @param state The outer variables the body reassigns, in first-assignment order.
 * @param doWhile Whether the body runs once before the first check.
 */
public record WhileIntent(
    TypedNode condition,
    ImmutableList<TypedNode> body,
    ImmutableList<String> state,
    boolean doWhile)
    implements LoopIntent {

  @Override
  public Kind kind() {
    return doWhile ? Kind.DO_WHILE : Kind.WHILE;
  }
}
