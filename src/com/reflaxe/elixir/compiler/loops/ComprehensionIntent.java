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

import com.reflaxe.elixir.typed.TypedNode;

/** A fused filter and map: appends {@code transform} of the elements satisfying {@code filter}. */
public record ComprehensionIntent(
    String variable,
    IterationSource source,
    String result,
    TypedNode filter,
    TypedNode transform)
    implements IteratingIntent {

  @Override
  public Kind kind() {
    return Kind.COMPREHENSION;
  }
}
