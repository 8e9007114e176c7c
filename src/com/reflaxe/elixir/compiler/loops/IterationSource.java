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

import com.reflaxe.elixir.typed.TypedNode;
import org.jspecify.annotations.Nullable;

/**
 * What a loop iterates over: either a collection, or an integer range from {@code start} to
 * {@code end} with a positive {@code step}.
 *
 * @param collection The collection, or null for a range.
 * @param start First value of a range.
 * @param end Bound of a range; included only if {@code inclusive}.
 * @param step Distance between consecutive values of a range.
 * @param inclusive Whether a range includes {@code end}.
 * @param counter The variable a while loop tests against the bound, if the range was recognized
 *     from a while loop. It may differ from the intent's variable when the loop is a desugared
 *     counted for.
 */
public record IterationSource(
    @Nullable TypedNode collection,
    @Nullable TypedNode start,
    @Nullable TypedNode end,
    long step,
    boolean inclusive,
    @Nullable String counter) {

  public IterationSource {
    checkArgument(
        (collection == null) == (start != null && end != null), "collection or range expected");
    checkArgument(step > 0, "step must be positive: %s", step);
  }

  public static IterationSource collection(TypedNode collection) {
    return new IterationSource(collection, null, null, 1, false, null);
  }

  public static IterationSource range(
      TypedNode start, TypedNode end, long step, boolean inclusive, @Nullable String counter) {
    return new IterationSource(null, start, end, step, inclusive, counter);
  }

  public boolean isRange() {
    return collection == null;
  }
}
