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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.reflaxe.elixir.compiler.NameVariants;
import com.reflaxe.elixir.typed.TypedNode;
import com.reflaxe.elixir.typed.TypedToken;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Facts about the code around a loop: the values some variables hold when the loop starts, and
 * the variables read after it. Initial values are keyed by the exact name; liveness is matched
 * modulo spelling variants.
 */
public final class LoopContext {

  public static final LoopContext EMPTY = builder().build();

  private final ImmutableMap<String, TypedNode> initialValues;
  private final ImmutableSet<String> liveAfterLoop;

  private LoopContext(
      ImmutableMap<String, TypedNode> initialValues, ImmutableSet<String> liveAfterLoop) {
    this.initialValues = initialValues;
    this.liveAfterLoop = liveAfterLoop;
  }

  /** Returns the value {@code name} holds when the loop starts, or null if unknown. */
  public @Nullable TypedNode getInitialValue(String name) {
    return initialValues.get(name);
  }

  /** Whether {@code name} is known to hold the empty list when the loop starts. */
  public boolean isKnownEmptyList(String name) {
    TypedNode value = getInitialValue(name);
    return value != null && value.getToken() == TypedToken.ARRAY_DECL && value.getChildCount() == 0;
  }

  /** Whether {@code name} is read after the loop. */
  public boolean isLiveAfterLoop(String name) {
    return liveAfterLoop.contains(NameVariants.canonicalKey(name));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A builder for a {@link LoopContext}. */
  public static final class Builder {
    private final Map<String, TypedNode> initialValues = new LinkedHashMap<>();
    private final Set<String> liveAfterLoop = new LinkedHashSet<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setInitialValue(String name, TypedNode value) {
      initialValues.put(name, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addLiveAfterLoop(String name) {
      liveAfterLoop.add(NameVariants.canonicalKey(name));
      return this;
    }

    public LoopContext build() {
      return new LoopContext(
          ImmutableMap.copyOf(initialValues), ImmutableSet.copyOf(liveAfterLoop));
    }
  }
}
