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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import com.reflaxe.elixir.compiler.loops.ExpressionBuilder;
import org.jspecify.annotations.Nullable;

/** Read-only facts about the module being rewritten, handed to contextual passes. */
@AutoValue
public abstract class RewriteContext {

  /** The tag of modules compiled as web components. */
  public static final String COMPONENT_TAG = "component";

  /** The tag of modules compiled as live views. */
  public static final String LIVEVIEW_TAG = "liveview";

  public abstract String getModuleName();

  public abstract ImmutableSet<String> getModuleTags();

  /** Converts input-AST expressions for loop lowering; null when loops cannot be lowered. */
  public abstract @Nullable ExpressionBuilder getExpressionBuilder();

  public abstract Builder toBuilder();

  RewriteContext() {}

  /**
   * Whether the module is a web component or live view, whose callbacks receive an implicit
   * {@code assigns} parameter.
   */
  public boolean isWebComponentModule() {
    return getModuleTags().contains(COMPONENT_TAG) || getModuleTags().contains(LIVEVIEW_TAG);
  }

  /** A builder for a {@link RewriteContext}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setModuleName(String x);

    public abstract Builder setModuleTags(ImmutableSet<String> x);

    public abstract Builder setExpressionBuilder(@Nullable ExpressionBuilder x);

    public abstract RewriteContext build();
  }

  public static Builder builder() {
    return new AutoValue_RewriteContext.Builder()
        .setModuleName("")
        .setModuleTags(ImmutableSet.of());
  }

  /** A context with no module facts. */
  public static RewriteContext empty() {
    return builder().build();
  }
}
