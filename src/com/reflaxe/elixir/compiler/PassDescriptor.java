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

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ForOverride;
import com.reflaxe.elixir.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Describes one rewrite pass of the pipeline.
 *
 * <p>Contains all meta-data about the pass: a unique name used in logs and dependency edges, a
 * human-readable description, the default enablement, and the names of passes it must run after.
 * Exactly one of {@link #getPass()} and {@link #getContextualPass()} is set.
 */
@AutoValue
public abstract class PassDescriptor {

  /** The name of the pass as it will appear in logs and {@code runAfter} edges. */
  public abstract String getName();

  public abstract String getDescription();

  /** Whether the pass runs unless {@link RewriteOptions} says otherwise. */
  public abstract boolean isEnabled();

  public abstract @Nullable RewritePass getPass();

  public abstract @Nullable ContextualRewritePass getContextualPass();

  /** Names of passes that must run before this one when they are present. */
  public abstract ImmutableList<String> getRunAfter();

  public abstract Builder toBuilder();

  PassDescriptor() {}

  /** Runs the pass on {@code root}. */
  final Node run(Node root, RewriteContext context) {
    RewritePass pass = getPass();
    if (pass != null) {
      return pass.process(root);
    }
    return getContextualPass().process(root, context);
  }

  /** A builder for a {@link PassDescriptor}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String x);

    public abstract Builder setDescription(String x);

    public abstract Builder setEnabled(boolean x);

    public abstract Builder setPass(@Nullable RewritePass x);

    public abstract Builder setContextualPass(@Nullable ContextualRewritePass x);

    abstract ImmutableList.Builder<String> runAfterBuilder();

    @CanIgnoreReturnValue
    public final Builder addRunAfter(String passName) {
      runAfterBuilder().add(passName);
      return this;
    }

    @ForOverride
    abstract PassDescriptor autoBuild();

    public final PassDescriptor build() {
      PassDescriptor result = autoBuild();
      checkState(!result.getName().isEmpty());
      checkState(
          (result.getPass() == null) != (result.getContextualPass() == null),
          "pass %s needs exactly one rewrite function",
          result.getName());
      return result;
    }
  }

  public static Builder builder() {
    return new AutoValue_PassDescriptor.Builder().setDescription("").setEnabled(true);
  }

  /** Creates a pass that returns its input unchanged. */
  public static PassDescriptor createEmptyPass(String name) {
    return builder().setName(name).setPass(root -> root).build();
  }
}
