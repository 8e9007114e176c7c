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

import com.google.common.collect.ImmutableSet;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.compiler.UsageScanner.ScopeMode;
import org.jspecify.annotations.Nullable;

/**
 * Answers whether a variable is read inside a subtree.
 *
 * <p>A read is a {@code NAME} reference, a pinned pattern name, or an identifier inside
 * pass-through code or an interpolation span. Binding a name is not a read. Names rebound by an
 * inner clause, generator or function parameter are not reads of the outer variable, while plain
 * statement rebinding is not treated as shadowing: if any statement of a block reads {@code x}, the
 * block reads {@code x}.
 */
public final class VariableUsageAnalyzer {

  private VariableUsageAnalyzer() {}

  /** Whether {@code node} reads exactly {@code name}. */
  public static boolean isReferenced(@Nullable Node node, @Nullable String name) {
    if (node == null || NameVariants.isIgnored(name)) {
      return false;
    }
    return referencedNames(node).contains(name);
  }

  /**
   * Whether {@code node} reads {@code name} or one of its spelling variants, such as {@code
   * userId} for {@code user_id} or {@code _user_id}.
   */
  public static boolean isReferencedAnyVariant(@Nullable Node node, @Nullable String name) {
    if (node == null || NameVariants.isIgnored(name)) {
      return false;
    }
    String key = NameVariants.canonicalKey(name);
    for (String used : referencedNames(node)) {
      if (used.equals(name) || NameVariants.canonicalKey(used).equals(key)) {
        return true;
      }
    }
    return false;
  }

  /** Returns every name {@code node} reads, in first-read order. */
  public static ImmutableSet<String> referencedNames(@Nullable Node node) {
    return UsageScanner.referencedNames(node, ScopeMode.CONSERVATIVE);
  }
}
