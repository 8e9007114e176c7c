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
 * Computes the free variables of a function, closure or body under lexical scoping.
 *
 * <p>Unlike {@link VariableUsageAnalyzer}, a binding made by a block statement shadows the
 * statements after it: {@code x = 1; f(x)} has no free variables. A nested closure whose parameter
 * is {@code x} does not read an outer {@code x}, but any other name it reads is free in the
 * enclosing node as well.
 */
public final class ClosureFreeVariableCollector {

  private ClosureFreeVariableCollector() {}

  /** Returns the names free in {@code node}, in first-read order. */
  public static ImmutableSet<String> freeVariables(@Nullable Node node) {
    return UsageScanner.referencedNames(node, ScopeMode.LEXICAL);
  }

  /** Whether {@code name} is free in {@code node}. */
  public static boolean isFreeIn(@Nullable Node node, @Nullable String name) {
    if (node == null || NameVariants.isIgnored(name)) {
      return false;
    }
    return freeVariables(node).contains(name);
  }
}
