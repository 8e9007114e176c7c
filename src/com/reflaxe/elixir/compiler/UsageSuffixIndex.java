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

import static com.google.common.base.Preconditions.checkPositionIndex;

import com.google.common.collect.ImmutableMap;
import com.reflaxe.elixir.ast.Node;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Answers "is this name read at or after statement i" for a fixed statement list in constant
 * time.
 *
 * <p>The index records, for every name read by the list, the position of the last statement that
 * reads it. A name is read at or after {@code i} exactly when that position is at least {@code i}.
 * The index is a snapshot; rebuild it after changing the list.
 */
public final class UsageSuffixIndex {

  private final ImmutableMap<String, Integer> lastUse;
  private final int size;
  private final boolean fuzzy;

  private UsageSuffixIndex(ImmutableMap<String, Integer> lastUse, int size, boolean fuzzy) {
    this.lastUse = lastUse;
    this.size = size;
    this.fuzzy = fuzzy;
  }

  /** Builds an index that matches names modulo spelling variants. */
  public static UsageSuffixIndex build(List<Node> stmts) {
    return build(stmts, true);
  }

  /** Builds an index that matches names exactly. */
  public static UsageSuffixIndex buildExact(List<Node> stmts) {
    return build(stmts, false);
  }

  private static UsageSuffixIndex build(List<Node> stmts, boolean fuzzy) {
    Map<String, Integer> lastUse = new HashMap<>();
    for (int i = stmts.size() - 1; i >= 0; i--) {
      for (String name : VariableUsageAnalyzer.referencedNames(stmts.get(i))) {
        lastUse.putIfAbsent(fuzzy ? NameVariants.canonicalKey(name) : name, i);
      }
    }
    return new UsageSuffixIndex(ImmutableMap.copyOf(lastUse), stmts.size(), fuzzy);
  }

  /** Returns the number of statements indexed. */
  public int size() {
    return size;
  }

  /**
   * Whether {@code name} is read by a statement at position {@code startIdx} or later. {@code
   * startIdx} may equal {@link #size()}, in which case nothing follows.
   */
  public boolean usedLater(int startIdx, @Nullable String name) {
    checkPositionIndex(startIdx, size);
    if (NameVariants.isIgnored(name)) {
      return false;
    }
    Integer last = lastUse.get(fuzzy ? NameVariants.canonicalKey(name) : name);
    return last != null && last >= startIdx;
  }
}
