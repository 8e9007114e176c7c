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

import com.reflaxe.elixir.ast.Node;
import java.util.function.Predicate;

/**
 * Prefixes an underscore to the parameters of named and anonymous functions that the function
 * body never reads. In component and LiveView modules the {@code assigns} parameter is kept, since
 * templates read it implicitly.
 */
final class UnderscoreUnusedParameters implements ContextualRewritePass {

  static final String ASSIGNS = "assigns";

  @Override
  public Node process(Node root, RewriteContext context) {
    boolean keepAssigns = context.isWebComponentModule();
    return NodeTraversal.traversePostOrder(
        root,
        (t, n, parent) -> {
          if (!n.isClause() || parent == null || !(parent.isDefinition() || parent.isFn())) {
            return n;
          }
          Predicate<String> isUsed = UnderscoreUnusedBindings.usedInClause(n);
          if (keepAssigns) {
            isUsed = isUsed.or(ASSIGNS::equals);
          }
          return n.withPatterns(UnderscoreUnusedBindings.underscoreUnused(n.getPatterns(), isUsed));
        });
  }
}
