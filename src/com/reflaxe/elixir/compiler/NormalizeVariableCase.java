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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Renames camelCase variables to snake_case, one function at a time. Every binder and read of a
 * renamed variable changes together, including the identifiers in pass-through code and string
 * interpolations. A variable whose snake_case name is already taken in the function keeps its
 * name.
 */
final class NormalizeVariableCase extends NodeTraversal.AbstractPostOrderCallback
    implements RewritePass {

  private static final Logger logger = Logger.getLogger(NormalizeVariableCase.class.getName());

  private boolean sawDefinition;

  @Override
  public Node process(Node root) {
    sawDefinition = false;
    Node result = NodeTraversal.traverse(root, this);
    return sawDefinition ? result : normalize(root);
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isDefinition()) {
      return n;
    }
    sawDefinition = true;
    return normalize(n);
  }

  private static Node normalize(Node unit) {
    // Payloads of loops that could not be lowered are not renamed, so the function is left alone.
    if (NodeUtil.containsLoop(unit)) {
      return unit;
    }
    ImmutableSet<String> binders = NodeUtil.getAllBinders(unit);
    ImmutableSet<String> taken =
        ImmutableSet.<String>builder()
            .addAll(binders)
            .addAll(VariableUsageAnalyzer.referencedNames(unit))
            .build();
    Map<String, String> renames = new LinkedHashMap<>();
    for (String name : binders) {
      if (!NameVariants.isCamelCase(name)) {
        continue;
      }
      String snake = NameVariants.toSnakeCase(name);
      if (taken.contains(snake) || renames.containsValue(snake)) {
        logger.fine("Keeping " + name + ": " + snake + " is taken");
        continue;
      }
      renames.put(name, snake);
    }
    if (renames.isEmpty()) {
      return unit;
    }
    return NodeUtil.renameVariables(unit, NodeUtil.renamer(renames));
  }
}
