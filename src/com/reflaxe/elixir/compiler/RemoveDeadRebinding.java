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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Drops {@code x = literal} when the very next statement rebinds {@code x} without reading it.
 * Such placeholders come from declarations that were initialized before being assigned.
 */
final class RemoveDeadRebinding extends NodeTraversal.AbstractPostOrderCallback
    implements RewritePass {

  @Override
  public Node process(Node root) {
    return NodeTraversal.traverse(root, this);
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isBlock()) {
      return n;
    }
    List<Node> stmts = new ArrayList<>();
    List<Node> children = n.getChildren();
    for (int i = 0; i < children.size(); i++) {
      Node stmt = children.get(i);
      if (i + 1 < children.size() && isDeadPlaceholder(stmt, children.get(i + 1))) {
        continue;
      }
      stmts.add(stmt);
    }
    return NodeUtil.withStatements(n, stmts);
  }

  private static boolean isDeadPlaceholder(Node stmt, Node next) {
    if (!NodeUtil.isSimpleBinding(stmt) || !NodeUtil.isSimpleBinding(next)) {
      return false;
    }
    Node value = NodeUtil.getMatchValue(stmt);
    if (!value.isLiteral() && !NodeUtil.isEmptyList(value)) {
      return false;
    }
    String name = NodeUtil.getBoundName(stmt);
    return NodeUtil.getBoundName(next).equals(name)
        && !VariableUsageAnalyzer.isReferenced(NodeUtil.getMatchValue(next), name);
  }
}
