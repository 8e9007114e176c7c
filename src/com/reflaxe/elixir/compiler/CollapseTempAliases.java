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

import com.reflaxe.elixir.ast.IR;
import com.reflaxe.elixir.ast.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Collapses a binding that only feeds the next one:
 *
 * <pre>
 *   temp = compute()
 *   x = temp
 * </pre>
 *
 * becomes {@code x = compute()} when nothing after the pair reads {@code temp}.
 */
final class CollapseTempAliases extends NodeTraversal.AbstractPostOrderCallback
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
    List<Node> stmts = new ArrayList<>(n.getChildren());
    UsageSuffixIndex index = UsageSuffixIndex.buildExact(stmts);
    // Statements after position i are untouched originals, shifted left by removed.
    int removed = 0;
    int i = 0;
    while (i + 1 < stmts.size()) {
      Node first = stmts.get(i);
      Node second = stmts.get(i + 1);
      if (isCollapsible(first, second)
          && !index.usedLater(i + 2 + removed, NodeUtil.getBoundName(first))) {
        stmts.set(i, IR.match(second.getOnlyPattern(), NodeUtil.getMatchValue(first)));
        stmts.remove(i + 1);
        removed++;
      } else {
        i++;
      }
    }
    return NodeUtil.withStatements(n, stmts);
  }

  private static boolean isCollapsible(Node first, Node second) {
    if (!NodeUtil.isSimpleBinding(first) || !NodeUtil.isSimpleBinding(second)) {
      return false;
    }
    String temp = NodeUtil.getBoundName(first);
    String target = NodeUtil.getBoundName(second);
    return NodeUtil.getMatchValue(second).isName(temp)
        && !target.equals(temp)
        && !NodeUtil.getMatchValue(first).isName(target);
  }
}
