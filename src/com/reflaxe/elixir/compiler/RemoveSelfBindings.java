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
 * Removes bindings of a variable to itself, {@code x = x}. In value position the binding is
 * replaced by a plain read of the variable.
 */
final class RemoveSelfBindings extends NodeTraversal.AbstractPostOrderCallback
    implements RewritePass {

  @Override
  public Node process(Node root) {
    return NodeTraversal.traverse(root, this);
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isBlock()) {
      return removeFromBlock(n);
    }
    if (isSelfBinding(n) && (parent == null || !parent.isBlock())) {
      return IR.name(NodeUtil.getBoundName(n));
    }
    return n;
  }

  private static Node removeFromBlock(Node block) {
    List<Node> stmts = new ArrayList<>();
    int last = block.getChildCount() - 1;
    for (int i = 0; i <= last; i++) {
      Node stmt = block.getChildAt(i);
      if (!isSelfBinding(stmt)) {
        stmts.add(stmt);
      } else if (i == last) {
        stmts.add(IR.name(NodeUtil.getBoundName(stmt)));
      }
    }
    return NodeUtil.withStatements(block, stmts);
  }

  static boolean isSelfBinding(Node n) {
    return NodeUtil.isSimpleBinding(n)
        && NodeUtil.getMatchValue(n).isName(NodeUtil.getBoundName(n));
  }
}
