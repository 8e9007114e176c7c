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

import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Splices blocks nested directly in other blocks into their parent, and replaces a block holding a
 * single expression by that expression.
 *
 * <p>Loop lowering and expression building both produce nested blocks freely; this pass is what
 * keeps the printed code flat.
 */
final class FlattenBlocks extends NodeTraversal.AbstractPostOrderCallback implements RewritePass {

  @Override
  public Node process(Node root) {
    return NodeTraversal.traverse(root, this);
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isBlock()) {
      return n;
    }
    ImmutableList.Builder<Node> stmts = ImmutableList.builder();
    for (Node child : n.getChildren()) {
      if (child.isBlock()) {
        stmts.addAll(child.getChildren());
      } else {
        stmts.add(child);
      }
    }
    ImmutableList<Node> flat = stmts.build();
    if (flat.size() == 1) {
      return flat.get(0);
    }
    return n.withChildren(flat);
  }
}
