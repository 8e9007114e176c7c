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
import org.jspecify.annotations.Nullable;

/** Rewrites {@code [] ++ x} and {@code x ++ []} to {@code x}. */
final class RemoveEmptyListConcat extends NodeTraversal.AbstractPostOrderCallback
    implements RewritePass {

  @Override
  public Node process(Node root) {
    return NodeTraversal.traverse(root, this);
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isBinaryOp("++")) {
      return n;
    }
    if (NodeUtil.isEmptyList(n.getFirstChild())) {
      return n.getLastChild();
    }
    if (NodeUtil.isEmptyList(n.getLastChild())) {
      return n.getFirstChild();
    }
    return n;
  }
}
