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
import com.reflaxe.elixir.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * Replaces a zero-argument anonymous function that is called on the spot, {@code (fn -> e
 * end).()}, by its body. Bodies that bind variables are left wrapped, since inlining them would
 * leak the bindings into the enclosing scope.
 */
final class InlineImmediateFunctions extends NodeTraversal.AbstractPostOrderCallback
    implements RewritePass {

  @Override
  public Node process(Node root) {
    return NodeTraversal.traverse(root, this);
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.getToken() != Token.APPLY || n.getChildCount() != 1) {
      return n;
    }
    Node function = n.getFirstChild();
    if (!function.isFn() || function.getChildCount() != 1) {
      return n;
    }
    Node clause = function.getFirstChild();
    if (!clause.getPatterns().isEmpty() || NodeUtil.getClauseGuard(clause) != null) {
      return n;
    }
    Node body = NodeUtil.getClauseBody(clause);
    if (body.isBlock() || body.isMatch()) {
      return n;
    }
    return body;
  }
}
