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
import com.reflaxe.elixir.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * Replaces {@code if c, do: true, else: false} by {@code c} and the swapped form by {@code not c}.
 * Only conditions known to produce a boolean are rewritten; any other value would change from
 * truthy to itself.
 */
final class SimplifyBooleanIf extends NodeTraversal.AbstractPostOrderCallback
    implements RewritePass {

  @Override
  public Node process(Node root) {
    return NodeTraversal.traverse(root, this);
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isIf() || n.getChildCount() != 3) {
      return n;
    }
    Node cond = n.getChildAt(0);
    Token thenToken = n.getChildAt(1).getToken();
    Token elseToken = n.getChildAt(2).getToken();
    if (!isBoolean(cond)) {
      return n;
    }
    if (thenToken == Token.TRUE && elseToken == Token.FALSE) {
      return cond;
    }
    if (thenToken == Token.FALSE && elseToken == Token.TRUE) {
      return IR.unaryOp("not", cond);
    }
    return n;
  }

  private static boolean isBoolean(Node n) {
    switch (n.getToken()) {
      case TRUE:
      case FALSE:
        return true;
      case UNARY_OP:
        return n.getString().equals("not");
      case BINARY_OP:
        return NodeUtil.isComparison(n) || n.isBinaryOp("and") || n.isBinaryOp("or");
      default:
        return false;
    }
  }
}
