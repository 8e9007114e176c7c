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
import org.jspecify.annotations.Nullable;

/**
 * Simplifies binary concatenation: drops empty string operands, folds two string literals into
 * one, and turns {@code "s" <> to_string(v)} into the interpolation {@code "s#{v}"}.
 */
final class SimplifyStringConcat extends NodeTraversal.AbstractPostOrderCallback
    implements RewritePass {

  private static final String CONCAT = "<>";

  @Override
  public Node process(Node root) {
    return NodeTraversal.traverse(root, this);
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isBinaryOp(CONCAT)) {
      return n;
    }
    Node lhs = n.getFirstChild();
    Node rhs = n.getLastChild();
    if (NodeUtil.isEmptyString(lhs)) {
      return rhs;
    }
    if (NodeUtil.isEmptyString(rhs)) {
      return lhs;
    }
    String left = asStringPart(lhs);
    String right = asStringPart(rhs);
    if (left != null && right != null && (lhs.isString() || rhs.isString())) {
      if (right.startsWith("{") && endsWithUnescapedHash(left)) {
        // A literal '#' followed by '{' would open an interpolation.
        left = left.substring(0, left.length() - 1) + "\\#";
      }
      return IR.string(left + right);
    }
    return n;
  }

  private static boolean endsWithUnescapedHash(String text) {
    if (!text.endsWith("#")) {
      return false;
    }
    int backslashes = 0;
    for (int i = text.length() - 2; i >= 0 && text.charAt(i) == '\\'; i--) {
      backslashes++;
    }
    return backslashes % 2 == 0;
  }

  /**
   * Returns the text the operand contributes inside a string literal: the literal's own text, or
   * an interpolation span for {@code to_string(v)} of a variable. Null for anything else.
   */
  private static @Nullable String asStringPart(Node n) {
    if (n.isString()) {
      return n.getString();
    }
    if (n.isCall() && n.getString().equals("to_string") && n.getChildCount() == 1) {
      Node arg = n.getFirstChild();
      if (arg.isName()) {
        return "#{" + arg.getString() + "}";
      }
    }
    return null;
  }
}
