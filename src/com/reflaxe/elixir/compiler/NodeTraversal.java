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
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal walks a tree and rebuilds it from the replacements its callback returns.
 *
 * <p>Children are rewritten before their parent, left to right. A parent whose children all come
 * back unchanged is not copied, so a traversal that rewrites nothing returns the original root.
 */
public final class NodeTraversal {
  private final Callback callback;

  /** Original ancestors of the node being visited, innermost first. */
  private final Deque<Node> ancestors = new ArrayDeque<>();

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its
     * children should be traversed. A node that is not traversed is kept as is.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node, as it was before the traversal.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children) and returns its replacement.
     *
     * @param t The current traversal.
     * @param n The current node, with its children already rewritten.
     * @param parent The parent of the current node, as it was before the traversal.
     * @return the node to put in place of {@code n}; {@code n} itself to keep it
     */
    Node visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** Abstract callback to visit all nodes in postorder. */
  @FunctionalInterface
  public static interface AbstractPostOrderCallbackInterface {
    Node visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  private NodeTraversal(Callback callback) {
    this.callback = callback;
  }

  /** Traverses the tree rooted at {@code root} and returns the rewritten root. */
  public static Node traverse(Node root, Callback cb) {
    return new NodeTraversal(cb).traverseBranch(root, null);
  }

  /** Traverses every node of the tree in postorder. */
  public static Node traversePostOrder(Node root, AbstractPostOrderCallbackInterface cb) {
    return traverse(
        root,
        new AbstractPostOrderCallback() {
          @Override
          public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
            return cb.visit(t, n, parent);
          }
        });
  }

  /** Returns the innermost DEF or DEFP enclosing the node being visited, or null. */
  public @Nullable Node getEnclosingDefinition() {
    for (Node ancestor : ancestors) {
      if (ancestor.isDefinition()) {
        return ancestor;
      }
    }
    return null;
  }

  /** Returns the number of ancestors of the node being visited. */
  public int getDepth() {
    return ancestors.size();
  }

  private Node traverseBranch(Node n, @Nullable Node parent) {
    if (!callback.shouldTraverse(this, n, parent)) {
      return n;
    }
    Node current = n;
    if (n.hasChildren()) {
      ancestors.push(n);
      ImmutableList.Builder<Node> children =
          ImmutableList.builderWithExpectedSize(n.getChildCount());
      for (Node child : n.getChildren()) {
        children.add(traverseBranch(child, n));
      }
      ancestors.pop();
      current = n.withChildren(children.build());
    }
    return callback.visit(this, current, parent);
  }
}
