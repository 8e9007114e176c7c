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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites nested {@code Enum} calls as a pipeline:
 *
 * <pre>
 *   Enum.sum(Enum.map(xs, f))   becomes   xs |> Enum.map(f) |> Enum.sum()
 * </pre>
 *
 * <p>A call whose first argument is already a pipeline ending in an {@code Enum} stage is appended
 * to it. Stages on the right of an existing {@code |>} are not revisited.
 */
final class PipelineEnumCalls implements NodeTraversal.Callback, RewritePass {

  private static final String ENUM = "Enum";
  private static final String PIPE = "|>";

  /** For each node on the current path, whether it is the right operand of a pipe. */
  private final Deque<Boolean> stages = new ArrayDeque<>();

  @Override
  public Node process(Node root) {
    return NodeTraversal.traverse(root, this);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    stages.push(parent != null && parent.isBinaryOp(PIPE) && parent.getLastChild() == n);
    return true;
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    boolean isStage = stages.pop();
    if (!isEnumCallWithArgs(n) || isStage) {
      return n;
    }
    Node subject = n.getChildAt(1);
    if (isEnumCallWithArgs(subject)) {
      return IR.binaryOp(PIPE, pipe(subject.getChildAt(1), subject), stageOf(n));
    }
    if (subject.isBinaryOp(PIPE) && NodeUtil.isRemoteCallOn(subject.getLastChild(), ENUM)) {
      return IR.binaryOp(PIPE, subject, stageOf(n));
    }
    return n;
  }

  private static Node pipe(Node value, Node call) {
    return IR.binaryOp(PIPE, value, stageOf(call));
  }

  /** Returns the call without its first argument. */
  private static Node stageOf(Node call) {
    List<Node> children = call.getChildren();
    return IR.remoteCall(
        call.getFirstChild(), call.getString(), children.subList(2, children.size()));
  }

  private static boolean isEnumCallWithArgs(Node n) {
    return NodeUtil.isRemoteCallOn(n, ENUM) && n.getChildCount() >= 2;
  }
}
