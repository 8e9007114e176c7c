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
package com.reflaxe.elixir.compiler.loops;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.reflaxe.elixir.ast.IR;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.compiler.NodeUtil;
import com.reflaxe.elixir.typed.TypedNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a loop body whose every exit must produce a value: {@code {:cont, state}} and {@code
 * {:halt, state}} for a fold, or the recursive call and the final state for a while function.
 *
 * <p>{@code break} becomes the halt tail and {@code continue} the continue tail; the statements
 * after either are unreachable and dropped. A body that falls off its end gets the continue tail.
 * A conditional that contains a signal or writes a state variable receives the statements after it
 * in each of its branches, so that every branch ends in a tail that sees its own bindings.
 */
final class ControlSignalLowering {

  private final ExpressionBuilder builder;
  private final ImmutableSet<String> state;
  private final Node continueTail;
  private final Node haltTail;

  ControlSignalLowering(
      ExpressionBuilder builder, List<String> state, Node continueTail, Node haltTail) {
    this.builder = builder;
    this.state = ImmutableSet.copyOf(state);
    this.continueTail = continueTail;
    this.haltTail = haltTail;
  }

  Node lower(List<TypedNode> stmts) {
    return NodeUtil.toBody(lowerSequence(stmts));
  }

  private List<Node> lowerSequence(List<TypedNode> stmts) {
    List<Node> out = new ArrayList<>();
    for (int i = 0; i < stmts.size(); i++) {
      TypedNode stmt = stmts.get(i);
      List<TypedNode> rest = stmts.subList(i + 1, stmts.size());
      switch (stmt.getToken()) {
        case BREAK:
          out.add(haltTail);
          return out;
        case CONTINUE:
          out.add(continueTail);
          return out;
        case BLOCK:
          out.addAll(lowerSequence(concat(stmt.getChildren(), rest)));
          return out;
        case IF:
          if (needsSplit(stmt)) {
            List<TypedNode> elseStmts =
                stmt.getChildCount() == 3 ? stmt.getChildAt(2).statements() : ImmutableList.of();
            out.add(
                IR.ifNode(
                    builder.build(stmt.getFirstChild()),
                    lower(concat(stmt.getChildAt(1).statements(), rest)),
                    lower(concat(elseStmts, rest))));
            return out;
          }
          out.add(builder.build(stmt));
          break;
        default:
          out.add(builder.build(stmt));
          break;
      }
    }
    out.add(continueTail);
    return out;
  }

  private boolean needsSplit(TypedNode ifStmt) {
    if (TypedNodes.containsSignal(ifStmt)) {
      return true;
    }
    for (String written : TypedNodes.assignedNames(ImmutableList.of(ifStmt))) {
      if (state.contains(written)) {
        return true;
      }
    }
    return false;
  }

  private static List<TypedNode> concat(List<TypedNode> first, List<TypedNode> second) {
    return ImmutableList.<TypedNode>builder().addAll(first).addAll(second).build();
  }
}
