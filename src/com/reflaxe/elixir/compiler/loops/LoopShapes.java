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
import com.reflaxe.elixir.typed.TypedIR;
import com.reflaxe.elixir.typed.TypedNode;
import com.reflaxe.elixir.typed.TypedToken;
import org.jspecify.annotations.Nullable;

/** Decomposes loops that visit a range or collection into variable, source and body. */
final class LoopShapes {

  private LoopShapes() {}

  /** A loop seen as "for {@code variable} in {@code source} do {@code body}". */
  record IterationShape(String variable, IterationSource source, ImmutableList<TypedNode> body) {}

  /**
   * Returns the iteration shape of {@code loop}, or null if it is not a for-in loop or a counted
   * while loop.
   *
   * <p>A while loop is counted when its condition is {@code c < end} or {@code c <= end} and its
   * body increments {@code c} exactly once, either as the last statement or as the desugared
   * first statement {@code var v = c++}. The counter must not be written anywhere else, {@code end}
   * must not depend on what the body writes, and the counter must not be read after the loop. A
   * body that increments last may not {@code continue}, which would skip the increment.
   */
  static @Nullable IterationShape getIterationShape(TypedNode loop, LoopContext context) {
    switch (loop.getToken()) {
      case FOR_IN:
        return getForInShape(loop);
      case WHILE:
        return getCountedWhileShape(loop, context);
      default:
        return null;
    }
  }

  private static IterationShape getForInShape(TypedNode loop) {
    TypedNode iterable = loop.getFirstChild();
    IterationSource source =
        iterable.getToken() == TypedToken.RANGE
            ? IterationSource.range(
                iterable.getFirstChild(), iterable.getChildAt(1), 1, false, null)
            : IterationSource.collection(iterable);
    return new IterationShape(loop.getString(), source, loop.getChildAt(1).statements());
  }

  private static @Nullable IterationShape getCountedWhileShape(
      TypedNode loop, LoopContext context) {
    TypedNode condition = loop.getFirstChild();
    if (condition.getToken() != TypedToken.BINOP
        || !(condition.getString().equals("<") || condition.getString().equals("<="))
        || !condition.getFirstChild().isLocal()) {
      return null;
    }
    String counter = condition.getFirstChild().getString();
    TypedNode end = condition.getChildAt(1);
    boolean inclusive = condition.getString().equals("<=");
    ImmutableList<TypedNode> stmts = loop.getChildAt(1).statements();
    if (stmts.isEmpty() || context.isLiveAfterLoop(counter)) {
      return null;
    }

    String variable;
    long step;
    ImmutableList<TypedNode> body;
    TypedNode first = stmts.get(0);
    if (isDesugaredCounterRead(first, counter)) {
      variable = first.getString();
      step = 1;
      body = stmts.subList(1, stmts.size());
    } else {
      step = TypedNodes.getIncrementStep(stmts.get(stmts.size() - 1), counter);
      if (step == 0) {
        return null;
      }
      variable = counter;
      body = stmts.subList(0, stmts.size() - 1);
      if (TypedNodes.containsContinue(body)) {
        return null;
      }
    }

    if (TypedNodes.assignedNames(body).contains(counter)
        || TypedNodes.declaredNames(body).contains(counter)) {
      return null;
    }
    for (String written : TypedNodes.assignedNames(body)) {
      if (TypedNodes.references(end, written)) {
        return null;
      }
    }

    TypedNode start = context.getInitialValue(counter);
    if (start == null) {
      start = TypedIR.intLiteral(0);
    }
    return new IterationShape(
        variable, IterationSource.range(start, end, step, inclusive, counter), body);
  }

  /** Whether {@code stmt} is {@code var v = counter++}. */
  private static boolean isDesugaredCounterRead(TypedNode stmt, String counter) {
    if (stmt.getToken() != TypedToken.VAR || stmt.getChildCount() != 1) {
      return false;
    }
    TypedNode init = stmt.getFirstChild();
    return init.getToken() == TypedToken.UNOP
        && init.getString().equals("++")
        && init.isPostfix()
        && init.getFirstChild().isLocal(counter);
  }
}
