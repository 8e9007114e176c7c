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
import com.reflaxe.elixir.compiler.loops.LoopShapes.IterationShape;
import com.reflaxe.elixir.typed.TypedIR;
import com.reflaxe.elixir.typed.TypedNode;
import com.reflaxe.elixir.typed.TypedToken;
import org.jspecify.annotations.Nullable;

/**
 * Recognizes loops whose whole body accumulates into one variable.
 *
 * <ul>
 *   <li>{@code result.push(f(x))}: a map.
 *   <li>{@code if (p(x)) result.push(x)}: a filter.
 *   <li>{@code if (p(x)) result.push(f(x))}: a comprehension.
 *   <li>{@code acc += f(x)}, {@code acc = acc op f(x)}: a reduce.
 * </ul>
 *
 * The accumulated variable may not be read by the transform, predicate or combined value.
 */
public final class AccumulationLoopAnalyzer implements LoopAnalyzer {

  private static final ImmutableSet<String> REDUCIBLE_OPERATORS =
      ImmutableSet.of("+", "-", "*", "/", "&&", "||", "&", "|", "^");

  @Override
  public @Nullable LoopAnalysis analyze(TypedNode loop, LoopContext context) {
    IterationShape shape = LoopShapes.getIterationShape(loop, context);
    if (shape == null || shape.body().size() != 1) {
      return null;
    }
    LoopIntent intent = analyzeStatement(shape, shape.body().get(0));
    return intent == null
        ? null
        : new LoopAnalysis(intent, LoopAnalysis.ACCUMULATION_CONFIDENCE);
  }

  private static @Nullable LoopIntent analyzeStatement(IterationShape shape, TypedNode stmt) {
    String variable = shape.variable();
    String result = TypedNodes.getPushTarget(stmt);
    if (result != null) {
      TypedNode value = TypedNodes.getPushValue(stmt);
      if (!isAccumulationTarget(result, shape) || !isPureRead(value, result)) {
        return null;
      }
      return new MapIntent(variable, shape.source(), result, value);
    }

    if (stmt.getToken() == TypedToken.IF && stmt.getChildCount() == 2) {
      ImmutableList<TypedNode> then = stmt.getChildAt(1).statements();
      if (then.size() != 1) {
        return null;
      }
      result = TypedNodes.getPushTarget(then.get(0));
      TypedNode condition = stmt.getFirstChild();
      if (result == null
          || !isAccumulationTarget(result, shape)
          || !isPureRead(condition, result)) {
        return null;
      }
      TypedNode value = TypedNodes.getPushValue(then.get(0));
      if (!isPureRead(value, result)) {
        return null;
      }
      if (value.isLocal(variable)) {
        return new FilterIntent(variable, shape.source(), result, condition);
      }
      return new ComprehensionIntent(variable, shape.source(), result, condition, value);
    }

    return analyzeReduce(shape, stmt);
  }

  private static @Nullable LoopIntent analyzeReduce(IterationShape shape, TypedNode stmt) {
    TypedNode target;
    String operator;
    TypedNode operand;
    if (stmt.getToken() == TypedToken.ASSIGN_OP) {
      target = stmt.getFirstChild();
      operator = stmt.getString();
      operand = stmt.getChildAt(1);
    } else if (stmt.getToken() == TypedToken.ASSIGN
        && stmt.getChildAt(1).getToken() == TypedToken.BINOP
        && stmt.getChildAt(1).getFirstChild().equals(stmt.getFirstChild())) {
      target = stmt.getFirstChild();
      operator = stmt.getChildAt(1).getString();
      operand = stmt.getChildAt(1).getChildAt(1);
    } else {
      return null;
    }
    if (!target.isLocal() || !REDUCIBLE_OPERATORS.contains(operator)) {
      return null;
    }
    String accumulator = target.getString();
    if (!isAccumulationTarget(accumulator, shape) || !isPureRead(operand, accumulator)) {
      return null;
    }
    return new ReduceIntent(
        shape.variable(),
        shape.source(),
        accumulator,
        TypedIR.binop(operator, TypedIR.local(accumulator), operand));
  }

  private static boolean isAccumulationTarget(String name, IterationShape shape) {
    return !name.equals(shape.variable()) && !name.equals(shape.source().counter());
  }

  /** Whether {@code expr} writes nothing and does not read {@code accumulator}. */
  private static boolean isPureRead(TypedNode expr, String accumulator) {
    return !TypedNodes.references(expr, accumulator)
        && TypedNodes.assignedNames(ImmutableList.of(expr)).isEmpty();
  }
}
