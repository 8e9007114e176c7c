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
import com.reflaxe.elixir.ast.IR;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.ast.Pattern;
import com.reflaxe.elixir.compiler.NodeUtil;
import com.reflaxe.elixir.typed.TypedNode;
import java.util.List;

/**
 * Builds the target-AST form of a {@link LoopIntent}.
 *
 * <ul>
 *   <li>Range and collection loops become {@code Enum.each}, or {@code Enum.reduce_while} over a
 *       state tuple when the body writes outer variables or uses {@code break}/{@code continue}.
 *   <li>Map, filter and reduce become {@code Enum.map}, {@code Enum.filter} and {@code
 *       Enum.reduce}; a comprehension becomes {@code for}. A result list that is not known to
 *       start empty is extended with {@code ++}.
 *   <li>While loops become an anonymous function that receives itself as its first argument and
 *       recurses while the condition holds, returning the final state.
 * </ul>
 */
public final class LoopIntentLowering {

  static final String WHILE_FUNCTION_NAME = "while_fn";

  private final ExpressionBuilder builder;

  public LoopIntentLowering(ExpressionBuilder builder) {
    this.builder = builder;
  }

  public Node lower(LoopIntent intent, LoopContext context) {
    return switch (intent.kind()) {
      case RANGE -> {
        RangeIntent range = (RangeIntent) intent;
        yield lowerEach(range.variable(), range.source(), range.body());
      }
      case COLLECTION_EACH -> {
        CollectionEachIntent each = (CollectionEachIntent) intent;
        yield lowerEach(each.variable(), each.source(), each.body());
      }
      case MAP -> lowerMap((MapIntent) intent, context);
      case FILTER -> lowerFilter((FilterIntent) intent, context);
      case COMPREHENSION -> lowerComprehension((ComprehensionIntent) intent, context);
      case REDUCE -> lowerReduce((ReduceIntent) intent);
      case WHILE, DO_WHILE -> lowerWhile((WhileIntent) intent);
    };
  }

  private Node lowerEach(String variable, IterationSource source, List<TypedNode> body) {
    Node enumerable = lowerSource(source);
    List<String> state = TypedNodes.outerState(body, variable);
    if (state.isEmpty() && !TypedNodes.containsSignal(body)) {
      return IR.remoteCall(
          "Enum",
          "each",
          enumerable,
          IR.lambda(ImmutableList.of(Pattern.bind(variable)), lowerStatements(body)));
    }
    Node stateValue = stateValue(state);
    Node fnBody =
        new ControlSignalLowering(
                builder,
                state,
                IR.tuple(IR.atom("cont"), stateValue),
                IR.tuple(IR.atom("halt"), stateValue))
            .lower(body);
    Node fold =
        IR.remoteCall(
            "Enum",
            "reduce_while",
            enumerable,
            stateValue,
            IR.lambda(ImmutableList.of(Pattern.bind(variable), statePattern(state)), fnBody));
    return state.isEmpty() ? fold : IR.match(statePattern(state), fold);
  }

  private Node lowerMap(MapIntent intent, LoopContext context) {
    Node call =
        IR.remoteCall(
            "Enum",
            "map",
            lowerSource(intent.source()),
            IR.lambda(
                ImmutableList.of(Pattern.bind(intent.variable())),
                builder.build(intent.transform())));
    return assignResult(intent.result(), call, context);
  }

  private Node lowerFilter(FilterIntent intent, LoopContext context) {
    Node call =
        IR.remoteCall(
            "Enum",
            "filter",
            lowerSource(intent.source()),
            IR.lambda(
                ImmutableList.of(Pattern.bind(intent.variable())),
                builder.build(intent.predicate())));
    return assignResult(intent.result(), call, context);
  }

  private Node lowerComprehension(ComprehensionIntent intent, LoopContext context) {
    Node comprehension =
        IR.forComprehension(
            ImmutableList.of(
                IR.generator(Pattern.bind(intent.variable()), lowerSource(intent.source())),
                IR.filter(builder.build(intent.filter()))),
            builder.build(intent.transform()));
    return assignResult(intent.result(), comprehension, context);
  }

  private Node lowerReduce(ReduceIntent intent) {
    String accumulator = intent.accumulator();
    return IR.match(
        accumulator,
        IR.remoteCall(
            "Enum",
            "reduce",
            lowerSource(intent.source()),
            IR.name(accumulator),
            IR.lambda(
                ImmutableList.of(Pattern.bind(intent.variable()), Pattern.bind(accumulator)),
                builder.build(intent.combine()))));
  }

  /**
   * Lowers a while loop to a self-applying function. Anonymous functions cannot refer to
   * themselves by name, so the function is passed to itself as its first argument.
   */
  private Node lowerWhile(WhileIntent intent) {
    List<String> state = intent.state();
    String fnName = freshFunctionName(intent);
    ImmutableList.Builder<Pattern> params = ImmutableList.builder();
    ImmutableList.Builder<Node> args = ImmutableList.builder();
    params.add(Pattern.bind(fnName));
    args.add(IR.name(fnName));
    for (String name : state) {
      params.add(Pattern.bind(name));
      args.add(IR.name(name));
    }
    Node recurse = IR.apply(IR.name(fnName), args.build());
    Node finalState = stateValue(state);
    Node condition = builder.build(intent.condition());

    Node fnBody;
    if (intent.doWhile()) {
      fnBody =
          new ControlSignalLowering(
                  builder, state, IR.ifNode(condition, recurse, finalState), finalState)
              .lower(intent.body());
    } else {
      Node body =
          new ControlSignalLowering(builder, state, recurse, finalState).lower(intent.body());
      fnBody = IR.ifNode(condition, body, finalState);
    }

    Node definition = IR.match(fnName, IR.lambda(params.build(), fnBody));
    Node run = state.isEmpty() ? recurse : IR.match(statePattern(state), recurse);
    return IR.block(definition, run);
  }

  private String freshFunctionName(WhileIntent intent) {
    String name = WHILE_FUNCTION_NAME;
    int suffix = 1;
    while (intent.state().contains(name)
        || TypedNodes.references(intent.condition(), name)
        || TypedNodes.references(intent.body(), name)
        || TypedNodes.declaredNames(intent.body()).contains(name)) {
      name = WHILE_FUNCTION_NAME + "_" + suffix++;
    }
    return name;
  }

  private Node assignResult(String result, Node value, LoopContext context) {
    if (context.isKnownEmptyList(result)) {
      return IR.match(result, value);
    }
    return IR.match(result, IR.binaryOp("++", IR.name(result), value));
  }

  private Node lowerStatements(List<TypedNode> stmts) {
    if (stmts.isEmpty()) {
      return IR.nil();
    }
    ImmutableList.Builder<Node> out = ImmutableList.builder();
    for (TypedNode stmt : stmts) {
      out.add(builder.build(stmt));
    }
    return NodeUtil.toBody(out.build());
  }

  /**
   * Lowers the iteration source. Literal bounds are folded: an exclusive literal end {@code n}
   * becomes {@code n - 1}, and an empty literal range becomes {@code []}. A range with a computed
   * bound always carries an explicit step so that it is empty rather than descending when the
   * bound is below the start.
   */
  private Node lowerSource(IterationSource source) {
    if (!source.isRange()) {
      return builder.build(source.collection());
    }
    TypedNode start = source.start();
    TypedNode end = source.end();
    if (start.isInt() && end.isInt()) {
      long first = start.getIntValue();
      long last = source.inclusive() ? end.getIntValue() : end.getIntValue() - 1;
      if (last < first) {
        return IR.list();
      }
      return source.step() == 1
          ? IR.range(IR.number(first), IR.number(last))
          : IR.range(IR.number(first), IR.number(last), IR.number(source.step()));
    }
    Node last;
    if (source.inclusive()) {
      last = builder.build(end);
    } else if (end.isInt()) {
      last = IR.number(end.getIntValue() - 1);
    } else {
      last = IR.binaryOp("-", builder.build(end), IR.number(1));
    }
    return IR.range(builder.build(start), last, IR.number(source.step()));
  }

  private static Node stateValue(List<String> state) {
    if (state.isEmpty()) {
      return IR.atom("ok");
    }
    if (state.size() == 1) {
      return IR.name(state.get(0));
    }
    ImmutableList.Builder<Node> names = ImmutableList.builder();
    for (String name : state) {
      names.add(IR.name(name));
    }
    return IR.tuple(names.build());
  }

  private static Pattern statePattern(List<String> state) {
    if (state.isEmpty()) {
      return Pattern.wildcard();
    }
    if (state.size() == 1) {
      return Pattern.bind(state.get(0));
    }
    ImmutableList.Builder<Pattern> binds = ImmutableList.builder();
    for (String name : state) {
      binds.add(Pattern.bind(name));
    }
    return Pattern.tuple(binds.build());
  }
}
