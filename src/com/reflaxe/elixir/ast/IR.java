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
package com.reflaxe.elixir.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.typed.TypedNode;
import java.util.List;

/** An AST construction helper class. */
public final class IR {

  private IR() {}

  public static Node module(String name, Node... definitions) {
    return module(name, ImmutableList.copyOf(definitions));
  }

  public static Node module(String name, List<Node> definitions) {
    return new Node(Token.MODULE, name, definitions);
  }

  public static Node def(String name, Node clause) {
    checkArgument(clause.isClause(), clause);
    return new Node(Token.DEF, name, ImmutableList.of(clause));
  }

  public static Node defp(String name, Node clause) {
    checkArgument(clause.isClause(), clause);
    return new Node(Token.DEFP, name, ImmutableList.of(clause));
  }

  public static Node clause(List<Pattern> patterns, Node body) {
    return new Node(
        Token.CLAUSE, null, ImmutableList.copyOf(patterns), ImmutableList.of(body), null);
  }

  public static Node clause(List<Pattern> patterns, Node guard, Node body) {
    return new Node(
        Token.CLAUSE, null, ImmutableList.copyOf(patterns), ImmutableList.of(guard, body), null);
  }

  /** A single-pattern clause, as used by {@code case}, {@code receive} and {@code rescue}. */
  public static Node clause(Pattern pattern, Node body) {
    return clause(ImmutableList.of(pattern), body);
  }

  public static Node block(Node... stmts) {
    return block(ImmutableList.copyOf(stmts));
  }

  public static Node block(List<Node> stmts) {
    for (Node stmt : stmts) {
      checkArgument(!stmt.isClause() && !stmt.isDefinition(), "Block cannot contain %s", stmt);
    }
    return new Node(Token.BLOCK, null, stmts);
  }

  public static Node match(Pattern lhs, Node rhs) {
    return new Node(Token.MATCH, null, ImmutableList.of(lhs), ImmutableList.of(rhs), null);
  }

  /** Shorthand for {@code name = rhs}. */
  public static Node match(String name, Node rhs) {
    return match(Pattern.bind(name), rhs);
  }

  public static Node name(String name) {
    checkArgument(!name.isEmpty(), "empty name");
    return new Node(Token.NAME, name, ImmutableList.of());
  }

  public static Node atom(String value) {
    return new Node(Token.ATOM, value, ImmutableList.of());
  }

  public static Node string(String value) {
    return new Node(Token.STRING, value, ImmutableList.of());
  }

  public static Node number(long value) {
    return new Node(Token.NUMBER, Long.toString(value), ImmutableList.of());
  }

  public static Node number(double value) {
    return new Node(Token.NUMBER, Double.toString(value), ImmutableList.of());
  }

  public static Node trueNode() {
    return new Node(Token.TRUE, null, ImmutableList.of());
  }

  public static Node falseNode() {
    return new Node(Token.FALSE, null, ImmutableList.of());
  }

  public static Node nil() {
    return new Node(Token.NIL, null, ImmutableList.of());
  }

  public static Node raw(String code) {
    return new Node(Token.RAW, code, ImmutableList.of());
  }

  public static Node moduleRef(String module) {
    return new Node(Token.MODULE_REF, module, ImmutableList.of());
  }

  public static Node binaryOp(String operator, Node lhs, Node rhs) {
    return new Node(Token.BINARY_OP, operator, ImmutableList.of(lhs, rhs));
  }

  public static Node unaryOp(String operator, Node operand) {
    return new Node(Token.UNARY_OP, operator, ImmutableList.of(operand));
  }

  public static Node ifNode(Node cond, Node then) {
    return new Node(Token.IF, null, ImmutableList.of(cond, then));
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    return new Node(Token.IF, null, ImmutableList.of(cond, then, elseNode));
  }

  public static Node caseNode(Node subject, Node... clauses) {
    return caseNode(subject, ImmutableList.copyOf(clauses));
  }

  public static Node caseNode(Node subject, List<Node> clauses) {
    checkClauses(clauses);
    return new Node(
        Token.CASE,
        null,
        ImmutableList.<Node>builder().add(subject).addAll(clauses).build());
  }

  public static Node with(List<Node> generators, Node body, List<Node> elseClauses) {
    checkArgument(!generators.isEmpty(), "with needs at least one clause");
    for (Node generator : generators) {
      checkArgument(generator.getToken() == Token.GENERATOR, generator);
    }
    checkArgument(body.getToken() != Token.GENERATOR && !body.isClause(), body);
    checkClauses(elseClauses);
    return new Node(
        Token.WITH,
        null,
        ImmutableList.<Node>builder().addAll(generators).add(body).addAll(elseClauses).build());
  }

  public static Node forComprehension(List<Node> qualifiers, Node body) {
    checkArgument(!qualifiers.isEmpty(), "for needs at least one generator");
    checkArgument(qualifiers.get(0).getToken() == Token.GENERATOR, qualifiers.get(0));
    for (Node qualifier : qualifiers) {
      checkArgument(
          qualifier.getToken() == Token.GENERATOR || qualifier.getToken() == Token.FILTER,
          qualifier);
    }
    return new Node(
        Token.FOR, null, ImmutableList.<Node>builder().addAll(qualifiers).add(body).build());
  }

  public static Node generator(Pattern lhs, Node enumerable) {
    return new Node(
        Token.GENERATOR, null, ImmutableList.of(lhs), ImmutableList.of(enumerable), null);
  }

  public static Node filter(Node cond) {
    return new Node(Token.FILTER, null, ImmutableList.of(cond));
  }

  public static Node fn(Node... clauses) {
    return fn(ImmutableList.copyOf(clauses));
  }

  public static Node fn(List<Node> clauses) {
    checkArgument(!clauses.isEmpty(), "fn needs at least one clause");
    checkClauses(clauses);
    return new Node(Token.FN, null, clauses);
  }

  /** Shorthand for a single-clause {@code fn params -> body end}. */
  public static Node lambda(List<Pattern> params, Node body) {
    return fn(clause(params, body));
  }

  public static Node tryNode(Node body, Node... rescueClauses) {
    List<Node> clauses = ImmutableList.copyOf(rescueClauses);
    checkClauses(clauses);
    return new Node(
        Token.TRY, null, ImmutableList.<Node>builder().add(body).addAll(clauses).build());
  }

  public static Node receive(Node... clauses) {
    List<Node> list = ImmutableList.copyOf(clauses);
    checkClauses(list);
    return new Node(Token.RECEIVE, null, list);
  }

  public static Node call(String function, Node... args) {
    return call(function, ImmutableList.copyOf(args));
  }

  public static Node call(String function, List<Node> args) {
    return new Node(Token.CALL, function, args);
  }

  public static Node remoteCall(Node target, String function, Node... args) {
    return remoteCall(target, function, ImmutableList.copyOf(args));
  }

  public static Node remoteCall(Node target, String function, List<Node> args) {
    return new Node(
        Token.REMOTE_CALL,
        function,
        ImmutableList.<Node>builder().add(target).addAll(args).build());
  }

  /** Shorthand for {@code Module.function(args)}. */
  public static Node remoteCall(String module, String function, Node... args) {
    return remoteCall(moduleRef(module), function, ImmutableList.copyOf(args));
  }

  public static Node apply(Node function, Node... args) {
    return apply(function, ImmutableList.copyOf(args));
  }

  public static Node apply(Node function, List<Node> args) {
    return new Node(
        Token.APPLY, null, ImmutableList.<Node>builder().add(function).addAll(args).build());
  }

  public static Node access(Node target, String field) {
    return new Node(Token.ACCESS, field, ImmutableList.of(target));
  }

  public static Node index(Node target, Node key) {
    return new Node(Token.INDEX, null, ImmutableList.of(target, key));
  }

  public static Node list(Node... elements) {
    return list(ImmutableList.copyOf(elements));
  }

  public static Node list(List<Node> elements) {
    return new Node(Token.LIST, null, elements);
  }

  public static Node tuple(Node... elements) {
    return tuple(ImmutableList.copyOf(elements));
  }

  public static Node tuple(List<Node> elements) {
    return new Node(Token.TUPLE, null, elements);
  }

  public static Node map(Node... pairs) {
    List<Node> list = ImmutableList.copyOf(pairs);
    checkPairs(list);
    return new Node(Token.MAP, null, list);
  }

  public static Node struct(String module, Node... pairs) {
    List<Node> list = ImmutableList.copyOf(pairs);
    checkPairs(list);
    return new Node(Token.STRUCT, module, list);
  }

  public static Node pair(Node key, Node value) {
    return new Node(Token.PAIR, null, ImmutableList.of(key, value));
  }

  public static Node range(Node first, Node last) {
    return new Node(Token.RANGE, null, ImmutableList.of(first, last));
  }

  public static Node range(Node first, Node last, Node step) {
    return new Node(Token.RANGE, null, ImmutableList.of(first, last, step));
  }

  /** Wraps an imperative loop of the input AST until the loop-lowering pass replaces it. */
  public static Node loop(TypedNode loop) {
    checkArgument(loop.isLoop(), "not a loop: %s", loop);
    return new Node(Token.LOOP, null, ImmutableList.of(), ImmutableList.of(), loop);
  }

  private static void checkClauses(List<Node> clauses) {
    for (Node clause : clauses) {
      checkArgument(clause.isClause(), "expected a clause: %s", clause);
    }
  }

  private static void checkPairs(List<Node> pairs) {
    for (Node pair : pairs) {
      checkArgument(pair.getToken() == Token.PAIR, "expected a pair: %s", pair);
    }
  }
}
