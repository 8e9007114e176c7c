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
import com.reflaxe.elixir.typed.TypedNode;
import com.reflaxe.elixir.typed.TypedToken;
import java.util.List;

/**
 * A small expression builder for tests. It covers the statements loop bodies are made of:
 * assignments become matches, {@code r.push(x)} becomes {@code r = r ++ [x]}, nested loops stay
 * wrapped in LOOP nodes.
 */
public final class FakeExpressionBuilder implements ExpressionBuilder {

  @Override
  public Node build(TypedNode expr) {
    switch (expr.getToken()) {
      case LOCAL:
        return IR.name(expr.getString());
      case INT:
        return IR.number(expr.getIntValue());
      case FLOAT:
        return IR.number(Double.parseDouble(expr.getString()));
      case STRING:
        return IR.string(expr.getString());
      case BOOL:
        return expr.getString().equals("true") ? IR.trueNode() : IR.falseNode();
      case NULL:
        return IR.nil();
      case VAR:
        return IR.match(
            expr.getString(), expr.getChildCount() == 0 ? IR.nil() : build(expr.getFirstChild()));
      case ASSIGN:
        return IR.match(targetName(expr), build(expr.getChildAt(1)));
      case ASSIGN_OP:
        String target = targetName(expr);
        return IR.match(
            target,
            binaryOp(expr.getString(), IR.name(target), build(expr.getChildAt(1))));
      case BINOP:
        return binaryOp(
            expr.getString(), build(expr.getFirstChild()), build(expr.getChildAt(1)));
      case UNOP:
        return buildUnary(expr);
      case BLOCK:
        return IR.block(buildAll(expr.getChildren()));
      case IF:
        List<Node> parts = buildAll(expr.getChildren());
        return parts.size() == 2
            ? IR.ifNode(parts.get(0), parts.get(1))
            : IR.ifNode(parts.get(0), parts.get(1), parts.get(2));
      case WHILE:
      case DO_WHILE:
      case FOR_IN:
        return IR.loop(expr);
      case RANGE:
        return IR.range(
            build(expr.getFirstChild()),
            IR.binaryOp("-", build(expr.getChildAt(1)), IR.number(1)));
      case ARRAY_DECL:
        return IR.list(buildAll(expr.getChildren()));
      case CALL:
        return buildCall(expr);
      case FIELD:
        return IR.access(build(expr.getFirstChild()), expr.getString());
      case ARRAY_ACCESS:
        return IR.remoteCall(
            "Enum", "at", build(expr.getFirstChild()), build(expr.getChildAt(1)));
      case RETURN:
        return expr.getChildCount() == 0 ? IR.nil() : build(expr.getFirstChild());
      case BREAK:
      case CONTINUE:
        throw new IllegalArgumentException("unlowered loop signal " + expr);
    }
    throw new AssertionError(expr.getToken());
  }

  private Node buildUnary(TypedNode expr) {
    TypedNode operand = expr.getFirstChild();
    switch (expr.getString()) {
      case "++":
        return IR.match(
            operand.getString(), IR.binaryOp("+", IR.name(operand.getString()), IR.number(1)));
      case "--":
        return IR.match(
            operand.getString(), IR.binaryOp("-", IR.name(operand.getString()), IR.number(1)));
      case "!":
        return IR.unaryOp("not", build(operand));
      default:
        return IR.unaryOp(expr.getString(), build(operand));
    }
  }

  private Node buildCall(TypedNode expr) {
    TypedNode callee = expr.getFirstChild();
    List<Node> args = buildAll(expr.getChildren().subList(1, expr.getChildCount()));
    if (callee.getToken() == TypedToken.FIELD) {
      Node receiver = build(callee.getFirstChild());
      if (callee.getString().equals("push") && receiver.isName()) {
        return IR.match(receiver.getString(), IR.binaryOp("++", receiver, IR.list(args)));
      }
      return IR.remoteCall(receiver, callee.getString(), args);
    }
    if (callee.isLocal()) {
      return IR.call(callee.getString(), args);
    }
    return IR.apply(build(callee), args);
  }

  private static Node binaryOp(String operator, Node lhs, Node rhs) {
    switch (operator) {
      case "%":
        return IR.call("rem", lhs, rhs);
      case "&&":
        return IR.binaryOp("and", lhs, rhs);
      case "||":
        return IR.binaryOp("or", lhs, rhs);
      default:
        return IR.binaryOp(operator, lhs, rhs);
    }
  }

  private static String targetName(TypedNode assignment) {
    TypedNode target = assignment.getFirstChild();
    if (!target.isLocal()) {
      throw new IllegalArgumentException("only locals are assignable here: " + target);
    }
    return target.getString();
  }

  private List<Node> buildAll(List<TypedNode> nodes) {
    ImmutableList.Builder<Node> out = ImmutableList.builder();
    for (TypedNode node : nodes) {
      out.add(build(node));
    }
    return out.build();
  }
}
