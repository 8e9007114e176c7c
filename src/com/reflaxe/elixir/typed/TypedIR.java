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
package com.reflaxe.elixir.typed;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A construction helper for the typed input AST. */
public final class TypedIR {

  private TypedIR() {}

  public static TypedNode local(String name) {
    checkArgument(!name.isEmpty(), "empty name");
    return new TypedNode(TypedToken.LOCAL, name, false, ImmutableList.of());
  }

  public static TypedNode intLiteral(long value) {
    return new TypedNode(TypedToken.INT, Long.toString(value), false, ImmutableList.of());
  }

  public static TypedNode floatLiteral(double value) {
    return new TypedNode(TypedToken.FLOAT, Double.toString(value), false, ImmutableList.of());
  }

  public static TypedNode stringLiteral(String value) {
    return new TypedNode(TypedToken.STRING, value, false, ImmutableList.of());
  }

  public static TypedNode boolLiteral(boolean value) {
    return new TypedNode(TypedToken.BOOL, Boolean.toString(value), false, ImmutableList.of());
  }

  public static TypedNode nullLiteral() {
    return new TypedNode(TypedToken.NULL, null, false, ImmutableList.of());
  }

  public static TypedNode var(String name) {
    return new TypedNode(TypedToken.VAR, name, false, ImmutableList.of());
  }

  public static TypedNode var(String name, TypedNode init) {
    return new TypedNode(TypedToken.VAR, name, false, ImmutableList.of(init));
  }

  public static TypedNode assign(TypedNode target, TypedNode value) {
    checkAssignable(target);
    return new TypedNode(TypedToken.ASSIGN, null, false, ImmutableList.of(target, value));
  }

  /** A compound assignment such as {@code x += value}; {@code operator} excludes the '='. */
  public static TypedNode assignOp(String operator, TypedNode target, TypedNode value) {
    checkAssignable(target);
    return new TypedNode(TypedToken.ASSIGN_OP, operator, false, ImmutableList.of(target, value));
  }

  public static TypedNode binop(String operator, TypedNode lhs, TypedNode rhs) {
    return new TypedNode(TypedToken.BINOP, operator, false, ImmutableList.of(lhs, rhs));
  }

  public static TypedNode unop(String operator, boolean postfix, TypedNode operand) {
    return new TypedNode(TypedToken.UNOP, operator, postfix, ImmutableList.of(operand));
  }

  /** {@code name++} */
  public static TypedNode postIncrement(String name) {
    return unop("++", true, local(name));
  }

  public static TypedNode block(TypedNode... stmts) {
    return block(ImmutableList.copyOf(stmts));
  }

  public static TypedNode block(List<TypedNode> stmts) {
    return new TypedNode(TypedToken.BLOCK, null, false, stmts);
  }

  public static TypedNode ifNode(TypedNode cond, TypedNode then) {
    return new TypedNode(TypedToken.IF, null, false, ImmutableList.of(cond, then));
  }

  public static TypedNode ifNode(TypedNode cond, TypedNode then, TypedNode elseNode) {
    return new TypedNode(TypedToken.IF, null, false, ImmutableList.of(cond, then, elseNode));
  }

  public static TypedNode whileLoop(TypedNode cond, TypedNode body) {
    return new TypedNode(TypedToken.WHILE, null, false, ImmutableList.of(cond, body));
  }

  public static TypedNode doWhileLoop(TypedNode cond, TypedNode body) {
    return new TypedNode(TypedToken.DO_WHILE, null, false, ImmutableList.of(cond, body));
  }

  public static TypedNode forIn(String variable, TypedNode iterable, TypedNode body) {
    return new TypedNode(TypedToken.FOR_IN, variable, false, ImmutableList.of(iterable, body));
  }

  /** An exclusive integer range {@code start...end}. */
  public static TypedNode range(TypedNode start, TypedNode end) {
    return new TypedNode(TypedToken.RANGE, null, false, ImmutableList.of(start, end));
  }

  public static TypedNode arrayDecl(TypedNode... elements) {
    return new TypedNode(TypedToken.ARRAY_DECL, null, false, ImmutableList.copyOf(elements));
  }

  public static TypedNode call(TypedNode callee, TypedNode... args) {
    return new TypedNode(
        TypedToken.CALL,
        null,
        false,
        ImmutableList.<TypedNode>builder().add(callee).add(args).build());
  }

  /** {@code target.method(args)} */
  public static TypedNode methodCall(TypedNode target, String method, TypedNode... args) {
    return call(field(target, method), args);
  }

  public static TypedNode field(TypedNode object, String name) {
    return new TypedNode(TypedToken.FIELD, name, false, ImmutableList.of(object));
  }

  public static TypedNode arrayAccess(TypedNode array, TypedNode index) {
    return new TypedNode(TypedToken.ARRAY_ACCESS, null, false, ImmutableList.of(array, index));
  }

  public static TypedNode returnNode() {
    return new TypedNode(TypedToken.RETURN, null, false, ImmutableList.of());
  }

  public static TypedNode returnNode(TypedNode value) {
    return new TypedNode(TypedToken.RETURN, null, false, ImmutableList.of(value));
  }

  public static TypedNode breakNode() {
    return new TypedNode(TypedToken.BREAK, null, false, ImmutableList.of());
  }

  public static TypedNode continueNode() {
    return new TypedNode(TypedToken.CONTINUE, null, false, ImmutableList.of());
  }

  private static void checkAssignable(TypedNode target) {
    checkArgument(
        target.getToken() == TypedToken.LOCAL
            || target.getToken() == TypedToken.FIELD
            || target.getToken() == TypedToken.ARRAY_ACCESS,
        "not assignable: %s",
        target);
  }
}
