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
import com.reflaxe.elixir.typed.TypedNode;
import com.reflaxe.elixir.typed.TypedToken;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Queries over input-AST loop bodies. */
final class TypedNodes {

  private TypedNodes() {}

  /** Whether a {@code return} appears anywhere in the statements, nested loops included. */
  static boolean containsReturn(List<TypedNode> stmts) {
    for (TypedNode stmt : stmts) {
      if (containsToken(stmt, TypedToken.RETURN, true)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether a {@code break} or {@code continue} of the current loop appears in the statements.
   * Signals inside nested loops belong to those loops.
   */
  static boolean containsSignal(List<TypedNode> stmts) {
    for (TypedNode stmt : stmts) {
      if (containsToken(stmt, TypedToken.BREAK, false)
          || containsToken(stmt, TypedToken.CONTINUE, false)) {
        return true;
      }
    }
    return false;
  }

  static boolean containsSignal(TypedNode stmt) {
    return containsSignal(ImmutableList.of(stmt));
  }

  /** Whether a {@code continue} of the current loop appears in the statements. */
  static boolean containsContinue(List<TypedNode> stmts) {
    for (TypedNode stmt : stmts) {
      if (containsToken(stmt, TypedToken.CONTINUE, false)) {
        return true;
      }
    }
    return false;
  }

  private static boolean containsToken(TypedNode n, TypedToken token, boolean enterLoops) {
    if (n.getToken() == token) {
      return true;
    }
    if (n.isLoop() && !enterLoops) {
      return false;
    }
    for (TypedNode child : n.getChildren()) {
      if (containsToken(child, token, enterLoops)) {
        return true;
      }
    }
    return false;
  }

  /** Whether {@code n} reads or writes the local {@code name}. */
  static boolean references(TypedNode n, String name) {
    if (n.isLocal(name)) {
      return true;
    }
    for (TypedNode child : n.getChildren()) {
      if (references(child, name)) {
        return true;
      }
    }
    return false;
  }

  static boolean references(List<TypedNode> stmts, String name) {
    for (TypedNode stmt : stmts) {
      if (references(stmt, name)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the list {@code stmt} pushes to when it is {@code list.push(value)}, or null. */
  static @Nullable String getPushTarget(TypedNode stmt) {
    if (stmt.getToken() != TypedToken.CALL || stmt.getChildCount() != 2) {
      return null;
    }
    TypedNode callee = stmt.getFirstChild();
    if (callee.getToken() != TypedToken.FIELD
        || !callee.getString().equals("push")
        || !callee.getFirstChild().isLocal()) {
      return null;
    }
    return callee.getFirstChild().getString();
  }

  /** Returns the pushed value of a statement recognized by {@link #getPushTarget}. */
  static TypedNode getPushValue(TypedNode stmt) {
    return stmt.getChildAt(1);
  }

  /** Returns the names declared with {@code var} anywhere in the statements. */
  static ImmutableSet<String> declaredNames(List<TypedNode> stmts) {
    Set<String> out = new LinkedHashSet<>();
    for (TypedNode stmt : stmts) {
      collectDeclared(stmt, out);
    }
    return ImmutableSet.copyOf(out);
  }

  private static void collectDeclared(TypedNode n, Set<String> out) {
    if (n.getToken() == TypedToken.VAR) {
      out.add(n.getString());
    } else if (n.getToken() == TypedToken.FOR_IN) {
      out.add(n.getString());
    }
    for (TypedNode child : n.getChildren()) {
      collectDeclared(child, out);
    }
  }

  /**
   * Returns the locals the statements reassign or mutate, in first-write order. Assignment,
   * compound assignment, increment, decrement and {@code push} count as writes.
   */
  static ImmutableSet<String> assignedNames(List<TypedNode> stmts) {
    Set<String> out = new LinkedHashSet<>();
    for (TypedNode stmt : stmts) {
      collectAssigned(stmt, out);
    }
    return ImmutableSet.copyOf(out);
  }

  private static void collectAssigned(TypedNode n, Set<String> out) {
    @Nullable String target = getWriteTarget(n);
    if (target != null) {
      out.add(target);
    }
    for (TypedNode child : n.getChildren()) {
      collectAssigned(child, out);
    }
  }

  private static @Nullable String getWriteTarget(TypedNode n) {
    switch (n.getToken()) {
      case ASSIGN:
      case ASSIGN_OP:
        return n.getFirstChild().isLocal() ? n.getFirstChild().getString() : null;
      case UNOP:
        boolean step = n.getString().equals("++") || n.getString().equals("--");
        return step && n.getFirstChild().isLocal() ? n.getFirstChild().getString() : null;
      case CALL:
        return getPushTarget(n);
      default:
        return null;
    }
  }

  /**
   * Returns the outer variables a loop body writes: the written names minus the names the body
   * declares and the loop variable.
   */
  static ImmutableList<String> outerState(List<TypedNode> body, String... loopVariables) {
    Set<String> declared = new LinkedHashSet<>(declaredNames(body));
    declared.addAll(ImmutableList.copyOf(loopVariables));
    ImmutableList.Builder<String> state = ImmutableList.builder();
    for (String name : assignedNames(body)) {
      if (!declared.contains(name)) {
        state.add(name);
      }
    }
    return state.build();
  }

  /**
   * Returns the amount {@code stmt} increments the local {@code name} by, or 0 if it is not an
   * increment. Recognizes {@code i++}, {@code ++i}, {@code i += k} and {@code i = i + k} for a
   * positive literal {@code k}.
   */
  static long getIncrementStep(TypedNode stmt, String name) {
    switch (stmt.getToken()) {
      case UNOP:
        return stmt.getString().equals("++") && stmt.getFirstChild().isLocal(name) ? 1 : 0;
      case ASSIGN_OP:
        if (stmt.getString().equals("+")
            && stmt.getFirstChild().isLocal(name)
            && stmt.getChildAt(1).isInt()) {
          return Math.max(0, stmt.getChildAt(1).getIntValue());
        }
        return 0;
      case ASSIGN:
        if (!stmt.getFirstChild().isLocal(name)) {
          return 0;
        }
        TypedNode value = stmt.getChildAt(1);
        if (value.getToken() != TypedToken.BINOP || !value.getString().equals("+")) {
          return 0;
        }
        TypedNode lhs = value.getFirstChild();
        TypedNode rhs = value.getChildAt(1);
        if (lhs.isLocal(name) && rhs.isInt()) {
          return Math.max(0, rhs.getIntValue());
        }
        if (rhs.isLocal(name) && lhs.isInt()) {
          return Math.max(0, lhs.getIntValue());
        }
        return 0;
      default:
        return 0;
    }
  }
}
