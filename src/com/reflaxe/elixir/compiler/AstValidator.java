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

import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.ast.Token;

/**
 * This class walks the AST and validates that the structure is correct.
 *
 * <p>The {@code IR} factories reject most malformed trees, but {@code withChildren} copies do not
 * know the shape of their token; passes that rebuild children can break it.
 */
public final class AstValidator {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;

  public AstValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  public AstValidator() {
    this(
        (message, n) -> {
          throw new IllegalStateException(message + ". Reference node:\n" + n.toStringTree());
        });
  }

  public void validate(Node n) {
    switch (n.getToken()) {
      case MODULE:
        for (Node child : n.getChildren()) {
          validateNotClause(child);
        }
        break;
      case DEF:
      case DEFP:
        validateChildCount(n, 1);
        validateToken(Token.CLAUSE, n.getFirstChild());
        break;
      case CLAUSE:
        validateChildCountBetween(n, 1, 2);
        break;
      case BLOCK:
        for (Node child : n.getChildren()) {
          validateNotClause(child);
          if (child.isDefinition()) {
            violation("Definitions cannot appear in a block", child);
          }
        }
        break;
      case MATCH:
        validateChildCount(n, 1);
        if (n.getPatterns().size() != 1) {
          violation("Match must have exactly one pattern", n);
        }
        break;
      case GENERATOR:
        validateChildCount(n, 1);
        if (n.getPatterns().size() != 1) {
          violation("Generator must have exactly one pattern", n);
        }
        break;
      case IF:
        validateChildCountBetween(n, 2, 3);
        break;
      case CASE:
        validateMinimumChildCount(n, 1);
        for (int i = 1; i < n.getChildCount(); i++) {
          validateToken(Token.CLAUSE, n.getChildAt(i));
        }
        break;
      case FN:
        validateMinimumChildCount(n, 1);
        // fall through
      case RECEIVE:
        for (Node child : n.getChildren()) {
          validateToken(Token.CLAUSE, child);
        }
        break;
      case TRY:
        validateMinimumChildCount(n, 1);
        for (int i = 1; i < n.getChildCount(); i++) {
          validateToken(Token.CLAUSE, n.getChildAt(i));
        }
        break;
      case WITH:
      case FOR:
        validateMinimumChildCount(n, 2);
        validateToken(Token.GENERATOR, n.getFirstChild());
        break;
      case FILTER:
      case UNARY_OP:
      case ACCESS:
        validateChildCount(n, 1);
        break;
      case BINARY_OP:
      case PAIR:
      case INDEX:
        validateChildCount(n, 2);
        break;
      case RANGE:
        validateChildCountBetween(n, 2, 3);
        break;
      case REMOTE_CALL:
      case APPLY:
        validateMinimumChildCount(n, 1);
        break;
      case MAP:
      case STRUCT:
        for (Node child : n.getChildren()) {
          validateToken(Token.PAIR, child);
        }
        break;
      case NAME:
      case ATOM:
      case STRING:
      case NUMBER:
      case TRUE:
      case FALSE:
      case NIL:
      case RAW:
      case MODULE_REF:
      case LOOP:
        validateChildCount(n, 0);
        break;
      case CALL:
      case LIST:
      case TUPLE:
        break;
    }
    for (Node child : n.getChildren()) {
      validate(child);
    }
  }

  private void validateNotClause(Node n) {
    if (n.isClause()) {
      violation("Clause outside of a clause-holding node", n);
    }
  }

  private void validateToken(Token token, Node n) {
    if (n.getToken() != token) {
      violation("Expected " + token + " but was " + n.getToken(), n);
    }
  }

  private void validateChildCount(Node n, int count) {
    if (n.getChildCount() != count) {
      violation("Expected " + count + " children, but was " + n.getChildCount(), n);
    }
  }

  private void validateChildCountBetween(Node n, int min, int max) {
    if (n.getChildCount() < min || n.getChildCount() > max) {
      violation(
          "Expected " + min + " to " + max + " children, but was " + n.getChildCount(), n);
    }
  }

  private void validateMinimumChildCount(Node n, int min) {
    if (n.getChildCount() < min) {
      violation("Expected at least " + min + " children, but was " + n.getChildCount(), n);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }
}
