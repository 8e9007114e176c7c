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

/**
 * The kinds of expression nodes in the target AST.
 *
 * <p>The comment next to each token describes the string payload, the patterns and the children
 * the node carries. Patterns are only ever held by {@code MATCH}, {@code CLAUSE} and
 * {@code GENERATOR}; no other token binds names.
 */
public enum Token {
  MODULE, // string: module name; children: definitions and attributes
  DEF, // string: function name; children: [CLAUSE]
  DEFP, // string: function name; children: [CLAUSE]
  CLAUSE, // patterns: parameters or case pattern; children: [body] or [guard, body]
  BLOCK, // children: statements

  MATCH, // patterns: [lhs]; children: [rhs]
  NAME, // string: variable name
  ATOM, // string: atom text without the leading colon
  STRING, // string: literal text, may contain #{...} interpolation spans
  NUMBER, // string: literal text
  TRUE,
  FALSE,
  NIL,
  RAW, // string: pass-through code
  MODULE_REF, // string: module alias such as Enum

  BINARY_OP, // string: operator; children: [lhs, rhs]
  UNARY_OP, // string: operator; children: [operand]

  IF, // children: [condition, then] or [condition, then, else]
  CASE, // children: [subject, CLAUSE...]
  WITH, // children: [GENERATOR..., body, CLAUSE... (else clauses)]
  FOR, // children: [GENERATOR | FILTER..., body]
  GENERATOR, // patterns: [lhs]; children: [enumerable]
  FILTER, // children: [condition]
  FN, // children: CLAUSE...
  TRY, // children: [body, CLAUSE... (rescue clauses)]
  RECEIVE, // children: CLAUSE...

  CALL, // string: local function name; children: arguments
  REMOTE_CALL, // string: function name; children: [target, arguments...]
  APPLY, // children: [function, arguments...]
  ACCESS, // string: field name; children: [target]
  INDEX, // children: [target, key]

  LIST, // children: elements
  TUPLE, // children: elements
  MAP, // children: PAIR...
  STRUCT, // string: module name; children: PAIR...
  PAIR, // children: [key, value]
  RANGE, // children: [first, last] or [first, last, step]

  LOOP; // typed payload: an imperative loop awaiting lowering

  /** Whether nodes of this kind carry a string payload. */
  public boolean hasString() {
    switch (this) {
      case MODULE:
      case DEF:
      case DEFP:
      case NAME:
      case ATOM:
      case STRING:
      case NUMBER:
      case RAW:
      case MODULE_REF:
      case BINARY_OP:
      case UNARY_OP:
      case CALL:
      case REMOTE_CALL:
      case ACCESS:
      case STRUCT:
        return true;
      default:
        return false;
    }
  }

  /** Whether nodes of this kind hold patterns. */
  public boolean hasPatterns() {
    return this == MATCH || this == CLAUSE || this == GENERATOR;
  }
}
