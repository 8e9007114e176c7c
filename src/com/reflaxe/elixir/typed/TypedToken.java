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

/** The kinds of nodes in the typed imperative input AST. */
public enum TypedToken {
  LOCAL, // string: variable name
  INT, // string: literal text
  FLOAT, // string: literal text
  STRING, // string: literal value
  BOOL, // string: "true" or "false"
  NULL,

  VAR, // string: declared name; children: [] or [initializer]
  ASSIGN, // children: [target, value]
  ASSIGN_OP, // string: binary operator; children: [target, value]
  BINOP, // string: operator; children: [lhs, rhs]
  UNOP, // string: operator; postfix flag; children: [operand]

  BLOCK, // children: statements
  IF, // children: [condition, then] or [condition, then, else]
  WHILE, // children: [condition, body]
  DO_WHILE, // children: [condition, body]
  FOR_IN, // string: loop variable; children: [iterable, body]
  RANGE, // children: [start, end], end exclusive

  ARRAY_DECL, // children: elements
  CALL, // children: [callee, arguments...]
  FIELD, // string: field name; children: [object]
  ARRAY_ACCESS, // children: [array, index]

  RETURN, // children: [] or [value]
  BREAK,
  CONTINUE;

  boolean hasString() {
    switch (this) {
      case LOCAL:
      case INT:
      case FLOAT:
      case STRING:
      case BOOL:
      case VAR:
      case ASSIGN_OP:
      case BINOP:
      case UNOP:
      case FOR_IN:
      case FIELD:
        return true;
      default:
        return false;
    }
  }
}
