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

/** The kinds of pattern nodes in the target AST. */
public enum PatternToken {
  BIND, // string: bound name
  WILDCARD,
  LITERAL, // literal: the matched expression
  TUPLE, // children: elements
  LIST, // children: elements
  CONS, // children: [head, tail]
  MAP, // children: MAP_ENTRY...
  MAP_ENTRY, // literal: key expression; children: [value]
  STRUCT, // string: module name; children: MAP_ENTRY...
  PIN, // string: referenced name
  ALIAS, // string: bound name; children: [aliased pattern]
  BINARY, // children: BINARY_SEGMENT...
  BINARY_SEGMENT; // string: segment spec, may be empty; children: [value]

  /** Whether patterns of this kind carry a string payload. */
  public boolean hasString() {
    return this == BIND || this == STRUCT || this == PIN || this == ALIAS || this == BINARY_SEGMENT;
  }
}
