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

/**
 * Interface for classes that rewrite the target AST.
 *
 * <p>Class has single function "process", which is passed the root node of the tree and returns
 * the root of the rewritten tree. Trees are immutable; a pass that finds nothing to change returns
 * its input.
 */
@FunctionalInterface
public interface RewritePass {

  /**
   * Rewrite the tree with root node root.
   *
   * @param root Top of the tree
   * @return the rewritten tree
   */
  Node process(Node root);
}
