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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.reflaxe.elixir.ast.IR;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.ast.Pattern;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * Renames a binder {@code _x} that is read afterwards as {@code _x} back to {@code x}, together
 * with its reads. Elixir warns about underscored variables that are used. The rename is skipped
 * when {@code x} is already read or bound in the same scope.
 */
final class RestoreUsedUnderscoreBinders extends NodeTraversal.AbstractPostOrderCallback
    implements RewritePass {

  @Override
  public Node process(Node root) {
    return NodeTraversal.traverse(root, this);
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isBlock()) {
      return restoreInBlock(n);
    }
    if (n.isClause()) {
      return restoreInClause(n);
    }
    return n;
  }

  private static Node restoreInBlock(Node block) {
    List<Node> stmts = new ArrayList<>(block.getChildren());
    for (int i = 0; i < stmts.size(); i++) {
      Node stmt = stmts.get(i);
      if (!stmt.isMatch()) {
        continue;
      }
      for (String binder : NodeUtil.getPatternBinders(stmt.getPatterns())) {
        Node rest = IR.block(stmts.subList(i + 1, stmts.size()));
        String restored = restoredName(binder, stmt.getPatterns(), ImmutableList.of(rest));
        if (restored == null) {
          continue;
        }
        UnaryOperator<String> rename = name -> name.equals(binder) ? restored : name;
        stmt = stmt.withPatterns(renameBinders(stmt.getPatterns(), rename));
        for (int j = i + 1; j < stmts.size(); j++) {
          stmts.set(j, NodeUtil.renameVariables(stmts.get(j), rename));
        }
      }
      stmts.set(i, stmt);
    }
    return block.withChildren(stmts);
  }

  private static Node restoreInClause(Node clause) {
    Node result = clause;
    for (String binder : NodeUtil.getPatternBinders(clause.getPatterns())) {
      String restored = restoredName(binder, result.getPatterns(), result.getChildren());
      if (restored == null) {
        continue;
      }
      UnaryOperator<String> rename = name -> name.equals(binder) ? restored : name;
      ImmutableList.Builder<Node> children = ImmutableList.builder();
      for (Node child : result.getChildren()) {
        children.add(NodeUtil.renameVariables(child, rename));
      }
      result =
          result
              .withPatterns(renameBinders(result.getPatterns(), rename))
              .withChildren(children.build());
    }
    return result;
  }

  /**
   * Returns the name {@code binder} should be restored to, or null if it should stay: it is not
   * underscored, its scope does not read it, or the plain name is already in use there.
   */
  private static @Nullable String restoredName(
      String binder, List<Pattern> patterns, List<Node> scope) {
    if (!binder.startsWith("_") || binder.length() < 2) {
      return null;
    }
    String plain = binder.substring(1);
    if (plain.startsWith("_") || NodeUtil.getPatternBinders(patterns).contains(plain)) {
      return null;
    }
    boolean read = false;
    for (Node n : scope) {
      ImmutableSet<String> names = VariableUsageAnalyzer.referencedNames(n);
      if (names.contains(plain) || NodeUtil.getAllBinders(n).contains(plain)) {
        return null;
      }
      read |= names.contains(binder);
    }
    return read ? plain : null;
  }

  private static ImmutableList<Pattern> renameBinders(
      List<Pattern> patterns, UnaryOperator<String> rename) {
    ImmutableList.Builder<Pattern> result = ImmutableList.builder();
    for (Pattern pattern : patterns) {
      result.add(NodeUtil.renameBinders(pattern, rename));
    }
    return result.build();
  }
}
