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
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.ast.Pattern;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * Prefixes an underscore to the variables bound by a match or a case-like clause that nothing
 * reads afterwards.
 *
 * <p>Only bodies whose bindings cannot escape are examined: clause bodies, the branches of an
 * {@code if}, the body of a {@code try} and the root. Variants of a name count as uses, so a
 * binding read under another spelling is left alone. Parameters of functions are handled by
 * {@link UnderscoreUnusedParameters}.
 */
final class UnderscoreUnusedBindings extends NodeTraversal.AbstractPostOrderCallback
    implements RewritePass {

  @Override
  public Node process(Node root) {
    return processBody(NodeTraversal.traverse(root, this));
  }

  @Override
  public Node visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case CLAUSE:
        Node clause = NodeUtil.withClauseBody(n, processBody(NodeUtil.getClauseBody(n)));
        if (parent != null && (parent.isDefinition() || parent.isFn())) {
          return clause;
        }
        return clause.withPatterns(
            underscoreUnused(clause.getPatterns(), usedInClause(clause)));
      case IF:
        Node result = n;
        for (int i = 1; i < n.getChildCount(); i++) {
          result = result.withChildAt(i, processBody(n.getChildAt(i)));
        }
        return result;
      case TRY:
        return n.withChildAt(0, processBody(n.getFirstChild()));
      default:
        return n;
    }
  }

  private static Node processBody(Node body) {
    if (body.isMatch()) {
      return body.withPatterns(underscoreUnused(body.getPatterns(), name -> false));
    }
    if (!body.isBlock()) {
      return body;
    }
    List<Node> stmts = new ArrayList<>(body.getChildren());
    UsageSuffixIndex index = UsageSuffixIndex.build(stmts);
    for (int i = 0; i < stmts.size(); i++) {
      Node stmt = stmts.get(i);
      if (stmt.isMatch()) {
        int next = i + 1;
        Predicate<String> isUsed = name -> index.usedLater(next, name);
        stmts.set(i, stmt.withPatterns(underscoreUnused(stmt.getPatterns(), isUsed)));
      }
    }
    return body.withChildren(stmts);
  }

  /** Returns whether a name is read by the guard or body of the clause, under any spelling. */
  static Predicate<String> usedInClause(Node clause) {
    ImmutableSet.Builder<String> keys = ImmutableSet.builder();
    for (Node child : clause.getChildren()) {
      for (String name : VariableUsageAnalyzer.referencedNames(child)) {
        keys.add(NameVariants.canonicalKey(name));
      }
    }
    ImmutableSet<String> used = keys.build();
    return name -> used.contains(NameVariants.canonicalKey(name));
  }

  /**
   * Prefixes an underscore to the binders of the patterns that {@code isUsed} rejects. Binders
   * bound twice in the patterns, or read by the patterns themselves, are kept.
   */
  static ImmutableList<Pattern> underscoreUnused(List<Pattern> patterns, Predicate<String> isUsed) {
    ImmutableSet.Builder<String> patternUses = ImmutableSet.builder();
    for (Pattern pattern : patterns) {
      patternUses.addAll(NodeUtil.getPatternUses(pattern));
    }
    ImmutableSet<String> readByPatterns = patternUses.build();
    ImmutableList.Builder<Pattern> result = ImmutableList.builder();
    for (Pattern pattern : patterns) {
      result.add(
          NodeUtil.renameBinders(
              pattern,
              name ->
                  name.startsWith("_")
                          || readByPatterns.contains(name)
                          || NodeUtil.countBindings(patterns, name) > 1
                          || isUsed.test(name)
                      ? name
                      : NameVariants.underscored(name)));
    }
    return result.build();
  }
}
