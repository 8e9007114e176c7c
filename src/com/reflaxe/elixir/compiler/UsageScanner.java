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

import com.google.common.collect.ImmutableSet;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.ast.Pattern;
import com.reflaxe.elixir.ast.Token;
import com.reflaxe.elixir.compiler.NodeUtil.IdentifierSpan;
import com.reflaxe.elixir.typed.TypedNode;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The traversal behind every variable-usage query.
 *
 * <p>Collects the names a subtree <em>reads</em>. Names bound by a pattern are not reads; a name
 * read under a binder that rebinds it refers to the inner binding and is not reported.
 */
final class UsageScanner {

  /** How bindings made by statements of a block affect the statements after them. */
  enum ScopeMode {
    /**
     * Block statements do not shadow later statements, so {@code x = 1; f(x)} reports {@code x}.
     * Only pattern binders of clauses, generators and function parameters shadow. Use queries
     * asking whether an outer binding may be read.
     */
    CONSERVATIVE,
    /**
     * Block statements shadow later statements as well. Use when computing the free variables of
     * a closure.
     */
    LEXICAL
  }

  /** The set of names bound between the query root and the node being scanned. */
  private static final class Scope {
    static final Scope EMPTY = new Scope(ImmutableSet.of());

    final ImmutableSet<String> shadowed;

    Scope(ImmutableSet<String> shadowed) {
      this.shadowed = shadowed;
    }

    Scope plus(Collection<String> names) {
      if (names.isEmpty() || shadowed.containsAll(names)) {
        return this;
      }
      return new Scope(ImmutableSet.<String>builder().addAll(shadowed).addAll(names).build());
    }

    boolean contains(String name) {
      return shadowed.contains(name);
    }
  }

  private final ScopeMode mode;
  private final Set<String> referenced = new LinkedHashSet<>();

  private UsageScanner(ScopeMode mode) {
    this.mode = mode;
  }

  /** Returns the names read by {@code n}, in first-read order. */
  static ImmutableSet<String> referencedNames(@Nullable Node n, ScopeMode mode) {
    if (n == null) {
      return ImmutableSet.of();
    }
    UsageScanner scanner = new UsageScanner(mode);
    scanner.scan(n, Scope.EMPTY);
    return ImmutableSet.copyOf(scanner.referenced);
  }

  /** Scans {@code n} and returns the scope that applies to the statements following it. */
  private Scope scan(Node n, Scope scope) {
    return switch (n.getToken()) {
      case MODULE,
          DEF,
          DEFP,
          BINARY_OP,
          UNARY_OP,
          IF,
          CASE,
          FILTER,
          FN,
          TRY,
          RECEIVE,
          CALL,
          REMOTE_CALL,
          APPLY,
          ACCESS,
          INDEX,
          LIST,
          TUPLE,
          MAP,
          STRUCT,
          PAIR,
          RANGE -> scanChildren(n.getChildren(), scope);
      case CLAUSE -> scanClause(n, scope);
      case BLOCK -> scanBlock(n, scope);
      case MATCH -> scanMatch(n, scope);
      case WITH, FOR -> scanQualifiers(n, scope);
      case GENERATOR -> scanGenerator(n, scope);
      case NAME -> use(n.getString(), scope);
      case STRING -> useAll(NodeUtil.findInterpolatedIdentifiers(n.getString()), scope);
      case RAW -> useAll(NodeUtil.findIdentifiers(n.getString()), scope);
      case ATOM, NUMBER, TRUE, FALSE, NIL, MODULE_REF -> scope;
      case LOOP -> scanTypedLoop(n.getTypedLoop(), scope);
    };
  }

  private Scope scanChildren(List<Node> children, Scope scope) {
    for (Node child : children) {
      scan(child, scope);
    }
    return scope;
  }

  private Scope scanClause(Node clause, Scope scope) {
    List<Pattern> patterns = clause.getPatterns();
    scanPatternUses(patterns, scope);
    scanChildren(clause.getChildren(), scope.plus(NodeUtil.getPatternBinders(patterns)));
    return scope;
  }

  private Scope scanBlock(Node block, Scope scope) {
    Scope current = scope;
    for (Node stmt : block.getChildren()) {
      Scope next = scan(stmt, current);
      if (mode == ScopeMode.LEXICAL) {
        current = next;
      }
    }
    return current;
  }

  private Scope scanMatch(Node match, Scope scope) {
    scan(match.getFirstChild(), scope);
    scanPatternUses(match.getPatterns(), scope);
    if (mode == ScopeMode.LEXICAL) {
      return scope.plus(NodeUtil.getPatternBinders(match.getPatterns()));
    }
    return scope;
  }

  /**
   * Generators bind for the qualifiers and body after them; {@code else} clauses of a {@code with}
   * see none of those bindings.
   */
  private Scope scanQualifiers(Node n, Scope scope) {
    Scope current = scope;
    for (Node child : n.getChildren()) {
      if (child.getToken() == Token.GENERATOR) {
        current = scanGenerator(child, current);
      } else if (child.isClause()) {
        scan(child, scope);
      } else {
        scan(child, current);
      }
    }
    return scope;
  }

  private Scope scanGenerator(Node generator, Scope scope) {
    scan(generator.getFirstChild(), scope);
    scanPatternUses(generator.getPatterns(), scope);
    return scope.plus(NodeUtil.getPatternBinders(generator.getPatterns()));
  }

  private void scanPatternUses(List<Pattern> patterns, Scope scope) {
    for (Pattern pattern : patterns) {
      for (String name : NodeUtil.getPatternUses(pattern)) {
        use(name, scope);
      }
    }
  }

  private Scope scanTypedLoop(TypedNode n, Scope scope) {
    if (n.isLocal()) {
      use(n.getString(), scope);
    }
    for (TypedNode child : n.getChildren()) {
      scanTypedLoop(child, scope);
    }
    return scope;
  }

  private Scope useAll(List<IdentifierSpan> spans, Scope scope) {
    for (IdentifierSpan span : spans) {
      use(span.name(), scope);
    }
    return scope;
  }

  private Scope use(String name, Scope scope) {
    if (!NameVariants.isIgnored(name) && !scope.contains(name)) {
      referenced.add(name);
    }
    return scope;
  }
}
