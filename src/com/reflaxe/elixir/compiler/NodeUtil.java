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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.reflaxe.elixir.ast.IR;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.ast.Pattern;
import com.reflaxe.elixir.ast.PatternToken;
import com.reflaxe.elixir.ast.Token;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  // Utility class; do not instantiate.
  private NodeUtil() {}

  /** An identifier occurrence inside pass-through code or an interpolated string. */
  record IdentifierSpan(int start, int end, String name) {}

  /** Returns the body of a CLAUSE. */
  public static Node getClauseBody(Node clause) {
    checkArgument(clause.isClause(), clause);
    return clause.getLastChild();
  }

  /** Returns the guard of a CLAUSE, or null if it has none. */
  public static @Nullable Node getClauseGuard(Node clause) {
    checkArgument(clause.isClause(), clause);
    return clause.getChildCount() == 2 ? clause.getFirstChild() : null;
  }

  /** Returns a copy of the CLAUSE with its body replaced. */
  public static Node withClauseBody(Node clause, Node body) {
    checkArgument(clause.isClause(), clause);
    return clause.withChildAt(clause.getChildCount() - 1, body);
  }

  /** Returns the statements of a BLOCK, or the node itself as a one-statement list. */
  public static ImmutableList<Node> statements(Node n) {
    return n.isBlock() ? n.getChildren() : ImmutableList.of(n);
  }

  /** Wraps statements in a BLOCK unless there is exactly one, which is returned as is. */
  public static Node toBody(List<Node> stmts) {
    if (stmts.size() == 1 && !stmts.get(0).isBlock()) {
      return stmts.get(0);
    }
    return IR.block(stmts);
  }

  /**
   * Returns the block with its statements replaced. A block that shrinks to a single statement is
   * replaced by that statement.
   */
  static Node withStatements(Node block, List<Node> stmts) {
    checkArgument(block.isBlock(), block);
    if (stmts.size() == 1 && block.getChildCount() > 1) {
      return stmts.get(0);
    }
    return block.withChildren(stmts);
  }

  /** Whether the node is a MATCH that binds exactly the single name. */
  public static boolean isSimpleBinding(Node n) {
    return n.isMatch() && n.getOnlyPattern().isBind();
  }

  /** Returns the bound name of a simple binding. */
  public static String getBoundName(Node match) {
    checkArgument(isSimpleBinding(match), match);
    return match.getOnlyPattern().getString();
  }

  /** Returns the right-hand side of a MATCH. */
  public static Node getMatchValue(Node match) {
    checkArgument(match.isMatch(), match);
    return match.getFirstChild();
  }

  /** Returns the names a pattern binds, in source order. Pins are uses, not binders. */
  public static ImmutableSet<String> getPatternBinders(Pattern pattern) {
    Set<String> out = new LinkedHashSet<>();
    collectBinders(pattern, out);
    return ImmutableSet.copyOf(out);
  }

  /** Returns the names bound by all the patterns, in source order. */
  public static ImmutableSet<String> getPatternBinders(List<Pattern> patterns) {
    Set<String> out = new LinkedHashSet<>();
    for (Pattern pattern : patterns) {
      collectBinders(pattern, out);
    }
    return ImmutableSet.copyOf(out);
  }

  private static void collectBinders(Pattern pattern, Set<String> out) {
    switch (pattern.getToken()) {
      case BIND:
      case ALIAS:
        out.add(pattern.getString());
        break;
      default:
        break;
    }
    for (Pattern child : pattern.getChildren()) {
      collectBinders(child, out);
    }
  }

  /**
   * Returns the names a pattern reads: pinned names and identifiers in binary segment size
   * specifications such as {@code size(len)}.
   */
  public static ImmutableSet<String> getPatternUses(Pattern pattern) {
    Set<String> out = new LinkedHashSet<>();
    collectUses(pattern, out);
    return ImmutableSet.copyOf(out);
  }

  private static void collectUses(Pattern pattern, Set<String> out) {
    if (pattern.getToken() == PatternToken.PIN) {
      out.add(pattern.getString());
    } else if (pattern.getToken() == PatternToken.BINARY_SEGMENT) {
      for (IdentifierSpan span : findIdentifiers(pattern.getString())) {
        out.add(span.name());
      }
    }
    for (Pattern child : pattern.getChildren()) {
      collectUses(child, out);
    }
  }

  /**
   * Applies {@code rename} to every binder of the pattern. Pins are left alone; they refer to a
   * binding made elsewhere.
   */
  public static Pattern renameBinders(Pattern pattern, UnaryOperator<String> rename) {
    Pattern result = pattern;
    if (pattern.isBind() || pattern.getToken() == PatternToken.ALIAS) {
      String newName = rename.apply(pattern.getString());
      if (newName.equals("_")) {
        if (pattern.isBind()) {
          return Pattern.wildcard();
        }
        return renameChildren(pattern, rename).getFirstChild();
      }
      result = pattern.withString(newName);
    }
    return renameChildren(result, rename);
  }

  private static Pattern renameChildren(Pattern pattern, UnaryOperator<String> rename) {
    if (pattern.getChildren().isEmpty()) {
      return pattern;
    }
    ImmutableList.Builder<Pattern> children = ImmutableList.builder();
    for (Pattern child : pattern.getChildren()) {
      children.add(renameBinders(child, rename));
    }
    return pattern.withChildren(children.build());
  }

  /** Applies {@code rename} to the names pinned in the pattern. */
  public static Pattern renamePins(Pattern pattern, UnaryOperator<String> rename) {
    Pattern result = pattern;
    if (pattern.getToken() == PatternToken.PIN) {
      result = pattern.withString(rename.apply(pattern.getString()));
    } else if (pattern.getToken() == PatternToken.BINARY_SEGMENT) {
      result = pattern.withString(renameIdentifiers(pattern.getString(), rename));
    }
    if (result.getChildren().isEmpty()) {
      return result;
    }
    ImmutableList.Builder<Pattern> children = ImmutableList.builder();
    for (Pattern child : result.getChildren()) {
      children.add(renamePins(child, rename));
    }
    return result.withChildren(children.build());
  }

  /**
   * Finds the variable-like identifiers in a fragment of pass-through code. Identifiers that start
   * with an upper-case letter or a digit are module aliases or numbers, and identifiers directly
   * preceded by {@code .}, {@code :} or {@code @} are fields, atoms or module attributes; neither
   * is reported.
   */
  static ImmutableList<IdentifierSpan> findIdentifiers(String code) {
    return findIdentifiers(code, 0, code.length());
  }

  private static ImmutableList<IdentifierSpan> findIdentifiers(String code, int from, int to) {
    ImmutableList.Builder<IdentifierSpan> spans = ImmutableList.builder();
    int i = from;
    while (i < to) {
      char c = code.charAt(i);
      if (!isWordChar(c)) {
        i++;
        continue;
      }
      int start = i;
      while (i < to && isWordChar(code.charAt(i))) {
        i++;
      }
      if (i < to && (code.charAt(i) == '?' || code.charAt(i) == '!')) {
        i++;
      }
      char first = code.charAt(start);
      boolean excludedPrefix = false;
      if (start > 0) {
        char prev = code.charAt(start - 1);
        excludedPrefix = prev == '.' || prev == ':' || prev == '@';
      }
      String word = code.substring(start, i);
      if (!excludedPrefix
          && (first == '_' || Character.isLowerCase(first))
          && !NameVariants.isIgnored(word)) {
        spans.add(new IdentifierSpan(start, i, word));
      }
    }
    return spans.build();
  }

  /** Finds the identifiers inside the {@code #{...}} interpolation spans of a string literal. */
  static ImmutableList<IdentifierSpan> findInterpolatedIdentifiers(String str) {
    ImmutableList.Builder<IdentifierSpan> spans = ImmutableList.builder();
    int i = 0;
    while (i < str.length() - 1) {
      if (str.charAt(i) == '#'
          && str.charAt(i + 1) == '{'
          && (i == 0 || str.charAt(i - 1) != '\\')) {
        int open = i + 2;
        int close = findClosingBrace(str, open);
        spans.addAll(findIdentifiers(str, open, close));
        i = close;
      } else {
        i++;
      }
    }
    return spans.build();
  }

  /** Whether the string literal contains an interpolation span. */
  static boolean hasInterpolation(String str) {
    return str.contains("#{");
  }

  private static int findClosingBrace(String str, int open) {
    int depth = 1;
    for (int i = open; i < str.length(); i++) {
      char c = str.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return str.length();
  }

  private static boolean isWordChar(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }

  /** Renames the identifiers of a fragment of pass-through code. */
  static String renameIdentifiers(String code, UnaryOperator<String> rename) {
    return applyRenames(code, findIdentifiers(code), rename);
  }

  /** Renames the identifiers inside the interpolation spans of a string literal. */
  static String renameInterpolatedIdentifiers(String str, UnaryOperator<String> rename) {
    return applyRenames(str, findInterpolatedIdentifiers(str), rename);
  }

  private static String applyRenames(
      String text, List<IdentifierSpan> spans, UnaryOperator<String> rename) {
    StringBuilder sb = null;
    int copied = 0;
    for (IdentifierSpan span : spans) {
      String newName = rename.apply(span.name());
      if (newName.equals(span.name())) {
        continue;
      }
      if (sb == null) {
        sb = new StringBuilder(text.length() + 8);
      }
      sb.append(text, copied, span.start()).append(newName);
      copied = span.end();
    }
    if (sb == null) {
      return text;
    }
    return sb.append(text, copied, text.length()).toString();
  }

  /** Returns a rename function that maps the keys of {@code renames} and leaves other names. */
  static UnaryOperator<String> renamer(Map<String, String> renames) {
    return name -> renames.getOrDefault(name, name);
  }

  /**
   * Renames every binder, pin and read of a variable in the subtree, including identifiers in
   * pass-through code and interpolation spans. Scopes are not considered: every occurrence of a
   * name is renamed alike.
   */
  public static Node renameVariables(Node root, UnaryOperator<String> rename) {
    return NodeTraversal.traversePostOrder(root, (t, n, parent) -> renameVariablesIn(n, rename));
  }

  private static Node renameVariablesIn(Node n, UnaryOperator<String> rename) {
    switch (n.getToken()) {
      case NAME:
        return n.withString(rename.apply(n.getString()));
      case RAW:
        return n.withString(renameIdentifiers(n.getString(), rename));
      case STRING:
        return n.withString(renameInterpolatedIdentifiers(n.getString(), rename));
      default:
        break;
    }
    if (n.getPatterns().isEmpty()) {
      return n;
    }
    ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
    for (Pattern pattern : n.getPatterns()) {
      patterns.add(renamePins(renameBinders(pattern, rename), rename));
    }
    return n.withPatterns(patterns.build());
  }

  /** Returns every name bound by a pattern anywhere in the subtree. */
  public static ImmutableSet<String> getAllBinders(Node root) {
    Set<String> out = new LinkedHashSet<>();
    collectAllBinders(root, out);
    return ImmutableSet.copyOf(out);
  }

  private static void collectAllBinders(Node n, Set<String> out) {
    for (Pattern pattern : n.getPatterns()) {
      collectBinders(pattern, out);
    }
    for (Node child : n.getChildren()) {
      collectAllBinders(child, out);
    }
  }

  /** Returns how many times {@code name} is bound across the patterns. */
  static int countBindings(List<Pattern> patterns, String name) {
    int count = 0;
    for (Pattern pattern : patterns) {
      count += countBindings(pattern, name);
    }
    return count;
  }

  private static int countBindings(Pattern pattern, String name) {
    int count =
        (pattern.isBind() || pattern.getToken() == PatternToken.ALIAS)
                && pattern.getString().equals(name)
            ? 1
            : 0;
    for (Pattern child : pattern.getChildren()) {
      count += countBindings(child, name);
    }
    return count;
  }

  /** Whether the subtree contains a LOOP node. */
  static boolean containsLoop(Node n) {
    if (n.isLoop()) {
      return true;
    }
    for (Node child : n.getChildren()) {
      if (containsLoop(child)) {
        return true;
      }
    }
    return false;
  }

  /** Whether {@code n} is {@code Module.function(...)} for some function of the module. */
  static boolean isRemoteCallOn(Node n, String module) {
    return n.isRemoteCall()
        && n.getFirstChild().getToken() == Token.MODULE_REF
        && n.getFirstChild().getString().equals(module);
  }

  /** Whether {@code n} is the empty list literal. */
  static boolean isEmptyList(Node n) {
    return n.isList() && !n.hasChildren();
  }

  /** Whether {@code n} is the string literal {@code ""}. */
  static boolean isEmptyString(Node n) {
    return n.isString() && n.getString().isEmpty();
  }

  /** Whether {@code n} is a comparison whose negation can be written with {@code not}. */
  static boolean isComparison(Node n) {
    if (n.getToken() != Token.BINARY_OP) {
      return false;
    }
    switch (n.getString()) {
      case "==":
      case "!=":
      case "===":
      case "!==":
      case "<":
      case "<=":
      case ">":
      case ">=":
        return true;
      default:
        return false;
    }
  }
}
