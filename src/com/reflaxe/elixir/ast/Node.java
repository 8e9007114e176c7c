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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.typed.TypedNode;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node of the target AST.
 *
 * <p>Nodes are immutable and own their children outright. Rewrites produce new nodes through the
 * {@code with*} methods, so a tree handed to a pass is never changed by it. Equality is
 * structural.
 */
public final class Node {

  private final Token token;
  private final @Nullable String str;
  private final ImmutableList<Pattern> patterns;
  private final ImmutableList<Node> children;
  private final @Nullable TypedNode typedLoop;

  // Lazily computed structural hash; 0 means not yet computed.
  private int hash;

  Node(
      Token token,
      @Nullable String str,
      ImmutableList<Pattern> patterns,
      ImmutableList<Node> children,
      @Nullable TypedNode typedLoop) {
    checkArgument(token.hasString() == (str != null), "%s string payload mismatch", token);
    checkArgument(
        token.hasPatterns() || patterns.isEmpty(), "%s cannot hold patterns", token);
    checkArgument((token == Token.LOOP) == (typedLoop != null), "%s loop payload mismatch", token);
    this.token = token;
    this.str = str;
    this.patterns = patterns;
    this.children = children;
    this.typedLoop = typedLoop;
  }

  Node(Token token, @Nullable String str, List<Node> children) {
    this(token, str, ImmutableList.of(), ImmutableList.copyOf(children), null);
  }

  public Token getToken() {
    return token;
  }

  /** Returns the string payload; only valid for tokens where {@link Token#hasString()}. */
  public String getString() {
    checkState(str != null, "%s has no string payload", token);
    return str;
  }

  public ImmutableList<Node> getChildren() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public Node getChildAt(int i) {
    return children.get(i);
  }

  public Node getFirstChild() {
    checkState(!children.isEmpty(), "%s has no children", token);
    return children.get(0);
  }

  public Node getLastChild() {
    checkState(!children.isEmpty(), "%s has no children", token);
    return children.get(children.size() - 1);
  }

  public ImmutableList<Pattern> getPatterns() {
    return patterns;
  }

  /** Returns the single pattern of a MATCH or GENERATOR node. */
  public Pattern getOnlyPattern() {
    checkState(patterns.size() == 1, "%s does not hold exactly one pattern", token);
    return patterns.get(0);
  }

  /** Returns the deferred imperative loop of a LOOP node. */
  public TypedNode getTypedLoop() {
    checkState(typedLoop != null, "%s is not a loop", token);
    return typedLoop;
  }

  public Node withChildren(List<Node> newChildren) {
    ImmutableList<Node> copy = ImmutableList.copyOf(newChildren);
    if (copy.equals(children)) {
      return this;
    }
    return new Node(token, str, patterns, copy, typedLoop);
  }

  public Node withChildAt(int index, Node child) {
    if (children.get(index).equals(child)) {
      return this;
    }
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (int i = 0; i < children.size(); i++) {
      builder.add(i == index ? child : children.get(i));
    }
    return new Node(token, str, patterns, builder.build(), typedLoop);
  }

  public Node withPatterns(List<Pattern> newPatterns) {
    ImmutableList<Pattern> copy = ImmutableList.copyOf(newPatterns);
    if (copy.equals(patterns)) {
      return this;
    }
    return new Node(token, str, copy, children, typedLoop);
  }

  public Node withString(String newString) {
    checkState(token.hasString(), "%s has no string payload", token);
    if (newString.equals(str)) {
      return this;
    }
    return new Node(token, newString, patterns, children, typedLoop);
  }

  public boolean isModule() {
    return token == Token.MODULE;
  }

  public boolean isDefinition() {
    return token == Token.DEF || token == Token.DEFP;
  }

  public boolean isClause() {
    return token == Token.CLAUSE;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isMatch() {
    return token == Token.MATCH;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  /** Whether this is a reference to the variable {@code name}. */
  public boolean isName(String name) {
    return token == Token.NAME && name.equals(str);
  }

  public boolean isString() {
    return token == Token.STRING;
  }

  public boolean isNumber() {
    return token == Token.NUMBER;
  }

  public boolean isNil() {
    return token == Token.NIL;
  }

  public boolean isRaw() {
    return token == Token.RAW;
  }

  public boolean isIf() {
    return token == Token.IF;
  }

  public boolean isFn() {
    return token == Token.FN;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isRemoteCall() {
    return token == Token.REMOTE_CALL;
  }

  /** Whether this is a call {@code Module.function(...)} on a module alias. */
  public boolean isRemoteCall(String module, String function) {
    return token == Token.REMOTE_CALL
        && function.equals(str)
        && children.get(0).token == Token.MODULE_REF
        && module.equals(children.get(0).str);
  }

  public boolean isBinaryOp(String operator) {
    return token == Token.BINARY_OP && operator.equals(str);
  }

  public boolean isList() {
    return token == Token.LIST;
  }

  public boolean isLoop() {
    return token == Token.LOOP;
  }

  /** Whether this node is a literal without children. */
  public boolean isLiteral() {
    switch (token) {
      case ATOM:
      case STRING:
      case NUMBER:
      case TRUE:
      case FALSE:
      case NIL:
        return true;
      default:
        return false;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Node)) {
      return false;
    }
    Node that = (Node) o;
    return token == that.token
        && hashCode() == that.hashCode()
        && Objects.equals(str, that.str)
        && patterns.equals(that.patterns)
        && children.equals(that.children)
        && Objects.equals(typedLoop, that.typedLoop);
  }

  @Override
  public int hashCode() {
    int h = hash;
    if (h == 0) {
      h = Objects.hash(token, str, patterns, children, typedLoop);
      hash = h == 0 ? 1 : h;
    }
    return hash;
  }

  @Override
  public String toString() {
    return str == null ? token.toString() : token + " " + str;
  }

  /** Prints the tree one node per line, indented by depth. Used in test failure messages. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb, 0);
    return sb.toString();
  }

  void appendTree(StringBuilder sb, int level) {
    indent(sb, level).append(this).append('\n');
    for (Pattern pattern : patterns) {
      pattern.appendTree(sb, level + 1);
    }
    if (typedLoop != null) {
      indent(sb, level + 1).append("typed ").append(typedLoop.toStringTree()).append('\n');
    }
    for (Node child : children) {
      child.appendTree(sb, level + 1);
    }
  }

  static StringBuilder indent(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    return sb;
  }
}
