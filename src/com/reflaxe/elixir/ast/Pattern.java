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
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node on the binding side of a match.
 *
 * <p>Patterns are kept apart from {@link Node} so that expression position can never bind a name.
 * Everything in a pattern binds, except {@link PatternToken#PIN}, which reads an existing binding,
 * and literal keys and values, which bind nothing.
 */
public final class Pattern {

  private final PatternToken token;
  private final @Nullable String str;
  private final @Nullable Node literal;
  private final ImmutableList<Pattern> children;

  private Pattern(
      PatternToken token,
      @Nullable String str,
      @Nullable Node literal,
      ImmutableList<Pattern> children) {
    checkArgument(token.hasString() == (str != null), "%s string payload mismatch", token);
    checkArgument(
        (token == PatternToken.LITERAL || token == PatternToken.MAP_ENTRY) == (literal != null),
        "%s literal payload mismatch",
        token);
    this.token = token;
    this.str = str;
    this.literal = literal;
    this.children = children;
  }

  public static Pattern bind(String name) {
    checkArgument(!name.isEmpty() && !name.equals("_"), "invalid binder: %s", name);
    return new Pattern(PatternToken.BIND, name, null, ImmutableList.of());
  }

  public static Pattern wildcard() {
    return new Pattern(PatternToken.WILDCARD, null, null, ImmutableList.of());
  }

  public static Pattern literal(Node value) {
    checkArgument(value.isLiteral() || value.getToken() == Token.MODULE_REF, value);
    return new Pattern(PatternToken.LITERAL, null, value, ImmutableList.of());
  }

  public static Pattern tuple(Pattern... elements) {
    return tuple(ImmutableList.copyOf(elements));
  }

  public static Pattern tuple(List<Pattern> elements) {
    return new Pattern(PatternToken.TUPLE, null, null, ImmutableList.copyOf(elements));
  }

  public static Pattern list(Pattern... elements) {
    return new Pattern(PatternToken.LIST, null, null, ImmutableList.copyOf(elements));
  }

  public static Pattern cons(Pattern head, Pattern tail) {
    return new Pattern(PatternToken.CONS, null, null, ImmutableList.of(head, tail));
  }

  public static Pattern map(Pattern... entries) {
    for (Pattern entry : entries) {
      checkArgument(entry.token == PatternToken.MAP_ENTRY, entry);
    }
    return new Pattern(PatternToken.MAP, null, null, ImmutableList.copyOf(entries));
  }

  public static Pattern mapEntry(Node key, Pattern value) {
    checkArgument(key.isLiteral(), "map pattern keys must be literals: %s", key);
    return new Pattern(PatternToken.MAP_ENTRY, null, key, ImmutableList.of(value));
  }

  public static Pattern struct(String module, Pattern... entries) {
    for (Pattern entry : entries) {
      checkArgument(entry.token == PatternToken.MAP_ENTRY, entry);
    }
    return new Pattern(PatternToken.STRUCT, module, null, ImmutableList.copyOf(entries));
  }

  public static Pattern pin(String name) {
    return new Pattern(PatternToken.PIN, name, null, ImmutableList.of());
  }

  public static Pattern alias(Pattern aliased, String name) {
    return new Pattern(PatternToken.ALIAS, name, null, ImmutableList.of(aliased));
  }

  public static Pattern binary(Pattern... segments) {
    for (Pattern segment : segments) {
      checkArgument(segment.token == PatternToken.BINARY_SEGMENT, segment);
    }
    return new Pattern(PatternToken.BINARY, null, null, ImmutableList.copyOf(segments));
  }

  public static Pattern binarySegment(Pattern value, String spec) {
    return new Pattern(PatternToken.BINARY_SEGMENT, spec, null, ImmutableList.of(value));
  }

  public PatternToken getToken() {
    return token;
  }

  public String getString() {
    checkState(str != null, "%s has no string payload", token);
    return str;
  }

  public Node getLiteral() {
    checkState(literal != null, "%s has no literal", token);
    return literal;
  }

  public ImmutableList<Pattern> getChildren() {
    return children;
  }

  public Pattern getFirstChild() {
    checkState(!children.isEmpty(), "%s has no children", token);
    return children.get(0);
  }

  public boolean isBind() {
    return token == PatternToken.BIND;
  }

  public boolean isBind(String name) {
    return token == PatternToken.BIND && name.equals(str);
  }

  public Pattern withString(String newString) {
    checkState(token.hasString(), "%s has no string payload", token);
    if (newString.equals(str)) {
      return this;
    }
    return new Pattern(token, newString, literal, children);
  }

  public Pattern withChildren(List<Pattern> newChildren) {
    ImmutableList<Pattern> copy = ImmutableList.copyOf(newChildren);
    if (copy.equals(children)) {
      return this;
    }
    return new Pattern(token, str, literal, copy);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Pattern)) {
      return false;
    }
    Pattern that = (Pattern) o;
    return token == that.token
        && Objects.equals(str, that.str)
        && Objects.equals(literal, that.literal)
        && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(token, str, literal, children);
  }

  @Override
  public String toString() {
    return str == null ? "pattern " + token : "pattern " + token + " " + str;
  }

  void appendTree(StringBuilder sb, int level) {
    Node.indent(sb, level).append(this).append('\n');
    if (literal != null) {
      literal.appendTree(sb, level + 1);
    }
    for (Pattern child : children) {
      child.appendTree(sb, level + 1);
    }
  }
}
