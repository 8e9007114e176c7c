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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node of the typed, fully resolved imperative input AST.
 *
 * <p>The front end that produces these trees is not part of this project; this class models the
 * boundary the loop analysis reads. Nodes are immutable with structural equality.
 */
public final class TypedNode {

  private final TypedToken token;
  private final @Nullable String str;
  private final boolean postfix;
  private final ImmutableList<TypedNode> children;

  TypedNode(TypedToken token, @Nullable String str, boolean postfix, List<TypedNode> children) {
    checkArgument(token.hasString() == (str != null), "%s string payload mismatch", token);
    checkArgument(!postfix || token == TypedToken.UNOP, "only unary operators are postfix");
    this.token = token;
    this.str = str;
    this.postfix = postfix;
    this.children = ImmutableList.copyOf(children);
  }

  public TypedToken getToken() {
    return token;
  }

  public String getString() {
    checkState(str != null, "%s has no string payload", token);
    return str;
  }

  /** Whether a unary operator is written after its operand, as in {@code i++}. */
  public boolean isPostfix() {
    return postfix;
  }

  public ImmutableList<TypedNode> getChildren() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public TypedNode getChildAt(int i) {
    return children.get(i);
  }

  public TypedNode getFirstChild() {
    checkState(!children.isEmpty(), "%s has no children", token);
    return children.get(0);
  }

  public TypedNode getLastChild() {
    checkState(!children.isEmpty(), "%s has no children", token);
    return children.get(children.size() - 1);
  }

  public boolean isLoop() {
    return token == TypedToken.WHILE || token == TypedToken.DO_WHILE || token == TypedToken.FOR_IN;
  }

  public boolean isLocal() {
    return token == TypedToken.LOCAL;
  }

  public boolean isLocal(String name) {
    return token == TypedToken.LOCAL && name.equals(str);
  }

  public boolean isBlock() {
    return token == TypedToken.BLOCK;
  }

  public boolean isInt() {
    return token == TypedToken.INT;
  }

  /** Returns the value of an INT literal. */
  public long getIntValue() {
    checkState(token == TypedToken.INT, "%s is not an int literal", token);
    return Long.parseLong(getString());
  }

  /**
   * Returns the statements of this node viewed as a statement list: the children of a block, or
   * the node itself.
   */
  public ImmutableList<TypedNode> statements() {
    return token == TypedToken.BLOCK ? children : ImmutableList.of(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TypedNode)) {
      return false;
    }
    TypedNode that = (TypedNode) o;
    return token == that.token
        && postfix == that.postfix
        && Objects.equals(str, that.str)
        && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(token, str, postfix, children);
  }

  @Override
  public String toString() {
    if (str == null) {
      return token.toString();
    }
    return postfix ? token + " " + str + " postfix" : token + " " + str;
  }

  /** Prints the tree on one line in prefix form. */
  public String toStringTree() {
    if (children.isEmpty()) {
      return "(" + this + ")";
    }
    StringBuilder sb = new StringBuilder("(").append(this);
    for (TypedNode child : children) {
      sb.append(' ').append(child.toStringTree());
    }
    return sb.append(')').toString();
  }
}
