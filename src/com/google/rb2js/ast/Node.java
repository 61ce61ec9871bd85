/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.rb2js.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An immutable syntax tree node: a {@link Token} kind, an ordered list of children and an optional
 * {@link SourceSpan}.
 *
 * <p>Children are either nodes or literal payloads: {@link String} for identifiers, symbols and
 * string contents, {@link Long} and {@link Double} for numbers, {@link Boolean}, or {@code null}
 * for an empty slot (a send without receiver, an {@code if} without else branch).
 *
 * <p>Equality is structural over kind and children and ignores spans. Rewrites go through the
 * {@code with*} methods, which keep the span of the node they are called on.
 */
@Immutable
@SuppressWarnings("Immutable") // children are copied into an unmodifiable list
public final class Node {

  private final Token token;
  private final List<@Nullable Object> children;
  private final @Nullable SourceSpan span;

  private Node(Token token, List<@Nullable Object> children, @Nullable SourceSpan span) {
    this.token = token;
    this.children = children;
    this.span = span;
  }

  public static Node of(Token token, @Nullable Object... children) {
    return create(token, Arrays.asList(children), null);
  }

  public static Node create(
      Token token, List<? extends @Nullable Object> children, @Nullable SourceSpan span) {
    checkNotNull(token);
    List<@Nullable Object> copy = new ArrayList<>(children.size());
    for (Object child : children) {
      checkArgument(isValidChild(child), "bad child %s for %s", child, token);
      copy.add(child instanceof Integer ? Long.valueOf((Integer) child) : child);
    }
    return new Node(token, Collections.unmodifiableList(copy), span);
  }

  private static boolean isValidChild(@Nullable Object child) {
    return child == null
        || child instanceof Node
        || child instanceof String
        || child instanceof Long
        || child instanceof Integer
        || child instanceof Double
        || child instanceof Boolean;
  }

  public Token getToken() {
    return token;
  }

  public boolean isToken(Token kind) {
    return token == kind;
  }

  public List<@Nullable Object> getChildren() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public @Nullable Object getChild(int i) {
    checkElementIndex(i, children.size(), "child of " + token.getName());
    return children.get(i);
  }

  /** Returns child {@code i}, which must be a node or an empty slot. */
  public @Nullable Node getNode(int i) {
    Object child = getChild(i);
    checkState(child == null || child instanceof Node, "%s child %s is not a node", token, i);
    return (Node) child;
  }

  /** Returns child {@code i}, which must be a node. */
  public Node getNonNullNode(int i) {
    Node child = getNode(i);
    checkState(child != null, "%s child %s is empty", token, i);
    return child;
  }

  /** Returns child {@code i}, which must be a string payload. */
  public String getString(int i) {
    Object child = getChild(i);
    checkState(child instanceof String, "%s child %s is not a name", token, i);
    return (String) child;
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : getNode(0);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : getNode(children.size() - 1);
  }

  /** Returns the node children, skipping literals and empty slots. */
  public ImmutableList<Node> nodeChildren() {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Object child : children) {
      if (child instanceof Node) {
        builder.add((Node) child);
      }
    }
    return builder.build();
  }

  /** Returns children {@code from} to the end as nodes. */
  public List<Node> nodesFrom(int from) {
    List<Node> result = new ArrayList<>();
    for (int i = from; i < children.size(); i++) {
      Node child = getNode(i);
      if (child != null) {
        result.add(child);
      }
    }
    return result;
  }

  public @Nullable SourceSpan getSpan() {
    return span;
  }

  public boolean hasSpan() {
    return span != null;
  }

  /**
   * Returns a node of the same kind and span with the given children. Returns this node when every
   * child is identical to the current one.
   */
  public Node withChildren(List<? extends @Nullable Object> newChildren) {
    if (newChildren.size() == children.size()) {
      boolean same = true;
      for (int i = 0; i < children.size(); i++) {
        if (newChildren.get(i) != children.get(i)) {
          same = false;
          break;
        }
      }
      if (same) {
        return this;
      }
    }
    return create(token, newChildren, span);
  }

  public Node withChildren(@Nullable Object... newChildren) {
    return withChildren(Arrays.asList(newChildren));
  }

  public Node withChild(int i, @Nullable Object child) {
    checkElementIndex(i, children.size());
    List<@Nullable Object> copy = new ArrayList<>(children);
    copy.set(i, child);
    return withChildren(copy);
  }

  /** Returns a node of another kind with the same children and span. */
  public Node withToken(Token newToken) {
    return newToken == token ? this : new Node(newToken, children, span);
  }

  /** Returns a node of another kind with new children, keeping this node's span. */
  public Node updated(Token newToken, @Nullable Object... newChildren) {
    return create(newToken, Arrays.asList(newChildren), span);
  }

  public Node withSpan(@Nullable SourceSpan newSpan) {
    return Objects.equals(newSpan, span) ? this : new Node(token, children, newSpan);
  }

  /** Copies the span of {@code other} onto this node, unless this node already has one. */
  public Node withSpanOf(@Nullable Node other) {
    if (span != null || other == null || other.span == null) {
      return this;
    }
    return new Node(token, children, other.span);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Node)) {
      return false;
    }
    Node that = (Node) o;
    return token == that.token && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return 31 * token.hashCode() + children.hashCode();
  }

  /** Prints the node as an s-expression that {@link SexpReader} reads back. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  private void appendTo(StringBuilder sb) {
    sb.append('(').append(token.getName());
    for (Object child : children) {
      sb.append(' ');
      if (child == null) {
        sb.append("nil");
      } else if (child instanceof Node) {
        ((Node) child).appendTo(sb);
      } else if (child instanceof String) {
        SexpReader.appendString(sb, (String) child);
      } else {
        sb.append(child);
      }
    }
    sb.append(')');
  }
}
