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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Factory methods for building trees by hand. Used by filters and tests. */
public class IR {
  private IR() {}

  public static Node nil() {
    return Node.of(Token.NIL);
  }

  public static Node trueNode() {
    return Node.of(Token.TRUE);
  }

  public static Node falseNode() {
    return Node.of(Token.FALSE);
  }

  public static Node self() {
    return Node.of(Token.SELF);
  }

  public static Node number(long value) {
    return Node.of(Token.INT, value);
  }

  public static Node number(double value) {
    return Node.of(Token.FLOAT, value);
  }

  public static Node string(String value) {
    return Node.of(Token.STR, value);
  }

  public static Node sym(String value) {
    return Node.of(Token.SYM, value);
  }

  public static Node lvar(String name) {
    return Node.of(Token.LVAR, name);
  }

  public static Node ivar(String name) {
    return Node.of(Token.IVAR, name);
  }

  public static Node constant(@Nullable Node scope, String name) {
    return Node.of(Token.CONST, scope, name);
  }

  public static Node constant(String name) {
    return constant(null, name);
  }

  public static Node lvasgn(String name, @Nullable Node value) {
    return value == null ? Node.of(Token.LVASGN, name) : Node.of(Token.LVASGN, name, value);
  }

  public static Node send(@Nullable Node receiver, String method, Node... args) {
    return send(receiver, method, Arrays.asList(args));
  }

  public static Node send(@Nullable Node receiver, String method, List<Node> args) {
    List<@Nullable Object> children = new ArrayList<>();
    children.add(receiver);
    children.add(method);
    children.addAll(args);
    return Node.create(Token.SEND, children, null);
  }

  /** A method call that is always emitted with parentheses. */
  public static Node call(@Nullable Node receiver, String method, Node... args) {
    return send(receiver, method, args).withToken(Token.CALL);
  }

  /** A property read that is never emitted with parentheses. */
  public static Node attr(Node receiver, String name) {
    return Node.of(Token.ATTR, receiver, name);
  }

  public static Node array(List<Node> elements) {
    return Node.create(Token.ARRAY, elements, null);
  }

  public static Node array(Node... elements) {
    return array(Arrays.asList(elements));
  }

  public static Node hash(Node... pairs) {
    return Node.create(Token.HASH, Arrays.asList(pairs), null);
  }

  public static Node pair(Node key, Node value) {
    return Node.of(Token.PAIR, key, value);
  }

  public static Node begin(List<Node> statements) {
    return Node.create(Token.BEGIN, statements, null);
  }

  public static Node begin(Node... statements) {
    return begin(Arrays.asList(statements));
  }

  public static Node args(String... names) {
    List<Node> args = new ArrayList<>();
    for (String name : names) {
      args.add(Node.of(Token.ARG, name));
    }
    return Node.create(Token.ARGS, args, null);
  }

  public static Node block(Node call, Node args, @Nullable Node body) {
    return Node.of(Token.BLOCK, call, args, body);
  }

  public static Node def(String name, Node args, @Nullable Node body) {
    return Node.of(Token.DEF, name, args, body);
  }

  public static Node ifNode(Node condition, @Nullable Node then, @Nullable Node otherwise) {
    return Node.of(Token.IF, condition, then, otherwise);
  }

  public static Node and(Node left, Node right) {
    return Node.of(Token.AND, left, right);
  }

  public static Node or(Node left, Node right) {
    return Node.of(Token.OR, left, right);
  }

  public static Node not(Node operand) {
    return Node.of(Token.NOT, operand);
  }

  public static Node returnNode(@Nullable Node value) {
    return value == null ? Node.of(Token.RETURN) : Node.of(Token.RETURN, value);
  }

  public static Node autoreturn(@Nullable Node body) {
    return Node.of(Token.AUTORETURN, body);
  }

  public static Node jsLiteral(String text) {
    return Node.of(Token.JSLITERAL, text);
  }
}
