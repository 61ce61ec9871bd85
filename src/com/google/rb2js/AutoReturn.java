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

package com.google.rb2js;

import com.google.common.collect.ImmutableSet;
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites a function body wrapped in {@code autoreturn} so that the value of its tail statement
 * is returned. Conditionals, case bodies and try bodies have several tails and each gets its own
 * {@code return}.
 */
final class AutoReturn {

  private static final ImmutableSet<Token> EXPRESSIONS =
      ImmutableSet.of(
          Token.INT,
          Token.FLOAT,
          Token.STR,
          Token.SYM,
          Token.DSTR,
          Token.DSYM,
          Token.REGEXP,
          Token.TRUE,
          Token.FALSE,
          Token.NIL,
          Token.SELF,
          Token.ARRAY,
          Token.HASH,
          Token.LVAR,
          Token.IVAR,
          Token.GVAR,
          Token.CVAR,
          Token.CONST,
          Token.SEND,
          Token.CSEND,
          Token.ATTR,
          Token.CALL,
          Token.BLOCK,
          Token.NUMBLOCK,
          Token.SUPER,
          Token.ZSUPER,
          Token.YIELD,
          Token.AND,
          Token.OR,
          Token.NOT,
          Token.DEFINED,
          Token.NULLISH);

  private AutoReturn() {}

  static @Nullable Node apply(@Nullable Node node) {
    if (node == null) {
      return null;
    }
    switch (node.getToken()) {
      case AUTORETURN:
        return apply(node.getNode(0));
      case BEGIN:
      case KWBEGIN:
        {
          if (!node.hasChildren()) {
            return node;
          }
          int last = node.getChildCount() - 1;
          return node.withChild(last, apply(node.getNode(last)));
        }
      case IF:
        return node.withChildren(
            node.getNode(0), apply(node.getNode(1)), apply(node.getNode(2)));
      case CASE:
        {
          List<@Nullable Object> children = new ArrayList<>(node.getChildren());
          for (int i = 1; i < children.size(); i++) {
            Node clause = (Node) children.get(i);
            if (clause != null && clause.isToken(Token.WHEN)) {
              int body = clause.getChildCount() - 1;
              children.set(i, clause.withChild(body, apply(clause.getNode(body))));
            } else {
              children.set(i, apply(clause));
            }
          }
          return node.withChildren(children);
        }
      case RESCUE:
        return applyToRescue(node);
      case ENSURE:
        return node.withChild(0, apply(node.getNode(0)));
      case LVASGN:
      case IVASGN:
      case GVASGN:
      case CVASGN:
        if (node.getChildCount() < 2) {
          return node;
        }
        return returnAfter(node, node);
      case OP_ASGN:
      case OR_ASGN:
      case AND_ASGN:
        return returnAfter(node, node.getNonNullNode(0));
      default:
        return isExpression(node) ? IR.returnNode(node).withSpanOf(node) : node;
    }
  }

  private static Node applyToRescue(Node node) {
    List<@Nullable Object> children = new ArrayList<>(node.getChildren());
    Node last = (Node) children.get(children.size() - 1);
    boolean hasElse = last != null && !last.isToken(Token.RESBODY);
    if (hasElse) {
      children.set(children.size() - 1, apply(last));
    } else {
      children.set(0, apply(node.getNode(0)));
    }
    for (int i = 1; i < children.size(); i++) {
      Node clause = (Node) children.get(i);
      if (clause != null && clause.isToken(Token.RESBODY)) {
        children.set(i, clause.withChild(2, apply(clause.getNode(2))));
      }
    }
    return node.withChildren(children);
  }

  private static Node returnAfter(Node assignment, Node target) {
    Token read;
    switch (target.getToken()) {
      case LVASGN:
        read = Token.LVAR;
        break;
      case IVASGN:
        read = Token.IVAR;
        break;
      case GVASGN:
        read = Token.GVAR;
        break;
      case CVASGN:
        read = Token.CVAR;
        break;
      default:
        return isExpression(target) ? IR.returnNode(assignment).withSpanOf(assignment) : assignment;
    }
    Node variable = Node.of(read, target.getString(0)).withSpanOf(target);
    return IR.begin(assignment, IR.returnNode(variable).withSpanOf(assignment))
        .withSpanOf(assignment);
  }

  /** Whether {@code node} produces a value that a {@code return} may carry. */
  static boolean isExpression(Node node) {
    if (!EXPRESSIONS.contains(node.getToken())) {
      return false;
    }
    if (node.isToken(Token.SEND)) {
      String method = node.getString(1);
      if (node.getNode(0) == null && method.equals("raise")) {
        return false;
      }
      if (method.equals("<<") && node.getChildCount() == 3) {
        return false;
      }
    }
    if (node.isToken(Token.BLOCK) || node.isToken(Token.NUMBLOCK)) {
      return !isLoopBlock(node);
    }
    return true;
  }

  /** Blocks the generator turns into loop statements: {@code loop}, range iteration, times. */
  static boolean isLoopBlock(Node block) {
    if (!block.isToken(Token.BLOCK)) {
      return false;
    }
    Node call = block.getNonNullNode(0);
    if (!call.isToken(Token.SEND)) {
      return false;
    }
    Node receiver = call.getNode(0);
    String method = call.getString(1);
    int argCount = call.getChildCount() - 2;
    if (receiver == null) {
      return method.equals("loop") && argCount == 0;
    }
    switch (method) {
      case "each":
        return argCount == 0 && isRange(receiver);
      case "step":
        return argCount == 1 && isRange(receiver);
      case "times":
        return argCount == 0;
      default:
        return false;
    }
  }

  static boolean isRange(Node node) {
    Node inner = unwrapParens(node);
    return inner.isToken(Token.IRANGE) || inner.isToken(Token.ERANGE);
  }

  /** Strips the {@code begin} the parser puts around a parenthesized expression. */
  static Node unwrapParens(Node node) {
    Node current = node;
    while (current.isToken(Token.BEGIN) && current.getChildCount() == 1) {
      Node only = current.getNode(0);
      if (only == null) {
        break;
      }
      current = only;
    }
    return current;
  }
}
