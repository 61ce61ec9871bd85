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

package com.google.rb2js.filters;

import com.google.common.collect.ImmutableSet;
import com.google.rb2js.AbstractFilter;
import com.google.rb2js.FilterChain;
import com.google.rb2js.FilterRegistry;
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;

/**
 * Makes methods and blocks return the value of their last expression, the way Ruby does. Bodies
 * are wrapped in an {@code autoreturn} node; the code generator decides where the {@code return}
 * goes.
 */
public final class ReturnFilter extends AbstractFilter {

  /** Blocks run for their side effects; a return would end the iteration early. */
  private static final ImmutableSet<String> ITERATORS =
      ImmutableSet.of(
          "each",
          "each_with_index",
          "each_pair",
          "each_key",
          "each_value",
          "forEach",
          "loop",
          "times",
          "step",
          "upto",
          "downto");

  public ReturnFilter() {
    super(FilterRegistry.RETURN);
    on(Token.DEF, (node, chain) -> wrapMethod(node, chain, 2));
    on(Token.DEFS, (node, chain) -> wrapMethod(node, chain, 3));
    on(Token.BLOCK, this::wrapBlock);
    on(Token.NUMBLOCK, this::wrapBlock);
  }

  private static Node wrapMethod(Node node, FilterChain chain, int bodyIndex) {
    Node processed = chain.next(node);
    if (processed.getToken() != node.getToken()) {
      return processed;
    }
    String name = processed.getString(bodyIndex - 2);
    if (name.equals("initialize") || isSetterName(name)) {
      return processed;
    }
    return wrap(processed, bodyIndex);
  }

  private Node wrapBlock(Node node, FilterChain chain) {
    Node processed = chain.next(node);
    if (processed.getToken() != node.getToken()) {
      return processed;
    }
    Node call = processed.getNonNullNode(0);
    if (call.isToken(Token.SEND) || call.isToken(Token.CSEND)) {
      String method = call.getString(1);
      if (ITERATORS.contains(method) || isClassNew(call, method)) {
        return processed;
      }
    }
    return wrap(processed, 2);
  }

  private static Node wrap(Node node, int bodyIndex) {
    Node body = node.getNode(bodyIndex);
    if (body == null || body.isToken(Token.AUTORETURN)) {
      return node;
    }
    return node.withChild(bodyIndex, IR.autoreturn(body).withSpanOf(body));
  }

  /** {@code Class.new do ... end} holds method definitions, not a value. */
  private static boolean isClassNew(Node call, String method) {
    Node receiver = call.getNode(0);
    return method.equals("new")
        && receiver != null
        && receiver.isToken(Token.CONST)
        && receiver.getNode(0) == null
        && receiver.getString(1).equals("Class");
  }

  private static boolean isSetterName(String name) {
    return name.endsWith("=")
        && !name.equals("==")
        && !name.equals("!=")
        && !name.equals("===")
        && !name.equals("<=")
        && !name.equals(">=")
        && !name.equals("[]=");
  }
}
