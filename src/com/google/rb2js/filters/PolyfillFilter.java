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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.rb2js.AbstractFilter;
import com.google.rb2js.Filter;
import com.google.rb2js.FilterChain;
import com.google.rb2js.FilterRegistry;
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Keeps Ruby methods that have no JavaScript counterpart by defining them on the built-in
 * prototypes. A program calling {@code a.compact} gets an {@code Array.prototype} getter named
 * {@code compact} in front of it; {@code s.chomp} gets {@code String.prototype.chomp}.
 *
 * <p>Each definition is added once per program and only when used. The definitions are written in
 * ES5 so that they work at every output level. This filter moves itself ahead of {@code
 * functions}, which would otherwise rewrite {@code first} and {@code last} into index expressions.
 */
public final class PolyfillFilter extends AbstractFilter {

  private static final Logger logger = Logger.getLogger(PolyfillFilter.class.getName());

  /** Methods read as properties, defined as getters. */
  private static final ImmutableMap<String, String> GETTERS =
      ImmutableMap.<String, String>builder()
          .put("first", "return this[0]")
          .put("last", "return this[this.length - 1]")
          .put(
              "compact",
              "return this.filter(function(x) {return x !== null && x !== undefined})")
          .put("uniq", "return this.filter(function(x, i, a) {return a.indexOf(x) === i})")
          .buildOrThrow();

  /** Methods called with arguments, defined as functions when the prototype lacks them. */
  private static final ImmutableMap<String, Method> METHODS =
      ImmutableMap.<String, Method>builder()
          .put(
              "insert",
              new Method(
                  "Array",
                  "index",
                  "var items = Array.prototype.slice.call(arguments, 1);"
                      + " Array.prototype.splice.apply(this, [index, 0].concat(items));"
                      + " return this",
                  1,
                  Integer.MAX_VALUE))
          .put(
              "delete_at",
              new Method(
                  "Array",
                  "index",
                  "if (index < 0) {index += this.length};"
                      + " if (index < 0 || index >= this.length) {return undefined};"
                      + " return this.splice(index, 1)[0]",
                  1,
                  1))
          .put(
              "chomp",
              new Method(
                  "String",
                  "suffix",
                  "if (suffix === undefined) {return this.replace(/\\r?\\n$/, \"\")};"
                      + " if (" + endsWith("suffix") + ") {"
                      + "return this.slice(0, this.length - suffix.length)};"
                      + " return String(this)",
                  0,
                  1))
          .put(
              "delete_prefix",
              new Method(
                  "String",
                  "prefix",
                  "if (this.indexOf(prefix) === 0) {return this.slice(prefix.length)};"
                      + " return String(this)",
                  1,
                  1))
          .put(
              "delete_suffix",
              new Method(
                  "String",
                  "suffix",
                  "if (" + endsWith("suffix") + ") {"
                      + "return this.slice(0, this.length - suffix.length)};"
                      + " return String(this)",
                  1,
                  1))
          .buildOrThrow();

  public PolyfillFilter() {
    super(FilterRegistry.POLYFILL);
    on(Token.SEND, this::rewriteSend);
  }

  @Override
  public ImmutableList<Filter> reorder(ImmutableList<Filter> filters) {
    int self = filters.indexOf(this);
    int functions = -1;
    for (int i = 0; i < filters.size(); i++) {
      if (filters.get(i).getName().equals(FilterRegistry.FUNCTIONS)) {
        functions = i;
        break;
      }
    }
    if (functions < 0 || self < functions) {
      return filters;
    }
    List<Filter> reordered = new ArrayList<>(filters);
    reordered.remove(self);
    reordered.add(functions, this);
    return ImmutableList.copyOf(reordered);
  }

  private @Nullable Node rewriteSend(Node node, FilterChain chain) {
    Node receiver = node.getNode(0);
    if (receiver == null) {
      return null;
    }
    String method = node.getString(1);
    List<Node> args = node.nodesFrom(2);
    if (GETTERS.containsKey(method) && args.isEmpty()) {
      add(method, chain);
      return IR.attr(chain.process(receiver), method).withSpanOf(node);
    }
    Method definition = METHODS.get(method);
    if (definition != null
        && args.size() >= definition.minArgs
        && args.size() <= definition.maxArgs) {
      add(method, chain);
      List<Node> processed = new ArrayList<>();
      for (Node arg : args) {
        processed.add(chain.process(arg));
      }
      return IR.call(chain.process(receiver), method, processed.toArray(new Node[0]))
          .withSpanOf(node);
    }
    return null;
  }

  // Prepended statements are kept in a set, so a repeated definition is dropped there.
  private static void add(String method, FilterChain chain) {
    logger.fine("Adding polyfill for " + method);
    chain.prepend(IR.jsLiteral(definitionOf(method)));
  }

  /** The JavaScript statement that defines {@code method}. */
  static String definitionOf(String method) {
    String getter = GETTERS.get(method);
    if (getter != null) {
      return "Object.defineProperty(Array.prototype, \""
          + method
          + "\", {get: function() {"
          + getter
          + "}, configurable: true})";
    }
    Method definition = METHODS.get(method);
    if (definition == null) {
      throw new IllegalArgumentException("no polyfill for " + method);
    }
    String target = definition.prototype + ".prototype." + method;
    return "if (!"
        + target
        + ") {"
        + target
        + " = function("
        + definition.parameter
        + ") {"
        + definition.body
        + "}}";
  }

  private static String endsWith(String suffix) {
    return "this.length >= "
        + suffix
        + ".length && this.slice(this.length - "
        + suffix
        + ".length) === "
        + suffix;
  }

  private static final class Method {
    final String prototype;
    final String parameter;
    final String body;
    final int minArgs;
    final int maxArgs;

    Method(String prototype, String parameter, String body, int minArgs, int maxArgs) {
      this.prototype = prototype;
      this.parameter = parameter;
      this.body = body;
      this.minArgs = minArgs;
      this.maxArgs = maxArgs;
    }
  }
}
