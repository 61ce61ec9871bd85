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
import com.google.common.collect.ImmutableSet;
import com.google.rb2js.AbstractFilter;
import com.google.rb2js.Filter;
import com.google.rb2js.FilterChain;
import com.google.rb2js.FilterRegistry;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renames snake_case identifiers to camelCase: {@code foo_bar} becomes {@code fooBar}. Method
 * names, variables, parameters and symbols are all renamed. It runs its handlers after the rest of
 * the chain so that other filters still see the Ruby names, and it moves itself to the front of the
 * pipeline for the same reason.
 */
public final class CamelCaseFilter extends AbstractFilter {

  private static final ImmutableSet<String> ALLOWLIST =
      ImmutableSet.of(
          "attr_accessor",
          "attr_reader",
          "attr_writer",
          "method_missing",
          "is_a?",
          "kind_of?",
          "instance_of?");

  private static final ImmutableMap<String, String> CAPS_EXCEPTIONS =
      ImmutableMap.<String, String>builder()
          .put("innerHtml", "innerHTML")
          .put("innerHtml=", "innerHTML=")
          .put("outerHtml", "outerHTML")
          .put("outerHtml=", "outerHTML=")
          .put("encodeUri", "encodeURI")
          .put("encodeUriComponent", "encodeURIComponent")
          .put("decodeUri", "decodeURI")
          .put("decodeUriComponent", "decodeURIComponent")
          .buildOrThrow();

  private static final ImmutableSet<Token> NAMED =
      ImmutableSet.of(
          Token.DEF,
          Token.ARG,
          Token.OPTARG,
          Token.RESTARG,
          Token.KWARG,
          Token.KWOPTARG,
          Token.BLOCKARG,
          Token.LVAR,
          Token.IVAR,
          Token.CVAR,
          Token.LVASGN,
          Token.IVASGN,
          Token.CVASGN,
          Token.SYM);

  private static final Pattern UNDERSCORE = Pattern.compile("(?!^)_([a-z0-9])");
  private static final Pattern NAME_WORTH_RENAMING = Pattern.compile("_.*[?!\\w]$");
  private static final Pattern METHOD_WORTH_RENAMING = Pattern.compile("_.*\\w[=!?]?$");

  public CamelCaseFilter() {
    super(FilterRegistry.CAMEL_CASE);
    for (Token kind : NAMED) {
      on(kind, (node, chain) -> renameChild(chain.next(node), kind, 0, NAME_WORTH_RENAMING));
    }
    on(
        Token.DEFS,
        (node, chain) -> renameChild(chain.next(node), Token.DEFS, 1, NAME_WORTH_RENAMING));
    on(Token.SEND, this::renameMethod);
    on(Token.CSEND, this::renameMethod);
    on(Token.ATTR, this::renameMethod);
  }

  @Override
  public ImmutableList<Filter> reorder(ImmutableList<Filter> filters) {
    if (filters.indexOf(this) <= 0) {
      return filters;
    }
    ImmutableList.Builder<Filter> reordered = ImmutableList.<Filter>builder().add(this);
    for (Filter filter : filters) {
      if (filter != this) {
        reordered.add(filter);
      }
    }
    return reordered.build();
  }

  /** Converts {@code snake_case} to {@code camelCase}, leaving allowlisted names alone. */
  static String camelCase(String name) {
    if (ALLOWLIST.contains(name)) {
      return name;
    }
    Matcher matcher = UNDERSCORE.matcher(name);
    StringBuffer result = new StringBuffer();
    while (matcher.find()) {
      matcher.appendReplacement(result, matcher.group(1).toUpperCase());
    }
    matcher.appendTail(result);
    String renamed = result.toString();
    return CAPS_EXCEPTIONS.getOrDefault(renamed, renamed);
  }

  private static Node renameChild(Node node, Token kind, int index, Pattern worthRenaming) {
    if (!node.isToken(kind) || !(node.getChild(index) instanceof String)) {
      return node;
    }
    String name = node.getString(index);
    if (!worthRenaming.matcher(name).find() || ALLOWLIST.contains(name)) {
      return node;
    }
    return node.withChild(index, camelCase(name));
  }

  private Node renameMethod(Node node, FilterChain chain) {
    Token kind = node.getToken();
    Node processed = chain.next(node);
    if (!processed.isToken(kind)) {
      return processed;
    }
    Node receiver = processed.getNode(0);
    String method = processed.getString(1);
    if (receiver == null && ALLOWLIST.contains(method)) {
      return processed;
    }
    return renameChild(processed, kind, 1, METHOD_WORTH_RENAMING);
  }
}
