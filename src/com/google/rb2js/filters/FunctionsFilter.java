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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.rb2js.AbstractFilter;
import com.google.rb2js.ConversionException.Stage;
import com.google.rb2js.ConverterOptions;
import com.google.rb2js.FilterChain;
import com.google.rb2js.FilterRegistry;
import com.google.rb2js.UnsupportedConstructException;
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Maps common Ruby core methods onto their JavaScript counterparts: {@code puts} becomes {@code
 * console.log}, {@code str.upcase} becomes {@code str.toUpperCase()}, {@code a.each} becomes
 * {@code a.forEach} and so on.
 *
 * <p>Every mapping is named after the Ruby method it rewrites and can be turned off with the
 * {@code exclude} option. A handful of zero argument methods ({@code keys}, {@code values}, {@code
 * entries}, {@code max}, {@code min}, {@code clear}) read just as naturally as JavaScript property
 * names, so they are only mapped when listed in {@code include}.
 */
public final class FunctionsFilter extends AbstractFilter {

  private static final ImmutableSet<String> OPT_IN =
      ImmutableSet.of("keys", "values", "entries", "max", "min", "clear");

  /** Methods that are renamed and otherwise left alone. */
  private static final ImmutableMap<String, String> RENAMES =
      ImmutableMap.<String, String>builder()
          .put("upcase", "toUpperCase")
          .put("downcase", "toLowerCase")
          .put("strip", "trim")
          .put("lstrip", "trimStart")
          .put("rstrip", "trimEnd")
          .put("start_with?", "startsWith")
          .put("end_with?", "endsWith")
          .put("include?", "includes")
          .put("sub", "replace")
          .put("to_s", "toString")
          .buildOrThrow();

  /** Iteration methods whose block becomes the callback of a JavaScript array method. */
  private static final ImmutableMap<String, String> BLOCK_RENAMES =
      ImmutableMap.<String, String>builder()
          .put("each", "forEach")
          .put("each_with_index", "forEach")
          .put("select", "filter")
          .put("any?", "some")
          .put("all?", "every")
          .put("find_index", "findIndex")
          .put("index", "findIndex")
          .buildOrThrow();

  private static final ImmutableSet<String> MATH_FUNCTIONS =
      ImmutableSet.of("abs", "round", "ceil", "floor");

  private static final ImmutableSet<String> TYPE_TESTS =
      ImmutableSet.of("is_a?", "kind_of?", "instance_of?");

  private static final ImmutableSet<String> ERROR_CLASSES =
      ImmutableSet.of("Exception", "StandardError", "RuntimeError");

  private static final Pattern REGEXP_SPECIALS = Pattern.compile("[\\\\^$.|?*+()\\[\\]{}]");
  private static final Pattern BACK_REFERENCE = Pattern.compile("\\\\(\\d)");

  private final ConverterOptions options;

  /** Calls that carry a block; zero argument rewrites would lose the block. */
  private final Set<Node> blockCalls = Collections.newSetFromMap(new IdentityHashMap<>());

  public FunctionsFilter(ConverterOptions options) {
    super(FilterRegistry.FUNCTIONS);
    this.options = options;
    on(Token.SEND, this::rewriteSend);
    on(Token.BLOCK, this::rewriteBlock);
    on(Token.NUMBLOCK, this::rewriteBlock);
  }

  private boolean enabled(String method) {
    return options.isEnabled(method, !OPT_IN.contains(method));
  }

  private Node rewriteBlock(Node block, FilterChain chain) {
    Node call = block.getNonNullNode(0);
    if (!call.isToken(Token.SEND) || call.getNode(0) == null) {
      blockCalls.add(call);
      return chain.next(block);
    }
    String method = call.getString(1);
    Node renamed = call;
    if (method.equals("reject") && enabled(method)) {
      Node negated = negateBody(block);
      if (negated != null) {
        return chain.next(negated);
      }
    } else if (method.equals("upto") && call.getChildCount() == 3 && enabled(method)) {
      // 1.upto(n) { |i| ... } is a counted loop over an inclusive range.
      Node range = Node.of(Token.IRANGE, call.getNode(0), call.getNode(2));
      renamed = IR.send(range, "each").withSpanOf(call);
    } else if (BLOCK_RENAMES.containsKey(method)
        && enabled(method)
        && !isRange(unwrapParens(call.getNonNullNode(0)))) {
      // Ranges stay as they are; the generator turns (a..b).each into a counted loop.
      renamed = call.withChild(1, BLOCK_RENAMES.get(method));
    }
    blockCalls.add(renamed);
    return chain.next(renamed == call ? block : block.withChild(0, renamed));
  }

  /** Rewrites {@code a.reject { |x| test }} to {@code a.filter { |x| !test }}. */
  private @Nullable Node negateBody(Node block) {
    int bodyIndex = block.getChildCount() - 1;
    Node body = block.getNode(bodyIndex);
    if (body == null || body.isToken(Token.BEGIN) || body.isToken(Token.AUTORETURN)) {
      return null;
    }
    Node call = block.getNonNullNode(0).withChild(1, "filter");
    return block.withChild(0, call).withChild(bodyIndex, IR.not(body).withSpanOf(body));
  }

  private @Nullable Node rewriteSend(Node node, FilterChain chain) {
    Node processed = chain.next(node);
    if (!processed.isToken(Token.SEND)) {
      return processed;
    }
    Node receiver = processed.getNode(0);
    String method = processed.getString(1);
    if (!enabled(method)) {
      return processed;
    }
    List<Node> args = processed.nodesFrom(2);
    boolean hasBlock = blockCalls.contains(node);
    Node rewritten =
        receiver == null
            ? rewriteFunction(method, args, hasBlock)
            : rewriteMethod(receiver, method, args, hasBlock);
    return rewritten == null ? processed : rewritten.withSpanOf(processed);
  }

  /** Receiverless calls: {@code puts}, {@code raise}, {@code Array(x)} and friends. */
  private @Nullable Node rewriteFunction(String method, List<Node> args, boolean hasBlock) {
    switch (method) {
      case "puts":
      case "p":
        return IR.call(IR.constant("console"), "log", args.toArray(new Node[0]));
      case "raise":
        if (args.size() == 1 && isStringLike(args.get(0))) {
          return IR.send(null, "raise", IR.constant("Error"), args.get(0));
        }
        if (!args.isEmpty() && isErrorClass(args.get(0))) {
          List<Node> replaced = new ArrayList<>(args);
          replaced.set(0, IR.constant("Error").withSpanOf(args.get(0)));
          return IR.send(null, "raise", replaced);
        }
        return null;
      case "rand":
        if (args.isEmpty()) {
          return random();
        }
        if (args.size() == 1) {
          return IR.call(null, "parseInt", IR.send(random(), "*", args.get(0)));
        }
        return null;
      case "Array":
        if (args.size() != 1 || hasBlock) {
          return null;
        }
        if (options.esLevelAtLeast(ConverterOptions.ES2015)) {
          return IR.call(IR.constant("Array"), "from", args.get(0));
        }
        return IR.call(
            IR.attr(IR.attr(IR.constant("Array"), "prototype"), "slice"), "call", args.get(0));
      default:
        return null;
    }
  }

  private @Nullable Node rewriteMethod(
      Node receiver, String method, List<Node> args, boolean hasBlock) {
    if (isErrorClass(receiver) && method.equals("new")) {
      return IR.send(IR.constant("Error").withSpanOf(receiver), "new", args);
    }
    if (RENAMES.containsKey(method)) {
      return rewriteRenamed(receiver, method, args);
    }
    if (MATH_FUNCTIONS.contains(method) && args.isEmpty() && !hasBlock) {
      return IR.call(IR.constant("Math"), method, receiver);
    }
    if (TYPE_TESTS.contains(method) && args.size() == 1) {
      Node type = args.get(0);
      if (type.isToken(Token.CONST)
          && type.getNode(0) == null
          && type.getString(1).equals("Array")) {
        return IR.call(IR.constant("Array"), "isArray", receiver);
      }
      return IR.send(receiver, "instanceof", type);
    }
    if (hasBlock) {
      return null;
    }
    switch (method) {
      case "to_i":
        return IR.call(null, "parseInt", prepend(receiver, args));
      case "to_f":
        return args.isEmpty() ? IR.call(null, "parseFloat", receiver) : null;
      case "to_json":
      case "inspect":
        return args.size() <= (method.equals("inspect") ? 0 : 2)
            ? IR.call(IR.constant("JSON"), "stringify", prepend(receiver, args))
            : null;
      case "length":
      case "size":
      case "count":
        return args.isEmpty() ? IR.attr(receiver, "length") : null;
      case "empty?":
        return args.isEmpty() ? IR.send(IR.attr(receiver, "length"), "==", IR.number(0)) : null;
      case "nil?":
        return args.isEmpty() ? IR.send(receiver, "==", IR.nil()) : null;
      case "respond_to?":
        return args.size() == 1 ? IR.send(args.get(0), "in", receiver) : null;
      case "first":
        return rewriteFirst(receiver, args);
      case "last":
        return rewriteLast(receiver, args);
      case "[]":
        return args.size() == 1 ? rewriteIndex(receiver, args.get(0)) : null;
      case "keys":
      case "values":
      case "entries":
        return args.isEmpty() ? IR.call(IR.constant("Object"), method, receiver) : null;
      case "max":
      case "min":
        return args.isEmpty() ? rewriteExtreme(receiver, method) : null;
      case "clear":
        return args.isEmpty() ? IR.send(receiver, "length=", IR.number(0)) : null;
      case "reverse":
      case "pop":
      case "shift":
        return args.isEmpty() ? IR.call(receiver, method) : null;
      case "dup":
        return args.isEmpty() ? IR.call(receiver, "slice") : null;
      case "join":
        // Ruby joins with no separator, JavaScript with a comma.
        return args.isEmpty() ? IR.call(receiver, "join", IR.string("")) : null;
      case "sum":
        return args.isEmpty() ? rewriteSum(receiver) : null;
      case "freeze":
        return args.isEmpty() ? IR.call(IR.constant("Object"), "freeze", receiver) : null;
      case "merge":
        return args.isEmpty() ? null : rewriteMerge(receiver, args);
      case "gsub":
        return args.size() == 2 ? rewriteGsub(receiver, args) : null;
      case "sub!":
      case "gsub!":
        return args.size() == 2 ? rewriteInPlace(receiver, method, args) : null;
      case "ord":
        return args.isEmpty() ? rewriteOrd(receiver) : null;
      case "chr":
        return args.isEmpty() ? rewriteChr(receiver) : null;
      case "chars":
        return args.isEmpty() && options.esLevelAtLeast(ConverterOptions.ES2015)
            ? IR.call(IR.constant("Array"), "from", receiver)
            : null;
      case "*":
        return args.size() == 1 && isStringLike(receiver)
            ? IR.call(receiver, "repeat", args.get(0))
            : null;
      default:
        return null;
    }
  }

  private static @Nullable Node rewriteRenamed(Node receiver, String method, List<Node> args) {
    String name = RENAMES.get(method);
    if (method.equals("include?") && args.size() == 1 && isRange(unwrapParens(receiver))) {
      return rangeIncludes(unwrapParens(receiver), args.get(0));
    }
    if (method.equals("sub") && args.size() == 2) {
      return IR.call(receiver, name, args.get(0), replacement(args.get(1)));
    }
    return IR.call(receiver, name, args.toArray(new Node[0]));
  }

  /** {@code (1..10).include?(x)} tests the bounds instead of building the range. */
  private static @Nullable Node rangeIncludes(Node range, Node value) {
    Node low = range.getNode(0);
    Node high = range.getNode(1);
    if (low == null || high == null || !isSimple(value)) {
      return null;
    }
    String upper = range.isToken(Token.IRANGE) ? "<=" : "<";
    return IR.and(IR.send(value, ">=", low), IR.send(value, upper, high));
  }

  private static Node rewriteFirst(Node receiver, List<Node> args) {
    if (args.isEmpty()) {
      return IR.send(receiver, "[]", IR.number(0));
    }
    return IR.call(receiver, "slice", IR.number(0), args.get(0));
  }

  private static @Nullable Node rewriteLast(Node receiver, List<Node> args) {
    if (!isSimple(receiver)) {
      return null;
    }
    Node length = IR.attr(receiver, "length");
    if (args.isEmpty()) {
      return IR.send(receiver, "[]", IR.send(length, "-", IR.number(1)));
    }
    return IR.call(receiver, "slice", IR.send(length, "-", args.get(0)), length);
  }

  /** Negative indexes count from the end and ranges become slices. */
  private static @Nullable Node rewriteIndex(Node receiver, Node index) {
    if (index.isToken(Token.INT)) {
      long value = (Long) index.getChild(0);
      if (value >= 0 || !isSimple(receiver)) {
        return null;
      }
      return IR.send(receiver, "[]", IR.send(IR.attr(receiver, "length"), "-", IR.number(-value)));
    }
    if (!isRange(index)) {
      return null;
    }
    Node start = index.getNode(0);
    Node end = index.getNode(1);
    Node from = start == null ? IR.number(0) : start;
    if (end == null) {
      return IR.call(receiver, "slice", from);
    }
    if (index.isToken(Token.ERANGE)) {
      return IR.call(receiver, "slice", from, end);
    }
    if (end.isToken(Token.INT)) {
      long last = (Long) end.getChild(0);
      return last == -1
          ? IR.call(receiver, "slice", from)
          : IR.call(receiver, "slice", from, IR.number(last + 1));
    }
    return IR.call(receiver, "slice", from, IR.send(end, "+", IR.number(1)));
  }

  private Node rewriteExtreme(Node receiver, String method) {
    if (receiver.isToken(Token.ARRAY)
        && receiver.nodeChildren().stream().noneMatch(e -> e.isToken(Token.SPLAT))) {
      return IR.call(IR.constant("Math"), method, receiver.nodeChildren().toArray(new Node[0]));
    }
    return IR.call(IR.constant("Math"), method, Node.of(Token.SPLAT, receiver));
  }

  /** {@code a.sum} adds the elements with {@code reduce}, starting from zero. */
  private static Node rewriteSum(Node receiver) {
    Node adder =
        IR.block(
            IR.send(null, "lambda"),
            IR.args("a", "b"),
            IR.autoreturn(IR.send(IR.lvar("a"), "+", IR.lvar("b"))));
    return IR.call(receiver, "reduce", adder, IR.number(0));
  }

  private @Nullable Node rewriteMerge(Node receiver, List<Node> args) {
    if (options.esLevelAtLeast(ConverterOptions.ES2018)) {
      List<Node> pairs = new ArrayList<>();
      pairs.add(Node.of(Token.KWSPLAT, receiver));
      for (Node arg : args) {
        if (arg.isToken(Token.HASH)) {
          pairs.addAll(arg.nodeChildren());
        } else {
          pairs.add(Node.of(Token.KWSPLAT, arg));
        }
      }
      return IR.hash(pairs.toArray(new Node[0]));
    }
    if (options.esLevelAtLeast(ConverterOptions.ES2015)) {
      List<Node> sources = new ArrayList<>();
      sources.add(IR.hash());
      sources.add(receiver);
      sources.addAll(args);
      return IR.call(IR.constant("Object"), "assign", sources.toArray(new Node[0]));
    }
    throw UnsupportedConstructException.requiresLevel(
        Stage.FILTER,
        "merge",
        ConverterOptions.ES2015,
        options.getEsLevel(),
        IR.send(receiver, "merge", args).withSpanOf(receiver));
  }

  /** {@code gsub} replaces every match, so its pattern always carries the global flag. */
  private static @Nullable Node rewriteGsub(Node receiver, List<Node> args) {
    Node pattern = globalPattern(args.get(0));
    if (pattern == null) {
      return null;
    }
    return IR.call(receiver, "replace", pattern, replacement(args.get(1)));
  }

  private static @Nullable Node globalPattern(Node pattern) {
    if (pattern.isToken(Token.STR)) {
      String quoted = REGEXP_SPECIALS.matcher(pattern.getString(0)).replaceAll("\\\\$0");
      return Node.of(Token.REGEXP, IR.string(quoted), Node.of(Token.REGOPT, "g"))
          .withSpanOf(pattern);
    }
    if (!pattern.isToken(Token.REGEXP)) {
      return null;
    }
    int last = pattern.getChildCount() - 1;
    Node flags = pattern.getNode(last);
    List<@Nullable Object> options = new ArrayList<>();
    options.add("g");
    if (flags != null) {
      for (Object flag : flags.getChildren()) {
        if (!"g".equals(flag)) {
          options.add(flag);
        }
      }
    }
    return pattern.withChild(last, Node.create(Token.REGOPT, options, null));
  }

  /** Ruby spells back references in a replacement {@code \1}; JavaScript spells them {@code $1}. */
  private static Node replacement(Node value) {
    if (!value.isToken(Token.STR)) {
      return value;
    }
    Matcher matcher = BACK_REFERENCE.matcher(value.getString(0));
    return matcher.find() ? value.withChild(0, matcher.replaceAll("\\$$1")) : value;
  }

  /** {@code s.gsub!(a, b)} assigns the replaced string back to {@code s}. */
  private static @Nullable Node rewriteInPlace(Node receiver, String method, List<Node> args) {
    Node replaced =
        method.equals("gsub!")
            ? rewriteGsub(receiver, args)
            : IR.call(receiver, "replace", args.get(0), replacement(args.get(1)));
    if (replaced == null) {
      return null;
    }
    switch (receiver.getToken()) {
      case LVAR:
        return IR.lvasgn(receiver.getString(0), replaced);
      case IVAR:
        return Node.of(Token.IVASGN, receiver.getString(0), replaced);
      case SEND:
        if (receiver.getChildCount() == 2 && receiver.getNode(0) != null) {
          return IR.send(receiver.getNode(0), receiver.getString(1) + "=", replaced);
        }
        return null;
      default:
        return null;
    }
  }

  private static Node rewriteOrd(Node receiver) {
    if (receiver.isToken(Token.STR) && receiver.getString(0).length() == 1) {
      return IR.number(receiver.getString(0).charAt(0));
    }
    return IR.call(receiver, "charCodeAt", IR.number(0));
  }

  private static Node rewriteChr(Node receiver) {
    if (receiver.isToken(Token.INT)) {
      long code = (Long) receiver.getChild(0);
      if (code >= 0 && code <= Character.MAX_VALUE) {
        return IR.string(String.valueOf((char) code));
      }
    }
    return IR.call(IR.constant("String"), "fromCharCode", receiver);
  }

  private static Node random() {
    return IR.call(IR.constant("Math"), "random");
  }

  private static Node[] prepend(Node first, List<Node> rest) {
    Node[] all = new Node[rest.size() + 1];
    all[0] = first;
    for (int i = 0; i < rest.size(); i++) {
      all[i + 1] = rest.get(i);
    }
    return all;
  }

  private static boolean isStringLike(Node n) {
    return n.isToken(Token.STR) || n.isToken(Token.DSTR);
  }

  private static Node unwrapParens(Node n) {
    Node current = n;
    while (current.isToken(Token.BEGIN) && current.getChildCount() == 1) {
      Node only = current.getNode(0);
      if (only == null) {
        break;
      }
      current = only;
    }
    return current;
  }

  private static boolean isRange(Node n) {
    return n.isToken(Token.IRANGE) || n.isToken(Token.ERANGE);
  }

  private static boolean isErrorClass(Node n) {
    return n.isToken(Token.CONST)
        && n.getNode(0) == null
        && ERROR_CLASSES.contains(n.getString(1));
  }

  private static boolean isSimple(Node n) {
    switch (n.getToken()) {
      case LVAR:
      case IVAR:
      case CONST:
      case SELF:
      case INT:
      case STR:
        return true;
      case SEND:
        return n.getChildCount() == 2 && (n.getNode(0) == null || isSimple(n.getNonNullNode(0)));
      default:
        return false;
    }
  }
}
