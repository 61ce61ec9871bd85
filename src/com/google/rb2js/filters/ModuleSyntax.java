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
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Recognizes the Ruby spellings of {@code import} and {@code export} statements and builds the
 * {@link Token#IMPORT} and {@link Token#EXPORT} nodes the code generator prints. Shared by the
 * module filters.
 */
final class ModuleSyntax {

  static final String DEFAULT = "default";

  private ModuleSyntax() {}

  /** The statements of a program, looking through a top level {@code begin}. */
  static List<Node> statements(Node root) {
    return root.isToken(Token.BEGIN) ? root.nodesFrom(0) : ImmutableList.of(root);
  }

  /** Rebuilds a program from its statements, splicing nested statement groups. */
  static Node program(Node root, List<Node> statements) {
    List<Node> flat = new ArrayList<>();
    for (Node statement : statements) {
      if (statement.isToken(Token.BEGIN)) {
        flat.addAll(statement.nodesFrom(0));
      } else {
        flat.add(statement);
      }
    }
    if (flat.size() == 1 && !root.isToken(Token.BEGIN)) {
      return flat.get(0);
    }
    return Node.create(Token.BEGIN, flat, root.getSpan());
  }

  private static boolean isCommand(Node n, String name) {
    return n.isToken(Token.SEND) && n.getNode(0) == null && n.getString(1).equals(name);
  }

  /**
   * Converts {@code export X}, {@code export default X} and {@code export [A, default: B]}.
   * Returns null for anything else.
   */
  static @Nullable Node asExport(Node statement) {
    if (statement.isToken(Token.EXPORT)) {
      return statement;
    }
    if (!isCommand(statement, "export") || statement.getChildCount() != 3) {
      return null;
    }
    Node value = statement.getNonNullNode(2);
    if (isCommand(value, DEFAULT) && value.getChildCount() == 3) {
      return Node.of(Token.EXPORT, DEFAULT, value.getNonNullNode(2)).withSpanOf(statement);
    }
    if (value.isToken(Token.ARRAY)) {
      List<Node> names = new ArrayList<>();
      for (Node element : value.nodeChildren()) {
        if (element.isToken(Token.HASH)) {
          for (Node pair : element.nodeChildren()) {
            names.add(IR.pair(pair.getNonNullNode(1), pair.getNonNullNode(0)));
          }
        } else {
          names.add(element);
        }
      }
      return Node.of(Token.EXPORT, IR.array(names).withSpanOf(value)).withSpanOf(statement);
    }
    return Node.of(Token.EXPORT, value).withSpanOf(statement);
  }

  /**
   * Converts {@code import "x"}, {@code import X, "x"}, {@code import X, from: "x"}, {@code
   * import X, as: "*", from: "x"} and {@code import [X, Y], from: "x"}. Returns null for anything
   * else, including the dynamic {@code import()} function.
   */
  static @Nullable Node asImport(Node statement) {
    if (!isCommand(statement, "import")) {
      return null;
    }
    List<Node> args = statement.nodesFrom(2);
    if (args.size() == 1) {
      Node only = args.get(0);
      if (only.isToken(Token.STR)) {
        return Node.of(Token.IMPORT, only.getString(0)).withSpanOf(statement);
      }
      // import X from "x" parses as import(X(from("x"))).
      if (only.isToken(Token.SEND) && only.getNode(0) == null && only.getChildCount() == 3) {
        Node from = only.getNonNullNode(2);
        if (isCommand(from, "from") && from.getChildCount() == 3) {
          Node path = from.getNonNullNode(2);
          if (path.isToken(Token.STR)) {
            return Node.of(Token.IMPORT, path.getString(0), IR.string(only.getString(1)))
                .withSpanOf(statement);
          }
        }
      }
      return null;
    }
    if (args.size() != 2) {
      return null;
    }
    Node specifier = args.get(0);
    Node source = args.get(1);
    if (source.isToken(Token.STR)) {
      return Node.of(Token.IMPORT, source.getString(0), specifier).withSpanOf(statement);
    }
    if (!source.isToken(Token.HASH)) {
      return null;
    }
    String path = null;
    boolean namespace = false;
    for (Node pair : source.nodeChildren()) {
      if (!pair.isToken(Token.PAIR) || !pair.getNonNullNode(0).isToken(Token.SYM)) {
        return null;
      }
      String key = pair.getNonNullNode(0).getString(0);
      Node value = pair.getNonNullNode(1);
      if (key.equals("from") && value.isToken(Token.STR)) {
        path = value.getString(0);
      } else if (key.equals("as") && value.isToken(Token.STR) && value.getString(0).equals("*")) {
        namespace = true;
      } else {
        return null;
      }
    }
    if (path == null) {
      return null;
    }
    Node binding = namespace ? Node.of(Token.SPLAT, specifier) : specifier;
    return Node.of(Token.IMPORT, path, binding).withSpanOf(statement);
  }

  /**
   * Whether a top level statement is a definition that {@code autoexports} exports: a method, a
   * class or module with an unscoped name, or an unscoped constant.
   */
  static boolean isExportable(Node statement) {
    switch (statement.getToken()) {
      case DEF:
        return true;
      case CLASS:
      case MODULE:
        return statement.getNonNullNode(0).getNode(0) == null;
      case CASGN:
        return statement.getNode(0) == null;
      default:
        return false;
    }
  }

  /** The local name a definition or import binding introduces, or null. */
  static @Nullable String definedName(Node n) {
    switch (n.getToken()) {
      case DEF:
      case LVASGN:
      case STR:
      case SYM:
      case LVAR:
        return n.getString(0);
      case CLASS:
      case MODULE:
        return definedName(n.getNonNullNode(0));
      case CONST:
        return n.getNode(0) == null ? n.getString(1) : null;
      case CASGN:
        return n.getNode(0) == null ? n.getString(1) : null;
      case SEND:
        return n.getNode(0) == null && n.getChildCount() == 2 ? n.getString(1) : null;
      case SPLAT:
        return definedName(n.getNonNullNode(0));
      case EXPORT:
        return definedName(n.getNonNullNode(n.getChildCount() - 1));
      default:
        return null;
    }
  }
}
