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

import com.google.rb2js.AbstractFilter;
import com.google.rb2js.ConverterOptions;
import com.google.rb2js.FilterChain;
import com.google.rb2js.FilterRegistry;
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * CommonJS exports. {@code export def f} becomes {@code exports.f = ...}, {@code export default
 * x} becomes {@code module.exports = x}, and with {@code autoexports} every top level definition is
 * exported that way. Also maps {@code __dir__} to {@code __dirname}.
 */
public final class CjsFilter extends AbstractFilter {

  private final ConverterOptions options;

  public CjsFilter(ConverterOptions options) {
    super(FilterRegistry.CJS);
    this.options = options;
    on(Token.SEND, CjsFilter::rewriteDirectory);
  }

  private static @Nullable Node rewriteDirectory(Node node, FilterChain chain) {
    if (node.getNode(0) == null
        && node.getChildCount() == 2
        && node.getString(1).equals("__dir__")) {
      return IR.jsLiteral("__dirname").withSpanOf(node);
    }
    return null;
  }

  @Override
  public Node finish(Node root, FilterChain chain) {
    List<Node> statements = new ArrayList<>();
    for (Node statement : ModuleSyntax.statements(root)) {
      Node export = ModuleSyntax.asExport(statement);
      if (export == null && options.isAutoexports() && ModuleSyntax.isExportable(statement)) {
        export = Node.of(Token.EXPORT, statement).withSpanOf(statement);
      }
      Node rewritten = export == null ? null : toCommonJs(export);
      statements.add(rewritten == null ? statement : rewritten.withSpanOf(statement));
    }
    return ModuleSyntax.program(root, statements);
  }

  /** Returns null when the export has no CommonJS spelling. */
  private static @Nullable Node toCommonJs(Node export) {
    Node value = export.getNonNullNode(export.getChildCount() - 1);
    if (export.getChildCount() == 2) {
      return assign(IR.jsLiteral("module"), "exports", value);
    }
    switch (value.getToken()) {
      case ARRAY:
        {
          List<Node> assignments = new ArrayList<>();
          for (Node element : value.nodeChildren()) {
            Node local = element.isToken(Token.PAIR) ? element.getNonNullNode(0) : element;
            Node exported = element.isToken(Token.PAIR) ? element.getNonNullNode(1) : element;
            String name = ModuleSyntax.definedName(exported);
            if (name == null) {
              return null;
            }
            assignments.add(IR.send(exports(), name + "=", reference(local)));
          }
          return IR.begin(assignments);
        }
      case CASGN:
        if (value.getNode(0) != null) {
          return null;
        }
        return IR.send(exports(), value.getString(1) + "=", value.getNonNullNode(2));
      case LVASGN:
        return IR.send(exports(), value.getString(0) + "=", value.getNonNullNode(1));
      default:
        {
          String name = ModuleSyntax.definedName(value);
          return name == null ? null : assign(exports(), name, value);
        }
    }
  }

  /** Assigns a definition or expression to {@code target.property}. */
  private static @Nullable Node assign(Node target, String property, Node value) {
    switch (value.getToken()) {
      case DEF:
        return IR.send(
            target,
            property + "=",
            IR.block(IR.send(null, "proc"), value.getNonNullNode(1), value.getNode(2)));
      case CLASS:
      case MODULE:
        {
          Node name = value.getNonNullNode(0);
          if (name.getNode(0) != null) {
            return null;
          }
          // Names the class after the property, so the generator writes target.property = class.
          Node scoped = Node.of(Token.CONST, targetConstant(target), property).withSpanOf(name);
          return value.withChild(0, scoped);
        }
      default:
        return IR.send(target, property + "=", value);
    }
  }

  private static Node targetConstant(Node target) {
    return IR.constant(target.getString(0));
  }

  private static Node exports() {
    return IR.jsLiteral("exports");
  }

  private static Node reference(Node name) {
    if (name.isToken(Token.STR) || name.isToken(Token.SYM)) {
      return IR.lvar(name.getString(0));
    }
    return name;
  }
}
