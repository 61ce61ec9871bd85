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

import com.google.common.base.Splitter;
import com.google.rb2js.AbstractFilter;
import com.google.rb2js.ConverterOptions;
import com.google.rb2js.FilterChain;
import com.google.rb2js.FilterRegistry;
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ES module syntax. Turns top level {@code import} and {@code export} calls into module
 * statements, exports every top level definition when {@code autoexports} is set, and imports the
 * names listed in {@code autoimports} that the program uses without defining.
 *
 * <p>An {@code autoimports} key naming several comma separated names imports them together:
 * {@code "func, another" -> "func.js"} becomes {@code import {func, another} from "func.js"}.
 */
public final class EsmFilter extends AbstractFilter {

  private static final Logger logger = Logger.getLogger(EsmFilter.class.getName());

  private static final Splitter NAME_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private final ConverterOptions options;

  public EsmFilter(ConverterOptions options) {
    super(FilterRegistry.ESM);
    this.options = options;
  }

  @Override
  public Node finish(Node root, FilterChain chain) {
    List<Node> statements = new ArrayList<>();
    for (Node statement : ModuleSyntax.statements(root)) {
      Node rewritten = ModuleSyntax.asImport(statement);
      if (rewritten == null) {
        rewritten = ModuleSyntax.asExport(statement);
      }
      if (rewritten == null && options.isAutoexports() && ModuleSyntax.isExportable(statement)) {
        rewritten = Node.of(Token.EXPORT, statement).withSpanOf(statement);
      }
      statements.add(rewritten == null ? statement : rewritten);
    }
    if (!options.getAutoimports().isEmpty()) {
      addAutoimports(statements, chain);
    }
    return ModuleSyntax.program(root, statements);
  }

  private void addAutoimports(List<Node> statements, FilterChain chain) {
    Set<String> defined = new HashSet<>();
    for (Node statement : statements) {
      if (statement.isToken(Token.IMPORT)) {
        for (Node binding : statement.nodesFrom(1)) {
          addBindings(binding, defined);
        }
      } else {
        String name = ModuleSyntax.definedName(statement);
        if (name != null) {
          defined.add(name);
        }
      }
    }
    Set<String> referenced = new LinkedHashSet<>();
    for (Node statement : statements) {
      if (!statement.isToken(Token.IMPORT)) {
        collectReferences(statement, referenced);
      }
    }
    for (Map.Entry<String, String> entry : options.getAutoimports().entrySet()) {
      List<String> names = NAME_SPLITTER.splitToList(entry.getKey());
      boolean used = false;
      for (String name : names) {
        used |= referenced.contains(name) && !defined.contains(name);
      }
      if (!used) {
        continue;
      }
      Node binding;
      if (names.size() == 1) {
        binding = IR.string(names.get(0));
      } else {
        List<Node> elements = new ArrayList<>();
        for (String name : names) {
          elements.add(IR.string(name));
        }
        binding = IR.array(elements);
      }
      logger.fine("Importing " + names + " from " + entry.getValue());
      chain.prepend(Node.of(Token.IMPORT, entry.getValue(), binding));
    }
  }

  private static void addBindings(Node binding, Set<String> names) {
    if (binding.isToken(Token.ARRAY)) {
      for (Node element : binding.nodeChildren()) {
        Node local = element.isToken(Token.PAIR) ? element.getNonNullNode(1) : element;
        addBindings(local, names);
      }
      return;
    }
    String name = ModuleSyntax.definedName(binding);
    if (name != null) {
      names.add(name);
    }
  }

  /** Unscoped constants and receiverless calls, the names a module import could provide. */
  private static void collectReferences(Node n, Set<String> names) {
    if (n.isToken(Token.CONST) && n.getNode(0) == null) {
      names.add(n.getString(1));
    } else if (n.isToken(Token.SEND) && n.getNode(0) == null) {
      names.add(n.getString(1));
    }
    for (Node child : n.nodeChildren()) {
      collectReferences(child, names);
    }
  }
}
