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

import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Finds the local variables a statement assigns, so that the code generator can declare them
 * before the statement when a declaration cannot go where the assignment is.
 *
 * <p>Walks stop at function boundaries: method, class and module bodies and blocks introduce their
 * own locals.
 */
final class DeclarationAnalyzer {

  /** Names a statement assigns, split by where the assignment happens. */
  static final class Assignments {
    /** Assigned inside an expression, where no declaration keyword may appear. */
    final Set<String> inExpressions = new LinkedHashSet<>();
    /** Assigned as statements of a nested body: an if branch, a loop, a case or a try. */
    final Set<String> inNestedBodies = new LinkedHashSet<>();
  }

  private DeclarationAnalyzer() {}

  /**
   * Collects the assignments of {@code statement}, leaving out the target of the statement itself
   * when it is an assignment.
   */
  static Assignments assignments(Node statement) {
    Assignments result = new Assignments();
    visitStatement(statement, false, true, result);
    return result;
  }

  private static void visitStatement(
      Node node, boolean nested, boolean top, Assignments result) {
    switch (node.getToken()) {
      case EXPORT:
        for (Node child : node.nodeChildren()) {
          visitStatement(child, nested, top, result);
        }
        return;
      case BEGIN:
      case KWBEGIN:
      case AUTORETURN:
        for (Node child : node.nodeChildren()) {
          visitStatement(child, nested, false, result);
        }
        return;
      case IF:
        visitExpression(node.getNonNullNode(0), nested, result);
        visitBody(node.getNode(1), result);
        visitBody(node.getNode(2), result);
        return;
      case WHILE:
      case UNTIL:
      case WHILE_POST:
      case UNTIL_POST:
        visitExpression(node.getNonNullNode(0), nested, result);
        visitBody(node.getNode(1), result);
        return;
      case FOR:
        addTargets(node.getNonNullNode(0), result.inNestedBodies);
        visitExpression(node.getNonNullNode(1), nested, result);
        visitBody(node.getNode(2), result);
        return;
      case CASE:
        visitCase(node, nested, result);
        return;
      case RESCUE:
        visitBody(node.getNode(0), result);
        for (int i = 1; i < node.getChildCount(); i++) {
          Node clause = node.getNode(i);
          if (clause == null) {
            continue;
          }
          if (clause.isToken(Token.RESBODY)) {
            visitBody(clause.getNode(2), result);
          } else {
            visitBody(clause, result);
          }
        }
        return;
      case ENSURE:
        visitBody(node.getNode(0), result);
        visitBody(node.getNode(1), result);
        return;
      case LVASGN:
        if (!top) {
          (nested ? result.inNestedBodies : result.inExpressions).add(node.getString(0));
        }
        if (node.getChildCount() > 1) {
          visitExpression(node.getNonNullNode(1), nested, result);
        }
        return;
      case OR_ASGN:
      case AND_ASGN:
      case OP_ASGN:
        {
          Node target = node.getNonNullNode(0);
          if (target.isToken(Token.LVASGN)) {
            if (!top) {
              (nested ? result.inNestedBodies : result.inExpressions).add(target.getString(0));
            }
          } else {
            visitExpression(target, nested, result);
          }
          visitExpression(node.getNonNullNode(node.getChildCount() - 1), nested, result);
          return;
        }
      case MASGN:
        if (!top) {
          addTargets(node.getNonNullNode(0), nested ? result.inNestedBodies : result.inExpressions);
        }
        visitExpression(node.getNonNullNode(1), nested, result);
        return;
      default:
        visitExpression(node, nested, result);
    }
  }

  private static void visitCase(Node node, boolean nested, Assignments result) {
    Node subject = node.getNode(0);
    if (subject != null) {
      visitExpression(subject, nested, result);
    }
    for (int i = 1; i < node.getChildCount(); i++) {
      Node clause = node.getNode(i);
      if (clause == null) {
        continue;
      }
      if (clause.isToken(Token.WHEN)) {
        int last = clause.getChildCount() - 1;
        for (int j = 0; j < last; j++) {
          visitExpression(clause.getNonNullNode(j), nested, result);
        }
        visitBody(clause.getNode(last), result);
      } else {
        visitBody(clause, result);
      }
    }
  }

  private static void visitBody(@Nullable Node body, Assignments result) {
    if (body != null) {
      visitStatement(body, true, false, result);
    }
  }

  private static void visitExpression(Node node, boolean nested, Assignments result) {
    switch (node.getToken()) {
      case DEF:
      case DEFS:
      case CLASS:
      case MODULE:
        return;
      case BLOCK:
      case NUMBLOCK:
        visitExpression(node.getNonNullNode(0), nested, result);
        return;
      case LVASGN:
        (nested ? result.inNestedBodies : result.inExpressions).add(node.getString(0));
        if (node.getChildCount() > 1) {
          visitExpression(node.getNonNullNode(1), nested, result);
        }
        return;
      case MASGN:
        addTargets(node.getNonNullNode(0), nested ? result.inNestedBodies : result.inExpressions);
        visitExpression(node.getNonNullNode(1), nested, result);
        return;
      default:
        break;
    }
    for (Node child : node.nodeChildren()) {
      visitExpression(child, nested, result);
    }
  }

  /** Adds the local names among the targets of a multiple assignment or loop variable. */
  static void addTargets(Node target, Set<String> names) {
    switch (target.getToken()) {
      case LVASGN:
        names.add(target.getString(0));
        break;
      case MLHS:
        for (Node child : target.nodeChildren()) {
          addTargets(child, names);
        }
        break;
      case SPLAT:
        if (target.getChildCount() > 0 && target.getNode(0) != null) {
          addTargets(target.getNonNullNode(0), names);
        }
        break;
      default:
        break;
    }
  }

  /** Local names read or updated anywhere in {@code statements}, closures included. */
  static Set<String> references(List<Node> statements) {
    Set<String> names = new LinkedHashSet<>();
    for (Node statement : statements) {
      collectReferences(statement, names);
    }
    return names;
  }

  private static void collectReferences(Node node, Set<String> names) {
    if (node.isToken(Token.LVAR)) {
      names.add(node.getString(0));
    } else if ((node.isToken(Token.OP_ASGN)
            || node.isToken(Token.OR_ASGN)
            || node.isToken(Token.AND_ASGN))
        && node.getNonNullNode(0).isToken(Token.LVASGN)) {
      names.add(node.getNonNullNode(0).getString(0));
    }
    for (Node child : node.nodeChildren()) {
      collectReferences(child, names);
    }
  }

  /** Every identifier-like name in the tree, used to keep temporaries apart from program names. */
  static Set<String> identifiers(Node root) {
    Set<String> names = new LinkedHashSet<>();
    collectIdentifiers(root, names);
    return names;
  }

  private static void collectIdentifiers(Node node, Set<String> names) {
    switch (node.getToken()) {
      case LVAR:
      case LVASGN:
      case GVAR:
      case GVASGN:
      case ARG:
      case OPTARG:
      case RESTARG:
      case KWARG:
      case KWOPTARG:
      case KWRESTARG:
      case BLOCKARG:
      case SHADOWARG:
        if (node.getChildCount() > 0 && node.getChild(0) instanceof String) {
          names.add(node.getString(0));
        }
        break;
      case SEND:
        if (node.getNode(0) == null) {
          names.add(node.getString(1));
        }
        break;
      default:
        break;
    }
    for (Node child : node.nodeChildren()) {
      collectIdentifiers(child, names);
    }
  }

  /** Whether a method body yields to its block, looking into blocks but not nested methods. */
  static boolean containsYield(@Nullable Node node) {
    if (node == null) {
      return false;
    }
    switch (node.getToken()) {
      case YIELD:
        return true;
      case DEF:
      case DEFS:
      case CLASS:
      case MODULE:
        return false;
      default:
        break;
    }
    for (Node child : node.nodeChildren()) {
      if (containsYield(child)) {
        return true;
      }
    }
    return false;
  }

  /** Whether code refers to the current object, looking into blocks but not nested methods. */
  static boolean referencesSelf(@Nullable Node node) {
    if (node == null) {
      return false;
    }
    switch (node.getToken()) {
      case SELF:
      case IVAR:
      case IVASGN:
      case SUPER:
      case ZSUPER:
        return true;
      case DEF:
      case DEFS:
      case CLASS:
      case MODULE:
        return false;
      default:
        break;
    }
    for (Node child : node.nodeChildren()) {
      if (referencesSelf(child)) {
        return true;
      }
    }
    return false;
  }
}
