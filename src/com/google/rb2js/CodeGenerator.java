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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.rb2js.ConversionException.Stage;
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * CodeGenerator generates JavaScript from a rewritten tree, sending it to the specified
 * CodeConsumer.
 *
 * <p>Output is produced statement by statement with line breaks after opening braces but without
 * indentation; the {@link WhitespaceNormalizer} fixes indentation afterwards. Every piece of text
 * is written while the node it comes from is the innermost mapped node, which is how the source
 * map learns where output came from.
 */
final class CodeGenerator {
  private static final Logger logger = Logger.getLogger(CodeGenerator.class.getName());

  // JavaScript operator precedence, loosest first.
  private static final int COMMA = 1;
  private static final int ASSIGN = 3;
  private static final int CONDITIONAL = 4;
  private static final int LOGICAL_OR = 5;
  private static final int LOGICAL_AND = 6;
  private static final int EQUALITY = 10;
  private static final int RELATIONAL = 11;
  private static final int ADDITIVE = 13;
  private static final int UNARY = 16;
  private static final int CALL = 18;
  private static final int PRIMARY = 19;

  private static final ImmutableMap<String, Integer> BINARY_OPERATORS =
      ImmutableMap.<String, Integer>builder()
          .put("**", 15)
          .put("*", 14)
          .put("/", 14)
          .put("%", 14)
          .put("+", 13)
          .put("-", 13)
          .put("<<", 12)
          .put(">>", 12)
          .put("<", 11)
          .put("<=", 11)
          .put(">", 11)
          .put(">=", 11)
          .put("instanceof", 11)
          .put("in", 11)
          .put("==", 10)
          .put("!=", 10)
          .put("===", 10)
          .put("!==", 10)
          .put("&", 9)
          .put("^", 8)
          .put("|", 7)
          .buildOrThrow();

  private static final ImmutableSet<String> COMPARISONS =
      ImmutableSet.of("==", "!=", "===", "!==", "<", "<=", ">", ">=", "instanceof", "in");

  private static final ImmutableSet<String> CATCH_ALL =
      ImmutableSet.of("StandardError", "Exception");

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

  /** Parameter that receives the block of a method that yields without naming its block. */
  static final String IMPLICIT_BLOCK = "_implicitBlockYield";

  private enum JumpTarget {
    LOOP,
    FUNCTION,
    SWITCH
  }

  private enum FunctionKind {
    FUNCTION,
    CONSTRUCTOR,
    METHOD,
    GETTER,
    SETTER
  }

  /** The method or function whose body is being generated. */
  private static final class FunctionContext {
    final FunctionKind kind;
    final String name;
    final boolean isStatic;
    /** Parameters as written in a call that passes them all on, for implicit super. */
    final ImmutableList<String> forwarded;

    final @Nullable String blockName;

    FunctionContext(
        FunctionKind kind,
        String name,
        boolean isStatic,
        List<String> forwarded,
        @Nullable String blockName) {
      this.kind = kind;
      this.name = name;
      this.isStatic = isStatic;
      this.forwarded = ImmutableList.copyOf(forwarded);
      this.blockName = blockName;
    }
  }

  /** The class or module whose body is being generated. */
  private static final class ClassContext {
    /** JavaScript expression naming the class, e.g. {@code A.Person}. */
    final String name;

    final @Nullable Node superclass;
    final ClassBody body;

    ClassContext(String name, @Nullable Node superclass, ClassBody body) {
      this.name = name;
      this.superclass = superclass;
      this.body = body;
    }
  }

  /** What a parameter list declared, and what the function body must run first. */
  private static final class Parameters {
    final List<Runnable> prologue = new ArrayList<>();
    final List<String> forwarded = new ArrayList<>();
    @Nullable String blockName;
  }

  private final CodeConsumer cc;
  private final ConverterOptions options;
  private final int esLevel;
  private Scope scope;
  private final Deque<JumpTarget> jumps = new ArrayDeque<>();
  private @Nullable ClassContext classContext;
  private @Nullable FunctionContext function;
  private @Nullable String catchVariable;

  CodeGenerator(CodeConsumer consumer, ConverterOptions options) {
    this.cc = consumer;
    this.options = options;
    this.esLevel = options.getEsLevel();
    this.scope = new Scope(es2015(), ImmutableSet.of());
  }

  /** Inserts the strict mode directive. */
  void tagAsStrict() {
    cc.put("\"use strict\"");
    cc.separator();
  }

  /** Generates a whole program. */
  void generate(Node root) {
    try {
      scope = new Scope(es2015(), DeclarationAnalyzer.identifiers(root));
      addStatements(ImmutableList.of(root));
    } catch (IndexOutOfBoundsException | NullPointerException | ClassCastException e) {
      // Statement lists are flattened and analyzed before any single node is emitted.
      throw new PipelineException(
          Stage.GENERATE,
          "malformed tree under " + root.getToken().getName() + ": " + e.getMessage(),
          root,
          e);
    }
    logger.fine("Generated " + cc.getLines().size() + " lines at ES" + esLevel);
  }

  private boolean es2015() {
    return esLevel >= ConverterOptions.ES2015;
  }

  private boolean atLeast(int level) {
    return options.esLevelAtLeast(level);
  }

  private String declarationKeyword() {
    return es2015() ? "let" : "var";
  }

  private UnsupportedConstructException unsupported(String message, Node n) {
    return new UnsupportedConstructException(Stage.GENERATE, message, n);
  }

  private UnsupportedConstructException requiresLevel(String feature, int level, Node n) {
    return UnsupportedConstructException.requiresLevel(Stage.GENERATE, feature, level, esLevel, n);
  }

  private static PipelineException malformed(String message, Node n) {
    return new PipelineException(Stage.GENERATE, message, n);
  }

  /**
   * Runs {@code body} with {@code n} as the innermost mapped node. A precondition failure while
   * generating a node means the tree has the wrong shape, which is reported against that node.
   */
  private void emit(Node n, Runnable body) {
    cc.startSourceMapping(n);
    try {
      body.run();
    } catch (IllegalStateException
        | IllegalArgumentException
        | IndexOutOfBoundsException
        | NullPointerException
        | ClassCastException e) {
      throw new PipelineException(
          Stage.GENERATE,
          "malformed " + n.getToken().getName() + " node: " + e.getMessage(),
          n,
          e);
    } finally {
      cc.endSourceMapping(n);
    }
  }

  // Statements.

  /** Splices nested statement groups and expands auto-returned bodies. */
  private static List<Node> flatten(List<Node> statements) {
    List<Node> result = new ArrayList<>();
    for (Node statement : statements) {
      switch (statement.getToken()) {
        case BEGIN:
        case KWBEGIN:
          result.addAll(flatten(statement.nodeChildren()));
          break;
        case AUTORETURN:
          {
            Node body = AutoReturn.apply(statement);
            if (body != null) {
              result.addAll(flatten(ImmutableList.of(body)));
            }
            break;
          }
        default:
          result.add(statement);
      }
    }
    return result;
  }

  private static List<Node> statementsOf(@Nullable Node body) {
    return body == null ? ImmutableList.of() : flatten(ImmutableList.of(body));
  }

  private void addStatements(List<Node> statements) {
    List<Node> flat = flatten(statements);
    for (int i = 0; i < flat.size(); i++) {
      if (i > 0) {
        cc.separator();
      }
      Node statement = flat.get(i);
      Set<String> hoisted = hoistedNames(statement, flat.subList(i + 1, flat.size()));
      if (!hoisted.isEmpty()) {
        cc.put(declarationKeyword() + " " + Joiner.on(", ").join(hoisted));
        for (String name : hoisted) {
          scope.declare(name);
        }
        cc.separator();
      }
      addStatement(statement);
    }
  }

  /**
   * Names to declare ahead of {@code statement}: locals it assigns inside expressions, and with
   * block scoping the locals it assigns in nested bodies that later statements still use.
   */
  private Set<String> hoistedNames(Node statement, List<Node> following) {
    DeclarationAnalyzer.Assignments assignments = DeclarationAnalyzer.assignments(statement);
    Set<String> names = new LinkedHashSet<>(assignments.inExpressions);
    if (es2015() && !assignments.inNestedBodies.isEmpty()) {
      if (statement.isToken(Token.CASE)) {
        names.addAll(assignments.inNestedBodies);
      } else {
        Set<String> later = DeclarationAnalyzer.references(following);
        for (String name : assignments.inNestedBodies) {
          if (later.contains(name)) {
            names.add(name);
          }
        }
      }
    }
    names.removeIf(scope::isDeclared);
    return names;
  }

  private void addStatement(Node n) {
    emit(n, () -> addStatementInner(n));
  }

  private void addStatementInner(Node n) {
    switch (n.getToken()) {
      case BEGIN:
      case KWBEGIN:
      case AUTORETURN:
        addStatements(ImmutableList.of(n));
        return;
      case IF:
        addIf(n, false);
        return;
      case CASE:
        addCase(n);
        return;
      case WHILE:
      case UNTIL:
        addWhile(n);
        return;
      case WHILE_POST:
      case UNTIL_POST:
        addDoWhile(n);
        return;
      case FOR:
        addFor(n);
        return;
      case BREAK:
        addBreak(n);
        return;
      case NEXT:
        addNext(n);
        return;
      case RETURN:
        addReturn(n);
        return;
      case RESCUE:
      case ENSURE:
        addTry(n);
        return;
      case DEF:
        addDef(n);
        return;
      case DEFS:
        addDefs(n);
        return;
      case CLASS:
        addClass(n);
        return;
      case MODULE:
        addModule(n);
        return;
      case LVASGN:
        addLocalAssignment(n);
        return;
      case CASGN:
        addConstantAssignment(n, true);
        return;
      case OR_ASGN:
      case AND_ASGN:
        addLogicalAssignment(n, true);
        return;
      case MASGN:
        addMultipleAssignment(n, true);
        return;
      case IMPORT:
        addImport(n);
        return;
      case EXPORT:
        addExport(n);
        return;
      case SEND:
        if (isRaise(n)) {
          addRaise(n);
          return;
        }
        if (isPush(n)) {
          addReceiver(n.getNonNullNode(0));
          cc.put(".push(");
          addExpr(n.getNonNullNode(2), ASSIGN);
          cc.put(")");
          return;
        }
        break;
      case BLOCK:
        if (AutoReturn.isLoopBlock(n)) {
          addLoopBlock(n);
          return;
        }
        break;
      case HASH:
        cc.put("(");
        addExpr(n, COMMA);
        cc.put(")");
        return;
      default:
        break;
    }
    addExpr(n, COMMA);
  }

  private static boolean isRaise(Node n) {
    return n.isToken(Token.SEND) && n.getNode(0) == null && n.getString(1).equals("raise");
  }

  private static boolean isPush(Node n) {
    return n.getNode(0) != null
        && n.getString(1).equals("<<")
        && n.getChildCount() == 3
        && !isSpecialArgument(n.getNonNullNode(2));
  }

  private static boolean isSpecialArgument(Node arg) {
    return arg.isToken(Token.SPLAT) || arg.isToken(Token.BLOCK_PASS);
  }

  private void addRaise(Node n) {
    List<Node> args = n.nodesFrom(2);
    if (args.isEmpty()) {
      if (catchVariable == null) {
        throw unsupported("raise without an exception outside of rescue", n);
      }
      cc.put("throw " + catchVariable);
      return;
    }
    Node first = args.get(0);
    if (args.size() > 2) {
      throw unsupported("raise with a backtrace", n);
    }
    cc.put("throw ");
    if (args.size() == 2 || first.isToken(Token.CONST)) {
      cc.put("new ");
      addExpr(first, CALL);
      cc.put("(");
      if (args.size() == 2) {
        addExpr(args.get(1), ASSIGN);
      }
      cc.put(")");
    } else {
      addExpr(first, COMMA);
    }
  }

  /** Writes a body in braces, in a fresh block scope. Short bodies may drop the braces. */
  private void addBody(@Nullable Node body, boolean allowBraceless) {
    scope.pushBlock();
    try {
      List<Node> list = statementsOf(body);
      Runnable statements = () -> addStatements(list);
      // A nested if would capture a following else.
      if (allowBraceless && list.size() == 1 && !list.get(0).isToken(Token.IF)) {
        cc.wrap(statements);
      } else {
        cc.block(statements);
      }
    } finally {
      scope.pop();
    }
  }

  // Control flow.

  private void addIf(Node n, boolean chained) {
    Node condition = n.getNonNullNode(0);
    Node then = n.getNode(1);
    Node otherwise = n.getNode(2);
    boolean negate = false;
    if (then == null && otherwise != null) {
      negate = true;
      then = otherwise;
      otherwise = null;
    }
    cc.put("if (");
    if (negate) {
      addNot(condition);
    } else {
      addExpr(condition, COMMA);
    }
    cc.put(") ");
    if (otherwise == null) {
      addBody(then, !chained);
      return;
    }
    addBody(then, false);
    cc.put(" else ");
    if (otherwise.isToken(Token.IF)) {
      Node elseIf = otherwise;
      emit(elseIf, () -> addIf(elseIf, true));
    } else {
      addBody(otherwise, false);
    }
  }

  private void addCase(Node n) {
    Node subject = n.getNode(0);
    List<Node> whens = new ArrayList<>();
    Node otherwise = null;
    for (int i = 1; i < n.getChildCount(); i++) {
      Node clause = n.getNode(i);
      if (clause != null && clause.isToken(Token.WHEN)) {
        whens.add(clause);
      } else {
        otherwise = clause;
      }
    }
    if (subject == null) {
      addStatement(caseToIf(whens, otherwise));
      return;
    }
    boolean ranges = false;
    for (Node when : whens) {
      for (int j = 0; j < when.getChildCount() - 1; j++) {
        Node value = when.getNonNullNode(j);
        if (value.isToken(Token.SPLAT)) {
          throw unsupported("splat in when", value);
        }
        ranges |= AutoReturn.isRange(value);
      }
    }
    if (ranges && !isSimple(subject)) {
      throw unsupported("case over ranges needs a variable as its subject", n);
    }
    boolean matchRanges = ranges;
    Node elseBody = otherwise;
    cc.put("switch (");
    if (matchRanges) {
      cc.put("true");
    } else {
      addExpr(subject, COMMA);
    }
    cc.put(") ");
    jumps.push(JumpTarget.SWITCH);
    try {
      cc.block(
          () -> {
            for (int i = 0; i < whens.size(); i++) {
              if (i > 0) {
                cc.separator();
              }
              addWhen(whens.get(i), matchRanges ? subject : null);
            }
            if (elseBody != null) {
              if (!whens.isEmpty()) {
                cc.separator();
              }
              cc.put("default:");
              cc.ws();
              addClauseBody(statementsOf(elseBody));
            }
          });
    } finally {
      jumps.pop();
    }
  }

  private void addWhen(Node when, @Nullable Node rangeSubject) {
    int last = when.getChildCount() - 1;
    emit(
        when,
        () -> {
          for (int j = 0; j < last; j++) {
            if (j > 0) {
              cc.ws();
            }
            Node value = when.getNonNullNode(j);
            cc.put("case ");
            if (rangeSubject != null) {
              addCaseCondition(rangeSubject, value);
            } else {
              addExpr(value, COMMA);
            }
            cc.put(":");
          }
          cc.ws();
          List<Node> statements = statementsOf(when.getNode(last));
          addClauseBody(statements);
          if (!endsWithJump(statements)) {
            if (!statements.isEmpty()) {
              cc.separator();
            }
            cc.put("break");
          }
        });
  }

  private void addClauseBody(List<Node> statements) {
    scope.pushBlock();
    try {
      addStatements(statements);
    } finally {
      scope.pop();
    }
  }

  private void addCaseCondition(Node subject, Node value) {
    Node range = AutoReturn.unwrapParens(value);
    if (!AutoReturn.isRange(range)) {
      addExpr(subject, EQUALITY + 1);
      cc.put(" === ");
      addExpr(value, EQUALITY + 1);
      return;
    }
    Node low = range.getNode(0);
    Node high = range.getNode(1);
    if (low != null) {
      addExpr(subject, RELATIONAL + 1);
      cc.put(" >= ");
      addExpr(low, RELATIONAL + 1);
    }
    if (high != null) {
      if (low != null) {
        cc.put(" && ");
      }
      addExpr(subject, RELATIONAL + 1);
      cc.put(range.isToken(Token.ERANGE) ? " < " : " <= ");
      addExpr(high, RELATIONAL + 1);
    }
  }

  /** A case without a subject tests each when value for truth, like an if chain. */
  private static Node caseToIf(List<Node> whens, @Nullable Node otherwise) {
    Node result = otherwise;
    for (int i = whens.size() - 1; i >= 0; i--) {
      Node when = whens.get(i);
      int last = when.getChildCount() - 1;
      Node condition = when.getNonNullNode(0);
      for (int j = 1; j < last; j++) {
        condition = IR.or(condition, when.getNonNullNode(j)).withSpanOf(when);
      }
      result = IR.ifNode(condition, when.getNode(last), result).withSpanOf(when);
    }
    return result == null ? IR.nil() : result;
  }

  private static boolean endsWithJump(List<Node> statements) {
    if (statements.isEmpty()) {
      return false;
    }
    Node last = statements.get(statements.size() - 1);
    switch (last.getToken()) {
      case RETURN:
      case BREAK:
      case NEXT:
        return true;
      case SEND:
        return isRaise(last);
      default:
        return false;
    }
  }

  private void addWhile(Node n) {
    cc.put("while (");
    if (n.isToken(Token.UNTIL)) {
      addNot(n.getNonNullNode(0));
    } else {
      addExpr(n.getNonNullNode(0), COMMA);
    }
    cc.put(") ");
    addLoopBody(n.getNode(1));
  }

  private void addDoWhile(Node n) {
    cc.put("do ");
    addLoopBody(n.getNode(1));
    cc.put(" while (");
    if (n.isToken(Token.UNTIL_POST)) {
      addNot(n.getNonNullNode(0));
    } else {
      addExpr(n.getNonNullNode(0), COMMA);
    }
    cc.put(")");
  }

  private void addLoopBody(@Nullable Node body) {
    jumps.push(JumpTarget.LOOP);
    try {
      addBody(body, false);
    } finally {
      jumps.pop();
    }
  }

  private void addFor(Node n) {
    Node variable = n.getNonNullNode(0);
    Node collection = n.getNonNullNode(1);
    Node body = n.getNode(2);
    Node range = AutoReturn.unwrapParens(collection);
    if (AutoReturn.isRange(range)) {
      if (!variable.isToken(Token.LVASGN)) {
        throw unsupported("counted loop over " + variable.getToken().getName(), variable);
      }
      addCountedLoop(variable.getString(0), range, null, body);
      return;
    }
    if (es2015()) {
      scope.pushBlock();
      jumps.push(JumpTarget.LOOP);
      try {
        cc.put("for (");
        Set<String> locals = new LinkedHashSet<>();
        DeclarationAnalyzer.addTargets(variable, locals);
        locals.removeIf(scope::isDeclared);
        if (!locals.isEmpty()) {
          cc.put("let ");
          locals.forEach(scope::declareLocal);
        }
        addAssignmentTarget(variable);
        cc.put(" of ");
        addExpr(collection, ASSIGN);
        cc.put(") ");
        cc.block(() -> addStatements(statementsOf(body)));
      } finally {
        jumps.pop();
        scope.pop();
      }
      return;
    }
    if (!variable.isToken(Token.LVASGN)) {
      throw requiresLevel("destructuring loop variable", ConverterOptions.ES2015, variable);
    }
    addReceiver(collection);
    cc.put(".forEach(function(" + variable.getString(0) + ") ");
    scope.pushFunction();
    jumps.push(JumpTarget.FUNCTION);
    try {
      scope.declareLocal(variable.getString(0));
      cc.block(() -> addStatements(statementsOf(body)));
    } finally {
      jumps.pop();
      scope.pop();
    }
    addBind(body);
    cc.put(")");
  }

  /** Binds a function expression to the current object when its body uses it. */
  private void addBind(@Nullable Node body) {
    if (function != null && DeclarationAnalyzer.referencesSelf(body)) {
      cc.put(".bind(this)");
    }
  }

  /**
   * Writes {@code for (let i = low; i <= high; i++)}. The range gives the bounds; a null name
   * asks for a temporary.
   */
  private void addCountedLoop(
      @Nullable String name, Node range, @Nullable Node step, @Nullable Node body) {
    Node low = range.getNode(0);
    Node high = range.getNode(1);
    if (low == null || high == null) {
      throw unsupported("loop over an endless range", range);
    }
    addCountedLoop(name, low, high, range.isToken(Token.ERANGE), step, body);
  }

  private void addCountedLoop(
      @Nullable String name,
      Node low,
      Node high,
      boolean exclusive,
      @Nullable Node step,
      @Nullable Node body) {
    scope.pushBlock();
    jumps.push(JumpTarget.LOOP);
    try {
      String index = name == null ? scope.uniqueName("i") : name;
      cc.put("for (");
      if (es2015()) {
        if (!scope.isDeclared(index)) {
          cc.put("let ");
          scope.declareLocal(index);
        }
      } else if (scope.declare(index)) {
        cc.put("var ");
      }
      cc.put(index + " = ");
      addExpr(low, ASSIGN);
      cc.put("; " + index + (exclusive ? " < " : " <= "));
      addExpr(high, RELATIONAL + 1);
      cc.put("; " + index);
      if (step == null) {
        cc.put("++");
      } else {
        cc.put(" += ");
        addExpr(step, ASSIGN);
      }
      cc.put(") ");
      cc.block(() -> addStatements(statementsOf(body)));
    } finally {
      jumps.pop();
      scope.pop();
    }
  }

  /** Blocks that iterate without producing a value become plain loops. */
  private void addLoopBlock(Node block) {
    Node call = block.getNonNullNode(0);
    Node args = block.getNonNullNode(1);
    Node body = block.getNode(2);
    if (body != null && body.isToken(Token.AUTORETURN)) {
      body = body.getNode(0);
    }
    String method = call.getString(1);
    String variable = null;
    if (args.hasChildren()) {
      Node first = args.getNonNullNode(0);
      if (!first.isToken(Token.ARG)) {
        throw unsupported("loop block parameter " + first.getToken().getName(), first);
      }
      variable = first.getString(0);
    }
    Node receiver = call.getNode(0);
    switch (method) {
      case "loop":
        cc.put("while (true) ");
        addLoopBody(body);
        return;
      case "times":
        addCountedLoop(variable, IR.number(0), checkNotNullNode(receiver, call), true, null, body);
        return;
      case "step":
        addCountedLoop(
            variable,
            AutoReturn.unwrapParens(checkNotNullNode(receiver, call)),
            call.getNonNullNode(2),
            body);
        return;
      default:
        addCountedLoop(
            variable, AutoReturn.unwrapParens(checkNotNullNode(receiver, call)), null, body);
    }
  }

  private static Node checkNotNullNode(@Nullable Node node, Node parent) {
    if (node == null) {
      throw malformed("missing receiver", parent);
    }
    return node;
  }

  private void addBreak(Node n) {
    JumpTarget target = jumps.peek();
    if (n.hasChildren() && n.getNode(0) != null) {
      throw unsupported("break with a value", n);
    }
    if (target == JumpTarget.FUNCTION) {
      throw unsupported("break out of a block", n);
    }
    if (target == JumpTarget.SWITCH) {
      throw unsupported("break inside a case", n);
    }
    cc.put("break");
  }

  private void addNext(Node n) {
    JumpTarget target = null;
    for (JumpTarget jump : jumps) {
      if (jump != JumpTarget.SWITCH) {
        target = jump;
        break;
      }
    }
    Node value = n.hasChildren() ? n.getNode(0) : null;
    if (target == JumpTarget.FUNCTION) {
      cc.put("return");
      if (value != null) {
        cc.put(" ");
        addExpr(value, COMMA);
      }
      return;
    }
    if (value != null) {
      throw unsupported("next with a value inside a loop", n);
    }
    cc.put("continue");
  }

  private void addReturn(Node n) {
    List<Node> values = n.nodesFrom(0);
    cc.put("return");
    if (values.size() == 1) {
      cc.put(" ");
      addExpr(values.get(0), COMMA);
    } else if (values.size() > 1) {
      cc.put(" ");
      addArray(values);
    }
  }

  private void addTry(Node n) {
    Node main = n;
    Node ensureBody = null;
    if (n.isToken(Token.ENSURE)) {
      main = n.getNode(0);
      ensureBody = n.getNode(1);
    }
    cc.put("try ");
    if (main != null && main.isToken(Token.RESCUE)) {
      Node rescue = main;
      addBody(rescue.getNode(0), false);
      emit(rescue, () -> addCatch(rescue));
    } else {
      addBody(main, false);
    }
    if (n.isToken(Token.ENSURE)) {
      cc.put(" finally ");
      addBody(ensureBody, false);
    }
  }

  private void addCatch(Node rescue) {
    List<Node> clauses = new ArrayList<>();
    for (int i = 1; i < rescue.getChildCount(); i++) {
      Node clause = rescue.getNode(i);
      if (clause == null) {
        continue;
      }
      if (!clause.isToken(Token.RESBODY)) {
        throw unsupported("rescue with else", clause);
      }
      clauses.add(clause);
    }
    if (clauses.isEmpty()) {
      throw malformed("rescue without a clause", rescue);
    }
    Node first = clauses.get(0);
    if (clauses.size() == 1 && isCatchAll(first)) {
      Node variable = first.getNode(1);
      if (variable == null && atLeast(ConverterOptions.ES2019)) {
        cc.put(" catch ");
        addCatchBody(null, first.getNode(2));
        return;
      }
      String name = variable == null ? scope.uniqueName("e") : variable.getString(0);
      cc.put(" catch (" + name + ") ");
      addCatchBody(name, first.getNode(2));
      return;
    }
    String name = commonVariable(clauses);
    String caught = name == null ? scope.uniqueName("e") : name;
    Node dispatch = IR.send(null, "raise", IR.lvar(caught));
    for (int i = clauses.size() - 1; i >= 0; i--) {
      Node clause = clauses.get(i);
      Node body = clause.getNode(2);
      Node variable = clause.getNode(1);
      if (variable != null && !variable.getString(0).equals(caught)) {
        body =
            body == null
                ? IR.lvasgn(variable.getString(0), IR.lvar(caught))
                : IR.begin(IR.lvasgn(variable.getString(0), IR.lvar(caught)), body);
      }
      if (isCatchAll(clause)) {
        dispatch = body == null ? IR.nil() : body;
        continue;
      }
      Node condition = null;
      for (Node type : clause.getNonNullNode(0).nodeChildren()) {
        if (type.isToken(Token.SPLAT)) {
          throw unsupported("splat in rescue", type);
        }
        Node test = IR.send(IR.lvar(caught), "instanceof", type).withSpanOf(type);
        condition = condition == null ? test : IR.or(condition, test);
      }
      dispatch = IR.ifNode(checkNotNullNode(condition, clause), body, dispatch).withSpanOf(clause);
    }
    cc.put(" catch (" + caught + ") ");
    addCatchBody(caught, dispatch);
  }

  private static @Nullable String commonVariable(List<Node> clauses) {
    String name = null;
    for (Node clause : clauses) {
      Node variable = clause.getNode(1);
      if (variable == null) {
        continue;
      }
      if (name != null && !name.equals(variable.getString(0))) {
        return null;
      }
      name = variable.getString(0);
    }
    return name;
  }

  private static boolean isCatchAll(Node clause) {
    Node types = clause.getNode(0);
    if (types == null) {
      return true;
    }
    for (Node type : types.nodeChildren()) {
      if (!type.isToken(Token.CONST)
          || type.getNode(0) != null
          || !CATCH_ALL.contains(type.getString(1))) {
        return false;
      }
    }
    return true;
  }

  private void addCatchBody(@Nullable String variable, @Nullable Node body) {
    String saved = catchVariable;
    scope.pushBlock();
    try {
      if (variable != null) {
        scope.declareLocal(variable);
      }
      catchVariable = variable;
      cc.block(() -> addStatements(statementsOf(body)));
    } finally {
      catchVariable = saved;
      scope.pop();
    }
  }

  // Assignments.

  private void addLocalAssignment(Node n) {
    String name = n.getString(0);
    if (n.getChildCount() < 2) {
      throw malformed("assignment without a value", n);
    }
    if (scope.declare(name)) {
      cc.put(declarationKeyword() + " ");
    }
    cc.put(name + " = ");
    addExpr(n.getNonNullNode(1), ASSIGN);
  }

  private void addConstantAssignment(Node n, boolean statement) {
    Node value = n.getNonNullNode(2);
    if (statement && n.getNode(0) == null) {
      String name = n.getString(1);
      scope.declare(name);
      cc.put((es2015() ? "const " : "var ") + name + " = ");
    } else {
      addAssignmentTarget(n);
      cc.put(" = ");
    }
    addExpr(value, ASSIGN);
  }

  /** Writes the left hand side of an assignment. */
  private void addAssignmentTarget(Node target) {
    switch (target.getToken()) {
      case LVASGN:
        cc.put(target.getString(0));
        return;
      case IVASGN:
        cc.put("this." + field(target.getString(0)));
        return;
      case GVASGN:
        cc.put(globalName(target));
        return;
      case CVASGN:
        cc.put(classVariable(target));
        return;
      case CASGN:
        {
          Node scopeNode = target.getNode(0);
          if (scopeNode != null && !scopeNode.isToken(Token.CBASE)) {
            addExpr(scopeNode, CALL);
            cc.put(".");
          }
          cc.put(target.getString(1));
          return;
        }
      case SEND:
      case ATTR:
        {
          addReceiver(target.getNonNullNode(0));
          String method = target.getString(1);
          if (method.equals("[]") || method.equals("[]=")) {
            cc.put("[");
            addExpr(target.getNonNullNode(2), COMMA);
            cc.put("]");
          } else {
            addPropertyName(
                method.endsWith("=") ? method.substring(0, method.length() - 1) : method);
          }
          return;
        }
      case MLHS:
        if (!es2015()) {
          throw requiresLevel("destructuring assignment", ConverterOptions.ES2015, target);
        }
        cc.put("[");
        List<Node> elements = target.nodeChildren();
        for (int i = 0; i < elements.size(); i++) {
          if (i > 0) {
            cc.put(", ");
          }
          Node element = elements.get(i);
          emit(element, () -> addAssignmentTarget(element));
        }
        cc.put("]");
        return;
      case SPLAT:
        cc.put("...");
        addAssignmentTarget(target.getNonNullNode(0));
        return;
      default:
        throw malformed("cannot assign to " + target.getToken().getName(), target);
    }
  }

  /** The expression reading what {@code target} assigns. */
  private static Node readOf(Node target) {
    switch (target.getToken()) {
      case LVASGN:
        return IR.lvar(target.getString(0)).withSpanOf(target);
      case IVASGN:
        return IR.ivar(target.getString(0)).withSpanOf(target);
      case GVASGN:
        return Node.of(Token.GVAR, target.getString(0)).withSpanOf(target);
      case CVASGN:
        return Node.of(Token.CVAR, target.getString(0)).withSpanOf(target);
      case CASGN:
        return IR.constant(target.getNode(0), target.getString(1)).withSpanOf(target);
      default:
        return target;
    }
  }

  /** Gives a value to a bare assignment target from a multiple assignment. */
  private static Node assignTo(Node target, Node value) {
    switch (target.getToken()) {
      case LVASGN:
      case IVASGN:
      case GVASGN:
      case CVASGN:
        return target.withChildren(target.getString(0), value);
      case CASGN:
        return target.withChildren(target.getNode(0), target.getString(1), value);
      case SEND:
        {
          List<@Nullable Object> children = new ArrayList<>(target.getChildren());
          String method = target.getString(1);
          children.set(1, method.equals("[]") ? "[]=" : method + "=");
          children.add(value);
          return target.withChildren(children);
        }
      default:
        throw malformed("cannot assign to " + target.getToken().getName(), target);
    }
  }

  private void addOpAssignment(Node n) {
    Node target = n.getNonNullNode(0);
    String operator = n.getString(1);
    Node value = n.getNonNullNode(2);
    if ((operator.equals("+") || operator.equals("-"))
        && value.isToken(Token.INT)
        && Long.valueOf(1).equals(value.getChild(0))) {
      addAssignmentTarget(target);
      cc.put(operator + operator);
      return;
    }
    addAssignmentTarget(target);
    if (operator.equals("**") && !atLeast(ConverterOptions.ES2016)) {
      cc.put(" = Math.pow(");
      addExpr(readOf(target), ASSIGN);
      cc.put(", ");
      addExpr(value, ASSIGN);
      cc.put(")");
      return;
    }
    if (!BINARY_OPERATORS.containsKey(operator) || COMPARISONS.contains(operator)) {
      throw unsupported("operator assignment with " + operator, n);
    }
    cc.put(" " + operator + "= ");
    addExpr(value, ASSIGN);
  }

  /** {@code a ||= b} and {@code a &&= b}. */
  private void addLogicalAssignment(Node n, boolean statement) {
    Node target = n.getNonNullNode(0);
    Node value = n.getNonNullNode(1);
    if (statement && target.isToken(Token.LVASGN) && scope.declare(target.getString(0))) {
      cc.put(declarationKeyword() + " " + target.getString(0) + " = ");
      addExpr(value, ASSIGN);
      return;
    }
    Node read = readOf(target);
    String operator;
    if (n.isToken(Token.AND_ASGN)) {
      operator = "&&";
    } else {
      operator = useNullish(read, value) ? "??" : "||";
    }
    addAssignmentTarget(target);
    if (atLeast(ConverterOptions.ES2021)) {
      cc.put(" " + operator + "= ");
      addExpr(value, ASSIGN);
      return;
    }
    cc.put(" = ");
    int precedence = operator.equals("&&") ? LOGICAL_AND : LOGICAL_OR;
    addLogicalOperand(read, operator, precedence, false);
    cc.put(" " + operator + " ");
    addLogicalOperand(value, operator, precedence, true);
  }

  private void addMultipleAssignment(Node n, boolean statement) {
    Node targets = n.getNonNullNode(0);
    Node value = n.getNonNullNode(1);
    if (es2015()) {
      Set<String> names = new LinkedHashSet<>();
      DeclarationAnalyzer.addTargets(targets, names);
      Set<String> undeclared = new LinkedHashSet<>(names);
      undeclared.removeIf(scope::isDeclared);
      if (statement && !undeclared.isEmpty()) {
        if (undeclared.size() == names.size() && onlyLocals(targets)) {
          cc.put("let ");
        } else {
          cc.put("let " + Joiner.on(", ").join(undeclared));
          cc.separator();
        }
        undeclared.forEach(scope::declare);
      }
      addAssignmentTarget(targets);
      cc.put(" = ");
      addExpr(value, ASSIGN);
      return;
    }
    if (!statement) {
      throw requiresLevel("multiple assignment in an expression", ConverterOptions.ES2015, n);
    }
    List<Node> elements = targets.nodeChildren();
    for (int i = 0; i < elements.size(); i++) {
      Node element = elements.get(i);
      if (element.isToken(Token.MLHS)) {
        throw requiresLevel("nested destructuring", ConverterOptions.ES2015, element);
      }
      if (element.isToken(Token.SPLAT) && i != elements.size() - 1) {
        throw requiresLevel("splat before the last target", ConverterOptions.ES2015, element);
      }
    }
    if (value.isToken(Token.ARRAY)
        && value.getChildCount() == elements.size()
        && !value.nodeChildren().stream().anyMatch(e -> e.isToken(Token.SPLAT))
        && !readsAny(value, targets)) {
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          cc.separator();
        }
        Node element = elements.get(i);
        Node target = element.isToken(Token.SPLAT) ? element.getNonNullNode(0) : element;
        Node item = value.getNonNullNode(i);
        addStatement(
            assignTo(target, element.isToken(Token.SPLAT) ? IR.array(item) : item)
                .withSpanOf(element));
      }
      return;
    }
    String temporary = scope.uniqueName("$tmp");
    addStatement(IR.lvasgn(temporary, value).withSpanOf(value));
    for (int i = 0; i < elements.size(); i++) {
      cc.separator();
      Node element = elements.get(i);
      Node read =
          element.isToken(Token.SPLAT)
              ? IR.jsLiteral(temporary + ".slice(" + i + ")")
              : IR.jsLiteral(temporary + "[" + i + "]");
      Node target = element.isToken(Token.SPLAT) ? element.getNonNullNode(0) : element;
      addStatement(assignTo(target, read).withSpanOf(element));
    }
  }

  private static boolean onlyLocals(Node targets) {
    for (Node target : targets.nodeChildren()) {
      Node inner = target.isToken(Token.SPLAT) ? target.getNode(0) : target;
      if (inner == null) {
        return false;
      }
      if (inner.isToken(Token.MLHS)) {
        if (!onlyLocals(inner)) {
          return false;
        }
      } else if (!inner.isToken(Token.LVASGN)) {
        return false;
      }
    }
    return true;
  }

  private static boolean readsAny(Node value, Node targets) {
    Set<String> names = new LinkedHashSet<>();
    DeclarationAnalyzer.addTargets(targets, names);
    Set<String> read = DeclarationAnalyzer.references(ImmutableList.of(value));
    for (String name : names) {
      if (read.contains(name)) {
        return true;
      }
    }
    return !onlyLocals(targets);
  }

  private static String field(String instanceVariable) {
    return "_" + instanceVariable.substring(instanceVariable.startsWith("@") ? 1 : 0);
  }

  private String globalName(Node n) {
    String name = n.getString(0);
    if (!IDENTIFIER.matcher(name).matches()) {
      throw unsupported("global variable " + name, n);
    }
    return name;
  }

  private String classVariable(Node n) {
    if (classContext == null) {
      throw unsupported("class variable outside of a class", n);
    }
    String name = n.getString(0);
    return classContext.name + "._" + name.substring(name.startsWith("@@") ? 2 : 0);
  }

  // Functions.

  /** Writes a parenthesised parameter list and collects what the body has to do first. */
  private Parameters addParameters(Node args, @Nullable Node body, boolean isMethod) {
    Parameters result = new Parameters();
    List<Runnable> items = new ArrayList<>();
    List<Node> keywords = new ArrayList<>();
    String restName = null;
    boolean hasBlock = false;
    int position = 0;
    for (Node arg : args.nodeChildren()) {
      switch (arg.getToken()) {
        case ARG:
          {
            String name = arg.getString(0);
            scope.declareLocal(name);
            items.add(() -> cc.put(name));
            result.forwarded.add(name);
            position++;
            break;
          }
        case OPTARG:
          {
            String name = arg.getString(0);
            Node value = arg.getNonNullNode(1);
            scope.declareLocal(name);
            if (es2015()) {
              items.add(
                  () -> {
                    cc.put(name + " = ");
                    addExpr(value, ASSIGN);
                  });
            } else {
              items.add(() -> cc.put(name));
              result.prologue.add(
                  () -> {
                    cc.put("if (typeof " + name + " === 'undefined') " + name + " = ");
                    addExpr(value, ASSIGN);
                  });
            }
            result.forwarded.add(name);
            position++;
            break;
          }
        case RESTARG:
          {
            String name = optionalName(arg, "args");
            scope.declareLocal(name);
            restName = name;
            if (es2015()) {
              items.add(() -> cc.put("..." + name));
              result.forwarded.add("..." + name);
            } else {
              int from = position;
              result.prologue.add(
                  () ->
                      cc.put(
                          "var "
                              + name
                              + " = Array.prototype.slice.call(arguments, "
                              + from
                              + ")"));
            }
            break;
          }
        case KWARG:
        case KWOPTARG:
        case KWRESTARG:
          if (!es2015()) {
            throw requiresLevel("keyword arguments", ConverterOptions.ES2015, arg);
          }
          if (arg.isToken(Token.KWRESTARG) && !atLeast(ConverterOptions.ES2018)) {
            throw requiresLevel("keyword rest argument", ConverterOptions.ES2018, arg);
          }
          if (keywords.isEmpty()) {
            items.add(() -> addKeywordPattern(keywords));
          }
          keywords.add(arg);
          scope.declareLocal(optionalName(arg, "options"));
          break;
        case BLOCKARG:
          {
            String name = optionalName(arg, "block");
            scope.declareLocal(name);
            result.blockName = name;
            hasBlock = true;
            addBlockParameter(name, restName, items, result.prologue);
            if (es2015()) {
              result.forwarded.add(name);
            }
            break;
          }
        case SHADOWARG:
          {
            String name = arg.getString(0);
            scope.declareLocal(name);
            result.prologue.add(() -> cc.put(declarationKeyword() + " " + name));
            break;
          }
        case MLHS:
          if (!es2015()) {
            throw requiresLevel("destructuring parameter", ConverterOptions.ES2015, arg);
          }
          declarePattern(arg);
          items.add(() -> addParameterPattern(arg));
          position++;
          break;
        default:
          throw malformed("unexpected " + arg.getToken().getName() + " in parameters", arg);
      }
    }
    if (!keywords.isEmpty()) {
      List<String> names = new ArrayList<>();
      for (Node keyword : keywords) {
        names.add((keyword.isToken(Token.KWRESTARG) ? "..." : "") + keywordName(keyword));
      }
      result.forwarded.add("{" + Joiner.on(", ").join(names) + "}");
    }
    if (isMethod && !hasBlock && DeclarationAnalyzer.containsYield(body)) {
      scope.declareLocal(IMPLICIT_BLOCK);
      addBlockParameter(IMPLICIT_BLOCK, restName, items, result.prologue);
    }
    cc.put("(");
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        cc.put(", ");
      }
      items.get(i).run();
    }
    cc.put(")");
    return result;
  }

  /** A block parameter after a rest parameter is whatever function ends the rest. */
  private void addBlockParameter(
      String name, @Nullable String restName, List<Runnable> items, List<Runnable> prologue) {
    if (restName == null) {
      items.add(() -> cc.put(name));
      return;
    }
    prologue.add(
        () ->
            cc.put(
                declarationKeyword()
                    + " "
                    + name
                    + " = typeof "
                    + restName
                    + "["
                    + restName
                    + ".length - 1] === \"function\" ? "
                    + restName
                    + ".pop() : null"));
  }

  private String optionalName(Node arg, String base) {
    if (arg.getChildCount() > 0 && arg.getChild(0) instanceof String) {
      return arg.getString(0);
    }
    return scope.uniqueName(base);
  }

  private static String keywordName(Node keyword) {
    return keyword.getChildCount() > 0 && keyword.getChild(0) instanceof String
        ? keyword.getString(0)
        : "options";
  }

  private void addKeywordPattern(List<Node> keywords) {
    boolean allOptional = true;
    cc.put("{");
    for (int i = 0; i < keywords.size(); i++) {
      if (i > 0) {
        cc.put(", ");
      }
      Node keyword = keywords.get(i);
      switch (keyword.getToken()) {
        case KWARG:
          allOptional = false;
          cc.put(keyword.getString(0));
          break;
        case KWOPTARG:
          cc.put(keyword.getString(0) + " = ");
          addExpr(keyword.getNonNullNode(1), ASSIGN);
          break;
        default:
          cc.put("..." + keywordName(keyword));
      }
    }
    cc.put("}");
    if (allOptional) {
      cc.put(" = {}");
    }
  }

  private void declarePattern(Node pattern) {
    for (Node element : pattern.nodeChildren()) {
      if (element.isToken(Token.MLHS)) {
        declarePattern(element);
      } else if (element.getChildCount() > 0 && element.getChild(0) instanceof String) {
        scope.declareLocal(element.getString(0));
      }
    }
  }

  private void addParameterPattern(Node pattern) {
    cc.put("[");
    List<Node> elements = pattern.nodeChildren();
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        cc.put(", ");
      }
      Node element = elements.get(i);
      switch (element.getToken()) {
        case MLHS:
          addParameterPattern(element);
          break;
        case RESTARG:
          cc.put("..." + element.getString(0));
          break;
        case ARG:
          cc.put(element.getString(0));
          break;
        default:
          throw malformed("unexpected " + element.getToken().getName() + " in a pattern", element);
      }
    }
    cc.put("]");
  }

  /** Writes a function body: the parameter prologue followed by the statements. */
  private void addFunctionBlock(List<Runnable> prologue, @Nullable Node body) {
    cc.block(
        () -> {
          for (int i = 0; i < prologue.size(); i++) {
            if (i > 0) {
              cc.separator();
            }
            prologue.get(i).run();
          }
          List<Node> statements = statementsOf(body);
          if (!prologue.isEmpty() && !statements.isEmpty()) {
            cc.separator();
          }
          addStatements(statements);
        });
  }

  /**
   * Writes the parameters and body of a named function or method. The caller has already written
   * whatever precedes the parameter list.
   */
  private void addMethodBody(
      FunctionKind kind, String name, boolean isStatic, Node args, @Nullable Node body) {
    FunctionContext saved = function;
    String savedCatch = catchVariable;
    scope.pushFunction();
    jumps.push(JumpTarget.FUNCTION);
    try {
      Parameters parameters = addParameters(args, body, true);
      function =
          new FunctionContext(
              kind, name, isStatic, parameters.forwarded, parameters.blockName);
      catchVariable = null;
      cc.put(" ");
      addFunctionBlock(parameters.prologue, body);
    } finally {
      function = saved;
      catchVariable = savedCatch;
      jumps.pop();
      scope.pop();
    }
  }

  /** Writes a block or lambda as a function expression. */
  private void addFunctionExpression(Node args, @Nullable Node body) {
    scope.pushFunction();
    jumps.push(JumpTarget.FUNCTION);
    try {
      if (es2015()) {
        Parameters parameters = addParameters(args, body, false);
        cc.put(" => ");
        Node expression = conciseBody(body);
        if (expression != null && parameters.prologue.isEmpty()) {
          if (expression.isToken(Token.HASH)) {
            cc.put("(");
            addExpr(expression, COMMA);
            cc.put(")");
          } else {
            addExpr(expression, ASSIGN);
          }
        } else {
          addFunctionBlock(parameters.prologue, body);
        }
        return;
      }
      cc.put("function");
      Parameters parameters = addParameters(args, body, false);
      cc.put(" ");
      addFunctionBlock(parameters.prologue, body);
    } finally {
      jumps.pop();
      scope.pop();
    }
    if (function != null && usesThis(body)) {
      cc.put(".bind(this)");
    }
  }

  /** The returned expression of a body that does nothing but return one. */
  private static @Nullable Node conciseBody(@Nullable Node body) {
    if (body == null || !body.isToken(Token.AUTORETURN)) {
      return null;
    }
    List<Node> statements = statementsOf(body);
    if (statements.size() != 1) {
      return null;
    }
    Node only = statements.get(0);
    if (!only.isToken(Token.RETURN) || only.getChildCount() != 1) {
      return null;
    }
    return only.getNode(0);
  }

  /** Whether a function body needs the enclosing {@code this}. */
  private boolean usesThis(@Nullable Node body) {
    return DeclarationAnalyzer.referencesSelf(body) || mentionsClassMember(body);
  }

  private boolean mentionsClassMember(@Nullable Node node) {
    if (node == null) {
      return false;
    }
    switch (node.getToken()) {
      case DEF:
      case DEFS:
      case CLASS:
      case MODULE:
        return false;
      case SEND:
        if (node.getNode(0) == null && isClassMember(stripSuffix(node.getString(1)))) {
          return true;
        }
        break;
      default:
        break;
    }
    for (Node child : node.nodeChildren()) {
      if (mentionsClassMember(child)) {
        return true;
      }
    }
    return false;
  }

  private void addDef(Node n) {
    String name = stripSuffix(n.getString(0));
    if (!IDENTIFIER.matcher(name).matches()) {
      throw unsupported("function named " + n.getString(0), n);
    }
    scope.declare(name);
    cc.put("function " + name);
    addMethodBody(FunctionKind.FUNCTION, name, false, n.getNonNullNode(1), n.getNode(2));
  }

  private void addDefs(Node n) {
    Node receiver = n.getNonNullNode(0);
    String name = stripSuffix(n.getString(1));
    if (receiver.isToken(Token.SELF) && classContext == null) {
      if (!IDENTIFIER.matcher(name).matches()) {
        throw unsupported("function named " + n.getString(1), n);
      }
      cc.put("function " + name);
      addMethodBody(FunctionKind.FUNCTION, name, false, n.getNonNullNode(2), n.getNode(3));
      return;
    }
    if (receiver.isToken(Token.SELF)) {
      cc.put(checkNotNullContext(n).name);
    } else {
      addReceiver(receiver);
    }
    addPropertyName(name);
    cc.put(" = function");
    addMethodBody(FunctionKind.METHOD, name, true, n.getNonNullNode(2), n.getNode(3));
  }

  private ClassContext checkNotNullContext(Node n) {
    if (classContext == null) {
      throw unsupported(n.getToken().getName() + " outside of a class", n);
    }
    return classContext;
  }

  private static Node definitionArgs(Node definition) {
    return definition.getNonNullNode(definition.isToken(Token.DEFS) ? 2 : 1);
  }

  private static @Nullable Node definitionBody(Node definition) {
    return definition.getNode(definition.isToken(Token.DEFS) ? 3 : 2);
  }

  // Classes and modules.

  /** The JavaScript expression for a constant path such as {@code A::B}. */
  private static String constantName(Node n) {
    checkState(n.isToken(Token.CONST), "expected a constant, found %s", n.getToken());
    Node scopeNode = n.getNode(0);
    if (scopeNode == null || scopeNode.isToken(Token.CBASE)) {
      return n.getString(1);
    }
    return constantName(scopeNode) + "." + n.getString(1);
  }

  private void addClass(Node n) {
    Node nameNode = n.getNonNullNode(0);
    Node superclass = n.getNode(1);
    String name = constantName(nameNode);
    ClassBody body = ClassBody.analyze(nameNode, n.getNode(2));
    ClassContext savedClass = classContext;
    FunctionContext savedFunction = function;
    classContext = new ClassContext(name, superclass, body);
    function = null;
    try {
      if (!name.contains(".")) {
        scope.declare(name);
      }
      if (es2015()) {
        addClassDeclaration(name, superclass, body);
      } else {
        addPrototypeClass(name, superclass, body);
      }
      for (Node statement : body.trailing) {
        cc.separator();
        addStatement(statement);
      }
    } finally {
      classContext = savedClass;
      function = savedFunction;
    }
    logger.finest("Generated class " + name + " with " + body.members.size() + " members");
  }

  private void addClassDeclaration(String name, @Nullable Node superclass, ClassBody body) {
    if (name.contains(".")) {
      cc.put(name + " = class");
    } else {
      cc.put("class " + name);
    }
    if (superclass != null) {
      cc.put(" extends ");
      addExpr(superclass, CALL);
    }
    cc.put(" ");
    cc.block(
        () -> {
          for (int i = 0; i < body.members.size(); i++) {
            if (i > 0) {
              cc.separator();
            }
            ClassBody.Member member = body.members.get(i);
            emit(member.source, () -> addClassMember(member));
          }
        });
  }

  private void addClassMember(ClassBody.Member member) {
    if (!IDENTIFIER.matcher(member.name).matches()) {
      throw unsupported("method named " + member.name, member.source);
    }
    if (member.isStatic) {
      cc.put("static ");
    }
    Node definition = member.definition;
    switch (member.kind) {
      case CONSTRUCTOR:
        cc.put("constructor");
        addMember(FunctionKind.CONSTRUCTOR, member);
        return;
      case GETTER:
        cc.put("get " + member.name);
        if (definition == null) {
          cc.put("() ");
          cc.block(() -> cc.put("return this." + member.field()));
        } else {
          addMember(FunctionKind.GETTER, member);
        }
        return;
      case SETTER:
        cc.put("set " + member.name);
        if (definition == null) {
          cc.put("(" + member.name + ") ");
          cc.block(() -> cc.put("this." + member.field() + " = " + member.name));
        } else {
          addMember(FunctionKind.SETTER, member);
        }
        return;
      case METHOD:
        cc.put(member.name);
        addMember(FunctionKind.METHOD, member);
        return;
    }
  }

  private void addMember(FunctionKind kind, ClassBody.Member member) {
    Node definition = member.definition;
    checkState(definition != null, "member %s has no definition", member.name);
    addMethodBody(
        kind,
        member.name,
        member.isStatic,
        definitionArgs(definition),
        definitionBody(definition));
  }

  /** Classes before ES2015: a constructor function and prototype assignments. */
  private void addPrototypeClass(String name, @Nullable Node superclass, ClassBody body) {
    ClassBody.Member constructor = body.constructor();
    cc.put(name.contains(".") ? name + " = function" : "function " + name);
    if (constructor != null) {
      Node definition = constructor.definition;
      emit(
          constructor.source,
          () ->
              addMethodBody(
                  FunctionKind.CONSTRUCTOR,
                  name,
                  false,
                  definitionArgs(definition),
                  definitionBody(definition)));
    } else if (superclass != null) {
      cc.put("() ");
      cc.block(
          () -> {
            addExpr(superclass, CALL);
            cc.put(".apply(this, arguments)");
          });
    } else {
      cc.put("() {}");
    }
    if (superclass != null) {
      cc.separator();
      cc.put(name + ".prototype = Object.create(");
      addExpr(superclass, CALL);
      cc.put(".prototype)");
      cc.separator();
      cc.put(name + ".prototype.constructor = " + name);
    }
    Map<String, List<ClassBody.Member>> accessors = new LinkedHashMap<>();
    for (ClassBody.Member member : body.members) {
      switch (member.kind) {
        case METHOD:
          cc.separator();
          emit(
              member.source,
              () -> {
                cc.put(name + (member.isStatic ? "" : ".prototype"));
                addPropertyName(member.name);
                cc.put(" = function");
                addMember(FunctionKind.METHOD, member);
              });
          break;
        case GETTER:
        case SETTER:
          accessors
              .computeIfAbsent(
                  (member.isStatic ? "static " : "") + member.name, k -> new ArrayList<>())
              .add(member);
          break;
        default:
          break;
      }
    }
    for (List<ClassBody.Member> group : accessors.values()) {
      cc.separator();
      ClassBody.Member first = group.get(0);
      emit(first.source, () -> addDefineProperty(name, group));
    }
  }

  private void addDefineProperty(String className, List<ClassBody.Member> group) {
    ClassBody.Member first = group.get(0);
    cc.put(
        "Object.defineProperty("
            + className
            + (first.isStatic ? "" : ".prototype")
            + ", "
            + jsString(first.name)
            + ", ");
    List<Runnable> entries = new ArrayList<>();
    entries.add(() -> cc.put("enumerable: true"));
    entries.add(() -> cc.put("configurable: true"));
    for (ClassBody.Member member : group) {
      entries.add(
          () -> {
            if (member.kind == ClassBody.MemberKind.GETTER) {
              cc.put("get: function");
              if (member.definition == null) {
                cc.put("() ");
                cc.block(() -> cc.put("return this." + member.field()));
              } else {
                addMember(FunctionKind.GETTER, member);
              }
            } else {
              cc.put("set: function");
              if (member.definition == null) {
                cc.put("(" + member.name + ") ");
                cc.block(() -> cc.put("this." + member.field() + " = " + member.name));
              } else {
                addMember(FunctionKind.SETTER, member);
              }
            }
          });
    }
    addList("{", "}", entries);
    cc.put(")");
  }

  /** A module becomes an object literal holding its methods. */
  private void addModule(Node n) {
    Node nameNode = n.getNonNullNode(0);
    String name = constantName(nameNode);
    ClassBody body = ClassBody.analyze(nameNode, n.getNode(1));
    ClassContext savedClass = classContext;
    FunctionContext savedFunction = function;
    classContext = new ClassContext(name, null, body);
    function = null;
    try {
      if (name.contains(".")) {
        cc.put(name + " = ");
      } else {
        scope.declare(name);
        cc.put((es2015() ? "const " : "var ") + name + " = ");
      }
      List<Runnable> entries = new ArrayList<>();
      for (ClassBody.Member member : body.members) {
        entries.add(() -> emit(member.source, () -> addModuleMember(member)));
      }
      addList("{", "}", entries);
      for (Node statement : body.trailing) {
        cc.separator();
        addStatement(statement);
      }
    } finally {
      classContext = savedClass;
      function = savedFunction;
    }
  }

  private void addModuleMember(ClassBody.Member member) {
    if (!IDENTIFIER.matcher(member.name).matches()) {
      throw unsupported("method named " + member.name, member.source);
    }
    switch (member.kind) {
      case CONSTRUCTOR:
        throw unsupported("initialize in a module", member.source);
      case GETTER:
        cc.put("get " + member.name);
        if (member.definition == null) {
          cc.put("() ");
          cc.block(() -> cc.put("return this." + member.field()));
        } else {
          addMember(FunctionKind.GETTER, member);
        }
        return;
      case SETTER:
        cc.put("set " + member.name);
        if (member.definition == null) {
          cc.put("(" + member.name + ") ");
          cc.block(() -> cc.put("this." + member.field() + " = " + member.name));
        } else {
          addMember(FunctionKind.SETTER, member);
        }
        return;
      case METHOD:
        cc.put(es2015() ? member.name : member.name + ": function");
        addMember(FunctionKind.METHOD, member);
        return;
    }
  }

  private boolean isClassMember(String name) {
    if (classContext == null || function == null || function.kind == FunctionKind.FUNCTION) {
      return false;
    }
    ClassBody body = classContext.body;
    if (function.isStatic) {
      return body.staticGetters.contains(name) || body.staticMethods.contains(name);
    }
    return body.getters.contains(name) || body.methods.contains(name);
  }

  private boolean isClassMethod(String name) {
    if (classContext == null || function == null || function.kind == FunctionKind.FUNCTION) {
      return false;
    }
    ClassBody body = classContext.body;
    return function.isStatic ? body.staticMethods.contains(name) : body.methods.contains(name);
  }

  // Modules.

  private void addImport(Node n) {
    if (!es2015()) {
      throw requiresLevel("import", ConverterOptions.ES2015, n);
    }
    String path = n.getString(0);
    List<Node> specifiers = n.nodesFrom(1);
    cc.put("import ");
    if (!specifiers.isEmpty()) {
      for (int i = 0; i < specifiers.size(); i++) {
        if (i > 0) {
          cc.put(", ");
        }
        addImportSpecifier(specifiers.get(i));
      }
      cc.put(" from ");
    }
    cc.put(jsString(path));
  }

  private void addImportSpecifier(Node specifier) {
    switch (specifier.getToken()) {
      case SPLAT:
        cc.put("* as " + bindingName(specifier.getNonNullNode(0)));
        return;
      case ARRAY:
        addNamedBindings(specifier);
        return;
      default:
        cc.put(bindingName(specifier));
    }
  }

  /** {@code {a, b as c}}, used by both import and export. */
  private void addNamedBindings(Node array) {
    List<String> names = new ArrayList<>();
    for (Node element : array.nodeChildren()) {
      if (element.isToken(Token.PAIR)) {
        names.add(
            bindingName(element.getNonNullNode(0))
                + " as "
                + bindingName(element.getNonNullNode(1)));
      } else {
        names.add(bindingName(element));
      }
    }
    cc.put("{" + Joiner.on(", ").join(names) + "}");
  }

  private static String bindingName(Node n) {
    switch (n.getToken()) {
      case CONST:
        return n.getString(1);
      case SEND:
        if (n.getNode(0) == null && n.getChildCount() == 2) {
          return n.getString(1);
        }
        break;
      case LVAR:
      case STR:
      case SYM:
        return n.getString(0);
      default:
        break;
    }
    throw malformed("cannot bind " + n.getToken().getName() + " in an import or export", n);
  }

  /**
   * {@code (export value)} exports a declaration or a list of names; {@code (export "default"
   * value)} is a default export.
   */
  private void addExport(Node n) {
    if (!es2015()) {
      throw requiresLevel("export", ConverterOptions.ES2015, n);
    }
    Node value = n.getNonNullNode(n.getChildCount() - 1);
    cc.put("export ");
    if (n.getChildCount() == 2) {
      cc.put("default ");
      switch (value.getToken()) {
        case DEF:
        case CLASS:
          addStatement(value);
          return;
        default:
          addExpr(value, ASSIGN);
          return;
      }
    }
    if (value.isToken(Token.ARRAY)) {
      addNamedBindings(value);
      return;
    }
    if (value.isToken(Token.LVASGN) && value.getChildCount() > 1) {
      String name = value.getString(0);
      cc.put("const " + name + " = ");
      addExpr(value.getNonNullNode(1), ASSIGN);
      scope.declare(name);
      return;
    }
    addStatement(value);
  }

  // Expressions.

  /** Writes an expression, in parentheses when it binds looser than {@code minPrecedence}. */
  private void addExpr(Node n, int minPrecedence) {
    emit(
        n,
        () -> {
          boolean parens = precedence(n) < minPrecedence;
          if (parens) {
            cc.put("(");
          }
          addExpression(n);
          if (parens) {
            cc.put(")");
          }
        });
  }

  private void addExpression(Node n) {
    switch (n.getToken()) {
      case INT:
      case FLOAT:
        cc.put(formatNumber(n.getChild(0)));
        return;
      case STR:
      case SYM:
        cc.put(jsString(n.getString(0)));
        return;
      case DSTR:
      case DSYM:
        addInterpolation(n);
        return;
      case REGEXP:
        addRegexp(n);
        return;
      case TRUE:
        cc.put("true");
        return;
      case FALSE:
        cc.put("false");
        return;
      case NIL:
        cc.put("null");
        return;
      case SELF:
        cc.put("this");
        return;
      case ARRAY:
        addArray(n.nodeChildren());
        return;
      case HASH:
        addHash(n);
        return;
      case SPLAT:
        if (!es2015()) {
          throw requiresLevel("spread", ConverterOptions.ES2015, n);
        }
        cc.put("...");
        addExpr(n.getNonNullNode(0), ASSIGN);
        return;
      case IRANGE:
      case ERANGE:
        throw unsupported("range outside of a loop or case", n);
      case LVAR:
        cc.put(n.getString(0));
        return;
      case IVAR:
        cc.put("this." + field(n.getString(0)));
        return;
      case GVAR:
        cc.put(globalName(n));
        return;
      case CVAR:
        cc.put(classVariable(n));
        return;
      case CONST:
        addConstant(n);
        return;
      case LVASGN:
      case IVASGN:
      case GVASGN:
      case CVASGN:
        if (n.getChildCount() < 2) {
          throw malformed("assignment without a value", n);
        }
        addAssignmentTarget(n);
        cc.put(" = ");
        addExpr(n.getNonNullNode(1), ASSIGN);
        return;
      case CASGN:
        addConstantAssignment(n, false);
        return;
      case OP_ASGN:
        addOpAssignment(n);
        return;
      case OR_ASGN:
      case AND_ASGN:
        addLogicalAssignment(n, false);
        return;
      case MASGN:
        addMultipleAssignment(n, false);
        return;
      case SEND:
      case CALL:
        addSend(n, null);
        return;
      case CSEND:
        addSafeNavigation(n, null);
        return;
      case ATTR:
        addReceiver(n.getNonNullNode(0));
        addPropertyName(n.getString(1));
        return;
      case BLOCK:
      case NUMBLOCK:
        addBlock(n);
        return;
      case SUPER:
      case ZSUPER:
        addSuper(n, null);
        return;
      case YIELD:
        addYield(n);
        return;
      case DEF:
        addDef(n);
        return;
      case DEFS:
        addDefs(n);
        return;
      case CLASS:
        if (!es2015()) {
          throw requiresLevel("class expression", ConverterOptions.ES2015, n);
        }
        if (!ClassBody.analyze(n.getNonNullNode(0), n.getNode(2)).trailing.isEmpty()) {
          throw unsupported("class with constants or mixins in an expression", n);
        }
        addClass(n);
        return;
      case MODULE:
        throw unsupported("module in an expression", n);
      case BEGIN:
      case KWBEGIN:
        addGroup(n);
        return;
      case IF:
        addConditional(n);
        return;
      case CASE:
      case RESCUE:
      case ENSURE:
        addIife(n);
        return;
      case WHILE:
      case UNTIL:
      case WHILE_POST:
      case UNTIL_POST:
      case FOR:
        throw unsupported("loop in an expression", n);
      case AND:
      case OR:
        addLogical(n);
        return;
      case NOT:
        addNot(n.getNonNullNode(0));
        return;
      case DEFINED:
        cc.put("typeof ");
        addExpr(n.getNonNullNode(0), UNARY);
        cc.put(" !== 'undefined'");
        return;
      case NULLISH:
        addNullish(n);
        return;
      case JSLITERAL:
        cc.put(n.getString(0));
        return;
      case RETURN:
      case BREAK:
      case NEXT:
        throw unsupported(n.getToken().getName() + " in an expression", n);
      case AUTORETURN:
        addGroup(IR.begin(statementsOf(n)).withSpanOf(n));
        return;
      default:
        throw malformed(n.getToken().getName() + " outside of its parent", n);
    }
  }

  private static String formatNumber(@Nullable Object value) {
    if (value instanceof Double) {
      double d = (Double) value;
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return Double.toString(d);
      }
      return Double.toString(d).replace('E', 'e');
    }
    checkState(value instanceof Long, "not a number: %s", value);
    return value.toString();
  }

  static String jsString(String value) {
    return '"' + escape(value, '"') + '"';
  }

  private static String escape(String value, char quote) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\u000B':
          sb.append("\\v");
          break;
        case '\0':
          boolean digitFollows = i + 1 < value.length() && Character.isDigit(value.charAt(i + 1));
          sb.append(digitFollows ? "\\x00" : "\\0");
          break;
        case '\u2028':
          sb.append("\\u2028");
          break;
        case '\u2029':
          sb.append("\\u2029");
          break;
        default:
          if (c == quote) {
            sb.append('\\').append(c);
          } else if (quote == '`' && c == '$' && i + 1 < value.length()
              && value.charAt(i + 1) == '{') {
            sb.append("\\$");
          } else if (c < 0x20 || c == 0x7f) {
            sb.append(c < 0x10 ? "\\x0" : "\\x").append(Integer.toHexString(c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  /** The parts of an interpolated string, with nested interpolations spliced and empties gone. */
  private static List<Node> interpolationParts(Node n) {
    List<Node> parts = new ArrayList<>();
    for (Node part : n.nodeChildren()) {
      if (part.isToken(Token.DSTR)) {
        parts.addAll(interpolationParts(part));
      } else if (part.isToken(Token.STR)) {
        if (!part.getString(0).isEmpty()) {
          parts.add(part);
        }
      } else if (part.isToken(Token.BEGIN)) {
        if (part.hasChildren()) {
          parts.add(part.getChildCount() == 1 ? part.getNonNullNode(0) : part);
        }
      } else {
        parts.add(part);
      }
    }
    return parts;
  }

  private void addInterpolation(Node n) {
    List<Node> parts = interpolationParts(n);
    if (es2015()) {
      cc.put("`");
      for (Node part : parts) {
        if (part.isToken(Token.STR)) {
          cc.put(escape(part.getString(0), '`'));
        } else {
          cc.put("${");
          addExpr(part, COMMA);
          cc.put("}");
        }
      }
      cc.put("`");
      return;
    }
    if (parts.isEmpty()) {
      cc.put("\"\"");
      return;
    }
    if (!parts.get(0).isToken(Token.STR)) {
      cc.put("\"\" + ");
    }
    for (int i = 0; i < parts.size(); i++) {
      if (i > 0) {
        cc.put(" + ");
      }
      addExpr(parts.get(i), ADDITIVE + 1);
    }
  }

  private void addRegexp(Node n) {
    List<Node> parts = new ArrayList<>();
    Node options = null;
    for (Node child : n.nodeChildren()) {
      if (child.isToken(Token.REGOPT)) {
        options = child;
      } else {
        parts.add(child);
      }
    }
    boolean global = false;
    boolean ignoreCase = false;
    boolean dotAll = false;
    boolean extended = false;
    if (options != null) {
      for (Object option : options.getChildren()) {
        switch (String.valueOf(option)) {
          case "g":
            global = true;
            break;
          case "i":
            ignoreCase = true;
            break;
          case "m":
            if (!atLeast(ConverterOptions.ES2018)) {
              throw requiresLevel("multiline regexp", ConverterOptions.ES2018, options);
            }
            dotAll = true;
            break;
          case "x":
            extended = true;
            break;
          default:
            break;
        }
      }
    }
    String flags = (global ? "g" : "") + (ignoreCase ? "i" : "") + (dotAll ? "s" : "");
    boolean literal = true;
    StringBuilder source = new StringBuilder();
    for (Node part : parts) {
      if (part.isToken(Token.STR)) {
        source.append(part.getString(0));
      } else {
        literal = false;
      }
    }
    if (literal) {
      String converted = regexpSource(source.toString(), extended);
      cc.put("/" + (converted.isEmpty() ? "(?:)" : converted) + "/" + flags);
      return;
    }
    List<Node> converted = new ArrayList<>();
    for (Node part : parts) {
      converted.add(
          part.isToken(Token.STR)
              ? IR.string(regexpSource(part.getString(0), extended)).withSpanOf(part)
              : part);
    }
    cc.put("new RegExp(");
    addExpr(Node.create(Token.DSTR, converted, n.getSpan()), ASSIGN);
    if (!flags.isEmpty()) {
      cc.put(", " + jsString(flags));
    }
    cc.put(")");
  }

  /** Rewrites Ruby regexp syntax that JavaScript spells differently. */
  private static String regexpSource(String source, boolean extended) {
    StringBuilder sb = new StringBuilder();
    boolean inClass = false;
    for (int i = 0; i < source.length(); i++) {
      char c = source.charAt(i);
      if (c == '\\' && i + 1 < source.length()) {
        char next = source.charAt(++i);
        if (!inClass && next == 'A') {
          sb.append('^');
        } else if (!inClass && (next == 'z' || next == 'Z')) {
          sb.append('$');
        } else {
          sb.append(c).append(next);
        }
        continue;
      }
      if (inClass) {
        inClass = c != ']';
        sb.append(c);
        continue;
      }
      if (extended && Character.isWhitespace(c)) {
        continue;
      }
      if (extended && c == '#') {
        while (i + 1 < source.length() && source.charAt(i + 1) != '\n') {
          i++;
        }
        continue;
      }
      switch (c) {
        case '[':
          inClass = true;
          sb.append(c);
          break;
        case '/':
          sb.append("\\/");
          break;
        case '\n':
          sb.append("\\n");
          break;
        default:
          sb.append(c);
      }
    }
    return sb.toString();
  }

  private void addArray(List<Node> elements) {
    boolean splat = elements.stream().anyMatch(e -> e.isToken(Token.SPLAT));
    if (!splat || es2015()) {
      List<Runnable> items = new ArrayList<>();
      for (Node element : elements) {
        items.add(() -> addExpr(element, ASSIGN));
      }
      addList("[", "]", items);
      return;
    }
    // Runs of plain elements become array literals joined with concat.
    List<Runnable> pieces = new ArrayList<>();
    List<Node> run = new ArrayList<>();
    for (Node element : elements) {
      if (element.isToken(Token.SPLAT)) {
        if (!run.isEmpty()) {
          List<Node> literal = ImmutableList.copyOf(run);
          pieces.add(() -> addArray(literal));
          run.clear();
        }
        Node spread = element.getNonNullNode(0);
        int precedence = pieces.isEmpty() ? CALL : ASSIGN;
        pieces.add(() -> emit(element, () -> addExpr(spread, precedence)));
      } else {
        run.add(element);
      }
    }
    if (!run.isEmpty()) {
      List<Node> literal = ImmutableList.copyOf(run);
      pieces.add(() -> addArray(literal));
    }
    for (int i = 0; i < pieces.size(); i++) {
      if (i > 0) {
        cc.put(".concat(");
      }
      pieces.get(i).run();
      if (i > 0) {
        cc.put(")");
      }
    }
  }

  /**
   * Writes the items of an array, object or argument list. In vertical mode each item starts on
   * its own line unless the whole list fits on one.
   */
  private void addList(String open, String close, List<Runnable> items) {
    if (items.isEmpty()) {
      cc.put(open + close);
      return;
    }
    if (!cc.isVertical()) {
      cc.put(open);
      for (int i = 0; i < items.size(); i++) {
        if (i > 0) {
          cc.put(", ");
        }
        items.get(i).run();
      }
      cc.put(close);
      return;
    }
    cc.compact(
        () -> {
          cc.puts(open);
          for (int i = 0; i < items.size(); i++) {
            items.get(i).run();
            if (i < items.size() - 1) {
              cc.puts(",");
            }
          }
          cc.sput(close);
        });
  }

  private void addHash(Node n) {
    List<Node> entries = n.nodeChildren();
    boolean splat = entries.stream().anyMatch(e -> e.isToken(Token.KWSPLAT));
    if (!splat || atLeast(ConverterOptions.ES2018)) {
      addObjectLiteral(entries);
      return;
    }
    if (!es2015()) {
      throw requiresLevel("hash splat", ConverterOptions.ES2015, n);
    }
    cc.put("Object.assign({}");
    List<Node> run = new ArrayList<>();
    for (Node entry : entries) {
      if (entry.isToken(Token.KWSPLAT)) {
        if (!run.isEmpty()) {
          cc.put(", ");
          addObjectLiteral(run);
          run.clear();
        }
        cc.put(", ");
        addExpr(entry.getNonNullNode(0), ASSIGN);
      } else {
        run.add(entry);
      }
    }
    if (!run.isEmpty()) {
      cc.put(", ");
      addObjectLiteral(run);
    }
    cc.put(")");
  }

  private void addObjectLiteral(List<Node> entries) {
    List<Runnable> items = new ArrayList<>();
    for (Node entry : entries) {
      items.add(() -> emit(entry, () -> addHashEntry(entry)));
    }
    addList("{", "}", items);
  }

  private void addHashEntry(Node entry) {
    if (entry.isToken(Token.KWSPLAT)) {
      cc.put("...");
      addExpr(entry.getNonNullNode(0), ASSIGN);
      return;
    }
    if (!entry.isToken(Token.PAIR)) {
      throw malformed(entry.getToken().getName() + " in a hash", entry);
    }
    Node key = entry.getNonNullNode(0);
    Node value = entry.getNonNullNode(1);
    switch (key.getToken()) {
      case SYM:
      case STR:
        {
          String name = key.getString(0);
          if (!IDENTIFIER.matcher(name).matches()) {
            cc.put(jsString(name));
            break;
          }
          if (es2015() && value.isToken(Token.LVAR) && value.getString(0).equals(name)) {
            cc.put(name);
            return;
          }
          cc.put(name);
          break;
        }
      case INT:
      case FLOAT:
        cc.put(formatNumber(key.getChild(0)));
        break;
      default:
        if (!es2015()) {
          throw requiresLevel("computed property name", ConverterOptions.ES2015, key);
        }
        cc.put("[");
        addExpr(key, ASSIGN);
        cc.put("]");
    }
    cc.put(": ");
    addExpr(value, ASSIGN);
  }

  private void addConstant(Node n) {
    Node scopeNode = n.getNode(0);
    String name = n.getString(1);
    if (scopeNode == null) {
      if (classContext != null && classContext.body.constants.contains(name)) {
        cc.put(classContext.name + "." + name);
      } else {
        cc.put(name);
      }
      return;
    }
    if (!scopeNode.isToken(Token.CBASE)) {
      addExpr(scopeNode, CALL);
      cc.put(".");
    }
    cc.put(name);
  }

  /** A parenthesised group: one expression, or several joined by commas. */
  private void addGroup(Node n) {
    if (needsFunction(n)) {
      addIife(n);
      return;
    }
    List<Node> children = n.nodeChildren();
    if (children.isEmpty()) {
      cc.put("null");
      return;
    }
    if (children.size() == 1) {
      addExpr(children.get(0), 0);
      return;
    }
    for (int i = 0; i < children.size(); i++) {
      if (i > 0) {
        cc.put(", ");
      }
      addExpr(children.get(i), ASSIGN);
    }
  }

  private static boolean needsFunction(Node group) {
    for (Node child : group.nodeChildren()) {
      switch (child.getToken()) {
        case RESCUE:
        case ENSURE:
        case CASE:
        case WHILE:
        case UNTIL:
        case WHILE_POST:
        case UNTIL_POST:
        case FOR:
          return true;
        default:
          break;
      }
    }
    return false;
  }

  private void addConditional(Node n) {
    addExpr(n.getNonNullNode(0), LOGICAL_OR);
    cc.put(" ? ");
    addBranch(n.getNode(1));
    cc.put(" : ");
    addBranch(n.getNode(2));
  }

  private void addBranch(@Nullable Node branch) {
    if (branch == null) {
      cc.put("null");
    } else {
      addExpr(branch, ASSIGN);
    }
  }

  /** Statements in expression position run in an immediately invoked function. */
  private void addIife(Node n) {
    Node body = AutoReturn.apply(n);
    scope.pushFunction();
    jumps.push(JumpTarget.FUNCTION);
    try {
      if (es2015()) {
        cc.put("(() => ");
        addFunctionBlock(ImmutableList.of(), body);
        cc.put(")()");
        return;
      }
      cc.put("(function() ");
      addFunctionBlock(ImmutableList.of(), body);
      cc.put(")");
    } finally {
      jumps.pop();
      scope.pop();
    }
    cc.put(function != null && usesThis(n) ? ".call(this)" : "()");
  }

  // Logical operators.

  private void addLogical(Node n) {
    Node left = n.getNonNullNode(0);
    Node right = n.getNonNullNode(1);
    String operator;
    int precedence;
    if (n.isToken(Token.AND)) {
      operator = "&&";
      precedence = LOGICAL_AND;
    } else {
      operator = useNullish(left, right) ? "??" : "||";
      precedence = LOGICAL_OR;
    }
    addLogicalOperand(left, operator, precedence, false);
    cc.put(" " + operator + " ");
    addLogicalOperand(right, operator, precedence, true);
  }

  /** JavaScript refuses to mix {@code ??} with {@code &&} or {@code ||} without parentheses. */
  private void addLogicalOperand(Node operand, String operator, int precedence, boolean right) {
    int min = right ? precedence + 1 : precedence;
    Node inner = AutoReturn.unwrapParens(operand);
    boolean logical = inner.isToken(Token.AND) || inner.isToken(Token.OR);
    if (operator.equals("??") && logical) {
      min = PRIMARY + 1;
    } else if (!operator.equals("??") && printsNullish(inner)) {
      min = PRIMARY + 1;
    }
    addExpr(operand, min);
  }

  private boolean printsNullish(Node n) {
    if (n.isToken(Token.NULLISH)) {
      return atLeast(ConverterOptions.ES2020);
    }
    return n.isToken(Token.OR) && useNullish(n.getNonNullNode(0), n.getNonNullNode(1));
  }

  private boolean useNullish(Node left, Node right) {
    return options.getOr() == ConverterOptions.LogicalOr.NULLISH
        && atLeast(ConverterOptions.ES2020)
        && !isBoolean(left)
        && !isBoolean(right);
  }

  private void addNullish(Node n) {
    Node left = n.getNonNullNode(0);
    Node right = n.getNonNullNode(1);
    if (atLeast(ConverterOptions.ES2020)) {
      addLogicalOperand(left, "??", LOGICAL_OR, false);
      cc.put(" ?? ");
      addLogicalOperand(right, "??", LOGICAL_OR, true);
      return;
    }
    if (!isSimple(left)) {
      throw requiresLevel("nullish coalescing", ConverterOptions.ES2020, n);
    }
    addExpr(left, EQUALITY + 1);
    cc.put(" != null ? ");
    addExpr(left, ASSIGN);
    cc.put(" : ");
    addExpr(right, ASSIGN);
  }

  private void addNot(Node operand) {
    Node inner = AutoReturn.unwrapParens(operand);
    if (inner.isToken(Token.DEFINED)) {
      emit(
          inner,
          () -> {
            cc.put("typeof ");
            addExpr(inner.getNonNullNode(0), UNARY);
            cc.put(" === 'undefined'");
          });
      return;
    }
    if (isEquality(inner)) {
      String inverted = INVERSES.get(inner.getString(1));
      addExpr(inner.withChild(1, inverted), EQUALITY);
      return;
    }
    cc.put("!");
    addExpr(operand, UNARY);
  }

  private static final ImmutableMap<String, String> INVERSES =
      ImmutableMap.of("==", "!=", "!=", "==", "===", "!==", "!==", "===");

  private static boolean isEquality(Node n) {
    return n.isToken(Token.SEND)
        && n.getNode(0) != null
        && n.getChildCount() == 3
        && INVERSES.containsKey(n.getString(1))
        && !isSpecialArgument(n.getNonNullNode(2));
  }

  private static boolean negatesToEquality(Node operand) {
    Node inner = AutoReturn.unwrapParens(operand);
    return inner.isToken(Token.DEFINED) || isEquality(inner);
  }

  /** Whether {@code n} certainly produces a boolean, where {@code ??} would change meaning. */
  private static boolean isBoolean(Node n) {
    Node inner = AutoReturn.unwrapParens(n);
    switch (inner.getToken()) {
      case TRUE:
      case FALSE:
      case NOT:
      case AND:
      case OR:
      case DEFINED:
        return true;
      case SEND:
        {
          String method = inner.getString(1);
          return method.equals("!") || COMPARISONS.contains(method) || method.endsWith("?");
        }
      default:
        return false;
    }
  }

  private static boolean isSimple(Node n) {
    switch (n.getToken()) {
      case LVAR:
      case IVAR:
      case GVAR:
      case CVAR:
      case CONST:
      case SELF:
        return true;
      default:
        return false;
    }
  }

  // Calls.

  private void addReceiver(Node receiver) {
    if (receiver.isToken(Token.INT) || receiver.isToken(Token.FLOAT)) {
      cc.put("(");
      addExpr(receiver, COMMA);
      cc.put(")");
    } else {
      addExpr(receiver, CALL);
    }
  }

  private void addPropertyName(String name) {
    if (IDENTIFIER.matcher(name).matches()) {
      cc.put("." + name);
    } else {
      cc.put("[" + jsString(name) + "]");
    }
  }

  /** Writes a method call; {@code block} is a block node whose function ends the arguments. */
  private void addSend(Node n, @Nullable Node block) {
    Node receiver = n.getNode(0);
    String method = n.getString(1);
    List<Node> args = n.nodesFrom(2);
    if (block == null && !n.isToken(Token.CALL) && addOperator(n, receiver, method, args)) {
      return;
    }
    if (receiver != null && method.equals("new")) {
      addNew(receiver, args, block);
      return;
    }
    boolean splat = args.stream().anyMatch(a -> a.isToken(Token.SPLAT));
    if (splat && !es2015()) {
      addApply(n, receiver, method, args, block);
      return;
    }
    String name = stripSuffix(method);
    boolean call =
        block != null
            || !args.isEmpty()
            || method.endsWith("!")
            || n.isToken(Token.CALL)
            || ((receiver == null || receiver.isToken(Token.SELF)) && isClassMethod(name));
    if (receiver == null) {
      if (!IDENTIFIER.matcher(name).matches()) {
        throw unsupported("call to " + method, n);
      }
      cc.put(isClassMember(name) ? "this." + name : name);
    } else {
      addReceiver(receiver);
      addPropertyName(name);
    }
    if (call) {
      addArguments(args, block);
    }
  }

  /** Handles sends that are JavaScript operators. Returns false for ordinary calls. */
  private boolean addOperator(Node n, @Nullable Node receiver, String method, List<Node> args) {
    if (receiver == null) {
      if (method.equals("typeof") && args.size() == 1) {
        cc.put("typeof ");
        addExpr(args.get(0), UNARY);
        return true;
      }
      if (method.equals("raise")) {
        throw unsupported("raise in an expression", n);
      }
      return false;
    }
    if (args.stream().anyMatch(CodeGenerator::isSpecialArgument)) {
      return false;
    }
    if (args.isEmpty()) {
      switch (method) {
        case "!":
          addNot(receiver);
          return true;
        case "-@":
        case "+@":
        case "~":
          cc.put(method.substring(0, 1));
          addExpr(receiver, startsWithSign(receiver) ? PRIMARY + 1 : UNARY);
          return true;
        default:
          return false;
      }
    }
    if (args.size() == 2 && method.equals("[]=")) {
      addReceiver(receiver);
      cc.put("[");
      addExpr(args.get(0), COMMA);
      cc.put("] = ");
      addExpr(args.get(1), ASSIGN);
      return true;
    }
    if (args.size() != 1) {
      return false;
    }
    Node arg = args.get(0);
    switch (method) {
      case "=~":
        addMatch(receiver, arg);
        return true;
      case "!~":
        cc.put("!");
        addMatch(receiver, arg);
        return true;
      case "[]":
        addReceiver(receiver);
        cc.put("[");
        addExpr(arg, COMMA);
        cc.put("]");
        return true;
      case "**":
        if (!atLeast(ConverterOptions.ES2016)) {
          cc.put("Math.pow(");
          addExpr(receiver, ASSIGN);
          cc.put(", ");
          addExpr(arg, ASSIGN);
          cc.put(")");
          return true;
        }
        break;
      default:
        break;
    }
    Integer precedence = BINARY_OPERATORS.get(method);
    if (precedence != null) {
      addBinary(receiver, method, arg, precedence);
      return true;
    }
    if (ClassBody.isSetterName(method)) {
      addReceiver(receiver);
      addPropertyName(method.substring(0, method.length() - 1));
      cc.put(" = ");
      addExpr(arg, ASSIGN);
      return true;
    }
    return false;
  }

  private void addBinary(Node left, String operator, Node right, int precedence) {
    String js = operator;
    if (operator.equals("==") || operator.equals("!=")) {
      boolean negated = operator.equals("!=");
      if (left.isToken(Token.NIL) || right.isToken(Token.NIL)) {
        js = negated ? "!=" : "==";
      } else {
        js = options.equalityOperator(negated);
      }
    }
    if (operator.equals("**")) {
      addExpr(left, UNARY + 1);
      cc.put(" ** ");
      addExpr(right, precedence);
      return;
    }
    addExpr(left, precedence);
    cc.put(" " + js + " ");
    addExpr(right, precedence + 1);
  }

  private static boolean startsWithSign(Node n) {
    if (n.isToken(Token.INT) || n.isToken(Token.FLOAT)) {
      return formatNumber(n.getChild(0)).startsWith("-");
    }
    if (n.isToken(Token.SEND) && n.getNode(0) != null && n.getChildCount() == 2) {
      String method = n.getString(1);
      return method.equals("-@") || method.equals("+@");
    }
    return false;
  }

  /** {@code a =~ /re/} tests the regexp against the other operand. */
  private void addMatch(Node left, Node right) {
    Node regexp = left;
    Node subject = right;
    if (!AutoReturn.unwrapParens(left).isToken(Token.REGEXP)) {
      regexp = right;
      subject = left;
    }
    addReceiver(regexp);
    cc.put(".test(");
    addExpr(subject, ASSIGN);
    cc.put(")");
  }

  private void addNew(Node receiver, List<Node> args, @Nullable Node block) {
    if (!es2015() && args.stream().anyMatch(a -> a.isToken(Token.SPLAT))) {
      throw requiresLevel("splat in a constructor call", ConverterOptions.ES2015, receiver);
    }
    cc.put("new ");
    Node target = AutoReturn.unwrapParens(receiver);
    boolean parens =
        target.isToken(Token.SEND) || target.isToken(Token.CSEND) || target.isToken(Token.CALL);
    if (parens) {
      cc.put("(");
      addExpr(receiver, COMMA);
      cc.put(")");
    } else {
      addExpr(receiver, CALL);
    }
    addArguments(args, block);
  }

  /** Splat arguments before ES2015: {@code f.apply(receiver, [a].concat(rest))}. */
  private void addApply(
      Node n, @Nullable Node receiver, String method, List<Node> args, @Nullable Node block) {
    if (block != null) {
      throw requiresLevel("splat with a block", ConverterOptions.ES2015, n);
    }
    if (receiver != null && !isSimple(receiver)) {
      throw requiresLevel("splat with a computed receiver", ConverterOptions.ES2015, n);
    }
    String name = stripSuffix(method);
    if (receiver == null) {
      if (isClassMember(name)) {
        cc.put("this." + name + ".apply(this, ");
      } else {
        cc.put(name + ".apply(null, ");
      }
    } else {
      addReceiver(receiver);
      addPropertyName(name);
      cc.put(".apply(");
      addExpr(receiver, ASSIGN);
      cc.put(", ");
    }
    addArray(args);
    cc.put(")");
  }

  private void addArguments(List<Node> args, @Nullable Node block) {
    cc.put("(");
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        cc.put(", ");
      }
      Node arg = args.get(i);
      if (arg.isToken(Token.BLOCK_PASS)) {
        emit(arg, () -> addBlockPass(arg));
      } else {
        addExpr(arg, ASSIGN);
      }
    }
    if (block != null) {
      if (!args.isEmpty()) {
        cc.put(", ");
      }
      addFunctionExpression(blockArgs(block), block.getNode(2));
    }
    cc.put(")");
  }

  /** {@code &:name} becomes a function reading that property. */
  private void addBlockPass(Node pass) {
    Node value = pass.getChildCount() > 0 ? pass.getNode(0) : null;
    if (value == null) {
      throw unsupported("anonymous block argument", pass);
    }
    if (!value.isToken(Token.SYM)) {
      addExpr(value, ASSIGN);
      return;
    }
    String item = scope.uniqueName("item");
    String property = stripSuffix(value.getString(0));
    String access =
        IDENTIFIER.matcher(property).matches()
            ? item + "." + property
            : item + "[" + jsString(property) + "]";
    if (es2015()) {
      cc.put("(" + item + ") => " + access);
    } else {
      cc.put("function(" + item + ") {return " + access + "}");
    }
  }

  private static Node blockArgs(Node block) {
    if (!block.isToken(Token.NUMBLOCK)) {
      return block.getNonNullNode(1);
    }
    Object count = block.getChild(1);
    checkState(count instanceof Long, "numblock without a parameter count");
    String[] names = new String[((Long) count).intValue()];
    for (int i = 0; i < names.length; i++) {
      names[i] = "_" + (i + 1);
    }
    return IR.args(names).withSpanOf(block);
  }

  private static boolean isFunctionLiteral(Node call) {
    if (!call.isToken(Token.SEND) || call.getChildCount() != 2) {
      return false;
    }
    Node receiver = call.getNode(0);
    String method = call.getString(1);
    if (receiver == null) {
      return method.equals("lambda") || method.equals("proc");
    }
    return method.equals("new")
        && receiver.isToken(Token.CONST)
        && receiver.getNode(0) == null
        && receiver.getString(1).equals("Proc");
  }

  private void addBlock(Node block) {
    Node call = block.getNonNullNode(0);
    if (isFunctionLiteral(call)) {
      addFunctionExpression(blockArgs(block), block.getNode(2));
      return;
    }
    switch (call.getToken()) {
      case SEND:
      case CALL:
        emit(call, () -> addSend(call, block));
        return;
      case CSEND:
        emit(call, () -> addSafeNavigation(call, block));
        return;
      case SUPER:
      case ZSUPER:
        emit(call, () -> addSuper(call, block));
        return;
      default:
        throw malformed("block attached to " + call.getToken().getName(), block);
    }
  }

  private void addSafeNavigation(Node n, @Nullable Node block) {
    Node receiver = n.getNonNullNode(0);
    String method = n.getString(1);
    List<Node> args = n.nodesFrom(2);
    if (ClassBody.isSetterName(method) || method.equals("[]=")) {
      throw unsupported("assignment through safe navigation", n);
    }
    if (atLeast(ConverterOptions.ES2020)) {
      addReceiver(receiver);
      if (method.equals("[]") && args.size() == 1) {
        cc.put("?.[");
        addExpr(args.get(0), COMMA);
        cc.put("]");
        return;
      }
      String name = stripSuffix(method);
      if (!IDENTIFIER.matcher(name).matches()) {
        throw unsupported("operator " + method + " through safe navigation", n);
      }
      cc.put("?." + name);
      if (block != null || !args.isEmpty() || method.endsWith("!")) {
        addArguments(args, block);
      }
      return;
    }
    if (!isSimple(receiver)) {
      throw requiresLevel("safe navigation", ConverterOptions.ES2020, n);
    }
    addExpr(receiver, LOGICAL_AND);
    cc.put(" && ");
    Node send = n.withToken(Token.SEND);
    if (block == null) {
      addExpr(send, LOGICAL_AND + 1);
    } else {
      addSend(send, block);
    }
  }

  private void addYield(Node n) {
    if (function == null) {
      throw unsupported("yield outside of a method", n);
    }
    cc.put(function.blockName != null ? function.blockName : IMPLICIT_BLOCK);
    addArguments(n.nodesFrom(0), null);
  }

  private void addSuper(Node n, @Nullable Node block) {
    if (classContext == null || function == null || function.kind == FunctionKind.FUNCTION) {
      throw unsupported("super outside of a method", n);
    }
    FunctionContext method = function;
    boolean implicit = n.isToken(Token.ZSUPER);
    List<Node> args = implicit ? ImmutableList.of() : n.nodesFrom(0);
    if (es2015()) {
      switch (method.kind) {
        case CONSTRUCTOR:
          cc.put("super");
          break;
        case GETTER:
          cc.put("super." + method.name);
          return;
        case SETTER:
          cc.put("super." + method.name + " = ");
          if (implicit) {
            cc.put(method.forwarded.isEmpty() ? "undefined" : method.forwarded.get(0));
          } else if (args.size() == 1) {
            addExpr(args.get(0), ASSIGN);
          } else {
            throw unsupported("super in a setter with " + args.size() + " arguments", n);
          }
          return;
        default:
          cc.put("super." + method.name);
          break;
      }
      if (implicit) {
        addForwardedArguments(method, block);
      } else {
        addArguments(args, block);
      }
      return;
    }
    Node superclass = classContext.superclass;
    if (superclass == null) {
      throw unsupported("super in a class without a superclass", n);
    }
    if (method.kind == FunctionKind.GETTER || method.kind == FunctionKind.SETTER) {
      throw requiresLevel("super in an accessor", ConverterOptions.ES2015, n);
    }
    if (block != null) {
      throw requiresLevel("super with a block", ConverterOptions.ES2015, n);
    }
    addExpr(superclass, CALL);
    if (method.kind == FunctionKind.METHOD) {
      cc.put(method.isStatic ? "" : ".prototype");
      addPropertyName(method.name);
    }
    if (implicit) {
      cc.put(".apply(this, arguments)");
      return;
    }
    if (args.stream().anyMatch(a -> a.isToken(Token.SPLAT))) {
      cc.put(".apply(this, ");
      addArray(args);
      cc.put(")");
      return;
    }
    cc.put(".call(this");
    for (Node arg : args) {
      cc.put(", ");
      addExpr(arg, ASSIGN);
    }
    cc.put(")");
  }

  private void addForwardedArguments(FunctionContext method, @Nullable Node block) {
    cc.put("(" + Joiner.on(", ").join(method.forwarded));
    if (block != null) {
      if (!method.forwarded.isEmpty()) {
        cc.put(", ");
      }
      addFunctionExpression(blockArgs(block), block.getNode(2));
    }
    cc.put(")");
  }

  // Precedence.

  private int precedence(Node n) {
    switch (n.getToken()) {
      case INT:
      case FLOAT:
        return startsWithSign(n) ? UNARY : PRIMARY;
      case DSTR:
      case DSYM:
        {
          if (es2015()) {
            return PRIMARY;
          }
          List<Node> parts = interpolationParts(n);
          return parts.size() == 1 && parts.get(0).isToken(Token.STR) ? PRIMARY : ADDITIVE;
        }
      case REGEXP:
        for (Node part : n.nodeChildren()) {
          if (!part.isToken(Token.STR) && !part.isToken(Token.REGOPT)) {
            return CALL;
          }
        }
        return PRIMARY;
      case LVASGN:
      case IVASGN:
      case GVASGN:
      case CVASGN:
      case CASGN:
      case OP_ASGN:
      case OR_ASGN:
      case AND_ASGN:
      case MASGN:
      case SPLAT:
        return ASSIGN;
      case DEFS:
        return n.getNonNullNode(0).isToken(Token.SELF) && classContext == null ? PRIMARY : ASSIGN;
      case CLASS:
        return constantName(n.getNonNullNode(0)).contains(".") ? ASSIGN : PRIMARY;
      case IF:
        return CONDITIONAL;
      case AND:
        return LOGICAL_AND;
      case OR:
        return LOGICAL_OR;
      case NULLISH:
        return atLeast(ConverterOptions.ES2020) ? LOGICAL_OR : CONDITIONAL;
      case NOT:
        return negatesToEquality(n.getNonNullNode(0)) ? EQUALITY : UNARY;
      case DEFINED:
        return EQUALITY;
      case CSEND:
        return atLeast(ConverterOptions.ES2020) ? CALL : LOGICAL_AND;
      case SEND:
      case CALL:
        return sendPrecedence(n);
      case BLOCK:
      case NUMBLOCK:
        {
          Node call = n.getNonNullNode(0);
          if (isFunctionLiteral(call)) {
            return es2015() ? ASSIGN : PRIMARY;
          }
          if (call.isToken(Token.CSEND) && !atLeast(ConverterOptions.ES2020)) {
            return LOGICAL_AND;
          }
          return CALL;
        }
      case SUPER:
      case ZSUPER:
        return es2015() && function != null && function.kind == FunctionKind.SETTER
            ? ASSIGN
            : CALL;
      case BEGIN:
      case KWBEGIN:
        {
          if (needsFunction(n)) {
            return CALL;
          }
          List<Node> children = n.nodeChildren();
          if (children.isEmpty()) {
            return PRIMARY;
          }
          return children.size() == 1 ? precedence(children.get(0)) : COMMA;
        }
      case AUTORETURN:
        return COMMA;
      case CASE:
      case RESCUE:
      case ENSURE:
        return CALL;
      default:
        return PRIMARY;
    }
  }

  /** Mirrors the operator cases of {@link #addOperator}. */
  private int sendPrecedence(Node n) {
    if (n.isToken(Token.CALL)) {
      return CALL;
    }
    Node receiver = n.getNode(0);
    String method = n.getString(1);
    List<Node> args = n.nodesFrom(2);
    if (receiver == null) {
      return method.equals("typeof") && args.size() == 1 ? UNARY : CALL;
    }
    if (args.stream().anyMatch(CodeGenerator::isSpecialArgument)) {
      return CALL;
    }
    if (args.isEmpty()) {
      switch (method) {
        case "!":
          return negatesToEquality(receiver) ? EQUALITY : UNARY;
        case "-@":
        case "+@":
        case "~":
          return UNARY;
        default:
          return CALL;
      }
    }
    if (args.size() == 2) {
      return method.equals("[]=") ? ASSIGN : CALL;
    }
    if (args.size() != 1) {
      return CALL;
    }
    switch (method) {
      case "=~":
      case "[]":
        return CALL;
      case "!~":
        return UNARY;
      case "**":
        if (!atLeast(ConverterOptions.ES2016)) {
          return CALL;
        }
        break;
      default:
        break;
    }
    Integer precedence = BINARY_OPERATORS.get(method);
    if (precedence != null) {
      return precedence;
    }
    return ClassBody.isSetterName(method) ? ASSIGN : CALL;
  }

  /** Drops the {@code ?} or {@code !} that ends a Ruby predicate or bang method name. */
  static String stripSuffix(String name) {
    if (name.length() > 1 && (name.endsWith("?") || name.endsWith("!"))) {
      return name.substring(0, name.length() - 1);
    }
    return name;
  }
}
