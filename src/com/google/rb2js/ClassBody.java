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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Sorts the statements of a class or module body into members, which go inside the class, and
 * trailing statements, which run after it: constants, class variables, nested classes, mixins and
 * anything else Ruby executes while defining the class.
 */
final class ClassBody {

  enum MemberKind {
    CONSTRUCTOR,
    METHOD,
    GETTER,
    SETTER
  }

  /** A constructor, method or accessor defined by the class. */
  static final class Member {
    final MemberKind kind;
    final String name;
    final boolean isStatic;
    /** The {@code def} or {@code defs}; null for accessors made by {@code attr_accessor}. */
    final @Nullable Node definition;
    final Node source;

    Member(
        MemberKind kind, String name, boolean isStatic, @Nullable Node definition, Node source) {
      this.kind = kind;
      this.name = name;
      this.isStatic = isStatic;
      this.definition = definition;
      this.source = source;
    }

    /** The instance variable backing an accessor. */
    String field() {
      return "_" + name;
    }
  }

  private static final ImmutableSet<String> VISIBILITY =
      ImmutableSet.of("private", "protected", "public", "module_function", "private_constant");

  final Node name;
  final List<Member> members = new ArrayList<>();
  final List<Node> trailing = new ArrayList<>();
  final Set<String> getters = new HashSet<>();
  final Set<String> methods = new HashSet<>();
  final Set<String> staticGetters = new HashSet<>();
  final Set<String> staticMethods = new HashSet<>();
  final Set<String> constants = new HashSet<>();

  private ClassBody(Node name) {
    this.name = name;
  }

  /**
   * @param name the constant naming the class; trailing statements refer to the class through it
   */
  static ClassBody analyze(Node name, @Nullable Node body) {
    ClassBody result = new ClassBody(name);
    for (Node statement : statements(body)) {
      result.add(statement);
    }
    return result;
  }

  private static List<Node> statements(@Nullable Node body) {
    if (body == null) {
      return ImmutableList.of();
    }
    if (body.isToken(Token.BEGIN)) {
      List<Node> result = new ArrayList<>();
      for (Node child : body.nodeChildren()) {
        result.addAll(statements(child));
      }
      return result;
    }
    return ImmutableList.of(body);
  }

  private void add(Node statement) {
    switch (statement.getToken()) {
      case DEF:
        addDefinition(statement, statement.getString(0), statement.getNonNullNode(1), false);
        return;
      case DEFS:
        if (statement.getNonNullNode(0).isToken(Token.SELF)) {
          addDefinition(statement, statement.getString(1), statement.getNonNullNode(2), true);
          return;
        }
        break;
      case SEND:
        if (statement.getNode(0) == null && addMacro(statement)) {
          return;
        }
        break;
      case CASGN:
        if (statement.getNode(0) == null) {
          constants.add(statement.getString(1));
          trailing.add(statement.withChild(0, name));
          return;
        }
        break;
      case CLASS:
      case MODULE:
        {
          Node inner = statement.getNonNullNode(0);
          if (inner.isToken(Token.CONST) && inner.getNode(0) == null) {
            constants.add(inner.getString(1));
            trailing.add(statement.withChild(0, inner.withChild(0, name)));
            return;
          }
          break;
        }
      default:
        break;
    }
    trailing.add(statement);
  }

  private void addDefinition(Node def, String rubyName, Node args, boolean isStatic) {
    MemberKind kind;
    String jsName;
    if (!isStatic && rubyName.equals("initialize")) {
      kind = MemberKind.CONSTRUCTOR;
      jsName = "constructor";
    } else if (isSetterName(rubyName)) {
      kind = MemberKind.SETTER;
      jsName = rubyName.substring(0, rubyName.length() - 1);
    } else if (!args.hasChildren() && !rubyName.endsWith("!")) {
      kind = MemberKind.GETTER;
      jsName = CodeGenerator.stripSuffix(rubyName);
    } else {
      kind = MemberKind.METHOD;
      jsName = CodeGenerator.stripSuffix(rubyName);
    }
    members.add(new Member(kind, jsName, isStatic, def, def));
    if (kind == MemberKind.GETTER) {
      (isStatic ? staticGetters : getters).add(jsName);
    } else if (kind == MemberKind.METHOD) {
      (isStatic ? staticMethods : methods).add(jsName);
    }
  }

  /** Handles attr_* declarations, visibility markers and mixins. */
  private boolean addMacro(Node send) {
    String method = send.getString(1);
    List<Node> args = send.nodesFrom(2);
    switch (method) {
      case "attr_accessor":
      case "attr_reader":
      case "attr_writer":
        for (Node arg : args) {
          if (!arg.isToken(Token.SYM) && !arg.isToken(Token.STR)) {
            return false;
          }
        }
        for (Node arg : args) {
          String attribute = arg.getString(0);
          if (!method.equals("attr_writer")) {
            members.add(new Member(MemberKind.GETTER, attribute, false, null, arg));
            getters.add(attribute);
          }
          if (!method.equals("attr_reader")) {
            members.add(new Member(MemberKind.SETTER, attribute, false, null, arg));
          }
        }
        return true;
      case "alias_method":
        if (args.size() == 2) {
          Node prototype = IR.attr(name, "prototype");
          trailing.add(
              IR.send(
                      prototype,
                      CodeGenerator.stripSuffix(args.get(0).getString(0)) + "=",
                      IR.attr(prototype, CodeGenerator.stripSuffix(args.get(1).getString(0))))
                  .withSpanOf(send));
          return true;
        }
        return false;
      case "include":
      case "extend":
        {
          Node target = method.equals("include") ? IR.attr(name, "prototype") : name;
          for (Node arg : args) {
            trailing.add(
                IR.call(IR.constant("Object"), "assign", target, arg).withSpanOf(send));
          }
          return true;
        }
      default:
        break;
    }
    if (!VISIBILITY.contains(method)) {
      return false;
    }
    for (Node arg : args) {
      if (arg.isToken(Token.DEF) || arg.isToken(Token.DEFS)) {
        add(arg);
      }
    }
    return true;
  }

  static boolean isSetterName(String name) {
    return name.length() > 1
        && name.endsWith("=")
        && !name.equals("==")
        && !name.equals("!=")
        && !name.equals("<=")
        && !name.equals(">=")
        && !name.equals("===")
        && !name.equals("[]=");
  }

  @Nullable Member constructor() {
    for (Member member : members) {
      if (member.kind == MemberKind.CONSTRUCTOR) {
        return member;
      }
    }
    return null;
  }
}
