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

package com.google.rb2js.ast;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Node kinds. The parser spelling of each kind is available through {@link #getName()}; most are
 * the lower-cased constant name.
 */
public enum Token {
  // Literals.
  INT,
  FLOAT,
  STR,
  SYM,
  DSTR,
  DSYM,
  REGEXP,
  REGOPT,
  TRUE,
  FALSE,
  NIL,
  SELF,
  ARRAY,
  HASH,
  PAIR,
  SPLAT,
  KWSPLAT,
  IRANGE,
  ERANGE,

  // Variables and assignment.
  LVAR,
  IVAR,
  GVAR,
  CVAR,
  CONST,
  CBASE,
  LVASGN,
  IVASGN,
  GVASGN,
  CVASGN,
  CASGN,
  OP_ASGN,
  OR_ASGN,
  AND_ASGN,
  MASGN,
  MLHS,

  // Calls.
  SEND,
  CSEND,
  BLOCK,
  NUMBLOCK,
  BLOCK_PASS,
  SUPER,
  ZSUPER,
  YIELD,

  // Definitions.
  DEF,
  DEFS,
  ARGS,
  ARG,
  OPTARG,
  RESTARG,
  KWARG,
  KWOPTARG,
  KWRESTARG,
  BLOCKARG,
  SHADOWARG,
  CLASS,
  MODULE,

  // Control flow.
  BEGIN,
  KWBEGIN,
  IF,
  CASE,
  WHEN,
  WHILE,
  UNTIL,
  WHILE_POST,
  UNTIL_POST,
  FOR,
  BREAK,
  NEXT,
  RETURN,
  AND,
  OR,
  NOT,
  RESCUE,
  RESBODY,
  ENSURE,
  DEFINED("defined?"),

  // Kinds introduced by filters; the parser never produces these.
  ATTR,
  CALL,
  AUTORETURN,
  NULLISH,
  IMPORT,
  EXPORT,
  JSLITERAL;

  private static final ImmutableMap<String, Token> BY_NAME;

  static {
    ImmutableMap.Builder<String, Token> builder = ImmutableMap.builder();
    for (Token token : values()) {
      builder.put(token.name, token);
    }
    BY_NAME = builder.buildOrThrow();
  }

  private final String name;

  Token() {
    this.name = name().toLowerCase(Locale.ROOT);
  }

  Token(String name) {
    this.name = name;
  }

  /** Returns the parser spelling of this kind, e.g. {@code op_asgn} or {@code defined?}. */
  public String getName() {
    return name;
  }

  /** True for kinds only a filter may introduce. */
  public boolean isSynthetic() {
    return compareTo(ATTR) >= 0;
  }

  /** True for the formal parameter kinds found under {@code args}. */
  public boolean isArgument() {
    switch (this) {
      case ARG:
      case OPTARG:
      case RESTARG:
      case KWARG:
      case KWOPTARG:
      case KWRESTARG:
      case BLOCKARG:
      case SHADOWARG:
      case MLHS:
        return true;
      default:
        return false;
    }
  }

  /** Looks up a kind by its parser spelling. Returns null for unknown names. */
  public static @Nullable Token fromName(String name) {
    return BY_NAME.get(name);
  }
}
