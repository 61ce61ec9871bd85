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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * The local names visible while generating code. Function frames hold parameters and
 * function-scoped declarations; block frames hold block-scoped declarations, which only exist from
 * ES2015 on.
 */
final class Scope {

  enum Kind {
    FUNCTION,
    BLOCK
  }

  private static final class Frame {
    final Kind kind;
    final Set<String> names = new HashSet<>();

    Frame(Kind kind) {
      this.kind = kind;
    }
  }

  private final Deque<Frame> frames = new ArrayDeque<>();
  private final boolean blockScoped;
  private final Set<String> reserved;
  private int temporaries = 0;

  /**
   * @param blockScoped whether declarations land in the innermost frame ({@code let}) or in the
   *     innermost function frame ({@code var})
   * @param reserved names used anywhere in the program, which temporaries must avoid
   */
  Scope(boolean blockScoped, Set<String> reserved) {
    this.blockScoped = blockScoped;
    this.reserved = new HashSet<>(reserved);
    frames.push(new Frame(Kind.FUNCTION));
  }

  void pushFunction() {
    frames.push(new Frame(Kind.FUNCTION));
  }

  void pushBlock() {
    frames.push(new Frame(Kind.BLOCK));
  }

  void pop() {
    checkState(frames.size() > 1, "cannot pop the program scope");
    frames.pop();
  }

  int depth() {
    return frames.size();
  }

  /** Records a declaration. Returns false when the name was already visible. */
  boolean declare(String name) {
    if (isDeclared(name)) {
      return false;
    }
    target().names.add(name);
    return true;
  }

  /** Records a parameter or other name that belongs to the innermost frame. */
  void declareLocal(String name) {
    frames.peek().names.add(name);
  }

  boolean isDeclared(String name) {
    for (Frame frame : frames) {
      if (frame.names.contains(name)) {
        return true;
      }
    }
    return false;
  }

  private Frame target() {
    if (blockScoped) {
      return frames.peek();
    }
    for (Frame frame : frames) {
      if (frame.kind == Kind.FUNCTION) {
        return frame;
      }
    }
    throw new IllegalStateException("no function frame");
  }

  /** Returns a fresh name starting with {@code base} that no program name or earlier temp uses. */
  String uniqueName(String base) {
    String name = base;
    while (reserved.contains(name) || isDeclared(name)) {
      name = base + "$" + (++temporaries);
    }
    reserved.add(name);
    return name;
  }
}
