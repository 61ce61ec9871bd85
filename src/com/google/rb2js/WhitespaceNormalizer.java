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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Second pass over multi-line output. The code generator breaks lines but never indents them;
 * this class assigns indentation from the brackets at the start and end of each line and places
 * blank lines around blocks.
 *
 * <ul>
 *   <li>A line starting with {@code )}, {@code ]} or <code>}</code> is indented one level less than
 *       the line before it. Code that follows such a closing line after a semicolon is moved to
 *       its own line.
 *   <li>A line ending with {@code (}, {@code [} or <code>{</code> indents the lines after it.
 *   <li>A blank line goes before a line that opens a block when the line before is a sibling at
 *       the same depth, after the line that closes a block when a sibling follows, and before a
 *       comment.
 *   <li>{@code case} and {@code default} labels are printed one level left of their body.
 * </ul>
 *
 * <p>Indentation never goes below zero.
 */
public final class WhitespaceNormalizer {
  private static final Logger logger = Logger.getLogger(WhitespaceNormalizer.class.getName());

  static final int INDENT = 2;

  private WhitespaceNormalizer() {}

  /** Normalizes plain JavaScript text. */
  public static String normalize(String text) {
    List<OutputLine> lines = new ArrayList<>();
    for (String line : Splitter.on('\n').split(text)) {
      lines.add(new OutputLine(line.trim()));
    }
    normalize(lines);
    return render(lines);
  }

  static String render(List<OutputLine> lines) {
    List<String> printed = new ArrayList<>(lines.size());
    for (OutputLine line : lines) {
      printed.add(line.isEmpty() ? "" : spaces(line.printedIndent()) + line.text());
    }
    return Joiner.on('\n').join(printed);
  }

  static String spaces(int count) {
    StringBuilder sb = new StringBuilder(count);
    for (int i = 0; i < count; i++) {
      sb.append(' ');
    }
    return sb.toString();
  }

  /** Normalizes in place. */
  static void normalize(List<OutputLine> lines) {
    splitClosingLines(lines);
    reindent(lines);
    respace(lines);
    logger.fine("Normalized " + lines.size() + " lines");
  }

  private static boolean isOpener(char c) {
    return c == '(' || c == '{' || c == '[';
  }

  private static boolean isCloser(char c) {
    return c == ')' || c == '}' || c == ']';
  }

  /** Moves code that follows a closing bracket and a semicolon onto a line of its own. */
  private static void splitClosingLines(List<OutputLine> lines) {
    for (int i = 0; i < lines.size(); i++) {
      OutputLine line = lines.get(i);
      String text = line.text();
      if (text.isEmpty() || !isCloser(text.charAt(0))) {
        continue;
      }
      int j = 0;
      while (j < text.length() && isCloser(text.charAt(j))) {
        j++;
      }
      if (j < text.length() && text.charAt(j) == ';') {
        int rest = j + 1;
        while (rest < text.length() && text.charAt(rest) == ' ') {
          rest++;
        }
        if (rest < text.length()) {
          lines.add(i + 1, line.splitAt(j + 1));
        }
      }
    }
  }

  private static void reindent(List<OutputLine> lines) {
    int indent = 0;
    for (OutputLine line : lines) {
      String text = line.text().trim();
      if (text.isEmpty()) {
        line.indent = indent;
        continue;
      }
      if (isCloser(text.charAt(0))) {
        indent = Math.max(0, indent - INDENT);
      }
      line.indent = indent;
      if (isOpener(text.charAt(text.length() - 1))) {
        indent += INDENT;
      }
    }
  }

  private static void respace(List<OutputLine> lines) {
    for (int i = lines.size() - 3; i >= 0; i--) {
      OutputLine current = lines.get(i);
      OutputLine next = lines.get(i + 1);
      OutputLine after = lines.get(i + 2);
      if (next.isComment() && !current.isComment() && !current.isEmpty()) {
        // before a comment
        lines.add(i + 1, new OutputLine());
      } else if (current.indent == next.indent
          && next.indent < after.indent
          && !current.isComment()
          && !current.isEmpty()) {
        // start of an indented block
        lines.add(i + 1, new OutputLine());
      } else if (current.indent > next.indent
          && next.indent == after.indent
          && !after.isEmpty()) {
        // end of an indented block
        lines.add(i + 2, new OutputLine());
      }
    }
  }
}
