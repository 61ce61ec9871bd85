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
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.SourceSpan;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Collects the output of the {@link CodeGenerator} as a list of lines made of text segments.
 *
 * <p>The generator always breaks lines after opening braces and between statements. In compact
 * mode the lines are later joined without separators, giving single-line output; in vertical mode
 * they are joined with newlines after the {@link WhitespaceNormalizer} fixed their indentation.
 */
final class CodeConsumer {

  /** A position in the output: a line index and a segment count on that line. */
  static final class Mark {
    final int line;
    final int segment;

    Mark(int line, int segment) {
      this.line = line;
      this.segment = segment;
    }
  }

  private final boolean vertical;
  private final int width;
  private final List<OutputLine> lines = new ArrayList<>();
  private OutputLine line;
  private final List<@Nullable SourceSpan> spans = new ArrayList<>();

  CodeConsumer(boolean vertical, int width) {
    this.vertical = vertical;
    this.width = width;
    this.line = new OutputLine();
    lines.add(line);
  }

  boolean isVertical() {
    return vertical;
  }

  ImmutableList<OutputLine> getLines() {
    return ImmutableList.copyOf(lines);
  }

  /** Segments written until the matching {@link #endSourceMapping} carry the node's span. */
  void startSourceMapping(Node node) {
    spans.add(node.getSpan());
  }

  void endSourceMapping(Node node) {
    spans.remove(spans.size() - 1);
  }

  private @Nullable SourceSpan currentSpan() {
    return spans.isEmpty() ? null : spans.get(spans.size() - 1);
  }

  /** Adds text to the current line. Newlines in {@code text} start new lines. */
  void put(String text) {
    if (text.indexOf('\n') < 0) {
      line.add(text, currentSpan());
      return;
    }
    String[] parts = text.split("\n", -1);
    line.add(parts[0], currentSpan());
    for (int i = 1; i < parts.length; i++) {
      newLine();
      if (!parts[i].isEmpty()) {
        line.add(parts[i], currentSpan());
      }
    }
  }

  /** Adds text, then starts a new line. */
  void puts(String text) {
    put(text);
    newLine();
  }

  /** Starts a new line, then adds text to it. */
  void sput(String text) {
    newLine();
    put(text);
  }

  void newLine() {
    line = new OutputLine();
    lines.add(line);
  }

  /** Ends a statement that is followed by another one. */
  void separator() {
    if (vertical) {
      puts(";");
    } else {
      put("; ");
    }
  }

  /** A break between items of a list: a newline in vertical mode, a blank otherwise. */
  void ws() {
    if (vertical) {
      newLine();
    } else {
      put(" ");
    }
  }

  Mark mark() {
    return new Mark(lines.size() - 1, line.segments.size());
  }

  /** Whether anything was written since {@code mark}. */
  boolean wroteSince(Mark mark) {
    if (lines.size() - 1 > mark.line) {
      return true;
    }
    for (int i = mark.segment; i < line.segments.size(); i++) {
      if (!line.segments.get(i).text.isEmpty()) {
        return true;
      }
    }
    return false;
  }

  /** The text written since {@code mark} with line breaks as blanks. */
  String textSince(Mark mark) {
    StringBuilder sb = new StringBuilder();
    for (int i = mark.line; i < lines.size(); i++) {
      List<OutputLine.Segment> segments = lines.get(i).segments;
      for (int j = i == mark.line ? mark.segment : 0; j < segments.size(); j++) {
        sb.append(segments.get(j).text);
      }
    }
    return sb.toString();
  }

  /**
   * Writes a braced body. A body that turns out to be one short line that does not declare
   * anything loses its braces: {@code if (x) y}.
   */
  void wrap(Runnable body) {
    puts("{");
    Mark mark = mark();
    body.run();
    OutputLine header = lines.get(mark.line - 1);
    if (lines.size() - 1 == mark.line && line.isEmpty()) {
      lines.remove(lines.size() - 1);
      line = header;
      put("}");
      return;
    }
    String bodyText = line.text();
    if (lines.size() > mark.line + 1
        || header.length() + bodyText.length() >= width
        || declares(bodyText)) {
      sput("}");
      return;
    }
    header.segments.remove(header.segments.size() - 1);
    lines.remove(lines.size() - 1);
    header.segments.addAll(line.segments);
    line = header;
  }

  /** Writes a braced body that always keeps its braces. */
  void block(Runnable body) {
    puts("{");
    Mark mark = mark();
    body.run();
    if (lines.size() - 1 == mark.line && line.isEmpty()) {
      lines.remove(lines.size() - 1);
      line = lines.get(lines.size() - 1);
      put("}");
    } else {
      sput("}");
    }
  }

  private static boolean declares(String text) {
    return text.startsWith("let ")
        || text.startsWith("const ")
        || text.startsWith("var ")
        || text.startsWith("function ")
        || text.startsWith("class ");
  }

  /**
   * Joins the lines written by {@code body} into one when they fit, so that short arrays and
   * object literals stay on a single line.
   */
  void compact(Runnable body) {
    Mark mark = mark();
    body.run();
    if (lines.size() - mark.line <= 1) {
      return;
    }
    List<OutputLine> written = lines.subList(mark.line, lines.size());
    int length = 0;
    for (OutputLine l : written) {
      if (l.isComment()) {
        return;
      }
      length += l.length() + 1;
    }
    if (length >= width - 10) {
      return;
    }
    OutputLine joined = new OutputLine();
    for (int i = 0; i < written.size(); i++) {
      if (i > 1 && i < written.size() - 1) {
        joined.add(" ", null);
      }
      joined.segments.addAll(written.get(i).segments);
    }
    written.clear();
    lines.add(joined);
    line = joined;
  }
}
