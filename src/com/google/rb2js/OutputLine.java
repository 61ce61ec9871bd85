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

import com.google.rb2js.ast.SourceSpan;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One line of generated output: the text fragments written to it, each remembering the span of
 * the node that produced it, plus the indentation the {@link WhitespaceNormalizer} assigns.
 */
final class OutputLine {

  /** A fragment of text and the span it was generated from. */
  static final class Segment {
    final String text;
    final @Nullable SourceSpan span;

    Segment(String text, @Nullable SourceSpan span) {
      this.text = text;
      this.span = span;
    }

    @Override
    public String toString() {
      return text;
    }
  }

  final List<Segment> segments = new ArrayList<>();
  int indent = 0;

  OutputLine() {}

  OutputLine(String text) {
    segments.add(new Segment(text, null));
  }

  void add(String text, @Nullable SourceSpan span) {
    segments.add(new Segment(text, span));
  }

  String text() {
    StringBuilder sb = new StringBuilder();
    for (Segment segment : segments) {
      sb.append(segment.text);
    }
    return sb.toString();
  }

  int length() {
    int length = 0;
    for (Segment segment : segments) {
      length += segment.text.length();
    }
    return length;
  }

  boolean isEmpty() {
    for (Segment segment : segments) {
      if (!segment.text.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  boolean isComment() {
    return text().trim().startsWith("//");
  }

  /** True for {@code case} and {@code default} labels, printed one level left of their body. */
  boolean isCaseLabel() {
    String text = text().trim();
    return text.startsWith("case ") || text.startsWith("default:");
  }

  /** The indentation the line is printed with. */
  int printedIndent() {
    return isCaseLabel() ? Math.max(0, indent - WhitespaceNormalizer.INDENT) : indent;
  }

  /**
   * Moves everything after character {@code offset} to a new line, which is returned. Leading
   * blanks of the moved text are dropped.
   */
  OutputLine splitAt(int offset) {
    OutputLine rest = new OutputLine();
    List<Segment> kept = new ArrayList<>();
    int position = 0;
    for (Segment segment : segments) {
      int end = position + segment.text.length();
      if (end <= offset) {
        kept.add(segment);
      } else if (position >= offset) {
        rest.segments.add(segment);
      } else {
        int cut = offset - position;
        kept.add(new Segment(segment.text.substring(0, cut), segment.span));
        rest.segments.add(new Segment(segment.text.substring(cut), segment.span));
      }
      position = end;
    }
    segments.clear();
    segments.addAll(kept);
    while (!rest.segments.isEmpty()) {
      Segment first = rest.segments.get(0);
      String stripped = stripLeading(first.text);
      if (!stripped.isEmpty()) {
        rest.segments.set(0, new Segment(stripped, first.span));
        break;
      }
      rest.segments.remove(0);
    }
    return rest;
  }

  private static String stripLeading(String text) {
    int i = 0;
    while (i < text.length() && text.charAt(i) == ' ') {
      i++;
    }
    return text.substring(i);
  }

  @Override
  public String toString() {
    return text();
  }
}
