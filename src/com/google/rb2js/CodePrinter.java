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
import com.google.rb2js.sourcemap.FilePosition;
import com.google.rb2js.sourcemap.SourceMapGeneratorV3;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Turns the lines collected by a {@link CodeConsumer} into the final text, reporting where every
 * segment that has a span ended up to a {@link SourceMapGeneratorV3}.
 */
final class CodePrinter {
  private final boolean vertical;
  private final @Nullable SourceMapGeneratorV3 generator;
  private final String defaultSourceName;
  private final StringBuilder code = new StringBuilder(1024);
  private int lineIndex = 0;
  private int lineLength = 0;

  CodePrinter(
      boolean vertical, @Nullable SourceMapGeneratorV3 generator, String defaultSourceName) {
    this.vertical = vertical;
    this.generator = generator;
    this.defaultSourceName = defaultSourceName;
  }

  /** Prints lines joined by newlines in vertical mode, and concatenated otherwise. */
  String print(List<OutputLine> lines) {
    boolean first = true;
    for (OutputLine line : lines) {
      if (vertical && !first) {
        code.append('\n');
        lineIndex++;
        lineLength = 0;
      }
      first = false;
      if (vertical && line.isEmpty()) {
        continue;
      }
      if (vertical) {
        append(WhitespaceNormalizer.spaces(line.printedIndent()), null);
      }
      for (OutputLine.Segment segment : line.segments) {
        append(segment.text, segment.span);
      }
    }
    return code.toString();
  }

  private void append(String text, @Nullable SourceSpan span) {
    if (span != null && generator != null) {
      int leading = 0;
      while (leading < text.length() && text.charAt(leading) == ' ') {
        leading++;
      }
      if (leading < text.length()) {
        String source = span.getSourceFile() == null ? defaultSourceName : span.getSourceFile();
        generator.addMapping(
            source,
            null,
            FilePosition.create(Math.max(0, span.getStartLine() - 1), span.getStartColumn()),
            FilePosition.create(lineIndex, lineLength + leading));
      }
    }
    code.append(text);
    lineLength += text.length();
  }
}
