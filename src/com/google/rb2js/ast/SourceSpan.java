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

import com.google.auto.value.AutoValue;
import org.jspecify.annotations.Nullable;

/**
 * A region of the original source. Lines are 1-based and columns 0-based, which is what Ruby
 * parsers report.
 */
@AutoValue
public abstract class SourceSpan {

  public static SourceSpan create(
      @Nullable String sourceFile, int startLine, int startColumn, int endLine, int endColumn) {
    return new AutoValue_SourceSpan(sourceFile, startLine, startColumn, endLine, endColumn);
  }

  public abstract @Nullable String getSourceFile();

  public abstract int getStartLine();

  public abstract int getStartColumn();

  public abstract int getEndLine();

  public abstract int getEndColumn();

  public final boolean isMultiLine() {
    return getEndLine() > getStartLine();
  }

  /** Returns the smallest span covering both this span and {@code other}. */
  public final SourceSpan union(SourceSpan other) {
    SourceSpan first = comesBefore(other) ? this : other;
    SourceSpan last = endsAfter(other) ? this : other;
    return create(
        getSourceFile(),
        first.getStartLine(),
        first.getStartColumn(),
        last.getEndLine(),
        last.getEndColumn());
  }

  private boolean comesBefore(SourceSpan other) {
    return getStartLine() < other.getStartLine()
        || (getStartLine() == other.getStartLine() && getStartColumn() <= other.getStartColumn());
  }

  private boolean endsAfter(SourceSpan other) {
    return getEndLine() > other.getEndLine()
        || (getEndLine() == other.getEndLine() && getEndColumn() >= other.getEndColumn());
  }

  @Override
  public final String toString() {
    String file = getSourceFile() == null ? "<unknown>" : getSourceFile();
    return file + ":" + getStartLine() + ":" + getStartColumn();
  }
}
