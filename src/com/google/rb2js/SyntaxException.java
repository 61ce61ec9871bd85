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
import org.jspecify.annotations.Nullable;

/**
 * Raised when source text cannot be parsed. Wraps the diagnostic of the parser adapter, which is
 * kept as the cause.
 */
public final class SyntaxException extends ConversionException {
  private static final long serialVersionUID = 1L;

  public SyntaxException(String message, @Nullable SourceSpan span, @Nullable Throwable cause) {
    super(ErrorKind.SYNTAX, Stage.PARSE, message, null, span, cause);
  }

  public SyntaxException(String message, @Nullable SourceSpan span) {
    this(message, span, null);
  }
}
