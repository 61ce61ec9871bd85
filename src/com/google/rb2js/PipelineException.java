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

import com.google.rb2js.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Raised for a tree no filter lowered into something the code generator understands. This is a
 * bug in the filter chain, not in the input program.
 */
public final class PipelineException extends ConversionException {
  private static final long serialVersionUID = 1L;

  public PipelineException(Stage stage, String message, @Nullable Node node) {
    this(stage, message, node, null);
  }

  public PipelineException(
      Stage stage, String message, @Nullable Node node, @Nullable Throwable cause) {
    super(ErrorKind.PIPELINE, stage, message, node, cause);
  }
}
