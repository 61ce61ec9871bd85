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
 * Raised when a filter or the code generator recognizes a construct it cannot express at the
 * requested ECMAScript level.
 */
public final class UnsupportedConstructException extends ConversionException {
  private static final long serialVersionUID = 1L;

  public UnsupportedConstructException(Stage stage, String message, @Nullable Node node) {
    super(ErrorKind.UNSUPPORTED_CONSTRUCT, stage, message, node, null);
  }

  /** A construct that needs {@code requiredLevel} or later. */
  public static UnsupportedConstructException requiresLevel(
      Stage stage, String feature, int requiredLevel, int esLevel, Node node) {
    return new UnsupportedConstructException(
        stage,
        feature + " requires ES" + requiredLevel + " (eslevel is " + esLevel + ")",
        node);
  }
}
