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
 * Turns source text into a tree. The converter does not parse Ruby itself; callers plug in
 * whatever produces {@link Node} trees.
 */
@FunctionalInterface
public interface SourceParser {

  /**
   * @param fileName the name recorded in node spans, or null
   * @throws SyntaxException if the text cannot be parsed
   */
  Node parse(String source, @Nullable String fileName);
}
