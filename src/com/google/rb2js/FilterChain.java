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

/** The view of the composed {@link Pipeline} a {@link Filter.Handler} works against. */
public interface FilterChain {

  /**
   * Offers {@code node} to the filters after the current one, ending in the default traversal.
   * Lets a handler inspect a node, delegate, and further rewrite the result.
   */
  Node next(Node node);

  /** Runs {@code node} through the whole composed pipeline, starting at the first filter. */
  @Nullable Node process(@Nullable Node node);

  /**
   * The default traversal: runs every node child through the whole pipeline and rebuilds the node
   * if any child changed. Returns {@code node} itself otherwise.
   */
  Node processChildren(Node node);

  ConverterOptions getOptions();

  /**
   * Queues a statement to be placed in front of the program once the walk is complete. Imports
   * go ahead of everything else; a statement already queued is not added twice.
   */
  void prepend(Node statement);
}
