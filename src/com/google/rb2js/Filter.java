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
import com.google.common.collect.ImmutableMap;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * A tree rewriting pass. A filter declares one handler per node kind it is interested in; nodes of
 * other kinds go straight to the next filter in the {@link Pipeline}.
 */
public interface Filter {

  /** Rewrites one node. */
  @FunctionalInterface
  interface Handler {
    /**
     * Returns the replacement for {@code node}, or null to leave the node to the rest of the chain
     * as if this filter had no handler for its kind.
     */
    @Nullable Node rewrite(Node node, FilterChain chain);
  }

  /** The name used in logs and for lookup in a {@link FilterRegistry}. */
  String getName();

  ImmutableMap<Token, Handler> getHandlers();

  /**
   * Called once with the rewritten root after the whole tree has been walked. Filters that need
   * to see the entire program first (export every top level definition, for example) do their
   * work here.
   */
  default Node finish(Node root, FilterChain chain) {
    return root;
  }

  /**
   * Gives the filter a chance to move itself, or others, within the list it is composed into.
   * Called once per filter, in list order, before the pipeline is built.
   */
  default ImmutableList<Filter> reorder(ImmutableList<Filter> filters) {
    return filters;
  }
}
