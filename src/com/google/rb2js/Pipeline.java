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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * An ordered list of filters composed into a single rewriting visitor.
 *
 * <p>The first filter in the list is the outermost: a node is offered to filter 0 first. A filter
 * that has no handler for the node's kind, or whose handler returns null, passes the node on to
 * the next filter. Once every filter has declined, the default traversal rewrites the node's
 * children, and it does so through the whole pipeline starting again at filter 0. A rewrite one
 * filter makes to a child is therefore seen by every filter when recursion reaches that child.
 *
 * <p>A pipeline holds the filters' scratch state and is used for a single conversion.
 */
public final class Pipeline {
  private static final Logger logger = Logger.getLogger(Pipeline.class.getName());

  private final ImmutableList<Filter> filters;
  private final ConverterOptions options;
  private final Link[] links;
  private final Set<Node> imports = new LinkedHashSet<>();
  private final Set<Node> prepends = new LinkedHashSet<>();
  private int visits = 0;

  private Pipeline(ImmutableList<Filter> filters, ConverterOptions options) {
    this.filters = filters;
    this.options = options;
    this.links = new Link[filters.size() + 1];
    for (int i = 0; i <= filters.size(); i++) {
      links[i] = new Link(i);
    }
  }

  /**
   * Composes filter instances, first listed outermost, after letting each filter {@link
   * Filter#reorder reorder} the list. An empty list is legal.
   */
  public static Pipeline compose(List<? extends Filter> filters, ConverterOptions options) {
    ImmutableList<Filter> ordered = ImmutableList.copyOf(filters);
    for (Filter filter : ImmutableList.copyOf(filters)) {
      ordered = checkNotNull(filter.reorder(ordered));
      checkState(
          ordered.size() == filters.size() && ordered.containsAll(filters),
          "%s reordered %s into %s",
          filter.getName(),
          filters,
          ordered);
    }
    return new Pipeline(ordered, checkNotNull(options));
  }

  /** Creates one filter per factory and composes them. */
  public static Pipeline create(List<FilterFactory> factories, ConverterOptions options) {
    List<Filter> filters = new ArrayList<>();
    for (FilterFactory factory : factories) {
      filters.add(factory.create(options));
    }
    return compose(filters, options);
  }

  public ImmutableList<Filter> getFilters() {
    return filters;
  }

  /**
   * Rewrites a whole program. Runs the walk, then each filter's {@link Filter#finish} hook in list
   * order, then puts queued imports and other prepended statements in front of the result.
   */
  public Node process(Node root) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Running pipeline " + filterNames());
    }
    Node result = links[0].process(root);
    checkNotNull(result, "pipeline dropped the root");
    for (Filter filter : filters) {
      result = filter.finish(result, links[0]);
    }
    result = applyPrepends(result);
    logger.fine("Pipeline visited " + visits + " nodes");
    return result;
  }

  /** Number of times a node was offered to the chain during the last walk. */
  int getVisitCount() {
    return visits;
  }

  private String filterNames() {
    List<String> names = new ArrayList<>();
    for (Filter filter : filters) {
      names.add(filter.getName());
    }
    return names.toString();
  }

  private Node dispatch(Node node, int from) {
    visits++;
    Token kind = node.getToken();
    for (int i = from; i < filters.size(); i++) {
      Filter.Handler handler = filters.get(i).getHandlers().get(kind);
      if (handler == null) {
        continue;
      }
      Node result = handler.rewrite(node, links[i + 1]);
      if (result != null) {
        if (logger.isLoggable(Level.FINEST) && result != node) {
          logger.finest(filters.get(i).getName() + " rewrote " + node + " to " + result);
        }
        return result;
      }
    }
    return processChildren(node);
  }

  private Node processChildren(Node node) {
    List<@Nullable Object> children = node.getChildren();
    List<@Nullable Object> rewritten = null;
    for (int i = 0; i < children.size(); i++) {
      Object child = children.get(i);
      if (!(child instanceof Node)) {
        continue;
      }
      Node newChild = dispatch((Node) child, 0);
      if (newChild != child) {
        if (rewritten == null) {
          rewritten = new ArrayList<>(children);
        }
        rewritten.set(i, newChild);
      }
    }
    return rewritten == null ? node : node.withChildren(rewritten);
  }

  private Node applyPrepends(Node root) {
    if (imports.isEmpty() && prepends.isEmpty()) {
      return root;
    }
    List<Node> statements = new ArrayList<>(imports);
    statements.addAll(prepends);
    if (root.isToken(Token.BEGIN)) {
      statements.addAll(root.nodesFrom(0));
    } else {
      statements.add(root);
    }
    return Node.create(Token.BEGIN, statements, root.getSpan());
  }

  /** The chain as seen from position {@code index}. */
  private final class Link implements FilterChain {
    private final int index;

    Link(int index) {
      this.index = index;
    }

    @Override
    public Node next(Node node) {
      return dispatch(node, index);
    }

    @Override
    public @Nullable Node process(@Nullable Node node) {
      return node == null ? null : dispatch(node, 0);
    }

    @Override
    public Node processChildren(Node node) {
      return Pipeline.this.processChildren(node);
    }

    @Override
    public ConverterOptions getOptions() {
      return options;
    }

    @Override
    public void prepend(Node statement) {
      if (statement.isToken(Token.IMPORT)) {
        imports.add(statement);
      } else {
        prepends.add(statement);
      }
    }
  }
}
