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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.Token;
import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Convenience base class for filters. Subclasses register handlers from their constructor:
 *
 * <pre>
 *   MyFilter() {
 *     super("my");
 *     on(Token.SEND, this::rewriteSend);
 *   }
 * </pre>
 */
public abstract class AbstractFilter implements Filter {

  private final String name;
  private final Map<Token, Handler> handlers = new EnumMap<>(Token.class);
  private @Nullable ImmutableMap<Token, Handler> frozen;

  protected AbstractFilter(String name) {
    this.name = name;
  }

  protected final void on(Token kind, Handler handler) {
    checkArgument(frozen == null, "handlers of %s are already in use", name);
    checkArgument(!handlers.containsKey(kind), "%s handles %s twice", name, kind);
    handlers.put(kind, handler);
  }

  @Override
  public final String getName() {
    return name;
  }

  @Override
  public final ImmutableMap<Token, Handler> getHandlers() {
    if (frozen == null) {
      frozen = Maps.immutableEnumMap(handlers);
    }
    return frozen;
  }

  /** Runs a possibly empty child through the whole pipeline. */
  protected static @Nullable Node process(FilterChain chain, @Nullable Node node) {
    return node == null ? null : chain.process(node);
  }

  @Override
  public String toString() {
    return "Filter(" + name + ")";
  }
}
