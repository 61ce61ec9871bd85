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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import com.google.rb2js.filters.CamelCaseFilter;
import com.google.rb2js.filters.CjsFilter;
import com.google.rb2js.filters.EsmFilter;
import com.google.rb2js.filters.FunctionsFilter;
import com.google.rb2js.filters.PolyfillFilter;
import com.google.rb2js.filters.ReturnFilter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps filter names to factories and knows the list used when a caller names none. Registries are
 * immutable; {@link #getDefault()} is built once when the class is loaded and only read after.
 */
@Immutable
@SuppressWarnings("Immutable") // factories hold stateless creation functions
public final class FilterRegistry {

  public static final String FUNCTIONS = "functions";
  public static final String RETURN = "return";
  public static final String ESM = "esm";
  public static final String CJS = "cjs";
  public static final String CAMEL_CASE = "camelCase";
  public static final String POLYFILL = "polyfill";

  private static final FilterRegistry DEFAULT =
      builder()
          .register(FilterFactory.of(FUNCTIONS, FunctionsFilter::new))
          .register(FilterFactory.of(RETURN, options -> new ReturnFilter()))
          .register(FilterFactory.of(ESM, EsmFilter::new))
          .register(FilterFactory.of(CJS, CjsFilter::new))
          .register(FilterFactory.of(CAMEL_CASE, options -> new CamelCaseFilter()))
          .register(FilterFactory.of(POLYFILL, options -> new PolyfillFilter()))
          .setDefaults(ESM, FUNCTIONS, RETURN)
          .build();

  private final ImmutableMap<String, FilterFactory> factories;
  private final ImmutableList<FilterFactory> defaults;

  private FilterRegistry(
      ImmutableMap<String, FilterFactory> factories, ImmutableList<FilterFactory> defaults) {
    this.factories = factories;
    this.defaults = defaults;
  }

  /** The process wide registry of built-in filters. */
  public static FilterRegistry getDefault() {
    return DEFAULT;
  }

  public ImmutableSet<String> getNames() {
    return factories.keySet();
  }

  /** The filters used when the options name none. */
  public ImmutableList<FilterFactory> getDefaultFilters() {
    return defaults;
  }

  public boolean contains(String name) {
    return factories.containsKey(name);
  }

  /** Looks up a filter by name. */
  public FilterFactory resolve(String name) {
    FilterFactory factory = factories.get(name);
    if (factory == null) {
      throw new IllegalArgumentException(
          "unknown filter '" + name + "'; known filters are " + factories.keySet());
    }
    return factory;
  }

  /**
   * Resolves a mixed list of filter names, {@link FilterFactory factories} and {@link Filter}
   * instances. An instance is used as is, so a list holding one should only be used once.
   */
  public ImmutableList<FilterFactory> resolveAll(List<?> references) {
    ImmutableList.Builder<FilterFactory> builder = ImmutableList.builder();
    for (Object reference : references) {
      if (reference instanceof FilterFactory) {
        builder.add((FilterFactory) reference);
      } else if (reference instanceof Filter) {
        Filter filter = (Filter) reference;
        builder.add(FilterFactory.of(filter.getName(), options -> filter));
      } else if (reference instanceof String) {
        builder.add(resolve((String) reference));
      } else {
        throw new IllegalArgumentException("not a filter: " + reference);
      }
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder seeded with this registry's filters and defaults. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.factories.putAll(factories);
    builder.defaults = defaults;
    return builder;
  }

  /** Builder for {@link FilterRegistry}. */
  public static final class Builder {
    private final Map<String, FilterFactory> factories = new LinkedHashMap<>();
    private ImmutableList<FilterFactory> defaults = ImmutableList.of();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder register(FilterFactory factory) {
      checkArgument(
          !factories.containsKey(factory.getName()), "duplicate filter %s", factory.getName());
      factories.put(factory.getName(), factory);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDefaults(String... names) {
      ImmutableList.Builder<FilterFactory> list = ImmutableList.builder();
      for (String name : names) {
        FilterFactory factory = factories.get(name);
        checkArgument(factory != null, "default filter %s is not registered", name);
        list.add(factory);
      }
      defaults = list.build();
      return this;
    }

    public FilterRegistry build() {
      return new FilterRegistry(ImmutableMap.copyOf(factories), defaults);
    }
  }
}
