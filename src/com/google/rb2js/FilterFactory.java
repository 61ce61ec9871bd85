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

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.ForOverride;
import java.util.function.Function;

/**
 * Creates a fresh {@link Filter} for each conversion. Filters keep scratch state for one walk, so
 * instances are never shared between conversions.
 */
@AutoValue
public abstract class FilterFactory {

  /** The name of the filter as it will appear in logs and in a {@link FilterRegistry}. */
  public abstract String getName();

  abstract Function<ConverterOptions, ? extends Filter> getInternalFactory();

  FilterFactory() {
    // Subclasses in this package only.
  }

  /** A builder for a {@link FilterFactory}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String x);

    public abstract Builder setInternalFactory(Function<ConverterOptions, ? extends Filter> x);

    @ForOverride
    abstract FilterFactory autoBuild();

    public final FilterFactory build() {
      FilterFactory result = autoBuild();
      checkState(!result.getName().isEmpty());
      return result;
    }
  }

  public static Builder builder() {
    return new AutoValue_FilterFactory.Builder();
  }

  public static FilterFactory of(String name, Function<ConverterOptions, ? extends Filter> f) {
    return builder().setName(name).setInternalFactory(f).build();
  }

  /** Creates a new filter for one conversion. */
  public final Filter create(ConverterOptions options) {
    return getInternalFactory().apply(options);
  }
}
