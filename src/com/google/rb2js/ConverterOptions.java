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

import com.google.auto.value.AutoValue;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ForOverride;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/** Immutable settings for one conversion. */
@AutoValue
public abstract class ConverterOptions {
  private static final Logger logger = Logger.getLogger(ConverterOptions.class.getName());

  /** The oldest ECMAScript level the output may use. */
  public static final int ES5 = 2009;

  public static final int ES2015 = 2015;
  public static final int ES2016 = 2016;
  public static final int ES2017 = 2017;
  public static final int ES2018 = 2018;
  public static final int ES2019 = 2019;
  public static final int ES2020 = 2020;
  public static final int ES2021 = 2021;
  public static final int ES2022 = 2022;

  /** The newest level the code generator knows about. */
  public static final int LATEST = 2025;

  /** How Ruby {@code ==} and {@code !=} are written. */
  public enum Comparison {
    /** {@code ==} and {@code !=}. */
    LOOSE,
    /** {@code ===} and {@code !==}. */
    STRICT,
    /** Same output as {@link #STRICT}; kept for configurations written against older names. */
    IDENTITY
  }

  /** How Ruby {@code ||} is written. */
  public enum LogicalOr {
    LOGICAL,
    NULLISH
  }

  public abstract int getEsLevel();

  /** The explicit filter list. Absent means the registry default; empty means no rewriting. */
  public abstract Optional<ImmutableList<FilterFactory>> getFilters();

  public abstract ImmutableSet<String> getInclude();

  public abstract ImmutableSet<String> getExclude();

  public abstract boolean isIncludeAll();

  public abstract Comparison getComparison();

  public abstract LogicalOr getOr();

  public abstract boolean isAutoexports();

  /** Constant or method name to the module that provides it. */
  public abstract ImmutableMap<String, String> getAutoimports();

  public abstract Optional<String> getFileName();

  public abstract boolean isSourceMapRequested();

  public abstract Optional<String> getTemplateMarker();

  public abstract boolean isStrict();

  public abstract int getWidth();

  public abstract Builder toBuilder();

  public final boolean esLevelAtLeast(int level) {
    return getEsLevel() >= level;
  }

  /** True when a source map is to be produced. */
  public final boolean wantsSourceMap() {
    return getFileName().isPresent() || isSourceMapRequested();
  }

  /**
   * Whether an optional rewrite named {@code category} is enabled. Exclusion wins over inclusion;
   * categories nobody mentions get {@code enabledByDefault}.
   */
  public final boolean isEnabled(String category, boolean enabledByDefault) {
    if (getExclude().contains(category)) {
      return false;
    }
    if (isIncludeAll() || getInclude().contains(category)) {
      return true;
    }
    return enabledByDefault;
  }

  /** The equality operator for Ruby {@code ==}. */
  public final String equalityOperator(boolean negated) {
    if (getComparison() == Comparison.LOOSE) {
      return negated ? "!=" : "==";
    }
    return negated ? "!==" : "===";
  }

  ConverterOptions() {
    // Only AutoValue subclasses.
  }

  /** A builder for {@link ConverterOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setEsLevel(int level);

    public abstract Builder setFilters(ImmutableList<FilterFactory> filters);

    public abstract Builder setInclude(ImmutableSet<String> include);

    public abstract Builder setExclude(ImmutableSet<String> exclude);

    public abstract Builder setIncludeAll(boolean includeAll);

    public abstract Builder setComparison(Comparison comparison);

    public abstract Builder setOr(LogicalOr or);

    public abstract Builder setAutoexports(boolean autoexports);

    public abstract Builder setAutoimports(ImmutableMap<String, String> autoimports);

    public abstract Builder setFileName(String fileName);

    public abstract Builder setSourceMapRequested(boolean sourceMap);

    public abstract Builder setTemplateMarker(String marker);

    public abstract Builder setStrict(boolean strict);

    public abstract Builder setWidth(int width);

    /** Resolves filter names and instances against the default registry. */
    @CanIgnoreReturnValue
    public final Builder setFilters(Object... filters) {
      return setFilters(FilterRegistry.getDefault().resolveAll(Arrays.asList(filters)));
    }

    @CanIgnoreReturnValue
    public final Builder setInclude(String... include) {
      return setInclude(ImmutableSet.copyOf(include));
    }

    @CanIgnoreReturnValue
    public final Builder setExclude(String... exclude) {
      return setExclude(ImmutableSet.copyOf(exclude));
    }

    @ForOverride
    abstract ConverterOptions autoBuild();

    public final ConverterOptions build() {
      ConverterOptions options = autoBuild();
      checkArgument(isKnownLevel(options.getEsLevel()), "bad eslevel %s", options.getEsLevel());
      checkArgument(options.getWidth() > 10, "bad width %s", options.getWidth());
      return options;
    }
  }

  public static Builder builder() {
    return new AutoValue_ConverterOptions.Builder()
        .setEsLevel(ES5)
        .setInclude(ImmutableSet.<String>of())
        .setExclude(ImmutableSet.<String>of())
        .setIncludeAll(false)
        .setComparison(Comparison.LOOSE)
        .setOr(LogicalOr.LOGICAL)
        .setAutoexports(false)
        .setAutoimports(ImmutableMap.<String, String>of())
        .setSourceMapRequested(false)
        .setStrict(false)
        .setWidth(80);
  }

  public static ConverterOptions defaults() {
    return builder().build();
  }

  private static boolean isKnownLevel(int level) {
    return level == ES5 || (level >= ES2015 && level <= LATEST);
  }

  /**
   * Normalizes an ECMAScript level given as a year (2015), an edition number (6), or a name
   * ({@code "es2015"}, {@code "ES6"}).
   */
  public static int parseEsLevel(Object value) {
    int level;
    if (value instanceof Number) {
      level = ((Number) value).intValue();
    } else {
      String text = Ascii.toLowerCase(value.toString().trim());
      if (text.startsWith("es")) {
        text = text.substring(2);
      }
      try {
        level = Integer.parseInt(text);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("bad eslevel " + value, e);
      }
    }
    if (level <= 5) {
      return ES5;
    }
    if (level < 2000) {
      level += 2009;
    }
    checkArgument(isKnownLevel(level), "bad eslevel %s", value);
    return level;
  }

  /**
   * Builds options from loosely typed configuration, such as a parsed JSON or YAML document.
   * Unrecognized keys are ignored. Filter names must be known to the default registry.
   */
  public static ConverterOptions fromMap(Map<String, ?> map) {
    Builder builder = builder();
    for (Map.Entry<String, ?> entry : map.entrySet()) {
      Object value = entry.getValue();
      if (value == null) {
        continue;
      }
      switch (entry.getKey()) {
        case "eslevel":
        case "esLevel":
          builder.setEsLevel(parseEsLevel(value));
          break;
        case "filters":
          builder.setFilters(FilterRegistry.getDefault().resolveAll(asList(value)));
          break;
        case "include":
          builder.setInclude(asStringSet(value));
          break;
        case "exclude":
          builder.setExclude(asStringSet(value));
          break;
        case "include_all":
        case "includeAll":
          builder.setIncludeAll(asBoolean(value));
          break;
        case "comparison":
          builder.setComparison(
              Comparison.valueOf(Ascii.toUpperCase(value.toString()).replace("EQUALITY", "LOOSE")));
          break;
        case "or":
          builder.setOr(LogicalOr.valueOf(Ascii.toUpperCase(value.toString())));
          break;
        case "autoexports":
          builder.setAutoexports(asBoolean(value));
          break;
        case "autoimports":
          builder.setAutoimports(asStringMap(value));
          break;
        case "file":
        case "fileName":
          builder.setFileName(value.toString());
          break;
        case "sourceMap":
        case "sourcemap":
          builder.setSourceMapRequested(asBoolean(value));
          break;
        case "template":
        case "templateMarker":
          builder.setTemplateMarker(value.toString());
          break;
        case "strict":
          builder.setStrict(asBoolean(value));
          break;
        case "width":
          builder.setWidth(((Number) value).intValue());
          break;
        default:
          logger.fine("Ignoring unknown option " + entry.getKey());
      }
    }
    return builder.build();
  }

  /** Parses a JSON object with {@link Gson} and hands it to {@link #fromMap}. */
  public static ConverterOptions fromJson(String json) {
    Map<String, Object> map;
    try {
      map = new Gson().fromJson(json, new TypeToken<Map<String, Object>>() {}.getType());
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("options are not a JSON object: " + e.getMessage(), e);
    }
    checkArgument(map != null, "empty options");
    return fromMap(map);
  }

  private static List<?> asList(Object value) {
    if (value instanceof List) {
      return (List<?>) value;
    }
    if (value instanceof Object[]) {
      return Arrays.asList((Object[]) value);
    }
    return ImmutableList.of(value);
  }

  private static ImmutableSet<String> asStringSet(Object value) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (Object element : asList(value)) {
      builder.add(element.toString());
    }
    return builder.build();
  }

  private static ImmutableMap<String, String> asStringMap(Object value) {
    checkArgument(value instanceof Map, "expected a map, got %s", value);
    ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
      builder.put(entry.getKey().toString(), entry.getValue().toString());
    }
    return builder.buildOrThrow();
  }

  private static boolean asBoolean(@Nullable Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return value != null && Boolean.parseBoolean(value.toString());
  }
}
