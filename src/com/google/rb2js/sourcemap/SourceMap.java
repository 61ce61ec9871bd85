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

package com.google.rb2js.sourcemap;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * A finished version 3 source map.
 *
 * <p>{@link #getSourcesContent()} is either empty or holds one entry per source.
 */
@AutoValue
public abstract class SourceMap {
  public static final int VERSION = 3;

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  public static SourceMap create(
      String file,
      ImmutableList<String> sources,
      ImmutableList<String> sourcesContent,
      ImmutableList<String> names,
      String mappings) {
    if (!sourcesContent.isEmpty() && sourcesContent.size() != sources.size()) {
      throw new IllegalArgumentException("sourcesContent does not match sources");
    }
    return new AutoValue_SourceMap(file, sources, sourcesContent, names, mappings);
  }

  public final int getVersion() {
    return VERSION;
  }

  public abstract String getFile();

  public abstract ImmutableList<String> getSources();

  public abstract ImmutableList<String> getSourcesContent();

  public abstract ImmutableList<String> getNames();

  /** The VLQ encoded segments, one group per generated line separated by semicolons. */
  public abstract String getMappings();

  public final JsonObject toJsonObject() {
    JsonObject map = new JsonObject();
    map.addProperty("version", VERSION);
    map.addProperty("file", getFile());
    map.add("sources", toArray(getSources()));
    if (!getSourcesContent().isEmpty()) {
      map.add("sourcesContent", toArray(getSourcesContent()));
    }
    map.add("names", toArray(getNames()));
    map.addProperty("mappings", getMappings());
    return map;
  }

  public final String toJson() {
    return GSON.toJson(toJsonObject());
  }

  private static JsonArray toArray(ImmutableList<String> values) {
    JsonArray array = new JsonArray();
    for (String value : values) {
      array.add(value);
    }
    return array;
  }

  /** Reads a map written by {@link #toJson()} or any other version 3 producer. */
  public static SourceMap fromJson(String json) throws SourceMapParseException {
    JsonObject root;
    try {
      JsonElement element = JsonParser.parseString(json);
      if (!element.isJsonObject()) {
        throw new SourceMapParseException("source map is not a JSON object");
      }
      root = element.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new SourceMapParseException("JSON parse exception: " + e.getMessage(), e);
    }
    if (!root.has("version") || root.get("version").getAsInt() != VERSION) {
      throw new SourceMapParseException("Unknown version: " + root.get("version"));
    }
    if (!root.has("mappings")) {
      throw new SourceMapParseException("missing mappings");
    }
    try {
      return create(
          root.has("file") ? root.get("file").getAsString() : "",
          readArray(root, "sources"),
          readArray(root, "sourcesContent"),
          readArray(root, "names"),
          root.get("mappings").getAsString());
    } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
      throw new SourceMapParseException("malformed source map: " + e.getMessage(), e);
    }
  }

  private static ImmutableList<String> readArray(JsonObject root, String name) {
    if (!root.has(name) || root.get(name).isJsonNull()) {
      return ImmutableList.of();
    }
    if (!root.get(name).isJsonArray()) {
      throw new IllegalArgumentException(name + " is not an array");
    }
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (JsonElement element : root.getAsJsonArray(name)) {
      builder.add(element.isJsonNull() ? "" : element.getAsString());
    }
    return builder.build();
  }

  @Override
  public final String toString() {
    return toJson();
  }
}
