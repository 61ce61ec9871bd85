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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Collects mappings from generated positions to original positions and encodes them as a version
 * 3 source map.
 *
 * <p>Mappings must be added in generated order. A mapping at the same generated position as the
 * previous one is dropped; the first one recorded for a position wins.
 *
 * @see <a href="https://sourcemaps.info/spec.html">Source Map Revision 3</a>
 */
public final class SourceMapGeneratorV3 {
  private static final Logger logger = Logger.getLogger(SourceMapGeneratorV3.class.getName());

  /** Mappings in the order they were added, which is generated order. */
  private final List<Mapping> mappings = new ArrayList<>();

  /** Source name to source index. */
  private final LinkedHashMap<String, Integer> sourceFileMap = new LinkedHashMap<>();

  /** Symbol name to name index. */
  private final LinkedHashMap<String, Integer> originalNameMap = new LinkedHashMap<>();

  private final Map<String, String> sourceContents = new HashMap<>();

  private @Nullable Mapping lastMapping;

  /** Registers a source and the text to embed for it in {@code sourcesContent}. */
  public void addSourceContent(String sourceName, String content) {
    getSourceId(sourceName);
    sourceContents.put(sourceName, content);
  }

  /**
   * Adds a mapping for the generated code starting at {@code outputStartPosition}.
   *
   * @param sourceName The file name of the original source.
   * @param symbolName The original identifier, if the generated code names one.
   * @param sourceStartPosition The 0-based position in the original source.
   * @param outputStartPosition The 0-based position in the generated code.
   */
  public void addMapping(
      String sourceName,
      @Nullable String symbolName,
      FilePosition sourceStartPosition,
      FilePosition outputStartPosition) {
    checkArgument(sourceStartPosition.getLine() >= 0, "bad source line %s", sourceStartPosition);
    checkArgument(
        sourceStartPosition.getColumn() >= 0, "bad source column %s", sourceStartPosition);
    if (lastMapping != null) {
      int order = outputStartPosition.compareTo(lastMapping.generatedPosition);
      checkState(order >= 0, "mapping at %s added after %s", outputStartPosition, lastMapping);
      if (order == 0) {
        return;
      }
    }
    Mapping mapping =
        new Mapping(sourceName, symbolName, sourceStartPosition, outputStartPosition);
    getSourceId(sourceName);
    if (symbolName != null) {
      getNameId(symbolName);
    }
    mappings.add(mapping);
    lastMapping = mapping;
  }

  public int getMappingCount() {
    return mappings.size();
  }

  /** Encodes the collected mappings. With none, the result has an empty mappings string. */
  public SourceMap build(String file) {
    StringBuilder out = new StringBuilder();
    new LineMapper(out).appendLineMappings();

    ImmutableList<String> sources = ImmutableList.copyOf(sourceFileMap.keySet());
    ImmutableList<String> contents = ImmutableList.of();
    if (!sourceContents.isEmpty()) {
      ImmutableList.Builder<String> builder = ImmutableList.builder();
      for (String source : sources) {
        String content = sourceContents.get(source);
        builder.add(content == null ? "" : content);
      }
      contents = builder.build();
    }
    logger.fine("Encoded " + mappings.size() + " mappings for " + file);
    return SourceMap.create(
        file, sources, contents, ImmutableList.copyOf(originalNameMap.keySet()), out.toString());
  }

  private int getSourceId(String sourceName) {
    Integer id = sourceFileMap.get(sourceName);
    if (id == null) {
      id = sourceFileMap.size();
      sourceFileMap.put(sourceName, id);
    }
    return id;
  }

  private int getNameId(String symbolName) {
    Integer id = originalNameMap.get(symbolName);
    if (id == null) {
      id = originalNameMap.size();
      originalNameMap.put(symbolName, id);
    }
    return id;
  }

  /** A mapping from a position in an original source to a position in the generated code. */
  static final class Mapping {
    final String sourceFile;
    final @Nullable String originalName;
    final FilePosition originalPosition;
    final FilePosition generatedPosition;

    Mapping(
        String sourceFile,
        @Nullable String originalName,
        FilePosition originalPosition,
        FilePosition generatedPosition) {
      this.sourceFile = sourceFile;
      this.originalName = originalName;
      this.originalPosition = originalPosition;
      this.generatedPosition = generatedPosition;
    }

    @Override
    public String toString() {
      return generatedPosition + " -> " + sourceFile + "@" + originalPosition;
    }
  }

  /**
   * Writes the segments line by line. Every field is stored relative to the previous segment;
   * the generated column restarts at zero on each line.
   */
  private class LineMapper {
    private final StringBuilder out;

    private int previousLine = 0;
    private int previousColumn = 0;
    private int previousSourceFileId;
    private int previousSourceLine;
    private int previousSourceColumn;
    private int previousNameId;

    LineMapper(StringBuilder out) {
      this.out = out;
    }

    void appendLineMappings() {
      boolean firstOnLine = true;
      for (Mapping m : mappings) {
        int line = m.generatedPosition.getLine();
        while (previousLine < line) {
          out.append(';');
          previousLine++;
          previousColumn = 0;
          firstOnLine = true;
        }
        if (!firstOnLine) {
          out.append(',');
        }
        writeEntry(m);
        firstOnLine = false;
      }
    }

    private void writeEntry(Mapping m) {
      int column = m.generatedPosition.getColumn();
      Base64VLQ.encode(out, column - previousColumn);
      previousColumn = column;

      int sourceId = getSourceId(m.sourceFile);
      Base64VLQ.encode(out, sourceId - previousSourceFileId);
      previousSourceFileId = sourceId;

      int srcLine = m.originalPosition.getLine();
      int srcColumn = m.originalPosition.getColumn();
      Base64VLQ.encode(out, srcLine - previousSourceLine);
      previousSourceLine = srcLine;

      Base64VLQ.encode(out, srcColumn - previousSourceColumn);
      previousSourceColumn = srcColumn;

      if (m.originalName != null) {
        int nameId = getNameId(m.originalName);
        Base64VLQ.encode(out, nameId - previousNameId);
        previousNameId = nameId;
      }
    }
  }
}
