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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.rb2js.sourcemap.Base64VLQ.CharIterator;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Reads the mappings of a version 3 source map back into positions. */
public final class SourceMapConsumerV3 {
  static final int UNMAPPED = -1;

  private ImmutableList<String> sources = ImmutableList.of();
  private ImmutableList<String> names = ImmutableList.of();
  // Slots are null for generated lines without segments.
  private List<@Nullable List<Entry>> lines = new ArrayList<>();

  /** Receives every mapped segment, in generated order. */
  public interface EntryVisitor {
    void visit(
        String sourceName,
        @Nullable String symbolName,
        FilePosition sourceStartPosition,
        FilePosition generatedStartPosition);
  }

  public void parse(String contents) throws SourceMapParseException {
    parse(SourceMap.fromJson(contents));
  }

  public void parse(SourceMap map) throws SourceMapParseException {
    sources = map.getSources();
    names = map.getNames();
    lines = new ArrayList<>();
    try {
      new MappingBuilder(map.getMappings()).build();
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new SourceMapParseException("bad mappings: " + e.getMessage(), e);
    }
  }

  /** Number of generated lines that the mappings describe. */
  public int getLineCount() {
    return lines.size();
  }

  public ImmutableList<String> getOriginalSources() {
    return sources;
  }

  /**
   * Returns the original position for a 1-based generated line and column: the closest segment at
   * or before the column on that line, else the last segment of an earlier line. Returns null
   * when nothing precedes the position.
   */
  public @Nullable OriginalMapping getMappingForLine(int lineNumber, int column) {
    // Normalize the line and column numbers to 0.
    lineNumber--;
    column--;
    if (lineNumber < 0 || lineNumber >= lines.size() || column < 0) {
      return null;
    }

    List<Entry> entries = lines.get(lineNumber);
    if (entries == null || entries.get(0).generatedColumn > column) {
      return getPreviousMapping(lineNumber);
    }
    Entry best = entries.get(0);
    for (Entry entry : entries) {
      if (entry.generatedColumn > column) {
        break;
      }
      best = entry;
    }
    return toOriginalMapping(best);
  }

  public void visitMappings(EntryVisitor visitor) {
    for (int line = 0; line < lines.size(); line++) {
      List<Entry> entries = lines.get(line);
      if (entries == null) {
        continue;
      }
      for (Entry entry : entries) {
        if (entry.sourceFileId == UNMAPPED) {
          continue;
        }
        visitor.visit(
            sources.get(entry.sourceFileId),
            entry.nameId == UNMAPPED ? null : names.get(entry.nameId),
            FilePosition.create(entry.sourceLine, entry.sourceColumn),
            FilePosition.create(line, entry.generatedColumn));
      }
    }
  }

  private @Nullable OriginalMapping getPreviousMapping(int lineNumber) {
    do {
      if (lineNumber == 0) {
        return null;
      }
      lineNumber--;
    } while (lines.get(lineNumber) == null);
    List<Entry> entries = lines.get(lineNumber);
    return toOriginalMapping(entries.get(entries.size() - 1));
  }

  private @Nullable OriginalMapping toOriginalMapping(Entry entry) {
    if (entry.sourceFileId == UNMAPPED) {
      return null;
    }
    return OriginalMapping.create(
        sources.get(entry.sourceFileId),
        entry.sourceLine + 1,
        entry.sourceColumn + 1,
        entry.nameId == UNMAPPED ? null : names.get(entry.nameId));
  }

  private class MappingBuilder {
    private static final int MAX_ENTRY_VALUES = 5;
    private final StringCharIterator content;
    private int previousCol = 0;
    private int previousSrcId = 0;
    private int previousSrcLine = 0;
    private int previousSrcColumn = 0;
    private int previousNameId = 0;

    MappingBuilder(String lineMap) {
      this.content = new StringCharIterator(lineMap);
    }

    void build() {
      int[] temp = new int[MAX_ENTRY_VALUES];
      List<Entry> entries = new ArrayList<>();
      while (content.hasNext()) {
        // ';' denotes a new line.
        if (tryConsumeToken(';')) {
          lines.add(entries.isEmpty() ? null : entries);
          entries = new ArrayList<>();
          previousCol = 0;
        } else {
          int entryValues = 0;
          while (!entryComplete()) {
            checkState(entryValues < MAX_ENTRY_VALUES, "too many values in segment");
            temp[entryValues] = Base64VLQ.decode(content);
            entryValues++;
          }
          entries.add(decodeEntry(temp, entryValues));
          tryConsumeToken(',');
        }
      }
      if (!entries.isEmpty()) {
        lines.add(entries);
      }
    }

    /**
     * The values of a segment, each relative to the same field of the previous segment: generated
     * column, source index, source line, source column, name index.
     */
    private Entry decodeEntry(int[] vals, int entryValues) {
      Entry entry;
      switch (entryValues) {
        case 1:
          entry = new Entry(vals[0] + previousCol, UNMAPPED, 0, 0, UNMAPPED);
          break;
        case 4:
        case 5:
          entry =
              new Entry(
                  vals[0] + previousCol,
                  vals[1] + previousSrcId,
                  vals[2] + previousSrcLine,
                  vals[3] + previousSrcColumn,
                  entryValues == 5 ? vals[4] + previousNameId : UNMAPPED);
          previousSrcId = entry.sourceFileId;
          previousSrcLine = entry.sourceLine;
          previousSrcColumn = entry.sourceColumn;
          if (entryValues == 5) {
            previousNameId = entry.nameId;
          }
          break;
        default:
          throw new IllegalStateException("Unexpected number of values for entry:" + entryValues);
      }
      previousCol = entry.generatedColumn;
      checkState(
          entry.sourceFileId == UNMAPPED || entry.sourceFileId < sources.size(),
          "source index %s out of range",
          entry.sourceFileId);
      checkState(
          entry.nameId == UNMAPPED || entry.nameId < names.size(),
          "name index %s out of range",
          entry.nameId);
      return entry;
    }

    private boolean tryConsumeToken(char token) {
      if (content.hasNext() && content.peek() == token) {
        content.next();
        return true;
      }
      return false;
    }

    private boolean entryComplete() {
      if (!content.hasNext()) {
        return true;
      }
      char c = content.peek();
      return c == ';' || c == ',';
    }
  }

  private static final class StringCharIterator implements CharIterator {
    private final String content;
    private int current = 0;

    StringCharIterator(String content) {
      this.content = content;
    }

    @Override
    public char next() {
      return content.charAt(current++);
    }

    char peek() {
      return content.charAt(current);
    }

    @Override
    public boolean hasNext() {
      return current < content.length();
    }
  }

  private static final class Entry {
    final int generatedColumn;
    final int sourceFileId;
    final int sourceLine;
    final int sourceColumn;
    final int nameId;

    Entry(int generatedColumn, int sourceFileId, int sourceLine, int sourceColumn, int nameId) {
      this.generatedColumn = generatedColumn;
      this.sourceFileId = sourceFileId;
      this.sourceLine = sourceLine;
      this.sourceColumn = sourceColumn;
      this.nameId = nameId;
    }
  }
}
