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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link SourceMapConsumerV3} */
@RunWith(JUnit4.class)
public final class SourceMapConsumerV3Test {

  private final SourceMapConsumerV3 consumer = new SourceMapConsumerV3();

  private static SourceMap golden() {
    return SourceMap.create(
        "out.js",
        ImmutableList.of("a.rb"),
        ImmutableList.of(),
        ImmutableList.of("x"),
        "AAAA,IACE;AACFA");
  }

  @Test
  public void testSources() throws Exception {
    consumer.parse(golden());
    assertThat(consumer.getOriginalSources()).containsExactly("a.rb");
    assertThat(consumer.getLineCount()).isEqualTo(2);
  }

  @Test
  public void testGetMappingForLine() throws Exception {
    consumer.parse(golden());

    OriginalMapping first = consumer.getMappingForLine(1, 1);
    assertThat(first.getOriginalFile()).isEqualTo("a.rb");
    assertThat(first.getLineNumber()).isEqualTo(1);
    assertThat(first.getColumnPosition()).isEqualTo(1);
    assertThat(first.getIdentifier()).isNull();

    // Columns between segments belong to the segment before them.
    OriginalMapping second = consumer.getMappingForLine(1, 7);
    assertThat(second.getLineNumber()).isEqualTo(2);
    assertThat(second.getColumnPosition()).isEqualTo(3);

    OriginalMapping named = consumer.getMappingForLine(2, 1);
    assertThat(named.getLineNumber()).isEqualTo(3);
    assertThat(named.getColumnPosition()).isEqualTo(1);
    assertThat(named.getIdentifier()).isEqualTo("x");
  }

  @Test
  public void testOutOfRange() throws Exception {
    consumer.parse(golden());
    assertThat(consumer.getMappingForLine(3, 1)).isNull();
    assertThat(consumer.getMappingForLine(0, 1)).isNull();
    assertThat(consumer.getMappingForLine(1, 0)).isNull();
  }

  @Test
  public void testEmptyLineFallsBackToPreviousLine() throws Exception {
    consumer.parse(
        SourceMap.create(
            "out.js", ImmutableList.of("a.rb"), ImmutableList.of(), ImmutableList.of(), "AAAA;;EAAE"));
    OriginalMapping mapping = consumer.getMappingForLine(2, 5);
    assertThat(mapping.getLineNumber()).isEqualTo(1);
    assertThat(mapping.getColumnPosition()).isEqualTo(1);
    // Before the first segment of line 3, the last segment of line 1 applies.
    assertThat(consumer.getMappingForLine(3, 1).getColumnPosition()).isEqualTo(1);
    assertThat(consumer.getMappingForLine(3, 3).getColumnPosition()).isEqualTo(3);
  }

  @Test
  public void testVisitMappings() throws Exception {
    consumer.parse(golden());
    List<String> visited = new ArrayList<>();
    consumer.visitMappings(
        (source, name, original, generated) ->
            visited.add(
                source
                    + ":"
                    + original.getLine()
                    + ":"
                    + original.getColumn()
                    + " -> "
                    + generated.getLine()
                    + ":"
                    + generated.getColumn()
                    + (name == null ? "" : " " + name)));
    assertThat(visited)
        .containsExactly("a.rb:0:0 -> 0:0", "a.rb:1:2 -> 0:4", "a.rb:2:0 -> 1:0 x")
        .inOrder();
  }

  @Test
  public void testParseJson() throws Exception {
    consumer.parse(golden().toJson());
    assertThat(consumer.getMappingForLine(2, 1).getIdentifier()).isEqualTo("x");
  }

  @Test
  public void testRoundTripThroughGenerator() throws Exception {
    SourceMapGeneratorV3 generator = new SourceMapGeneratorV3();
    generator.addMapping("b.rb", null, FilePosition.create(4, 7), FilePosition.create(2, 3));
    generator.addMapping("c.rb", "y", FilePosition.create(0, 1), FilePosition.create(2, 9));
    consumer.parse(generator.build("out.js"));

    OriginalMapping b = consumer.getMappingForLine(3, 4);
    assertThat(b.getOriginalFile()).isEqualTo("b.rb");
    assertThat(b.getLineNumber()).isEqualTo(5);
    assertThat(b.getColumnPosition()).isEqualTo(8);

    OriginalMapping c = consumer.getMappingForLine(3, 10);
    assertThat(c.getOriginalFile()).isEqualTo("c.rb");
    assertThat(c.getIdentifier()).isEqualTo("y");
  }

  @Test
  public void testBadMappings() {
    assertThrows(
        SourceMapParseException.class,
        () ->
            consumer.parse(
                SourceMap.create(
                    "out.js", ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), "AAAA")));
    assertThrows(
        SourceMapParseException.class,
        () ->
            consumer.parse(
                SourceMap.create(
                    "out.js",
                    ImmutableList.of("a.rb"),
                    ImmutableList.of(),
                    ImmutableList.of(),
                    "AA!A")));
    assertThrows(
        SourceMapParseException.class,
        () ->
            consumer.parse(
                SourceMap.create(
                    "out.js",
                    ImmutableList.of("a.rb"),
                    ImmutableList.of(),
                    ImmutableList.of(),
                    "AA")));
  }
}
