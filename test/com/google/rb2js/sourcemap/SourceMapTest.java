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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceMapTest {

  private static final SourceMap MAP =
      SourceMap.create(
          "out.js",
          ImmutableList.of("a.rb"),
          ImmutableList.of("(str \"<b>\")"),
          ImmutableList.of("x"),
          "AAAA;AACFA");

  @Test
  public void testToJson() {
    assertThat(MAP.toJson())
        .isEqualTo(
            "{\"version\":3,\"file\":\"out.js\",\"sources\":[\"a.rb\"],"
                + "\"sourcesContent\":[\"(str \\\"<b>\\\")\"],\"names\":[\"x\"],"
                + "\"mappings\":\"AAAA;AACFA\"}");
  }

  @Test
  public void testSourcesContentIsOmittedWhenEmpty() {
    SourceMap map =
        SourceMap.create(
            "out.js", ImmutableList.of("a.rb"), ImmutableList.of(), ImmutableList.of(), "AAAA");
    assertThat(map.toJsonObject().has("sourcesContent")).isFalse();
  }

  @Test
  public void testFromJsonRoundTrip() throws Exception {
    assertThat(SourceMap.fromJson(MAP.toJson())).isEqualTo(MAP);
  }

  @Test
  public void testFromJsonWithoutOptionalFields() throws Exception {
    SourceMap map = SourceMap.fromJson("{\"version\":3,\"mappings\":\"\"}");
    assertThat(map.getFile()).isEmpty();
    assertThat(map.getSources()).isEmpty();
    assertThat(map.getNames()).isEmpty();
  }

  @Test
  public void testMismatchedSourcesContent() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            SourceMap.create(
                "out.js",
                ImmutableList.of("a.rb", "b.rb"),
                ImmutableList.of("only one"),
                ImmutableList.of(),
                ""));
  }

  @Test
  public void testFromJsonErrors() {
    assertThrows(SourceMapParseException.class, () -> SourceMap.fromJson("{"));
    assertThrows(SourceMapParseException.class, () -> SourceMap.fromJson("[]"));
    assertThrows(
        SourceMapParseException.class,
        () -> SourceMap.fromJson("{\"version\":2,\"mappings\":\"\"}"));
    assertThrows(SourceMapParseException.class, () -> SourceMap.fromJson("{\"version\":3}"));
    assertThrows(
        SourceMapParseException.class,
        () -> SourceMap.fromJson("{\"version\":3,\"mappings\":\"\",\"sources\":\"a.rb\"}"));
  }
}
