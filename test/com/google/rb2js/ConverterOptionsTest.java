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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.rb2js.ConverterOptions.Comparison;
import com.google.rb2js.ConverterOptions.LogicalOr;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ConverterOptionsTest {

  @Test
  public void testDefaults() {
    ConverterOptions options = ConverterOptions.defaults();
    assertThat(options.getEsLevel()).isEqualTo(ConverterOptions.ES5);
    assertThat(options.getFilters()).isEmpty();
    assertThat(options.getComparison()).isEqualTo(Comparison.LOOSE);
    assertThat(options.getOr()).isEqualTo(LogicalOr.LOGICAL);
    assertThat(options.getWidth()).isEqualTo(80);
    assertThat(options.getFileName()).isEmpty();
    assertThat(options.wantsSourceMap()).isFalse();
    assertThat(options.isStrict()).isFalse();
  }

  @Test
  public void testParseEsLevel() {
    assertThat(ConverterOptions.parseEsLevel(2017)).isEqualTo(ConverterOptions.ES2017);
    assertThat(ConverterOptions.parseEsLevel(6)).isEqualTo(ConverterOptions.ES2015);
    assertThat(ConverterOptions.parseEsLevel(11)).isEqualTo(ConverterOptions.ES2020);
    assertThat(ConverterOptions.parseEsLevel(5)).isEqualTo(ConverterOptions.ES5);
    assertThat(ConverterOptions.parseEsLevel("es6")).isEqualTo(ConverterOptions.ES2015);
    assertThat(ConverterOptions.parseEsLevel(" ES2022 ")).isEqualTo(ConverterOptions.ES2022);
    assertThat(ConverterOptions.parseEsLevel(2021.0)).isEqualTo(ConverterOptions.ES2021);
  }

  @Test
  public void testParseEsLevelRejectsUnknownLevels() {
    assertThrows(IllegalArgumentException.class, () -> ConverterOptions.parseEsLevel(2014));
    assertThrows(IllegalArgumentException.class, () -> ConverterOptions.parseEsLevel(2099));
    assertThrows(IllegalArgumentException.class, () -> ConverterOptions.parseEsLevel("modern"));
  }

  @Test
  public void testBuildChecksValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConverterOptions.builder().setEsLevel(2012).build());
    assertThrows(
        IllegalArgumentException.class, () -> ConverterOptions.builder().setWidth(5).build());
  }

  @Test
  public void testExclusionWins() {
    ConverterOptions options =
        ConverterOptions.builder().setInclude("keys", "max").setExclude("max").build();
    assertThat(options.isEnabled("keys", false)).isTrue();
    assertThat(options.isEnabled("max", false)).isFalse();
    assertThat(options.isEnabled("sum", true)).isTrue();
    assertThat(options.isEnabled("clear", false)).isFalse();

    ConverterOptions all = ConverterOptions.builder().setIncludeAll(true).setExclude("clear").build();
    assertThat(all.isEnabled("keys", false)).isTrue();
    assertThat(all.isEnabled("clear", false)).isFalse();
  }

  @Test
  public void testEqualityOperator() {
    ConverterOptions loose = ConverterOptions.defaults();
    assertThat(loose.equalityOperator(false)).isEqualTo("==");
    assertThat(loose.equalityOperator(true)).isEqualTo("!=");
    ConverterOptions strict =
        ConverterOptions.builder().setComparison(Comparison.IDENTITY).build();
    assertThat(strict.equalityOperator(false)).isEqualTo("===");
    assertThat(strict.equalityOperator(true)).isEqualTo("!==");
  }

  @Test
  public void testFileNameImpliesSourceMap() {
    assertThat(ConverterOptions.builder().setFileName("a.rb").build().wantsSourceMap()).isTrue();
    assertThat(ConverterOptions.builder().setSourceMapRequested(true).build().wantsSourceMap())
        .isTrue();
  }

  @Test
  public void testFromMap() {
    ConverterOptions options =
        ConverterOptions.fromMap(
            ImmutableMap.<String, Object>builder()
                .put("eslevel", "es2020")
                .put("filters", ImmutableList.of("functions", "return"))
                .put("comparison", "identity")
                .put("or", "nullish")
                .put("include", "keys")
                .put("autoexports", "true")
                .put("autoimports", ImmutableMap.of("React", "react"))
                .put("file", "app.rb")
                .put("template", "__END__")
                .put("strict", true)
                .put("width", 100)
                .put("unknownOption", 1)
                .buildOrThrow());
    assertThat(options.getEsLevel()).isEqualTo(ConverterOptions.ES2020);
    assertThat(options.getFilters().get()).hasSize(2);
    assertThat(options.getFilters().get().get(0).getName()).isEqualTo(FilterRegistry.FUNCTIONS);
    assertThat(options.getComparison()).isEqualTo(Comparison.IDENTITY);
    assertThat(options.getOr()).isEqualTo(LogicalOr.NULLISH);
    assertThat(options.getInclude()).containsExactly("keys");
    assertThat(options.isAutoexports()).isTrue();
    assertThat(options.getAutoimports()).containsExactly("React", "react");
    assertThat(options.getFileName()).hasValue("app.rb");
    assertThat(options.getTemplateMarker()).hasValue("__END__");
    assertThat(options.isStrict()).isTrue();
    assertThat(options.getWidth()).isEqualTo(100);
  }

  @Test
  public void testEqualityIsAnAliasForLoose() {
    ConverterOptions options =
        ConverterOptions.fromMap(ImmutableMap.of("comparison", "equality"));
    assertThat(options.getComparison()).isEqualTo(Comparison.LOOSE);
  }

  @Test
  public void testFromMapRejectsUnknownFilters() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> ConverterOptions.fromMap(ImmutableMap.of("filters", ImmutableList.of("nope"))));
    assertThat(e).hasMessageThat().contains("unknown filter 'nope'");
  }

  @Test
  public void testFromJson() {
    ConverterOptions options =
        ConverterOptions.fromJson(
            "{\"eslevel\": 2021, \"filters\": [\"esm\"], \"comparison\": \"strict\","
                + " \"sourceMap\": true, \"width\": 60}");
    assertThat(options.getEsLevel()).isEqualTo(ConverterOptions.ES2021);
    assertThat(options.getFilters().get().get(0).getName()).isEqualTo(FilterRegistry.ESM);
    assertThat(options.getComparison()).isEqualTo(Comparison.STRICT);
    assertThat(options.isSourceMapRequested()).isTrue();
    assertThat(options.getWidth()).isEqualTo(60);
  }

  @Test
  public void testFromJsonErrors() {
    assertThrows(IllegalArgumentException.class, () -> ConverterOptions.fromJson("{"));
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> ConverterOptions.fromJson("null"));
    assertThat(e).hasMessageThat().isEqualTo("empty options");
  }

  @Test
  public void testToBuilder() {
    ConverterOptions options = ConverterOptions.builder().setStrict(true).build();
    ConverterOptions changed = options.toBuilder().setEsLevel(ConverterOptions.ES2018).build();
    assertThat(changed.isStrict()).isTrue();
    assertThat(changed.getEsLevel()).isEqualTo(ConverterOptions.ES2018);
    assertThat(changed.esLevelAtLeast(ConverterOptions.ES2017)).isTrue();
    assertThat(changed.esLevelAtLeast(ConverterOptions.ES2019)).isFalse();
  }
}
