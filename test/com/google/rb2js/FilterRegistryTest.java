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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.rb2js.ast.IR;
import com.google.rb2js.ast.Token;
import com.google.rb2js.filters.ReturnFilter;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FilterRegistryTest {

  private static final FilterFactory NOOP =
      FilterFactory.of("noop", options -> new AbstractFilter("noop") {});

  @Test
  public void testBuiltInFilters() {
    FilterRegistry registry = FilterRegistry.getDefault();
    assertThat(registry.getNames())
        .containsExactly("functions", "return", "esm", "cjs", "camelCase", "polyfill");
    assertThat(registry.contains("esm")).isTrue();
    assertThat(registry.contains("node")).isFalse();
  }

  @Test
  public void testDefaultFilters() {
    ImmutableList<FilterFactory> defaults = FilterRegistry.getDefault().getDefaultFilters();
    assertThat(defaults).hasSize(3);
    assertThat(defaults.get(0).getName()).isEqualTo(FilterRegistry.ESM);
    assertThat(defaults.get(1).getName()).isEqualTo(FilterRegistry.FUNCTIONS);
    assertThat(defaults.get(2).getName()).isEqualTo(FilterRegistry.RETURN);
  }

  @Test
  public void testUnknownNameFailsFast() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> FilterRegistry.getDefault().resolve("jquery"));
    assertThat(e).hasMessageThat().contains("unknown filter 'jquery'");
  }

  @Test
  public void testResolveAllAcceptsMixedReferences() {
    ReturnFilter instance = new ReturnFilter();
    ImmutableList<FilterFactory> factories =
        FilterRegistry.getDefault().resolveAll(ImmutableList.of("esm", NOOP, instance));
    assertThat(factories).hasSize(3);
    assertThat(factories.get(0).getName()).isEqualTo("esm");
    assertThat(factories.get(1)).isSameInstanceAs(NOOP);
    assertThat(factories.get(2).create(ConverterOptions.defaults())).isSameInstanceAs(instance);
    assertThrows(
        IllegalArgumentException.class,
        () -> FilterRegistry.getDefault().resolveAll(ImmutableList.of(42)));
  }

  @Test
  public void testFactoriesCreateFreshFilters() {
    FilterFactory factory = FilterRegistry.getDefault().resolve(FilterRegistry.FUNCTIONS);
    ConverterOptions options = ConverterOptions.defaults();
    Filter first = factory.create(options);
    assertThat(first.getName()).isEqualTo(FilterRegistry.FUNCTIONS);
    assertThat(factory.create(options)).isNotSameInstanceAs(first);
  }

  @Test
  public void testCustomRegistry() {
    FilterRegistry registry =
        FilterRegistry.getDefault().toBuilder().register(NOOP).setDefaults("noop").build();
    assertThat(registry.contains("noop")).isTrue();
    assertThat(registry.contains("esm")).isTrue();
    assertThat(registry.getDefaultFilters()).containsExactly(NOOP);
    assertThat(FilterRegistry.getDefault().contains("noop")).isFalse();
  }

  @Test
  public void testBuilderChecks() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FilterRegistry.builder().register(NOOP).register(NOOP));
    assertThrows(
        IllegalArgumentException.class, () -> FilterRegistry.builder().setDefaults("missing"));
  }

  @Test
  public void testCustomRegistryInConverter() {
    FilterFactory shout =
        FilterFactory.of(
            "shout",
            options ->
                new AbstractFilter("shout") {
                  {
                    on(
                        Token.STR,
                        (node, chain) -> IR.string(Ascii.toUpperCase(node.getString(0))));
                  }
                });
    FilterRegistry registry = FilterRegistry.builder().register(shout).setDefaults("shout").build();
    Converter converter = new Converter(new SexpParser(), registry);
    assertThat(converter.convert("(str \"hi\")", ConverterOptions.defaults()).getText())
        .isEqualTo("\"HI\"");
  }
}
