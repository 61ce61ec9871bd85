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

package com.google.rb2js.filters;

import static com.google.common.truth.Truth.assertThat;

import com.google.rb2js.ConversionTestBase;
import com.google.rb2js.ConverterOptions;
import com.google.rb2js.FilterRegistry;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CamelCaseFilterTest extends ConversionTestBase {

  @Before
  public void useCamelCaseFilter() {
    setFilters(FilterRegistry.CAMEL_CASE);
    setEsLevel(ConverterOptions.ES2015);
  }

  @Test
  public void testCamelCase() {
    assertThat(CamelCaseFilter.camelCase("foo_bar_baz")).isEqualTo("fooBarBaz");
    assertThat(CamelCaseFilter.camelCase("_private")).isEqualTo("_private");
    assertThat(CamelCaseFilter.camelCase("is_a?")).isEqualTo("is_a?");
    assertThat(CamelCaseFilter.camelCase("inner_html")).isEqualTo("innerHTML");
    assertThat(CamelCaseFilter.camelCase("version_2")).isEqualTo("version2");
  }

  @Test
  public void testRenamesDefinitionsAndReferences() {
    assertConvert(
        "(def :foo_bar (args (arg :some_arg)) (send nil :other_call (lvar :some_arg)))",
        "function fooBar(someArg) {otherCall(someArg)}");
    assertConvert("(ivasgn :@my_var (int 1))", "this._myVar = 1");
    assertConvert("(sym :foo_bar)", "\"fooBar\"");
    assertConvert("(lvar :_private)", "_private");
  }

  @Test
  public void testCapitalizedExceptions() {
    assertConvert("(send (lvar :el) :inner_html= (str \"x\"))", "el.innerHTML = \"x\"");
    assertConvert("(send nil :encode_uri_component (lvar :s))", "encodeURIComponent(s)");
  }

  @Test
  public void testOtherFiltersSeeRubyNames() {
    setFilters(FilterRegistry.FUNCTIONS, FilterRegistry.CAMEL_CASE);
    assertConvert("(send (lvar :my_str) :start_with? (str \"a\"))", "myStr.startsWith(\"a\")");
  }
}
