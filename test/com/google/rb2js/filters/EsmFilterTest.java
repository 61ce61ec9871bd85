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

import com.google.common.collect.ImmutableMap;
import com.google.rb2js.ConversionTestBase;
import com.google.rb2js.ConverterOptions;
import com.google.rb2js.FilterRegistry;
import com.google.rb2js.UnsupportedConstructException;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class EsmFilterTest extends ConversionTestBase {

  @Before
  public void useEsmFilter() {
    setFilters(FilterRegistry.ESM);
    setEsLevel(ConverterOptions.ES2015);
  }

  @Test
  public void testImports() {
    assertConvert("(send nil :import (str \"x.js\"))", "import \"x.js\"");
    assertConvert(
        "(send nil :import (const nil :X) (str \"x.js\"))", "import X from \"x.js\"");
    assertConvert(
        "(send nil :import (const nil :X) (hash (pair (sym :from) (str \"x.js\"))))",
        "import X from \"x.js\"");
    assertConvert(
        "(send nil :import (const nil :X)"
            + " (hash (pair (sym :as) (str \"*\")) (pair (sym :from) (str \"x.js\"))))",
        "import * as X from \"x.js\"");
    assertConvert(
        "(send nil :import (array (const nil :A) (const nil :B))"
            + " (hash (pair (sym :from) (str \"p\"))))",
        "import {A, B} from \"p\"");
  }

  @Test
  public void testImportFromWithoutComma() {
    assertConvert(
        "(send nil :import (send nil :X (send nil :from (str \"x.js\"))))",
        "import X from \"x.js\"");
  }

  @Test
  public void testExports() {
    assertConvert("(send nil :export (def :f (args) nil))", "export function f() {}");
    assertConvert(
        "(send nil :export (send nil :default (const nil :X)))", "export default X");
    assertConvert(
        "(send nil :export (array (const nil :A) (hash (pair (sym :default) (const nil :B)))))",
        "export {A, B as default}");
  }

  @Test
  public void testAutoexports() {
    options.setAutoexports(true);
    assertConvert(
        "(def :f (args) nil) (class (const nil :A) nil nil) (casgn nil :X (int 1))"
            + " (send nil :g)",
        "export function f() {}; export class A {}; export const X = 1; g");
  }

  @Test
  public void testAutoimports() {
    options.setAutoimports(
        ImmutableMap.of(
            "React", "react", "func, another", "func.js", "Unused", "unused.js"));
    assertConvert(
        "(send (const nil :React) :render (send nil :func))",
        "import React from \"react\"; import {func, another} from \"func.js\"; React.render(func)");
  }

  @Test
  public void testDefinedNamesAreNotImported() {
    options.setAutoimports(ImmutableMap.of("func", "func.js"));
    assertConvert("(def :func (args) nil) (send nil :func)", "function func() {}; func");
  }

  @Test
  public void testNeedsEs2015() {
    setEsLevel(ConverterOptions.ES5);
    UnsupportedConstructException e = assertUnsupported("(send nil :import (str \"x.js\"))");
    assertThat(e.getDetail()).startsWith("import requires ES2015");
  }
}
