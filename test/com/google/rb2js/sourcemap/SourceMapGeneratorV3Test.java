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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceMapGeneratorV3Test {

  private final SourceMapGeneratorV3 generator = new SourceMapGeneratorV3();

  private void map(String source, String name, int srcLine, int srcCol, int line, int col) {
    generator.addMapping(
        source, name, FilePosition.create(srcLine, srcCol), FilePosition.create(line, col));
  }

  @Test
  public void testEmptyMap() {
    SourceMap map = generator.build("out.js");
    assertThat(map.getMappings()).isEmpty();
    assertThat(map.getSources()).isEmpty();
    assertThat(map.getFile()).isEqualTo("out.js");
    assertThat(map.getVersion()).isEqualTo(3);
  }

  @Test
  public void testGoldenMappings() {
    map("a.rb", null, 0, 0, 0, 0);
    map("a.rb", null, 1, 2, 0, 4);
    map("a.rb", "x", 2, 0, 1, 0);
    SourceMap map = generator.build("out.js");
    assertThat(map.getMappings()).isEqualTo("AAAA,IACE;AACFA");
    assertThat(map.getSources()).containsExactly("a.rb");
    assertThat(map.getNames()).containsExactly("x");
    assertThat(map.getSourcesContent()).isEmpty();
  }

  @Test
  public void testEmptyGeneratedLinesAreSkipped() {
    map("a.rb", null, 0, 0, 0, 0);
    map("a.rb", null, 0, 0, 3, 2);
    assertThat(generator.build("out.js").getMappings()).isEqualTo("AAAA;;;EAAA");
  }

  @Test
  public void testSeveralSources() {
    map("a.rb", null, 0, 0, 0, 0);
    map("b.rb", null, 0, 0, 0, 2);
    map("a.rb", null, 0, 1, 0, 4);
    SourceMap map = generator.build("out.js");
    assertThat(map.getSources()).containsExactly("a.rb", "b.rb").inOrder();
    assertThat(map.getMappings()).isEqualTo("AAAA,ECAA,EDAC");
  }

  @Test
  public void testSamePositionKeepsFirstMapping() {
    map("a.rb", null, 0, 0, 0, 0);
    map("a.rb", null, 5, 5, 0, 0);
    assertThat(generator.getMappingCount()).isEqualTo(1);
    assertThat(generator.build("out.js").getMappings()).isEqualTo("AAAA");
  }

  @Test
  public void testMappingsMustArriveInOrder() {
    map("a.rb", null, 0, 0, 1, 0);
    assertThrows(IllegalStateException.class, () -> map("a.rb", null, 0, 0, 0, 5));
  }

  @Test
  public void testNegativeSourcePositionIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> map("a.rb", null, -1, 0, 0, 0));
  }

  @Test
  public void testSourceContent() {
    generator.addSourceContent("a.rb", "(int 1)");
    map("a.rb", null, 0, 0, 0, 0);
    SourceMap map = generator.build("out.js");
    assertThat(map.getSources()).containsExactly("a.rb");
    assertThat(map.getSourcesContent()).containsExactly("(int 1)");
  }

  @Test
  public void testSourceContentWithoutMappings() {
    generator.addSourceContent("a.rb", "");
    SourceMap map = generator.build("out.js");
    assertThat(map.getSources()).containsExactly("a.rb");
    assertThat(map.getSourcesContent()).containsExactly("");
    assertThat(map.getMappings()).isEmpty();
  }
}
