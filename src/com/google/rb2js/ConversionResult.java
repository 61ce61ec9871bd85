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

import com.google.auto.value.AutoValue;
import com.google.rb2js.ast.Node;
import com.google.rb2js.sourcemap.SourceMap;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** What a conversion produces. */
@AutoValue
public abstract class ConversionResult {

  static ConversionResult create(
      String text, Node ast, @Nullable SourceMap sourceMap, Optional<String> template) {
    return new AutoValue_ConversionResult(text, ast, sourceMap, template);
  }

  /** The generated JavaScript. */
  public abstract String getText();

  /** The tree after every filter ran; what the code generator consumed. */
  public abstract Node getAst();

  /** Null unless a file name was given or a source map was requested. */
  public abstract @Nullable SourceMap getSourceMap();

  /** The text following the template marker line, when the source had one. */
  public abstract Optional<String> getTemplate();

  @Override
  public final String toString() {
    return getText();
  }
}
