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

import com.google.rb2js.ast.Node;
import com.google.rb2js.ast.SexpReader;
import com.google.rb2js.ast.SexpReader.MalformedSexpException;
import com.google.rb2js.ast.SourceSpan;
import org.jspecify.annotations.Nullable;

/** Parses trees written as s-expressions with {@link SexpReader}. */
public final class SexpParser implements SourceParser {

  @Override
  public Node parse(String source, @Nullable String fileName) {
    try {
      return SexpReader.read(source, fileName);
    } catch (MalformedSexpException e) {
      SourceSpan span =
          SourceSpan.create(fileName, e.getLine(), e.getColumn(), e.getLine(), e.getColumn());
      throw new SyntaxException(e.getMessage(), span, e);
    }
  }
}
