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

import com.google.auto.value.AutoValue;
import org.jspecify.annotations.Nullable;

/** Where a generated position came from. Line and column are 1-based. */
@AutoValue
public abstract class OriginalMapping {

  static OriginalMapping create(
      String originalFile, int lineNumber, int columnPosition, @Nullable String identifier) {
    return new AutoValue_OriginalMapping(originalFile, lineNumber, columnPosition, identifier);
  }

  public abstract String getOriginalFile();

  public abstract int getLineNumber();

  public abstract int getColumnPosition();

  public abstract @Nullable String getIdentifier();
}
