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

/**
 * A position in a file. Both line and column start at 0, as in the version 3 source map format.
 */
@AutoValue
public abstract class FilePosition implements Comparable<FilePosition> {

  public static FilePosition create(int line, int column) {
    return new AutoValue_FilePosition(line, column);
  }

  public abstract int getLine();

  /** The character index on the line. */
  public abstract int getColumn();

  @Override
  public final int compareTo(FilePosition other) {
    if (getLine() != other.getLine()) {
      return Integer.compare(getLine(), other.getLine());
    }
    return Integer.compare(getColumn(), other.getColumn());
  }
}
