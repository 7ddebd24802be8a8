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

package com.google.mlformat.syntax;

import com.google.errorprone.annotations.Immutable;

/**
 * Represents a position in a source file.
 *
 * <p>Lines are 1-based and columns are 0-based, the convention used by every range in the tree.
 */
@Immutable
public final class FilePosition implements Comparable<FilePosition> {
  private final int line;
  private final int column;

  public FilePosition(int line, int column) {
    this.line = line;
    this.column = column;
  }

  /** Returns the line number of this position, with the first line being 1. */
  public int getLine() {
    return line;
  }

  /**
   * @return the character index on the line of this position, with the first column being 0.
   */
  public int getColumn() {
    return column;
  }

  @Override
  public int compareTo(FilePosition that) {
    if (line != that.line) {
      return Integer.compare(line, that.line);
    }
    return Integer.compare(column, that.column);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FilePosition)) {
      return false;
    }
    FilePosition that = (FilePosition) o;
    return line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public String toString() {
    return "(" + line + "," + column + ")";
  }
}
