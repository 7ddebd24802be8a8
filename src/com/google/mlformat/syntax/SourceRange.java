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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.Immutable;

/**
 * A half-open region of source text, from a start position up to (but excluding) an end position.
 */
@Immutable
public final class SourceRange {
  private final FilePosition start;
  private final FilePosition end;

  private SourceRange(FilePosition start, FilePosition end) {
    checkArgument(start.compareTo(end) <= 0, "Range start %s is after its end %s", start, end);
    this.start = start;
    this.end = end;
  }

  public static SourceRange of(FilePosition start, FilePosition end) {
    return new SourceRange(start, end);
  }

  public static SourceRange of(int startLine, int startColumn, int endLine, int endColumn) {
    return new SourceRange(
        new FilePosition(startLine, startColumn), new FilePosition(endLine, endColumn));
  }

  /** Creates a zero-width range, used for cursors and blank lines. */
  public static SourceRange point(int line, int column) {
    FilePosition p = new FilePosition(line, column);
    return new SourceRange(p, p);
  }

  /** Returns the smallest range covering both {@code first} and {@code last}. */
  public static SourceRange span(SourceRange first, SourceRange last) {
    FilePosition start = first.start.compareTo(last.start) <= 0 ? first.start : last.start;
    FilePosition end = first.end.compareTo(last.end) >= 0 ? first.end : last.end;
    return new SourceRange(start, end);
  }

  public FilePosition getStart() {
    return start;
  }

  public FilePosition getEnd() {
    return end;
  }

  public int getStartLine() {
    return start.getLine();
  }

  public int getStartColumn() {
    return start.getColumn();
  }

  public int getEndLine() {
    return end.getLine();
  }

  public int getEndColumn() {
    return end.getColumn();
  }

  public boolean isSingleLine() {
    return start.getLine() == end.getLine();
  }

  /** Whether {@code other} lies entirely within this range. */
  public boolean contains(SourceRange other) {
    return start.compareTo(other.start) <= 0 && other.end.compareTo(end) <= 0;
  }

  /** Whether this range and {@code other} share at least one character. */
  public boolean overlaps(SourceRange other) {
    return start.compareTo(other.end) < 0 && other.start.compareTo(end) < 0;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SourceRange)) {
      return false;
    }
    SourceRange that = (SourceRange) o;
    return start.equals(that.start) && end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return 31 * start.hashCode() + end.hashCode();
  }

  @Override
  public String toString() {
    return "[" + start.getLine() + "," + start.getColumn() + "-" + end.getLine() + ","
        + end.getColumn() + ")";
  }
}
