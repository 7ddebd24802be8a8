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

package com.google.mlformat.format;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.mlformat.syntax.FilePosition;
import com.google.mlformat.syntax.SourceRange;

/** The lines of a source file, addressed by 1-based line number. */
final class SourceText {
  private final ImmutableList<String> lines;

  SourceText(String normalizedSource) {
    this.lines = ImmutableList.copyOf(Splitter.on('\n').split(normalizedSource));
  }

  int lineCount() {
    return lines.size();
  }

  String line(int line) {
    checkArgument(line >= 1 && line <= lines.size(), "No line %s", line);
    return lines.get(line - 1);
  }

  /** Returns the text within {@code range}, lines joined with {@code \n}. */
  String text(SourceRange range) {
    StringBuilder sb = new StringBuilder();
    for (int i = range.getStartLine(); i <= range.getEndLine(); i++) {
      String text = line(i);
      int start = i == range.getStartLine() ? Math.min(range.getStartColumn(), text.length()) : 0;
      int end =
          i == range.getEndLine() ? Math.min(range.getEndColumn(), text.length()) : text.length();
      if (i > range.getStartLine()) {
        sb.append('\n');
      }
      sb.append(text, start, Math.max(start, end));
    }
    return sb.toString();
  }

  boolean isBlank(int line) {
    return CharMatcher.whitespace().matchesAllOf(line(line));
  }

  /** Whether only whitespace precedes {@code position} on its line. */
  boolean isBlankBefore(FilePosition position) {
    String text = line(position.getLine());
    int end = Math.min(position.getColumn(), text.length());
    return CharMatcher.whitespace().matchesAllOf(text.substring(0, end));
  }

  /** Whether only whitespace follows {@code position} on its line. */
  boolean isBlankAfter(FilePosition position) {
    String text = line(position.getLine());
    int start = Math.min(position.getColumn(), text.length());
    return CharMatcher.whitespace().matchesAllOf(text.substring(start));
  }
}
