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

/** The kinds of source text that the tree itself does not carry. */
public enum TriviaKind {
  /** A line comment with nothing but whitespace before it on its line. */
  LINE_COMMENT_OWN_LINE,
  /** A line comment that follows code on the same line. */
  LINE_COMMENT_TRAILING,
  BLOCK_COMMENT,
  BLANK_LINES,
  DIRECTIVE,
  CURSOR;

  public boolean isComment() {
    return this == LINE_COMMENT_OWN_LINE || this == LINE_COMMENT_TRAILING || this == BLOCK_COMMENT;
  }
}
