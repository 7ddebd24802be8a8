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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

/**
 * A comment, blank-line run, directive or cursor marker, with the source range it was found at.
 *
 * <p>Trivia is attached to tree nodes as content before or after them and printed around the
 * node's own text.
 */
@Immutable
public final class Trivia {
  private final TriviaKind kind;
  private final SourceRange range;
  private final String text;
  private final int blankLines;
  private final boolean newlineBefore;
  private final boolean newlineAfter;

  private Trivia(
      TriviaKind kind,
      SourceRange range,
      String text,
      int blankLines,
      boolean newlineBefore,
      boolean newlineAfter) {
    this.kind = checkNotNull(kind);
    this.range = checkNotNull(range);
    this.text = checkNotNull(text);
    this.blankLines = blankLines;
    this.newlineBefore = newlineBefore;
    this.newlineAfter = newlineAfter;
  }

  public static Trivia ownLineComment(SourceRange range, String text) {
    return new Trivia(TriviaKind.LINE_COMMENT_OWN_LINE, range, text, 0, false, false);
  }

  public static Trivia trailingComment(SourceRange range, String text) {
    return new Trivia(TriviaKind.LINE_COMMENT_TRAILING, range, text, 0, false, false);
  }

  public static Trivia blockComment(
      SourceRange range, String text, boolean newlineBefore, boolean newlineAfter) {
    return new Trivia(TriviaKind.BLOCK_COMMENT, range, text, 0, newlineBefore, newlineAfter);
  }

  public static Trivia blankLines(SourceRange range, int count) {
    checkArgument(count > 0, "A blank line run must not be empty");
    return new Trivia(TriviaKind.BLANK_LINES, range, "", count, false, false);
  }

  public static Trivia directive(SourceRange range, String text) {
    return new Trivia(TriviaKind.DIRECTIVE, range, text, 0, false, false);
  }

  public static Trivia cursor(FilePosition position) {
    return new Trivia(
        TriviaKind.CURSOR,
        SourceRange.point(position.getLine(), position.getColumn()),
        "",
        0,
        false,
        false);
  }

  public TriviaKind getKind() {
    return kind;
  }

  public SourceRange getRange() {
    return range;
  }

  /** The comment or directive text, empty for blank lines and cursors. */
  public String getText() {
    return text;
  }

  public int getBlankLineCount() {
    return blankLines;
  }

  /** For block comments: whether only whitespace precedes the comment on its first line. */
  public boolean hasNewlineBefore() {
    return newlineBefore;
  }

  /** For block comments: whether only whitespace follows the comment on its last line. */
  public boolean hasNewlineAfter() {
    return newlineAfter;
  }

  public boolean isComment() {
    return kind.isComment();
  }

  @Override
  public String toString() {
    switch (kind) {
      case BLANK_LINES:
        return kind + "(" + blankLines + ")" + range;
      case CURSOR:
        return kind + range.toString();
      default:
        return kind + "(" + text + ")" + range;
    }
  }
}
