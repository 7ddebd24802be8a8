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

import com.google.common.collect.ImmutableList;
import com.google.mlformat.syntax.CommentRange;
import com.google.mlformat.syntax.DirectiveRange;
import com.google.mlformat.syntax.FilePosition;
import com.google.mlformat.syntax.Node;
import com.google.mlformat.syntax.ParseResult;
import com.google.mlformat.syntax.SourceRange;
import com.google.mlformat.syntax.Token;
import com.google.mlformat.syntax.Trivia;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Gathers the comments, blank-line runs, directives and the cursor of a parsed file into a list
 * of {@link Trivia}, ordered by position.
 *
 * <p>Blank lines inside multi-line strings and block comments belong to those tokens and are not
 * collected. Leading and trailing blank lines of the file are dropped, and every run is capped at
 * {@link FormatOptions#keepMaxBlankLines()}.
 *
 * <p>A cursor inside a single-line literal is recorded on that literal as an offset instead.
 */
public final class TriviaCollector {
  private static final Comparator<Trivia> BY_POSITION =
      Comparator.comparing((Trivia t) -> t.getRange().getStart());

  private final ParseResult parseResult;
  private final SourceText text;
  private final FormatOptions options;

  private TriviaCollector(ParseResult parseResult, SourceText text, FormatOptions options) {
    this.parseResult = parseResult;
    this.text = text;
    this.options = options;
  }

  /**
   * Collects the trivia of {@code parseResult}. In strict mode only the cursor is collected.
   *
   * @param normalizedSource the source the tree was parsed from, with {@code \n} line breaks
   */
  public static ImmutableList<Trivia> collect(
      ParseResult parseResult,
      String normalizedSource,
      FormatOptions options,
      @Nullable FilePosition cursor) {
    TriviaCollector collector =
        new TriviaCollector(parseResult, new SourceText(normalizedSource), options);
    List<Trivia> trivia = new ArrayList<>();
    if (!options.strictMode()) {
      collector.collectComments(trivia);
      collector.collectBlankLines(trivia);
      collector.collectDirectives(trivia);
    }
    if (cursor != null) {
      collector.collectCursor(cursor, trivia);
    }
    trivia.sort(BY_POSITION);
    return ImmutableList.copyOf(trivia);
  }

  private void collectComments(List<Trivia> out) {
    for (CommentRange comment : parseResult.getComments()) {
      SourceRange range = comment.getRange();
      if (comment.isBlock()) {
        out.add(
            Trivia.blockComment(
                range,
                comment.getText(),
                text.isBlankBefore(range.getStart()),
                text.isBlankAfter(range.getEnd())));
      } else if (text.isBlankBefore(range.getStart())) {
        out.add(Trivia.ownLineComment(range, comment.getText()));
      } else {
        out.add(Trivia.trailingComment(range, comment.getText()));
      }
    }
  }

  private void collectBlankLines(List<Trivia> out) {
    BitSet insideToken = new BitSet();
    for (CommentRange comment : parseResult.getComments()) {
      markContinuationLines(comment.getRange(), insideToken);
    }
    markMultilineStrings(parseResult.getRoot(), insideToken);

    int first = 1;
    while (first <= text.lineCount() && text.isBlank(first)) {
      first++;
    }
    int last = text.lineCount();
    while (last > first && text.isBlank(last)) {
      last--;
    }
    int max = options.keepMaxBlankLines();
    int runStart = -1;
    for (int line = first; line <= last + 1; line++) {
      boolean blank = line <= last && text.isBlank(line) && !insideToken.get(line);
      if (blank && runStart < 0) {
        runStart = line;
      } else if (!blank && runStart >= 0) {
        int count = Math.min(line - runStart, max);
        if (count > 0) {
          out.add(Trivia.blankLines(SourceRange.of(runStart, 0, line - 1, 0), count));
        }
        runStart = -1;
      }
    }
  }

  private static void markContinuationLines(SourceRange range, BitSet lines) {
    if (!range.isSingleLine()) {
      lines.set(range.getStartLine() + 1, range.getEndLine() + 1);
    }
  }

  private static void markMultilineStrings(Node n, BitSet lines) {
    if (n.getToken() == Token.STRING) {
      markContinuationLines(n.getRange(), lines);
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      markMultilineStrings(c, lines);
    }
  }

  private void collectDirectives(List<Trivia> out) {
    SourceRange rootRange = parseResult.getRoot().getRange();
    for (DirectiveRange directive : parseResult.getDirectives()) {
      if (rootRange.contains(directive.getRange())) {
        out.add(Trivia.directive(directive.getRange(), directive.getText()));
      }
    }
  }

  private void collectCursor(FilePosition cursor, List<Trivia> out) {
    Node literal = findLiteralAt(parseResult.getRoot(), SourceRange.of(cursor, cursor));
    if (literal == null) {
      out.add(Trivia.cursor(cursor));
      return;
    }
    int offset = cursor.getColumn() - literal.getRange().getStartColumn();
    int length = literal.isUnit() ? 2 : literal.getString().length();
    literal.setCursorOffset(Math.min(offset, length));
  }

  private static @Nullable Node findLiteralAt(Node n, SourceRange point) {
    if (!n.getRange().contains(point)) {
      return null;
    }
    if ((n.getToken().isLiteral() || n.isUnit()) && n.getRange().isSingleLine()) {
      return n;
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      Node found = findLiteralAt(c, point);
      if (found != null) {
        return found;
      }
    }
    return null;
  }
}
