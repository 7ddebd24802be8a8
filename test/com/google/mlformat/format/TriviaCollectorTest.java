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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.mlformat.syntax.FilePosition;
import com.google.mlformat.syntax.Node;
import com.google.mlformat.syntax.NodeUtil;
import com.google.mlformat.syntax.ParseResult;
import com.google.mlformat.syntax.Parser;
import com.google.mlformat.syntax.SourceRange;
import com.google.mlformat.syntax.Trivia;
import com.google.mlformat.syntax.TriviaKind;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TriviaCollectorTest {

  private static final FormatOptions DEFAULTS = FormatOptions.defaults();

  private ParseResult parsed;

  private ImmutableList<Trivia> collect(String source) {
    return collect(source, DEFAULTS, null);
  }

  private ImmutableList<Trivia> collect(
      String source, FormatOptions options, @Nullable FilePosition cursor) {
    parsed = Parser.parse("test.fs", source);
    return TriviaCollector.collect(parsed, source, options, cursor);
  }

  private static List<TriviaKind> kinds(List<Trivia> trivia) {
    List<TriviaKind> kinds = new ArrayList<>();
    for (Trivia t : trivia) {
      kinds.add(t.getKind());
    }
    return kinds;
  }

  @Test
  public void testLineComments() {
    ImmutableList<Trivia> trivia = collect("let x = 1 // c\n  // own\nlet y = 2");
    assertThat(kinds(trivia))
        .containsExactly(TriviaKind.LINE_COMMENT_TRAILING, TriviaKind.LINE_COMMENT_OWN_LINE)
        .inOrder();
    assertThat(trivia.get(0).getText()).isEqualTo("// c");
    assertThat(trivia.get(1).getRange().getStart()).isEqualTo(new FilePosition(2, 2));
  }

  @Test
  public void testBlockCommentNewlineFlags() {
    ImmutableList<Trivia> trivia = collect("let x = (* a *) 1\n(* b *)\nlet y = 2");
    assertThat(trivia).hasSize(2);
    assertThat(trivia.get(0).hasNewlineBefore()).isFalse();
    assertThat(trivia.get(0).hasNewlineAfter()).isFalse();
    assertThat(trivia.get(1).hasNewlineBefore()).isTrue();
    assertThat(trivia.get(1).hasNewlineAfter()).isTrue();
  }

  @Test
  public void testBlankLines() {
    ImmutableList<Trivia> trivia = collect("\n\nlet a = 1\n\n\nlet b = 2\n\n");
    assertThat(trivia).hasSize(1);
    Trivia blank = trivia.get(0);
    assertThat(blank.getKind()).isEqualTo(TriviaKind.BLANK_LINES);
    assertThat(blank.getBlankLineCount()).isEqualTo(2);
    assertThat(blank.getRange()).isEqualTo(SourceRange.of(4, 0, 5, 0));
  }

  @Test
  public void testWhitespaceOnlyLinesAreBlank() {
    ImmutableList<Trivia> trivia = collect("let a = 1\n   \t\nlet b = 2");
    assertThat(kinds(trivia)).containsExactly(TriviaKind.BLANK_LINES);
  }

  @Test
  public void testBlankLinesAreCapped() {
    String source = "let a = 1\n\n\n\nlet b = 2";
    FormatOptions keepOne = DEFAULTS.toBuilder().setKeepMaxBlankLines(1).build();
    assertThat(collect(source, keepOne, null).get(0).getBlankLineCount()).isEqualTo(1);
    FormatOptions keepNone = DEFAULTS.toBuilder().setKeepMaxBlankLines(0).build();
    assertThat(collect(source, keepNone, null)).isEmpty();
  }

  @Test
  public void testBlankLinesInsideStringsAreNotCollected() {
    assertThat(collect("let s = \"\"\"a\n\nb\"\"\"\nlet t = 1")).isEmpty();
  }

  @Test
  public void testBlankLinesInsideCommentsAreNotCollected() {
    ImmutableList<Trivia> trivia = collect("(* a\n\nb *)\nlet t = 1");
    assertThat(kinds(trivia)).containsExactly(TriviaKind.BLOCK_COMMENT);
  }

  @Test
  public void testDirectives() {
    ImmutableList<Trivia> trivia = collect("#if DEBUG\nlet x = 1\n#endif\n");
    assertThat(kinds(trivia)).containsExactly(TriviaKind.DIRECTIVE, TriviaKind.DIRECTIVE);
    assertThat(trivia.get(0).getText()).isEqualTo("#if DEBUG");
    assertThat(trivia.get(1).getText()).isEqualTo("#endif");
  }

  @Test
  public void testStrictModeDropsEverythingButTheCursor() {
    FormatOptions strict = DEFAULTS.toBuilder().setStrictMode(true).build();
    ImmutableList<Trivia> trivia =
        collect("// c\nlet x = 1\n\nlet y =  2 // d", strict, new FilePosition(4, 7));
    assertThat(kinds(trivia)).containsExactly(TriviaKind.CURSOR);
  }

  @Test
  public void testCursorInsideLiteral() {
    ImmutableList<Trivia> trivia = collect("let x=foo+bar", DEFAULTS, new FilePosition(1, 11));
    assertThat(trivia).isEmpty();
    Node bar = NodeUtil.getLetBody(parsed.getRoot().getOnlyChild()).getLastChild();
    assertThat(bar.getString()).isEqualTo("bar");
    assertThat(bar.getCursorOffset()).isEqualTo(1);
  }

  @Test
  public void testCursorAtEndOfLiteral() {
    collect("let x = abc", DEFAULTS, new FilePosition(1, 11));
    assertThat(NodeUtil.getLetBody(parsed.getRoot().getOnlyChild()).getCursorOffset())
        .isEqualTo(3);
  }

  @Test
  public void testCursorBetweenTokens() {
    ImmutableList<Trivia> trivia = collect("let x =  1", DEFAULTS, new FilePosition(1, 8));
    assertThat(kinds(trivia)).containsExactly(TriviaKind.CURSOR);
    assertThat(trivia.get(0).getRange()).isEqualTo(SourceRange.point(1, 8));
  }

  @Test
  public void testOrderedByPosition() {
    ImmutableList<Trivia> trivia =
        collect("// a\nlet x = 1 (* b *)\n\n#if X\nlet y = 2\n#endif");
    assertThat(kinds(trivia))
        .containsExactly(
            TriviaKind.LINE_COMMENT_OWN_LINE,
            TriviaKind.BLOCK_COMMENT,
            TriviaKind.BLANK_LINES,
            TriviaKind.DIRECTIVE,
            TriviaKind.DIRECTIVE)
        .inOrder();
  }
}
