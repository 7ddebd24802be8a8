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
import com.google.mlformat.syntax.IR;
import com.google.mlformat.syntax.Node;
import com.google.mlformat.syntax.NodeUtil;
import com.google.mlformat.syntax.ParseResult;
import com.google.mlformat.syntax.Parser;
import com.google.mlformat.syntax.SourceRange;
import com.google.mlformat.syntax.Trivia;
import com.google.mlformat.syntax.TriviaKind;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TriviaAttacherTest {

  private final TriviaAttacher attacher = new TriviaAttacher("test.fs");

  /** Parses {@code source}, attaches its trivia and returns the root. */
  private Node parseAndAttach(String source) {
    return parseAndAttach(source, null);
  }

  private Node parseAndAttach(String source, @Nullable FilePosition cursor) {
    ParseResult parsed = Parser.parse("test.fs", source);
    ImmutableList<Trivia> trivia =
        TriviaCollector.collect(parsed, source, FormatOptions.defaults(), cursor);
    assertThat(attacher.attach(parsed.getRoot(), trivia)).isEmpty();
    return parsed.getRoot();
  }

  private static TriviaKind onlyKind(List<Trivia> trivia) {
    assertThat(trivia).hasSize(1);
    return trivia.get(0).getKind();
  }

  @Test
  public void testTrailingCommentFollowsLastNodeOnLine() {
    Node root = parseAndAttach("let x = f a // c");
    Node app = NodeUtil.getLetBody(root.getOnlyChild());
    Node a = app.getLastChild();
    assertThat(onlyKind(a.getContentAfter())).isEqualTo(TriviaKind.LINE_COMMENT_TRAILING);
    assertThat(app.hasContentAfter()).isFalse();
    assertThat(root.getOnlyChild().hasContentAfter()).isFalse();
  }

  @Test
  public void testTrailingCommentInsideBlock() {
    Node root = parseAndAttach("let f x =\n    let y = x // c\n    y");
    Node sequential = NodeUtil.getLetBody(root.getOnlyChild());
    Node innerLet = sequential.getFirstChild();
    assertThat(onlyKind(NodeUtil.getLetBody(innerLet).getContentAfter()))
        .isEqualTo(TriviaKind.LINE_COMMENT_TRAILING);
  }

  @Test
  public void testOwnLineCommentPrecedesNextDeclaration() {
    Node root = parseAndAttach("let x = 1\n// c\nlet y = 2");
    assertThat(onlyKind(root.getLastChild().getContentBefore()))
        .isEqualTo(TriviaKind.LINE_COMMENT_OWN_LINE);
    assertThat(root.getFirstChild().hasContentAfter()).isFalse();
  }

  @Test
  public void testCommentAtEndOfFileFollowsLastDeclaration() {
    Node root = parseAndAttach("let x = 1\n// end");
    assertThat(onlyKind(root.getOnlyChild().getContentAfter()))
        .isEqualTo(TriviaKind.LINE_COMMENT_OWN_LINE);
  }

  @Test
  public void testCommentInsideBody() {
    Node root = parseAndAttach("let f x =\n    // inside\n    x + 1");
    Node body = NodeUtil.getLetBody(root.getOnlyChild());
    assertThat(body.isInfix()).isTrue();
    assertThat(onlyKind(body.getContentBefore())).isEqualTo(TriviaKind.LINE_COMMENT_OWN_LINE);
  }

  @Test
  public void testBlockCommentFollowsNodeOnSameLine() {
    Node root = parseAndAttach("let x = f (* c *) y");
    Node app = NodeUtil.getLetBody(root.getOnlyChild());
    assertThat(onlyKind(app.getFirstChild().getContentAfter()))
        .isEqualTo(TriviaKind.BLOCK_COMMENT);
    assertThat(app.getLastChild().hasContentBefore()).isFalse();
  }

  @Test
  public void testBlockCommentOnOwnLinePrecedesNextNode() {
    Node root = parseAndAttach("let x = 1\n(* c *)\nlet y = 2");
    assertThat(onlyKind(root.getLastChild().getContentBefore()))
        .isEqualTo(TriviaKind.BLOCK_COMMENT);
  }

  @Test
  public void testBlankLinesPrecedeNextDeclaration() {
    Node root = parseAndAttach("let x = 1\n\n\nlet y = 2");
    Trivia blank = root.getLastChild().getContentBefore().get(0);
    assertThat(blank.getKind()).isEqualTo(TriviaKind.BLANK_LINES);
    assertThat(blank.getBlankLineCount()).isEqualTo(2);
  }

  @Test
  public void testCommentInEmptyFile() {
    Node root = parseAndAttach("// only");
    assertThat(onlyKind(root.getContentBefore())).isEqualTo(TriviaKind.LINE_COMMENT_OWN_LINE);
  }

  @Test
  public void testCursorPrecedesNextNode() {
    Node root = parseAndAttach("let x =  1", new FilePosition(1, 8));
    Node body = NodeUtil.getLetBody(root.getOnlyChild());
    assertThat(onlyKind(body.getContentBefore())).isEqualTo(TriviaKind.CURSOR);
  }

  @Test
  public void testTriviaOutsideRootRange() {
    Node let =
        IR.let(
            SourceRange.of(2, 0, 2, 9),
            false,
            IR.name(SourceRange.of(2, 4, 2, 5), "x"),
            ImmutableList.of(),
            null,
            IR.number(SourceRange.of(2, 8, 2, 9), "1"));
    Node root = IR.file(SourceRange.of(2, 0, 2, 9), ImmutableList.of(let));
    Trivia header = Trivia.ownLineComment(SourceRange.of(1, 0, 1, 4), "// a");
    Trivia footer = Trivia.ownLineComment(SourceRange.of(3, 0, 3, 4), "// b");
    assertThat(attacher.attach(root, ImmutableList.of(header, footer))).isEmpty();
    assertThat(let.getContentBefore()).containsExactly(header);
    assertThat(let.getContentAfter()).containsExactly(footer);
  }

  @Test
  public void testNodeWithChildOutsideItsRangeIsOpaque() {
    Node f = IR.name(SourceRange.of(2, 8, 2, 9), "f");
    // Claims a line well past the end of its parent.
    Node y = IR.name(SourceRange.of(9, 0, 9, 1), "y");
    Node app = IR.app(SourceRange.of(2, 8, 4, 1), f, ImmutableList.of(y));
    Node root = IR.file(SourceRange.of(1, 0, 10, 0), ImmutableList.of(app));
    Trivia comment = Trivia.ownLineComment(SourceRange.of(3, 0, 3, 4), "// c");

    assertThat(attacher.attach(root, ImmutableList.of(comment))).isEmpty();

    assertThat(app.getContentAfter()).containsExactly(comment);
    assertThat(app.hasContentBefore()).isFalse();
    assertThat(f.hasContentBefore()).isFalse();
    assertThat(f.hasContentAfter()).isFalse();
    assertThat(y.hasContentBefore()).isFalse();
    assertThat(y.hasContentAfter()).isFalse();
  }

  @Test
  public void testOpaqueNodeTakesTrailingComment() {
    Node f = IR.name(SourceRange.of(1, 0, 1, 1), "f");
    Node y = IR.name(SourceRange.of(5, 0, 5, 1), "y");
    Node app = IR.app(SourceRange.of(1, 0, 1, 3), f, ImmutableList.of(y));
    Node root = IR.file(SourceRange.of(1, 0, 6, 0), ImmutableList.of(app));
    Trivia comment = Trivia.trailingComment(SourceRange.of(1, 2, 1, 3), "//");

    assertThat(attacher.attach(root, ImmutableList.of(comment))).isEmpty();

    assertThat(app.getContentAfter()).containsExactly(comment);
    assertThat(f.hasContentAfter()).isFalse();
  }

  @Test
  public void testTriviaInsideParseErrorIsDropped() {
    Node error = IR.fromParseError(SourceRange.of(1, 0, 2, 10));
    Node root = IR.file(SourceRange.of(1, 0, 3, 0), ImmutableList.of(error));
    Trivia comment = Trivia.ownLineComment(SourceRange.of(2, 0, 2, 4), "// x");

    ImmutableList<FormatError> warnings = attacher.attach(root, ImmutableList.of(comment));

    assertThat(warnings).hasSize(1);
    FormatError warning = warnings.get(0);
    assertThat(warning.type()).isEqualTo(TriviaAttacher.MLF_TRIVIA_DROPPED);
    assertThat(warning.isError()).isFalse();
    assertThat(warning.lineno()).isEqualTo(2);
    assertThat(warning.description())
        .isEqualTo("LINE_COMMENT_OWN_LINE at line 2 has no node to attach to and was left out");
    assertThat(error.hasContentBefore()).isFalse();
    assertThat(error.hasContentAfter()).isFalse();
  }
}
