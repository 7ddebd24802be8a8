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
import static com.google.mlformat.format.Docs.newline;
import static com.google.mlformat.format.Docs.text;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Strings;
import com.google.mlformat.format.FormatOptions.EndOfLineStyle;
import com.google.mlformat.syntax.FilePosition;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ContextTest {

  private static final FormatOptions OPTIONS = FormatOptions.builder().setPageWidth(60).build();

  private static Context empty() {
    return Context.create(OPTIONS);
  }

  @Test
  public void testWriteAndNewline() {
    Context ctx = empty().write("let x =").indent().newline().write("1");
    assertThat(ctx.lineNumber()).isEqualTo(2);
    assertThat(ctx.column()).isEqualTo(5);
    assertThat(ctx.dump()).isEqualTo("let x =\n    1\n");
  }

  @Test
  public void testNewlineTrimsTrailingWhitespace() {
    assertThat(empty().write("a  ").newline().write("b").dump()).isEqualTo("a\nb\n");
  }

  @Test
  public void testTrailingBlankLinesAreDropped() {
    assertThat(empty().write("a").newline().newline().newline().dump()).isEqualTo("a\n");
    assertThat(empty().dump()).isEmpty();
  }

  @Test
  public void testSepSpace() {
    assertThat(empty().write("a").sepSpace().sepSpace().write("b").dump()).isEqualTo("a b\n");
    assertThat(empty().sepSpace().write("b").dump()).isEqualTo("b\n");
  }

  @Test
  public void testWriteBeforeNewline() {
    Context ctx = empty().write("x").writeBeforeNewline("// c");
    assertThat(ctx.dump()).isEqualTo("x // c\n");
    assertThat(ctx.newline().write("y").dump()).isEqualTo("x // c\ny\n");
  }

  @Test
  public void testRequireNewline() {
    assertThat(empty().write("a").requireNewline().write("b").dump()).isEqualTo("a\nb\n");
    // An explicit line break satisfies the requirement.
    assertThat(empty().write("a").requireNewline().newline().write("b").dump())
        .isEqualTo("a\nb\n");
    assertThat(empty().write("a").requireNewline().lineHasContent()).isTrue();
  }

  @Test
  public void testIndentNeverGoesBelowAtColumn() {
    Context ctx = empty().write("abc").withIndentation(0, 3);
    Context indented = ctx.indent();
    assertThat(indented.getIndent()).isEqualTo(4);
    assertThat(indented.unindent().getIndent()).isEqualTo(3);
    assertThat(indented.newline().column()).isEqualTo(4);
  }

  @Test
  public void testIndentFromDeepAtColumn() {
    Context ctx = empty().withIndentation(0, 10).indent();
    assertThat(ctx.getIndent()).isEqualTo(14);
  }

  @Test
  public void testProbeDoesNotChangeTheContext() {
    Context ctx = empty().write("abc");
    Context probed = ctx.probe(text("def"));
    assertThat(probed.isProbe()).isTrue();
    assertThat(probed.isFailed()).isFalse();
    assertThat(probed.column()).isEqualTo(6);
    assertThat(ctx.column()).isEqualTo(3);
    assertThat(ctx.dump()).isEqualTo("abc\n");
  }

  @Test
  public void testProbeFailsOnNewline() {
    assertThat(empty().probe(newline()).isFailed()).isTrue();
    assertThat(empty().probe(text("a\nb")).isFailed()).isTrue();
  }

  @Test
  public void testProbeFailsPastPageWidth() {
    assertThat(empty().probe(text(Strings.repeat("x", 60))).isFailed()).isFalse();
    assertThat(empty().probe(text(Strings.repeat("x", 61))).isFailed()).isTrue();
    assertThat(empty().write("a").probe(text(Strings.repeat("x", 60))).isFailed()).isTrue();
  }

  @Test
  public void testProbeFailsAfterPendingTrailingComment() {
    Context ctx = empty().write("x").writeBeforeNewline("// c");
    assertThat(ctx.probe(text("y")).isFailed()).isTrue();
    assertThat(ctx.probe(Docs.empty()).isFailed()).isFalse();
  }

  @Test
  public void testProbeFailsWhenNewlineIsRequired() {
    Context ctx = empty().write("x").requireNewline();
    assertThat(ctx.probe(text("y")).isFailed()).isTrue();
  }

  @Test
  public void testFailedContextIgnoresFurtherOperations() {
    Context failed = empty().probe(newline());
    assertThat(failed.write("abc")).isSameInstanceAs(failed);
    assertThat(failed.indent()).isSameInstanceAs(failed);
    assertThat(failed.probe(text("a"))).isSameInstanceAs(failed);
  }

  @Test
  public void testProbeHasNoOutput() {
    Context probe = empty().probe(text("a"));
    assertThrows(IllegalStateException.class, probe::dump);
  }

  @Test
  public void testProbeOutcomesAreCached() {
    ProbeCache cache = new ProbeCache();
    Context ctx = Context.create(OPTIONS, cache).write("ab");
    Doc doc = text("cde");
    Context first = ctx.probe(doc);
    Context second = ctx.probe(doc);
    assertThat(cache.getMisses()).isEqualTo(1);
    assertThat(cache.getHits()).isEqualTo(1);
    assertThat(second.column()).isEqualTo(first.column());
    assertThat(second.currentLine()).isEqualTo("abcde");
  }

  @Test
  public void testFailedProbesAreCached() {
    ProbeCache cache = new ProbeCache();
    Context ctx = Context.create(OPTIONS, cache);
    Doc doc = Docs.seq(text("a"), newline());
    assertThat(ctx.probe(doc).isFailed()).isTrue();
    assertThat(ctx.probe(doc).isFailed()).isTrue();
    assertThat(cache.getHits()).isEqualTo(1);
  }

  @Test
  public void testCacheKeyIncludesLineState() {
    ProbeCache cache = new ProbeCache();
    Doc doc = text("x");
    Context.create(OPTIONS, cache).write("a").probe(doc);
    Context.create(OPTIONS, cache).write("b").probe(doc);
    assertThat(cache.getHits()).isEqualTo(0);
    assertThat(cache.size()).isEqualTo(2);
  }

  @Test
  public void testRecordCursor() {
    Context ctx = empty().write("let x").newline().write("ab").recordCursor(1);
    assertThat(ctx.getFormattedCursor()).isEqualTo(new FilePosition(2, 3));
  }

  @Test
  public void testProbeDoesNotRecordCursor() {
    Context probe = empty().probe(ctx -> ctx.recordCursor(0));
    assertThat(probe.getFormattedCursor()).isNull();
  }

  @Test
  public void testCrlfOutput() {
    FormatOptions crlf = OPTIONS.toBuilder().setEndOfLine(EndOfLineStyle.CRLF).build();
    Context ctx = Context.create(crlf).write("a").newline().write("b");
    assertThat(ctx.dump()).isEqualTo("a\r\nb\r\n");
  }

  @Test
  public void testNoFinalNewline() {
    FormatOptions options = OPTIONS.toBuilder().setInsertFinalNewline(false).build();
    Context ctx = Context.create(options).write("a").newline().write("b");
    assertThat(ctx.dump()).isEqualTo("a\nb");
  }

  @Test
  public void testMultilineTextIsWrittenVerbatim() {
    Context ctx = empty().indent().write("s =").newline().write("\"\"\"a\n  b\"\"\"");
    assertThat(ctx.dump()).isEqualTo("s =\n    \"\"\"a\n  b\"\"\"\n");
    assertThat(ctx.lineNumber()).isEqualTo(3);
  }
}
