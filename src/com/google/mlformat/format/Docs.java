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
import java.util.List;

/** Combinators for building {@link Doc}s. */
public final class Docs {

  private Docs() {}

  private static final Doc EMPTY = ctx -> ctx;
  private static final Doc NEWLINE = Context::newline;
  private static final Doc SEP_SPACE = Context::sepSpace;
  private static final Doc INDENT = Context::indent;
  private static final Doc UNINDENT = Context::unindent;
  private static final Doc NEWLINE_IF_LINE_HAS_CONTENT =
      ctx -> ctx.lineHasContent() ? ctx.newline() : ctx;

  public static Doc empty() {
    return EMPTY;
  }

  public static Doc text(String text) {
    return ctx -> ctx.write(text);
  }

  public static Doc newline() {
    return NEWLINE;
  }

  public static Doc sepSpace() {
    return SEP_SPACE;
  }

  public static Doc indent() {
    return INDENT;
  }

  public static Doc unindent() {
    return UNINDENT;
  }

  /** Starts a new line unless the current one holds nothing but indentation. */
  public static Doc newlineIfLineHasContent() {
    return NEWLINE_IF_LINE_HAS_CONTENT;
  }

  public static Doc writeBeforeNewline(String text) {
    return ctx -> ctx.writeBeforeNewline(text);
  }

  public static Doc seq(Doc... docs) {
    return seq(ImmutableList.copyOf(docs));
  }

  public static Doc seq(List<Doc> docs) {
    ImmutableList<Doc> copy = ImmutableList.copyOf(docs);
    if (copy.size() == 1) {
      return copy.get(0);
    }
    return ctx -> {
      for (Doc doc : copy) {
        if (ctx.isFailed()) {
          return ctx;
        }
        ctx = doc.apply(ctx);
      }
      return ctx;
    };
  }

  /** Lays out {@code docs} with {@code separator} between each pair. */
  public static Doc join(Doc separator, List<Doc> docs) {
    ImmutableList.Builder<Doc> parts = ImmutableList.builder();
    for (int i = 0; i < docs.size(); i++) {
      if (i > 0) {
        parts.add(separator);
      }
      parts.add(docs.get(i));
    }
    return seq(parts.build());
  }

  public static Doc when(boolean condition, Doc doc) {
    return condition ? doc : EMPTY;
  }

  public static Doc ifElse(boolean condition, Doc then, Doc otherwise) {
    return condition ? then : otherwise;
  }

  /** {@code doc} one indent level deeper. The indent is restored afterwards. */
  public static Doc indented(Doc doc) {
    return seq(INDENT, doc, UNINDENT);
  }

  /** {@code doc} on new lines one indent level deeper. */
  public static Doc indentedOnNewline(Doc doc) {
    return seq(INDENT, NEWLINE, doc, UNINDENT);
  }

  /**
   * Lays out {@code doc} so that its new lines start no further left than the current column.
   * The previous indentation is restored afterwards.
   */
  public static Doc atCurrentColumn(Doc doc) {
    return ctx -> {
      Context after = doc.apply(ctx.withIndentation(ctx.getIndent(), ctx.column()));
      return after.withIndentation(ctx.getIndent(), ctx.getAtColumn());
    };
  }

  /** Like {@link #atCurrentColumn}, and also makes the current column the base for indenting. */
  public static Doc atCurrentColumnIndent(Doc doc) {
    return ctx -> {
      Context after = doc.apply(ctx.withIndentation(ctx.column(), ctx.column()));
      return after.withIndentation(ctx.getIndent(), ctx.getAtColumn());
    };
  }

  /**
   * Lays out {@code shortDoc} if it fits on the rest of the current line without a line break,
   * otherwise {@code longDoc}.
   *
   * <p>Inside a probe, only the short form is tried: if it fails, so does the probe.
   */
  public static Doc fitsOnRestOfLine(Doc shortDoc, Doc longDoc) {
    return ctx -> {
      if (ctx.isProbe()) {
        return ctx.probe(shortDoc);
      }
      return ctx.probe(shortDoc).isFailed() ? longDoc.apply(ctx) : shortDoc.apply(ctx);
    };
  }

  /**
   * Like {@link #fitsOnRestOfLine}, but the short form must also be at most {@code maxWidth}
   * columns wide. Ties favor the short form.
   */
  public static Doc isShortExpression(int maxWidth, Doc shortDoc, Doc longDoc) {
    return ctx -> {
      Context measured = ctx.probe(shortDoc);
      boolean fits = !measured.isFailed() && measured.column() - ctx.column() <= maxWidth;
      if (ctx.isProbe()) {
        return fits || measured.isFailed() ? measured : measured.fail();
      }
      return fits ? shortDoc.apply(ctx) : longDoc.apply(ctx);
    };
  }

  /**
   * Lays out {@code doc} after a space if it fits within {@code maxWidth} on the rest of the
   * line, otherwise on an indented new line.
   */
  public static Doc sepSpaceOrIndentAndNewlineIfExceeds(int maxWidth, Doc doc) {
    return isShortExpression(maxWidth, seq(SEP_SPACE, doc), indentedOnNewline(doc));
  }
}
