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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CheckReturnValue;
import com.google.mlformat.format.ProbeCache.Outcome;
import com.google.mlformat.syntax.FilePosition;
import org.jspecify.annotations.Nullable;

/**
 * The state threaded through printing: the output written so far, the options, and the probe
 * cache of the current format call.
 *
 * <p>Contexts are immutable. A probe context is a copy used only to measure whether a document
 * fits on the rest of the current line. It fails as soon as the document starts a new line or
 * writes past the page width, and every operation on a failed context is a no-op.
 */
@CheckReturnValue
public final class Context {
  private final FormatOptions options;
  private final WriterModel model;
  private final ProbeCache cache;
  private final boolean probe;
  private final boolean failed;
  private final @Nullable FilePosition cursor;

  private Context(
      FormatOptions options,
      WriterModel model,
      ProbeCache cache,
      boolean probe,
      boolean failed,
      @Nullable FilePosition cursor) {
    this.options = options;
    this.model = model;
    this.cache = cache;
    this.probe = probe;
    this.failed = failed;
    this.cursor = cursor;
  }

  /** Creates an empty context with a fresh probe cache. */
  public static Context create(FormatOptions options) {
    return create(options, new ProbeCache());
  }

  static Context create(FormatOptions options, ProbeCache cache) {
    return new Context(
        checkNotNull(options), WriterModel.empty(), checkNotNull(cache), false, false, null);
  }

  public FormatOptions getOptions() {
    return options;
  }

  /** Whether this context only measures and its output is thrown away. */
  public boolean isProbe() {
    return probe;
  }

  /** Whether this probe has already started a new line or run past the page width. */
  public boolean isFailed() {
    return failed;
  }

  public int column() {
    return model.column();
  }

  /** The 1-based number of the line being written. */
  public int lineNumber() {
    return model.lineNumber();
  }

  /** Whether the current line holds anything but indentation. */
  public boolean lineHasContent() {
    return model.lineHasContent();
  }

  public String currentLine() {
    return model.currentLine();
  }

  public int getIndent() {
    return model.indent();
  }

  public int getAtColumn() {
    return model.atColumn();
  }

  /** The position the cursor was moved to, or null if no cursor was printed. */
  public @Nullable FilePosition getFormattedCursor() {
    return cursor;
  }

  ProbeCache getCache() {
    return cache;
  }

  WriterModel getModel() {
    return model;
  }

  /** Appends {@code text} to the current line. */
  public Context write(String text) {
    if (failed || text.isEmpty()) {
      return this;
    }
    Context ctx = model.isNewlinePending() ? newline() : this;
    if (ctx.failed) {
      return ctx;
    }
    if (probe) {
      // Text after a deferred trailing comment would push the comment away from its code.
      if (!ctx.model.writeBeforeNewline().isEmpty() || text.indexOf('\n') >= 0) {
        return ctx.fail();
      }
      WriterModel written = ctx.model.write(text);
      return written.column() > options.pageWidth() ? ctx.fail() : ctx.withModel(written);
    }
    return ctx.withModel(ctx.model.write(text));
  }

  /** Writes a space unless the line is empty or already ends with one. */
  public Context sepSpace() {
    if (failed || model.isNewlinePending()) {
      return this;
    }
    String line = model.currentLine();
    if (line.isEmpty() || line.endsWith(" ")) {
      return this;
    }
    return write(" ");
  }

  /** Starts a new line, indented to {@code max(indent, atColumn)}. */
  public Context newline() {
    if (failed) {
      return this;
    }
    if (probe) {
      return fail();
    }
    return withModel(model.newline());
  }

  /** Makes the next write start on a new line, unless a line break comes first anyway. */
  public Context requireNewline() {
    if (failed) {
      return this;
    }
    return withModel(model.requireNewline());
  }

  /** Defers {@code text}, typically a trailing comment, until just before the next line break. */
  public Context writeBeforeNewline(String text) {
    if (failed) {
      return this;
    }
    return withModel(model.addWriteBeforeNewline(text));
  }

  public Context indent() {
    return failed ? this : withModel(model.indentBy(options.indentSize()));
  }

  public Context unindent() {
    return failed ? this : withModel(model.unindentBy(options.indentSize()));
  }

  Context withIndentation(int indent, int atColumn) {
    return failed ? this : withModel(model.withIndentation(indent, atColumn));
  }

  /** Records the cursor at {@code offset} characters past the current column. */
  public Context recordCursor(int offset) {
    if (failed || probe) {
      return this;
    }
    Context ctx = model.isNewlinePending() ? newline() : this;
    return new Context(
        options,
        ctx.model,
        cache,
        false,
        false,
        new FilePosition(ctx.lineNumber(), ctx.column() + offset));
  }

  /**
   * Lays out {@code doc} on the rest of the current line, reusing a previous result for the same
   * document and line state when there is one.
   *
   * <p>On a probe context, returns the context after the document. On a real context, nothing is
   * committed; the returned context is a probe context, failed if the document does not fit.
   */
  Context probe(Doc doc) {
    if (failed) {
      return this;
    }
    Context start = probe ? this : new Context(options, model, cache, true, false, null);
    WriterModel.LineState before = model.lineState();
    Outcome outcome = cache.lookup(doc, before);
    if (outcome != null) {
      return outcome.fits() ? start.withModel(model.withLineState(outcome.after())) : start.fail();
    }
    Context after = doc.apply(start);
    checkState(after.probe, "A document escaped its probe");
    cache.store(
        doc, before, after.failed ? ProbeCache.DOES_NOT_FIT : new Outcome(after.model.lineState()));
    return after;
  }

  /** Marks this probe as failed. */
  Context fail() {
    checkState(probe, "Only probes can fail");
    return failed ? this : new Context(options, model, cache, true, true, null);
  }

  private Context withModel(WriterModel newModel) {
    return new Context(options, newModel, cache, probe, failed, cursor);
  }

  /**
   * Returns the formatted text.
   *
   * @throws IllegalStateException if called on a probe
   */
  public String dump() {
    checkState(!probe, "Probes have no output");
    return model.dump(options.endOfLine().lineSeparator(), options.insertFinalNewline());
  }

  @Override
  public String toString() {
    return "Context(line="
        + lineNumber()
        + ", column="
        + column()
        + ", indent="
        + getIndent()
        + ", atColumn="
        + getAtColumn()
        + (probe ? ", probe" : "")
        + (failed ? ", failed" : "")
        + ")";
  }
}
