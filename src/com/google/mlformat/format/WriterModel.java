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
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.errorprone.annotations.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The text written so far plus the indentation state. Instances are immutable: every operation
 * returns a new model that shares all completed lines with the old one.
 */
@Immutable
final class WriterModel {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  /** A line of output. Lines are linked most recent first. */
  @Immutable
  private static final class Line {
    final String text;
    final @Nullable Line previous;
    // 1-based
    final int number;

    Line(String text, @Nullable Line previous) {
      this.text = text;
      this.previous = previous;
      this.number = previous == null ? 1 : previous.number + 1;
    }

    Line withText(String newText) {
      return new Line(newText, previous);
    }
  }

  /**
   * Everything about a model that can change without starting a new line: the text of the
   * current line and the indentation state. Two models with equal states lay out any document
   * identically as long as no new line is started.
   */
  record LineState(
      String currentLine,
      int indent,
      int atColumn,
      String writeBeforeNewline,
      boolean newlinePending) {}

  private static final WriterModel EMPTY = new WriterModel(new Line("", null), 0, 0, "", false);

  private final Line current;
  private final int indent;
  private final int atColumn;
  private final String writeBeforeNewline;
  private final boolean newlinePending;

  private WriterModel(
      Line current,
      int indent,
      int atColumn,
      String writeBeforeNewline,
      boolean newlinePending) {
    this.current = current;
    this.indent = indent;
    this.atColumn = atColumn;
    this.writeBeforeNewline = writeBeforeNewline;
    this.newlinePending = newlinePending;
  }

  static WriterModel empty() {
    return EMPTY;
  }

  /** The column the next write goes to, which is the length of the current line. */
  int column() {
    return current.text.length();
  }

  /** The 1-based number of the current line. */
  int lineNumber() {
    return current.number;
  }

  String currentLine() {
    return current.text;
  }

  boolean lineHasContent() {
    return !CharMatcher.whitespace().matchesAllOf(current.text) || newlinePending;
  }

  int indent() {
    return indent;
  }

  int atColumn() {
    return atColumn;
  }

  String writeBeforeNewline() {
    return writeBeforeNewline;
  }

  boolean isNewlinePending() {
    return newlinePending;
  }

  /**
   * Appends {@code text} to the current line. Text spanning several lines (multiline strings and
   * comments) is written verbatim: its continuation lines get no indentation.
   */
  WriterModel write(String text) {
    if (text.isEmpty()) {
      return this;
    }
    List<String> parts = LINE_SPLITTER.splitToList(text);
    Line line = current.withText(current.text + parts.get(0));
    for (int i = 1; i < parts.size(); i++) {
      line = new Line(parts.get(i), line);
    }
    return new WriterModel(line, indent, atColumn, writeBeforeNewline, newlinePending);
  }

  /**
   * Closes the current line, first appending any text deferred until the end of the line, and
   * opens a new line indented to {@code max(indent, atColumn)}.
   */
  WriterModel newline() {
    String closed = current.text;
    if (!writeBeforeNewline.isEmpty()) {
      if (!closed.isEmpty() && !closed.endsWith(" ")) {
        closed += " ";
      }
      closed += writeBeforeNewline;
    }
    Line closedLine = current.withText(CharMatcher.whitespace().trimTrailingFrom(closed));
    Line next = new Line(Strings.repeat(" ", Math.max(indent, atColumn)), closedLine);
    return new WriterModel(next, indent, atColumn, "", false);
  }

  /** Increases the indent by {@code size}, starting from the alignment column if it is deeper. */
  WriterModel indentBy(int size) {
    int newIndent = atColumn >= indent + size ? atColumn + size : indent + size;
    return withIndentation(newIndent, atColumn);
  }

  /** Decreases the indent by {@code size}, but never below the alignment column. */
  WriterModel unindentBy(int size) {
    return withIndentation(Math.max(atColumn, indent - size), atColumn);
  }

  WriterModel withIndentation(int newIndent, int newAtColumn) {
    checkArgument(newIndent >= 0 && newAtColumn >= 0, "Negative indentation");
    return new WriterModel(current, newIndent, newAtColumn, writeBeforeNewline, newlinePending);
  }

  /** Defers {@code text} until just before the next line break. */
  WriterModel addWriteBeforeNewline(String text) {
    String pending = writeBeforeNewline.isEmpty() ? text : writeBeforeNewline + " " + text;
    return new WriterModel(current, indent, atColumn, pending, newlinePending);
  }

  /** Marks that the next write must start on a new line. */
  WriterModel requireNewline() {
    return new WriterModel(current, indent, atColumn, writeBeforeNewline, true);
  }

  LineState lineState() {
    return new LineState(current.text, indent, atColumn, writeBeforeNewline, newlinePending);
  }

  /** Replaces the current line and indentation state, keeping all completed lines. */
  WriterModel withLineState(LineState state) {
    return new WriterModel(
        current.withText(state.currentLine()),
        state.indent(),
        state.atColumn(),
        state.writeBeforeNewline(),
        state.newlinePending());
  }

  /**
   * Returns the text written so far. Pending trailing text is flushed, trailing blank lines are
   * removed and, if requested, a single final line separator is added.
   */
  String dump(String lineSeparator, boolean finalNewline) {
    WriterModel model = writeBeforeNewline.isEmpty() ? this : newline();
    List<String> lines = new ArrayList<>();
    for (Line l = model.current; l != null; l = l.previous) {
      lines.add(l.text);
    }
    Collections.reverse(lines);
    int end = lines.size();
    while (end > 0 && CharMatcher.whitespace().matchesAllOf(lines.get(end - 1))) {
      end--;
    }
    if (end == 0) {
      return "";
    }
    List<String> kept = new ArrayList<>(lines.subList(0, end));
    kept.set(end - 1, CharMatcher.whitespace().trimTrailingFrom(kept.get(end - 1)));
    String text = Joiner.on(lineSeparator).join(kept);
    return finalNewline ? text + lineSeparator : text;
  }
}
