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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.mlformat.format.FormatOptions.EndOfLineStyle;
import com.google.mlformat.syntax.FilePosition;
import com.google.mlformat.syntax.Node;
import com.google.mlformat.syntax.ParseResult;
import com.google.mlformat.syntax.Parser;
import com.google.mlformat.syntax.SourceRange;
import com.google.mlformat.syntax.SyntaxException;
import com.google.mlformat.syntax.Token;
import com.google.mlformat.syntax.Trivia;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Formats source files.
 *
 * <p>A file is parsed, its trivia is collected and attached to the tree, and the tree is printed
 * into a fresh {@link Context}. Every call has its own probe cache and trivia pool, so calls for
 * different files may run concurrently.
 */
public final class CodeFormatter {

  static final DiagnosticType MLF_PARSE_ERROR =
      DiagnosticType.error("MLF_PARSE_ERROR", "Parse error. {0}");

  static final DiagnosticType MLF_INVALID_SELECTION =
      DiagnosticType.error("MLF_INVALID_SELECTION", "Selection {0} does not cover a declaration");

  private static final Logger logger = Logger.getLogger(CodeFormatter.class.getName());

  private CodeFormatter() {}

  public static FormatResult format(String sourceName, String source, FormatOptions options) {
    return formatDocument(sourceName, source, options, null);
  }

  /**
   * Formats {@code source} and moves {@code cursor}, if given, to the matching position in the
   * output.
   */
  public static FormatResult formatDocument(
      String sourceName, String source, FormatOptions options, @Nullable FilePosition cursor) {
    String normalized = Parser.normalizeLineEndings(source);
    ParseResult parsed;
    try {
      parsed = Parser.parse(sourceName, normalized);
    } catch (SyntaxException e) {
      return parseFailure(sourceName, source, e);
    }

    Node root = parsed.getRoot();
    ImmutableList<Trivia> trivia =
        TriviaCollector.collect(parsed, normalized, options, cursor);
    ImmutableList<FormatError> warnings = new TriviaAttacher(sourceName).attach(root, trivia);

    Context formatted;
    try {
      formatted = print(root, options);
    } catch (FormatException e) {
      return FormatResult.failure(sourceName, source, e.toError(sourceName));
    }
    return FormatResult.success(
        sourceName, source, formatted.dump(), formatted.getFormattedCursor(), warnings);
  }

  /**
   * Formats the smallest run of declarations, or of items of one block, that covers {@code
   * selection}.
   *
   * <p>The result holds only the formatted text of those declarations, to be put in place of
   * {@link FormatResult#getSelection()}. Lines after the first are indented to the column the
   * first declaration starts at.
   */
  public static FormatResult formatSelection(
      String sourceName, String source, SourceRange selection, FormatOptions options) {
    String normalized = Parser.normalizeLineEndings(source);
    ParseResult parsed;
    try {
      parsed = Parser.parse(sourceName, normalized);
    } catch (SyntaxException e) {
      return parseFailure(sourceName, source, e);
    }

    ImmutableList<Node> covering = coveringDeclarations(parsed.getRoot(), selection);
    if (covering.isEmpty()) {
      return FormatResult.failure(
          sourceName,
          source,
          FormatError.make(
              MLF_INVALID_SELECTION,
              sourceName,
              selection.getStartLine(),
              selection.getStartColumn(),
              selection.toString()));
    }
    SourceRange range =
        SourceRange.span(covering.get(0).getRange(), covering.get(covering.size() - 1).getRange());
    logger.fine("Formatting " + range + " of " + sourceName);

    int column = range.getStartColumn();
    String selected = new SourceText(normalized).text(range);
    FormatOptions selectionOptions =
        options.toBuilder()
            .setEndOfLine(EndOfLineStyle.LF)
            .setPageWidth(Math.max(FormatOptions.MIN_PAGE_WIDTH, options.pageWidth() - column))
            .build();
    FormatResult result =
        formatDocument(sourceName, shiftLines(selected, -column), selectionOptions, null);
    if (!result.isSuccess()) {
      return FormatResult.failure(sourceName, selected, result.getErrors().get(0));
    }
    String formatted = CharMatcher.is('\n').trimTrailingFrom(result.getFormattedSource());
    return FormatResult.selection(
        sourceName,
        selected,
        shiftLines(formatted, column).replace("\n", options.endOfLine().lineSeparator()),
        range,
        result.getWarnings());
  }

  /** Returns the declarations or block items under {@code n} that {@code selection} touches. */
  private static ImmutableList<Node> coveringDeclarations(Node n, SourceRange selection) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (c.getRange().contains(selection)) {
        ImmutableList<Node> inner = coveringDeclarations(c, selection);
        if (!inner.isEmpty()) {
          return inner;
        }
        return isDeclaration(c) ? ImmutableList.of(c) : ImmutableList.of();
      }
    }
    if (n.getToken() != Token.FILE && n.getToken() != Token.SEQUENTIAL) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Node> touched = ImmutableList.builder();
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (c.getRange().overlaps(selection)) {
        touched.add(c);
      }
    }
    return touched.build();
  }

  private static boolean isDeclaration(Node n) {
    Token parent = n.getParent().getToken();
    return n.isLet() || parent == Token.FILE || parent == Token.SEQUENTIAL;
  }

  /**
   * Moves every line but the first {@code by} columns to the right, or to the left when negative.
   * Blank lines stay empty, and no line loses more than its leading whitespace.
   */
  private static String shiftLines(String text, int by) {
    List<String> lines = new ArrayList<>();
    boolean first = true;
    for (String line : Splitter.on('\n').split(text)) {
      if (first || line.isEmpty()) {
        lines.add(line);
      } else if (by >= 0) {
        lines.add(Strings.repeat(" ", by) + line);
      } else {
        int indent = line.length() - CharMatcher.whitespace().trimLeadingFrom(line).length();
        lines.add(line.substring(Math.min(indent, -by)));
      }
      first = false;
    }
    return Joiner.on('\n').join(lines);
  }

  /**
   * Prints a tree built by another front end. Trivia already attached to the tree is printed with
   * it.
   *
   * @throws FormatException if the tree holds a node that has no layout
   */
  public static String formatTree(Node root, FormatOptions options) {
    return print(root, options).dump();
  }

  private static FormatResult parseFailure(String sourceName, String source, SyntaxException e) {
    return FormatResult.failure(
        sourceName,
        source,
        FormatError.make(MLF_PARSE_ERROR, sourceName, e.getLine(), e.getColumn(), e.details()));
  }

  private static Context print(Node root, FormatOptions options) {
    ProbeCache cache = new ProbeCache();
    Doc doc = new NodePrinter(options).print(root);
    Context result = doc.apply(Context.create(options, cache));
    logger.fine("Probe cache: " + cache);
    return result;
  }
}
