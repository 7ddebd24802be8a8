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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.mlformat.syntax.Lexeme.Kind;
import org.jspecify.annotations.Nullable;

/**
 * Splits source text into lexemes. Comments and conditional compilation lines are not returned as
 * lexemes; they are collected on the side and handed to the trivia collector.
 */
final class Scanner {

  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "let", "rec", "in", "if", "then", "else", "elif", "fun", "match", "with", "open");

  private static final ImmutableSet<String> DIRECTIVES = ImmutableSet.of("#if", "#else", "#endif");

  private static final CharMatcher OPERATOR_CHARS = CharMatcher.anyOf("!$%&*+-./<=>?@^|~:");
  private static final CharMatcher IDENT_START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.is('_'));
  private static final CharMatcher IDENT_PART =
      IDENT_START.or(CharMatcher.inRange('0', '9')).or(CharMatcher.is('\''));
  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');

  private final String sourceName;
  private final String source;
  private int offset;
  private int line = 1;
  private int column;
  private @Nullable Lexeme previous;

  private final ImmutableList.Builder<CommentRange> comments = ImmutableList.builder();
  private final ImmutableList.Builder<DirectiveRange> directives = ImmutableList.builder();

  /** @param source text with {@code \n} line terminators */
  Scanner(String sourceName, String source) {
    this.sourceName = sourceName;
    this.source = source;
  }

  /** Scans the whole source. The last lexeme is always {@link Kind#EOF}. */
  ImmutableList<Lexeme> scanAll() {
    ImmutableList.Builder<Lexeme> lexemes = ImmutableList.builder();
    while (true) {
      Lexeme lexeme = next();
      lexemes.add(lexeme);
      if (lexeme.is(Kind.EOF)) {
        return lexemes.build();
      }
    }
  }

  ImmutableList<CommentRange> getComments() {
    return comments.build();
  }

  ImmutableList<DirectiveRange> getDirectives() {
    return directives.build();
  }

  private Lexeme next() {
    skipTrivia();
    int startLine = line;
    int startColumn = column;
    if (offset >= source.length()) {
      return make(Kind.EOF, "", startLine, startColumn);
    }
    int start = offset;
    char c = peekChar(0);

    if (c == '"' || ((c == '$' || c == '@') && peekChar(1) == '"')) {
      scanString();
      return make(Kind.STRING, source.substring(start, offset), startLine, startColumn);
    }
    if (c == '\'') {
      return scanQuote(start, startLine, startColumn);
    }
    if (DIGIT.matches(c)) {
      scanNumber();
      return make(Kind.NUMBER, source.substring(start, offset), startLine, startColumn);
    }
    if (c == '`' && peekChar(1) == '`') {
      int close = source.indexOf("``", offset + 2);
      if (close < 0 || source.substring(offset, close).indexOf('\n') >= 0) {
        throw error(startLine, startColumn, "Unterminated quoted identifier");
      }
      advanceTo(close + 2);
      return make(Kind.IDENT, source.substring(start, offset), startLine, startColumn);
    }
    if (IDENT_START.matches(c)) {
      while (offset < source.length() && IDENT_PART.matches(peekChar(0))) {
        advance();
      }
      String text = source.substring(start, offset);
      Kind kind = KEYWORDS.contains(text) ? Kind.KEYWORD : Kind.IDENT;
      return make(kind, text, startLine, startColumn);
    }
    if (c == '[' && peekChar(1) == '|') {
      advance();
      advance();
      return make(Kind.LARRAY, "[|", startLine, startColumn);
    }
    if (c == '|' && peekChar(1) == ']') {
      advance();
      advance();
      return make(Kind.RARRAY, "|]", startLine, startColumn);
    }
    Kind punctuation = punctuation(c);
    if (punctuation != null) {
      advance();
      return make(punctuation, String.valueOf(c), startLine, startColumn);
    }
    if (OPERATOR_CHARS.matches(c)) {
      while (offset < source.length()
          && OPERATOR_CHARS.matches(peekChar(0))
          && !(peekChar(0) == '|' && peekChar(1) == ']')) {
        advance();
      }
      String text = source.substring(start, offset);
      return make(operatorKind(text), text, startLine, startColumn);
    }
    throw error(startLine, startColumn, "Unexpected character '" + c + "'");
  }

  private static @Nullable Kind punctuation(char c) {
    switch (c) {
      case '(':
        return Kind.LPAREN;
      case ')':
        return Kind.RPAREN;
      case '[':
        return Kind.LBRACKET;
      case ']':
        return Kind.RBRACKET;
      case '{':
        return Kind.LBRACE;
      case '}':
        return Kind.RBRACE;
      case ',':
        return Kind.COMMA;
      case ';':
        return Kind.SEMICOLON;
      default:
        return null;
    }
  }

  private static Kind operatorKind(String text) {
    switch (text) {
      case "->":
        return Kind.ARROW;
      case "|":
        return Kind.BAR;
      case ":":
        return Kind.COLON;
      case ".":
        return Kind.DOT;
      default:
        return Kind.OPERATOR;
    }
  }

  /** Skips whitespace, comments and directive lines, recording the latter two. */
  private void skipTrivia() {
    while (offset < source.length()) {
      char c = peekChar(0);
      if (c == ' ' || c == '\t' || c == '\n') {
        advance();
      } else if (c == '/' && peekChar(1) == '/') {
        int startLine = line;
        int startColumn = column;
        int start = offset;
        while (offset < source.length() && peekChar(0) != '\n') {
          advance();
        }
        String text = CharMatcher.whitespace().trimTrailingFrom(source.substring(start, offset));
        comments.add(
            new CommentRange(
                SourceRange.of(startLine, startColumn, startLine, startColumn + text.length()),
                text,
                false));
      } else if (c == '(' && peekChar(1) == '*' && peekChar(2) != ')') {
        scanBlockComment();
      } else if (c == '#' && isAtLineStart() && isDirective()) {
        int startLine = line;
        int startColumn = column;
        int start = offset;
        while (offset < source.length() && peekChar(0) != '\n') {
          advance();
        }
        String text = source.substring(start, offset).trim();
        directives.add(
            new DirectiveRange(
                SourceRange.of(startLine, startColumn, startLine, startColumn + text.length()),
                text));
      } else {
        return;
      }
    }
  }

  private void scanBlockComment() {
    int startLine = line;
    int startColumn = column;
    int start = offset;
    advance();
    advance();
    int depth = 1;
    while (depth > 0) {
      if (offset >= source.length()) {
        throw error(startLine, startColumn, "Unterminated comment");
      }
      if (peekChar(0) == '(' && peekChar(1) == '*') {
        depth++;
        advance();
      } else if (peekChar(0) == '*' && peekChar(1) == ')') {
        depth--;
        advance();
      }
      advance();
    }
    comments.add(
        new CommentRange(
            SourceRange.of(startLine, startColumn, line, column),
            source.substring(start, offset),
            true));
  }

  private boolean isAtLineStart() {
    for (int i = offset - 1; i >= 0 && source.charAt(i) != '\n'; i--) {
      if (source.charAt(i) != ' ' && source.charAt(i) != '\t') {
        return false;
      }
    }
    return true;
  }

  private boolean isDirective() {
    int end = offset + 1;
    while (end < source.length() && IDENT_PART.matches(source.charAt(end))) {
      end++;
    }
    return DIRECTIVES.contains(source.substring(offset, end));
  }

  private void scanString() {
    int startLine = line;
    int startColumn = column;
    boolean verbatim = peekChar(0) == '@';
    if (peekChar(0) != '"') {
      advance();
    }
    if (source.startsWith("\"\"\"", offset)) {
      int close = source.indexOf("\"\"\"", offset + 3);
      if (close < 0) {
        throw error(startLine, startColumn, "Unterminated string");
      }
      advanceTo(close + 3);
      return;
    }
    advance();
    while (true) {
      if (offset >= source.length()) {
        throw error(startLine, startColumn, "Unterminated string");
      }
      char c = peekChar(0);
      if (c == '\\' && !verbatim) {
        advance();
        if (offset < source.length()) {
          advance();
        }
      } else if (c == '"') {
        advance();
        if (verbatim && peekChar(0) == '"') {
          advance();
        } else {
          return;
        }
      } else {
        advance();
      }
    }
  }

  /** Scans a character literal, or a type variable such as {@code 'a} when it is not one. */
  private Lexeme scanQuote(int start, int startLine, int startColumn) {
    if (peekChar(1) == '\\') {
      int close = source.indexOf('\'', offset + 3);
      if (close < 0 || close - offset > 8) {
        throw error(startLine, startColumn, "Unterminated character literal");
      }
      advanceTo(close + 1);
      return make(Kind.CHAR, source.substring(start, offset), startLine, startColumn);
    }
    if (peekChar(2) == '\'' && peekChar(1) != '\n') {
      advanceTo(offset + 3);
      return make(Kind.CHAR, source.substring(start, offset), startLine, startColumn);
    }
    advance();
    if (!IDENT_START.matches(peekChar(0))) {
      throw error(startLine, startColumn, "Unexpected character '''");
    }
    while (offset < source.length() && IDENT_PART.matches(peekChar(0))) {
      advance();
    }
    return make(Kind.IDENT, source.substring(start, offset), startLine, startColumn);
  }

  private void scanNumber() {
    while (offset < source.length() && IDENT_PART.matches(peekChar(0))) {
      advance();
    }
    if (peekChar(0) == '.' && DIGIT.matches(peekChar(1))) {
      advance();
      while (offset < source.length() && IDENT_PART.matches(peekChar(0))) {
        advance();
      }
    }
  }

  private Lexeme make(Kind kind, String text, int startLine, int startColumn) {
    boolean firstOnLine = previous == null || previous.range.getEndLine() < startLine;
    Lexeme lexeme =
        new Lexeme(
            kind, text, SourceRange.of(startLine, startColumn, line, column), firstOnLine);
    previous = lexeme;
    return lexeme;
  }

  private char peekChar(int ahead) {
    int i = offset + ahead;
    return i < source.length() ? source.charAt(i) : '\0';
  }

  private void advance() {
    if (source.charAt(offset) == '\n') {
      line++;
      column = 0;
    } else {
      column++;
    }
    offset++;
  }

  private void advanceTo(int target) {
    while (offset < target) {
      advance();
    }
  }

  private SyntaxException error(int line, int column, String message) {
    return new SyntaxException(sourceName, line, column, message);
  }
}
