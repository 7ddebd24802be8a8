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

import static com.google.common.base.Preconditions.checkNotNull;

/** A token produced by the {@link Scanner}. */
final class Lexeme {

  enum Kind {
    IDENT,
    KEYWORD,
    NUMBER,
    STRING,
    CHAR,
    OPERATOR,
    ARROW,
    BAR,
    COLON,
    DOT,
    COMMA,
    SEMICOLON,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LARRAY,
    RARRAY,
    LBRACE,
    RBRACE,
    EOF
  }

  final Kind kind;
  final String text;
  final SourceRange range;
  // Whether no other lexeme ends on the line this one starts on.
  final boolean firstOnLine;

  Lexeme(Kind kind, String text, SourceRange range, boolean firstOnLine) {
    this.kind = checkNotNull(kind);
    this.text = checkNotNull(text);
    this.range = checkNotNull(range);
    this.firstOnLine = firstOnLine;
  }

  int line() {
    return range.getStartLine();
  }

  int column() {
    return range.getStartColumn();
  }

  boolean is(Kind kind) {
    return this.kind == kind;
  }

  boolean isKeyword(String keyword) {
    return kind == Kind.KEYWORD && text.equals(keyword);
  }

  boolean isOperator(String op) {
    return kind == Kind.OPERATOR && text.equals(op);
  }

  boolean isClosingDelimiter() {
    switch (kind) {
      case RPAREN:
      case RBRACKET:
      case RARRAY:
      case RBRACE:
        return true;
      default:
        return false;
    }
  }

  /** Whether this lexeme starts exactly where {@code previous} ends. */
  boolean isAdjacentTo(Lexeme previous) {
    return previous.range.getEnd().equals(range.getStart());
  }

  @Override
  public String toString() {
    return kind == Kind.EOF ? "end of input" : "'" + text + "'";
  }
}
