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

import static java.util.Objects.requireNonNull;

import com.google.mlformat.syntax.Node;

/**
 * A formatting error or warning.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location, or -1 if unknown.
 * @param charno Zero-indexed character number of the error location, or -1 if unknown.
 * @param level The reporting level.
 */
public record FormatError(
    DiagnosticType type,
    String description,
    String sourceName,
    int lineno,
    int charno,
    CheckLevel level) {
  public FormatError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(sourceName, "sourceName");
    requireNonNull(level, "level");
  }

  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_CHARNO = -1;

  /** Creates an error with no location. */
  public static FormatError make(DiagnosticType type, String sourceName, String... arguments) {
    return make(type, sourceName, DEFAULT_LINENO, DEFAULT_CHARNO, arguments);
  }

  /** Creates an error located at the start of {@code n}. */
  public static FormatError make(
      DiagnosticType type, String sourceName, Node n, String... arguments) {
    return make(
        type,
        sourceName,
        n.getRange().getStartLine(),
        n.getRange().getStartColumn(),
        arguments);
  }

  public static FormatError make(
      DiagnosticType type, String sourceName, int lineno, int charno, String... arguments) {
    return new FormatError(
        type, type.format(arguments), sourceName, lineno, charno, type.level);
  }

  public boolean isError() {
    return level == CheckLevel.ERROR;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(type.key).append(". ").append(description).append(" at ").append(sourceName);
    if (lineno > 0) {
      sb.append(" line ").append(lineno).append(" : ").append(charno);
    }
    return sb.toString();
  }
}
