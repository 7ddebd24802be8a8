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
import com.google.mlformat.syntax.Node;
import com.google.mlformat.syntax.Parser;
import com.google.mlformat.syntax.SyntaxException;
import org.jspecify.annotations.Nullable;

/**
 * Checks that formatting did not change what a file means, by parsing the output again and
 * comparing the two trees. Ranges and trivia are not compared.
 */
public final class FormatValidator {

  static final DiagnosticType MLF_FORMATTED_CODE_INVALID =
      DiagnosticType.error(
          "MLF_FORMATTED_CODE_INVALID", "The formatted code differs from the original: {0}");

  static final DiagnosticType MLF_CANNOT_PARSE_FORMATTED_CODE =
      DiagnosticType.error(
          "MLF_CANNOT_PARSE_FORMATTED_CODE", "The formatted code does not parse: {0}");

  private FormatValidator() {}

  /**
   * Returns the errors found comparing {@code originalSource} with {@code formattedSource}.
   *
   * @throws SyntaxException if the original source does not parse
   */
  public static ImmutableList<FormatError> validate(
      String sourceName, String originalSource, String formattedSource) {
    Node original = Parser.parse(sourceName, originalSource).getRoot();
    return validate(sourceName, original, formattedSource);
  }

  public static ImmutableList<FormatError> validate(
      String sourceName, Node originalRoot, String formattedSource) {
    Node formatted;
    try {
      formatted = Parser.parse(sourceName, formattedSource).getRoot();
    } catch (SyntaxException e) {
      return ImmutableList.of(
          FormatError.make(
              MLF_CANNOT_PARSE_FORMATTED_CODE,
              sourceName,
              e.getLine(),
              e.getColumn(),
              e.details()));
    }
    Node difference = findDifference(originalRoot, formatted);
    if (difference == null) {
      return ImmutableList.of();
    }
    return ImmutableList.of(
        FormatError.make(
            MLF_FORMATTED_CODE_INVALID, sourceName, difference, difference.toString()));
  }

  /** Returns the first node of {@code original} whose subtree has no match, or null. */
  private static @Nullable Node findDifference(Node original, Node formatted) {
    if (original.isEquivalentTo(formatted)) {
      return null;
    }
    if (original.getToken() == formatted.getToken()
        && original.getChildCount() == formatted.getChildCount()) {
      for (Node a = original.getFirstChild(), b = formatted.getFirstChild();
          a != null;
          a = a.getNext(), b = b.getNext()) {
        Node difference = findDifference(a, b);
        if (difference != null) {
          return difference;
        }
      }
    }
    return original;
  }
}
