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

/** Thrown when source text cannot be parsed. */
@SuppressWarnings("serial")
public class SyntaxException extends RuntimeException {
  private final String sourceName;
  private final int line;
  private final int column;

  public SyntaxException(String sourceName, int line, int column, String details) {
    super(details);
    this.sourceName = sourceName;
    this.line = line;
    this.column = column;
  }

  /** The name of the source that failed to parse. */
  public final String sourceName() {
    return sourceName;
  }

  /** The 1-based line of the offending token. */
  public final int getLine() {
    return line;
  }

  /** The 0-based column of the offending token. */
  public final int getColumn() {
    return column;
  }

  public String details() {
    return super.getMessage();
  }

  @Override
  public final String getMessage() {
    return details() + " (" + sourceName + "#" + line + ":" + column + ")";
  }
}
