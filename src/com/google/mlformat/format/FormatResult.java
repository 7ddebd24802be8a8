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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.mlformat.syntax.FilePosition;
import com.google.mlformat.syntax.SourceRange;
import org.jspecify.annotations.Nullable;

/** The outcome of formatting one source file. */
@AutoValue
public abstract class FormatResult {

  public abstract String getSourceName();

  /** The text that was formatted: the whole file, or for a selection the selected declarations. */
  public abstract String getOriginalSource();

  /** The formatted text, or null if formatting failed. */
  public abstract @Nullable String getFormattedSource();

  /** Where the cursor ended up in the formatted text, if a cursor was given. */
  public abstract @Nullable FilePosition getCursor();

  /**
   * For a selection, the range of the original file that the formatted text replaces. Null when
   * the whole file was formatted.
   */
  public abstract @Nullable SourceRange getSelection();

  public abstract ImmutableList<FormatError> getErrors();

  public abstract ImmutableList<FormatError> getWarnings();

  public boolean isSuccess() {
    return getFormattedSource() != null && getErrors().isEmpty();
  }

  /** Whether formatting succeeded and produced text different from the original. */
  public boolean isChanged() {
    return isSuccess() && !getFormattedSource().equals(getOriginalSource());
  }

  static FormatResult success(
      String sourceName,
      String originalSource,
      String formattedSource,
      @Nullable FilePosition cursor,
      ImmutableList<FormatError> warnings) {
    return new AutoValue_FormatResult(
        sourceName, originalSource, formattedSource, cursor, null, ImmutableList.of(), warnings);
  }

  static FormatResult selection(
      String sourceName,
      String originalText,
      String formattedText,
      SourceRange selection,
      ImmutableList<FormatError> warnings) {
    return new AutoValue_FormatResult(
        sourceName, originalText, formattedText, null, selection, ImmutableList.of(), warnings);
  }

  static FormatResult failure(String sourceName, String originalSource, FormatError error) {
    return new AutoValue_FormatResult(
        sourceName,
        originalSource,
        null,
        null,
        null,
        ImmutableList.of(error),
        ImmutableList.of());
  }

  /** Returns this result with {@code error} added, no longer carrying formatted text. */
  FormatResult withError(FormatError error) {
    return new AutoValue_FormatResult(
        getSourceName(),
        getOriginalSource(),
        null,
        null,
        getSelection(),
        ImmutableList.<FormatError>builder().addAll(getErrors()).add(error).build(),
        getWarnings());
  }
}
