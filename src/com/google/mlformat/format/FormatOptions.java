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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.ForOverride;

/**
 * Formatting options. Instances are immutable and fully resolved: the formatter never reads
 * configuration files, flags or the environment.
 */
@AutoValue
public abstract class FormatOptions {

  /** How multiline records, lists and arrays place their brackets. */
  public enum MultilineBracketStyle {
    /** Items start on the opening bracket's line and the closing bracket follows the last. */
    CRAMPED,
    /** Brackets on their own lines at the column of the construct, items indented. */
    ALIGNED,
    /** Like {@link #ALIGNED}, but the opening bracket stays on the preceding line. */
    STROUSTRUP
  }

  /** How the threshold for breaking a record, list or array over several lines is measured. */
  public enum MultilineFormatterType {
    CHARACTER_WIDTH,
    NUMBER_OF_ITEMS
  }

  public enum EndOfLineStyle {
    LF("\n"),
    CRLF("\r\n");

    private final String separator;

    EndOfLineStyle(String separator) {
      this.separator = separator;
    }

    public String lineSeparator() {
      return separator;
    }
  }

  public static final int MIN_PAGE_WIDTH = 60;
  public static final int MAX_INDENT_SIZE = 10;

  public abstract int indentSize();

  /** The maximum line length that short forms must respect. */
  public abstract int pageWidth();

  public abstract EndOfLineStyle endOfLine();

  public abstract boolean insertFinalNewline();

  /** Whether to write {@code f (x)} rather than {@code f(x)} for lowercase functions. */
  public abstract boolean spaceBeforeLowercaseInvocation();

  /** Whether to write {@code F (x)} rather than {@code F(x)} for uppercase functions. */
  public abstract boolean spaceBeforeUppercaseInvocation();

  public abstract boolean spaceBeforeColon();

  public abstract boolean spaceAfterComma();

  public abstract boolean spaceAfterSemicolon();

  /** Whether to write {@code [ 1; 2 ]} rather than {@code [1; 2]}. */
  public abstract boolean spaceAroundDelimiter();

  public abstract int maxIfThenElseShortWidth();

  public abstract int maxInfixOperatorExpression();

  /** The width of a chain such as {@code a.B(1).C(2)} that may stay on one line. */
  public abstract int maxDotGetExpressionWidth();

  public abstract int maxRecordWidth();

  public abstract int maxRecordNumberOfItems();

  public abstract MultilineFormatterType recordMultilineFormatter();

  public abstract int maxArrayOrListWidth();

  public abstract int maxArrayOrListNumberOfItems();

  public abstract MultilineFormatterType arrayOrListMultilineFormatter();

  /** The width of the body of a binding without parameters that may stay on the same line. */
  public abstract int maxValueBindingWidth();

  /** The width of the body of a binding with parameters that may stay on the same line. */
  public abstract int maxFunctionBindingWidth();

  public abstract MultilineBracketStyle multilineBracketStyle();

  /** The longest run of blank lines that is kept. Longer runs are shortened to this length. */
  public abstract int keepMaxBlankLines();

  /** Whether to format from the tree alone, dropping comments, blank lines and directives. */
  public abstract boolean strictMode();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_FormatOptions.Builder()
        .setIndentSize(4)
        .setPageWidth(120)
        .setEndOfLine(EndOfLineStyle.LF)
        .setInsertFinalNewline(true)
        .setSpaceBeforeLowercaseInvocation(true)
        .setSpaceBeforeUppercaseInvocation(false)
        .setSpaceBeforeColon(false)
        .setSpaceAfterComma(true)
        .setSpaceAfterSemicolon(true)
        .setSpaceAroundDelimiter(true)
        .setMaxIfThenElseShortWidth(40)
        .setMaxInfixOperatorExpression(50)
        .setMaxDotGetExpressionWidth(50)
        .setMaxRecordWidth(40)
        .setMaxRecordNumberOfItems(1)
        .setRecordMultilineFormatter(MultilineFormatterType.CHARACTER_WIDTH)
        .setMaxArrayOrListWidth(40)
        .setMaxArrayOrListNumberOfItems(1)
        .setArrayOrListMultilineFormatter(MultilineFormatterType.CHARACTER_WIDTH)
        .setMaxValueBindingWidth(80)
        .setMaxFunctionBindingWidth(40)
        .setMultilineBracketStyle(MultilineBracketStyle.CRAMPED)
        .setKeepMaxBlankLines(100)
        .setStrictMode(false);
  }

  public static FormatOptions defaults() {
    return builder().build();
  }

  /** Builder for {@link FormatOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setIndentSize(int value);

    public abstract Builder setPageWidth(int value);

    public abstract Builder setEndOfLine(EndOfLineStyle value);

    public abstract Builder setInsertFinalNewline(boolean value);

    public abstract Builder setSpaceBeforeLowercaseInvocation(boolean value);

    public abstract Builder setSpaceBeforeUppercaseInvocation(boolean value);

    public abstract Builder setSpaceBeforeColon(boolean value);

    public abstract Builder setSpaceAfterComma(boolean value);

    public abstract Builder setSpaceAfterSemicolon(boolean value);

    public abstract Builder setSpaceAroundDelimiter(boolean value);

    public abstract Builder setMaxIfThenElseShortWidth(int value);

    public abstract Builder setMaxInfixOperatorExpression(int value);

    public abstract Builder setMaxDotGetExpressionWidth(int value);

    public abstract Builder setMaxRecordWidth(int value);

    public abstract Builder setMaxRecordNumberOfItems(int value);

    public abstract Builder setRecordMultilineFormatter(MultilineFormatterType value);

    public abstract Builder setMaxArrayOrListWidth(int value);

    public abstract Builder setMaxArrayOrListNumberOfItems(int value);

    public abstract Builder setArrayOrListMultilineFormatter(MultilineFormatterType value);

    public abstract Builder setMaxValueBindingWidth(int value);

    public abstract Builder setMaxFunctionBindingWidth(int value);

    public abstract Builder setMultilineBracketStyle(MultilineBracketStyle value);

    public abstract Builder setKeepMaxBlankLines(int value);

    public abstract Builder setStrictMode(boolean value);

    @ForOverride
    abstract FormatOptions autoBuild();

    /**
     * @throws IllegalArgumentException if the page width is below {@value #MIN_PAGE_WIDTH}, the
     *     indent size is outside 1 to {@value #MAX_INDENT_SIZE} or a limit is negative
     */
    public final FormatOptions build() {
      FormatOptions options = autoBuild();
      checkArgument(
          options.pageWidth() >= MIN_PAGE_WIDTH,
          "Page width must be at least %s, was %s",
          MIN_PAGE_WIDTH,
          options.pageWidth());
      checkArgument(
          options.indentSize() >= 1 && options.indentSize() <= MAX_INDENT_SIZE,
          "Indent size must be between 1 and %s, was %s",
          MAX_INDENT_SIZE,
          options.indentSize());
      checkArgument(options.keepMaxBlankLines() >= 0, "keepMaxBlankLines must not be negative");
      checkArgument(
          options.maxRecordNumberOfItems() >= 1 && options.maxArrayOrListNumberOfItems() >= 1,
          "Item count limits must be at least 1");
      checkArgument(
          options.maxIfThenElseShortWidth() >= 0
              && options.maxInfixOperatorExpression() >= 0
              && options.maxDotGetExpressionWidth() >= 0
              && options.maxRecordWidth() >= 0
              && options.maxArrayOrListWidth() >= 0
              && options.maxValueBindingWidth() >= 0
              && options.maxFunctionBindingWidth() >= 0,
          "Width limits must not be negative");
      return options;
    }
  }
}
