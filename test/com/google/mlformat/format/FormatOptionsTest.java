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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.mlformat.format.FormatOptions.EndOfLineStyle;
import com.google.mlformat.format.FormatOptions.MultilineBracketStyle;
import com.google.mlformat.format.FormatOptions.MultilineFormatterType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FormatOptionsTest {

  @Test
  public void testDefaults() {
    FormatOptions options = FormatOptions.defaults();
    assertThat(options.indentSize()).isEqualTo(4);
    assertThat(options.pageWidth()).isEqualTo(120);
    assertThat(options.endOfLine()).isEqualTo(EndOfLineStyle.LF);
    assertThat(options.insertFinalNewline()).isTrue();
    assertThat(options.spaceBeforeLowercaseInvocation()).isTrue();
    assertThat(options.spaceBeforeUppercaseInvocation()).isFalse();
    assertThat(options.maxDotGetExpressionWidth()).isEqualTo(50);
    assertThat(options.multilineBracketStyle()).isEqualTo(MultilineBracketStyle.CRAMPED);
    assertThat(options.recordMultilineFormatter())
        .isEqualTo(MultilineFormatterType.CHARACTER_WIDTH);
    assertThat(options.keepMaxBlankLines()).isEqualTo(100);
    assertThat(options.strictMode()).isFalse();
  }

  @Test
  public void testToBuilder() {
    FormatOptions options = FormatOptions.defaults().toBuilder().setIndentSize(2).build();
    assertThat(options.indentSize()).isEqualTo(2);
    assertThat(options.pageWidth()).isEqualTo(120);
    assertThat(options).isNotEqualTo(FormatOptions.defaults());
    assertThat(options.toBuilder().setIndentSize(4).build()).isEqualTo(FormatOptions.defaults());
  }

  @Test
  public void testLineSeparators() {
    assertThat(EndOfLineStyle.LF.lineSeparator()).isEqualTo("\n");
    assertThat(EndOfLineStyle.CRLF.lineSeparator()).isEqualTo("\r\n");
  }

  @Test
  public void testPageWidthTooSmall() {
    FormatOptions.Builder builder = FormatOptions.builder().setPageWidth(59);
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
    assertThat(e).hasMessageThat().contains("Page width must be at least 60");
    assertThat(FormatOptions.builder().setPageWidth(60).build().pageWidth()).isEqualTo(60);
  }

  @Test
  public void testIndentSizeOutOfRange() {
    assertThrows(
        IllegalArgumentException.class, () -> FormatOptions.builder().setIndentSize(0).build());
    assertThrows(
        IllegalArgumentException.class, () -> FormatOptions.builder().setIndentSize(11).build());
  }

  @Test
  public void testNegativeLimits() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FormatOptions.builder().setKeepMaxBlankLines(-1).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> FormatOptions.builder().setMaxRecordWidth(-1).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> FormatOptions.builder().setMaxDotGetExpressionWidth(-1).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> FormatOptions.builder().setMaxArrayOrListNumberOfItems(0).build());
  }
}
