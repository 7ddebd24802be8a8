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

import com.google.errorprone.annotations.Immutable;

/** The location and trimmed text of a conditional compilation line such as {@code #if DEBUG}. */
@Immutable
public final class DirectiveRange {
  private final SourceRange range;
  private final String text;

  public DirectiveRange(SourceRange range, String text) {
    this.range = checkNotNull(range);
    this.text = checkNotNull(text);
  }

  public SourceRange getRange() {
    return range;
  }

  public String getText() {
    return text;
  }

  @Override
  public String toString() {
    return text + range;
  }
}
