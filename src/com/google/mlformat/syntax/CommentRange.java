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

/**
 * The location and text of a comment. Comments never become nodes; the parser reports them next
 * to the tree.
 */
@Immutable
public final class CommentRange {
  private final SourceRange range;
  private final String text;
  private final boolean block;

  public CommentRange(SourceRange range, String text, boolean block) {
    this.range = checkNotNull(range);
    this.text = checkNotNull(text);
    this.block = block;
  }

  public SourceRange getRange() {
    return range;
  }

  /** The comment text including its delimiters. */
  public String getText() {
    return text;
  }

  /** Whether this is a {@code (* ... *)} comment rather than a {@code //} comment. */
  public boolean isBlock() {
    return block;
  }

  @Override
  public String toString() {
    return text + range;
  }
}
