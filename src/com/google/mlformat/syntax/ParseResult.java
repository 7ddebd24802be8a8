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

import com.google.common.collect.ImmutableList;

/** A parsed tree together with the comments and directives found beside it. */
public final class ParseResult {
  private final String sourceName;
  private final Node root;
  private final ImmutableList<CommentRange> comments;
  private final ImmutableList<DirectiveRange> directives;

  public ParseResult(
      String sourceName,
      Node root,
      ImmutableList<CommentRange> comments,
      ImmutableList<DirectiveRange> directives) {
    this.sourceName = checkNotNull(sourceName);
    this.root = checkNotNull(root);
    this.comments = checkNotNull(comments);
    this.directives = checkNotNull(directives);
  }

  public String getSourceName() {
    return sourceName;
  }

  /** The {@link Token#FILE} root, whose range covers the whole source. */
  public Node getRoot() {
    return root;
  }

  /** Comments in source order. */
  public ImmutableList<CommentRange> getComments() {
    return comments;
  }

  /** Directive lines in source order. */
  public ImmutableList<DirectiveRange> getDirectives() {
    return directives;
  }
}
