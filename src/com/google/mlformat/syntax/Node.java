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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node in the syntax tree.
 *
 * <p>Children are kept in a singly linked list, the way the JavaScript tree does it. Besides its
 * kind, text and range, every node has two trivia slots: content printed before the node and
 * content printed after it. Only the trivia attacher fills them, and only the printer reads them.
 */
public final class Node {

  private final Token token;
  private final @Nullable String string;
  private SourceRange range;
  private boolean recursive;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node last;
  private @Nullable Node next;

  private final List<Trivia> contentBefore = new ArrayList<>();
  private final List<Trivia> contentAfter = new ArrayList<>();

  // Offset of the cursor inside this node's text, or -1.
  private int cursorOffset = -1;

  Node(Token token, @Nullable String string, SourceRange range) {
    this.token = checkNotNull(token);
    this.string = string;
    this.range = checkNotNull(range);
  }

  public Token getToken() {
    return token;
  }

  /** Returns the text of a literal, the operator of an infix, or the name of a dot-get. */
  public String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public boolean hasString() {
    return string != null;
  }

  public SourceRange getRange() {
    return range;
  }

  void setRange(SourceRange range) {
    this.range = checkNotNull(range);
  }

  /** Whether this is a {@code let rec} binding. */
  public boolean isRecursive() {
    return recursive;
  }

  void setRecursive(boolean recursive) {
    checkState(token == Token.LET, "Only bindings can be recursive: %s", token);
    this.recursive = recursive;
  }

  public @Nullable Node getParent() {
    return parent;
  }

  public @Nullable Node getFirstChild() {
    return first;
  }

  public @Nullable Node getLastChild() {
    return last;
  }

  public @Nullable Node getNext() {
    return next;
  }

  public @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public Node getOnlyChild() {
    checkState(first != null && first == last, "%s does not have exactly one child", token);
    return first;
  }

  public Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      checkArgument(n != null, "Child index out of range");
      n = n.next;
      i--;
    }
    checkArgument(n != null, "Child index out of range");
    return n;
  }

  public boolean hasChildren() {
    return first != null;
  }

  public int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  /** Returns the children as an immutable snapshot. */
  public ImmutableList<Node> children() {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Node n = first; n != null; n = n.next) {
      builder.add(n);
    }
    return builder.build();
  }

  public void addChildToBack(Node child) {
    checkArgument(child.parent == null, "new child has existing parent");
    checkArgument(child.next == null, "new child has existing next sibling");
    child.parent = this;
    if (last == null) {
      first = child;
    } else {
      last.next = child;
    }
    last = child;
  }

  public void addChildrenToBack(Iterable<Node> children) {
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  /** Trivia printed before this node's own text. */
  public List<Trivia> getContentBefore() {
    return contentBefore;
  }

  /** Trivia printed after this node's own text. */
  public List<Trivia> getContentAfter() {
    return contentAfter;
  }

  public boolean hasContentBefore() {
    return !contentBefore.isEmpty();
  }

  public boolean hasContentAfter() {
    return !contentAfter.isEmpty();
  }

  public void addContentBefore(Trivia trivia) {
    contentBefore.add(checkNotNull(trivia));
  }

  public void addContentAfter(Trivia trivia) {
    contentAfter.add(checkNotNull(trivia));
  }

  /** Returns the cursor offset recorded inside this node's text, or -1 if there is none. */
  public int getCursorOffset() {
    return cursorOffset;
  }

  public void setCursorOffset(int offset) {
    checkArgument(offset >= 0, "Negative cursor offset %s", offset);
    this.cursorOffset = offset;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isLet() {
    return token == Token.LET;
  }

  public boolean isIf() {
    return token == Token.IF;
  }

  public boolean isLambda() {
    return token == Token.LAMBDA;
  }

  public boolean isMatch() {
    return token == Token.MATCH;
  }

  public boolean isInfix() {
    return token == Token.INFIX;
  }

  public boolean isType() {
    return token == Token.TYPE;
  }

  public boolean isUnit() {
    return token == Token.UNIT;
  }

  public boolean isParen() {
    return token == Token.PAREN;
  }

  /** Whether this node carries its source text and has no children. */
  public boolean isLeaf() {
    return first == null;
  }

  /**
   * Returns true if this node has the same shape as {@code node}: same kinds, strings, flags and
   * children, in order. Ranges and trivia are ignored.
   */
  public boolean isEquivalentTo(Node node) {
    if (token != node.token
        || recursive != node.recursive
        || !Objects.equals(string, node.string)
        || getChildCount() != node.getChildCount()) {
      return false;
    }
    for (Node a = first, b = node.first; a != null; a = a.next, b = b.next) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
    }
    return true;
  }

  @CheckReturnValue
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    toStringTreeHelper(this, 0, sb);
    return sb.toString();
  }

  private static void toStringTreeHelper(Node n, int level, StringBuilder sb) {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n);
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (recursive) {
      sb.append(" [rec]");
    }
    sb.append(' ').append(range);
    return sb.toString();
  }
}
