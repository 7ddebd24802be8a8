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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.mlformat.syntax.FilePosition;
import com.google.mlformat.syntax.Node;
import com.google.mlformat.syntax.SourceRange;
import com.google.mlformat.syntax.Token;
import com.google.mlformat.syntax.Trivia;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Attaches trivia to the nodes it should be printed next to.
 *
 * <p>Each item goes to the smallest node enclosing it, the anchor, and from there to one of the
 * anchor's children:
 *
 * <ul>
 *   <li>a trailing line comment follows the child that ends last on its line;
 *   <li>a block comment follows the child before it when they share a line, otherwise it precedes
 *       the child after it;
 *   <li>own-line comments, blank lines, directives and cursors precede the next child, or follow
 *       the last one.
 * </ul>
 *
 * <p>A node whose children do not all lie within its own range is opaque: trivia inside it is
 * attached to the node itself rather than to one of its children.
 */
public final class TriviaAttacher {

  static final DiagnosticType MLF_TRIVIA_DROPPED =
      DiagnosticType.warning(
          "MLF_TRIVIA_DROPPED", "{0} at line {1} has no node to attach to and was left out");

  private static final Logger logger = Logger.getLogger(TriviaAttacher.class.getName());

  // Trailing comments move into the last child of these, so the comment stays after the
  // rightmost text on the line.
  private static final ImmutableSet<Token> LAST_CHILD_DESCENDS =
      ImmutableSet.of(
          Token.LET,
          Token.APP,
          Token.INFIX,
          Token.MATCH,
          Token.MATCH_CLAUSE,
          Token.LAMBDA,
          Token.IF,
          Token.TYPED,
          Token.SEQUENTIAL,
          Token.TUPLE,
          Token.RECORD_FIELD);

  private final String sourceName;

  public TriviaAttacher(String sourceName) {
    this.sourceName = sourceName;
  }

  /**
   * Attaches every item of {@code trivia} to a node of the tree under {@code root}.
   *
   * @return a warning for each item that could not be placed
   */
  public ImmutableList<FormatError> attach(Node root, List<Trivia> trivia) {
    TriviaPool pool = new TriviaPool(ImmutableList.copyOf(trivia));
    for (int i = 0; i < pool.size(); i++) {
      if (attach(root, pool.get(i))) {
        pool.markAttached(i);
      } else {
        pool.markDropped(i);
      }
    }
    checkState(pool.isSettled(), "Unplaced trivia left in %s", sourceName);

    ImmutableList.Builder<FormatError> warnings = ImmutableList.builder();
    for (Trivia dropped : pool.getDropped()) {
      logger.fine("Dropping " + dropped + " in " + sourceName);
      FilePosition start = dropped.getRange().getStart();
      warnings.add(
          FormatError.make(
              MLF_TRIVIA_DROPPED,
              sourceName,
              start.getLine(),
              start.getColumn(),
              dropped.getKind().toString(),
              Integer.toString(start.getLine())));
    }
    return warnings.build();
  }

  private boolean attach(Node root, Trivia trivia) {
    SourceRange range = trivia.getRange();
    if (!root.getRange().contains(range)) {
      Node first = root.getFirstChild();
      if (first == null) {
        root.addContentBefore(trivia);
      } else if (range.getEnd().compareTo(first.getRange().getStart()) <= 0) {
        first.addContentBefore(trivia);
      } else {
        root.getLastChild().addContentAfter(trivia);
      }
      return true;
    }

    Node anchor = findAnchor(root, range);
    // Error placeholders are never printed.
    if (anchor.getToken() == Token.FROM_PARSE_ERROR) {
      return false;
    }
    if (!childrenWithinParent(anchor)) {
      // Opaque: its children cannot be trusted to say where the trivia belongs.
      if (range.getStartLine() < anchor.getRange().getStartLine()) {
        anchor.addContentBefore(trivia);
      } else {
        anchor.addContentAfter(trivia);
      }
      return true;
    }
    switch (trivia.getKind()) {
      case LINE_COMMENT_TRAILING:
        Node before = lastEndingOnLine(anchor, range.getStart());
        if (before != null) {
          visitLastChildNode(before).addContentAfter(trivia);
          return true;
        }
        return attachBlockComment(anchor, trivia);
      case BLOCK_COMMENT:
        return attachBlockComment(anchor, trivia);
      case CURSOR:
        return attachBetweenChildren(anchor, trivia, true);
      case LINE_COMMENT_OWN_LINE:
      case BLANK_LINES:
      case DIRECTIVE:
        return attachBetweenChildren(anchor, trivia, false);
    }
    throw new AssertionError(trivia.getKind());
  }

  /** Returns the smallest node under {@code root} whose range contains {@code range}. */
  private static Node findAnchor(Node root, SourceRange range) {
    Node anchor = root;
    while (childrenWithinParent(anchor)) {
      Node next = null;
      for (Node c = anchor.getFirstChild(); c != null; c = c.getNext()) {
        if (c.getRange().contains(range)) {
          next = c;
          break;
        }
      }
      if (next == null) {
        break;
      }
      anchor = next;
    }
    return anchor;
  }

  private static boolean childrenWithinParent(Node n) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (!n.getRange().contains(c.getRange())) {
        return false;
      }
    }
    return true;
  }

  private static @Nullable Node lastEndingOnLine(Node anchor, FilePosition comment) {
    Node best = null;
    for (Node c = anchor.getFirstChild(); c != null; c = c.getNext()) {
      SourceRange r = c.getRange();
      if (r.getEndLine() == comment.getLine()
          && r.getEnd().compareTo(comment) <= 0
          && (best == null || r.getStartColumn() >= best.getRange().getStartColumn())) {
        best = c;
      }
    }
    return best;
  }

  private static Node visitLastChildNode(Node n) {
    while (LAST_CHILD_DESCENDS.contains(n.getToken()) && n.hasChildren()) {
      n = n.getLastChild();
    }
    return n;
  }

  private static boolean attachBlockComment(Node anchor, Trivia trivia) {
    SourceRange range = trivia.getRange();
    Node nodeBefore = null;
    Node nodeAfter = null;
    for (Node c = anchor.getFirstChild(); c != null; c = c.getNext()) {
      if (c.getRange().getEnd().compareTo(range.getStart()) <= 0) {
        nodeBefore = c;
      } else if (nodeAfter == null && c.getRange().getStart().compareTo(range.getEnd()) >= 0) {
        nodeAfter = c;
      }
    }
    if (nodeBefore != null && nodeBefore.getRange().getEndLine() == range.getStartLine()) {
      nodeBefore.addContentAfter(trivia);
    } else if (nodeAfter != null) {
      nodeAfter.addContentBefore(trivia);
    } else if (nodeBefore != null) {
      nodeBefore.addContentAfter(trivia);
    } else {
      attachToChildless(anchor, trivia);
    }
    return true;
  }

  private static boolean attachBetweenChildren(Node anchor, Trivia trivia, boolean byPosition) {
    SourceRange range = trivia.getRange();
    for (Node c = anchor.getFirstChild(); c != null; c = c.getNext()) {
      boolean after =
          byPosition
              ? c.getRange().getStart().compareTo(range.getStart()) >= 0
              : c.getRange().getStartLine() > range.getStartLine();
      if (after) {
        c.addContentBefore(trivia);
        return true;
      }
    }
    Node last = anchor.getLastChild();
    if (last != null) {
      last.addContentAfter(trivia);
    } else {
      attachToChildless(anchor, trivia);
    }
    return true;
  }

  private static void attachToChildless(Node anchor, Trivia trivia) {
    if (anchor.getParent() == null) {
      anchor.addContentBefore(trivia);
    } else {
      anchor.addContentAfter(trivia);
    }
  }
}
