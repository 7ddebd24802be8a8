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

import static com.google.mlformat.format.Docs.atCurrentColumn;
import static com.google.mlformat.format.Docs.atCurrentColumnIndent;
import static com.google.mlformat.format.Docs.empty;
import static com.google.mlformat.format.Docs.fitsOnRestOfLine;
import static com.google.mlformat.format.Docs.indented;
import static com.google.mlformat.format.Docs.indentedOnNewline;
import static com.google.mlformat.format.Docs.isShortExpression;
import static com.google.mlformat.format.Docs.join;
import static com.google.mlformat.format.Docs.newline;
import static com.google.mlformat.format.Docs.newlineIfLineHasContent;
import static com.google.mlformat.format.Docs.sepSpace;
import static com.google.mlformat.format.Docs.seq;
import static com.google.mlformat.format.Docs.text;
import static com.google.mlformat.format.Docs.when;
import static com.google.mlformat.format.Docs.writeBeforeNewline;

import com.google.common.collect.ImmutableList;
import com.google.mlformat.format.FormatOptions.MultilineBracketStyle;
import com.google.mlformat.format.FormatOptions.MultilineFormatterType;
import com.google.mlformat.syntax.Node;
import com.google.mlformat.syntax.NodeUtil;
import com.google.mlformat.syntax.Parser;
import com.google.mlformat.syntax.Token;
import com.google.mlformat.syntax.Trivia;
import com.google.mlformat.syntax.TriviaKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a syntax tree into a {@link Doc}.
 *
 * <p>Every node is printed as its leading trivia, its own layout and its trailing trivia. Most
 * constructs have a short, single-line form and a long form; the short form is used when it fits
 * on the rest of the line and within the width limit configured for that construct. Lambdas and
 * match expressions always force the long form of the construct that directly contains them.
 *
 * <p>Documents are built once per node, so a probe cache entry for a node's document can be
 * reused no matter how often the enclosing layouts are tried.
 */
public final class NodePrinter {

  static final DiagnosticType MLF_UNSUPPORTED_CONSTRUCT =
      DiagnosticType.error("MLF_UNSUPPORTED_CONSTRUCT", "Cannot format a {0} node");

  private final FormatOptions options;
  private final Map<Node, Doc> docs = new IdentityHashMap<>();
  private final Map<Node, Doc> layouts = new IdentityHashMap<>();

  public NodePrinter(FormatOptions options) {
    this.options = options;
  }

  /**
   * Returns the document for {@code n}, trivia included.
   *
   * @throws FormatException if the tree holds a node that has no layout
   */
  public Doc print(Node n) {
    Doc doc = docs.get(n);
    if (doc == null) {
      doc = seq(contentBefore(n), layout(n), contentAfter(n));
      docs.put(n, doc);
    }
    return doc;
  }

  private List<Doc> printAll(List<Node> nodes) {
    List<Doc> result = new ArrayList<>(nodes.size());
    for (Node n : nodes) {
      result.add(print(n));
    }
    return result;
  }

  private Doc layout(Node n) {
    Doc doc = layouts.get(n);
    if (doc == null) {
      doc = createLayout(n);
      layouts.put(n, doc);
    }
    return doc;
  }

  private Doc createLayout(Node n) {
    switch (n.getToken()) {
      case FILE:
        return file(n);
      case OPEN:
        return text("open " + n.getString());
      case LET:
        return let(n);
      case SEQUENTIAL:
        return atCurrentColumn(join(newline(), printAll(n.children())));
      case NAME:
      case NUMBER:
      case STRING:
      case CHAR:
      case WILDCARD:
      case TYPE:
        return literal(n, n.getString());
      case UNIT:
        return literal(n, "()");
      case TYPED:
        return seq(print(n.getFirstChild()), colon(), print(n.getLastChild()));
      case PAREN:
        return seq(text("("), atCurrentColumn(print(n.getOnlyChild())), text(")"));
      case TUPLE:
        return tuple(n);
      case LIST:
        return delimited(n, "[", "]", false);
      case ARRAY:
        return delimited(n, "[|", "|]", false);
      case RECORD:
        return delimited(n, "{", "}", true);
      case RECORD_FIELD:
        return recordField(n);
      case APP:
        return isDotGetChain(n) ? dotGetChain(n) : app(n);
      case INFIX:
        return infix(n);
      case DOT_GET:
        return dotGetChain(n);
      case IF:
        return ifThenElse(n);
      case LAMBDA:
        return lambda(n);
      case MATCH:
        return match(n);
      case MATCH_CLAUSE:
        return matchClause(n);
      case FROM_PARSE_ERROR:
        break;
    }
    throw new FormatException(MLF_UNSUPPORTED_CONSTRUCT, n, n.getToken().toString());
  }

  // Trivia

  private Doc contentBefore(Node n) {
    if (!n.hasContentBefore()) {
      return empty();
    }
    List<Doc> parts = new ArrayList<>();
    for (Trivia trivia : n.getContentBefore()) {
      parts.add(triviaBefore(trivia));
    }
    return seq(parts);
  }

  private Doc contentAfter(Node n) {
    if (!n.hasContentAfter()) {
      return empty();
    }
    List<Doc> parts = new ArrayList<>();
    for (Trivia trivia : n.getContentAfter()) {
      parts.add(triviaAfter(trivia));
    }
    return seq(parts);
  }

  private static Doc triviaBefore(Trivia trivia) {
    String text = trivia.getText();
    switch (trivia.getKind()) {
      case LINE_COMMENT_OWN_LINE:
      case DIRECTIVE:
        return seq(newlineIfLineHasContent(), text(text), newline());
      case LINE_COMMENT_TRAILING:
        return ctx ->
            ctx.lineHasContent() ? ctx.writeBeforeNewline(text) : ctx.write(text).newline();
      case BLOCK_COMMENT:
        return seq(
            when(trivia.hasNewlineBefore(), newlineIfLineHasContent()),
            sepSpace(),
            text(text),
            trivia.hasNewlineAfter() ? newline() : sepSpace());
      case BLANK_LINES:
        int count = trivia.getBlankLineCount();
        return ctx -> {
          if (ctx.lineHasContent()) {
            ctx = ctx.newline();
          }
          for (int i = 0; i < count; i++) {
            ctx = ctx.newline();
          }
          return ctx;
        };
      case CURSOR:
        return ctx -> ctx.recordCursor(0);
    }
    throw new AssertionError(trivia.getKind());
  }

  private static Doc triviaAfter(Trivia trivia) {
    String text = trivia.getText();
    switch (trivia.getKind()) {
      case LINE_COMMENT_TRAILING:
        return writeBeforeNewline(text);
      case LINE_COMMENT_OWN_LINE:
      case DIRECTIVE:
        return seq(newlineIfLineHasContent(), text(text), Context::requireNewline);
      case BLOCK_COMMENT:
        return seq(
            when(trivia.hasNewlineBefore(), newlineIfLineHasContent()),
            sepSpace(),
            text(text),
            when(trivia.hasNewlineAfter(), Context::requireNewline));
      case BLANK_LINES:
        int count = trivia.getBlankLineCount();
        return ctx -> {
          if (ctx.lineHasContent()) {
            ctx = ctx.newline();
          }
          // The last blank line is left for whatever is written next.
          for (int i = 1; i < count; i++) {
            ctx = ctx.newline();
          }
          return ctx.requireNewline();
        };
      case CURSOR:
        return ctx -> ctx.recordCursor(0);
    }
    throw new AssertionError(trivia.getKind());
  }

  private static Doc literal(Node n, String text) {
    int cursorOffset = n.getCursorOffset();
    if (cursorOffset < 0) {
      return text(text);
    }
    return ctx -> ctx.recordCursor(cursorOffset).write(text);
  }

  /**
   * Prints the part of {@code n}'s text that starts at {@code start}, recording the cursor if it
   * falls inside. The cursor may sit at the very end only of the {@code last} part.
   */
  private static Doc literalPart(Node n, String text, int start, boolean last) {
    int offset = n.getCursorOffset() - start;
    boolean inside = offset >= 0 && (last ? offset <= text.length() : offset < text.length());
    if (n.getCursorOffset() < 0 || !inside) {
      return text(text);
    }
    return ctx -> ctx.recordCursor(offset).write(text);
  }

  // Declarations

  private Doc file(Node n) {
    ImmutableList<Node> declarations = n.children();
    List<Doc> before = new ArrayList<>();
    List<Doc> after = new ArrayList<>();
    for (Node declaration : declarations) {
      before.add(contentBefore(declaration));
      after.add(contentAfter(declaration));
    }
    return ctx -> {
      boolean previousMultiline = false;
      for (int i = 0; i < declarations.size(); i++) {
        Node declaration = declarations.get(i);
        if (i > 0) {
          ctx = ctx.newline();
          if (needsBlankLineBefore(ctx, declaration, previousMultiline)) {
            ctx = ctx.newline();
          }
        }
        // Only the declaration's own lines count, not the comments above it.
        ctx = before.get(i).apply(ctx);
        int startLine = ctx.lineNumber();
        ctx = layout(declaration).apply(ctx);
        previousMultiline = ctx.lineNumber() > startLine;
        ctx = after.get(i).apply(ctx);
      }
      return ctx;
    };
  }

  /**
   * A declaration that spans several lines is separated from its neighbours by a blank line,
   * unless the source already put a blank line or a comment there.
   */
  private boolean needsBlankLineBefore(Context ctx, Node declaration, boolean previousMultiline) {
    if (options.keepMaxBlankLines() == 0) {
      return false;
    }
    for (Trivia trivia : declaration.getContentBefore()) {
      if (trivia.getKind() != TriviaKind.CURSOR) {
        return false;
      }
    }
    return previousMultiline || ctx.probe(layout(declaration)).isFailed();
  }

  private Doc let(Node n) {
    Node pattern = NodeUtil.getLetPattern(n);
    ImmutableList<Node> parameters = NodeUtil.getLetParameters(n);
    Node returnType = NodeUtil.getLetReturnType(n);
    Node body = NodeUtil.getLetBody(n);

    List<Doc> head = new ArrayList<>();
    head.add(text(n.isRecursive() ? "let rec " : "let "));
    head.add(print(pattern));
    for (Node parameter : parameters) {
      head.add(sepSpace());
      head.add(print(parameter));
    }
    if (returnType != null) {
      head.add(colon());
      head.add(print(returnType));
    }
    head.add(text(" ="));
    Doc headDoc = seq(head);

    Doc bodyDoc = print(body);
    if (options.multilineBracketStyle() == MultilineBracketStyle.STROUSTRUP
        && isDelimited(body)
        && !body.hasContentBefore()) {
      return seq(headDoc, sepSpace(), bodyDoc);
    }
    Doc shortBody = seq(sepSpace(), bodyDoc);
    Doc longBody = indentedOnNewline(bodyDoc);
    boolean forceLong =
        body.isLambda() || body.isMatch() || body.isLet() || body.getToken() == Token.SEQUENTIAL;
    if (forceLong) {
      return seq(headDoc, longBody);
    }
    int maxWidth =
        parameters.isEmpty() ? options.maxValueBindingWidth() : options.maxFunctionBindingWidth();
    return seq(headDoc, isShortExpression(maxWidth, shortBody, longBody));
  }

  private static boolean isDelimited(Node n) {
    switch (n.getToken()) {
      case LIST:
      case ARRAY:
      case RECORD:
        return n.hasChildren();
      default:
        return false;
    }
  }

  private Doc colon() {
    return text(options.spaceBeforeColon() ? " : " : ": ");
  }

  // Expressions

  private Doc tuple(Node n) {
    List<Doc> items = printAll(n.children());
    Doc shortDoc = join(text(options.spaceAfterComma() ? ", " : ","), items);
    Doc longDoc = atCurrentColumn(join(seq(text(","), newline()), items));
    return hasLambdaOrMatchChild(n) ? longDoc : fitsOnRestOfLine(shortDoc, longDoc);
  }

  private Doc delimited(Node n, String open, String close, boolean isRecord) {
    if (!n.hasChildren()) {
      return text(open + close);
    }
    List<Doc> items = printAll(n.children());
    String pad = options.spaceAroundDelimiter() ? " " : "";
    Doc shortDoc =
        seq(
            text(open + pad),
            join(text(options.spaceAfterSemicolon() ? "; " : ";"), items),
            text(pad + close));
    Doc itemLines = join(newline(), items);
    Doc longDoc;
    switch (options.multilineBracketStyle()) {
      case ALIGNED:
        longDoc =
            atCurrentColumnIndent(
                seq(text(open), indentedOnNewline(itemLines), newline(), text(close)));
        break;
      case STROUSTRUP:
        longDoc = seq(text(open), indentedOnNewline(itemLines), newline(), text(close));
        break;
      case CRAMPED:
      default:
        longDoc = seq(text(open + pad), atCurrentColumn(itemLines), text(pad + close));
        break;
    }
    if (hasLambdaOrMatchChild(n)) {
      return longDoc;
    }

    MultilineFormatterType formatter =
        isRecord ? options.recordMultilineFormatter() : options.arrayOrListMultilineFormatter();
    if (formatter == MultilineFormatterType.NUMBER_OF_ITEMS) {
      int maxItems =
          isRecord ? options.maxRecordNumberOfItems() : options.maxArrayOrListNumberOfItems();
      return n.getChildCount() > maxItems ? longDoc : fitsOnRestOfLine(shortDoc, longDoc);
    }
    int maxWidth = isRecord ? options.maxRecordWidth() : options.maxArrayOrListWidth();
    return isShortExpression(maxWidth, shortDoc, longDoc);
  }

  private Doc recordField(Node n) {
    Node value = n.getLastChild();
    Doc head = seq(print(n.getFirstChild()), text(" ="));
    Doc valueDoc = print(value);
    Doc longDoc = indentedOnNewline(valueDoc);
    // Values that break indent from the field name, whatever the enclosing indentation.
    if (value.isLambda() || value.isMatch()) {
      return atCurrentColumnIndent(seq(head, longDoc));
    }
    return atCurrentColumnIndent(seq(head, fitsOnRestOfLine(seq(sepSpace(), valueDoc), longDoc)));
  }

  private Doc app(Node n) {
    Node function = n.getFirstChild();
    List<Doc> shortParts = new ArrayList<>();
    List<Doc> longParts = new ArrayList<>();
    shortParts.add(print(function));
    for (Node arg = function.getNext(); arg != null; arg = arg.getNext()) {
      boolean first = arg == function.getNext();
      shortParts.add(first && !spaceBeforeArgument(function, arg) ? empty() : sepSpace());
      shortParts.add(print(arg));
      longParts.add(newline());
      longParts.add(print(arg));
    }
    Doc longDoc = seq(print(function), indented(seq(longParts)));
    return hasLambdaOrMatchChild(n) ? longDoc : fitsOnRestOfLine(seq(shortParts), longDoc);
  }

  /** Whether {@code f (x)} or {@code f ()} is written with a space, per the invoked name's case. */
  private boolean spaceBeforeArgument(Node function, Node arg) {
    if (!arg.isParen() && !arg.isUnit()) {
      return true;
    }
    return isUppercaseName(function)
        ? options.spaceBeforeUppercaseInvocation()
        : options.spaceBeforeLowercaseInvocation();
  }

  private static boolean isUppercaseName(Node n) {
    if (!n.isName()) {
      return false;
    }
    String name = n.getString();
    String last = name.substring(name.lastIndexOf('.') + 1);
    return !last.isEmpty() && Character.isUpperCase(last.charAt(0));
  }

  // Dot-get chains

  /** A step of a dot-get chain, such as {@code .WithName(name)}, printed on one line. */
  private static final class ChainLink {
    final Doc text;
    final List<Node> arguments = new ArrayList<>();
    // Spine nodes whose leading trivia goes before this link, and whose trailing trivia after it.
    final List<Node> startsHere = new ArrayList<>();
    final List<Node> endsHere = new ArrayList<>();

    ChainLink(Doc text) {
      this.text = text;
    }
  }

  private static boolean isDotGetChain(Node n) {
    return n.getToken() == Token.DOT_GET || (isMethodCall(n) && isDotGetChain(n.getFirstChild()));
  }

  /** Whether {@code n} applies a function to a single parenthesized argument or unit. */
  private static boolean isMethodCall(Node n) {
    if (n.getToken() != Token.APP || n.getChildCount() != 2) {
      return false;
    }
    Node arg = n.getLastChild();
    return arg.isParen() || arg.isUnit();
  }

  /**
   * Prints a chain such as {@code builder.WithA(a).WithB(b)}. A chain of two or more links that
   * is wider than {@code maxDotGetExpressionWidth} puts every link after the first on its own
   * indented line. Arguments always stay glued to their link.
   */
  private Doc dotGetChain(Node n) {
    List<ChainLink> links = new ArrayList<>();
    collectLinks(n, links, true);
    List<Doc> linkDocs = new ArrayList<>();
    for (ChainLink link : links) {
      linkDocs.add(linkDoc(link));
    }
    Doc shortDoc = seq(linkDocs);
    if (links.size() < 3) {
      return shortDoc;
    }
    List<Doc> rest = new ArrayList<>();
    for (Doc link : linkDocs.subList(1, linkDocs.size())) {
      rest.add(newline());
      rest.add(link);
    }
    Doc longDoc = seq(linkDocs.get(0), indented(seq(rest)));
    return isShortExpression(options.maxDotGetExpressionWidth(), shortDoc, longDoc);
  }

  private void collectLinks(Node n, List<ChainLink> links, boolean outermost) {
    if (n.getToken() == Token.DOT_GET) {
      collectLinks(n.getFirstChild(), links, false);
      links.add(new ChainLink(text("." + n.getString())));
    } else if (isMethodCall(n) && isDotGetChain(n.getFirstChild())) {
      collectLinks(n.getFirstChild(), links, false);
      links.get(links.size() - 1).arguments.add(n.getLastChild());
    } else if (isMethodCall(n)) {
      collectHead(n.getFirstChild(), links);
      links.get(links.size() - 1).arguments.add(n.getLastChild());
    } else {
      collectHead(n, links);
      return;
    }
    if (!outermost) {
      links.get(0).startsHere.add(0, n);
      links.get(links.size() - 1).endsHere.add(n);
    }
  }

  /** Adds the start of a chain. A long identifier {@code a.B} becomes {@code a} and {@code .B}. */
  private void collectHead(Node n, List<ChainLink> links) {
    String name = n.isName() ? n.getString() : "";
    int dot = name.lastIndexOf('.');
    if (dot <= 0) {
      links.add(new ChainLink(print(n)));
      return;
    }
    ChainLink head = new ChainLink(literalPart(n, name.substring(0, dot), 0, false));
    head.startsHere.add(n);
    ChainLink member = new ChainLink(literalPart(n, name.substring(dot), dot, true));
    member.endsHere.add(n);
    links.add(head);
    links.add(member);
  }

  private Doc linkDoc(ChainLink link) {
    List<Doc> parts = new ArrayList<>();
    for (Node n : link.startsHere) {
      parts.add(contentBefore(n));
    }
    parts.add(link.text);
    for (Node arg : link.arguments) {
      parts.add(print(arg));
    }
    for (Node n : link.endsHere) {
      parts.add(contentAfter(n));
    }
    return seq(parts);
  }

  private Doc infix(Node n) {
    String op = n.getString();
    List<Node> operands = flattenInfix(n);
    List<Doc> shortParts = new ArrayList<>();
    List<Doc> longParts = new ArrayList<>();
    boolean forceLong = false;
    for (int i = 0; i < operands.size(); i++) {
      Node operand = operands.get(i);
      forceLong |= operand.isLambda() || operand.isMatch();
      Doc operandDoc = print(operand);
      if (i > 0) {
        shortParts.add(sepSpace());
        shortParts.add(text(op + " "));
        longParts.add(newline());
        longParts.add(text(op + " "));
      }
      shortParts.add(operandDoc);
      longParts.add(operandDoc);
    }
    Doc longDoc = atCurrentColumn(seq(longParts));
    // Two pipes or more read best one step per line.
    if (forceLong || (op.equals("|>") && operands.size() > 2)) {
      return longDoc;
    }
    return isShortExpression(options.maxInfixOperatorExpression(), seq(shortParts), longDoc);
  }

  /** Collects the operands of a chain of the same left-associative operator. */
  private static List<Node> flattenInfix(Node n) {
    String op = n.getString();
    Deque<Node> operands = new ArrayDeque<>();
    operands.addFirst(n.getLastChild());
    Node current = n.getFirstChild();
    if (!Parser.isRightAssociative(op)) {
      while (current.isInfix()
          && current.getString().equals(op)
          && !current.hasContentBefore()
          && !current.hasContentAfter()) {
        operands.addFirst(current.getLastChild());
        current = current.getFirstChild();
      }
    }
    operands.addFirst(current);
    return new ArrayList<>(operands);
  }

  private Doc ifThenElse(Node n) {
    List<Doc> shortParts = new ArrayList<>();
    List<Doc> longParts = new ArrayList<>();
    boolean forceLong = false;
    Node current = n;
    Node elseBranch;
    while (true) {
      Node condition = current.getFirstChild();
      Node thenBranch = condition.getNext();
      elseBranch = NodeUtil.getElse(current);
      forceLong |= isLambdaOrMatch(condition) || isLambdaOrMatch(thenBranch);
      String keyword = current == n ? "if " : "elif ";
      if (current != n) {
        shortParts.add(sepSpace());
        longParts.add(newline());
      }
      shortParts.add(seq(text(keyword), print(condition), text(" then "), print(thenBranch)));
      longParts.add(
          seq(
              text(keyword),
              atCurrentColumn(print(condition)),
              text(" then"),
              indentedOnNewline(print(thenBranch))));
      if (elseBranch == null || !isFlattenableElif(elseBranch)) {
        break;
      }
      current = elseBranch;
    }
    if (elseBranch != null) {
      forceLong |= isLambdaOrMatch(elseBranch);
      shortParts.add(seq(text(" else "), print(elseBranch)));
      longParts.add(seq(newline(), text("else"), indentedOnNewline(print(elseBranch))));
    }
    Doc longDoc = atCurrentColumn(seq(longParts));
    if (forceLong) {
      return longDoc;
    }
    return isShortExpression(options.maxIfThenElseShortWidth(), seq(shortParts), longDoc);
  }

  /** An {@code if} in the else slot is printed as {@code elif}, unless it carries trivia. */
  private static boolean isFlattenableElif(Node elseBranch) {
    return elseBranch.isIf() && !elseBranch.hasContentBefore() && !elseBranch.hasContentAfter();
  }

  private Doc lambda(Node n) {
    List<Doc> head = new ArrayList<>();
    head.add(text("fun"));
    for (Node parameter : NodeUtil.getLambdaParameters(n)) {
      head.add(sepSpace());
      head.add(print(parameter));
    }
    head.add(text(" ->"));
    Doc headDoc = seq(head);
    Node body = NodeUtil.getLambdaBody(n);
    Doc bodyDoc = print(body);
    Doc longDoc = seq(headDoc, indentedOnNewline(bodyDoc));
    if (isLambdaOrMatch(body)) {
      return longDoc;
    }
    return fitsOnRestOfLine(seq(headDoc, sepSpace(), bodyDoc), longDoc);
  }

  private Doc match(Node n) {
    Node expr = n.getFirstChild();
    List<Doc> parts = new ArrayList<>();
    parts.add(text("match "));
    parts.add(atCurrentColumn(print(expr)));
    parts.add(text(" with"));
    for (Node clause = expr.getNext(); clause != null; clause = clause.getNext()) {
      parts.add(newline());
      parts.add(print(clause));
    }
    return atCurrentColumn(seq(parts));
  }

  private Doc matchClause(Node n) {
    Node body = n.getLastChild();
    Doc head = seq(text("| "), print(n.getFirstChild()), text(" ->"));
    Doc bodyDoc = print(body);
    Doc longDoc = seq(head, indentedOnNewline(bodyDoc));
    if (isLambdaOrMatch(body)) {
      return longDoc;
    }
    return fitsOnRestOfLine(seq(head, sepSpace(), bodyDoc), longDoc);
  }

  private static boolean isLambdaOrMatch(Node n) {
    return n.isLambda() || n.isMatch();
  }

  private static boolean hasLambdaOrMatchChild(Node n) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (isLambdaOrMatch(c)) {
        return true;
      }
    }
    return false;
  }
}
