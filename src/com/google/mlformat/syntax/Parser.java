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

import com.google.common.collect.ImmutableList;
import com.google.mlformat.syntax.Lexeme.Kind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A recursive descent parser for the light, indentation-aware syntax.
 *
 * <p>Blocks are delimited by layout. The column of a block's first token is the block column. A
 * token that starts a later line at the block column begins the next item, a token to its left
 * closes the block and a token to its right continues the current item. Lines that start with an
 * infix operator, a bar, a comma, a closing delimiter or one of {@code then else elif with in}
 * continue the current item even at the block column.
 */
public final class Parser {

  private final String sourceName;
  private final ImmutableList<Lexeme> lexemes;
  private final Map<Integer, Integer> firstColumnOnLine = new HashMap<>();
  private int index;
  private Lexeme lastConsumed;
  // The column of the innermost open block.
  private int offside;

  private Parser(String sourceName, ImmutableList<Lexeme> lexemes) {
    this.sourceName = sourceName;
    this.lexemes = lexemes;
    this.lastConsumed = lexemes.get(0);
    for (Lexeme lexeme : lexemes) {
      firstColumnOnLine.putIfAbsent(lexeme.line(), lexeme.column());
    }
  }

  /**
   * Parses a whole source file.
   *
   * @throws SyntaxException if the source is not well formed
   */
  public static ParseResult parse(String sourceName, String source) {
    String normalized = normalizeLineEndings(source);
    Scanner scanner = new Scanner(sourceName, normalized);
    ImmutableList<Lexeme> lexemes = scanner.scanAll();
    Parser parser = new Parser(sourceName, lexemes);
    Node root = parser.parseFile(endOf(normalized));
    return new ParseResult(sourceName, root, scanner.getComments(), scanner.getDirectives());
  }

  public static String normalizeLineEndings(String source) {
    return source.replace("\r\n", "\n").replace('\r', '\n');
  }

  private static FilePosition endOf(String source) {
    int lastNewline = source.lastIndexOf('\n');
    int line = 1;
    for (int i = 0; i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        line++;
      }
    }
    return new FilePosition(line, source.length() - lastNewline - 1);
  }

  private Node parseFile(FilePosition end) {
    List<Node> declarations = new ArrayList<>();
    if (!peek().is(Kind.EOF)) {
      declarations.addAll(parseItems(true));
      Lexeme t = peek();
      if (!t.is(Kind.EOF)) {
        throw error(t, "Unexpected " + t + " at top level");
      }
    }
    return IR.file(SourceRange.of(new FilePosition(1, 0), end), declarations);
  }

  /** Parses the items of a block whose column is the column of the next lexeme. */
  private List<Node> parseItems(boolean topLevel) {
    int saved = offside;
    offside = peek().column();
    List<Node> items = new ArrayList<>();
    while (true) {
      Node item = parseItem(topLevel);
      items.add(item);
      Lexeme t = peek();
      if (item.isLet() && t.isKeyword("in")) {
        next();
        continue;
      }
      if (!t.is(Kind.EOF) && t.firstOnLine && t.column() == offside && !isContinuation(t)) {
        continue;
      }
      break;
    }
    offside = saved;
    return items;
  }

  private Node parseItem(boolean topLevel) {
    Lexeme t = peek();
    if (t.isKeyword("let")) {
      return parseLet();
    }
    if (topLevel && t.isKeyword("open")) {
      return parseOpen();
    }
    return parseExpr();
  }

  /** Parses the block following {@code introducer}, such as the body after {@code =}. */
  private Node parseBody(Lexeme introducer) {
    Lexeme first = peek();
    if (first.firstOnLine && first.column() <= lineIndent(introducer)) {
      throw error(first, "Expected an indented expression after " + introducer);
    }
    List<Node> items = parseItems(false);
    if (items.size() == 1) {
      return items.get(0);
    }
    return IR.sequential(rangeFrom(items.get(0)), items);
  }

  private int lineIndent(Lexeme lexeme) {
    Integer column = firstColumnOnLine.get(lexeme.line());
    return column != null ? column : lexeme.column();
  }

  private Node parseOpen() {
    Lexeme start = next();
    StringBuilder path = new StringBuilder(expect(Kind.IDENT, "a module name").text);
    while (peek().is(Kind.DOT)) {
      next();
      path.append('.').append(expect(Kind.IDENT, "a module name").text);
    }
    return IR.open(rangeFrom(start), path.toString());
  }

  private Node parseLet() {
    Lexeme start = next();
    boolean recursive = false;
    if (peek().isKeyword("rec")) {
      next();
      recursive = true;
    }
    Node pattern = parseHeadPattern();
    List<Node> parameters = new ArrayList<>();
    while (startsAtom(peek()) && !endsItem(peek())) {
      parameters.add(parseAtom());
    }
    Node returnType = null;
    if (peek().is(Kind.COLON)) {
      next();
      returnType = parseType();
    }
    Lexeme equals = expectOperator("=");
    Node body = parseBody(equals);
    return IR.let(rangeFrom(start), recursive, pattern, parameters, returnType, body);
  }

  private Node parseHeadPattern() {
    Node first = parseAtom();
    if (!peek().is(Kind.COMMA)) {
      return first;
    }
    List<Node> items = new ArrayList<>();
    items.add(first);
    while (peek().is(Kind.COMMA)) {
      next();
      items.add(parseAtom());
    }
    return IR.tuple(rangeFrom(first), items);
  }

  /** Reads type text up to the next {@code =}, {@code ,} or closing delimiter outside brackets. */
  private Node parseType() {
    Lexeme first = peek();
    StringBuilder text = new StringBuilder();
    int depth = 0;
    Lexeme previous = null;
    while (true) {
      Lexeme t = peek();
      if (t.is(Kind.EOF) || t.is(Kind.KEYWORD) || t.is(Kind.SEMICOLON) || endsItem(t)) {
        break;
      }
      if (depth == 0
          && (t.isOperator("=") || t.is(Kind.COMMA) || t.isClosingDelimiter() || t.is(Kind.BAR))) {
        break;
      }
      if (t.isOperator("<") || t.is(Kind.LPAREN) || t.is(Kind.LBRACKET)) {
        depth++;
      } else if (t.isOperator(">") || t.isClosingDelimiter()) {
        depth--;
      }
      if (previous != null && !t.isAdjacentTo(previous)) {
        text.append(' ');
      }
      text.append(t.text);
      previous = next();
    }
    if (previous == null) {
      throw error(first, "Expected a type but found " + first);
    }
    return IR.type(rangeFrom(first), text.toString());
  }

  private Node parseExpr() {
    Node first = parseTyped();
    if (!peek().is(Kind.COMMA) || endsItem(peek())) {
      return first;
    }
    List<Node> items = new ArrayList<>();
    items.add(first);
    while (peek().is(Kind.COMMA) && !endsItem(peek())) {
      next();
      items.add(parseTyped());
    }
    return IR.tuple(rangeFrom(first), items);
  }

  private Node parseTyped() {
    Node expr = parseInfix(0);
    if (peek().is(Kind.COLON) && !endsItem(peek())) {
      next();
      Node type = parseType();
      return IR.typed(rangeFrom(expr), expr, type);
    }
    return expr;
  }

  private Node parseInfix(int minPrecedence) {
    Node left = parseApp();
    while (true) {
      Lexeme op = peek();
      if (!op.is(Kind.OPERATOR) || endsItem(op)) {
        return left;
      }
      int precedence = precedence(op.text);
      if (precedence < minPrecedence) {
        return left;
      }
      next();
      Node right = parseInfix(isRightAssociative(op.text) ? precedence : precedence + 1);
      left = IR.infix(rangeFrom(left), op.text, left, right);
    }
  }

  static int precedence(String op) {
    if (op.equals("<-") || op.equals(":=")) {
      return 1;
    }
    if (op.equals("||")) {
      return 2;
    }
    if (op.equals("&&") || op.equals("&")) {
      return 3;
    }
    if (op.startsWith("::")) {
      return 6;
    }
    if (op.startsWith("**")) {
      return 9;
    }
    switch (op.charAt(0)) {
      case '^':
      case '@':
        return 5;
      case '+':
      case '-':
        return 7;
      case '*':
      case '/':
      case '%':
        return 8;
      default:
        return 4;
    }
  }

  /** Whether chains of {@code op} group to the right, as {@code a :: b :: c} does. */
  public static boolean isRightAssociative(String op) {
    return op.equals("<-")
        || op.equals(":=")
        || op.startsWith("::")
        || op.startsWith("**")
        || op.startsWith("^")
        || op.startsWith("@");
  }

  private Node parseApp() {
    Lexeme t = peek();
    if (t.isKeyword("if")) {
      return parseIf(next());
    }
    if (t.isKeyword("fun")) {
      return parseLambda();
    }
    if (t.isKeyword("match")) {
      return parseMatch();
    }
    Node function = parseDotted();
    List<Node> arguments = new ArrayList<>();
    while ((startsAtom(peek()) || startsNegativeArgument()) && !endsItem(peek())) {
      arguments.add(parseDotted());
    }
    return arguments.isEmpty() ? function : IR.app(rangeFrom(function), function, arguments);
  }

  /** Whether the next lexemes are a spaced {@code -} glued to a number, as in {@code f -1}. */
  private boolean startsNegativeArgument() {
    Lexeme t = peek();
    return t.isOperator("-")
        && !t.isAdjacentTo(lastConsumed)
        && peekAhead(1).is(Kind.NUMBER)
        && peekAhead(1).isAdjacentTo(t);
  }

  /**
   * Parses an atom and the links that follow it: {@code .Name} glued to the previous lexeme or
   * opening an indented line, and parenthesized arguments glued to a name that another link
   * follows, as in {@code builder.WithA(a).WithB(b)}.
   */
  private Node parseDotted() {
    Node expr = parseAtom();
    while (true) {
      if (atDotLink(0, lastConsumed)) {
        next();
        Lexeme name = next();
        if (expr.isName()) {
          expr = IR.name(rangeFrom(expr), expr.getString() + "." + name.text);
        } else {
          expr = IR.dotGet(rangeFrom(expr), expr, name.text);
        }
      } else if (atMethodArgument()) {
        Node argument = parseAtom();
        expr = IR.app(rangeFrom(expr), expr, ImmutableList.of(argument));
      } else {
        return expr;
      }
    }
  }

  private boolean atDotLink(int ahead, Lexeme previous) {
    Lexeme dot = peekAhead(ahead);
    Lexeme name = peekAhead(ahead + 1);
    return dot.is(Kind.DOT)
        && name.is(Kind.IDENT)
        && name.isAdjacentTo(dot)
        && (dot.isAdjacentTo(previous) || (dot.firstOnLine && dot.column() > offside));
  }

  private boolean atMethodArgument() {
    Lexeme open = peek();
    if (!open.is(Kind.LPAREN) || !open.isAdjacentTo(lastConsumed)) {
      return false;
    }
    int depth = 0;
    for (int i = 0; ; i++) {
      Lexeme t = peekAhead(i);
      if (t.is(Kind.EOF)) {
        return false;
      } else if (t.is(Kind.LPAREN)) {
        depth++;
      } else if (t.is(Kind.RPAREN) && --depth == 0) {
        return atDotLink(i + 1, t);
      }
    }
  }

  private Node parseAtom() {
    Lexeme t = peek();
    switch (t.kind) {
      case IDENT:
        next();
        return t.text.equals("_") ? IR.wildcard(t.range) : IR.name(t.range, t.text);
      case NUMBER:
        next();
        return IR.number(t.range, t.text);
      case STRING:
        next();
        return IR.string(t.range, t.text);
      case CHAR:
        next();
        return IR.character(t.range, t.text);
      case LPAREN:
        return parseParen();
      case LBRACKET:
        {
          Lexeme open = next();
          List<Node> items = parseDelimitedItems(Kind.RBRACKET, "]");
          return IR.list(rangeFrom(open), items);
        }
      case LARRAY:
        {
          Lexeme open = next();
          List<Node> items = parseDelimitedItems(Kind.RARRAY, "|]");
          return IR.array(rangeFrom(open), items);
        }
      case LBRACE:
        return parseRecord();
      case OPERATOR:
        if (t.text.equals("-")
            && peekAhead(1).is(Kind.NUMBER)
            && peekAhead(1).isAdjacentTo(t)) {
          next();
          Lexeme number = next();
          return IR.number(rangeFrom(t), "-" + number.text);
        }
        throw error(t, "Unexpected " + t);
      default:
        throw error(t, "Unexpected " + t);
    }
  }

  private Node parseParen() {
    Lexeme open = next();
    if (peek().is(Kind.RPAREN)) {
      next();
      return IR.unit(rangeFrom(open));
    }
    List<Node> items = parseItems(false);
    Node inner = items.size() == 1 ? items.get(0) : IR.sequential(rangeFrom(items.get(0)), items);
    expect(Kind.RPAREN, "')'");
    return IR.paren(rangeFrom(open), inner);
  }

  private Node parseRecord() {
    Lexeme open = next();
    List<Node> fields = new ArrayList<>();
    if (!peek().is(Kind.RBRACE)) {
      int saved = offside;
      offside = peek().column();
      while (true) {
        fields.add(parseRecordField());
        if (!continueDelimited(Kind.RBRACE, "}")) {
          break;
        }
      }
      offside = saved;
    }
    expect(Kind.RBRACE, "'}'");
    return IR.record(rangeFrom(open), fields);
  }

  private Node parseRecordField() {
    Lexeme t = peek();
    if (!t.is(Kind.IDENT)) {
      throw error(t, "Expected a field name but found " + t);
    }
    Node name = parseDotted();
    if (!name.isName()) {
      throw error(t, "Expected a field name");
    }
    expectOperator("=");
    Node value = parseExpr();
    return IR.recordField(rangeFrom(name), name, value);
  }

  private List<Node> parseDelimitedItems(Kind close, String closeText) {
    List<Node> items = new ArrayList<>();
    if (!peek().is(close)) {
      int saved = offside;
      offside = peek().column();
      while (true) {
        items.add(parseExpr());
        if (!continueDelimited(close, closeText)) {
          break;
        }
      }
      offside = saved;
    }
    expect(close, "'" + closeText + "'");
    return items;
  }

  /**
   * Consumes an item separator if there is one. Returns whether another item follows before the
   * closing delimiter.
   */
  private boolean continueDelimited(Kind close, String closeText) {
    Lexeme t = peek();
    if (t.is(Kind.SEMICOLON)) {
      next();
      return !peek().is(close);
    }
    if (t.is(close)) {
      return false;
    }
    if (t.firstOnLine && t.column() == offside) {
      return true;
    }
    throw error(t, "Expected ';' or '" + closeText + "' but found " + t);
  }

  /** Parses the rest of a conditional whose {@code if} or {@code elif} was just consumed. */
  private Node parseIf(Lexeme keyword) {
    Node cond = parseExpr();
    Lexeme then = expectKeyword("then");
    Node thenBranch = parseBody(then);
    Node elseBranch = null;
    Lexeme t = peek();
    if ((t.isKeyword("else") || t.isKeyword("elif"))
        && (!t.firstOnLine || t.column() >= keyword.column())) {
      next();
      elseBranch = t.isKeyword("elif") ? parseIf(t) : parseBody(t);
    }
    return IR.ifNode(rangeFrom(keyword), cond, thenBranch, elseBranch);
  }

  private Node parseLambda() {
    Lexeme fun = next();
    List<Node> parameters = new ArrayList<>();
    while (startsAtom(peek())) {
      parameters.add(parseAtom());
    }
    if (parameters.isEmpty()) {
      throw error(peek(), "Expected a parameter but found " + peek());
    }
    Lexeme arrow = expect(Kind.ARROW, "'->'");
    Node body = parseBody(arrow);
    return IR.lambda(rangeFrom(fun), parameters, body);
  }

  private Node parseMatch() {
    Lexeme keyword = next();
    Node expr = parseExpr();
    expectKeyword("with");
    List<Node> clauses = new ArrayList<>();
    while (true) {
      Lexeme t = peek();
      Lexeme start = t;
      if (t.is(Kind.BAR)) {
        if (t.firstOnLine && t.column() < keyword.column()) {
          break;
        }
        next();
        start = t;
      } else if (!clauses.isEmpty()) {
        break;
      }
      Node pattern = parseExpr();
      Lexeme arrow = expect(Kind.ARROW, "'->'");
      Node body = parseBody(arrow);
      clauses.add(IR.matchClause(rangeFrom(start), pattern, body));
    }
    if (clauses.isEmpty()) {
      throw error(peek(), "Expected a match clause");
    }
    return IR.match(rangeFrom(keyword), expr, clauses);
  }

  /** Whether {@code t} is on a new line at or left of the block column, ending the item. */
  private boolean endsItem(Lexeme t) {
    if (t.is(Kind.EOF)) {
      return true;
    }
    if (!t.firstOnLine) {
      return false;
    }
    return t.column() < offside || (t.column() == offside && !isContinuation(t));
  }

  private static boolean isContinuation(Lexeme t) {
    switch (t.kind) {
      case OPERATOR:
      case BAR:
      case COMMA:
      case COLON:
      case ARROW:
      case RPAREN:
      case RBRACKET:
      case RARRAY:
      case RBRACE:
        return true;
      case KEYWORD:
        return t.text.equals("then")
            || t.text.equals("else")
            || t.text.equals("elif")
            || t.text.equals("with")
            || t.text.equals("in");
      default:
        return false;
    }
  }

  private static boolean startsAtom(Lexeme t) {
    switch (t.kind) {
      case IDENT:
      case NUMBER:
      case STRING:
      case CHAR:
      case LPAREN:
      case LBRACKET:
      case LARRAY:
      case LBRACE:
        return true;
      default:
        return false;
    }
  }

  private SourceRange rangeFrom(Lexeme start) {
    return SourceRange.of(start.range.getStart(), lastConsumed.range.getEnd());
  }

  private SourceRange rangeFrom(Node start) {
    return SourceRange.of(start.getRange().getStart(), lastConsumed.range.getEnd());
  }

  private Lexeme peek() {
    return lexemes.get(index);
  }

  private Lexeme peekAhead(int n) {
    return lexemes.get(Math.min(index + n, lexemes.size() - 1));
  }

  private Lexeme next() {
    Lexeme t = lexemes.get(index);
    if (!t.is(Kind.EOF)) {
      index++;
    }
    lastConsumed = t;
    return t;
  }

  private Lexeme expect(Kind kind, String what) {
    Lexeme t = peek();
    if (!t.is(kind)) {
      throw error(t, "Expected " + what + " but found " + t);
    }
    return next();
  }

  private Lexeme expectKeyword(String keyword) {
    Lexeme t = peek();
    if (!t.isKeyword(keyword)) {
      throw error(t, "Expected '" + keyword + "' but found " + t);
    }
    return next();
  }

  private Lexeme expectOperator(String op) {
    Lexeme t = peek();
    if (!t.isOperator(op)) {
      throw error(t, "Expected '" + op + "' but found " + t);
    }
    return next();
  }

  private SyntaxException error(Lexeme t, String message) {
    return new SyntaxException(sourceName, t.line(), t.column(), message);
  }
}
