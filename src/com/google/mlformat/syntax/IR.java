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
import static com.google.common.base.Preconditions.checkState;

import java.util.List;
import org.jspecify.annotations.Nullable;

/** A tree construction helper class. */
public final class IR {

  private IR() {}

  public static Node file(SourceRange range, List<Node> declarations) {
    Node file = new Node(Token.FILE, null, range);
    file.addChildrenToBack(declarations);
    return file;
  }

  public static Node open(SourceRange range, String path) {
    return new Node(Token.OPEN, path, range);
  }

  /**
   * Creates a binding. Its children are the head pattern, the parameters, the optional return
   * type and the body, in that order.
   */
  public static Node let(
      SourceRange range,
      boolean recursive,
      Node pattern,
      List<Node> parameters,
      @Nullable Node returnType,
      Node body) {
    checkState(returnType == null || returnType.isType(), returnType);
    for (Node parameter : parameters) {
      checkState(mayBePattern(parameter), "Bad parameter %s", parameter);
    }
    Node let = new Node(Token.LET, null, range);
    let.addChildToBack(pattern);
    let.addChildrenToBack(parameters);
    if (returnType != null) {
      let.addChildToBack(returnType);
    }
    let.addChildToBack(body);
    if (recursive) {
      let.setRecursive(true);
    }
    return let;
  }

  public static Node sequential(SourceRange range, List<Node> items) {
    checkArgument(items.size() > 1, "A sequence needs at least two items");
    Node seq = new Node(Token.SEQUENTIAL, null, range);
    seq.addChildrenToBack(items);
    return seq;
  }

  public static Node name(SourceRange range, String name) {
    return new Node(Token.NAME, name, range);
  }

  public static Node number(SourceRange range, String text) {
    return new Node(Token.NUMBER, text, range);
  }

  public static Node string(SourceRange range, String text) {
    return new Node(Token.STRING, text, range);
  }

  public static Node character(SourceRange range, String text) {
    return new Node(Token.CHAR, text, range);
  }

  public static Node unit(SourceRange range) {
    return new Node(Token.UNIT, null, range);
  }

  public static Node wildcard(SourceRange range) {
    return new Node(Token.WILDCARD, "_", range);
  }

  public static Node type(SourceRange range, String text) {
    return new Node(Token.TYPE, text, range);
  }

  public static Node typed(SourceRange range, Node expr, Node type) {
    checkState(type.isType(), type);
    Node typed = new Node(Token.TYPED, null, range);
    typed.addChildToBack(expr);
    typed.addChildToBack(type);
    return typed;
  }

  public static Node paren(SourceRange range, Node inner) {
    Node paren = new Node(Token.PAREN, null, range);
    paren.addChildToBack(inner);
    return paren;
  }

  public static Node tuple(SourceRange range, List<Node> items) {
    checkArgument(items.size() > 1, "A tuple needs at least two items");
    return withChildren(new Node(Token.TUPLE, null, range), items);
  }

  public static Node list(SourceRange range, List<Node> items) {
    return withChildren(new Node(Token.LIST, null, range), items);
  }

  public static Node array(SourceRange range, List<Node> items) {
    return withChildren(new Node(Token.ARRAY, null, range), items);
  }

  public static Node record(SourceRange range, List<Node> fields) {
    for (Node field : fields) {
      checkState(field.getToken() == Token.RECORD_FIELD, field);
    }
    return withChildren(new Node(Token.RECORD, null, range), fields);
  }

  public static Node recordField(SourceRange range, Node name, Node value) {
    checkState(name.isName(), name);
    Node field = new Node(Token.RECORD_FIELD, null, range);
    field.addChildToBack(name);
    field.addChildToBack(value);
    return field;
  }

  public static Node app(SourceRange range, Node function, List<Node> arguments) {
    checkArgument(!arguments.isEmpty(), "An application needs arguments");
    Node app = new Node(Token.APP, null, range);
    app.addChildToBack(function);
    app.addChildrenToBack(arguments);
    return app;
  }

  public static Node infix(SourceRange range, String operator, Node left, Node right) {
    Node infix = new Node(Token.INFIX, operator, range);
    infix.addChildToBack(left);
    infix.addChildToBack(right);
    return infix;
  }

  public static Node dotGet(SourceRange range, Node expr, String name) {
    Node dotGet = new Node(Token.DOT_GET, name, range);
    dotGet.addChildToBack(expr);
    return dotGet;
  }

  public static Node ifNode(SourceRange range, Node cond, Node then, @Nullable Node otherwise) {
    Node ifNode = new Node(Token.IF, null, range);
    ifNode.addChildToBack(cond);
    ifNode.addChildToBack(then);
    if (otherwise != null) {
      ifNode.addChildToBack(otherwise);
    }
    return ifNode;
  }

  public static Node lambda(SourceRange range, List<Node> parameters, Node body) {
    checkArgument(!parameters.isEmpty(), "A lambda needs parameters");
    Node lambda = new Node(Token.LAMBDA, null, range);
    lambda.addChildrenToBack(parameters);
    lambda.addChildToBack(body);
    return lambda;
  }

  public static Node match(SourceRange range, Node expr, List<Node> clauses) {
    checkArgument(!clauses.isEmpty(), "A match needs clauses");
    for (Node clause : clauses) {
      checkState(clause.getToken() == Token.MATCH_CLAUSE, clause);
    }
    Node match = new Node(Token.MATCH, null, range);
    match.addChildToBack(expr);
    match.addChildrenToBack(clauses);
    return match;
  }

  public static Node matchClause(SourceRange range, Node pattern, Node body) {
    Node clause = new Node(Token.MATCH_CLAUSE, null, range);
    clause.addChildToBack(pattern);
    clause.addChildToBack(body);
    return clause;
  }

  /** A placeholder for source that a front end could not make sense of. */
  public static Node fromParseError(SourceRange range) {
    return new Node(Token.FROM_PARSE_ERROR, null, range);
  }

  private static Node withChildren(Node parent, List<Node> children) {
    parent.addChildrenToBack(children);
    return parent;
  }

  private static boolean mayBePattern(Node n) {
    switch (n.getToken()) {
      case NAME:
      case WILDCARD:
      case UNIT:
      case PAREN:
      case NUMBER:
      case STRING:
      case CHAR:
      case LIST:
      case ARRAY:
      case RECORD:
        return true;
      default:
        return false;
    }
  }
}
