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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParserTest {

  private static Node parse(String source) {
    return Parser.parse("test.fs", source).getRoot();
  }

  /** Parses a single declaration and returns it. */
  private static Node parseOne(String source) {
    Node root = parse(source);
    assertThat(root.getChildCount()).isEqualTo(1);
    return root.getOnlyChild();
  }

  /** Parses {@code let x = <expr>} and returns the expression. */
  private static Node parseExpr(String expr) {
    return NodeUtil.getLetBody(parseOne("let x = " + expr));
  }

  @Test
  public void testEmptyFile() {
    Node root = parse("\n\n");
    assertThat(root.getToken()).isEqualTo(Token.FILE);
    assertThat(root.hasChildren()).isFalse();
  }

  @Test
  public void testSimpleLet() {
    Node let = parseOne("let x=1+2");
    assertThat(let.getToken()).isEqualTo(Token.LET);
    assertThat(let.isRecursive()).isFalse();
    assertThat(NodeUtil.getLetPattern(let).getString()).isEqualTo("x");
    assertThat(NodeUtil.getLetParameters(let)).isEmpty();
    Node body = NodeUtil.getLetBody(let);
    assertThat(body.getToken()).isEqualTo(Token.INFIX);
    assertThat(body.getString()).isEqualTo("+");
    assertThat(let.getRange()).isEqualTo(SourceRange.of(1, 0, 1, 9));
  }

  @Test
  public void testFunctionWithTypes() {
    Node let = parseOne("let rec f (x: int) y : string = g x y");
    assertThat(let.isRecursive()).isTrue();
    assertThat(NodeUtil.getLetParameters(let)).hasSize(2);
    Node param = NodeUtil.getLetParameters(let).get(0);
    assertThat(param.getToken()).isEqualTo(Token.PAREN);
    assertThat(param.getOnlyChild().getToken()).isEqualTo(Token.TYPED);
    assertThat(NodeUtil.getLetReturnType(let).getString()).isEqualTo("string");
    Node body = NodeUtil.getLetBody(let);
    assertThat(body.getToken()).isEqualTo(Token.APP);
    assertThat(body.getChildCount()).isEqualTo(3);
  }

  @Test
  public void testGenericTypeText() {
    Node let = parseOne("let xs : Map<string, int list> = empty");
    assertThat(NodeUtil.getLetReturnType(let).getString()).isEqualTo("Map<string, int list>");
  }

  @Test
  public void testPrecedence() {
    Node sum = parseExpr("1 + 2 * 3");
    assertThat(sum.getString()).isEqualTo("+");
    assertThat(sum.getLastChild().getString()).isEqualTo("*");

    Node or = parseExpr("a && b || c");
    assertThat(or.getString()).isEqualTo("||");
    assertThat(or.getFirstChild().getString()).isEqualTo("&&");
  }

  @Test
  public void testAssociativity() {
    Node minus = parseExpr("a - b - c");
    assertThat(minus.getFirstChild().isInfix()).isTrue();
    assertThat(minus.getLastChild().isName()).isTrue();

    Node cons = parseExpr("a :: b :: c");
    assertThat(cons.getFirstChild().isName()).isTrue();
    assertThat(cons.getLastChild().isInfix()).isTrue();
  }

  @Test
  public void testApplicationBindsTighterThanOperators() {
    Node pipe = parseExpr("xs |> List.map f");
    assertThat(pipe.getString()).isEqualTo("|>");
    Node app = pipe.getLastChild();
    assertThat(app.getToken()).isEqualTo(Token.APP);
    assertThat(app.getFirstChild().getString()).isEqualTo("List.map");
  }

  @Test
  public void testNegativeNumberArgument() {
    Node app = parseExpr("f -1");
    assertThat(app.getToken()).isEqualTo(Token.APP);
    assertThat(app.getLastChild().getString()).isEqualTo("-1");

    Node minus = parseExpr("f - 1");
    assertThat(minus.getToken()).isEqualTo(Token.INFIX);
  }

  @Test
  public void testDotGet() {
    Node get = parseExpr("(f x).Length");
    assertThat(get.getToken()).isEqualTo(Token.DOT_GET);
    assertThat(get.getString()).isEqualTo("Length");
    assertThat(get.getFirstChild().isParen()).isTrue();
  }

  @Test
  public void testMethodChain() {
    Node chain = parseExpr("a.M(x).N(y)");
    assertThat(chain.getToken()).isEqualTo(Token.APP);
    assertThat(chain.getLastChild().isParen()).isTrue();

    Node get = chain.getFirstChild();
    assertThat(get.getToken()).isEqualTo(Token.DOT_GET);
    assertThat(get.getString()).isEqualTo("N");

    Node call = get.getFirstChild();
    assertThat(call.getToken()).isEqualTo(Token.APP);
    assertThat(call.getFirstChild().getString()).isEqualTo("a.M");
    assertThat(call.getLastChild().isParen()).isTrue();
  }

  @Test
  public void testSpacedArgumentStartsNewArgument() {
    Node app = parseExpr("f (x).N");
    assertThat(app.getToken()).isEqualTo(Token.APP);
    assertThat(app.getFirstChild().getString()).isEqualTo("f");
    assertThat(app.getLastChild().getToken()).isEqualTo(Token.DOT_GET);

    Node last = parseExpr("f(x) y");
    assertThat(last.getToken()).isEqualTo(Token.APP);
    assertThat(last.getChildCount()).isEqualTo(3);
  }

  @Test
  public void testChainLinksOnIndentedLines() {
    Node chain = parseExpr("a.M(x).N(y)");
    Node split = parseExpr("\n    a\n        .M(x)\n        .N(y)");
    assertThat(split.isEquivalentTo(chain)).isTrue();
  }

  @Test
  public void testDotAtOffsideColumnIsNotALink() {
    assertThrows(SyntaxException.class, () -> parse("let x = a\n.M(x)"));
  }

  @Test
  public void testTuplesAndUnit() {
    Node tuple = parseExpr("1, (), \"s\"");
    assertThat(tuple.getToken()).isEqualTo(Token.TUPLE);
    assertThat(tuple.getChildCount()).isEqualTo(3);
    assertThat(tuple.getSecondChild().isUnit()).isTrue();

    Node let = parseOne("let a, b = t");
    assertThat(NodeUtil.getLetPattern(let).getToken()).isEqualTo(Token.TUPLE);
  }

  @Test
  public void testCollections() {
    assertThat(parseExpr("[1; 2; 3]").getChildCount()).isEqualTo(3);
    assertThat(parseExpr("[||]").getToken()).isEqualTo(Token.ARRAY);
    assertThat(parseExpr("[]").hasChildren()).isFalse();

    Node record = parseExpr("{ A = 1; B = x + 1 }");
    assertThat(record.getToken()).isEqualTo(Token.RECORD);
    assertThat(record.getChildCount()).isEqualTo(2);
    Node field = record.getLastChild();
    assertThat(field.getToken()).isEqualTo(Token.RECORD_FIELD);
    assertThat(field.getFirstChild().getString()).isEqualTo("B");
    assertThat(field.getLastChild().isInfix()).isTrue();
  }

  @Test
  public void testNewlineSeparatedItems() {
    Node list = parseExpr("[ 1\n          2\n          3 ]");
    assertThat(list.getChildCount()).isEqualTo(3);

    Node record = parseExpr("{\n    A = 1\n    B = 2\n}");
    assertThat(record.getChildCount()).isEqualTo(2);
  }

  @Test
  public void testIfElif() {
    Node ifNode = parseExpr("if a then b elif c then d else e");
    assertThat(ifNode.isIf()).isTrue();
    Node elif = NodeUtil.getElse(ifNode);
    assertThat(elif.isIf()).isTrue();
    assertThat(NodeUtil.isElif(elif)).isTrue();
    assertThat(NodeUtil.getElse(elif).getString()).isEqualTo("e");

    Node noElse = parseExpr("if a then b");
    assertThat(NodeUtil.getElse(noElse)).isNull();
  }

  @Test
  public void testMultilineIf() {
    Node ifNode = parseExpr("\n    if a then\n        b\n    else\n        c");
    assertThat(ifNode.getChildCount()).isEqualTo(3);
  }

  @Test
  public void testLambda() {
    Node lambda = parseExpr("fun a b -> a + b");
    assertThat(lambda.isLambda()).isTrue();
    assertThat(NodeUtil.getLambdaParameters(lambda)).hasSize(2);
    assertThat(NodeUtil.getLambdaBody(lambda).isInfix()).isTrue();
  }

  @Test
  public void testMatch() {
    Node let =
        parseOne(
            "let describe n =\n"
                + "    match n with\n"
                + "    | 0 -> \"zero\"\n"
                + "    | _ -> \"many\"\n");
    Node match = NodeUtil.getLetBody(let);
    assertThat(match.isMatch()).isTrue();
    assertThat(match.getChildCount()).isEqualTo(3);
    Node last = match.getLastChild();
    assertThat(last.getToken()).isEqualTo(Token.MATCH_CLAUSE);
    assertThat(last.getFirstChild().getToken()).isEqualTo(Token.WILDCARD);
  }

  @Test
  public void testMatchWithoutLeadingBar() {
    Node match = parseExpr("match n with 0 -> a | _ -> b");
    assertThat(match.getChildCount()).isEqualTo(3);
  }

  @Test
  public void testOffsideBlocks() {
    Node root =
        parse(
            "let f x =\n"
                + "    let y = x + 1\n"
                + "    y * 2\n"
                + "let z = 3\n");
    assertThat(root.getChildCount()).isEqualTo(2);
    Node body = NodeUtil.getLetBody(root.getFirstChild());
    assertThat(body.getToken()).isEqualTo(Token.SEQUENTIAL);
    assertThat(body.getChildCount()).isEqualTo(2);
    assertThat(body.getFirstChild().isLet()).isTrue();
  }

  @Test
  public void testOperatorLinesContinueTheItem() {
    Node body =
        NodeUtil.getLetBody(parseOne("let r =\n    xs\n    |> List.map f\n    |> List.sum\n"));
    assertThat(body.isInfix()).isTrue();
    assertThat(body.getFirstChild().isInfix()).isTrue();
  }

  @Test
  public void testLetIn() {
    Node root = parse("let x = 1 in x + 1");
    assertThat(root.getChildCount()).isEqualTo(2);
    assertThat(root.getLastChild().isInfix()).isTrue();
  }

  @Test
  public void testOpen() {
    Node open = parseOne("open System.Collections.Generic");
    assertThat(open.getToken()).isEqualTo(Token.OPEN);
    assertThat(open.getString()).isEqualTo("System.Collections.Generic");
  }

  @Test
  public void testCommentsAndDirectivesAreNotNodes() {
    ParseResult result =
        Parser.parse("test.fs", "#if DEBUG\nlet x = 1 // c\n#endif\n(* b *)\n");
    assertThat(result.getRoot().getChildCount()).isEqualTo(1);
    assertThat(result.getComments()).hasSize(2);
    assertThat(result.getDirectives()).hasSize(2);
  }

  @Test
  public void testCrlfIsNormalized() {
    Node root = parse("let a = 1\r\nlet b = 2\r\n");
    assertThat(root.getChildCount()).isEqualTo(2);
    assertThat(root.getLastChild().getRange().getStartLine()).isEqualTo(2);
  }

  @Test
  public void testLoneCarriageReturnIsNormalized() {
    Node root = parse("let a = 1\rlet b = 2\r\nlet c = 3\r");
    assertThat(root.getChildCount()).isEqualTo(3);
    assertThat(root.getChildAtIndex(1).getRange().getStartLine()).isEqualTo(2);
    assertThat(root.getLastChild().getRange().getStartLine()).isEqualTo(3);
    assertThat(Parser.normalizeLineEndings("a\rb\r\nc")).isEqualTo("a\nb\nc");
  }

  @Test
  public void testRootCoversWholeSource() {
    Node root = parse("let a = 1\n\n");
    assertThat(root.getRange()).isEqualTo(SourceRange.of(1, 0, 3, 0));
  }

  @Test
  public void testMissingBody() {
    SyntaxException e = assertThrows(SyntaxException.class, () -> parse("let x ="));
    assertThat(e.sourceName()).isEqualTo("test.fs");
    assertThat(e.getMessage()).contains("test.fs");
  }

  @Test
  public void testBodyMustBeIndented() {
    assertThrows(SyntaxException.class, () -> parse("let x =\n1\n"));
  }

  @Test
  public void testUnclosedList() {
    assertThrows(SyntaxException.class, () -> parse("let x = [1; 2"));
  }
}
