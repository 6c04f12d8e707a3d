// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pycst.java.syntax;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of the parser: lossless round trips, tree shape, errors and grammar versions. */
@RunWith(TestParameterInjector.class)
public final class ParserTest {

  private static final ParserConfig PY37 =
      ParserConfig.builder().pythonVersion(PythonVersion.PY_3_7).build();
  private static final ParserConfig PY38 =
      ParserConfig.builder().pythonVersion(PythonVersion.PY_3_8).build();
  private static final ParserConfig PY310 =
      ParserConfig.builder().pythonVersion(PythonVersion.PY_3_10).build();

  /** Sources that must be reproduced exactly by parsing and generating code. */
  enum Source {
    EMPTY(""),
    BLANK_LINES("\n\n"),
    COMMENT_ONLY("# only"),
    NO_TRAILING_NEWLINE("x = 1"),
    ASSIGNMENT("x = 1\n"),
    CHAINED_ASSIGNMENT("a = b = c\n"),
    AUGMENTED_ASSIGNMENT("x  +=  1\n"),
    ANNOTATED_ASSIGNMENT("x: int = 1\ny : List[int]\n"),
    STARRED_TARGET("a, *b = c\n"),
    SEMICOLONS("a = 1; b = 2;\n"),
    CRLF("x = 1\r\ny = 2\r\n"),
    COMMENTS(
        "# header\n\nimport os  # trailing\n\n\ndef f():\n    # inside\n    return 1\n\n"
            + "# footer\n"),
    WHITESPACE_ONLY_LINE("x = 1\n    \ny = 2\n"),
    BACKSLASH("x = 1 + \\\n    2\n"),
    PARENTHESIZED_CONTINUATION("x = (1 +\n     2)\n"),
    NESTED_PARENS("x = ((a))\n"),
    IMPORTS("import a.b as c, d\nfrom __future__ import annotations\n"),
    RELATIVE_IMPORTS(
        "from . import a\nfrom .. x import y\nfrom ...pkg.mod import (a as b,\n    c,)\n"),
    IMPORT_STAR("from os import *\n"),
    FLOW("while True:\n    pass\n    break\n    continue\n"),
    RETURN_AND_RAISE("def f():\n    return\n    return a, b\n    raise\n    raise E from e\n"),
    ASSERT_DEL_GLOBAL("assert x, 'msg'\ndel a, b[0]\nglobal g, h\n"),
    IF_ELIF_ELSE("if a:\n    pass\nelif b:\n    pass\nelse:\n    pass\n"),
    COMMENT_BEFORE_ELSE("if a:\n    pass\n# c\nelse:\n    pass\n"),
    IF_HEADER_COMMENT("if x:  # c\n    pass\n"),
    SIMPLE_SUITE("if x: pass\nwhile y: a; b\n"),
    FOR_ELSE("for i, (a, b) in enumerate(x):\n    continue\nelse:\n    break\n"),
    TRY(
        "try:\n    pass\nexcept (A, B) as e:\n    pass\nexcept:\n    pass\nelse:\n    pass\n"
            + "finally:\n    pass\n"),
    TRY_FINALLY("try:\n    pass\nfinally:\n    pass\n"),
    EXCEPT_STAR("try:\n    pass\nexcept* ValueError:\n    pass\n"),
    WITH("with open(f) as g, h:\n    pass\nwith a, b as (c, d):\n    pass\n"),
    PARENTHESIZED_WITH("with (\n    open(a) as b,\n    open(c) as d,\n):\n    pass\n"),
    FUNCTION("def f(a, b=1):\n    return a\n"),
    FUNCTION_ANNOTATIONS("def f(x: int = 0, *args: str, **kw) -> str:\n    return ''\n"),
    POSITIONAL_ONLY("def f(a, /, b, *, c, **d):\n    pass\n"),
    KEYWORD_ONLY("def f(*, a=1):\n    pass\n"),
    MULTILINE_PARAMS("def f(\n    a,\n    b,\n):\n    pass\n"),
    ELLIPSIS_BODY("def f(): ...\n"),
    DECORATORS("@a\n\n# c\n@b(1)\nclass C:\n    pass\n"),
    RELAXED_DECORATOR("@buttons[0].clicked.connect\ndef f(): pass\n"),
    CLASS("class A:\n    pass\nclass B():\n    pass\nclass C(A, metaclass=M):\n    x: int = 1\n"),
    NESTED_FUNCTIONS(
        "def f():\n    x = 1\n\n    def g():\n        return x\n\n    return g\n"),
    ASYNC(
        "async def f():\n    async for x in y:\n        await z\n    async with a as b:\n"
            + "        pass\n    return [x async for x in y]\n"),
    TABS_AND_CRLF("if a:\r\n\tif b:\r\n\t\tpass\r\n"),
    MIXED_INDENT_WIDTHS("if a:\n  b\nif c:\n    d\n"),
    DEDENT_BY_TWO_LEVELS("if a:\n    if b:\n        c\nd\n"),
    OPERATORS("x = -a ** -b + c // d % e @ f << g >> h & i ^ j | ~k\n"),
    BOOLEAN_OPERATORS("x = not a and b or c\n"),
    COMPARISONS("x = a < b <= c != d not in e is not f in g is h\n"),
    CONDITIONAL("x = a if b else c\n"),
    LAMBDAS("f = lambda: 0\ng = lambda x, y=2: x\nh = lambda *args, **kw: 0\n"),
    WALRUS("if (n := len(a)) > 10:\n    pass\n"),
    CALLS("f(a, b=1, *c, **d)\ng(x for x in y)\nh(a, b,)\ni()\n"),
    SUBSCRIPTS("x = a[1:2, ::3], a[::2], a[1:], a[:-1], a[i][j]\n"),
    ATTRIBUTES("x = a.b.c(d).e\n"),
    COLLECTIONS("x = [1, 2,], (), (1,), {1, 2}, {}, {'a': 1, **b}, [*a, *b]\n"),
    COMPREHENSIONS(
        "a = [x for x in y if x]\nb = {k: v for k, v in items}\nc = {x for x in y}\n"
            + "d = (x for x in y for z in x if z if not x)\n"),
    STRINGS("x = 'a' \"b\"\ny = r'\\d' + b'x' + u'u' + f'{a[\"k\"]!r}'\nz = '''m\nl'''\n"),
    CONCATENATED_ACROSS_LINES("x = ('a'\n     'b')\n"),
    NUMBERS("x = 0o17 + 0xFF + 1_000 + 1e10 + 3.14j + .5\n"),
    YIELDS("def g():\n    yield\n    yield a, b\n    x = yield from c\n    y = (yield)\n"),
    STARRED_RETURN("def f():\n    return *a, b\n"),
    STARRED_FOR("for x in *a, *b:\n    pass\n"),
    WITH_YIELD("def f():\n    with (yield):\n        pass\n    with ( yield x ) as y: pass\n"),
    ELLIPSIS("x = ...\n"),
    WEIRD_SPACING("x   =   f (  a  ,  b  )  [  0  ]  .  c\n");

    final String source;

    Source(String source) {
      this.source = source;
    }
  }

  @Test
  public void testRoundTrip(@TestParameter Source source) throws Exception {
    Module module = Module.parse(source.source);
    assertThat(module.getCode()).isEqualTo(source.source);
  }

  @Test
  public void testWhitespaceIsOwnedOnce(@TestParameter Source source) throws Exception {
    String code = source.source;
    Module module = Module.parse(code);
    ImmutableMap<Node, CodeRange> positions = module.computePositions();
    int[] lineStarts = lineStarts(code);

    // Characters belonging to semantic tokens.
    boolean[] inToken = new boolean[code.length()];
    for (Token token : Tokenizer.tokenize(code, ParserConfig.DEFAULT)) {
      if (!WHITESPACE_TOKENS.contains(token.getKind())) {
        mark(
            inToken,
            offset(lineStarts, code, token.getStart()),
            offset(lineStarts, code, token.getEnd()));
      }
    }

    // Characters generated by whitespace nodes, counting nested nodes once.
    List<CodeRange> owned = new ArrayList<>();
    module.visit(
        new CstVisitor() {
          @Override
          public boolean onVisit(Node node) {
            switch (node.kind()) {
              case SIMPLE_WHITESPACE:
              case PARENTHESIZED_WHITESPACE:
              case TRAILING_WHITESPACE:
              case EMPTY_LINE:
                owned.add(positions.get(node));
                return false;
              default:
                return true;
            }
          }
        });
    int[] owners = new int[code.length()];
    int ownedLength = 0;
    for (CodeRange range : owned) {
      int start = offset(lineStarts, code, range.start());
      int end = offset(lineStarts, code, range.end());
      ownedLength += end - start;
      for (int i = start; i < end; i++) {
        owners[i]++;
      }
    }

    int whitespaceLength = 0;
    int regeneratedIndent = 0;
    for (int i = 0; i < code.length(); i++) {
      assertThat(owners[i]).isAtMost(1);
      if (inToken[i]) {
        assertThat(owners[i]).isEqualTo(0);
        continue;
      }
      whitespaceLength++;
      if (owners[i] == 0) {
        // Only block indentation is left to the statements, which regenerate it.
        assertThat(isLeadingIndent(code, i)).isTrue();
        regeneratedIndent++;
      }
    }
    assertThat(ownedLength).isEqualTo(whitespaceLength - regeneratedIndent);
  }

  private static final ImmutableSet<TokenKind> WHITESPACE_TOKENS =
      ImmutableSet.of(TokenKind.NEWLINE, TokenKind.INDENT, TokenKind.DEDENT, TokenKind.ENDMARKER);

  private static int[] lineStarts(String code) {
    ImmutableList<String> lines = ParseInput.splitLines(code);
    int[] starts = new int[lines.size()];
    int offset = 0;
    for (int i = 0; i < lines.size(); i++) {
      starts[i] = offset;
      offset += lines.get(i).length();
    }
    return starts;
  }

  // Positions past the end, such as a newline the parser appended, are clamped.
  private static int offset(int[] lineStarts, String code, CodePosition position) {
    if (position.line() > lineStarts.length) {
      return code.length();
    }
    return Math.min(code.length(), lineStarts[position.line() - 1] + position.column());
  }

  private static void mark(boolean[] chars, int start, int end) {
    for (int i = start; i < end; i++) {
      chars[i] = true;
    }
  }

  private static boolean isLeadingIndent(String code, int i) {
    for (int j = i; j >= 0; j--) {
      char c = code.charAt(j);
      if (c == '\n' || c == '\r') {
        return j < i;
      }
      if (c != ' ' && c != '\t' && c != '\f') {
        return false;
      }
    }
    return true;
  }

  @Test
  public void testIndependentParsesAreDeeplyEqual(@TestParameter Source source)
      throws Exception {
    Module a = Module.parse(source.source);
    Module b = Module.parse(source.source);
    assertThat(a.deepEquals(b)).isTrue();
    assertThat(a.deepClone().deepEquals(a)).isTrue();
  }

  @Test
  public void testAssignmentShape() throws Exception {
    Module module = Module.parse("x = 1\n");
    SimpleStatementLine line = (SimpleStatementLine) module.getBody().get(0);
    AssignStatement assign = (AssignStatement) line.getBody().get(0);
    assertThat(((Name) assign.getTargets().get(0).getTarget()).getValue()).isEqualTo("x");
    assertThat(((IntLiteral) assign.getValue()).getValue()).isEqualTo("1");
  }

  @Test
  public void testModuleHeaderAndFooter() throws Exception {
    Module module = Module.parse("# a\n\nx\n\n# b\n");
    assertThat(module.getHeader()).hasSize(2);
    assertThat(module.getHeader().get(0).getComment().getValue()).isEqualTo("# a");
    assertThat(module.getFooter()).hasSize(2);
    assertThat(module.getFooter().get(1).getComment().getValue()).isEqualTo("# b");
    assertThat(((SimpleStatementLine) module.getBody().get(0)).getLeadingLines()).isEmpty();
  }

  @Test
  public void testDefaultIndentIsTakenFromFirstBlock() throws Exception {
    Module module = Module.parse("if a:\n  b\nif c:\n    d\n");
    assertThat(module.getDefaultIndent()).isEqualTo("  ");
    IndentedBlock first = (IndentedBlock) ((IfStatement) module.getBody().get(0)).getBody();
    IndentedBlock second = (IndentedBlock) ((IfStatement) module.getBody().get(1)).getBody();
    assertThat(first.getIndent()).isNull();
    assertThat(second.getIndent()).isEqualTo("    ");
  }

  @Test
  public void testConfiguredDefaults() throws Exception {
    ParserConfig config =
        ParserConfig.builder().defaultIndent("\t").defaultNewline("\r\n").build();
    Module module = Module.parse("if a:\n    b\n", config);
    assertThat(module.getDefaultIndent()).isEqualTo("\t");
    assertThat(module.getDefaultNewline()).isEqualTo("\r\n");
    assertThat(module.getCode()).isEqualTo("if a:\n    b\n");
  }

  @Test
  public void testDetectedDefaults() throws Exception {
    Module module = Module.parse("x = 1\r\n");
    assertThat(module.getDefaultNewline()).isEqualTo("\r\n");
    assertThat(module.getDefaultIndent()).isEqualTo("    ");
    assertThat(module.hasTrailingNewline()).isTrue();
    assertThat(Module.parse("x").hasTrailingNewline()).isFalse();
  }

  @Test
  public void testElifIsNestedIf() throws Exception {
    IfStatement stmt = (IfStatement) Statement.parse("if a:\n    pass\nelif b:\n    pass\n");
    assertThat(stmt.getOrelse()).isInstanceOf(IfStatement.class);
  }

  @Test
  public void testComparisonOperators() throws Exception {
    Comparison comparison = (Comparison) Expression.parse("a not in b is not c");
    assertThat(comparison.getComparisons()).hasSize(2);
    assertThat(comparison.getComparisons().get(0).getOperator().getOperator())
        .isEqualTo(TokenKind.NOT_IN);
    assertThat(comparison.getComparisons().get(1).getOperator().getOperator())
        .isEqualTo(TokenKind.IS_NOT);
  }

  @Test
  public void testParenthesesBelongToExpression() throws Exception {
    Expression e = Expression.parse("((a))");
    assertThat(e).isInstanceOf(Name.class);
    assertThat(e.getLpar()).hasSize(2);
    assertThat(e.getRpar()).hasSize(2);
  }

  @Test
  public void testKeywordArgument() throws Exception {
    Call call = (Call) Expression.parse("f(a, key = 1)");
    assertThat(call.getArgs()).hasSize(2);
    assertThat(call.getArgs().get(0).getKeyword()).isNull();
    assertThat(call.getArgs().get(1).getKeyword().getValue()).isEqualTo("key");
  }

  @Test
  public void testStatementKeepsLeadingLines() throws Exception {
    Statement stmt = Statement.parse("# c\nx = 1\n");
    assertThat(stmt.getLeadingLines()).hasSize(1);
  }

  @Test
  public void testStatementRejectsTrailingStatement() {
    assertThrows(UnexpectedTokenException.class, () -> Statement.parse("x = 1\ny = 2\n"));
  }

  @Test
  public void testExpressionRejectsTrailingTokens() {
    UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class, () -> Expression.parse("a b"));
    assertThat(e.getExpected()).containsExactly(TokenKind.NEWLINE.toString());
    assertThat(e.getColumn()).isEqualTo(2);
  }

  // --- errors ---

  @Test
  public void testUnclosedParenthesis() {
    UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class, () -> Module.parse("x = (1,\n"));
    assertThat(e.getExpected()).containsExactly(")");
    assertThat(e.getFound().getKind()).isEqualTo(TokenKind.ENDMARKER);
  }

  @Test
  public void testInvalidAssignmentTarget() {
    UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class, () -> Module.parse("x = 1\n1 = x\n"));
    assertThat(e.getExpected()).containsExactly("assignment target");
    assertThat(e.getLine()).isEqualTo(2);
    assertThat(e.getColumn()).isEqualTo(0);
    assertThat(e.getSourceLine()).isEqualTo("1 = x");
  }

  @Test
  public void testPositionalArgumentAfterKeyword() {
    UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class, () -> Module.parse("f(a=1, b)\n"));
    assertThat(e.getExpected()).containsExactly("keyword argument");
    assertThat(e.getColumn()).isEqualTo(7);
  }

  @Test
  public void testBareStarNeedsKeywordOnlyParameter() {
    UnexpectedTokenException e =
        assertThrows(
            UnexpectedTokenException.class, () -> Module.parse("def f(*,):\n    pass\n"));
    assertThat(e.getExpected()).containsExactly("keyword-only parameter");
  }

  @Test
  public void testMissingIndentedBlock() {
    UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class, () -> Module.parse("if x:\npass\n"));
    assertThat(e.getExpected()).containsExactly("indented block");
    assertThat(e.getLine()).isEqualTo(2);
  }

  @Test
  public void testUnexpectedIndent() {
    IndentationException e =
        assertThrows(IndentationException.class, () -> Module.parse("  x = 1\n"));
    assertThat(e.getRawMessage()).isEqualTo("unexpected indent");
  }

  @Test
  public void testTryNeedsHandlerOrFinally() {
    assertThrows(UnexpectedTokenException.class, () -> Module.parse("try:\n    pass\nx\n"));
  }

  @Test
  public void testMixedBytesAndStrings() {
    UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class, () -> Module.parse("x = 'a' b'c'\n"));
    assertThat(e.getExpected()).containsExactly("string literal");
  }

  @Test
  public void testErrorMessageShowsLocationAndCaret() {
    UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class, () -> Module.parse("x = = 1\n"));
    assertThat(e.getMessage()).startsWith("Syntax Error @ 1:5.\n");
    assertThat(e.getMessage()).endsWith("\n\nx = = 1\n    ^");
  }

  // --- grammar versions ---

  @Test
  public void testWalrusNeedsPython38() throws Exception {
    assertThrows(UnexpectedTokenException.class, () -> Module.parse("(x := 1)\n", PY37));
    Expression e = Expression.parse("(x := 1)", PY38);
    assertThat(e).isInstanceOf(NamedExpression.class);
  }

  @Test
  public void testPositionalOnlyNeedsPython38() throws Exception {
    String source = "def f(a, /):\n    pass\n";
    assertThrows(UnexpectedTokenException.class, () -> Module.parse(source, PY37));
    assertThat(Module.parse(source, PY38).getCode()).isEqualTo(source);
  }

  @Test
  public void testStarredReturnNeedsPython38() throws Exception {
    String source = "def f():\n    return *a, b\n";
    assertThrows(UnexpectedTokenException.class, () -> Module.parse(source, PY37));
    assertThat(Module.parse(source, PY38).getCode()).isEqualTo(source);
  }

  @Test
  public void testRelaxedDecoratorsNeedPython39() throws Exception {
    String source = "@a.b[0]\ndef f(): pass\n";
    assertThrows(UnexpectedTokenException.class, () -> Module.parse(source, PY38));
    assertThat(Module.parse(source).getCode()).isEqualTo(source);
  }

  @Test
  public void testDottedDecoratorCallBeforePython39() throws Exception {
    String source = "@a.b(1)\ndef f(): pass\n";
    assertThat(Module.parse(source, PY38).getCode()).isEqualTo(source);
  }

  @Test
  public void testStarredForIterableNeedsPython39() throws Exception {
    String source = "for x in *a, b:\n    pass\n";
    assertThrows(UnexpectedTokenException.class, () -> Module.parse(source, PY38));
    ForStatement loop = (ForStatement) Module.parse(source).getBody().get(0);
    TupleExpression iter = (TupleExpression) loop.getIter();
    assertThat(iter.getElements().get(0)).isInstanceOf(StarredElement.class);
  }

  @Test
  public void testParenthesizedYieldIsNotAWithItemList() throws Exception {
    String source = "def f():\n    with (yield):\n        pass\n";
    FunctionDef def = (FunctionDef) Module.parse(source).getBody().get(0);
    WithStatement with = (WithStatement) ((IndentedBlock) def.getBody()).getBody().get(0);
    assertThat(with.getLpar()).isNull();
    Expression item = with.getItems().get(0).getItem();
    assertThat(item).isInstanceOf(Yield.class);
    assertThat(item.isParenthesized()).isTrue();
  }

  @Test
  public void testExceptStarNeedsPython311() throws Exception {
    String source = "try:\n    pass\nexcept* E:\n    pass\n";
    assertThrows(UnexpectedTokenException.class, () -> Module.parse(source, PY310));
    TryStatement stmt = (TryStatement) Module.parse(source).getBody().get(0);
    assertThat(stmt.getHandlers().get(0).isStar()).isTrue();
  }

  @Test
  public void testMixedExceptAndExceptStar() {
    assertThrows(
        UnexpectedTokenException.class,
        () -> Module.parse("try:\n    pass\nexcept* A:\n    pass\nexcept B:\n    pass\n"));
  }

  // --- encodings ---

  @Test
  public void testByteOrderMark() throws Exception {
    byte[] body = "x = 1\n".getBytes(UTF_8);
    byte[] source = new byte[body.length + 3];
    source[0] = (byte) 0xef;
    source[1] = (byte) 0xbb;
    source[2] = (byte) 0xbf;
    System.arraycopy(body, 0, source, 3, body.length);
    Module module = Module.parse(source, ParserConfig.DEFAULT);
    assertThat(module.getEncoding()).isEqualTo("utf-8-sig");
    assertThat(module.getCode()).isEqualTo("x = 1\n");
    assertThat(module.getBytes()).isEqualTo(source);
  }

  @Test
  public void testCodingDeclaration() throws Exception {
    byte[] source = "# -*- coding: latin-1 -*-\nx = '\u00e9'\n".getBytes(ISO_8859_1);
    Module module = Module.parse(source, ParserConfig.DEFAULT);
    assertThat(module.getEncoding()).isEqualTo("latin-1");
    assertThat(module.getBytes()).isEqualTo(source);
  }

  @Test
  public void testUndecodableBytes() {
    byte[] source = {(byte) 0xff, 'x', '\n'};
    assertThrows(EncodingException.class, () -> Module.parse(source, ParserConfig.DEFAULT));
  }
}
