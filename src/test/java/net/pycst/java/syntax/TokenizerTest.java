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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Tokenizer}. */
@RunWith(JUnit4.class)
public final class TokenizerTest {

  private static ImmutableList<Token> tokens(String source) throws ParseException {
    return Tokenizer.tokenize(source, ParserConfig.DEFAULT);
  }

  /** Returns the kinds of the tokens of {@code source}, separated by spaces. */
  private static String kinds(String source) throws ParseException {
    List<String> names = new ArrayList<>();
    for (Token token : tokens(source)) {
      names.add(token.getKind().name());
    }
    return Joiner.on(' ').join(names);
  }

  @Test
  public void testSimpleStatement() throws Exception {
    assertThat(kinds("x = 1\n")).isEqualTo("NAME EQUALS NUMBER NEWLINE ENDMARKER");
  }

  @Test
  public void testMissingTrailingNewlineIsSupplied() throws Exception {
    assertThat(kinds("x")).isEqualTo("NAME NEWLINE ENDMARKER");
  }

  @Test
  public void testEmptyInput() throws Exception {
    assertThat(kinds("")).isEqualTo("ENDMARKER");
  }

  @Test
  public void testBlankAndCommentLinesProduceNoTokens() throws Exception {
    assertThat(kinds("# comment\n\n   \nx\n")).isEqualTo("NAME NEWLINE ENDMARKER");
  }

  @Test
  public void testIndentAndDedent() throws Exception {
    assertThat(kinds("if x:\n  y\nz\n"))
        .isEqualTo("IF NAME COLON NEWLINE INDENT NAME NEWLINE DEDENT NAME NEWLINE ENDMARKER");
  }

  @Test
  public void testDedentsAreClosedAtEndOfInput() throws Exception {
    assertThat(kinds("if a:\n if b:\n  c\n"))
        .isEqualTo(
            "IF NAME COLON NEWLINE INDENT IF NAME COLON NEWLINE INDENT NAME NEWLINE DEDENT DEDENT"
                + " ENDMARKER");
  }

  @Test
  public void testIndentRecordsRelativeIndentation() throws Exception {
    ImmutableList<Token> tokens = tokens("if x:\n\ty\n");
    Token indent = tokens.get(4);
    assertThat(indent.getKind()).isEqualTo(TokenKind.INDENT);
    assertThat(indent.getRelativeIndent()).isEqualTo("\t");
  }

  @Test
  public void testNewlinesInsideBracketsAreIgnored() throws Exception {
    assertThat(kinds("f(a,\n  b)\n"))
        .isEqualTo("NAME LPAREN NAME COMMA NAME RPAREN NEWLINE ENDMARKER");
    assertThat(kinds("x = [\n\n1,\n]\n"))
        .isEqualTo("NAME EQUALS LBRACKET NUMBER COMMA RBRACKET NEWLINE ENDMARKER");
  }

  @Test
  public void testBackslashContinuation() throws Exception {
    assertThat(kinds("x = 1 + \\\n    2\n"))
        .isEqualTo("NAME EQUALS NUMBER PLUS NUMBER NEWLINE ENDMARKER");
  }

  @Test
  public void testOperators() throws Exception {
    assertThat(kinds("a **= b // c -> d := e ... f != g\n"))
        .isEqualTo(
            "NAME STAR_STAR_EQUALS NAME SLASH_SLASH NAME RARROW NAME COLON_EQUALS NAME ELLIPSIS"
                + " NAME NOT_EQUALS NAME NEWLINE ENDMARKER");
  }

  @Test
  public void testKeywords() throws Exception {
    assertThat(kinds("async def await not in is lambda\n"))
        .isEqualTo("ASYNC DEF AWAIT NOT IN IS LAMBDA NEWLINE ENDMARKER");
  }

  @Test
  public void testNumbers() throws Exception {
    ImmutableList<Token> tokens = tokens("0x1F 1_000 1.5e-3 2j .5\n");
    List<String> texts = new ArrayList<>();
    for (Token token : tokens.subList(0, 5)) {
      assertThat(token.getKind()).isEqualTo(TokenKind.NUMBER);
      texts.add(token.getText());
    }
    assertThat(texts).containsExactly("0x1F", "1_000", "1.5e-3", "2j", ".5").inOrder();
  }

  @Test
  public void testStrings() throws Exception {
    ImmutableList<Token> tokens = tokens("rb'a' f\"b\" '''c\nd''' u'e'\n");
    assertThat(tokens.get(0).getText()).isEqualTo("rb'a'");
    assertThat(tokens.get(1).getText()).isEqualTo("f\"b\"");
    assertThat(tokens.get(2).getText()).isEqualTo("'''c\nd'''");
    assertThat(tokens.get(3).getText()).isEqualTo("u'e'");
    assertThat(tokens.get(4).getKind()).isEqualTo(TokenKind.NEWLINE);
  }

  @Test
  public void testNameThatLooksLikeAPrefix() throws Exception {
    assertThat(kinds("rb = br\n")).isEqualTo("NAME EQUALS NAME NEWLINE ENDMARKER");
  }

  @Test
  public void testUnterminatedStringIsAnErrorToken() throws Exception {
    assertThat(kinds("'abc\n")).isEqualTo("ERRORTOKEN NEWLINE ENDMARKER");
  }

  @Test
  public void testPositions() throws Exception {
    ImmutableList<Token> tokens = tokens("x = (1,\n  2)\n");
    Token two = tokens.get(5);
    assertThat(two.getText()).isEqualTo("2");
    assertThat(two.getStart()).isEqualTo(CodePosition.create(2, 2));
    assertThat(two.getEnd()).isEqualTo(CodePosition.create(2, 3));
  }

  @Test
  public void testInconsistentDedent() {
    IndentationException e =
        assertThrows(IndentationException.class, () -> tokens("if x:\n    a\n  b\n"));
    assertThat(e.getRawMessage())
        .isEqualTo("unindent does not match any outer indentation level");
    assertThat(e.getLine()).isEqualTo(3);
    assertThat(e.getSourceLine()).isEqualTo("  b");
  }

  @Test
  public void testTokensArePulledOnDemand() throws Exception {
    Tokenizer tokenizer = Tokenizer.create("a\n", ParserConfig.DEFAULT);
    assertThat(tokenizer.hasNext()).isTrue();
    assertThat(tokenizer.nextToken().getKind()).isEqualTo(TokenKind.NAME);
    assertThat(tokenizer.nextToken().getKind()).isEqualTo(TokenKind.NEWLINE);
    assertThat(tokenizer.nextToken().getKind()).isEqualTo(TokenKind.ENDMARKER);
    assertThat(tokenizer.hasNext()).isFalse();
    assertThrows(IllegalStateException.class, tokenizer::nextToken);
  }

  @Test
  public void testAdjacentTokensShareWhitespace() throws Exception {
    ImmutableList<Token> tokens = tokens("a  +b\n");
    assertThat(tokens.get(0).whitespaceAfter).isSameInstanceAs(tokens.get(1).whitespaceBefore);
    assertThat(tokens.get(1).whitespaceAfter).isSameInstanceAs(tokens.get(2).whitespaceBefore);
  }

  @Test
  public void testTokenizeBytesUsesCodingDeclaration() throws Exception {
    byte[] source = "# -*- coding: latin-1 -*-\ns = '\u00e9'\n".getBytes(ISO_8859_1);
    ImmutableList<Token> tokens = Tokenizer.tokenize(source, ParserConfig.DEFAULT);
    assertThat(tokens.get(2).getKind()).isEqualTo(TokenKind.STRING);
    assertThat(tokens.get(2).getText()).isEqualTo("'\u00e9'");
  }

  @Test
  public void testTokenizeBytesSkipsByteOrderMark() throws Exception {
    byte[] source = "\ufeffx\n".getBytes(UTF_8);
    Tokenizer tokenizer = Tokenizer.create(source, ParserConfig.DEFAULT);
    Token first = tokenizer.nextToken();
    assertThat(first.getText()).isEqualTo("x");
    assertThat(first.getStart()).isEqualTo(CodePosition.create(1, 0));
  }

  @Test
  public void testUndecodableByteColumnCountsCharacters() {
    byte[] prefix = "x = 1\n\u00e9 = 1 ".getBytes(UTF_8);
    byte[] source = Arrays.copyOf(prefix, prefix.length + 2);
    source[prefix.length] = (byte) 0xff;
    source[prefix.length + 1] = '\n';
    EncodingException e =
        assertThrows(
            EncodingException.class, () -> Tokenizer.tokenize(source, ParserConfig.DEFAULT));
    assertThat(e.getLine()).isEqualTo(2);
    // The accented letter is two bytes but one column.
    assertThat(e.getColumn()).isEqualTo(6);
  }
}
