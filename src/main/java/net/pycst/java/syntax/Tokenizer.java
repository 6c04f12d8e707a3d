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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A scanner for Python source. Tokens are produced lazily, one {@link #nextToken} call at a time,
 * and each carries the whitespace cursors that let the parser attach the text between tokens to
 * exactly one node.
 *
 * <p>Newlines and indentation inside brackets are insignificant. Blank and comment-only lines
 * produce no tokens; their text is recovered later from the whitespace cursors.
 */
public final class Tokenizer {

  private final ParseInput input;
  private final char[] buffer;
  private int pos;
  private int line = 1;
  private int lineStart = 0;

  // The stack of enclosing indentation strings. The first element is always "".
  private final List<String> indents = new ArrayList<>();

  // Unclosed open brackets, innermost last.
  private final ArrayDeque<Character> brackets = new ArrayDeque<>();

  // Tokens scanned but not yet handed out.
  private final ArrayDeque<Token> pending = new ArrayDeque<>();

  private boolean atLineStart = true;
  private boolean finished;
  private WhitespaceState whitespace = new WhitespaceState(1, 0, "", false);

  private static final Map<String, TokenKind> keywordMap = new HashMap<>();

  static {
    keywordMap.put("and", TokenKind.AND);
    keywordMap.put("as", TokenKind.AS);
    keywordMap.put("assert", TokenKind.ASSERT);
    keywordMap.put("async", TokenKind.ASYNC);
    keywordMap.put("await", TokenKind.AWAIT);
    keywordMap.put("break", TokenKind.BREAK);
    keywordMap.put("class", TokenKind.CLASS);
    keywordMap.put("continue", TokenKind.CONTINUE);
    keywordMap.put("def", TokenKind.DEF);
    keywordMap.put("del", TokenKind.DEL);
    keywordMap.put("elif", TokenKind.ELIF);
    keywordMap.put("else", TokenKind.ELSE);
    keywordMap.put("except", TokenKind.EXCEPT);
    keywordMap.put("finally", TokenKind.FINALLY);
    keywordMap.put("for", TokenKind.FOR);
    keywordMap.put("from", TokenKind.FROM);
    keywordMap.put("global", TokenKind.GLOBAL);
    keywordMap.put("if", TokenKind.IF);
    keywordMap.put("import", TokenKind.IMPORT);
    keywordMap.put("in", TokenKind.IN);
    keywordMap.put("is", TokenKind.IS);
    keywordMap.put("lambda", TokenKind.LAMBDA);
    keywordMap.put("nonlocal", TokenKind.NONLOCAL);
    keywordMap.put("not", TokenKind.NOT);
    keywordMap.put("or", TokenKind.OR);
    keywordMap.put("pass", TokenKind.PASS);
    keywordMap.put("raise", TokenKind.RAISE);
    keywordMap.put("return", TokenKind.RETURN);
    keywordMap.put("try", TokenKind.TRY);
    keywordMap.put("while", TokenKind.WHILE);
    keywordMap.put("with", TokenKind.WITH);
    keywordMap.put("yield", TokenKind.YIELD);
  }

  // Operators, longest first within each length.
  private static final ImmutableMap<String, TokenKind> OPERATORS =
      ImmutableMap.<String, TokenKind>builder()
          .put("**=", TokenKind.STAR_STAR_EQUALS)
          .put("//=", TokenKind.SLASH_SLASH_EQUALS)
          .put(">>=", TokenKind.GREATER_GREATER_EQUALS)
          .put("<<=", TokenKind.LESS_LESS_EQUALS)
          .put("...", TokenKind.ELLIPSIS)
          .put("->", TokenKind.RARROW)
          .put(":=", TokenKind.COLON_EQUALS)
          .put("==", TokenKind.EQUALS_EQUALS)
          .put("!=", TokenKind.NOT_EQUALS)
          .put("<=", TokenKind.LESS_EQUALS)
          .put(">=", TokenKind.GREATER_EQUALS)
          .put("<<", TokenKind.LESS_LESS)
          .put(">>", TokenKind.GREATER_GREATER)
          .put("**", TokenKind.STAR_STAR)
          .put("//", TokenKind.SLASH_SLASH)
          .put("+=", TokenKind.PLUS_EQUALS)
          .put("-=", TokenKind.MINUS_EQUALS)
          .put("*=", TokenKind.STAR_EQUALS)
          .put("/=", TokenKind.SLASH_EQUALS)
          .put("%=", TokenKind.PERCENT_EQUALS)
          .put("&=", TokenKind.AMPERSAND_EQUALS)
          .put("|=", TokenKind.PIPE_EQUALS)
          .put("^=", TokenKind.CARET_EQUALS)
          .put("@=", TokenKind.AT_EQUALS)
          .put("+", TokenKind.PLUS)
          .put("-", TokenKind.MINUS)
          .put("*", TokenKind.STAR)
          .put("/", TokenKind.SLASH)
          .put("%", TokenKind.PERCENT)
          .put("@", TokenKind.AT)
          .put("&", TokenKind.AMPERSAND)
          .put("|", TokenKind.PIPE)
          .put("^", TokenKind.CARET)
          .put("~", TokenKind.TILDE)
          .put("<", TokenKind.LESS)
          .put(">", TokenKind.GREATER)
          .put("(", TokenKind.LPAREN)
          .put(")", TokenKind.RPAREN)
          .put("[", TokenKind.LBRACKET)
          .put("]", TokenKind.RBRACKET)
          .put("{", TokenKind.LBRACE)
          .put("}", TokenKind.RBRACE)
          .put(",", TokenKind.COMMA)
          .put(":", TokenKind.COLON)
          .put(";", TokenKind.SEMI)
          .put(".", TokenKind.DOT)
          .put("=", TokenKind.EQUALS)
          .buildOrThrow();

  Tokenizer(ParseInput input) {
    this.input = input;
    this.buffer = input.source.toCharArray();
    indents.add("");
  }

  /** Returns a tokenizer over {@code source}, normalized according to {@code config}. */
  public static Tokenizer create(String source, ParserConfig config) {
    return new Tokenizer(ParseInput.of(source, config));
  }

  /**
   * Returns a tokenizer over {@code source} decoded with the configured encoding, else the one
   * declared by a byte order mark or coding comment, else UTF-8.
   *
   * @throws EncodingException if the bytes cannot be decoded
   */
  public static Tokenizer create(byte[] source, ParserConfig config) throws EncodingException {
    return new Tokenizer(ParseInput.of(source, config));
  }

  /** Tokenizes all of {@code source}, ending with an ENDMARKER token. */
  public static ImmutableList<Token> tokenize(String source, ParserConfig config)
      throws ParseException {
    return drain(create(source, config));
  }

  /** Decodes and tokenizes all of {@code source}, ending with an ENDMARKER token. */
  public static ImmutableList<Token> tokenize(byte[] source, ParserConfig config)
      throws ParseException {
    return drain(create(source, config));
  }

  private static ImmutableList<Token> drain(Tokenizer tokenizer) throws ParseException {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    while (tokenizer.hasNext()) {
      tokens.add(tokenizer.nextToken());
    }
    return tokens.build();
  }

  ParseInput getInput() {
    return input;
  }

  /** Reports whether another token, possibly ENDMARKER, remains. */
  public boolean hasNext() {
    return !finished || !pending.isEmpty();
  }

  /**
   * Returns the next token. It is an error to call this after ENDMARKER has been returned.
   *
   * @throws IndentationException if the next logical line is badly indented
   */
  public Token nextToken() throws IndentationException {
    while (pending.isEmpty()) {
      if (finished) {
        throw new IllegalStateException("nextToken called after ENDMARKER");
      }
      scan();
    }
    Token token = pending.poll();
    token.whitespaceBefore = whitespace;
    switch (token.getKind()) {
      case INDENT:
      case DEDENT:
      case ENDMARKER:
        break;
      default:
        whitespace =
            new WhitespaceState(
                token.getEnd().line(),
                token.getEnd().column(),
                indents.get(indents.size() - 1),
                !brackets.isEmpty());
    }
    token.whitespaceAfter = whitespace;
    return token;
  }

  private CodePosition position() {
    return CodePosition.create(line, pos - lineStart);
  }

  private void addToken(TokenKind kind, int start, CodePosition startPos) {
    String text = new String(buffer, start, pos - start);
    pending.add(new Token(kind, text, startPos, position(), null));
  }

  private void addDummy(TokenKind kind, @Nullable String relativeIndent) {
    CodePosition here = position();
    pending.add(new Token(kind, "", here, here, relativeIndent));
  }

  private boolean isNewline(int c) {
    return c == '\n' || c == '\r';
  }

  // Consumes a line ending at pos and starts a new line.
  private void consumeNewline() {
    if (buffer[pos] == '\r' && peek(1) == '\n') {
      pos++;
    }
    pos++;
    line++;
    lineStart = pos;
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  /**
   * Skips blank and comment-only lines, then compares the indentation of the next logical line
   * with the enclosing block, queueing INDENT or DEDENT tokens. At end of input every open block
   * is closed.
   */
  private void computeIndentation() throws IndentationException {
    while (true) {
      int begin = pos;
      while (pos < buffer.length && isIndentChar(buffer[pos])) {
        pos++;
      }
      if (pos < buffer.length && buffer[pos] == '#') {
        while (pos < buffer.length && !isNewline(buffer[pos])) {
          pos++;
        }
      }
      if (pos >= buffer.length) {
        while (indents.size() > 1) {
          indents.remove(indents.size() - 1);
          addDummy(TokenKind.DEDENT, null);
        }
        return;
      }
      if (isNewline(buffer[pos])) {
        consumeNewline();
        continue;
      }

      String indent = new String(buffer, begin, pos - begin);
      String top = indents.get(indents.size() - 1);
      if (indent.equals(top)) {
        return;
      }
      if (indent.startsWith(top)) {
        indents.add(indent);
        addDummy(TokenKind.INDENT, indent.substring(top.length()));
        return;
      }
      if (!top.startsWith(indent)) {
        throw indentationError("inconsistent use of tabs and spaces in indentation");
      }
      while (indents.size() > 1 && indents.get(indents.size() - 1).length() > indent.length()) {
        if (!indents.get(indents.size() - 1).startsWith(indent)) {
          throw indentationError("inconsistent use of tabs and spaces in indentation");
        }
        indents.remove(indents.size() - 1);
        addDummy(TokenKind.DEDENT, null);
      }
      if (!indents.get(indents.size() - 1).equals(indent)) {
        throw indentationError("unindent does not match any outer indentation level");
      }
      return;
    }
  }

  private IndentationException indentationError(String message) {
    return new IndentationException(
        message, position(), ParseException.stripNewline(input.line(line)));
  }

  /** Scans at least one token into the pending queue. */
  private void scan() throws IndentationException {
    if (atLineStart) {
      atLineStart = false;
      computeIndentation();
      if (!pending.isEmpty()) {
        return;
      }
    }

    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == ' ' || c == '\t' || c == '\f') {
        pos++;
      } else if (c == '\\' && isNewline(peek(1))) {
        pos++;
        consumeNewline();
      } else if (c == '#') {
        while (pos < buffer.length && !isNewline(buffer[pos])) {
          pos++;
        }
      } else if (isNewline(c)) {
        if (!brackets.isEmpty()) {
          consumeNewline();
          continue;
        }
        int start = pos;
        CodePosition startPos = position();
        consumeNewline();
        pending.add(
            new Token(
                TokenKind.NEWLINE,
                new String(buffer, start, pos - start),
                startPos,
                position(),
                null));
        computeIndentation();
        return;
      } else {
        scanToken(c);
        return;
      }
    }

    addDummy(TokenKind.ENDMARKER, null);
    finished = true;
  }

  private void scanToken(char c) {
    int start = pos;
    CodePosition startPos = position();

    if (c == '\'' || c == '"') {
      scanString(start, startPos);
      return;
    }
    if (isdigit(c) || (c == '.' && isdigit(peek(1)))) {
      scanNumber(c);
      addToken(TokenKind.NUMBER, start, startPos);
      return;
    }
    int cp = Character.codePointAt(buffer, pos);
    if (cp == '_' || Character.isUnicodeIdentifierStart(cp)) {
      int prefixEnd = stringPrefixEnd();
      if (prefixEnd > pos) {
        pos = prefixEnd;
        scanString(start, startPos);
        return;
      }
      while (pos < buffer.length) {
        cp = Character.codePointAt(buffer, pos);
        if (cp != '_' && !Character.isUnicodeIdentifierPart(cp)) {
          break;
        }
        pos += Character.charCount(cp);
      }
      String id = new String(buffer, start, pos - start);
      TokenKind kind = keywordMap.get(id);
      addToken(kind != null ? kind : TokenKind.NAME, start, startPos);
      return;
    }

    for (int len = 3; len >= 1; len--) {
      if (pos + len <= buffer.length) {
        TokenKind kind = OPERATORS.get(new String(buffer, pos, len));
        if (kind != null) {
          pos += len;
          updateBrackets(kind);
          addToken(kind, start, startPos);
          return;
        }
      }
    }

    pos += Character.charCount(cp);
    addToken(TokenKind.ERRORTOKEN, start, startPos);
  }

  private void updateBrackets(TokenKind kind) {
    switch (kind) {
      case LPAREN:
        brackets.add('(');
        break;
      case LBRACKET:
        brackets.add('[');
        break;
      case LBRACE:
        brackets.add('{');
        break;
      case RPAREN:
      case RBRACKET:
      case RBRACE:
        // A mismatched closer is left for the parser to reject.
        if (!brackets.isEmpty()) {
          brackets.removeLast();
        }
        break;
      default:
        break;
    }
  }

  /**
   * If a string prefix (any combination of r, b, u, f accepted by Python) followed by a quote
   * starts at pos, returns the index of the quote; otherwise returns pos.
   */
  private int stringPrefixEnd() {
    int i = pos;
    StringBuilder prefix = new StringBuilder();
    while (i < buffer.length && i - pos < 2 && "rRbBuUfF".indexOf(buffer[i]) >= 0) {
      prefix.append(Character.toLowerCase(buffer[i]));
      i++;
    }
    if (i == pos || i >= buffer.length || (buffer[i] != '\'' && buffer[i] != '"')) {
      return pos;
    }
    switch (prefix.toString()) {
      case "r":
      case "b":
      case "u":
      case "f":
      case "br":
      case "rb":
      case "fr":
      case "rf":
        return i;
      default:
        return pos;
    }
  }

  // Scans a string literal whose opening quote is at pos. An unterminated literal becomes an
  // ERRORTOKEN.
  private void scanString(int start, CodePosition startPos) {
    char quote = buffer[pos];
    boolean triple = peek(1) == quote && peek(2) == quote;
    pos += triple ? 3 : 1;
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == '\\') {
        pos++;
        if (pos < buffer.length) {
          if (isNewline(buffer[pos])) {
            consumeNewline();
          } else {
            pos++;
          }
        }
      } else if (isNewline(c)) {
        if (!triple) {
          addToken(TokenKind.ERRORTOKEN, start, startPos);
          return;
        }
        consumeNewline();
      } else if (c == quote) {
        if (!triple) {
          pos++;
          addToken(TokenKind.STRING, start, startPos);
          return;
        }
        if (peek(1) == quote && peek(2) == quote) {
          pos += 3;
          addToken(TokenKind.STRING, start, startPos);
          return;
        }
        pos++;
      } else {
        pos++;
      }
    }
    addToken(TokenKind.ERRORTOKEN, start, startPos);
  }

  // Scans an int, float or imaginary literal starting at pos.
  private void scanNumber(int c) {
    if (c == '0' && "xXoObB".indexOf(peek(1)) >= 0) {
      pos += 2;
      while (pos < buffer.length && (isxdigit(buffer[pos]) || buffer[pos] == '_')) {
        pos++;
      }
      return;
    }
    scanDigits();
    if (peek(0) == '.') {
      pos++;
      scanDigits();
    }
    if (peek(0) == 'e' || peek(0) == 'E') {
      int sign = peek(1);
      if (isdigit(sign) || ((sign == '+' || sign == '-') && isdigit(peek(2)))) {
        pos += (sign == '+' || sign == '-') ? 2 : 1;
        scanDigits();
      }
    }
    if (peek(0) == 'j' || peek(0) == 'J') {
      pos++;
    }
  }

  private void scanDigits() {
    while (pos < buffer.length && (isdigit(buffer[pos]) || buffer[pos] == '_')) {
      pos++;
    }
  }

  private static boolean isIndentChar(char c) {
    return c == ' ' || c == '\t' || c == '\f';
  }

  private static boolean isdigit(int c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isxdigit(int c) {
    return isdigit(c) || (c >= 'A' && c <= 'F') || (c >= 'a' && c <= 'f');
  }
}
