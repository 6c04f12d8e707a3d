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
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * The decoded source of one parse together with everything detected from it: the split lines
 * the whitespace parser reads, the default newline, whether the text ended in a newline, and the
 * encoding.
 */
final class ParseInput {

  static final String UTF8_SIG = "utf-8-sig";

  private static final Pattern CODING_COOKIE =
      Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");
  private static final Pattern BLANK_OR_COMMENT = Pattern.compile("^[ \\t\\f]*(?:[#\\r\\n]|$)");
  private static final Pattern NEWLINE = Pattern.compile("\\r\\n?|\\n");

  final String source;
  final ImmutableList<String> lines;
  final String defaultNewline;
  @Nullable final String defaultIndent;
  final boolean hasTrailingNewline;
  final String encoding;
  final PythonVersion version;

  private ParseInput(String text, String encoding, ParserConfig config) {
    Matcher m = NEWLINE.matcher(text);
    String newline = config.defaultNewline();
    if (newline == null) {
      newline = m.find() ? m.group() : "\n";
    }
    boolean trailing = text.endsWith("\n") || text.endsWith("\r");
    this.source = trailing ? text : text + newline;
    this.lines = splitLines(source);
    this.defaultNewline = newline;
    this.defaultIndent = config.defaultIndent();
    this.hasTrailingNewline = trailing;
    this.encoding = encoding;
    this.version = config.pythonVersion();
  }

  static ParseInput of(String text, ParserConfig config) {
    String encoding = config.encoding();
    if (encoding == null) {
      encoding = detectCookie(text);
    }
    return new ParseInput(text, encoding == null ? "utf-8" : encoding, config);
  }

  static ParseInput of(byte[] bytes, ParserConfig config) throws EncodingException {
    int offset = 0;
    String encoding = config.encoding();
    if (encoding == null) {
      if (bytes.length >= 3
          && (bytes[0] & 0xff) == 0xef
          && (bytes[1] & 0xff) == 0xbb
          && (bytes[2] & 0xff) == 0xbf) {
        encoding = UTF8_SIG;
        offset = 3;
      } else {
        // Coding declarations are ASCII, so any ASCII-compatible view finds them.
        encoding = detectCookie(new String(bytes, StandardCharsets.ISO_8859_1));
        if (encoding == null) {
          encoding = "utf-8";
        }
      }
    }
    return new ParseInput(decode(bytes, offset, encoding), encoding, config);
  }

  /** Returns the 1-based line {@code n} including its line ending, or "" past the end. */
  String line(int n) {
    return n >= 1 && n <= lines.size() ? lines.get(n - 1) : "";
  }

  /** Returns the Java charset for a Python encoding name. */
  static Charset charsetFor(String encoding) {
    String name = encoding.toLowerCase(Locale.ROOT).replace('_', '-');
    if (name.equals("utf-8") || name.equals("utf8") || name.equals(UTF8_SIG)) {
      return StandardCharsets.UTF_8;
    }
    if (name.equals("latin-1") || name.equals("iso-8859-1") || name.equals("iso-latin-1")) {
      return StandardCharsets.ISO_8859_1;
    }
    return Charset.forName(encoding);
  }

  private static String decode(byte[] bytes, int offset, String encoding)
      throws EncodingException {
    Charset charset;
    try {
      charset = charsetFor(encoding);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
      throw new EncodingException(
          "unknown encoding: " + encoding, encoding, CodePosition.create(1, 0));
    }
    CharsetDecoder decoder =
        charset
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    ByteBuffer in = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
    try {
      CharBuffer out = decoder.decode(in);
      return out.toString();
    } catch (CharacterCodingException e) {
      throw new EncodingException(
          "invalid " + encoding + " byte sequence: " + e.getMessage(),
          encoding,
          errorPosition(bytes, offset, in.position(), charset));
    }
  }

  /**
   * Returns the position of the undecodable byte at {@code errorOffset}. Like every other column,
   * the column counts UTF-16 units, here of the valid text that precedes the error on its line.
   */
  private static CodePosition errorPosition(
      byte[] bytes, int textStart, int errorOffset, Charset charset) {
    int line = 1;
    int lineStart = textStart;
    for (int i = textStart; i < errorOffset && i < bytes.length; i++) {
      boolean loneReturn = bytes[i] == '\r' && (i + 1 >= bytes.length || bytes[i + 1] != '\n');
      if (bytes[i] == '\n' || loneReturn) {
        line++;
        lineStart = i + 1;
      }
    }
    int length = Math.max(0, errorOffset - lineStart);
    return CodePosition.create(line, new String(bytes, lineStart, length, charset).length());
  }

  @Nullable
  private static String detectCookie(String text) {
    ImmutableList<String> firstLines = splitLines(text);
    for (int i = 0; i < 2 && i < firstLines.size(); i++) {
      String line = firstLines.get(i);
      Matcher m = CODING_COOKIE.matcher(line);
      if (m.find()) {
        return m.group(1);
      }
      if (!BLANK_OR_COMMENT.matcher(line).find()) {
        break;
      }
    }
    return null;
  }

  /**
   * Splits text after each line ending, keeping the endings. Text ending in a newline yields a
   * final empty line.
   */
  static ImmutableList<String> splitLines(String text) {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    int start = 0;
    int n = text.length();
    for (int i = 0; i < n; i++) {
      char c = text.charAt(i);
      if (c == '\n' || c == '\r') {
        if (c == '\r' && i + 1 < n && text.charAt(i + 1) == '\n') {
          i++;
        }
        lines.add(text.substring(start, i + 1));
        start = i + 1;
      }
    }
    lines.add(text.substring(start));
    return lines.build();
  }
}
