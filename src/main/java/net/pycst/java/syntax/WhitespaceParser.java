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
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Turns the raw text between tokens into whitespace nodes.
 *
 * <p>Each function reads the source lines starting at a {@link WhitespaceState} and advances the
 * state past what it consumed. Because adjacent tokens share a state, text consumed here can never
 * be claimed again by the node on the other side of the gap. Functions whose name starts with
 * {@code try} are speculative: if they fail, the state is left untouched.
 */
final class WhitespaceParser {

  private static final Pattern SIMPLE_WHITESPACE =
      Pattern.compile("(?:[ \\f\\t]|\\\\(?:\\r\\n?|\\n))*");
  private static final Pattern COMMENT = Pattern.compile("#[^\\r\\n]*");
  private static final Pattern NEWLINE = Pattern.compile("\\r\\n?|\\n");

  private WhitespaceParser() {}

  /** Parses spaces, tabs, form feeds and backslash continuations, which may span lines. */
  static SimpleWhitespace parseSimpleWhitespace(ParseInput input, WhitespaceState state) {
    StringBuilder text = new StringBuilder();
    while (true) {
      String ws = match(SIMPLE_WHITESPACE, input.line(state.line), state.column);
      text.append(ws);
      if (ws.indexOf('\\') < 0) {
        state.column += ws.length();
        break;
      }
      // The match ended with a continuation: carry on at the start of the next line.
      state.line++;
      state.column = 0;
    }
    return SimpleWhitespace.of(text.toString());
  }

  /**
   * Parses whitespace that may run onto following lines when inside brackets. Outside brackets
   * this is the same as {@link #parseSimpleWhitespace}.
   */
  static ParenthesizableWhitespace parseParenthesizableWhitespace(
      ParseInput input, WhitespaceState state) {
    if (state.isParenthesized) {
      ParenthesizedWhitespace ws = tryParseParenthesizedWhitespace(input, state);
      if (ws != null) {
        return ws;
      }
    }
    return parseSimpleWhitespace(input, state);
  }

  /** Parses the rest of a line up to and including its newline. */
  static TrailingWhitespace parseTrailingWhitespace(ParseInput input, WhitespaceState state) {
    TrailingWhitespace ws = tryParseTrailingWhitespace(input, state);
    if (ws == null) {
      throw new IllegalStateException("expected end of line at " + state);
    }
    return ws;
  }

  /**
   * Parses a run of empty and comment-only lines.
   *
   * <p>If {@code overrideAbsoluteIndent} is given, lines are judged indented against it rather
   * than against the state's indentation, and the run is cut after its last indented line: the
   * lines after it are left for whatever follows, typically an enclosing, less indented block.
   */
  static ImmutableList<EmptyLine> parseEmptyLines(
      ParseInput input, WhitespaceState state, @Nullable String overrideAbsoluteIndent) {
    WhitespaceState speculative = copy(state);
    List<EmptyLine> lines = new ArrayList<>();
    List<WhitespaceState> states = new ArrayList<>();
    while (true) {
      EmptyLine line = tryParseEmptyLine(input, speculative, overrideAbsoluteIndent);
      if (line == null) {
        break;
      }
      lines.add(line);
      states.add(copy(speculative));
    }
    if (overrideAbsoluteIndent != null) {
      while (!lines.isEmpty() && !lines.get(lines.size() - 1).isIndent()) {
        lines.remove(lines.size() - 1);
        states.remove(states.size() - 1);
      }
    }
    if (!lines.isEmpty()) {
      restore(state, states.get(states.size() - 1));
    }
    return ImmutableList.copyOf(lines);
  }

  static ImmutableList<EmptyLine> parseEmptyLines(ParseInput input, WhitespaceState state) {
    return parseEmptyLines(input, state, null);
  }

  @Nullable
  private static EmptyLine tryParseEmptyLine(
      ParseInput input, WhitespaceState state, @Nullable String overrideAbsoluteIndent) {
    WhitespaceState speculative = copy(state);
    boolean indent = parseIndent(input, speculative, overrideAbsoluteIndent);
    SimpleWhitespace whitespace = parseSimpleWhitespace(input, speculative);
    Comment comment = parseComment(input, speculative);
    Newline newline = parseNewline(input, speculative);
    if (newline == null) {
      return null;
    }
    restore(state, speculative);
    return new EmptyLine(indent, whitespace, comment, newline);
  }

  @Nullable
  private static TrailingWhitespace tryParseTrailingWhitespace(
      ParseInput input, WhitespaceState state) {
    WhitespaceState speculative = copy(state);
    SimpleWhitespace whitespace = parseSimpleWhitespace(input, speculative);
    Comment comment = parseComment(input, speculative);
    Newline newline = parseNewline(input, speculative);
    if (newline == null) {
      return null;
    }
    restore(state, speculative);
    return new TrailingWhitespace(whitespace, comment, newline);
  }

  @Nullable
  private static ParenthesizedWhitespace tryParseParenthesizedWhitespace(
      ParseInput input, WhitespaceState state) {
    TrailingWhitespace firstLine = tryParseTrailingWhitespace(input, state);
    if (firstLine == null) {
      return null;
    }
    List<EmptyLine> emptyLines = new ArrayList<>();
    while (true) {
      EmptyLine line = tryParseEmptyLine(input, state, null);
      if (line == null) {
        break;
      }
      emptyLines.add(line);
    }
    boolean indent = parseIndent(input, state, null);
    SimpleWhitespace lastLine = parseSimpleWhitespace(input, state);
    return new ParenthesizedWhitespace(firstLine, emptyLines, indent, lastLine);
  }

  /**
   * Consumes the block indentation at the start of a line, if the line starts with it. Returns
   * false, consuming nothing, if it does not or if the state is not at the start of a line.
   */
  private static boolean parseIndent(
      ParseInput input, WhitespaceState state, @Nullable String overrideAbsoluteIndent) {
    String indent =
        overrideAbsoluteIndent != null ? overrideAbsoluteIndent : state.absoluteIndent;
    if (state.column != 0) {
      return false;
    }
    if (input.line(state.line).startsWith(indent)) {
      state.column += indent.length();
      return true;
    }
    return false;
  }

  @Nullable
  private static Comment parseComment(ParseInput input, WhitespaceState state) {
    String text = match(COMMENT, input.line(state.line), state.column);
    if (text.isEmpty()) {
      return null;
    }
    state.column += text.length();
    return new Comment(text);
  }

  @Nullable
  private static Newline parseNewline(ParseInput input, WhitespaceState state) {
    String text = match(NEWLINE, input.line(state.line), state.column);
    if (text.isEmpty()) {
      return null;
    }
    state.column += text.length();
    if (state.line < input.lines.size()) {
      state.line++;
      state.column = 0;
    }
    return new Newline(text.equals(input.defaultNewline) ? null : text);
  }

  // Returns the text matched by pattern at offset in line, or "" if there is no match.
  private static String match(Pattern pattern, String line, int offset) {
    if (offset > line.length()) {
      return "";
    }
    Matcher m = pattern.matcher(line);
    m.region(offset, line.length());
    return m.lookingAt() ? m.group() : "";
  }

  private static WhitespaceState copy(WhitespaceState state) {
    return new WhitespaceState(
        state.line, state.column, state.absoluteIndent, state.isParenthesized);
  }

  private static void restore(WhitespaceState state, WhitespaceState from) {
    state.line = from.line;
    state.column = from.column;
    state.absoluteIndent = from.absoluteIndent;
    state.isParenthesized = from.isParenthesized;
  }
}
