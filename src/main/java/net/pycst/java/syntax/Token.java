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

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * A lexical token: its kind, exact source text and span, plus the whitespace cursors before and
 * after it. INDENT, DEDENT and ENDMARKER tokens have empty text and share one cursor for both
 * sides.
 */
public final class Token {

  private final TokenKind kind;
  private final String text;
  private final CodePosition start;
  private final CodePosition end;
  @Nullable private final String relativeIndent;

  // Set by the tokenizer as tokens are handed out, in order.
  WhitespaceState whitespaceBefore;
  WhitespaceState whitespaceAfter;

  Token(
      TokenKind kind,
      String text,
      CodePosition start,
      CodePosition end,
      @Nullable String relativeIndent) {
    this.kind = Preconditions.checkNotNull(kind);
    this.text = Preconditions.checkNotNull(text);
    this.start = start;
    this.end = end;
    this.relativeIndent = relativeIndent;
  }

  public TokenKind getKind() {
    return kind;
  }

  /** Returns the exact source text of this token. */
  public String getText() {
    return text;
  }

  public CodePosition getStart() {
    return start;
  }

  public CodePosition getEnd() {
    return end;
  }

  /** For an INDENT token, the indentation it adds to the enclosing block; otherwise null. */
  @Nullable
  public String getRelativeIndent() {
    return relativeIndent;
  }

  /** Returns a description of this token suitable for error messages. */
  String describe() {
    switch (kind) {
      case NAME:
      case NUMBER:
      case STRING:
      case ERRORTOKEN:
        return kind + " '" + text + "'";
      default:
        return kind.toString();
    }
  }

  @Override
  public String toString() {
    return kind.name() + "(" + text.replace("\n", "\\n").replace("\r", "\\r") + ")@" + start;
  }
}
