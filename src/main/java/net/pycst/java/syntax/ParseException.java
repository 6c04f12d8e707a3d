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

import com.google.common.base.Strings;
import javax.annotation.Nullable;

/**
 * Thrown when source text cannot be decoded, tokenized or parsed. Parsing never recovers; no
 * partial tree is produced.
 */
public abstract class ParseException extends Exception {

  private final String rawMessage;
  private final CodePosition position;
  @Nullable private final String sourceLine;

  ParseException(String rawMessage, CodePosition position, @Nullable String sourceLine) {
    super(format(rawMessage, position, sourceLine));
    this.rawMessage = rawMessage;
    this.position = position;
    this.sourceLine = sourceLine;
  }

  /** Returns the message without location or context. */
  public String getRawMessage() {
    return rawMessage;
  }

  /** Returns where the error was detected. */
  public CodePosition getPosition() {
    return position;
  }

  /** Returns the 1-based line of the error. */
  public int getLine() {
    return position.line();
  }

  /** Returns the 0-based column of the error. */
  public int getColumn() {
    return position.column();
  }

  /** Returns the offending source line without its line ending, if known. */
  @Nullable
  public String getSourceLine() {
    return sourceLine;
  }

  private static String format(
      String rawMessage, CodePosition position, @Nullable String sourceLine) {
    StringBuilder buf = new StringBuilder();
    buf.append("Syntax Error @ ")
        .append(position.line())
        .append(':')
        .append(position.column() + 1)
        .append(".\n")
        .append(rawMessage);
    if (sourceLine != null) {
      buf.append("\n\n").append(sourceLine).append('\n');
      int caret = Math.min(position.column(), sourceLine.length());
      // Keep tabs so the caret lines up under the offending character.
      for (int i = 0; i < caret; i++) {
        buf.append(sourceLine.charAt(i) == '\t' ? '\t' : ' ');
      }
      buf.append('^');
    }
    return buf.toString();
  }

  static String stripNewline(String line) {
    int end = line.length();
    while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
      end--;
    }
    return Strings.nullToEmpty(line.substring(0, end));
  }
}
