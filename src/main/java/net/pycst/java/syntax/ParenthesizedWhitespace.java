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
import java.util.List;

/**
 * Whitespace inside brackets that spans lines: the rest of the first line (up to and including its
 * newline), any following empty lines, then the indentation and whitespace before the next token.
 */
public final class ParenthesizedWhitespace extends ParenthesizableWhitespace {

  private final TrailingWhitespace firstLine;
  private final ImmutableList<EmptyLine> emptyLines;
  private final boolean indent;
  private final SimpleWhitespace lastLine;

  public ParenthesizedWhitespace(
      TrailingWhitespace firstLine,
      List<EmptyLine> emptyLines,
      boolean indent,
      SimpleWhitespace lastLine) {
    super(Kind.PARENTHESIZED_WHITESPACE);
    this.firstLine = require("firstLine", firstLine);
    this.emptyLines = copyOf("emptyLines", emptyLines);
    this.indent = indent;
    this.lastLine = require("lastLine", lastLine);
  }

  public TrailingWhitespace getFirstLine() {
    return firstLine;
  }

  public ImmutableList<EmptyLine> getEmptyLines() {
    return emptyLines;
  }

  /** Reports whether the last line starts with the enclosing block indentation. */
  public boolean isIndent() {
    return indent;
  }

  public SimpleWhitespace getLastLine() {
    return lastLine;
  }

  @Override
  ParenthesizedWhitespace walkFields(FieldVisitor visitor) {
    TrailingWhitespace firstLine =
        visitor.node("firstLine", this.firstLine, TrailingWhitespace.class);
    ImmutableList<EmptyLine> emptyLines =
        visitor.nodes("emptyLines", this.emptyLines, EmptyLine.class);
    boolean indent = visitor.attribute("indent", this.indent, Boolean.class);
    SimpleWhitespace lastLine = visitor.node("lastLine", this.lastLine, SimpleWhitespace.class);
    return visitor.changed()
        ? new ParenthesizedWhitespace(firstLine, emptyLines, indent, lastLine)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    firstLine.generate(state);
    generateAll(state, emptyLines);
    if (indent) {
      state.addIndentTokens();
    }
    lastLine.generate(state);
  }

  @Override
  public boolean isEmpty() {
    return false;
  }
}
