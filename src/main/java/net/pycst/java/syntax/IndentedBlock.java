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
import javax.annotation.Nullable;

/**
 * A block of statements on their own lines, indented relative to the statement that owns it.
 *
 * <p>The header is the remainder of the line that opened the block. A null {@code indent} means the
 * module's default indentation. The footer holds trailing empty lines still indented at this
 * block's level; lines indented less belong to whatever follows the block.
 */
public final class IndentedBlock extends Suite {

  private final TrailingWhitespace header;
  @Nullable private final String indent;
  private final ImmutableList<Statement> body;
  private final ImmutableList<EmptyLine> footer;

  public IndentedBlock(
      TrailingWhitespace header,
      @Nullable String indent,
      List<Statement> body,
      List<EmptyLine> footer) {
    super(Kind.INDENTED_BLOCK);
    this.header = require("header", header);
    this.indent = indent;
    this.body = copyOf("body", body);
    this.footer = copyOf("footer", footer);
    checkNode(
        indent == null || isWhitespace(indent),
        "an indented block must have a non-empty whitespace indent, got '%s'",
        indent);
  }

  public TrailingWhitespace getHeader() {
    return header;
  }

  /** Returns the indentation relative to the enclosing block, or null for the module default. */
  @Nullable
  public String getIndent() {
    return indent;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  public ImmutableList<EmptyLine> getFooter() {
    return footer;
  }

  @Override
  IndentedBlock walkFields(FieldVisitor visitor) {
    TrailingWhitespace header = visitor.node("header", this.header, TrailingWhitespace.class);
    String indent = visitor.optionalAttribute("indent", this.indent, String.class);
    ImmutableList<Statement> body = visitor.nodes("body", this.body, Statement.class);
    ImmutableList<EmptyLine> footer = visitor.nodes("footer", this.footer, EmptyLine.class);
    return visitor.changed() ? new IndentedBlock(header, indent, body, footer) : this;
  }

  @Override
  void codegen(CodegenState state) {
    header.generate(state);
    state.increaseIndent(indent == null ? state.getDefaultIndent() : indent);
    if (body.isEmpty()) {
      // An empty block is not valid Python.
      state.addIndentTokens();
      state.add("pass");
      state.add(state.getDefaultNewline());
    } else {
      generateAll(state, body);
    }
    generateAll(state, footer);
    state.decreaseIndent();
  }

  /** Returns a block using the default indentation and newline. */
  public static IndentedBlock of(List<Statement> body) {
    return new IndentedBlock(TrailingWhitespace.of(), null, body, ImmutableList.of());
  }
}
