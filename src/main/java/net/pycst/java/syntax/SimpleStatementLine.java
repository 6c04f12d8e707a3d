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

/** A line of one or more small statements separated by semicolons, such as {@code x = 1; y = 2}. */
public final class SimpleStatementLine extends Statement {

  private final ImmutableList<EmptyLine> leadingLines;
  private final ImmutableList<SmallStatement> body;
  private final TrailingWhitespace trailingWhitespace;

  public SimpleStatementLine(
      List<EmptyLine> leadingLines,
      List<SmallStatement> body,
      TrailingWhitespace trailingWhitespace) {
    super(Kind.SIMPLE_STATEMENT_LINE);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.body = copyOf("body", body);
    this.trailingWhitespace = require("trailingWhitespace", trailingWhitespace);
  }

  public ImmutableList<EmptyLine> getLeadingLines() {
    return leadingLines;
  }

  public ImmutableList<SmallStatement> getBody() {
    return body;
  }

  public TrailingWhitespace getTrailingWhitespace() {
    return trailingWhitespace;
  }

  @Override
  SimpleStatementLine walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    ImmutableList<SmallStatement> body = visitor.nodes("body", this.body, SmallStatement.class);
    TrailingWhitespace trailingWhitespace =
        visitor.node("trailingWhitespace", this.trailingWhitespace, TrailingWhitespace.class);
    return visitor.changed()
        ? new SimpleStatementLine(leadingLines, body, trailingWhitespace)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    generateAll(state, leadingLines);
    state.addIndentTokens();
    SmallStatement.generateBody(state, body);
    trailingWhitespace.generate(state);
  }

  /** Returns a line holding a single statement. */
  public static SimpleStatementLine of(SmallStatement statement) {
    return new SimpleStatementLine(
        ImmutableList.of(), ImmutableList.of(statement), TrailingWhitespace.of());
  }
}
