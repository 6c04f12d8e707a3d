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
 * Syntax node for an if statement. An {@code elif} is represented as an IfStatement in the {@code
 * orelse} slot of the one before it.
 */
public final class IfStatement extends CompoundStatement {

  private final ImmutableList<EmptyLine> leadingLines;
  private final SimpleWhitespace whitespaceBeforeTest;
  private final Expression test;
  private final SimpleWhitespace whitespaceAfterTest;
  private final Suite body;
  @Nullable private final Node orelse;

  public IfStatement(
      List<EmptyLine> leadingLines,
      SimpleWhitespace whitespaceBeforeTest,
      Expression test,
      SimpleWhitespace whitespaceAfterTest,
      Suite body,
      @Nullable Node orelse) {
    super(Kind.IF_STATEMENT);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.whitespaceBeforeTest = require("whitespaceBeforeTest", whitespaceBeforeTest);
    this.test = require("test", test);
    this.whitespaceAfterTest = require("whitespaceAfterTest", whitespaceAfterTest);
    this.body = require("body", body);
    this.orelse = orelse;
    checkNode(
        orelse == null || orelse instanceof IfStatement || orelse instanceof ElseClause,
        "orelse must be an IfStatement or ElseClause, got %s",
        orelse == null ? null : orelse.kind());
  }

  public ImmutableList<EmptyLine> getLeadingLines() {
    return leadingLines;
  }

  public SimpleWhitespace getWhitespaceBeforeTest() {
    return whitespaceBeforeTest;
  }

  public Expression getTest() {
    return test;
  }

  public SimpleWhitespace getWhitespaceAfterTest() {
    return whitespaceAfterTest;
  }

  public Suite getBody() {
    return body;
  }

  /** Returns the following elif (an IfStatement) or else clause (an ElseClause), if any. */
  @Nullable
  public Node getOrelse() {
    return orelse;
  }

  @Override
  IfStatement walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    SimpleWhitespace whitespaceBeforeTest =
        visitor.node("whitespaceBeforeTest", this.whitespaceBeforeTest, SimpleWhitespace.class);
    Expression test = visitor.node("test", this.test, Expression.class);
    SimpleWhitespace whitespaceAfterTest =
        visitor.node("whitespaceAfterTest", this.whitespaceAfterTest, SimpleWhitespace.class);
    Suite body = visitor.node("body", this.body, Suite.class);
    Node orelse = visitor.optional("orelse", this.orelse, Node.class);
    return visitor.changed()
        ? new IfStatement(
            leadingLines,
            whitespaceBeforeTest,
            test,
            whitespaceAfterTest,
            body,
            orelse)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    codegen(state, false);
  }

  @Override
  void codegen(CodegenState state, boolean isElif) {
    generateAll(state, leadingLines);
    state.addIndentTokens();
    state.add(isElif ? "elif" : "if");
    whitespaceBeforeTest.generate(state);
    test.generate(state);
    whitespaceAfterTest.generate(state);
    state.add(":");
    body.generate(state);
    if (orelse != null) {
      orelse.generate(state, true);
    }
  }
}
