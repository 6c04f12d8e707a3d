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

/** Syntax node for a while loop. */
public final class WhileStatement extends CompoundStatement {

  private final ImmutableList<EmptyLine> leadingLines;
  private final SimpleWhitespace whitespaceAfterWhile;
  private final Expression test;
  private final SimpleWhitespace whitespaceBeforeColon;
  private final Suite body;
  @Nullable private final ElseClause orelse;

  public WhileStatement(
      List<EmptyLine> leadingLines,
      SimpleWhitespace whitespaceAfterWhile,
      Expression test,
      SimpleWhitespace whitespaceBeforeColon,
      Suite body,
      @Nullable ElseClause orelse) {
    super(Kind.WHILE_STATEMENT);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.whitespaceAfterWhile = require("whitespaceAfterWhile", whitespaceAfterWhile);
    this.test = require("test", test);
    this.whitespaceBeforeColon = require("whitespaceBeforeColon", whitespaceBeforeColon);
    this.body = require("body", body);
    this.orelse = orelse;
  }

  public ImmutableList<EmptyLine> getLeadingLines() {
    return leadingLines;
  }

  public SimpleWhitespace getWhitespaceAfterWhile() {
    return whitespaceAfterWhile;
  }

  public Expression getTest() {
    return test;
  }

  public SimpleWhitespace getWhitespaceBeforeColon() {
    return whitespaceBeforeColon;
  }

  public Suite getBody() {
    return body;
  }

  @Nullable
  public ElseClause getOrelse() {
    return orelse;
  }

  @Override
  WhileStatement walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    SimpleWhitespace whitespaceAfterWhile =
        visitor.node("whitespaceAfterWhile", this.whitespaceAfterWhile, SimpleWhitespace.class);
    Expression test = visitor.node("test", this.test, Expression.class);
    SimpleWhitespace whitespaceBeforeColon =
        visitor.node("whitespaceBeforeColon", this.whitespaceBeforeColon, SimpleWhitespace.class);
    Suite body = visitor.node("body", this.body, Suite.class);
    ElseClause orelse = visitor.optional("orelse", this.orelse, ElseClause.class);
    return visitor.changed()
        ? new WhileStatement(
            leadingLines,
            whitespaceAfterWhile,
            test,
            whitespaceBeforeColon,
            body,
            orelse)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    generateAll(state, leadingLines);
    state.addIndentTokens();
    state.add("while");
    whitespaceAfterWhile.generate(state);
    test.generate(state);
    whitespaceBeforeColon.generate(state);
    state.add(":");
    body.generate(state);
    if (orelse != null) {
      orelse.generate(state);
    }
  }
}
