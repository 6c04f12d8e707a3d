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
 * Syntax node for a try statement with its except handlers and optional else and finally clauses.
 * Handlers are either all {@code except} or all {@code except*}.
 */
public final class TryStatement extends CompoundStatement {

  private final ImmutableList<EmptyLine> leadingLines;
  private final SimpleWhitespace whitespaceBeforeColon;
  private final Suite body;
  private final ImmutableList<ExceptHandler> handlers;
  @Nullable private final ElseClause orelse;
  @Nullable private final FinallyClause finalBody;

  public TryStatement(
      List<EmptyLine> leadingLines,
      SimpleWhitespace whitespaceBeforeColon,
      Suite body,
      List<ExceptHandler> handlers,
      @Nullable ElseClause orelse,
      @Nullable FinallyClause finalBody) {
    super(Kind.TRY_STATEMENT);
    this.leadingLines = copyOf("leadingLines", leadingLines);
    this.whitespaceBeforeColon = require("whitespaceBeforeColon", whitespaceBeforeColon);
    this.body = require("body", body);
    this.handlers = copyOf("handlers", handlers);
    this.orelse = orelse;
    this.finalBody = finalBody;
    checkNode(
        !this.handlers.isEmpty() || finalBody != null,
        "a try statement must have at least one handler or a finally clause");
    checkNode(
        orelse == null || !this.handlers.isEmpty(),
        "a try statement must have a handler in order to have an else clause");
    for (int i = 0; i < this.handlers.size(); i++) {
      ExceptHandler handler = this.handlers.get(i);
      checkNode(
          handler.getType() != null || i == this.handlers.size() - 1,
          "a bare except must be the last handler");
      checkNode(
          handler.isStar() == this.handlers.get(0).isStar(),
          "cannot mix except and except* handlers");
    }
  }

  public ImmutableList<EmptyLine> getLeadingLines() {
    return leadingLines;
  }

  public SimpleWhitespace getWhitespaceBeforeColon() {
    return whitespaceBeforeColon;
  }

  public Suite getBody() {
    return body;
  }

  public ImmutableList<ExceptHandler> getHandlers() {
    return handlers;
  }

  @Nullable
  public ElseClause getOrelse() {
    return orelse;
  }

  @Nullable
  public FinallyClause getFinalBody() {
    return finalBody;
  }

  @Override
  TryStatement walkFields(FieldVisitor visitor) {
    ImmutableList<EmptyLine> leadingLines =
        visitor.nodes("leadingLines", this.leadingLines, EmptyLine.class);
    SimpleWhitespace whitespaceBeforeColon =
        visitor.node("whitespaceBeforeColon", this.whitespaceBeforeColon, SimpleWhitespace.class);
    Suite body = visitor.node("body", this.body, Suite.class);
    ImmutableList<ExceptHandler> handlers =
        visitor.nodes("handlers", this.handlers, ExceptHandler.class);
    ElseClause orelse = visitor.optional("orelse", this.orelse, ElseClause.class);
    FinallyClause finalBody = visitor.optional("finalBody", this.finalBody, FinallyClause.class);
    return visitor.changed()
        ? new TryStatement(leadingLines, whitespaceBeforeColon, body, handlers, orelse, finalBody)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    generateAll(state, leadingLines);
    state.addIndentTokens();
    state.add("try");
    whitespaceBeforeColon.generate(state);
    state.add(":");
    body.generate(state);
    generateAll(state, handlers);
    if (orelse != null) {
      orelse.generate(state);
    }
    if (finalBody != null) {
      finalBody.generate(state);
    }
  }
}
