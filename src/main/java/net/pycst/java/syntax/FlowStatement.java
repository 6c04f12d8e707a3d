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

import javax.annotation.Nullable;

/** Syntax node for a {@code pass}, {@code break} or {@code continue} statement. */
public final class FlowStatement extends SmallStatement {

  private final TokenKind keyword;

  public FlowStatement(TokenKind keyword, @Nullable Semicolon semicolon) {
    super(Kind.FLOW_STATEMENT, semicolon);
    this.keyword = require("keyword", keyword);
    checkNode(
        keyword == TokenKind.PASS || keyword == TokenKind.BREAK || keyword == TokenKind.CONTINUE,
        "not a flow keyword: %s",
        keyword);
  }

  /** Constructs an instance with no trailing semicolon. */
  public FlowStatement(TokenKind keyword) {
    this(keyword, null);
  }

  /** Returns PASS, BREAK or CONTINUE. */
  public TokenKind getKeyword() {
    return keyword;
  }

  @Override
  FlowStatement walkFields(FieldVisitor visitor) {
    TokenKind keyword = visitor.attribute("keyword", this.keyword, TokenKind.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed() ? new FlowStatement(keyword, semicolon) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add(keyword.text());
  }
}
