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

/** An opening square bracket or brace. */
public final class LeftBracket extends Node {

  private final TokenKind token;
  private final ParenthesizableWhitespace whitespaceAfter;

  public LeftBracket(TokenKind token, ParenthesizableWhitespace whitespaceAfter) {
    super(Kind.LEFT_BRACKET);
    this.token = require("token", token);
    this.whitespaceAfter = require("whitespaceAfter", whitespaceAfter);
    checkNode(
        token == TokenKind.LBRACKET || token == TokenKind.LBRACE,
        "not an opening bracket: %s",
        token);
  }

  /** Returns LBRACKET or LBRACE. */
  public TokenKind getToken() {
    return token;
  }

  public ParenthesizableWhitespace getWhitespaceAfter() {
    return whitespaceAfter;
  }

  @Override
  LeftBracket walkFields(FieldVisitor visitor) {
    TokenKind token = visitor.attribute("token", this.token, TokenKind.class);
    ParenthesizableWhitespace whitespaceAfter =
        visitor.node("whitespaceAfter", this.whitespaceAfter, ParenthesizableWhitespace.class);
    return visitor.changed() ? new LeftBracket(token, whitespaceAfter) : this;
  }

  @Override
  void codegen(CodegenState state) {
    state.add(token.text());
    whitespaceAfter.generate(state);
  }
}
