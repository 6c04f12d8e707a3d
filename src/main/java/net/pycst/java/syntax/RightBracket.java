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

/** A closing square bracket or brace. */
public final class RightBracket extends Node {

  private final ParenthesizableWhitespace whitespaceBefore;
  private final TokenKind token;

  public RightBracket(ParenthesizableWhitespace whitespaceBefore, TokenKind token) {
    super(Kind.RIGHT_BRACKET);
    this.whitespaceBefore = require("whitespaceBefore", whitespaceBefore);
    this.token = require("token", token);
    checkNode(
        token == TokenKind.RBRACKET || token == TokenKind.RBRACE,
        "not a closing bracket: %s",
        token);
  }

  public ParenthesizableWhitespace getWhitespaceBefore() {
    return whitespaceBefore;
  }

  /** Returns RBRACKET or RBRACE. */
  public TokenKind getToken() {
    return token;
  }

  @Override
  RightBracket walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBefore =
        visitor.node("whitespaceBefore", this.whitespaceBefore, ParenthesizableWhitespace.class);
    TokenKind token = visitor.attribute("token", this.token, TokenKind.class);
    return visitor.changed() ? new RightBracket(whitespaceBefore, token) : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespaceBefore.generate(state);
    state.add(token.text());
  }
}
