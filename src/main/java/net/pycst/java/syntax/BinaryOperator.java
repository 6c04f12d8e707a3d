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

import com.google.common.collect.ImmutableSet;

/** A binary arithmetic or bitwise operator with its surrounding whitespace. */
public final class BinaryOperator extends Node {

  private final ParenthesizableWhitespace whitespaceBefore;
  private final TokenKind operator;
  private final ParenthesizableWhitespace whitespaceAfter;

  public BinaryOperator(
      ParenthesizableWhitespace whitespaceBefore,
      TokenKind operator,
      ParenthesizableWhitespace whitespaceAfter) {
    super(Kind.BINARY_OPERATOR);
    this.whitespaceBefore = require("whitespaceBefore", whitespaceBefore);
    this.operator = require("operator", operator);
    this.whitespaceAfter = require("whitespaceAfter", whitespaceAfter);
    checkNode(OPERATORS.contains(operator), "not a binary operator: %s", operator);
  }

  public ParenthesizableWhitespace getWhitespaceBefore() {
    return whitespaceBefore;
  }

  public TokenKind getOperator() {
    return operator;
  }

  public ParenthesizableWhitespace getWhitespaceAfter() {
    return whitespaceAfter;
  }

  @Override
  BinaryOperator walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBefore =
        visitor.node("whitespaceBefore", this.whitespaceBefore, ParenthesizableWhitespace.class);
    TokenKind operator = visitor.attribute("operator", this.operator, TokenKind.class);
    ParenthesizableWhitespace whitespaceAfter =
        visitor.node("whitespaceAfter", this.whitespaceAfter, ParenthesizableWhitespace.class);
    return visitor.changed()
        ? new BinaryOperator(whitespaceBefore, operator, whitespaceAfter)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespaceBefore.generate(state);
    state.add(operator.text());
    whitespaceAfter.generate(state);
  }

  static final ImmutableSet<TokenKind> OPERATORS =
      ImmutableSet.of(
          TokenKind.PLUS,
          TokenKind.MINUS,
          TokenKind.STAR,
          TokenKind.AT,
          TokenKind.SLASH,
          TokenKind.SLASH_SLASH,
          TokenKind.PERCENT,
          TokenKind.STAR_STAR,
          TokenKind.LESS_LESS,
          TokenKind.GREATER_GREATER,
          TokenKind.AMPERSAND,
          TokenKind.PIPE,
          TokenKind.CARET);

  /** Returns the operator surrounded by single spaces. */
  public static BinaryOperator of(TokenKind operator) {
    return new BinaryOperator(SimpleWhitespace.of(" "), operator, SimpleWhitespace.of(" "));
  }
}
