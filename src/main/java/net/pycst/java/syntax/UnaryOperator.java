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

/** A unary operator, {@code + - ~ not}, with the whitespace after it. */
public final class UnaryOperator extends Node {

  private final TokenKind operator;
  private final ParenthesizableWhitespace whitespaceAfter;

  public UnaryOperator(TokenKind operator, ParenthesizableWhitespace whitespaceAfter) {
    super(Kind.UNARY_OPERATOR);
    this.operator = require("operator", operator);
    this.whitespaceAfter = require("whitespaceAfter", whitespaceAfter);
    checkNode(OPERATORS.contains(operator), "not a unary operator: %s", operator);
  }

  public TokenKind getOperator() {
    return operator;
  }

  public ParenthesizableWhitespace getWhitespaceAfter() {
    return whitespaceAfter;
  }

  @Override
  UnaryOperator walkFields(FieldVisitor visitor) {
    TokenKind operator = visitor.attribute("operator", this.operator, TokenKind.class);
    ParenthesizableWhitespace whitespaceAfter =
        visitor.node("whitespaceAfter", this.whitespaceAfter, ParenthesizableWhitespace.class);
    return visitor.changed() ? new UnaryOperator(operator, whitespaceAfter) : this;
  }

  @Override
  void codegen(CodegenState state) {
    state.add(operator.text());
    whitespaceAfter.generate(state);
  }

  static final ImmutableSet<TokenKind> OPERATORS =
      ImmutableSet.of(
          TokenKind.PLUS,
          TokenKind.MINUS,
          TokenKind.TILDE,
          TokenKind.NOT);

  /** Returns the operator followed by the given whitespace. */
  public static UnaryOperator of(TokenKind operator, String whitespaceAfter) {
    return new UnaryOperator(operator, SimpleWhitespace.of(whitespaceAfter));
  }
}
