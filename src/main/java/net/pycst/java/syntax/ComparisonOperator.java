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
import javax.annotation.Nullable;

/** A comparison operator with its surrounding whitespace. */
public final class ComparisonOperator extends Node {

  private final ParenthesizableWhitespace whitespaceBefore;
  private final TokenKind operator;
  @Nullable private final ParenthesizableWhitespace whitespaceBetween;
  private final ParenthesizableWhitespace whitespaceAfter;

  public ComparisonOperator(
      ParenthesizableWhitespace whitespaceBefore,
      TokenKind operator,
      @Nullable ParenthesizableWhitespace whitespaceBetween,
      ParenthesizableWhitespace whitespaceAfter) {
    super(Kind.COMPARISON_OPERATOR);
    this.whitespaceBefore = require("whitespaceBefore", whitespaceBefore);
    this.operator = require("operator", operator);
    this.whitespaceBetween = whitespaceBetween;
    this.whitespaceAfter = require("whitespaceAfter", whitespaceAfter);
    checkNode(OPERATORS.contains(operator), "not a comparison operator: %s", operator);
    boolean twoWords = operator == TokenKind.NOT_IN || operator == TokenKind.IS_NOT;
    checkNode(
        (whitespaceBetween != null) == twoWords,
        "only 'not in' and 'is not' have whitespace between their words");
  }

  public ParenthesizableWhitespace getWhitespaceBefore() {
    return whitespaceBefore;
  }

  public TokenKind getOperator() {
    return operator;
  }

  /** Returns the whitespace inside {@code not in} or {@code is not}; null for other operators. */
  @Nullable
  public ParenthesizableWhitespace getWhitespaceBetween() {
    return whitespaceBetween;
  }

  public ParenthesizableWhitespace getWhitespaceAfter() {
    return whitespaceAfter;
  }

  @Override
  ComparisonOperator walkFields(FieldVisitor visitor) {
    ParenthesizableWhitespace whitespaceBefore =
        visitor.node("whitespaceBefore", this.whitespaceBefore, ParenthesizableWhitespace.class);
    TokenKind operator = visitor.attribute("operator", this.operator, TokenKind.class);
    ParenthesizableWhitespace whitespaceBetween =
        visitor.optional(
            "whitespaceBetween",
            this.whitespaceBetween,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfter =
        visitor.node("whitespaceAfter", this.whitespaceAfter, ParenthesizableWhitespace.class);
    return visitor.changed()
        ? new ComparisonOperator(whitespaceBefore, operator, whitespaceBetween, whitespaceAfter)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    whitespaceBefore.generate(state);
    if (whitespaceBetween != null) {
      String[] words = operator.text().split(" ");
      state.add(words[0]);
      whitespaceBetween.generate(state);
      state.add(words[1]);
    } else {
      state.add(operator.text());
    }
    whitespaceAfter.generate(state);
  }

  static final ImmutableSet<TokenKind> OPERATORS =
      ImmutableSet.of(
          TokenKind.LESS,
          TokenKind.GREATER,
          TokenKind.EQUALS_EQUALS,
          TokenKind.NOT_EQUALS,
          TokenKind.LESS_EQUALS,
          TokenKind.GREATER_EQUALS,
          TokenKind.IN,
          TokenKind.NOT_IN,
          TokenKind.IS,
          TokenKind.IS_NOT);
}
