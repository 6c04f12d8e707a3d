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

/** Syntax node for a subscript, {@code value[slice]}. */
public final class Subscript extends Expression {

  private final Expression value;
  private final ParenthesizableWhitespace whitespaceAfterValue;
  private final LeftBracket lbracket;
  private final ImmutableList<SubscriptElement> slice;
  private final RightBracket rbracket;

  public Subscript(
      Expression value,
      ParenthesizableWhitespace whitespaceAfterValue,
      LeftBracket lbracket,
      List<SubscriptElement> slice,
      RightBracket rbracket,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.SUBSCRIPT, lpar, rpar);
    this.value = require("value", value);
    this.whitespaceAfterValue = require("whitespaceAfterValue", whitespaceAfterValue);
    this.lbracket = require("lbracket", lbracket);
    this.slice = copyOf("slice", slice);
    this.rbracket = require("rbracket", rbracket);
    checkNode(!this.slice.isEmpty(), "a subscript must have at least one element");
    checkNode(
        lbracket.getToken() == TokenKind.LBRACKET && rbracket.getToken() == TokenKind.RBRACKET,
        "a subscript requires square brackets");
  }

  /** Constructs an unparenthesized instance. */
  public Subscript(
      Expression value,
      ParenthesizableWhitespace whitespaceAfterValue,
      LeftBracket lbracket,
      List<SubscriptElement> slice,
      RightBracket rbracket) {
    this(
        value,
        whitespaceAfterValue,
        lbracket,
        slice,
        rbracket,
        ImmutableList.of(),
        ImmutableList.of());
  }

  public Expression getValue() {
    return value;
  }

  public ParenthesizableWhitespace getWhitespaceAfterValue() {
    return whitespaceAfterValue;
  }

  public LeftBracket getLbracket() {
    return lbracket;
  }

  /** Returns the indices or slices, more than one for {@code x[a, b]}. */
  public ImmutableList<SubscriptElement> getSlice() {
    return slice;
  }

  public RightBracket getRbracket() {
    return rbracket;
  }

  @Override
  Subscript walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    Expression value = visitor.node("value", this.value, Expression.class);
    ParenthesizableWhitespace whitespaceAfterValue =
        visitor.node(
            "whitespaceAfterValue",
            this.whitespaceAfterValue,
            ParenthesizableWhitespace.class);
    LeftBracket lbracket = visitor.node("lbracket", this.lbracket, LeftBracket.class);
    ImmutableList<SubscriptElement> slice =
        visitor.nodes("slice", this.slice, SubscriptElement.class);
    RightBracket rbracket = visitor.node("rbracket", this.rbracket, RightBracket.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed()
        ? new Subscript(value, whitespaceAfterValue, lbracket, slice, rbracket, lpar, rpar)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    value.generate(state);
    whitespaceAfterValue.generate(state);
    lbracket.generate(state);
    generateSeparated(state, slice);
    rbracket.generate(state);
  }
}
