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

/** Syntax node for a dict comprehension, {@code {k: v for ...}}. */
public final class DictComprehension extends Expression {

  private final LeftBracket lbrace;
  private final Expression key;
  private final ParenthesizableWhitespace whitespaceBeforeColon;
  private final ParenthesizableWhitespace whitespaceAfterColon;
  private final Expression value;
  private final ComprehensionFor forIn;
  private final RightBracket rbrace;

  public DictComprehension(
      LeftBracket lbrace,
      Expression key,
      ParenthesizableWhitespace whitespaceBeforeColon,
      ParenthesizableWhitespace whitespaceAfterColon,
      Expression value,
      ComprehensionFor forIn,
      RightBracket rbrace,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.DICT_COMPREHENSION, lpar, rpar);
    this.lbrace = require("lbrace", lbrace);
    this.key = require("key", key);
    this.whitespaceBeforeColon = require("whitespaceBeforeColon", whitespaceBeforeColon);
    this.whitespaceAfterColon = require("whitespaceAfterColon", whitespaceAfterColon);
    this.value = require("value", value);
    this.forIn = require("forIn", forIn);
    this.rbrace = require("rbrace", rbrace);
  }

  /** Constructs an unparenthesized instance. */
  public DictComprehension(
      LeftBracket lbrace,
      Expression key,
      ParenthesizableWhitespace whitespaceBeforeColon,
      ParenthesizableWhitespace whitespaceAfterColon,
      Expression value,
      ComprehensionFor forIn,
      RightBracket rbrace) {
    this(
        lbrace,
        key,
        whitespaceBeforeColon,
        whitespaceAfterColon,
        value,
        forIn,
        rbrace,
        ImmutableList.of(),
        ImmutableList.of());
  }

  public LeftBracket getLbrace() {
    return lbrace;
  }

  public Expression getKey() {
    return key;
  }

  public ParenthesizableWhitespace getWhitespaceBeforeColon() {
    return whitespaceBeforeColon;
  }

  public ParenthesizableWhitespace getWhitespaceAfterColon() {
    return whitespaceAfterColon;
  }

  public Expression getValue() {
    return value;
  }

  public ComprehensionFor getForIn() {
    return forIn;
  }

  public RightBracket getRbrace() {
    return rbrace;
  }

  @Override
  DictComprehension walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    LeftBracket lbrace = visitor.node("lbrace", this.lbrace, LeftBracket.class);
    Expression key = visitor.node("key", this.key, Expression.class);
    ParenthesizableWhitespace whitespaceBeforeColon =
        visitor.node(
            "whitespaceBeforeColon",
            this.whitespaceBeforeColon,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfterColon =
        visitor.node(
            "whitespaceAfterColon",
            this.whitespaceAfterColon,
            ParenthesizableWhitespace.class);
    Expression value = visitor.node("value", this.value, Expression.class);
    ComprehensionFor forIn = visitor.node("forIn", this.forIn, ComprehensionFor.class);
    RightBracket rbrace = visitor.node("rbrace", this.rbrace, RightBracket.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed()
        ? new DictComprehension(
            lbrace,
            key,
            whitespaceBeforeColon,
            whitespaceAfterColon,
            value,
            forIn,
            rbrace,
            lpar,
            rpar)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    lbrace.generate(state);
    key.generate(state);
    whitespaceBeforeColon.generate(state);
    state.add(":");
    whitespaceAfterColon.generate(state);
    value.generate(state);
    forIn.generate(state);
    rbrace.generate(state);
  }
}
