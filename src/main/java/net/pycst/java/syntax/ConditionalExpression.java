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

/** Syntax node for {@code body if test else orelse}. */
public final class ConditionalExpression extends Expression {

  private final Expression body;
  private final ParenthesizableWhitespace whitespaceBeforeIf;
  private final ParenthesizableWhitespace whitespaceAfterIf;
  private final Expression test;
  private final ParenthesizableWhitespace whitespaceBeforeElse;
  private final ParenthesizableWhitespace whitespaceAfterElse;
  private final Expression orelse;

  public ConditionalExpression(
      Expression body,
      ParenthesizableWhitespace whitespaceBeforeIf,
      ParenthesizableWhitespace whitespaceAfterIf,
      Expression test,
      ParenthesizableWhitespace whitespaceBeforeElse,
      ParenthesizableWhitespace whitespaceAfterElse,
      Expression orelse,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.CONDITIONAL_EXPRESSION, lpar, rpar);
    this.body = require("body", body);
    this.whitespaceBeforeIf = require("whitespaceBeforeIf", whitespaceBeforeIf);
    this.whitespaceAfterIf = require("whitespaceAfterIf", whitespaceAfterIf);
    this.test = require("test", test);
    this.whitespaceBeforeElse = require("whitespaceBeforeElse", whitespaceBeforeElse);
    this.whitespaceAfterElse = require("whitespaceAfterElse", whitespaceAfterElse);
    this.orelse = require("orelse", orelse);
  }

  /** Constructs an unparenthesized instance. */
  public ConditionalExpression(
      Expression body,
      ParenthesizableWhitespace whitespaceBeforeIf,
      ParenthesizableWhitespace whitespaceAfterIf,
      Expression test,
      ParenthesizableWhitespace whitespaceBeforeElse,
      ParenthesizableWhitespace whitespaceAfterElse,
      Expression orelse) {
    this(
        body,
        whitespaceBeforeIf,
        whitespaceAfterIf,
        test,
        whitespaceBeforeElse,
        whitespaceAfterElse,
        orelse,
        ImmutableList.of(),
        ImmutableList.of());
  }

  public Expression getBody() {
    return body;
  }

  public ParenthesizableWhitespace getWhitespaceBeforeIf() {
    return whitespaceBeforeIf;
  }

  public ParenthesizableWhitespace getWhitespaceAfterIf() {
    return whitespaceAfterIf;
  }

  public Expression getTest() {
    return test;
  }

  public ParenthesizableWhitespace getWhitespaceBeforeElse() {
    return whitespaceBeforeElse;
  }

  public ParenthesizableWhitespace getWhitespaceAfterElse() {
    return whitespaceAfterElse;
  }

  public Expression getOrelse() {
    return orelse;
  }

  @Override
  ConditionalExpression walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    Expression body = visitor.node("body", this.body, Expression.class);
    ParenthesizableWhitespace whitespaceBeforeIf =
        visitor.node(
            "whitespaceBeforeIf",
            this.whitespaceBeforeIf,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfterIf =
        visitor.node("whitespaceAfterIf", this.whitespaceAfterIf, ParenthesizableWhitespace.class);
    Expression test = visitor.node("test", this.test, Expression.class);
    ParenthesizableWhitespace whitespaceBeforeElse =
        visitor.node(
            "whitespaceBeforeElse",
            this.whitespaceBeforeElse,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfterElse =
        visitor.node(
            "whitespaceAfterElse",
            this.whitespaceAfterElse,
            ParenthesizableWhitespace.class);
    Expression orelse = visitor.node("orelse", this.orelse, Expression.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed()
        ? new ConditionalExpression(
            body,
            whitespaceBeforeIf,
            whitespaceAfterIf,
            test,
            whitespaceBeforeElse,
            whitespaceAfterElse,
            orelse,
            lpar,
            rpar)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    body.generate(state);
    whitespaceBeforeIf.generate(state);
    state.add("if");
    whitespaceAfterIf.generate(state);
    test.generate(state);
    whitespaceBeforeElse.generate(state);
    state.add("else");
    whitespaceAfterElse.generate(state);
    orelse.generate(state);
  }
}
