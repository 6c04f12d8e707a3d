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

/** Syntax node for a lambda expression. */
public final class Lambda extends Expression {

  @Nullable private final ParenthesizableWhitespace whitespaceAfterLambda;
  private final Parameters params;
  private final Colon colon;
  private final Expression body;

  public Lambda(
      @Nullable ParenthesizableWhitespace whitespaceAfterLambda,
      Parameters params,
      Colon colon,
      Expression body,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.LAMBDA, lpar, rpar);
    this.whitespaceAfterLambda = whitespaceAfterLambda;
    this.params = require("params", params);
    this.colon = require("colon", colon);
    this.body = require("body", body);
    for (Parameter param : params.getAll()) {
      checkNode(param.getAnnotation() == null, "lambda parameters cannot be annotated");
    }
  }

  /** Constructs an unparenthesized instance. */
  public Lambda(
      @Nullable ParenthesizableWhitespace whitespaceAfterLambda,
      Parameters params,
      Colon colon,
      Expression body) {
    this(whitespaceAfterLambda, params, colon, body, ImmutableList.of(), ImmutableList.of());
  }

  /**
   * Returns the whitespace after {@code lambda}, or null for one space when there are parameters.
   */
  @Nullable
  public ParenthesizableWhitespace getWhitespaceAfterLambda() {
    return whitespaceAfterLambda;
  }

  public Parameters getParams() {
    return params;
  }

  public Colon getColon() {
    return colon;
  }

  public Expression getBody() {
    return body;
  }

  @Override
  Lambda walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    ParenthesizableWhitespace whitespaceAfterLambda =
        visitor.optional(
            "whitespaceAfterLambda",
            this.whitespaceAfterLambda,
            ParenthesizableWhitespace.class);
    Parameters params = visitor.node("params", this.params, Parameters.class);
    Colon colon = visitor.node("colon", this.colon, Colon.class);
    Expression body = visitor.node("body", this.body, Expression.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed()
        ? new Lambda(whitespaceAfterLambda, params, colon, body, lpar, rpar)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add("lambda");
    if (whitespaceAfterLambda != null) {
      whitespaceAfterLambda.generate(state);
    } else if (!params.isEmpty()) {
      state.add(" ");
    }
    params.generate(state);
    colon.generate(state);
    body.generate(state);
  }
}
