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

/** Syntax node for {@code await expression}. */
public final class Await extends Expression {

  private final ParenthesizableWhitespace whitespaceAfterAwait;
  private final Expression expression;

  public Await(
      ParenthesizableWhitespace whitespaceAfterAwait,
      Expression expression,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.AWAIT, lpar, rpar);
    this.whitespaceAfterAwait = require("whitespaceAfterAwait", whitespaceAfterAwait);
    this.expression = require("expression", expression);
  }

  /** Constructs an unparenthesized instance. */
  public Await(ParenthesizableWhitespace whitespaceAfterAwait, Expression expression) {
    this(whitespaceAfterAwait, expression, ImmutableList.of(), ImmutableList.of());
  }

  public ParenthesizableWhitespace getWhitespaceAfterAwait() {
    return whitespaceAfterAwait;
  }

  public Expression getExpression() {
    return expression;
  }

  @Override
  Await walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    ParenthesizableWhitespace whitespaceAfterAwait =
        visitor.node(
            "whitespaceAfterAwait",
            this.whitespaceAfterAwait,
            ParenthesizableWhitespace.class);
    Expression expression = visitor.node("expression", this.expression, Expression.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new Await(whitespaceAfterAwait, expression, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add("await");
    whitespaceAfterAwait.generate(state);
    expression.generate(state);
  }
}
