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

/** Syntax node for an assignment expression, {@code target := value}. */
public final class NamedExpression extends Expression {

  private final Expression target;
  private final ParenthesizableWhitespace whitespaceBeforeWalrus;
  private final ParenthesizableWhitespace whitespaceAfterWalrus;
  private final Expression value;

  public NamedExpression(
      Expression target,
      ParenthesizableWhitespace whitespaceBeforeWalrus,
      ParenthesizableWhitespace whitespaceAfterWalrus,
      Expression value,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.NAMED_EXPRESSION, lpar, rpar);
    this.target = require("target", target);
    this.whitespaceBeforeWalrus = require("whitespaceBeforeWalrus", whitespaceBeforeWalrus);
    this.whitespaceAfterWalrus = require("whitespaceAfterWalrus", whitespaceAfterWalrus);
    this.value = require("value", value);
    checkNode(target instanceof Name, "the target of ':=' must be a name");
  }

  /** Constructs an unparenthesized instance. */
  public NamedExpression(
      Expression target,
      ParenthesizableWhitespace whitespaceBeforeWalrus,
      ParenthesizableWhitespace whitespaceAfterWalrus,
      Expression value) {
    this(
        target,
        whitespaceBeforeWalrus,
        whitespaceAfterWalrus,
        value,
        ImmutableList.of(),
        ImmutableList.of());
  }

  public Expression getTarget() {
    return target;
  }

  public ParenthesizableWhitespace getWhitespaceBeforeWalrus() {
    return whitespaceBeforeWalrus;
  }

  public ParenthesizableWhitespace getWhitespaceAfterWalrus() {
    return whitespaceAfterWalrus;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  NamedExpression walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    Expression target = visitor.node("target", this.target, Expression.class);
    ParenthesizableWhitespace whitespaceBeforeWalrus =
        visitor.node(
            "whitespaceBeforeWalrus",
            this.whitespaceBeforeWalrus,
            ParenthesizableWhitespace.class);
    ParenthesizableWhitespace whitespaceAfterWalrus =
        visitor.node(
            "whitespaceAfterWalrus",
            this.whitespaceAfterWalrus,
            ParenthesizableWhitespace.class);
    Expression value = visitor.node("value", this.value, Expression.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed()
        ? new NamedExpression(
            target,
            whitespaceBeforeWalrus,
            whitespaceAfterWalrus,
            value,
            lpar,
            rpar)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    target.generate(state);
    whitespaceBeforeWalrus.generate(state);
    state.add(":=");
    whitespaceAfterWalrus.generate(state);
    value.generate(state);
  }
}
