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

/** Syntax node for a unary operation such as {@code -x} or {@code not x}. */
public final class UnaryOperation extends Expression {

  private final UnaryOperator operator;
  private final Expression expression;

  public UnaryOperation(
      UnaryOperator operator,
      Expression expression,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.UNARY_OPERATION, lpar, rpar);
    this.operator = require("operator", operator);
    this.expression = require("expression", expression);
  }

  /** Constructs an unparenthesized instance. */
  public UnaryOperation(UnaryOperator operator, Expression expression) {
    this(operator, expression, ImmutableList.of(), ImmutableList.of());
  }

  public UnaryOperator getOperator() {
    return operator;
  }

  public Expression getExpression() {
    return expression;
  }

  @Override
  UnaryOperation walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    UnaryOperator operator = visitor.node("operator", this.operator, UnaryOperator.class);
    Expression expression = visitor.node("expression", this.expression, Expression.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new UnaryOperation(operator, expression, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    operator.generate(state);
    expression.generate(state);
  }
}
