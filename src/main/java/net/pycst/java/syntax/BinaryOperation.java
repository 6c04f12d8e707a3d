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

/** Syntax node for a binary operation such as {@code a + b}. */
public final class BinaryOperation extends Expression {

  private final Expression left;
  private final BinaryOperator operator;
  private final Expression right;

  public BinaryOperation(
      Expression left,
      BinaryOperator operator,
      Expression right,
      List<LeftParen> lpar,
      List<RightParen> rpar) {
    super(Kind.BINARY_OPERATION, lpar, rpar);
    this.left = require("left", left);
    this.operator = require("operator", operator);
    this.right = require("right", right);
  }

  /** Constructs an unparenthesized instance. */
  public BinaryOperation(Expression left, BinaryOperator operator, Expression right) {
    this(left, operator, right, ImmutableList.of(), ImmutableList.of());
  }

  public Expression getLeft() {
    return left;
  }

  public BinaryOperator getOperator() {
    return operator;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  BinaryOperation walkFields(FieldVisitor visitor) {
    ImmutableList<LeftParen> lpar = visitor.nodes("lpar", getLpar(), LeftParen.class);
    Expression left = visitor.node("left", this.left, Expression.class);
    BinaryOperator operator = visitor.node("operator", this.operator, BinaryOperator.class);
    Expression right = visitor.node("right", this.right, Expression.class);
    ImmutableList<RightParen> rpar = visitor.nodes("rpar", getRpar(), RightParen.class);
    return visitor.changed() ? new BinaryOperation(left, operator, right, lpar, rpar) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    left.generate(state);
    operator.generate(state);
    right.generate(state);
  }
}
