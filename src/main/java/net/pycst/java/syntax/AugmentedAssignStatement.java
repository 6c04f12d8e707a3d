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

import javax.annotation.Nullable;

/** Syntax node for an augmented assignment such as {@code x += 1}. */
public final class AugmentedAssignStatement extends SmallStatement {

  private final Expression target;
  private final AugmentedOperator operator;
  private final Expression value;

  public AugmentedAssignStatement(
      Expression target,
      AugmentedOperator operator,
      Expression value,
      @Nullable Semicolon semicolon) {
    super(Kind.AUGMENTED_ASSIGN_STATEMENT, semicolon);
    this.target = require("target", target);
    this.operator = require("operator", operator);
    this.value = require("value", value);
  }

  /** Constructs an instance with no trailing semicolon. */
  public AugmentedAssignStatement(Expression target, AugmentedOperator operator, Expression value) {
    this(target, operator, value, null);
  }

  public Expression getTarget() {
    return target;
  }

  public AugmentedOperator getOperator() {
    return operator;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  AugmentedAssignStatement walkFields(FieldVisitor visitor) {
    Expression target = visitor.node("target", this.target, Expression.class);
    AugmentedOperator operator = visitor.node("operator", this.operator, AugmentedOperator.class);
    Expression value = visitor.node("value", this.value, Expression.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed()
        ? new AugmentedAssignStatement(target, operator, value, semicolon)
        : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    target.generate(state);
    operator.generate(state);
    value.generate(state);
  }
}
