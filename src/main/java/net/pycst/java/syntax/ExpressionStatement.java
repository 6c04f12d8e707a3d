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

/** Syntax node for an expression used as a statement. */
public final class ExpressionStatement extends SmallStatement {

  private final Expression value;

  public ExpressionStatement(Expression value, @Nullable Semicolon semicolon) {
    super(Kind.EXPRESSION_STATEMENT, semicolon);
    this.value = require("value", value);
  }

  /** Constructs an instance with no trailing semicolon. */
  public ExpressionStatement(Expression value) {
    this(value, null);
  }

  public Expression getValue() {
    return value;
  }

  @Override
  ExpressionStatement walkFields(FieldVisitor visitor) {
    Expression value = visitor.node("value", this.value, Expression.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed() ? new ExpressionStatement(value, semicolon) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    value.generate(state);
  }
}
