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

/** Syntax node for a return statement. */
public final class ReturnStatement extends SmallStatement {

  @Nullable private final SimpleWhitespace whitespaceAfterReturn;
  @Nullable private final Expression value;

  public ReturnStatement(
      @Nullable SimpleWhitespace whitespaceAfterReturn,
      @Nullable Expression value,
      @Nullable Semicolon semicolon) {
    super(Kind.RETURN_STATEMENT, semicolon);
    this.whitespaceAfterReturn = whitespaceAfterReturn;
    this.value = value;
  }

  /** Constructs an instance with no trailing semicolon. */
  public ReturnStatement(
      @Nullable SimpleWhitespace whitespaceAfterReturn,
      @Nullable Expression value) {
    this(whitespaceAfterReturn, value, null);
  }

  /**
   * Returns the whitespace after {@code return}, or null for a single space when there is a value.
   */
  @Nullable
  public SimpleWhitespace getWhitespaceAfterReturn() {
    return whitespaceAfterReturn;
  }

  @Nullable
  public Expression getValue() {
    return value;
  }

  @Override
  ReturnStatement walkFields(FieldVisitor visitor) {
    SimpleWhitespace whitespaceAfterReturn =
        visitor.optional(
            "whitespaceAfterReturn",
            this.whitespaceAfterReturn,
            SimpleWhitespace.class);
    Expression value = visitor.optional("value", this.value, Expression.class);
    Semicolon semicolon = visitor.optional("semicolon", getSemicolon(), Semicolon.class);
    return visitor.changed() ? new ReturnStatement(whitespaceAfterReturn, value, semicolon) : this;
  }

  @Override
  void codegenContent(CodegenState state) {
    state.add("return");
    if (whitespaceAfterReturn != null) {
      whitespaceAfterReturn.generate(state);
    } else if (value != null) {
      state.add(" ");
    }
    if (value != null) {
      value.generate(state);
    }
  }
}
